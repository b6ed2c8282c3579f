/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.popgetter.metadata;

import org.apache.calcite.adapter.popgetter.ResourceFetchException;
import org.apache.calcite.adapter.popgetter.storage.StorageProvider;
import org.apache.calcite.adapter.popgetter.util.Futures;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Loads the catalog of a release: discovers the published countries, loads
 * every country concurrently and unions each relation in country-list order.
 */
public class MetadataLoader {
  private static final Logger LOGGER = LoggerFactory.getLogger(MetadataLoader.class);

  public static final String COUNTRIES_FILE = "countries.txt";

  private final StorageProvider storageProvider;
  private final String basePath;
  private final CountryMetadataLoader countryLoader;

  public MetadataLoader(StorageProvider storageProvider, String basePath, Executor executor) {
    this.storageProvider = storageProvider;
    this.basePath = basePath;
    this.countryLoader = new CountryMetadataLoader(storageProvider, basePath, executor);
  }

  /**
   * Reads the country list of the release. Blank lines are skipped.
   *
   * @throws ResourceFetchException if the list cannot be fetched or names no
   *     country
   */
  public List<String> countries() {
    String path = storageProvider.resolvePath(basePath, COUNTRIES_FILE);
    String text;
    try {
      text = storageProvider.readText(path);
    } catch (IOException e) {
      throw new ResourceFetchException("Failed to fetch country list " + path + ": "
          + e.getMessage(), e);
    }
    List<String> countries = new ArrayList<>();
    for (String line : text.split("\\r?\\n")) {
      String country = line.trim();
      if (!country.isEmpty()) {
        countries.add(country);
      }
    }
    if (countries.isEmpty()) {
      throw new ResourceFetchException("Country list " + path + " names no countries");
    }
    LOGGER.info("Release {} publishes {} countries: {}", basePath, countries.size(), countries);
    return countries;
  }

  /** Loads every published country. */
  public Metadata loadAll() {
    return loadAll(countries());
  }

  /**
   * Loads the given countries concurrently and unions the results in list
   * order. Any failing country fails the whole load.
   */
  public Metadata loadAll(List<String> countries) {
    return Futures.join(loadAllAsync(countries));
  }

  public CompletableFuture<Metadata> loadAllAsync(List<String> countries) {
    if (countries.isEmpty()) {
      throw new ResourceFetchException("No countries to load from " + basePath);
    }
    List<CompletableFuture<Metadata>> loads = new ArrayList<>(countries.size());
    for (String country : countries) {
      loads.add(countryLoader.load(country));
    }
    return Futures.allOfFailFast(loads).thenApply(parts -> {
      Metadata metadata = Metadata.union(parts);
      for (MetadataTable kind : MetadataTable.values()) {
        LOGGER.info("{}: {} rows, columns {}", kind, metadata.get(kind).rowCount(),
            metadata.get(kind).columns());
      }
      return metadata;
    });
  }
}
