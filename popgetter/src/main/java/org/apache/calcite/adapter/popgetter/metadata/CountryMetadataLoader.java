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

import org.apache.calcite.adapter.popgetter.parquet.ParquetTableReader;
import org.apache.calcite.adapter.popgetter.storage.StorageProvider;
import org.apache.calcite.adapter.popgetter.table.Table;
import org.apache.calcite.adapter.popgetter.util.Futures;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Loads the five metadata relations of one country, all five fetches in
 * flight at once.
 */
public class CountryMetadataLoader {
  private static final Logger LOGGER = LoggerFactory.getLogger(CountryMetadataLoader.class);

  private final StorageProvider storageProvider;
  private final ParquetTableReader reader;
  private final String basePath;
  private final Executor executor;

  public CountryMetadataLoader(StorageProvider storageProvider, String basePath, Executor executor) {
    this.storageProvider = storageProvider;
    this.reader = new ParquetTableReader(storageProvider);
    this.basePath = basePath;
    this.executor = executor;
  }

  /**
   * Starts loading one country. The returned future fails with the first
   * relation that cannot be fetched.
   */
  public CompletableFuture<Metadata> load(final String country) {
    final MetadataTable[] kinds = MetadataTable.values();
    List<CompletableFuture<Table>> fetches = new ArrayList<>(kinds.length);
    for (final MetadataTable kind : kinds) {
      final String path = storageProvider.resolvePath(basePath, kind.relativePath(country));
      fetches.add(CompletableFuture.supplyAsync(() -> {
        LOGGER.debug("Fetching {} for {} from {}", kind, country, path);
        return reader.read(path);
      }, executor));
    }
    return Futures.allOfFailFast(fetches).thenApply(tables -> {
      Map<MetadataTable, Table> byKind = new EnumMap<>(MetadataTable.class);
      for (int i = 0; i < kinds.length; i++) {
        byKind.put(kinds[i], tables.get(i));
      }
      LOGGER.debug("Loaded metadata for {}: {} metrics", country,
          byKind.get(MetadataTable.METRIC).rowCount());
      return new Metadata(byKind);
    });
  }
}
