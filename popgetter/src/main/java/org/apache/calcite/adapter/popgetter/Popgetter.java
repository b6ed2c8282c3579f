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
package org.apache.calcite.adapter.popgetter;

import org.apache.calcite.adapter.popgetter.download.DuckDBMetricFetcher;
import org.apache.calcite.adapter.popgetter.download.Materializer;
import org.apache.calcite.adapter.popgetter.download.MetricFetcher;
import org.apache.calcite.adapter.popgetter.download.MetricRequest;
import org.apache.calcite.adapter.popgetter.download.MetricSqlBuilder;
import org.apache.calcite.adapter.popgetter.download.ParquetMetricFetcher;
import org.apache.calcite.adapter.popgetter.geo.GeometryFetcher;
import org.apache.calcite.adapter.popgetter.metadata.ExpandedMetadata;
import org.apache.calcite.adapter.popgetter.metadata.Metadata;
import org.apache.calcite.adapter.popgetter.metadata.MetadataCache;
import org.apache.calcite.adapter.popgetter.metadata.MetadataLoader;
import org.apache.calcite.adapter.popgetter.recipe.DataRequestSpec;
import org.apache.calcite.adapter.popgetter.search.DownloadParams;
import org.apache.calcite.adapter.popgetter.search.Params;
import org.apache.calcite.adapter.popgetter.search.SearchEngine;
import org.apache.calcite.adapter.popgetter.search.SearchParams;
import org.apache.calcite.adapter.popgetter.search.SearchResults;
import org.apache.calcite.adapter.popgetter.storage.StorageProvider;
import org.apache.calcite.adapter.popgetter.storage.StorageProviderFactory;
import org.apache.calcite.adapter.popgetter.table.Table;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point: the catalog of one release plus the search and download
 * operations over it.
 *
 * <p>Owns the I/O thread pool used for metadata loads and downloads; close
 * the instance to release it. Searches are synchronous and may be run from
 * several threads at once.
 */
public class Popgetter implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(Popgetter.class);

  private final PopgetterConfig config;
  private final ExpandedMetadata metadata;
  private final ExecutorService executor;
  private final Materializer materializer;

  Popgetter(PopgetterConfig config, Metadata metadata, ExecutorService executor,
      StorageProvider storageProvider) {
    this.config = config;
    this.metadata = new ExpandedMetadata(metadata);
    this.executor = executor;
    this.materializer = new Materializer(metricFetcher(config, storageProvider, executor),
        new GeometryFetcher(storageProvider, config.getGeoIdColumn(), config.getGeometryColumn()),
        config.getGeoIdColumn(), executor);
  }

  /** Loads the catalog from the configured release. */
  public static Popgetter create(PopgetterConfig config) {
    LOGGER.debug("Creating Popgetter with {}", config);
    StorageProvider storageProvider = StorageProviderFactory.createFromUrl(config.getBasePath());
    ExecutorService executor = newExecutor(config);
    try {
      Metadata metadata =
          new MetadataLoader(storageProvider, config.getBasePath(), executor).loadAll();
      return new Popgetter(config, metadata, executor, storageProvider);
    } catch (RuntimeException e) {
      executor.shutdownNow();
      throw e;
    }
  }

  /**
   * Reads the catalog from the cache directory when a readable snapshot is
   * there; otherwise loads it from the release and writes the snapshot.
   */
  public static Popgetter createWithCache(PopgetterConfig config) {
    Path cacheDirectory = config.resolveCacheDirectory();
    StorageProvider storageProvider = StorageProviderFactory.createFromUrl(config.getBasePath());
    ExecutorService executor = newExecutor(config);
    try {
      Metadata metadata = null;
      if (MetadataCache.isPresent(cacheDirectory)) {
        try {
          metadata = MetadataCache.read(cacheDirectory);
          LOGGER.info("Using cached metadata from {}", cacheDirectory);
        } catch (ResourceFetchException e) {
          LOGGER.warn("Ignoring unreadable metadata cache {}: {}", cacheDirectory,
              e.getMessage());
        }
      } else {
        LOGGER.info("No metadata cache at {}", cacheDirectory);
      }
      if (metadata == null) {
        metadata = new MetadataLoader(storageProvider, config.getBasePath(), executor).loadAll();
        MetadataCache.write(metadata, cacheDirectory);
      }
      return new Popgetter(config, metadata, executor, storageProvider);
    } catch (RuntimeException e) {
      executor.shutdownNow();
      throw e;
    }
  }

  private static ExecutorService newExecutor(PopgetterConfig config) {
    final AtomicInteger counter = new AtomicInteger();
    ThreadFactory factory = runnable -> {
      Thread thread = new Thread(runnable, "popgetter-io-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
    return Executors.newFixedThreadPool(config.getIoThreads(), factory);
  }

  private static MetricFetcher metricFetcher(PopgetterConfig config,
      StorageProvider storageProvider, ExecutorService executor) {
    switch (config.getMetricEngine()) {
      case DUCKDB:
        return new DuckDBMetricFetcher(config.getGeoIdColumn(), executor);
      case PARQUET:
      default:
        return new ParquetMetricFetcher(storageProvider, config.getGeoIdColumn(), executor);
    }
  }

  public PopgetterConfig config() {
    return config;
  }

  public Metadata metadata() {
    return metadata.metadata();
  }

  public ExpandedMetadata expandedMetadata() {
    return metadata;
  }

  /** The countries of the release, one row each. */
  public Table countries() {
    return metadata.metadata().countries();
  }

  public SearchResults search(SearchParams params) {
    return SearchEngine.search(metadata.view(), params);
  }

  public List<MetricRequest> toMetricRequests(SearchResults results) {
    return results.toMetricRequests(config.getBasePath());
  }

  /** Query equivalent to fetching {@code requests}, without running it. */
  public String toSqlText(List<MetricRequest> requests, @Nullable Collection<String> keys) {
    return MetricSqlBuilder.toSqlText(requests, keys, config.getGeoIdColumn());
  }

  /** Fetches the metrics of {@code results}, with geometries if asked for. */
  public Table download(SearchResults results, DownloadParams params) {
    return materializer.download(toMetricRequests(results), params);
  }

  /** Searches with {@code params} and downloads the matches. */
  public Table download(Params params) {
    return download(search(params.search()), params.download());
  }

  /** Runs a data request recipe. */
  public Table download(DataRequestSpec spec) {
    return download(spec.toParams());
  }

  @Override public void close() {
    executor.shutdownNow();
  }
}
