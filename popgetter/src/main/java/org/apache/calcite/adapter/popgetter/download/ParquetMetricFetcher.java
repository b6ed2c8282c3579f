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
package org.apache.calcite.adapter.popgetter.download;

import org.apache.calcite.adapter.popgetter.parquet.ParquetTableReader;
import org.apache.calcite.adapter.popgetter.storage.StorageProvider;
import org.apache.calcite.adapter.popgetter.table.Table;
import org.apache.calcite.adapter.popgetter.util.Futures;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * {@link MetricFetcher} that reads each metric file with the native parquet
 * reader, one task per file, and inner-joins the results pairwise in file
 * order.
 */
public class ParquetMetricFetcher implements MetricFetcher {
  private static final Logger LOGGER = LoggerFactory.getLogger(ParquetMetricFetcher.class);

  private final ParquetTableReader reader;
  private final String keyColumn;
  private final Executor executor;

  public ParquetMetricFetcher(StorageProvider storageProvider, String keyColumn,
      Executor executor) {
    this.reader = new ParquetTableReader(storageProvider);
    this.keyColumn = keyColumn;
    this.executor = executor;
  }

  @Override public CompletableFuture<Table> fetchMetrics(List<MetricRequest> requests,
      @Nullable Set<String> keys) {
    Map<String, List<String>> byFile = MetricRequest.columnsByFile(requests);
    LOGGER.debug("Fetching {} columns from {} files", requests.size(), byFile.size());
    List<CompletableFuture<Table>> fetches = new ArrayList<>(byFile.size());
    for (Map.Entry<String, List<String>> entry : byFile.entrySet()) {
      final String file = entry.getKey();
      final List<String> columns = entry.getValue();
      fetches.add(CompletableFuture.supplyAsync(
          () -> reader.fetchColumns(file, columns, keyColumn, keys), executor));
    }
    return Futures.allOfFailFast(fetches).thenApplyAsync(this::joinAll, executor);
  }

  private Table joinAll(List<Table> tables) {
    if (tables.isEmpty()) {
      throw new IllegalArgumentException("No metric files to join");
    }
    Table joined = tables.get(0);
    for (int i = 1; i < tables.size(); i++) {
      joined = joined.innerJoin(tables.get(i), keyColumn);
    }
    Table result = joined.moveColumnFirst(keyColumn);
    LOGGER.debug("Joined metrics: {} rows, columns {}", result.rowCount(), result.columnNames());
    return result;
  }
}
