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

import org.apache.calcite.adapter.popgetter.table.Table;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Fetches metric columns from their parquet files as one table keyed on the
 * geographic identifier, which comes first.
 */
public interface MetricFetcher {
  /**
   * Starts fetching the requested columns.
   *
   * @param requests Columns to fetch; files are read in first-appearance order
   * @param keys Keys to keep, or null for every row
   * @return future completing with the inner join of the per-file tables
   */
  CompletableFuture<Table> fetchMetrics(List<MetricRequest> requests, @Nullable Set<String> keys);
}
