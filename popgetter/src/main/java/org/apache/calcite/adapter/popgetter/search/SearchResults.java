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
package org.apache.calcite.adapter.popgetter.search;

import org.apache.calcite.adapter.popgetter.ResourceFetchException;
import org.apache.calcite.adapter.popgetter.download.MetricRequest;
import org.apache.calcite.adapter.popgetter.table.Table;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.GEOMETRY_FILEPATH_STEM;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.METRIC_PARQUET_COLUMN_NAME;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.METRIC_PARQUET_PATH;

/**
 * Rows of the catalog view matched by a search, one per (metric, country).
 */
public final class SearchResults {
  private final Table table;

  public SearchResults(Table table) {
    this.table = Objects.requireNonNull(table, "table");
  }

  public Table table() {
    return table;
  }

  public int size() {
    return table.rowCount();
  }

  public boolean isEmpty() {
    return table.isEmpty();
  }

  public Table select(String... columns) {
    return table.select(columns);
  }

  /**
   * Resolves every matched row into a {@link MetricRequest}, with file paths
   * resolved against {@code basePath}.
   *
   * @throws ResourceFetchException if a row lacks its parquet path, column
   *     name or geometry file stem
   */
  public List<MetricRequest> toMetricRequests(String basePath) {
    String base = basePath.endsWith("/") ? basePath.substring(0, basePath.length() - 1) : basePath;
    Table projected = table.select(METRIC_PARQUET_COLUMN_NAME, METRIC_PARQUET_PATH,
        GEOMETRY_FILEPATH_STEM);
    List<MetricRequest> requests = new ArrayList<>(projected.rowCount());
    for (int i = 0; i < projected.rowCount(); i++) {
      Object column = projected.get(i, 0);
      Object path = projected.get(i, 1);
      Object stem = projected.get(i, 2);
      if (column == null || path == null || stem == null) {
        throw new ResourceFetchException("Catalog row " + i + " has no parquet column, path or"
            + " geometry file: " + projected.row(i));
      }
      requests.add(new MetricRequest(column.toString(), base + "/" + path,
          base + "/" + stem + ".fgb"));
    }
    return requests;
  }

  /** Number of distinct values in each column, in column order. */
  public Map<String, Integer> summary() {
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (String column : table.columnNames()) {
      counts.put(column, new LinkedHashSet<>(table.columnValues(column)).size());
    }
    return counts;
  }

  /** Distinct values of a column in first-seen order. */
  public List<Object> uniqueValues(String column) {
    return table.distinctValues(column);
  }

  /** All values of a column in row order. */
  public List<Object> columnValues(String column) {
    return table.columnValues(column);
  }

  @Override public String toString() {
    return "SearchResults{" + table + "}";
  }
}
