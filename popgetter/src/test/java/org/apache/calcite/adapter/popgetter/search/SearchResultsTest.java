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
import org.apache.calcite.adapter.popgetter.table.Column;
import org.apache.calcite.adapter.popgetter.table.DataType;
import org.apache.calcite.adapter.popgetter.table.Table;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.GEOMETRY_FILEPATH_STEM;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.METRIC_ID;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.METRIC_PARQUET_COLUMN_NAME;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.METRIC_PARQUET_PATH;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link SearchResults}.
 */
@Tag("unit")
public class SearchResultsTest {
  private static Table.Builder catalog() {
    return Table.builder(Column.of(METRIC_ID, DataType.STRING),
        Column.of(METRIC_PARQUET_COLUMN_NAME, DataType.STRING),
        Column.of(METRIC_PARQUET_PATH, DataType.STRING),
        Column.of(GEOMETRY_FILEPATH_STEM, DataType.STRING));
  }

  @Test void testToMetricRequests() {
    SearchResults results = new SearchResults(catalog()
        .addRow("a", "col_a", "bel/metrics/x.parquet", "bel/geometries/m")
        .addRow("b", "col_b", "bel/metrics/x.parquet", "bel/geometries/m")
        .build());
    List<MetricRequest> requests = results.toMetricRequests("https://host/releases/v1/");
    assertEquals(Arrays.asList(
            new MetricRequest("col_a", "https://host/releases/v1/bel/metrics/x.parquet",
                "https://host/releases/v1/bel/geometries/m.fgb"),
            new MetricRequest("col_b", "https://host/releases/v1/bel/metrics/x.parquet",
                "https://host/releases/v1/bel/geometries/m.fgb")),
        requests);
  }

  @Test void testRowWithoutPathFails() {
    SearchResults results = new SearchResults(catalog()
        .addRow("a", "col_a", null, "bel/geometries/m")
        .build());
    assertThrows(ResourceFetchException.class, () -> results.toMetricRequests("/r"));
  }

  @Test void testSummaryAndUniqueValues() {
    SearchResults results = new SearchResults(catalog()
        .addRow("a", "col_a", "f.parquet", "g")
        .addRow("b", "col_b", "f.parquet", "g")
        .build());
    Map<String, Integer> summary = results.summary();
    assertEquals(Integer.valueOf(2), summary.get(METRIC_ID));
    assertEquals(Integer.valueOf(1), summary.get(METRIC_PARQUET_PATH));
    assertEquals(Arrays.<Object>asList("f.parquet"), results.uniqueValues(METRIC_PARQUET_PATH));
    assertEquals(2, results.size());
  }
}
