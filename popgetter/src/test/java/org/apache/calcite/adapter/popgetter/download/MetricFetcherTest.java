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

import org.apache.calcite.adapter.popgetter.ResourceFetchException;
import org.apache.calcite.adapter.popgetter.parquet.ParquetTableWriter;
import org.apache.calcite.adapter.popgetter.storage.LocalFileStorageProvider;
import org.apache.calcite.adapter.popgetter.table.Column;
import org.apache.calcite.adapter.popgetter.table.DataType;
import org.apache.calcite.adapter.popgetter.table.Table;
import org.apache.calcite.adapter.popgetter.util.Futures;

import com.google.common.collect.ImmutableSet;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link ParquetMetricFetcher} and {@link DuckDBMetricFetcher}
 * over the same files.
 */
@Tag("unit")
public class MetricFetcherTest {
  @TempDir
  Path tempDir;

  private ExecutorService executor;
  private String fileA;
  private String fileB;
  private String geom;

  @BeforeEach
  void setUp() throws Exception {
    executor = Executors.newFixedThreadPool(4);
    ParquetTableWriter writer = new ParquetTableWriter();
    Path a = tempDir.resolve("a.parquet");
    writer.write(Table.builder(Column.of("c1", DataType.LONG), Column.of("GEO_ID", DataType.STRING),
            Column.of("c2", DataType.DOUBLE))
        .addRow(1L, "E01", 0.5)
        .addRow(2L, "E02", 1.5)
        .addRow(3L, "E03", 2.5)
        .build(), a, "metrics");
    Path b = tempDir.resolve("b.parquet");
    writer.write(Table.builder(Column.of("GEO_ID", DataType.STRING), Column.of("c3", DataType.LONG))
        .addRow("E03", 30L)
        .addRow("E02", 20L)
        .addRow("E09", 90L)
        .build(), b, "metrics");
    fileA = a.toString();
    fileB = b.toString();
    geom = tempDir.resolve("g.fgb").toString();
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private List<MetricRequest> requests() {
    return Arrays.asList(new MetricRequest("c2", fileA, geom),
        new MetricRequest("c3", fileB, geom), new MetricRequest("c1", fileA, geom));
  }

  @Test void testParquetSingleFileKeyFirst() {
    MetricFetcher fetcher =
        new ParquetMetricFetcher(new LocalFileStorageProvider(), "GEO_ID", executor);
    Table table = Futures.join(fetcher.fetchMetrics(
        Collections.singletonList(new MetricRequest("c2", fileA, geom)), null));
    assertEquals(Arrays.asList("GEO_ID", "c2"), table.columnNames());
    assertEquals(3, table.rowCount());
  }

  @Test void testParquetJoinsFilesInOrder() {
    MetricFetcher fetcher =
        new ParquetMetricFetcher(new LocalFileStorageProvider(), "GEO_ID", executor);
    Table table = Futures.join(fetcher.fetchMetrics(requests(), null));
    assertEquals(Arrays.asList("GEO_ID", "c2", "c1", "c3"), table.columnNames());
    assertEquals(Arrays.<Object>asList("E02", "E03"), table.columnValues("GEO_ID"));
    assertEquals(Arrays.<Object>asList(20L, 30L), table.columnValues("c3"));
  }

  @Test void testParquetKeyFilter() {
    MetricFetcher fetcher =
        new ParquetMetricFetcher(new LocalFileStorageProvider(), "GEO_ID", executor);
    Table table = Futures.join(fetcher.fetchMetrics(requests(), ImmutableSet.of("E03")));
    assertEquals(Arrays.<Object>asList("E03"), table.columnValues("GEO_ID"));
    assertEquals(Arrays.<Object>asList(2.5), table.columnValues("c2"));
  }

  @Test void testParquetMissingFileFailsWhole() {
    MetricFetcher fetcher =
        new ParquetMetricFetcher(new LocalFileStorageProvider(), "GEO_ID", executor);
    List<MetricRequest> requests = Arrays.asList(new MetricRequest("c2", fileA, geom),
        new MetricRequest("c9", tempDir.resolve("none.parquet").toString(), geom));
    assertThrows(ResourceFetchException.class,
        () -> Futures.join(fetcher.fetchMetrics(requests, null)));
  }

  /** Requests column {@code c1} from {@code a.parquet} and from a second file. */
  private List<MetricRequest> clashingRequests() throws Exception {
    Path c = tempDir.resolve("c.parquet");
    new ParquetTableWriter().write(
        Table.builder(Column.of("GEO_ID", DataType.STRING), Column.of("c1", DataType.LONG))
            .addRow("E01", 100L)
            .addRow("E03", 300L)
            .build(), c, "metrics");
    return Arrays.asList(new MetricRequest("c1", fileA, geom),
        new MetricRequest("c1", c.toString(), geom));
  }

  @Test void testParquetSuffixesSameColumnFromTwoFiles() throws Exception {
    MetricFetcher fetcher =
        new ParquetMetricFetcher(new LocalFileStorageProvider(), "GEO_ID", executor);
    Table table = Futures.join(fetcher.fetchMetrics(clashingRequests(), null));
    assertEquals(Arrays.asList("GEO_ID", "c1", "c1" + Table.JOIN_SUFFIX), table.columnNames());
    assertEquals(Arrays.<Object>asList(1L, 3L), table.columnValues("c1"));
    assertEquals(Arrays.<Object>asList(100L, 300L), table.columnValues("c1_right"));
  }

  @Test void testParquetEmptyKeysGiveNoRows() {
    MetricFetcher fetcher =
        new ParquetMetricFetcher(new LocalFileStorageProvider(), "GEO_ID", executor);
    Table table = Futures.join(fetcher.fetchMetrics(requests(), ImmutableSet.<String>of()));
    assertEquals(Arrays.asList("GEO_ID", "c2", "c1", "c3"), table.columnNames());
    assertEquals(0, table.rowCount());
  }

  @Tag("integration")
  @Test void testDuckDBSuffixesLikeParquet() throws Exception {
    List<MetricRequest> requests = clashingRequests();
    MetricFetcher parquet =
        new ParquetMetricFetcher(new LocalFileStorageProvider(), "GEO_ID", executor);
    MetricFetcher duckdb = new DuckDBMetricFetcher("GEO_ID", executor);
    Table expected = Futures.join(parquet.fetchMetrics(requests, null));
    Table actual = Futures.join(duckdb.fetchMetrics(requests, null));
    assertEquals(expected.columnNames(), actual.columnNames());
    assertEquals(ImmutableSet.copyOf(expected.columnValues("c1_right")),
        ImmutableSet.copyOf(actual.columnValues("c1_right")));
  }

  @Tag("integration")
  @Test void testDuckDBEmptyKeysGiveNoRows() {
    MetricFetcher duckdb = new DuckDBMetricFetcher("GEO_ID", executor);
    Table table = Futures.join(duckdb.fetchMetrics(requests(), ImmutableSet.<String>of()));
    assertEquals(Arrays.asList("GEO_ID", "c2", "c1", "c3"), table.columnNames());
    assertEquals(0, table.rowCount());
  }

  @Tag("integration")
  @Test void testDuckDBMatchesParquet() {
    MetricFetcher parquet =
        new ParquetMetricFetcher(new LocalFileStorageProvider(), "GEO_ID", executor);
    MetricFetcher duckdb = new DuckDBMetricFetcher("GEO_ID", executor);
    Table expected = Futures.join(parquet.fetchMetrics(requests(), null));
    Table actual = Futures.join(duckdb.fetchMetrics(requests(), null));
    assertEquals(expected.columnNames(), actual.columnNames());
    assertEquals(ImmutableSet.copyOf(expected.columnValues("GEO_ID")),
        ImmutableSet.copyOf(actual.columnValues("GEO_ID")));
    assertEquals(DataType.LONG, actual.column("c3").type());
    assertEquals(DataType.DOUBLE, actual.column("c2").type());
  }

  @Tag("integration")
  @Test void testDuckDBMissingFile() {
    MetricFetcher duckdb = new DuckDBMetricFetcher("GEO_ID", executor);
    List<MetricRequest> requests = Collections.singletonList(
        new MetricRequest("c9", tempDir.resolve("none.parquet").toString(), geom));
    assertThrows(ResourceFetchException.class,
        () -> Futures.join(duckdb.fetchMetrics(requests, null)));
  }
}
