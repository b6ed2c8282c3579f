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

import org.apache.calcite.adapter.popgetter.ReleaseFixture;
import org.apache.calcite.adapter.popgetter.RequestShapeException;
import org.apache.calcite.adapter.popgetter.ResourceFetchException;
import org.apache.calcite.adapter.popgetter.UnsupportedRequestException;
import org.apache.calcite.adapter.popgetter.geo.FlatGeobufTestWriter;
import org.apache.calcite.adapter.popgetter.geo.GeometryFetcher;
import org.apache.calcite.adapter.popgetter.search.BBox;
import org.apache.calcite.adapter.popgetter.search.DownloadParams;
import org.apache.calcite.adapter.popgetter.search.RegionSpec;
import org.apache.calcite.adapter.popgetter.storage.LocalFileStorageProvider;
import org.apache.calcite.adapter.popgetter.table.Table;

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
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link Materializer}.
 */
@Tag("unit")
public class MaterializerTest {
  @TempDir
  Path tempDir;

  private ExecutorService executor;
  private ReleaseFixture release;
  private Materializer materializer;

  @BeforeEach
  void setUp() throws Exception {
    executor = Executors.newFixedThreadPool(4);
    release = ReleaseFixture.create(tempDir.resolve("release"));
    LocalFileStorageProvider storage = new LocalFileStorageProvider();
    materializer = new Materializer(new ParquetMetricFetcher(storage, "GEO_ID", executor),
        new GeometryFetcher(storage, "GEO_ID", "geometry"), "GEO_ID", executor);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private String path(String relative) {
    return release.basePath() + "/" + relative;
  }

  private List<MetricRequest> belgium() {
    String geom = path(ReleaseFixture.BEL_GEOMETRY_STEM + ".fgb");
    return Arrays.asList(
        new MetricRequest("bel_pop_total", path(ReleaseFixture.BEL_METRIC_FILE), geom),
        new MetricRequest("bel_pop_female", path(ReleaseFixture.BEL_METRIC_FILE), geom));
  }

  @Test void testGeometryFirstThenMetrics() {
    Table table = materializer.download(belgium(), DownloadParams.withGeometry());
    assertEquals(Arrays.asList("GEO_ID", "geometry", "bel_pop_total", "bel_pop_female"),
        table.columnNames());
    assertEquals(Arrays.<Object>asList("BE001", "BE002", "BE003"), table.columnValues("GEO_ID"));
    assertEquals(Arrays.<Object>asList(1000L, 2000L, 3000L), table.columnValues("bel_pop_total"));
    assertTrue(((String) table.get(0, "geometry")).startsWith("POLYGON"));
  }

  @Test void testMetricsOnly() {
    Table table = materializer.download(belgium(), DownloadParams.metricsOnly());
    assertEquals(Arrays.asList("GEO_ID", "bel_pop_total", "bel_pop_female"), table.columnNames());
    assertEquals(3, table.rowCount());
  }

  @Test void testBoundingBoxRestrictsRows() {
    DownloadParams params = new DownloadParams(true,
        Collections.singletonList(RegionSpec.boundingBox(new BBox(9, 9, 12, 12))));
    Table table = materializer.download(belgium(), params);
    assertEquals(Arrays.<Object>asList("BE002"), table.columnValues("GEO_ID"));
    assertEquals(Arrays.<Object>asList(990L), table.columnValues("bel_pop_female"));
  }

  @Test void testNoOverlappingKeysGivesEmptyTable() throws Exception {
    Path other = tempDir.resolve("other.fgb");
    new FlatGeobufTestWriter(Collections.singletonList("GEO_ID"))
        .add(ReleaseFixture.square(0, 0), "ZZ1")
        .write(other);
    List<MetricRequest> requests = Collections.singletonList(
        new MetricRequest("bel_pop_total", path(ReleaseFixture.BEL_METRIC_FILE),
            other.toString()));
    Table table = materializer.download(requests, DownloadParams.withGeometry());
    assertTrue(table.isEmpty());
    assertEquals(Arrays.asList("GEO_ID", "geometry", "bel_pop_total"), table.columnNames());
  }

  @Test void testNoRequests() {
    assertThrows(RequestShapeException.class,
        () -> materializer.download(Collections.<MetricRequest>emptyList(),
            DownloadParams.withGeometry()));
  }

  @Test void testSeveralGeometryFilesUnsupported() {
    List<MetricRequest> requests = Arrays.asList(belgium().get(0),
        new MetricRequest("nir_pop_total", path(ReleaseFixture.NIR_METRIC_FILE),
            path(ReleaseFixture.NIR_GEOMETRY_STEM + ".fgb")));
    assertThrows(UnsupportedRequestException.class,
        () -> materializer.download(requests, DownloadParams.withGeometry()));
  }

  @Test void testRegionLimitations() {
    RegionSpec box = RegionSpec.boundingBox(new BBox(0, 0, 1, 1));
    assertThrows(UnsupportedRequestException.class,
        () -> materializer.download(belgium(), new DownloadParams(true, Arrays.asList(box, box))));
    assertThrows(UnsupportedRequestException.class,
        () -> materializer.download(belgium(), new DownloadParams(true,
            Collections.<RegionSpec>singletonList(new RegionSpec.NamedArea("Brussels")))));
  }

  @Test void testMissingGeometryFileFails() {
    List<MetricRequest> requests = Collections.singletonList(
        new MetricRequest("bel_pop_total", path(ReleaseFixture.BEL_METRIC_FILE),
            path("bel/geometries/absent.fgb")));
    assertThrows(ResourceFetchException.class,
        () -> materializer.download(requests, DownloadParams.withGeometry()));
  }
}
