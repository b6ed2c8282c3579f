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

import org.apache.calcite.adapter.popgetter.RequestShapeException;
import org.apache.calcite.adapter.popgetter.UnsupportedRequestException;
import org.apache.calcite.adapter.popgetter.geo.GeometryFetcher;
import org.apache.calcite.adapter.popgetter.search.BBox;
import org.apache.calcite.adapter.popgetter.search.DownloadParams;
import org.apache.calcite.adapter.popgetter.search.RegionSpec;
import org.apache.calcite.adapter.popgetter.table.Table;
import org.apache.calcite.adapter.popgetter.util.Futures;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Turns metric requests into a table: metric columns fetched from their
 * parquet files and, when asked for, the geometries of the one geometry file
 * they share, joined on the key column.
 *
 * <p>Metrics and geometries are fetched concurrently; either failing fails
 * the download and cancels the other.
 */
public class Materializer {
  private static final Logger LOGGER = LoggerFactory.getLogger(Materializer.class);

  private final MetricFetcher metricFetcher;
  private final GeometryFetcher geometryFetcher;
  private final String keyColumn;
  private final Executor executor;

  public Materializer(MetricFetcher metricFetcher, GeometryFetcher geometryFetcher,
      String keyColumn, Executor executor) {
    this.metricFetcher = metricFetcher;
    this.geometryFetcher = geometryFetcher;
    this.keyColumn = keyColumn;
    this.executor = executor;
  }

  /**
   * Downloads and waits for the result.
   *
   * @throws RequestShapeException if there is nothing to fetch
   * @throws UnsupportedRequestException if the requests span several geometry
   *     files, or the region is not a single bounding box
   */
  public Table download(List<MetricRequest> requests, DownloadParams params) {
    return Futures.join(downloadAsync(requests, params));
  }

  /**
   * Starts a download. Shape problems are thrown immediately rather than
   * through the returned future.
   */
  public CompletableFuture<Table> downloadAsync(List<MetricRequest> requests,
      DownloadParams params) {
    if (requests.isEmpty()) {
      throw new RequestShapeException("No metric requests were derived from the search results"
          + " (download params " + params + ")");
    }
    Set<String> geometryFiles = MetricRequest.geometryFiles(requests);
    if (geometryFiles.size() > 1) {
      LOGGER.error("Multiple geometries not supported in current release: {}", geometryFiles);
      throw new UnsupportedRequestException("Multiple geometries not supported in current"
          + " release: " + geometryFiles);
    }
    if (geometryFiles.isEmpty()) {
      throw new RequestShapeException("No geometry files for metric requests " + requests);
    }
    String geometryFile = geometryFiles.iterator().next();
    LOGGER.info("Downloading {} metrics from {} files, geometry {} ({})", requests.size(),
        MetricRequest.columnsByFile(requests).size(), geometryFile,
        params.includeGeoms() ? "included" : "not included");

    if (!params.includeGeoms()) {
      return metricFetcher.fetchMetrics(requests, null);
    }

    final BBox bbox = boundingBox(params.regionSpecs());
    CompletableFuture<Table> metrics = metricFetcher.fetchMetrics(requests, null);
    CompletableFuture<Table> geometries = CompletableFuture.supplyAsync(
        () -> geometryFetcher.fetchGeometries(geometryFile, bbox), executor);
    return Futures.allOfFailFast(Arrays.asList(geometries, metrics))
        .thenApplyAsync(tables -> {
          Table joined = tables.get(0).innerJoin(tables.get(1), keyColumn);
          LOGGER.info("Download joined {} geometries with {} metric rows into {} rows",
              tables.get(0).rowCount(), tables.get(1).rowCount(), joined.rowCount());
          return joined;
        }, executor);
  }

  private static @Nullable BBox boundingBox(List<RegionSpec> regionSpecs) {
    if (regionSpecs.isEmpty()) {
      return null;
    }
    if (regionSpecs.size() > 1) {
      throw new UnsupportedRequestException("Multiple region specifications are not yet"
          + " supported: " + regionSpecs);
    }
    RegionSpec region = regionSpecs.get(0);
    if (!(region instanceof RegionSpec.BoundingBox)) {
      throw new UnsupportedRequestException("Only bounding box regions are supported: " + region);
    }
    LOGGER.warn("The bounding box should be specified in the same coordinate reference system"
        + " as the requested geometry.");
    return ((RegionSpec.BoundingBox) region).bbox();
  }
}
