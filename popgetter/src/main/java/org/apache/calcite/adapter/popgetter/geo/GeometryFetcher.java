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
package org.apache.calcite.adapter.popgetter.geo;

import org.apache.calcite.adapter.popgetter.ResourceFetchException;
import org.apache.calcite.adapter.popgetter.search.BBox;
import org.apache.calcite.adapter.popgetter.storage.StorageProvider;
import org.apache.calcite.adapter.popgetter.table.Column;
import org.apache.calcite.adapter.popgetter.table.DataType;
import org.apache.calcite.adapter.popgetter.table.Table;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.locationtech.jts.io.WKTWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Fetches the geometries of one FlatGeobuf file as a two-column table of
 * key and WKT text.
 */
public class GeometryFetcher {
  private static final Logger LOGGER = LoggerFactory.getLogger(GeometryFetcher.class);

  private final StorageProvider storageProvider;
  private final String keyColumn;
  private final String geometryColumn;

  public GeometryFetcher(StorageProvider storageProvider, String keyColumn, String geometryColumn) {
    this.storageProvider = storageProvider;
    this.keyColumn = keyColumn;
    this.geometryColumn = geometryColumn;
  }

  /**
   * Reads the features of {@code url} intersecting {@code bbox}, or all of
   * them when it is null.
   *
   * @throws ResourceFetchException if the file cannot be read or a feature
   *     has no key property
   */
  public Table fetchGeometries(String url, @Nullable BBox bbox) {
    LOGGER.debug("Fetching geometries from {} bbox={}", url, bbox);
    List<FlatGeobufFeature> features;
    try {
      features = new FlatGeobufReader(storageProvider, url).read(bbox);
    } catch (IOException e) {
      throw new ResourceFetchException("Failed to read geometries from " + url + ": "
          + e.getMessage(), e);
    }
    WKTWriter wktWriter = new WKTWriter();
    Table.Builder builder = Table.builder(Column.of(keyColumn, DataType.STRING),
        Column.of(geometryColumn, DataType.STRING));
    for (FlatGeobufFeature feature : features) {
      Object key = feature.properties().get(keyColumn);
      if (key == null) {
        throw new ResourceFetchException("Feature in " + url + " has no '" + keyColumn
            + "' property");
      }
      String wkt = feature.geometry() == null ? null : wktWriter.write(feature.geometry());
      builder.addRow(key.toString(), wkt);
    }
    Table table = builder.build();
    LOGGER.info("Fetched {} geometries from {}", table.rowCount(), url);
    return table;
  }
}
