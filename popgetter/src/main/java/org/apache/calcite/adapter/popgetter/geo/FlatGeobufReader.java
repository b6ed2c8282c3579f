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
import org.apache.calcite.adapter.popgetter.storage.BufferedRangeReader;
import org.apache.calcite.adapter.popgetter.storage.StorageProvider;

import com.google.common.primitives.UnsignedLong;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wololo.flatgeobuf.ColumnMeta;
import org.wololo.flatgeobuf.Constants;
import org.wololo.flatgeobuf.GeometryConversions;
import org.wololo.flatgeobuf.HeaderMeta;
import org.wololo.flatgeobuf.PackedRTree;
import org.wololo.flatgeobuf.generated.Column;
import org.wololo.flatgeobuf.generated.ColumnType;
import org.wololo.flatgeobuf.generated.Feature;
import org.wololo.flatgeobuf.generated.GeometryType;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads features from a FlatGeobuf file through a range-capable
 * {@link StorageProvider}.
 *
 * <p>With a bounding box and a spatial index only the tree nodes and the
 * matching features are fetched. Files without an index are read
 * sequentially and filtered on each feature's envelope.
 */
public class FlatGeobufReader {
  private static final Logger LOGGER = LoggerFactory.getLogger(FlatGeobufReader.class);

  /** Magic bytes checked before the header; the last one is the patch version. */
  private static final int MAGIC_CHECKED = 7;
  private static final int SIZE_PREFIX = 4;
  private static final int MAX_HEADER_SIZE = 10 * 1024 * 1024;

  private final BufferedRangeReader reader;
  private final String path;

  private @Nullable HeaderMeta header;
  private List<ColumnMeta> columns = new ArrayList<>();
  private long treeOffset;
  private long featuresOffset;

  public FlatGeobufReader(StorageProvider storageProvider, String path) {
    this.reader = new BufferedRangeReader(storageProvider, path);
    this.path = path;
  }

  /** Reads every feature in file order. */
  public List<FlatGeobufFeature> readAll() throws IOException {
    return readFiltered(null);
  }

  /**
   * Reads the features intersecting {@code bbox}, or every feature when it
   * is null.
   */
  public List<FlatGeobufFeature> read(@Nullable BBox bbox) throws IOException {
    HeaderMeta h = header();
    if (bbox == null) {
      return readAll();
    }
    if (h.indexNodeSize == 0 || h.featuresCount == 0) {
      LOGGER.debug("{} has no spatial index; scanning all features", path);
      return readFiltered(bbox);
    }
    List<Long> offsets = PackedRTreeSearch.search(reader, treeOffset, h.featuresCount,
        h.indexNodeSize, bbox);
    LOGGER.debug("Index search of {} found {} of {} features", path, offsets.size(),
        h.featuresCount);
    List<FlatGeobufFeature> features = new ArrayList<>(offsets.size());
    for (long offset : offsets) {
      features.add(readFeature(featuresOffset + offset).feature);
    }
    return features;
  }

  /** Names of the properties declared in the header. */
  public List<String> columnNames() throws IOException {
    header();
    return columnNames(columns);
  }

  private List<FlatGeobufFeature> readFiltered(@Nullable BBox bbox) throws IOException {
    HeaderMeta h = header();
    long length = reader.length();
    long position = featuresOffset;
    long expected = h.featuresCount;
    List<FlatGeobufFeature> features = new ArrayList<>();
    long read = 0;
    while (position < length && (expected == 0 || read < expected)) {
      Positioned next = readFeature(position);
      position = next.end;
      read++;
      if (bbox == null || intersects(next.feature.geometry(), bbox)) {
        features.add(next.feature);
      }
    }
    return features;
  }

  private static boolean intersects(@Nullable Geometry geometry, BBox bbox) {
    if (geometry == null) {
      return false;
    }
    Envelope e = geometry.getEnvelopeInternal();
    return !e.isNull() && bbox.intersects(e.getMinX(), e.getMinY(), e.getMaxX(), e.getMaxY());
  }

  private HeaderMeta header() throws IOException {
    if (header != null) {
      return header;
    }
    int prefixEnd = Constants.MAGIC_BYTES.length + SIZE_PREFIX;
    ByteBuffer prefix = reader.readBuffer(0, prefixEnd);
    for (int i = 0; i < MAGIC_CHECKED; i++) {
      if (prefix.get(i) != Constants.MAGIC_BYTES[i]) {
        throw new ResourceFetchException(path + " is not a FlatGeobuf v3 file");
      }
    }
    long headerSize = prefix.getInt(Constants.MAGIC_BYTES.length) & 0xFFFFFFFFL;
    if (headerSize > MAX_HEADER_SIZE) {
      throw new ResourceFetchException("FlatGeobuf header of " + path + " is too large: "
          + headerSize);
    }
    HeaderMeta h = HeaderMeta.read(reader.readBuffer(0, prefixEnd + (int) headerSize));
    columns = h.columns == null ? new ArrayList<ColumnMeta>() : h.columns;
    treeOffset = prefixEnd + headerSize;
    long treeSize = 0;
    if (h.indexNodeSize > 0 && h.featuresCount > 0) {
      if (h.featuresCount > Integer.MAX_VALUE) {
        throw new ResourceFetchException("Too many features to index in " + path + ": "
            + h.featuresCount);
      }
      treeSize = PackedRTree.calcSize((int) h.featuresCount, h.indexNodeSize);
    }
    featuresOffset = treeOffset + treeSize;
    LOGGER.debug("{}: {} features, geometry type {}, index node size {}, columns {}", path,
        h.featuresCount, h.geometryType, h.indexNodeSize, columnNames(columns));
    header = h;
    return h;
  }

  private static List<String> columnNames(List<ColumnMeta> columns) {
    List<String> names = new ArrayList<>(columns.size());
    for (ColumnMeta column : columns) {
      names.add(column.name);
    }
    return names;
  }

  private Positioned readFeature(long position) throws IOException {
    long size = reader.readBuffer(position, SIZE_PREFIX).getInt(0) & 0xFFFFFFFFL;
    ByteBuffer bytes = reader.readBuffer(position + SIZE_PREFIX, (int) size);
    Feature feature = Feature.getRootAsFeature(bytes);

    Geometry geometry = null;
    org.wololo.flatgeobuf.generated.Geometry encoded = feature.geometry();
    if (encoded != null) {
      int type = header.geometryType;
      if (type == GeometryType.Unknown) {
        type = encoded.type();
      }
      geometry = GeometryConversions.deserialize(encoded, (byte) type);
    }

    List<ColumnMeta> featureColumns = columns;
    if (feature.columnsLength() > 0) {
      featureColumns = new ArrayList<>(feature.columnsLength());
      for (int i = 0; i < feature.columnsLength(); i++) {
        Column column = feature.columns(i);
        ColumnMeta meta = new ColumnMeta();
        meta.name = column.name();
        meta.type = (byte) column.type();
        featureColumns.add(meta);
      }
    }
    Map<String, Object> properties = decodeProperties(feature, featureColumns);
    return new Positioned(new FlatGeobufFeature(geometry, properties),
        position + SIZE_PREFIX + size);
  }

  private Map<String, Object> decodeProperties(Feature feature, List<ColumnMeta> columns) {
    int length = feature.propertiesLength();
    byte[] raw = new byte[length];
    for (int i = 0; i < length; i++) {
      raw[i] = (byte) feature.properties(i);
    }
    ByteBuffer buffer = ByteBuffer.wrap(raw).order(ByteOrder.LITTLE_ENDIAN);
    Map<String, Object> properties = new LinkedHashMap<>();
    while (buffer.remaining() >= 2) {
      int index = buffer.getShort() & 0xFFFF;
      if (index >= columns.size()) {
        throw new ResourceFetchException("Feature in " + path + " refers to column " + index
            + " but only " + columns.size() + " are declared");
      }
      ColumnMeta column = columns.get(index);
      properties.put(column.name, readValue(buffer, column));
    }
    return properties;
  }

  private Object readValue(ByteBuffer buffer, ColumnMeta column) {
    switch (column.type) {
      case ColumnType.Byte:
        return buffer.get();
      case ColumnType.UByte:
        return buffer.get() & 0xFF;
      case ColumnType.Bool:
        return buffer.get() != 0;
      case ColumnType.Short:
        return buffer.getShort();
      case ColumnType.UShort:
        return buffer.getShort() & 0xFFFF;
      case ColumnType.Int:
        return buffer.getInt();
      case ColumnType.UInt:
        return buffer.getInt() & 0xFFFFFFFFL;
      case ColumnType.Long:
        return buffer.getLong();
      case ColumnType.ULong:
        return UnsignedLong.fromLongBits(buffer.getLong());
      case ColumnType.Float:
        return buffer.getFloat();
      case ColumnType.Double:
        return buffer.getDouble();
      case ColumnType.String:
      case ColumnType.Json:
      case ColumnType.DateTime:
        return new String(readBlob(buffer), StandardCharsets.UTF_8);
      case ColumnType.Binary:
        return readBlob(buffer);
      default:
        throw new ResourceFetchException("Unsupported FlatGeobuf column type " + column.type
            + " for column " + column.name + " in " + path);
    }
  }

  private static byte[] readBlob(ByteBuffer buffer) {
    int length = buffer.getInt();
    byte[] bytes = new byte[length];
    buffer.get(bytes);
    return bytes;
  }

  /** A decoded feature and the file position just past it. */
  private static final class Positioned {
    final FlatGeobufFeature feature;
    final long end;

    Positioned(FlatGeobufFeature feature, long end) {
      this.feature = feature;
      this.end = end;
    }
  }
}
