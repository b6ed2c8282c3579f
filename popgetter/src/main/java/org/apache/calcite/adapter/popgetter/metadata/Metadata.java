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
package org.apache.calcite.adapter.popgetter.metadata;

import org.apache.calcite.adapter.popgetter.table.Table;

import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The five metadata relations of a catalog, for one country or unioned over
 * several. Immutable.
 */
public final class Metadata {
  private final ImmutableMap<MetadataTable, Table> tables;

  public Metadata(Map<MetadataTable, Table> tables) {
    for (MetadataTable kind : MetadataTable.values()) {
      if (!tables.containsKey(kind)) {
        throw new IllegalArgumentException("Missing metadata relation " + kind);
      }
    }
    this.tables = ImmutableMap.copyOf(new EnumMap<>(tables));
  }

  public Table get(MetadataTable kind) {
    return tables.get(kind);
  }

  public Table metrics() {
    return tables.get(MetadataTable.METRIC);
  }

  public Table geometries() {
    return tables.get(MetadataTable.GEOMETRY);
  }

  public Table sourceDataReleases() {
    return tables.get(MetadataTable.SOURCE_DATA_RELEASE);
  }

  public Table dataPublishers() {
    return tables.get(MetadataTable.DATA_PUBLISHER);
  }

  public Table countries() {
    return tables.get(MetadataTable.COUNTRY);
  }

  /**
   * Unions each relation across {@code parts}, in list order, widening
   * column types that disagree.
   */
  public static Metadata union(List<Metadata> parts) {
    Map<MetadataTable, Table> unioned = new EnumMap<>(MetadataTable.class);
    for (MetadataTable kind : MetadataTable.values()) {
      List<Table> tables = new ArrayList<>(parts.size());
      for (Metadata part : parts) {
        tables.add(part.get(kind));
      }
      unioned.put(kind, Table.unionByName(tables));
    }
    return new Metadata(unioned);
  }

  @Override public boolean equals(Object o) {
    return o instanceof Metadata && tables.equals(((Metadata) o).tables);
  }

  @Override public int hashCode() {
    return tables.hashCode();
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder("Metadata{");
    for (Map.Entry<MetadataTable, Table> entry : tables.entrySet()) {
      sb.append(entry.getKey()).append('=').append(entry.getValue().rowCount()).append(" rows; ");
    }
    return sb.append('}').toString();
  }
}
