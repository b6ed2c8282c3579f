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
package org.apache.calcite.adapter.popgetter.sql;

import org.apache.calcite.adapter.popgetter.Popgetter;
import org.apache.calcite.adapter.popgetter.metadata.MetadataTable;
import org.apache.calcite.schema.impl.AbstractSchema;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Schema over the catalog of a {@link Popgetter}: one table per metadata
 * relation, named as published, plus {@value #METRICS_VIEW}, the expanded
 * one-row-per-metric-and-country view that searches run against.
 */
public class PopgetterSchema extends AbstractSchema {
  public static final String METRICS_VIEW = "metrics";

  private final Popgetter popgetter;

  public PopgetterSchema(Popgetter popgetter) {
    this.popgetter = popgetter;
  }

  public Popgetter popgetter() {
    return popgetter;
  }

  @Override protected Map<String, org.apache.calcite.schema.Table> getTableMap() {
    ImmutableMap.Builder<String, org.apache.calcite.schema.Table> builder =
        ImmutableMap.builder();
    for (final MetadataTable kind : MetadataTable.values()) {
      builder.put(kind.tableName(),
          new PopgetterTable(() -> popgetter.metadata().get(kind)));
    }
    builder.put(METRICS_VIEW, new PopgetterTable(() -> popgetter.expandedMetadata().view()));
    return builder.build();
  }
}
