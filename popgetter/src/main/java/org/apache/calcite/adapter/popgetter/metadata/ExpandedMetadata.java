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

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.COUNTRY_ID;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.DATA_PUBLISHER_COUNTRIES_OF_INTEREST;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.DATA_PUBLISHER_ID;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.GEOMETRY_ID;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.METRIC_SOURCE_DATA_RELEASE_ID;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.SOURCE_DATA_RELEASE_DATA_PUBLISHER_ID;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.SOURCE_DATA_RELEASE_GEOMETRY_METADATA_ID;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.SOURCE_DATA_RELEASE_ID;

/**
 * Denormalized view of a {@link Metadata}: one row per (metric, country).
 *
 * <p>Built as metrics ⋈ source releases ⋈ geometries ⋈ publishers, with the
 * publisher's countries of interest exploded and joined to countries. All
 * joins are inner joins, so a metric missing any link is not in the view.
 * The view is computed on first use and then shared.
 */
public class ExpandedMetadata {
  private static final Logger LOGGER = LoggerFactory.getLogger(ExpandedMetadata.class);

  private final Metadata metadata;
  private final Supplier<Table> view;

  public ExpandedMetadata(Metadata metadata) {
    this.metadata = metadata;
    this.view = Suppliers.memoize(this::compute);
  }

  public Metadata metadata() {
    return metadata;
  }

  /** Returns the joined view, computing it on the first call. */
  public Table view() {
    return view.get();
  }

  public List<String> columnNames() {
    return view().columnNames();
  }

  private Table compute() {
    long start = System.currentTimeMillis();
    Table joined = metadata.metrics()
        .innerJoin(metadata.sourceDataReleases(), METRIC_SOURCE_DATA_RELEASE_ID,
            SOURCE_DATA_RELEASE_ID)
        .innerJoin(metadata.geometries(), SOURCE_DATA_RELEASE_GEOMETRY_METADATA_ID, GEOMETRY_ID)
        .innerJoin(metadata.dataPublishers(), SOURCE_DATA_RELEASE_DATA_PUBLISHER_ID,
            DATA_PUBLISHER_ID)
        .explode(DATA_PUBLISHER_COUNTRIES_OF_INTEREST)
        .innerJoin(metadata.countries(), DATA_PUBLISHER_COUNTRIES_OF_INTEREST, COUNTRY_ID);
    LOGGER.debug("Expanded catalog view: {} rows, {} columns in {} ms", joined.rowCount(),
        joined.columnCount(), System.currentTimeMillis() - start);
    return joined;
  }
}
