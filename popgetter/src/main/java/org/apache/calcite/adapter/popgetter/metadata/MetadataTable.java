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

/**
 * The five metadata relations published for every country, with the file
 * name each is stored under.
 */
public enum MetadataTable {
  METRIC("metric_metadata.parquet", "metric_metadata"),
  GEOMETRY("geometry_metadata.parquet", "geometry_metadata"),
  SOURCE_DATA_RELEASE("source_metadata.parquet", "source_metadata"),
  DATA_PUBLISHER("publisher_metadata.parquet", "publisher_metadata"),
  COUNTRY("country_metadata.parquet", "country_metadata");

  private final String fileName;
  private final String tableName;

  MetadataTable(String fileName, String tableName) {
    this.fileName = fileName;
    this.tableName = tableName;
  }

  public String fileName() {
    return fileName;
  }

  /** Name used for the relation in SQL and in parquet record schemas. */
  public String tableName() {
    return tableName;
  }

  /** Path of this relation for one country, relative to the release root. */
  public String relativePath(String country) {
    return country + "/" + fileName;
  }
}
