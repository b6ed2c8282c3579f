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
 * Column names of the published metadata relations.
 */
public final class CatalogColumns {
  private CatalogColumns() {
  }

  // Country
  public static final String COUNTRY_ID = "country_id";
  public static final String COUNTRY_NAME_SHORT_EN = "country_name_short_en";
  public static final String COUNTRY_NAME_OFFICIAL = "country_name_official";
  public static final String COUNTRY_ISO2 = "country_iso2";
  public static final String COUNTRY_ISO3 = "country_iso3";
  public static final String COUNTRY_ISO3166_2 = "country_iso3166_2";

  // DataPublisher
  public static final String DATA_PUBLISHER_ID = "data_publisher_id";
  public static final String DATA_PUBLISHER_NAME = "data_publisher_name";
  public static final String DATA_PUBLISHER_URL = "data_publisher_url";
  public static final String DATA_PUBLISHER_DESCRIPTION = "data_publisher_description";
  public static final String DATA_PUBLISHER_COUNTRIES_OF_INTEREST =
      "data_publisher_countries_of_interest";

  // GeometryMetadata
  public static final String GEOMETRY_ID = "geometry_id";
  public static final String GEOMETRY_FILEPATH_STEM = "geometry_filepath_stem";
  public static final String GEOMETRY_VALIDITY_PERIOD_START = "geometry_validity_period_start";
  public static final String GEOMETRY_VALIDITY_PERIOD_END = "geometry_validity_period_end";
  public static final String GEOMETRY_LEVEL = "geometry_level";
  public static final String GEOMETRY_HXL_TAG = "geometry_hxl_tag";

  // SourceDataRelease
  public static final String SOURCE_DATA_RELEASE_ID = "source_data_release_id";
  public static final String SOURCE_DATA_RELEASE_NAME = "source_data_release_name";
  public static final String SOURCE_DATA_RELEASE_DATE_PUBLISHED =
      "source_data_release_date_published";
  public static final String SOURCE_DATA_RELEASE_REFERENCE_PERIOD_START =
      "source_data_release_reference_period_start";
  public static final String SOURCE_DATA_RELEASE_REFERENCE_PERIOD_END =
      "source_data_release_reference_period_end";
  public static final String SOURCE_DATA_RELEASE_COLLECTION_PERIOD_START =
      "source_data_release_collection_period_start";
  public static final String SOURCE_DATA_RELEASE_COLLECTION_PERIOD_END =
      "source_data_release_collection_period_end";
  public static final String SOURCE_DATA_RELEASE_EXPECT_NEXT_UPDATE =
      "source_data_release_expect_next_update";
  public static final String SOURCE_DATA_RELEASE_URL = "source_data_release_url";
  public static final String SOURCE_DATA_RELEASE_DATA_PUBLISHER_ID =
      "source_data_release_data_publisher_id";
  public static final String SOURCE_DATA_RELEASE_DESCRIPTION = "source_data_release_description";
  public static final String SOURCE_DATA_RELEASE_GEOMETRY_METADATA_ID =
      "source_data_release_geometry_metadata_id";

  // MetricMetadata
  public static final String METRIC_ID = "metric_id";
  public static final String METRIC_HUMAN_READABLE_NAME = "metric_human_readable_name";
  public static final String METRIC_SOURCE_ID = "metric_source_id";
  public static final String METRIC_DESCRIPTION = "metric_description";
  public static final String METRIC_HXL_TAG = "metric_hxl_tag";
  public static final String METRIC_PARQUET_PATH = "metric_parquet_path";
  public static final String METRIC_PARQUET_COLUMN_NAME = "metric_parquet_column_name";
  public static final String METRIC_PARQUET_MARGIN_OF_ERROR_COLUMN =
      "metric_parquet_margin_of_error_column";
  public static final String METRIC_PARQUET_MARGIN_OF_ERROR_FILE =
      "metric_parquet_margin_of_error_file";
  public static final String METRIC_POTENTIAL_DENOMINATOR_IDS = "metric_potential_denominator_ids";
  public static final String METRIC_PARENT_METRIC_ID = "metric_parent_metric_id";
  public static final String METRIC_SOURCE_DATA_RELEASE_ID = "metric_source_data_release_id";
  public static final String METRIC_SOURCE_DOWNLOAD_URL = "metric_source_download_url";
  public static final String METRIC_SOURCE_ARCHIVE_FILE_PATH = "metric_source_archive_file_path";
  public static final String METRIC_SOURCE_DOCUMENTATION_URL = "metric_source_documentation_url";
}
