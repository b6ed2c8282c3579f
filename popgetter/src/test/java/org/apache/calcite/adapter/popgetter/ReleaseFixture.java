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
package org.apache.calcite.adapter.popgetter;

import org.apache.calcite.adapter.popgetter.geo.FlatGeobufTestWriter;
import org.apache.calcite.adapter.popgetter.metadata.MetadataTable;
import org.apache.calcite.adapter.popgetter.parquet.ParquetTableWriter;
import org.apache.calcite.adapter.popgetter.table.Column;
import org.apache.calcite.adapter.popgetter.table.DataType;
import org.apache.calcite.adapter.popgetter.table.Table;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;

import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.COUNTRY_ID;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.COUNTRY_ISO2;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.COUNTRY_ISO3;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.COUNTRY_ISO3166_2;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.COUNTRY_NAME_OFFICIAL;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.COUNTRY_NAME_SHORT_EN;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.DATA_PUBLISHER_COUNTRIES_OF_INTEREST;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.DATA_PUBLISHER_DESCRIPTION;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.DATA_PUBLISHER_ID;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.DATA_PUBLISHER_NAME;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.DATA_PUBLISHER_URL;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.GEOMETRY_FILEPATH_STEM;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.GEOMETRY_HXL_TAG;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.GEOMETRY_ID;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.GEOMETRY_LEVEL;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.GEOMETRY_VALIDITY_PERIOD_END;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.GEOMETRY_VALIDITY_PERIOD_START;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.METRIC_DESCRIPTION;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.METRIC_HUMAN_READABLE_NAME;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.METRIC_HXL_TAG;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.METRIC_ID;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.METRIC_PARENT_METRIC_ID;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.METRIC_PARQUET_COLUMN_NAME;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.METRIC_PARQUET_MARGIN_OF_ERROR_COLUMN;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.METRIC_PARQUET_MARGIN_OF_ERROR_FILE;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.METRIC_PARQUET_PATH;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.METRIC_POTENTIAL_DENOMINATOR_IDS;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.METRIC_SOURCE_ARCHIVE_FILE_PATH;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.METRIC_SOURCE_DATA_RELEASE_ID;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.METRIC_SOURCE_DOCUMENTATION_URL;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.METRIC_SOURCE_DOWNLOAD_URL;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.METRIC_SOURCE_ID;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.SOURCE_DATA_RELEASE_COLLECTION_PERIOD_END;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.SOURCE_DATA_RELEASE_COLLECTION_PERIOD_START;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.SOURCE_DATA_RELEASE_DATA_PUBLISHER_ID;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.SOURCE_DATA_RELEASE_DATE_PUBLISHED;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.SOURCE_DATA_RELEASE_DESCRIPTION;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.SOURCE_DATA_RELEASE_EXPECT_NEXT_UPDATE;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.SOURCE_DATA_RELEASE_GEOMETRY_METADATA_ID;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.SOURCE_DATA_RELEASE_ID;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.SOURCE_DATA_RELEASE_NAME;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.SOURCE_DATA_RELEASE_REFERENCE_PERIOD_END;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.SOURCE_DATA_RELEASE_REFERENCE_PERIOD_START;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.SOURCE_DATA_RELEASE_URL;

/**
 * Writes a small two-country release to a directory: the country list, the
 * five metadata relations per country, one metric parquet file and one
 * FlatGeobuf geometry file per country.
 *
 * <p>Belgium ("bel") has three municipalities and two metrics from its 2021
 * census; Northern Ireland ("gb_nir") has two small areas and two metrics
 * from its 2021 census, one of which is a household count.
 */
public final class ReleaseFixture {
  public static final String BEL = "bel";
  public static final String NIR = "gb_nir";

  public static final String BEL_POP_TOTAL = "bel-pop-total";
  public static final String BEL_POP_FEMALE = "bel-pop-female";
  public static final String NIR_POP_TOTAL = "nir-pop-total";
  public static final String NIR_HOUSEHOLDS = "nir-households";

  public static final String BEL_METRIC_FILE = "bel/metrics/census_2021.parquet";
  public static final String NIR_METRIC_FILE = "gb_nir/metrics/census_2021.parquet";
  public static final String BEL_GEOMETRY_STEM = "bel/geometries/municipality_2021";
  public static final String NIR_GEOMETRY_STEM = "gb_nir/geometries/sdz_2021";

  private static final GeometryFactory FACTORY = new GeometryFactory();

  private final Path root;

  private ReleaseFixture(Path root) {
    this.root = root;
  }

  public Path root() {
    return root;
  }

  public String basePath() {
    return root.toString();
  }

  /** Writes the release under {@code root} and returns it. */
  public static ReleaseFixture create(Path root) throws IOException {
    Files.createDirectories(root);
    Files.write(root.resolve("countries.txt"),
        (BEL + "\n\n" + NIR + "\n").getBytes(StandardCharsets.UTF_8));
    writeBelgium(root);
    writeNorthernIreland(root);
    return new ReleaseFixture(root);
  }

  public static Geometry square(double x, double y) {
    return FACTORY.createPolygon(new Coordinate[] {
        new Coordinate(x, y), new Coordinate(x + 1, y), new Coordinate(x + 1, y + 1),
        new Coordinate(x, y + 1), new Coordinate(x, y)});
  }

  private static void writeBelgium(Path root) throws IOException {
    writeRelation(root, BEL, MetadataTable.COUNTRY, country(BEL, "Belgium", "Kingdom of Belgium", "BE", "BEL", null));
    writeRelation(root, BEL, MetadataTable.DATA_PUBLISHER,
        publisher("statbel", "Statbel", "https://statbel.fgov.be/", BEL));
    writeRelation(root, BEL, MetadataTable.GEOMETRY,
        geometry("bel_municipality_2021", BEL_GEOMETRY_STEM, 2021, "municipality",
            "#adm4+code"));
    writeRelation(root, BEL, MetadataTable.SOURCE_DATA_RELEASE,
        sourceRelease("bel_census_2021", "Census 2021", 2021, "statbel",
            "bel_municipality_2021"));
    writeRelation(root, BEL, MetadataTable.METRIC,
        metrics()
            .addRow(BEL_POP_TOTAL, "Total population", "TOTAL", "Total resident population",
                "#population+total", BEL_METRIC_FILE, "bel_pop_total", null, null,
                Collections.emptyList(), null, "bel_census_2021",
                "https://statbel.fgov.be/census/total.zip", null,
                "https://statbel.fgov.be/census/docs")
            .addRow(BEL_POP_FEMALE, "Female population", "F", "Resident women",
                "#population+f", BEL_METRIC_FILE, "bel_pop_female", null, null,
                Arrays.asList(BEL_POP_TOTAL), BEL_POP_TOTAL, "bel_census_2021",
                "https://statbel.fgov.be/census/sex.zip", "sex.csv",
                "https://statbel.fgov.be/census/docs")
            .build());
    writeParquet(root.resolve(BEL_METRIC_FILE), "metrics",
        Table.builder(Column.of("GEO_ID", DataType.STRING),
                Column.of("bel_pop_total", DataType.LONG),
                Column.of("bel_pop_female", DataType.LONG))
            .addRow("BE001", 1000L, 510L)
            .addRow("BE002", 2000L, 990L)
            .addRow("BE003", 3000L, 1520L)
            .build());
    writeGeometries(root.resolve(BEL_GEOMETRY_STEM + ".fgb"),
        new String[] {"BE001", "BE002", "BE003"}, 0);
  }

  private static void writeNorthernIreland(Path root) throws IOException {
    writeRelation(root, NIR, MetadataTable.COUNTRY, country(NIR, "Northern Ireland", "Northern Ireland", "GB",
        "GBR", "GB-NIR"));
    writeRelation(root, NIR, MetadataTable.DATA_PUBLISHER,
        publisher("nisra", "NISRA", "https://www.nisra.gov.uk/", NIR));
    writeRelation(root, NIR, MetadataTable.GEOMETRY,
        geometry("nir_sdz_2021", NIR_GEOMETRY_STEM, 2021, "sdz", "#adm3+code"));
    writeRelation(root, NIR, MetadataTable.SOURCE_DATA_RELEASE,
        sourceRelease("nir_census_2021", "Census 2021", 2021, "nisra", "nir_sdz_2021"));
    writeRelation(root, NIR, MetadataTable.METRIC,
        metrics()
            .addRow(NIR_POP_TOTAL, "All usual residents", "MS-A01", "Usual resident population",
                "#population+total", NIR_METRIC_FILE, "nir_pop_total", null, null,
                Collections.emptyList(), null, "nir_census_2021",
                "https://build.nisra.gov.uk/ms-a01.csv", null,
                "https://www.nisra.gov.uk/census")
            .addRow(NIR_HOUSEHOLDS, "Households", "MS-E01", "Number of households",
                "#household+total", NIR_METRIC_FILE, "nir_households", null, null,
                Collections.emptyList(), null, "nir_census_2021",
                "https://build.nisra.gov.uk/ms-e01.csv", null,
                "https://www.nisra.gov.uk/census")
            .build());
    writeParquet(root.resolve(NIR_METRIC_FILE), "metrics",
        Table.builder(Column.of("GEO_ID", DataType.STRING),
                Column.of("nir_pop_total", DataType.LONG),
                Column.of("nir_households", DataType.LONG))
            .addRow("N001", 400L, 160L)
            .addRow("N002", 600L, 250L)
            .build());
    writeGeometries(root.resolve(NIR_GEOMETRY_STEM + ".fgb"), new String[] {"N001", "N002"},
        100);
  }

  private static Table country(String id, String name, String official, String iso2,
      String iso3, String iso3166) {
    return Table.builder(Column.of(COUNTRY_ID, DataType.STRING),
            Column.of(COUNTRY_NAME_SHORT_EN, DataType.STRING),
            Column.of(COUNTRY_NAME_OFFICIAL, DataType.STRING),
            Column.of(COUNTRY_ISO2, DataType.STRING),
            Column.of(COUNTRY_ISO3, DataType.STRING),
            Column.of(COUNTRY_ISO3166_2, DataType.STRING))
        .addRow(id, name, official, iso2, iso3, iso3166)
        .build();
  }

  private static Table publisher(String id, String name, String url, String country) {
    return Table.builder(Column.of(DATA_PUBLISHER_ID, DataType.STRING),
            Column.of(DATA_PUBLISHER_NAME, DataType.STRING),
            Column.of(DATA_PUBLISHER_URL, DataType.STRING),
            Column.of(DATA_PUBLISHER_DESCRIPTION, DataType.STRING),
            Column.of(DATA_PUBLISHER_COUNTRIES_OF_INTEREST, DataType.STRING_LIST))
        .addRow(id, name, url, "National statistics office", Arrays.asList(country))
        .build();
  }

  private static Table geometry(String id, String stem, int year, String level, String hxl) {
    return Table.builder(Column.of(GEOMETRY_ID, DataType.STRING),
            Column.of(GEOMETRY_FILEPATH_STEM, DataType.STRING),
            Column.of(GEOMETRY_VALIDITY_PERIOD_START, DataType.DATE),
            Column.of(GEOMETRY_VALIDITY_PERIOD_END, DataType.DATE),
            Column.of(GEOMETRY_LEVEL, DataType.STRING),
            Column.of(GEOMETRY_HXL_TAG, DataType.STRING))
        .addRow(id, stem, LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31), level, hxl)
        .build();
  }

  private static Table sourceRelease(String id, String name, int year, String publisher,
      String geometry) {
    return Table.builder(Column.of(SOURCE_DATA_RELEASE_ID, DataType.STRING),
            Column.of(SOURCE_DATA_RELEASE_NAME, DataType.STRING),
            Column.of(SOURCE_DATA_RELEASE_DATE_PUBLISHED, DataType.DATE),
            Column.of(SOURCE_DATA_RELEASE_REFERENCE_PERIOD_START, DataType.DATE),
            Column.of(SOURCE_DATA_RELEASE_REFERENCE_PERIOD_END, DataType.DATE),
            Column.of(SOURCE_DATA_RELEASE_COLLECTION_PERIOD_START, DataType.DATE),
            Column.of(SOURCE_DATA_RELEASE_COLLECTION_PERIOD_END, DataType.DATE),
            Column.of(SOURCE_DATA_RELEASE_EXPECT_NEXT_UPDATE, DataType.DATE),
            Column.of(SOURCE_DATA_RELEASE_URL, DataType.STRING),
            Column.of(SOURCE_DATA_RELEASE_DATA_PUBLISHER_ID, DataType.STRING),
            Column.of(SOURCE_DATA_RELEASE_DESCRIPTION, DataType.STRING),
            Column.of(SOURCE_DATA_RELEASE_GEOMETRY_METADATA_ID, DataType.STRING))
        .addRow(id, name, LocalDate.of(year + 2, 1, 1), LocalDate.of(year, 3, 21),
            LocalDate.of(year, 3, 21), LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31),
            LocalDate.of(year + 10, 1, 1), "https://example.org/" + id, publisher,
            name + " results", geometry)
        .build();
  }

  private static Table.Builder metrics() {
    return Table.builder(Column.of(METRIC_ID, DataType.STRING),
        Column.of(METRIC_HUMAN_READABLE_NAME, DataType.STRING),
        Column.of(METRIC_SOURCE_ID, DataType.STRING),
        Column.of(METRIC_DESCRIPTION, DataType.STRING),
        Column.of(METRIC_HXL_TAG, DataType.STRING),
        Column.of(METRIC_PARQUET_PATH, DataType.STRING),
        Column.of(METRIC_PARQUET_COLUMN_NAME, DataType.STRING),
        Column.of(METRIC_PARQUET_MARGIN_OF_ERROR_COLUMN, DataType.STRING),
        Column.of(METRIC_PARQUET_MARGIN_OF_ERROR_FILE, DataType.STRING),
        Column.of(METRIC_POTENTIAL_DENOMINATOR_IDS, DataType.STRING_LIST),
        Column.of(METRIC_PARENT_METRIC_ID, DataType.STRING),
        Column.of(METRIC_SOURCE_DATA_RELEASE_ID, DataType.STRING),
        Column.of(METRIC_SOURCE_DOWNLOAD_URL, DataType.STRING),
        Column.of(METRIC_SOURCE_ARCHIVE_FILE_PATH, DataType.STRING),
        Column.of(METRIC_SOURCE_DOCUMENTATION_URL, DataType.STRING));
  }

  private static void writeRelation(Path root, String country, MetadataTable kind, Table table)
      throws IOException {
    writeParquet(root.resolve(kind.relativePath(country)), kind.tableName(), table);
  }

  private static void writeParquet(Path file, String recordName, Table table)
      throws IOException {
    Files.createDirectories(file.getParent());
    new ParquetTableWriter().write(table, file, recordName);
  }

  /** One unit square per key, placed diagonally from {@code origin} in steps of 10. */
  private static void writeGeometries(Path file, String[] keys, double origin)
      throws IOException {
    Files.createDirectories(file.getParent());
    FlatGeobufTestWriter writer = new FlatGeobufTestWriter(Arrays.asList("GEO_ID"))
        .headerGeometryType(FlatGeobufTestWriter.TYPE_POLYGON)
        .nodeSize(2);
    for (int i = 0; i < keys.length; i++) {
      writer.add(square(origin + 10 * i, origin + 10 * i), keys[i]);
    }
    writer.write(file);
  }
}
