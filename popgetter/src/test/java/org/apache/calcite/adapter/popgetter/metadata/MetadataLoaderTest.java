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

import org.apache.calcite.adapter.popgetter.ReleaseFixture;
import org.apache.calcite.adapter.popgetter.ResourceFetchException;
import org.apache.calcite.adapter.popgetter.storage.HttpStorageProvider;
import org.apache.calcite.adapter.popgetter.storage.LocalFileStorageProvider;
import org.apache.calcite.adapter.popgetter.storage.RangeHttpServer;
import org.apache.calcite.adapter.popgetter.table.DataType;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link MetadataLoader} and {@link CountryMetadataLoader}.
 */
@Tag("unit")
public class MetadataLoaderTest {
  @TempDir
  Path tempDir;

  private ExecutorService executor;
  private ReleaseFixture release;

  @BeforeEach
  void setUp() throws Exception {
    executor = Executors.newFixedThreadPool(4);
    release = ReleaseFixture.create(tempDir.resolve("v0.2"));
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private MetadataLoader localLoader() {
    return new MetadataLoader(new LocalFileStorageProvider(), release.basePath(), executor);
  }

  @Test void testCountriesSkipBlankLines() {
    assertEquals(Arrays.asList(ReleaseFixture.BEL, ReleaseFixture.NIR), localLoader().countries());
  }

  @Test void testLoadAllUnionsInCountryOrder() {
    Metadata metadata = localLoader().loadAll();
    assertEquals(Arrays.<Object>asList(ReleaseFixture.BEL_POP_TOTAL, ReleaseFixture.BEL_POP_FEMALE,
            ReleaseFixture.NIR_POP_TOTAL, ReleaseFixture.NIR_HOUSEHOLDS),
        metadata.metrics().columnValues(CatalogColumns.METRIC_ID));
    for (MetadataTable kind : Arrays.asList(MetadataTable.GEOMETRY,
        MetadataTable.SOURCE_DATA_RELEASE, MetadataTable.DATA_PUBLISHER, MetadataTable.COUNTRY)) {
      assertEquals(2, metadata.get(kind).rowCount(), kind.toString());
    }
    assertEquals(Arrays.<Object>asList("bel", "gb_nir"),
        metadata.countries().columnValues(CatalogColumns.COUNTRY_ID));
    assertEquals(DataType.DATE,
        metadata.geometries().column(CatalogColumns.GEOMETRY_VALIDITY_PERIOD_START).type());
    assertEquals(DataType.STRING_LIST,
        metadata.dataPublishers().column(CatalogColumns.DATA_PUBLISHER_COUNTRIES_OF_INTEREST)
            .type());
  }

  @Test void testLoadSubset() {
    Metadata metadata = localLoader().loadAll(Collections.singletonList(ReleaseFixture.NIR));
    assertEquals(2, metadata.metrics().rowCount());
    assertEquals(1, metadata.countries().rowCount());
  }

  @Test void testMissingRelationFailsWholeLoad() throws Exception {
    Files.delete(release.root().resolve(MetadataTable.GEOMETRY.relativePath(ReleaseFixture.NIR)));
    MetadataLoader loader = localLoader();
    assertThrows(ResourceFetchException.class, loader::loadAll);
  }

  @Test void testMissingCountryList() {
    MetadataLoader loader = new MetadataLoader(new LocalFileStorageProvider(),
        tempDir.resolve("nowhere").toString(), executor);
    assertThrows(ResourceFetchException.class, loader::countries);
  }

  @Test void testEmptyCountryList() throws Exception {
    Files.write(release.root().resolve(MetadataLoader.COUNTRIES_FILE),
        "\n  \n".getBytes(StandardCharsets.UTF_8));
    MetadataLoader loader = localLoader();
    assertThrows(ResourceFetchException.class, loader::countries);
    assertThrows(ResourceFetchException.class, loader::loadAll);
    assertThrows(ResourceFetchException.class,
        () -> loader.loadAll(Collections.<String>emptyList()));
  }

  @Test void testLoadOverHttp() throws Exception {
    try (RangeHttpServer server = new RangeHttpServer(tempDir, true)) {
      MetadataLoader loader =
          new MetadataLoader(new HttpStorageProvider(), server.baseUrl() + "/v0.2", executor);
      assertEquals(localLoader().loadAll(), loader.loadAll());
    }
  }
}
