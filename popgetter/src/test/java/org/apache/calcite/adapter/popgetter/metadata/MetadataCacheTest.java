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
import org.apache.calcite.adapter.popgetter.storage.LocalFileStorageProvider;
import org.apache.calcite.adapter.popgetter.table.Column;
import org.apache.calcite.adapter.popgetter.table.DataType;
import org.apache.calcite.adapter.popgetter.table.Table;

import com.google.common.util.concurrent.MoreExecutors;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link MetadataCache}.
 */
@Tag("unit")
public class MetadataCacheTest {
  @TempDir
  Path tempDir;

  private Metadata load() throws Exception {
    ReleaseFixture release = ReleaseFixture.create(tempDir.resolve("release"));
    return new MetadataLoader(new LocalFileStorageProvider(), release.basePath(),
        MoreExecutors.directExecutor()).loadAll();
  }

  @Test void testRoundTrip() throws Exception {
    Metadata metadata = load();
    Path cache = tempDir.resolve("cache");
    assertFalse(MetadataCache.isPresent(cache));
    MetadataCache.write(metadata, cache);
    assertTrue(MetadataCache.isPresent(cache));
    for (MetadataTable kind : MetadataTable.values()) {
      assertTrue(Files.isRegularFile(cache.resolve(kind.fileName())), kind.toString());
    }
    assertEquals(metadata, MetadataCache.read(cache));
  }

  @Test void testOverwriteReplacesSnapshot() throws Exception {
    Metadata metadata = load();
    Path cache = tempDir.resolve("cache");
    Files.createDirectories(cache);
    Files.write(cache.resolve("stale.txt"), new byte[] {1});
    MetadataCache.write(metadata, cache);
    assertFalse(Files.exists(cache.resolve("stale.txt")));
    assertEquals(metadata, MetadataCache.read(cache));
  }

  @Test void testFailedWriteLeavesNothingBehind() throws Exception {
    Metadata metadata = load();
    Map<MetadataTable, Table> tables = new EnumMap<>(MetadataTable.class);
    for (MetadataTable kind : MetadataTable.values()) {
      tables.put(kind, metadata.get(kind));
    }
    // A DATE column holding text cannot be encoded
    tables.put(MetadataTable.GEOMETRY,
        Table.builder(Column.of(CatalogColumns.GEOMETRY_VALIDITY_PERIOD_START, DataType.DATE))
            .addRow("not a date")
            .build());
    Path cache = tempDir.resolve("cache");
    assertThrows(ResourceFetchException.class,
        () -> MetadataCache.write(new Metadata(tables), cache));
    assertFalse(Files.exists(cache));
    try (Stream<Path> siblings = Files.list(tempDir)) {
      assertEquals(0, siblings.filter(p -> p.getFileName().toString().startsWith("cache"))
          .count());
    }
  }

  @Test void testReadOfIncompleteCache() throws Exception {
    Path cache = tempDir.resolve("partial");
    Files.createDirectories(cache);
    assertFalse(MetadataCache.isPresent(cache));
    assertThrows(ResourceFetchException.class, () -> MetadataCache.read(cache));
  }
}
