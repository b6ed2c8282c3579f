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

import org.apache.calcite.adapter.popgetter.ResourceFetchException;
import org.apache.calcite.adapter.popgetter.parquet.ParquetTableReader;
import org.apache.calcite.adapter.popgetter.parquet.ParquetTableWriter;
import org.apache.calcite.adapter.popgetter.storage.LocalFileStorageProvider;
import org.apache.calcite.adapter.popgetter.table.Table;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * On-disk snapshot of a {@link Metadata}: the five relations as parquet files
 * under one directory, named as they are published.
 *
 * <p>Writes go to a sibling temporary directory that is moved into place
 * once complete. A failed write leaves neither directory behind.
 */
public final class MetadataCache {
  private static final Logger LOGGER = LoggerFactory.getLogger(MetadataCache.class);

  private MetadataCache() {
  }

  /** Whether all five relation files are present under {@code directory}. */
  public static boolean isPresent(Path directory) {
    for (MetadataTable kind : MetadataTable.values()) {
      if (!Files.isRegularFile(directory.resolve(kind.fileName()))) {
        return false;
      }
    }
    return true;
  }

  /**
   * Reads a snapshot.
   *
   * @throws ResourceFetchException if any file is missing or unreadable
   */
  public static Metadata read(Path directory) {
    ParquetTableReader reader = new ParquetTableReader(new LocalFileStorageProvider());
    Map<MetadataTable, Table> tables = new EnumMap<>(MetadataTable.class);
    for (MetadataTable kind : MetadataTable.values()) {
      Path file = directory.resolve(kind.fileName());
      if (!Files.isRegularFile(file)) {
        throw new ResourceFetchException("Cache file missing: " + file);
      }
      tables.put(kind, reader.read(file.toString()));
    }
    LOGGER.info("Read metadata cache from {}", directory);
    return new Metadata(tables);
  }

  /**
   * Writes a snapshot, replacing any previous one.
   *
   * @throws ResourceFetchException if the snapshot cannot be written; by then
   *     any partial output has been removed
   */
  public static void write(Metadata metadata, Path directory) {
    Path absolute = directory.toAbsolutePath();
    Path staging = absolute.resolveSibling(absolute.getFileName() + ".tmp-" + UUID.randomUUID());
    ParquetTableWriter writer = new ParquetTableWriter();
    try {
      Files.createDirectories(staging);
      for (MetadataTable kind : MetadataTable.values()) {
        writer.write(metadata.get(kind), staging.resolve(kind.fileName()), kind.tableName());
      }
      if (Files.exists(absolute)) {
        deleteRecursively(absolute);
      }
      try {
        Files.move(staging, absolute, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(staging, absolute);
      }
      LOGGER.info("Wrote metadata cache to {}", absolute);
    } catch (IOException | RuntimeException e) {
      cleanUp(staging);
      cleanUp(absolute);
      throw new ResourceFetchException("Failed to write metadata cache " + absolute + ": "
          + e.getMessage(), e);
    }
  }

  private static void cleanUp(Path path) {
    try {
      deleteRecursively(path);
    } catch (IOException e) {
      LOGGER.warn("Could not remove partial cache {}: {}", path, e.getMessage());
    }
  }

  static void deleteRecursively(Path path) throws IOException {
    if (!Files.exists(path)) {
      return;
    }
    try (Stream<Path> walk = Files.walk(path)) {
      Path[] paths = walk.sorted(Comparator.reverseOrder()).toArray(Path[]::new);
      for (Path p : paths) {
        Files.delete(p);
      }
    }
  }
}
