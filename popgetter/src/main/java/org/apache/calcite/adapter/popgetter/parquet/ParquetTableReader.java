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
package org.apache.calcite.adapter.popgetter.parquet;

import org.apache.calcite.adapter.popgetter.ResourceFetchException;
import org.apache.calcite.adapter.popgetter.storage.StorageProvider;
import org.apache.calcite.adapter.popgetter.storage.StorageProviderInputFile;
import org.apache.calcite.adapter.popgetter.table.Column;
import org.apache.calcite.adapter.popgetter.table.Table;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroReadSupport;
import org.apache.parquet.avro.AvroSchemaConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.api.InitContext;
import org.apache.parquet.hadoop.api.ReadSupport;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.Type;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads parquet files from a {@link StorageProvider} into {@link Table}s.
 *
 * <p>Only the requested columns are decoded. Over HTTP the footer and the
 * projected column chunks are fetched with range requests.
 */
public class ParquetTableReader {
  private static final Logger LOGGER = LoggerFactory.getLogger(ParquetTableReader.class);

  private final StorageProvider storageProvider;

  public ParquetTableReader(StorageProvider storageProvider) {
    this.storageProvider = storageProvider;
  }

  /** Reads every column of a file. */
  public Table read(String path) {
    return read(path, null);
  }

  /**
   * Reads the named columns of a file, in the given order, or all columns
   * when {@code columns} is null.
   *
   * @throws ResourceFetchException if the file cannot be read or lacks a column
   */
  public Table read(String path, @Nullable List<String> columns) {
    return read(path, columns, null, null);
  }

  /**
   * Fetches {@code columns} plus {@code keyColumn} from one file, key first,
   * keeping only rows whose key is in {@code keys} when a key set is given.
   */
  public Table fetchColumns(String path, List<String> columns, String keyColumn,
      @Nullable Set<String> keys) {
    Set<String> wanted = new LinkedHashSet<>();
    wanted.add(keyColumn);
    wanted.addAll(columns);
    return read(path, new ArrayList<>(wanted), keyColumn, keys);
  }

  private Table read(String path, @Nullable List<String> columns, @Nullable String keyColumn,
      @Nullable Set<String> keys) {
    LOGGER.debug("Reading parquet {} columns={} keys={}", path, columns,
        keys == null ? "all" : keys.size());
    InputFile inputFile = new StorageProviderInputFile(storageProvider, path);
    try {
      MessageType fileSchema;
      try (ParquetFileReader footerReader = ParquetFileReader.open(inputFile)) {
        fileSchema = footerReader.getFooter().getFileMetaData().getSchema();
      }
      MessageType projection = project(path, fileSchema, columns);

      Configuration conf = new Configuration();
      conf.setBoolean("parquet.avro.add-list-element-records", false);
      conf.setBoolean("parquet.avro.readInt96AsFixed", true);
      Schema avroSchema = new AvroSchemaConverter(conf).convert(projection);
      // The projection goes to parquet as is; converting it back from Avro
      // would rewrite the file's list layout and lose list values.
      AvroReadSupport.setAvroReadSchema(conf, avroSchema);

      List<Schema.Field> fields = avroSchema.getFields();
      List<Column> tableColumns = new ArrayList<>(fields.size());
      for (Schema.Field field : fields) {
        tableColumns.add(Column.of(field.name(), AvroTableSchemas.fromAvro(field.schema())));
      }
      int keyIndex = keyColumn == null ? -1 : projection.getFieldIndex(keyColumn);

      Table.Builder builder = Table.builder(tableColumns);
      try (ParquetReader<GenericRecord> reader = new ProjectedReaderBuilder(inputFile, projection)
          .withConf(conf)
          .build()) {
        GenericRecord record;
        Object[] values = new Object[fields.size()];
        while ((record = reader.read()) != null) {
          for (int i = 0; i < fields.size(); i++) {
            values[i] = AvroTableSchemas.fromAvroValue(fields.get(i).schema(),
                record.get(fields.get(i).name()));
          }
          if (keys != null && keyIndex >= 0
              && (values[keyIndex] == null || !keys.contains(values[keyIndex].toString()))) {
            continue;
          }
          builder.addRow(values.clone());
        }
      }
      Table table = builder.build();
      LOGGER.debug("Read {} rows from {}", table.rowCount(), path);
      return table;
    } catch (IOException | RuntimeException e) {
      if (e instanceof ResourceFetchException) {
        throw (ResourceFetchException) e;
      }
      throw new ResourceFetchException("Failed to read parquet file " + path + ": " + e.getMessage(), e);
    }
  }

  /** Reads Avro records with a parquet-level column projection. */
  private static class ProjectedReaderBuilder extends ParquetReader.Builder<GenericRecord> {
    private final MessageType projection;

    ProjectedReaderBuilder(InputFile file, MessageType projection) {
      super(file);
      this.projection = projection;
    }

    @Override protected ReadSupport<GenericRecord> getReadSupport() {
      return new AvroReadSupport<GenericRecord>() {
        @Override public ReadContext init(InitContext context) {
          ReadContext avroContext = super.init(context);
          return new ReadContext(projection, avroContext.getReadSupportMetadata());
        }
      };
    }
  }

  private static MessageType project(String path, MessageType fileSchema,
      @Nullable List<String> columns) {
    if (columns == null) {
      return fileSchema;
    }
    List<Type> fields = new ArrayList<>(columns.size());
    for (String column : columns) {
      if (!fileSchema.containsField(column)) {
        throw new ResourceFetchException("Column '" + column + "' not found in " + path);
      }
      fields.add(fileSchema.getType(column));
    }
    return new MessageType(fileSchema.getName(), fields);
  }
}
