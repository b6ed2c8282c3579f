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

import org.apache.calcite.adapter.popgetter.storage.LocalOutputFile;
import org.apache.calcite.adapter.popgetter.table.Column;
import org.apache.calcite.adapter.popgetter.table.Table;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes {@link Table}s as Snappy-compressed parquet files on the local
 * filesystem.
 */
public class ParquetTableWriter {
  private static final Logger LOGGER = LoggerFactory.getLogger(ParquetTableWriter.class);

  private final CompressionCodecName codec;

  public ParquetTableWriter() {
    this(CompressionCodecName.SNAPPY);
  }

  public ParquetTableWriter(CompressionCodecName codec) {
    this.codec = codec;
  }

  /**
   * Writes a table to {@code path}, replacing any existing file.
   *
   * @param table Rows to write
   * @param path Destination file
   * @param recordName Avro record name stored in the file schema
   * @throws IOException If the file cannot be written
   */
  public void write(Table table, Path path, String recordName) throws IOException {
    List<Column> columns = table.columns();
    Schema schema = AvroTableSchemas.toAvro(recordName, columns);
    Configuration conf = new Configuration();
    conf.setBoolean("parquet.avro.write-old-list-structure", false);

    LOGGER.debug("Writing {} rows to {}", table.rowCount(), path);
    try (ParquetWriter<GenericRecord> writer = AvroParquetWriter
        .<GenericRecord>builder(new LocalOutputFile(path))
        .withSchema(schema)
        .withConf(conf)
        .withCompressionCodec(codec)
        .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
        .build()) {
      for (int r = 0; r < table.rowCount(); r++) {
        GenericRecord record = new GenericData.Record(schema);
        for (int c = 0; c < columns.size(); c++) {
          record.put(c, AvroTableSchemas.toAvroValue(columns.get(c).type(), table.get(r, c)));
        }
        writer.write(record);
      }
    }
  }
}
