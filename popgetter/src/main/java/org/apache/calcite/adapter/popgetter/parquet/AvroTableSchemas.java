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

import org.apache.calcite.adapter.popgetter.table.Column;
import org.apache.calcite.adapter.popgetter.table.DataType;

import org.apache.avro.LogicalType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.util.Utf8;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Mapping between table {@link DataType}s and Avro schemas, used on both the
 * read and write side of parquet files.
 *
 * <p>Every field is written nullable. Dates are Avro {@code date} ints and
 * timestamps are {@code timestamp-micros} longs.
 */
final class AvroTableSchemas {
  private AvroTableSchemas() {
  }

  static Schema toAvro(String recordName, List<Column> columns) {
    SchemaBuilder.FieldAssembler<Schema> fields = SchemaBuilder.record(recordName)
        .namespace("org.apache.calcite.adapter.popgetter").fields();
    for (Column column : columns) {
      Schema nullable = Schema.createUnion(Schema.create(Schema.Type.NULL), toAvro(column.type()));
      fields = fields.name(column.name()).type(nullable).withDefault(null);
    }
    return fields.endRecord();
  }

  private static Schema toAvro(DataType type) {
    switch (type) {
      case BOOLEAN:
        return Schema.create(Schema.Type.BOOLEAN);
      case INTEGER:
        return Schema.create(Schema.Type.INT);
      case LONG:
        return Schema.create(Schema.Type.LONG);
      case FLOAT:
        return Schema.create(Schema.Type.FLOAT);
      case DOUBLE:
        return Schema.create(Schema.Type.DOUBLE);
      case DATE:
        return LogicalTypes.date().addToSchema(Schema.create(Schema.Type.INT));
      case TIMESTAMP:
        return LogicalTypes.timestampMicros().addToSchema(Schema.create(Schema.Type.LONG));
      case STRING_LIST:
        return Schema.createArray(Schema.create(Schema.Type.STRING));
      case STRING:
      case NULL:
      default:
        return Schema.create(Schema.Type.STRING);
    }
  }

  /** Converts a table value into what {@code AvroWriteSupport} expects. */
  static @Nullable Object toAvroValue(DataType type, @Nullable Object value) {
    if (value == null) {
      return null;
    }
    switch (type) {
      case DATE:
        return (int) ((LocalDate) value).toEpochDay();
      case TIMESTAMP:
        Instant instant = (Instant) value;
        return TimeUnit.SECONDS.toMicros(instant.getEpochSecond())
            + TimeUnit.NANOSECONDS.toMicros(instant.getNano());
      case NULL:
        return null;
      default:
        return value;
    }
  }

  /** Derives the table type of an Avro field schema read from a file. */
  static DataType fromAvro(Schema schema) {
    Schema s = unwrapNullable(schema);
    LogicalType logicalType = s.getLogicalType();
    switch (s.getType()) {
      case BOOLEAN:
        return DataType.BOOLEAN;
      case INT:
        if (logicalType instanceof LogicalTypes.Date) {
          return DataType.DATE;
        }
        return DataType.INTEGER;
      case LONG:
        if (isTimestamp(logicalType)) {
          return DataType.TIMESTAMP;
        }
        return DataType.LONG;
      case FLOAT:
        return DataType.FLOAT;
      case DOUBLE:
        return DataType.DOUBLE;
      case ARRAY:
        return DataType.STRING_LIST;
      case NULL:
        return DataType.NULL;
      default:
        return DataType.STRING;
    }
  }

  /** Converts a value produced by the Avro reader into the table representation. */
  static @Nullable Object fromAvroValue(Schema schema, @Nullable Object value) {
    if (value == null) {
      return null;
    }
    Schema s = unwrapNullable(schema);
    DataType type = fromAvro(s);
    switch (type) {
      case DATE:
        if (value instanceof LocalDate) {
          return value;
        }
        return LocalDate.ofEpochDay(((Number) value).longValue());
      case TIMESTAMP:
        if (value instanceof Instant) {
          return value;
        }
        return toInstant(s.getLogicalType(), ((Number) value).longValue());
      case STRING_LIST:
        return toStringList(value);
      case STRING:
        return toText(value);
      default:
        return value;
    }
  }

  private static List<String> toStringList(Object value) {
    List<String> out = new ArrayList<>();
    for (Object element : (Collection<?>) value) {
      Object item = element;
      // Lists written with element wrapper records come back as single-field records
      if (item instanceof GenericRecord && ((GenericRecord) item).getSchema().getFields().size() == 1) {
        item = ((GenericRecord) item).get(0);
      }
      out.add(item == null ? null : toText(item));
    }
    return out;
  }

  private static String toText(Object value) {
    if (value instanceof Utf8 || value instanceof CharSequence) {
      return value.toString();
    }
    if (value instanceof ByteBuffer) {
      ByteBuffer buffer = ((ByteBuffer) value).duplicate();
      byte[] bytes = new byte[buffer.remaining()];
      buffer.get(bytes);
      return new String(bytes, StandardCharsets.UTF_8);
    }
    return value.toString();
  }

  private static boolean isTimestamp(@Nullable LogicalType logicalType) {
    return logicalType instanceof LogicalTypes.TimestampMillis
        || logicalType instanceof LogicalTypes.TimestampMicros
        || logicalType instanceof LogicalTypes.LocalTimestampMillis
        || logicalType instanceof LogicalTypes.LocalTimestampMicros;
  }

  private static Instant toInstant(@Nullable LogicalType logicalType, long value) {
    if (logicalType instanceof LogicalTypes.TimestampMillis
        || logicalType instanceof LogicalTypes.LocalTimestampMillis) {
      return Instant.ofEpochMilli(value);
    }
    return Instant.ofEpochSecond(Math.floorDiv(value, 1_000_000L),
        TimeUnit.MICROSECONDS.toNanos(Math.floorMod(value, 1_000_000L)));
  }

  static Schema unwrapNullable(Schema schema) {
    if (schema.getType() != Schema.Type.UNION) {
      return schema;
    }
    for (Schema branch : schema.getTypes()) {
      if (branch.getType() != Schema.Type.NULL) {
        return branch;
      }
    }
    return schema.getTypes().get(0);
  }
}
