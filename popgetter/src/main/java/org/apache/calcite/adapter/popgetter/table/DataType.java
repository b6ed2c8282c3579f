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
package org.apache.calcite.adapter.popgetter.table;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Logical column types of an in-memory {@link Table}.
 *
 * <p>Each type has one canonical Java representation; {@link #coerce(Object)}
 * converts a value of a narrower type into it.
 */
public enum DataType {
  /** Column whose every value is null; widens to any other type. */
  NULL(Void.class),
  BOOLEAN(Boolean.class),
  INTEGER(Integer.class),
  LONG(Long.class),
  FLOAT(Float.class),
  DOUBLE(Double.class),
  STRING(String.class),
  DATE(LocalDate.class),
  TIMESTAMP(Instant.class),
  STRING_LIST(List.class);

  private final Class<?> javaClass;

  DataType(Class<?> javaClass) {
    this.javaClass = javaClass;
  }

  public Class<?> javaClass() {
    return javaClass;
  }

  public boolean isNumeric() {
    return this == INTEGER || this == LONG || this == FLOAT || this == DOUBLE;
  }

  /**
   * Returns the narrowest type both {@code a} and {@code b} can be widened to.
   *
   * <p>Used when the same relation arrives from several sources whose column
   * types disagree. A list column stays a list, scalars from other sources
   * becoming lists of their comma-separated parts. Anything else without a
   * numeric or temporal common supertype falls back to {@link #STRING}.
   */
  public static DataType widen(DataType a, DataType b) {
    if (a == b) {
      return a;
    }
    if (a == NULL) {
      return b;
    }
    if (b == NULL) {
      return a;
    }
    if (a == STRING_LIST || b == STRING_LIST) {
      return STRING_LIST;
    }
    if (a.isNumeric() && b.isNumeric()) {
      if ((a == INTEGER && b == LONG) || (a == LONG && b == INTEGER)) {
        return LONG;
      }
      return DOUBLE;
    }
    if ((a == DATE && b == TIMESTAMP) || (a == TIMESTAMP && b == DATE)) {
      return TIMESTAMP;
    }
    return STRING;
  }

  /**
   * Converts a value of this type or of a narrower type into this type's
   * canonical representation. Nulls stay null.
   */
  public @Nullable Object coerce(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    switch (this) {
      case NULL:
        return null;
      case BOOLEAN:
        return value instanceof Boolean ? value : Boolean.valueOf(value.toString());
      case INTEGER:
        return value instanceof Integer ? value : ((Number) value).intValue();
      case LONG:
        return value instanceof Long ? value : ((Number) value).longValue();
      case FLOAT:
        return value instanceof Float ? value : ((Number) value).floatValue();
      case DOUBLE:
        return value instanceof Double ? value : ((Number) value).doubleValue();
      case DATE:
        return value;
      case TIMESTAMP:
        if (value instanceof LocalDate) {
          return ((LocalDate) value).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        return value;
      case STRING:
        return render(value);
      case STRING_LIST:
        return value instanceof List ? value : split(value.toString());
      default:
        throw new AssertionError(this);
    }
  }

  private static List<String> split(String value) {
    if (value.isEmpty()) {
      return Collections.emptyList();
    }
    return Arrays.asList(value.split(",", -1));
  }

  private static String render(Object value) {
    if (value instanceof List) {
      return ((List<?>) value).stream()
          .map(String::valueOf)
          .collect(Collectors.joining(","));
    }
    return value.toString();
  }

  /** Infers the type of a single non-null value; null maps to {@link #NULL}. */
  public static DataType of(@Nullable Object value) {
    if (value == null) {
      return NULL;
    }
    for (DataType type : values()) {
      if (type != NULL && type.javaClass.isInstance(value)) {
        return type;
      }
    }
    return STRING;
  }
}
