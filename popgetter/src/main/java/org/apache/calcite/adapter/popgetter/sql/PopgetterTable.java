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
package org.apache.calcite.adapter.popgetter.sql;

import org.apache.calcite.DataContext;
import org.apache.calcite.adapter.popgetter.table.Column;
import org.apache.calcite.adapter.popgetter.table.DataType;
import org.apache.calcite.adapter.popgetter.table.Table;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Linq4j;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.schema.ScannableTable;
import org.apache.calcite.schema.impl.AbstractTable;
import org.apache.calcite.sql.type.SqlTypeName;

import com.google.common.base.Supplier;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only SQL view of one in-memory {@link Table}. The table is obtained
 * lazily, so the expanded catalog is only built when it is first queried.
 */
public class PopgetterTable extends AbstractTable implements ScannableTable {
  private final Supplier<Table> table;

  public PopgetterTable(Supplier<Table> table) {
    this.table = table;
  }

  @Override public RelDataType getRowType(RelDataTypeFactory typeFactory) {
    RelDataTypeFactory.Builder builder = typeFactory.builder();
    for (Column column : table.get().columns()) {
      RelDataType type = sqlType(typeFactory, column.type());
      builder.add(column.name(), typeFactory.createTypeWithNullability(type, true));
    }
    return builder.build();
  }

  private static RelDataType sqlType(RelDataTypeFactory typeFactory, DataType type) {
    switch (type) {
      case BOOLEAN:
        return typeFactory.createSqlType(SqlTypeName.BOOLEAN);
      case INTEGER:
        return typeFactory.createSqlType(SqlTypeName.INTEGER);
      case LONG:
        return typeFactory.createSqlType(SqlTypeName.BIGINT);
      case FLOAT:
        return typeFactory.createSqlType(SqlTypeName.REAL);
      case DOUBLE:
        return typeFactory.createSqlType(SqlTypeName.DOUBLE);
      case DATE:
        return typeFactory.createSqlType(SqlTypeName.DATE);
      case TIMESTAMP:
        return typeFactory.createSqlType(SqlTypeName.TIMESTAMP);
      case STRING_LIST:
        return typeFactory.createArrayType(
            typeFactory.createTypeWithNullability(
                typeFactory.createSqlType(SqlTypeName.VARCHAR), true), -1);
      case NULL:
      case STRING:
      default:
        return typeFactory.createSqlType(SqlTypeName.VARCHAR);
    }
  }

  @Override public Enumerable<@Nullable Object[]> scan(DataContext root) {
    Table t = table.get();
    List<Column> columns = t.columns();
    List<@Nullable Object[]> rows = new ArrayList<>(t.rowCount());
    for (int r = 0; r < t.rowCount(); r++) {
      Object[] row = new Object[columns.size()];
      for (int c = 0; c < row.length; c++) {
        row[c] = toSql(columns.get(c).type(), t.get(r, c));
      }
      rows.add(row);
    }
    return Linq4j.asEnumerable(rows);
  }

  /** Converts a value to the representation Calcite's enumerable runtime uses. */
  static @Nullable Object toSql(DataType type, @Nullable Object value) {
    if (value == null) {
      return null;
    }
    switch (type) {
      case DATE:
        return (int) ((LocalDate) value).toEpochDay();
      case TIMESTAMP:
        return ((Instant) value).toEpochMilli();
      case NULL:
        return null;
      default:
        return value;
    }
  }
}
