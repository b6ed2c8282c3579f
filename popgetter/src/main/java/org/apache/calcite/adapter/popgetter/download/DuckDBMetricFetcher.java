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
package org.apache.calcite.adapter.popgetter.download;

import org.apache.calcite.adapter.popgetter.ResourceFetchException;
import org.apache.calcite.adapter.popgetter.storage.StorageProviderFactory;
import org.apache.calcite.adapter.popgetter.table.Column;
import org.apache.calcite.adapter.popgetter.table.DataType;
import org.apache.calcite.adapter.popgetter.table.Table;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Array;
import java.sql.Connection;
import java.sql.Date;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * {@link MetricFetcher} that runs the query of
 * {@link MetricSqlBuilder#toSqlText} in an in-memory DuckDB database.
 *
 * <p>Remote files are read through DuckDB's {@code httpfs} extension, which
 * is installed on first use.
 */
public class DuckDBMetricFetcher implements MetricFetcher {
  private static final Logger LOGGER = LoggerFactory.getLogger(DuckDBMetricFetcher.class);

  private final String keyColumn;
  private final Executor executor;

  public DuckDBMetricFetcher(String keyColumn, Executor executor) {
    this.keyColumn = keyColumn;
    this.executor = executor;
  }

  @Override public CompletableFuture<Table> fetchMetrics(final List<MetricRequest> requests,
      final @Nullable Set<String> keys) {
    return CompletableFuture.supplyAsync(() -> query(requests, keys), executor);
  }

  private Table query(List<MetricRequest> requests, @Nullable Set<String> keys) {
    String sql = MetricSqlBuilder.toSqlText(requests, keys, keyColumn);
    LOGGER.debug("DuckDB metric query: {}", sql);
    try (Connection conn = DriverManager.getConnection("jdbc:duckdb:");
         Statement stmt = conn.createStatement()) {
      if (anyRemote(requests)) {
        stmt.execute("INSTALL httpfs");
        stmt.execute("LOAD httpfs");
      }
      try (ResultSet rs = stmt.executeQuery(sql)) {
        Table table = toTable(rs).moveColumnFirst(keyColumn);
        LOGGER.debug("DuckDB returned {} rows", table.rowCount());
        return table;
      }
    } catch (SQLException e) {
      throw new ResourceFetchException("Failed to fetch metrics via DuckDB: " + e.getMessage(), e);
    }
  }

  private static boolean anyRemote(List<MetricRequest> requests) {
    for (MetricRequest request : requests) {
      if (StorageProviderFactory.isRemote(request.metricFile())) {
        return true;
      }
    }
    return false;
  }

  private static Table toTable(ResultSet rs) throws SQLException {
    ResultSetMetaData meta = rs.getMetaData();
    int count = meta.getColumnCount();
    List<Column> columns = new ArrayList<>(count);
    for (int i = 1; i <= count; i++) {
      columns.add(Column.of(meta.getColumnLabel(i), typeOf(meta.getColumnType(i))));
    }
    Table.Builder builder = Table.builder(columns);
    Object[] values = new Object[count];
    while (rs.next()) {
      for (int i = 1; i <= count; i++) {
        values[i - 1] = valueOf(rs.getObject(i), columns.get(i - 1).type());
      }
      builder.addRow(values.clone());
    }
    return builder.build();
  }

  private static DataType typeOf(int sqlType) {
    switch (sqlType) {
      case Types.BOOLEAN:
      case Types.BIT:
        return DataType.BOOLEAN;
      case Types.TINYINT:
      case Types.SMALLINT:
      case Types.INTEGER:
        return DataType.INTEGER;
      case Types.BIGINT:
        return DataType.LONG;
      case Types.REAL:
      case Types.FLOAT:
        return DataType.FLOAT;
      case Types.DOUBLE:
      case Types.DECIMAL:
      case Types.NUMERIC:
        return DataType.DOUBLE;
      case Types.DATE:
        return DataType.DATE;
      case Types.TIMESTAMP:
      case Types.TIMESTAMP_WITH_TIMEZONE:
        return DataType.TIMESTAMP;
      default:
        return DataType.STRING;
    }
  }

  private static @Nullable Object valueOf(@Nullable Object value, DataType type)
      throws SQLException {
    if (value == null) {
      return null;
    }
    switch (type) {
      case DATE:
        if (value instanceof Date) {
          return ((Date) value).toLocalDate();
        }
        return value;
      case TIMESTAMP:
        if (value instanceof Timestamp) {
          return ((Timestamp) value).toInstant();
        }
        if (value instanceof OffsetDateTime) {
          return ((OffsetDateTime) value).toInstant();
        }
        if (value instanceof LocalDateTime) {
          return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
        }
        return value;
      case STRING:
        if (value instanceof Array) {
          return Arrays.toString((Object[]) ((Array) value).getArray());
        }
        return value.toString();
      default:
        return value;
    }
  }
}
