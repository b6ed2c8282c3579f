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

import org.apache.calcite.adapter.popgetter.table.Table;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders the query that fetches a set of metric columns, in the DuckDB
 * dialect, without running it.
 *
 * <p>One file gives a single {@code SELECT ... FROM read_parquet(...)}.
 * Several files give one sub-select per file, aliased {@code q0, q1, ...}
 * in first-appearance order and joined {@code USING} the key column; the
 * outer select lists the key once, then every column qualified by the
 * sub-select that owns it. A column name already taken by an earlier file is
 * aliased with {@link Table#JOIN_SUFFIX}, as {@link Table#innerJoin} names it.
 *
 * <p>An empty key collection selects no rows.
 */
public final class MetricSqlBuilder {
  public static final String DEFAULT_KEY_COLUMN = "GEO_ID";

  private MetricSqlBuilder() {
  }

  public static String toSqlText(List<MetricRequest> requests, @Nullable Collection<String> keys) {
    return toSqlText(requests, keys, DEFAULT_KEY_COLUMN);
  }

  /**
   * Returns the query text.
   *
   * @param requests Columns to fetch; must not be empty
   * @param keys Keys to keep, or null for all rows
   * @param keyColumn Column shared by every metric file
   */
  public static String toSqlText(List<MetricRequest> requests, @Nullable Collection<String> keys,
      String keyColumn) {
    if (requests.isEmpty()) {
      throw new IllegalArgumentException("No metric requests to render");
    }
    Map<String, List<String>> byFile = MetricRequest.columnsByFile(requests);
    if (byFile.size() == 1) {
      Map.Entry<String, List<String>> only = byFile.entrySet().iterator().next();
      return subSelect(only.getKey(), only.getValue(), keys, keyColumn);
    }

    List<String> outer = new ArrayList<>();
    outer.add("q0." + quoteIdentifier(keyColumn));
    Set<String> names = new HashSet<>();
    names.add(keyColumn);
    StringBuilder from = new StringBuilder();
    int i = 0;
    for (Map.Entry<String, List<String>> entry : byFile.entrySet()) {
      String alias = "q" + i;
      for (String column : entry.getValue()) {
        if (column.equals(keyColumn)) {
          continue;
        }
        String name = column;
        while (names.contains(name)) {
          name = name + Table.JOIN_SUFFIX;
        }
        names.add(name);
        String qualified = alias + "." + quoteIdentifier(column);
        outer.add(name.equals(column) ? qualified : qualified + " AS " + quoteIdentifier(name));
      }
      String sub = "(" + subSelect(entry.getKey(), entry.getValue(), keys, keyColumn) + ") "
          + alias;
      if (i == 0) {
        from.append(sub);
      } else {
        from.append(" JOIN ").append(sub).append(" USING (").append(keyColumn).append(')');
      }
      i++;
    }
    return "SELECT " + String.join(", ", outer) + " FROM " + from;
  }

  private static String subSelect(String file, List<String> columns,
      @Nullable Collection<String> keys, String keyColumn) {
    List<String> selected = new ArrayList<>(columns.size() + 1);
    selected.add(quoteIdentifier(keyColumn));
    for (String column : columns) {
      if (!column.equals(keyColumn)) {
        selected.add(quoteIdentifier(column));
      }
    }
    StringBuilder sql = new StringBuilder("SELECT ")
        .append(String.join(", ", selected))
        .append(" FROM read_parquet(")
        .append(quoteLiteral(file))
        .append(')');
    if (keys != null && keys.isEmpty()) {
      sql.append(" WHERE FALSE");
    } else if (keys != null) {
      List<String> literals = new ArrayList<>(keys.size());
      for (String key : keys) {
        literals.add(quoteLiteral(key));
      }
      sql.append(" WHERE ").append(quoteIdentifier(keyColumn)).append(" IN (")
          .append(String.join(", ", literals)).append(')');
    }
    return sql.toString();
  }

  static String quoteIdentifier(String identifier) {
    return "\"" + identifier.replace("\"", "\"\"") + "\"";
  }

  static String quoteLiteral(String value) {
    return "'" + value.replace("'", "''") + "'";
  }
}
