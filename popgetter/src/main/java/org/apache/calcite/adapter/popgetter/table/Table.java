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

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, row-oriented, in-memory relation.
 *
 * <p>Every operation returns a new table and never blocks, so tables can be
 * shared freely between threads and transformed from any context. Row values
 * use the canonical Java class of their column's {@link DataType}.
 */
public final class Table {
  /** Suffix appended to right-hand column names that clash in a join. */
  public static final String JOIN_SUFFIX = "_right";

  private final ImmutableList<Column> columns;
  private final List<Object[]> rows;
  private final Map<String, Integer> positions;

  private Table(List<Column> columns, List<Object[]> rows) {
    this.columns = ImmutableList.copyOf(columns);
    this.rows = Collections.unmodifiableList(rows);
    Map<String, Integer> map = new LinkedHashMap<>();
    for (int i = 0; i < columns.size(); i++) {
      if (map.put(columns.get(i).name(), i) != null) {
        throw new IllegalArgumentException("Duplicate column name: " + columns.get(i).name());
      }
    }
    this.positions = Collections.unmodifiableMap(map);
  }

  public static Builder builder(List<Column> columns) {
    return new Builder(columns);
  }

  public static Builder builder(Column... columns) {
    return new Builder(Arrays.asList(columns));
  }

  public static Table empty(List<Column> columns) {
    return new Table(columns, new ArrayList<>());
  }

  public List<Column> columns() {
    return columns;
  }

  public List<String> columnNames() {
    List<String> names = new ArrayList<>(columns.size());
    for (Column column : columns) {
      names.add(column.name());
    }
    return names;
  }

  public int columnCount() {
    return columns.size();
  }

  public int rowCount() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public boolean hasColumn(String name) {
    return positions.containsKey(name);
  }

  /** Returns the position of a column, or -1 if there is no such column. */
  public int indexOf(String name) {
    Integer index = positions.get(name);
    return index == null ? -1 : index;
  }

  public Column column(String name) {
    return columns.get(requireIndex(name));
  }

  public @Nullable Object get(int row, int column) {
    return rows.get(row)[column];
  }

  public @Nullable Object get(int row, String column) {
    return rows.get(row)[requireIndex(column)];
  }

  /** Returns a read-only view of one row. */
  public List<Object> row(int row) {
    return Collections.unmodifiableList(Arrays.asList(rows.get(row)));
  }

  /** Returns every value of one column, in row order. */
  public List<Object> columnValues(String name) {
    int index = requireIndex(name);
    List<Object> values = new ArrayList<>(rows.size());
    for (Object[] row : rows) {
      values.add(row[index]);
    }
    return values;
  }

  /** Returns the distinct values of one column in first-seen order. */
  public List<Object> distinctValues(String name) {
    return new ArrayList<>(new LinkedHashSet<>(columnValues(name)));
  }

  public Table select(String... names) {
    return select(Arrays.asList(names));
  }

  /** Projects the given columns, in the given order. */
  public Table select(List<String> names) {
    int[] indexes = new int[names.size()];
    List<Column> selected = new ArrayList<>(names.size());
    for (int i = 0; i < names.size(); i++) {
      indexes[i] = requireIndex(names.get(i));
      selected.add(columns.get(indexes[i]));
    }
    List<Object[]> projected = new ArrayList<>(rows.size());
    for (Object[] row : rows) {
      Object[] values = new Object[indexes.length];
      for (int i = 0; i < indexes.length; i++) {
        values[i] = row[indexes[i]];
      }
      projected.add(values);
    }
    return new Table(selected, projected);
  }

  public Table filter(RowPredicate predicate) {
    List<Object[]> kept = new ArrayList<>();
    for (Object[] row : rows) {
      if (predicate.test(row)) {
        kept.add(row);
      }
    }
    return new Table(columns, kept);
  }

  /**
   * Inner-joins this table with {@code right} on a column both share.
   *
   * <p>Output rows follow this table's row order, and for each left row the
   * matching right rows in their own order. The right key column is dropped;
   * other right columns whose name already exists on the left get
   * {@link #JOIN_SUFFIX}. Null keys never match. Integral numeric keys compare
   * by value regardless of width.
   */
  public Table innerJoin(Table right, String key) {
    return innerJoin(right, key, key);
  }

  /**
   * Inner-joins on {@code leftKey = rightKey}; otherwise as
   * {@link #innerJoin(Table, String)}.
   */
  public Table innerJoin(Table right, String leftKeyName, String rightKeyName) {
    int leftKey = requireIndex(leftKeyName);
    int rightKey = right.requireIndex(rightKeyName);

    ListMultimap<Object, Integer> index = ArrayListMultimap.create();
    for (int i = 0; i < right.rows.size(); i++) {
      Object value = normalizeKey(right.rows.get(i)[rightKey]);
      if (value != null) {
        index.put(value, i);
      }
    }

    List<Column> joined = new ArrayList<>(columns);
    Set<String> names = new LinkedHashSet<>(columnNames());
    List<Integer> rightIndexes = new ArrayList<>();
    for (int i = 0; i < right.columns.size(); i++) {
      if (i == rightKey) {
        continue;
      }
      Column column = right.columns.get(i);
      String name = column.name();
      while (names.contains(name)) {
        name = name + JOIN_SUFFIX;
      }
      names.add(name);
      joined.add(column.withName(name));
      rightIndexes.add(i);
    }

    List<Object[]> out = new ArrayList<>();
    for (Object[] leftRow : rows) {
      Object value = normalizeKey(leftRow[leftKey]);
      if (value == null) {
        continue;
      }
      for (int r : index.get(value)) {
        Object[] rightRow = right.rows.get(r);
        Object[] values = Arrays.copyOf(leftRow, joined.size());
        int position = leftRow.length;
        for (int i : rightIndexes) {
          values[position++] = rightRow[i];
        }
        out.add(values);
      }
    }
    return new Table(joined, out);
  }

  /**
   * Replaces a list-valued column with one row per element. A null or empty
   * list yields a single row holding null.
   */
  public Table explode(String name) {
    int index = requireIndex(name);
    Column column = columns.get(index);
    if (column.type() != DataType.STRING_LIST && column.type() != DataType.NULL) {
      throw new IllegalArgumentException("Column " + name + " is not a list column: " + column.type());
    }
    List<Column> exploded = new ArrayList<>(columns);
    exploded.set(index, column.withType(DataType.STRING));
    List<Object[]> out = new ArrayList<>();
    for (Object[] row : rows) {
      List<?> values = (List<?>) row[index];
      if (values == null || values.isEmpty()) {
        Object[] copy = row.clone();
        copy[index] = null;
        out.add(copy);
        continue;
      }
      for (Object value : values) {
        Object[] copy = row.clone();
        copy[index] = value == null ? null : value.toString();
        out.add(copy);
      }
    }
    return new Table(exploded, out);
  }

  /** Returns a table with the named column moved to the first position. */
  public Table moveColumnFirst(String name) {
    List<String> order = new ArrayList<>();
    order.add(column(name).name());
    for (Column column : columns) {
      if (!column.name().equals(name)) {
        order.add(column.name());
      }
    }
    return select(order);
  }

  public Table rename(String from, String to) {
    int index = requireIndex(from);
    List<Column> renamed = new ArrayList<>(columns);
    renamed.set(index, columns.get(index).withName(to));
    return new Table(renamed, rows);
  }

  /**
   * Vertically concatenates tables, matching columns by name.
   *
   * <p>The output has every column that appears in any input, in first-seen
   * order. Types that disagree are widened with {@link DataType#widen}, and a
   * column missing from an input is null-filled for that input's rows.
   */
  public static Table unionByName(List<Table> tables) {
    Map<String, DataType> types = new LinkedHashMap<>();
    for (Table table : tables) {
      for (Column column : table.columns) {
        DataType existing = types.get(column.name());
        types.put(column.name(),
            existing == null ? column.type() : DataType.widen(existing, column.type()));
      }
    }
    List<Column> unioned = new ArrayList<>();
    for (Map.Entry<String, DataType> entry : types.entrySet()) {
      unioned.add(Column.of(entry.getKey(), entry.getValue()));
    }
    List<Object[]> out = new ArrayList<>();
    for (Table table : tables) {
      int[] sources = new int[unioned.size()];
      for (int i = 0; i < sources.length; i++) {
        sources[i] = table.indexOf(unioned.get(i).name());
      }
      for (Object[] row : table.rows) {
        Object[] values = new Object[sources.length];
        for (int i = 0; i < sources.length; i++) {
          values[i] = sources[i] < 0 ? null : unioned.get(i).type().coerce(row[sources[i]]);
        }
        out.add(values);
      }
    }
    return new Table(unioned, out);
  }

  private int requireIndex(String name) {
    Integer index = positions.get(name);
    if (index == null) {
      throw new IllegalArgumentException("No column '" + name + "' in " + columnNames());
    }
    return index;
  }

  static @Nullable Object normalizeKey(@Nullable Object value) {
    if (value instanceof Integer || value instanceof Long
        || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    return value;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Table)) {
      return false;
    }
    Table that = (Table) o;
    if (!columns.equals(that.columns) || rows.size() != that.rows.size()) {
      return false;
    }
    for (int i = 0; i < rows.size(); i++) {
      if (!Arrays.equals(rows.get(i), that.rows.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override public int hashCode() {
    int hash = columns.hashCode();
    for (Object[] row : rows) {
      hash = 31 * hash + Arrays.hashCode(row);
    }
    return hash;
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder("Table{columns=").append(columns)
        .append(", rows=").append(rows.size());
    int shown = Math.min(5, rows.size());
    for (int i = 0; i < shown; i++) {
      sb.append("\n  ").append(Arrays.toString(rows.get(i)));
    }
    if (rows.size() > shown) {
      sb.append("\n  ...");
    }
    return sb.append('}').toString();
  }

  /** Accumulates rows for a new {@link Table}. */
  public static final class Builder {
    private final List<Column> columns;
    private final List<Object[]> rows = new ArrayList<>();

    private Builder(List<Column> columns) {
      this.columns = new ArrayList<>(columns);
    }

    public Builder addRow(@Nullable Object... values) {
      if (values.length != columns.size()) {
        throw new IllegalArgumentException("Expected " + columns.size()
            + " values but got " + values.length);
      }
      Object[] coerced = new Object[values.length];
      for (int i = 0; i < values.length; i++) {
        coerced[i] = columns.get(i).type().coerce(values[i]);
      }
      rows.add(coerced);
      return this;
    }

    public Builder addRow(List<?> values) {
      return addRow(values.toArray());
    }

    public int rowCount() {
      return rows.size();
    }

    public Table build() {
      return new Table(columns, new ArrayList<>(rows));
    }
  }
}
