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
package org.apache.calcite.adapter.popgetter.search.expr;

import org.apache.calcite.adapter.popgetter.SearchValidationException;
import org.apache.calcite.adapter.popgetter.table.RowPredicate;
import org.apache.calcite.adapter.popgetter.table.Table;

import com.google.common.collect.ImmutableList;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Boolean expression over the rows of the catalog view.
 *
 * <p>The set of node kinds is closed: {@link Match}, {@link DateCompare},
 * {@link And} and {@link Or}. An expression is bound to a concrete table with
 * {@link #bind(Table)}, which resolves column names once and returns a
 * {@link RowPredicate}.
 */
public abstract class Expr {
  private Expr() {
  }

  /**
   * Resolves this expression against a table's columns.
   *
   * @throws SearchValidationException if a referenced column does not exist
   */
  public abstract RowPredicate bind(Table table);

  public static Expr match(String column, Pattern pattern) {
    return new Match(column, pattern);
  }

  public static Expr dateCompare(String column, Comparison comparison, LocalDate date) {
    return new DateCompare(column, comparison, date);
  }

  /** AND of the given expressions; a single operand is returned as is. */
  public static Expr and(List<Expr> operands) {
    return operands.size() == 1 ? operands.get(0) : new And(operands);
  }

  public static Expr and(Expr... operands) {
    return and(ImmutableList.copyOf(operands));
  }

  /** OR of the given expressions; a single operand is returned as is. */
  public static Expr or(List<Expr> operands) {
    return operands.size() == 1 ? operands.get(0) : new Or(operands);
  }

  public static Expr or(Expr... operands) {
    return or(ImmutableList.copyOf(operands));
  }

  static int resolve(Table table, String column) {
    int index = table.indexOf(column);
    if (index < 0) {
      throw new SearchValidationException("Unknown catalog column '" + column + "'");
    }
    return index;
  }

  /** Comparison operator of a {@link DateCompare}. */
  public enum Comparison {
    LESS_OR_EQUAL("<="),
    GREATER_OR_EQUAL(">=");

    private final String symbol;

    Comparison(String symbol) {
      this.symbol = symbol;
    }

    boolean test(int compareResult) {
      return this == LESS_OR_EQUAL ? compareResult <= 0 : compareResult >= 0;
    }
  }

  /**
   * Regular-expression search in a text cell. List cells match if any element
   * matches; null cells never match.
   */
  public static final class Match extends Expr {
    private final String column;
    private final Pattern pattern;

    Match(String column, Pattern pattern) {
      this.column = Objects.requireNonNull(column, "column");
      this.pattern = Objects.requireNonNull(pattern, "pattern");
    }

    public String column() {
      return column;
    }

    public Pattern pattern() {
      return pattern;
    }

    @Override public RowPredicate bind(Table table) {
      final int index = resolve(table, column);
      return row -> matches(row[index]);
    }

    private boolean matches(Object value) {
      if (value == null) {
        return false;
      }
      if (value instanceof List) {
        for (Object element : (List<?>) value) {
          if (element != null && pattern.matcher(element.toString()).find()) {
            return true;
          }
        }
        return false;
      }
      return pattern.matcher(value.toString()).find();
    }

    @Override public String toString() {
      String flags = (pattern.flags() & Pattern.CASE_INSENSITIVE) != 0 ? "(?i)" : "";
      return column + " ~ /" + flags + pattern.pattern() + "/";
    }
  }

  /** Compares a date cell against a constant; null cells never match. */
  public static final class DateCompare extends Expr {
    private final String column;
    private final Comparison comparison;
    private final LocalDate date;

    DateCompare(String column, Comparison comparison, LocalDate date) {
      this.column = Objects.requireNonNull(column, "column");
      this.comparison = Objects.requireNonNull(comparison, "comparison");
      this.date = Objects.requireNonNull(date, "date");
    }

    public String column() {
      return column;
    }

    public Comparison comparison() {
      return comparison;
    }

    public LocalDate date() {
      return date;
    }

    @Override public RowPredicate bind(Table table) {
      final int index = resolve(table, column);
      return row -> {
        LocalDate value = toDate(row[index]);
        return value != null && comparison.test(value.compareTo(date));
      };
    }

    private static LocalDate toDate(Object value) {
      if (value == null) {
        return null;
      }
      if (value instanceof LocalDate) {
        return (LocalDate) value;
      }
      if (value instanceof Instant) {
        return ((Instant) value).atZone(ZoneOffset.UTC).toLocalDate();
      }
      String text = value.toString();
      try {
        return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
      } catch (DateTimeParseException e) {
        return null;
      }
    }

    @Override public String toString() {
      return column + " " + comparison.symbol + " " + date;
    }
  }

  /** Conjunction. */
  public static final class And extends Expr {
    private final ImmutableList<Expr> operands;

    And(List<Expr> operands) {
      this.operands = ImmutableList.copyOf(operands);
    }

    public List<Expr> operands() {
      return operands;
    }

    @Override public RowPredicate bind(Table table) {
      final List<RowPredicate> predicates = bindAll(operands, table);
      return row -> {
        for (RowPredicate predicate : predicates) {
          if (!predicate.test(row)) {
            return false;
          }
        }
        return true;
      };
    }

    @Override public String toString() {
      return operands.stream().map(Object::toString)
          .collect(Collectors.joining(" AND ", "(", ")"));
    }
  }

  /** Disjunction. */
  public static final class Or extends Expr {
    private final ImmutableList<Expr> operands;

    Or(List<Expr> operands) {
      this.operands = ImmutableList.copyOf(operands);
    }

    public List<Expr> operands() {
      return operands;
    }

    @Override public RowPredicate bind(Table table) {
      final List<RowPredicate> predicates = bindAll(operands, table);
      return row -> {
        for (RowPredicate predicate : predicates) {
          if (predicate.test(row)) {
            return true;
          }
        }
        return false;
      };
    }

    @Override public String toString() {
      return operands.stream().map(Object::toString)
          .collect(Collectors.joining(" OR ", "(", ")"));
    }
  }

  private static List<RowPredicate> bindAll(List<Expr> operands, Table table) {
    List<RowPredicate> predicates = new ArrayList<>(operands.size());
    for (Expr operand : operands) {
      predicates.add(operand.bind(table));
    }
    return predicates;
  }
}
