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
package org.apache.calcite.adapter.popgetter.search;

import org.apache.calcite.adapter.popgetter.SearchValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reference-period filter: {@link Before}, {@link After} or {@link Between}
 * a pair of years, all inclusive.
 *
 * <p>Text form, as accepted by {@link #parse(String)}: {@code 2020},
 * {@code 2015...}, {@code ...2015} or {@code 2011...2021}.
 */
public abstract class YearRange {
  private static final String SEPARATOR = "...";

  private YearRange() {
  }

  /** Releases whose reference period starts on or before the end of a year. */
  public static final class Before extends YearRange {
    private final int year;

    public Before(int year) {
      this.year = year;
    }

    public int year() {
      return year;
    }

    @Override public boolean equals(Object o) {
      return o instanceof Before && ((Before) o).year == year;
    }

    @Override public int hashCode() {
      return Objects.hash("before", year);
    }

    @Override public String toString() {
      return SEPARATOR + year;
    }
  }

  /** Releases whose reference period ends on or after the start of a year. */
  public static final class After extends YearRange {
    private final int year;

    public After(int year) {
      this.year = year;
    }

    public int year() {
      return year;
    }

    @Override public boolean equals(Object o) {
      return o instanceof After && ((After) o).year == year;
    }

    @Override public int hashCode() {
      return Objects.hash("after", year);
    }

    @Override public String toString() {
      return year + SEPARATOR;
    }
  }

  /** Releases whose reference period overlaps {@code [from, to]}. */
  public static final class Between extends YearRange {
    private final int from;
    private final int to;

    public Between(int from, int to) {
      if (from > to) {
        throw new SearchValidationException("Year range start " + from + " is after end " + to);
      }
      this.from = from;
      this.to = to;
    }

    public int from() {
      return from;
    }

    public int to() {
      return to;
    }

    @Override public boolean equals(Object o) {
      return o instanceof Between && ((Between) o).from == from && ((Between) o).to == to;
    }

    @Override public int hashCode() {
      return Objects.hash(from, to);
    }

    @Override public String toString() {
      return from + SEPARATOR + to;
    }
  }

  /**
   * Parses one year range.
   *
   * @throws SearchValidationException if the text is not a valid range
   */
  public static YearRange parse(String text) {
    String s = text.trim();
    int idx = s.indexOf(SEPARATOR);
    if (idx < 0) {
      int year = parseYear(s, text);
      return new Between(year, year);
    }
    String left = s.substring(0, idx).trim();
    String right = s.substring(idx + SEPARATOR.length()).trim();
    if (left.isEmpty() && right.isEmpty()) {
      throw new SearchValidationException("Invalid year range '" + text + "': no year given");
    }
    if (left.isEmpty()) {
      return new Before(parseYear(right, text));
    }
    if (right.isEmpty()) {
      return new After(parseYear(left, text));
    }
    return new Between(parseYear(left, text), parseYear(right, text));
  }

  /** Parses a comma-separated list of year ranges. */
  public static List<YearRange> parseList(String text) {
    List<YearRange> ranges = new ArrayList<>();
    for (String part : text.split(",")) {
      ranges.add(parse(part));
    }
    return ranges;
  }

  private static int parseYear(String s, String original) {
    if (s.isEmpty() || s.length() > 4 || !s.chars().allMatch(Character::isDigit)) {
      throw new SearchValidationException("Invalid year range '" + original + "': '" + s
          + "' is not a year");
    }
    return Integer.parseInt(s);
  }
}
