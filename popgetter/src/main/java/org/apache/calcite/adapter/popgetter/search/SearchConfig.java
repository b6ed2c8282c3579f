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

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Match mode and case sensitivity attached to one filter.
 */
public final class SearchConfig {
  public static final SearchConfig EXACT_INSENSITIVE =
      new SearchConfig(MatchType.EXACT, CaseSensitivity.INSENSITIVE);
  public static final SearchConfig STARTS_WITH_INSENSITIVE =
      new SearchConfig(MatchType.STARTS_WITH, CaseSensitivity.INSENSITIVE);

  private final MatchType matchType;
  private final CaseSensitivity caseSensitivity;

  public SearchConfig(MatchType matchType, CaseSensitivity caseSensitivity) {
    this.matchType = Objects.requireNonNull(matchType, "matchType");
    this.caseSensitivity = Objects.requireNonNull(caseSensitivity, "caseSensitivity");
  }

  public MatchType matchType() {
    return matchType;
  }

  public CaseSensitivity caseSensitivity() {
    return caseSensitivity;
  }

  public SearchConfig withCaseSensitivity(CaseSensitivity sensitivity) {
    return new SearchConfig(matchType, sensitivity);
  }

  /**
   * Compiles {@code value} under this configuration.
   *
   * @throws SearchValidationException if a regex value does not compile
   */
  public Pattern compile(String value) {
    int flags = caseSensitivity == CaseSensitivity.INSENSITIVE
        ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
        : 0;
    try {
      return Pattern.compile(matchType.toPatternSource(value), flags);
    } catch (PatternSyntaxException e) {
      throw new SearchValidationException("Invalid regular expression '" + value + "': "
          + e.getDescription(), e);
    }
  }

  @Override public boolean equals(Object o) {
    return o instanceof SearchConfig
        && matchType == ((SearchConfig) o).matchType
        && caseSensitivity == ((SearchConfig) o).caseSensitivity;
  }

  @Override public int hashCode() {
    return Objects.hash(matchType, caseSensitivity);
  }

  @Override public String toString() {
    return matchType + "/" + caseSensitivity;
  }
}
