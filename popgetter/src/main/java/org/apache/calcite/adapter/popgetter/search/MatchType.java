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

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * How a filter value is compared against a catalog cell.
 *
 * <p>All modes are evaluated as a regular-expression search; the literal
 * modes quote the user's text first.
 */
public enum MatchType {
  EXACT,
  CONTAINS,
  STARTS_WITH,
  REGEX;

  /** Turns a filter value into the pattern source for this mode. */
  public String toPatternSource(String value) {
    switch (this) {
      case EXACT:
        return "^" + Pattern.quote(value) + "\\z";
      case STARTS_WITH:
        return "^" + Pattern.quote(value);
      case CONTAINS:
        return Pattern.quote(value);
      case REGEX:
      default:
        return value;
    }
  }

  @JsonCreator
  public static MatchType parse(String name) {
    String normalized = name.trim().toLowerCase(Locale.ROOT).replace("_", "");
    switch (normalized) {
      case "exact":
        return EXACT;
      case "contains":
        return CONTAINS;
      case "startswith":
      case "prefix":
        return STARTS_WITH;
      case "regex":
        return REGEX;
      default:
        throw new IllegalArgumentException("Unknown match type: " + name);
    }
  }
}
