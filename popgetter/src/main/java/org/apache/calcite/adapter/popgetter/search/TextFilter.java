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

import java.util.Objects;

/**
 * Value and match configuration of a single-valued facet such as geometry
 * level, publisher or country.
 */
public final class TextFilter {
  private final String value;
  private final SearchConfig config;

  public TextFilter(String value, SearchConfig config) {
    this.value = Objects.requireNonNull(value, "value");
    this.config = Objects.requireNonNull(config, "config");
  }

  /** Exact, case-insensitive filter. */
  public static TextFilter of(String value) {
    return new TextFilter(value, SearchConfig.EXACT_INSENSITIVE);
  }

  public String value() {
    return value;
  }

  public SearchConfig config() {
    return config;
  }

  @Override public boolean equals(Object o) {
    return o instanceof TextFilter
        && value.equals(((TextFilter) o).value)
        && config.equals(((TextFilter) o).config);
  }

  @Override public int hashCode() {
    return Objects.hash(value, config);
  }

  @Override public String toString() {
    return value + " (" + config + ")";
  }
}
