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

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * Free-text search over one or more {@link SearchContext}s. A row matches
 * when any selected context matches.
 */
public final class SearchText {
  private final String text;
  private final ImmutableList<SearchContext> contexts;
  private final SearchConfig config;

  public SearchText(String text, List<SearchContext> contexts, SearchConfig config) {
    this.text = Objects.requireNonNull(text, "text");
    if (contexts.isEmpty()) {
      throw new IllegalArgumentException("A text search needs at least one context");
    }
    this.contexts = ImmutableList.copyOf(contexts);
    this.config = Objects.requireNonNull(config, "config");
  }

  /** Exact, case-insensitive search over every context. */
  public static SearchText of(String text) {
    return new SearchText(text, SearchContext.all(), SearchConfig.EXACT_INSENSITIVE);
  }

  public String text() {
    return text;
  }

  public List<SearchContext> contexts() {
    return contexts;
  }

  public SearchConfig config() {
    return config;
  }

  @Override public boolean equals(Object o) {
    if (!(o instanceof SearchText)) {
      return false;
    }
    SearchText that = (SearchText) o;
    return text.equals(that.text) && contexts.equals(that.contexts) && config.equals(that.config);
  }

  @Override public int hashCode() {
    return Objects.hash(text, contexts, config);
  }

  @Override public String toString() {
    return "SearchText{" + text + " in " + contexts + ", " + config + "}";
  }
}
