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

import org.apache.calcite.adapter.popgetter.search.expr.Expr;
import org.apache.calcite.adapter.popgetter.table.Table;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Applies compiled search parameters to the catalog view.
 */
public final class SearchEngine {
  private static final Logger LOGGER = LoggerFactory.getLogger(SearchEngine.class);

  private SearchEngine() {
  }

  /**
   * Filters {@code view} by {@code params}. Parameters with no facets return
   * the view unchanged.
   */
  public static SearchResults search(Table view, SearchParams params) {
    Optional<Expr> expr = SearchPredicateCompiler.compile(params);
    if (!expr.isPresent()) {
      return new SearchResults(view);
    }
    Table matched = view.filter(expr.get().bind(view));
    LOGGER.info("Search matched {} of {} catalog rows", matched.rowCount(), view.rowCount());
    return new SearchResults(matched);
  }
}
