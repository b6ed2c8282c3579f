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

import org.apache.calcite.adapter.popgetter.metadata.CatalogColumns;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** Catalog column a free-text search looks at. */
public enum SearchContext {
  HXL(CatalogColumns.METRIC_HXL_TAG),
  HUMAN_READABLE_NAME(CatalogColumns.METRIC_HUMAN_READABLE_NAME),
  DESCRIPTION(CatalogColumns.METRIC_DESCRIPTION);

  private static final List<SearchContext> ALL =
      Collections.unmodifiableList(Arrays.asList(values()));

  private final String column;

  SearchContext(String column) {
    this.column = column;
  }

  public String column() {
    return column;
  }

  public static List<SearchContext> all() {
    return ALL;
  }
}
