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
import org.apache.calcite.adapter.popgetter.search.expr.Expr.Comparison;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.COUNTRY_ISO2;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.COUNTRY_ISO3;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.COUNTRY_ISO3166_2;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.COUNTRY_NAME_OFFICIAL;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.COUNTRY_NAME_SHORT_EN;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.DATA_PUBLISHER_COUNTRIES_OF_INTEREST;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.DATA_PUBLISHER_NAME;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.GEOMETRY_LEVEL;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.METRIC_ID;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.METRIC_SOURCE_DOWNLOAD_URL;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.METRIC_SOURCE_ID;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.SOURCE_DATA_RELEASE_NAME;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.SOURCE_DATA_RELEASE_REFERENCE_PERIOD_END;
import static org.apache.calcite.adapter.popgetter.metadata.CatalogColumns.SOURCE_DATA_RELEASE_REFERENCE_PERIOD_START;

/**
 * Translates {@link SearchParams} into a single {@link Expr} over the catalog
 * view.
 *
 * <p>Combination rules:
 * <ul>
 *   <li>each text search is an OR over its contexts;
 *   <li>several year ranges are OR-ed;
 *   <li>all facets except metric ids are AND-ed into a refinement;
 *   <li>metric ids are OR-ed into an identity test;
 *   <li>the result is {@code refinement OR identity}, or whichever exists.
 * </ul>
 * An empty result means every row matches.
 */
public final class SearchPredicateCompiler {
  private static final Logger LOGGER = LoggerFactory.getLogger(SearchPredicateCompiler.class);

  /** Columns a country filter is tried against. */
  public static final List<String> COUNTRY_COLUMNS = ImmutableList.of(
      COUNTRY_NAME_SHORT_EN,
      COUNTRY_NAME_OFFICIAL,
      COUNTRY_ISO2,
      COUNTRY_ISO3,
      COUNTRY_ISO3166_2,
      DATA_PUBLISHER_COUNTRIES_OF_INTEREST);

  private SearchPredicateCompiler() {
  }

  public static Optional<Expr> compile(SearchParams params) {
    List<Expr> refinement = new ArrayList<>();
    for (SearchText text : params.text()) {
      refinement.add(compileText(text));
    }
    if (params.yearRanges().isPresent() && !params.yearRanges().get().isEmpty()) {
      List<Expr> years = new ArrayList<>();
      for (YearRange range : params.yearRanges().get()) {
        years.add(compileYearRange(range));
      }
      refinement.add(Expr.or(years));
    }
    params.geometryLevel().ifPresent(f -> refinement.add(compileFilter(GEOMETRY_LEVEL, f)));
    params.sourceDataRelease().ifPresent(f ->
        refinement.add(compileFilter(SOURCE_DATA_RELEASE_NAME, f)));
    params.dataPublisher().ifPresent(f -> refinement.add(compileFilter(DATA_PUBLISHER_NAME, f)));
    params.sourceDownloadUrl().ifPresent(f ->
        refinement.add(compileFilter(METRIC_SOURCE_DOWNLOAD_URL, f)));
    params.sourceMetricId().ifPresent(f -> refinement.add(compileFilter(METRIC_SOURCE_ID, f)));
    params.country().ifPresent(f -> refinement.add(compileCountry(f)));

    List<Expr> identity = new ArrayList<>();
    for (MetricId id : params.metricIds()) {
      identity.add(Expr.match(METRIC_ID, id.config().compile(id.id())));
    }

    Optional<Expr> result;
    if (!refinement.isEmpty() && !identity.isEmpty()) {
      result = Optional.of(Expr.or(Expr.and(refinement), Expr.or(identity)));
    } else if (!refinement.isEmpty()) {
      result = Optional.of(Expr.and(refinement));
    } else if (!identity.isEmpty()) {
      result = Optional.of(Expr.or(identity));
    } else {
      result = Optional.empty();
    }
    LOGGER.debug("Compiled {} to {}", params, result.map(Object::toString).orElse("<all rows>"));
    return result;
  }

  static Expr compileText(SearchText text) {
    Pattern pattern = text.config().compile(text.text());
    List<Expr> perContext = new ArrayList<>();
    for (SearchContext context : text.contexts()) {
      perContext.add(Expr.match(context.column(), pattern));
    }
    return Expr.or(perContext);
  }

  static Expr compileFilter(String column, TextFilter filter) {
    return Expr.match(column, filter.config().compile(filter.value()));
  }

  /** Country names and codes are matched case-insensitively whatever the request says. */
  static Expr compileCountry(TextFilter filter) {
    Pattern pattern = filter.config()
        .withCaseSensitivity(CaseSensitivity.INSENSITIVE)
        .compile(filter.value());
    List<Expr> perColumn = new ArrayList<>();
    for (String column : COUNTRY_COLUMNS) {
      perColumn.add(Expr.match(column, pattern));
    }
    return Expr.or(perColumn);
  }

  static Expr compileYearRange(YearRange range) {
    String start = SOURCE_DATA_RELEASE_REFERENCE_PERIOD_START;
    String end = SOURCE_DATA_RELEASE_REFERENCE_PERIOD_END;
    if (range instanceof YearRange.Before) {
      int year = ((YearRange.Before) range).year();
      return Expr.dateCompare(start, Comparison.LESS_OR_EQUAL, LocalDate.of(year, 12, 31));
    }
    if (range instanceof YearRange.After) {
      int year = ((YearRange.After) range).year();
      return Expr.dateCompare(end, Comparison.GREATER_OR_EQUAL, LocalDate.of(year, 1, 1));
    }
    YearRange.Between between = (YearRange.Between) range;
    LocalDate from = LocalDate.of(between.from(), 1, 1);
    LocalDate to = LocalDate.of(between.to(), 12, 31);
    return Expr.or(
        // period straddles the start of the range
        Expr.and(Expr.dateCompare(start, Comparison.LESS_OR_EQUAL, from),
            Expr.dateCompare(end, Comparison.GREATER_OR_EQUAL, from)),
        // period straddles the end of the range
        Expr.and(Expr.dateCompare(start, Comparison.LESS_OR_EQUAL, to),
            Expr.dateCompare(end, Comparison.GREATER_OR_EQUAL, to)),
        // period lies inside the range
        Expr.and(Expr.dateCompare(start, Comparison.GREATER_OR_EQUAL, from),
            Expr.dateCompare(end, Comparison.LESS_OR_EQUAL, to)));
  }
}
