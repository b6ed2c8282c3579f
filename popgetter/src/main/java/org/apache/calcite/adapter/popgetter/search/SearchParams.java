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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Every facet of a catalog search. Unset facets do not restrict the result.
 *
 * <p>Facets other than the metric ids are combined with AND; metric ids are
 * combined with OR and then OR-ed with the rest, so an explicitly named metric
 * is always returned.
 */
public final class SearchParams {
  private final ImmutableList<SearchText> text;
  private final @Nullable ImmutableList<YearRange> yearRanges;
  private final ImmutableList<MetricId> metricIds;
  private final @Nullable TextFilter geometryLevel;
  private final @Nullable TextFilter sourceDataRelease;
  private final @Nullable TextFilter dataPublisher;
  private final @Nullable TextFilter sourceDownloadUrl;
  private final @Nullable TextFilter country;
  private final @Nullable TextFilter sourceMetricId;
  private final ImmutableList<RegionSpec> regionSpecs;

  private SearchParams(Builder b) {
    this.text = ImmutableList.copyOf(b.text);
    this.yearRanges = b.yearRanges == null ? null : ImmutableList.copyOf(b.yearRanges);
    this.metricIds = ImmutableList.copyOf(b.metricIds);
    this.geometryLevel = b.geometryLevel;
    this.sourceDataRelease = b.sourceDataRelease;
    this.dataPublisher = b.dataPublisher;
    this.sourceDownloadUrl = b.sourceDownloadUrl;
    this.country = b.country;
    this.sourceMetricId = b.sourceMetricId;
    this.regionSpecs = ImmutableList.copyOf(b.regionSpecs);
  }

  /** Parameters that match the whole catalog. */
  public static SearchParams empty() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builds parameters from a single line of user input: the whole text is a
   * default text search, and each comma-separated token is also tried as a
   * metric id prefix.
   */
  public static SearchParams fromText(String value) {
    Builder builder = builder().text(SearchText.of(value));
    for (String token : value.split(",")) {
      String id = token.trim();
      if (!id.isEmpty()) {
        builder.metricId(MetricId.of(id));
      }
    }
    return builder.build();
  }

  public List<SearchText> text() {
    return text;
  }

  public Optional<List<YearRange>> yearRanges() {
    return Optional.ofNullable(yearRanges);
  }

  public List<MetricId> metricIds() {
    return metricIds;
  }

  public Optional<TextFilter> geometryLevel() {
    return Optional.ofNullable(geometryLevel);
  }

  public Optional<TextFilter> sourceDataRelease() {
    return Optional.ofNullable(sourceDataRelease);
  }

  public Optional<TextFilter> dataPublisher() {
    return Optional.ofNullable(dataPublisher);
  }

  public Optional<TextFilter> sourceDownloadUrl() {
    return Optional.ofNullable(sourceDownloadUrl);
  }

  public Optional<TextFilter> country() {
    return Optional.ofNullable(country);
  }

  public Optional<TextFilter> sourceMetricId() {
    return Optional.ofNullable(sourceMetricId);
  }

  public List<RegionSpec> regionSpecs() {
    return regionSpecs;
  }

  public Builder toBuilder() {
    Builder b = new Builder();
    b.text.addAll(text);
    b.yearRanges = yearRanges == null ? null : new ArrayList<>(yearRanges);
    b.metricIds.addAll(metricIds);
    b.geometryLevel = geometryLevel;
    b.sourceDataRelease = sourceDataRelease;
    b.dataPublisher = dataPublisher;
    b.sourceDownloadUrl = sourceDownloadUrl;
    b.country = country;
    b.sourceMetricId = sourceMetricId;
    b.regionSpecs.addAll(regionSpecs);
    return b;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SearchParams)) {
      return false;
    }
    SearchParams that = (SearchParams) o;
    return text.equals(that.text)
        && Objects.equals(yearRanges, that.yearRanges)
        && metricIds.equals(that.metricIds)
        && Objects.equals(geometryLevel, that.geometryLevel)
        && Objects.equals(sourceDataRelease, that.sourceDataRelease)
        && Objects.equals(dataPublisher, that.dataPublisher)
        && Objects.equals(sourceDownloadUrl, that.sourceDownloadUrl)
        && Objects.equals(country, that.country)
        && Objects.equals(sourceMetricId, that.sourceMetricId)
        && regionSpecs.equals(that.regionSpecs);
  }

  @Override public int hashCode() {
    return Objects.hash(text, yearRanges, metricIds, geometryLevel, sourceDataRelease,
        dataPublisher, sourceDownloadUrl, country, sourceMetricId, regionSpecs);
  }

  @Override public String toString() {
    return "SearchParams{text=" + text
        + ", yearRanges=" + yearRanges
        + ", metricIds=" + metricIds
        + ", geometryLevel=" + geometryLevel
        + ", sourceDataRelease=" + sourceDataRelease
        + ", dataPublisher=" + dataPublisher
        + ", sourceDownloadUrl=" + sourceDownloadUrl
        + ", country=" + country
        + ", sourceMetricId=" + sourceMetricId
        + ", regionSpecs=" + regionSpecs + "}";
  }

  /** Collects facets for a {@link SearchParams}. */
  public static final class Builder {
    private final List<SearchText> text = new ArrayList<>();
    private @Nullable List<YearRange> yearRanges;
    private final List<MetricId> metricIds = new ArrayList<>();
    private @Nullable TextFilter geometryLevel;
    private @Nullable TextFilter sourceDataRelease;
    private @Nullable TextFilter dataPublisher;
    private @Nullable TextFilter sourceDownloadUrl;
    private @Nullable TextFilter country;
    private @Nullable TextFilter sourceMetricId;
    private final List<RegionSpec> regionSpecs = new ArrayList<>();

    private Builder() {
    }

    public Builder text(SearchText searchText) {
      text.add(searchText);
      return this;
    }

    public Builder yearRange(YearRange range) {
      if (yearRanges == null) {
        yearRanges = new ArrayList<>();
      }
      yearRanges.add(range);
      return this;
    }

    public Builder yearRanges(List<YearRange> ranges) {
      for (YearRange range : ranges) {
        yearRange(range);
      }
      return this;
    }

    public Builder metricId(MetricId id) {
      metricIds.add(id);
      return this;
    }

    public Builder geometryLevel(@Nullable TextFilter filter) {
      geometryLevel = filter;
      return this;
    }

    public Builder sourceDataRelease(@Nullable TextFilter filter) {
      sourceDataRelease = filter;
      return this;
    }

    public Builder dataPublisher(@Nullable TextFilter filter) {
      dataPublisher = filter;
      return this;
    }

    public Builder sourceDownloadUrl(@Nullable TextFilter filter) {
      sourceDownloadUrl = filter;
      return this;
    }

    public Builder country(@Nullable TextFilter filter) {
      country = filter;
      return this;
    }

    public Builder sourceMetricId(@Nullable TextFilter filter) {
      sourceMetricId = filter;
      return this;
    }

    public Builder regionSpec(RegionSpec spec) {
      regionSpecs.add(spec);
      return this;
    }

    public SearchParams build() {
      return new SearchParams(this);
    }
  }
}
