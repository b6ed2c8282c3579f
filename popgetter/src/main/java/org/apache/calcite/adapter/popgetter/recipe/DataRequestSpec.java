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
package org.apache.calcite.adapter.popgetter.recipe;

import org.apache.calcite.adapter.popgetter.SearchValidationException;
import org.apache.calcite.adapter.popgetter.UnsupportedRequestException;
import org.apache.calcite.adapter.popgetter.search.BBox;
import org.apache.calcite.adapter.popgetter.search.DownloadParams;
import org.apache.calcite.adapter.popgetter.search.Params;
import org.apache.calcite.adapter.popgetter.search.RegionSpec;
import org.apache.calcite.adapter.popgetter.search.SearchParams;
import org.apache.calcite.adapter.popgetter.search.SearchText;
import org.apache.calcite.adapter.popgetter.search.TextFilter;
import org.apache.calcite.adapter.popgetter.search.YearRange;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A data request recipe: which metrics, for which years, at which geometry
 * level and in which region. Read from JSON such as
 *
 * <pre>{@code
 * {
 *   "geometry": {"geometry_level": "municipality", "include_geoms": true},
 *   "region": [{"BoundingBox": [4.3, 50.8, 4.5, 50.9]}],
 *   "metrics": [{"MetricText": "population"}, {"MetricId": {"id": "f29c1976"}}],
 *   "years": ["2021", "...2015"]
 * }
 * }</pre>
 *
 * <p>and turned into search and download parameters by {@link #toParams()}.
 */
public final class DataRequestSpec {
  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private final @Nullable GeometrySpec geometry;
  private final ImmutableList<RegionSpec> region;
  private final ImmutableList<MetricSpec> metrics;
  private final @Nullable ImmutableList<String> years;

  public DataRequestSpec(@Nullable GeometrySpec geometry, List<RegionSpec> region,
      List<MetricSpec> metrics, @Nullable List<String> years) {
    this.geometry = geometry;
    this.region = ImmutableList.copyOf(region);
    this.metrics = ImmutableList.copyOf(metrics);
    this.years = years == null ? null : ImmutableList.copyOf(years);
  }

  @JsonCreator
  static DataRequestSpec create(
      @JsonProperty("geometry") @Nullable GeometrySpec geometry,
      @JsonProperty("region") @Nullable List<JsonNode> region,
      @JsonProperty("metrics") @Nullable List<MetricSpec> metrics,
      @JsonProperty("years") @Nullable List<String> years) {
    List<RegionSpec> regions = new ArrayList<>();
    if (region != null) {
      for (JsonNode node : region) {
        regions.add(regionSpec(node));
      }
    }
    return new DataRequestSpec(geometry, regions,
        metrics == null ? Collections.<MetricSpec>emptyList() : metrics, years);
  }

  /**
   * Parses a recipe.
   *
   * @throws SearchValidationException if the document is not a valid recipe
   */
  public static DataRequestSpec fromJson(String json) {
    try {
      return MAPPER.readValue(json, DataRequestSpec.class);
    } catch (IOException e) {
      throw invalid(e);
    }
  }

  public static DataRequestSpec fromJson(Path file) {
    try {
      return MAPPER.readValue(file.toFile(), DataRequestSpec.class);
    } catch (IOException e) {
      throw invalid(e);
    }
  }

  private static SearchValidationException invalid(IOException e) {
    // Validation failures raised inside creators arrive wrapped by Jackson
    for (Throwable t = e.getCause(); t != null; t = t.getCause()) {
      if (t instanceof SearchValidationException) {
        return (SearchValidationException) t;
      }
    }
    return new SearchValidationException("Invalid data request spec: " + e.getMessage(), e);
  }

  private static RegionSpec regionSpec(JsonNode node) {
    if (!node.isObject() || node.size() != 1) {
      throw new SearchValidationException("Region entry must be an object with one key: " + node);
    }
    Map.Entry<String, JsonNode> entry = node.fields().next();
    JsonNode value = entry.getValue();
    switch (entry.getKey()) {
      case "BoundingBox":
        if (value.isTextual()) {
          return RegionSpec.boundingBox(BBox.parse(value.asText()));
        }
        if (!value.isArray()) {
          throw new SearchValidationException("BoundingBox must be four numbers: " + value);
        }
        List<Double> values = new ArrayList<>();
        for (JsonNode n : value) {
          if (!n.isNumber()) {
            throw new SearchValidationException("BoundingBox must be four numbers: " + value);
          }
          values.add(n.asDouble());
        }
        return RegionSpec.boundingBox(BBox.of(values));
      case "Polygon":
        return new RegionSpec.Polygon(value.isNull() ? "" : value.asText());
      case "NamedArea":
        return new RegionSpec.NamedArea(value.asText());
      default:
        throw new SearchValidationException("Unknown region entry '" + entry.getKey() + "'");
    }
  }

  public Optional<GeometrySpec> geometry() {
    return Optional.ofNullable(geometry);
  }

  public List<RegionSpec> region() {
    return region;
  }

  public List<MetricSpec> metrics() {
    return metrics;
  }

  public Optional<List<String>> years() {
    return Optional.<List<String>>ofNullable(years);
  }

  /**
   * Converts the recipe into search and download parameters. Text entries
   * search names, HXL tags and descriptions; the region restricts both the
   * search and the download.
   *
   * @throws UnsupportedRequestException if the recipe names a data product
   * @throws SearchValidationException if a year range is malformed
   */
  public Params toParams() {
    SearchParams.Builder search = SearchParams.builder();
    for (MetricSpec metric : metrics) {
      if (metric instanceof MetricSpec.ByText) {
        search.text(SearchText.of(((MetricSpec.ByText) metric).text()));
      } else if (metric instanceof MetricSpec.ById) {
        search.metricId(((MetricSpec.ById) metric).metricId());
      } else {
        throw new UnsupportedRequestException("Data products are not supported: " + metric);
      }
    }
    if (years != null) {
      List<YearRange> ranges = new ArrayList<>(years.size());
      for (String year : years) {
        ranges.add(YearRange.parse(year));
      }
      search.yearRanges(ranges);
    }
    GeometrySpec geometrySpec = geometry == null ? GeometrySpec.defaults() : geometry;
    if (geometrySpec.geometryLevel().isPresent()) {
      search.geometryLevel(TextFilter.of(geometrySpec.geometryLevel().get()));
    }
    for (RegionSpec spec : region) {
      search.regionSpec(spec);
    }
    return new Params(search.build(), new DownloadParams(geometrySpec.includeGeoms(), region));
  }

  @Override public boolean equals(Object o) {
    if (!(o instanceof DataRequestSpec)) {
      return false;
    }
    DataRequestSpec that = (DataRequestSpec) o;
    return Objects.equals(geometry, that.geometry) && region.equals(that.region)
        && metrics.equals(that.metrics) && Objects.equals(years, that.years);
  }

  @Override public int hashCode() {
    return Objects.hash(geometry, region, metrics, years);
  }

  @Override public String toString() {
    return "DataRequestSpec{geometry=" + geometry + ", region=" + region + ", metrics=" + metrics
        + ", years=" + years + "}";
  }
}
