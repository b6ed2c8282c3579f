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
import org.apache.calcite.adapter.popgetter.search.CaseSensitivity;
import org.apache.calcite.adapter.popgetter.search.MatchType;
import org.apache.calcite.adapter.popgetter.search.MetricId;
import org.apache.calcite.adapter.popgetter.search.Params;
import org.apache.calcite.adapter.popgetter.search.RegionSpec;
import org.apache.calcite.adapter.popgetter.search.SearchConfig;
import org.apache.calcite.adapter.popgetter.search.SearchText;
import org.apache.calcite.adapter.popgetter.search.TextFilter;
import org.apache.calcite.adapter.popgetter.search.YearRange;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DataRequestSpec}.
 */
@Tag("unit")
public class DataRequestSpecTest {
  @TempDir
  Path tempDir;

  private static final String RECIPE = "{\n"
      + "  \"geometry\": {\"geometry_level\": \"municipality\", \"include_geoms\": false},\n"
      + "  \"region\": [{\"BoundingBox\": [4.3, 50.8, 4.5, 50.9]}],\n"
      + "  \"metrics\": [\n"
      + "    {\"MetricText\": \"population\"},\n"
      + "    {\"MetricId\": {\"id\": \"f29c1976\", \"config\": {\"match_type\": \"Exact\","
      + " \"case_sensitivity\": \"Sensitive\"}}},\n"
      + "    {\"MetricId\": {\"id\": \"079f3ba3\"}}\n"
      + "  ],\n"
      + "  \"years\": [\"2021\", \"...2015\"]\n"
      + "}";

  @Test void testParse() {
    DataRequestSpec spec = DataRequestSpec.fromJson(RECIPE);
    assertEquals(new GeometrySpec("municipality", false), spec.geometry().get());
    assertEquals(Collections.singletonList(
            RegionSpec.boundingBox(new BBox(4.3, 50.8, 4.5, 50.9))),
        spec.region());
    assertEquals(Arrays.asList(
            new MetricSpec.ByText("population"),
            new MetricSpec.ById(new MetricId("f29c1976",
                new SearchConfig(MatchType.EXACT, CaseSensitivity.SENSITIVE))),
            new MetricSpec.ById(MetricId.of("079f3ba3"))),
        spec.metrics());
    assertEquals(Arrays.asList("2021", "...2015"), spec.years().get());
  }

  @Test void testParseFile() throws Exception {
    Path file = tempDir.resolve("recipe.json");
    Files.write(file, RECIPE.getBytes(StandardCharsets.UTF_8));
    assertEquals(DataRequestSpec.fromJson(RECIPE), DataRequestSpec.fromJson(file));
  }

  @Test void testCamelCaseAliasesAndDefaults() {
    DataRequestSpec spec = DataRequestSpec.fromJson(
        "{\"geometry\": {\"geometryLevel\": \"sdz\"}, \"metrics\": []}");
    assertEquals("sdz", spec.geometry().get().geometryLevel().get());
    assertTrue(spec.geometry().get().includeGeoms());
    assertTrue(spec.region().isEmpty());
    assertFalse(spec.years().isPresent());
  }

  @Test void testToParams() {
    Params params = DataRequestSpec.fromJson(RECIPE).toParams();
    assertEquals(Collections.singletonList(SearchText.of("population")),
        params.search().text());
    assertEquals(2, params.search().metricIds().size());
    assertEquals(SearchConfig.STARTS_WITH_INSENSITIVE,
        params.search().metricIds().get(1).config());
    assertEquals(TextFilter.of("municipality"), params.search().geometryLevel().get());
    assertEquals(Arrays.asList(new YearRange.Between(2021, 2021), new YearRange.Before(2015)),
        params.search().yearRanges().get());
    assertFalse(params.download().includeGeoms());
    assertEquals(params.download().regionSpecs(), params.search().regionSpecs());
  }

  @Test void testMissingGeometryIncludesGeometries() {
    Params params = DataRequestSpec.fromJson("{\"metrics\": [{\"MetricText\": \"x\"}]}")
        .toParams();
    assertTrue(params.download().includeGeoms());
    assertFalse(params.search().geometryLevel().isPresent());
    assertFalse(params.search().yearRanges().isPresent());
  }

  @Test void testDataProductIsUnsupported() {
    DataRequestSpec spec =
        DataRequestSpec.fromJson("{\"metrics\": [{\"DataProduct\": \"census_2021\"}]}");
    assertEquals(new MetricSpec.DataProduct("census_2021"), spec.metrics().get(0));
    assertThrows(UnsupportedRequestException.class, spec::toParams);
  }

  @Test void testMalformedYearIsAValidationError() {
    DataRequestSpec spec = DataRequestSpec.fromJson("{\"years\": [\"twenty\"]}");
    assertThrows(SearchValidationException.class, spec::toParams);
  }

  @Test void testMalformedDocuments() {
    assertThrows(SearchValidationException.class,
        () -> DataRequestSpec.fromJson("{\"metrics\": [{\"Unknown\": 1}]}"));
    assertThrows(SearchValidationException.class,
        () -> DataRequestSpec.fromJson("{\"region\": [{\"BoundingBox\": [1, 2, 3]}]}"));
    assertThrows(SearchValidationException.class,
        () -> DataRequestSpec.fromJson("{\"metrics\": [{\"MetricId\": {\"id\": \"a\","
            + " \"config\": {\"match_type\": \"Fuzzy\"}}}]}"));
    assertThrows(SearchValidationException.class, () -> DataRequestSpec.fromJson("not json"));
  }

  @Test void testOtherRegionKinds() {
    DataRequestSpec spec = DataRequestSpec.fromJson("{\"region\": ["
        + "{\"BoundingBox\": \"0,0,1,1\"}, {\"NamedArea\": \"Brussels\"},"
        + " {\"Polygon\": \"POLYGON ((0 0, 1 0, 1 1, 0 0))\"}]}");
    assertEquals(Arrays.asList(RegionSpec.boundingBox(new BBox(0, 0, 1, 1)),
            new RegionSpec.NamedArea("Brussels"),
            new RegionSpec.Polygon("POLYGON ((0 0, 1 0, 1 1, 0 0))")),
        spec.region());
  }
}
