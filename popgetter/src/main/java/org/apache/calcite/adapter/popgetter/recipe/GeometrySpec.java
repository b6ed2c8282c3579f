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

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;
import java.util.Optional;

/**
 * Geometry part of a recipe: the geometry level to restrict the search to and
 * whether geometries are joined into the download. Geometries are included
 * unless switched off.
 */
public final class GeometrySpec {
  private final @Nullable String geometryLevel;
  private final boolean includeGeoms;

  @JsonCreator
  public GeometrySpec(
      @JsonProperty("geometry_level") @JsonAlias("geometryLevel") @Nullable String geometryLevel,
      @JsonProperty("include_geoms") @JsonAlias("includeGeoms") @Nullable Boolean includeGeoms) {
    this.geometryLevel = geometryLevel;
    this.includeGeoms = includeGeoms == null || includeGeoms;
  }

  public static GeometrySpec defaults() {
    return new GeometrySpec(null, true);
  }

  public Optional<String> geometryLevel() {
    return Optional.ofNullable(geometryLevel);
  }

  public boolean includeGeoms() {
    return includeGeoms;
  }

  @Override public boolean equals(Object o) {
    return o instanceof GeometrySpec
        && Objects.equals(geometryLevel, ((GeometrySpec) o).geometryLevel)
        && includeGeoms == ((GeometrySpec) o).includeGeoms;
  }

  @Override public int hashCode() {
    return Objects.hash(geometryLevel, includeGeoms);
  }

  @Override public String toString() {
    return "GeometrySpec{geometryLevel=" + geometryLevel + ", includeGeoms=" + includeGeoms + "}";
  }
}
