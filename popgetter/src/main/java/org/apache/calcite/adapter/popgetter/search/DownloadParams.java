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

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Options of a download: whether geometries are joined in, and the region
 * to restrict them to.
 */
public final class DownloadParams {
  private final boolean includeGeoms;
  private final ImmutableList<RegionSpec> regionSpecs;

  public DownloadParams(boolean includeGeoms, List<RegionSpec> regionSpecs) {
    this.includeGeoms = includeGeoms;
    this.regionSpecs = ImmutableList.copyOf(regionSpecs);
  }

  public static DownloadParams withGeometry() {
    return new DownloadParams(true, Collections.<RegionSpec>emptyList());
  }

  public static DownloadParams metricsOnly() {
    return new DownloadParams(false, Collections.<RegionSpec>emptyList());
  }

  public boolean includeGeoms() {
    return includeGeoms;
  }

  public List<RegionSpec> regionSpecs() {
    return regionSpecs;
  }

  @Override public boolean equals(Object o) {
    return o instanceof DownloadParams
        && includeGeoms == ((DownloadParams) o).includeGeoms
        && regionSpecs.equals(((DownloadParams) o).regionSpecs);
  }

  @Override public int hashCode() {
    return Objects.hash(includeGeoms, regionSpecs);
  }

  @Override public String toString() {
    return "DownloadParams{includeGeoms=" + includeGeoms + ", regionSpecs=" + regionSpecs + "}";
  }
}
