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
package org.apache.calcite.adapter.popgetter.download;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One metric column to fetch: the column, the parquet file holding it and the
 * geometry file its rows are keyed against.
 */
public final class MetricRequest {
  private final String column;
  private final String metricFile;
  private final String geomFile;

  public MetricRequest(String column, String metricFile, String geomFile) {
    this.column = Objects.requireNonNull(column, "column");
    this.metricFile = Objects.requireNonNull(metricFile, "metricFile");
    this.geomFile = Objects.requireNonNull(geomFile, "geomFile");
  }

  public String column() {
    return column;
  }

  public String metricFile() {
    return metricFile;
  }

  public String geomFile() {
    return geomFile;
  }

  /**
   * Groups the requested columns by metric file. Files and columns keep the
   * order in which they first appear; repeated columns are listed once.
   */
  public static Map<String, List<String>> columnsByFile(List<MetricRequest> requests) {
    Map<String, Set<String>> grouped = new LinkedHashMap<>();
    for (MetricRequest request : requests) {
      grouped.computeIfAbsent(request.metricFile, f -> new LinkedHashSet<>()).add(request.column);
    }
    Map<String, List<String>> result = new LinkedHashMap<>();
    for (Map.Entry<String, Set<String>> entry : grouped.entrySet()) {
      result.put(entry.getKey(), new ArrayList<>(entry.getValue()));
    }
    return result;
  }

  /** Distinct geometry files of the requests, in first-appearance order. */
  public static Set<String> geometryFiles(List<MetricRequest> requests) {
    Set<String> files = new LinkedHashSet<>();
    for (MetricRequest request : requests) {
      files.add(request.geomFile);
    }
    return files;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MetricRequest)) {
      return false;
    }
    MetricRequest that = (MetricRequest) o;
    return column.equals(that.column) && metricFile.equals(that.metricFile)
        && geomFile.equals(that.geomFile);
  }

  @Override public int hashCode() {
    return Objects.hash(column, metricFile, geomFile);
  }

  @Override public String toString() {
    return "MetricRequest{column=" + column + ", metricFile=" + metricFile
        + ", geomFile=" + geomFile + "}";
  }
}
