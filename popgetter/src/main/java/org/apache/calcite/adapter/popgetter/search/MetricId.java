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

import java.util.Objects;

/**
 * Metric identifier filter. Defaults to a case-insensitive prefix match, so a
 * shortened id selects every metric that starts with it.
 */
public final class MetricId {
  private final String id;
  private final SearchConfig config;

  public MetricId(String id, SearchConfig config) {
    this.id = Objects.requireNonNull(id, "id");
    this.config = Objects.requireNonNull(config, "config");
  }

  public static MetricId of(String id) {
    return new MetricId(id, SearchConfig.STARTS_WITH_INSENSITIVE);
  }

  public String id() {
    return id;
  }

  public SearchConfig config() {
    return config;
  }

  @Override public boolean equals(Object o) {
    return o instanceof MetricId
        && id.equals(((MetricId) o).id)
        && config.equals(((MetricId) o).config);
  }

  @Override public int hashCode() {
    return Objects.hash(id, config);
  }

  @Override public String toString() {
    return "MetricId{" + id + ", " + config + "}";
  }
}
