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
package org.apache.calcite.adapter.popgetter.geo;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.locationtech.jts.geom.Geometry;

import java.util.Collections;
import java.util.Map;

/** One decoded FlatGeobuf feature. */
public final class FlatGeobufFeature {
  private final @Nullable Geometry geometry;
  private final Map<String, Object> properties;

  FlatGeobufFeature(@Nullable Geometry geometry, Map<String, Object> properties) {
    this.geometry = geometry;
    this.properties = Collections.unmodifiableMap(properties);
  }

  public @Nullable Geometry geometry() {
    return geometry;
  }

  public Map<String, Object> properties() {
    return properties;
  }
}
