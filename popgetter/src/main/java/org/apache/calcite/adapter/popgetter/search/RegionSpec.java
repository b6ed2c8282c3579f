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
 * Spatial restriction of a request. Only {@link BoundingBox} is acted on by
 * the download engine; the other variants are carried so that recipes using
 * them can be parsed and rejected with a clear message.
 */
public abstract class RegionSpec {
  private RegionSpec() {
  }

  public static RegionSpec boundingBox(BBox bbox) {
    return new BoundingBox(bbox);
  }

  /** Rectangle in geometry-file coordinates. */
  public static final class BoundingBox extends RegionSpec {
    private final BBox bbox;

    BoundingBox(BBox bbox) {
      this.bbox = Objects.requireNonNull(bbox, "bbox");
    }

    public BBox bbox() {
      return bbox;
    }

    @Override public boolean equals(Object o) {
      return o instanceof BoundingBox && bbox.equals(((BoundingBox) o).bbox);
    }

    @Override public int hashCode() {
      return bbox.hashCode();
    }

    @Override public String toString() {
      return "BoundingBox(" + bbox + ")";
    }
  }

  /** Arbitrary polygon, given as WKT. */
  public static final class Polygon extends RegionSpec {
    private final String wkt;

    public Polygon(String wkt) {
      this.wkt = Objects.requireNonNull(wkt, "wkt");
    }

    public String wkt() {
      return wkt;
    }

    @Override public boolean equals(Object o) {
      return o instanceof Polygon && wkt.equals(((Polygon) o).wkt);
    }

    @Override public int hashCode() {
      return wkt.hashCode();
    }

    @Override public String toString() {
      return "Polygon(" + wkt + ")";
    }
  }

  /** Area identified by name, for example a local authority. */
  public static final class NamedArea extends RegionSpec {
    private final String name;

    public NamedArea(String name) {
      this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
      return name;
    }

    @Override public boolean equals(Object o) {
      return o instanceof NamedArea && name.equals(((NamedArea) o).name);
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public String toString() {
      return "NamedArea(" + name + ")";
    }
  }
}
