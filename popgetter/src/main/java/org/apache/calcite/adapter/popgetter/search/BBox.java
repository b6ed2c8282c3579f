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

import org.apache.calcite.adapter.popgetter.SearchValidationException;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Axis-aligned bounding box in the coordinate system of the geometry files.
 */
public final class BBox {
  private final double minX;
  private final double minY;
  private final double maxX;
  private final double maxY;

  public BBox(double minX, double minY, double maxX, double maxY) {
    this.minX = minX;
    this.minY = minY;
    this.maxX = maxX;
    this.maxY = maxY;
  }

  /**
   * Parses {@code "minx,miny,maxx,maxy"}.
   *
   * @throws SearchValidationException unless the text holds exactly four
   *     finite numbers
   */
  public static BBox parse(String text) {
    String[] parts = text.split(",", -1);
    if (parts.length != 4) {
      throw new SearchValidationException("Bounding box '" + text
          + "' must have four comma-separated values");
    }
    double[] values = new double[4];
    for (int i = 0; i < 4; i++) {
      try {
        values[i] = Double.parseDouble(parts[i].trim());
      } catch (NumberFormatException e) {
        throw new SearchValidationException("Bounding box '" + text + "' has a non-numeric value '"
            + parts[i].trim() + "'", e);
      }
      if (Double.isNaN(values[i]) || Double.isInfinite(values[i])) {
        throw new SearchValidationException("Bounding box '" + text + "' has a non-finite value");
      }
    }
    return new BBox(values[0], values[1], values[2], values[3]);
  }

  public static BBox of(List<? extends Number> values) {
    if (values.size() != 4) {
      throw new SearchValidationException("Bounding box needs four values but got " + values);
    }
    return new BBox(values.get(0).doubleValue(), values.get(1).doubleValue(),
        values.get(2).doubleValue(), values.get(3).doubleValue());
  }

  public double minX() {
    return minX;
  }

  public double minY() {
    return minY;
  }

  public double maxX() {
    return maxX;
  }

  public double maxY() {
    return maxY;
  }

  /** Whether this box and the given extent share at least one point. */
  public boolean intersects(double otherMinX, double otherMinY, double otherMaxX, double otherMaxY) {
    return otherMaxX >= minX && otherMinX <= maxX && otherMaxY >= minY && otherMinY <= maxY;
  }

  public List<Double> toList() {
    return Arrays.asList(minX, minY, maxX, maxY);
  }

  @Override public boolean equals(Object o) {
    if (!(o instanceof BBox)) {
      return false;
    }
    BBox that = (BBox) o;
    return Double.compare(minX, that.minX) == 0 && Double.compare(minY, that.minY) == 0
        && Double.compare(maxX, that.maxX) == 0 && Double.compare(maxY, that.maxY) == 0;
  }

  @Override public int hashCode() {
    return Objects.hash(minX, minY, maxX, maxY);
  }

  @Override public String toString() {
    return minX + "," + minY + "," + maxX + "," + maxY;
  }
}
