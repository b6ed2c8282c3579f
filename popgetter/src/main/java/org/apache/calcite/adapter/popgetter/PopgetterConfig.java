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
package org.apache.calcite.adapter.popgetter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration of a {@link Popgetter} instance.
 *
 * <p>Can be built from defaults ({@link #defaults()}), a JSON document
 * ({@link #fromJson(Path)}) or the operand map of a Calcite model
 * ({@link #fromOperand(Map)}). The base path defaults to the published
 * release and can be overridden with the {@value #BASE_PATH_ENV}
 * environment variable.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PopgetterConfig {
  public static final String DEFAULT_BASE_PATH =
      "https://popgetter.blob.core.windows.net/releases/v0.2";
  public static final String BASE_PATH_ENV = "POPGETTER_BASE_PATH";
  public static final String DEFAULT_GEO_ID_COLUMN = "GEO_ID";
  public static final String DEFAULT_GEOMETRY_COLUMN = "geometry";
  public static final int DEFAULT_IO_THREADS = 8;

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  /** How metric columns are fetched. */
  public enum MetricEngine {
    /** Read parquet files directly and join in memory. */
    PARQUET,
    /** Run the generated SQL through an embedded DuckDB. */
    DUCKDB
  }

  private final String basePath;
  private final @Nullable String cacheDirectory;
  private final int ioThreads;
  private final MetricEngine metricEngine;
  private final String geoIdColumn;
  private final String geometryColumn;

  @JsonCreator
  public PopgetterConfig(
      @JsonProperty("basePath") @Nullable String basePath,
      @JsonProperty("cacheDirectory") @Nullable String cacheDirectory,
      @JsonProperty("ioThreads") @Nullable Integer ioThreads,
      @JsonProperty("metricEngine") @Nullable MetricEngine metricEngine,
      @JsonProperty("geoIdColumn") @Nullable String geoIdColumn,
      @JsonProperty("geometryColumn") @Nullable String geometryColumn) {
    this.basePath = stripTrailingSlash(basePath != null ? basePath : defaultBasePath(System.getenv()));
    this.cacheDirectory = cacheDirectory;
    this.ioThreads = ioThreads != null ? ioThreads : DEFAULT_IO_THREADS;
    if (this.ioThreads < 1) {
      throw new IllegalArgumentException("ioThreads must be positive: " + this.ioThreads);
    }
    this.metricEngine = metricEngine != null ? metricEngine : MetricEngine.PARQUET;
    this.geoIdColumn = geoIdColumn != null ? geoIdColumn : DEFAULT_GEO_ID_COLUMN;
    this.geometryColumn = geometryColumn != null ? geometryColumn : DEFAULT_GEOMETRY_COLUMN;
  }

  public static PopgetterConfig defaults() {
    return new PopgetterConfig(null, null, null, null, null, null);
  }

  public static PopgetterConfig forBasePath(String basePath) {
    return new PopgetterConfig(basePath, null, null, null, null, null);
  }

  static String defaultBasePath(Map<String, String> env) {
    String fromEnv = env.get(BASE_PATH_ENV);
    return fromEnv != null && !fromEnv.trim().isEmpty() ? fromEnv.trim() : DEFAULT_BASE_PATH;
  }

  public static PopgetterConfig fromJson(Path file) {
    try {
      return MAPPER.readValue(file.toFile(), PopgetterConfig.class);
    } catch (IOException e) {
      throw new PopgetterException("Cannot read configuration " + file + ": " + e.getMessage(), e);
    }
  }

  public static PopgetterConfig fromJson(String json) {
    try {
      return MAPPER.readValue(json, PopgetterConfig.class);
    } catch (IOException e) {
      throw new PopgetterException("Invalid configuration: " + e.getMessage(), e);
    }
  }

  /**
   * Builds a configuration from a Calcite model operand. Keys match the JSON
   * property names; the engine name is case-insensitive.
   */
  public static PopgetterConfig fromOperand(Map<String, Object> operand) {
    Object engine = operand.get("metricEngine");
    Object threads = operand.get("ioThreads");
    return new PopgetterConfig(
        (String) operand.get("basePath"),
        (String) operand.get("cacheDirectory"),
        threads == null ? null : Integer.valueOf(threads.toString()),
        engine == null ? null : MetricEngine.valueOf(engine.toString().toUpperCase(Locale.ROOT)),
        (String) operand.get("geoIdColumn"),
        (String) operand.get("geometryColumn"));
  }

  @JsonProperty("basePath")
  public String getBasePath() {
    return basePath;
  }

  /**
   * Directory holding the metadata cache. Defaults to
   * {@code ~/.cache/popgetter/<release>} where the release is the last segment
   * of the base path.
   */
  public Path resolveCacheDirectory() {
    if (cacheDirectory != null) {
      return Paths.get(cacheDirectory);
    }
    String release = basePath.substring(basePath.lastIndexOf('/') + 1);
    if (release.isEmpty()) {
      release = "default";
    }
    return Paths.get(System.getProperty("user.home"), ".cache", "popgetter", release);
  }

  @JsonProperty("cacheDirectory")
  @Nullable String getConfiguredCacheDirectory() {
    return cacheDirectory;
  }

  @JsonProperty("ioThreads")
  public int getIoThreads() {
    return ioThreads;
  }

  @JsonProperty("metricEngine")
  public MetricEngine getMetricEngine() {
    return metricEngine;
  }

  @JsonProperty("geoIdColumn")
  public String getGeoIdColumn() {
    return geoIdColumn;
  }

  @JsonProperty("geometryColumn")
  public String getGeometryColumn() {
    return geometryColumn;
  }

  public PopgetterConfig withBasePath(String newBasePath) {
    return new PopgetterConfig(newBasePath, cacheDirectory, ioThreads, metricEngine,
        geoIdColumn, geometryColumn);
  }

  public PopgetterConfig withCacheDirectory(Path directory) {
    return new PopgetterConfig(basePath, directory.toString(), ioThreads, metricEngine,
        geoIdColumn, geometryColumn);
  }

  public PopgetterConfig withMetricEngine(MetricEngine engine) {
    return new PopgetterConfig(basePath, cacheDirectory, ioThreads, engine,
        geoIdColumn, geometryColumn);
  }

  private static String stripTrailingSlash(String path) {
    String p = path;
    while (p.length() > 1 && p.endsWith("/")) {
      p = p.substring(0, p.length() - 1);
    }
    return p;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PopgetterConfig)) {
      return false;
    }
    PopgetterConfig that = (PopgetterConfig) o;
    return ioThreads == that.ioThreads
        && basePath.equals(that.basePath)
        && Objects.equals(cacheDirectory, that.cacheDirectory)
        && metricEngine == that.metricEngine
        && geoIdColumn.equals(that.geoIdColumn)
        && geometryColumn.equals(that.geometryColumn);
  }

  @Override public int hashCode() {
    return Objects.hash(basePath, cacheDirectory, ioThreads, metricEngine, geoIdColumn,
        geometryColumn);
  }

  @Override public String toString() {
    return "PopgetterConfig{basePath=" + basePath
        + ", cacheDirectory=" + resolveCacheDirectory()
        + ", ioThreads=" + ioThreads
        + ", metricEngine=" + metricEngine + "}";
  }
}
