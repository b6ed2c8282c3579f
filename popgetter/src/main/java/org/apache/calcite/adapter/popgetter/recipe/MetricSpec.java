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
import org.apache.calcite.adapter.popgetter.search.CaseSensitivity;
import org.apache.calcite.adapter.popgetter.search.MatchType;
import org.apache.calcite.adapter.popgetter.search.MetricId;
import org.apache.calcite.adapter.popgetter.search.SearchConfig;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of a recipe's metric list. In JSON each entry is an object with a
 * single key naming the variant:
 *
 * <pre>{@code
 * {"MetricId": {"id": "f29c1976", "config": {"match_type": "Exact"}}}
 * {"MetricText": "population"}
 * {"DataProduct": "census_2021"}
 * }</pre>
 */
public abstract class MetricSpec {
  private MetricSpec() {
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static MetricSpec fromJson(JsonNode node) {
    if (!node.isObject() || node.size() != 1) {
      throw new SearchValidationException("Metric entry must be an object with one key: " + node);
    }
    Map.Entry<String, JsonNode> entry = node.fields().next();
    JsonNode value = entry.getValue();
    switch (entry.getKey()) {
      case "MetricId":
        return new ById(metricId(value));
      case "MetricText":
        return new ByText(text(entry.getKey(), value));
      case "DataProduct":
        return new DataProduct(text(entry.getKey(), value));
      default:
        throw new SearchValidationException("Unknown metric entry '" + entry.getKey() + "'");
    }
  }

  private static String text(String kind, JsonNode value) {
    if (!value.isTextual()) {
      throw new SearchValidationException(kind + " must be a string: " + value);
    }
    return value.asText();
  }

  private static MetricId metricId(JsonNode value) {
    if (value.isTextual()) {
      return MetricId.of(value.asText());
    }
    JsonNode id = value.get("id");
    if (id == null || !id.isTextual()) {
      throw new SearchValidationException("MetricId needs a string 'id': " + value);
    }
    JsonNode config = value.get("config");
    if (config == null || config.isNull()) {
      return MetricId.of(id.asText());
    }
    MatchType matchType = SearchConfig.STARTS_WITH_INSENSITIVE.matchType();
    CaseSensitivity sensitivity = SearchConfig.STARTS_WITH_INSENSITIVE.caseSensitivity();
    try {
      for (Iterator<Map.Entry<String, JsonNode>> it = config.fields(); it.hasNext();) {
        Map.Entry<String, JsonNode> field = it.next();
        switch (field.getKey()) {
          case "match_type":
          case "matchType":
            matchType = MatchType.parse(field.getValue().asText());
            break;
          case "case_sensitivity":
          case "caseSensitivity":
            sensitivity = CaseSensitivity.parse(field.getValue().asText());
            break;
          default:
            throw new SearchValidationException("Unknown MetricId config key '" + field.getKey()
                + "'");
        }
      }
    } catch (IllegalArgumentException e) {
      throw new SearchValidationException(e.getMessage(), e);
    }
    return new MetricId(id.asText(), new SearchConfig(matchType, sensitivity));
  }

  /** Metrics whose id matches. */
  public static final class ById extends MetricSpec {
    private final MetricId metricId;

    public ById(MetricId metricId) {
      this.metricId = Objects.requireNonNull(metricId, "metricId");
    }

    public MetricId metricId() {
      return metricId;
    }

    @Override public boolean equals(Object o) {
      return o instanceof ById && metricId.equals(((ById) o).metricId);
    }

    @Override public int hashCode() {
      return metricId.hashCode();
    }

    @Override public String toString() {
      return "MetricId(" + metricId + ")";
    }
  }

  /** Metrics whose name, HXL tag or description matches the text. */
  public static final class ByText extends MetricSpec {
    private final String text;

    public ByText(String text) {
      this.text = Objects.requireNonNull(text, "text");
    }

    public String text() {
      return text;
    }

    @Override public boolean equals(Object o) {
      return o instanceof ByText && text.equals(((ByText) o).text);
    }

    @Override public int hashCode() {
      return text.hashCode();
    }

    @Override public String toString() {
      return "MetricText(" + text + ")";
    }
  }

  /** A named bundle of metrics. Parsed but not resolvable. */
  public static final class DataProduct extends MetricSpec {
    private final String name;

    public DataProduct(String name) {
      this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
      return name;
    }

    @Override public boolean equals(Object o) {
      return o instanceof DataProduct && name.equals(((DataProduct) o).name);
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public String toString() {
      return "DataProduct(" + name + ")";
    }
  }
}
