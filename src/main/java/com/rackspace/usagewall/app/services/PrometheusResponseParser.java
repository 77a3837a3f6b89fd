/*
 * Copyright 2023 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.usagewall.app.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.rackspace.usagewall.app.model.SeriesSet;
import com.rackspace.usagewall.app.utils.DateTimeUtils;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;

/**
 * Converts the JSON body of the Prometheus HTTP query API into a {@link SeriesSet}.
 * <p>
 * See <a href="https://prometheus.io/docs/prometheus/latest/querying/api/#expression-query-result-formats">
 * expression query result formats</a>.
 * </p>
 */
@Slf4j
public class PrometheusResponseParser {

  static final String STATUS_SUCCESS = "success";
  static final String RESULT_MATRIX = "matrix";
  static final String RESULT_VECTOR = "vector";

  private PrometheusResponseParser() {
  }

  /**
   * @param groupLabel the metric label whose value names each series' group, series without it
   *                   are skipped
   * @throws IllegalStateException when Prometheus reports that the query failed
   * @throws IllegalArgumentException when the body is not a query response
   */
  public static SeriesSet parse(JsonNode body, String groupLabel) {
    if (body == null || !body.isObject()) {
      throw new IllegalArgumentException("Response body is not a JSON object");
    }
    final String status = body.path("status").asText();
    if (!STATUS_SUCCESS.equals(status)) {
      throw new IllegalStateException(String.format("Query failed with status '%s': %s %s",
          status, body.path("errorType").asText(), body.path("error").asText()));
    }

    final JsonNode data = body.path("data");
    final String resultType = data.path("resultType").asText();
    final JsonNode result = data.path("result");
    if (!result.isArray()) {
      throw new IllegalArgumentException("Response has no result array");
    }

    final SeriesSet.Builder builder = SeriesSet.builder();
    for (JsonNode series : result) {
      final JsonNode label = series.path("metric").path(groupLabel);
      if (!label.isTextual()) {
        log.debug("Skipping series without label {}: {}", groupLabel, series.path("metric"));
        continue;
      }
      final String group = label.asText();
      builder.group(group);
      if (RESULT_MATRIX.equals(resultType)) {
        for (JsonNode point : series.path("values")) {
          addPoint(builder, group, point);
        }
      } else if (RESULT_VECTOR.equals(resultType)) {
        addPoint(builder, group, series.path("value"));
      } else {
        throw new IllegalArgumentException("Unsupported result type: " + resultType);
      }
    }
    return builder.build();
  }

  private static void addPoint(SeriesSet.Builder builder, String group, JsonNode point) {
    if (!point.isArray() || point.size() != 2 || !point.get(0).isNumber()) {
      throw new IllegalArgumentException("Malformed sample for group " + group + ": " + point);
    }
    final Instant timestamp = DateTimeUtils.fromEpochSeconds(point.get(0).decimalValue());
    builder.sample(group, timestamp, parseValue(point.get(1).asText()));
  }

  /**
   * Sample values are strings so that the special float values survive JSON.
   */
  static double parseValue(String value) {
    switch (value) {
      case "+Inf":
        return Double.POSITIVE_INFINITY;
      case "-Inf":
        return Double.NEGATIVE_INFINITY;
      case "NaN":
        return Double.NaN;
      default:
        try {
          return new BigDecimal(value).doubleValue();
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("Malformed sample value: " + value, e);
        }
    }
  }
}
