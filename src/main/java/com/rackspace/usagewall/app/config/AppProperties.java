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

package com.rackspace.usagewall.app.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import javax.validation.Valid;
import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("usagewall")
@Component
@Data
@Validated
public class AppProperties {

  /**
   * Base URL of the Prometheus server of each cluster, keyed by cluster name.
   * For example: <code>rusty: http://prometheus.example.org:80</code>
   */
  @NotNull
  Map<String, String> clusters = new LinkedHashMap<>();

  /**
   * PromQL for usage by a grouping label. The placeholders <code>{grouping}</code> and
   * <code>{resource}</code> are replaced before the query is sent.
   */
  @NotBlank
  String usageQueryTemplate =
      "sum by({grouping}) (slurm_job_{resource}{state=\"running\",job=\"slurm\"})";

  /**
   * PromQL for the available capacity by a grouping label, excluding drained and down nodes.
   */
  @NotBlank
  String capacityQueryTemplate =
      "sum by({grouping}) (slurm_node_{resource}{state!=\"drain\",state!=\"down\"})";

  /**
   * The label that capacity is grouped by for stacked usage views, where only its total is drawn.
   */
  @NotBlank
  String capacityGrouping = "nodes";

  /**
   * How far back range queries look when no start is given.
   */
  @NotNull
  Duration defaultLookback = Duration.ofDays(7);

  /**
   * Resolution of range queries when no step is given.
   */
  @NotNull
  Duration defaultStep = Duration.ofHours(1);

  /**
   * When a request leaves the end of its window open, "now" is truncated to this resolution so
   * that refreshes close together share cached query results.
   */
  @NotNull
  Duration nowResolution = Duration.ofMinutes(1);

  /**
   * Value used for a group that has no sample at one of the aligned timestamps.
   */
  double fillValue = 0;

  /**
   * Share of the grand total below which the smallest groups of a stacked view are merged into
   * "Others". Leave unset to disable bucketing unless a request asks for it.
   */
  @DecimalMin(value = "0", inclusive = false)
  @DecimalMax(value = "1", inclusive = false)
  Double stackedThreshold;

  @NotNull
  Duration queryTimeout = Duration.ofSeconds(30);

  /**
   * Largest Prometheus response body that will be buffered.
   */
  @Min(1024)
  int maxResponseBytes = 16 * 1024 * 1024;

  /**
   * Skips TLS certificate verification when talking to Prometheus over https.
   */
  boolean insecureSkipTlsVerify = false;

  /**
   * How long query results are reused across requests. Zero disables reuse.
   */
  @NotNull
  Duration queryCacheTtl = Duration.ofMinutes(1);

  @Min(0)
  long queryCacheSize = 500;

  @NotNull
  @Valid
  RetrySpec retryQuery = new RetrySpec()
      .setMaxAttempts(3)
      .setMinBackoff(Duration.ofMillis(200));

  /**
   * @return the Prometheus URL of the cluster, matching the name case-insensitively
   */
  public Optional<String> clusterUrl(String cluster) {
    if (cluster == null) {
      return Optional.empty();
    }
    final String url = clusters.get(cluster);
    if (url != null) {
      return Optional.of(url);
    }
    return clusters.entrySet().stream()
        .filter(entry -> entry.getKey().toLowerCase(Locale.ROOT)
            .equals(cluster.toLowerCase(Locale.ROOT)))
        .map(Map.Entry::getValue)
        .findFirst();
  }
}
