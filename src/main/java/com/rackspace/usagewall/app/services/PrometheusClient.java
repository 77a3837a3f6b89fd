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
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.rackspace.usagewall.app.config.AppProperties;
import com.rackspace.usagewall.app.model.PrometheusCacheKey;
import com.rackspace.usagewall.app.model.QueryWindow;
import com.rackspace.usagewall.app.model.SeriesSet;
import com.rackspace.usagewall.app.utils.DateTimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.URI;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

/**
 * Fetches grouped series from the Prometheus HTTP API of a cluster.
 * <p>
 * Failures never propagate: an unknown cluster, an unreachable server, an error response or an
 * unparseable body are logged, counted and reported as an empty {@link SeriesSet}, which callers
 * treat as "no data".
 * </p>
 */
@Service
@Slf4j
public class PrometheusClient {

  static final String QUERY_RANGE_PATH = "/api/v1/query_range";
  static final String QUERY_PATH = "/api/v1/query";

  private final WebClient webClient;
  private final AppProperties appProperties;
  private final AsyncCache<PrometheusCacheKey, SeriesSet> resultCache;
  private final MeterRegistry meterRegistry;

  @Autowired
  public PrometheusClient(@Qualifier("prometheusWebClient") WebClient webClient,
                          AppProperties appProperties,
                          AsyncCache<PrometheusCacheKey, SeriesSet> prometheusResultCache,
                          MeterRegistry meterRegistry) {
    this.webClient = webClient;
    this.appProperties = appProperties;
    this.resultCache = prometheusResultCache;
    this.meterRegistry = meterRegistry;
  }

  public Mono<SeriesSet> queryRange(String cluster, String query, QueryWindow window,
                                    String groupLabel) {
    final Map<String, String> params = new LinkedHashMap<>();
    params.put("query", query);
    params.put("start", DateTimeUtils.toEpochSeconds(window.getStart()));
    params.put("end", DateTimeUtils.toEpochSeconds(window.getEnd()));
    params.put("step", DateTimeUtils.toSeconds(window.getStep()));
    return cached(
        new PrometheusCacheKey(cluster, query, groupLabel, window.getStart(), window.getEnd(),
            window.getStep()),
        QUERY_RANGE_PATH, params);
  }

  public Mono<SeriesSet> queryInstant(String cluster, String query, Instant time,
                                      String groupLabel) {
    final Map<String, String> params = new LinkedHashMap<>();
    params.put("query", query);
    params.put("time", DateTimeUtils.toEpochSeconds(time));
    return cached(new PrometheusCacheKey(cluster, query, groupLabel, time, time, null),
        QUERY_PATH, params);
  }

  private Mono<SeriesSet> cached(PrometheusCacheKey key, String path, Map<String, String> params) {
    return Mono.fromFuture(() -> resultCache.get(key, (k, executor) ->
            fetch(k, path, params).toFuture()))
        .onErrorResume(e -> {
          meterRegistry.counter("usagewall.prometheus.errors", "cluster", key.getCluster())
              .increment();
          log.warn("Prometheus query on cluster {} failed, treating as no data: {} [{}]",
              key.getCluster(), e.getMessage(), key.getQuery());
          return Mono.just(SeriesSet.empty());
        });
  }

  private Mono<SeriesSet> fetch(PrometheusCacheKey key, String path, Map<String, String> params) {
    final String baseUrl = appProperties.clusterUrl(key.getCluster())
        .orElse(null);
    if (baseUrl == null) {
      return Mono.error(new IllegalArgumentException("Unknown cluster " + key.getCluster()));
    }
    final UriComponentsBuilder uriBuilder = UriComponentsBuilder.fromHttpUrl(baseUrl)
        .path(path);
    params.keySet().forEach(name -> uriBuilder.queryParam(name, "{" + name + "}"));
    final URI uri = uriBuilder.encode().buildAndExpand(params).toUri();

    log.debug("Querying {}", uri);
    return webClient.get()
        .uri(uri)
        .retrieve()
        .bodyToMono(JsonNode.class)
        .timeout(appProperties.getQueryTimeout())
        .retryWhen(appProperties.getRetryQuery().build()
            .filter(PrometheusClient::isTransient))
        .map(body -> PrometheusResponseParser.parse(body, key.getGroupLabel()))
        .doOnNext(seriesSet -> log.debug("Query on cluster {} returned {} groups",
            key.getCluster(), seriesSet.getSeries().size()));
  }

  static boolean isTransient(Throwable e) {
    if (e instanceof WebClientResponseException) {
      return ((WebClientResponseException) e).getStatusCode().is5xxServerError();
    }
    return e instanceof WebClientRequestException || e instanceof TimeoutException;
  }
}
