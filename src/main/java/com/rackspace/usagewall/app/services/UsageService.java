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

import com.rackspace.usagewall.app.config.AppProperties;
import com.rackspace.usagewall.app.config.PresentationProperties;
import com.rackspace.usagewall.app.matrix.SeriesAligner;
import com.rackspace.usagewall.app.matrix.SignificanceBucketer;
import com.rackspace.usagewall.app.model.BucketedMatrix;
import com.rackspace.usagewall.app.model.CapacityRecord;
import com.rackspace.usagewall.app.model.CapacitySnapshot;
import com.rackspace.usagewall.app.model.CurrentUsage;
import com.rackspace.usagewall.app.model.DenseMatrix;
import com.rackspace.usagewall.app.model.QueryWindow;
import com.rackspace.usagewall.app.model.Resource;
import com.rackspace.usagewall.app.model.SeriesSet;
import com.rackspace.usagewall.app.model.StackedUsage;
import com.rackspace.usagewall.app.presentation.ColorPalette;
import com.rackspace.usagewall.app.utils.DateTimeUtils;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Builds the usage views of a cluster from Prometheus queries.
 */
@Service
@Slf4j
public class UsageService {

  private final PrometheusClient prometheusClient;
  private final PromQueries promQueries;
  private final AppProperties appProperties;
  private final PresentationProperties presentationProperties;

  @Autowired
  public UsageService(PrometheusClient prometheusClient, PromQueries promQueries,
                      AppProperties appProperties,
                      PresentationProperties presentationProperties) {
    this.prometheusClient = prometheusClient;
    this.promQueries = promQueries;
    this.appProperties = appProperties;
    this.presentationProperties = presentationProperties;
  }

  /**
   * @return usage of the resource by each value of the grouping label, aligned onto one time grid
   */
  public Mono<DenseMatrix> usageBy(String cluster, String grouping, Resource resource,
                                   QueryWindow window) {
    return prometheusClient
        .queryRange(cluster, promQueries.usage(grouping, resource), window, grouping)
        .map(this::align);
  }

  public Mono<CapacityRecord> capacity(String cluster, Resource resource, String grouping,
                                       QueryWindow window) {
    return prometheusClient
        .queryRange(cluster, promQueries.capacity(grouping, resource), window, grouping)
        .map(this::align)
        .map(CapacityRecord::of);
  }

  /**
   * Usage over time with its capacity. When a threshold is given, or configured as the default,
   * the least significant groups are merged into "Others".
   */
  public Mono<StackedUsage> stackedUsage(String cluster, String grouping, Resource resource,
                                         QueryWindow window, Double threshold) {
    final Double effectiveThreshold =
        threshold != null ? threshold : appProperties.getStackedThreshold();
    return Mono.zip(
        usageBy(cluster, grouping, resource, window),
        capacity(cluster, resource, appProperties.getCapacityGrouping(), window)
    )
        .map(results -> {
          final DenseMatrix usage = results.getT1();
          final BucketedMatrix bucketed = effectiveThreshold != null ?
              SignificanceBucketer.bucket(usage, effectiveThreshold) :
              SignificanceBucketer.unbucketed(usage);
          if (bucketed.hasOthers()) {
            log.debug("Merged {} into Others for {} usage by {} on {}",
                bucketed.getMergedGroups(), resource, grouping, cluster);
          }
          return new StackedUsage()
              .setCluster(cluster)
              .setGrouping(grouping)
              .setResource(resource)
              .setThreshold(effectiveThreshold)
              .setUsage(bucketed)
              .setCapacity(results.getT2())
              .setColors(palette(bucketed.groups()).asMap());
        });
  }

  /**
   * Stacked usage of several clusters, queried in parallel and returned in the given order. The
   * views share one palette built from the union of their groups so that a group keeps its
   * color on every cluster.
   */
  public Mono<List<StackedUsage>> stackedUsage(List<String> clusters, String grouping,
                                               Resource resource, QueryWindow window,
                                               Double threshold) {
    return Flux.fromIterable(clusters)
        .flatMapSequential(cluster ->
            stackedUsage(cluster, grouping, resource, window, threshold))
        .collectList()
        .map(views -> {
          final Set<String> groups = new LinkedHashSet<>();
          views.forEach(view -> groups.addAll(view.getUsage().groups()));
          final Map<String, String> colors = palette(groups).asMap();
          views.forEach(view -> view.setColors(colors));
          return views;
        });
  }

  /**
   * The latest usage of each group next to its capacity. Without a window the values come from
   * instant queries at the current time, otherwise from the last timestamp of range queries.
   * Groups without capacity and hidden groups are left out and the rest are sorted by name.
   */
  public Mono<CurrentUsage> currentUsage(String cluster, String grouping, Resource resource,
                                         QueryWindow window) {
    if (window == null) {
      return currentUsageAt(cluster, grouping, resource,
          DateTimeUtils.normalizedNow(appProperties.getNowResolution()));
    }
    return current(cluster, grouping, resource,
        usageBy(cluster, grouping, resource, window).map(DenseMatrix::latest),
        capacity(cluster, resource, grouping, window).map(CapacityRecord::latest));
  }

  /**
   * Like {@link #currentUsage(String, String, Resource, QueryWindow)} from instant queries
   * evaluated at the given time.
   */
  public Mono<CurrentUsage> currentUsageAt(String cluster, String grouping, Resource resource,
                                           Instant time) {
    return current(cluster, grouping, resource,
        prometheusClient
            .queryInstant(cluster, promQueries.usage(grouping, resource), time, grouping)
            .map(seriesSet -> align(seriesSet).latest()),
        prometheusClient
            .queryInstant(cluster, promQueries.capacity(grouping, resource), time, grouping)
            .map(seriesSet -> CapacityRecord.of(align(seriesSet)).latest()));
  }

  private Mono<CurrentUsage> current(String cluster, String grouping, Resource resource,
                                     Mono<Map<String, Double>> used,
                                     Mono<CapacitySnapshot> capacity) {
    return Mono.zip(used, capacity)
        .map(results -> new CurrentUsage()
            .setCluster(cluster)
            .setGrouping(grouping)
            .setResource(resource)
            .setEntries(currentEntries(results.getT1(), results.getT2(), resource))
            .setTotalCapacity(results.getT2().getTotal()));
  }

  private List<CurrentUsage.Entry> currentEntries(Map<String, Double> used,
                                                  CapacitySnapshot capacity, Resource resource) {
    final Set<String> hidden = presentationProperties.hiddenFor(resource);
    final List<CurrentUsage.Entry> entries = new ArrayList<>();
    new TreeMap<>(used).forEach((group, value) -> {
      final double groupCapacity = capacity.capacityOf(group);
      if (groupCapacity > 0 && !hidden.contains(group)) {
        entries.add(new CurrentUsage.Entry(
            group, presentationProperties.labelOf(group), value, groupCapacity));
      }
    });
    return entries;
  }

  private DenseMatrix align(SeriesSet seriesSet) {
    return SeriesAligner.align(seriesSet, appProperties.getFillValue());
  }

  private ColorPalette palette(Set<String> groups) {
    return ColorPalette.assign(groups,
        presentationProperties.getFixedColors(),
        presentationProperties.getFallbackColors(),
        presentationProperties.getOthersColor());
  }
}
