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

package com.rackspace.usagewall.app.web;

import com.rackspace.usagewall.app.config.AppProperties;
import com.rackspace.usagewall.app.model.CurrentUsage;
import com.rackspace.usagewall.app.model.QueryWindow;
import com.rackspace.usagewall.app.model.Resource;
import com.rackspace.usagewall.app.model.StackedUsage;
import com.rackspace.usagewall.app.services.UsageService;
import com.rackspace.usagewall.app.utils.DateTimeUtils;
import com.rackspace.usagewall.app.validation.RequestValidator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Usage views of a cluster.
 */
@RestController
@RequestMapping("/api/usage")
public class UsageController {

  private final UsageService usageService;
  private final AppProperties appProperties;
  private final Counter stackedQueryCounter;
  private final Counter currentQueryCounter;

  @Autowired
  public UsageController(UsageService usageService, AppProperties appProperties,
                         MeterRegistry meterRegistry) {
    this.usageService = usageService;
    this.appProperties = appProperties;
    stackedQueryCounter = meterRegistry.counter("usagewall.query", "type", "stacked");
    currentQueryCounter = meterRegistry.counter("usagewall.query", "type", "current");
  }

  /**
   * Usage over time by grouping, for stacked area charts. The <code>threshold</code> is the
   * share of the whole range's total under which the smallest groups are merged into "Others".
   */
  @GetMapping("/{cluster}/stacked")
  public Mono<StackedUsage> stacked(
      @PathVariable String cluster,
      @RequestParam(defaultValue = "account") String grouping,
      @RequestParam(defaultValue = "cpus") Resource resource,
      @RequestParam(required = false) String start,
      @RequestParam(required = false) String end,
      @RequestParam(required = false) String step,
      @RequestParam(required = false) Double threshold) {
    RequestValidator.validateCluster(cluster, appProperties);
    RequestValidator.validateGroupingLabel(grouping);
    RequestValidator.validateThreshold(threshold);
    stackedQueryCounter.increment();
    return usageService.stackedUsage(cluster, grouping, resource,
        window(start, end, step), threshold);
  }

  /**
   * Stacked usage of several clusters shown side by side. All views share one color palette so
   * a group keeps its color across clusters.
   */
  @GetMapping("/stacked")
  public Mono<List<StackedUsage>> stackedAcrossClusters(
      @RequestParam List<String> cluster,
      @RequestParam(defaultValue = "account") String grouping,
      @RequestParam(defaultValue = "cpus") Resource resource,
      @RequestParam(required = false) String start,
      @RequestParam(required = false) String end,
      @RequestParam(required = false) String step,
      @RequestParam(required = false) Double threshold) {
    cluster.forEach(name -> RequestValidator.validateCluster(name, appProperties));
    RequestValidator.validateGroupingLabel(grouping);
    RequestValidator.validateThreshold(threshold);
    stackedQueryCounter.increment();
    return usageService.stackedUsage(cluster, grouping, resource,
        window(start, end, step), threshold);
  }

  /**
   * The latest usage by grouping next to capacity, for bar charts. Without a <code>start</code>
   * the values come from instant queries at <code>end</code>, or now when that is not given
   * either. A <code>step</code> only applies to a window and is rejected without a start.
   */
  @GetMapping("/{cluster}/current")
  public Mono<CurrentUsage> current(
      @PathVariable String cluster,
      @RequestParam(defaultValue = "nodes") String grouping,
      @RequestParam(defaultValue = "cpus") Resource resource,
      @RequestParam(required = false) String start,
      @RequestParam(required = false) String end,
      @RequestParam(required = false) String step) {
    RequestValidator.validateCluster(cluster, appProperties);
    RequestValidator.validateGroupingLabel(grouping);
    if (StringUtils.isBlank(start) && StringUtils.isNotBlank(step)) {
      throw new IllegalArgumentException("step requires start");
    }
    currentQueryCounter.increment();
    if (StringUtils.isNotBlank(start)) {
      return usageService.currentUsage(cluster, grouping, resource, window(start, end, step));
    }
    return StringUtils.isBlank(end) ?
        usageService.currentUsage(cluster, grouping, resource, null) :
        usageService.currentUsageAt(cluster, grouping, resource, DateTimeUtils.parseInstant(end));
  }

  private QueryWindow window(String start, String end, String step) {
    return DateTimeUtils.resolveWindow(start, end, step,
        appProperties.getDefaultLookback(), appProperties.getDefaultStep(),
        appProperties.getNowResolution());
  }
}
