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
import com.rackspace.usagewall.app.model.CapacityRecord;
import com.rackspace.usagewall.app.model.Resource;
import com.rackspace.usagewall.app.services.UsageService;
import com.rackspace.usagewall.app.utils.DateTimeUtils;
import com.rackspace.usagewall.app.validation.RequestValidator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/capacity")
public class CapacityController {

  private final UsageService usageService;
  private final AppProperties appProperties;
  private final Counter capacityQueryCounter;

  @Autowired
  public CapacityController(UsageService usageService, AppProperties appProperties,
                            MeterRegistry meterRegistry) {
    this.usageService = usageService;
    this.appProperties = appProperties;
    capacityQueryCounter = meterRegistry.counter("usagewall.query", "type", "capacity");
  }

  @GetMapping("/{cluster}")
  public Mono<CapacityRecord> capacity(
      @PathVariable String cluster,
      @RequestParam(defaultValue = "cpus") Resource resource,
      @RequestParam(required = false) String grouping,
      @RequestParam(required = false) String start,
      @RequestParam(required = false) String end,
      @RequestParam(required = false) String step) {
    RequestValidator.validateCluster(cluster, appProperties);
    final String capacityGrouping =
        grouping != null ? grouping : appProperties.getCapacityGrouping();
    RequestValidator.validateGroupingLabel(capacityGrouping);
    capacityQueryCounter.increment();
    return usageService.capacity(cluster, resource, capacityGrouping,
        DateTimeUtils.resolveWindow(start, end, step,
            appProperties.getDefaultLookback(), appProperties.getDefaultStep(),
            appProperties.getNowResolution()));
  }
}
