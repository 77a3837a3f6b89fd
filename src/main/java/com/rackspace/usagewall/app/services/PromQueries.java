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
import com.rackspace.usagewall.app.model.Resource;
import com.rackspace.usagewall.app.validation.RequestValidator;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Renders the configured PromQL templates.
 */
@Component
public class PromQueries {

  static final String GROUPING_PLACEHOLDER = "{grouping}";
  static final String RESOURCE_PLACEHOLDER = "{resource}";

  private final AppProperties appProperties;

  @Autowired
  public PromQueries(AppProperties appProperties) {
    this.appProperties = appProperties;
  }

  public String usage(String grouping, Resource resource) {
    return render(appProperties.getUsageQueryTemplate(), grouping, resource);
  }

  public String capacity(String grouping, Resource resource) {
    return render(appProperties.getCapacityQueryTemplate(), grouping, resource);
  }

  private static String render(String template, String grouping, Resource resource) {
    RequestValidator.validateGroupingLabel(grouping);
    return StringUtils.replaceEach(template,
        new String[]{GROUPING_PLACEHOLDER, RESOURCE_PLACEHOLDER},
        new String[]{grouping, resource.name()});
  }
}
