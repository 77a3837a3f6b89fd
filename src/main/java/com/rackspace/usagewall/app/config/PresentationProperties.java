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

import com.rackspace.usagewall.app.model.Resource;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Display settings handed to whatever renders the usage views.
 */
@ConfigurationProperties("usagewall.presentation")
@Component
@Data
@Validated
public class PresentationProperties {

  /**
   * Colors that always go to the same group, keyed by lower-case group name.
   */
  @NotNull
  Map<String, String> fixedColors = new LinkedHashMap<>();

  /**
   * Colors cycled through for groups without a fixed color. Defaults to the tab10 palette.
   */
  @NotEmpty
  List<String> fallbackColors = List.of(
      "#1f77b4", "#ff7f0e", "#2ca02c", "#d62728", "#9467bd",
      "#8c564b", "#e377c2", "#7f7f7f", "#bcbd22", "#17becf");

  /**
   * Color of the merged "Others" group when it has no fixed color.
   */
  @NotNull
  String othersColor = "#c7c7c7";

  /**
   * Groups left out of current usage views, per resource.
   */
  @NotNull
  Map<Resource, Set<String>> hidden = new LinkedHashMap<>();

  /**
   * Shorter display names for long group names.
   */
  @NotNull
  Map<String, String> nicknames = new LinkedHashMap<>();

  public Set<String> hiddenFor(Resource resource) {
    return hidden.getOrDefault(resource, Set.of());
  }

  public String labelOf(String group) {
    return nicknames.getOrDefault(group, group);
  }
}
