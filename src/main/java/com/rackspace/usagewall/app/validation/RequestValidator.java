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

package com.rackspace.usagewall.app.validation;

import com.rackspace.usagewall.app.config.AppProperties;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

public class RequestValidator {

  private static final Pattern LABEL_NAME = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

  private RequestValidator() {
  }

  /**
   * Grouping labels are placed into PromQL verbatim, so only valid label names are accepted.
   */
  public static void validateGroupingLabel(String grouping) {
    if (!StringUtils.hasText(grouping) || !LABEL_NAME.matcher(grouping).matches()) {
      throw new IllegalArgumentException("grouping must be a valid label name: " + grouping);
    }
  }

  public static void validateCluster(String cluster, AppProperties appProperties) {
    if (appProperties.clusterUrl(cluster).isEmpty()) {
      throw new IllegalArgumentException("Unknown cluster: " + cluster);
    }
  }

  public static void validateThreshold(Double threshold) {
    if (threshold != null && !(threshold > 0 && threshold < 1)) {
      throw new IllegalArgumentException("threshold must be between 0 and 1 exclusive");
    }
  }
}
