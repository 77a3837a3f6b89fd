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

package com.rackspace.usagewall.app.model;

import java.util.Map;
import lombok.Data;

/**
 * Usage over time ready to be drawn as a stacked area chart with a capacity line on top.
 */
@Data
public class StackedUsage {
  String cluster;
  String grouping;
  Resource resource;
  /**
   * The significance threshold that was applied, null when groups were not bucketed.
   */
  Double threshold;
  BucketedMatrix usage;
  CapacityRecord capacity;
  Map<String, String> colors;
}
