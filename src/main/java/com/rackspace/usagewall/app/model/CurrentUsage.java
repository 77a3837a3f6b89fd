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

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The latest usage of each group next to its capacity, for bar charts.
 */
@Data
public class CurrentUsage {
  String cluster;
  String grouping;
  Resource resource;
  List<Entry> entries;
  double totalCapacity;

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Entry {
    String group;
    /**
     * Display name, the configured nickname of the group if it has one.
     */
    String label;
    double used;
    double capacity;
  }
}
