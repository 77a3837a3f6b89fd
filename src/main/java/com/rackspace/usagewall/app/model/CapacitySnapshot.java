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

import com.rackspace.usagewall.app.matrix.ReservedGroupNameException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Value;

/**
 * Capacity per group at a single instant.
 */
@Value
public class CapacitySnapshot {

  private static final CapacitySnapshot EMPTY = new CapacitySnapshot(Map.of(), 0);

  Map<String, Double> groups;
  double total;

  private CapacitySnapshot(Map<String, Double> groups, double total) {
    this.groups = groups;
    this.total = total;
  }

  public static CapacitySnapshot empty() {
    return EMPTY;
  }

  public static CapacitySnapshot of(Map<String, Double> groups) {
    if (groups.containsKey(CapacityRecord.TOTAL)) {
      throw new ReservedGroupNameException(CapacityRecord.TOTAL, "capacity snapshot");
    }
    double total = 0;
    for (Double value : groups.values()) {
      total += value;
    }
    return new CapacitySnapshot(Collections.unmodifiableMap(new LinkedHashMap<>(groups)), total);
  }

  /**
   * @return the capacity of the group or zero when the group reports none
   */
  public double capacityOf(String group) {
    return groups.getOrDefault(group, 0.0);
  }
}
