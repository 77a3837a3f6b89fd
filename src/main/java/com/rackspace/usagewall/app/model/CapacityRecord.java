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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.rackspace.usagewall.app.matrix.ReservedGroupNameException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Value;

/**
 * Available capacity over time, per group, along with the {@value #TOTAL} across all groups at
 * each timestamp.
 */
@Value
public class CapacityRecord {

  public static final String TOTAL = "total";

  private static final CapacityRecord EMPTY = new CapacityRecord(List.of(), Map.of(), List.of());

  List<Instant> timestamps;
  Map<String, List<Double>> groups;
  List<Double> total;

  private CapacityRecord(List<Instant> timestamps, Map<String, List<Double>> groups,
                         List<Double> total) {
    this.timestamps = timestamps;
    this.groups = groups;
    this.total = total;
  }

  public static CapacityRecord empty() {
    return EMPTY;
  }

  /**
   * Builds a record from aligned capacity values, summing the groups at each timestamp.
   *
   * @throws ReservedGroupNameException if a group is named {@value #TOTAL}
   */
  public static CapacityRecord of(DenseMatrix capacity) {
    if (capacity.isEmpty()) {
      return EMPTY;
    }
    if (capacity.groups().contains(TOTAL)) {
      throw new ReservedGroupNameException(TOTAL, "capacity record");
    }
    final List<Double> total = new ArrayList<>(capacity.size());
    for (int i = 0; i < capacity.size(); i++) {
      total.add(capacity.columnSum(i));
    }
    return new CapacityRecord(capacity.getTimestamps(), capacity.getValues(), List.copyOf(total));
  }

  @JsonIgnore
  public boolean isEmpty() {
    return groups.isEmpty();
  }

  /**
   * Reduces the record to the values at its most recent timestamp.
   */
  public CapacitySnapshot latest() {
    if (timestamps.isEmpty()) {
      return CapacitySnapshot.empty();
    }
    final int last = timestamps.size() - 1;
    final Map<String, Double> latest = new LinkedHashMap<>();
    groups.forEach((group, values) -> latest.put(group, values.get(last)));
    return CapacitySnapshot.of(latest);
  }
}
