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
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Value;

/**
 * Time-aligned values where every group has exactly one value per timestamp. The timestamps are
 * strictly increasing and index <code>i</code> of each group's values corresponds to
 * <code>timestamps[i]</code>.
 */
@Value
public class DenseMatrix {

  private static final DenseMatrix EMPTY = new DenseMatrix(List.of(), Map.of());

  List<Instant> timestamps;
  Map<String, List<Double>> values;

  public DenseMatrix(List<Instant> timestamps, Map<String, List<Double>> values) {
    this.timestamps = List.copyOf(timestamps);
    this.values = copyValues(values, this.timestamps.size());
  }

  public static DenseMatrix empty() {
    return EMPTY;
  }

  @JsonIgnore
  public boolean isEmpty() {
    return values.isEmpty();
  }

  public int size() {
    return timestamps.size();
  }

  public Set<String> groups() {
    return values.keySet();
  }

  public List<Double> valuesOf(String group) {
    return values.getOrDefault(group, List.of());
  }

  /**
   * @return the sum over all groups at the given timestamp index
   */
  public double columnSum(int index) {
    double sum = 0;
    for (List<Double> groupValues : values.values()) {
      sum += groupValues.get(index);
    }
    return sum;
  }

  /**
   * @return each group's value at the most recent timestamp, empty when there are no timestamps
   */
  public Map<String, Double> latest() {
    if (timestamps.isEmpty()) {
      return Map.of();
    }
    final int last = timestamps.size() - 1;
    final Map<String, Double> latest = new LinkedHashMap<>();
    values.forEach((group, groupValues) -> latest.put(group, groupValues.get(last)));
    return Collections.unmodifiableMap(latest);
  }

  static Map<String, List<Double>> copyValues(Map<String, List<Double>> values, int length) {
    final Map<String, List<Double>> copy = new LinkedHashMap<>();
    values.forEach((group, groupValues) -> {
      if (groupValues.size() != length) {
        throw new IllegalArgumentException(String.format(
            "Group %s has %d values but there are %d timestamps",
            group, groupValues.size(), length));
      }
      copy.put(group, List.copyOf(groupValues));
    });
    return Collections.unmodifiableMap(copy);
  }
}
