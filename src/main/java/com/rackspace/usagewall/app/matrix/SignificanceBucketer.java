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

package com.rackspace.usagewall.app.matrix;

import static com.rackspace.usagewall.app.model.BucketedMatrix.OTHERS;

import com.rackspace.usagewall.app.model.BucketedMatrix;
import com.rackspace.usagewall.app.model.DenseMatrix;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * Merges groups that contribute little over a whole time range into a single {@value
 * BucketedMatrix#OTHERS} group while keeping the total at every timestamp unchanged.
 * <p>
 * Membership is decided once from each group's sum over the entire range so that a group does
 * not move in and out of the bucket from one timestamp to the next.
 * </p>
 */
@Slf4j
public class SignificanceBucketer {

  private static final Comparator<Entry<String, Double>> ASCENDING_MAGNITUDE =
      Entry.<String, Double>comparingByValue()
          .thenComparing(Entry.<String, Double>comparingByKey());

  private SignificanceBucketer() {
  }

  public static BucketedMatrix bucket(DenseMatrix matrix, double threshold) {
    final Set<String> smallGroups = selectSmallGroups(matrix.getValues(), threshold);
    return new BucketedMatrix(matrix.getTimestamps(),
        orderByLatest(merge(matrix.getValues(), smallGroups)), smallGroups);
  }

  /**
   * Variant of {@link #bucket(DenseMatrix, double)} for values that are not attached to
   * timestamps.
   *
   * @param valuesByGroup equal-length values per group
   * @return the groups in presentation order with the small ones merged
   */
  public static Map<String, List<Double>> bucket(Map<String, List<Double>> valuesByGroup,
                                                 double threshold) {
    return orderByLatest(merge(valuesByGroup, selectSmallGroups(valuesByGroup, threshold)));
  }

  /**
   * Wraps the matrix without merging any group, only applying the presentation order.
   */
  public static BucketedMatrix unbucketed(DenseMatrix matrix) {
    return new BucketedMatrix(matrix.getTimestamps(), orderByLatest(matrix.getValues()), Set.of());
  }

  /**
   * Walks the groups from smallest to largest total magnitude and collects them for as long as
   * their combined share of the grand total stays strictly below the threshold. Equal
   * magnitudes are taken in group name order.
   *
   * @param threshold a fraction in (0, 1)
   * @return the selected groups, empty when nothing qualifies or the grand total is not positive
   * @throws ReservedGroupNameException if a group is already named {@value BucketedMatrix#OTHERS}
   */
  public static Set<String> selectSmallGroups(Map<String, List<Double>> valuesByGroup,
                                              double threshold) {
    Validate.exclusiveBetween(0.0, 1.0, threshold, "threshold must be between 0 and 1 exclusive");
    if (valuesByGroup.containsKey(OTHERS)) {
      throw new ReservedGroupNameException(OTHERS, "bucketed grouping");
    }
    requireEqualLengths(valuesByGroup);

    final List<Entry<String, Double>> magnitudes = new ArrayList<>(valuesByGroup.size());
    double grandTotal = 0;
    for (Entry<String, List<Double>> entry : valuesByGroup.entrySet()) {
      final double magnitude = sum(entry.getValue());
      magnitudes.add(Map.entry(entry.getKey(), magnitude));
      grandTotal += magnitude;
    }
    if (!(grandTotal > 0) || Double.isInfinite(grandTotal)) {
      log.debug("Skipping bucketing of {} groups with grand total {}", magnitudes.size(), grandTotal);
      return Set.of();
    }

    magnitudes.sort(ASCENDING_MAGNITUDE);
    final Set<String> selected = new LinkedHashSet<>();
    double runningSum = 0;
    for (Entry<String, Double> entry : magnitudes) {
      final double candidate = runningSum + entry.getValue();
      if (!(candidate / grandTotal < threshold)) {
        break;
      }
      runningSum = candidate;
      selected.add(entry.getKey());
    }
    return selected;
  }

  /**
   * Orders groups by their most recent value, largest first, which is the order they get
   * stacked in. Ties are broken by group name.
   */
  public static Map<String, List<Double>> orderByLatest(Map<String, List<Double>> valuesByGroup) {
    final List<String> groups = new ArrayList<>(valuesByGroup.keySet());
    groups.sort(Comparator.<String>comparingDouble(group -> latest(valuesByGroup.get(group)))
        .reversed()
        .thenComparing(Comparator.naturalOrder()));
    final Map<String, List<Double>> ordered = new LinkedHashMap<>();
    for (String group : groups) {
      ordered.put(group, valuesByGroup.get(group));
    }
    return ordered;
  }

  private static Map<String, List<Double>> merge(Map<String, List<Double>> valuesByGroup,
                                                 Set<String> smallGroups) {
    if (smallGroups.isEmpty()) {
      return valuesByGroup;
    }
    final Map<String, List<Double>> merged = new LinkedHashMap<>();
    double[] others = null;
    for (Entry<String, List<Double>> entry : valuesByGroup.entrySet()) {
      if (!smallGroups.contains(entry.getKey())) {
        merged.put(entry.getKey(), entry.getValue());
        continue;
      }
      final List<Double> values = entry.getValue();
      if (others == null) {
        others = new double[values.size()];
      }
      for (int i = 0; i < values.size(); i++) {
        others[i] += values.get(i);
      }
    }
    final List<Double> othersValues = new ArrayList<>(others.length);
    for (double value : others) {
      othersValues.add(value);
    }
    merged.put(OTHERS, othersValues);
    log.debug("Merged {} of {} groups into {}", smallGroups.size(), valuesByGroup.size(), OTHERS);
    return merged;
  }

  private static void requireEqualLengths(Map<String, List<Double>> valuesByGroup) {
    int length = -1;
    for (Entry<String, List<Double>> entry : valuesByGroup.entrySet()) {
      if (length < 0) {
        length = entry.getValue().size();
      } else if (entry.getValue().size() != length) {
        throw new IllegalArgumentException(
            "All groups must have the same number of values, but " + entry.getKey() + " has "
                + entry.getValue().size() + " instead of " + length);
      }
    }
  }

  private static double sum(List<Double> values) {
    double sum = 0;
    for (Double value : values) {
      sum += value;
    }
    return sum;
  }

  private static double latest(List<Double> values) {
    return values.isEmpty() ? 0 : values.get(values.size() - 1);
  }
}
