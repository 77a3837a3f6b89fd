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

import com.rackspace.usagewall.app.model.DenseMatrix;
import com.rackspace.usagewall.app.model.Sample;
import com.rackspace.usagewall.app.model.SeriesSet;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Reconciles sparse per-group samples onto a common time grid.
 */
public class SeriesAligner {

  public static final double DEFAULT_FILL_VALUE = 0;

  private SeriesAligner() {
  }

  public static DenseMatrix align(SeriesSet seriesSet) {
    return align(seriesSet, DEFAULT_FILL_VALUE);
  }

  /**
   * Aligns every group onto the sorted union of all sample timestamps. A group without a sample
   * at one of those timestamps gets <code>fillValue</code> there. When a group reports the same
   * timestamp more than once, the last sample wins.
   *
   * @return the aligned matrix, empty when the series set is empty
   */
  public static DenseMatrix align(SeriesSet seriesSet, double fillValue) {
    if (seriesSet.isEmpty()) {
      return DenseMatrix.empty();
    }

    final TreeSet<Instant> allTimestamps = new TreeSet<>();
    final Map<String, Map<Instant, Double>> lookups = new LinkedHashMap<>();
    seriesSet.getSeries().forEach((group, samples) -> {
      final Map<Instant, Double> lookup = new HashMap<>(samples.size());
      for (Sample sample : samples) {
        lookup.put(sample.getTimestamp(), sample.getValue());
        allTimestamps.add(sample.getTimestamp());
      }
      lookups.put(group, lookup);
    });

    final List<Instant> timestamps = new ArrayList<>(allTimestamps);
    final Map<String, List<Double>> values = new LinkedHashMap<>();
    lookups.forEach((group, lookup) -> {
      final List<Double> groupValues = new ArrayList<>(timestamps.size());
      for (Instant timestamp : timestamps) {
        groupValues.add(lookup.getOrDefault(timestamp, fillValue));
      }
      values.put(group, groupValues);
    });

    return new DenseMatrix(timestamps, values);
  }
}
