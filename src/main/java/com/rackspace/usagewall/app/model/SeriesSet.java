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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.Value;

/**
 * Sparse samples keyed by group name, as returned by a grouped metrics query. Groups may report
 * disjoint or overlapping timestamps and samples within a group are unordered.
 */
@Value
public class SeriesSet {

  private static final SeriesSet EMPTY = new SeriesSet(Map.of());

  Map<String, List<Sample>> series;

  public SeriesSet(Map<String, List<Sample>> series) {
    final Map<String, List<Sample>> copy = new LinkedHashMap<>();
    series.forEach((group, samples) ->
        copy.put(Objects.requireNonNull(group, "group"), List.copyOf(samples)));
    this.series = Collections.unmodifiableMap(copy);
  }

  public static SeriesSet empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean isEmpty() {
    return series.isEmpty();
  }

  public Set<String> groups() {
    return series.keySet();
  }

  public List<Sample> samplesOf(String group) {
    return series.getOrDefault(group, List.of());
  }

  public static class Builder {
    private final Map<String, List<Sample>> series = new LinkedHashMap<>();

    /**
     * Declares a group even if it ends up without samples.
     */
    public Builder group(String group) {
      series.computeIfAbsent(group, g -> new ArrayList<>());
      return this;
    }

    public Builder sample(String group, Instant timestamp, double value) {
      series.computeIfAbsent(group, g -> new ArrayList<>()).add(new Sample(timestamp, value));
      return this;
    }

    public Builder sample(String group, long epochSeconds, double value) {
      return sample(group, Instant.ofEpochSecond(epochSeconds), value);
    }

    public SeriesSet build() {
      return series.isEmpty() ? EMPTY : new SeriesSet(series);
    }
  }
}
