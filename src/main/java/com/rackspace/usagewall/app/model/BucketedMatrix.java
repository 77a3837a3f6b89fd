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
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.Value;

/**
 * A {@link DenseMatrix} whose low-significance groups may have been merged into a single
 * {@value #OTHERS} group. Groups are kept in presentation order, most recent value first.
 */
@Value
public class BucketedMatrix {

  public static final String OTHERS = "Others";

  List<Instant> timestamps;
  Map<String, List<Double>> values;
  /**
   * The original groups that were folded into {@value #OTHERS}, sorted by name.
   */
  Set<String> mergedGroups;

  public BucketedMatrix(List<Instant> timestamps, Map<String, List<Double>> values,
                        Set<String> mergedGroups) {
    this.timestamps = List.copyOf(timestamps);
    this.values = DenseMatrix.copyValues(values, this.timestamps.size());
    this.mergedGroups = Collections.unmodifiableSet(new TreeSet<>(mergedGroups));
  }

  public boolean hasOthers() {
    return !mergedGroups.isEmpty();
  }

  public Set<String> groups() {
    return values.keySet();
  }

  public List<Double> valuesOf(String group) {
    return values.getOrDefault(group, List.of());
  }
}
