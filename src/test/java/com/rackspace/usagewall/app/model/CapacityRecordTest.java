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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rackspace.usagewall.app.matrix.ReservedGroupNameException;
import com.rackspace.usagewall.app.matrix.SeriesAligner;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CapacityRecordTest {

  @Test
  void sumsGroupsAtEachTimestamp() {
    final DenseMatrix capacity = SeriesAligner.align(SeriesSet.builder()
        .sample("genoa", 0, 100)
        .sample("genoa", 60, 120)
        .sample("rome", 0, 50)
        .sample("rome", 60, 40)
        .build());

    final CapacityRecord record = CapacityRecord.of(capacity);

    assertThat(record.getTimestamps())
        .containsExactly(Instant.ofEpochSecond(0), Instant.ofEpochSecond(60));
    assertThat(record.getGroups()).containsOnlyKeys("genoa", "rome");
    assertThat(record.getTotal()).containsExactly(150.0, 160.0);
  }

  @Test
  void latestReducesToMostRecentTimestamp() {
    final DenseMatrix capacity = new DenseMatrix(
        List.of(Instant.ofEpochSecond(0), Instant.ofEpochSecond(60)),
        Map.of("genoa", List.of(100.0, 120.0), "rome", List.of(50.0, 0.0)));

    final CapacitySnapshot snapshot = CapacityRecord.of(capacity).latest();

    assertThat(snapshot.getTotal()).isEqualTo(120.0);
    assertThat(snapshot.capacityOf("genoa")).isEqualTo(120.0);
    assertThat(snapshot.capacityOf("rome")).isEqualTo(0.0);
    assertThat(snapshot.capacityOf("unknown")).isEqualTo(0.0);
  }

  @Test
  void emptyCapacityGivesEmptyRecord() {
    final CapacityRecord record = CapacityRecord.of(DenseMatrix.empty());

    assertThat(record.isEmpty()).isTrue();
    assertThat(record.getTotal()).isEmpty();
    assertThat(record.latest()).isEqualTo(CapacitySnapshot.empty());
  }

  @Test
  void rejectsGroupNamedTotal() {
    final DenseMatrix capacity = new DenseMatrix(
        List.of(Instant.ofEpochSecond(0)),
        Map.of("total", List.of(1.0), "rome", List.of(2.0)));

    assertThatThrownBy(() -> CapacityRecord.of(capacity))
        .isInstanceOf(ReservedGroupNameException.class)
        .hasMessageContaining("'total'");
  }

  @Test
  void snapshotRejectsGroupNamedTotal() {
    assertThatThrownBy(() -> CapacitySnapshot.of(Map.of("total", 1.0)))
        .isInstanceOf(ReservedGroupNameException.class);
  }
}
