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

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import lombok.Value;

/**
 * The time range and resolution of a Prometheus range query.
 */
@Value
public class QueryWindow {
  Instant start;
  Instant end;
  Duration step;

  public QueryWindow(Instant start, Instant end, Duration step) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    Objects.requireNonNull(step, "step");
    if (start.isAfter(end)) {
      throw new IllegalArgumentException("start must not be after end");
    }
    if (step.isZero() || step.isNegative()) {
      throw new IllegalArgumentException("step must be positive");
    }
    this.start = start;
    this.end = end;
    this.step = step;
  }
}
