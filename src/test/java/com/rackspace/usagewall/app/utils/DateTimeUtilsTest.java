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

package com.rackspace.usagewall.app.utils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rackspace.usagewall.app.model.QueryWindow;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import org.junit.jupiter.api.Test;

public class DateTimeUtilsTest {

  @Test
  public void getAbsoluteTimeFromRelativeTimeTest() {
    Instant actual = DateTimeUtils.getAbsoluteTimeFromRelativeTime("1s-ago");
    Instant expected = Instant.now().minus(1, ChronoUnit.SECONDS);
    assertThat(Duration.between(actual, expected).getSeconds()).isLessThanOrEqualTo(1);
  }

  @Test
  public void getAbsoluteTimeFromRelativeTimeTest_Invalid() {
    assertThatThrownBy(() -> DateTimeUtils.getAbsoluteTimeFromRelativeTime("1ss-ago"))
        .isInstanceOf(IllegalArgumentException.class).hasMessage("Invalid relative time format");
  }

  @Test
  public void isValidInstantInstanceTest() {
    assertThat(DateTimeUtils.isValidInstantInstance("2023-04-11T14:24:35Z")).isTrue();
    assertThat(DateTimeUtils.isValidInstantInstance("13:03:15.454+0530Z")).isFalse();
  }

  @Test
  public void isValidEpochTest() {
    assertThat(DateTimeUtils.isValidEpochMillis("1681223075000")).isTrue();
    assertThat(DateTimeUtils.isValidEpochMillis("1681223075")).isFalse();
    assertThat(DateTimeUtils.isValidEpochSeconds("1681223075")).isTrue();
    assertThat(DateTimeUtils.isValidEpochSeconds("1681223075000")).isFalse();
  }

  @Test
  public void parseInstantTestWithNull() {
    assertThat(Duration.between(DateTimeUtils.parseInstant(null), Instant.now()).getSeconds())
        .isLessThanOrEqualTo(1);
  }

  @Test
  public void parseInstantTest() {
    assertThat(DateTimeUtils.parseInstant("1681223075000"))
        .isEqualTo(Instant.ofEpochMilli(1681223075000L));
    assertThat(DateTimeUtils.parseInstant("1681223075"))
        .isEqualTo(Instant.ofEpochSecond(1681223075));
    assertThat(DateTimeUtils.parseInstant("2023-04-11T14:24:35Z"))
        .isEqualTo(Instant.parse("2023-04-11T14:24:35Z"));
    assertThat(DateTimeUtils.parseInstant("7d-ago"))
        .isBefore(Instant.now().minus(Duration.ofDays(6)));
  }

  @Test
  public void parseStepTest() {
    assertThat(DateTimeUtils.parseStep("1h")).isEqualTo(Duration.ofHours(1));
    assertThat(DateTimeUtils.parseStep("30s")).isEqualTo(Duration.ofSeconds(30));
    assertThat(DateTimeUtils.parseStep("2d")).isEqualTo(Duration.ofDays(2));
    assertThatThrownBy(() -> DateTimeUtils.parseStep("1hour"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void epochSecondsConversionTest() {
    assertThat(DateTimeUtils.fromEpochSeconds(new BigDecimal("1681223075.781")))
        .isEqualTo(Instant.ofEpochSecond(1681223075, 781_000_000));
    assertThat(DateTimeUtils.toEpochSeconds(Instant.ofEpochSecond(1681223075, 500_000_000)))
        .isEqualTo("1681223075.5");
    assertThat(DateTimeUtils.toEpochSeconds(Instant.ofEpochSecond(1681223075)))
        .isEqualTo("1681223075");
  }

  @Test
  public void toSecondsTest() {
    assertThat(DateTimeUtils.toSeconds(Duration.ofHours(1))).isEqualTo("3600");
    assertThat(DateTimeUtils.toSeconds(Duration.ofMillis(500))).isEqualTo("0.5");
    assertThat(DateTimeUtils.toSeconds(DateTimeUtils.parseStep("1500ms"))).isEqualTo("1.5");
  }

  @Test
  public void truncateTest() {
    assertThat(DateTimeUtils.truncate(Instant.parse("2023-04-11T10:15:32.08Z"),
        Duration.ofMinutes(1)))
        .isEqualTo(Instant.parse("2023-04-11T10:15:00Z"));
    assertThat(DateTimeUtils.truncate(Instant.parse("2023-04-11T10:59:59.99Z"),
        Duration.ofHours(1)))
        .isEqualTo(Instant.parse("2023-04-11T10:00:00Z"));
    assertThat(DateTimeUtils.truncate(Instant.parse("2023-04-11T10:15:00Z"),
        Duration.ofMinutes(1)))
        .isEqualTo(Instant.parse("2023-04-11T10:15:00Z"));
    assertThat(DateTimeUtils.truncate(Instant.parse("1969-12-31T23:30:00Z"),
        Duration.ofHours(1)))
        .isEqualTo(Instant.parse("1969-12-31T23:00:00Z"));
  }

  @Test
  public void truncateRejectsSubSecondResolution() {
    assertThatThrownBy(() -> DateTimeUtils.truncate(Instant.now(), Duration.ofMillis(500)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void resolveWindowWithDefaults() {
    final QueryWindow window = DateTimeUtils.resolveWindow(null, null, null,
        Duration.ofDays(7), Duration.ofHours(1), Duration.ofMinutes(1));

    assertThat(window.getEnd().getEpochSecond() % 60).isZero();
    assertThat(window.getEnd().getNano()).isZero();
    assertThat(Duration.between(window.getStart(), window.getEnd())).isEqualTo(Duration.ofDays(7));
    assertThat(window.getStep()).isEqualTo(Duration.ofHours(1));
  }

  @Test
  public void resolveWindowWithExplicitValues() {
    final QueryWindow window = DateTimeUtils.resolveWindow(
        "2023-04-01T00:00:00Z", "2023-04-02T00:00:00Z", "15m",
        Duration.ofDays(7), Duration.ofHours(1), Duration.ofMinutes(1));

    assertThat(window.getStart()).isEqualTo(Instant.parse("2023-04-01T00:00:00Z"));
    assertThat(window.getEnd()).isEqualTo(Instant.parse("2023-04-02T00:00:00Z"));
    assertThat(window.getStep()).isEqualTo(Duration.ofMinutes(15));
  }

  @Test
  public void resolveWindowRejectsStartAfterEnd() {
    assertThatThrownBy(() -> DateTimeUtils.resolveWindow(
        "2023-04-03T00:00:00Z", "2023-04-02T00:00:00Z", null,
        Duration.ofDays(7), Duration.ofHours(1), Duration.ofMinutes(1)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
