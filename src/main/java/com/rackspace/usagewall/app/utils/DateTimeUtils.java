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

import com.rackspace.usagewall.app.model.QueryWindow;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

public class DateTimeUtils {

  public static final String RELATIVE_TIME_PATTERN = "([0-9]+)(ms|s|m|h|d|w)-ago";
  public static final String STEP_PATTERN = "([0-9]+)(ms|s|m|h|d|w)";
  public static final String EPOCH_MILLIS_PATTERN = "\\d{13,}";
  public static final String EPOCH_SECONDS_PATTERN = "\\d{1,12}";

  private static final Pattern RELATIVE_TIME = Pattern.compile(RELATIVE_TIME_PATTERN);
  private static final Pattern STEP = Pattern.compile(STEP_PATTERN);
  private static final Pattern EPOCH_MILLIS = Pattern.compile(EPOCH_MILLIS_PATTERN);
  private static final Pattern EPOCH_SECONDS = Pattern.compile(EPOCH_SECONDS_PATTERN);

  private static final Map<String, Duration> UNITS = Map.of(
      "ms", Duration.ofMillis(1),
      "s", Duration.ofSeconds(1),
      "m", Duration.ofMinutes(1),
      "h", Duration.ofHours(1),
      "d", Duration.ofDays(1),
      "w", Duration.ofDays(7)
  );

  private DateTimeUtils() {
  }

  /**
   * Gets the absolute Instant instance for relativeTime.
   */
  public static Instant getAbsoluteTimeFromRelativeTime(String relativeTime) {
    Matcher match = RELATIVE_TIME.matcher(relativeTime);
    if (match.matches()) {
      return Instant.now().minus(durationOf(match.group(1), match.group(2)));
    } else {
      throw new IllegalArgumentException("Invalid relative time format");
    }
  }

  /**
   * Checks if the string time is valid Instant in UTC.
   */
  public static boolean isValidInstantInstance(String time) {
    try {
      Instant.parse(time);
      return true;
    } catch (DateTimeParseException dateTimeParseException) {
      return false;
    }
  }

  public static boolean isValidEpochMillis(String time) {
    return EPOCH_MILLIS.matcher(time).matches();
  }

  public static boolean isValidEpochSeconds(String time) {
    return EPOCH_SECONDS.matcher(time).matches();
  }

  /**
   * Gets the instance of Instant based on the format of argument.
   */
  public static Instant parseInstant(String instant) {
    if (instant == null) {
      return Instant.now();
    }
    if (isValidInstantInstance(instant)) {
      return Instant.parse(instant);
    } else if (isValidEpochMillis(instant)) {
      return Instant.ofEpochMilli(Long.parseLong(instant));
    } else if (isValidEpochSeconds(instant)) {
      return Instant.ofEpochSecond(Long.parseLong(instant));
    } else {
      return getAbsoluteTimeFromRelativeTime(instant);
    }
  }

  /**
   * Parses a Prometheus style duration such as <code>30s</code>, <code>1h</code> or
   * <code>1d</code>.
   */
  public static Duration parseStep(String step) {
    Matcher match = STEP.matcher(step);
    if (match.matches()) {
      return durationOf(match.group(1), match.group(2));
    } else {
      throw new IllegalArgumentException("Invalid step format: " + step);
    }
  }

  /**
   * Converts Prometheus timestamps, which are decimal epoch seconds, keeping the fraction.
   */
  public static Instant fromEpochSeconds(BigDecimal epochSeconds) {
    final long seconds = epochSeconds.longValue();
    final long nanos = epochSeconds.subtract(BigDecimal.valueOf(seconds))
        .movePointRight(9)
        .longValue();
    return Instant.ofEpochSecond(seconds, nanos);
  }

  /**
   * Formats an instant as decimal epoch seconds for Prometheus query parameters.
   */
  public static String toEpochSeconds(Instant instant) {
    return decimalSeconds(instant.getEpochSecond(), instant.getNano());
  }

  /**
   * Formats a duration as decimal seconds, keeping sub-second precision, for the
   * <code>step</code> of Prometheus range queries.
   */
  public static String toSeconds(Duration duration) {
    return decimalSeconds(duration.getSeconds(), duration.getNano());
  }

  /**
   * @return the current time truncated to the given resolution, so that requests made close
   * together resolve to the same instant
   */
  public static Instant normalizedNow(Duration resolution) {
    return truncate(Instant.now(), resolution);
  }

  /**
   * Truncates down to a whole multiple of the resolution since the epoch, also for instants
   * before the epoch.
   */
  public static Instant truncate(Instant instant, Duration resolution) {
    final long seconds = resolution.getSeconds();
    if (seconds < 1) {
      throw new IllegalArgumentException("resolution must be at least one second");
    }
    return Instant.ofEpochSecond(Math.floorDiv(instant.getEpochSecond(), seconds) * seconds);
  }

  /**
   * Resolves optional request parameters into a query window, falling back to a window ending
   * now that spans the default lookback.
   */
  public static QueryWindow resolveWindow(String start, String end, String step,
                                          Duration defaultLookback, Duration defaultStep,
                                          Duration nowResolution) {
    final Instant endTime = StringUtils.isBlank(end) ?
        normalizedNow(nowResolution) : parseInstant(end);
    final Instant startTime = StringUtils.isBlank(start) ?
        endTime.minus(defaultLookback) : parseInstant(start);
    final Duration stepWidth = StringUtils.isBlank(step) ? defaultStep : parseStep(step);
    return new QueryWindow(startTime, endTime, stepWidth);
  }

  private static Duration durationOf(String amount, String unit) {
    return UNITS.get(unit).multipliedBy(Long.parseLong(amount));
  }

  private static String decimalSeconds(long seconds, int nanos) {
    return BigDecimal.valueOf(seconds)
        .add(BigDecimal.valueOf(nanos, 9))
        .stripTrailingZeros()
        .toPlainString();
  }
}
