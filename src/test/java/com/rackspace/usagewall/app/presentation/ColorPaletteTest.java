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

package com.rackspace.usagewall.app.presentation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ColorPaletteTest {

  private static final Map<String, String> FIXED = Map.of(
      "cca", "#CE3232",
      "ccb", "#81AD4A"
  );

  private static final List<String> FALLBACK = List.of("#111111", "#222222", "#333333");

  @Test
  void fixedColorsMatchCaseInsensitively() {
    final ColorPalette palette = ColorPalette.assign(
        List.of("CCA", "ccb"), FIXED, FALLBACK, "#c7c7c7");

    assertThat(palette.colorOf("CCA")).isEqualTo("#CE3232");
    assertThat(palette.colorOf("ccb")).isEqualTo("#81AD4A");
  }

  @Test
  void othersGetsItsOwnColor() {
    final ColorPalette palette = ColorPalette.assign(
        List.of("cca", "Others", "zeta"), FIXED, FALLBACK, "#c7c7c7");

    assertThat(palette.colorOf("Others")).isEqualTo("#c7c7c7");
    assertThat(palette.colorOf("zeta")).isEqualTo("#111111");
  }

  @Test
  void remainingGroupsCycleThroughFallbackByName() {
    final ColorPalette palette = ColorPalette.assign(
        List.of("d", "b", "a", "c", "cca"), FIXED, FALLBACK, "#c7c7c7");

    assertThat(palette.asMap()).containsExactlyInAnyOrderEntriesOf(Map.of(
        "cca", "#CE3232",
        "a", "#111111",
        "b", "#222222",
        "c", "#333333",
        "d", "#111111"
    ));
  }

  @Test
  void sameGroupsGiveSameColorsRegardlessOfOrder() {
    final ColorPalette first = ColorPalette.assign(
        List.of("x", "y", "z"), FIXED, FALLBACK, "#c7c7c7");
    final ColorPalette second = ColorPalette.assign(
        List.of("z", "x", "y"), FIXED, FALLBACK, "#c7c7c7");

    assertThat(first).isEqualTo(second);
  }

  @Test
  void requiresFallbackColors() {
    assertThatThrownBy(() -> ColorPalette.assign(List.of("a"), FIXED, List.of(), "#c7c7c7"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
