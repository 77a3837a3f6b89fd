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

import static com.rackspace.usagewall.app.model.BucketedMatrix.OTHERS;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.apache.commons.lang3.Validate;

/**
 * Group to display color assignments, built once for the set of groups shown together so that a
 * group keeps its color across all the charts of a view.
 */
@EqualsAndHashCode
@ToString
public final class ColorPalette {

  private final Map<String, String> colors;

  private ColorPalette(Map<String, String> colors) {
    this.colors = Collections.unmodifiableMap(colors);
  }

  /**
   * Groups whose lower-case name has a fixed color get it. The remaining groups, sorted by name,
   * cycle through the fallback colors, except "Others" which gets <code>othersColor</code>.
   */
  public static ColorPalette assign(Collection<String> groups,
                                    Map<String, String> fixedColors,
                                    List<String> fallbackColors,
                                    String othersColor) {
    Validate.notEmpty(fallbackColors, "fallbackColors");
    final Map<String, String> assigned = new LinkedHashMap<>();
    final List<String> remaining = new ArrayList<>();
    for (String group : groups) {
      final String fixed = fixedColors.get(group.toLowerCase(Locale.ROOT));
      if (fixed != null) {
        assigned.put(group, fixed);
      } else if (OTHERS.equals(group)) {
        assigned.put(group, othersColor);
      } else if (!remaining.contains(group)) {
        remaining.add(group);
      }
    }
    Collections.sort(remaining);
    for (int i = 0; i < remaining.size(); i++) {
      assigned.put(remaining.get(i), fallbackColors.get(i % fallbackColors.size()));
    }
    return new ColorPalette(assigned);
  }

  public String colorOf(String group) {
    return colors.get(group);
  }

  @JsonValue
  public Map<String, String> asMap() {
    return colors;
  }
}
