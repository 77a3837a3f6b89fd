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

import lombok.Getter;

/**
 * Thrown when metric data contains a group whose name is reserved for a synthetic entry, such as
 * the merged "Others" group or a capacity "total".
 */
@Getter
public class ReservedGroupNameException extends IllegalStateException {

  private final String group;

  public ReservedGroupNameException(String group, String context) {
    super(String.format("Group name '%s' is reserved and cannot be used in a %s", group, context));
    this.group = group;
  }
}
