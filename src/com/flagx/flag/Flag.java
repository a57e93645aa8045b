/*
 * Copyright 2020-present Facebook, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License. You may obtain
 * a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package com.flagx.flag;

import com.google.common.base.MoreObjects;

/**
 * The state of a flag or positional entry. Everything but the contents of {@link #getValue()} is
 * fixed at registration.
 */
public final class Flag {

  private final String name;
  private final String usage;
  private final FlagValue value;
  private final String defValue;

  public Flag(String name, String usage, FlagValue value, String defValue) {
    this.name = name;
    this.usage = usage;
    this.value = value;
    this.defValue = defValue;
  }

  /** @return the name as it appears on the command line, or {@code ?<index>} for a positional. */
  public String getName() {
    return name;
  }

  public String getUsage() {
    return usage;
  }

  public FlagValue getValue() {
    return value;
  }

  /** @return the default value as text, for usage messages. */
  public String getDefValue() {
    return defValue;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("value", value.asString())
        .add("default", defValue)
        .toString();
  }
}
