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

/**
 * The dynamic value stored in a flag or positional entry.
 *
 * <p>{@link #set} is called once, in command line order, for each occurrence. {@link #asString()}
 * may be called before any value has been stored and must then render the zero value of the type.
 */
public interface FlagValue {

  /**
   * Parses {@code text} and stores the result in the bound cell.
   *
   * @throws IllegalArgumentException if {@code text} is not valid for this type. The message is
   *     short enough to be embedded in a larger error, e.g. {@code parse error}.
   */
  void set(String text);

  /** @return the current value rendered as text, suitable to be passed back to {@link #set}. */
  String asString();

  /**
   * If this returns true, the command-line parser makes {@code -name} equivalent to {@code
   * -name=true} rather than using the next command-line argument.
   */
  default boolean isBoolFlag() {
    return false;
  }

  /** @return the name shown next to the flag in usage output, or empty for none. */
  default String typeName() {
    return "value";
  }
}
