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

import javax.annotation.Nullable;

/** A {@code bool} adapter. Accepts 1, t, T, TRUE, true, True and their false counterparts. */
public class BoolValue extends AbstractValue<Boolean> {

  public BoolValue(@Nullable ValueCell<Boolean> cell) {
    super(cell);
  }

  public BoolValue(ValueCell<Boolean> cell, boolean initial) {
    super(initialized(cell, initial));
  }

  static boolean parseBool(String text) {
    switch (text) {
      case "1":
      case "t":
      case "T":
      case "TRUE":
      case "true":
      case "True":
        return true;
      case "0":
      case "f":
      case "F":
      case "FALSE":
      case "false":
      case "False":
        return false;
      default:
        throw new IllegalArgumentException(NumberSyntax.PARSE_ERROR);
    }
  }

  @Override
  protected Boolean parse(String text) {
    return parseBool(text);
  }

  @Override
  protected String format(Boolean value) {
    return value.toString();
  }

  @Override
  protected Boolean zero() {
    return false;
  }

  @Override
  public boolean isBoolFlag() {
    return true;
  }

  @Override
  public String typeName() {
    return "";
  }
}
