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

public class StringValue extends AbstractValue<String> {

  public StringValue(@Nullable ValueCell<String> cell) {
    super(cell);
  }

  public StringValue(ValueCell<String> cell, String initial) {
    super(initialized(cell, initial));
  }

  @Override
  protected String parse(String text) {
    return text;
  }

  @Override
  protected String format(String value) {
    return value;
  }

  @Override
  protected String zero() {
    return "";
  }

  @Override
  public String typeName() {
    return "string";
  }
}
