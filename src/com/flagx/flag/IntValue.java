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

/** An {@code int} adapter, 32 bits wide. */
public class IntValue extends AbstractValue<Integer> {

  public IntValue(@Nullable ValueCell<Integer> cell) {
    super(cell);
  }

  public IntValue(ValueCell<Integer> cell, int initial) {
    super(initialized(cell, initial));
  }

  @Override
  protected Integer parse(String text) {
    return (int) NumberSyntax.parseSigned(text, Integer.SIZE);
  }

  @Override
  protected String format(Integer value) {
    return value.toString();
  }

  @Override
  protected Integer zero() {
    return 0;
  }

  @Override
  public String typeName() {
    return "int";
  }
}
