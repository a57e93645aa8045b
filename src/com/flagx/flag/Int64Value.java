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

/** An {@code int64} adapter. */
public class Int64Value extends AbstractValue<Long> {

  public Int64Value(@Nullable ValueCell<Long> cell) {
    super(cell);
  }

  public Int64Value(ValueCell<Long> cell, long initial) {
    super(initialized(cell, initial));
  }

  @Override
  protected Long parse(String text) {
    return NumberSyntax.parseSigned(text, Long.SIZE);
  }

  @Override
  protected String format(Long value) {
    return value.toString();
  }

  @Override
  protected Long zero() {
    return 0L;
  }

  @Override
  public String typeName() {
    return "int";
  }
}
