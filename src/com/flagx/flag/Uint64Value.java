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

import com.google.common.primitives.UnsignedLong;
import javax.annotation.Nullable;

/** A {@code uint64} adapter. Signs are rejected. */
public class Uint64Value extends AbstractValue<UnsignedLong> {

  public Uint64Value(@Nullable ValueCell<UnsignedLong> cell) {
    super(cell);
  }

  public Uint64Value(ValueCell<UnsignedLong> cell, UnsignedLong initial) {
    super(initialized(cell, initial));
  }

  @Override
  protected UnsignedLong parse(String text) {
    return UnsignedLong.fromLongBits(NumberSyntax.parseUnsigned(text, Long.SIZE));
  }

  @Override
  protected String format(UnsignedLong value) {
    return value.toString();
  }

  @Override
  protected UnsignedLong zero() {
    return UnsignedLong.ZERO;
  }

  @Override
  public String typeName() {
    return "uint";
  }
}
