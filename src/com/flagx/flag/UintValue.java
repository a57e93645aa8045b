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

import com.google.common.primitives.UnsignedInteger;
import javax.annotation.Nullable;

/** A {@code uint} adapter, 32 bits wide. Signs are rejected. */
public class UintValue extends AbstractValue<UnsignedInteger> {

  public UintValue(@Nullable ValueCell<UnsignedInteger> cell) {
    super(cell);
  }

  public UintValue(ValueCell<UnsignedInteger> cell, UnsignedInteger initial) {
    super(initialized(cell, initial));
  }

  @Override
  protected UnsignedInteger parse(String text) {
    return UnsignedInteger.fromIntBits((int) NumberSyntax.parseUnsigned(text, Integer.SIZE));
  }

  @Override
  protected String format(UnsignedInteger value) {
    return value.toString();
  }

  @Override
  protected UnsignedInteger zero() {
    return UnsignedInteger.ZERO;
  }

  @Override
  public String typeName() {
    return "uint";
  }
}
