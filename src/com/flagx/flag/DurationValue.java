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

import java.time.Duration;
import javax.annotation.Nullable;

/** A duration adapter using the {@link DurationFormat} grammar, e.g. {@code 1h30m}. */
public class DurationValue extends AbstractValue<Duration> {

  public DurationValue(@Nullable ValueCell<Duration> cell) {
    super(cell);
  }

  public DurationValue(ValueCell<Duration> cell, Duration initial) {
    super(initialized(cell, initial));
  }

  @Override
  protected Duration parse(String text) {
    return DurationFormat.parse(text);
  }

  @Override
  protected String format(Duration value) {
    return DurationFormat.format(value);
  }

  @Override
  protected Duration zero() {
    return Duration.ZERO;
  }

  @Override
  public String typeName() {
    return "duration";
  }
}
