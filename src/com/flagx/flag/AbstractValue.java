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

import com.google.common.base.Preconditions;
import javax.annotation.Nullable;

/**
 * Base class of the typed adapters: parses text into a {@link ValueCell} and renders the cell back.
 *
 * @param <T> boxed type stored in the cell
 */
public abstract class AbstractValue<T> implements FlagValue {

  @Nullable private final ValueCell<T> cell;

  /**
   * @param cell where parsed values are stored, or null for a detached value that can only be
   *     rendered (it then renders the zero value)
   */
  protected AbstractValue(@Nullable ValueCell<T> cell) {
    this.cell = cell;
  }

  /** Stores {@code initial} in {@code cell} and returns the cell, for use in constructors. */
  protected static <T> ValueCell<T> initialized(ValueCell<T> cell, T initial) {
    Preconditions.checkNotNull(cell).set(initial);
    return cell;
  }

  protected abstract T parse(String text);

  protected abstract String format(T value);

  protected abstract T zero();

  @Override
  public void set(String text) {
    Preconditions.checkState(cell != null, "value is not bound to a cell");
    cell.set(parse(text));
  }

  /** @return the current value, or the zero value when the cell is empty or absent. */
  public T get() {
    T value = cell == null ? null : cell.get();
    return value == null ? zero() : value;
  }

  @Override
  public String asString() {
    return format(get());
  }

  /** @return the rendering of the zero value, used to hide uninteresting defaults in usage. */
  public String zeroString() {
    return format(zero());
  }

  @Override
  public String toString() {
    return asString();
  }
}
