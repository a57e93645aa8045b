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
import javax.annotation.Nullable;

/**
 * An addressable storage location for a single value.
 *
 * @param <T> type of the stored value
 */
public interface ValueCell<T> {

  @Nullable
  T get();

  void set(T value);

  /** @return a standalone cell initialised to {@code initial}. */
  static <T> ValueCell<T> of(@Nullable T initial) {
    return new SimpleCell<>(initial);
  }

  /** Cell backed by a plain field. */
  final class SimpleCell<T> implements ValueCell<T> {
    @Nullable private T value;

    private SimpleCell(@Nullable T value) {
      this.value = value;
    }

    @Nullable
    @Override
    public T get() {
      return value;
    }

    @Override
    public void set(T value) {
      this.value = value;
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this).add("value", value).toString();
    }
  }
}
