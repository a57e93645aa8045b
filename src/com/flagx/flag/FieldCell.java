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
import java.lang.reflect.Field;
import javax.annotation.Nullable;

/** A {@link ValueCell} reading and writing one field of an options object through reflection. */
public final class FieldCell<T> implements ValueCell<T> {

  private final Field field;
  private final Object target;
  private final Class<T> type;

  private FieldCell(Field field, Object target, Class<T> type) {
    this.field = field;
    this.target = target;
    this.type = type;
  }

  /**
   * @param type the boxed type of the field; primitive fields are read and written through their
   *     wrapper.
   */
  public static <T> FieldCell<T> of(Field field, Object target, Class<T> type) {
    Preconditions.checkArgument(
        field.getDeclaringClass().isInstance(target),
        "%s is not an instance of %s",
        target.getClass().getName(),
        field.getDeclaringClass().getName());
    field.setAccessible(true);
    return new FieldCell<>(field, target, type);
  }

  @Nullable
  @Override
  public T get() {
    try {
      return type.cast(field.get(target));
    } catch (IllegalAccessException e) {
      throw new IllegalStateException("cannot read field " + field, e);
    }
  }

  @Override
  public void set(T value) {
    try {
      field.set(target, value);
    } catch (IllegalAccessException e) {
      throw new IllegalStateException("cannot write field " + field, e);
    }
  }

  Field getField() {
    return field;
  }
}
