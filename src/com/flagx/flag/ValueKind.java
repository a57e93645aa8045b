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

import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;
import java.lang.reflect.Field;
import java.time.Duration;
import java.util.Optional;

/** The field types an options object may bind, and the adapter each one uses. */
public enum ValueKind {
  BOOL,
  INT,
  INT64,
  UINT,
  UINT64,
  FLOAT64,
  STRING,
  DURATION;

  private static final ImmutableMap<Class<?>, ValueKind> BY_TYPE =
      ImmutableMap.<Class<?>, ValueKind>builder()
          .put(boolean.class, BOOL)
          .put(Boolean.class, BOOL)
          .put(int.class, INT)
          .put(Integer.class, INT)
          .put(long.class, INT64)
          .put(Long.class, INT64)
          .put(UnsignedInteger.class, UINT)
          .put(UnsignedLong.class, UINT64)
          .put(double.class, FLOAT64)
          .put(Double.class, FLOAT64)
          .put(String.class, STRING)
          .put(Duration.class, DURATION)
          .build();

  public static Optional<ValueKind> forType(Class<?> type) {
    return Optional.ofNullable(BY_TYPE.get(type));
  }

  /** @return an adapter reading and writing {@code field} of {@code target}. */
  public FlagValue newValue(Field field, Object target) {
    switch (this) {
      case BOOL:
        return new BoolValue(FieldCell.of(field, target, Boolean.class));
      case INT:
        return new IntValue(FieldCell.of(field, target, Integer.class));
      case INT64:
        return new Int64Value(FieldCell.of(field, target, Long.class));
      case UINT:
        return new UintValue(FieldCell.of(field, target, UnsignedInteger.class));
      case UINT64:
        return new Uint64Value(FieldCell.of(field, target, UnsignedLong.class));
      case FLOAT64:
        return new Float64Value(FieldCell.of(field, target, Double.class));
      case STRING:
        return new StringValue(FieldCell.of(field, target, String.class));
      case DURATION:
        return new DurationValue(FieldCell.of(field, target, Duration.class));
    }
    throw new AssertionError("unknown kind " + this);
  }
}
