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

import com.flagx.util.immutables.FlagxStyleValue;
import java.lang.reflect.Field;
import java.util.Optional;
import java.util.OptionalInt;
import org.immutables.value.Value;

/** How one field of an options class is exposed on the command line. */
@Value.Immutable
@FlagxStyleValue
public interface FieldBinding {

  Field getField();

  /** @return the flag name, or the display name {@code ?<index>} of a positional entry. */
  String getName();

  OptionalInt getPositionalIndex();

  String getUsage();

  /** @return the default from the tag; when absent the field's initial value is the default. */
  Optional<String> getDefaultText();

  ValueKind getKind();

  default boolean isPositional() {
    return getPositionalIndex().isPresent();
  }

  static FieldBinding of(
      Field field,
      String name,
      OptionalInt positionalIndex,
      String usage,
      Optional<String> defaultText,
      ValueKind kind) {
    return ImmutableFieldBinding.of(field, name, positionalIndex, usage, defaultText, kind);
  }
}
