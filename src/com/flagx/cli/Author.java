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

package com.flagx.cli;

import com.flagx.util.immutables.FlagxStyleValue;
import org.immutables.value.Value;

/** Someone who contributed to an application, listed in its usage text. */
@Value.Immutable
@FlagxStyleValue
public abstract class Author {

  public abstract String getName();

  /** @return the email address, or the empty string. */
  public abstract String getEmail();

  public static Author of(String name, String email) {
    return ImmutableAuthor.of(name, email);
  }

  public static Author of(String name) {
    return of(name, "");
  }

  /** @return {@code Name <email>}, or just the name when there is no email. */
  @Override
  public String toString() {
    return getEmail().isEmpty() ? getName() : getName() + " <" + getEmail() + ">";
  }
}
