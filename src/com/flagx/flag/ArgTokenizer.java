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
import java.util.List;
import java.util.function.Predicate;
import javax.annotation.Nullable;

/**
 * Classifies arguments without knowing which flags exist.
 *
 * <p>An argument is a flag if it starts with {@code -} and is at least two characters long; a
 * second leading {@code -} only widens the prefix, and a bare {@code --} is the terminator. A flag
 * takes its value after {@code =}, otherwise from the following argument unless that argument
 * starts with {@code -} or the flag is known to be boolean.
 */
final class ArgTokenizer {

  enum Kind {
    FLAG,
    TERMINATOR,
    NON_FLAG,
  }

  static final class Token {
    private final Kind kind;
    private final String name;
    @Nullable private final String value;
    private final int width;

    private Token(Kind kind, String name, @Nullable String value, int width) {
      this.kind = kind;
      this.name = name;
      this.value = value;
      this.width = width;
    }

    Kind getKind() {
      return kind;
    }

    /** @return the flag name without dashes, or the argument itself for a non-flag. */
    String getName() {
      return name;
    }

    @Nullable
    String getValue() {
      return value;
    }

    /** @return how many arguments this token spans, 2 when the value was the next argument. */
    int getWidth() {
      return width;
    }

    /** @return the flag in the single-argument form {@code -name} or {@code -name=value}. */
    String toArgument() {
      return value == null ? "-" + name : "-" + name + "=" + value;
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("kind", kind)
          .add("name", name)
          .add("value", value)
          .add("width", width)
          .toString();
    }
  }

  private ArgTokenizer() {}

  /**
   * Reads the token that starts at {@code args.get(pos)}.
   *
   * @param isBoolFlag tells whether a flag name is a defined boolean flag
   * @throws FlagParseException on a malformed flag such as {@code ---x} or {@code -=x}
   */
  static Token next(List<String> args, int pos, Predicate<String> isBoolFlag)
      throws FlagParseException {
    String s = args.get(pos);
    if (s.length() < 2 || s.charAt(0) != '-') {
      return new Token(Kind.NON_FLAG, s, null, 1);
    }
    int numMinuses = 1;
    if (s.charAt(1) == '-') {
      numMinuses++;
      if (s.length() == 2) {
        return new Token(Kind.TERMINATOR, s, null, 1);
      }
    }
    String name = s.substring(numMinuses);
    if (name.isEmpty() || name.charAt(0) == '-' || name.charAt(0) == '=') {
      throw new FlagParseException("bad flag syntax: " + s);
    }
    int equals = name.indexOf('=', 1);
    if (equals > 0) {
      return new Token(Kind.FLAG, name.substring(0, equals), name.substring(equals + 1), 1);
    }
    if (pos + 1 < args.size() && !isBoolFlag.test(name)) {
      String maybeValue = args.get(pos + 1);
      if (maybeValue.isEmpty() || maybeValue.charAt(0) != '-') {
        return new Token(Kind.FLAG, name, maybeValue, 2);
      }
    }
    return new Token(Kind.FLAG, name, null, 1);
  }
}
