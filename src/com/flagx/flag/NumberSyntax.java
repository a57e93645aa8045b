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

import java.math.BigInteger;

/**
 * Integer literal parsing with base prefixes: {@code 0x} hex, {@code 0b} binary, {@code 0o} or a
 * bare leading {@code 0} octal, decimal otherwise.
 */
final class NumberSyntax {

  static final String PARSE_ERROR = "parse error";
  static final String RANGE_ERROR = "value out of range";

  private NumberSyntax() {}

  /** @return the value of {@code text} as a two's complement integer of {@code bits} width. */
  static long parseSigned(String text, int bits) {
    boolean negative = false;
    String digits = text;
    if (!digits.isEmpty() && (digits.charAt(0) == '+' || digits.charAt(0) == '-')) {
      negative = digits.charAt(0) == '-';
      digits = digits.substring(1);
    }
    BigInteger magnitude = parseMagnitude(digits);
    BigInteger value = negative ? magnitude.negate() : magnitude;
    BigInteger max = BigInteger.ONE.shiftLeft(bits - 1).subtract(BigInteger.ONE);
    BigInteger min = BigInteger.ONE.shiftLeft(bits - 1).negate();
    if (value.compareTo(max) > 0 || value.compareTo(min) < 0) {
      throw new IllegalArgumentException(RANGE_ERROR);
    }
    return value.longValue();
  }

  /**
   * @return the value of {@code text} as an unsigned integer of {@code bits} width, held in the
   *     low bits of a long.
   */
  static long parseUnsigned(String text, int bits) {
    BigInteger value = parseMagnitude(text);
    if (value.bitLength() > bits) {
      throw new IllegalArgumentException(RANGE_ERROR);
    }
    return value.longValue();
  }

  private static BigInteger parseMagnitude(String text) {
    int radix = 10;
    String digits = text;
    if (digits.length() > 1 && digits.charAt(0) == '0') {
      char prefix = Character.toLowerCase(digits.charAt(1));
      if (prefix == 'x') {
        radix = 16;
        digits = digits.substring(2);
      } else if (prefix == 'b') {
        radix = 2;
        digits = digits.substring(2);
      } else if (prefix == 'o') {
        radix = 8;
        digits = digits.substring(2);
      } else {
        radix = 8;
        digits = digits.substring(1);
      }
    }
    if (digits.isEmpty()) {
      throw new IllegalArgumentException(PARSE_ERROR);
    }
    for (int i = 0; i < digits.length(); i++) {
      char c = digits.charAt(i);
      if (c >= 0x80 || Character.digit(c, radix) < 0) {
        throw new IllegalArgumentException(PARSE_ERROR);
      }
    }
    return new BigInteger(digits, radix);
  }
}
