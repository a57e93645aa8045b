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

import com.flagx.util.MoreStrings;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;

/**
 * Human readable durations such as {@code 300ms}, {@code -1.5h} or {@code 2h45m}.
 *
 * <p>Valid units are {@code ns}, {@code us} (or {@code µs}), {@code ms}, {@code s}, {@code m} and
 * {@code h}. The rendered form always round-trips through {@link #parse}.
 */
public final class DurationFormat {

  private static final ImmutableMap<String, Long> UNITS =
      ImmutableMap.<String, Long>builder()
          .put("ns", 1L)
          .put("us", 1_000L)
          .put("µs", 1_000L)
          .put("μs", 1_000L)
          .put("ms", 1_000_000L)
          .put("s", 1_000_000_000L)
          .put("m", 60_000_000_000L)
          .put("h", 3_600_000_000_000L)
          .build();

  private static final BigInteger MAX_MAGNITUDE = BigInteger.ONE.shiftLeft(63);

  private DurationFormat() {}

  public static Duration parse(String text) {
    String s = text;
    boolean negative = false;
    if (!s.isEmpty() && (s.charAt(0) == '-' || s.charAt(0) == '+')) {
      negative = s.charAt(0) == '-';
      s = s.substring(1);
    }
    if (s.equals("0")) {
      return Duration.ZERO;
    }
    if (s.isEmpty()) {
      throw invalid(text);
    }
    BigInteger total = BigInteger.ZERO;
    int pos = 0;
    while (pos < s.length()) {
      char first = s.charAt(pos);
      if (first != '.' && !isDigit(first)) {
        throw invalid(text);
      }
      int intStart = pos;
      while (pos < s.length() && isDigit(s.charAt(pos))) {
        pos++;
      }
      String intPart = s.substring(intStart, pos);
      String fracPart = "";
      if (pos < s.length() && s.charAt(pos) == '.') {
        int fracStart = ++pos;
        while (pos < s.length() && isDigit(s.charAt(pos))) {
          pos++;
        }
        fracPart = s.substring(fracStart, pos);
      }
      if (intPart.isEmpty() && fracPart.isEmpty()) {
        throw invalid(text);
      }
      int unitStart = pos;
      while (pos < s.length() && s.charAt(pos) != '.' && !isDigit(s.charAt(pos))) {
        pos++;
      }
      if (unitStart == pos) {
        throw new IllegalArgumentException(
            "time: missing unit in duration " + MoreStrings.quote(text));
      }
      String unit = s.substring(unitStart, pos);
      Long unitNanos = UNITS.get(unit);
      if (unitNanos == null) {
        throw new IllegalArgumentException(
            "time: unknown unit "
                + MoreStrings.quote(unit)
                + " in duration "
                + MoreStrings.quote(text));
      }
      BigDecimal amount =
          new BigDecimal((intPart.isEmpty() ? "0" : intPart) + "." + fracPart + "0");
      total = total.add(amount.multiply(BigDecimal.valueOf(unitNanos)).toBigInteger());
      if (total.compareTo(MAX_MAGNITUDE) > 0) {
        throw invalid(text);
      }
    }
    if (!negative && total.equals(MAX_MAGNITUDE)) {
      throw invalid(text);
    }
    return Duration.ofNanos((negative ? total.negate() : total).longValue());
  }

  public static String format(Duration duration) {
    if (duration.isZero()) {
      return "0s";
    }
    Duration abs = duration.abs();
    long seconds = abs.getSeconds();
    int nanos = abs.getNano();
    String rendered;
    if (seconds == 0) {
      if (nanos < 1_000) {
        rendered = nanos + "ns";
      } else if (nanos < 1_000_000) {
        rendered = withFraction(nanos, 3) + "µs";
      } else {
        rendered = withFraction(nanos, 6) + "ms";
      }
    } else {
      rendered = (seconds % 60) + fraction(nanos, 9) + "s";
      long minutes = seconds / 60;
      if (minutes > 0) {
        rendered = (minutes % 60) + "m" + rendered;
        long hours = minutes / 60;
        if (hours > 0) {
          rendered = hours + "h" + rendered;
        }
      }
    }
    return duration.isNegative() ? "-" + rendered : rendered;
  }

  private static String withFraction(long value, int precision) {
    long scale = (long) Math.pow(10, precision);
    return (value / scale) + fraction(value % scale, precision);
  }

  private static String fraction(long value, int precision) {
    if (value == 0) {
      return "";
    }
    String digits = Strings.padStart(Long.toString(value), precision, '0');
    int end = digits.length();
    while (digits.charAt(end - 1) == '0') {
      end--;
    }
    return "." + digits.substring(0, end);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static IllegalArgumentException invalid(String text) {
    return new IllegalArgumentException("time: invalid duration " + MoreStrings.quote(text));
  }
}
