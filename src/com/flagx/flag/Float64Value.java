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

import com.google.common.base.Ascii;
import com.google.common.base.Strings;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import javax.annotation.Nullable;

/**
 * A {@code float64} adapter.
 *
 * <p>Values render with the shortest digits that parse back to the same double, switching to
 * exponent form below 1e-4 and from 1e+06 upwards ({@code 0.0001}, {@code 1e-05}, {@code 123456},
 * {@code 1.234567e+06}).
 */
public class Float64Value extends AbstractValue<Double> {

  public Float64Value(@Nullable ValueCell<Double> cell) {
    super(cell);
  }

  public Float64Value(ValueCell<Double> cell, double initial) {
    super(initialized(cell, initial));
  }

  @Override
  protected Double parse(String text) {
    String lower = Ascii.toLowerCase(text);
    String unsigned = lower.startsWith("+") || lower.startsWith("-") ? lower.substring(1) : lower;
    if (unsigned.equals("inf") || unsigned.equals("infinity")) {
      return lower.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    }
    if (lower.equals("nan")) {
      return Double.NaN;
    }
    if (text.isEmpty()
        || !text.trim().equals(text)
        || unsigned.startsWith("n")
        || unsigned.startsWith("i")
        || "fd".indexOf(lower.charAt(lower.length() - 1)) >= 0) {
      throw new IllegalArgumentException(NumberSyntax.PARSE_ERROR);
    }
    double value;
    try {
      value = Double.parseDouble(text);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(NumberSyntax.PARSE_ERROR, e);
    }
    if (Double.isInfinite(value)) {
      throw new IllegalArgumentException(NumberSyntax.RANGE_ERROR);
    }
    return value;
  }

  @Override
  protected String format(Double value) {
    return formatShortest(value);
  }

  @Override
  protected Double zero() {
    return 0.0;
  }

  @Override
  public String typeName() {
    return "float";
  }

  /** @return the decimal with the fewest digits that parses back to {@code magnitude}. */
  private static BigDecimal shortestDecimal(double magnitude) {
    // Double.toString may emit a digit more than needed, e.g. 4.9E-324.
    BigDecimal decimal = new BigDecimal(Double.toString(magnitude)).stripTrailingZeros();
    for (int precision = 1; precision < decimal.precision(); precision++) {
      BigDecimal rounded = decimal.round(new MathContext(precision, RoundingMode.HALF_EVEN));
      if (rounded.doubleValue() == magnitude) {
        return rounded.stripTrailingZeros();
      }
    }
    return decimal;
  }

  static String formatShortest(double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "+Inf" : "-Inf";
    }
    if (value == 0) {
      return 1 / value < 0 ? "-0" : "0";
    }
    String sign = value < 0 ? "-" : "";
    BigDecimal decimal = shortestDecimal(Math.abs(value));
    String digits = decimal.unscaledValue().toString();
    int digitCount = digits.length();
    // value == 0.<digits> * 10^decimalPoint
    int decimalPoint = digitCount - decimal.scale();
    int exponent = decimalPoint - 1;
    if (exponent < -4 || exponent >= 6) {
      StringBuilder builder = new StringBuilder(sign).append(digits.charAt(0));
      if (digitCount > 1) {
        builder.append('.').append(digits, 1, digitCount);
      }
      builder.append('e').append(exponent < 0 ? '-' : '+');
      return builder.append(Strings.padStart(Integer.toString(Math.abs(exponent)), 2, '0'))
          .toString();
    }
    StringBuilder builder = new StringBuilder(sign);
    if (decimalPoint > 0) {
      builder.append(digits, 0, Math.min(decimalPoint, digitCount));
      builder.append(Strings.repeat("0", Math.max(decimalPoint - digitCount, 0)));
    } else {
      builder.append('0');
    }
    int fractionDigits = Math.max(digitCount - decimalPoint, 0);
    if (fractionDigits > 0) {
      builder.append('.');
      for (int i = 0; i < fractionDigits; i++) {
        int index = decimalPoint + i;
        builder.append(index >= 0 && index < digitCount ? digits.charAt(index) : '0');
      }
    }
    return builder.toString();
  }
}
