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

package com.flagx.util;

import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Map;

public final class MoreStrings {

  private MoreStrings() {}

  /** @return the edit distance between {@code str1} and {@code str2}. */
  public static int getLevenshteinDistance(String str1, String str2) {
    int[] previous = new int[str2.length() + 1];
    int[] current = new int[str2.length() + 1];
    for (int j = 0; j <= str2.length(); j++) {
      previous[j] = j;
    }
    for (int i = 1; i <= str1.length(); i++) {
      current[0] = i;
      for (int j = 1; j <= str2.length(); j++) {
        int cost = str1.charAt(i - 1) == str2.charAt(j - 1) ? 0 : 1;
        current[j] =
            Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }
    return previous[str2.length()];
  }

  /**
   * @return the {@code options} within {@code maxDistance} edits of {@code input}, closest first,
   *     ties broken alphabetically.
   */
  public static ImmutableList<String> getSpellingSuggestions(
      String input, Collection<String> options, int maxDistance) {
    return options.stream()
        .map(option -> Map.entry(option, getLevenshteinDistance(input, option)))
        .filter(entry -> entry.getValue() <= maxDistance)
        .sorted(
            Comparator.<Map.Entry<String, Integer>>comparingInt(Map.Entry::getValue)
                .thenComparing(Map.Entry::getKey))
        .map(Map.Entry::getKey)
        .collect(ImmutableList.toImmutableList());
  }

  /** Quotes {@code str} the way a Go-style {@code %q} verb would for printable input. */
  public static String quote(String str) {
    StringBuilder builder = new StringBuilder(str.length() + 2).append('"');
    for (int i = 0; i < str.length(); i++) {
      char c = str.charAt(i);
      switch (c) {
        case '"':
          builder.append("\\\"");
          break;
        case '\\':
          builder.append("\\\\");
          break;
        case '\n':
          builder.append("\\n");
          break;
        case '\t':
          builder.append("\\t");
          break;
        case '\r':
          builder.append("\\r");
          break;
        default:
          builder.append(c);
      }
    }
    return builder.append('"').toString();
  }
}
