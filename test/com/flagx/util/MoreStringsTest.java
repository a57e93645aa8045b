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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

public class MoreStringsTest {

  @Test
  public void levenshteinDistance() {
    assertThat(MoreStrings.getLevenshteinDistance("", ""), equalTo(0));
    assertThat(MoreStrings.getLevenshteinDistance("abc", "abc"), equalTo(0));
    assertThat(MoreStrings.getLevenshteinDistance("abc", ""), equalTo(3));
    assertThat(MoreStrings.getLevenshteinDistance("kitten", "sitting"), equalTo(3));
    assertThat(MoreStrings.getLevenshteinDistance("build", "biuld"), equalTo(2));
  }

  @Test
  public void spellingSuggestionsAreSortedByDistanceThenName() {
    ImmutableList<String> options = ImmutableList.of("push", "pull", "status", "puss", "log");
    assertThat(
        MoreStrings.getSpellingSuggestions("pus", options, 2), contains("push", "puss", "pull"));
  }

  @Test
  public void spellingSuggestionsRespectMaxDistance() {
    assertThat(
        MoreStrings.getSpellingSuggestions("xyz", ImmutableList.of("status", "log"), 2), empty());
  }

  @Test
  public void quoteEscapesSpecialCharacters() {
    assertThat(MoreStrings.quote("plain"), equalTo("\"plain\""));
    assertThat(MoreStrings.quote(""), equalTo("\"\""));
    assertThat(MoreStrings.quote("a\"b"), equalTo("\"a\\\"b\""));
    assertThat(MoreStrings.quote("tab\there"), equalTo("\"tab\\there\""));
  }
}
