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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

import java.time.Duration;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

public class DurationFormatTest {

  @Rule public ExpectedException thrown = ExpectedException.none();

  @Test
  public void parsesCompoundDurations() {
    assertThat(DurationFormat.parse("1h30m"), equalTo(Duration.ofMinutes(90)));
    assertThat(DurationFormat.parse("1.5h"), equalTo(Duration.ofMinutes(90)));
    assertThat(DurationFormat.parse("-2m3s"), equalTo(Duration.ofSeconds(-123)));
    assertThat(DurationFormat.parse("300ms"), equalTo(Duration.ofMillis(300)));
    assertThat(DurationFormat.parse("1us"), equalTo(Duration.ofNanos(1000)));
    assertThat(DurationFormat.parse("1µs"), equalTo(Duration.ofNanos(1000)));
    assertThat(DurationFormat.parse(".5s"), equalTo(Duration.ofMillis(500)));
    assertThat(DurationFormat.parse("0"), equalTo(Duration.ZERO));
  }

  @Test
  public void formatsLikeTheCanonicalForm() {
    assertThat(DurationFormat.format(Duration.ZERO), equalTo("0s"));
    assertThat(DurationFormat.format(Duration.ofMinutes(90)), equalTo("1h30m0s"));
    assertThat(DurationFormat.format(Duration.ofMillis(1500)), equalTo("1.5s"));
    assertThat(DurationFormat.format(Duration.ofMillis(300)), equalTo("300ms"));
    assertThat(DurationFormat.format(Duration.ofNanos(1500)), equalTo("1.5µs"));
    assertThat(DurationFormat.format(Duration.ofNanos(12)), equalTo("12ns"));
    assertThat(DurationFormat.format(Duration.ofSeconds(-61)), equalTo("-1m1s"));
  }

  @Test
  public void rejectsMissingUnit() {
    thrown.expect(IllegalArgumentException.class);
    thrown.expectMessage("time: missing unit in duration \"10\"");
    DurationFormat.parse("10");
  }

  @Test
  public void rejectsUnknownUnit() {
    thrown.expect(IllegalArgumentException.class);
    thrown.expectMessage("time: unknown unit \"d\" in duration \"3d\"");
    DurationFormat.parse("3d");
  }

  @Test
  public void rejectsGarbage() {
    thrown.expect(IllegalArgumentException.class);
    thrown.expectMessage("time: invalid duration \"abc\"");
    DurationFormat.parse("abc");
  }

  @Test
  public void rejectsEmpty() {
    thrown.expect(IllegalArgumentException.class);
    thrown.expectMessage("time: invalid duration \"\"");
    DurationFormat.parse("");
  }
}
