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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class StatusTest {

  @Test
  public void okHasNoMessage() {
    assertTrue(Status.ok().isOk());
    assertThat(Status.ok().getMsg(), equalTo(""));
    assertFalse(Status.ok().getCause().isPresent());
  }

  @Test
  public void emptyMessageFallsBackToTheCause() {
    Status status = Status.of(9, "", new IllegalStateException("broken"));
    assertThat(status.getMsg(), equalTo("broken"));
    assertThat(
        Status.of(9, null, new IllegalStateException()).getMsg(),
        equalTo("java.lang.IllegalStateException"));
    assertThat(
        Status.of(9, "given", new IllegalStateException("broken")).getMsg(), equalTo("given"));
    assertFalse(status.getStack().isPresent());
  }

  @Test
  public void withStackRecordsTheCaller() {
    Status status = Status.withStack(5, "here", null);
    assertThat(
        status.getStack().get(),
        containsString("com.flagx.cli.StatusTest.withStackRecordsTheCaller"));
    assertFalse(status.isOk());
  }

  @Test
  public void uncaughtKeepsTheTrace() {
    Status status = Status.uncaught(new UnsupportedOperationException("nope"));
    assertThat(status.getCode(), equalTo(Status.UNCAUGHT));
    assertThat(status.getMsg(), equalTo("nope"));
    assertThat(status.getStack().get(), containsString("UnsupportedOperationException: nope"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void okStatusCannotBeThrown() {
    throw new StatusException(Status.ok());
  }
}
