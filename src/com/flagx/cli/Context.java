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

import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/** What a handler gets to see of one {@link App#exec} call. */
public final class Context {

  private final CancellationCarrier carrier;
  private final ImmutableList<String> args;
  private final ImmutableList<String> cmdPath;

  Context(CancellationCarrier carrier, ImmutableList<String> args, ImmutableList<String> cmdPath) {
    this.carrier = carrier;
    this.args = args;
    this.cmdPath = cmdPath;
  }

  public CancellationCarrier getCarrier() {
    return carrier;
  }

  /** @return the arguments passed to {@link App#exec}, unmodified. */
  public ImmutableList<String> getArgs() {
    return args;
  }

  /** @return the program name followed by the names of the resolved commands. */
  public ImmutableList<String> getCmdPath() {
    return cmdPath;
  }

  public String getCmdPathString() {
    return Joiner.on(' ').join(cmdPath);
  }

  /** Ends the handling with a status carrying the current stack. */
  public void throwStatus(int code, @Nullable String msg, @Nullable Throwable cause) {
    throw new StatusException(Status.withStack(code, msg, cause));
  }

  /**
   * Ends the handling if {@code error} is not null.
   *
   * @param msg the status message; when empty the message of {@code error} is used
   */
  public void checkStatus(@Nullable Throwable error, int code, @Nullable String msg) {
    checkStatus(error, code, msg, null);
  }

  /** Like {@link #checkStatus(Throwable, int, String)}, running {@code whenError} first. */
  public void checkStatus(
      @Nullable Throwable error, int code, @Nullable String msg, @Nullable Runnable whenError) {
    if (error == null) {
      return;
    }
    if (whenError != null) {
      whenError.run();
    }
    throw new StatusException(Status.withStack(code, msg, error));
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("cmdPath", cmdPath).add("args", args).toString();
  }
}
