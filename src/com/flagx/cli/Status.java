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
import com.google.common.base.Strings;
import com.google.common.base.Throwables;
import java.util.Arrays;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Outcome of {@link App#exec}: a code, a message, and optionally the cause and the stack where the
 * status was raised.
 *
 * <p>Code 0 is success. Positive codes classify dispatch failures, see the constants below. Codes
 * raised by handlers through {@link Context#throwStatus} are the handler's own.
 */
public final class Status {

  /** Handled successfully. */
  public static final int OK = 0;
  /** A flag was given where a subcommand name was expected. */
  public static final int BAD_ARGS = 1;
  /** No command matched the arguments and there is no not-found handler. */
  public static final int NOT_FOUND = 2;
  /** The options of a filter or action did not parse. */
  public static final int PARSE_FAILED = 3;
  /** The validator rejected the options of a filter or action. */
  public static final int VALIDATE_FAILED = 4;
  /** A handler failed with an exception that was not a {@link StatusException}. */
  public static final int UNCAUGHT = -1;

  private static final Status OK_STATUS = new Status(OK, "", null, null);

  private final int code;
  private final String msg;
  @Nullable private final Throwable cause;
  @Nullable private final String stack;

  private Status(int code, String msg, @Nullable Throwable cause, @Nullable String stack) {
    this.code = code;
    this.msg = msg;
    this.cause = cause;
    this.stack = stack;
  }

  public static Status ok() {
    return OK_STATUS;
  }

  /**
   * @param msg the message; when empty the message of {@code cause} is used
   */
  public static Status of(int code, @Nullable String msg, @Nullable Throwable cause) {
    return new Status(code, resolveMsg(msg, cause), cause, null);
  }

  /** Like {@link #of}, also recording the stack of the calling thread. */
  public static Status withStack(int code, @Nullable String msg, @Nullable Throwable cause) {
    StackTraceElement[] frames = Thread.currentThread().getStackTrace();
    // Drop getStackTrace and this method.
    String stack =
        Joiner.on('\n')
            .join(
                Arrays.stream(frames)
                    .skip(Math.min(2, frames.length))
                    .map(frame -> "\tat " + frame)
                    .iterator());
    return new Status(code, resolveMsg(msg, cause), cause, stack);
  }

  /** @return a status for an exception that escaped a handler. */
  static Status uncaught(Throwable throwable) {
    return new Status(
        UNCAUGHT,
        resolveMsg(null, throwable),
        throwable,
        Throwables.getStackTraceAsString(throwable));
  }

  private static String resolveMsg(@Nullable String msg, @Nullable Throwable cause) {
    if (!Strings.isNullOrEmpty(msg)) {
      return msg;
    }
    if (cause == null) {
      return "";
    }
    return cause.getMessage() == null ? cause.toString() : cause.getMessage();
  }

  public int getCode() {
    return code;
  }

  public String getMsg() {
    return msg;
  }

  public Optional<Throwable> getCause() {
    return Optional.ofNullable(cause);
  }

  public Optional<String> getStack() {
    return Optional.ofNullable(stack);
  }

  public boolean isOk() {
    return code == OK;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("code", code)
        .add("msg", msg)
        .add("cause", cause)
        .omitNullValues()
        .toString();
  }
}
