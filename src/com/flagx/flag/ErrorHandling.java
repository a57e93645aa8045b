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

/** Defines how a parse behaves when it fails. */
public enum ErrorHandling {
  /** Throw a descriptive, checked {@link FlagParseException}. */
  CONTINUE_ON_ERROR,
  /** Terminate the process: status 2, or 0 when help was requested. */
  EXIT_ON_ERROR,
  /** Throw an unchecked {@link IllegalStateException} wrapping the parse failure. */
  PANIC_ON_ERROR;

  /** Status used by {@link #EXIT_ON_ERROR} for parse failures. */
  public static final int EXIT_STATUS = 2;
}
