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

/**
 * Handles a resolved command.
 *
 * <p>An action given as a lambda, or as an object without an accessible no-argument constructor,
 * is called as is. Any other action is an options object: its fields are bound with {@link
 * com.flagx.flag.FlagSet#structVars} on a fresh copy for every invocation, and that copy handles
 * the command. Implement {@link ActionCopier} to control how the copy is made.
 *
 * <p>Failures are reported with {@link Context#throwStatus} or {@link Context#checkStatus}.
 */
@FunctionalInterface
public interface Action {
  void handle(Context context);
}
