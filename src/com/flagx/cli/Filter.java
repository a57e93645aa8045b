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
 * Wraps the handling of every command at or below the command it is registered on. A filter
 * decides whether and when to call {@code next}.
 *
 * <p>Filters are bound like {@link Action}s: a lambda is called as is, an options object is copied
 * and bound for every invocation. Implement {@link FilterCopier} to control the copy.
 */
@FunctionalInterface
public interface Filter {
  void filter(Context context, Action next);
}
