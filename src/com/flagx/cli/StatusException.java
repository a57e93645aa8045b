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

import com.google.common.base.Preconditions;

/** Unwinds a handler with a {@link Status}, which {@link App#exec} then returns. */
public class StatusException extends RuntimeException {

  private final Status status;

  public StatusException(Status status) {
    super(status.getMsg(), status.getCause().orElse(null));
    Preconditions.checkArgument(!status.isOk(), "cannot throw a successful status");
    this.status = status;
  }

  public Status getStatus() {
    return status;
  }
}
