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

import java.time.Instant;
import java.util.Optional;

/**
 * Caller-owned cancellation state handed through to handlers via {@link Context#getCarrier()}.
 * Dispatch itself never checks it.
 */
public interface CancellationCarrier {

  boolean isCancelled();

  Optional<Instant> getDeadline();

  /** @return a carrier that is never cancelled and has no deadline. */
  static CancellationCarrier background() {
    return Background.INSTANCE;
  }

  /** The carrier behind {@link #background()}. */
  enum Background implements CancellationCarrier {
    INSTANCE;

    @Override
    public boolean isCancelled() {
      return false;
    }

    @Override
    public Optional<Instant> getDeadline() {
      return Optional.empty();
    }
  }
}
