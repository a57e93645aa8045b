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

package com.flagx.log;

import java.util.logging.Level;
import java.util.logging.LogRecord;
import javax.annotation.Nullable;

/**
 * Thin wrapper around {@link java.util.logging.Logger} which takes {@link String#format} style
 * arguments and only formats them when the level is enabled.
 *
 * <p>Levels map as follows: verbose is FINER, debug is FINE, info is INFO, warn is WARNING and
 * error is SEVERE.
 */
public class Logger {

  private final java.util.logging.Logger delegate;

  private Logger(java.util.logging.Logger delegate) {
    this.delegate = delegate;
  }

  public static Logger get(Class<?> cls) {
    return get(cls.getName());
  }

  public static Logger get(String name) {
    return new Logger(java.util.logging.Logger.getLogger(name));
  }

  public boolean isVerboseEnabled() {
    return delegate.isLoggable(Level.FINER);
  }

  public boolean isDebugEnabled() {
    return delegate.isLoggable(Level.FINE);
  }

  public void verbose(String format, Object... args) {
    log(Level.FINER, null, format, args);
  }

  public void debug(String format, Object... args) {
    log(Level.FINE, null, format, args);
  }

  public void info(String format, Object... args) {
    log(Level.INFO, null, format, args);
  }

  public void warn(String format, Object... args) {
    log(Level.WARNING, null, format, args);
  }

  public void warn(Throwable t, String format, Object... args) {
    log(Level.WARNING, t, format, args);
  }

  public void error(String format, Object... args) {
    log(Level.SEVERE, null, format, args);
  }

  public void error(Throwable t, String format, Object... args) {
    log(Level.SEVERE, t, format, args);
  }

  private void log(Level level, @Nullable Throwable t, String format, Object... args) {
    if (!delegate.isLoggable(level)) {
      return;
    }
    String message = args.length == 0 ? format : String.format(format, args);
    LogRecord record = new LogRecord(level, message);
    record.setLoggerName(delegate.getName());
    record.setThrown(t);
    delegate.log(record);
  }
}
