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

import com.flagx.log.Logger;
import com.flagx.util.immutables.FlagxStyleValue;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.io.Files;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import org.immutables.value.Value;

/**
 * Facts about the running program that an {@link App} uses as defaults: the command name and the
 * time the program was built.
 */
@Value.Immutable
@FlagxStyleValue
public interface ProgramInfo {

  String DEFAULT_PROGRAM_NAME = "app";

  String getProgramName();

  Instant getCompiled();

  static ProgramInfo of(String programName, Instant compiled) {
    return ImmutableProgramInfo.of(programName, compiled);
  }

  /**
   * Derives the program from the launch command: the name of the jar without its extension, or
   * the simple name of the main class. The compile time is the modification time of the jar, or
   * now when there is no jar.
   */
  static ProgramInfo fromSystem() {
    String command = Strings.nullToEmpty(System.getProperty("sun.java.command")).trim();
    String launched = Splitter.on(' ').split(command).iterator().next();
    if (launched.isEmpty()) {
      return of(DEFAULT_PROGRAM_NAME, Instant.now());
    }
    if (launched.endsWith(".jar")) {
      Path jar = Paths.get(launched);
      Instant compiled;
      try {
        compiled = java.nio.file.Files.getLastModifiedTime(jar).toInstant();
      } catch (IOException e) {
        Logger.get(ProgramInfo.class).debug("cannot stat %s: %s", jar, e.getMessage());
        compiled = Instant.now();
      }
      return of(Files.getNameWithoutExtension(launched), compiled);
    }
    return of(launched.substring(launched.lastIndexOf('.') + 1), Instant.now());
  }
}
