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

import com.flagx.util.MoreStrings;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import javax.annotation.Nullable;

/**
 * A table of named flags and the conventional scanner for them.
 *
 * <p>Flags are written {@code -name}, {@code --name}, {@code -name=value} or {@code -name value}.
 * Boolean flags never take the following argument as their value. Scanning stops just before the
 * first non-flag argument ({@code "-"} is a non-flag argument) or after the terminator {@code
 * "--"}.
 */
public class FlagTable {

  private static final ImmutableSet<String> ZERO_TEXTS = ImmutableSet.of("", "0", "false");

  private final String name;
  private final ErrorHandling errorHandling;
  private final SortedMap<String, Flag> formal = new TreeMap<>();
  private final SortedMap<String, Flag> actual = new TreeMap<>();
  private ImmutableList<String> args = ImmutableList.of();
  private boolean parsed;
  private boolean sawTerminator;
  @Nullable private PrintStream output;
  @Nullable private Runnable usage;
  private IntConsumer exitHandler = System::exit;

  public FlagTable(String name, ErrorHandling errorHandling) {
    this.name = Preconditions.checkNotNull(name);
    this.errorHandling = Preconditions.checkNotNull(errorHandling);
  }

  public String getName() {
    return name;
  }

  public ErrorHandling getErrorHandling() {
    return errorHandling;
  }

  /** @return the destination for usage and error messages, stderr unless overridden. */
  public PrintStream getOutput() {
    return output == null ? System.err : output;
  }

  public void setOutput(@Nullable PrintStream output) {
    this.output = output;
  }

  /** Replaces the function called when a parse error occurs. */
  public void setUsage(@Nullable Runnable usage) {
    this.usage = usage;
  }

  /** Replaces how {@link ErrorHandling#EXIT_ON_ERROR} terminates the process. */
  public void setExitHandler(IntConsumer exitHandler) {
    this.exitHandler = Preconditions.checkNotNull(exitHandler);
  }

  IntConsumer getExitHandler() {
    return exitHandler;
  }

  /**
   * Defines a flag with the specified name and usage string. The default value is the current
   * rendering of {@code value}.
   *
   * @throws IllegalArgumentException if the name is malformed or already defined
   */
  public void var(FlagValue value, String flagName, String flagUsage) {
    Preconditions.checkArgument(!flagName.startsWith("-"), "flag %s begins with -", flagName);
    Preconditions.checkArgument(!flagName.contains("="), "flag %s contains =", flagName);
    if (formal.containsKey(flagName)) {
      String message =
          name.isEmpty()
              ? String.format("flag redefined: %s", flagName)
              : String.format("%s flag redefined: %s", name, flagName);
      getOutput().println(message);
      throw new IllegalArgumentException(message);
    }
    formal.put(flagName, new Flag(flagName, flagUsage, value, value.asString()));
  }

  public Optional<Flag> lookup(String flagName) {
    return Optional.ofNullable(formal.get(flagName));
  }

  /**
   * Sets the value of the named flag as if it had been given on the command line.
   *
   * @throws IllegalArgumentException if there is no such flag or the value does not parse
   */
  public void set(String flagName, String value) {
    Flag flag = formal.get(flagName);
    Preconditions.checkArgument(flag != null, "no such flag -%s", flagName);
    flag.getValue().set(value);
    actual.put(flagName, flag);
  }

  /**
   * Parses flag definitions from the argument list, which should not include the command name.
   * Must be called after all flags are defined and before flags are accessed by the program.
   *
   * @throws HelpRequestedException if {@code -help} or {@code -h} were set but not defined
   */
  public void parse(List<String> arguments) throws FlagParseException {
    parsed = true;
    sawTerminator = false;
    Deque<String> remaining = new ArrayDeque<>(arguments);
    try {
      while (parseOne(remaining)) {
        // keep scanning
      }
    } catch (FlagParseException e) {
      args = ImmutableList.copyOf(remaining);
      handleError(e);
      return;
    }
    args = ImmutableList.copyOf(remaining);
  }

  /** @return whether the current argument was a flag; consumes it and its value if so. */
  private boolean parseOne(Deque<String> remaining) throws FlagParseException {
    String s = remaining.peekFirst();
    if (s == null || s.length() < 2 || s.charAt(0) != '-') {
      return false;
    }
    int numMinuses = 1;
    if (s.charAt(1) == '-') {
      numMinuses++;
      if (s.length() == 2) {
        remaining.removeFirst();
        sawTerminator = true;
        return false;
      }
    }
    String flagName = s.substring(numMinuses);
    if (flagName.isEmpty() || flagName.charAt(0) == '-' || flagName.charAt(0) == '=') {
      throw failf("bad flag syntax: %s", s);
    }
    remaining.removeFirst();

    String value = null;
    int equals = flagName.indexOf('=', 1);
    if (equals > 0) {
      value = flagName.substring(equals + 1);
      flagName = flagName.substring(0, equals);
    }

    Flag flag = formal.get(flagName);
    if (flag == null) {
      if (flagName.equals("help") || flagName.equals("h")) {
        usage();
        throw new HelpRequestedException();
      }
      throw failf("flag provided but not defined: -%s", flagName);
    }

    if (flag.getValue().isBoolFlag()) {
      String text = value == null ? "true" : value;
      try {
        flag.getValue().set(text);
      } catch (IllegalArgumentException e) {
        if (value == null) {
          throw failf("invalid boolean flag %s: %s", flagName, e.getMessage());
        }
        throw failf(
            "invalid boolean value %s for -%s: %s",
            MoreStrings.quote(value),
            flagName,
            e.getMessage());
      }
    } else {
      if (value == null && !remaining.isEmpty()) {
        value = remaining.removeFirst();
      }
      if (value == null) {
        throw failf("flag needs an argument: -%s", flagName);
      }
      try {
        flag.getValue().set(value);
      } catch (IllegalArgumentException e) {
        throw failf(
            "invalid value %s for flag -%s: %s",
            MoreStrings.quote(value),
            flagName,
            e.getMessage());
      }
    }
    actual.put(flagName, flag);
    return true;
  }

  /** Applies the error handling policy to a failed parse. */
  void handleError(FlagParseException e) throws FlagParseException {
    switch (errorHandling) {
      case CONTINUE_ON_ERROR:
        throw e;
      case EXIT_ON_ERROR:
        exitHandler.accept(e instanceof HelpRequestedException ? 0 : ErrorHandling.EXIT_STATUS);
        throw e;
      case PANIC_ON_ERROR:
        throw new IllegalStateException(e.getMessage(), e);
    }
    throw new AssertionError("unknown error handling " + errorHandling);
  }

  /** Writes the error and the usage message to the output, and returns the error. */
  FlagParseException failf(String format, Object... formatArgs) {
    FlagParseException e = new FlagParseException(String.format(format, formatArgs));
    getOutput().println(e.getMessage());
    usage();
    return e;
  }

  void usage() {
    if (usage == null) {
      defaultUsage();
    } else {
      usage.run();
    }
  }

  public void defaultUsage() {
    if (name.isEmpty()) {
      getOutput().println("Usage:");
    } else {
      getOutput().printf("Usage of %s:%n", name);
    }
    printDefaults();
  }

  /** Prints the default values of all defined flags, one two-line entry each. */
  public void printDefaults() {
    visitAll(flag -> getOutput().println(describe("-", flag)));
  }

  /**
   * Renders one usage entry: a line with the name and value type, then the usage text indented by
   * a tab, followed by the default when it is not the zero value.
   */
  static String describe(String prefix, Flag flag) {
    StringBuilder builder = new StringBuilder("  ").append(prefix).append(flag.getName());
    String typeName = flag.getValue().typeName();
    String usage = flag.getUsage();
    int start = usage.indexOf('`');
    int end = start < 0 ? -1 : usage.indexOf('`', start + 1);
    if (end > start) {
      typeName = usage.substring(start + 1, end);
      usage = usage.substring(0, start) + typeName + usage.substring(end + 1);
    }
    if (!typeName.isEmpty()) {
      builder.append(' ').append(typeName);
    }
    builder.append(builder.length() <= 4 ? "\t" : "\n    \t");
    builder.append(usage.replace("\n", "\n    \t"));
    if (!isZeroValue(flag)) {
      String defValue = flag.getDefValue();
      builder
          .append(" (default ")
          .append(flag.getValue() instanceof StringValue ? MoreStrings.quote(defValue) : defValue)
          .append(')');
    }
    return builder.toString();
  }

  private static boolean isZeroValue(Flag flag) {
    FlagValue value = flag.getValue();
    if (value instanceof AbstractValue) {
      return flag.getDefValue().equals(((AbstractValue<?>) value).zeroString());
    }
    return ZERO_TEXTS.contains(flag.getDefValue());
  }

  public boolean isParsed() {
    return parsed;
  }

  /** @return whether the last parse consumed a {@code --} terminator. */
  public boolean sawTerminator() {
    return sawTerminator;
  }

  /** @return the non-flag arguments remaining after the last parse. */
  public ImmutableList<String> args() {
    return args;
  }

  public int nArg() {
    return args.size();
  }

  /** @return the i'th remaining argument, or the empty string if there is no such argument. */
  public String arg(int i) {
    return i < 0 || i >= args.size() ? "" : args.get(i);
  }

  /** @return the number of flags that have been set. */
  public int nFlag() {
    return actual.size();
  }

  /** Visits the flags that have been set, in lexicographical order. */
  public void visit(Consumer<Flag> visitor) {
    actual.values().forEach(visitor);
  }

  /** Visits all defined flags, in lexicographical order. */
  public void visitAll(Consumer<Flag> visitor) {
    formal.values().forEach(visitor);
  }
}
