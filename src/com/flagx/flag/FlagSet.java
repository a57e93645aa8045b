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

import com.flagx.log.Logger;
import com.flagx.util.MoreStrings;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;
import java.io.PrintStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import javax.annotation.Nullable;

/**
 * A set of named flags plus positional entries, the bare arguments bound by their index once the
 * flags have been removed.
 *
 * <p>Named flags are scanned by a {@link FlagTable}. When {@code continueOnUndefined} is set, flags
 * the set does not define are tolerated: defined flags are pulled out of the argument list wherever
 * they occur (up to the first {@code --}) and everything else is left, in order, for {@link
 * #nextArgs()}. Positional indices then skip arguments with no declared entry instead of stopping
 * at them.
 *
 * <p>A flag set is meant to serve one parse; state from an earlier parse is reset by the next one.
 */
public class FlagSet {

  private static final Logger LOG = Logger.get(FlagSet.class);

  /** Display prefix of positional entries, e.g. {@code ?0}. */
  public static final String POSITIONAL_PREFIX = "?";

  private static final String TERMINATOR = "--";

  private final FlagTable table;
  private final boolean continueOnUndefined;
  private final SortedMap<Integer, Flag> positionalFormal = new TreeMap<>();
  private final SortedMap<Integer, Flag> positionalActual = new TreeMap<>();
  @Nullable private Runnable usage;

  private ImmutableList<String> input = ImmutableList.of();
  private ImmutableList<String> args = ImmutableList.of();
  private BitSet consumed = new BitSet();
  private boolean terminated;
  private int terminatorIndex = -1;

  public FlagSet(String name, ErrorHandling errorHandling, boolean continueOnUndefined) {
    this.table = new FlagTable(name, errorHandling);
    this.continueOnUndefined = continueOnUndefined;
    this.table.setUsage(this::usage);
  }

  /** @return a strict flag set, one that rejects undefined flags. */
  public static FlagSet newFlagSet(String name, ErrorHandling errorHandling) {
    return new FlagSet(name, errorHandling, false);
  }

  public String getName() {
    return table.getName();
  }

  public ErrorHandling getErrorHandling() {
    return table.getErrorHandling();
  }

  public boolean isContinueOnUndefined() {
    return continueOnUndefined;
  }

  public PrintStream getOutput() {
    return table.getOutput();
  }

  public void setOutput(@Nullable PrintStream output) {
    table.setOutput(output);
  }

  public void setUsage(@Nullable Runnable usage) {
    this.usage = usage;
  }

  public void setExitHandler(IntConsumer exitHandler) {
    table.setExitHandler(exitHandler);
  }

  // Named flags.

  public void var(FlagValue value, String name, String usage) {
    table.var(value, name, usage);
  }

  public Optional<Flag> lookup(String name) {
    return table.lookup(name);
  }

  public void set(String name, String value) {
    table.set(name, value);
  }

  public ValueCell<Boolean> boolFlag(String name, boolean value, String usage) {
    ValueCell<Boolean> cell = ValueCell.of(value);
    var(new BoolValue(cell), name, usage);
    return cell;
  }

  public ValueCell<Integer> intFlag(String name, int value, String usage) {
    ValueCell<Integer> cell = ValueCell.of(value);
    var(new IntValue(cell), name, usage);
    return cell;
  }

  public ValueCell<Long> int64Flag(String name, long value, String usage) {
    ValueCell<Long> cell = ValueCell.of(value);
    var(new Int64Value(cell), name, usage);
    return cell;
  }

  public ValueCell<UnsignedInteger> uintFlag(String name, UnsignedInteger value, String usage) {
    ValueCell<UnsignedInteger> cell = ValueCell.of(value);
    var(new UintValue(cell), name, usage);
    return cell;
  }

  public ValueCell<UnsignedLong> uint64Flag(String name, UnsignedLong value, String usage) {
    ValueCell<UnsignedLong> cell = ValueCell.of(value);
    var(new Uint64Value(cell), name, usage);
    return cell;
  }

  public ValueCell<Double> float64Flag(String name, double value, String usage) {
    ValueCell<Double> cell = ValueCell.of(value);
    var(new Float64Value(cell), name, usage);
    return cell;
  }

  public ValueCell<String> stringFlag(String name, String value, String usage) {
    ValueCell<String> cell = ValueCell.of(value);
    var(new StringValue(cell), name, usage);
    return cell;
  }

  public ValueCell<Duration> durationFlag(String name, Duration value, String usage) {
    ValueCell<Duration> cell = ValueCell.of(value);
    var(new DurationValue(cell), name, usage);
    return cell;
  }

  // Positional entries.

  /**
   * Defines a positional entry at {@code index}. The default value is the current rendering of
   * {@code value}.
   *
   * @throws IllegalArgumentException if the index is negative or already defined
   */
  public void positionalVar(FlagValue value, int index, String usage) {
    Preconditions.checkArgument(index >= 0, "%s is not a valid positional index", index);
    String name = positionalName(index);
    if (positionalFormal.containsKey(index)) {
      String message =
          getName().isEmpty()
              ? String.format("flag redefined: %s", name)
              : String.format("%s flag redefined: %s", getName(), name);
      getOutput().println(message);
      throw new IllegalArgumentException(message);
    }
    positionalFormal.put(index, new Flag(name, usage, value, value.asString()));
  }

  public ValueCell<Boolean> boolPositional(int index, boolean value, String usage) {
    ValueCell<Boolean> cell = ValueCell.of(value);
    positionalVar(new BoolValue(cell), index, usage);
    return cell;
  }

  public ValueCell<Integer> intPositional(int index, int value, String usage) {
    ValueCell<Integer> cell = ValueCell.of(value);
    positionalVar(new IntValue(cell), index, usage);
    return cell;
  }

  public ValueCell<Long> int64Positional(int index, long value, String usage) {
    ValueCell<Long> cell = ValueCell.of(value);
    positionalVar(new Int64Value(cell), index, usage);
    return cell;
  }

  public ValueCell<UnsignedInteger> uintPositional(
      int index, UnsignedInteger value, String usage) {
    ValueCell<UnsignedInteger> cell = ValueCell.of(value);
    positionalVar(new UintValue(cell), index, usage);
    return cell;
  }

  public ValueCell<UnsignedLong> uint64Positional(int index, UnsignedLong value, String usage) {
    ValueCell<UnsignedLong> cell = ValueCell.of(value);
    positionalVar(new Uint64Value(cell), index, usage);
    return cell;
  }

  public ValueCell<Double> float64Positional(int index, double value, String usage) {
    ValueCell<Double> cell = ValueCell.of(value);
    positionalVar(new Float64Value(cell), index, usage);
    return cell;
  }

  public ValueCell<String> stringPositional(int index, String value, String usage) {
    ValueCell<String> cell = ValueCell.of(value);
    positionalVar(new StringValue(cell), index, usage);
    return cell;
  }

  public ValueCell<Duration> durationPositional(int index, Duration value, String usage) {
    ValueCell<Duration> cell = ValueCell.of(value);
    positionalVar(new DurationValue(cell), index, usage);
    return cell;
  }

  public Optional<Flag> lookupPositional(int index) {
    return Optional.ofNullable(positionalFormal.get(index));
  }

  /**
   * Defines flags and positional entries from the tagged fields of {@code options}.
   *
   * @throws IllegalArgumentException if {@code options} is not an options object, or a tag is
   *     malformed
   * @see FlagTag
   */
  public void structVars(Object options) {
    OptionsIntrospector.bind(options, this);
  }

  // Parsing.

  /**
   * Parses the argument list. A leading argument equal to the name of this set is taken to be the
   * invoked command and skipped.
   */
  public void parse(List<String> arguments) throws FlagParseException {
    input = ImmutableList.copyOf(arguments);
    consumed = new BitSet(input.size());
    positionalActual.clear();
    terminated = false;
    terminatorIndex = -1;

    int offset = 0;
    if (!input.isEmpty() && !getName().isEmpty() && input.get(0).equals(getName())) {
      consumed.set(0);
      offset = 1;
    }
    if (continueOnUndefined) {
      parseTolerant(offset);
    } else {
      parseStrict(offset);
    }
    if (LOG.isVerboseEnabled()) {
      LOG.verbose(
          "%s: parsed %s, %d flags, %d positionals, next %s",
          getName(), input, table.nFlag(), positionalActual.size(), nextArgs());
    }
  }

  private void parseStrict(int offset) throws FlagParseException {
    table.parse(input.subList(offset, input.size()));
    args = table.args();
    int restStart = input.size() - args.size();
    consumed.set(0, restStart);
    if (table.sawTerminator()) {
      terminated = true;
      terminatorIndex = restStart - 1;
      return;
    }
    for (int k = 0; k < args.size(); k++) {
      String value = args.get(k);
      if (value.equals(TERMINATOR)) {
        if (positionalFormal.containsKey(k)) {
          table.handleError(table.failf("positional %d defined but not provided", k));
        }
        terminated = true;
        terminatorIndex = restStart + k;
        consumed.set(terminatorIndex);
        return;
      }
      if (!bindPositional(k, value)) {
        return;
      }
      consumed.set(restStart + k);
    }
  }

  private void parseTolerant(int offset) throws FlagParseException {
    List<String> recognized = new ArrayList<>();
    List<Integer> bare = new ArrayList<>();
    int pos = offset;
    while (pos < input.size()) {
      ArgTokenizer.Token token;
      try {
        token = ArgTokenizer.next(input, pos, this::isBoolFlag);
      } catch (FlagParseException e) {
        table.handleError(table.failf("%s", e.getMessage()));
        return;
      }
      if (token.getKind() == ArgTokenizer.Kind.TERMINATOR) {
        terminated = true;
        terminatorIndex = pos;
        consumed.set(pos);
        break;
      }
      if (token.getKind() == ArgTokenizer.Kind.NON_FLAG) {
        bare.add(pos);
      } else if (table.lookup(token.getName()).isPresent()) {
        recognized.add(token.toArgument());
        consumed.set(pos, pos + token.getWidth());
      }
      pos += token.getWidth();
    }

    table.parse(recognized);
    args = unconsumed();
    if (terminated) {
      return;
    }
    for (int k = 0; k < bare.size(); k++) {
      int index = bare.get(k);
      if (bindPositional(k, input.get(index))) {
        consumed.set(index);
      }
    }
  }

  private boolean isBoolFlag(String name) {
    return table.lookup(name).map(flag -> flag.getValue().isBoolFlag()).orElse(false);
  }

  /** @return whether a positional entry exists at {@code index} and was bound. */
  private boolean bindPositional(int index, String value) throws FlagParseException {
    Flag flag = positionalFormal.get(index);
    if (flag == null) {
      return false;
    }
    try {
      flag.getValue().set(value);
    } catch (IllegalArgumentException e) {
      table.handleError(
          table.failf(
              "invalid value %s for positional %d: %s",
              MoreStrings.quote(value),
              index,
              e.getMessage()));
      return false;
    }
    positionalActual.put(index, flag);
    return true;
  }

  private ImmutableList<String> unconsumed() {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (int i = consumed.nextClearBit(0); i < input.size(); i = consumed.nextClearBit(i + 1)) {
      builder.add(input.get(i));
    }
    return builder.build();
  }

  /**
   * @return the arguments left after flag scanning, before positional binding. When a terminator
   *     was met these are the arguments after it.
   */
  public ImmutableList<String> args() {
    return args;
  }

  /**
   * @return every argument of the last parse that was neither a defined flag (or its value), nor
   *     the terminator, nor a bound positional, in the original order. This is what a nested
   *     command gets to parse.
   */
  public ImmutableList<String> nextArgs() {
    return unconsumed();
  }

  /** @return the arguments after the terminator, or empty if there was none. */
  public ImmutableList<String> subArgs() {
    if (terminatorIndex < 0) {
      List<String> next = nextArgs();
      int index = next.indexOf(TERMINATOR);
      return index < 0
          ? ImmutableList.of()
          : ImmutableList.copyOf(next.subList(index + 1, next.size()));
    }
    return input.subList(terminatorIndex + 1, input.size());
  }

  /** @return positions in the last parsed list that were used up by this set. */
  public BitSet consumed() {
    return (BitSet) consumed.clone();
  }

  /** @return whether the last parse met a {@code --} that ended scanning. */
  public boolean isTerminated() {
    return terminated;
  }

  public boolean isParsed() {
    return table.isParsed();
  }

  public int nFlag() {
    return table.nFlag();
  }

  /** @return the number of positional entries bound by the last parse. */
  public int nPositional() {
    return positionalActual.size();
  }

  public void visit(Consumer<Flag> visitor) {
    table.visit(visitor);
  }

  public void visitAll(Consumer<Flag> visitor) {
    table.visitAll(visitor);
  }

  /** Visits the positional entries bound by the last parse, by index. */
  public void visitPositionals(Consumer<Flag> visitor) {
    positionalActual.values().forEach(visitor);
  }

  /** Visits all defined positional entries, by index. */
  public void visitAllPositionals(Consumer<Flag> visitor) {
    positionalFormal.values().forEach(visitor);
  }

  // Usage.

  private void usage() {
    if (usage == null) {
      defaultUsage();
    } else {
      usage.run();
    }
  }

  public void defaultUsage() {
    if (getName().isEmpty()) {
      getOutput().println("Usage:");
    } else {
      getOutput().printf("Usage of %s:%n", getName());
    }
    printDefaults();
  }

  /** Prints named flags, then positional entries. */
  public void printDefaults() {
    table.printDefaults();
    visitAllPositionals(flag -> getOutput().println(FlagTable.describe("", flag)));
  }

  public static String positionalName(int index) {
    return POSITIONAL_PREFIX + index;
  }
}
