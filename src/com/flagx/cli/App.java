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
import com.flagx.util.MoreStrings;
import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.io.PrintStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * A command-line application: a tree of {@link Command}s rooted at the program, plus the metadata
 * shown in its usage text.
 *
 * <p>{@link #exec} routes an argument list to the deepest command with an action, collecting the
 * filters of every command on the way, and runs the action inside those filters. The tree should be
 * fully configured before the first call; calls to {@code exec} may then run concurrently.
 */
public class App {

  private static final Logger LOG = Logger.get(App.class);

  private static final String DEFAULT_VERSION = "0.0.1";
  private static final String TERMINATOR = "--";
  private static final ImmutableSet<String> HELP_ARGS = ImmutableSet.of("-h", "-help", "--help");
  private static final int MAX_SUGGESTION_DISTANCE = 2;

  private final ProgramInfo programInfo;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final Command root;

  private String cmdName;
  private String name = "";
  private String description = "";
  private String version = DEFAULT_VERSION;
  private Instant compiled;
  private ImmutableList<Author> authors = ImmutableList.of();
  private String copyright = "";
  @Nullable private Action notFound;
  @Nullable private Validator validator;
  private PrintStream output = System.err;
  @Nullable private volatile String usageText;

  public App() {
    this(ProgramInfo.fromSystem());
  }

  public App(ProgramInfo programInfo) {
    this.programInfo = Preconditions.checkNotNull(programInfo);
    this.cmdName = trimCmdName(programInfo.getProgramName());
    this.compiled = programInfo.getCompiled();
    this.root = new Command(ImmutableList.of(), "", () -> usageText = null);
  }

  private static String trimCmdName(String cmdName) {
    return CharMatcher.is('-').trimLeadingFrom(cmdName);
  }

  public Command getRoot() {
    return root;
  }

  public Command addSubcommand(String name, String description, Filter... filters) {
    return root.addSubcommand(name, description, filters);
  }

  public Command addSubaction(String name, String description, Action action, Filter... filters) {
    return root.addSubaction(name, description, action, filters);
  }

  /** Registers a filter around every command of the application. */
  public void addFilter(Filter filter) {
    root.addFilter(filter);
  }

  /** Makes the application itself handle its arguments, without subcommands. */
  public void setAction(Action action) {
    root.setAction(action);
  }

  // Metadata.

  public String getCmdName() {
    lock.readLock().lock();
    try {
      return cmdName;
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Sets the command name, the first element of every command path. Leading dashes are removed; an
   * empty name restores the program name.
   */
  public void setCmdName(@Nullable String cmdName) {
    lock.writeLock().lock();
    try {
      this.cmdName =
          trimCmdName(
              Strings.isNullOrEmpty(cmdName) ? programInfo.getProgramName() : cmdName);
      updateUsageLocked();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** @return the title of the application, the command name unless set. */
  public String getName() {
    lock.readLock().lock();
    try {
      return name.isEmpty() ? cmdName : name;
    } finally {
      lock.readLock().unlock();
    }
  }

  public void setName(@Nullable String name) {
    lock.writeLock().lock();
    try {
      this.name = Strings.nullToEmpty(name);
      updateUsageLocked();
    } finally {
      lock.writeLock().unlock();
    }
  }

  public String getDescription() {
    lock.readLock().lock();
    try {
      return description;
    } finally {
      lock.readLock().unlock();
    }
  }

  public void setDescription(@Nullable String description) {
    lock.writeLock().lock();
    try {
      this.description = Strings.nullToEmpty(description);
      updateUsageLocked();
    } finally {
      lock.writeLock().unlock();
    }
  }

  public String getVersion() {
    lock.readLock().lock();
    try {
      return version;
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Sets the version, without a leading {@code v} or {@code V}. Empty means {@code 0.0.1}. */
  public void setVersion(@Nullable String version) {
    String trimmed = Strings.nullToEmpty(version);
    if (trimmed.startsWith("v")) {
      trimmed = trimmed.substring(1);
    }
    if (trimmed.startsWith("V")) {
      trimmed = trimmed.substring(1);
    }
    lock.writeLock().lock();
    try {
      this.version = trimmed.isEmpty() ? DEFAULT_VERSION : trimmed;
      updateUsageLocked();
    } finally {
      lock.writeLock().unlock();
    }
  }

  public Instant getCompiled() {
    lock.readLock().lock();
    try {
      return compiled;
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Sets the build time; null restores the time from {@link ProgramInfo}. */
  public void setCompiled(@Nullable Instant compiled) {
    lock.writeLock().lock();
    try {
      this.compiled = compiled == null ? programInfo.getCompiled() : compiled;
      updateUsageLocked();
    } finally {
      lock.writeLock().unlock();
    }
  }

  public ImmutableList<Author> getAuthors() {
    lock.readLock().lock();
    try {
      return authors;
    } finally {
      lock.readLock().unlock();
    }
  }

  public void setAuthors(List<Author> authors) {
    lock.writeLock().lock();
    try {
      this.authors = ImmutableList.copyOf(authors);
      updateUsageLocked();
    } finally {
      lock.writeLock().unlock();
    }
  }

  public String getCopyright() {
    lock.readLock().lock();
    try {
      return copyright;
    } finally {
      lock.readLock().unlock();
    }
  }

  public void setCopyright(@Nullable String copyright) {
    lock.writeLock().lock();
    try {
      this.copyright = Strings.nullToEmpty(copyright);
      updateUsageLocked();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Sets the handler run, without filters, when the arguments name no command. Without one, such
   * arguments yield {@link Status#NOT_FOUND}.
   */
  public void setNotFound(@Nullable Action notFound) {
    lock.writeLock().lock();
    try {
      this.notFound = notFound;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Sets the check applied to every options object after its flags are parsed. */
  public void setValidator(@Nullable Validator validator) {
    lock.writeLock().lock();
    try {
      this.validator = validator;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public PrintStream getOutput() {
    lock.readLock().lock();
    try {
      return output;
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Sets where help text and parse errors are written, stderr by default. */
  public void setOutput(PrintStream output) {
    lock.writeLock().lock();
    try {
      this.output = Preconditions.checkNotNull(output);
    } finally {
      lock.writeLock().unlock();
    }
  }

  public String getUsageText() {
    String text = usageText;
    if (text != null) {
      return text;
    }
    lock.writeLock().lock();
    try {
      return updateUsageLocked();
    } finally {
      lock.writeLock().unlock();
    }
  }

  private String updateUsageLocked() {
    String text = renderUsageLocked();
    usageText = text;
    return text;
  }

  private String renderUsageLocked() {
    return UsageRenderer.renderApp(
        name.isEmpty() ? cmdName : name, cmdName, version, description, root, authors, copyright);
  }

  // Dispatch.

  /** Same as {@link #exec(CancellationCarrier, List)} with a background carrier. */
  public Status exec(List<String> arguments) {
    return exec(CancellationCarrier.background(), arguments);
  }

  /**
   * Routes {@code arguments} to a handler and runs it.
   *
   * @param arguments the process arguments; a leading command name is skipped
   * @return {@link Status#ok()}, the status a handler threw with {@link StatusException}, a routing
   *     failure, or {@link Status#UNCAUGHT} for any other exception or error a handler threw
   * @throws VirtualMachineError when the JVM fails, e.g. {@link OutOfMemoryError}
   */
  public Status exec(CancellationCarrier carrier, List<String> arguments) {
    ImmutableList<String> args = ImmutableList.copyOf(arguments);
    try {
      Route route = route(args);
      route.handler.handle(new Context(carrier, args, route.cmdPath));
      return Status.ok();
    } catch (StatusException e) {
      LOG.debug("%s: %s", args, e.getStatus());
      return e.getStatus();
    } catch (VirtualMachineError e) {
      throw e;
    } catch (RuntimeException | Error e) {
      LOG.warn(e, "uncaught exception handling %s", args);
      return Status.uncaught(e);
    }
  }

  private Route route(ImmutableList<String> arguments) {
    lock.readLock().lock();
    try {
      List<String> cmdPath = new ArrayList<>();
      cmdPath.add(cmdName);
      ImmutableList<String> args = arguments;
      if (!args.isEmpty() && args.get(0).equals(cmdName)) {
        args = args.subList(1, args.size());
      }

      List<Filter> chain = new ArrayList<>();
      Command current = root;
      while (true) {
        String flagSetName = Joiner.on(' ').join(cmdPath);

        BitSet consumed = new BitSet();
        for (HandlerBinding<Filter> binding : current.getFilters()) {
          HandlerBinding.Bound<Filter> filter =
              binding.bind(flagSetName, args, output, validator);
          chain.add(filter.getHandler());
          consumed.or(filter.getConsumed());
        }
        args = remove(args, consumed);

        Optional<HandlerBinding<Action>> binding = current.getAction();
        if (binding.isPresent()) {
          Action action = binding.get().bind(flagSetName, args, output, validator).getHandler();
          LOG.debug("routed %s to \"%s\"", arguments, flagSetName);
          return new Route(wrap(chain, action), cmdPath);
        }

        if (!args.isEmpty() && args.get(0).equals(TERMINATOR)) {
          args = args.subList(1, args.size());
        }
        if (args.isEmpty()) {
          return notFound(current, cmdPath);
        }
        String next = args.get(0);
        if (HELP_ARGS.contains(next)) {
          String cached = usageText;
          String help;
          if (current != root) {
            help = UsageRenderer.renderCommand(cmdName, current);
          } else {
            help = cached == null ? renderUsageLocked() : cached;
          }
          output.print(help);
          return new Route(context -> {}, cmdPath);
        }
        if (next.length() > 1 && next.charAt(0) == '-') {
          throw new StatusException(
              Status.of(
                  Status.BAD_ARGS, "flag provided but not defined: " + next, null));
        }
        cmdPath.add(next);
        Optional<Command> subcommand = current.getSubcommand(next);
        if (!subcommand.isPresent()) {
          return notFound(current, cmdPath);
        }
        current = subcommand.get();
        args = args.subList(1, args.size());
      }
    } finally {
      lock.readLock().unlock();
    }
  }

  private Route notFound(Command current, List<String> cmdPath) {
    if (notFound != null) {
      return new Route(notFound, cmdPath);
    }
    String message =
        String.format(
            "not found command action: %s", MoreStrings.quote(Joiner.on(' ').join(cmdPath)));
    if (cmdPath.size() > current.getPath().size() + 1) {
      String unknown = cmdPath.get(cmdPath.size() - 1);
      List<String> names =
          current.getSubcommands().stream().map(Command::getName).collect(Collectors.toList());
      ImmutableList<String> suggestions =
          MoreStrings.getSpellingSuggestions(unknown, names, MAX_SUGGESTION_DISTANCE);
      if (!suggestions.isEmpty()) {
        message += String.format("; did you mean %s?", Joiner.on(" or ").join(suggestions));
      }
    }
    throw new StatusException(Status.of(Status.NOT_FOUND, message, null));
  }

  /** Wraps {@code action} so that the first filter of {@code chain} runs outermost. */
  private static Action wrap(List<Filter> chain, Action action) {
    Action handler = action;
    for (int i = chain.size() - 1; i >= 0; i--) {
      Filter filter = chain.get(i);
      Action next = handler;
      handler = context -> filter.filter(context, next);
    }
    return handler;
  }

  private static ImmutableList<String> remove(ImmutableList<String> args, BitSet positions) {
    if (positions.isEmpty()) {
      return args;
    }
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (int i = positions.nextClearBit(0); i < args.size(); i = positions.nextClearBit(i + 1)) {
      builder.add(args.get(i));
    }
    return builder.build();
  }

  private static final class Route {
    private final Action handler;
    private final ImmutableList<String> cmdPath;

    private Route(Action handler, List<String> cmdPath) {
      this.handler = handler;
      this.cmdPath = ImmutableList.copyOf(cmdPath);
    }
  }
}
