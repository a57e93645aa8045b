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

import com.flagx.flag.Flag;
import com.flagx.log.Logger;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import javax.annotation.Nullable;

/**
 * A node of the command tree. A command either has an action, and handles its arguments, or has
 * subcommands, and routes to them by the next argument. Filters may be registered on either kind.
 *
 * <p>A command knows its path from the root but holds no reference to its parent.
 */
public class Command {

  private static final Logger LOG = Logger.get(Command.class);

  private final ImmutableList<String> path;
  private final String description;
  private final Runnable onChange;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  private final List<HandlerBinding<Filter>> filters = new ArrayList<>();
  @Nullable private HandlerBinding<Action> action;
  private final SortedMap<String, Command> subcommands = new TreeMap<>();

  /**
   * @param path names from the root, empty for the root command
   * @param onChange called after every change to this command or one added below it
   */
  Command(ImmutableList<String> path, String description, Runnable onChange) {
    this.path = path;
    this.description = description;
    this.onChange = onChange;
  }

  /** @return the command's own name, empty for the root command. */
  public String getName() {
    return path.isEmpty() ? "" : path.get(path.size() - 1);
  }

  public String getDescription() {
    return description;
  }

  public ImmutableList<String> getPath() {
    return path;
  }

  public String getPathString() {
    return Joiner.on(' ').join(path);
  }

  /**
   * Adds a subcommand with the given filters.
   *
   * @throws IllegalArgumentException if the name is empty or taken, or a filter is an options
   *     object with malformed options
   * @throws IllegalStateException if this command has an action
   */
  public Command addSubcommand(String name, String description, Filter... filters) {
    return addSubcommand(name, description, bindFilters(filters), null);
  }

  /**
   * Adds a subcommand that handles its arguments with {@code action}. Nothing is added when the
   * action or a filter is rejected.
   */
  public Command addSubaction(String name, String description, Action action, Filter... filters) {
    ImmutableList<HandlerBinding<Filter>> filterBindings = bindFilters(filters);
    return addSubcommand(name, description, filterBindings, HandlerBinding.forAction(action));
  }

  private static ImmutableList<HandlerBinding<Filter>> bindFilters(Filter... filters) {
    ImmutableList.Builder<HandlerBinding<Filter>> bindings = ImmutableList.builder();
    for (Filter filter : filters) {
      bindings.add(HandlerBinding.forFilter(filter));
    }
    return bindings.build();
  }

  private Command addSubcommand(
      String name,
      String description,
      ImmutableList<HandlerBinding<Filter>> filterBindings,
      @Nullable HandlerBinding<Action> actionBinding) {
    Preconditions.checkArgument(name != null && !name.isEmpty(), "command name is empty");
    Command subcommand =
        new Command(
            ImmutableList.<String>builder().addAll(path).add(name).build(),
            Preconditions.checkNotNull(description),
            onChange);
    subcommand.filters.addAll(filterBindings);
    subcommand.action = actionBinding;
    lock.writeLock().lock();
    try {
      Preconditions.checkState(
          action == null,
          "action has been set, no subcommand can be set: \"%s\"",
          getPathString());
      Preconditions.checkArgument(
          !subcommands.containsKey(name), "command named %s already exists", name);
      subcommands.put(name, subcommand);
    } finally {
      lock.writeLock().unlock();
    }
    LOG.verbose("added command \"%s\"", subcommand.getPathString());
    onChange.run();
    return subcommand;
  }

  /**
   * Registers a filter. Filters run in registration order, after those of the enclosing commands.
   *
   * @throws IllegalArgumentException if the filter is an options object with malformed options
   */
  public void addFilter(Filter filter) {
    HandlerBinding<Filter> binding = HandlerBinding.forFilter(filter);
    lock.writeLock().lock();
    try {
      filters.add(binding);
    } finally {
      lock.writeLock().unlock();
    }
    onChange.run();
  }

  /**
   * @throws IllegalStateException if this command has subcommands or already has an action
   * @throws IllegalArgumentException if the action is an options object with malformed options
   */
  public void setAction(Action action) {
    setActionBinding(HandlerBinding.forAction(action));
  }

  private void setActionBinding(HandlerBinding<Action> binding) {
    lock.writeLock().lock();
    try {
      Preconditions.checkState(
          subcommands.isEmpty(),
          "some subcommands have been set, no action can be set: \"%s\"",
          getPathString());
      Preconditions.checkState(
          this.action == null, "action has already been set: \"%s\"", getPathString());
      this.action = binding;
    } finally {
      lock.writeLock().unlock();
    }
    onChange.run();
  }

  public Optional<Command> getSubcommand(String name) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(subcommands.get(name));
    } finally {
      lock.readLock().unlock();
    }
  }

  /** @return the subcommands, sorted by name. */
  public ImmutableList<Command> getSubcommands() {
    lock.readLock().lock();
    try {
      return ImmutableList.copyOf(subcommands.values());
    } finally {
      lock.readLock().unlock();
    }
  }

  public boolean hasAction() {
    return getAction().isPresent();
  }

  /** @return the options of the action keyed by flag name, empty for a function action. */
  public ImmutableMap<String, Flag> getActionOptions() {
    return getAction().map(HandlerBinding::getOptions).orElse(ImmutableMap.of());
  }

  /** @return the options of all options-backed filters of this command, keyed by flag name. */
  public ImmutableMap<String, Flag> getFilterOptions() {
    Map<String, Flag> options = new LinkedHashMap<>();
    for (HandlerBinding<Filter> filter : getFilters()) {
      filter.getOptions().forEach(options::putIfAbsent);
    }
    return ImmutableMap.copyOf(options);
  }

  /**
   * @return for a command with an action, a {@code path # description} line followed by the
   *     action's flag defaults; otherwise the usage text of every subcommand.
   */
  public String getUsageText() {
    Optional<HandlerBinding<Action>> binding = getAction();
    if (binding.isPresent()) {
      String header = path.isEmpty() ? "" : getPathString() + " # " + description + "\n";
      return header + binding.get().getDefaults();
    }
    StringBuilder builder = new StringBuilder();
    for (Command subcommand : getSubcommands()) {
      builder.append(subcommand.getUsageText());
    }
    return builder.toString();
  }

  /** @return the commands below this one that have an action, depth first by name. */
  ImmutableList<Command> getLeaves() {
    ImmutableList.Builder<Command> builder = ImmutableList.builder();
    for (Command subcommand : getSubcommands()) {
      if (subcommand.hasAction()) {
        builder.add(subcommand);
      } else {
        builder.addAll(subcommand.getLeaves());
      }
    }
    return builder.build();
  }

  ImmutableList<HandlerBinding<Filter>> getFilters() {
    lock.readLock().lock();
    try {
      return ImmutableList.copyOf(filters);
    } finally {
      lock.readLock().unlock();
    }
  }

  Optional<HandlerBinding<Action>> getAction() {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(action);
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public String toString() {
    return "Command{" + getPathString() + "}";
  }
}
