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

import com.flagx.flag.ErrorHandling;
import com.flagx.flag.Flag;
import com.flagx.flag.FlagParseException;
import com.flagx.flag.FlagSet;
import com.flagx.flag.OptionsIntrospector;
import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;
import java.util.BitSet;
import java.util.Optional;
import java.util.function.Supplier;
import javax.annotation.Nullable;

/**
 * How a registered {@link Action} or {@link Filter} is turned into a handler for one invocation.
 *
 * <p>A function binding hands out the registered object itself. An options binding hands out a
 * fresh copy whose fields were parsed from the arguments of the invocation.
 */
final class HandlerBinding<T> {

  @Nullable private final T function;
  @Nullable private final Supplier<? extends T> factory;
  private final ImmutableMap<String, Flag> options;
  private final String defaults;

  private HandlerBinding(
      @Nullable T function,
      @Nullable Supplier<? extends T> factory,
      ImmutableMap<String, Flag> options,
      String defaults) {
    this.function = function;
    this.factory = factory;
    this.options = options;
    this.defaults = defaults;
  }

  static HandlerBinding<Action> forAction(Action action) {
    Preconditions.checkNotNull(action, "action");
    if (action instanceof ActionCopier) {
      return options(((ActionCopier) action)::deepCopy);
    }
    return create(action, Action.class);
  }

  static HandlerBinding<Filter> forFilter(Filter filter) {
    Preconditions.checkNotNull(filter, "filter");
    if (filter instanceof FilterCopier) {
      return options(((FilterCopier) filter)::deepCopy);
    }
    return create(filter, Filter.class);
  }

  private static <T> HandlerBinding<T> create(T handler, Class<T> type) {
    Optional<Supplier<T>> factory = constructorFactory(handler, type);
    if (factory.isPresent()) {
      return options(factory.get());
    }
    Preconditions.checkArgument(
        OptionsIntrospector.introspect(handler.getClass()).isEmpty(),
        "flagx: options class %s needs an accessible no-arg constructor or must implement %sCopier",
        handler.getClass().getName(),
        type.getSimpleName());
    return new HandlerBinding<>(handler, null, ImmutableMap.of(), "");
  }

  /** Binds a template copy once so that malformed options fail at registration. */
  private static <T> HandlerBinding<T> options(Supplier<? extends T> factory) {
    FlagSet template = new FlagSet("", ErrorHandling.CONTINUE_ON_ERROR, true);
    template.structVars(Preconditions.checkNotNull(factory.get(), "copy is null"));

    ImmutableMap.Builder<String, Flag> options = ImmutableMap.builder();
    template.visitAll(flag -> options.put(flag.getName(), flag));
    template.visitAllPositionals(flag -> options.put(flag.getName(), flag));

    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    template.setOutput(new PrintStream(bytes, true, StandardCharsets.UTF_8));
    template.printDefaults();
    return new HandlerBinding<>(
        null, factory, options.build(), new String(bytes.toByteArray(), StandardCharsets.UTF_8));
  }

  private static <T> Optional<Supplier<T>> constructorFactory(T handler, Class<T> type) {
    Class<?> cls = handler.getClass();
    if (cls.isSynthetic() || Modifier.isAbstract(cls.getModifiers())) {
      return Optional.empty();
    }
    Constructor<?> constructor;
    try {
      constructor = cls.getDeclaredConstructor();
    } catch (NoSuchMethodException e) {
      return Optional.empty();
    }
    if (!constructor.trySetAccessible()) {
      return Optional.empty();
    }
    return Optional.of(
        () -> {
          try {
            return type.cast(constructor.newInstance());
          } catch (InvocationTargetException e) {
            Throwables.throwIfUnchecked(e.getCause());
            throw new IllegalStateException("flagx: cannot copy " + cls.getName(), e.getCause());
          } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("flagx: cannot copy " + cls.getName(), e);
          }
        });
  }

  boolean isFunction() {
    return function != null;
  }

  /** @return the named flags and positional entries of the options, keyed by display name. */
  ImmutableMap<String, Flag> getOptions() {
    return options;
  }

  /** @return the flag defaults in the {@link FlagSet#printDefaults()} layout. */
  String getDefaults() {
    return defaults;
  }

  /**
   * Produces the handler for one invocation.
   *
   * @param flagSetName name of the flag set used for error messages
   * @param args the arguments at the command's level
   * @param output where parse errors and usage are written
   * @throws StatusException with {@link Status#PARSE_FAILED} or {@link Status#VALIDATE_FAILED}
   */
  Bound<T> bind(
      String flagSetName,
      ImmutableList<String> args,
      PrintStream output,
      @Nullable Validator validator) {
    if (function != null) {
      return new Bound<>(function, new BitSet());
    }
    T copy = Preconditions.checkNotNull(factory.get(), "copy is null");
    FlagSet flagSet = new FlagSet(flagSetName, ErrorHandling.CONTINUE_ON_ERROR, true);
    flagSet.setOutput(output);
    flagSet.structVars(copy);
    try {
      flagSet.parse(args);
    } catch (FlagParseException e) {
      throw new StatusException(Status.of(Status.PARSE_FAILED, "", e));
    }
    if (validator != null) {
      try {
        validator.validate(copy);
      } catch (ValidationException e) {
        throw new StatusException(Status.of(Status.VALIDATE_FAILED, "", e));
      }
    }
    return new Bound<>(copy, flagSet.consumed());
  }

  /** A handler for one invocation and the argument positions its options used up. */
  static final class Bound<T> {
    private final T handler;
    private final BitSet consumed;

    private Bound(T handler, BitSet consumed) {
      this.handler = handler;
      this.consumed = consumed;
    }

    T getHandler() {
      return handler;
    }

    BitSet getConsumed() {
      return consumed;
    }
  }
}
