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
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.base.Throwables;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Primitives;
import com.google.common.util.concurrent.UncheckedExecutionException;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Optional;
import java.util.OptionalInt;
import javax.annotation.Nullable;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;

/**
 * Turns the annotated fields of an options class into {@link FieldBinding}s and registers them on
 * a {@link FlagSet}.
 *
 * <p>Fields are declared with {@link FlagTag}, or with the args4j {@link Option} and {@link
 * Argument} annotations. Only the fields of the class itself and its superclasses are considered;
 * a field holding another options object is not descended into.
 */
public final class OptionsIntrospector {

  private static final Logger LOG = Logger.get(OptionsIntrospector.class);

  private static final String SKIP = "-";
  private static final String USAGE_KEY = "usage=";
  private static final String DEFAULT_KEY = "def=";

  private static final LoadingCache<Class<?>, ImmutableList<FieldBinding>> BINDINGS =
      CacheBuilder.newBuilder()
          .weakKeys()
          .build(CacheLoader.from(OptionsIntrospector::computeBindings));

  private OptionsIntrospector() {}

  /**
   * @return the bindings declared by {@code type}, in field order, superclass fields first.
   * @throws IllegalArgumentException if a tag is malformed or a tagged field has an unsupported
   *     type
   */
  public static ImmutableList<FieldBinding> introspect(Class<?> type) {
    try {
      return BINDINGS.getUnchecked(type);
    } catch (UncheckedExecutionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw e;
    }
  }

  /** Registers every binding of {@code options} on {@code flagSet}, bound to its fields. */
  static void bind(@Nullable Object options, FlagSet flagSet) {
    checkOptionsObject(options);
    for (FieldBinding binding : introspect(options.getClass())) {
      FlagValue value = binding.getKind().newValue(binding.getField(), options);
      if (binding.getDefaultText().isPresent()) {
        String text = binding.getDefaultText().get();
        try {
          value.set(text);
        } catch (IllegalArgumentException e) {
          throw new IllegalArgumentException(
              String.format(
                  "flagx: invalid default %s for %s: %s",
                  text, describe(binding.getField()), e.getMessage()),
              e);
        }
      }
      if (binding.isPositional()) {
        flagSet.positionalVar(value, binding.getPositionalIndex().getAsInt(), binding.getUsage());
      } else {
        flagSet.var(value, binding.getName(), binding.getUsage());
      }
    }
  }

  private static void checkOptionsObject(@Nullable Object options) {
    if (options == null) {
      throw new IllegalArgumentException("flagx: want an options object, but got null");
    }
    Class<?> type = options.getClass();
    if (type.isArray()
        || type.isEnum()
        || Primitives.isWrapperType(type)
        || options instanceof CharSequence
        || options instanceof Class) {
      throw new IllegalArgumentException(
          "flagx: want an options object, but got " + type.getName());
    }
  }

  private static ImmutableList<FieldBinding> computeBindings(Class<?> type) {
    Deque<Class<?>> hierarchy = new ArrayDeque<>();
    for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
      hierarchy.push(c);
    }
    ImmutableList.Builder<FieldBinding> builder = ImmutableList.builder();
    for (Class<?> c : hierarchy) {
      for (Field field : c.getDeclaredFields()) {
        if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
          continue;
        }
        FlagTag tag = field.getAnnotation(FlagTag.class);
        Option option = field.getAnnotation(Option.class);
        Argument argument = field.getAnnotation(Argument.class);
        if (tag != null) {
          addTagged(builder, field, tag.value());
        } else if (option != null) {
          addOption(builder, field, option);
        } else if (argument != null) {
          builder.add(
              FieldBinding.of(
                  field,
                  FlagSet.positionalName(argument.index()),
                  OptionalInt.of(argument.index()),
                  argument.usage(),
                  Optional.empty(),
                  kindOf(field)));
        }
      }
    }
    ImmutableList<FieldBinding> bindings = builder.build();
    LOG.verbose("%s declares %d flags", type.getName(), bindings.size());
    return bindings;
  }

  private static void addTagged(
      ImmutableList.Builder<FieldBinding> builder, Field field, String tag) {
    Iterator<String> segments = Splitter.on(';').split(tag).iterator();
    String name = segments.next().trim();
    if (name.equals(SKIP)) {
      return;
    }
    if (name.isEmpty()) {
      name = field.getName();
    }
    StringBuilder usage = null;
    StringBuilder defaultText = null;
    StringBuilder last = null;
    while (segments.hasNext()) {
      String segment = segments.next();
      if (segment.startsWith(USAGE_KEY)) {
        usage = new StringBuilder(segment.substring(USAGE_KEY.length()));
        last = usage;
      } else if (segment.startsWith(DEFAULT_KEY)) {
        defaultText = new StringBuilder(segment.substring(DEFAULT_KEY.length()));
        last = defaultText;
      } else if (last != null) {
        last.append(';').append(segment);
      } else {
        throw new IllegalArgumentException(
            String.format("flagx: malformed tag %s on %s", tag, describe(field)));
      }
    }

    OptionalInt index = OptionalInt.empty();
    if (name.startsWith(FlagSet.POSITIONAL_PREFIX)) {
      String digits = name.substring(FlagSet.POSITIONAL_PREFIX.length());
      if (digits.isEmpty() || !CharMatcher.inRange('0', '9').matchesAllOf(digits)) {
        throw new IllegalArgumentException(
            String.format("flagx: bad positional index in tag %s on %s", tag, describe(field)));
      }
      index = OptionalInt.of(Integer.parseInt(digits));
    }
    builder.add(
        FieldBinding.of(
            field,
            name,
            index,
            usage == null ? "" : usage.toString(),
            Optional.ofNullable(defaultText).map(StringBuilder::toString),
            kindOf(field)));
  }

  private static void addOption(
      ImmutableList.Builder<FieldBinding> builder, Field field, Option option) {
    ValueKind kind = kindOf(field);
    builder.add(
        FieldBinding.of(
            field,
            stripDashes(option.name()),
            OptionalInt.empty(),
            option.usage(),
            Optional.empty(),
            kind));
    for (String alias : option.aliases()) {
      builder.add(
          FieldBinding.of(
              field, stripDashes(alias), OptionalInt.empty(), option.usage(), Optional.empty(),
              kind));
    }
  }

  private static String stripDashes(String name) {
    return CharMatcher.is('-').trimLeadingFrom(name);
  }

  private static ValueKind kindOf(Field field) {
    return ValueKind.forType(field.getType())
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    String.format(
                        "flagx: %s has unsupported type %s; nested options are not supported",
                        describe(field), field.getType().getName())));
  }

  private static String describe(Field field) {
    return field.getDeclaringClass().getName() + "." + field.getName();
  }
}
