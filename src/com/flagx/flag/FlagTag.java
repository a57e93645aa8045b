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

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

/**
 * Declares a field of an options object as a flag.
 *
 * <p>The tag is {@code name[;usage=text][;def=value]} for a named flag, {@code ?index[;...]} for
 * a positional entry, or {@code -} to leave the field alone. For example:
 *
 * <pre>
 *   &#64;FlagTag("timeout;usage=how long to wait;def=30s")
 *   Duration timeout;
 *
 *   &#64;FlagTag("?0;usage=file to open")
 *   String file;
 * </pre>
 *
 * Without {@code def} the value held by the field of a freshly constructed object is the default.
 */
@Documented
@Target(FIELD)
@Retention(RUNTIME)
public @interface FlagTag {
  String value();
}
