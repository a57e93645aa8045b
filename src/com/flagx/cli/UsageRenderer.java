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

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.stringtemplate.v4.ST;

/** Renders the help text of applications and commands. */
final class UsageRenderer {

  private static final String APP_TEMPLATE =
      "$name$$if(version)$ - v$version$$endif$$if(description)$\n\n$description$$endif$\n\n"
          + "USAGE:\n"
          + "  $cmdName$$if(filters)$ [-globaloptions --]$endif$"
          + "$if(actionOptions)$ [-options]$endif$"
          + "$if(commands)$ [command] [-commandoptions]\n\n"
          + "COMMANDS:\n"
          + "$commands:{c|$cmdName$ $c$}; separator=\"\\n\"$$endif$"
          + "$if(actionOptions)$\n\n"
          + "OPTIONS:\n"
          + "$actionOptions$$endif$"
          + "$if(filters)$\n\n"
          + "GLOBAL OPTIONS:\n"
          + "$filters$$endif$"
          + "$if(authors)$\n\n"
          + "AUTHOR$if(plural)$S$endif$:\n"
          + "$authors:{a|  $a$}; separator=\"\\n\"$$endif$"
          + "$if(copyright)$\n\n"
          + "COPYRIGHT:\n"
          + "  $copyright$$endif$\n";

  private static final String COMMAND_TEMPLATE =
      "USAGE:\n"
          + "  $path$$if(filters)$ [-options --]$endif$ [command] [-commandoptions]"
          + "$if(commands)$\n\n"
          + "COMMANDS:\n"
          + "$commands:{c|$cmdName$ $c$}; separator=\"\\n\"$$endif$"
          + "$if(filters)$\n\n"
          + "OPTIONS:\n"
          + "$filters$$endif$\n";

  private UsageRenderer() {}

  static String renderApp(
      String name,
      String cmdName,
      String version,
      String description,
      Command root,
      List<Author> authors,
      String copyright) {
    ST st = new ST(APP_TEMPLATE, '$', '$');
    st.add("name", name);
    st.add("cmdName", cmdName);
    addIfPresent(st, "version", version);
    addIfPresent(st, "description", description);
    if (root.hasAction()) {
      addIfPresent(st, "actionOptions", trimTrailingNewlines(root.getUsageText()));
    }
    addIfPresent(st, "filters", filterDefaults(root));
    addIfPresent(st, "commands", commandLines(root));
    if (!authors.isEmpty()) {
      st.add("authors", authors);
      if (authors.size() > 1) {
        st.add("plural", true);
      }
    }
    addIfPresent(st, "copyright", copyright);
    return st.render();
  }

  /** Renders the help of a command that routes to subcommands. */
  static String renderCommand(String cmdName, Command command) {
    ST st = new ST(COMMAND_TEMPLATE, '$', '$');
    st.add("cmdName", cmdName);
    st.add("path", cmdName + " " + command.getPathString());
    addIfPresent(st, "filters", filterDefaults(command));
    addIfPresent(st, "commands", commandLines(command));
    return st.render();
  }

  private static ImmutableList<String> commandLines(Command command) {
    return command.getLeaves().stream()
        .map(leaf -> trimTrailingNewlines(leaf.getUsageText()))
        .collect(ImmutableList.toImmutableList());
  }

  private static String filterDefaults(Command command) {
    StringBuilder builder = new StringBuilder();
    for (HandlerBinding<Filter> filter : command.getFilters()) {
      builder.append(filter.getDefaults());
    }
    return trimTrailingNewlines(builder.toString());
  }

  private static String trimTrailingNewlines(String text) {
    return CharMatcher.is('\n').trimTrailingFrom(text);
  }

  private static void addIfPresent(ST st, String name, String value) {
    if (!Strings.isNullOrEmpty(value)) {
      st.add(name, value);
    }
  }

  private static void addIfPresent(ST st, String name, List<?> values) {
    if (!values.isEmpty()) {
      st.add(name, values);
    }
  }
}
