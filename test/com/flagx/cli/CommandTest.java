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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.flagx.flag.FlagTag;
import com.google.common.collect.ImmutableList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

public class CommandTest {

  @Rule public ExpectedException thrown = ExpectedException.none();

  private final AtomicInteger changes = new AtomicInteger();
  private Command root;

  public static class CopyAction implements Action {
    @FlagTag("f;usage=overwrite")
    boolean force;

    @FlagTag("?0;usage=source file")
    String source = "";

    @Override
    public void handle(Context context) {}
  }

  public static class TwiceAction implements Action {
    @FlagTag("n")
    int first;

    @FlagTag("n")
    int second;

    @Override
    public void handle(Context context) {}
  }

  public static class TwiceFilter implements Filter {
    @FlagTag("t")
    boolean first;

    @FlagTag("t")
    boolean second;

    @Override
    public void filter(Context context, Action next) {
      next.handle(context);
    }
  }

  public static class TraceFilter implements Filter {
    @FlagTag("trace;usage=trace calls")
    boolean trace;

    @Override
    public void filter(Context context, Action next) {
      next.handle(context);
    }
  }

  @Before
  public void setUp() {
    root = new Command(ImmutableList.of(), "", changes::incrementAndGet);
  }

  @Test
  public void subcommandsKnowTheirPath() {
    Command remote = root.addSubcommand("remote", "manage remotes");
    Command add = remote.addSubaction("add", "add a remote", context -> {});
    assertThat(root.getName(), equalTo(""));
    assertThat(add.getName(), equalTo("add"));
    assertThat(add.getPath(), contains("remote", "add"));
    assertThat(add.getPathString(), equalTo("remote add"));
    assertThat(add.getDescription(), equalTo("add a remote"));
    assertTrue(add.hasAction());
    assertFalse(remote.hasAction());
    assertThat(remote.getSubcommand("add").get(), equalTo(add));
    assertFalse(remote.getSubcommand("rm").isPresent());
  }

  @Test
  public void subcommandsAreSortedByName() {
    root.addSubcommand("zeta", "");
    root.addSubcommand("alpha", "");
    root.addSubcommand("mid", "");
    assertThat(
        root.getSubcommands().stream().map(Command::getName).collect(Collectors.toList()),
        contains("alpha", "mid", "zeta"));
  }

  @Test
  public void everyChangeIsReported() {
    Command sub = root.addSubcommand("sub", "", new TraceFilter());
    int afterAdd = changes.get();
    sub.setAction(context -> {});
    root.addFilter((context, next) -> next.handle(context));
    assertThat(changes.get(), equalTo(afterAdd + 2));
  }

  @Test
  public void emptyNameIsRejected() {
    thrown.expect(IllegalArgumentException.class);
    thrown.expectMessage("command name is empty");
    root.addSubcommand("", "");
  }

  @Test
  public void duplicateNameIsRejected() {
    root.addSubcommand("run", "");
    thrown.expect(IllegalArgumentException.class);
    thrown.expectMessage("command named run already exists");
    root.addSubcommand("run", "again");
  }

  @Test
  public void subcommandBelowAnActionIsRejected() {
    Command run = root.addSubaction("run", "", context -> {});
    thrown.expect(IllegalStateException.class);
    thrown.expectMessage("action has been set, no subcommand can be set: \"run\"");
    run.addSubcommand("fast", "");
  }

  @Test
  public void actionBesideSubcommandsIsRejected() {
    root.addSubcommand("run", "");
    thrown.expect(IllegalStateException.class);
    thrown.expectMessage("some subcommands have been set, no action can be set: \"\"");
    root.setAction(context -> {});
  }

  @Test
  public void secondActionIsRejected() {
    Command run = root.addSubaction("run", "", context -> {});
    thrown.expect(IllegalStateException.class);
    thrown.expectMessage("action has already been set: \"run\"");
    run.setAction(context -> {});
  }

  @Test
  public void malformedOptionsAreRejectedAtRegistration() {
    Command run = root.addSubcommand("run", "");
    thrown.expect(IllegalArgumentException.class);
    thrown.expectMessage("flag redefined: n");
    run.setAction(new TwiceAction());
  }

  @Test
  public void rejectedActionLeavesNoSubcommand() {
    try {
      root.addSubaction("run", "", new TwiceAction());
      throw new AssertionError("accepted duplicate flags");
    } catch (IllegalArgumentException e) {
      assertThat(e.getMessage(), containsString("flag redefined: n"));
    }
    assertFalse(root.getSubcommand("run").isPresent());
    assertThat(changes.get(), equalTo(0));
    root.addSubaction("run", "", new CopyAction());
    assertTrue(root.getSubcommand("run").get().hasAction());
  }

  @Test
  public void rejectedFilterLeavesNoSubcommand() {
    try {
      root.addSubcommand("run", "", new TraceFilter(), new TwiceFilter());
      throw new AssertionError("accepted duplicate flags");
    } catch (IllegalArgumentException e) {
      assertThat(e.getMessage(), containsString("flag redefined: t"));
    }
    assertFalse(root.getSubcommand("run").isPresent());
  }

  @Test
  public void optionsAreListedByName() {
    Command copy = root.addSubaction("copy", "", new CopyAction(), new TraceFilter());
    assertThat(copy.getActionOptions().keySet(), contains("f", "?0"));
    assertThat(copy.getActionOptions().get("?0").getUsage(), equalTo("source file"));
    assertThat(copy.getFilterOptions().keySet(), contains("trace"));
    assertTrue(root.addSubaction("fn", "", context -> {}).getActionOptions().isEmpty());
  }

  @Test
  public void usageTextListsLeavesWithTheirDefaults() {
    Command files = root.addSubcommand("files", "");
    files.addSubaction("copy", "copy a file", new CopyAction());
    root.addSubaction("version", "print the version", context -> {});

    String usage = root.getUsageText();

    assertThat(
        usage,
        equalTo(
            "files copy # copy a file\n"
                + "  -f\toverwrite\n"
                + "  ?0 string\n"
                + "    \tsource file\n"
                + "version # print the version\n"));
    assertThat(files.getUsageText(), containsString("files copy # copy a file"));
  }

  @Test
  public void rootActionUsageHasNoHeader() {
    root.setAction(new CopyAction());
    assertThat(root.getUsageText(), equalTo("  -f\toverwrite\n  ?0 string\n    \tsource file\n"));
  }
}
