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
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.flagx.flag.FlagParseException;
import com.flagx.flag.FlagTag;
import com.google.common.collect.ImmutableList;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.Before;
import org.junit.Test;

public class AppTest {

  private static final List<String> EVENTS = Collections.synchronizedList(new ArrayList<>());

  private ByteArrayOutputStream out;
  private App app;

  public static class XAction implements Action {
    @FlagTag("x;usage=the x value")
    int x;

    @FlagTag("?0")
    String file = "";

    @Override
    public void handle(Context context) {
      EVENTS.add("act x=" + x + " file=" + file + " path=" + context.getCmdPathString());
    }
  }

  public static class VerboseFilter implements Filter {
    @FlagTag("v;usage=print more")
    boolean verbose;

    @Override
    public void filter(Context context, Action next) {
      EVENTS.add("verbose=" + verbose);
      next.handle(context);
    }
  }

  public static class LevelFilter implements Filter {
    @FlagTag("level;def=1")
    int level;

    @Override
    public void filter(Context context, Action next) {
      EVENTS.add("level=" + level);
      next.handle(context);
    }
  }

  /** Counts its copies to show that a fresh copy handles every invocation. */
  public static class CopyingAction implements Action, ActionCopier {
    static int copies;

    @FlagTag("x")
    int x;

    @Override
    public Action deepCopy() {
      copies++;
      return new CopyingAction();
    }

    @Override
    public void handle(Context context) {
      EVENTS.add("copy x=" + x);
    }
  }

  public static class ArgumentAction implements Action {
    private final String label;

    @FlagTag("n")
    int n;

    public ArgumentAction(String label) {
      this.label = label;
    }

    @Override
    public void handle(Context context) {
      EVENTS.add(label + " n=" + n);
    }
  }

  public class InnerAction implements Action {
    @FlagTag("n")
    int n;

    @Override
    public void handle(Context context) {
      EVENTS.add("inner n=" + n);
    }
  }

  /** Has no options, so the registered instance itself handles every invocation. */
  public static class LabelAction implements Action {
    private final String label;

    public LabelAction(String label) {
      this.label = label;
    }

    @Override
    public void handle(Context context) {
      EVENTS.add(label);
    }
  }

  private static Filter recording(String name) {
    return (context, next) -> {
      EVENTS.add(name + "-entry");
      next.handle(context);
      EVENTS.add(name + "-exit");
    };
  }

  @Before
  public void setUp() {
    EVENTS.clear();
    out = new ByteArrayOutputStream();
    app = new App(ProgramInfo.of("prog", Instant.EPOCH));
    app.setOutput(new PrintStream(out, true, StandardCharsets.UTF_8));
  }

  private String output() {
    return new String(out.toByteArray(), StandardCharsets.UTF_8);
  }

  @Test
  public void filtersWrapTheActionInRegistrationOrder() {
    app.addSubaction(
        "run", "runs", context -> EVENTS.add("act"), recording("F1"), recording("F2"));
    Status status = app.exec(ImmutableList.of("run"));
    assertTrue(status.isOk());
    assertThat(EVENTS, contains("F1-entry", "F2-entry", "act", "F2-exit", "F1-exit"));
  }

  @Test
  public void resolvesTheDeepestCommandWithFiltersFromEveryLevel() {
    app.addFilter(recording("root"));
    Command a = app.addSubcommand("a", "first level", recording("a"));
    a.addSubaction("b", "second level", new XAction(), recording("b"));

    Status status = app.exec(ImmutableList.of("a", "b", "-x", "1"));

    assertTrue(status.toString(), status.isOk());
    assertThat(
        EVENTS,
        contains(
            "root-entry",
            "a-entry",
            "b-entry",
            "act x=1 file= path=prog a b",
            "b-exit",
            "a-exit",
            "root-exit"));
  }

  @Test
  public void contextCarriesTheOriginalArguments() {
    List<Context> seen = new ArrayList<>();
    app.addSubaction("run", "", seen::add);
    CancellationCarrier carrier = CancellationCarrier.background();
    app.exec(carrier, ImmutableList.of("prog", "run", "-q", "arg"));
    assertThat(seen.get(0).getArgs(), contains("prog", "run", "-q", "arg"));
    assertThat(seen.get(0).getCmdPath(), contains("prog", "run"));
    assertThat(seen.get(0).getCarrier(), equalTo(carrier));
  }

  @Test
  public void optionsFiltersParseTheirLevelAndLeaveTheRest() {
    app.addFilter(new VerboseFilter());
    app.addFilter(new LevelFilter());
    app.addSubcommand("a", "").addSubaction("b", "", new XAction());

    Status status =
        app.exec(ImmutableList.of("-v", "-level", "3", "a", "b", "-x", "2", "in.txt"));

    assertTrue(status.toString(), status.isOk());
    assertThat(
        EVENTS, contains("verbose=true", "level=3", "act x=2 file=in.txt path=prog a b"));
  }

  @Test
  public void everyInvocationGetsFreshOptions() {
    XAction registered = new XAction();
    app.addSubaction("run", "", registered);
    app.exec(ImmutableList.of("run", "-x", "5"));
    app.exec(ImmutableList.of("run"));
    assertThat(EVENTS, contains("act x=5 file= path=prog run", "act x=0 file= path=prog run"));
    assertThat(registered.x, equalTo(0));
  }

  @Test
  public void copierMakesTheCopies() {
    CopyingAction.copies = 0;
    app.addSubaction("run", "", new CopyingAction());
    int afterRegistration = CopyingAction.copies;
    app.exec(ImmutableList.of("run", "-x", "7"));
    assertThat(CopyingAction.copies, equalTo(afterRegistration + 1));
    assertThat(EVENTS, contains("copy x=7"));
  }

  @Test
  public void functionActionDoesNotParse() {
    app.addSubaction("run", "", context -> EVENTS.add("ran"));
    Status status = app.exec(ImmutableList.of("run", "-undefined", "--", "x"));
    assertTrue(status.isOk());
    assertThat(EVENTS, contains("ran"));
  }

  @Test
  public void leadingTerminatorBeforeSubcommandIsSkipped() {
    app.addSubaction("run", "", context -> EVENTS.add("ran"));
    assertTrue(app.exec(ImmutableList.of("--", "run")).isOk());
    assertThat(EVENTS, contains("ran"));
  }

  @Test
  public void filterMayStopTheChain() {
    app.addFilter((context, next) -> EVENTS.add("blocked"));
    app.addSubaction("run", "", context -> EVENTS.add("ran"));
    assertTrue(app.exec(ImmutableList.of("run")).isOk());
    assertThat(EVENTS, contains("blocked"));
  }

  @Test
  public void unknownCommandIsNotFound() {
    app.addFilter(recording("root"));
    app.addSubaction("run", "", context -> EVENTS.add("ran"));
    Status status = app.exec(ImmutableList.of("nope"));
    assertThat(status.getCode(), equalTo(Status.NOT_FOUND));
    assertThat(status.getMsg(), equalTo("not found command action: \"prog nope\""));
    assertThat(EVENTS, empty());
  }

  @Test
  public void notFoundSuggestsCloseNames() {
    app.addSubaction("run", "", context -> {});
    app.addSubaction("status", "", context -> {});
    Status status = app.exec(ImmutableList.of("rnu"));
    assertThat(status.getMsg(), containsString("did you mean run?"));
  }

  @Test
  public void missingCommandIsNotFound() {
    app.addSubaction("run", "", context -> {});
    Status status = app.exec(ImmutableList.of());
    assertThat(status.getCode(), equalTo(Status.NOT_FOUND));
    assertThat(status.getMsg(), equalTo("not found command action: \"prog\""));
  }

  @Test
  public void notFoundHandlerRunsWithoutFilters() {
    app.addFilter(recording("root"));
    app.addSubcommand("a", "").addSubaction("b", "", context -> EVENTS.add("ran"));
    app.setNotFound(context -> EVENTS.add("not found " + context.getCmdPathString()));
    Status status = app.exec(ImmutableList.of("a", "c"));
    assertTrue(status.isOk());
    assertThat(EVENTS, contains("not found prog a c"));
  }

  @Test
  public void flagInCommandPositionIsBadArgs() {
    app.addSubaction("run", "", context -> {});
    Status status = app.exec(ImmutableList.of("-zz", "run"));
    assertThat(status.getCode(), equalTo(Status.BAD_ARGS));
    assertThat(status.getMsg(), equalTo("flag provided but not defined: -zz"));
  }

  @Test
  public void helpPrintsUsage() {
    app.addSubcommand("a", "").addSubaction("b", "second level", new XAction());
    assertTrue(app.exec(ImmutableList.of("-h")).isOk());
    assertThat(output(), containsString("USAGE:"));
    assertThat(output(), containsString("prog a b # second level"));
  }

  @Test
  public void helpOfASubcommandListsItsCommands() {
    app.addSubcommand("a", "").addSubaction("b", "second level", new XAction());
    app.addSubaction("other", "elsewhere", context -> {});
    assertTrue(app.exec(ImmutableList.of("a", "--help")).isOk());
    assertThat(output(), containsString("prog a [command]"));
    assertThat(output(), containsString("prog a b # second level"));
    assertThat(output(), not(containsString("elsewhere")));
  }

  @Test
  public void parseFailureIsReported() {
    app.addSubaction("run", "", new XAction());
    Status status = app.exec(ImmutableList.of("run", "-x", "many"));
    assertThat(status.getCode(), equalTo(Status.PARSE_FAILED));
    assertThat(status.getMsg(), containsString("invalid value \"many\" for flag -x"));
    assertThat(status.getCause().get(), instanceOf(FlagParseException.class));
    assertThat(output(), containsString("invalid value \"many\" for flag -x"));
  }

  @Test
  public void validatorRejectionIsReported() {
    app.setValidator(
        options -> {
          if (options instanceof XAction && ((XAction) options).x < 0) {
            throw new ValidationException("x must not be negative");
          }
        });
    app.addSubaction("run", "", new XAction());
    Status status = app.exec(ImmutableList.of("run", "-x=-1"));
    assertThat(status.getCode(), equalTo(Status.VALIDATE_FAILED));
    assertThat(status.getMsg(), equalTo("x must not be negative"));
    assertTrue(app.exec(ImmutableList.of("run", "-x=1")).isOk());
  }

  @Test
  public void uncaughtExceptionBecomesAStatus() {
    app.addSubaction(
        "run",
        "",
        context -> {
          throw new IllegalArgumentException("boom");
        });
    Status status = app.exec(ImmutableList.of("run"));
    assertThat(status.getCode(), equalTo(Status.UNCAUGHT));
    assertThat(status.getMsg(), equalTo("boom"));
    assertThat(status.getCause().get(), instanceOf(IllegalArgumentException.class));
    assertThat(status.getStack().get(), containsString("boom"));
  }

  @Test
  public void errorFromHandlerBecomesAStatus() {
    app.addSubaction(
        "run",
        "",
        context -> {
          throw new AssertionError("boom");
        });
    Status status = app.exec(ImmutableList.of("run"));
    assertThat(status.getCode(), equalTo(Status.UNCAUGHT));
    assertThat(status.getMsg(), equalTo("boom"));
    assertThat(status.getCause().get(), instanceOf(AssertionError.class));
  }

  @Test
  public void optionsWithoutNoArgConstructorAreRejected() {
    for (Action action : new Action[] {new ArgumentAction("ctor"), new InnerAction()}) {
      try {
        app.addSubaction("run", "", action);
        throw new AssertionError("accepted " + action.getClass().getName());
      } catch (IllegalArgumentException e) {
        assertThat(
            e.getMessage(),
            equalTo(
                "flagx: options class "
                    + action.getClass().getName()
                    + " needs an accessible no-arg constructor or must implement ActionCopier"));
      }
      assertFalse(app.getRoot().getSubcommand("run").isPresent());
    }
    assertThat(EVENTS, empty());
  }

  @Test
  public void handlerWithoutOptionsMayTakeConstructorArguments() {
    app.addSubaction("run", "", new LabelAction("labelled"));
    assertTrue(app.exec(ImmutableList.of("run", "-n", "5")).isOk());
    assertThat(EVENTS, contains("labelled"));
  }

  @Test
  public void thrownStatusIsReturned() {
    app.addSubaction("run", "", context -> context.throwStatus(42, "custom", null));
    Status status = app.exec(ImmutableList.of("run"));
    assertThat(status.getCode(), equalTo(42));
    assertThat(status.getMsg(), equalTo("custom"));
    assertTrue(status.getStack().isPresent());
  }

  @Test
  public void checkStatusOnlyThrowsForErrors() {
    List<String> cleanup = new ArrayList<>();
    app.addSubaction(
        "run",
        "",
        context -> {
          context.checkStatus(null, 7, "unused");
          context.checkStatus(
              new IllegalStateException("bad state"), 7, "", () -> cleanup.add("cleaned"));
        });
    Status status = app.exec(ImmutableList.of("run"));
    assertThat(status.getCode(), equalTo(7));
    assertThat(status.getMsg(), equalTo("bad state"));
    assertThat(cleanup, contains("cleaned"));
  }

  @Test
  public void rootActionHandlesArgumentsDirectly() {
    app.setAction(new XAction());
    assertTrue(app.exec(ImmutableList.of("prog", "-x", "4", "f")).isOk());
    assertThat(EVENTS, contains("act x=4 file=f path=prog"));
  }

  @Test
  public void metadataDefaultsAndNormalization() {
    assertThat(app.getCmdName(), equalTo("prog"));
    assertThat(app.getName(), equalTo("prog"));
    assertThat(app.getVersion(), equalTo("0.0.1"));
    assertThat(app.getCompiled(), equalTo(Instant.EPOCH));

    app.setCmdName("--tool");
    app.setVersion("v1.2.3");
    assertThat(app.getCmdName(), equalTo("tool"));
    assertThat(app.getName(), equalTo("tool"));
    assertThat(app.getVersion(), equalTo("1.2.3"));

    app.setName("The Tool");
    app.setVersion("");
    app.setCmdName("");
    assertThat(app.getName(), equalTo("The Tool"));
    assertThat(app.getVersion(), equalTo("0.0.1"));
    assertThat(app.getCmdName(), equalTo("prog"));
  }

  @Test
  public void usageTextShowsEverySection() {
    app.setCmdName("tool");
    app.setVersion("V2.0");
    app.setDescription("Does things.");
    app.setAuthors(
        ImmutableList.of(Author.of("Ann", "ann@example.com"), Author.of("Bob")));
    app.setCopyright("(c) 2020 Example");
    app.addFilter(new VerboseFilter());
    app.addSubcommand("a", "").addSubaction("b", "second level", new XAction());

    String usage = app.getUsageText();

    assertThat(usage, containsString("tool - v2.0\n\nDoes things.\n"));
    assertThat(
        usage, containsString("USAGE:\n  tool [-globaloptions --] [command] [-commandoptions]"));
    assertThat(usage, containsString("COMMANDS:\ntool a b # second level\n  -x int\n"));
    assertThat(usage, containsString("GLOBAL OPTIONS:\n  -v\tprint more"));
    assertThat(usage, containsString("AUTHORS:\n  Ann <ann@example.com>\n  Bob"));
    assertThat(usage, containsString("COPYRIGHT:\n  (c) 2020 Example"));
  }

  @Test
  public void usageTextFollowsTreeChanges() {
    app.addSubaction("first", "one", context -> {});
    assertThat(app.getUsageText(), containsString("prog first # one"));
    app.addSubaction("second", "two", context -> {});
    assertThat(app.getUsageText(), containsString("prog second # two"));
    assertFalse(app.getUsageText().contains("AUTHOR"));
  }

  @Test
  public void concurrentInvocationsDoNotShareOptions() throws InterruptedException {
    app.addSubaction("run", "", new XAction());
    List<Thread> threads = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      String value = Integer.toString(i);
      threads.add(new Thread(() -> app.exec(ImmutableList.of("run", "-x", value))));
    }
    threads.forEach(Thread::start);
    for (Thread thread : threads) {
      thread.join();
    }
    for (int i = 0; i < 8; i++) {
      assertThat(EVENTS, hasItem("act x=" + i + " file= path=prog run"));
    }
  }
}
