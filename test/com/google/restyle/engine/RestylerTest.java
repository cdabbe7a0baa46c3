/*
 * Copyright 2026 The Restyle Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.restyle.engine;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.restyle.tree.Comment;
import com.google.restyle.tree.Comments;
import com.google.restyle.tree.IR;
import com.google.restyle.tree.Node;
import com.google.restyle.tree.NodeMetadata;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RestylerTest {

  /** Parses one statement per line: integers, lower-case names and {@code #} comments. */
  private static final class LineParser implements SourceParser {
    @Override
    public ParsedSource parse(String sourceText, String filePath) {
      List<Node> statements = new ArrayList<>();
      List<Comment> comments = new ArrayList<>();
      String[] lines = sourceText.split("\n", -1);
      for (int i = 0; i < lines.length; i++) {
        int lineno = i + 1;
        String line = lines[i].trim();
        if (line.isEmpty()) {
          continue;
        } else if (line.startsWith("#")) {
          comments.add(Comment.leading(line, lineno));
        } else if (line.matches("-?[0-9]+")) {
          statements.add(Node.newLeaf(Long.parseLong(line), NodeMetadata.atLine(lineno)));
        } else if (line.matches("[a-z]+")) {
          statements.add(Node.newIdentifier(line, NodeMetadata.atLine(lineno)));
        } else {
          throw new ParseError(filePath, lineno, 1, "unexpected \"" + line + "\"");
        }
      }
      return ParsedSource.create(IR.block(statements), Comments.copyOf(comments));
    }

    @Override
    public ImmutableSet<String> getSupportedExtensions() {
      return ImmutableSet.of(".ex", ".exs");
    }
  }

  /** Prints each statement on its own line, preceded by the comments anchored up to its line. */
  private static final class LinePrinter implements SourcePrinter {
    int lastLineLength;

    @Override
    public String render(Node tree, Comments comments, int lineLength) {
      lastLineLength = lineLength;
      List<String> out = new ArrayList<>();
      int next = 0;
      for (Node statement : tree.getChildren()) {
        while (next < comments.size() && comments.get(next).line() <= statement.getLineno()) {
          out.add(comments.get(next++).text());
        }
        out.add(statement.isIdentifier() ? statement.getString() : "" + statement.getLiteral());
      }
      while (next < comments.size()) {
        out.add(comments.get(next++).text());
      }
      return String.join("\n", out);
    }
  }

  private static final PassFactory FAILING =
      PassFactory.of(
          "failing",
          (cursor, context) -> {
            if (cursor.getNode().isIdentifier()) {
              throw new UnsupportedOperationException("no names please");
            }
            return Signal.proceed();
          });

  private final LinePrinter printer = new LinePrinter();
  private LoggerErrorManager errorManager;
  private ExecutorService executor;

  @Before
  public void setUp() {
    errorManager = new LoggerErrorManager(Logger.getLogger(RestylerTest.class.getName()));
    executor = Executors.newFixedThreadPool(2);
  }

  @After
  public void tearDown() {
    executor.shutdownNow();
  }

  private Restyler restyler(PassConfig config, StyleOptions options) {
    return new Restyler(new LineParser(), printer, config, options, errorManager);
  }

  private Restyler failingRestyler(FailurePolicy policy) {
    return restyler(
        new DefaultPassConfig().plus(FAILING),
        StyleOptions.builder()
            .setEnabledPasses(
                ImmutableList.of(
                    PassSetting.create(PassNames.REMOVE_DEAD_LITERALS),
                    PassSetting.create("failing")))
            .setFailurePolicy(policy)
            .build());
  }

  @Test
  public void testFormatWithDefaults() {
    Restyler restyler = restyler(new DefaultPassConfig(), StyleOptions.defaults());
    assertThat(restyler.format("# lead\n1\nx\n2\n", "a.ex")).isEqualTo("# lead\nx\n2");
    assertThat(errorManager.getDiagnostics()).isEmpty();
    assertThat(printer.lastLineLength).isEqualTo(StyleOptions.DEFAULT_LINE_LENGTH);
  }

  @Test
  public void testCommentBetweenStatementsStaysInPlace() {
    Restyler restyler = restyler(new DefaultPassConfig(), StyleOptions.defaults());
    assertThat(restyler.format("x\n# gone\n1\ny", "a.ex")).isEqualTo("x\n# gone\ny");
  }

  @Test
  public void testLineLengthReachesPrinter() {
    Restyler restyler =
        restyler(new DefaultPassConfig(), StyleOptions.builder().setLineLength(80).build());
    restyler.format("x", "a.ex");
    assertThat(printer.lastLineLength).isEqualTo(80);
  }

  @Test
  public void testFailureIsReportedUnderLogPolicy() {
    Restyler restyler = failingRestyler(FailurePolicy.LOG);
    assertThat(restyler.format("1\nx\n2", "a.ex")).isEqualTo("x\n2");
    assertThat(errorManager.getWarningCount()).isEqualTo(1);
    Diagnostic diagnostic = errorManager.getDiagnostics().get(0);
    assertThat(diagnostic.passName()).isEqualTo("failing");
    assertThat(diagnostic.sourceName()).isEqualTo("a.ex");
    assertThat(diagnostic.description()).contains("no names please");
  }

  @Test
  public void testFailureAbortsUnderRaisePolicy() {
    Restyler restyler = failingRestyler(FailurePolicy.RAISE);
    PassFailure failure = assertThrows(PassFailure.class, () -> restyler.format("x", "a.ex"));
    assertThat(failure.getPassName()).isEqualTo("failing");
    assertThat(errorManager.getDiagnostics()).isEmpty();
  }

  @Test
  public void testParseErrorPropagates() {
    Restyler restyler = restyler(new DefaultPassConfig(), StyleOptions.defaults());
    ParseError e = assertThrows(ParseError.class, () -> restyler.format("x\n1 +", "a.ex"));
    assertThat(e.getSourceName()).isEqualTo("a.ex");
    assertThat(e.getLineNumber()).isEqualTo(2);
  }

  @Test
  public void testUnknownPassFailsBeforeAnyFile() {
    StyleOptions options =
        StyleOptions.builder()
            .setEnabledPasses(ImmutableList.of(PassSetting.create("nope")))
            .build();
    assertThrows(ConfigError.class, () -> restyler(new DefaultPassConfig(), options));
  }

  @Test
  public void testCanFormat() {
    Restyler restyler = restyler(new DefaultPassConfig(), StyleOptions.defaults());
    assertThat(restyler.canFormat("lib/a.ex")).isTrue();
    assertThat(restyler.canFormat("test/a_test.exs")).isTrue();
    assertThat(restyler.canFormat("README.md")).isFalse();
    assertThat(restyler.getSupportedExtensions()).containsExactly(".ex", ".exs");
  }

  @Test
  public void testFormatAllIsolatesFiles() {
    Restyler restyler = failingRestyler(FailurePolicy.RAISE);
    ImmutableMap<String, Restyler.Outcome> outcomes =
        restyler.formatAll(
            ImmutableMap.of("a.ex", "1\n2", "b.ex", "x", "c.ex", "?", "d.ex", "3\n4"), executor);

    assertThat(outcomes.keySet()).containsExactly("a.ex", "b.ex", "c.ex", "d.ex").inOrder();
    assertThat(outcomes.get("a.ex").formatted()).isEqualTo("2");
    assertThat(outcomes.get("b.ex").getKind()).isEqualTo(Restyler.Outcome.Kind.FAILED);
    assertThat(outcomes.get("b.ex").failed()).isInstanceOf(PassFailure.class);
    assertThat(outcomes.get("c.ex").failed()).isInstanceOf(ParseError.class);
    assertThat(outcomes.get("d.ex").formatted()).isEqualTo("4");
  }

  @Test
  public void testFormatAllFinishesEveryFileBeforeRethrowingAnError() {
    Queue<String> printed = new ConcurrentLinkedQueue<>();
    SourcePrinter crashing =
        (tree, comments, lineLength) -> {
          String output = printer.render(tree, comments, lineLength);
          if (output.equals("boom")) {
            throw new AssertionError("printer crashed");
          }
          printed.add(output);
          return output;
        };
    Restyler restyler =
        new Restyler(
            new LineParser(),
            crashing,
            new DefaultPassConfig(),
            StyleOptions.defaults(),
            errorManager);

    AssertionError error =
        assertThrows(
            AssertionError.class,
            () ->
                restyler.formatAll(
                    ImmutableMap.of("a.ex", "x", "b.ex", "boom", "c.ex", "y", "d.ex", "boom"),
                    executor));

    assertThat(error).hasMessageThat().isEqualTo("printer crashed");
    assertThat(error.getSuppressed()).hasLength(1);
    assertThat(printed).containsExactly("x", "y");
  }
}
