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

import com.google.restyle.tree.Comment;
import com.google.restyle.tree.CommentAnchoring;
import com.google.restyle.tree.Comments;
import com.google.restyle.tree.IR;
import com.google.restyle.tree.Node;
import com.google.restyle.tree.NodeMetadata;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class StyleContextTest {

  private static final Comments COMMENTS =
      Comments.of(Comment.leading("# a", 2), Comment.trailing("# b", 3), Comment.leading("# c", 5));

  private static Node at(String name, int line) {
    return Node.newIdentifier(name, NodeMetadata.atLine(line));
  }

  @Test
  public void testDefaults() {
    StyleContext context = StyleContext.create("a.ex", COMMENTS);
    assertThat(context.getFilePath()).isEqualTo("a.ex");
    assertThat(context.getDiagnostics()).isEmpty();
    assertThat(context.getAnchoringPolicy()).isEqualTo(CommentAnchoring.BY_LINE);
  }

  @Test
  public void testWithDiagnosticAppends() {
    DiagnosticType type = DiagnosticType.warning("TEST", "t");
    StyleContext context =
        StyleContext.create("a.ex", COMMENTS)
            .withDiagnostic(Diagnostic.make(type))
            .withDiagnostic(Diagnostic.make(type));
    assertThat(context.getDiagnostics()).hasSize(2);
  }

  @Test
  public void testReanchorUsesLineRangeOfRemovedSubtree() {
    Node removed = IR.call(at("f", 2), at("x", 3));
    StyleContext context =
        StyleContext.create("a.ex", COMMENTS).reanchorComments(removed, at("g", 1));
    assertThat(context.getComments().asList())
        .containsExactly(
            Comment.leading("# a", 1), Comment.trailing("# b", 1), Comment.leading("# c", 5))
        .inOrder();
  }

  @Test
  public void testReanchorWithoutLinesIsNoOp() {
    StyleContext context = StyleContext.create("a.ex", COMMENTS);
    assertThat(context.reanchorComments(Node.newLeaf(1), at("g", 1))).isSameInstanceAs(context);
  }

  @Test
  public void testReanchorWithDropPolicy() {
    StyleContext context =
        StyleContext.builder()
            .setFilePath("a.ex")
            .setComments(COMMENTS)
            .setAnchoringPolicy(CommentAnchoring.DROP)
            .build()
            .reanchorComments(at("x", 5), null);
    assertThat(context.getComments().size()).isEqualTo(2);
  }
}
