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

import static com.google.common.base.Preconditions.checkState;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.errorprone.annotations.ForOverride;
import com.google.restyle.tree.CommentAnchoring;
import com.google.restyle.tree.CommentAnchoringPolicy;
import com.google.restyle.tree.Comments;
import com.google.restyle.tree.Node;
import org.junit.Before;

/**
 * Base class for testing a single {@link StylePass}. Subclasses provide the pass; tests compare the
 * tree the pass produces with an expected tree, ignoring line numbers.
 */
public abstract class PassTestCase {

  private Comments comments;
  private CommentAnchoringPolicy anchoringPolicy;
  private StyleContext lastContext;
  private boolean setUpRan = false;

  @Before
  public void setUp() throws Exception {
    comments = Comments.empty();
    anchoringPolicy = CommentAnchoring.BY_LINE;
    lastContext = null;
    setUpRan = true;
  }

  /** Gets the pass to run. A new instance is requested for every run. */
  protected abstract StylePass getPass();

  /** Returns the number of times the pass should be run before results are verified. */
  @ForOverride
  protected int getNumRepetitions() {
    return 1;
  }

  /** Sets the comments the context of the next test starts with. */
  protected final void setComments(Comments comments) {
    checkState(this.setUpRan, "Attempted to configure before running setUp().");
    this.comments = comments;
  }

  protected final void setAnchoringPolicy(CommentAnchoringPolicy anchoringPolicy) {
    checkState(this.setUpRan, "Attempted to configure before running setUp().");
    this.anchoringPolicy = anchoringPolicy;
  }

  /** The context left by the last run of the pass. */
  protected final StyleContext getLastContext() {
    checkState(lastContext != null, "no test was run");
    return lastContext;
  }

  /**
   * Runs the pass over {@code input} and verifies the result is equivalent to {@code expected}.
   * When the pass runs more than once, the last run must leave the tree unchanged.
   */
  protected final void test(Node input, Node expected) {
    StyleContext context =
        StyleContext.builder()
            .setFilePath("test.ex")
            .setComments(comments)
            .setAnchoringPolicy(anchoringPolicy)
            .build();
    Node root = input;
    Node previous = null;
    for (int i = 0; i < getNumRepetitions(); i++) {
      TreeTraversal.Result result = TreeTraversal.traverse(root, context, getPass());
      previous = root;
      root = result.getRoot();
      context = result.getContext();
    }
    lastContext = context;

    assertWithMessage(
            "\nExpected: %s\nResult:   %s", expected.toStringTree(), root.toStringTree())
        .that(root.isEquivalentTo(expected))
        .isTrue();
    if (getNumRepetitions() > 1) {
      assertWithMessage("The pass is not idempotent. Last run changed\n%s", previous.toStringTree())
          .that(root.isEquivalentTo(previous))
          .isTrue();
    }
  }

  /** Verifies the pass leaves {@code input} alone. */
  protected final void testSame(Node input) {
    test(input, input);
  }
}
