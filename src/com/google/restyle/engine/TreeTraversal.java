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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.auto.value.AutoValue;
import com.google.restyle.tree.Node;

/**
 * TreeTraversal runs one {@link StylePass} over a whole tree, in pre-order, through a {@link
 * Cursor}.
 *
 * <p>After each visit the pass's {@link Signal} is applied: the replacement, if any, is put in
 * place of the visited node and the walk continues into the (replaced) node's children, past them,
 * or stops altogether. Siblings are always visited left-to-right.
 */
public final class TreeTraversal {

  private TreeTraversal() {}

  /** The outcome of one traversal. */
  @AutoValue
  public abstract static class Result {
    /** The tree with every edit the pass made. */
    public abstract Node getRoot();

    /** The context as left by the last visit. */
    public abstract StyleContext getContext();

    /** Whether the pass stopped the traversal before it reached the last node. */
    public abstract boolean isHalted();

    /** The number of nodes the pass visited. */
    public abstract int getVisitCount();

    static Result create(Node root, StyleContext context, boolean halted, int visitCount) {
      return new AutoValue_TreeTraversal_Result(root, context, halted, visitCount);
    }
  }

  /**
   * Traverses {@code root} with {@code pass}.
   *
   * <p>Exceptions thrown by the pass propagate unchanged; callers that need the edits to be
   * dropped on failure rely on the tree being immutable and simply keep {@code root}.
   */
  public static Result traverse(Node root, StyleContext context, StylePass pass) {
    Cursor cursor = Cursor.enter(root);
    int visits = 0;
    while (true) {
      Signal signal = checkNotNull(pass.visit(cursor, context), "pass returned no signal");
      visits++;
      Node replacement = signal.getReplacement();
      if (replacement != null) {
        cursor = cursor.replace(replacement);
      }
      if (signal.getContext() != null) {
        context = signal.getContext();
      }

      Cursor next;
      switch (signal.getAction()) {
        case HALT:
          return Result.create(cursor.root(), context, true, visits);
        case SKIP:
          next = cursor.skip();
          break;
        case CONTINUE:
          next = cursor.next();
          break;
        default:
          throw new IllegalStateException("unexpected action " + signal.getAction());
      }
      if (next == null) {
        return Result.create(cursor.root(), context, false, visits);
      }
      cursor = next;
    }
  }
}
