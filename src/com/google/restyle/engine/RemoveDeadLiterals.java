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

import com.google.common.collect.ImmutableList;
import com.google.restyle.tree.Node;
import java.util.List;

/**
 * Removes literal statements that have no effect: every leaf statement of a block except the last,
 * which is the block's value.
 *
 * <p>Comments inside a removed statement are handed to the context's anchoring policy, with the
 * nearest preceding kept statement (or the block's value) as the new anchor.
 */
final class RemoveDeadLiterals implements StylePass {

  @Override
  public Signal visit(Cursor cursor, StyleContext context) {
    Node n = cursor.getNode();
    if (!n.isBlock() || n.getChildCount() < 2) {
      return Signal.proceed();
    }

    ImmutableList<Node> statements = n.getChildren();
    int last = statements.size() - 1;
    ImmutableList.Builder<Node> kept = ImmutableList.builder();
    boolean changed = false;
    for (int i = 0; i < last; i++) {
      Node statement = statements.get(i);
      if (statement.isLeaf()) {
        context = context.reanchorComments(statement, nearestSurvivor(statements, i));
        changed = true;
      } else {
        kept.add(statement);
      }
    }
    if (!changed) {
      return Signal.proceed();
    }
    kept.add(statements.get(last));
    return Signal.proceed(n.withChildren(kept.build()), context);
  }

  /** The closest kept statement before {@code index}, or the block's value if there is none. */
  private static Node nearestSurvivor(List<Node> statements, int index) {
    for (int i = index - 1; i >= 0; i--) {
      if (!statements.get(i).isLeaf()) {
        return statements.get(i);
      }
    }
    return statements.get(statements.size() - 1);
  }
}
