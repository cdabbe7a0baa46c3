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

/** Splices the statements of a block nested directly in another block into the outer block. */
final class FlattenNestedBlocks implements StylePass {

  @Override
  public Signal visit(Cursor cursor, StyleContext context) {
    Node n = cursor.getNode();
    if (!n.isBlock() || !hasNestedBlock(n)) {
      return Signal.proceed();
    }
    return Signal.proceed(flatten(n));
  }

  private static boolean hasNestedBlock(Node block) {
    for (Node child : block.getChildren()) {
      if (child.isBlock()) {
        return true;
      }
    }
    return false;
  }

  private static Node flatten(Node block) {
    ImmutableList.Builder<Node> statements = ImmutableList.builder();
    for (Node child : block.getChildren()) {
      if (child.isBlock()) {
        statements.addAll(flatten(child).getChildren());
      } else {
        statements.add(child);
      }
    }
    return block.withChildren(statements.build());
  }
}
