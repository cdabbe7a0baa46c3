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
import com.google.common.collect.Range;
import com.google.restyle.tree.Node;
import org.jspecify.annotations.Nullable;

/** NodeUtil contains generally useful tree utilities. */
public final class NodeUtil {

  private NodeUtil() {}

  /**
   * Returns the closed range of source lines covered by the nodes of {@code n}'s subtree that have
   * a known line, or null if none has one.
   */
  public static @Nullable Range<Integer> getLineRange(Node n) {
    int min = Integer.MAX_VALUE;
    int max = Integer.MIN_VALUE;
    for (Node d : preOrder(n)) {
      if (d.getMetadata().hasLineno()) {
        min = Math.min(min, d.getLineno());
        max = Math.max(max, d.getLineno());
      }
    }
    return min > max ? null : Range.closed(min, max);
  }

  /** Returns the nodes of {@code root}'s subtree in pre-order, {@code root} first. */
  public static ImmutableList<Node> preOrder(Node root) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    addPreOrder(root, result);
    return result.build();
  }

  private static void addPreOrder(Node n, ImmutableList.Builder<Node> result) {
    result.add(n);
    for (Node child : n.getChildren()) {
      addPreOrder(child, result);
    }
  }
}
