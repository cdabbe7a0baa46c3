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

/**
 * A rewrite rule, applied to every node of a tree in pre-order by {@link TreeTraversal}.
 *
 * <p>Passes never edit the tree directly. They return the replacement for the visited node, if
 * any, in the {@link Signal}. The cursor handed to {@link #visit} may be navigated freely to look
 * at the surrounding code; moving it has no effect on the traversal.
 *
 * <p>Throwing an unchecked exception from {@link #visit} aborts the pass. The pipeline then drops
 * every edit the pass made, see {@link FailurePolicy}.
 */
@FunctionalInterface
public interface StylePass {

  /**
   * Visits a node in pre-order (before its children).
   *
   * @param cursor The cursor focused on the current node. Its trail holds the current node's
   *     ancestors and siblings, including the edits this pass already made to them.
   * @param context The context of the file being styled.
   * @return how to continue, with an optional replacement node and context
   */
  Signal visit(Cursor cursor, StyleContext context);
}
