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

import com.google.restyle.tree.Comments;
import com.google.restyle.tree.Node;

/** Renders a tree and its comments back to source text. */
@FunctionalInterface
public interface SourcePrinter {

  /**
   * @param tree The tree to print.
   * @param comments The comments to place, by line.
   * @param lineLength The maximum line length the output should respect.
   */
  String render(Node tree, Comments comments, int lineLength);
}
