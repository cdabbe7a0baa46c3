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

package com.google.restyle.tree;

/**
 * The kinds of {@link Node}. Each kind fixes how many children a node has and what they mean.
 */
public enum Kind {
  /** A literal value. No children. */
  LEAF(0, 0),
  /** A name. No children. */
  IDENTIFIER(0, 0),
  /** A call: the target followed by the arguments. */
  CALL(1, Integer.MAX_VALUE),
  /** An ordered statement list. */
  BLOCK(0, Integer.MAX_VALUE),
  /** An operator applied to a left and a right operand. */
  BINARY_OP(2, 2),
  /** A list, tuple or map literal; see {@link CollectionKind}. */
  COLLECTION(0, Integer.MAX_VALUE),
  /** A pattern and the value bound to it. */
  ASSIGNMENT(2, 2),
  /** A single inner node wrapped with extra annotations. */
  ANNOTATED(1, 1);

  private final int minChildren;
  private final int maxChildren;

  Kind(int minChildren, int maxChildren) {
    this.minChildren = minChildren;
    this.maxChildren = maxChildren;
  }

  public int getMinChildren() {
    return minChildren;
  }

  public int getMaxChildren() {
    return maxChildren;
  }

  /** Whether nodes of this kind may gain or lose children. */
  public boolean hasVariableArity() {
    return minChildren != maxChildren;
  }

  boolean acceptsChildCount(int count) {
    return count >= minChildren && count <= maxChildren;
  }
}
