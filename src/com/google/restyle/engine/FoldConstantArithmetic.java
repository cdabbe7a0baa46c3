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
import com.google.common.collect.Sets;
import com.google.restyle.tree.Node;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Folds {@code +}, {@code -} and {@code *} over integer literals. Operands are folded first, so
 * {@code (1 + 2) * 3} becomes {@code 9}. Results that would not fit in a long are left unfolded.
 *
 * <p>The outermost operation of a nested expression is folded in one go. The operations left in
 * its result are remembered, so the walk below it does not fold them again.
 */
final class FoldConstantArithmetic implements StylePass {

  // Operations already folded as far as they go. Compared by identity.
  private final Set<Node> folded = Sets.newIdentityHashSet();

  @Override
  public Signal visit(Cursor cursor, StyleContext context) {
    Node n = cursor.getNode();
    if (!n.isBinaryOp() || folded.contains(n)) {
      return Signal.proceed();
    }
    Node result = fold(n);
    return result == n ? Signal.proceed() : Signal.proceed(result);
  }

  /**
   * Returns {@code root} with every foldable operation in its chain of operations folded, or
   * {@code root} itself. Operands that are not operations are not entered.
   */
  Node fold(Node root) {
    // Post-order without recursion: an operation is pushed once to expand it, then again to
    // combine the two operand results that its expansion left on the value stack.
    Deque<Node> work = new ArrayDeque<>();
    Deque<Boolean> expanded = new ArrayDeque<>();
    Deque<Node> values = new ArrayDeque<>();
    work.push(root);
    expanded.push(false);
    while (!work.isEmpty()) {
      Node n = work.pop();
      boolean ready = expanded.pop();
      if (!n.isBinaryOp() || folded.contains(n)) {
        values.push(n);
      } else if (!ready) {
        work.push(n);
        expanded.push(true);
        work.push(n.getRight());
        expanded.push(false);
        work.push(n.getLeft());
        expanded.push(false);
      } else {
        Node right = values.pop();
        Node left = values.pop();
        values.push(combine(n, left, right));
      }
    }
    return values.pop();
  }

  private Node combine(Node n, Node left, Node right) {
    if (left.isIntegerLiteral() && right.isIntegerLiteral()) {
      BigInteger l = BigInteger.valueOf(left.getLong());
      BigInteger r = BigInteger.valueOf(right.getLong());
      BigInteger result = evaluate(n.getString(), l, r);
      if (result != null && result.bitLength() < Long.SIZE) {
        return Node.newLeaf(result.longValue(), n.getMetadata());
      }
    }
    Node rebuilt = n.withChildren(ImmutableList.of(left, right));
    folded.add(rebuilt);
    return rebuilt;
  }

  private static @Nullable BigInteger evaluate(String operator, BigInteger left, BigInteger right) {
    switch (operator) {
      case "+":
        return left.add(right);
      case "-":
        return left.subtract(right);
      case "*":
        return left.multiply(right);
      default:
        return null;
    }
  }
}
