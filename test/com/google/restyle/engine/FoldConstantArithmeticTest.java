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

import com.google.restyle.tree.Comments;
import com.google.restyle.tree.IR;
import com.google.restyle.tree.Node;
import com.google.restyle.tree.NodeMetadata;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link FoldConstantArithmetic}. */
@RunWith(JUnit4.class)
public final class FoldConstantArithmeticTest extends PassTestCase {

  @Override
  protected StylePass getPass() {
    return new FoldConstantArithmetic();
  }

  @Override
  protected int getNumRepetitions() {
    return 2;
  }

  private static Node num(long value) {
    return Node.newLeaf(value);
  }

  private static Node op(String operator, Node left, Node right) {
    return IR.binaryOp(operator, left, right);
  }

  @Test
  public void testFoldSimpleArithmetic() {
    test(IR.block(op("+", num(1), num(2))), IR.block(num(3)));
    test(IR.block(op("-", num(1), num(2))), IR.block(num(-1)));
    test(IR.block(op("*", num(4), num(5))), IR.block(num(20)));
  }

  @Test
  public void testFoldNested() {
    test(IR.block(op("*", op("+", num(1), num(2)), num(3))), IR.block(num(9)));
  }

  @Test
  public void testFoldInsideCall() {
    Node f = Node.newIdentifier("f");
    test(IR.call(f, op("+", num(1), num(1))), IR.call(f, num(2)));
  }

  @Test
  public void testPartialFold() {
    Node x = Node.newIdentifier("x");
    test(op("+", x, op("*", num(2), num(3))), op("+", x, num(6)));
  }

  @Test
  public void testNoFoldOfOtherOperatorsOrLiterals() {
    testSame(IR.block(op("/", num(4), num(2))));
    testSame(IR.block(op("+", Node.newLeaf("a"), Node.newLeaf("b"))));
    testSame(IR.block(op("+", Node.newLeaf(1.5), num(1))));
    testSame(IR.block(op("+", Node.newIdentifier("x"), num(1))));
  }

  @Test
  public void testNoFoldOnOverflow() {
    testSame(IR.block(op("+", num(Long.MAX_VALUE), num(1))));
    testSame(IR.block(op("*", num(Long.MIN_VALUE), num(-1))));
  }

  @Test
  public void testFoldedLiteralKeepsLine() {
    Node sum = op("+", num(1), num(2)).withMetadata(NodeMetadata.atLine(7));
    assertThat(new FoldConstantArithmetic().fold(sum).getLineno()).isEqualTo(7);
  }

  @Test
  public void testFoldReturnsSameInstanceWhenNothingFolds() {
    Node sum = op("+", Node.newIdentifier("x"), num(1));
    assertThat(new FoldConstantArithmetic().fold(sum)).isSameInstanceAs(sum);
  }

  @Test
  public void testFoldDeepChain() {
    Node chain = num(1);
    for (int i = 1; i < 20_000; i++) {
      chain = op("+", chain, num(1));
    }
    test(IR.block(chain), IR.block(num(20_000)));
  }

  @Test
  public void testDeepUnfoldableChainIsLeftAlone() {
    Node chain = Node.newIdentifier("x");
    for (int i = 0; i < 20_000; i++) {
      chain = op("+", chain, num(1));
    }
    Node tree = IR.block(chain);
    TreeTraversal.Result result =
        TreeTraversal.traverse(
            tree, StyleContext.create("a.ex", Comments.empty()), new FoldConstantArithmetic());
    assertThat(result.getRoot()).isSameInstanceAs(tree);
    assertThat(result.getVisitCount()).isEqualTo(2 * 20_000 + 2);
  }
}
