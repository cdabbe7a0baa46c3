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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.Range;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CommentsTest {

  private static final Comment FIRST = Comment.leading("# first", 1);
  private static final Comment SECOND = Comment.trailing("# second", 3);
  private static final Comment THIRD = Comment.leading("# third", 5);

  @Test
  public void testCopyOfSortsByLineAndKeepsSameLineOrder() {
    Comment a = Comment.leading("# a", 3);
    Comments comments = Comments.of(THIRD, a, SECOND, FIRST);
    assertThat(comments.asList()).containsExactly(FIRST, a, SECOND, THIRD).inOrder();
  }

  @Test
  public void testPlusGoesAfterSameLineComments() {
    Comment extra = Comment.leading("# extra", 3);
    Comments comments = Comments.of(FIRST, SECOND, THIRD).plus(extra);
    assertThat(comments.asList()).containsExactly(FIRST, SECOND, extra, THIRD).inOrder();
  }

  @Test
  public void testMinus() {
    Comments comments = Comments.of(FIRST, SECOND).minus(FIRST);
    assertThat(comments.asList()).containsExactly(SECOND);
    assertThrows(IllegalArgumentException.class, () -> comments.minus(THIRD));
  }

  @Test
  public void testRelocate() {
    Comments comments = Comments.of(FIRST, SECOND, THIRD).relocate(FIRST, 4);
    assertThat(comments.asList())
        .containsExactly(SECOND, Comment.leading("# first", 4), THIRD)
        .inOrder();
  }

  @Test
  public void testRelocateLinesKeepsCount() {
    Comments comments = Comments.of(FIRST, SECOND, THIRD);
    Comments moved = comments.relocateLines(Range.closed(2, 5), 1);
    assertThat(moved.size()).isEqualTo(comments.size());
    assertThat(moved.get(0)).isEqualTo(FIRST);
    assertThat(moved.get(1)).isEqualTo(Comment.trailing("# second", 1));
    assertThat(moved.get(2)).isEqualTo(Comment.leading("# third", 1));
  }

  @Test
  public void testRelocateLinesWithNothingInRangeIsIdentity() {
    Comments comments = Comments.of(FIRST, THIRD);
    assertThat(comments.relocateLines(Range.closed(2, 4), 9)).isSameInstanceAs(comments);
  }

  @Test
  public void testWithoutLines() {
    Comments comments = Comments.of(FIRST, SECOND, THIRD);
    assertThat(comments.withoutLines(Range.closed(3, 5)).asList()).containsExactly(FIRST);
    assertThat(comments.withoutLines(Range.closed(6, 7))).isSameInstanceAs(comments);
  }

  @Test
  public void testInLines() {
    Comments comments = Comments.of(FIRST, SECOND, THIRD);
    assertThat(comments.inLines(Range.closed(1, 3))).containsExactly(FIRST, SECOND).inOrder();
  }

  @Test
  public void testEquality() {
    assertThat(Comments.of(FIRST, SECOND)).isEqualTo(Comments.of(SECOND, FIRST));
    assertThat(Comments.of()).isEqualTo(Comments.empty());
    assertThat(Comments.empty().isEmpty()).isTrue();
  }

  @Test
  public void testBadAnchorLine() {
    assertThrows(IllegalArgumentException.class, () -> Comment.leading("# x", 0));
  }
}
