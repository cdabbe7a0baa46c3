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

import com.google.common.collect.Range;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CommentAnchoringTest {

  private static final Comments COMMENTS =
      Comments.of(
          Comment.leading("# keep", 1), Comment.trailing("# dead", 2), Comment.leading("# z", 6));

  @Test
  public void testByLineMovesToSurvivor() {
    Comments result = CommentAnchoring.BY_LINE.reanchor(COMMENTS, Range.closed(2, 3), 1);
    assertThat(result.size()).isEqualTo(3);
    assertThat(result.inLines(Range.singleton(1))).hasSize(2);
    assertThat(result.inLines(Range.closed(2, 3))).isEmpty();
  }

  @Test
  public void testByLineWithoutSurvivorKeepsComments() {
    assertThat(
            CommentAnchoring.BY_LINE.reanchor(
                COMMENTS, Range.closed(2, 3), NodeMetadata.UNKNOWN_LINE))
        .isSameInstanceAs(COMMENTS);
  }

  @Test
  public void testKeep() {
    assertThat(CommentAnchoring.KEEP.reanchor(COMMENTS, Range.closed(1, 6), 9))
        .isSameInstanceAs(COMMENTS);
  }

  @Test
  public void testDrop() {
    Comments result = CommentAnchoring.DROP.reanchor(COMMENTS, Range.closed(2, 3), 1);
    assertThat(result.size()).isEqualTo(2);
    assertThat(result.inLines(Range.closed(2, 3))).isEmpty();
  }

  @Test
  public void testForConfigName() {
    assertThat(CommentAnchoring.forConfigName("line")).isEqualTo(CommentAnchoring.BY_LINE);
    assertThat(CommentAnchoring.forConfigName("DROP")).isEqualTo(CommentAnchoring.DROP);
    assertThat(CommentAnchoring.forConfigName("nearest")).isNull();
  }
}
