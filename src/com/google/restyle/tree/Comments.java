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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import com.google.errorprone.annotations.CheckReturnValue;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The comments of one source file, ordered by anchor line. Comments on the same line keep the order
 * they were added in.
 *
 * <p>Instances are immutable. Every change returns a new sequence, and no change happens as a side
 * effect of editing the tree: a pass that deletes code must decide explicitly what happens to the
 * comments anchored in it, usually through a {@link CommentAnchoringPolicy}.
 */
@CheckReturnValue
public final class Comments implements Iterable<Comment> {

  private static final Comparator<Comment> BY_LINE = Comparator.comparingInt(Comment::line);

  private static final Comments EMPTY = new Comments(ImmutableList.of());

  private final ImmutableList<Comment> comments;

  private Comments(ImmutableList<Comment> sorted) {
    this.comments = sorted;
  }

  public static Comments empty() {
    return EMPTY;
  }

  public static Comments of(Comment... comments) {
    return copyOf(ImmutableList.copyOf(comments));
  }

  public static Comments copyOf(Iterable<Comment> comments) {
    // sortedCopyOf is stable, so same-line comments keep their relative order.
    return new Comments(ImmutableList.sortedCopyOf(BY_LINE, comments));
  }

  public int size() {
    return comments.size();
  }

  public boolean isEmpty() {
    return comments.isEmpty();
  }

  public Comment get(int index) {
    return comments.get(index);
  }

  public ImmutableList<Comment> asList() {
    return comments;
  }

  @Override
  public Iterator<Comment> iterator() {
    return comments.iterator();
  }

  /** Returns the comments anchored on a line inside {@code lines}, in order. */
  public ImmutableList<Comment> inLines(Range<Integer> lines) {
    ImmutableList.Builder<Comment> result = ImmutableList.builder();
    for (Comment c : comments) {
      if (lines.contains(c.line())) {
        result.add(c);
      }
    }
    return result.build();
  }

  /** Adds a comment after any comment already anchored on the same line. */
  public Comments plus(Comment comment) {
    List<Comment> result = new ArrayList<>(comments.size() + 1);
    int i = 0;
    while (i < comments.size() && comments.get(i).line() <= comment.line()) {
      result.add(comments.get(i++));
    }
    result.add(comment);
    result.addAll(comments.subList(i, comments.size()));
    return new Comments(ImmutableList.copyOf(result));
  }

  /**
   * Removes one occurrence of {@code comment}.
   *
   * @throws IllegalArgumentException if the comment is not in this sequence
   */
  public Comments minus(Comment comment) {
    int index = comments.indexOf(comment);
    checkArgument(index >= 0, "no such comment: %s", comment);
    return new Comments(
        ImmutableList.<Comment>builder()
            .addAll(comments.subList(0, index))
            .addAll(comments.subList(index + 1, comments.size()))
            .build());
  }

  /** Moves one comment to another anchor line. */
  public Comments relocate(Comment comment, int newLine) {
    return minus(comment).plus(comment.withLine(newLine));
  }

  /**
   * Moves every comment anchored inside {@code lines} to {@code targetLine}. The moved comments
   * keep their relative order and follow the comments already on the target line.
   */
  public Comments relocateLines(Range<Integer> lines, int targetLine) {
    ImmutableList<Comment> moved = inLines(lines);
    if (moved.isEmpty()) {
      return this;
    }
    Comments result = withoutLines(lines);
    for (Comment c : moved) {
      result = result.plus(c.withLine(targetLine));
    }
    return result;
  }

  /** Drops every comment anchored inside {@code lines}. */
  public Comments withoutLines(Range<Integer> lines) {
    ImmutableList.Builder<Comment> result = ImmutableList.builder();
    boolean changed = false;
    for (Comment c : comments) {
      if (lines.contains(c.line())) {
        changed = true;
      } else {
        result.add(c);
      }
    }
    return changed ? new Comments(result.build()) : this;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    return o instanceof Comments && ((Comments) o).comments.equals(comments);
  }

  @Override
  public int hashCode() {
    return comments.hashCode();
  }

  @Override
  public String toString() {
    return comments.toString();
  }
}
