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

import static java.util.Objects.requireNonNull;

import com.google.common.base.Preconditions;

/**
 * A source comment. Comments are not part of the tree; they are kept in a {@link Comments} sequence
 * and tied to the code only through the line they are anchored to.
 *
 * @param text The comment's contents, including its delimiters.
 * @param line One-indexed line the comment is anchored to.
 * @param placement Whether the printer should put the comment before the code on its anchor line or
 *     after it.
 */
public record Comment(String text, int line, Placement placement) {

  /** Where a comment sits relative to the code on its anchor line. */
  public enum Placement {
    LEADING,
    TRAILING
  }

  public Comment {
    requireNonNull(text, "text");
    requireNonNull(placement, "placement");
    Preconditions.checkArgument(line > 0, "bad anchor line %s", line);
  }

  public static Comment leading(String text, int line) {
    return new Comment(text, line, Placement.LEADING);
  }

  public static Comment trailing(String text, int line) {
    return new Comment(text, line, Placement.TRAILING);
  }

  public Comment withLine(int newLine) {
    return newLine == line ? this : new Comment(text, newLine, placement);
  }

  public boolean isTrailing() {
    return placement == Placement.TRAILING;
  }
}
