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

import com.google.common.collect.Range;

/**
 * Decides what happens to the comments anchored inside code that a pass deletes or moves.
 *
 * @see CommentAnchoring for the built-in policies
 */
@FunctionalInterface
public interface CommentAnchoringPolicy {

  /**
   * @param comments The current comments of the file.
   * @param removedLines The lines spanned by the code that went away.
   * @param survivorLine The line of the nearest code that is still there, or {@link
   *     NodeMetadata#UNKNOWN_LINE} if there is none.
   * @return the comments after re-anchoring
   */
  Comments reanchor(Comments comments, Range<Integer> removedLines, int survivorLine);
}
