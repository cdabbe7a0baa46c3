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

import com.google.common.base.Ascii;
import com.google.common.collect.Range;
import org.jspecify.annotations.Nullable;

/** The built-in {@link CommentAnchoringPolicy} implementations. */
public enum CommentAnchoring implements CommentAnchoringPolicy {
  /**
   * Anchor by line: comments inside the removed lines move to the survivor's line. Without a
   * survivor they stay where they are and the printer places them by line.
   */
  BY_LINE("line") {
    @Override
    public Comments reanchor(Comments comments, Range<Integer> removedLines, int survivorLine) {
      if (survivorLine == NodeMetadata.UNKNOWN_LINE) {
        return comments;
      }
      return comments.relocateLines(removedLines, survivorLine);
    }
  },

  /** Leaves every comment on its original line. */
  KEEP("keep") {
    @Override
    public Comments reanchor(Comments comments, Range<Integer> removedLines, int survivorLine) {
      return comments;
    }
  },

  /** Deletes the comments anchored inside the removed lines. */
  DROP("drop") {
    @Override
    public Comments reanchor(Comments comments, Range<Integer> removedLines, int survivorLine) {
      return comments.withoutLines(removedLines);
    }
  };

  private final String configName;

  CommentAnchoring(String configName) {
    this.configName = configName;
  }

  /** The name used for this policy in configuration files. */
  public String getConfigName() {
    return configName;
  }

  public static @Nullable CommentAnchoring forConfigName(String name) {
    String lower = Ascii.toLowerCase(name);
    for (CommentAnchoring policy : values()) {
      if (policy.configName.equals(lower)) {
        return policy;
      }
    }
    return null;
  }
}
