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

import com.google.auto.value.AutoValue;

/**
 * Source information attached to every {@link Node}.
 *
 * <p>The anchor id is an opaque token a parser may hand out so that comments can be associated with
 * a node. It plays no part in ownership: two nodes may share an anchor id, and a node rebuilt from
 * another keeps its anchor id.
 */
@AutoValue
public abstract class NodeMetadata {

  public static final int UNKNOWN_LINE = -1;
  public static final int NO_ANCHOR = 0;

  /** Metadata for synthesized nodes with no source position. */
  public static final NodeMetadata EMPTY = create(UNKNOWN_LINE, NO_ANCHOR);

  /** One-indexed line number, or {@link #UNKNOWN_LINE}. */
  public abstract int getLineno();

  public abstract int getAnchorId();

  public static NodeMetadata create(int lineno, int anchorId) {
    checkArgument(lineno == UNKNOWN_LINE || lineno > 0, "bad line number %s", lineno);
    return new AutoValue_NodeMetadata(lineno, anchorId);
  }

  public static NodeMetadata atLine(int lineno) {
    return create(lineno, NO_ANCHOR);
  }

  public final boolean hasLineno() {
    return getLineno() != UNKNOWN_LINE;
  }

  public final NodeMetadata withLineno(int lineno) {
    return create(lineno, getAnchorId());
  }
}
