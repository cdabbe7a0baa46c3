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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.restyle.tree.CommentAnchoring;
import com.google.restyle.tree.CommentAnchoringPolicy;
import com.google.restyle.tree.Comments;
import com.google.restyle.tree.Node;
import com.google.restyle.tree.NodeMetadata;
import org.jspecify.annotations.Nullable;

/**
 * The per-file state threaded through every pass of a pipeline run: the file's comments, its path
 * and the diagnostics recorded so far.
 *
 * <p>Contexts are immutable and are replaced, never mutated. A context belongs to exactly one file.
 */
@AutoValue
@CheckReturnValue
public abstract class StyleContext {

  /** The path of the file being styled, as given to the pipeline. */
  public abstract String getFilePath();

  public abstract Comments getComments();

  /** Diagnostics recorded so far, in the order they were recorded. */
  public abstract ImmutableList<Diagnostic> getDiagnostics();

  /** The policy passes should use when code that carries comments goes away. */
  public abstract CommentAnchoringPolicy getAnchoringPolicy();

  public abstract Builder toBuilder();

  public static StyleContext create(String filePath, Comments comments) {
    return builder().setFilePath(filePath).setComments(comments).build();
  }

  public static Builder builder() {
    return new AutoValue_StyleContext.Builder()
        .setDiagnostics(ImmutableList.of())
        .setAnchoringPolicy(CommentAnchoring.BY_LINE);
  }

  public final StyleContext withComments(Comments comments) {
    return toBuilder().setComments(comments).build();
  }

  public final StyleContext withDiagnostic(Diagnostic diagnostic) {
    return toBuilder()
        .setDiagnostics(
            ImmutableList.<Diagnostic>builder()
                .addAll(getDiagnostics())
                .add(diagnostic)
                .build())
        .build();
  }

  /**
   * Applies the anchoring policy to the comments anchored inside {@code removed}, a node a pass is
   * about to drop from the tree.
   *
   * @param removed The node that goes away.
   * @param survivor The nearest node that stays, or null if there is none.
   */
  public final StyleContext reanchorComments(Node removed, @Nullable Node survivor) {
    Range<Integer> lines = NodeUtil.getLineRange(removed);
    if (lines == null) {
      return this;
    }
    int survivorLine = survivor == null ? NodeMetadata.UNKNOWN_LINE : survivor.getLineno();
    Comments updated = getAnchoringPolicy().reanchor(getComments(), lines, survivorLine);
    return updated.equals(getComments()) ? this : withComments(updated);
  }

  /** A builder for a {@link StyleContext}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setFilePath(String x);

    public abstract Builder setComments(Comments x);

    public abstract Builder setDiagnostics(ImmutableList<Diagnostic> x);

    public abstract Builder setAnchoringPolicy(CommentAnchoringPolicy x);

    public abstract StyleContext build();
  }
}
