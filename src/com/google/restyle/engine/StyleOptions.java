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

import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.ForOverride;
import com.google.restyle.tree.CommentAnchoring;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.jspecify.annotations.Nullable;

/** User-facing options of a styling run. */
@AutoValue
public abstract class StyleOptions {

  /** The line length a printer is asked to respect when none is configured. */
  public static final int DEFAULT_LINE_LENGTH = 122;

  /**
   * The passes to run, in order, or null to run every known pass in the default order. An empty
   * list runs no pass.
   */
  public abstract @Nullable ImmutableList<PassSetting> getEnabledPasses();

  public abstract FailurePolicy getFailurePolicy();

  /** The maximum line length handed to the printer. */
  public abstract int getLineLength();

  /** The directory relative file paths and ignore prefixes are resolved against. */
  public abstract Path getWorkingDirectory();

  public abstract CommentAnchoring getCommentAnchoring();

  public abstract Builder toBuilder();

  /** Returns options with every value at its default. */
  public static StyleOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_StyleOptions.Builder()
        .setEnabledPasses(null)
        .setFailurePolicy(FailurePolicy.LOG)
        .setLineLength(DEFAULT_LINE_LENGTH)
        .setWorkingDirectory(Paths.get("").toAbsolutePath())
        .setCommentAnchoring(CommentAnchoring.BY_LINE);
  }

  /** A builder for {@link StyleOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setEnabledPasses(@Nullable ImmutableList<PassSetting> x);

    public abstract Builder setFailurePolicy(FailurePolicy x);

    public abstract Builder setLineLength(int x);

    public abstract Builder setWorkingDirectory(Path x);

    public abstract Builder setCommentAnchoring(CommentAnchoring x);

    @ForOverride
    abstract StyleOptions autoBuild();

    public final StyleOptions build() {
      StyleOptions options = autoBuild();
      checkState(options.getLineLength() > 0, "line length must be positive");
      return options;
    }
  }
}
