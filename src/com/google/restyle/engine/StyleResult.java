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
import com.google.restyle.tree.Comments;
import com.google.restyle.tree.Node;

/** The styled tree and comments of one file, and the diagnostics recorded while styling it. */
@AutoValue
public abstract class StyleResult {

  public abstract Node getRoot();

  public abstract Comments getComments();

  public abstract ImmutableList<Diagnostic> getDiagnostics();

  public final boolean hasDiagnostics() {
    return !getDiagnostics().isEmpty();
  }

  static StyleResult create(Node root, Comments comments, ImmutableList<Diagnostic> diagnostics) {
    return new AutoValue_StyleResult(root, comments, diagnostics);
  }
}
