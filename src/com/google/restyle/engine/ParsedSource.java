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
import com.google.restyle.tree.Comments;
import com.google.restyle.tree.Node;

/** A parsed file: its tree and, separately, its comments. */
@AutoValue
public abstract class ParsedSource {

  public abstract Node getTree();

  public abstract Comments getComments();

  public static ParsedSource create(Node tree, Comments comments) {
    return new AutoValue_ParsedSource(tree, comments);
  }
}
