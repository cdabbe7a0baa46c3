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

import com.google.common.collect.ImmutableSet;

/** Turns source text into a tree and its comments. */
public interface SourceParser {

  /**
   * Parses one file.
   *
   * @param sourceText The content of the file.
   * @param filePath The path of the file, used in error messages.
   * @throws ParseError if the text is not valid source
   */
  ParsedSource parse(String sourceText, String filePath);

  /**
   * The file extensions, with their leading dot, this parser understands. Empty if it understands
   * every file.
   */
  default ImmutableSet<String> getSupportedExtensions() {
    return ImmutableSet.of();
  }
}
