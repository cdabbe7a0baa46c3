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

/**
 * Thrown by a {@link SourceParser} for source text it cannot parse. The engine never recovers from
 * it; it reaches the caller unchanged.
 */
public class ParseError extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String sourceName;
  private final int lineNumber;
  private final int columnNumber;

  /**
   * @param sourceName the name of the source responsible for the error
   * @param lineNumber the one-indexed line number of the error
   * @param columnNumber the column number of the error (may be zero if unknown)
   * @param message the parser's description of the problem
   */
  public ParseError(String sourceName, int lineNumber, int columnNumber, String message) {
    super(sourceName + ":" + lineNumber + ":" + columnNumber + ": " + message);
    this.sourceName = sourceName;
    this.lineNumber = lineNumber;
    this.columnNumber = columnNumber;
  }

  public String getSourceName() {
    return sourceName;
  }

  public int getLineNumber() {
    return lineNumber;
  }

  public int getColumnNumber() {
    return columnNumber;
  }
}
