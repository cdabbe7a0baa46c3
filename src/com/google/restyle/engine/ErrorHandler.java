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
 * The error handler is any generic sink for the diagnostics a styling run produces. A {@link
 * Restyler} may report from several threads at once when it styles files in parallel.
 */
public interface ErrorHandler {
  /**
   * @param level the reporting level
   * @param diagnostic the diagnostic to report
   */
  void report(CheckLevel level, Diagnostic diagnostic);
}
