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

/** The diagnostics the engine itself reports. */
public final class StyleDiagnostics {

  private StyleDiagnostics() {}

  /** A pass threw while visiting a file and its edits were dropped. */
  public static final DiagnosticType PASS_FAILURE =
      DiagnosticType.warning(
          "RESTYLE_PASS_FAILURE", "Pass {0} failed: {1}. Skipping the pass and continuing on.");
}
