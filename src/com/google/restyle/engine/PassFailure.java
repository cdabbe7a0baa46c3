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

import static com.google.common.base.Preconditions.checkNotNull;

/** Thrown when a pass fails on a file and the pipeline runs with {@link FailurePolicy#RAISE}. */
public final class PassFailure extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String passName;
  private final String filePath;

  public PassFailure(String passName, String filePath, RuntimeException cause) {
    super(
        "Pass " + passName + " failed on " + filePath + ": " + cause.getMessage(),
        checkNotNull(cause));
    this.passName = passName;
    this.filePath = filePath;
  }

  public String getPassName() {
    return passName;
  }

  public String getFilePath() {
    return filePath;
  }

  /** The exception the pass threw. */
  @Override
  public synchronized RuntimeException getCause() {
    return (RuntimeException) super.getCause();
  }
}
