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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An error manager that logs diagnostics using a logger in addition to collecting them in memory.
 * Errors are logged at the SEVERE level and warnings are logged at the WARNING level.
 */
public class LoggerErrorManager implements ErrorHandler {
  private final Logger logger;
  private final List<Diagnostic> diagnostics = new ArrayList<>();
  private int errorCount;
  private int warningCount;

  public LoggerErrorManager(Logger logger) {
    this.logger = logger;
  }

  @Override
  public synchronized void report(CheckLevel level, Diagnostic diagnostic) {
    if (!level.isOn()) {
      return;
    }
    diagnostics.add(diagnostic);
    switch (level) {
      case ERROR:
        errorCount++;
        logger.log(Level.SEVERE, diagnostic.toString(), diagnostic.cause());
        break;
      case WARNING:
        warningCount++;
        logger.log(Level.WARNING, diagnostic.toString(), diagnostic.cause());
        break;
      case OFF:
        break;
    }
  }

  public synchronized ImmutableList<Diagnostic> getDiagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  public synchronized int getErrorCount() {
    return errorCount;
  }

  public synchronized int getWarningCount() {
    return warningCount;
  }

  /** Logs the number of errors and warnings reported so far. */
  public synchronized void printSummary() {
    Level level = (errorCount + warningCount == 0) ? Level.INFO : Level.WARNING;
    logger.log(
        level, "{0} error(s), {1} warning(s)", new Object[] {errorCount, warningCount});
  }
}
