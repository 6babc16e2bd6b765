/*
 * Copyright 2007 The Closure Compiler Authors.
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

package com.google.tsprinter.emit;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An error manager that logs errors and warnings using a logger in addition to collecting them in
 * memory. Errors are logged at the SEVERE level and warnings are logged at the WARNING level. Each
 * error is logged by one report only.
 */
public class LoggerErrorManager implements ErrorManager {
  private final Logger logger;
  private final List<ErrorWithLevel> errors = new ArrayList<>();
  private int errorCount;
  private int warningCount;
  // Errors before this index were written out by an earlier report.
  private int reportedCount;

  public LoggerErrorManager(Logger logger) {
    this.logger = logger;
  }

  @Override
  public void report(CheckLevel level, EmitError error) {
    switch (level) {
      case ERROR:
        errorCount++;
        break;
      case WARNING:
        warningCount++;
        break;
      case OFF:
        return;
    }
    errors.add(new ErrorWithLevel(error, level));
  }

  /** Logs the errors reported since the previous report, then a summary of them. */
  @Override
  public void generateReport() {
    int newErrors = 0;
    int newWarnings = 0;
    for (ErrorWithLevel e : errors.subList(reportedCount, errors.size())) {
      println(e.level, e.error);
      if (e.level == CheckLevel.ERROR) {
        newErrors++;
      } else {
        newWarnings++;
      }
    }
    reportedCount = errors.size();
    printSummary(newErrors, newWarnings);
  }

  public void println(CheckLevel level, EmitError error) {
    switch (level) {
      case ERROR:
        logger.severe(error.format());
        break;
      case WARNING:
        logger.warning(error.format());
        break;
      case OFF:
        break;
    }
  }

  protected void printSummary(int errors, int warnings) {
    if (errors + warnings > 0) {
      logger.log(Level.WARNING, "{0} error(s), {1} warning(s)", new Object[] {errors, warnings});
    }
  }

  @Override
  public int getErrorCount() {
    return errorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public ImmutableList<EmitError> getDiagnostics() {
    return errors.stream().map(e -> e.error).collect(toImmutableList());
  }

  /** An error and the level it was reported at. */
  static final class ErrorWithLevel {
    final EmitError error;
    final CheckLevel level;

    ErrorWithLevel(EmitError error, CheckLevel level) {
      this.error = error;
      this.level = level;
    }
  }
}
