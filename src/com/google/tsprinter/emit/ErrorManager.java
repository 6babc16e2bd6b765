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

import com.google.common.collect.ImmutableList;

/** Collects the errors and warnings of an emit run. */
public interface ErrorManager {

  /** Reports an error at the given level. */
  void report(CheckLevel level, EmitError error);

  /** Writes out the errors collected since the previous report. */
  void generateReport();

  int getErrorCount();

  int getWarningCount();

  /** Returns the errors and warnings reported so far, in report order. */
  ImmutableList<EmitError> getDiagnostics();
}
