/*
 * Copyright 2016 The Closure Compiler Authors.
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

/** The output buffer the printer writes into. Lines and columns are zero based. */
public interface TextWriter {

  /** Appends text that contains no line breaks, indenting first if at the start of a line. */
  void write(String s);

  /** Appends text that may contain line breaks, keeping line bookkeeping in sync. */
  void writeLiteral(String s);

  /** Ends the current line, unless nothing has been written on it yet. */
  void writeLine();

  void increaseIndent();

  void decreaseIndent();

  int getIndent();

  int getLine();

  int getColumn();

  /** Returns the number of characters written so far. */
  int getTextPos();

  /** Whether nothing has been written on the current line. */
  boolean isAtStartOfLine();

  String getText();

  /** Discards all output and indentation. */
  void reset();
}
