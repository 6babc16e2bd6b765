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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.google.tsprinter.ast.Trivia;

/**
 * A text writer that indents each line by four spaces per level. Indentation is written lazily,
 * by the first write on a line, so empty lines carry no trailing whitespace.
 */
public final class IndentingTextWriter implements TextWriter {
  static final String INDENT = "    ";

  private static final CharMatcher LINE_BREAKS =
      CharMatcher.anyOf("\r\n\u2028\u2029");

  private final String newLine;
  private final StringBuilder output = new StringBuilder(1024);
  private int indent;
  private boolean lineStart = true;
  private int lineCount;
  private int linePos;

  public IndentingTextWriter(String newLine) {
    this.newLine = newLine;
  }

  @Override
  public void write(String s) {
    if (s.isEmpty()) {
      return;
    }
    if (lineStart) {
      output.append(Strings.repeat(INDENT, indent));
      lineStart = false;
    }
    output.append(s);
  }

  @Override
  public void writeLiteral(String s) {
    if (s.isEmpty()) {
      return;
    }
    write(s);
    if (LINE_BREAKS.matchesAnyOf(s)) {
      int lastLineStart = 0;
      for (int i = 0; i < s.length(); i++) {
        char ch = s.charAt(i);
        if (Trivia.isLineBreak(ch)) {
          if (ch == '\r' && i + 1 < s.length() && s.charAt(i + 1) == '\n') {
            i++;
          }
          lineCount++;
          lastLineStart = i + 1;
        }
      }
      linePos = output.length() - s.length() + lastLineStart;
    }
  }

  @Override
  public void writeLine() {
    if (!lineStart) {
      output.append(newLine);
      lineCount++;
      linePos = output.length();
      lineStart = true;
    }
  }

  @Override
  public void increaseIndent() {
    indent++;
  }

  @Override
  public void decreaseIndent() {
    checkState(indent > 0, "Unbalanced indentation");
    indent--;
  }

  @Override
  public int getIndent() {
    return indent;
  }

  @Override
  public int getLine() {
    return lineCount;
  }

  @Override
  public int getColumn() {
    return lineStart ? indent * INDENT.length() : output.length() - linePos;
  }

  @Override
  public int getTextPos() {
    return output.length();
  }

  @Override
  public boolean isAtStartOfLine() {
    return lineStart;
  }

  @Override
  public String getText() {
    return output.toString();
  }

  @Override
  public void reset() {
    output.setLength(0);
    indent = 0;
    lineStart = true;
    lineCount = 0;
    linePos = 0;
  }

  @Override
  public String toString() {
    return getText();
  }
}
