/*
 * Copyright 2009 The Closure Compiler Authors.
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

package com.google.tsprinter.sourcemap;

import com.google.common.base.Objects;

/** A zero based line and column in a generated or original file. */
public final class FilePosition {
  private final int line;
  private final int column;

  public FilePosition(int line, int column) {
    this.line = line;
    this.column = column;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  /** Whether this position comes after {@code other}. */
  public boolean isAfter(FilePosition other) {
    return line > other.line || (line == other.line && column > other.column);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof FilePosition)) {
      return false;
    }
    FilePosition that = (FilePosition) o;
    return line == that.line && column == that.column;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(line, column);
  }

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
