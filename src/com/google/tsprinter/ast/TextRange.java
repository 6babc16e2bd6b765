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

package com.google.tsprinter.ast;

/**
 * A half-open range of character offsets into a source text. Synthesized ranges use {@code -1}
 * for both ends.
 */
public interface TextRange {
  int getPos();

  int getEnd();

  /** Returns a detached range with the given bounds. */
  static TextRange of(int pos, int end) {
    return new SimpleTextRange(pos, end);
  }

  /** An immutable range that belongs to no node. */
  record SimpleTextRange(int pos, int end) implements TextRange {
    @Override
    public int getPos() {
      return pos;
    }

    @Override
    public int getEnd() {
      return end;
    }
  }
}
