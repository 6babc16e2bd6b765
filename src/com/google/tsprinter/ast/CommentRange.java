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
 * A comment found in source text.
 *
 * @param pos offset of the first character of the comment
 * @param end offset just past the comment
 * @param multiLine whether this is a {@code /* ... *}{@code /} comment
 * @param hasTrailingNewLine whether a line break follows the comment
 */
public record CommentRange(int pos, int end, boolean multiLine, boolean hasTrailingNewLine)
    implements TextRange {

  @Override
  public int getPos() {
    return pos;
  }

  @Override
  public int getEnd() {
    return end;
  }

  CommentRange withTrailingNewLine() {
    return new CommentRange(pos, end, multiLine, true);
  }

  /** Returns the comment text, including its delimiters. */
  public String getText(String sourceText) {
    return sourceText.substring(pos, end);
  }
}
