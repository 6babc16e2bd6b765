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

import com.google.common.base.Predicate;
import com.google.common.collect.ImmutableList;
import com.google.tsprinter.ast.CommentRange;
import com.google.tsprinter.ast.Node;
import com.google.tsprinter.ast.SourceFile;
import com.google.tsprinter.ast.TextRange;
import java.util.List;

/**
 * Finds the comments of the current source file that belong to a range and writes them. Each
 * comment is handed out at most once per output pass.
 */
public interface CommentWriter {

  ImmutableList<CommentRange> getLeadingComments(TextRange range);

  /** Returns no comments when {@code skip} applies to the node. */
  ImmutableList<CommentRange> getLeadingComments(Node node, Predicate<Node> skip);

  ImmutableList<CommentRange> getTrailingComments(TextRange range);

  /** Returns no comments when {@code skip} applies to the node. */
  ImmutableList<CommentRange> getTrailingComments(Node node, Predicate<Node> skip);

  /** Returns the comments on the same line after {@code pos}. */
  ImmutableList<CommentRange> getTrailingCommentsOfPosition(int pos);

  void emitLeadingComments(TextRange range, List<CommentRange> comments);

  void emitTrailingComments(TextRange range, List<CommentRange> comments);

  /**
   * Writes the comments before {@code range} that are separated from it by a blank line, such as
   * a license header.
   */
  void emitDetachedComments(TextRange range);

  void setSourceFile(SourceFile sourceFile);

  void reset();
}
