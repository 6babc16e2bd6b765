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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Predicate;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.tsprinter.ast.CommentRange;
import com.google.tsprinter.ast.Node;
import com.google.tsprinter.ast.SourceFile;
import com.google.tsprinter.ast.TextRange;
import com.google.tsprinter.ast.Trivia;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * The default {@link CommentWriter}. Comments are read from the source text of the current file.
 * With {@code removeComments} set, only {@code /*!} comments at the top of a file survive.
 */
public final class DefaultCommentWriter implements CommentWriter {

  private static final Splitter LINE_SPLITTER =
      Splitter.on(Pattern.compile("\r\n|\r|\n|\u2028|\u2029"));

  private static final int TAB_WIDTH = IndentingTextWriter.INDENT.length();

  private final TextWriter writer;
  private final SourceMapWriter sourceMap;
  private final boolean removeComments;

  // Start positions of the comments already handed out in this pass.
  private final Set<Integer> consumed = new HashSet<>();

  private @Nullable SourceFile currentSourceFile;

  public DefaultCommentWriter(TextWriter writer, SourceMapWriter sourceMap, EmitOptions options) {
    this.writer = checkNotNull(writer);
    this.sourceMap = checkNotNull(sourceMap);
    this.removeComments = options.getRemoveComments();
  }

  @Override
  public ImmutableList<CommentRange> getLeadingComments(TextRange range) {
    if (removeComments || currentSourceFile == null || range.getPos() < 0) {
      return ImmutableList.of();
    }
    return consume(
        Trivia.getLeadingCommentRanges(currentSourceFile.getSourceText(), range.getPos()));
  }

  @Override
  public ImmutableList<CommentRange> getLeadingComments(Node node, Predicate<Node> skip) {
    if (skip.apply(node) || !isInCurrentFile(node)) {
      return ImmutableList.of();
    }
    return getLeadingComments(node);
  }

  @Override
  public ImmutableList<CommentRange> getTrailingComments(TextRange range) {
    if (removeComments || currentSourceFile == null || range.getEnd() < 0) {
      return ImmutableList.of();
    }
    return consume(
        Trivia.getTrailingCommentRanges(currentSourceFile.getSourceText(), range.getEnd()));
  }

  @Override
  public ImmutableList<CommentRange> getTrailingComments(Node node, Predicate<Node> skip) {
    if (skip.apply(node) || !isInCurrentFile(node)) {
      return ImmutableList.of();
    }
    return getTrailingComments(node);
  }

  @Override
  public ImmutableList<CommentRange> getTrailingCommentsOfPosition(int pos) {
    if (removeComments || currentSourceFile == null || pos < 0) {
      return ImmutableList.of();
    }
    return consume(Trivia.getTrailingCommentRanges(currentSourceFile.getSourceText(), pos));
  }

  private boolean isInCurrentFile(Node node) {
    SourceFile file = node.getSourceFile();
    return file == null || file == currentSourceFile;
  }

  private ImmutableList<CommentRange> consume(List<CommentRange> comments) {
    ImmutableList.Builder<CommentRange> result = ImmutableList.builder();
    for (CommentRange comment : comments) {
      if (consumed.add(comment.getPos())) {
        result.add(comment);
      }
    }
    return result.build();
  }

  @Override
  public void emitLeadingComments(TextRange range, List<CommentRange> comments) {
    if (comments.isEmpty()) {
      return;
    }
    emitNewLineBeforeLeadingComments(range, comments);
    emitComments(comments, /* leadingSeparator= */ false, /* trailingSeparator= */ true);
  }

  @Override
  public void emitTrailingComments(TextRange range, List<CommentRange> comments) {
    if (comments.isEmpty()) {
      return;
    }
    emitComments(comments, /* leadingSeparator= */ true, /* trailingSeparator= */ false);
    if (!comments.get(comments.size() - 1).multiLine()) {
      writer.writeLine();
    }
  }

  @Override
  public void emitDetachedComments(TextRange range) {
    if (currentSourceFile == null || range.getPos() < 0) {
      return;
    }
    String text = currentSourceFile.getSourceText();
    List<CommentRange> leadingComments;
    if (removeComments) {
      if (range.getPos() != 0) {
        return;
      }
      leadingComments = new ArrayList<>();
      for (CommentRange comment : Trivia.getLeadingCommentRanges(text, 0)) {
        if (isPinnedComment(text, comment)) {
          leadingComments.add(comment);
        }
      }
    } else {
      leadingComments = Trivia.getLeadingCommentRanges(text, range.getPos());
    }

    List<CommentRange> detached = new ArrayList<>();
    @Nullable CommentRange last = null;
    for (CommentRange comment : leadingComments) {
      if (consumed.contains(comment.getPos())) {
        return;
      }
      if (last != null && lineOf(comment.getPos()) >= lineOf(last.getEnd()) + 2) {
        // A blank line ends the header block.
        break;
      }
      detached.add(comment);
      last = comment;
    }
    if (last == null) {
      return;
    }
    // The header must be followed by a blank line too.
    if (lineOf(Trivia.skipTrivia(text, range.getPos())) >= lineOf(last.getEnd()) + 2) {
      emitNewLineBeforeLeadingComments(range, detached);
      emitComments(detached, /* leadingSeparator= */ false, /* trailingSeparator= */ true);
      for (CommentRange comment : detached) {
        consumed.add(comment.getPos());
      }
    }
  }

  private static boolean isPinnedComment(String text, CommentRange comment) {
    return comment.multiLine()
        && comment.getPos() + 2 < text.length()
        && text.charAt(comment.getPos() + 2) == '!';
  }

  private void emitNewLineBeforeLeadingComments(TextRange range, List<CommentRange> comments) {
    int firstPos = comments.get(0).getPos();
    if (range.getPos() != firstPos && lineOf(range.getPos()) != lineOf(firstPos)) {
      writer.writeLine();
    }
  }

  private void emitComments(
      List<CommentRange> comments, boolean leadingSeparator, boolean trailingSeparator) {
    if (leadingSeparator) {
      writer.write(" ");
    }
    boolean emitInterveningSeparator = false;
    for (CommentRange comment : comments) {
      if (emitInterveningSeparator) {
        writer.write(" ");
        emitInterveningSeparator = false;
      }
      writeComment(comment);
      if (comment.hasTrailingNewLine()) {
        writer.writeLine();
      } else {
        emitInterveningSeparator = true;
      }
    }
    if (emitInterveningSeparator && trailingSeparator) {
      writer.write(" ");
    }
  }

  private void writeComment(CommentRange comment) {
    SourceFile file = checkNotNull(currentSourceFile);
    String text = file.getSourceText();
    sourceMap.emitPos(comment.getPos());
    if (!comment.multiLine()) {
      writer.write(comment.getText(text).trim());
    } else {
      int firstLineIndent = indentOfLine(file, comment.getPos());
      boolean first = true;
      for (String line : LINE_SPLITTER.split(comment.getText(text))) {
        if (first) {
          writer.write(line.trim());
          first = false;
          continue;
        }
        writer.writeLine();
        int indent = leadingWidth(line);
        String trimmed = line.trim();
        int extra = indent - firstLineIndent;
        writer.write(extra > 0 && !trimmed.isEmpty() ? " ".repeat(extra) + trimmed : trimmed);
      }
    }
    sourceMap.emitPos(comment.getEnd());
  }

  private static int indentOfLine(SourceFile file, int pos) {
    String text = file.getSourceText();
    int lineStart = pos - file.getColumnOfPosition(pos);
    return leadingWidth(text.substring(lineStart, pos));
  }

  /** Measures the leading whitespace of {@code line}, with tab stops every four columns. */
  private static int leadingWidth(String line) {
    int width = 0;
    for (int i = 0; i < line.length(); i++) {
      char ch = line.charAt(i);
      if (ch == '\t') {
        width += TAB_WIDTH - width % TAB_WIDTH;
      } else if (Trivia.isWhiteSpaceSingleLine(ch)) {
        width++;
      } else {
        break;
      }
    }
    return width;
  }

  private int lineOf(int pos) {
    return checkNotNull(currentSourceFile).getLineOfPosition(pos);
  }

  @Override
  public void setSourceFile(SourceFile sourceFile) {
    this.currentSourceFile = sourceFile;
  }

  @Override
  public void reset() {
    consumed.clear();
    currentSourceFile = null;
  }
}
