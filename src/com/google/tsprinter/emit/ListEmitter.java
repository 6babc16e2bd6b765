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
import static com.google.tsprinter.emit.ListFormat.has;

import com.google.tsprinter.ast.Node;
import com.google.tsprinter.ast.NodeList;
import com.google.tsprinter.ast.SourceFile;
import com.google.tsprinter.emit.TransformContext.NodeEmitter;
import org.jspecify.annotations.Nullable;

/**
 * Writes a sequence of child nodes with the brackets, delimiters, spacing, line breaks and
 * indentation that a {@link ListFormat} asks for.
 */
final class ListEmitter {

  private final TextWriter writer;
  private final CommentWriter comments;
  private final PrintSession session;

  ListEmitter(TextWriter writer, CommentWriter comments, PrintSession session) {
    this.writer = checkNotNull(writer);
    this.comments = checkNotNull(comments);
    this.session = checkNotNull(session);
  }

  void emitList(Node parent, @Nullable NodeList children, int format, NodeEmitter emitter) {
    emitList(parent, children, format, 0, children == null ? 0 : children.size(), emitter);
  }

  void emitList(
      Node parent, @Nullable NodeList children, int format, int start, NodeEmitter emitter) {
    emitList(
        parent,
        children,
        format,
        start,
        children == null ? 0 : children.size() - start,
        emitter);
  }

  /** Emits {@code count} children starting at {@code start}. */
  void emitList(
      Node parent,
      @Nullable NodeList children,
      int format,
      int start,
      int count,
      NodeEmitter emitter) {
    if (children == null && has(format, ListFormat.OPTIONAL_IF_UNDEFINED)) {
      return;
    }
    boolean isEmpty =
        children == null || children.isEmpty() || start >= children.size() || count <= 0;
    if (isEmpty && has(format, ListFormat.OPTIONAL_IF_EMPTY)) {
      return;
    }

    if (has(format, ListFormat.BRACKETS_MASK)) {
      writer.write(ListFormat.getOpeningBracket(format));
    }

    if (isEmpty) {
      // Write a line terminator if the parent node was multi-line
      if (has(format, ListFormat.MULTI_LINE)) {
        writer.writeLine();
      } else if (has(format, ListFormat.SPACE_BETWEEN_BRACES)) {
        writer.write(" ");
      }
    } else {
      checkNotNull(children);
      // Comments that trail the position of a child are written as its leading comments, unless
      // a line break was just written in front of it.
      boolean shouldEmitInterveningComments = true;
      if (shouldWriteLeadingLineTerminator(parent, children, format)) {
        writer.writeLine();
        shouldEmitInterveningComments = false;
      } else if (has(format, ListFormat.SPACE_BETWEEN_BRACES)) {
        writer.write(" ");
      }

      if (has(format, ListFormat.INDENTED)) {
        writer.increaseIndent();
      }

      String delimiter = ListFormat.getDelimiter(format);
      @Nullable Node previousSibling = null;
      boolean shouldDecreaseIndentAfterEmit = false;
      int end = Math.min(start + count, children.size());
      for (int i = start; i < end; i++) {
        Node child = children.get(i);

        if (previousSibling != null) {
          writer.write(delimiter);
          if (shouldWriteSeparatingLineTerminator(previousSibling, child, format)) {
            // A single-line list is indented while a child sits on a line of its own.
            if ((format & (ListFormat.LINES_MASK | ListFormat.INDENTED))
                == ListFormat.SINGLE_LINE) {
              writer.increaseIndent();
              shouldDecreaseIndentAfterEmit = true;
            }
            writer.writeLine();
            shouldEmitInterveningComments = false;
          } else if (has(format, ListFormat.SPACE_BETWEEN_SIBLINGS)) {
            writer.write(" ");
          }
        }

        if (shouldEmitInterveningComments) {
          comments.emitLeadingComments(
              child, comments.getTrailingCommentsOfPosition(child.getPos()));
        } else {
          shouldEmitInterveningComments = true;
        }

        emitter.emit(child);

        if (shouldDecreaseIndentAfterEmit) {
          writer.decreaseIndent();
          shouldDecreaseIndentAfterEmit = false;
        }
        previousSibling = child;
      }

      if (has(format, ListFormat.ALLOW_TRAILING_COMMA)
          && has(format, ListFormat.COMMA_DELIMITED)
          && children.hasTrailingComma()) {
        writer.write(",");
      }

      if (has(format, ListFormat.INDENTED)) {
        writer.decreaseIndent();
      }

      if (shouldWriteClosingLineTerminator(parent, children, format)) {
        writer.writeLine();
      } else if (has(format, ListFormat.SPACE_BETWEEN_BRACES)) {
        writer.write(" ");
      }
    }

    if (has(format, ListFormat.BRACKETS_MASK)) {
      writer.write(ListFormat.getClosingBracket(format));
    }
  }

  boolean shouldWriteLeadingLineTerminator(Node parent, NodeList children, int format) {
    if (has(format, ListFormat.MULTI_LINE)) {
      return true;
    }
    if (has(format, ListFormat.PRESERVE_LINES)) {
      if (has(format, ListFormat.PREFER_NEW_LINE)) {
        return true;
      }
      Node firstChild = children.getFirst();
      if (firstChild == null) {
        return !NodeUtil.rangeIsOnSingleLine(file(), parent);
      }
      if (parent.isSynthesized() || firstChild.isSynthesized()) {
        return synthesizedNodeStartsOnNewLine(firstChild, format);
      }
      return !NodeUtil.rangeStartPositionsAreOnSameLine(file(), parent, firstChild);
    }
    return false;
  }

  boolean shouldWriteSeparatingLineTerminator(Node previous, Node next, int format) {
    if (has(format, ListFormat.MULTI_LINE)) {
      return true;
    }
    if (has(format, ListFormat.PRESERVE_LINES)) {
      if (previous.isSynthesized() || next.isSynthesized()) {
        return synthesizedNodeStartsOnNewLine(previous, format)
            || synthesizedNodeStartsOnNewLine(next, format);
      }
      return !NodeUtil.rangeEndIsOnSameLineAsRangeStart(file(), previous, next);
    }
    return Boolean.TRUE.equals(next.getStartsOnNewLine());
  }

  boolean shouldWriteClosingLineTerminator(Node parent, NodeList children, int format) {
    if (has(format, ListFormat.MULTI_LINE)) {
      return !has(format, ListFormat.NO_TRAILING_NEW_LINE);
    }
    if (has(format, ListFormat.PRESERVE_LINES)) {
      if (has(format, ListFormat.PREFER_NEW_LINE)) {
        return true;
      }
      Node lastChild = children.getLast();
      if (lastChild == null) {
        return !NodeUtil.rangeIsOnSingleLine(file(), parent);
      }
      if (parent.isSynthesized() || lastChild.isSynthesized()) {
        return synthesizedNodeStartsOnNewLine(lastChild, format);
      }
      return !NodeUtil.rangeEndPositionsAreOnSameLine(file(), parent, lastChild);
    }
    return false;
  }

  private static boolean synthesizedNodeStartsOnNewLine(Node node, int format) {
    if (node.isSynthesized()) {
      Boolean startsOnNewLine = node.getStartsOnNewLine();
      if (startsOnNewLine == null) {
        return has(format, ListFormat.PREFER_NEW_LINE);
      }
      return startsOnNewLine;
    }
    return has(format, ListFormat.PREFER_NEW_LINE);
  }

  private SourceFile file() {
    return session.getSourceFile();
  }
}
