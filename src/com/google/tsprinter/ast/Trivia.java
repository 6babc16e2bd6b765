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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Scans whitespace, comments and line structure in source text. */
public final class Trivia {

  private Trivia() {}

  public static boolean isLineBreak(char ch) {
    return ch == '\n' || ch == '\r' || ch == '\u2028' || ch == '\u2029';
  }

  public static boolean isWhiteSpaceSingleLine(char ch) {
    return ch == ' '
        || ch == '\t'
        || ch == '\u000b'
        || ch == '\f'
        || ch == '\u00a0'
        || ch == '\u0085'
        || ch == '\u1680'
        || (ch >= '\u2000' && ch <= '\u200b')
        || ch == '\u202f'
        || ch == '\u205f'
        || ch == '\u3000'
        || ch == '\ufeff';
  }

  static int[] computeLineStarts(String text) {
    List<Integer> result = new ArrayList<>();
    result.add(0);
    int pos = 0;
    while (pos < text.length()) {
      char ch = text.charAt(pos++);
      if (ch == '\r' && pos < text.length() && text.charAt(pos) == '\n') {
        pos++;
      }
      if (isLineBreak(ch)) {
        result.add(pos);
      }
    }
    return result.stream().mapToInt(Integer::intValue).toArray();
  }

  /**
   * Collects every identifier-shaped word in the text. Words inside strings and comments are
   * included, which can only make generated names more conservative.
   */
  static ImmutableSet<String> collectIdentifiers(String text) {
    ImmutableSet.Builder<String> builder = ImmutableSet.builder();
    int pos = 0;
    while (pos < text.length()) {
      char ch = text.charAt(pos);
      if (Character.isJavaIdentifierStart(ch)) {
        int start = pos;
        pos++;
        while (pos < text.length() && Character.isJavaIdentifierPart(text.charAt(pos))) {
          pos++;
        }
        builder.add(text.substring(start, pos));
      } else {
        pos++;
      }
    }
    return builder.build();
  }

  /** Returns the {@code #!} line at the start of the text, without its line break. */
  public static @Nullable String getShebang(String text) {
    if (!text.startsWith("#!")) {
      return null;
    }
    int end = 2;
    while (end < text.length() && !isLineBreak(text.charAt(end))) {
      end++;
    }
    return text.substring(0, end);
  }

  /**
   * Returns the position of the first token at or after {@code pos}, skipping whitespace, line
   * breaks, comments and a leading shebang. Synthesized positions are returned unchanged.
   */
  public static int skipTrivia(String text, int pos) {
    if (pos < 0) {
      return pos;
    }
    if (pos == 0) {
      String shebang = getShebang(text);
      if (shebang != null) {
        pos = shebang.length();
      }
    }
    while (pos < text.length()) {
      char ch = text.charAt(pos);
      if (isLineBreak(ch) || isWhiteSpaceSingleLine(ch)) {
        pos++;
      } else if (ch == '/' && pos + 1 < text.length() && text.charAt(pos + 1) == '/') {
        pos += 2;
        while (pos < text.length() && !isLineBreak(text.charAt(pos))) {
          pos++;
        }
      } else if (ch == '/' && pos + 1 < text.length() && text.charAt(pos + 1) == '*') {
        pos = skipMultiLineComment(text, pos + 2);
      } else {
        break;
      }
    }
    return pos;
  }

  /**
   * Returns the comments that lead the token at {@code pos}. Comments that share a line with the
   * previous token belong to that token, so collection starts after the first line break, or
   * right away at the start of the file.
   */
  public static ImmutableList<CommentRange> getLeadingCommentRanges(String text, int pos) {
    return getCommentRanges(text, pos, false);
  }

  /** Returns the comments that follow {@code pos} on the same line. */
  public static ImmutableList<CommentRange> getTrailingCommentRanges(String text, int pos) {
    return getCommentRanges(text, pos, true);
  }

  private static ImmutableList<CommentRange> getCommentRanges(
      String text, int pos, boolean trailing) {
    if (pos < 0 || pos > text.length()) {
      return ImmutableList.of();
    }
    List<CommentRange> result = new ArrayList<>();
    boolean collecting = trailing || pos == 0;
    if (pos == 0) {
      String shebang = getShebang(text);
      if (shebang != null) {
        pos = shebang.length();
      }
    }
    scan:
    while (pos < text.length()) {
      char ch = text.charAt(pos);
      if (isLineBreak(ch)) {
        pos++;
        if (ch == '\r' && pos < text.length() && text.charAt(pos) == '\n') {
          pos++;
        }
        if (trailing) {
          break;
        }
        collecting = true;
        int last = result.size() - 1;
        if (last >= 0) {
          result.set(last, result.get(last).withTrailingNewLine());
        }
      } else if (isWhiteSpaceSingleLine(ch)) {
        pos++;
      } else if (ch == '/' && pos + 1 < text.length()) {
        char next = text.charAt(pos + 1);
        int start = pos;
        if (next == '/') {
          pos += 2;
          while (pos < text.length() && !isLineBreak(text.charAt(pos))) {
            pos++;
          }
        } else if (next == '*') {
          pos = skipMultiLineComment(text, pos + 2);
        } else {
          break scan;
        }
        if (collecting) {
          result.add(new CommentRange(start, pos, next == '*', false));
        }
      } else {
        break;
      }
    }
    return ImmutableList.copyOf(result);
  }

  private static int skipMultiLineComment(String text, int pos) {
    int close = text.indexOf("*/", pos);
    return close < 0 ? text.length() : close + 2;
  }
}
