/*
 * Copyright 2004 The Closure Compiler Authors.
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
import static com.google.common.base.Preconditions.checkState;

import com.google.tsprinter.ast.Node;
import com.google.tsprinter.ast.SourceFile;
import com.google.tsprinter.ast.SyntaxKind;
import com.google.tsprinter.ast.TextRange;
import com.google.tsprinter.ast.Trivia;
import com.google.tsprinter.emit.EmitOptions.ScriptTarget;
import com.google.tsprinter.sourcemap.Util;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/** NodeUtil contains generally useful AST utilities for printing. */
final class NodeUtil {

  private NodeUtil() {}

  static boolean isSynthesized(TextRange range) {
    return range.getPos() < 0;
  }

  /** Returns the source text of a parsed node, without its leading trivia. */
  static String getSourceTextOfNode(Node node) {
    SourceFile file = checkNotNull(node.getSourceFile(), "Node is not in a file: %s", node);
    String text = file.getSourceText();
    checkState(!node.isSynthesized(), node);
    return text.substring(Trivia.skipTrivia(text, node.getPos()), node.getEnd());
  }

  /**
   * Returns the text of a literal. Parsed literals keep their source text. Synthesized literals
   * are quoted and escaped from their value.
   */
  static String getLiteralText(Node node, ScriptTarget target) {
    if (!node.isSynthesized() && node.getParent() != null) {
      return getSourceTextOfNode(node);
    }
    String value = node.getText() == null ? "" : node.getText();
    SyntaxKind kind = node.getKind();
    if (kind.isTemplateLiteral() && target.isBelow(ScriptTarget.ES6)) {
      return quote(value, '"', "\"", "\"");
    }
    switch (kind) {
      case STRING_LITERAL:
        return quote(value, '"', "\"", "\"");
      case NO_SUBSTITUTION_TEMPLATE_LITERAL:
        return quote(value, '`', "`", "`");
      case TEMPLATE_HEAD:
        return quote(value, '`', "`", "${");
      case TEMPLATE_MIDDLE:
        return quote(value, '`', "}", "${");
      case TEMPLATE_TAIL:
        return quote(value, '`', "}", "`");
      default:
        return value;
    }
  }

  private static String quote(String value, char quoteChar, String open, String close) {
    return open + escapeString(value, quoteChar) + close;
  }

  /** Escapes {@code s} for use inside a literal delimited by {@code quote}. */
  static String escapeString(String s, char quote) {
    StringBuilder sb = new StringBuilder(s.length() + 2);
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '\0':
          sb.append("\\0");
          break;
        case '\u000B':
          sb.append("\\v");
          break;
        // From the SingleEscapeCharacter grammar production.
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        // Line terminators that JavaScript does not allow in literals
        case '\u2028':
        case '\u2029':
        case '\u0085':
          Util.appendHexJavaScriptRepresentation(sb, c);
          break;
        default:
          if (c == quote) {
            sb.append('\\').append(c);
          } else if (c < 0x20) {
            Util.appendHexJavaScriptRepresentation(sb, c);
          } else {
            sb.append(c);
          }
      }
    }
    return sb.toString();
  }

  /** Formats a number the way JavaScript's {@code Number.prototype.toString} does. */
  static String numberToString(double x) {
    if (Double.isNaN(x)) {
      return "NaN";
    }
    if (Double.isInfinite(x)) {
      return x > 0 ? "Infinity" : "-Infinity";
    }
    if (x == 0) {
      return "0";
    }
    if (x < 0) {
      return "-" + numberToString(-x);
    }
    // Every integer up to 2^53 is exact, so its digits are already the shortest ones.
    if ((long) x == x && x <= (1L << 53)) {
      return Long.toString((long) x);
    }
    BigDecimal decimal = shortestDecimal(x);
    String digits = decimal.unscaledValue().toString();
    int k = digits.length();
    // The decimal point sits n digits from the left of the digit string.
    int n = k - decimal.scale();
    StringBuilder sb = new StringBuilder();
    if (k <= n && n <= 21) {
      sb.append(digits);
      for (int i = k; i < n; i++) {
        sb.append('0');
      }
    } else if (0 < n && n <= 21) {
      sb.append(digits, 0, n).append('.').append(digits, n, k);
    } else if (-6 < n && n <= 0) {
      sb.append("0.");
      for (int i = n; i < 0; i++) {
        sb.append('0');
      }
      sb.append(digits);
    } else {
      sb.append(digits.charAt(0));
      if (k > 1) {
        sb.append('.').append(digits, 1, k);
      }
      int e = n - 1;
      sb.append('e').append(e < 0 ? '-' : '+').append(Math.abs(e));
    }
    return sb.toString();
  }

  /** Returns the decimal with the fewest significant digits that reads back as {@code x}. */
  private static BigDecimal shortestDecimal(double x) {
    BigDecimal exact = new BigDecimal(x);
    for (int precision = 1; precision < 17; precision++) {
      BigDecimal rounded = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
      if (rounded.doubleValue() == x) {
        return rounded.stripTrailingZeros();
      }
    }
    return exact.round(new MathContext(17, RoundingMode.HALF_EVEN)).stripTrailingZeros();
  }

  // Line predicates. Parsed ranges start at their first token, synthesized ones at -1.

  static int getStartPos(SourceFile file, TextRange range) {
    return isSynthesized(range)
        ? range.getPos()
        : Trivia.skipTrivia(file.getSourceText(), range.getPos());
  }

  static boolean positionsAreOnSameLine(SourceFile file, int pos1, int pos2) {
    return file.getLineOfPosition(pos1) == file.getLineOfPosition(pos2);
  }

  static boolean rangeIsOnSingleLine(SourceFile file, TextRange range) {
    return positionsAreOnSameLine(file, getStartPos(file, range), range.getEnd());
  }

  static boolean rangeStartPositionsAreOnSameLine(
      SourceFile file, TextRange range1, TextRange range2) {
    return positionsAreOnSameLine(file, getStartPos(file, range1), getStartPos(file, range2));
  }

  static boolean rangeEndPositionsAreOnSameLine(
      SourceFile file, TextRange range1, TextRange range2) {
    return positionsAreOnSameLine(file, range1.getEnd(), range2.getEnd());
  }

  static boolean rangeEndIsOnSameLineAsRangeStart(
      SourceFile file, TextRange range1, TextRange range2) {
    return positionsAreOnSameLine(file, range1.getEnd(), getStartPos(file, range2));
  }

  /** Whether a prefix operator needs a space to stay apart from its operand's operator. */
  static boolean needsSpaceAfterPrefixOperator(SyntaxKind operator, Node operand) {
    if (!operand.isKind(SyntaxKind.PREFIX_UNARY_EXPRESSION)) {
      return false;
    }
    SyntaxKind operandOperator = operand.getOperator();
    return (operator == SyntaxKind.PLUS_TOKEN
            && (operandOperator == SyntaxKind.PLUS_TOKEN
                || operandOperator == SyntaxKind.PLUS_PLUS_TOKEN))
        || (operator == SyntaxKind.MINUS_TOKEN
            && (operandOperator == SyntaxKind.MINUS_TOKEN
                || operandOperator == SyntaxKind.MINUS_MINUS_TOKEN));
  }

  /** Skips synthesized parentheses, which have no position of their own. */
  static Node skipSynthesizedParentheses(Node node) {
    while (node.isKind(SyntaxKind.PARENTHESIZED_EXPRESSION) && node.isSynthesized()) {
      node = checkNotNull(node.getChild(Node.Slot.EXPRESSION));
    }
    return node;
  }
}
