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

import static com.google.common.truth.Truth.assertThat;

import com.google.tsprinter.ast.IR;
import com.google.tsprinter.ast.Node;
import com.google.tsprinter.ast.SourceFile;
import com.google.tsprinter.ast.SyntaxKind;
import com.google.tsprinter.emit.EmitOptions.ScriptTarget;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeUtilTest {

  @Test
  public void testNumberToString() {
    assertThat(NodeUtil.numberToString(0)).isEqualTo("0");
    assertThat(NodeUtil.numberToString(-0.0)).isEqualTo("0");
    assertThat(NodeUtil.numberToString(42)).isEqualTo("42");
    assertThat(NodeUtil.numberToString(-0.5)).isEqualTo("-0.5");
    assertThat(NodeUtil.numberToString(1.5)).isEqualTo("1.5");
    assertThat(NodeUtil.numberToString(0.1)).isEqualTo("0.1");
    assertThat(NodeUtil.numberToString(1e20)).isEqualTo("100000000000000000000");
    assertThat(NodeUtil.numberToString(1e21)).isEqualTo("1e+21");
    assertThat(NodeUtil.numberToString(0.000001)).isEqualTo("0.000001");
    assertThat(NodeUtil.numberToString(1e-7)).isEqualTo("1e-7");
    assertThat(NodeUtil.numberToString(2e23)).isEqualTo("2e+23");
    assertThat(NodeUtil.numberToString(Double.MAX_VALUE)).isEqualTo("1.7976931348623157e+308");
    assertThat(NodeUtil.numberToString(5e-324)).isEqualTo("5e-324");
    assertThat(NodeUtil.numberToString(Math.pow(2, 60))).isEqualTo("1152921504606847000");
    assertThat(NodeUtil.numberToString(9007199254740992.0)).isEqualTo("9007199254740992");
    assertThat(NodeUtil.numberToString(Double.NaN)).isEqualTo("NaN");
    assertThat(NodeUtil.numberToString(Double.NEGATIVE_INFINITY)).isEqualTo("-Infinity");
  }

  @Test
  public void testEscapeString() {
    assertThat(NodeUtil.escapeString("a\"b'c", '"')).isEqualTo("a\\\"b'c");
    assertThat(NodeUtil.escapeString("a\"b'c", '\'')).isEqualTo("a\"b\\'c");
    assertThat(NodeUtil.escapeString("\t\n\\", '"')).isEqualTo("\\t\\n\\\\");
    assertThat(NodeUtil.escapeString("\0\u000B", '"')).isEqualTo("\\0\\v");
    assertThat(NodeUtil.escapeString("\u0001\u2028", '"')).isEqualTo("\\u0001\\u2028");
    assertThat(NodeUtil.escapeString("café", '"')).isEqualTo("café");
  }

  @Test
  public void testLiteralTextOfSynthesizedLiterals() {
    assertThat(NodeUtil.getLiteralText(IR.string("it's"), ScriptTarget.ES5))
        .isEqualTo("\"it's\"");
    Node head = IR.templateLiteral(SyntaxKind.TEMPLATE_HEAD, "a`");
    assertThat(NodeUtil.getLiteralText(head, ScriptTarget.ES6)).isEqualTo("`a\\`${");
    Node template = IR.templateLiteral(SyntaxKind.NO_SUBSTITUTION_TEMPLATE_LITERAL, "a");
    assertThat(NodeUtil.getLiteralText(template, ScriptTarget.ES5)).isEqualTo("\"a\"");
  }

  @Test
  public void testLiteralTextOfParsedLiteral() {
    Node literal = IR.string("a").setRange(3, 7);
    SourceFile file = new SourceFile("a.ts", "x = 'a';");
    file.setList(
        Node.ListSlot.STATEMENTS,
        IR.exprResult(IR.assign(IR.name("x").setRange(0, 1), literal)).setRange(0, 8));

    assertThat(NodeUtil.getLiteralText(literal, ScriptTarget.ES5)).isEqualTo("'a'");
  }

  @Test
  public void testLinePredicates() {
    SourceFile file = new SourceFile("a.ts", "a\n  b c");

    assertThat(NodeUtil.positionsAreOnSameLine(file, 0, 1)).isTrue();
    assertThat(NodeUtil.positionsAreOnSameLine(file, 0, 4)).isFalse();
    assertThat(NodeUtil.positionsAreOnSameLine(file, 4, 6)).isTrue();
  }

  @Test
  public void testNeedsSpaceAfterPrefixOperator() {
    Node negated = IR.prefix(SyntaxKind.MINUS_TOKEN, IR.name("x"));
    Node incremented = IR.prefix(SyntaxKind.PLUS_PLUS_TOKEN, IR.name("x"));

    assertThat(NodeUtil.needsSpaceAfterPrefixOperator(SyntaxKind.MINUS_TOKEN, negated)).isTrue();
    assertThat(NodeUtil.needsSpaceAfterPrefixOperator(SyntaxKind.PLUS_TOKEN, incremented))
        .isTrue();
    assertThat(NodeUtil.needsSpaceAfterPrefixOperator(SyntaxKind.PLUS_TOKEN, negated)).isFalse();
    assertThat(NodeUtil.needsSpaceAfterPrefixOperator(SyntaxKind.MINUS_TOKEN, IR.name("x")))
        .isFalse();
  }

  @Test
  public void testSkipSynthesizedParentheses() {
    Node name = IR.name("x");

    assertThat(NodeUtil.skipSynthesizedParentheses(IR.paren(IR.paren(name))))
        .isSameInstanceAs(name);
  }
}
