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

import static com.google.common.truth.Truth.assertThat;

import com.google.tsprinter.ast.IR;
import com.google.tsprinter.ast.Node;
import com.google.tsprinter.ast.NodeList;
import com.google.tsprinter.ast.SourceFile;
import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ListEmitterTest {

  private static final Node PARENT = IR.name("parent");

  private final IndentingTextWriter writer = new IndentingTextWriter("\n");

  @Test
  public void testParenthesizedCommaList() {
    assertThat(emit(names("a", "b", "c"), ListFormat.CALL_EXPRESSION_ARGUMENTS))
        .isEqualTo("(a, b, c)");
  }

  @Test
  public void testOptionalEmptyList() {
    int format = ListFormat.MULTI_LINE | ListFormat.BRACES | ListFormat.OPTIONAL_IF_EMPTY;

    assertThat(emit(NodeList.empty(), format)).isEmpty();
    assertThat(emit(null, format)).isEmpty();
  }

  @Test
  public void testEmptyListKeepsBrackets() {
    assertThat(emit(NodeList.empty(), ListFormat.MULTI_LINE | ListFormat.BRACES))
        .isEqualTo("{\n}");
    assertThat(emit(NodeList.empty(), ListFormat.SINGLE_LINE_BLOCK_STATEMENTS | ListFormat.BRACES))
        .isEqualTo("{ }");
    assertThat(emit(NodeList.empty(), ListFormat.NEW_EXPRESSION_ARGUMENTS)).isEqualTo("()");
  }

  @Test
  public void testAbsentListIsOptional() {
    assertThat(emit(null, ListFormat.NEW_EXPRESSION_ARGUMENTS)).isEmpty();
  }

  @Test
  public void testMultiLineIndented() {
    assertThat(emit(names("a", "b"), ListFormat.CLASS_MEMBERS | ListFormat.BRACES))
        .isEqualTo("{\n    a\n    b\n}");
  }

  @Test
  public void testNoTrailingNewLine() {
    // The leading line break has no effect at the start of the output.
    assertThat(emit(names("a", "b"), ListFormat.SOURCE_FILE_STATEMENTS)).isEqualTo("a\nb");
  }

  @Test
  public void testTrailingComma() {
    NodeList elements = names("a", "b").withTrailingComma(true);

    int format = ListFormat.ARRAY_BINDING_PATTERN_ELEMENTS | ListFormat.SQUARE_BRACKETS;

    assertThat(emit(elements, format)).isEqualTo("[a, b,]");
    assertThat(emit(elements, ListFormat.CALL_EXPRESSION_ARGUMENTS)).isEqualTo("(a, b)");
  }

  @Test
  public void testDelimiters() {
    assertThat(emit(names("A", "B"), ListFormat.UNION_TYPE_CONSTITUENTS)).isEqualTo("A | B");
    assertThat(emit(names("A", "B"), ListFormat.INTERSECTION_TYPE_CONSTITUENTS))
        .isEqualTo("A & B");
  }

  @Test
  public void testStartsOnNewLineInSingleLineList() {
    Node a = IR.name("a");
    Node b = IR.name("b").setStartsOnNewLine(true);

    assertThat(emit(NodeList.of(a, b), ListFormat.CALL_EXPRESSION_ARGUMENTS))
        .isEqualTo("(a,\n    b)");
  }

  @Test
  public void testPreserveLinesFollowsSource() {
    String text = "[a,\n b]";
    Node a = IR.name("a").setRange(1, 2);
    Node b = IR.name("b").setRange(3, 6);
    Node array = IR.arraylit(a, b).setRange(0, 7);

    String output =
        emit(
            new SourceFile("a.ts", text),
            array,
            NodeList.of(a, b),
            ListFormat.ARRAY_LITERAL_EXPRESSION_ELEMENTS);

    assertThat(output).isEqualTo("[a,\n    b]");
  }

  @Test
  public void testPreserveLinesPrefersNewLineForSynthesized() {
    int format = ListFormat.OBJECT_LITERAL_EXPRESSION_PROPERTIES | ListFormat.PREFER_NEW_LINE;

    assertThat(emit(names("a", "b"), format)).isEqualTo("{\n    a,\n    b\n}");
  }

  @Test
  public void testStartAndCount() {
    ListEmitter lists = newListEmitter(new SourceFile("a.ts", ""));

    lists.emitList(
        PARENT, names("a", "b", "c", "d"), ListFormat.CALL_EXPRESSION_ARGUMENTS, 1, 2, this::write);

    assertThat(writer.getText()).isEqualTo("(b, c)");
  }

  private String emit(@Nullable NodeList children, int format) {
    return emit(new SourceFile("a.ts", ""), PARENT, children, format);
  }

  private String emit(SourceFile file, Node parent, @Nullable NodeList children, int format) {
    writer.reset();
    newListEmitter(file).emitList(parent, children, format, this::write);
    return writer.getText();
  }

  private ListEmitter newListEmitter(SourceFile file) {
    EmitOptions options = new EmitOptions();
    DefaultCommentWriter comments = new DefaultCommentWriter(writer, SourceMapWriter.NULL, options);
    comments.setSourceFile(file);
    PrintSession session = new PrintSession();
    session.setSourceFile(file);
    return new ListEmitter(writer, comments, session);
  }

  private void write(Node node) {
    writer.write(node.getText());
  }

  private static NodeList names(String... names) {
    Node[] nodes = new Node[names.length];
    for (int i = 0; i < names.length; i++) {
      nodes[i] = IR.name(names[i]);
    }
    return NodeList.of(nodes);
  }
}
