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
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Predicate;
import com.google.common.collect.ImmutableList;
import com.google.common.io.BaseEncoding;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.tsprinter.ast.IR;
import com.google.tsprinter.ast.Node;
import com.google.tsprinter.ast.Node.ListSlot;
import com.google.tsprinter.ast.SourceFile;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DefaultSourceMapWriterTest {
  private static final Predicate<Node> NEVER = node -> false;
  private static final Predicate<Node> ALWAYS = node -> true;
  private static final String DATA_URL_PREFIX = "data:application/json;base64,";

  private EmitOptions options;
  private IndentingTextWriter writer;
  private DefaultSourceMapWriter sourceMap;
  private SourceFile file;

  @Before
  public void setUp() {
    options = new EmitOptions();
    options.setSourceMap(true);
    writer = new IndentingTextWriter("\n");
    sourceMap = new DefaultSourceMapWriter(writer, options);
    file = new SourceFile("a.ts", "x = 1;");
    sourceMap.initialize("a.js", "a.js.map", ImmutableList.of(file), false);
    sourceMap.setSourceFile(file);
  }

  @Test
  public void testNodeMapping() {
    Node x = IR.name("x").setRange(0, 1);
    file.setList(ListSlot.STATEMENTS, IR.exprResult(x));

    sourceMap.emitStart(x, NEVER, NEVER);
    writer.write("x");
    sourceMap.emitEnd(x, NEVER, NEVER);

    JsonObject map = parse(sourceMap.getText());
    assertThat(map.get("version").getAsInt()).isEqualTo(3);
    assertThat(map.get("file").getAsString()).isEqualTo("a.js");
    assertThat(map.get("mappings").getAsString()).isEqualTo("AAAA;");
    assertThat(map.get("sources").getAsJsonArray().get(0).getAsString()).isEqualTo("a.ts");
  }

  @Test
  public void testPointMappingRunsToNextMark() {
    sourceMap.emitPos(2);
    writer.write("abc");

    assertThat(parse(sourceMap.getText()).get("mappings").getAsString()).isEqualTo("AAAE;");
  }

  @Test
  public void testSynthesizedAndIgnoredNodesAreNotMapped() {
    String empty = parse(sourceMap.getText()).get("mappings").getAsString();

    Node synthesized = IR.name("y");
    sourceMap.emitStart(synthesized, NEVER, NEVER);
    writer.write("y");
    sourceMap.emitEnd(synthesized, NEVER, NEVER);

    Node ignored = IR.name("x").setRange(0, 1);
    file.setList(ListSlot.STATEMENTS, IR.exprResult(ignored));
    sourceMap.emitStart(ignored, ALWAYS, NEVER);
    writer.write("x");
    sourceMap.emitEnd(ignored, ALWAYS, NEVER);

    assertThat(parse(sourceMap.getText()).get("mappings").getAsString()).isEqualTo(empty);
  }

  @Test
  public void testIgnoredChildren() {
    Node outer = IR.name("x").setRange(0, 1);
    Node inner = IR.number(1).setRange(4, 5);
    file.setList(ListSlot.STATEMENTS, IR.exprResult(IR.assign(outer, inner)));

    sourceMap.emitStart(outer, NEVER, ALWAYS);
    sourceMap.emitStart(inner, NEVER, NEVER);
    writer.write("1");
    sourceMap.emitEnd(inner, NEVER, NEVER);
    writer.write("2");
    sourceMap.emitEnd(outer, NEVER, ALWAYS);

    // Only the outer node is mapped.
    assertThat(parse(sourceMap.getText()).get("mappings").getAsString()).isEqualTo("AAAA;");
  }

  @Test
  public void testUnbalancedEnd() {
    Node x = IR.name("x").setRange(0, 1);
    assertThrows(IllegalStateException.class, () -> sourceMap.emitEnd(x, NEVER, ALWAYS));
  }

  @Test
  public void testSourceMappingUrl() {
    assertThat(sourceMap.getSourceMappingUrl()).isEqualTo("a.js.map");

    options.setMapRoot("http://example.com/maps");
    assertThat(sourceMap.getSourceMappingUrl()).isEqualTo("http://example.com/maps/a.js.map");
  }

  @Test
  public void testInlineSourceMappingUrl() {
    options.setInlineSourceMap(true);

    String url = sourceMap.getSourceMappingUrl();
    assertThat(url).startsWith(DATA_URL_PREFIX);
    String json =
        new String(BaseEncoding.base64().decode(url.substring(DATA_URL_PREFIX.length())), UTF_8);
    assertThat(json).isEqualTo(sourceMap.getText());
  }

  @Test
  public void testSourceRootAndInlineSources() {
    options.setSourceRoot("/src/");
    options.setInlineSources(true);

    JsonObject map = parse(sourceMap.getText());
    assertThat(map.get("sourceRoot").getAsString()).isEqualTo("/src/");
    assertThat(map.get("sourcesContent").getAsJsonArray().get(0).getAsString())
        .isEqualTo("x = 1;");
  }

  @Test
  public void testSourcesRelativeToMapDirectory() {
    SourceFile nested = new SourceFile("out/src/b.ts", "");
    sourceMap.initialize("out/b.js", "out/b.js.map", ImmutableList.of(nested), false);

    SourceMapData data = sourceMap.getSourceMapData();
    assertThat(data.sources()).containsExactly("src/b.ts");
    assertThat(data.sourceMapFile()).isEqualTo("b.js");
    assertThat(data.sourceMapFilePath()).isEqualTo("out/b.js.map");
  }

  @Test
  public void testReset() {
    sourceMap.emitPos(0);
    writer.write("x");
    sourceMap.reset();

    assertThat(parse(sourceMap.getText()).get("sources").getAsJsonArray()).isEmpty();
  }

  private static JsonObject parse(String json) {
    return JsonParser.parseString(json).getAsJsonObject();
  }
}
