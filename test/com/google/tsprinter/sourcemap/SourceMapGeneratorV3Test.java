/*
 * Copyright 2011 The Closure Compiler Authors.
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

package com.google.tsprinter.sourcemap;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SourceMapGeneratorV3Test {

  private SourceMapGeneratorV3 generator;

  @Before
  public void setUp() {
    generator = new SourceMapGeneratorV3();
  }

  @Test
  public void testEmptyMap() {
    JsonObject map = parse(generator.toJson("out.js"));
    assertThat(map.get("version").getAsInt()).isEqualTo(3);
    assertThat(map.get("file").getAsString()).isEqualTo("out.js");
    assertThat(map.get("sources").getAsJsonArray()).isEmpty();
    assertThat(map.has("sourceRoot")).isFalse();
    assertThat(map.has("sourcesContent")).isFalse();
  }

  @Test
  public void testSingleMapping() {
    generator.addMapping("a.ts", null, pos(0, 0), pos(0, 0), pos(0, 5));
    JsonObject map = parse(generator.toJson("a.js"));
    assertThat(map.get("mappings").getAsString()).isEqualTo("AAAA;");
    assertThat(map.get("sources").getAsJsonArray().get(0).getAsString()).isEqualTo("a.ts");
    assertThat(generator.getMappingCount()).isEqualTo(1);
  }

  @Test
  public void testSiblingMappingsWithGap() {
    generator.addMapping("a.ts", null, pos(0, 0), pos(0, 0), pos(0, 3));
    generator.addMapping("a.ts", null, pos(1, 2), pos(0, 4), pos(0, 7));
    JsonObject map = parse(generator.toJson("a.js"));
    // The unmapped column 3 gets an entry of its own.
    assertThat(map.get("mappings").getAsString()).isEqualTo("AAAA,G,CACE;");
  }

  @Test
  public void testSecondLine() {
    generator.addMapping("a.ts", null, pos(0, 0), pos(1, 2), pos(1, 4));
    JsonObject map = parse(generator.toJson("a.js"));
    // Line 0 holds a single unmapped segment.
    assertThat(map.get("mappings").getAsString()).isEqualTo("A;EAAA;");
    assertThat(map.get("lineCount").getAsInt()).isEqualTo(2);
  }

  @Test
  public void testSourceRootAndContent() {
    generator.setSourceRoot("http://example.com/src/");
    generator.addSourceFile("a.ts", "let x = \"1\";\n");
    generator.addSourceFile("b.ts", null);
    JsonObject map = parse(generator.toJson("out.js"));
    assertThat(map.get("sourceRoot").getAsString()).isEqualTo("http://example.com/src/");
    assertThat(map.get("sources").getAsJsonArray()).hasSize(2);
    assertThat(map.get("sourcesContent").getAsJsonArray().get(0).getAsString())
        .isEqualTo("let x = \"1\";\n");
    assertThat(map.get("sourcesContent").getAsJsonArray().get(1).isJsonNull()).isTrue();
  }

  @Test
  public void testMappingsMustBeOrdered() {
    generator.addMapping("a.ts", null, pos(0, 0), pos(0, 4), pos(0, 6));
    assertThrows(
        IllegalStateException.class,
        () -> generator.addMapping("a.ts", null, pos(0, 0), pos(0, 1), pos(0, 2)));
  }

  @Test
  public void testReset() {
    generator.addMapping("a.ts", null, pos(0, 0), pos(0, 0), pos(0, 5));
    generator.reset();
    assertThat(generator.getMappingCount()).isEqualTo(0);
    assertThat(parse(generator.toJson("a.js")).get("sources").getAsJsonArray()).isEmpty();
  }

  private static FilePosition pos(int line, int column) {
    return new FilePosition(line, column);
  }

  private static JsonObject parse(String json) {
    return JsonParser.parseString(json).getAsJsonObject();
  }
}
