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
import static com.google.tsprinter.emit.GeneratedNameResolver.TEMP_FLAGS_AUTO;
import static com.google.tsprinter.emit.GeneratedNameResolver.TEMP_FLAGS_I;
import static com.google.tsprinter.emit.GeneratedNameResolver.TEMP_FLAGS_N;

import com.google.common.collect.ImmutableSet;
import com.google.tsprinter.ast.IR;
import com.google.tsprinter.ast.Node;
import com.google.tsprinter.ast.SourceFile;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class GeneratedNameResolverTest {

  private PrintSession session;
  private GeneratedNameResolver names;

  @Before
  public void setUp() {
    session = new PrintSession();
    session.setSourceFile(new SourceFile("a.ts", ""));
    names = new GeneratedNameResolver(session, EmitResolver.EMPTY);
  }

  @Test
  public void testTempNamesSkipLoopNames() {
    List<String> generated = new ArrayList<>();
    for (int i = 0; i < 14; i++) {
      generated.add(names.makeTempVariableName(TEMP_FLAGS_AUTO));
    }

    assertThat(generated)
        .containsExactly(
            "_a", "_b", "_c", "_d", "_e", "_f", "_g", "_h", "_j", "_k", "_l", "_m", "_o", "_p")
        .inOrder();
  }

  @Test
  public void testTempNamesContinueWithNumbers() {
    String last = null;
    for (int i = 0; i < 25; i++) {
      last = names.makeTempVariableName(TEMP_FLAGS_AUTO);
    }

    assertThat(last).isEqualTo("_0");
    assertThat(names.makeTempVariableName(TEMP_FLAGS_AUTO)).isEqualTo("_1");
  }

  @Test
  public void testLoopNames() {
    assertThat(names.makeTempVariableName(TEMP_FLAGS_I)).isEqualTo("_i");
    assertThat(names.makeTempVariableName(TEMP_FLAGS_I)).isEqualTo("_n");
    assertThat(names.makeTempVariableName(TEMP_FLAGS_I)).isEqualTo("_a");
    assertThat(names.makeTempVariableName(TEMP_FLAGS_N)).isEqualTo("_b");
  }

  @Test
  public void testLoopNamesAreReservedPerTempScope() {
    assertThat(names.makeTempVariableName(TEMP_FLAGS_I)).isEqualTo("_i");

    session.pushTempScope();
    // The scope is fresh, but _i is still taken in this pass.
    assertThat(names.makeTempVariableName(TEMP_FLAGS_I)).isEqualTo("_n");
    session.popTempScope();

    assertThat(names.makeTempVariableName(TEMP_FLAGS_N)).isEqualTo("_a");
  }

  @Test
  public void testAvoidsFileIdentifiers() {
    session.setSourceFile(new SourceFile("a.ts", "", ImmutableSet.of("_a", "_b", "_i", "x_1")));

    assertThat(names.makeTempVariableName(TEMP_FLAGS_AUTO)).isEqualTo("_c");
    assertThat(names.makeTempVariableName(TEMP_FLAGS_I)).isEqualTo("_n");
    assertThat(names.makeUniqueName("x")).isEqualTo("x_2");
  }

  @Test
  public void testAvoidsGlobals() {
    names =
        new GeneratedNameResolver(
            session,
            new EmitResolver() {
              @Override
              public @Nullable Double getConstantValue(Node node) {
                return null;
              }

              @Override
              public boolean hasGlobalName(String name) {
                return name.equals("_a") || name.equals("foo_1");
              }
            });

    assertThat(names.makeTempVariableName(TEMP_FLAGS_AUTO)).isEqualTo("_b");
    assertThat(names.makeUniqueName("foo")).isEqualTo("foo_2");
  }

  @Test
  public void testUniqueNames() {
    assertThat(names.makeUniqueName("foo")).isEqualTo("foo_1");
    assertThat(names.makeUniqueName("foo")).isEqualTo("foo_2");
    assertThat(names.makeUniqueName("foo_")).isEqualTo("foo_3");
  }

  @Test
  public void testGeneratedNameIsStablePerIdentifier() {
    Node temp = IR.tempVariable();
    Node other = IR.tempVariable();

    assertThat(names.getGeneratedName(temp)).isEqualTo("_a");
    assertThat(names.getGeneratedName(other)).isEqualTo("_b");
    assertThat(names.getGeneratedName(temp)).isEqualTo("_a");
  }

  @Test
  public void testNamesForNodes() {
    Node x = IR.name("x");
    Node enumDeclaration = IR.enumDeclaration(IR.name("E"));
    Node importDeclaration = IR.importDeclaration(null, IR.string("./my-lib"));

    assertThat(names.getGeneratedName(IR.generatedNameForNode(x))).isEqualTo("x_1");
    // Every name for the same node is the same.
    assertThat(names.getGeneratedName(IR.generatedNameForNode(x))).isEqualTo("x_1");
    assertThat(names.getGeneratedName(IR.generatedNameForNode(enumDeclaration))).isEqualTo("E");
    assertThat(names.getGeneratedName(IR.generatedNameForNode(importDeclaration)))
        .isEqualTo("my_lib_1");
  }

  @Test
  public void testEnumNameShadowedByLocal() {
    Node enumDeclaration = IR.enumDeclaration(IR.name("E")).setLocals(ImmutableSet.of("E"));

    assertThat(names.getGeneratedName(IR.generatedNameForNode(enumDeclaration)))
        .isEqualTo("E_1");
  }

  @Test
  public void testIdentifierFromModuleName() {
    assertThat(GeneratedNameResolver.makeIdentifierFromModuleName("./my-lib"))
        .isEqualTo("my_lib");
    assertThat(GeneratedNameResolver.makeIdentifierFromModuleName("lib/2d/")).isEqualTo("_2d");
    assertThat(GeneratedNameResolver.makeIdentifierFromModuleName("a.b")).isEqualTo("a_b");
  }

  @Test
  public void testEscapeIdentifier() {
    assertThat(GeneratedNameResolver.escapeIdentifier("__proto__")).isEqualTo("___proto__");
    assertThat(GeneratedNameResolver.escapeIdentifier("_a")).isEqualTo("_a");
    assertThat(GeneratedNameResolver.unescapeIdentifier("___proto__")).isEqualTo("__proto__");
    assertThat(GeneratedNameResolver.unescapeIdentifier("__proto__")).isEqualTo("__proto__");
  }
}
