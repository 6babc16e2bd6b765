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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.tsprinter.ast.IR;
import com.google.tsprinter.ast.Node;
import com.google.tsprinter.ast.NodeFlags;
import com.google.tsprinter.ast.SyntaxKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * A {@link TransformContext} that keeps emit flags in an identity map and collects hoisted
 * variables and functions per lexical environment.
 */
public class DefaultTransformContext implements TransformContext {

  private final Map<Node, Integer> emitFlags = new IdentityHashMap<>();
  private final Deque<LexicalEnvironment> environments = new ArrayDeque<>();

  private EmitNotification emitNotification = EmitNotification.NONE;
  private NodeSubstitution expressionSubstitution = NodeSubstitution.NONE;
  private NodeSubstitution identifierSubstitution = NodeSubstitution.NONE;

  private static class LexicalEnvironment {
    final List<Node> hoistedVariables = new ArrayList<>();
    final List<Node> hoistedFunctions = new ArrayList<>();
  }

  @Override
  public int getEmitFlags(Node node) {
    Integer flags = emitFlags.get(node);
    return flags == null ? EmitFlags.NONE : flags;
  }

  @Override
  public void setEmitFlags(Node node, int flags) {
    emitFlags.put(checkNotNull(node), flags);
  }

  @Override
  public EmitNotification getEmitNotification() {
    return emitNotification;
  }

  public void setEmitNotification(EmitNotification emitNotification) {
    this.emitNotification = checkNotNull(emitNotification);
  }

  @Override
  public NodeSubstitution getExpressionSubstitution() {
    return expressionSubstitution;
  }

  public void setExpressionSubstitution(NodeSubstitution expressionSubstitution) {
    this.expressionSubstitution = checkNotNull(expressionSubstitution);
  }

  @Override
  public NodeSubstitution getIdentifierSubstitution() {
    return identifierSubstitution;
  }

  public void setIdentifierSubstitution(NodeSubstitution identifierSubstitution) {
    this.identifierSubstitution = checkNotNull(identifierSubstitution);
  }

  @Override
  public void startLexicalEnvironment() {
    environments.push(new LexicalEnvironment());
  }

  /**
   * Returns a {@code var} statement declaring the hoisted variables, if there are any, followed by
   * the hoisted functions.
   */
  @Override
  public ImmutableList<Node> endLexicalEnvironment() {
    checkState(!environments.isEmpty(), "No lexical environment to end");
    LexicalEnvironment environment = environments.pop();
    ImmutableList.Builder<Node> statements = ImmutableList.builder();
    if (!environment.hoistedVariables.isEmpty()) {
      Node[] declarations = new Node[environment.hoistedVariables.size()];
      for (int i = 0; i < declarations.length; i++) {
        declarations[i] = IR.variableDeclaration(environment.hoistedVariables.get(i), null);
      }
      statements.add(IR.varStatement(NodeFlags.NONE, declarations));
    }
    statements.addAll(environment.hoistedFunctions);
    return statements.build();
  }

  /** Declares {@code name} with a {@code var} at the top of the innermost environment. */
  public void hoistVariableDeclaration(Node name) {
    checkState(!environments.isEmpty(), "No lexical environment to hoist into");
    checkState(name.isKind(SyntaxKind.IDENTIFIER), name);
    environments.peek().hoistedVariables.add(name);
  }

  /** Moves a function declaration to the top of the innermost environment. */
  public void hoistFunctionDeclaration(Node function) {
    checkState(!environments.isEmpty(), "No lexical environment to hoist into");
    checkState(function.isKind(SyntaxKind.FUNCTION_DECLARATION), function);
    environments.peek().hoistedFunctions.add(function);
  }
}
