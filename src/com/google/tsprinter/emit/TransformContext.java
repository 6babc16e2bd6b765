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

import com.google.common.collect.ImmutableList;
import com.google.tsprinter.ast.Node;

/**
 * The state a transformation pipeline leaves for the printer: out-of-band emit flags, the hooks
 * that may replace or wrap nodes while they are printed, and the hoisted declarations of each
 * lexical environment.
 */
public interface TransformContext {

  /** Returns the {@link EmitFlags} of a node, or {@link EmitFlags#NONE}. */
  int getEmitFlags(Node node);

  void setEmitFlags(Node node, int flags);

  EmitNotification getEmitNotification();

  NodeSubstitution getExpressionSubstitution();

  NodeSubstitution getIdentifierSubstitution();

  /** Opens a new environment for hoisted declarations. */
  void startLexicalEnvironment();

  /** Closes the innermost environment and returns its hoisted statements. */
  ImmutableList<Node> endLexicalEnvironment();

  /** Prints a node. */
  interface NodeEmitter {
    void emit(Node node);
  }

  /** Gets a chance to run code around the printing of a node. */
  interface EmitNotification {
    boolean isEnabled(Node node);

    /**
     * Called instead of printing the node. Implementations call {@code emitCallback} to print it.
     */
    void onEmitNode(Node node, NodeEmitter emitCallback);

    EmitNotification NONE =
        new EmitNotification() {
          @Override
          public boolean isEnabled(Node node) {
            return false;
          }

          @Override
          public void onEmitNode(Node node, NodeEmitter emitCallback) {
            emitCallback.emit(node);
          }
        };
  }

  /** Replaces nodes just before they are printed. */
  interface NodeSubstitution {
    boolean isEnabled(Node node);

    /** Returns the node to print in place of {@code node}, or {@code node} itself. */
    Node substitute(Node node);

    NodeSubstitution NONE =
        new NodeSubstitution() {
          @Override
          public boolean isEnabled(Node node) {
            return false;
          }

          @Override
          public Node substitute(Node node) {
            return node;
          }
        };
  }
}
