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
import com.google.common.collect.Iterables;
import java.util.Iterator;
import org.jspecify.annotations.Nullable;

/** An immutable sequence of sibling nodes, with the source range that surrounds them. */
public final class NodeList implements TextRange, Iterable<Node> {
  private static final NodeList EMPTY = new NodeList(ImmutableList.of(), false, -1, -1);

  private final ImmutableList<Node> nodes;
  private final boolean hasTrailingComma;
  private final int pos;
  private final int end;

  private NodeList(ImmutableList<Node> nodes, boolean hasTrailingComma, int pos, int end) {
    this.nodes = nodes;
    this.hasTrailingComma = hasTrailingComma;
    this.pos = pos;
    this.end = end;
  }

  public static NodeList empty() {
    return EMPTY;
  }

  public static NodeList of(Node... nodes) {
    return new NodeList(ImmutableList.copyOf(nodes), false, -1, -1);
  }

  public static NodeList copyOf(Iterable<? extends Node> nodes) {
    return new NodeList(ImmutableList.copyOf(nodes), false, -1, -1);
  }

  /** Returns a copy with the given trailing comma marker. */
  public NodeList withTrailingComma(boolean hasTrailingComma) {
    return new NodeList(nodes, hasTrailingComma, pos, end);
  }

  /** Returns a copy that covers the given source range. */
  public NodeList withRange(int pos, int end) {
    return new NodeList(nodes, hasTrailingComma, pos, end);
  }

  public int size() {
    return nodes.size();
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  public Node get(int index) {
    return nodes.get(index);
  }

  public @Nullable Node getFirst() {
    return Iterables.getFirst(nodes, null);
  }

  public @Nullable Node getLast() {
    return Iterables.getLast(nodes, null);
  }

  public boolean hasTrailingComma() {
    return hasTrailingComma;
  }

  public ImmutableList<Node> asList() {
    return nodes;
  }

  @Override
  public int getPos() {
    return pos;
  }

  @Override
  public int getEnd() {
    return end;
  }

  @Override
  public Iterator<Node> iterator() {
    return nodes.iterator();
  }

  @Override
  public String toString() {
    return nodes.toString();
  }
}
