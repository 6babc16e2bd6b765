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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A node in a transformed syntax tree.
 *
 * <p>Children live in named slots. A child records the first node it is attached to as its
 * parent; attaching an original node to a synthesized parent leaves that link alone so the
 * child's source text can still be found. Nodes whose range is {@code -1} were synthesized by a
 * transformation and have no source text.
 */
public class Node implements TextRange {

  /** Single-child slots. */
  public enum Slot {
    NAME,
    PROPERTY_NAME,
    EXPRESSION,
    ARGUMENT_EXPRESSION,
    TYPE,
    INITIALIZER,
    OBJECT_ASSIGNMENT_INITIALIZER,
    BODY,
    LEFT,
    RIGHT,
    OPERATOR_TOKEN,
    OPERAND,
    CONDITION,
    WHEN_TRUE,
    WHEN_FALSE,
    THEN_STATEMENT,
    ELSE_STATEMENT,
    STATEMENT,
    INCREMENTOR,
    LABEL,
    TRY_BLOCK,
    CATCH_CLAUSE,
    FINALLY_BLOCK,
    VARIABLE_DECLARATION,
    BLOCK,
    CASE_BLOCK,
    DECLARATION_LIST,
    IMPORT_CLAUSE,
    NAMED_BINDINGS,
    MODULE_SPECIFIER,
    MODULE_REFERENCE,
    EXPORT_CLAUSE,
    TAG,
    TEMPLATE,
    HEAD,
    LITERAL,
    CONSTRAINT,
    PARAMETER_NAME,
    TYPE_NAME,
    EXPR_NAME,
    ELEMENT_TYPE,
    OPENING_ELEMENT,
    CLOSING_ELEMENT,
    TAG_NAME,
    END_OF_FILE_TOKEN,
    TEXT_SOURCE_NODE
  }

  /** Child sequence slots. */
  public enum ListSlot {
    STATEMENTS,
    PARAMETERS,
    TYPE_PARAMETERS,
    TYPE_ARGUMENTS,
    ARGUMENTS,
    ELEMENTS,
    PROPERTIES,
    MEMBERS,
    MODIFIERS,
    DECORATORS,
    HERITAGE_CLAUSES,
    TYPES,
    DECLARATIONS,
    CLAUSES,
    TEMPLATE_SPANS,
    ATTRIBUTES,
    CHILDREN
  }

  /** Boolean markers. */
  public enum Prop {
    // The construct was written across several lines, or should be printed that way.
    MULTI_LINE,
    // function*, yield*, generator methods
    ASTERISK,
    // rest parameters and rest binding elements
    DOT_DOT_DOT,
    // optional parameters and members
    QUESTION,
    // export = x
    EXPORT_EQUALS
  }

  private final SyntaxKind kind;
  private int pos = -1;
  private int end = -1;
  private int flags;
  private @Nullable Node parent;
  private @Nullable Node original;
  private @Nullable String text;
  private @Nullable SyntaxKind operator;
  private @Nullable GeneratedNameKind autoGenerateKind;
  private @Nullable Boolean startsOnNewLine;
  private ImmutableSet<String> locals = ImmutableSet.of();
  private final EnumSet<Prop> props = EnumSet.noneOf(Prop.class);
  private final EnumMap<Slot, Node> children = new EnumMap<>(Slot.class);
  private final EnumMap<ListSlot, NodeList> lists = new EnumMap<>(ListSlot.class);

  public Node(SyntaxKind kind) {
    this.kind = checkNotNull(kind);
  }

  public final SyntaxKind getKind() {
    return kind;
  }

  public final boolean isKind(SyntaxKind kind) {
    return this.kind == kind;
  }

  @Override
  public final int getPos() {
    return pos;
  }

  @Override
  public final int getEnd() {
    return end;
  }

  @CanIgnoreReturnValue
  public final Node setRange(int pos, int end) {
    checkArgument(pos <= end, "pos %s after end %s", pos, end);
    this.pos = pos;
    this.end = end;
    return this;
  }

  /** Whether this node was created by a transformation rather than read from source text. */
  public final boolean isSynthesized() {
    return pos < 0;
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  /** Walks up the parent chain to the enclosing source file, if any. */
  public final @Nullable SourceFile getSourceFile() {
    Node n = this;
    while (n != null && !(n instanceof SourceFile)) {
      n = n.parent;
    }
    return (SourceFile) n;
  }

  public final @Nullable Node getOriginal() {
    return original;
  }

  /** Records the node this one was cloned or derived from. */
  @CanIgnoreReturnValue
  public final Node setOriginal(@Nullable Node original) {
    checkArgument(original != this, "A node cannot be its own original");
    this.original = original;
    return this;
  }

  public final @Nullable String getText() {
    return text;
  }

  @CanIgnoreReturnValue
  public final Node setText(@Nullable String text) {
    this.text = text;
    return this;
  }

  public final @Nullable SyntaxKind getOperator() {
    return operator;
  }

  @CanIgnoreReturnValue
  public final Node setOperator(SyntaxKind operator) {
    checkArgument(operator.isToken(), "Not a token: %s", operator);
    this.operator = operator;
    return this;
  }

  public final int getFlags() {
    return flags;
  }

  public final boolean hasFlag(int flag) {
    return (flags & flag) != 0;
  }

  @CanIgnoreReturnValue
  public final Node setFlags(int flags) {
    this.flags = flags;
    return this;
  }

  public final @Nullable GeneratedNameKind getAutoGenerateKind() {
    return autoGenerateKind;
  }

  /** Whether this is an identifier whose text is chosen at print time. */
  public final boolean isGeneratedIdentifier() {
    return kind == SyntaxKind.IDENTIFIER && autoGenerateKind != null;
  }

  @CanIgnoreReturnValue
  public final Node setAutoGenerateKind(GeneratedNameKind autoGenerateKind) {
    checkState(kind == SyntaxKind.IDENTIFIER, "Only identifiers can be generated: %s", kind);
    this.autoGenerateKind = autoGenerateKind;
    return this;
  }

  /** The line hint of a synthesized node, or null when the node expresses no preference. */
  public final @Nullable Boolean getStartsOnNewLine() {
    return startsOnNewLine;
  }

  @CanIgnoreReturnValue
  public final Node setStartsOnNewLine(@Nullable Boolean startsOnNewLine) {
    this.startsOnNewLine = startsOnNewLine;
    return this;
  }

  public final boolean getBooleanProp(Prop prop) {
    return props.contains(prop);
  }

  @CanIgnoreReturnValue
  public final Node putBooleanProp(Prop prop, boolean value) {
    if (value) {
      props.add(prop);
    } else {
      props.remove(prop);
    }
    return this;
  }

  public final boolean isMultiLine() {
    return props.contains(Prop.MULTI_LINE);
  }

  /** The names declared directly in this container. */
  public final ImmutableSet<String> getLocals() {
    return locals;
  }

  @CanIgnoreReturnValue
  public final Node setLocals(Iterable<String> locals) {
    this.locals = ImmutableSet.copyOf(locals);
    return this;
  }

  public final @Nullable Node getChild(Slot slot) {
    return children.get(slot);
  }

  public final boolean hasChild(Slot slot) {
    return children.containsKey(slot);
  }

  @CanIgnoreReturnValue
  public final Node setChild(Slot slot, @Nullable Node child) {
    if (child == null) {
      children.remove(slot);
    } else {
      checkArgument(child != this, "A node cannot be its own child");
      adopt(child);
      children.put(slot, child);
    }
    return this;
  }

  public final @Nullable NodeList getList(ListSlot slot) {
    return lists.get(slot);
  }

  @CanIgnoreReturnValue
  public final Node setList(ListSlot slot, @Nullable NodeList list) {
    if (list == null) {
      lists.remove(slot);
    } else {
      for (Node child : list) {
        adopt(child);
      }
      lists.put(slot, list);
    }
    return this;
  }

  @CanIgnoreReturnValue
  public final Node setList(ListSlot slot, Node... nodes) {
    return setList(slot, NodeList.of(nodes));
  }

  /** Returns every child, single slots first, in declaration order of the slots. */
  public final ImmutableList<Node> getChildNodes() {
    ImmutableList.Builder<Node> builder = ImmutableList.builder();
    for (Map.Entry<Slot, Node> entry : children.entrySet()) {
      if (entry.getKey() != Slot.TEXT_SOURCE_NODE) {
        builder.add(entry.getValue());
      }
    }
    for (NodeList list : lists.values()) {
      builder.addAll(list);
    }
    return builder.build();
  }

  /** Whether {@code ancestor} is this node or one of its parents. */
  public final boolean isDescendantOf(Node ancestor) {
    for (Node n = this; n != null; n = n.parent) {
      if (n == ancestor) {
        return true;
      }
    }
    return false;
  }

  private void adopt(Node child) {
    if (child.parent == null && !(child instanceof SourceFile)) {
      child.parent = this;
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(kind.name());
    if (text != null) {
      sb.append(' ').append(text);
    }
    if (autoGenerateKind != null) {
      sb.append(" <").append(autoGenerateKind).append('>');
    }
    if (pos >= 0) {
      sb.append(" [").append(pos).append(", ").append(end).append(')');
    }
    return sb.toString();
  }
}
