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

import com.google.common.base.Predicate;
import com.google.common.collect.ImmutableList;
import com.google.tsprinter.ast.CommentRange;
import com.google.tsprinter.ast.Node;
import com.google.tsprinter.ast.Node.ListSlot;
import com.google.tsprinter.ast.Node.Prop;
import com.google.tsprinter.ast.Node.Slot;
import com.google.tsprinter.ast.NodeFlags;
import com.google.tsprinter.ast.NodeList;
import com.google.tsprinter.ast.SourceFile;
import com.google.tsprinter.ast.SyntaxKind;
import com.google.tsprinter.ast.TextRange;
import com.google.tsprinter.ast.Trivia;
import com.google.tsprinter.emit.EmitOptions.ScriptTarget;
import com.google.tsprinter.emit.TransformContext.NodeEmitter;
import com.google.tsprinter.emit.TransformContext.NodeSubstitution;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * CodeGenerator generates code from a transformed syntax tree, sending it to the specified
 * TextWriter together with source map marks and comments.
 *
 * <p>One instance prints one output pass. The per-pass state lives in the {@link PrintSession}.
 */
final class CodeGenerator {

  private final EmitOptions options;
  private final TextWriter writer;
  private final SourceMapWriter sourceMap;
  private final CommentWriter comments;
  private final TransformContext context;
  private final EmitResolver resolver;
  private final PrintSession session;

  private final ListEmitter lists;
  private final GeneratedNameResolver names;
  private final RuntimeHelperInjector helpers;

  private final Predicate<Node> shouldSkipComments;
  private final Predicate<Node> shouldIgnoreSourceMapForNode;
  private final Predicate<Node> shouldIgnoreSourceMapForChildren;

  CodeGenerator(
      EmitOptions options,
      TextWriter writer,
      SourceMapWriter sourceMap,
      CommentWriter comments,
      TransformContext context,
      EmitResolver resolver,
      PrintSession session) {
    this.options = checkNotNull(options);
    this.writer = checkNotNull(writer);
    this.sourceMap = checkNotNull(sourceMap);
    this.comments = checkNotNull(comments);
    this.context = checkNotNull(context);
    this.resolver = checkNotNull(resolver);
    this.session = checkNotNull(session);
    this.lists = new ListEmitter(writer, comments, session);
    this.names = new GeneratedNameResolver(session, resolver);
    this.helpers = new RuntimeHelperInjector(options, context, session, writer);

    this.shouldSkipComments =
        node ->
            node.isKind(SyntaxKind.NOT_EMITTED_STATEMENT)
                || (context.getEmitFlags(node) & EmitFlags.NO_COMMENTS) != 0;
    this.shouldIgnoreSourceMapForNode =
        node ->
            node.isKind(SyntaxKind.NOT_EMITTED_STATEMENT)
                || node.isKind(SyntaxKind.PARTIALLY_EMITTED_EXPRESSION)
                || (context.getEmitFlags(node) & EmitFlags.NO_SOURCE_MAP) != 0;
    this.shouldIgnoreSourceMapForChildren =
        node -> (context.getEmitFlags(node) & EmitFlags.NO_NESTED_SOURCE_MAPS) != 0;
  }

  /** Prints a whole source file into the current pass. */
  void printSourceFile(SourceFile file) {
    session.setSourceFile(file);
    sourceMap.setSourceFile(file);
    comments.setSourceFile(file);
    emitNodeWithNotification(file, this::emitWorker);
  }

  /** Writes, up front, the helpers every file of a bundle needs. */
  void emitBundleHelpers(List<SourceFile> files) {
    for (SourceFile file : files) {
      session.setSourceFile(file);
      helpers.emitEmitHelpers(file);
    }
  }

  /** Emits a statement, declaration, type or any other node. Null is ignored. */
  void emit(@Nullable Node node) {
    if (node != null) {
      emitNodeWithNotification(node, n -> emitNodeWithWorker(n, this::emitWorker));
    }
  }

  /** Emits an expression, giving the expression substitution a chance to replace it. */
  void emitExpression(@Nullable Node node) {
    if (node != null) {
      emitNodeWithNotification(node, n -> emitNodeWithWorker(n, this::emitExpressionWorker));
    }
  }

  private void emitNodeWithNotification(Node node, NodeEmitter emitter) {
    TransformContext.EmitNotification notification = context.getEmitNotification();
    if (notification.isEnabled(node)) {
      notification.onEmitNode(node, emitter);
    } else {
      emitter.emit(node);
    }
  }

  private void emitNodeWithWorker(Node node, NodeEmitter worker) {
    ImmutableList<CommentRange> leadingComments =
        comments.getLeadingComments(node, shouldSkipComments);
    ImmutableList<CommentRange> trailingComments =
        comments.getTrailingComments(node, shouldSkipComments);
    comments.emitLeadingComments(node, leadingComments);
    sourceMap.emitStart(node, shouldIgnoreSourceMapForNode, shouldIgnoreSourceMapForChildren);
    worker.emit(node);
    sourceMap.emitEnd(node, shouldIgnoreSourceMapForNode, shouldIgnoreSourceMapForChildren);
    comments.emitTrailingComments(node, trailingComments);
  }

  private void emitWorker(Node node) {
    switch (node.getKind()) {
      // Pseudo-literals
      case TEMPLATE_HEAD:
      case TEMPLATE_MIDDLE:
      case TEMPLATE_TAIL:
        emitLiteral(node);
        return;

      case IDENTIFIER:
        if (tryEmitSubstitute(node, context.getIdentifierSubstitution())) {
          return;
        }
        emitIdentifier(node);
        return;

      // Reserved words
      case CONST_KEYWORD:
      case DEFAULT_KEYWORD:
      case EXPORT_KEYWORD:
      case VOID_KEYWORD:
      // Strict mode reserved words
      case PRIVATE_KEYWORD:
      case PROTECTED_KEYWORD:
      case PUBLIC_KEYWORD:
      case STATIC_KEYWORD:
      // Contextual keywords
      case ABSTRACT_KEYWORD:
      case ANY_KEYWORD:
      case ASYNC_KEYWORD:
      case BOOLEAN_KEYWORD:
      case DECLARE_KEYWORD:
      case NUMBER_KEYWORD:
      case READONLY_KEYWORD:
      case STRING_KEYWORD:
      case SYMBOL_KEYWORD:
      case GLOBAL_KEYWORD:
        writeTokenNode(node);
        return;

      // Names
      case QUALIFIED_NAME:
        emitEntityName(child(node, Slot.LEFT));
        write(".");
        emit(child(node, Slot.RIGHT));
        return;
      case COMPUTED_PROPERTY_NAME:
        write("[");
        emitExpression(child(node, Slot.EXPRESSION));
        write("]");
        return;

      // Signature elements
      case TYPE_PARAMETER:
        emit(child(node, Slot.NAME));
        emitWithPrefix(" extends ", node.getChild(Slot.CONSTRAINT));
        return;
      case PARAMETER:
        emitDecorators(node);
        emitModifiers(node);
        writeIf(node.getBooleanProp(Prop.DOT_DOT_DOT), "...");
        emit(child(node, Slot.NAME));
        writeIf(node.getBooleanProp(Prop.QUESTION), "?");
        emitExpressionWithPrefix(" = ", node.getChild(Slot.INITIALIZER));
        emitWithPrefix(": ", node.getChild(Slot.TYPE));
        return;
      case DECORATOR:
        write("@");
        emitExpression(child(node, Slot.EXPRESSION));
        return;

      // Type members
      case PROPERTY_SIGNATURE:
        emitDecorators(node);
        emitModifiers(node);
        emit(child(node, Slot.NAME));
        writeIf(node.getBooleanProp(Prop.QUESTION), "?");
        emitWithPrefix(": ", node.getChild(Slot.TYPE));
        write(";");
        return;
      case PROPERTY_DECLARATION:
        emitDecorators(node);
        emitModifiers(node);
        emit(child(node, Slot.NAME));
        emitWithPrefix(": ", node.getChild(Slot.TYPE));
        emitExpressionWithPrefix(" = ", node.getChild(Slot.INITIALIZER));
        write(";");
        return;
      case METHOD_SIGNATURE:
        emitDecorators(node);
        emitModifiers(node);
        emit(child(node, Slot.NAME));
        writeIf(node.getBooleanProp(Prop.QUESTION), "?");
        emitTypeParameters(node);
        emitParameters(node);
        emitWithPrefix(": ", node.getChild(Slot.TYPE));
        write(";");
        return;
      case METHOD_DECLARATION:
        emitDecorators(node);
        emitModifiers(node);
        writeIf(node.getBooleanProp(Prop.ASTERISK), "*");
        emit(child(node, Slot.NAME));
        emitSignatureAndBody(node, this::emitSignatureHead);
        return;
      case CONSTRUCTOR:
        emitModifiers(node);
        write("constructor");
        emitSignatureAndBody(node, this::emitSignatureHead);
        return;
      case GET_ACCESSOR:
      case SET_ACCESSOR:
        emitDecorators(node);
        emitModifiers(node);
        write(node.isKind(SyntaxKind.GET_ACCESSOR) ? "get " : "set ");
        emit(child(node, Slot.NAME));
        emitSignatureAndBody(node, this::emitSignatureHead);
        return;
      case CALL_SIGNATURE:
        emitDecorators(node);
        emitModifiers(node);
        emitTypeParameters(node);
        emitParameters(node);
        emitWithPrefix(": ", node.getChild(Slot.TYPE));
        write(";");
        return;
      case CONSTRUCT_SIGNATURE:
        emitDecorators(node);
        emitModifiers(node);
        write("new ");
        emitTypeParameters(node);
        emitParameters(node);
        emitWithPrefix(": ", node.getChild(Slot.TYPE));
        write(";");
        return;
      case INDEX_SIGNATURE:
        emitDecorators(node);
        emitModifiers(node);
        emitList(node, node.getList(ListSlot.PARAMETERS), ListFormat.INDEX_SIGNATURE_PARAMETERS);
        emitWithPrefix(": ", node.getChild(Slot.TYPE));
        write(";");
        return;
      case SEMICOLON_CLASS_ELEMENT:
        write(";");
        return;

      // Types
      case TYPE_PREDICATE:
        emit(child(node, Slot.PARAMETER_NAME));
        write(" is ");
        emit(child(node, Slot.TYPE));
        return;
      case TYPE_REFERENCE:
        emit(child(node, Slot.TYPE_NAME));
        emitTypeArguments(node);
        return;
      case FUNCTION_TYPE:
        emitTypeParameters(node);
        emitParametersForArrow(node);
        write(" => ");
        emit(child(node, Slot.TYPE));
        return;
      case CONSTRUCTOR_TYPE:
        write("new ");
        emitTypeParameters(node);
        emitParametersForArrow(node);
        write(" => ");
        emit(child(node, Slot.TYPE));
        return;
      case TYPE_QUERY:
        write("typeof ");
        emit(child(node, Slot.EXPR_NAME));
        return;
      case TYPE_LITERAL:
        write("{");
        emitList(node, node.getList(ListSlot.MEMBERS), ListFormat.TYPE_LITERAL_MEMBERS);
        write("}");
        return;
      case ARRAY_TYPE:
        emit(child(node, Slot.ELEMENT_TYPE));
        write("[]");
        return;
      case TUPLE_TYPE:
        write("[");
        emitList(node, node.getList(ListSlot.TYPES), ListFormat.TUPLE_TYPE_ELEMENTS);
        write("]");
        return;
      case UNION_TYPE:
        emitList(node, node.getList(ListSlot.TYPES), ListFormat.UNION_TYPE_CONSTITUENTS);
        return;
      case INTERSECTION_TYPE:
        emitList(node, node.getList(ListSlot.TYPES), ListFormat.INTERSECTION_TYPE_CONSTITUENTS);
        return;
      case PARENTHESIZED_TYPE:
        write("(");
        emit(child(node, Slot.TYPE));
        write(")");
        return;
      case EXPRESSION_WITH_TYPE_ARGUMENTS:
        emitExpression(child(node, Slot.EXPRESSION));
        emitTypeArguments(node);
        return;
      case THIS_TYPE:
        write("this");
        return;
      case STRING_LITERAL_TYPE:
        emitLiteral(node);
        return;

      // Binding patterns
      case OBJECT_BINDING_PATTERN:
        emitBindingPattern(node, "{", "}", ListFormat.OBJECT_BINDING_PATTERN_ELEMENTS);
        return;
      case ARRAY_BINDING_PATTERN:
        emitBindingPattern(node, "[", "]", ListFormat.ARRAY_BINDING_PATTERN_ELEMENTS);
        return;
      case BINDING_ELEMENT:
        emitWithSuffix(node.getChild(Slot.PROPERTY_NAME), ": ");
        writeIf(node.getBooleanProp(Prop.DOT_DOT_DOT), "...");
        emit(child(node, Slot.NAME));
        emitExpressionWithPrefix(" = ", node.getChild(Slot.INITIALIZER));
        return;

      // Misc
      case TEMPLATE_SPAN:
        emitExpression(child(node, Slot.EXPRESSION));
        emit(child(node, Slot.LITERAL));
        return;

      // Statements
      case BLOCK:
        emitBlock(node);
        return;
      case VARIABLE_STATEMENT:
        emitModifiers(node);
        emit(child(node, Slot.DECLARATION_LIST));
        write(";");
        return;
      case EMPTY_STATEMENT:
        write(";");
        return;
      case EXPRESSION_STATEMENT:
        emitExpression(child(node, Slot.EXPRESSION));
        write(";");
        return;
      case IF_STATEMENT:
        emitIfStatement(node);
        return;
      case DO_STATEMENT:
        {
          Node body = child(node, Slot.STATEMENT);
          write("do");
          emitEmbeddedStatement(body);
          if (body.isKind(SyntaxKind.BLOCK)) {
            write(" ");
          } else {
            writer.writeLine();
          }
          write("while (");
          emitExpression(child(node, Slot.EXPRESSION));
          write(");");
          return;
        }
      case WHILE_STATEMENT:
        write("while (");
        emitExpression(child(node, Slot.EXPRESSION));
        write(")");
        emitEmbeddedStatement(child(node, Slot.STATEMENT));
        return;
      case FOR_STATEMENT:
        write("for (");
        emitForBinding(node.getChild(Slot.INITIALIZER));
        write(";");
        emitExpressionWithPrefix(" ", node.getChild(Slot.CONDITION));
        write(";");
        emitExpressionWithPrefix(" ", node.getChild(Slot.INCREMENTOR));
        write(")");
        emitEmbeddedStatement(child(node, Slot.STATEMENT));
        return;
      case FOR_IN_STATEMENT:
      case FOR_OF_STATEMENT:
        write("for (");
        emitForBinding(node.getChild(Slot.INITIALIZER));
        write(node.isKind(SyntaxKind.FOR_IN_STATEMENT) ? " in " : " of ");
        emitExpression(child(node, Slot.EXPRESSION));
        write(")");
        emitEmbeddedStatement(child(node, Slot.STATEMENT));
        return;
      case CONTINUE_STATEMENT:
        write("continue");
        emitWithPrefix(" ", node.getChild(Slot.LABEL));
        write(";");
        return;
      case BREAK_STATEMENT:
        write("break");
        emitWithPrefix(" ", node.getChild(Slot.LABEL));
        write(";");
        return;
      case RETURN_STATEMENT:
        write("return");
        emitExpressionWithPrefix(" ", node.getChild(Slot.EXPRESSION));
        write(";");
        return;
      case WITH_STATEMENT:
        write("with (");
        emitExpression(child(node, Slot.EXPRESSION));
        write(")");
        emitEmbeddedStatement(child(node, Slot.STATEMENT));
        return;
      case SWITCH_STATEMENT:
        write("switch (");
        emitExpression(child(node, Slot.EXPRESSION));
        write(") ");
        emit(child(node, Slot.CASE_BLOCK));
        return;
      case LABELED_STATEMENT:
        emit(child(node, Slot.LABEL));
        write(": ");
        emit(child(node, Slot.STATEMENT));
        return;
      case THROW_STATEMENT:
        write("throw");
        emitExpressionWithPrefix(" ", node.getChild(Slot.EXPRESSION));
        write(";");
        return;
      case TRY_STATEMENT:
        write("try ");
        emit(child(node, Slot.TRY_BLOCK));
        emit(node.getChild(Slot.CATCH_CLAUSE));
        if (node.getChild(Slot.FINALLY_BLOCK) != null) {
          writer.writeLine();
          write("finally ");
          emit(node.getChild(Slot.FINALLY_BLOCK));
        }
        return;
      case DEBUGGER_STATEMENT:
        write("debugger;");
        return;

      // Declarations
      case VARIABLE_DECLARATION:
        emit(child(node, Slot.NAME));
        emitExpressionWithPrefix(" = ", node.getChild(Slot.INITIALIZER));
        return;
      case VARIABLE_DECLARATION_LIST:
        if (node.hasFlag(NodeFlags.LET)) {
          write("let ");
        } else if (node.hasFlag(NodeFlags.CONST)) {
          write("const ");
        } else {
          write("var ");
        }
        emitList(node, node.getList(ListSlot.DECLARATIONS), ListFormat.VARIABLE_DECLARATION_LIST);
        return;
      case FUNCTION_DECLARATION:
        emitFunctionDeclarationOrExpression(node);
        return;
      case CLASS_DECLARATION:
        emitClassDeclarationOrExpression(node);
        return;
      case INTERFACE_DECLARATION:
        emitDecorators(node);
        emitModifiers(node);
        write("interface ");
        emit(child(node, Slot.NAME));
        emitTypeParameters(node);
        emitList(node, node.getList(ListSlot.HERITAGE_CLAUSES), ListFormat.HERITAGE_CLAUSES);
        write(" {");
        emitList(node, node.getList(ListSlot.MEMBERS), ListFormat.INTERFACE_MEMBERS);
        write("}");
        return;
      case TYPE_ALIAS_DECLARATION:
        emitDecorators(node);
        emitModifiers(node);
        write("type ");
        emit(child(node, Slot.NAME));
        emitTypeParameters(node);
        write(" = ");
        emit(child(node, Slot.TYPE));
        write(";");
        return;
      case ENUM_DECLARATION:
        emitModifiers(node);
        write("enum ");
        emit(child(node, Slot.NAME));
        session.pushTempScope();
        write(" {");
        emitList(node, node.getList(ListSlot.MEMBERS), ListFormat.ENUM_MEMBERS);
        write("}");
        session.popTempScope();
        return;
      case MODULE_DECLARATION:
        emitModuleDeclaration(node);
        return;
      case MODULE_BLOCK:
        emitModuleBlock(node);
        return;
      case CASE_BLOCK:
        write("{");
        emitList(node, node.getList(ListSlot.CLAUSES), ListFormat.CASE_BLOCK_CLAUSES);
        write("}");
        return;
      case IMPORT_EQUALS_DECLARATION:
        emitModifiers(node);
        write("import ");
        emit(child(node, Slot.NAME));
        write(" = ");
        emitEntityName(child(node, Slot.MODULE_REFERENCE));
        write(";");
        return;
      case IMPORT_DECLARATION:
        emitModifiers(node);
        write("import ");
        if (node.getChild(Slot.IMPORT_CLAUSE) != null) {
          emit(node.getChild(Slot.IMPORT_CLAUSE));
          write(" from ");
        }
        emitExpression(child(node, Slot.MODULE_SPECIFIER));
        write(";");
        return;
      case IMPORT_CLAUSE:
        emit(node.getChild(Slot.NAME));
        if (node.getChild(Slot.NAME) != null && node.getChild(Slot.NAMED_BINDINGS) != null) {
          write(", ");
        }
        emit(node.getChild(Slot.NAMED_BINDINGS));
        return;
      case NAMESPACE_IMPORT:
        write("* as ");
        emit(child(node, Slot.NAME));
        return;
      case NAMED_IMPORTS:
      case NAMED_EXPORTS:
        write("{");
        emitList(
            node,
            node.getList(ListSlot.ELEMENTS),
            ListFormat.NAMED_IMPORTS_OR_EXPORTS_ELEMENTS);
        write("}");
        return;
      case IMPORT_SPECIFIER:
      case EXPORT_SPECIFIER:
        if (node.getChild(Slot.PROPERTY_NAME) != null) {
          emit(node.getChild(Slot.PROPERTY_NAME));
          write(" as ");
        }
        emit(child(node, Slot.NAME));
        return;
      case EXPORT_ASSIGNMENT:
        write(node.getBooleanProp(Prop.EXPORT_EQUALS) ? "export = " : "export default ");
        emitExpression(child(node, Slot.EXPRESSION));
        write(";");
        return;
      case EXPORT_DECLARATION:
        write("export ");
        if (node.getChild(Slot.EXPORT_CLAUSE) != null) {
          emit(node.getChild(Slot.EXPORT_CLAUSE));
        } else {
          write("*");
        }
        if (node.getChild(Slot.MODULE_SPECIFIER) != null) {
          write(" from ");
          emitExpression(node.getChild(Slot.MODULE_SPECIFIER));
        }
        write(";");
        return;
      case MISSING_DECLARATION:
        return;

      // Module references
      case EXTERNAL_MODULE_REFERENCE:
        write("require(");
        emitExpression(child(node, Slot.EXPRESSION));
        write(")");
        return;

      // JSX (non-expression)
      case JSX_TEXT:
        writer.writeLiteral(getTextOfNode(node, /* includeTrivia= */ true));
        return;
      case JSX_OPENING_ELEMENT:
        {
          NodeList attributes = node.getList(ListSlot.ATTRIBUTES);
          write("<");
          emitEntityName(child(node, Slot.TAG_NAME));
          if (attributes != null && !attributes.isEmpty()) {
            write(" ");
          }
          emitList(node, attributes, ListFormat.JSX_ELEMENT_ATTRIBUTES);
          write(">");
          return;
        }
      case JSX_CLOSING_ELEMENT:
        write("</");
        emitEntityName(child(node, Slot.TAG_NAME));
        write(">");
        return;
      case JSX_ATTRIBUTE:
        emit(child(node, Slot.NAME));
        emitWithPrefix("=", node.getChild(Slot.INITIALIZER));
        return;
      case JSX_SPREAD_ATTRIBUTE:
        write("{...");
        emitExpression(child(node, Slot.EXPRESSION));
        write("}");
        return;
      case JSX_EXPRESSION:
        if (node.getChild(Slot.EXPRESSION) != null) {
          write("{");
          emitExpression(node.getChild(Slot.EXPRESSION));
          write("}");
        }
        return;

      // Clauses
      case CASE_CLAUSE:
        write("case ");
        emitExpression(child(node, Slot.EXPRESSION));
        write(":");
        emitCaseOrDefaultClauseStatements(node);
        return;
      case DEFAULT_CLAUSE:
        write("default:");
        emitCaseOrDefaultClauseStatements(node);
        return;
      case HERITAGE_CLAUSE:
        write(" ");
        write(checkNotNull(node.getOperator(), node).getText());
        write(" ");
        emitList(node, node.getList(ListSlot.TYPES), ListFormat.HERITAGE_CLAUSE_TYPES);
        return;
      case CATCH_CLAUSE:
        writer.writeLine();
        write("catch (");
        emit(child(node, Slot.VARIABLE_DECLARATION));
        write(") ");
        emit(child(node, Slot.BLOCK));
        return;

      // Property assignments
      case PROPERTY_ASSIGNMENT:
        {
          Node initializer = child(node, Slot.INITIALIZER);
          emit(child(node, Slot.NAME));
          write(": ");
          // A comment right after the colon trails the name rather than leading the value, so it
          // is picked up here.
          TextRange start = TextRange.of(initializer.getPos(), initializer.getPos());
          comments.emitLeadingComments(initializer, comments.getTrailingComments(start));
          emitExpression(initializer);
          return;
        }
      case SHORTHAND_PROPERTY_ASSIGNMENT:
        emit(child(node, Slot.NAME));
        emitExpressionWithPrefix(" = ", node.getChild(Slot.OBJECT_ASSIGNMENT_INITIALIZER));
        return;

      // Enum
      case ENUM_MEMBER:
        emit(child(node, Slot.NAME));
        emitExpressionWithPrefix(" = ", node.getChild(Slot.INITIALIZER));
        return;

      // Top-level nodes
      case SOURCE_FILE:
        emitSourceFile((SourceFile) node);
        return;

      default:
        break;
    }

    if (node.getKind().isExpression()) {
      emitExpressionWorker(node);
    }
  }

  private void emitExpressionWorker(Node node) {
    if (tryEmitSubstitute(node, context.getExpressionSubstitution())) {
      return;
    }

    switch (node.getKind()) {
      // Literals
      case NUMERIC_LITERAL:
      case STRING_LITERAL:
      case REGULAR_EXPRESSION_LITERAL:
      case NO_SUBSTITUTION_TEMPLATE_LITERAL:
        emitLiteral(node);
        return;

      case IDENTIFIER:
        emitIdentifier(node);
        return;

      // Reserved words
      case FALSE_KEYWORD:
      case NULL_KEYWORD:
      case SUPER_KEYWORD:
      case TRUE_KEYWORD:
      case THIS_KEYWORD:
        writeTokenNode(node);
        return;

      case ARRAY_LITERAL_EXPRESSION:
        {
          NodeList elements = node.getList(ListSlot.ELEMENTS);
          if (elements == null || elements.isEmpty()) {
            write("[]");
          } else {
            int preferNewLine = node.isMultiLine() ? ListFormat.PREFER_NEW_LINE : ListFormat.NONE;
            emitExpressionList(
                node, elements, ListFormat.ARRAY_LITERAL_EXPRESSION_ELEMENTS | preferNewLine);
          }
          return;
        }
      case OBJECT_LITERAL_EXPRESSION:
        emitObjectLiteralExpression(node);
        return;
      case PROPERTY_ACCESS_EXPRESSION:
        emitPropertyAccessExpression(node);
        return;
      case ELEMENT_ACCESS_EXPRESSION:
        if (tryEmitConstantValue(node)) {
          return;
        }
        emitExpression(child(node, Slot.EXPRESSION));
        write("[");
        emitExpression(child(node, Slot.ARGUMENT_EXPRESSION));
        write("]");
        return;
      case CALL_EXPRESSION:
        emitExpression(child(node, Slot.EXPRESSION));
        emitExpressionList(
            node, node.getList(ListSlot.ARGUMENTS), ListFormat.CALL_EXPRESSION_ARGUMENTS);
        return;
      case NEW_EXPRESSION:
        write("new ");
        emitExpression(child(node, Slot.EXPRESSION));
        emitExpressionList(
            node, node.getList(ListSlot.ARGUMENTS), ListFormat.NEW_EXPRESSION_ARGUMENTS);
        return;
      case TAGGED_TEMPLATE_EXPRESSION:
        emitExpression(child(node, Slot.TAG));
        write(" ");
        emitExpression(child(node, Slot.TEMPLATE));
        return;
      case TYPE_ASSERTION_EXPRESSION:
        if (node.getChild(Slot.TYPE) != null) {
          write("<");
          emit(node.getChild(Slot.TYPE));
          write(">");
        }
        emitExpression(child(node, Slot.EXPRESSION));
        return;
      case PARENTHESIZED_EXPRESSION:
        write("(");
        emitExpression(child(node, Slot.EXPRESSION));
        write(")");
        return;
      case FUNCTION_EXPRESSION:
        emitFunctionDeclarationOrExpression(node);
        return;
      case ARROW_FUNCTION:
        emitDecorators(node);
        emitModifiers(node);
        emitSignatureAndBody(node, this::emitArrowFunctionHead);
        return;
      case DELETE_EXPRESSION:
        write("delete ");
        emitExpression(child(node, Slot.EXPRESSION));
        return;
      case TYPE_OF_EXPRESSION:
        write("typeof ");
        emitExpression(child(node, Slot.EXPRESSION));
        return;
      case VOID_EXPRESSION:
        write("void ");
        emitExpression(child(node, Slot.EXPRESSION));
        return;
      case AWAIT_EXPRESSION:
        write("await ");
        emitExpression(child(node, Slot.EXPRESSION));
        return;
      case PREFIX_UNARY_EXPRESSION:
        {
          SyntaxKind operator = checkNotNull(node.getOperator(), node);
          Node operand = child(node, Slot.OPERAND);
          write(operator.getText());
          if (NodeUtil.needsSpaceAfterPrefixOperator(operator, operand)) {
            write(" ");
          }
          emitExpression(operand);
          return;
        }
      case POSTFIX_UNARY_EXPRESSION:
        emitExpression(child(node, Slot.OPERAND));
        write(checkNotNull(node.getOperator(), node).getText());
        return;
      case BINARY_EXPRESSION:
        emitBinaryExpression(node);
        return;
      case CONDITIONAL_EXPRESSION:
        emitConditionalExpression(node);
        return;
      case TEMPLATE_EXPRESSION:
        emit(child(node, Slot.HEAD));
        emitList(node, node.getList(ListSlot.TEMPLATE_SPANS), ListFormat.TEMPLATE_EXPRESSION_SPANS);
        return;
      case YIELD_EXPRESSION:
        write(node.getBooleanProp(Prop.ASTERISK) ? "yield*" : "yield");
        emitExpressionWithPrefix(" ", node.getChild(Slot.EXPRESSION));
        return;
      case SPREAD_ELEMENT_EXPRESSION:
        write("...");
        emitExpression(child(node, Slot.EXPRESSION));
        return;
      case CLASS_EXPRESSION:
        emitClassDeclarationOrExpression(node);
        return;
      case OMITTED_EXPRESSION:
        return;
      case AS_EXPRESSION:
        emitExpression(child(node, Slot.EXPRESSION));
        if (node.getChild(Slot.TYPE) != null) {
          write(" as ");
          emit(node.getChild(Slot.TYPE));
        }
        return;

      // JSX
      case JSX_ELEMENT:
        emit(child(node, Slot.OPENING_ELEMENT));
        emitList(node, node.getList(ListSlot.CHILDREN), ListFormat.JSX_ELEMENT_CHILDREN);
        emit(child(node, Slot.CLOSING_ELEMENT));
        return;
      case JSX_SELF_CLOSING_ELEMENT:
        write("<");
        emitEntityName(child(node, Slot.TAG_NAME));
        write(" ");
        emitList(node, node.getList(ListSlot.ATTRIBUTES), ListFormat.JSX_ELEMENT_ATTRIBUTES);
        write("/>");
        return;

      // Transformation nodes
      case PARTIALLY_EMITTED_EXPRESSION:
        emitExpression(child(node, Slot.EXPRESSION));
        return;

      default:
        break;
    }
  }

  /**
   * Replaces {@code node} with what {@code substitution} returns for it. The replacement is marked
   * so that it is not substituted again, and printed without the comments and source map marks
   * that the original already received.
   */
  private boolean tryEmitSubstitute(Node node, NodeSubstitution substitution) {
    int flags = context.getEmitFlags(node);
    if ((flags & EmitFlags.NO_SUBSTITUTION) != 0 || !substitution.isEnabled(node)) {
      return false;
    }
    Node substitute = substitution.substitute(node);
    if (substitute == node) {
      return false;
    }
    context.setEmitFlags(substitute, context.getEmitFlags(substitute) | EmitFlags.NO_SUBSTITUTION);
    emitWorker(substitute);
    return true;
  }

  // Literals

  private void emitLiteral(Node node) {
    String text = getLiteralTextOfNode(node);
    if (options.shouldGenerateSourceMap()
        && (node.isKind(SyntaxKind.STRING_LITERAL) || node.getKind().isTemplateLiteral())) {
      writer.writeLiteral(text);
    } else {
      write(text);
    }
  }

  private void emitIdentifier(Node node) {
    if ((context.getEmitFlags(node) & EmitFlags.UMD_DEFINE) != 0) {
      helpers.emitUmdHelper();
    } else {
      write(getTextOfNode(node, /* includeTrivia= */ false));
    }
  }

  private void emitEntityName(Node node) {
    if (node.isKind(SyntaxKind.IDENTIFIER)) {
      emitExpression(node);
    } else {
      emit(node);
    }
  }

  // Binding patterns

  private void emitBindingPattern(Node node, String open, String close, int format) {
    NodeList elements = node.getList(ListSlot.ELEMENTS);
    if (elements == null || elements.isEmpty()) {
      write(open + close);
    } else {
      write(open);
      emitList(node, elements, format);
      write(close);
    }
  }

  // Expressions

  private void emitObjectLiteralExpression(Node node) {
    NodeList properties = node.getList(ListSlot.PROPERTIES);
    if (properties == null || properties.isEmpty()) {
      write("{}");
      return;
    }
    boolean indented = (context.getEmitFlags(node) & EmitFlags.INDENTED) != 0;
    if (indented) {
      session.pushTempScope();
      writer.increaseIndent();
    }
    int preferNewLine = node.isMultiLine() ? ListFormat.PREFER_NEW_LINE : ListFormat.NONE;
    // Trailing commas in object literals are an ES5 addition.
    int allowTrailingComma =
        options.getTarget().isBelow(ScriptTarget.ES5)
            ? ListFormat.NONE
            : ListFormat.ALLOW_TRAILING_COMMA;
    emitList(
        node,
        properties,
        ListFormat.OBJECT_LITERAL_EXPRESSION_PROPERTIES | allowTrailingComma | preferNewLine);
    if (indented) {
      writer.decreaseIndent();
      session.popTempScope();
    }
  }

  private void emitPropertyAccessExpression(Node node) {
    if (tryEmitConstantValue(node)) {
      return;
    }

    Node expression = child(node, Slot.EXPRESSION);
    Node name = child(node, Slot.NAME);
    TextRange dot = getTokenRangeAfter(expression, SyntaxKind.DOT_TOKEN);
    boolean indentBeforeDot = needsIndentation(node, expression, dot);
    boolean indentAfterDot = needsIndentation(node, dot, name);
    boolean shouldEmitDotDot = !indentBeforeDot && needsDotDotForPropertyAccess(expression);

    emitExpression(expression);
    increaseIndentIf(indentBeforeDot, null);
    write(shouldEmitDotDot ? ".." : ".");
    increaseIndentIf(indentAfterDot, null);
    emit(name);
    decreaseIndentIf(indentBeforeDot, indentAfterDot);
  }

  /**
   * 1..toString is a valid property access; a single dot after an integer literal would be read
   * as a decimal point. The same holds for an access folded into an integer constant.
   */
  private boolean needsDotDotForPropertyAccess(Node expression) {
    if (expression.isKind(SyntaxKind.NUMERIC_LITERAL)) {
      return !getLiteralTextOfNode(expression).contains(".");
    }
    Double constantValue = tryGetConstantValue(expression);
    return constantValue != null
        && !constantValue.isInfinite()
        && Math.floor(constantValue) == constantValue;
  }

  private boolean tryEmitConstantValue(Node node) {
    Double constantValue = tryGetConstantValue(node);
    if (constantValue == null) {
      return false;
    }
    write(NodeUtil.numberToString(constantValue));
    if (!options.getRemoveComments()) {
      String propertyName =
          node.isKind(SyntaxKind.PROPERTY_ACCESS_EXPRESSION)
              ? getTextOfNode(child(node, Slot.NAME), /* includeTrivia= */ false)
              : getTextOfNode(child(node, Slot.ARGUMENT_EXPRESSION), /* includeTrivia= */ false);
      write(" /* " + propertyName + " */");
    }
    return true;
  }

  private @Nullable Double tryGetConstantValue(Node node) {
    if (options.isIsolatedModules()) {
      return null;
    }
    if (node.isKind(SyntaxKind.PROPERTY_ACCESS_EXPRESSION)
        || node.isKind(SyntaxKind.ELEMENT_ACCESS_EXPRESSION)) {
      return resolver.getConstantValue(node);
    }
    return null;
  }

  private void emitBinaryExpression(Node node) {
    Node left = child(node, Slot.LEFT);
    Node operatorToken = child(node, Slot.OPERATOR_TOKEN);
    Node right = child(node, Slot.RIGHT);
    boolean isCommaOperator = operatorToken.isKind(SyntaxKind.COMMA_TOKEN);
    boolean indentBeforeOperator = needsIndentation(node, left, operatorToken);
    boolean indentAfterOperator = needsIndentation(node, operatorToken, right);

    emitExpression(left);
    increaseIndentIf(indentBeforeOperator, isCommaOperator ? null : " ");
    writeTokenNode(operatorToken);
    increaseIndentIf(indentAfterOperator, " ");
    emitExpression(right);
    decreaseIndentIf(indentBeforeOperator, indentAfterOperator);
  }

  private void emitConditionalExpression(Node node) {
    Node condition = child(node, Slot.CONDITION);
    Node whenTrue = child(node, Slot.WHEN_TRUE);
    Node whenFalse = child(node, Slot.WHEN_FALSE);
    TextRange questionToken = getTokenRangeAfter(condition, SyntaxKind.QUESTION_TOKEN);
    TextRange colonToken = getTokenRangeAfter(whenTrue, SyntaxKind.COLON_TOKEN);
    boolean indentBeforeQuestion = needsIndentation(node, condition, questionToken);
    boolean indentAfterQuestion = needsIndentation(node, questionToken, whenTrue);
    boolean indentBeforeColon = needsIndentation(node, whenTrue, colonToken);
    boolean indentAfterColon = needsIndentation(node, colonToken, whenFalse);

    emitExpression(condition);
    increaseIndentIf(indentBeforeQuestion, " ");
    write("?");
    increaseIndentIf(indentAfterQuestion, " ");
    emitExpression(whenTrue);
    decreaseIndentIf(indentBeforeQuestion, indentAfterQuestion);

    increaseIndentIf(indentBeforeColon, " ");
    write(":");
    increaseIndentIf(indentAfterColon, " ");
    emitExpression(whenFalse);
    decreaseIndentIf(indentBeforeColon, indentAfterColon);
  }

  // Statements

  private void emitBlock(Node node) {
    if (isSingleLineEmptyBlock(node)) {
      write("{ }");
    } else {
      write("{");
      emitBlockStatements(node);
      write("}");
    }
  }

  private void emitBlockStatements(Node node) {
    int format =
        (context.getEmitFlags(node) & EmitFlags.SINGLE_LINE) != 0
            ? ListFormat.SINGLE_LINE_BLOCK_STATEMENTS
            : ListFormat.MULTI_LINE_BLOCK_STATEMENTS;
    emitList(node, node.getList(ListSlot.STATEMENTS), format);
  }

  private void emitIfStatement(Node node) {
    write("if (");
    emitExpression(child(node, Slot.EXPRESSION));
    write(")");
    emitEmbeddedStatement(child(node, Slot.THEN_STATEMENT));
    Node elseStatement = node.getChild(Slot.ELSE_STATEMENT);
    if (elseStatement != null) {
      writer.writeLine();
      write("else");
      if (elseStatement.isKind(SyntaxKind.IF_STATEMENT)) {
        write(" ");
        emit(elseStatement);
      } else {
        emitEmbeddedStatement(elseStatement);
      }
    }
  }

  private void emitForBinding(@Nullable Node node) {
    if (node == null) {
      return;
    }
    if (node.isKind(SyntaxKind.VARIABLE_DECLARATION_LIST)) {
      emit(node);
    } else {
      write("(");
      emitExpression(node);
      write(")");
    }
  }

  private void emitEmbeddedStatement(Node node) {
    if (node.isKind(SyntaxKind.BLOCK)) {
      write(" ");
      emit(node);
    } else {
      writer.writeLine();
      writer.increaseIndent();
      emit(node);
      writer.decreaseIndent();
    }
  }

  private void emitCaseOrDefaultClauseStatements(Node node) {
    NodeList statements = node.getList(ListSlot.STATEMENTS);
    // Synthesized nodes count as being on the clause's line.
    boolean emitAsSingleStatement =
        statements != null
            && statements.size() == 1
            && (node.isSynthesized()
                || statements.get(0).isSynthesized()
                || NodeUtil.rangeStartPositionsAreOnSameLine(
                    session.getSourceFile(), node, statements.get(0)));
    if (emitAsSingleStatement) {
      write(" ");
      emit(statements.get(0));
    } else {
      emitList(node, statements, ListFormat.CASE_OR_DEFAULT_CLAUSE_STATEMENTS);
    }
  }

  // Declarations

  private void emitFunctionDeclarationOrExpression(Node node) {
    emitDecorators(node);
    emitModifiers(node);
    write(node.getBooleanProp(Prop.ASTERISK) ? "function* " : "function ");
    emit(node.getChild(Slot.NAME));
    emitSignatureAndBody(node, this::emitSignatureHead);
  }

  private void emitSignatureAndBody(Node node, NodeEmitter signatureHead) {
    Node body = node.getChild(Slot.BODY);
    if (body == null) {
      signatureHead.emit(node);
      write(";");
    } else if (body.isKind(SyntaxKind.BLOCK)) {
      boolean indented = (context.getEmitFlags(node) & EmitFlags.INDENTED) != 0;
      if (indented) {
        writer.increaseIndent();
      }
      session.pushTempScope();
      context.startLexicalEnvironment();
      signatureHead.emit(node);
      write(" {");
      emitBlockFunctionBody(body);
      write("}");
      if (indented) {
        writer.decreaseIndent();
      }
      session.popTempScope();
    } else {
      signatureHead.emit(node);
      write(" ");
      emitExpression(body);
    }
  }

  private void emitSignatureHead(Node node) {
    emitTypeParameters(node);
    emitParameters(node);
    emitWithPrefix(": ", node.getChild(Slot.TYPE));
  }

  private void emitArrowFunctionHead(Node node) {
    emitTypeParameters(node);
    emitParametersForArrow(node);
    emitWithPrefix(": ", node.getChild(Slot.TYPE));
    write(" =>");
  }

  private void emitBlockFunctionBody(Node body) {
    NodeList statements = listOrEmpty(body, ListSlot.STATEMENTS);
    int startingLine = writer.getLine();
    writer.increaseIndent();
    comments.emitDetachedComments(statements);

    int statementOffset = emitPrologueDirectives(statements, /* startWithNewLine= */ true);
    boolean helpersEmitted = helpers.emitHelpers(body);

    if (statementOffset == 0 && !helpersEmitted && shouldEmitBlockFunctionBodyOnSingleLine(body)) {
      writer.decreaseIndent();
      emitList(body, statements, ListFormat.SINGLE_LINE_FUNCTION_BODY_STATEMENTS);
      writer.increaseIndent();
    } else {
      lists.emitList(
          body,
          statements,
          ListFormat.MULTI_LINE_FUNCTION_BODY_STATEMENTS,
          statementOffset,
          this::emit);
    }

    int endingLine = writer.getLine();
    emitLexicalEnvironment(context.endLexicalEnvironment(), startingLine != endingLine);

    TextRange end = TextRange.of(statements.getEnd(), statements.getEnd());
    comments.emitLeadingComments(end, comments.getLeadingComments(end));
    writer.decreaseIndent();
  }

  private boolean shouldEmitBlockFunctionBodyOnSingleLine(Node body) {
    if ((context.getEmitFlags(body) & EmitFlags.SINGLE_LINE) != 0) {
      return true;
    }
    if (body.isMultiLine()) {
      return false;
    }
    if (!body.isSynthesized() && !NodeUtil.rangeIsOnSingleLine(session.getSourceFile(), body)) {
      return false;
    }

    NodeList statements = listOrEmpty(body, ListSlot.STATEMENTS);
    if (lists.shouldWriteLeadingLineTerminator(body, statements, ListFormat.PRESERVE_LINES)
        || lists.shouldWriteClosingLineTerminator(body, statements, ListFormat.PRESERVE_LINES)) {
      return false;
    }
    Node previousStatement = null;
    for (Node statement : statements) {
      if (previousStatement != null
          && lists.shouldWriteSeparatingLineTerminator(
              previousStatement, statement, ListFormat.PRESERVE_LINES)) {
        return false;
      }
      previousStatement = statement;
    }
    return true;
  }

  private void emitClassDeclarationOrExpression(Node node) {
    emitDecorators(node);
    emitModifiers(node);
    write("class");
    emitWithPrefix(" ", node.getChild(Slot.NAME));

    boolean indented = (context.getEmitFlags(node) & EmitFlags.INDENTED) != 0;
    if (indented) {
      writer.increaseIndent();
    }

    emitTypeParameters(node);
    emitList(node, node.getList(ListSlot.HERITAGE_CLAUSES), ListFormat.CLASS_HERITAGE_CLAUSES);

    session.pushTempScope();
    write(" {");
    emitList(node, node.getList(ListSlot.MEMBERS), ListFormat.CLASS_MEMBERS);
    write("}");

    if (indented) {
      writer.decreaseIndent();
    }
    session.popTempScope();
  }

  private void emitModuleDeclaration(Node node) {
    emitModifiers(node);
    write(node.hasFlag(NodeFlags.NAMESPACE) ? "namespace " : "module ");
    emit(child(node, Slot.NAME));

    // namespace a.b.c is a chain of declarations, one per name.
    Node body = child(node, Slot.BODY);
    while (body.isKind(SyntaxKind.MODULE_DECLARATION)) {
      write(".");
      emit(child(body, Slot.NAME));
      body = child(body, Slot.BODY);
    }

    write(" ");
    emit(body);
  }

  private void emitModuleBlock(Node node) {
    if (isSingleLineEmptyBlock(node)) {
      write("{ }");
      return;
    }
    session.pushTempScope();
    context.startLexicalEnvironment();
    write("{");

    int startingLine = writer.getLine();
    writer.increaseIndent();
    boolean helpersEmitted = helpers.emitHelpers(node);
    writer.decreaseIndent();
    if (helpersEmitted) {
      emitList(node, node.getList(ListSlot.STATEMENTS), ListFormat.MULTI_LINE_BLOCK_STATEMENTS);
    } else {
      emitBlockStatements(node);
    }

    int endingLine = writer.getLine();
    // Hoisted declarations line up with the statements of the block.
    writer.increaseIndent();
    emitLexicalEnvironment(context.endLexicalEnvironment(), startingLine != endingLine);
    writer.decreaseIndent();
    write("}");
    session.popTempScope();
  }

  // Top-level nodes

  private void emitSourceFile(SourceFile node) {
    writer.writeLine();
    emitShebang(node);
    comments.emitDetachedComments(node);

    NodeList statements = listOrEmpty(node, ListSlot.STATEMENTS);
    int statementOffset = emitPrologueDirectives(statements, /* startWithNewLine= */ false);
    if ((context.getEmitFlags(node) & EmitFlags.NO_LEXICAL_ENVIRONMENT) != 0) {
      helpers.emitHelpers(node);
      lists.emitList(node, statements, ListFormat.MULTI_LINE, statementOffset, this::emit);
    } else {
      session.pushTempScope();
      context.startLexicalEnvironment();
      helpers.emitHelpers(node);
      lists.emitList(node, statements, ListFormat.MULTI_LINE, statementOffset, this::emit);
      emitLexicalEnvironment(context.endLexicalEnvironment(), /* newLine= */ true);
      session.popTempScope();
    }

    Node endOfFileToken = node.getChild(Slot.END_OF_FILE_TOKEN);
    if (endOfFileToken != null) {
      comments.emitLeadingComments(endOfFileToken, comments.getLeadingComments(endOfFileToken));
    }
  }

  private void emitShebang(SourceFile file) {
    String shebang = Trivia.getShebang(file.getSourceText());
    if (shebang != null) {
      write(shebang);
      writer.writeLine();
    }
  }

  private void emitLexicalEnvironment(List<Node> declarations, boolean newLine) {
    if (declarations.isEmpty()) {
      return;
    }
    for (Node declaration : declarations) {
      if (newLine) {
        writer.writeLine();
      } else {
        write(" ");
      }
      emit(declaration);
    }
    if (newLine) {
      writer.writeLine();
    } else {
      write(" ");
    }
  }

  /**
   * Emits the prologue directives ("use strict" and the like) at the start of a statement list.
   * Returns the index of the first statement that is not one.
   */
  private int emitPrologueDirectives(NodeList statements, boolean startWithNewLine) {
    for (int i = 0; i < statements.size(); i++) {
      Node statement = statements.get(i);
      if (!isPrologueDirective(statement)) {
        return i;
      }
      if (startWithNewLine || i > 0) {
        writer.writeLine();
      }
      emit(statement);
    }
    return statements.size();
  }

  private static boolean isPrologueDirective(Node statement) {
    if (!statement.isKind(SyntaxKind.EXPRESSION_STATEMENT)) {
      return false;
    }
    Node expression = statement.getChild(Slot.EXPRESSION);
    return expression != null && expression.isKind(SyntaxKind.STRING_LITERAL);
  }

  // Lists

  private void emitModifiers(Node node) {
    NodeList modifiers = node.getList(ListSlot.MODIFIERS);
    if (modifiers != null && !modifiers.isEmpty()) {
      emitList(node, modifiers, ListFormat.MODIFIERS);
      write(" ");
    }
  }

  private void emitDecorators(Node node) {
    emitList(node, node.getList(ListSlot.DECORATORS), ListFormat.DECORATORS);
  }

  private void emitTypeArguments(Node node) {
    emitList(node, node.getList(ListSlot.TYPE_ARGUMENTS), ListFormat.TYPE_ARGUMENTS);
  }

  private void emitTypeParameters(Node node) {
    emitList(node, node.getList(ListSlot.TYPE_PARAMETERS), ListFormat.TYPE_PARAMETERS);
  }

  private void emitParameters(Node node) {
    emitList(node, node.getList(ListSlot.PARAMETERS), ListFormat.PARAMETERS);
  }

  /** A lone untyped parameter written without parentheses in the source stays that way. */
  private void emitParametersForArrow(Node node) {
    NodeList parameters = node.getList(ListSlot.PARAMETERS);
    if (parameters != null
        && parameters.size() == 1
        && parameters.get(0).getChild(Slot.TYPE) == null
        && parameters.get(0).getPos() == node.getPos()) {
      emit(parameters.get(0));
    } else {
      emitParameters(node);
    }
  }

  private void emitList(Node parent, @Nullable NodeList children, int format) {
    lists.emitList(parent, children, format, this::emit);
  }

  private void emitExpressionList(Node parent, @Nullable NodeList children, int format) {
    lists.emitList(parent, children, format, this::emitExpression);
  }

  // Helpers

  private void write(String s) {
    writer.write(s);
  }

  private void writeIf(boolean condition, String s) {
    if (condition) {
      writer.write(s);
    }
  }

  private void writeTokenNode(Node node) {
    sourceMap.emitStart(node, shouldIgnoreSourceMapForNode, shouldIgnoreSourceMapForChildren);
    write(checkNotNull(node.getKind().getText(), node));
    sourceMap.emitEnd(node, shouldIgnoreSourceMapForNode, shouldIgnoreSourceMapForChildren);
  }

  private void emitWithPrefix(String prefix, @Nullable Node node) {
    if (node != null) {
      write(prefix);
      emit(node);
    }
  }

  private void emitExpressionWithPrefix(String prefix, @Nullable Node node) {
    if (node != null) {
      write(prefix);
      emitExpression(node);
    }
  }

  private void emitWithSuffix(@Nullable Node node, String suffix) {
    if (node != null) {
      emit(node);
      write(suffix);
    }
  }

  private void increaseIndentIf(boolean value, @Nullable String valueToWriteWhenNotIndenting) {
    if (value) {
      writer.increaseIndent();
      writer.writeLine();
    } else if (valueToWriteWhenNotIndenting != null) {
      write(valueToWriteWhenNotIndenting);
    }
  }

  private void decreaseIndentIf(boolean value1, boolean value2) {
    if (value1) {
      writer.decreaseIndent();
    }
    if (value2) {
      writer.decreaseIndent();
    }
  }

  /**
   * Whether a line break separated {@code range1} from {@code range2} in the source, or the
   * second one asks to start on a new line.
   */
  private boolean needsIndentation(Node parent, TextRange range1, TextRange range2) {
    parent = NodeUtil.skipSynthesizedParentheses(parent);
    range1 = skipSynthesizedParentheses(range1);
    range2 = skipSynthesizedParentheses(range2);

    if (range2 instanceof Node && Boolean.TRUE.equals(((Node) range2).getStartsOnNewLine())) {
      return true;
    }
    return !parent.isSynthesized()
        && !NodeUtil.isSynthesized(range1)
        && !NodeUtil.isSynthesized(range2)
        && !NodeUtil.rangeEndIsOnSameLineAsRangeStart(session.getSourceFile(), range1, range2);
  }

  private static TextRange skipSynthesizedParentheses(TextRange range) {
    return range instanceof Node ? NodeUtil.skipSynthesizedParentheses((Node) range) : range;
  }

  /** Locates a punctuation token that has no node of its own, right after {@code previous}. */
  private TextRange getTokenRangeAfter(Node previous, SyntaxKind token) {
    if (previous.isSynthesized()) {
      return TextRange.of(-1, -1);
    }
    String text = session.getSourceFile().getSourceText();
    int start = Trivia.skipTrivia(text, previous.getEnd());
    return TextRange.of(previous.getEnd(), start + checkNotNull(token.getText()).length());
  }

  private boolean isSingleLineEmptyBlock(Node block) {
    NodeList statements = block.getList(ListSlot.STATEMENTS);
    return !block.isMultiLine()
        && (statements == null || statements.isEmpty())
        && NodeUtil.rangeEndIsOnSameLineAsRangeStart(session.getSourceFile(), block, block);
  }

  private String getTextOfNode(Node node, boolean includeTrivia) {
    if (node.isGeneratedIdentifier()) {
      return names.getGeneratedName(node);
    }
    if (node.isKind(SyntaxKind.IDENTIFIER) && (node.isSynthesized() || node.getParent() == null)) {
      return GeneratedNameResolver.unescapeIdentifier(checkNotNull(node.getText(), node));
    }
    Node textSourceNode = node.getChild(Slot.TEXT_SOURCE_NODE);
    if (node.isKind(SyntaxKind.STRING_LITERAL) && textSourceNode != null) {
      return getTextOfNode(textSourceNode, includeTrivia);
    }
    if ((node.isSynthesized() || node.getParent() == null) && node.getText() != null) {
      return node.getText();
    }
    return getSourceTextOfNode(node, includeTrivia);
  }

  private String getSourceTextOfNode(Node node, boolean includeTrivia) {
    SourceFile file = node.getSourceFile();
    String text = (file != null ? file : session.getSourceFile()).getSourceText();
    int start = includeTrivia ? node.getPos() : Trivia.skipTrivia(text, node.getPos());
    return text.substring(start, node.getEnd());
  }

  private String getLiteralTextOfNode(Node node) {
    Node textSourceNode = node.getChild(Slot.TEXT_SOURCE_NODE);
    if (node.isKind(SyntaxKind.STRING_LITERAL) && textSourceNode != null) {
      if (textSourceNode.isKind(SyntaxKind.IDENTIFIER)) {
        String text = getTextOfNode(textSourceNode, /* includeTrivia= */ false);
        return "\"" + NodeUtil.escapeString(text, '"') + "\"";
      }
      return getLiteralTextOfNode(textSourceNode);
    }
    return NodeUtil.getLiteralText(node, options.getTarget());
  }

  private static NodeList listOrEmpty(Node node, ListSlot slot) {
    NodeList list = node.getList(slot);
    return list == null ? NodeList.empty() : list;
  }

  private static Node child(Node node, Slot slot) {
    return checkNotNull(node.getChild(slot), "%s has no %s", node, slot);
  }
}
