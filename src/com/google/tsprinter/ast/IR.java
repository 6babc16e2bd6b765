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
import static com.google.common.base.Preconditions.checkState;

import com.google.tsprinter.ast.Node.ListSlot;
import com.google.tsprinter.ast.Node.Prop;
import com.google.tsprinter.ast.Node.Slot;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * An AST construction helper class for synthesized trees. Every node built here has a
 * synthesized range.
 */
public final class IR {

  private IR() {}

  // Names

  public static Node name(String text) {
    checkArgument(!text.isEmpty(), "empty identifier");
    return new Node(SyntaxKind.IDENTIFIER).setText(text);
  }

  /** A temporary whose name is the next free {@code _a, _b, ...}. */
  public static Node tempVariable() {
    return new Node(SyntaxKind.IDENTIFIER).setText("").setAutoGenerateKind(GeneratedNameKind.AUTO);
  }

  /** A temporary that prefers the name {@code _i}. */
  public static Node loopVariable() {
    return new Node(SyntaxKind.IDENTIFIER).setText("").setAutoGenerateKind(GeneratedNameKind.LOOP);
  }

  /** A name based on {@code baseName} with a numeric suffix. */
  public static Node uniqueName(String baseName) {
    return new Node(SyntaxKind.IDENTIFIER)
        .setText(baseName)
        .setAutoGenerateKind(GeneratedNameKind.UNIQUE);
  }

  /** A name derived from the declaration or identifier {@code node}. */
  public static Node generatedNameForNode(Node node) {
    return new Node(SyntaxKind.IDENTIFIER)
        .setText("")
        .setAutoGenerateKind(GeneratedNameKind.NODE)
        .setOriginal(node);
  }

  public static Node qualifiedName(Node left, Node right) {
    checkState(left.isKind(SyntaxKind.IDENTIFIER) || left.isKind(SyntaxKind.QUALIFIED_NAME));
    return new Node(SyntaxKind.QUALIFIED_NAME)
        .setChild(Slot.LEFT, left)
        .setChild(Slot.RIGHT, right);
  }

  public static Node computedPropertyName(Node expression) {
    return new Node(SyntaxKind.COMPUTED_PROPERTY_NAME).setChild(Slot.EXPRESSION, expression);
  }

  /** A keyword or punctuation token node, such as a modifier or a binary operator. */
  public static Node token(SyntaxKind kind) {
    checkArgument(kind.isToken(), "Not a token: %s", kind);
    return new Node(kind);
  }

  // Literals

  public static Node number(double value) {
    checkArgument(!Double.isNaN(value) && value >= 0, "Not a literal value: %s", value);
    String text =
        value == Math.rint(value) && Math.abs(value) < 1e21
            ? Long.toString((long) value)
            : Double.toString(value);
    return number(text);
  }

  public static Node number(String text) {
    return new Node(SyntaxKind.NUMERIC_LITERAL).setText(text);
  }

  public static Node string(String value) {
    return new Node(SyntaxKind.STRING_LITERAL).setText(value);
  }

  /** A string literal that prints as the text of {@code source}. */
  public static Node stringFromNode(Node source) {
    return new Node(SyntaxKind.STRING_LITERAL)
        .setText(source.getText())
        .setChild(Slot.TEXT_SOURCE_NODE, source);
  }

  public static Node regex(String text) {
    return new Node(SyntaxKind.REGULAR_EXPRESSION_LITERAL).setText(text);
  }

  public static Node templateLiteral(SyntaxKind kind, String cooked) {
    checkArgument(kind.isTemplateLiteral(), kind);
    return new Node(kind).setText(cooked);
  }

  public static Node templateExpression(Node head, Node... spans) {
    return new Node(SyntaxKind.TEMPLATE_EXPRESSION)
        .setChild(Slot.HEAD, head)
        .setList(ListSlot.TEMPLATE_SPANS, spans);
  }

  public static Node templateSpan(Node expression, Node literal) {
    return new Node(SyntaxKind.TEMPLATE_SPAN)
        .setChild(Slot.EXPRESSION, expression)
        .setChild(Slot.LITERAL, literal);
  }

  public static Node trueNode() {
    return token(SyntaxKind.TRUE_KEYWORD);
  }

  public static Node falseNode() {
    return token(SyntaxKind.FALSE_KEYWORD);
  }

  public static Node nullNode() {
    return token(SyntaxKind.NULL_KEYWORD);
  }

  public static Node thisNode() {
    return token(SyntaxKind.THIS_KEYWORD);
  }

  public static Node superNode() {
    return token(SyntaxKind.SUPER_KEYWORD);
  }

  // Expressions

  public static Node getprop(Node target, String name) {
    return getprop(target, name(name));
  }

  public static Node getprop(Node target, Node name) {
    checkState(mayBeExpression(target), target);
    return new Node(SyntaxKind.PROPERTY_ACCESS_EXPRESSION)
        .setChild(Slot.EXPRESSION, target)
        .setChild(Slot.NAME, name);
  }

  public static Node getelem(Node target, Node argument) {
    checkState(mayBeExpression(target), target);
    checkState(mayBeExpression(argument), argument);
    return new Node(SyntaxKind.ELEMENT_ACCESS_EXPRESSION)
        .setChild(Slot.EXPRESSION, target)
        .setChild(Slot.ARGUMENT_EXPRESSION, argument);
  }

  public static Node call(Node target, Node... args) {
    checkState(mayBeExpression(target), target);
    return new Node(SyntaxKind.CALL_EXPRESSION)
        .setChild(Slot.EXPRESSION, target)
        .setList(ListSlot.ARGUMENTS, args);
  }

  /** A {@code new} expression. A null argument list prints without parentheses. */
  public static Node newNode(Node target, @Nullable NodeList args) {
    return new Node(SyntaxKind.NEW_EXPRESSION)
        .setChild(Slot.EXPRESSION, target)
        .setList(ListSlot.ARGUMENTS, args);
  }

  public static Node taggedTemplate(Node tag, Node template) {
    return new Node(SyntaxKind.TAGGED_TEMPLATE_EXPRESSION)
        .setChild(Slot.TAG, tag)
        .setChild(Slot.TEMPLATE, template);
  }

  public static Node paren(Node expression) {
    return new Node(SyntaxKind.PARENTHESIZED_EXPRESSION).setChild(Slot.EXPRESSION, expression);
  }

  public static Node binary(Node left, SyntaxKind operator, Node right) {
    checkState(mayBeExpression(left), left);
    checkState(mayBeExpression(right), right);
    return new Node(SyntaxKind.BINARY_EXPRESSION)
        .setChild(Slot.LEFT, left)
        .setChild(Slot.OPERATOR_TOKEN, token(operator))
        .setChild(Slot.RIGHT, right);
  }

  public static Node assign(Node target, Node value) {
    return binary(target, SyntaxKind.EQUALS_TOKEN, value);
  }

  public static Node comma(Node left, Node right) {
    return binary(left, SyntaxKind.COMMA_TOKEN, right);
  }

  public static Node prefix(SyntaxKind operator, Node operand) {
    return new Node(SyntaxKind.PREFIX_UNARY_EXPRESSION)
        .setOperator(operator)
        .setChild(Slot.OPERAND, operand);
  }

  public static Node postfix(Node operand, SyntaxKind operator) {
    return new Node(SyntaxKind.POSTFIX_UNARY_EXPRESSION)
        .setOperator(operator)
        .setChild(Slot.OPERAND, operand);
  }

  public static Node hook(Node condition, Node whenTrue, Node whenFalse) {
    return new Node(SyntaxKind.CONDITIONAL_EXPRESSION)
        .setChild(Slot.CONDITION, condition)
        .setChild(Slot.WHEN_TRUE, whenTrue)
        .setChild(Slot.WHEN_FALSE, whenFalse);
  }

  /** A unary keyword expression: {@code delete}, {@code typeof}, {@code void} or {@code await}. */
  public static Node unaryKeyword(SyntaxKind kind, Node expression) {
    checkArgument(
        kind == SyntaxKind.DELETE_EXPRESSION
            || kind == SyntaxKind.TYPE_OF_EXPRESSION
            || kind == SyntaxKind.VOID_EXPRESSION
            || kind == SyntaxKind.AWAIT_EXPRESSION,
        kind);
    return new Node(kind).setChild(Slot.EXPRESSION, expression);
  }

  public static Node yield(@Nullable Node expression, boolean delegate) {
    return new Node(SyntaxKind.YIELD_EXPRESSION)
        .setChild(Slot.EXPRESSION, expression)
        .putBooleanProp(Prop.ASTERISK, delegate);
  }

  public static Node spread(Node expression) {
    return new Node(SyntaxKind.SPREAD_ELEMENT_EXPRESSION).setChild(Slot.EXPRESSION, expression);
  }

  public static Node arraylit(Node... elements) {
    return new Node(SyntaxKind.ARRAY_LITERAL_EXPRESSION).setList(ListSlot.ELEMENTS, elements);
  }

  public static Node omitted() {
    return new Node(SyntaxKind.OMITTED_EXPRESSION);
  }

  public static Node objectlit(Node... properties) {
    return new Node(SyntaxKind.OBJECT_LITERAL_EXPRESSION)
        .setList(ListSlot.PROPERTIES, properties);
  }

  public static Node propertyAssignment(Node name, Node initializer) {
    return new Node(SyntaxKind.PROPERTY_ASSIGNMENT)
        .setChild(Slot.NAME, name)
        .setChild(Slot.INITIALIZER, initializer);
  }

  public static Node shorthandPropertyAssignment(Node name) {
    return new Node(SyntaxKind.SHORTHAND_PROPERTY_ASSIGNMENT).setChild(Slot.NAME, name);
  }

  public static Node asExpression(Node expression, Node type) {
    return new Node(SyntaxKind.AS_EXPRESSION)
        .setChild(Slot.EXPRESSION, expression)
        .setChild(Slot.TYPE, type);
  }

  public static Node typeAssertion(Node type, Node expression) {
    return new Node(SyntaxKind.TYPE_ASSERTION_EXPRESSION)
        .setChild(Slot.TYPE, type)
        .setChild(Slot.EXPRESSION, expression);
  }

  public static Node partiallyEmitted(Node expression, Node original) {
    return new Node(SyntaxKind.PARTIALLY_EMITTED_EXPRESSION)
        .setChild(Slot.EXPRESSION, expression)
        .setOriginal(original);
  }

  // Functions

  public static Node param(Node name) {
    return new Node(SyntaxKind.PARAMETER).setChild(Slot.NAME, name);
  }

  public static Node param(String name) {
    return param(name(name));
  }

  public static Node function(@Nullable Node name, NodeList params, Node body) {
    checkState(body.isKind(SyntaxKind.BLOCK), body);
    return new Node(SyntaxKind.FUNCTION_DECLARATION)
        .setChild(Slot.NAME, name)
        .setList(ListSlot.PARAMETERS, params)
        .setChild(Slot.BODY, body);
  }

  public static Node functionExpression(@Nullable Node name, NodeList params, Node body) {
    checkState(body.isKind(SyntaxKind.BLOCK), body);
    return new Node(SyntaxKind.FUNCTION_EXPRESSION)
        .setChild(Slot.NAME, name)
        .setList(ListSlot.PARAMETERS, params)
        .setChild(Slot.BODY, body);
  }

  /** An arrow function whose body is a block or an expression. */
  public static Node arrowFunction(NodeList params, Node body) {
    checkState(body.isKind(SyntaxKind.BLOCK) || mayBeExpression(body), body);
    return new Node(SyntaxKind.ARROW_FUNCTION)
        .setList(ListSlot.PARAMETERS, params)
        .setChild(Slot.BODY, body);
  }

  public static Node method(Node name, NodeList params, @Nullable Node body) {
    return new Node(SyntaxKind.METHOD_DECLARATION)
        .setChild(Slot.NAME, name)
        .setList(ListSlot.PARAMETERS, params)
        .setChild(Slot.BODY, body);
  }

  public static Node constructor(NodeList params, Node body) {
    return new Node(SyntaxKind.CONSTRUCTOR)
        .setList(ListSlot.PARAMETERS, params)
        .setChild(Slot.BODY, body);
  }

  public static Node getter(Node name, Node body) {
    return new Node(SyntaxKind.GET_ACCESSOR)
        .setChild(Slot.NAME, name)
        .setList(ListSlot.PARAMETERS, NodeList.empty())
        .setChild(Slot.BODY, body);
  }

  public static Node setter(Node name, Node param, Node body) {
    return new Node(SyntaxKind.SET_ACCESSOR)
        .setChild(Slot.NAME, name)
        .setList(ListSlot.PARAMETERS, param)
        .setChild(Slot.BODY, body);
  }

  public static Node decorator(Node expression) {
    return new Node(SyntaxKind.DECORATOR).setChild(Slot.EXPRESSION, expression);
  }

  // Classes

  public static Node classDeclaration(
      @Nullable Node name, @Nullable NodeList heritageClauses, Node... members) {
    return new Node(SyntaxKind.CLASS_DECLARATION)
        .setChild(Slot.NAME, name)
        .setList(ListSlot.HERITAGE_CLAUSES, heritageClauses)
        .setList(ListSlot.MEMBERS, members);
  }

  public static Node classExpression(
      @Nullable Node name, @Nullable NodeList heritageClauses, Node... members) {
    return new Node(SyntaxKind.CLASS_EXPRESSION)
        .setChild(Slot.NAME, name)
        .setList(ListSlot.HERITAGE_CLAUSES, heritageClauses)
        .setList(ListSlot.MEMBERS, members);
  }

  /** An {@code extends} or {@code implements} clause. */
  public static Node heritageClause(SyntaxKind token, Node... types) {
    checkArgument(
        token == SyntaxKind.EXTENDS_KEYWORD || token == SyntaxKind.IMPLEMENTS_KEYWORD, token);
    return new Node(SyntaxKind.HERITAGE_CLAUSE)
        .setOperator(token)
        .setList(ListSlot.TYPES, types);
  }

  public static Node expressionWithTypeArguments(Node expression) {
    return new Node(SyntaxKind.EXPRESSION_WITH_TYPE_ARGUMENTS)
        .setChild(Slot.EXPRESSION, expression);
  }

  public static Node propertyDeclaration(Node name, @Nullable Node initializer) {
    return new Node(SyntaxKind.PROPERTY_DECLARATION)
        .setChild(Slot.NAME, name)
        .setChild(Slot.INITIALIZER, initializer);
  }

  // Statements

  public static Node block(Node... statements) {
    for (Node statement : statements) {
      checkState(mayBeStatement(statement), "Block node cannot contain %s", statement.getKind());
    }
    return new Node(SyntaxKind.BLOCK).setList(ListSlot.STATEMENTS, statements);
  }

  public static Node block(List<Node> statements) {
    return block(statements.toArray(new Node[0]));
  }

  public static Node exprResult(Node expression) {
    checkState(mayBeExpression(expression), expression);
    return new Node(SyntaxKind.EXPRESSION_STATEMENT).setChild(Slot.EXPRESSION, expression);
  }

  public static Node returnNode(@Nullable Node expression) {
    return new Node(SyntaxKind.RETURN_STATEMENT).setChild(Slot.EXPRESSION, expression);
  }

  public static Node throwNode(Node expression) {
    return new Node(SyntaxKind.THROW_STATEMENT).setChild(Slot.EXPRESSION, expression);
  }

  public static Node empty() {
    return new Node(SyntaxKind.EMPTY_STATEMENT);
  }

  public static Node debugger() {
    return new Node(SyntaxKind.DEBUGGER_STATEMENT);
  }

  public static Node ifNode(Node condition, Node thenStatement, @Nullable Node elseStatement) {
    return new Node(SyntaxKind.IF_STATEMENT)
        .setChild(Slot.EXPRESSION, condition)
        .setChild(Slot.THEN_STATEMENT, thenStatement)
        .setChild(Slot.ELSE_STATEMENT, elseStatement);
  }

  public static Node doNode(Node body, Node condition) {
    return new Node(SyntaxKind.DO_STATEMENT)
        .setChild(Slot.STATEMENT, body)
        .setChild(Slot.EXPRESSION, condition);
  }

  public static Node whileNode(Node condition, Node body) {
    return new Node(SyntaxKind.WHILE_STATEMENT)
        .setChild(Slot.EXPRESSION, condition)
        .setChild(Slot.STATEMENT, body);
  }

  public static Node forNode(
      @Nullable Node initializer,
      @Nullable Node condition,
      @Nullable Node incrementor,
      Node body) {
    return new Node(SyntaxKind.FOR_STATEMENT)
        .setChild(Slot.INITIALIZER, initializer)
        .setChild(Slot.CONDITION, condition)
        .setChild(Slot.INCREMENTOR, incrementor)
        .setChild(Slot.STATEMENT, body);
  }

  public static Node forIn(Node initializer, Node expression, Node body) {
    return new Node(SyntaxKind.FOR_IN_STATEMENT)
        .setChild(Slot.INITIALIZER, initializer)
        .setChild(Slot.EXPRESSION, expression)
        .setChild(Slot.STATEMENT, body);
  }

  public static Node forOf(Node initializer, Node expression, Node body) {
    return new Node(SyntaxKind.FOR_OF_STATEMENT)
        .setChild(Slot.INITIALIZER, initializer)
        .setChild(Slot.EXPRESSION, expression)
        .setChild(Slot.STATEMENT, body);
  }

  public static Node breakNode(@Nullable Node label) {
    return new Node(SyntaxKind.BREAK_STATEMENT).setChild(Slot.LABEL, label);
  }

  public static Node continueNode(@Nullable Node label) {
    return new Node(SyntaxKind.CONTINUE_STATEMENT).setChild(Slot.LABEL, label);
  }

  public static Node label(Node label, Node statement) {
    return new Node(SyntaxKind.LABELED_STATEMENT)
        .setChild(Slot.LABEL, label)
        .setChild(Slot.STATEMENT, statement);
  }

  public static Node with(Node expression, Node body) {
    return new Node(SyntaxKind.WITH_STATEMENT)
        .setChild(Slot.EXPRESSION, expression)
        .setChild(Slot.STATEMENT, body);
  }

  public static Node switchNode(Node expression, Node... clauses) {
    Node caseBlock = new Node(SyntaxKind.CASE_BLOCK).setList(ListSlot.CLAUSES, clauses);
    return new Node(SyntaxKind.SWITCH_STATEMENT)
        .setChild(Slot.EXPRESSION, expression)
        .setChild(Slot.CASE_BLOCK, caseBlock);
  }

  public static Node caseNode(Node expression, Node... statements) {
    return new Node(SyntaxKind.CASE_CLAUSE)
        .setChild(Slot.EXPRESSION, expression)
        .setList(ListSlot.STATEMENTS, statements);
  }

  public static Node defaultCase(Node... statements) {
    return new Node(SyntaxKind.DEFAULT_CLAUSE).setList(ListSlot.STATEMENTS, statements);
  }

  public static Node tryCatch(Node tryBlock, Node catchClause) {
    return tryCatchFinally(tryBlock, catchClause, null);
  }

  public static Node tryCatchFinally(
      Node tryBlock, @Nullable Node catchClause, @Nullable Node finallyBlock) {
    checkState(catchClause != null || finallyBlock != null, "try without catch or finally");
    return new Node(SyntaxKind.TRY_STATEMENT)
        .setChild(Slot.TRY_BLOCK, tryBlock)
        .setChild(Slot.CATCH_CLAUSE, catchClause)
        .setChild(Slot.FINALLY_BLOCK, finallyBlock);
  }

  public static Node catchClause(Node variableDeclaration, Node block) {
    return new Node(SyntaxKind.CATCH_CLAUSE)
        .setChild(Slot.VARIABLE_DECLARATION, variableDeclaration)
        .setChild(Slot.BLOCK, block);
  }

  // Declarations

  public static Node var(Node name, @Nullable Node initializer) {
    return varStatement(NodeFlags.NONE, variableDeclaration(name, initializer));
  }

  public static Node let(Node name, @Nullable Node initializer) {
    return varStatement(NodeFlags.LET, variableDeclaration(name, initializer));
  }

  public static Node constNode(Node name, Node initializer) {
    return varStatement(NodeFlags.CONST, variableDeclaration(name, initializer));
  }

  public static Node varStatement(int flags, Node... declarations) {
    return new Node(SyntaxKind.VARIABLE_STATEMENT)
        .setChild(Slot.DECLARATION_LIST, variableDeclarationList(flags, declarations));
  }

  public static Node variableDeclarationList(int flags, Node... declarations) {
    return new Node(SyntaxKind.VARIABLE_DECLARATION_LIST)
        .setFlags(flags & NodeFlags.BLOCK_SCOPED)
        .setList(ListSlot.DECLARATIONS, declarations);
  }

  public static Node variableDeclaration(Node name, @Nullable Node initializer) {
    return new Node(SyntaxKind.VARIABLE_DECLARATION)
        .setChild(Slot.NAME, name)
        .setChild(Slot.INITIALIZER, initializer);
  }

  public static Node enumDeclaration(Node name, Node... members) {
    return new Node(SyntaxKind.ENUM_DECLARATION)
        .setChild(Slot.NAME, name)
        .setList(ListSlot.MEMBERS, members);
  }

  public static Node enumMember(Node name, @Nullable Node initializer) {
    return new Node(SyntaxKind.ENUM_MEMBER)
        .setChild(Slot.NAME, name)
        .setChild(Slot.INITIALIZER, initializer);
  }

  /** A {@code namespace} declaration; {@code body} is a module block or a nested declaration. */
  public static Node namespace(Node name, Node body) {
    checkState(
        body.isKind(SyntaxKind.MODULE_BLOCK) || body.isKind(SyntaxKind.MODULE_DECLARATION), body);
    return new Node(SyntaxKind.MODULE_DECLARATION)
        .setFlags(NodeFlags.NAMESPACE)
        .setChild(Slot.NAME, name)
        .setChild(Slot.BODY, body);
  }

  public static Node moduleBlock(Node... statements) {
    return new Node(SyntaxKind.MODULE_BLOCK).setList(ListSlot.STATEMENTS, statements);
  }

  public static Node importDeclaration(@Nullable Node importClause, Node moduleSpecifier) {
    return new Node(SyntaxKind.IMPORT_DECLARATION)
        .setChild(Slot.IMPORT_CLAUSE, importClause)
        .setChild(Slot.MODULE_SPECIFIER, moduleSpecifier);
  }

  public static Node importClause(@Nullable Node name, @Nullable Node namedBindings) {
    return new Node(SyntaxKind.IMPORT_CLAUSE)
        .setChild(Slot.NAME, name)
        .setChild(Slot.NAMED_BINDINGS, namedBindings);
  }

  public static Node namespaceImport(Node name) {
    return new Node(SyntaxKind.NAMESPACE_IMPORT).setChild(Slot.NAME, name);
  }

  public static Node namedImports(Node... specifiers) {
    return new Node(SyntaxKind.NAMED_IMPORTS).setList(ListSlot.ELEMENTS, specifiers);
  }

  public static Node importSpecifier(@Nullable Node propertyName, Node name) {
    return new Node(SyntaxKind.IMPORT_SPECIFIER)
        .setChild(Slot.PROPERTY_NAME, propertyName)
        .setChild(Slot.NAME, name);
  }

  public static Node exportDeclaration(
      @Nullable Node exportClause, @Nullable Node moduleSpecifier) {
    return new Node(SyntaxKind.EXPORT_DECLARATION)
        .setChild(Slot.EXPORT_CLAUSE, exportClause)
        .setChild(Slot.MODULE_SPECIFIER, moduleSpecifier);
  }

  public static Node namedExports(Node... specifiers) {
    return new Node(SyntaxKind.NAMED_EXPORTS).setList(ListSlot.ELEMENTS, specifiers);
  }

  public static Node exportSpecifier(@Nullable Node propertyName, Node name) {
    return new Node(SyntaxKind.EXPORT_SPECIFIER)
        .setChild(Slot.PROPERTY_NAME, propertyName)
        .setChild(Slot.NAME, name);
  }

  public static Node exportAssignment(Node expression, boolean isExportEquals) {
    return new Node(SyntaxKind.EXPORT_ASSIGNMENT)
        .setChild(Slot.EXPRESSION, expression)
        .putBooleanProp(Prop.EXPORT_EQUALS, isExportEquals);
  }

  public static Node importEquals(Node name, Node moduleReference) {
    return new Node(SyntaxKind.IMPORT_EQUALS_DECLARATION)
        .setChild(Slot.NAME, name)
        .setChild(Slot.MODULE_REFERENCE, moduleReference);
  }

  public static Node externalModuleReference(Node expression) {
    return new Node(SyntaxKind.EXTERNAL_MODULE_REFERENCE).setChild(Slot.EXPRESSION, expression);
  }

  public static Node notEmittedStatement(Node original) {
    return new Node(SyntaxKind.NOT_EMITTED_STATEMENT).setOriginal(original);
  }

  // Types

  public static Node typeReference(Node typeName, Node... typeArguments) {
    return new Node(SyntaxKind.TYPE_REFERENCE)
        .setChild(Slot.TYPE_NAME, typeName)
        .setList(
            ListSlot.TYPE_ARGUMENTS,
            typeArguments.length == 0 ? null : NodeList.of(typeArguments));
  }

  public static Node unionType(Node... types) {
    return new Node(SyntaxKind.UNION_TYPE).setList(ListSlot.TYPES, types);
  }

  public static Node intersectionType(Node... types) {
    return new Node(SyntaxKind.INTERSECTION_TYPE).setList(ListSlot.TYPES, types);
  }

  public static Node arrayType(Node elementType) {
    return new Node(SyntaxKind.ARRAY_TYPE).setChild(Slot.ELEMENT_TYPE, elementType);
  }

  public static Node tupleType(Node... elementTypes) {
    return new Node(SyntaxKind.TUPLE_TYPE).setList(ListSlot.TYPES, elementTypes);
  }

  public static Node typeParameter(Node name, @Nullable Node constraint) {
    return new Node(SyntaxKind.TYPE_PARAMETER)
        .setChild(Slot.NAME, name)
        .setChild(Slot.CONSTRAINT, constraint);
  }

  // Files

  /** Creates a synthesized source file holding {@code statements}. */
  public static SourceFile script(String fileName, Node... statements) {
    SourceFile file = new SourceFile(fileName, "");
    file.setList(ListSlot.STATEMENTS, statements);
    file.setChild(Slot.END_OF_FILE_TOKEN, new Node(SyntaxKind.END_OF_FILE_TOKEN));
    return file;
  }

  static boolean mayBeStatement(Node n) {
    switch (n.getKind()) {
      case BLOCK:
      case VARIABLE_STATEMENT:
      case EMPTY_STATEMENT:
      case EXPRESSION_STATEMENT:
      case IF_STATEMENT:
      case DO_STATEMENT:
      case WHILE_STATEMENT:
      case FOR_STATEMENT:
      case FOR_IN_STATEMENT:
      case FOR_OF_STATEMENT:
      case CONTINUE_STATEMENT:
      case BREAK_STATEMENT:
      case RETURN_STATEMENT:
      case WITH_STATEMENT:
      case SWITCH_STATEMENT:
      case LABELED_STATEMENT:
      case THROW_STATEMENT:
      case TRY_STATEMENT:
      case DEBUGGER_STATEMENT:
      case FUNCTION_DECLARATION:
      case CLASS_DECLARATION:
      case INTERFACE_DECLARATION:
      case TYPE_ALIAS_DECLARATION:
      case ENUM_DECLARATION:
      case MODULE_DECLARATION:
      case IMPORT_EQUALS_DECLARATION:
      case IMPORT_DECLARATION:
      case EXPORT_ASSIGNMENT:
      case EXPORT_DECLARATION:
      case MISSING_DECLARATION:
      case NOT_EMITTED_STATEMENT:
        return true;
      default:
        return false;
    }
  }

  static boolean mayBeExpression(Node n) {
    return n.getKind().isExpression();
  }
}
