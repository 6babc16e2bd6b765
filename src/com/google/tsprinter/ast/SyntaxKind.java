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

import org.jspecify.annotations.Nullable;

/**
 * The kinds of syntax nodes and tokens the printer understands.
 *
 * <p>Token kinds carry the text they print as. Node kinds have no fixed text.
 */
public enum SyntaxKind {
  // Punctuation
  OPEN_BRACE_TOKEN("{"),
  CLOSE_BRACE_TOKEN("}"),
  OPEN_PAREN_TOKEN("("),
  CLOSE_PAREN_TOKEN(")"),
  OPEN_BRACKET_TOKEN("["),
  CLOSE_BRACKET_TOKEN("]"),
  DOT_TOKEN("."),
  DOT_DOT_DOT_TOKEN("..."),
  SEMICOLON_TOKEN(";"),
  COMMA_TOKEN(","),
  LESS_THAN_TOKEN("<"),
  GREATER_THAN_TOKEN(">"),
  LESS_THAN_EQUALS_TOKEN("<="),
  GREATER_THAN_EQUALS_TOKEN(">="),
  EQUALS_EQUALS_TOKEN("=="),
  EXCLAMATION_EQUALS_TOKEN("!="),
  EQUALS_EQUALS_EQUALS_TOKEN("==="),
  EXCLAMATION_EQUALS_EQUALS_TOKEN("!=="),
  EQUALS_GREATER_THAN_TOKEN("=>"),
  PLUS_TOKEN("+"),
  MINUS_TOKEN("-"),
  ASTERISK_TOKEN("*"),
  ASTERISK_ASTERISK_TOKEN("**"),
  SLASH_TOKEN("/"),
  PERCENT_TOKEN("%"),
  PLUS_PLUS_TOKEN("++"),
  MINUS_MINUS_TOKEN("--"),
  LESS_THAN_LESS_THAN_TOKEN("<<"),
  GREATER_THAN_GREATER_THAN_TOKEN(">>"),
  GREATER_THAN_GREATER_THAN_GREATER_THAN_TOKEN(">>>"),
  AMPERSAND_TOKEN("&"),
  BAR_TOKEN("|"),
  CARET_TOKEN("^"),
  EXCLAMATION_TOKEN("!"),
  TILDE_TOKEN("~"),
  AMPERSAND_AMPERSAND_TOKEN("&&"),
  BAR_BAR_TOKEN("||"),
  QUESTION_TOKEN("?"),
  COLON_TOKEN(":"),
  AT_TOKEN("@"),
  EQUALS_TOKEN("="),
  PLUS_EQUALS_TOKEN("+="),
  MINUS_EQUALS_TOKEN("-="),
  ASTERISK_EQUALS_TOKEN("*="),
  ASTERISK_ASTERISK_EQUALS_TOKEN("**="),
  SLASH_EQUALS_TOKEN("/="),
  PERCENT_EQUALS_TOKEN("%="),
  LESS_THAN_LESS_THAN_EQUALS_TOKEN("<<="),
  GREATER_THAN_GREATER_THAN_EQUALS_TOKEN(">>="),
  GREATER_THAN_GREATER_THAN_GREATER_THAN_EQUALS_TOKEN(">>>="),
  AMPERSAND_EQUALS_TOKEN("&="),
  BAR_EQUALS_TOKEN("|="),
  CARET_EQUALS_TOKEN("^="),

  // Reserved words
  CONST_KEYWORD("const"),
  DEFAULT_KEYWORD("default"),
  EXPORT_KEYWORD("export"),
  EXTENDS_KEYWORD("extends"),
  FALSE_KEYWORD("false"),
  IN_KEYWORD("in"),
  INSTANCEOF_KEYWORD("instanceof"),
  NULL_KEYWORD("null"),
  SUPER_KEYWORD("super"),
  THIS_KEYWORD("this"),
  TRUE_KEYWORD("true"),
  VOID_KEYWORD("void"),

  // Strict mode reserved words
  IMPLEMENTS_KEYWORD("implements"),
  PRIVATE_KEYWORD("private"),
  PROTECTED_KEYWORD("protected"),
  PUBLIC_KEYWORD("public"),
  STATIC_KEYWORD("static"),

  // Contextual keywords
  ABSTRACT_KEYWORD("abstract"),
  ANY_KEYWORD("any"),
  ASYNC_KEYWORD("async"),
  BOOLEAN_KEYWORD("boolean"),
  DECLARE_KEYWORD("declare"),
  NUMBER_KEYWORD("number"),
  READONLY_KEYWORD("readonly"),
  STRING_KEYWORD("string"),
  SYMBOL_KEYWORD("symbol"),
  GLOBAL_KEYWORD("global"),

  // Literals
  NUMERIC_LITERAL,
  STRING_LITERAL,
  REGULAR_EXPRESSION_LITERAL,
  NO_SUBSTITUTION_TEMPLATE_LITERAL,

  // Pseudo-literals
  TEMPLATE_HEAD,
  TEMPLATE_MIDDLE,
  TEMPLATE_TAIL,

  IDENTIFIER,

  // Names
  QUALIFIED_NAME,
  COMPUTED_PROPERTY_NAME,

  // Signature elements
  TYPE_PARAMETER,
  PARAMETER,
  DECORATOR,

  // Type members
  PROPERTY_SIGNATURE,
  PROPERTY_DECLARATION,
  METHOD_SIGNATURE,
  METHOD_DECLARATION,
  CONSTRUCTOR,
  GET_ACCESSOR,
  SET_ACCESSOR,
  CALL_SIGNATURE,
  CONSTRUCT_SIGNATURE,
  INDEX_SIGNATURE,

  // Types
  TYPE_PREDICATE,
  TYPE_REFERENCE,
  FUNCTION_TYPE,
  CONSTRUCTOR_TYPE,
  TYPE_QUERY,
  TYPE_LITERAL,
  ARRAY_TYPE,
  TUPLE_TYPE,
  UNION_TYPE,
  INTERSECTION_TYPE,
  PARENTHESIZED_TYPE,
  THIS_TYPE,
  STRING_LITERAL_TYPE,

  // Binding patterns
  OBJECT_BINDING_PATTERN,
  ARRAY_BINDING_PATTERN,
  BINDING_ELEMENT,

  // Expressions
  ARRAY_LITERAL_EXPRESSION,
  OBJECT_LITERAL_EXPRESSION,
  PROPERTY_ACCESS_EXPRESSION,
  ELEMENT_ACCESS_EXPRESSION,
  CALL_EXPRESSION,
  NEW_EXPRESSION,
  TAGGED_TEMPLATE_EXPRESSION,
  TYPE_ASSERTION_EXPRESSION,
  PARENTHESIZED_EXPRESSION,
  FUNCTION_EXPRESSION,
  ARROW_FUNCTION,
  DELETE_EXPRESSION,
  TYPE_OF_EXPRESSION,
  VOID_EXPRESSION,
  AWAIT_EXPRESSION,
  PREFIX_UNARY_EXPRESSION,
  POSTFIX_UNARY_EXPRESSION,
  BINARY_EXPRESSION,
  CONDITIONAL_EXPRESSION,
  TEMPLATE_EXPRESSION,
  YIELD_EXPRESSION,
  SPREAD_ELEMENT_EXPRESSION,
  CLASS_EXPRESSION,
  OMITTED_EXPRESSION,
  EXPRESSION_WITH_TYPE_ARGUMENTS,
  AS_EXPRESSION,

  // Misc
  TEMPLATE_SPAN,
  SEMICOLON_CLASS_ELEMENT,

  // Statements
  BLOCK,
  VARIABLE_STATEMENT,
  EMPTY_STATEMENT,
  EXPRESSION_STATEMENT,
  IF_STATEMENT,
  DO_STATEMENT,
  WHILE_STATEMENT,
  FOR_STATEMENT,
  FOR_IN_STATEMENT,
  FOR_OF_STATEMENT,
  CONTINUE_STATEMENT,
  BREAK_STATEMENT,
  RETURN_STATEMENT,
  WITH_STATEMENT,
  SWITCH_STATEMENT,
  LABELED_STATEMENT,
  THROW_STATEMENT,
  TRY_STATEMENT,
  DEBUGGER_STATEMENT,

  // Declarations
  VARIABLE_DECLARATION,
  VARIABLE_DECLARATION_LIST,
  FUNCTION_DECLARATION,
  CLASS_DECLARATION,
  INTERFACE_DECLARATION,
  TYPE_ALIAS_DECLARATION,
  ENUM_DECLARATION,
  MODULE_DECLARATION,
  MODULE_BLOCK,
  CASE_BLOCK,
  IMPORT_EQUALS_DECLARATION,
  IMPORT_DECLARATION,
  IMPORT_CLAUSE,
  NAMESPACE_IMPORT,
  NAMED_IMPORTS,
  IMPORT_SPECIFIER,
  EXPORT_ASSIGNMENT,
  EXPORT_DECLARATION,
  NAMED_EXPORTS,
  EXPORT_SPECIFIER,
  MISSING_DECLARATION,

  // Module references
  EXTERNAL_MODULE_REFERENCE,

  // JSX
  JSX_ELEMENT,
  JSX_SELF_CLOSING_ELEMENT,
  JSX_OPENING_ELEMENT,
  JSX_CLOSING_ELEMENT,
  JSX_TEXT,
  JSX_ATTRIBUTE,
  JSX_SPREAD_ATTRIBUTE,
  JSX_EXPRESSION,

  // Clauses
  CASE_CLAUSE,
  DEFAULT_CLAUSE,
  HERITAGE_CLAUSE,
  CATCH_CLAUSE,

  // Property assignments
  PROPERTY_ASSIGNMENT,
  SHORTHAND_PROPERTY_ASSIGNMENT,

  // Enum
  ENUM_MEMBER,

  // Top-level nodes
  SOURCE_FILE,
  END_OF_FILE_TOKEN,

  // JSDoc nodes, never printed
  JSDOC_COMMENT,

  // Transformation nodes
  NOT_EMITTED_STATEMENT,
  PARTIALLY_EMITTED_EXPRESSION;

  private final @Nullable String text;

  SyntaxKind() {
    this(null);
  }

  SyntaxKind(@Nullable String text) {
    this.text = text;
  }

  /** Returns the text of a token kind, or null for node kinds. */
  public @Nullable String getText() {
    return text;
  }

  public boolean isToken() {
    return text != null;
  }

  public boolean isKeyword() {
    return text != null && Character.isLetter(text.charAt(0));
  }

  public boolean isLiteral() {
    return compareTo(NUMERIC_LITERAL) >= 0 && compareTo(NO_SUBSTITUTION_TEMPLATE_LITERAL) <= 0;
  }

  public boolean isTemplateLiteral() {
    return this == NO_SUBSTITUTION_TEMPLATE_LITERAL
        || this == TEMPLATE_HEAD
        || this == TEMPLATE_MIDDLE
        || this == TEMPLATE_TAIL;
  }

  public boolean isModifier() {
    switch (this) {
      case ABSTRACT_KEYWORD:
      case ASYNC_KEYWORD:
      case CONST_KEYWORD:
      case DECLARE_KEYWORD:
      case DEFAULT_KEYWORD:
      case EXPORT_KEYWORD:
      case PUBLIC_KEYWORD:
      case PRIVATE_KEYWORD:
      case PROTECTED_KEYWORD:
      case READONLY_KEYWORD:
      case STATIC_KEYWORD:
        return true;
      default:
        return false;
    }
  }

  /**
   * Whether nodes of this kind are expressions and may be printed through the expression entry
   * point of the code generator.
   */
  public boolean isExpression() {
    switch (this) {
      case NUMERIC_LITERAL:
      case STRING_LITERAL:
      case REGULAR_EXPRESSION_LITERAL:
      case NO_SUBSTITUTION_TEMPLATE_LITERAL:
      case IDENTIFIER:
      case FALSE_KEYWORD:
      case NULL_KEYWORD:
      case SUPER_KEYWORD:
      case TRUE_KEYWORD:
      case THIS_KEYWORD:
      case ARRAY_LITERAL_EXPRESSION:
      case OBJECT_LITERAL_EXPRESSION:
      case PROPERTY_ACCESS_EXPRESSION:
      case ELEMENT_ACCESS_EXPRESSION:
      case CALL_EXPRESSION:
      case NEW_EXPRESSION:
      case TAGGED_TEMPLATE_EXPRESSION:
      case TYPE_ASSERTION_EXPRESSION:
      case PARENTHESIZED_EXPRESSION:
      case FUNCTION_EXPRESSION:
      case ARROW_FUNCTION:
      case DELETE_EXPRESSION:
      case TYPE_OF_EXPRESSION:
      case VOID_EXPRESSION:
      case AWAIT_EXPRESSION:
      case PREFIX_UNARY_EXPRESSION:
      case POSTFIX_UNARY_EXPRESSION:
      case BINARY_EXPRESSION:
      case CONDITIONAL_EXPRESSION:
      case TEMPLATE_EXPRESSION:
      case YIELD_EXPRESSION:
      case SPREAD_ELEMENT_EXPRESSION:
      case CLASS_EXPRESSION:
      case OMITTED_EXPRESSION:
      case AS_EXPRESSION:
      case JSX_ELEMENT:
      case JSX_SELF_CLOSING_ELEMENT:
      case PARTIALLY_EMITTED_EXPRESSION:
        return true;
      default:
        return false;
    }
  }
}
