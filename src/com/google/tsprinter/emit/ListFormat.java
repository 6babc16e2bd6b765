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

/**
 * Bit flags that describe how a list of sibling nodes is printed: its line layout, delimiter,
 * whitespace, brackets, and when it may be left out. The named presets combine them for each
 * kind of list the printer writes.
 */
public final class ListFormat {

  private ListFormat() {}

  public static final int NONE = 0;

  // Line separators
  /** Prints the list on a single line. This is the default. */
  public static final int SINGLE_LINE = 0;
  /** Prints the list on multiple lines. */
  public static final int MULTI_LINE = 1 << 0;
  /** Prints the list using the line breaks of the source where possible. */
  public static final int PRESERVE_LINES = 1 << 1;
  public static final int LINES_MASK = SINGLE_LINE | MULTI_LINE | PRESERVE_LINES;

  // Delimiters
  public static final int NOT_DELIMITED = 0;
  /** Each item is followed by " |". */
  public static final int BAR_DELIMITED = 1 << 2;
  /** Each item is followed by " &". */
  public static final int AMPERSAND_DELIMITED = 1 << 3;
  /** Each item is followed by ",". */
  public static final int COMMA_DELIMITED = 1 << 4;
  public static final int DELIMITERS_MASK = BAR_DELIMITED | AMPERSAND_DELIMITED | COMMA_DELIMITED;

  /** Writes a trailing comma if the list had one. */
  public static final int ALLOW_TRAILING_COMMA = 1 << 5;

  // Whitespace
  public static final int INDENTED = 1 << 6;
  /** A space after the opening bracket and before the closing one. */
  public static final int SPACE_BETWEEN_BRACES = 1 << 7;
  public static final int SPACE_BETWEEN_SIBLINGS = 1 << 8;

  // Brackets
  public static final int BRACES = 1 << 9;
  public static final int PARENTHESIS = 1 << 10;
  public static final int ANGLE_BRACKETS = 1 << 11;
  public static final int SQUARE_BRACKETS = 1 << 12;
  public static final int BRACKETS_MASK = BRACES | PARENTHESIS | ANGLE_BRACKETS | SQUARE_BRACKETS;

  /** Writes nothing, brackets included, when the list is absent. */
  public static final int OPTIONAL_IF_UNDEFINED = 1 << 13;
  /** Writes nothing, brackets included, when the list is absent or empty. */
  public static final int OPTIONAL_IF_EMPTY = 1 << 14;
  public static final int OPTIONAL = OPTIONAL_IF_UNDEFINED | OPTIONAL_IF_EMPTY;

  // Other
  /** Breaks lines around synthesized items that express no preference. */
  public static final int PREFER_NEW_LINE = 1 << 15;
  /** Leaves out the closing line break of a multi-line list. */
  public static final int NO_TRAILING_NEW_LINE = 1 << 16;

  // Presets
  public static final int MODIFIERS = SINGLE_LINE | SPACE_BETWEEN_SIBLINGS;
  public static final int HERITAGE_CLAUSES = SINGLE_LINE | SPACE_BETWEEN_SIBLINGS;
  public static final int TYPE_LITERAL_MEMBERS = MULTI_LINE | INDENTED;
  public static final int TUPLE_TYPE_ELEMENTS =
      COMMA_DELIMITED | SPACE_BETWEEN_SIBLINGS | SINGLE_LINE | INDENTED;
  public static final int UNION_TYPE_CONSTITUENTS =
      BAR_DELIMITED | SPACE_BETWEEN_SIBLINGS | SINGLE_LINE;
  public static final int INTERSECTION_TYPE_CONSTITUENTS =
      AMPERSAND_DELIMITED | SPACE_BETWEEN_SIBLINGS | SINGLE_LINE;
  public static final int OBJECT_BINDING_PATTERN_ELEMENTS =
      SINGLE_LINE
          | ALLOW_TRAILING_COMMA
          | SPACE_BETWEEN_BRACES
          | COMMA_DELIMITED
          | SPACE_BETWEEN_SIBLINGS;
  public static final int ARRAY_BINDING_PATTERN_ELEMENTS =
      SINGLE_LINE | ALLOW_TRAILING_COMMA | COMMA_DELIMITED | SPACE_BETWEEN_SIBLINGS;
  public static final int OBJECT_LITERAL_EXPRESSION_PROPERTIES =
      PRESERVE_LINES
          | COMMA_DELIMITED
          | SPACE_BETWEEN_SIBLINGS
          | SPACE_BETWEEN_BRACES
          | INDENTED
          | BRACES;
  public static final int ARRAY_LITERAL_EXPRESSION_ELEMENTS =
      PRESERVE_LINES
          | COMMA_DELIMITED
          | SPACE_BETWEEN_SIBLINGS
          | ALLOW_TRAILING_COMMA
          | INDENTED
          | SQUARE_BRACKETS;
  public static final int CALL_EXPRESSION_ARGUMENTS =
      COMMA_DELIMITED | SPACE_BETWEEN_SIBLINGS | SINGLE_LINE | PARENTHESIS;
  public static final int NEW_EXPRESSION_ARGUMENTS =
      COMMA_DELIMITED | SPACE_BETWEEN_SIBLINGS | SINGLE_LINE | PARENTHESIS | OPTIONAL_IF_UNDEFINED;
  public static final int TEMPLATE_EXPRESSION_SPANS = SINGLE_LINE;
  public static final int SINGLE_LINE_BLOCK_STATEMENTS =
      SPACE_BETWEEN_BRACES | SPACE_BETWEEN_SIBLINGS | SINGLE_LINE;
  public static final int MULTI_LINE_BLOCK_STATEMENTS = INDENTED | MULTI_LINE;
  public static final int VARIABLE_DECLARATION_LIST =
      COMMA_DELIMITED | SPACE_BETWEEN_SIBLINGS | SINGLE_LINE;
  public static final int SINGLE_LINE_FUNCTION_BODY_STATEMENTS =
      SINGLE_LINE | SPACE_BETWEEN_SIBLINGS | SPACE_BETWEEN_BRACES;
  public static final int MULTI_LINE_FUNCTION_BODY_STATEMENTS = MULTI_LINE;
  public static final int CLASS_HERITAGE_CLAUSES = SINGLE_LINE | SPACE_BETWEEN_SIBLINGS;
  public static final int CLASS_MEMBERS = INDENTED | MULTI_LINE;
  public static final int INTERFACE_MEMBERS = INDENTED | MULTI_LINE;
  public static final int ENUM_MEMBERS = COMMA_DELIMITED | INDENTED | MULTI_LINE;
  public static final int CASE_BLOCK_CLAUSES = INDENTED | MULTI_LINE;
  public static final int NAMED_IMPORTS_OR_EXPORTS_ELEMENTS =
      COMMA_DELIMITED
          | SPACE_BETWEEN_SIBLINGS
          | ALLOW_TRAILING_COMMA
          | SINGLE_LINE
          | SPACE_BETWEEN_BRACES;
  public static final int JSX_ELEMENT_CHILDREN = SINGLE_LINE;
  public static final int JSX_ELEMENT_ATTRIBUTES = SINGLE_LINE | SPACE_BETWEEN_SIBLINGS;
  public static final int CASE_OR_DEFAULT_CLAUSE_STATEMENTS =
      INDENTED | MULTI_LINE | NO_TRAILING_NEW_LINE | OPTIONAL_IF_EMPTY;
  public static final int HERITAGE_CLAUSE_TYPES =
      COMMA_DELIMITED | SPACE_BETWEEN_SIBLINGS | SINGLE_LINE;
  public static final int SOURCE_FILE_STATEMENTS = MULTI_LINE | NO_TRAILING_NEW_LINE;
  public static final int DECORATORS = MULTI_LINE | OPTIONAL;
  public static final int TYPE_ARGUMENTS =
      COMMA_DELIMITED | SPACE_BETWEEN_SIBLINGS | SINGLE_LINE | INDENTED | ANGLE_BRACKETS | OPTIONAL;
  public static final int TYPE_PARAMETERS =
      COMMA_DELIMITED | SPACE_BETWEEN_SIBLINGS | SINGLE_LINE | INDENTED | ANGLE_BRACKETS | OPTIONAL;
  public static final int PARAMETERS =
      COMMA_DELIMITED | SPACE_BETWEEN_SIBLINGS | SINGLE_LINE | INDENTED | PARENTHESIS;
  public static final int INDEX_SIGNATURE_PARAMETERS =
      COMMA_DELIMITED | SPACE_BETWEEN_SIBLINGS | SINGLE_LINE | INDENTED | SQUARE_BRACKETS;

  /** Returns the text written between two items of a list with this format. */
  public static String getDelimiter(int format) {
    switch (format & DELIMITERS_MASK) {
      case COMMA_DELIMITED:
        return ",";
      case BAR_DELIMITED:
        return " |";
      case AMPERSAND_DELIMITED:
        return " &";
      default:
        return "";
    }
  }

  public static String getOpeningBracket(int format) {
    switch (format & BRACKETS_MASK) {
      case BRACES:
        return "{";
      case PARENTHESIS:
        return "(";
      case ANGLE_BRACKETS:
        return "<";
      case SQUARE_BRACKETS:
        return "[";
      default:
        throw new IllegalArgumentException("No single bracket kind in format " + format);
    }
  }

  public static String getClosingBracket(int format) {
    switch (format & BRACKETS_MASK) {
      case BRACES:
        return "}";
      case PARENTHESIS:
        return ")";
      case ANGLE_BRACKETS:
        return ">";
      case SQUARE_BRACKETS:
        return "]";
      default:
        throw new IllegalArgumentException("No single bracket kind in format " + format);
    }
  }

  static boolean has(int format, int flag) {
    return (format & flag) != 0;
  }
}
