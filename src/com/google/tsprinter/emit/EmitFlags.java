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
 * Per-node directives that transformations attach to the tree out of band, through a {@link
 * TransformContext}.
 */
public final class EmitFlags {

  private EmitFlags() {}

  public static final int NONE = 0;
  /** Prints a block on one line. */
  public static final int SINGLE_LINE = 1 << 0;
  /** Indents the node's body one extra level. */
  public static final int INDENTED = 1 << 1;
  /** Writes the runtime helpers the current source file asks for. */
  public static final int EMIT_EMIT_HELPERS = 1 << 2;
  /** Writes the {@code __export} helper. */
  public static final int EMIT_EXPORT_STAR = 1 << 3;
  /** Writes the {@code _super} accessor helper. */
  public static final int EMIT_SUPER_HELPER = 1 << 4;
  /** Writes the {@code _super} accessor helper that supports assignment. */
  public static final int EMIT_ADVANCED_SUPER_HELPER = 1 << 5;
  /** Writes the UMD wrapper in place of the identifier. */
  public static final int UMD_DEFINE = 1 << 6;
  /** The node and its substitutes are never substituted again. */
  public static final int NO_SUBSTITUTION = 1 << 7;
  /** The body does not open a lexical environment. */
  public static final int NO_LEXICAL_ENVIRONMENT = 1 << 8;
  public static final int NO_COMMENTS = 1 << 9;
  /** No source map marks for the node itself. */
  public static final int NO_SOURCE_MAP = 1 << 10;
  /** No source map marks for anything inside the node. */
  public static final int NO_NESTED_SOURCE_MAPS = 1 << 11;
}
