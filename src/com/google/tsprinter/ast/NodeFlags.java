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

/**
 * Structural flags set upstream on nodes. Declaration lists record {@link #LET} and {@link
 * #CONST}, module declarations record {@link #NAMESPACE}, and source files record which runtime
 * helpers their transformed code depends on.
 */
public final class NodeFlags {
  public static final int NONE = 0;
  public static final int LET = 1 << 0;
  public static final int CONST = 1 << 1;
  public static final int NAMESPACE = 1 << 2;

  public static final int HAS_CLASS_EXTENDS = 1 << 3;
  public static final int HAS_DECORATORS = 1 << 4;
  public static final int HAS_PARAM_DECORATORS = 1 << 5;
  public static final int HAS_ASYNC_FUNCTIONS = 1 << 6;

  public static final int BLOCK_SCOPED = LET | CONST;
  public static final int EMIT_HELPER_FLAGS =
      HAS_CLASS_EXTENDS | HAS_DECORATORS | HAS_PARAM_DECORATORS | HAS_ASYNC_FUNCTIONS;

  private NodeFlags() {}
}
