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

/** How the text of a generated identifier is chosen when it is printed. */
public enum GeneratedNameKind {
  /** The next free name in the sequence {@code _a, _b, ..., _z, _0, _1, ...}. */
  AUTO,
  /** {@code _i}, then {@code _n}, then the {@link #AUTO} sequence. */
  LOOP,
  /** The identifier text plus a numeric suffix. */
  UNIQUE,
  /** A name derived from the node the identifier was created for. */
  NODE
}
