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

import com.google.tsprinter.ast.Node;
import org.jspecify.annotations.Nullable;

/** Answers the semantic questions the printer cannot answer from the tree alone. */
public interface EmitResolver {

  /**
   * Returns the compile time value of a property or element access on an enum, or null when the
   * access has no constant value.
   */
  @Nullable Double getConstantValue(Node node);

  /** Whether a global declaration of {@code name} is visible to the program. */
  boolean hasGlobalName(String name);

  /** Knows no constants and no globals. */
  EmitResolver EMPTY =
      new EmitResolver() {
        @Override
        public @Nullable Double getConstantValue(Node node) {
          return null;
        }

        @Override
        public boolean hasGlobalName(String name) {
          return false;
        }
      };
}
