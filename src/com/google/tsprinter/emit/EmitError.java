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

import static java.util.Objects.requireNonNull;

import org.jspecify.annotations.Nullable;

/**
 * An error raised while writing emit output.
 *
 * @param type the type of the error
 * @param description the formatted message
 * @param sourceName the output file the error concerns, if any
 * @param level the level the error is reported at
 */
public record EmitError(
    DiagnosticType type, String description, @Nullable String sourceName, CheckLevel level) {
  public EmitError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(level, "level");
  }

  /** Creates an error with no file information. */
  public static EmitError make(DiagnosticType type, Object... arguments) {
    return new EmitError(type, type.format(arguments), null, type.level);
  }

  /** Creates an error concerning {@code sourceName}. */
  public static EmitError make(String sourceName, DiagnosticType type, Object... arguments) {
    return new EmitError(type, type.format(arguments), sourceName, type.level);
  }

  /** Returns the error as a single line of text, prefixed by its file when known. */
  public String format() {
    StringBuilder sb = new StringBuilder();
    if (sourceName != null) {
      sb.append(sourceName).append(": ");
    }
    sb.append(level == CheckLevel.ERROR ? "ERROR" : "WARNING")
        .append(" - [")
        .append(type.key)
        .append("] ")
        .append(description);
    return sb.toString();
  }
}
