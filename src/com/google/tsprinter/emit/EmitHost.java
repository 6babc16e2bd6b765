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

import java.io.IOException;

/** Where printed output goes. */
public interface EmitHost {

  /** The line terminator used in the output. */
  String getNewLine();

  /** Whether output to {@code path} must not be written, for example because it is an input. */
  boolean isEmitBlocked(String path);

  void writeFile(String path, String text, boolean writeByteOrderMark) throws IOException;
}
