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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** The outcome of {@link CodePrinter#printFiles}. */
public final class EmitResult {
  private final boolean emitSkipped;
  private final ImmutableList<EmitError> diagnostics;
  private final ImmutableList<SourceMapData> sourceMaps;

  EmitResult(boolean emitSkipped, List<EmitError> diagnostics, List<SourceMapData> sourceMaps) {
    this.emitSkipped = emitSkipped;
    this.diagnostics = ImmutableList.copyOf(diagnostics);
    this.sourceMaps = ImmutableList.copyOf(sourceMaps);
  }

  /** Whether at least one output file was not printed, because of noEmit or a blocked path. */
  public boolean isEmitSkipped() {
    return emitSkipped;
  }

  public ImmutableList<EmitError> getDiagnostics() {
    return diagnostics;
  }

  /** The source maps of the printed files, or nothing when source maps are off. */
  public ImmutableList<SourceMapData> getSourceMaps() {
    return sourceMaps;
  }
}
