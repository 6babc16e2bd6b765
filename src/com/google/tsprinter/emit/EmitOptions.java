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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import org.jspecify.annotations.Nullable;

/** Options that control how syntax trees are printed and where the output goes. */
public class EmitOptions {

  /** The language level of the output. */
  public enum ScriptTarget {
    ES3,
    ES5,
    ES6;

    public boolean isBelow(ScriptTarget other) {
      return compareTo(other) < 0;
    }
  }

  /** The module system the output was transformed for. */
  public enum ModuleKind {
    NONE,
    COMMONJS,
    AMD,
    UMD,
    SYSTEM,
    ES6
  }

  /** The line terminator written between output lines. */
  public enum NewLineKind {
    CRLF("\r\n"),
    LF("\n");

    private final String text;

    NewLineKind(String text) {
      this.text = text;
    }

    public String getText() {
      return text;
    }
  }

  private ScriptTarget target = ScriptTarget.ES3;
  private ModuleKind module = ModuleKind.NONE;
  private boolean removeComments;
  private boolean isolatedModules;
  private boolean noEmitHelpers;
  private boolean emitDecoratorMetadata;
  private boolean sourceMap;
  private boolean inlineSourceMap;
  private boolean inlineSources;
  private @Nullable String sourceRoot;
  private @Nullable String mapRoot;
  private @Nullable String outFile;
  private NewLineKind newLine = NewLineKind.LF;
  private boolean emitBOM;
  private boolean noEmit;
  private HelperTemplates helperTemplates = new ResourceHelperTemplates();

  public ScriptTarget getTarget() {
    return target;
  }

  public void setTarget(ScriptTarget target) {
    this.target = checkNotNull(target);
  }

  public ModuleKind getModule() {
    return module;
  }

  public void setModule(ModuleKind module) {
    this.module = checkNotNull(module);
  }

  public boolean getRemoveComments() {
    return removeComments;
  }

  /** Drops every comment except {@code /*!} comments at the top of a body. */
  public void setRemoveComments(boolean removeComments) {
    this.removeComments = removeComments;
  }

  public boolean isIsolatedModules() {
    return isolatedModules;
  }

  /** Disables constant folding of member accesses, which needs whole-program knowledge. */
  public void setIsolatedModules(boolean isolatedModules) {
    this.isolatedModules = isolatedModules;
  }

  public boolean getNoEmitHelpers() {
    return noEmitHelpers;
  }

  public void setNoEmitHelpers(boolean noEmitHelpers) {
    this.noEmitHelpers = noEmitHelpers;
  }

  public boolean getEmitDecoratorMetadata() {
    return emitDecoratorMetadata;
  }

  public void setEmitDecoratorMetadata(boolean emitDecoratorMetadata) {
    this.emitDecoratorMetadata = emitDecoratorMetadata;
  }

  public boolean getSourceMap() {
    return sourceMap;
  }

  public void setSourceMap(boolean sourceMap) {
    this.sourceMap = sourceMap;
  }

  public boolean getInlineSourceMap() {
    return inlineSourceMap;
  }

  public void setInlineSourceMap(boolean inlineSourceMap) {
    this.inlineSourceMap = inlineSourceMap;
  }

  /** Whether source maps are produced at all, as a separate file or inline. */
  public boolean shouldGenerateSourceMap() {
    return sourceMap || inlineSourceMap;
  }

  public boolean getInlineSources() {
    return inlineSources;
  }

  public void setInlineSources(boolean inlineSources) {
    this.inlineSources = inlineSources;
  }

  public @Nullable String getSourceRoot() {
    return sourceRoot;
  }

  public void setSourceRoot(@Nullable String sourceRoot) {
    this.sourceRoot = sourceRoot;
  }

  public @Nullable String getMapRoot() {
    return mapRoot;
  }

  public void setMapRoot(@Nullable String mapRoot) {
    this.mapRoot = mapRoot;
  }

  public @Nullable String getOutFile() {
    return outFile;
  }

  /** Bundles every input into one output file. */
  public void setOutFile(@Nullable String outFile) {
    this.outFile = outFile;
  }

  public NewLineKind getNewLine() {
    return newLine;
  }

  public void setNewLine(NewLineKind newLine) {
    this.newLine = checkNotNull(newLine);
  }

  public boolean getEmitBOM() {
    return emitBOM;
  }

  public void setEmitBOM(boolean emitBOM) {
    this.emitBOM = emitBOM;
  }

  public boolean getNoEmit() {
    return noEmit;
  }

  public void setNoEmit(boolean noEmit) {
    this.noEmit = noEmit;
  }

  public HelperTemplates getHelperTemplates() {
    return helperTemplates;
  }

  public void setHelperTemplates(HelperTemplates helperTemplates) {
    this.helperTemplates = checkNotNull(helperTemplates);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("target", target)
        .add("module", module)
        .add("removeComments", removeComments)
        .add("isolatedModules", isolatedModules)
        .add("noEmitHelpers", noEmitHelpers)
        .add("emitDecoratorMetadata", emitDecoratorMetadata)
        .add("sourceMap", sourceMap)
        .add("inlineSourceMap", inlineSourceMap)
        .add("inlineSources", inlineSources)
        .add("sourceRoot", sourceRoot)
        .add("mapRoot", mapRoot)
        .add("outFile", outFile)
        .add("newLine", newLine)
        .add("emitBOM", emitBOM)
        .add("noEmit", noEmit)
        .toString();
  }
}
