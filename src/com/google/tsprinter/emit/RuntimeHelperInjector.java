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

import com.google.common.base.Splitter;
import com.google.tsprinter.ast.Node;
import com.google.tsprinter.ast.NodeFlags;
import com.google.tsprinter.ast.SourceFile;
import com.google.tsprinter.emit.EmitOptions.ScriptTarget;
import java.util.regex.Pattern;

/** Writes the runtime shims a file or body needs, each at most once per output file. */
final class RuntimeHelperInjector {

  private static final Splitter LINE_SPLITTER = Splitter.on(Pattern.compile("\r\n|\r|\n"));

  private final EmitOptions options;
  private final TransformContext context;
  private final PrintSession session;
  private final TextWriter writer;
  private final HelperTemplates templates;

  RuntimeHelperInjector(
      EmitOptions options, TransformContext context, PrintSession session, TextWriter writer) {
    this.options = checkNotNull(options);
    this.context = checkNotNull(context);
    this.session = checkNotNull(session);
    this.writer = checkNotNull(writer);
    this.templates = options.getHelperTemplates();
  }

  /**
   * Writes the helpers {@code node} asks for through its emit flags. Returns whether anything was
   * written.
   */
  boolean emitHelpers(Node node) {
    int emitFlags = context.getEmitFlags(node);
    boolean helpersEmitted = false;
    if ((emitFlags & EmitFlags.EMIT_EMIT_HELPERS) != 0) {
      helpersEmitted = emitEmitHelpers(session.getSourceFile());
    }
    if ((emitFlags & EmitFlags.EMIT_EXPORT_STAR) != 0) {
      writeHelper(RuntimeHelper.EXPORT_STAR);
      helpersEmitted = true;
    }
    if ((emitFlags & EmitFlags.EMIT_SUPER_HELPER) != 0) {
      writeHelper(RuntimeHelper.SUPER);
      helpersEmitted = true;
    }
    if ((emitFlags & EmitFlags.EMIT_ADVANCED_SUPER_HELPER) != 0) {
      writeHelper(RuntimeHelper.ADVANCED_SUPER);
      helpersEmitted = true;
    }
    return helpersEmitted;
  }

  /**
   * Writes the helpers that the constructs of {@code file} depend on and that have not been written
   * yet in this pass. Returns whether anything was written.
   */
  boolean emitEmitHelpers(SourceFile file) {
    if (options.getNoEmitHelpers()) {
      return false;
    }
    boolean helpersEmitted = false;

    // Only ES3 and ES5 need __extends, ES6 has classes.
    if (options.getTarget().isBelow(ScriptTarget.ES6)
        && file.hasFlag(NodeFlags.HAS_CLASS_EXTENDS)) {
      helpersEmitted |= writeHelperOnce(RuntimeHelper.EXTENDS);
    }
    if (file.hasFlag(NodeFlags.HAS_DECORATORS)) {
      helpersEmitted |= writeHelperOnce(RuntimeHelper.DECORATE);
    }
    if (file.hasFlag(NodeFlags.HAS_PARAM_DECORATORS)) {
      helpersEmitted |= writeHelperOnce(RuntimeHelper.PARAM);
    }
    if (file.hasFlag(NodeFlags.HAS_ASYNC_FUNCTIONS)) {
      helpersEmitted |= writeHelperOnce(RuntimeHelper.AWAITER);
    }
    if (helpersEmitted) {
      writer.writeLine();
    }
    return helpersEmitted;
  }

  private boolean writeHelperOnce(RuntimeHelper helper) {
    if (!session.markHelperEmitted(helper)) {
      return false;
    }
    writeHelper(helper);
    for (RuntimeHelper companion : RuntimeHelper.values()) {
      if (companion.getCompanionOf() == helper && isCompanionEnabled(companion)) {
        session.markHelperEmitted(companion);
        writeHelper(companion);
      }
    }
    return true;
  }

  private boolean isCompanionEnabled(RuntimeHelper companion) {
    switch (companion) {
      case METADATA:
        return options.getEmitDecoratorMetadata();
      default:
        return false;
    }
  }

  /** Writes the module wrapper that replaces an identifier flagged {@link EmitFlags#UMD_DEFINE}. */
  void emitUmdHelper() {
    writeHelper(RuntimeHelper.UMD);
  }

  private void writeHelper(RuntimeHelper helper) {
    writeLines(templates.getTemplate(helper));
  }

  /** Writes each non-empty line of {@code text} on a line of its own. */
  void writeLines(String text) {
    for (String line : LINE_SPLITTER.split(text)) {
      if (!line.isEmpty()) {
        writer.writeLine();
        writer.write(line);
      }
    }
  }
}
