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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.tsprinter.ast.SourceFile;
import com.google.tsprinter.emit.EmitOptions.ModuleKind;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * CodePrinter prints transformed source files as JavaScript, together with their source maps, and
 * hands the results to an {@link EmitHost}.
 *
 * <p>Instances are not thread-safe. Use one printer per thread.
 */
public final class CodePrinter {

  private static final Logger logger = Logger.getLogger(CodePrinter.class.getName());

  static final DiagnosticType EMIT_WRITE_FAILED =
      DiagnosticType.error("TS_EMIT_WRITE_FAILED", "Could not write file ''{0}'': {1}");

  private final EmitOptions options;
  private final EmitHost host;
  private final TransformContext context;
  private final EmitResolver resolver;
  private final ErrorManager errorManager;

  private final TextWriter writer;
  private final SourceMapWriter sourceMap;
  private final CommentWriter comments;

  private CodePrinter(Builder builder) {
    this.options = builder.options;
    this.host = builder.host != null ? builder.host : new FileSystemEmitHost(options);
    this.context = builder.context;
    this.resolver = builder.resolver;
    this.errorManager =
        builder.errorManager != null ? builder.errorManager : new LoggerErrorManager(logger);
    this.writer = new IndentingTextWriter(host.getNewLine());
    this.sourceMap =
        options.shouldGenerateSourceMap()
            ? new DefaultSourceMapWriter(writer, options)
            : SourceMapWriter.NULL;
    this.comments = new DefaultCommentWriter(writer, sourceMap, options);
  }

  /**
   * Prints {@code files}, either into one bundle when an output file is set or one output file per
   * input. Declaration files produce no output.
   */
  public EmitResult printFiles(List<SourceFile> files) {
    ImmutableList<SourceFile> emittedFiles =
        files.stream().filter(file -> !file.isDeclarationFile()).collect(toImmutableList());
    List<SourceMapData> sourceMaps = new ArrayList<>();
    boolean emitSkipped = false;
    int firstDiagnostic = errorManager.getDiagnostics().size();

    String outFile = options.getOutFile();
    if (outFile != null) {
      if (!emittedFiles.isEmpty()) {
        emitSkipped = !printPass(outFile, emittedFiles, /* isBundle= */ true, sourceMaps);
      }
    } else {
      for (SourceFile file : emittedFiles) {
        String jsFilePath = getOwnEmitOutputFilePath(file.getFileName());
        emitSkipped |= !printPass(jsFilePath, ImmutableList.of(file), false, sourceMaps);
      }
    }

    errorManager.generateReport();
    ImmutableList<EmitError> diagnostics = errorManager.getDiagnostics();
    return new EmitResult(
        emitSkipped, diagnostics.subList(firstDiagnostic, diagnostics.size()), sourceMaps);
  }

  /** Returns the text {@code file} prints as, without writing anything. */
  public String print(SourceFile file) {
    String jsFilePath = getOwnEmitOutputFilePath(file.getFileName());
    try {
      sourceMap.initialize(jsFilePath, jsFilePath + ".map", ImmutableList.of(file), false);
      newCodeGenerator().printSourceFile(file);
      return writer.getText();
    } finally {
      resetWriters();
    }
  }

  /** Returns false when the pass was skipped. */
  private boolean printPass(
      String jsFilePath, List<SourceFile> files, boolean isBundle, List<SourceMapData> sourceMaps) {
    if (options.getNoEmit() || host.isEmitBlocked(jsFilePath)) {
      logger.fine("Skipping " + jsFilePath);
      return false;
    }
    logger.fine("Printing " + jsFilePath);

    String sourceMapFilePath = jsFilePath + ".map";
    try {
      CodeGenerator generator = newCodeGenerator();
      sourceMap.initialize(jsFilePath, sourceMapFilePath, files, isBundle);
      if (isBundle && options.getModule() != ModuleKind.NONE) {
        generator.emitBundleHelpers(files);
      }
      for (SourceFile file : files) {
        generator.printSourceFile(file);
      }

      if (options.shouldGenerateSourceMap()) {
        String sourceMappingUrl = sourceMap.getSourceMappingUrl();
        if (sourceMappingUrl != null) {
          writer.writeLine();
          writer.write("//# sourceMappingURL=" + sourceMappingUrl);
        }
        if (options.getSourceMap() && !options.getInlineSourceMap()) {
          writeFile(sourceMapFilePath, sourceMap.getText(), /* writeByteOrderMark= */ false);
        }
        SourceMapData sourceMapData = sourceMap.getSourceMapData();
        if (sourceMapData != null) {
          sourceMaps.add(sourceMapData);
        }
      }

      writeFile(jsFilePath, writer.getText(), options.getEmitBOM());
    } finally {
      resetWriters();
    }
    return true;
  }

  private CodeGenerator newCodeGenerator() {
    return new CodeGenerator(
        options, writer, sourceMap, comments, context, resolver, new PrintSession());
  }

  private void writeFile(String path, String text, boolean writeByteOrderMark) {
    try {
      host.writeFile(path, text, writeByteOrderMark);
    } catch (IOException e) {
      errorManager.report(
          CheckLevel.ERROR, EmitError.make(path, EMIT_WRITE_FAILED, path, e.getMessage()));
    }
  }

  private void resetWriters() {
    writer.reset();
    sourceMap.reset();
    comments.reset();
  }

  /** Maps {@code dir/foo.ts} and {@code dir/foo.tsx} to {@code dir/foo.js}. */
  @VisibleForTesting
  static String getOwnEmitOutputFilePath(String fileName) {
    int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
    int dot = fileName.lastIndexOf('.');
    String base = dot > slash ? fileName.substring(0, dot) : fileName;
    return base + ".js";
  }

  /** Configures a {@link CodePrinter}. */
  public static final class Builder {
    private EmitOptions options = new EmitOptions();
    private @Nullable EmitHost host;
    private TransformContext context = new DefaultTransformContext();
    private EmitResolver resolver = EmitResolver.EMPTY;
    private @Nullable ErrorManager errorManager;

    /** Sets the options. The printer keeps reading them, so they should not change afterwards. */
    @CanIgnoreReturnValue
    public Builder setOptions(EmitOptions options) {
      this.options = checkNotNull(options);
      return this;
    }

    /**
     * Sets the host that receives the output files. Defaults to a {@link FileSystemEmitHost} for
     * the options.
     */
    @CanIgnoreReturnValue
    public Builder setHost(EmitHost host) {
      this.host = checkNotNull(host);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setTransformContext(TransformContext context) {
      this.context = checkNotNull(context);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setResolver(EmitResolver resolver) {
      this.resolver = checkNotNull(resolver);
      return this;
    }

    /** Sets where write failures are reported. Defaults to a {@link LoggerErrorManager}. */
    @CanIgnoreReturnValue
    public Builder setErrorManager(ErrorManager errorManager) {
      this.errorManager = checkNotNull(errorManager);
      return this;
    }

    public CodePrinter build() {
      return new CodePrinter(this);
    }
  }
}
