/*
 * Copyright 2009 The Closure Compiler Authors.
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
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Predicate;
import com.google.common.io.BaseEncoding;
import com.google.tsprinter.ast.Node;
import com.google.tsprinter.ast.SourceFile;
import com.google.tsprinter.ast.Trivia;
import com.google.tsprinter.sourcemap.FilePosition;
import com.google.tsprinter.sourcemap.SourceMapGeneratorV3;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A {@link SourceMapWriter} that keeps a stack of open node mappings and hands the finished
 * mappings to a {@link SourceMapGeneratorV3}.
 *
 * <p>A node mapping covers the text between its start and end marks. A mapping made by {@link
 * #emitPos} covers the text up to the next mark of any kind.
 */
public final class DefaultSourceMapWriter implements SourceMapWriter {

  private final TextWriter writer;
  private final EmitOptions options;
  private final SourceMapGeneratorV3 generator = new SourceMapGeneratorV3();

  private final Deque<Mapping> mappings = new ArrayDeque<>();
  private final List<Mapping> allMappings = new ArrayList<>();
  private final List<SourceFile> sourceFiles = new ArrayList<>();

  private @Nullable Mapping pendingPoint;
  private @Nullable SourceFile currentSourceFile;
  private int disabled;

  private String filePath = "";
  private String sourceMapFilePath = "";
  private @Nullable String text;

  public DefaultSourceMapWriter(TextWriter writer, EmitOptions options) {
    this.writer = checkNotNull(writer);
    this.options = checkNotNull(options);
  }

  private static class Mapping {
    @Nullable Node node;
    SourceFile source;
    FilePosition sourcePosition;
    FilePosition start;
    @Nullable FilePosition end;

    @Override
    public String toString() {
      // This toString() representation is used for debugging purposes only.
      return "Mapping: start " + start + ", end " + end + ", node " + node;
    }
  }

  @Override
  public void initialize(
      String filePath, String sourceMapFilePath, List<SourceFile> sourceFiles, boolean isBundle) {
    reset();
    this.filePath = filePath;
    this.sourceMapFilePath = sourceMapFilePath;
    this.sourceFiles.addAll(sourceFiles);
  }

  @Override
  public void setSourceFile(SourceFile sourceFile) {
    this.currentSourceFile = sourceFile;
  }

  @Override
  public void emitPos(int pos) {
    closePendingPoint();
    if (disabled > 0 || pos < 0 || currentSourceFile == null) {
      return;
    }
    Mapping mapping = newMapping(null, currentSourceFile, pos);
    pendingPoint = mapping;
    allMappings.add(mapping);
  }

  @Override
  public void emitStart(Node node, Predicate<Node> ignoreNode, Predicate<Node> ignoreChildren) {
    closePendingPoint();
    if (disabled == 0 && !ignoreNode.apply(node) && !node.isSynthesized()) {
      SourceFile source = node.getSourceFile() != null ? node.getSourceFile() : currentSourceFile;
      if (source != null) {
        Mapping mapping = newMapping(node, source, node.getPos());
        mappings.push(mapping);
        allMappings.add(mapping);
      }
    }
    if (ignoreChildren.apply(node)) {
      disabled++;
    }
  }

  @Override
  public void emitEnd(Node node, Predicate<Node> ignoreNode, Predicate<Node> ignoreChildren) {
    closePendingPoint();
    if (ignoreChildren.apply(node)) {
      checkState(disabled > 0, "Unbalanced source map end for %s", node);
      disabled--;
    }
    if (!mappings.isEmpty() && mappings.peek().node == node) {
      Mapping mapping = mappings.pop();
      mapping.end = currentPosition();
    }
  }

  private Mapping newMapping(@Nullable Node node, SourceFile source, int pos) {
    String sourceText = source.getSourceText();
    int start = pos < sourceText.length() ? Trivia.skipTrivia(sourceText, pos) : pos;
    Mapping mapping = new Mapping();
    mapping.node = node;
    mapping.source = source;
    mapping.sourcePosition =
        new FilePosition(source.getLineOfPosition(start), source.getColumnOfPosition(start));
    mapping.start = currentPosition();
    text = null;
    return mapping;
  }

  private void closePendingPoint() {
    if (pendingPoint != null) {
      pendingPoint.end = currentPosition();
      pendingPoint = null;
    }
  }

  private FilePosition currentPosition() {
    return new FilePosition(writer.getLine(), writer.getColumn());
  }

  @Override
  public String getText() {
    if (text == null) {
      closePendingPoint();
      generator.reset();
      generator.setSourceRoot(options.getSourceRoot());
      for (SourceFile sourceFile : sourceFiles) {
        generator.addSourceFile(
            getSourceName(sourceFile),
            options.getInlineSources() ? sourceFile.getSourceText() : null);
      }
      FilePosition last = currentPosition();
      for (Mapping mapping : allMappings) {
        FilePosition end = mapping.end != null ? mapping.end : last;
        if (end.equals(mapping.start)) {
          continue;
        }
        generator.addMapping(
            getSourceName(mapping.source), null, mapping.sourcePosition, mapping.start, end);
      }
      text = generator.toJson(baseName(filePath));
    }
    return text;
  }

  @Override
  public @Nullable String getSourceMappingUrl() {
    if (options.getInlineSourceMap()) {
      return "data:application/json;base64,"
          + BaseEncoding.base64().encode(getText().getBytes(UTF_8));
    }
    String mapFileName = baseName(sourceMapFilePath);
    String mapRoot = options.getMapRoot();
    if (mapRoot == null || mapRoot.isEmpty()) {
      return mapFileName;
    }
    return mapRoot.endsWith("/") ? mapRoot + mapFileName : mapRoot + "/" + mapFileName;
  }

  @Override
  public SourceMapData getSourceMapData() {
    return new SourceMapData(
        sourceMapFilePath,
        getSourceMappingUrl(),
        baseName(filePath),
        options.getSourceRoot(),
        sourceFiles.stream().map(this::getSourceName).collect(toImmutableList()),
        getText());
  }

  @Override
  public void reset() {
    generator.reset();
    mappings.clear();
    allMappings.clear();
    sourceFiles.clear();
    pendingPoint = null;
    currentSourceFile = null;
    disabled = 0;
    text = null;
  }

  /**
   * Names a source file relative to the directory of the map, unless a source root is set, in which
   * case the name is used as is.
   */
  private String getSourceName(SourceFile sourceFile) {
    String fileName = sourceFile.getFileName();
    String sourceRoot = options.getSourceRoot();
    if (sourceRoot != null && !sourceRoot.isEmpty()) {
      return fileName.replace('\\', '/');
    }
    Path mapDir = Paths.get(sourceMapFilePath).getParent();
    Path source = Paths.get(fileName);
    if (mapDir == null || mapDir.isAbsolute() != source.isAbsolute()) {
      return fileName.replace('\\', '/');
    }
    return mapDir.relativize(source).toString().replace('\\', '/');
  }

  private static String baseName(String path) {
    int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
    return path.substring(slash + 1);
  }
}
