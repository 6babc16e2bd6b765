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

import com.google.common.base.Predicate;
import com.google.tsprinter.ast.Node;
import com.google.tsprinter.ast.SourceFile;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Records where the printed text of each node came from. Every call to {@link #emitStart} is
 * paired with a call to {@link #emitEnd} for the same node.
 */
public interface SourceMapWriter {

  /** Starts a map for the output file {@code filePath}. */
  void initialize(
      String filePath, String sourceMapFilePath, List<SourceFile> sourceFiles, boolean isBundle);

  /** Sets the file that later positions refer to. */
  void setSourceFile(SourceFile sourceFile);

  /** Maps the current output position to {@code pos} in the current source file. */
  void emitPos(int pos);

  /**
   * Marks the start of a node's text.
   *
   * @param ignoreNode whether the node itself is left out of the map
   * @param ignoreChildren whether everything inside the node is left out of the map
   */
  void emitStart(Node node, Predicate<Node> ignoreNode, Predicate<Node> ignoreChildren);

  /** Marks the end of a node's text. The predicates must be the ones given to emitStart. */
  void emitEnd(Node node, Predicate<Node> ignoreNode, Predicate<Node> ignoreChildren);

  /** Returns the JSON text of the map. */
  String getText();

  /** Returns the URL the output should name in its {@code sourceMappingURL} comment. */
  @Nullable String getSourceMappingUrl();

  @Nullable SourceMapData getSourceMapData();

  void reset();

  /** Records nothing. */
  SourceMapWriter NULL =
      new SourceMapWriter() {
        @Override
        public void initialize(
            String filePath,
            String sourceMapFilePath,
            List<SourceFile> sourceFiles,
            boolean isBundle) {}

        @Override
        public void setSourceFile(SourceFile sourceFile) {}

        @Override
        public void emitPos(int pos) {}

        @Override
        public void emitStart(
            Node node, Predicate<Node> ignoreNode, Predicate<Node> ignoreChildren) {}

        @Override
        public void emitEnd(
            Node node, Predicate<Node> ignoreNode, Predicate<Node> ignoreChildren) {}

        @Override
        public String getText() {
          return "";
        }

        @Override
        public @Nullable String getSourceMappingUrl() {
          return null;
        }

        @Override
        public @Nullable SourceMapData getSourceMapData() {
          return null;
        }

        @Override
        public void reset() {}
      };
}
