/*
 * Copyright 2011 The Closure Compiler Authors.
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

package com.google.tsprinter.sourcemap;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.gson.Gson;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Collects information mapping the generated source back to its original sources and writes it
 * out as a revision 3 source map.
 *
 * <p>Mappings are ranges of the generated text. They must be added in the order a pre-order
 * traversal of the tree would start them; a mapping that starts inside another one and ends
 * before it is its child.
 */
public final class SourceMapGeneratorV3 {

  private static final int UNMAPPED = -1;

  private static final Gson GSON = new Gson();

  /** A pre-order traversal ordered list of mappings stored in this map. */
  private final List<Mapping> mappings = new ArrayList<>();

  private final LinkedHashMap<String, Integer> sourceFileMap = new LinkedHashMap<>();

  private final Map<String, String> sourcesContent = new LinkedHashMap<>();

  private final LinkedHashMap<String, Integer> originalNameMap = new LinkedHashMap<>();

  private @Nullable String lastSourceFile = null;

  private int lastSourceFileIndex = -1;

  private @Nullable Mapping lastMapping;

  private @Nullable String sourceRootPath;

  public void reset() {
    mappings.clear();
    lastMapping = null;
    sourceFileMap.clear();
    sourcesContent.clear();
    originalNameMap.clear();
    lastSourceFile = null;
    lastSourceFileIndex = -1;
  }

  /**
   * Registers a source file so it is listed in {@code sources} even if no mapping refers to it.
   * When {@code content} is non-null it is written to {@code sourcesContent}.
   */
  public void addSourceFile(String sourceName, @Nullable String content) {
    getSourceId(sourceName);
    if (content != null) {
      sourcesContent.put(sourceName, content);
    }
  }

  /**
   * Adds a mapping for a range of generated text. Mappings must be added in order of their start
   * positions.
   *
   * @param sourceStartPosition the zero based position in the original file
   * @param startPosition the start of the range in the generated file
   * @param endPosition the end of the range in the generated file
   */
  public void addMapping(
      String sourceName,
      @Nullable String symbolName,
      FilePosition sourceStartPosition,
      FilePosition startPosition,
      FilePosition endPosition) {
    // Don't bother if there is not sufficient information to be useful.
    if (sourceName == null || sourceStartPosition.getLine() < 0) {
      return;
    }
    checkArgument(
        !startPosition.isAfter(endPosition),
        "Mapping ends before it starts: %s to %s",
        startPosition,
        endPosition);

    Mapping mapping = new Mapping();
    mapping.sourceFile = sourceName;
    mapping.originalPosition = sourceStartPosition;
    mapping.originalName = symbolName;
    mapping.startPosition = startPosition;
    mapping.endPosition = endPosition;

    if (lastMapping != null) {
      checkState(
          !lastMapping.startPosition.isAfter(mapping.startPosition),
          "Incorrect source mappings order, previous : (%s)\nnew : (%s)",
          lastMapping.startPosition,
          mapping.startPosition);
    }

    lastMapping = mapping;
    mappings.add(mapping);
  }

  public int getMappingCount() {
    return mappings.size();
  }

  /**
   * A prefix to be added to the beginning of each source name. Debuggers expect (prefix +
   * sourceName) to be a URL for loading the source code.
   */
  public void setSourceRoot(@Nullable String path) {
    this.sourceRootPath = path;
  }

  /**
   * Writes out the source map:
   *
   * <pre>
   * {
   * "version":3,
   * "file":"out.js",
   * "lineCount":2,
   * "sourceRoot":"",
   * "mappings":"a;;abcde,abcd,a;",
   * "sources":["foo.ts","bar.ts"],
   * "sourcesContent":["...","..."],
   * "names":["src","maps","are","fun"]
   * }
   * </pre>
   *
   * <p>{@code sourceRoot} and {@code sourcesContent} are only written when present.
   */
  public void appendTo(Appendable out, String name) throws IOException {
    int maxLine = prepMappings() + 1;

    out.append("{\n");
    appendFirstField(out, "version", "3");
    appendField(out, "file", Util.escapeString(name));
    appendField(out, "lineCount", String.valueOf(maxLine));

    if (sourceRootPath != null && !sourceRootPath.isEmpty()) {
      appendField(out, "sourceRoot", Util.escapeString(sourceRootPath));
    }

    appendField(out, "mappings", "");
    new LineMapper(out, maxLine).appendLineMappings();

    appendField(out, "sources", "");
    out.append("[");
    addNameMap(out, sourceFileMap);
    out.append("]");

    if (!sourcesContent.isEmpty()) {
      appendField(out, "sourcesContent", "");
      out.append("[");
      int i = 0;
      for (String sourceName : sourceFileMap.keySet()) {
        if (i++ != 0) {
          out.append(",");
        }
        out.append(GSON.toJson(sourcesContent.get(sourceName)));
      }
      out.append("]");
    }

    appendField(out, "names", "");
    out.append("[");
    addNameMap(out, originalNameMap);
    out.append("]");

    out.append("\n}\n");
  }

  /** Returns the source map as a string. */
  public String toJson(String name) {
    StringBuilder sb = new StringBuilder();
    try {
      appendTo(sb, name);
    } catch (IOException e) {
      throw new IllegalStateException(e);
    }
    return sb.toString();
  }

  private static void addNameMap(Appendable out, Map<String, Integer> map) throws IOException {
    int i = 0;
    for (String key : map.keySet()) {
      if (i != 0) {
        out.append(",");
      }
      out.append(Util.escapeString(key));
      i++;
    }
  }

  private static void appendFirstField(Appendable out, String name, CharSequence value)
      throws IOException {
    out.append("\"").append(name).append("\":").append(value);
  }

  private static void appendField(Appendable out, String name, CharSequence value)
      throws IOException {
    out.append(",\n");
    appendFirstField(out, name, value);
  }

  /** Assigns sequential ids to used mappings, and returns the last line mapped. */
  private int prepMappings() throws IOException {
    new MappingTraversal().traverse(new UsedMappingCheck());

    int id = 0;
    int maxLine = 0;
    for (Mapping m : mappings) {
      if (m.used) {
        m.id = id++;
        maxLine = Math.max(maxLine, m.endPosition.getLine());
      }
    }
    return maxLine;
  }

  /** A mapping from a position in an input source file to a range of the generated code. */
  static class Mapping {
    int id = UNMAPPED;

    String sourceFile;

    FilePosition originalPosition;

    FilePosition startPosition;

    FilePosition endPosition;

    @Nullable String originalName;

    boolean used = false;
  }

  private static class UsedMappingCheck implements MappingVisitor {
    @Override
    public void visit(@Nullable Mapping m, int line, int col, int nextLine, int nextCol) {
      if (m != null) {
        m.used = true;
      }
    }
  }

  private interface MappingVisitor {
    /**
     * @param m the mapping for the current code segment, null if the segment is unmapped
     */
    void visit(@Nullable Mapping m, int line, int col, int endLine, int endCol)
        throws IOException;
  }

  /**
   * Walks the mappings and visits each segment. Unmapped segments are visited with a null
   * mapping; empty mappings are not visited.
   */
  private class MappingTraversal {
    // The last line and column written
    private int line;
    private int col;

    void traverse(MappingVisitor v) throws IOException {
      // The mapping positions are enough to rebuild the ancestor stack of a pre-order list.
      Deque<Mapping> stack = new ArrayDeque<>();
      for (Mapping m : mappings) {
        // An overlapping mapping is an ancestor of the current one. Siblings are closed in the
        // reverse order they were opened.
        while (!stack.isEmpty() && !isOverlapped(stack.peek(), m)) {
          maybeVisit(v, stack.pop());
        }

        // Any gap between the current position and the start of this mapping belongs to the
        // parent.
        maybeVisitParent(v, stack.peek(), m);

        stack.push(m);
      }

      while (!stack.isEmpty()) {
        maybeVisit(v, stack.pop());
      }
    }

    /** Whether m1 ends at or after the start of m2. */
    private boolean isOverlapped(Mapping m1, Mapping m2) {
      return !m2.startPosition.isAfter(m1.endPosition);
    }

    private void maybeVisit(MappingVisitor v, Mapping m) throws IOException {
      int nextLine = m.endPosition.getLine();
      int nextCol = m.endPosition.getColumn();
      if (line < nextLine || (line == nextLine && col < nextCol)) {
        visit(v, m, nextLine, nextCol);
      }
    }

    private void maybeVisitParent(MappingVisitor v, @Nullable Mapping parent, Mapping m)
        throws IOException {
      int nextLine = m.startPosition.getLine();
      int nextCol = m.startPosition.getColumn();
      checkState(line < nextLine || col <= nextCol);
      if (line < nextLine || (line == nextLine && col < nextCol)) {
        visit(v, parent, nextLine, nextCol);
      }
    }

    private void visit(MappingVisitor v, @Nullable Mapping m, int nextLine, int nextCol)
        throws IOException {
      checkState(line <= nextLine);
      checkState(line < nextLine || col < nextCol);
      v.visit(m, line, col, nextLine, nextCol);
      line = nextLine;
      col = nextCol;
    }
  }

  private int getSourceId(String sourceName) {
    if (!sourceName.equals(lastSourceFile)) {
      lastSourceFile = sourceName;
      Integer index = sourceFileMap.get(sourceName);
      if (index != null) {
        lastSourceFileIndex = index;
      } else {
        lastSourceFileIndex = sourceFileMap.size();
        sourceFileMap.put(sourceName, lastSourceFileIndex);
      }
    }
    return lastSourceFileIndex;
  }

  private int getNameId(String symbolName) {
    Integer index = originalNameMap.get(symbolName);
    if (index != null) {
      return index;
    }
    int originalNameIndex = originalNameMap.size();
    originalNameMap.put(symbolName, originalNameIndex);
    return originalNameIndex;
  }

  private class LineMapper implements MappingVisitor {
    private final Appendable out;
    private final int maxLine;

    private int previousLine = -1;
    private int previousColumn = 0;

    // Previous values used for storing relative ids.
    private int previousSourceFileId;
    private int previousSourceLine;
    private int previousSourceColumn;
    private int previousNameId;

    LineMapper(Appendable out, int maxLine) {
      this.out = out;
      this.maxLine = maxLine;
    }

    @Override
    public void visit(@Nullable Mapping m, int line, int col, int nextLine, int nextCol)
        throws IOException {
      if (previousLine != line) {
        previousColumn = 0;
      }

      if (line != nextLine || col != nextCol) {
        if (line < maxLine) {
          if (previousLine == line) {
            out.append(',');
          }
          writeEntry(m, col);
          previousLine = line;
          previousColumn = col;
        } else {
          checkState(m == null);
        }
      }

      for (int i = line; i < nextLine && i < maxLine; i++) {
        closeLine(false);
      }
    }

    /**
     * Writes an entry for the given generated column. Every field is relative to the previous
     * entry's value.
     */
    void writeEntry(@Nullable Mapping m, int column) throws IOException {
      Base64VLQ.encode(out, column - previousColumn);
      previousColumn = column;
      if (m != null) {
        int sourceId = getSourceId(m.sourceFile);
        Base64VLQ.encode(out, sourceId - previousSourceFileId);
        previousSourceFileId = sourceId;

        int srcline = m.originalPosition.getLine();
        int srcColumn = m.originalPosition.getColumn();
        Base64VLQ.encode(out, srcline - previousSourceLine);
        previousSourceLine = srcline;

        Base64VLQ.encode(out, srcColumn - previousSourceColumn);
        previousSourceColumn = srcColumn;

        if (m.originalName != null) {
          int nameId = getNameId(m.originalName);
          Base64VLQ.encode(out, nameId - previousNameId);
          previousNameId = nameId;
        }
      }
    }

    void appendLineMappings() throws IOException {
      out.append('"');
      new MappingTraversal().traverse(this);
      closeLine(true);
    }

    private void closeLine(boolean finalEntry) throws IOException {
      out.append(';');
      if (finalEntry) {
        out.append('"');
      }
    }
  }
}
