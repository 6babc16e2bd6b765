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

package com.google.tsprinter.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSet;
import java.util.Arrays;

/**
 * The root of a syntax tree, holding the text it was parsed from.
 *
 * <p>Positions in the tree are offsets into {@link #getSourceText()}; lines and columns are zero
 * based.
 */
public final class SourceFile extends Node {
  private final String fileName;
  private final String text;
  private final ImmutableSet<String> identifiers;
  private final int[] lineStarts;

  public SourceFile(String fileName, String text) {
    this(fileName, text, Trivia.collectIdentifiers(text));
  }

  public SourceFile(String fileName, String text, ImmutableSet<String> identifiers) {
    super(SyntaxKind.SOURCE_FILE);
    this.fileName = checkNotNull(fileName);
    this.text = checkNotNull(text);
    this.identifiers = identifiers;
    this.lineStarts = Trivia.computeLineStarts(text);
    setRange(0, text.length());
  }

  public String getFileName() {
    return fileName;
  }

  public String getSourceText() {
    return text;
  }

  public ImmutableSet<String> getIdentifiers() {
    return identifiers;
  }

  public boolean isDeclarationFile() {
    return fileName.endsWith(".d.ts");
  }

  public int getLineCount() {
    return lineStarts.length;
  }

  /** Returns the zero based line that contains {@code pos}. */
  public int getLineOfPosition(int pos) {
    int index = Arrays.binarySearch(lineStarts, pos);
    return index >= 0 ? index : -index - 2;
  }

  /** Returns the zero based column of {@code pos} within its line. */
  public int getColumnOfPosition(int pos) {
    return pos - lineStarts[getLineOfPosition(pos)];
  }

  @Override
  public String toString() {
    return "SOURCE_FILE " + fileName;
  }
}
