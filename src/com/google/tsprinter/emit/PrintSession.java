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
import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.tsprinter.ast.Node;
import com.google.tsprinter.ast.SourceFile;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * The mutable state of one output pass. A new session is created for every output file and
 * dropped when the file is done, so no counter or memo leaks from one file into the next.
 */
final class PrintSession {

  private @Nullable SourceFile currentSourceFile;

  private int tempFlags;
  private final Deque<Integer> savedTempFlags = new ArrayDeque<>();

  private final Set<RuntimeHelper> emittedHelpers = EnumSet.noneOf(RuntimeHelper.class);

  // Names of AUTO, LOOP and UNIQUE identifiers, keyed on the identifier.
  private final Map<Node, String> generatedNames = new IdentityHashMap<>();
  // Names of NODE identifiers, keyed on the node the name stands for.
  private final Map<Node, String> nodeGeneratedNames = new IdentityHashMap<>();
  private final Set<String> generatedNameSet = new HashSet<>();

  void setSourceFile(SourceFile sourceFile) {
    this.currentSourceFile = checkNotNull(sourceFile);
  }

  SourceFile getSourceFile() {
    return checkNotNull(currentSourceFile, "No source file is being printed");
  }

  int getTempFlags() {
    return tempFlags;
  }

  void setTempFlags(int tempFlags) {
    this.tempFlags = tempFlags;
  }

  /** Starts a scope with fresh temp names. */
  void pushTempScope() {
    savedTempFlags.push(tempFlags);
    tempFlags = 0;
  }

  void popTempScope() {
    checkState(!savedTempFlags.isEmpty(), "Unbalanced temp scope");
    tempFlags = savedTempFlags.pop();
  }

  /** Records that {@code helper} was written. Returns false if it already had been. */
  @CanIgnoreReturnValue
  boolean markHelperEmitted(RuntimeHelper helper) {
    return emittedHelpers.add(helper);
  }

  Map<Node, String> getGeneratedNames() {
    return generatedNames;
  }

  Map<Node, String> getNodeGeneratedNames() {
    return nodeGeneratedNames;
  }

  boolean isGeneratedName(String name) {
    return generatedNameSet.contains(name);
  }

  void addGeneratedName(String name) {
    generatedNameSet.add(name);
  }
}
