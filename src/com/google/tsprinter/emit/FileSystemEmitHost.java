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
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableSet;
import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.util.logging.Logger;

/** An {@link EmitHost} that writes UTF-8 files to disk. */
public class FileSystemEmitHost implements EmitHost {

  private static final Logger logger = Logger.getLogger(FileSystemEmitHost.class.getName());

  private final String newLine;
  private final ImmutableSet<String> blockedPaths;

  public FileSystemEmitHost(EmitOptions options) {
    this(options, ImmutableSet.of());
  }

  /**
   * @param blockedPaths output paths that must never be written, usually the paths of the inputs
   */
  public FileSystemEmitHost(EmitOptions options, Iterable<String> blockedPaths) {
    this.newLine = options.getNewLine().getText();
    this.blockedPaths = ImmutableSet.copyOf(checkNotNull(blockedPaths));
  }

  @Override
  public String getNewLine() {
    return newLine;
  }

  @Override
  public boolean isEmitBlocked(String path) {
    return blockedPaths.contains(path);
  }

  @Override
  public void writeFile(String path, String text, boolean writeByteOrderMark) throws IOException {
    File file = new File(path);
    Files.createParentDirs(file);
    Files.asCharSink(file, UTF_8).write(writeByteOrderMark ? "\uFEFF" + text : text);
    logger.fine("Wrote " + path);
  }
}
