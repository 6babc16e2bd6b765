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

import org.jspecify.annotations.Nullable;

/**
 * The runtime shims the printer can write into its output. Each one is written at most once per
 * output file.
 */
public enum RuntimeHelper {
  EXTENDS("extends.js"),
  DECORATE("decorate.js"),
  /** Only written directly after {@link #DECORATE}. */
  METADATA("metadata.js", DECORATE),
  PARAM("param.js"),
  AWAITER("awaiter.js"),
  EXPORT_STAR("export_star.js"),
  SUPER("super.js"),
  ADVANCED_SUPER("advanced_super.js"),
  UMD("umd.js");

  private final String resourceName;
  private final @Nullable RuntimeHelper companionOf;

  RuntimeHelper(String resourceName) {
    this(resourceName, null);
  }

  RuntimeHelper(String resourceName, @Nullable RuntimeHelper companionOf) {
    this.resourceName = resourceName;
    this.companionOf = companionOf;
  }

  /** The name of the template under {@code js/}, relative to this class. */
  public String getResourceName() {
    return resourceName;
  }

  /** The helper this one is written after, or null if it stands on its own. */
  public @Nullable RuntimeHelper getCompanionOf() {
    return companionOf;
  }
}
