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

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * What one output pass produced in the way of source maps.
 *
 * @param sourceMapFilePath where the map is written
 * @param jsSourceMappingUrl the URL written into the output file, or null when there is none
 * @param sourceMapFile the name of the output file the map describes
 * @param sourceRoot the {@code sourceRoot} field of the map
 * @param sources the {@code sources} field of the map
 * @param text the JSON text of the map
 */
public record SourceMapData(
    String sourceMapFilePath,
    @Nullable String jsSourceMappingUrl,
    String sourceMapFile,
    @Nullable String sourceRoot,
    ImmutableList<String> sources,
    String text) {}
