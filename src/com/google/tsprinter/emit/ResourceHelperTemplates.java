/*
 * Copyright 2015 The Closure Compiler Authors.
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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.io.CharStreams;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.Map;

/** Loads helper templates from the {@code js/} resources next to this class. */
public final class ResourceHelperTemplates implements HelperTemplates {

  private final Map<RuntimeHelper, String> cache = new EnumMap<>(RuntimeHelper.class);

  @Override
  public String getTemplate(RuntimeHelper helper) {
    return cache.computeIfAbsent(helper, h -> loadTextResource("js/" + h.getResourceName()));
  }

  static String loadTextResource(String path) {
    InputStream input = ResourceHelperTemplates.class.getResourceAsStream(path);
    if (input == null) {
      throw new IllegalStateException("No such resource: " + path);
    }
    try (Reader reader = new InputStreamReader(input, UTF_8)) {
      return CharStreams.toString(reader);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
