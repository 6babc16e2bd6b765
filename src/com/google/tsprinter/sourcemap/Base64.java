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

import java.util.Arrays;

/** The base64 digit alphabet used by source map segments. */
final class Base64 {

  private Base64() {}

  private static final String BASE64_MAP =
      "ABCDEFGHIJKLMNOPQRSTUVWXYZ" + "abcdefghijklmnopqrstuvwxyz" + "0123456789+/";

  private static final int[] BASE64_DECODE_MAP = new int[256];

  static {
    Arrays.fill(BASE64_DECODE_MAP, -1);
    for (int i = 0; i < BASE64_MAP.length(); i++) {
      BASE64_DECODE_MAP[BASE64_MAP.charAt(i)] = i;
    }
  }

  /** Returns the digit for a value in the range 0-63. */
  static char toBase64(int value) {
    checkArgument(value >= 0 && value <= 63, "value out of range: %s", value);
    return BASE64_MAP.charAt(value);
  }

  /** Returns the value in the range 0-63 of a base64 digit. */
  static int fromBase64(char c) {
    int result = c < 256 ? BASE64_DECODE_MAP[c] : -1;
    checkArgument(result != -1, "invalid base64 digit: %s", c);
    return result;
  }
}
