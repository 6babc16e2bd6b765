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

/** String escaping shared by source maps and printed literals. */
public final class Util {

  private static final char[] HEX_CHARS = {
    '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'a', 'b', 'c', 'd', 'e', 'f'
  };

  private Util() {}

  /** Escapes the given string to a double quoted JSON string. */
  static String escapeString(String s) {
    StringBuilder sb = new StringBuilder(s.length() + 2);
    sb.append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '"':
          sb.append("\\\"");
          break;
        default:
          if (c > 0x1f && c <= 0x7f) {
            sb.append(c);
          } else {
            appendHexJavaScriptRepresentation(sb, c);
          }
      }
    }
    sb.append('"');
    return sb.toString();
  }

  /** Appends {@code c} as a {@code \\uXXXX} escape. */
  public static void appendHexJavaScriptRepresentation(StringBuilder sb, char c) {
    sb.append("\\u")
        .append(HEX_CHARS[(c >>> 12) & 0xf])
        .append(HEX_CHARS[(c >>> 8) & 0xf])
        .append(HEX_CHARS[(c >>> 4) & 0xf])
        .append(HEX_CHARS[c & 0xf]);
  }
}
