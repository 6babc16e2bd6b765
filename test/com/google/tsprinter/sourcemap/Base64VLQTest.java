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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class Base64VLQTest {

  @Test
  public void testSmallValues() {
    assertThat(Base64VLQ.encode(0)).isEqualTo("A");
    assertThat(Base64VLQ.encode(1)).isEqualTo("C");
    assertThat(Base64VLQ.encode(-1)).isEqualTo("D");
    assertThat(Base64VLQ.encode(15)).isEqualTo("e");
  }

  @Test
  public void testContinuation() {
    // 16 no longer fits in the four value bits of the first digit.
    assertThat(Base64VLQ.encode(16)).isEqualTo("gB");
    assertThat(Base64VLQ.encode(-16)).isEqualTo("hB");
  }

  @Test
  public void testSelectedValues() {
    int base = 1;
    for (int i = 0; i < 30; i++) {
      assertDecodesTo(base - 1);
      assertDecodesTo(base);
      assertDecodesTo(-base);
      base *= 2;
    }
  }

  @Test
  public void testSignedRange() {
    for (int i = -(64 * 64 - 1); i < (64 * 64 - 1); i++) {
      assertDecodesTo(i);
    }
  }

  @Test
  public void testDecodeSequence() {
    Base64VLQ.CharIterator it = Base64VLQ.iterate("AACgBD");
    assertThat(Base64VLQ.decode(it)).isEqualTo(0);
    assertThat(Base64VLQ.decode(it)).isEqualTo(0);
    assertThat(Base64VLQ.decode(it)).isEqualTo(1);
    assertThat(Base64VLQ.decode(it)).isEqualTo(16);
    assertThat(Base64VLQ.decode(it)).isEqualTo(-1);
    assertThat(it.hasNext()).isFalse();
  }

  private static void assertDecodesTo(int value) {
    String encoded = Base64VLQ.encode(value);
    Base64VLQ.CharIterator it = Base64VLQ.iterate(encoded);
    assertThat(Base64VLQ.decode(it)).isEqualTo(value);
    assertThat(it.hasNext()).isFalse();
  }
}
