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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TriviaTest {

  @Test
  public void testSkipTrivia() {
    String text = "  // one\n  /* two */ x";
    assertThat(Trivia.skipTrivia(text, 0)).isEqualTo(text.indexOf('x'));
    assertThat(Trivia.skipTrivia(text, text.length())).isEqualTo(text.length());
  }

  @Test
  public void testSkipTriviaKeepsSynthesizedPositions() {
    assertThat(Trivia.skipTrivia("x", -1)).isEqualTo(-1);
  }

  @Test
  public void testSkipTriviaSkipsShebangAtStart() {
    String text = "#!/usr/bin/env node\nx";
    assertThat(Trivia.skipTrivia(text, 0)).isEqualTo(text.indexOf('x'));
  }

  @Test
  public void testShebang() {
    assertThat(Trivia.getShebang("#!/usr/bin/env node\r\nx")).isEqualTo("#!/usr/bin/env node");
    assertThat(Trivia.getShebang("x #!")).isNull();
  }

  @Test
  public void testLeadingCommentsStartAfterFirstLineBreak() {
    String text = "a; // trailing\n/* leading */\nb;";
    int pos = text.indexOf(';') + 1;
    ImmutableList<CommentRange> comments = Trivia.getLeadingCommentRanges(text, pos);
    assertThat(comments).hasSize(1);
    assertThat(comments.get(0).getText(text)).isEqualTo("/* leading */");
    assertThat(comments.get(0).multiLine()).isTrue();
    assertThat(comments.get(0).hasTrailingNewLine()).isTrue();
  }

  @Test
  public void testLeadingCommentsAtStartOfFile() {
    String text = "// header\nx;";
    ImmutableList<CommentRange> comments = Trivia.getLeadingCommentRanges(text, 0);
    assertThat(comments).hasSize(1);
    assertThat(comments.get(0).getText(text)).isEqualTo("// header");
    assertThat(comments.get(0).multiLine()).isFalse();
  }

  @Test
  public void testTrailingCommentsStopAtLineBreak() {
    String text = "a; /* one */ // two\n// three\nb;";
    int pos = text.indexOf(';') + 1;
    ImmutableList<CommentRange> comments = Trivia.getTrailingCommentRanges(text, pos);
    assertThat(comments).hasSize(2);
    assertThat(comments.get(0).getText(text)).isEqualTo("/* one */");
    assertThat(comments.get(1).getText(text)).isEqualTo("// two");
  }

  @Test
  public void testNoCommentsOutsideText() {
    assertThat(Trivia.getLeadingCommentRanges("x", -1)).isEmpty();
    assertThat(Trivia.getTrailingCommentRanges("x", 5)).isEmpty();
  }

  @Test
  public void testCollectIdentifiers() {
    assertThat(Trivia.collectIdentifiers("var _a = b1 + 'c';"))
        .containsExactly("var", "_a", "b1", "c");
  }
}
