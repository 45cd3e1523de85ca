// Copyright (C) 2026 The Android Open Source Project
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.gerrit.plugins.ownersresolver.backend;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;

/** Tests for {@link CodeOwnerConfigLines}. */
public class CodeOwnerConfigLinesTest {
  @Test
  public void emptyContentHasNoLines() throws Exception {
    assertThat(CodeOwnerConfigLines.cleanedLines("")).isEmpty();
    assertThat(CodeOwnerConfigLines.cleanedLines(null)).isEmpty();
    assertThat(CodeOwnerConfigLines.cleanedLines("\n\n  \t \n")).isEmpty();
  }

  @Test
  public void commentsAreRemoved() throws Exception {
    assertThat(
            CodeOwnerConfigLines.cleanedLines(
                "# comment line\n"
                    + "   * @jimmy     # inline comment     \n"
                    + "        # comment line with leading whitespace\n"
                    + " package.json @john @maria#inline comment without leading whitespace  "))
        .containsExactly("* @jimmy", "package.json @john @maria")
        .inOrder();
  }

  @Test
  public void linesAreSplitOnAnyLineBreak() throws Exception {
    assertThat(CodeOwnerConfigLines.cleanedLines("a @x\r\nb @y\rc @z d"))
        .containsExactly("a @x", "b @y", "c @z", "d")
        .inOrder();
  }

  @Test
  public void tokensAreSplitOnWhitespace() throws Exception {
    assertThat(CodeOwnerConfigLines.tokens("docs/ \t @docs-team   @jane"))
        .containsExactly("docs/", "@docs-team", "@jane")
        .inOrder();
    assertThat(CodeOwnerConfigLines.tokens("yarn.lock")).containsExactly("yarn.lock");
  }
}
