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

/** Tests for {@link GlobMatcher}. */
public class GlobMatcherTest extends AbstractPathExpressionMatcherTest {
  @Override
  protected PathExpressionMatcher getPathExpressionMatcher() {
    return GlobMatcher.INSTANCE;
  }

  @Test
  public void unanchoredPathExpressionMatchesInAllFolders() throws Exception {
    assertThat(GlobMatcher.asGlob("*.md")).isEqualTo("{**/,}*.md{/**,}");
    assertThat(GlobMatcher.asGlob("docs/")).isEqualTo("{**/,}docs{/**,}");
  }

  @Test
  public void pathExpressionWithSlashIsAnchored() throws Exception {
    assertThat(GlobMatcher.asGlob("/docs/")).isEqualTo("docs{/**,}");
    assertThat(GlobMatcher.asGlob("packages/a/")).isEqualTo("packages/a{/**,}");
    assertThat(GlobMatcher.asGlob("/BUILD")).isEqualTo("BUILD{/**,}");
  }

  @Test
  public void pathExpressionStartingWithDoubleStarIsNotPrefixed() throws Exception {
    assertThat(GlobMatcher.asGlob("**.md")).isEqualTo("**.md{/**,}");
  }

  @Test
  public void globalPathExpressionMatchesAllFiles() throws Exception {
    assertMatch("*", "README.md", "foo/bar.txt", "foo/bar/baz/BUILD");
  }

  @Test
  public void matchFileType() throws Exception {
    String pathExpression = "*.md";
    assertMatch(pathExpression, "README.md", "foo/README.md", "foo/bar/README.md");
    assertNoMatch(pathExpression, "README", "README.md5");
  }

  @Test
  public void matchFolder() throws Exception {
    String pathExpression = "docs/";
    assertMatch(pathExpression, "docs", "docs/README.md", "docs/a/b.txt", "foo/docs/README.md");
    assertNoMatch(pathExpression, "docsx/README.md", "README.md");
  }

  @Test
  public void matchAnchoredFolder() throws Exception {
    String pathExpression = "/docs/";
    assertMatch(pathExpression, "docs/README.md");
    assertNoMatch(pathExpression, "foo/docs/README.md");
  }

  @Test
  public void matchAlternatives() throws Exception {
    String pathExpression = "*.{html,htm}";
    assertMatch(pathExpression, "index.html", "foo/index.htm");
    assertNoMatch(pathExpression, "index.md");
  }

  @Test
  public void invalidGlobNeverMatches() throws Exception {
    assertNoMatch("foo[", "foo[", "foo");
  }
}
