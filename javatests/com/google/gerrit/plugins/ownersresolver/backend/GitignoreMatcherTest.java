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

import org.junit.Test;

/** Tests for {@link GitignoreMatcher}. */
public class GitignoreMatcherTest extends AbstractPathExpressionMatcherTest {
  @Override
  protected PathExpressionMatcher getPathExpressionMatcher() {
    return GitignoreMatcher.INSTANCE;
  }

  @Test
  public void globalPathExpressionMatchesAllFiles() throws Exception {
    assertMatch("*", "README.md", "foo/bar.txt", "foo/bar/baz/BUILD", ".gitignore");
  }

  @Test
  public void matchConcreteFileInAllFolders() throws Exception {
    String pathExpression = "package.json";
    assertMatch(pathExpression, "package.json", "packages/a/package.json");
    assertNoMatch(pathExpression, "package.json5", "package-lock.json", "yarn.lock");
  }

  @Test
  public void matchConcreteFileAnchoredAtRoot() throws Exception {
    String pathExpression = "/package.json";
    assertMatch(pathExpression, "package.json");
    assertNoMatch(pathExpression, "packages/a/package.json", "yarn.lock");
  }

  @Test
  public void matchFileTypeInAllFolders() throws Exception {
    String pathExpression = "*.md";
    assertMatch(pathExpression, "README.md", "docs/config.md", "foo/bar/README.md");
    assertNoMatch(pathExpression, "README", "README.md5", "README.txt");
  }

  @Test
  public void matchFolderInAllFolders() throws Exception {
    String pathExpression = "docs/";
    assertMatch(pathExpression, "docs/README.md", "docs/sub/config.md", "foo/docs/README.md");
    assertNoMatch(pathExpression, "docs.md", "mydocs/README.md", "README.md");
  }

  @Test
  public void folderPatternMatchesFolderPath() throws Exception {
    assertMatch("docs/", "docs");
  }

  @Test
  public void matchFolderWithInnerSlashIsAnchored() throws Exception {
    String pathExpression = "packages/a/";
    assertMatch(pathExpression, "packages/a/package.json", "packages/a/src/index.ts");
    assertNoMatch(
        pathExpression, "packages/ab/package.json", "other/packages/a/package.json", "a/foo");
  }

  @Test
  public void matchConcreteFileWithInnerSlash() throws Exception {
    String pathExpression = "config/db/database-setup.md";
    assertMatch(pathExpression, "config/db/database-setup.md");
    assertNoMatch(pathExpression, "database-setup.md", "sub/config/db/database-setup.md");
  }

  @Test
  public void doubleStarMatchesAnyNumberOfFolders() throws Exception {
    String pathExpression = "docs/**/*.md";
    assertMatch(pathExpression, "docs/README.md", "docs/sub/README.md", "docs/a/b/c/README.md");
    assertNoMatch(pathExpression, "README.md", "docs/README.txt", "other/docs/README.md");
  }

  @Test
  public void matchCharacterClass() throws Exception {
    String pathExpression = "[0-3]*.md";
    assertMatch(pathExpression, "001-file.md", "2-file.md");
    assertNoMatch(pathExpression, "5-file.md", "a-file.md");
  }

  @Test
  public void questionMarkMatchesSingleCharacter() throws Exception {
    String pathExpression = "a?c.txt";
    assertMatch(pathExpression, "abc.txt", "a1c.txt");
    assertNoMatch(pathExpression, "ac.txt", "abbc.txt");
  }

  @Test
  public void negatedPathExpressionNeverMatches() throws Exception {
    assertNoMatch("!foo.txt", "foo.txt", "bar.txt", "sub/foo.txt");
  }

  @Test
  public void invalidPathExpressionNeverMatches() throws Exception {
    assertNoMatch("[", "foo", "bar/baz", "README.md");
    assertNoMatch("a[b", "a", "ab", "a/b", "foo/bar");
    assertNoMatch("]]]", "foo", "bar/baz");
  }

  @Test
  public void rootFolderPathExpressionNeverMatches() throws Exception {
    assertNoMatch("/", "foo", "bar/baz", "README.md", "docs/config.md");
  }

  @Test
  public void pathWithLeadingSlashIsMatchedAsRelativePath() throws Exception {
    assertMatch("/package.json", "/package.json");
  }
}
