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

import com.google.common.flogger.FluentLogger;
import com.google.gerrit.plugins.ownersresolver.util.JgitPath;
import java.nio.file.Path;
import org.eclipse.jgit.ignore.FastIgnoreRule;

/**
 * Matcher that interprets path expressions the way {@code .gitignore} patterns are interpreted,
 * which is how CODEOWNERS files are specified by the hosting platforms.
 *
 * <ul>
 *   <li>'*': matches any string that does not include slashes
 *   <li>'**': matches any string, including slashes
 *   <li>'?': matches any character except a slash
 *   <li>'[a-c]': matches one character from the range given in the bracket
 *   <li>a trailing '/' restricts the pattern to a folder and matches all files below it
 *   <li>a pattern without a leading or inner '/' matches a file or folder name at any depth
 *   <li>a pattern with a leading or inner '/' is anchored at the repository root
 * </ul>
 *
 * <p>Negated patterns ('!foo') are not supported in CODEOWNERS files and never match.
 */
public class GitignoreMatcher implements PathExpressionMatcher {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Singleton instance. */
  public static final GitignoreMatcher INSTANCE = new GitignoreMatcher();

  /** Private constructor to prevent creation of further instances. */
  private GitignoreMatcher() {}

  @Override
  public boolean matches(String pathExpression, Path relativePath) {
    String path = JgitPath.of(relativePath).get();
    if (pathExpression.isEmpty() || path.isEmpty()) {
      return false;
    }
    if (pathExpression.startsWith("!")) {
      logger.atFine().log("negated path expression %s is not supported", pathExpression);
      return false;
    }

    FastIgnoreRule rule = new FastIgnoreRule(pathExpression);
    // a folder pattern also applies to a changed path that names the folder itself
    boolean isMatching =
        rule.isMatch(path, /* directory= */ false)
            || (rule.dirOnly() && rule.isMatch(path, /* directory= */ true));
    logger.atFine().log(
        "path %s %s matching %s", path, isMatching ? "is" : "is not", pathExpression);
    return isMatching;
  }
}
