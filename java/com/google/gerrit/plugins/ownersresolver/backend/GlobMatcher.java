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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.flogger.FluentLogger;
import com.google.gerrit.plugins.ownersresolver.util.JgitPath;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.util.regex.PatternSyntaxException;

/**
 * Matcher that checks for a given path expression as Java NIO glob if it matches a given path.
 *
 * <p>The anchoring rules of CODEOWNERS files are applied on top of the standard NIO globs:
 *
 * <ul>
 *   <li>a path expression without a leading or inner '/' matches in all folders, e.g. 'BUILD' is
 *       matched as '{**&#47;,}BUILD'
 *   <li>a path expression with a leading or inner '/' is anchored at the repository root
 *   <li>a path expression matches the path itself and all paths below it, e.g. 'docs/' is matched
 *       as 'docs{&#47;**,}'
 * </ul>
 *
 * <p>Otherwise all NIO glob features are available ('**', '?', '[a-c]', '{html,htm}'). Invalid
 * globs never match.
 */
public class GlobMatcher implements PathExpressionMatcher {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Singleton instance. */
  public static final GlobMatcher INSTANCE = new GlobMatcher();

  /** Private constructor to prevent creation of further instances. */
  private GlobMatcher() {}

  @Override
  public boolean matches(String pathExpression, Path relativePath) {
    String glob = asGlob(pathExpression);
    Path path = JgitPath.of(relativePath).getAsRelativePath();
    try {
      boolean isMatching = FileSystems.getDefault().getPathMatcher("glob:" + glob).matches(path);
      logger.atFine().log("path %s %s matching %s", path, isMatching ? "is" : "is not", glob);
      return isMatching;
    } catch (PatternSyntaxException e) {
      logger.atFine().log("glob %s is invalid: %s", glob, e.getMessage());
      return false;
    }
  }

  @VisibleForTesting
  static String asGlob(String pathExpression) {
    String glob = pathExpression;
    if (glob.endsWith("/")) {
      glob = glob.substring(0, glob.length() - 1);
    }
    boolean anchored = glob.contains("/");
    if (glob.startsWith("/")) {
      glob = glob.substring(1);
    }
    if (!anchored && !glob.startsWith("**")) {
      glob = "{**/,}" + glob;
    }
    return glob + "{/**,}";
  }
}
