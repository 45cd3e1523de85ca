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

import static java.util.Objects.requireNonNull;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Computes the code owners that one section of a CODEOWNERS file defines for a path.
 *
 * <p>Of all rules in the section that match the path, the rule that was declared last wins. The
 * result depends on the winning rule:
 *
 * <ul>
 *   <li>no matching rule: no code owners, no fallback to the global code owners
 *   <li>the global rule ('*'): no specific code owners, fallback to the global code owners
 *   <li>an orphan rule: no code owners, no fallback to the global code owners
 *   <li>any other rule: the code owners of the rule, plus fallback to the global code owners
 * </ul>
 */
@Singleton
public class PathCodeOwners {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final PathExpressionMatcher pathExpressionMatcher;

  @Inject
  public PathCodeOwners(PathExpressionMatcher pathExpressionMatcher) {
    this.pathExpressionMatcher = pathExpressionMatcher;
  }

  /**
   * Resolves the contribution of the given section to the code owners of the given path.
   *
   * @param path path of a changed file, relative to the repository root
   * @param section the section whose rules should be evaluated
   * @return the contribution of the section
   */
  public PathCodeOwnersResult resolve(Path path, CodeOwnerSection section) {
    requireNonNull(path, "path");
    requireNonNull(section, "section");

    Optional<CodeOwnerRule> winningRule = getWinningRule(path, section);
    if (!winningRule.isPresent()) {
      return PathCodeOwnersResult.none();
    }

    CodeOwnerRule rule = winningRule.get();
    logger.atFine().log(
        "rule %s of section %s wins for %s",
        rule.pathExpression(), section.name().orElse("<default>"), path);
    if (rule.isGlobal()) {
      return PathCodeOwnersResult.fallbackOnly();
    }
    if (rule.isOrphan()) {
      return PathCodeOwnersResult.none();
    }
    return PathCodeOwnersResult.withCodeOwners(rule.codeOwners());
  }

  private Optional<CodeOwnerRule> getWinningRule(Path path, CodeOwnerSection section) {
    // later rules override earlier rules, hence the last matching rule wins
    return section.rules().reverse().stream()
        .filter(rule -> pathExpressionMatcher.matches(rule.pathExpression(), path))
        .findFirst();
  }
}
