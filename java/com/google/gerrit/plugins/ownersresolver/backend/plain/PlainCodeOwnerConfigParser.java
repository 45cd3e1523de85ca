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

package com.google.gerrit.plugins.ownersresolver.backend.plain;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.gerrit.plugins.ownersresolver.backend.CodeOwnerConfig;
import com.google.gerrit.plugins.ownersresolver.backend.CodeOwnerConfigLines;
import com.google.gerrit.plugins.ownersresolver.backend.CodeOwnerConfigParser;
import com.google.gerrit.plugins.ownersresolver.backend.CodeOwnerRule;
import com.google.gerrit.plugins.ownersresolver.backend.CodeOwnerSection;

/**
 * Parser for the plain CODEOWNERS syntax that is shared by several hosting platforms.
 *
 * <p>Each line consists of a path expression followed by zero or more code owners:
 *
 * <pre>
 * # comment
 * *                  &#64;global-owner
 * docs/              &#64;docs-team &#64;jane
 * yarn.lock
 * </pre>
 *
 * <p>All rules are added to a single default section. A line without code owners creates an
 * orphan rule.
 */
public class PlainCodeOwnerConfigParser implements CodeOwnerConfigParser {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Singleton instance. */
  public static final PlainCodeOwnerConfigParser INSTANCE = new PlainCodeOwnerConfigParser();

  /** Private constructor to prevent creation of further instances. */
  private PlainCodeOwnerConfigParser() {}

  @Override
  public CodeOwnerConfig parse(String codeOwnerConfigAsString) {
    CodeOwnerSection.Builder defaultSection = CodeOwnerSection.builder();
    int ruleCount = 0;
    for (String line : CodeOwnerConfigLines.cleanedLines(codeOwnerConfigAsString)) {
      ImmutableList<String> tokens = CodeOwnerConfigLines.tokens(line);
      defaultSection.addRule(
          CodeOwnerRule.create(tokens.get(0), tokens.subList(1, tokens.size())));
      ruleCount++;
    }

    CodeOwnerConfig.Builder codeOwnerConfig = CodeOwnerConfig.builder();
    if (ruleCount > 0) {
      codeOwnerConfig.addSection(defaultSection.build());
    }
    logger.atFine().log("parsed %d rules", ruleCount);
    return codeOwnerConfig.build();
  }
}
