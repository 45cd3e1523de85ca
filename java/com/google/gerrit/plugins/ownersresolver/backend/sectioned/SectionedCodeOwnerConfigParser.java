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

package com.google.gerrit.plugins.ownersresolver.backend.sectioned;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.gerrit.plugins.ownersresolver.backend.CodeOwnerConfig;
import com.google.gerrit.plugins.ownersresolver.backend.CodeOwnerConfigLines;
import com.google.gerrit.plugins.ownersresolver.backend.CodeOwnerConfigParser;
import com.google.gerrit.plugins.ownersresolver.backend.CodeOwnerSection;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for the sectioned CODEOWNERS syntax in which rules are grouped into named sections.
 *
 * <pre>
 * # rules before the first section header belong to the default section
 * * &#64;general-approvers
 *
 * [Documentation] &#64;docs-team
 * docs/
 * README.md &#64;tech-writers
 *
 * ^[Optional][2] &#64;optional-team
 * optional/
 * </pre>
 *
 * <p>A section header must start at the beginning of the (trimmed) line. It consists of an optional
 * '^' that marks the section as optional, the section name in square brackets, an optional number
 * of required approvals in square brackets and the default code owners of the section. The
 * brackets must be followed by whitespace or the end of the line, so that a path expression with a
 * character class (e.g. '[0-3]*.md') is not taken for a section header.
 *
 * <p>Rules without code owners inherit the default code owners of their section. Rules with code
 * owners override the default code owners for the matching files.
 */
public class SectionedCodeOwnerConfigParser implements CodeOwnerConfigParser {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Singleton instance. */
  public static final SectionedCodeOwnerConfigParser INSTANCE =
      new SectionedCodeOwnerConfigParser();

  /** Private constructor to prevent creation of further instances. */
  private SectionedCodeOwnerConfigParser() {}

  @Override
  public CodeOwnerConfig parse(String codeOwnerConfigAsString) {
    return new Parser().parse(codeOwnerConfigAsString);
  }

  /** Parser state for a single file. A new instance is created for each file that is parsed. */
  @VisibleForTesting
  static class Parser {
    // PAT_SECTION_HEADER matches a line to four groups: (1) optional marker, (2) section name,
    // (3) number of required approvals, (4) default code owners
    private static final Pattern PAT_SECTION_HEADER =
        Pattern.compile("^(\\^)?\\[([^\\[\\]]+)\\](?:\\[(\\d+)\\])?(?:\\s+(.*))?$");

    private CodeOwnerSection.Builder currentSection = CodeOwnerSection.builder();
    private boolean currentSectionHasRules;
    private final List<CodeOwnerSection> sections = new ArrayList<>();

    CodeOwnerConfig parse(String codeOwnerConfigAsString) {
      for (String line : CodeOwnerConfigLines.cleanedLines(codeOwnerConfigAsString)) {
        parseLine(line);
      }
      finishCurrentSection();

      CodeOwnerConfig.Builder codeOwnerConfig = CodeOwnerConfig.builder();
      sections.forEach(codeOwnerConfig::addSection);
      return codeOwnerConfig.build();
    }

    private void parseLine(String line) {
      CodeOwnerSection.Builder sectionHeader;
      if ((sectionHeader = parseSectionHeader(line)) != null) {
        finishCurrentSection();
        currentSection = sectionHeader;
        // named sections are kept even without rules, the default section only if it has rules
        currentSectionHasRules = true;
      } else {
        ImmutableList<String> tokens = CodeOwnerConfigLines.tokens(line);
        currentSection.addRuleInheritingDefaults(tokens.get(0), tokens.subList(1, tokens.size()));
        currentSectionHasRules = true;
      }
    }

    private void finishCurrentSection() {
      if (currentSectionHasRules) {
        sections.add(currentSection.build());
      }
      currentSectionHasRules = false;
    }

    @VisibleForTesting
    static CodeOwnerSection.Builder parseSectionHeader(String line) {
      Matcher m = PAT_SECTION_HEADER.matcher(line);
      if (!m.matches()) {
        return null;
      }

      String name = m.group(2).trim();
      if (name.isEmpty()) {
        logger.atFine().log("ignoring section header without name: %s", line);
        return null;
      }

      CodeOwnerSection.Builder section =
          CodeOwnerSection.builder(name)
              .setOptional(m.group(1) != null)
              .setDefaultCodeOwners(CodeOwnerConfigLines.tokens(Strings.nullToEmpty(m.group(4))));
      if (m.group(3) != null) {
        try {
          section.setRequiredApprovals(Integer.parseInt(m.group(3)));
        } catch (NumberFormatException e) {
          logger.atFine().log("ignoring invalid number of required approvals in %s", line);
        }
      }
      return section;
    }
  }
}
