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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.gerrit.plugins.ownersresolver.util.JgitPath;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import java.util.List;

/**
 * Ranks the code owners that one section of a CODEOWNERS file defines for the files of a change.
 *
 * <p>The ranked list consists of 2 parts:
 *
 * <ol>
 *   <li>the specific code owners (code owners of winning non-global rules), ranked by {@link
 *       CodeOwnerRanking}
 *   <li>the code owners of the global rule, in declaration order, if the global rule applies to at
 *       least one of the files (see {@link PathCodeOwnersResult#triggersFallback()})
 * </ol>
 *
 * <p>Global code owners that are also specific code owners are only listed once, at the position
 * of their specific ranking.
 */
@Singleton
public class CodeOwnerRanker {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final PathCodeOwners pathCodeOwners;

  @Inject
  public CodeOwnerRanker(PathCodeOwners pathCodeOwners) {
    this.pathCodeOwners = pathCodeOwners;
  }

  /**
   * Ranks the code owners of the given section for the given files.
   *
   * @param changedFiles paths of the changed files, relative to the repository root, in the order
   *     in which the code owners should be encountered
   * @param section the section for which the code owners should be ranked
   * @return the ranked code owners without duplicates, empty list if the section doesn't define
   *     code owners for any of the files
   */
  public ImmutableList<String> rank(List<String> changedFiles, CodeOwnerSection section) {
    requireNonNull(changedFiles, "changedFiles");
    requireNonNull(section, "section");

    CodeOwnerRanking.Builder ranking = CodeOwnerRanking.builder();
    boolean triggersFallback = false;
    for (int fileIndex = 0; fileIndex < changedFiles.size(); fileIndex++) {
      PathCodeOwnersResult result =
          pathCodeOwners.resolve(
              JgitPath.of(changedFiles.get(fileIndex)).getAsRelativePath(), section);
      ranking.addFileCodeOwners(fileIndex, result.specificCodeOwners());
      triggersFallback |= result.triggersFallback();
    }

    ImmutableSet.Builder<String> rankedCodeOwners = ImmutableSet.builder();
    rankedCodeOwners.addAll(ranking.build().rankedCodeOwners());
    if (triggersFallback) {
      section
          .globalRule()
          .ifPresent(globalRule -> rankedCodeOwners.addAll(globalRule.codeOwners()));
    }

    ImmutableList<String> result = rankedCodeOwners.build().asList();
    logger.atFine().log(
        "ranked code owners of section %s: %s", section.name().orElse("<default>"), result);
    return result;
  }
}
