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
import com.google.inject.Inject;
import com.google.inject.Singleton;
import java.io.IOException;
import java.util.Optional;

/**
 * Computes the code owners that should be asked to review a change.
 *
 * <p>The code owners are computed from the CODEOWNERS file of the repository and the files that
 * were touched by the change. Each section of the CODEOWNERS file is ranked separately (see {@link
 * CodeOwnerRanker}). The ranked code owners of the sections are concatenated, starting with the
 * section that was declared last. Code owners that appear in several sections are only listed once,
 * at their first position.
 *
 * <p>Resolving code owners never fails. If the CODEOWNERS file or the changed files cannot be
 * loaded, the failure is logged and no code owners are returned.
 */
@Singleton
public class CodeOwnersResolver {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final CodeOwnerConfigLoader codeOwnerConfigLoader;
  private final ChangedFilesProvider changedFilesProvider;
  private final CodeOwnerConfigParser codeOwnerConfigParser;
  private final CodeOwnerRanker codeOwnerRanker;

  @Inject
  public CodeOwnersResolver(
      CodeOwnerConfigLoader codeOwnerConfigLoader,
      ChangedFilesProvider changedFilesProvider,
      CodeOwnerConfigParser codeOwnerConfigParser,
      CodeOwnerRanker codeOwnerRanker) {
    this.codeOwnerConfigLoader = codeOwnerConfigLoader;
    this.changedFilesProvider = changedFilesProvider;
    this.codeOwnerConfigParser = codeOwnerConfigParser;
    this.codeOwnerRanker = codeOwnerRanker;
  }

  /**
   * Computes the code owners for the given change.
   *
   * @param changeRequest the change for which the code owners should be computed
   * @return the code owners in the order in which they should be suggested as reviewers, without
   *     duplicates, empty list if the code owners cannot be computed
   */
  public ImmutableList<String> codeOwnersFor(ChangeRequest changeRequest) {
    requireNonNull(changeRequest, "changeRequest");
    try {
      return computeCodeOwners(changeRequest);
    } catch (IOException | RuntimeException e) {
      logger.atWarning().withCause(e).log(
          "failed to compute code owners for branch %s", changeRequest.sourceBranch());
      return ImmutableList.of();
    }
  }

  private ImmutableList<String> computeCodeOwners(ChangeRequest changeRequest)
      throws IOException {
    Optional<String> codeOwnerConfigContent = codeOwnerConfigLoader.load();
    if (!codeOwnerConfigContent.isPresent()) {
      logger.atFine().log("no code owner config file, hence no code owners");
      return ImmutableList.of();
    }

    ImmutableList<String> changedFiles = getChangedFiles(changeRequest);
    if (changedFiles.isEmpty()) {
      logger.atFine().log("no changed files on branch %s", changeRequest.sourceBranch());
      return ImmutableList.of();
    }

    CodeOwnerConfig codeOwnerConfig = codeOwnerConfigParser.parse(codeOwnerConfigContent.get());

    ImmutableSet.Builder<String> codeOwners = ImmutableSet.builder();
    for (CodeOwnerSection section : codeOwnerConfig.sectionsByPriority()) {
      codeOwners.addAll(codeOwnerRanker.rank(changedFiles, section));
    }
    ImmutableList<String> result = codeOwners.build().asList();
    logger.atFine().log(
        "code owners for branch %s (%d changed files): %s",
        changeRequest.sourceBranch(), changedFiles.size(), result);
    return result;
  }

  private ImmutableList<String> getChangedFiles(ChangeRequest changeRequest) throws IOException {
    if (changeRequest.commitId().isPresent()) {
      return changedFilesProvider.getBranchFilesFromCommit(changeRequest.commitId().get());
    }
    return changedFilesProvider.getBranchFiles(changeRequest.sourceBranch());
  }
}
