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

import com.google.common.collect.ImmutableList;
import java.io.IOException;

/** Enumerates the files that have been changed by a proposed change. */
public interface ChangedFilesProvider {
  /**
   * Gets the files that have been changed on a branch.
   *
   * @param branch the branch that contains the proposed change
   * @return paths of the changed files relative to the repository root
   * @throws IOException thrown if the changed files cannot be computed
   */
  ImmutableList<String> getBranchFiles(String branch) throws IOException;

  /**
   * Gets the files that have been changed by a commit.
   *
   * @param commitId the SHA-1 of the commit
   * @return paths of the changed files relative to the repository root
   * @throws IOException thrown if the changed files cannot be computed
   */
  ImmutableList<String> getBranchFilesFromCommit(String commitId) throws IOException;
}
