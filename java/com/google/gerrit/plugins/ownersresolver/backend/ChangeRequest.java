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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.auto.value.AutoValue;
import java.util.Optional;

/**
 * A proposed change (pull request, merge request) for which code owners should be suggested as
 * reviewers.
 */
@AutoValue
public abstract class ChangeRequest {
  /** The branch that contains the proposed change. */
  public abstract String sourceBranch();

  /**
   * The commit of the change whose files should be inspected.
   *
   * <p>If set, the changed files are the files that were touched by this commit. Otherwise the
   * changed files are all files that were touched on the {@link #sourceBranch()}.
   */
  public abstract Optional<String> commitId();

  /**
   * Creates a {@link ChangeRequest} for all files that were changed on a branch.
   *
   * @param sourceBranch the branch that contains the proposed change
   */
  public static ChangeRequest forBranch(String sourceBranch) {
    return builder(sourceBranch).build();
  }

  /**
   * Creates a {@link ChangeRequest} for the files that were changed by a commit.
   *
   * @param sourceBranch the branch that contains the proposed change
   * @param commitId the SHA-1 of the commit
   */
  public static ChangeRequest forCommit(String sourceBranch, String commitId) {
    return builder(sourceBranch).setCommitId(requireNonNull(commitId, "commitId")).build();
  }

  /**
   * Creates a builder for a {@link ChangeRequest}.
   *
   * @param sourceBranch the branch that contains the proposed change
   */
  public static Builder builder(String sourceBranch) {
    return new AutoValue_ChangeRequest.Builder()
        .setSourceBranch(requireNonNull(sourceBranch, "sourceBranch"));
  }

  @AutoValue.Builder
  public abstract static class Builder {
    abstract Builder setSourceBranch(String sourceBranch);

    /**
     * Sets the commit whose changed files should be inspected.
     *
     * @param commitId the SHA-1 of the commit
     * @return the Builder instance for chaining calls
     */
    public abstract Builder setCommitId(String commitId);

    abstract ChangeRequest autoBuild();

    /** Builds the {@link ChangeRequest} instance. */
    public ChangeRequest build() {
      ChangeRequest changeRequest = autoBuild();
      checkState(!changeRequest.sourceBranch().isEmpty(), "source branch cannot be empty");
      checkState(
          !changeRequest.commitId().isPresent() || !changeRequest.commitId().get().isEmpty(),
          "commit ID cannot be empty");
      return changeRequest;
    }
  }
}
