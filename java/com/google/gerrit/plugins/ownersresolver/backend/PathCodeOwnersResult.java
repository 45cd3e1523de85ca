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
import com.google.common.collect.ImmutableList;

/**
 * The contribution of one section to the code owners of one file, as computed by {@link
 * PathCodeOwners}.
 */
@AutoValue
public abstract class PathCodeOwnersResult {
  private static final PathCodeOwnersResult NONE =
      new AutoValue_PathCodeOwnersResult(ImmutableList.of(), /* triggersFallback= */ false);

  private static final PathCodeOwnersResult FALLBACK_ONLY =
      new AutoValue_PathCodeOwnersResult(ImmutableList.of(), /* triggersFallback= */ true);

  /**
   * The code owners of the rule that won for the file.
   *
   * <p>Empty if no rule matched, if the global rule won or if an orphan rule won.
   */
  public abstract ImmutableList<String> specificCodeOwners();

  /** Whether the owners of the section's global rule should be suggested for the file. */
  public abstract boolean triggersFallback();

  /** Result for a file that no rule matched or that an orphan rule won. */
  public static PathCodeOwnersResult none() {
    return NONE;
  }

  /** Result for a file that the global rule won. */
  public static PathCodeOwnersResult fallbackOnly() {
    return FALLBACK_ONLY;
  }

  /**
   * Result for a file that a rule with code owners won.
   *
   * @param codeOwners the code owners of the winning rule, must not be empty
   */
  public static PathCodeOwnersResult withCodeOwners(ImmutableList<String> codeOwners) {
    requireNonNull(codeOwners, "codeOwners");
    checkState(!codeOwners.isEmpty(), "code owners cannot be empty");
    return new AutoValue_PathCodeOwnersResult(codeOwners, /* triggersFallback= */ true);
  }
}
