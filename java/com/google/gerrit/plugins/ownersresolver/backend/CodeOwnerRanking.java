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
import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ranking of the specific code owners of one section across all files of a change.
 *
 * <p>Code owners that own more of the changed files rank higher. Code owners that own the same
 * number of files keep the order in which they were first encountered: first by the index of the
 * file that introduced them, then by their position in the code owner list of the rule that won
 * for that file.
 *
 * <p>A ranking is built for a single resolution and is not shared between threads.
 */
public class CodeOwnerRanking {
  private static final Comparator<Entry> BY_RANK =
      Comparator.<Entry>comparingInt(Entry::fileCount)
          .reversed()
          .thenComparingInt(Entry::firstFileIndex)
          .thenComparingInt(Entry::firstPosition);

  /** Creates a builder for a {@link CodeOwnerRanking}. */
  public static Builder builder() {
    return new Builder();
  }

  private final ImmutableList<Entry> entries;

  private CodeOwnerRanking(ImmutableList<Entry> entries) {
    this.entries = entries;
  }

  /** The ranked code owners, best ranked code owner first. */
  public ImmutableList<String> rankedCodeOwners() {
    return entries.stream().map(Entry::codeOwner).collect(toImmutableList());
  }

  /**
   * Returns the number of files that the given code owner owns.
   *
   * @param codeOwner the code owner
   * @return the number of files owned by the code owner, {@link Optional#empty()} if the code owner
   *     was not ranked
   */
  @VisibleForTesting
  Optional<Integer> fileCount(String codeOwner) {
    return entries.stream()
        .filter(entry -> entry.codeOwner().equals(codeOwner))
        .map(Entry::fileCount)
        .findFirst();
  }

  public static class Builder {
    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private int lastFileIndex = -1;

    private Builder() {}

    /**
     * Records the specific code owners of a file.
     *
     * <p>Files must be added in the order of the changed files. Each code owner is counted at most
     * once per file, even if it appears several times in the code owner list.
     *
     * @param fileIndex the index of the file in the list of changed files
     * @param codeOwners the specific code owners of the file
     * @return the Builder instance for chaining calls
     */
    public Builder addFileCodeOwners(int fileIndex, ImmutableList<String> codeOwners) {
      requireNonNull(codeOwners, "codeOwners");
      checkState(fileIndex >= 0, "file index cannot be negative: %s", fileIndex);
      checkState(
          fileIndex > lastFileIndex,
          "files must be added in order: %s after %s",
          fileIndex,
          lastFileIndex);
      lastFileIndex = fileIndex;

      Set<String> countedForFile = new HashSet<>();
      for (int position = 0; position < codeOwners.size(); position++) {
        String codeOwner = codeOwners.get(position);
        if (!countedForFile.add(codeOwner)) {
          continue;
        }
        Entry entry = entries.get(codeOwner);
        if (entry == null) {
          entries.put(codeOwner, new Entry(codeOwner, fileIndex, position));
        } else {
          entry.fileCount++;
        }
      }
      return this;
    }

    /** Builds the {@link CodeOwnerRanking} instance. */
    public CodeOwnerRanking build() {
      return new CodeOwnerRanking(
          entries.values().stream().sorted(BY_RANK).collect(toImmutableList()));
    }
  }

  private static class Entry {
    private final String codeOwner;
    private final int firstFileIndex;
    private final int firstPosition;
    private int fileCount = 1;

    Entry(String codeOwner, int firstFileIndex, int firstPosition) {
      this.codeOwner = codeOwner;
      this.firstFileIndex = firstFileIndex;
      this.firstPosition = firstPosition;
    }

    String codeOwner() {
      return codeOwner;
    }

    int firstFileIndex() {
      return firstFileIndex;
    }

    int firstPosition() {
      return firstPosition;
    }

    int fileCount() {
      return fileCount;
    }
  }
}
