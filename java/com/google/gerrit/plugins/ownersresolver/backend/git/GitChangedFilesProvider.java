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

package com.google.gerrit.plugins.ownersresolver.backend.git;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.gerrit.plugins.ownersresolver.backend.ChangedFilesProvider;
import java.io.IOException;
import java.util.List;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.revwalk.filter.RevFilter;
import org.eclipse.jgit.treewalk.EmptyTreeIterator;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.eclipse.jgit.treewalk.filter.TreeFilter;

/**
 * Computes the files that have been changed on a branch or by a commit of a git repository.
 *
 * <p>Renames are not detected: a renamed file is reported by its old path and by its new path.
 * Deleted files are reported by their old path. The returned paths are sorted and distinct.
 */
public class GitChangedFilesProvider implements ChangedFilesProvider {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Repository repository;
  private final String targetBranch;

  /**
   * Creates a provider for the given repository.
   *
   * @param repository the repository that contains the changes
   * @param targetBranch the branch into which the changes should be integrated, the files of a
   *     source branch are the files that were changed since the source branch diverged from it
   */
  public GitChangedFilesProvider(Repository repository, String targetBranch) {
    this.repository = requireNonNull(repository, "repository");
    this.targetBranch = requireNonNull(targetBranch, "targetBranch");
  }

  /**
   * Gets the files that have been changed on the given branch since it diverged from the target
   * branch.
   *
   * @throws IOException thrown if one of the branches doesn't exist, if the branches have no common
   *     history or if the repository cannot be read
   */
  @Override
  public ImmutableList<String> getBranchFiles(String branch) throws IOException {
    requireNonNull(branch, "branch");
    try (RevWalk revWalk = new RevWalk(repository)) {
      RevCommit source = revWalk.parseCommit(resolve(branch));
      RevCommit target = revWalk.parseCommit(resolve(targetBranch));

      revWalk.setRevFilter(RevFilter.MERGE_BASE);
      revWalk.markStart(source);
      revWalk.markStart(target);
      RevCommit mergeBase = revWalk.next();
      if (mergeBase == null) {
        throw new IOException(
            String.format("branches %s and %s have no common history", branch, targetBranch));
      }
      logger.atFine().log(
          "merge base of %s and %s is %s", branch, targetBranch, mergeBase.name());

      revWalk.reset();
      revWalk.setRevFilter(RevFilter.ALL);
      return diff(revWalk, revWalk.parseCommit(mergeBase), revWalk.parseCommit(source));
    }
  }

  /**
   * Gets the files that have been changed by the given commit, compared to its first parent. For
   * an initial commit all files of the commit are returned.
   *
   * @throws IOException thrown if the commit doesn't exist or if the repository cannot be read
   */
  @Override
  public ImmutableList<String> getBranchFilesFromCommit(String commitId) throws IOException {
    requireNonNull(commitId, "commitId");
    try (RevWalk revWalk = new RevWalk(repository)) {
      RevCommit commit = revWalk.parseCommit(resolve(commitId));
      if (commit.getParentCount() == 0) {
        return diff(revWalk, /* base= */ null, commit);
      }
      return diff(revWalk, revWalk.parseCommit(commit.getParent(0)), commit);
    }
  }

  private ObjectId resolve(String revision) throws IOException {
    ObjectId objectId = repository.resolve(revision);
    if (objectId == null) {
      throw new IOException(String.format("revision %s not found", revision));
    }
    return objectId;
  }

  /**
   * Diffs the tree of {@code commit} against the tree of {@code base}.
   *
   * @param base the commit to compare against, {@code null} to compare against the empty tree
   */
  private ImmutableList<String> diff(RevWalk revWalk, RevCommit base, RevCommit commit)
      throws IOException {
    try (TreeWalk treeWalk = new TreeWalk(repository, revWalk.getObjectReader())) {
      treeWalk.setRecursive(true);
      treeWalk.setFilter(TreeFilter.ANY_DIFF);
      if (base != null) {
        treeWalk.addTree(base.getTree());
      } else {
        treeWalk.addTree(new EmptyTreeIterator());
      }
      treeWalk.addTree(commit.getTree());

      List<DiffEntry> diffEntries = DiffEntry.scan(treeWalk);
      ImmutableList<String> changedFiles =
          diffEntries.stream()
              .map(GitChangedFilesProvider::getPath)
              .sorted()
              .distinct()
              .collect(toImmutableList());
      logger.atFine().log("%d changed files in %s", changedFiles.size(), commit.name());
      return changedFiles;
    }
  }

  private static String getPath(DiffEntry diffEntry) {
    return diffEntry.getChangeType() == DiffEntry.ChangeType.DELETE
        ? diffEntry.getOldPath()
        : diffEntry.getNewPath();
  }
}
