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

import static java.util.Objects.requireNonNull;

import com.google.common.flogger.FluentLogger;
import com.google.gerrit.plugins.ownersresolver.backend.CodeOwnerConfigFileReader;
import com.google.gerrit.plugins.ownersresolver.util.JgitPath;
import java.io.IOException;
import java.util.Optional;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.FileMode;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectLoader;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.eclipse.jgit.util.RawParseUtils;

/**
 * Reads files from a revision of a git repository.
 *
 * <p>Used for bare repositories that don't have a work tree.
 */
public class GitCodeOwnerConfigFileReader implements CodeOwnerConfigFileReader {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Repository repository;
  private final String revision;

  /**
   * Creates a reader for the given revision.
   *
   * @param repository the repository from which the files should be read
   * @param revision the revision from which the files should be read, e.g. a branch name or a
   *     commit SHA-1
   */
  public GitCodeOwnerConfigFileReader(Repository repository, String revision) {
    this.repository = requireNonNull(repository, "repository");
    this.revision = requireNonNull(revision, "revision");
  }

  @Override
  public Optional<String> read(String filePath) throws IOException {
    requireNonNull(filePath, "filePath");
    JgitPath jgitPath = JgitPath.of(filePath);
    if (jgitPath.isRoot()) {
      return Optional.empty();
    }

    ObjectId revisionId = repository.resolve(revision);
    if (revisionId == null) {
      logger.atFine().log("revision %s not found", revision);
      return Optional.empty();
    }

    try (RevWalk revWalk = new RevWalk(repository)) {
      RevCommit commit = revWalk.parseCommit(revisionId);
      ObjectReader reader = revWalk.getObjectReader();
      try (TreeWalk treeWalk = TreeWalk.forPath(reader, jgitPath.get(), commit.getTree())) {
        if (treeWalk == null) {
          return Optional.empty();
        }
        if ((treeWalk.getRawMode(0) & FileMode.TYPE_MASK) != FileMode.TYPE_FILE) {
          logger.atFine().log("%s is not a regular file in revision %s", filePath, revision);
          return Optional.empty();
        }
        ObjectLoader obj = reader.open(treeWalk.getObjectId(0), Constants.OBJ_BLOB);
        byte[] raw = obj.getCachedBytes(Integer.MAX_VALUE);
        return Optional.of(raw.length != 0 ? RawParseUtils.decode(raw) : "");
      }
    }
  }
}
