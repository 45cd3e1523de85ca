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

package com.google.gerrit.plugins.ownersresolver.backend.fs;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import com.google.common.flogger.FluentLogger;
import com.google.gerrit.plugins.ownersresolver.backend.CodeOwnerConfigFileReader;
import com.google.gerrit.plugins.ownersresolver.util.JgitPath;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;

/** Reads files from the work tree of a checked out repository. */
public class LocalCodeOwnerConfigFileReader implements CodeOwnerConfigFileReader {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Path workTree;

  /**
   * Creates a reader for the given work tree.
   *
   * @param workTree root directory of the work tree
   */
  public LocalCodeOwnerConfigFileReader(Path workTree) {
    this.workTree = requireNonNull(workTree, "workTree").toAbsolutePath().normalize();
  }

  @Override
  public Optional<String> read(String filePath) throws IOException {
    requireNonNull(filePath, "filePath");
    JgitPath jgitPath = JgitPath.of(filePath);
    if (jgitPath.isRoot()) {
      return Optional.empty();
    }

    Path file = workTree.resolve(jgitPath.get()).normalize();
    if (!file.startsWith(workTree)) {
      logger.atFine().log(
          "ignoring %s since it is outside of the work tree %s", filePath, workTree);
      return Optional.empty();
    }
    if (!Files.isRegularFile(file)) {
      return Optional.empty();
    }

    try {
      return Optional.of(new String(Files.readAllBytes(file), UTF_8));
    } catch (NoSuchFileException e) {
      // the file was deleted after the existence check
      logger.atFine().withCause(e).log("%s vanished", file);
      return Optional.empty();
    }
  }
}
