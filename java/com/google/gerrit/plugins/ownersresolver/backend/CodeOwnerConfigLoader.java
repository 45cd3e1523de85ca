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

import com.google.common.flogger.FluentLogger;
import com.google.gerrit.plugins.ownersresolver.backend.config.CodeOwnersResolverConfig;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import java.io.IOException;
import java.util.Optional;

/**
 * Locates the CODEOWNERS file of a repository and loads its content.
 *
 * <p>The configured candidate paths are tried in order. The first file that exists and is not
 * empty wins, files at later candidate paths are not read.
 */
@Singleton
public class CodeOwnerConfigLoader {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final CodeOwnersResolverConfig config;
  private final CodeOwnerConfigFileReader codeOwnerConfigFileReader;

  @Inject
  public CodeOwnerConfigLoader(
      CodeOwnersResolverConfig config, CodeOwnerConfigFileReader codeOwnerConfigFileReader) {
    this.config = config;
    this.codeOwnerConfigFileReader = codeOwnerConfigFileReader;
  }

  /**
   * Loads the content of the CODEOWNERS file.
   *
   * @return the content of the first non-empty CODEOWNERS file, {@link Optional#empty()} if none
   *     of the candidate paths has a non-empty file
   * @throws IOException thrown if an existing file cannot be read
   */
  public Optional<String> load() throws IOException {
    for (String filePath : config.getConfigFiles()) {
      Optional<String> content = codeOwnerConfigFileReader.read(filePath);
      if (content.isPresent() && !content.get().isEmpty()) {
        logger.atFine().log("using code owner config file %s", filePath);
        return content;
      }
      logger.atFine().log("no code owner config file at %s", filePath);
    }
    logger.atFine().log("no code owner config file found");
    return Optional.empty();
  }
}
