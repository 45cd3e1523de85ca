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

package com.google.gerrit.plugins.ownersresolver.module;

import static java.util.Objects.requireNonNull;

import com.google.common.flogger.FluentLogger;
import com.google.gerrit.plugins.ownersresolver.backend.ChangedFilesProvider;
import com.google.gerrit.plugins.ownersresolver.backend.CodeOwnerConfigFileReader;
import com.google.gerrit.plugins.ownersresolver.backend.CodeOwnerConfigParser;
import com.google.gerrit.plugins.ownersresolver.backend.PathExpressionMatcher;
import com.google.gerrit.plugins.ownersresolver.backend.config.CodeOwnersResolverConfig;
import com.google.gerrit.plugins.ownersresolver.backend.fs.LocalCodeOwnerConfigFileReader;
import com.google.gerrit.plugins.ownersresolver.backend.git.GitChangedFilesProvider;
import com.google.gerrit.plugins.ownersresolver.backend.git.GitCodeOwnerConfigFileReader;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import org.eclipse.jgit.lib.Config;
import org.eclipse.jgit.lib.Repository;

/**
 * Guice module that binds the owners resolver for a git repository.
 *
 * <p>For a repository with a work tree the CODEOWNERS file is read from the work tree. For a bare
 * repository it is read from the target branch.
 */
public class ResolverModule extends AbstractModule {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Repository repository;
  private final Config config;

  /**
   * Creates the module.
   *
   * @param repository the repository for which code owners should be resolved
   * @param config config that contains the {@code codeOwners} section, see {@link
   *     CodeOwnersResolverConfig}
   */
  public ResolverModule(Repository repository, Config config) {
    this.repository = requireNonNull(repository, "repository");
    this.config = requireNonNull(config, "config");
  }

  @Override
  protected void configure() {
    bind(Repository.class).toInstance(repository);
  }

  @Provides
  @Singleton
  CodeOwnersResolverConfig provideCodeOwnersResolverConfig() {
    return new CodeOwnersResolverConfig(config);
  }

  @Provides
  CodeOwnerConfigParser provideCodeOwnerConfigParser(CodeOwnersResolverConfig resolverConfig) {
    return resolverConfig.getDialect().getParser();
  }

  @Provides
  PathExpressionMatcher providePathExpressionMatcher(CodeOwnersResolverConfig resolverConfig) {
    return resolverConfig.getPathExpressions().getMatcher();
  }

  @Provides
  @Singleton
  CodeOwnerConfigFileReader provideCodeOwnerConfigFileReader(
      CodeOwnersResolverConfig resolverConfig) {
    if (repository.isBare()) {
      logger.atFine().log(
          "reading code owner config files from branch %s", resolverConfig.getTargetBranch());
      return new GitCodeOwnerConfigFileReader(repository, resolverConfig.getTargetBranch());
    }
    return new LocalCodeOwnerConfigFileReader(repository.getWorkTree().toPath());
  }

  @Provides
  @Singleton
  ChangedFilesProvider provideChangedFilesProvider(CodeOwnersResolverConfig resolverConfig) {
    return new GitChangedFilesProvider(repository, resolverConfig.getTargetBranch());
  }
}
