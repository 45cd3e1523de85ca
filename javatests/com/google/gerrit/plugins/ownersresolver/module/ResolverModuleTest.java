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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.gerrit.plugins.ownersresolver.backend.ChangeRequest;
import com.google.gerrit.plugins.ownersresolver.backend.CodeOwnerConfigFileReader;
import com.google.gerrit.plugins.ownersresolver.backend.CodeOwnerConfigParser;
import com.google.gerrit.plugins.ownersresolver.backend.CodeOwnersResolver;
import com.google.gerrit.plugins.ownersresolver.backend.GlobMatcher;
import com.google.gerrit.plugins.ownersresolver.backend.PathExpressionMatcher;
import com.google.gerrit.plugins.ownersresolver.backend.config.InvalidResolverConfigurationException;
import com.google.gerrit.plugins.ownersresolver.backend.fs.LocalCodeOwnerConfigFileReader;
import com.google.gerrit.plugins.ownersresolver.backend.git.GitCodeOwnerConfigFileReader;
import com.google.gerrit.plugins.ownersresolver.backend.sectioned.SectionedCodeOwnerConfigParser;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import java.io.File;
import org.eclipse.jgit.internal.storage.dfs.DfsRepositoryDescription;
import org.eclipse.jgit.internal.storage.dfs.InMemoryRepository;
import org.eclipse.jgit.junit.TestRepository;
import org.eclipse.jgit.lib.Config;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/** Tests for {@link ResolverModule}. */
public class ResolverModuleTest {
  @Rule public final TemporaryFolder temporaryFolder = new TemporaryFolder();

  private InMemoryRepository repository;
  private TestRepository<InMemoryRepository> testRepo;

  @Before
  public void setUp() throws Exception {
    repository = new InMemoryRepository(new DfsRepositoryDescription("test"));
    testRepo = new TestRepository<>(repository);
  }

  @Test
  public void resolveCodeOwnersOfBranch() throws Exception {
    RevCommit base =
        testRepo
            .branch("master")
            .commit()
            .message("Initial commit")
            .add(
                "CODEOWNERS",
                "* @john\n"
                    + "yarn.lock\n"
                    + "packages/a/ @maria\n"
                    + "packages/d/ @maria @jimmy\n"
                    + "packages/e/ @jimmy\n")
            .add("yarn.lock", "lock")
            .create();
    testRepo.branch("feature").update(base);
    testRepo
        .branch("feature")
        .commit()
        .message("Update packages")
        .add("packages/d/package.json", "{}")
        .add("packages/e/package.json", "{}")
        .add("yarn.lock", "new lock")
        .create();

    CodeOwnersResolver codeOwnersResolver =
        createInjector(new Config()).getInstance(CodeOwnersResolver.class);
    assertThat(codeOwnersResolver.codeOwnersFor(ChangeRequest.forBranch("feature")))
        .containsExactly("@jimmy", "@maria", "@john")
        .inOrder();
  }

  @Test
  public void resolveCodeOwnersOfCommitWithSectionedDialect() throws Exception {
    testRepo
        .branch("main")
        .commit()
        .message("Initial commit")
        .add("docs/CODEOWNERS", "* @general-approvers\n[Documentation] @docs-team\ndocs/\n")
        .create();
    RevCommit commit =
        testRepo
            .branch("main")
            .commit()
            .message("Update docs")
            .add("docs/index.md", "docs")
            .create();

    Config config = new Config();
    config.fromText("[codeOwners]\n  dialect = SECTIONED\n  targetBranch = main\n");
    CodeOwnersResolver codeOwnersResolver =
        createInjector(config).getInstance(CodeOwnersResolver.class);
    assertThat(
            codeOwnersResolver.codeOwnersFor(ChangeRequest.forCommit("feature", commit.name())))
        .containsExactly("@docs-team", "@general-approvers")
        .inOrder();
  }

  @Test
  public void noCodeOwnersIfTargetBranchIsMissing() throws Exception {
    testRepo
        .branch("feature")
        .commit()
        .message("Initial commit")
        .add("CODEOWNERS", "* @john")
        .create();
    CodeOwnersResolver codeOwnersResolver =
        createInjector(new Config()).getInstance(CodeOwnersResolver.class);
    assertThat(codeOwnersResolver.codeOwnersFor(ChangeRequest.forBranch("feature"))).isEmpty();
  }

  @Test
  public void configuredBindings() throws Exception {
    Config config = new Config();
    config.fromText("[codeOwners]\n  dialect = SECTIONED\n  pathExpressions = GLOB\n");
    Injector injector = createInjector(config);
    assertThat(injector.getInstance(CodeOwnerConfigParser.class))
        .isSameInstanceAs(SectionedCodeOwnerConfigParser.INSTANCE);
    assertThat(injector.getInstance(PathExpressionMatcher.class))
        .isSameInstanceAs(GlobMatcher.INSTANCE);
  }

  @Test
  public void bareRepositoryIsReadFromTargetBranch() throws Exception {
    assertThat(createInjector(new Config()).getInstance(CodeOwnerConfigFileReader.class))
        .isInstanceOf(GitCodeOwnerConfigFileReader.class);
  }

  @Test
  public void repositoryWithWorkTreeIsReadFromWorkTree() throws Exception {
    File workTree = temporaryFolder.newFolder("repo");
    try (Repository fileRepository = FileRepositoryBuilder.create(new File(workTree, ".git"))) {
      fileRepository.create();
      Injector injector = Guice.createInjector(new ResolverModule(fileRepository, new Config()));
      assertThat(injector.getInstance(CodeOwnerConfigFileReader.class))
          .isInstanceOf(LocalCodeOwnerConfigFileReader.class);
    }
  }

  @Test
  public void invalidConfiguration() throws Exception {
    Config config = new Config();
    config.fromText("[codeOwners]\n  dialect = GITEA\n");
    Injector injector = createInjector(config);
    ProvisionException exception =
        assertThrows(
            ProvisionException.class, () -> injector.getInstance(CodeOwnersResolver.class));
    assertThat(exception).hasCauseThat().isInstanceOf(InvalidResolverConfigurationException.class);
  }

  private Injector createInjector(Config config) {
    return Guice.createInjector(new ResolverModule(repository, config));
  }
}
