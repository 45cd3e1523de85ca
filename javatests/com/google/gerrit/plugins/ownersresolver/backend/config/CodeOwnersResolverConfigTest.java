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

package com.google.gerrit.plugins.ownersresolver.backend.config;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.gerrit.plugins.ownersresolver.backend.CodeOwnersDialect;
import com.google.gerrit.plugins.ownersresolver.backend.PathExpressions;
import org.eclipse.jgit.errors.ConfigInvalidException;
import org.eclipse.jgit.lib.Config;
import org.junit.Test;

/** Tests for {@link CodeOwnersResolverConfig}. */
public class CodeOwnersResolverConfigTest {
  @Test
  public void defaults() throws Exception {
    CodeOwnersResolverConfig config = CodeOwnersResolverConfig.createDefault();
    assertThat(config.getConfigFiles())
        .containsExactly(
            "CODEOWNERS", ".github/CODEOWNERS", ".gitlab/CODEOWNERS", "docs/CODEOWNERS")
        .inOrder();
    assertThat(config.getDialect()).isEqualTo(CodeOwnersDialect.DEFAULT);
    assertThat(config.getPathExpressions()).isEqualTo(PathExpressions.GITIGNORE);
    assertThat(config.getTargetBranch()).isEqualTo("master");
    assertThat(config.validate()).isEmpty();
  }

  @Test
  public void configuredValues() throws Exception {
    CodeOwnersResolverConfig config =
        CodeOwnersResolverConfig.fromText(
            "[codeOwners]\n"
                + "  configFile = /OWNERS\n"
                + "  configFile = .github/CODEOWNERS\n"
                + "  dialect = sectioned\n"
                + "  pathExpressions = GLOB\n"
                + "  targetBranch = main\n");
    assertThat(config.getConfigFiles()).containsExactly("OWNERS", ".github/CODEOWNERS").inOrder();
    assertThat(config.getDialect()).isEqualTo(CodeOwnersDialect.SECTIONED);
    assertThat(config.getPathExpressions()).isEqualTo(PathExpressions.GLOB);
    assertThat(config.getTargetBranch()).isEqualTo("main");
    assertThat(config.validate()).isEmpty();
  }

  @Test
  public void wrapsExistingConfig() throws Exception {
    Config cfg = new Config();
    cfg.setString(
        CodeOwnersResolverConfig.SECTION_CODE_OWNERS,
        /* subsection= */ null,
        CodeOwnersResolverConfig.KEY_DIALECT,
        "SECTIONED");
    CodeOwnersResolverConfig config = new CodeOwnersResolverConfig(cfg);
    assertThat(config.getDialect()).isEqualTo(CodeOwnersDialect.SECTIONED);
    assertThat(config.getConfig()).isSameInstanceAs(cfg);
  }

  @Test
  public void invalidDialect() throws Exception {
    CodeOwnersResolverConfig config =
        CodeOwnersResolverConfig.fromText("[codeOwners]\n  dialect = GITEA\n");
    InvalidResolverConfigurationException exception =
        assertThrows(InvalidResolverConfigurationException.class, config::getDialect);
    assertThat(exception)
        .hasMessageThat()
        .isEqualTo(
            "Invalid configuration of the owners resolver. Value 'GITEA' that is configured"
                + " (parameter codeOwners.dialect) is invalid.");
    assertThat(config.validate())
        .containsExactly(
            "Dialect 'GITEA' that is configured (parameter codeOwners.dialect) not found.");
  }

  @Test
  public void invalidPathExpressions() throws Exception {
    CodeOwnersResolverConfig config =
        CodeOwnersResolverConfig.fromText("[codeOwners]\n  pathExpressions = REGEX\n");
    assertThrows(InvalidResolverConfigurationException.class, config::getPathExpressions);
    assertThat(config.validate())
        .containsExactly(
            "Path expressions 'REGEX' that are configured (parameter codeOwners.pathExpressions)"
                + " not found.");
  }

  @Test
  public void configFileThatIsNotAFilePath() throws Exception {
    CodeOwnersResolverConfig config =
        CodeOwnersResolverConfig.fromText("[codeOwners]\n  configFile = /\n");
    assertThrows(InvalidResolverConfigurationException.class, config::getConfigFiles);
    assertThat(config.validate())
        .containsExactly(
            "Config file '/' that is configured (parameter codeOwners.configFile) is not a file"
                + " path.");
  }

  @Test
  public void emptyTargetBranchFallsBackToDefault() throws Exception {
    CodeOwnersResolverConfig config =
        CodeOwnersResolverConfig.fromText("[codeOwners]\n  targetBranch = \"  \"\n");
    assertThat(config.getTargetBranch()).isEqualTo("master");
    assertThat(config.validate())
        .containsExactly(
            "Target branch that is configured (parameter codeOwners.targetBranch) is empty.");
  }

  @Test
  public void invalidConfigSyntax() throws Exception {
    assertThrows(
        ConfigInvalidException.class, () -> CodeOwnersResolverConfig.fromText("[codeOwners"));
  }
}
