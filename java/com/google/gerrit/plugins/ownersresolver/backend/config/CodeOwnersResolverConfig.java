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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.gerrit.plugins.ownersresolver.backend.CodeOwnersDialect;
import com.google.gerrit.plugins.ownersresolver.backend.PathExpressions;
import com.google.gerrit.plugins.ownersresolver.util.JgitPath;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.eclipse.jgit.errors.ConfigInvalidException;
import org.eclipse.jgit.lib.Config;

/**
 * Class to read the configuration of the owners resolver.
 *
 * <p>The configuration uses the git config syntax:
 *
 * <pre>
 * [codeOwners]
 *   configFile = CODEOWNERS
 *   configFile = .github/CODEOWNERS
 *   dialect = SECTIONED
 *   pathExpressions = GITIGNORE
 *   targetBranch = main
 * </pre>
 *
 * <p>All parameters are optional. Parameters that are not set fall back to their defaults.
 */
public class CodeOwnersResolverConfig {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static final String SECTION_CODE_OWNERS = "codeOwners";

  public static final String KEY_CONFIG_FILE = "configFile";
  public static final String KEY_DIALECT = "dialect";
  public static final String KEY_PATH_EXPRESSIONS = "pathExpressions";
  public static final String KEY_TARGET_BRANCH = "targetBranch";

  /** The paths at which CODEOWNERS files are looked up by default, in lookup order. */
  public static final ImmutableList<String> DEFAULT_CONFIG_FILES =
      ImmutableList.of("CODEOWNERS", ".github/CODEOWNERS", ".gitlab/CODEOWNERS", "docs/CODEOWNERS");

  public static final String DEFAULT_TARGET_BRANCH = "master";

  private final Config config;

  /**
   * Creates a {@link CodeOwnersResolverConfig} from the given config.
   *
   * @param config the config that contains the {@code codeOwners} section
   */
  public CodeOwnersResolverConfig(Config config) {
    this.config = requireNonNull(config, "config");
  }

  /** Creates a {@link CodeOwnersResolverConfig} that uses the default values for all parameters. */
  public static CodeOwnersResolverConfig createDefault() {
    return new CodeOwnersResolverConfig(new Config());
  }

  /**
   * Parses a {@link CodeOwnersResolverConfig} from text in the git config syntax.
   *
   * @param configAsString the config as text
   * @return the parsed config
   * @throws ConfigInvalidException thrown if the text is not valid git config syntax
   */
  public static CodeOwnersResolverConfig fromText(String configAsString)
      throws ConfigInvalidException {
    Config config = new Config();
    config.fromText(Strings.nullToEmpty(configAsString));
    return new CodeOwnersResolverConfig(config);
  }

  /**
   * Validates the configuration.
   *
   * @return list of messages for validation errors, empty list if there are no validation errors
   */
  public ImmutableList<String> validate() {
    List<String> validationMessages = new ArrayList<>();

    String dialectName = config.getString(SECTION_CODE_OWNERS, /* subsection= */ null, KEY_DIALECT);
    if (dialectName != null && !CodeOwnersDialect.tryParse(dialectName).isPresent()) {
      validationMessages.add(
          String.format(
              "Dialect '%s' that is configured (parameter %s.%s) not found.",
              dialectName, SECTION_CODE_OWNERS, KEY_DIALECT));
    }

    String pathExpressionsName =
        config.getString(SECTION_CODE_OWNERS, /* subsection= */ null, KEY_PATH_EXPRESSIONS);
    if (pathExpressionsName != null
        && !PathExpressions.tryParse(pathExpressionsName).isPresent()) {
      validationMessages.add(
          String.format(
              "Path expressions '%s' that are configured (parameter %s.%s) not found.",
              pathExpressionsName, SECTION_CODE_OWNERS, KEY_PATH_EXPRESSIONS));
    }

    for (String configFile : getConfiguredConfigFiles()) {
      if (JgitPath.of(configFile).isRoot()) {
        validationMessages.add(
            String.format(
                "Config file '%s' that is configured (parameter %s.%s) is not a file path.",
                configFile, SECTION_CODE_OWNERS, KEY_CONFIG_FILE));
      }
    }

    String targetBranch =
        config.getString(SECTION_CODE_OWNERS, /* subsection= */ null, KEY_TARGET_BRANCH);
    if (targetBranch != null && targetBranch.trim().isEmpty()) {
      validationMessages.add(
          String.format(
              "Target branch that is configured (parameter %s.%s) is empty.",
              SECTION_CODE_OWNERS, KEY_TARGET_BRANCH));
    }

    return ImmutableList.copyOf(validationMessages);
  }

  /**
   * Gets the paths at which CODEOWNERS files should be looked up, in lookup order.
   *
   * @return the configured paths, {@link #DEFAULT_CONFIG_FILES} if no paths are configured
   * @throws InvalidResolverConfigurationException thrown if a configured path is not a file path
   */
  public ImmutableList<String> getConfigFiles() {
    ImmutableList<String> configFiles = getConfiguredConfigFiles();
    if (configFiles.isEmpty()) {
      return DEFAULT_CONFIG_FILES;
    }
    for (String configFile : configFiles) {
      if (JgitPath.of(configFile).isRoot()) {
        throw logAndCreateException(
            String.format(
                "Config file '%s' that is configured (parameter %s.%s) is not a file path.",
                configFile, SECTION_CODE_OWNERS, KEY_CONFIG_FILE));
      }
    }
    return configFiles.stream()
        .map(configFile -> JgitPath.of(configFile).get())
        .collect(toImmutableList());
  }

  /**
   * Gets the CODEOWNERS dialect.
   *
   * @return the configured dialect, {@link CodeOwnersDialect#DEFAULT} if no dialect is configured
   * @throws InvalidResolverConfigurationException thrown if the configured dialect doesn't exist
   */
  public CodeOwnersDialect getDialect() {
    return getEnumValue(KEY_DIALECT, CodeOwnersDialect::tryParse)
        .orElse(CodeOwnersDialect.DEFAULT);
  }

  /**
   * Gets the syntax of the path expressions in CODEOWNERS files.
   *
   * @return the configured path expressions, {@link PathExpressions#GITIGNORE} if no path
   *     expressions are configured
   * @throws InvalidResolverConfigurationException thrown if the configured path expressions don't
   *     exist
   */
  public PathExpressions getPathExpressions() {
    return getEnumValue(KEY_PATH_EXPRESSIONS, PathExpressions::tryParse)
        .orElse(PathExpressions.GITIGNORE);
  }

  /**
   * Gets the branch against which the files of a source branch are compared.
   *
   * @return the configured target branch, {@link #DEFAULT_TARGET_BRANCH} if no target branch is
   *     configured
   */
  public String getTargetBranch() {
    String targetBranch =
        config.getString(SECTION_CODE_OWNERS, /* subsection= */ null, KEY_TARGET_BRANCH);
    if (Strings.isNullOrEmpty(targetBranch) || targetBranch.trim().isEmpty()) {
      return DEFAULT_TARGET_BRANCH;
    }
    return targetBranch.trim();
  }

  @VisibleForTesting
  Config getConfig() {
    return config;
  }

  private ImmutableList<String> getConfiguredConfigFiles() {
    return Arrays.stream(
            config.getStringList(SECTION_CODE_OWNERS, /* subsection= */ null, KEY_CONFIG_FILE))
        .filter(configFile -> !Strings.isNullOrEmpty(configFile))
        .map(String::trim)
        .collect(toImmutableList());
  }

  private <T> Optional<T> getEnumValue(
      String key, Function<String, Optional<T>> parser) {
    String value = config.getString(SECTION_CODE_OWNERS, /* subsection= */ null, key);
    if (value == null) {
      return Optional.empty();
    }
    return Optional.of(
        parser
            .apply(value.trim())
            .orElseThrow(
                () ->
                    logAndCreateException(
                        String.format(
                            "Value '%s' that is configured (parameter %s.%s) is invalid.",
                            value, SECTION_CODE_OWNERS, key))));
  }

  private static InvalidResolverConfigurationException logAndCreateException(String message) {
    InvalidResolverConfigurationException e = new InvalidResolverConfigurationException(message);
    logger.atSevere().log("%s", e.getMessage());
    return e;
  }
}
