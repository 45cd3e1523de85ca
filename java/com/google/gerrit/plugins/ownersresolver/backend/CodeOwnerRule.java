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
import java.util.Arrays;

/**
 * A code owner rule assigns code owners to the files that match a path expression.
 *
 * <p>Each rule is parsed from exactly one line of a CODEOWNERS file.
 *
 * <p>A rule without code owners is an orphan rule: it explicitly disclaims ownership of the
 * matching files. This is different from no rule matching a file, since an orphan rule also
 * suppresses the global code owners of its section for the files it wins.
 */
@AutoValue
public abstract class CodeOwnerRule {
  /** The path expression that denotes the global rule of a section. */
  public static final String GLOBAL_PATH_EXPRESSION = "*";

  /** Path expression that matches the files that are owned by the {@link #codeOwners()}. */
  public abstract String pathExpression();

  /**
   * The code owners of the matching files, in the order in which they were declared.
   *
   * <p>If the rule didn't specify code owners explicitly, these are the default code owners of the
   * section that contains the rule.
   */
  public abstract ImmutableList<String> codeOwners();

  /** Whether this is the global rule ('*') that matches all files. */
  public boolean isGlobal() {
    return GLOBAL_PATH_EXPRESSION.equals(pathExpression());
  }

  /** Whether this rule has no code owners. */
  public boolean isOrphan() {
    return codeOwners().isEmpty();
  }

  /**
   * Creates a {@link CodeOwnerRule}.
   *
   * @param pathExpression the path expression of the rule
   * @param codeOwners the code owners of the rule, may be empty
   */
  public static CodeOwnerRule create(String pathExpression, ImmutableList<String> codeOwners) {
    requireNonNull(pathExpression, "pathExpression");
    requireNonNull(codeOwners, "codeOwners");
    checkState(!pathExpression.isEmpty(), "path expression cannot be empty");
    return new AutoValue_CodeOwnerRule(pathExpression, codeOwners);
  }

  /**
   * Creates a {@link CodeOwnerRule}.
   *
   * @param pathExpression the path expression of the rule
   * @param codeOwners the code owners of the rule
   */
  public static CodeOwnerRule create(String pathExpression, String... codeOwners) {
    return create(pathExpression, ImmutableList.copyOf(Arrays.asList(codeOwners)));
  }
}
