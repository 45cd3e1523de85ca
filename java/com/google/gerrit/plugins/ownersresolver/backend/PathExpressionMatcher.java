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

import java.nio.file.Path;

/**
 * Matcher that checks for a given path expression if it matches a given path.
 *
 * <p>This interface allows different path expression syntaxes to be used for the patterns in
 * CODEOWNERS files (see {@link PathExpressions}).
 *
 * <p>Implementations must be stateless, never throw and treat path expressions that cannot be
 * parsed as not matching.
 */
public interface PathExpressionMatcher {
  /**
   * Whether the given path expression matches the given path.
   *
   * <p>This method is invoked for any path expression, regardless of whether the path expression
   * contains any wildcard. This means that the given path expression can also be a plain
   * folder/file name.
   *
   * @param pathExpression path expression as it appears in the CODEOWNERS file, relative to the
   *     repository root
   * @param relativePath path of a changed file relative to the repository root
   * @return {@code true} if the given path expression matches the given path, otherwise {@code
   *     false}
   */
  boolean matches(String pathExpression, Path relativePath);
}
