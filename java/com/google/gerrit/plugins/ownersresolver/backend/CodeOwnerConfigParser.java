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

/**
 * Parser for the content of CODEOWNERS files.
 *
 * <p>The syntax of CODEOWNERS files differs between hosting platforms, which is why there is one
 * implementation per dialect (see {@link CodeOwnersDialect}). Platforms with dialects that are not
 * supported out of the box can provide their own implementation.
 *
 * <p>Implementations must be stateless so that a single instance can be shared between concurrent
 * resolutions.
 */
public interface CodeOwnerConfigParser {
  /**
   * Parses a {@link CodeOwnerConfig} from the content of a CODEOWNERS file.
   *
   * <p>Parsing never fails. Lines that cannot be parsed are dropped and don't affect the parsing of
   * the other lines.
   *
   * @param codeOwnerConfigAsString the content of the CODEOWNERS file
   * @return the parsed {@link CodeOwnerConfig}
   */
  CodeOwnerConfig parse(String codeOwnerConfigAsString);
}
