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

import com.google.gerrit.plugins.ownersresolver.backend.plain.PlainCodeOwnerConfigParser;
import com.google.gerrit.plugins.ownersresolver.backend.sectioned.SectionedCodeOwnerConfigParser;
import java.util.Locale;
import java.util.Optional;

/** Enum listing the supported CODEOWNERS dialects. */
public enum CodeOwnersDialect {
  /** Plain CODEOWNERS files with a single implicit section. */
  DEFAULT(PlainCodeOwnerConfigParser.INSTANCE),

  /** CODEOWNERS files with named sections, default code owners and optional sections. */
  SECTIONED(SectionedCodeOwnerConfigParser.INSTANCE);

  private final CodeOwnerConfigParser parser;

  private CodeOwnersDialect(CodeOwnerConfigParser parser) {
    this.parser = parser;
  }

  /** Gets the parser for this dialect. */
  public CodeOwnerConfigParser getParser() {
    return parser;
  }

  /**
   * Tries to parse a string as a {@link CodeOwnersDialect} enum.
   *
   * @param value the string value to be parsed
   * @return the parsed {@link CodeOwnersDialect} enum, {@link Optional#empty()} if the given value
   *     couldn't be parsed as {@link CodeOwnersDialect} enum
   */
  public static Optional<CodeOwnersDialect> tryParse(String value) {
    try {
      return Optional.of(CodeOwnersDialect.valueOf(value.toUpperCase(Locale.US)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
