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

/**
 * The parsed content of a CODEOWNERS file.
 *
 * <p>A code owner config consists of sections that contain the code owner rules (see {@link
 * CodeOwnerSection}). The order of the sections is the order in which they were declared in the
 * file. If the file contains rules outside of a named section, the default section that holds them
 * is always the first section.
 *
 * <p>Code owner configs are parsed from the file content on each resolution and are never cached.
 */
@AutoValue
public abstract class CodeOwnerConfig {
  /** The sections of this code owner config, in declaration order. */
  public abstract ImmutableList<CodeOwnerSection> sections();

  /** The sections of this code owner config in the order in which they take priority. */
  public ImmutableList<CodeOwnerSection> sectionsByPriority() {
    return sections().reverse();
  }

  /** Creates a builder for a {@link CodeOwnerConfig}. */
  public static Builder builder() {
    return new AutoValue_CodeOwnerConfig.Builder();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    /** Gets a builder to add sections. */
    abstract ImmutableList.Builder<CodeOwnerSection> sectionsBuilder();

    /**
     * Adds a section.
     *
     * @param section the section that should be added
     * @return the Builder instance for chaining calls
     */
    public Builder addSection(CodeOwnerSection section) {
      sectionsBuilder().add(requireNonNull(section, "section"));
      return this;
    }

    abstract CodeOwnerConfig autoBuild();

    /** Builds the {@link CodeOwnerConfig} instance. */
    public CodeOwnerConfig build() {
      CodeOwnerConfig codeOwnerConfig = autoBuild();
      ImmutableList<CodeOwnerSection> sections = codeOwnerConfig.sections();
      for (int i = 1; i < sections.size(); i++) {
        checkState(
            !sections.get(i).isDefaultSection(), "the default section must be the first section");
      }
      return codeOwnerConfig;
    }
  }
}
