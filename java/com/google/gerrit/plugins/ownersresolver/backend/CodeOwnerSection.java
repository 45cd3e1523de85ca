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
import java.util.Optional;

/**
 * A section groups code owner rules that are ranked independently of the rules in other sections.
 *
 * <p>Plain CODEOWNERS files consist of a single section without name (the default section).
 * Sectioned CODEOWNERS files may additionally declare named sections:
 *
 * <pre>
 * ^[Documentation][2] @docs-team
 * docs/
 * README.md @tech-writers
 * </pre>
 *
 * <p>A leading '^' marks the section as optional, the number in the second bracket is the number
 * of required approvals and the tokens after the header are the default code owners which are
 * inherited by all rules of the section that don't specify code owners explicitly.
 */
@AutoValue
public abstract class CodeOwnerSection {
  /** The name of the section, {@link Optional#empty()} for the default section. */
  public abstract Optional<String> name();

  /** The code owners that are inherited by rules that don't declare code owners. */
  public abstract ImmutableList<String> defaultCodeOwners();

  /** Whether the approval of the section is optional. */
  public abstract boolean optional();

  /**
   * The number of approvals that the section header requests.
   *
   * <p>Only informational, approvals are not enforced.
   */
  public abstract Optional<Integer> requiredApprovals();

  /** The rules of the section, in the order in which they were declared. */
  public abstract ImmutableList<CodeOwnerRule> rules();

  /** Whether this is the unnamed default section. */
  public boolean isDefaultSection() {
    return !name().isPresent();
  }

  /**
   * Returns the global rule of this section.
   *
   * <p>If several global rules have been declared, the last one is returned since it overrides the
   * earlier ones.
   *
   * @return the global rule of this section, {@link Optional#empty()} if the section has no global
   *     rule
   */
  public Optional<CodeOwnerRule> globalRule() {
    return rules().reverse().stream().filter(CodeOwnerRule::isGlobal).findFirst();
  }

  /**
   * Creates a builder for a {@link CodeOwnerSection}.
   *
   * <p>Without setting a name the builder creates the default section.
   */
  public static Builder builder() {
    return new AutoValue_CodeOwnerSection.Builder()
        .setDefaultCodeOwners(ImmutableList.of())
        .setOptional(false);
  }

  /** Creates a builder for a named {@link CodeOwnerSection}. */
  public static Builder builder(String name) {
    return builder().setName(requireNonNull(name, "name"));
  }

  @AutoValue.Builder
  public abstract static class Builder {
    /**
     * Sets the name of the section.
     *
     * @param name the name of the section
     * @return the Builder instance for chaining calls
     */
    public abstract Builder setName(String name);

    /**
     * Sets the default code owners of the section.
     *
     * @param defaultCodeOwners the default code owners
     * @return the Builder instance for chaining calls
     */
    public abstract Builder setDefaultCodeOwners(ImmutableList<String> defaultCodeOwners);

    /** Gets the default code owners that have been set. */
    public abstract ImmutableList<String> defaultCodeOwners();

    /**
     * Sets whether the approval of the section is optional.
     *
     * @param optional whether the approval of the section is optional
     * @return the Builder instance for chaining calls
     */
    public abstract Builder setOptional(boolean optional);

    /**
     * Sets the number of approvals that the section header requests.
     *
     * @param requiredApprovals the number of requested approvals
     * @return the Builder instance for chaining calls
     */
    public abstract Builder setRequiredApprovals(Integer requiredApprovals);

    /** Gets a builder to add rules. */
    abstract ImmutableList.Builder<CodeOwnerRule> rulesBuilder();

    /**
     * Adds a rule.
     *
     * @param rule the rule that should be added
     * @return the Builder instance for chaining calls
     */
    public Builder addRule(CodeOwnerRule rule) {
      rulesBuilder().add(requireNonNull(rule, "rule"));
      return this;
    }

    /**
     * Adds a rule that inherits the default code owners of the section if no code owners are
     * given.
     *
     * <p>The default code owners must be set before rules are added.
     *
     * @param pathExpression the path expression of the rule
     * @param codeOwners the explicit code owners of the rule, may be empty
     * @return the Builder instance for chaining calls
     */
    public Builder addRuleInheritingDefaults(
        String pathExpression, ImmutableList<String> codeOwners) {
      return addRule(
          CodeOwnerRule.create(
              pathExpression, codeOwners.isEmpty() ? defaultCodeOwners() : codeOwners));
    }

    abstract CodeOwnerSection autoBuild();

    /** Builds the {@link CodeOwnerSection} instance. */
    public CodeOwnerSection build() {
      CodeOwnerSection section = autoBuild();
      checkState(
          !(section.isDefaultSection() && section.optional()),
          "the default section cannot be optional");
      checkState(
          !section.requiredApprovals().isPresent() || section.requiredApprovals().get() >= 0,
          "required approvals cannot be negative: %s",
          section.requiredApprovals().orElse(0));
      return section;
    }
  }
}
