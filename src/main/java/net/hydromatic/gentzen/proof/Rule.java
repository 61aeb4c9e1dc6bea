/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.gentzen.proof;

import com.google.common.collect.ImmutableList;
import java.util.Locale;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Provenance of a derivation {@link Step}: one of the inference rules, or a
 * proposition or fact that was not derived.
 */
public enum Rule {
  /** Proposition declared by the caller. Not an inference rule. */
  PROPOSITION("Proposition", "fact", 0),
  /** Handle on a known fact; such steps never enter the step log. */
  FACT_REFERENCE("FactRef", "factRef", 0),
  /** Alpha rule, conjunction: from A and B, derive {@code (A ∧ B)}. */
  ALPHA_AND("alpha", "and", 2),
  /** Alpha rule, implication: from A and B, derive {@code (A → B)}. */
  ALPHA_IMPLIES("alpha", "implies", 2),
  /** Beta rule: from A and B, derive {@code (A ∨ B)}. */
  BETA("beta", "or", 2),
  /** From {@code (A → B)}, derive {@code (~B → ~A)}. */
  CONTRAPOSITION("contraposition", "contraposition", 1),
  /** From A, derive {@code ~~A}, unless A already starts with {@code ~~}. */
  DOUBLE_NEGATION_INTRODUCTION("doubleNegation", "introduction", 1),
  /** From {@code ~~A}, derive A; any other formula is unchanged. */
  DOUBLE_NEGATION_ELIMINATION("doubleNegation", "elimination", 1),
  /** From A and B, derive {@code (A ↔ B)}. */
  EQUIVALENCE("equivalence", "equiv", 2);

  /** Rules that combine two steps, in the order the search tries them. */
  public static final ImmutableList<Rule> BINARY_RULES =
      ImmutableList.of(ALPHA_AND, ALPHA_IMPLIES, BETA, EQUIVALENCE);

  /** Rules that transform one step, in the order the search tries them. */
  public static final ImmutableList<Rule> UNARY_RULES =
      ImmutableList.of(
          CONTRAPOSITION,
          DOUBLE_NEGATION_INTRODUCTION,
          DOUBLE_NEGATION_ELIMINATION);

  /** Name of the rule family, as written in a scenario; e.g. "alpha". */
  public final String ruleName;

  /** Variant within the family; e.g. "implies". */
  public final String subtype;

  /** Number of antecedent steps. */
  public final int arity;

  Rule(String ruleName, String subtype, int arity) {
    this.ruleName = ruleName;
    this.subtype = subtype;
    this.arity = arity;
  }

  /** Whether this is an inference rule (as opposed to a provenance). */
  public boolean isInference() {
    return arity > 0;
  }

  /**
   * Looks up a rule by the name and subtype used in scenarios.
   *
   * <p>If the subtype is null, "alpha" means {@link #ALPHA_AND} and
   * "doubleNegation" means {@link #DOUBLE_NEGATION_INTRODUCTION}. Rules
   * that have only one variant ignore the subtype.
   *
   * @throws RuleException if the rule or subtype is unknown
   */
  public static Rule lookup(String ruleName, @Nullable String subtype) {
    switch (ruleName) {
      case "alpha":
        if (subtype == null) {
          return ALPHA_AND;
        }
        switch (subtype.toLowerCase(Locale.ROOT)) {
          case "and":
            return ALPHA_AND;
          case "implies":
            return ALPHA_IMPLIES;
          default:
            throw new RuleException(
                "Unknown subtype '" + subtype + "' for alpha rule");
        }
      case "beta":
        return BETA;
      case "contraposition":
        return CONTRAPOSITION;
      case "doubleNegation":
        if (subtype == null) {
          return DOUBLE_NEGATION_INTRODUCTION;
        }
        switch (subtype.toLowerCase(Locale.ROOT)) {
          case "introduction":
            return DOUBLE_NEGATION_INTRODUCTION;
          case "elimination":
            return DOUBLE_NEGATION_ELIMINATION;
          default:
            throw new RuleException(
                "Unknown subtype '" + subtype + "' for doubleNegation rule");
        }
      case "equivalence":
        return EQUIVALENCE;
      default:
        throw new RuleException("Unknown rule '" + ruleName + "'");
    }
  }

  /** Returns "alpha/implies", "beta", "doubleNegation/elimination", etc. */
  @Override
  public String toString() {
    switch (this) {
      case ALPHA_AND:
      case ALPHA_IMPLIES:
      case DOUBLE_NEGATION_INTRODUCTION:
      case DOUBLE_NEGATION_ELIMINATION:
        return ruleName + "/" + subtype;
      default:
        return ruleName;
    }
  }
}

// End Rule.java
