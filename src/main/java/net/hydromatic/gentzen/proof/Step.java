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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Step in a derivation: one fact, proposition, or rule application.
 *
 * <p>A step is immutable. Its antecedents are the ordinals of the steps it
 * was derived from, within the {@link DerivationState} that owns it; an
 * antecedent of -1 refers to a fact that is not in the step log.
 */
public final class Step {
  /** Ordinal of a step that is not in a derivation's step log. */
  public static final int NO_ORDINAL = -1;

  public final Rule rule;
  public final ImmutableList<Integer> antecedents;
  /** The formula this step establishes; null for an axiom placeholder. */
  public final @Nullable String formula;
  /** Position in the owning derivation's step log, or {@link #NO_ORDINAL}. */
  public final int ordinal;

  Step(
      Rule rule,
      ImmutableList<Integer> antecedents,
      @Nullable String formula,
      int ordinal) {
    this.rule = requireNonNull(rule, "rule");
    this.antecedents = requireNonNull(antecedents, "antecedents");
    this.formula = formula;
    this.ordinal = ordinal;
  }

  /** Returns the set of formulas this step holds; zero or one element. */
  public ImmutableSet<String> formulas() {
    return formula == null ? ImmutableSet.of() : ImmutableSet.of(formula);
  }

  /**
   * Returns the formula of this step.
   *
   * @throws RuleException if the step does not hold exactly one formula
   */
  public String uniqueFormula() {
    if (formula == null) {
      throw new RuleException("Step must contain exactly one formula");
    }
    return formula;
  }

  /** Whether this step is part of a derivation's step log. */
  public boolean isLogged() {
    return ordinal != NO_ORDINAL;
  }

  @Override
  public String toString() {
    return (isLogged() ? "#" + (ordinal + 1) + " " : "")
        + rule
        + " "
        + (formula == null ? "-" : formula);
  }
}

// End Step.java
