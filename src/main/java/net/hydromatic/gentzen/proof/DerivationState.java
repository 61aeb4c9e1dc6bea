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

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.gentzen.formula.FormulaBuilder.formula;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import net.hydromatic.gentzen.formula.Formula;
import net.hydromatic.gentzen.formula.Formulas;
import net.hydromatic.gentzen.parse.FormulaParseException;
import net.hydromatic.gentzen.parse.Parsers;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Derivation state: the facts known axiomatically, and an append-only log of
 * derivation steps.
 *
 * <p>Rule methods such as {@link #alphaAnd} take steps of this state (or
 * fact references created by {@link #factReference}), append a new step, and
 * return it. A state only grows; the proof search explores alternatives by
 * working on {@link #copy() copies}.
 *
 * <p>Facts and step formulas are compared as exact strings by {@link
 * #isFactAvailable}, and as canonical formulas by {@link #isProved}.
 */
public class DerivationState {
  /** Separator between formulas in a {@link #signature()}. */
  static final String SIGNATURE_SEPARATOR = " | ";

  private final Set<String> facts;
  private final List<Step> steps;
  private final Set<String> missingFacts = new LinkedHashSet<>();
  private final List<SkippedStep> skippedSteps = new ArrayList<>();

  /** Creates an empty derivation state. */
  public DerivationState() {
    this(new LinkedHashSet<>(), new ArrayList<>());
  }

  private DerivationState(Set<String> facts, List<Step> steps) {
    this.facts = facts;
    this.steps = steps;
  }

  /**
   * Returns a copy of this state, with its own facts and step log.
   *
   * <p>Steps are immutable and their antecedents are ordinals, so the copy
   * shares step objects with this state and its lineage stays valid. Missing
   * facts and skipped steps are diagnostics of the state being built, and
   * are not copied.
   */
  public DerivationState copy() {
    return new DerivationState(
        new LinkedHashSet<>(facts), new ArrayList<>(steps));
  }

  /** Adds a fact, such as "CustomerIsVIP" or "~PaymentProcessed". */
  public void addFact(String fact) {
    facts.add(fact);
  }

  /** Returns the facts, in the order they were added. */
  public ImmutableSet<String> facts() {
    return ImmutableSet.copyOf(facts);
  }

  /** Returns the step log. */
  public List<Step> steps() {
    return Collections.unmodifiableList(steps);
  }

  /** Returns the atoms whose resolvability has failed. */
  public ImmutableSet<String> missingFacts() {
    return ImmutableSet.copyOf(missingFacts);
  }

  /** Returns the scenario steps that were skipped. */
  public ImmutableList<SkippedStep> skippedSteps() {
    return ImmutableList.copyOf(skippedSteps);
  }

  /** Records an atom that could not be resolved. */
  public void trackMissingFact(String name) {
    missingFacts.add(name);
  }

  /** Records a scenario step that was skipped. */
  public void recordSkippedStep(SkippedStep skippedStep) {
    skippedSteps.add(skippedStep);
  }

  /** Appends a proposition to the step log, and returns its step. */
  public Step addProposition(String proposition) {
    return append(Rule.PROPOSITION, ImmutableList.of(), proposition);
  }

  /**
   * Returns a handle on a formula, typically a fact, that can be passed to a
   * rule method. The handle is not appended to the step log.
   */
  public Step factReference(String fact) {
    return new Step(
        Rule.FACT_REFERENCE, ImmutableList.of(), fact, Step.NO_ORDINAL);
  }

  /**
   * Returns whether a formula string is a fact or is the formula of a step.
   * The comparison is exact; no parsing takes place.
   */
  public boolean isFactAvailable(String name) {
    if (facts.contains(name)) {
      return true;
    }
    for (Step step : steps) {
      if (name.equals(step.formula)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns whether an atom is resolvable, under the closed-world
   * assumption.
   *
   * <p>An available atom is resolvable. An unavailable negated atom,
   * "~X", is resolvable if its base "X" is not available. An unavailable
   * positive atom "X" is resolvable if "~X" is available. So an atom is
   * unresolvable only if neither it nor its negation has been established.
   */
  public boolean isAtomResolvable(String atom) {
    if (isFactAvailable(atom)) {
      return true;
    }
    if (atom.startsWith("~")) {
      return !isFactAvailable(atom.substring(1));
    }
    return isFactAvailable("~" + atom);
  }

  /**
   * Checks whether every atom referenced by a formula is resolvable.
   *
   * @throws FormulaParseException if the formula is malformed
   */
  public Resolution canResolveFormula(String formula) {
    final ImmutableList.Builder<String> missing = ImmutableList.builder();
    for (String atom : Parsers.atoms(formula)) {
      if (!isAtomResolvable(atom)) {
        missing.add(baseName(atom));
      }
    }
    return new Resolution(missing.build());
  }

  /** Strips any leading negation signs from an atom name. */
  static String baseName(String atom) {
    int i = 0;
    while (i < atom.length() && atom.charAt(i) == '~') {
      ++i;
    }
    return atom.substring(i);
  }

  /**
   * Returns whether a formula is a fact or has been derived, comparing
   * canonical strings; so "A AND B" matches the step "(A ∧ B)".
   *
   * @throws FormulaParseException if the target is malformed
   */
  public boolean isProved(String target) {
    final String canonicalTarget = Parsers.canonical(target);
    for (String fact : facts) {
      if (canonicalTarget.equals(canonicalOrSelf(fact))) {
        return true;
      }
    }
    for (Step step : steps) {
      if (step.formula != null
          && canonicalTarget.equals(canonicalOrSelf(step.formula))) {
        return true;
      }
    }
    return false;
  }

  /** Returns the steps whose formula is canonically equal to a formula. */
  public ImmutableList<Step> findStepsContaining(String formula) {
    final String canonical = Parsers.canonical(formula);
    final ImmutableList.Builder<Step> list = ImmutableList.builder();
    for (Step step : steps) {
      if (step.formula != null
          && canonical.equals(canonicalOrSelf(step.formula))) {
        list.add(step);
      }
    }
    return list.build();
  }

  private static String canonicalOrSelf(String s) {
    final @Nullable String canonical = Parsers.tryCanonical(s);
    return canonical != null ? canonical : s;
  }

  /**
   * Returns every formula known in this state, facts and step formulas, with
   * leading double negations stripped, deduplicated and sorted.
   */
  public ImmutableSet<String> knownFormulas() {
    final Set<String> formulas = new TreeSet<>();
    for (Step step : steps) {
      if (step.formula != null) {
        formulas.add(Formulas.stripDoubleNegation(step.formula));
      }
    }
    for (String fact : facts) {
      formulas.add(Formulas.stripDoubleNegation(fact));
    }
    return ImmutableSet.copyOf(formulas);
  }

  /**
   * Returns the signature of this state, a string that identifies the
   * knowledge it holds regardless of how that knowledge was derived.
   */
  public String signature() {
    return String.join(SIGNATURE_SEPARATOR, knownFormulas());
  }

  /**
   * Applies an inference rule to a list of steps.
   *
   * @throws RuleException if the rule cannot be applied
   */
  public Step apply(Rule rule, List<Step> antecedents) {
    if (!rule.isInference()) {
      throw new RuleException("'" + rule + "' is not an inference rule");
    }
    if (antecedents.size() != rule.arity) {
      throw new RuleException(
          "Rule '"
              + rule
              + "' expects "
              + rule.arity
              + " antecedent step(s) but got "
              + antecedents.size());
    }
    switch (rule) {
      case ALPHA_AND:
      case ALPHA_IMPLIES:
        return alpha(rule, antecedents.get(0), antecedents.get(1));
      case BETA:
        return beta(antecedents.get(0), antecedents.get(1));
      case CONTRAPOSITION:
        return contraposition(antecedents.get(0));
      case DOUBLE_NEGATION_INTRODUCTION:
      case DOUBLE_NEGATION_ELIMINATION:
        return doubleNegation(antecedents.get(0), rule);
      case EQUIVALENCE:
        return equivalence(antecedents.get(0), antecedents.get(1));
      case PROPOSITION:
      case FACT_REFERENCE:
      default:
        throw new AssertionError("unexpected rule " + rule);
    }
  }

  /** Applies the alpha rule; derives {@code (A ∧ B)}. */
  public Step alphaAnd(Step step0, Step step1) {
    return alpha(Rule.ALPHA_AND, step0, step1);
  }

  /** Applies the alpha rule; derives {@code (A → B)}. */
  public Step alphaImplies(Step step0, Step step1) {
    return alpha(Rule.ALPHA_IMPLIES, step0, step1);
  }

  /**
   * Applies a variant of the alpha rule.
   *
   * @param rule {@link Rule#ALPHA_AND} or {@link Rule#ALPHA_IMPLIES}
   * @throws RuleException if the rule is not an alpha rule, or a step does
   *     not hold exactly one formula
   */
  public Step alpha(Rule rule, Step step0, Step step1) {
    final String a = step0.uniqueFormula();
    final String b = step1.uniqueFormula();
    final String symbol;
    switch (rule) {
      case ALPHA_AND:
        symbol = " ∧ ";
        break;
      case ALPHA_IMPLIES:
        symbol = " → ";
        break;
      default:
        throw new RuleException("Unknown subtype for alpha rule: " + rule);
    }
    return append(rule, antecedents(step0, step1), "(" + a + symbol + b + ")");
  }

  /** Applies the beta rule; derives {@code (A ∨ B)}. */
  public Step beta(Step step0, Step step1) {
    final String a = step0.uniqueFormula();
    final String b = step1.uniqueFormula();
    return append(
        Rule.BETA, antecedents(step0, step1), "(" + a + " ∨ " + b + ")");
  }

  /** Applies the equivalence rule; derives {@code (A ↔ B)}. */
  public Step equivalence(Step step0, Step step1) {
    final String a = step0.uniqueFormula();
    final String b = step1.uniqueFormula();
    return append(
        Rule.EQUIVALENCE, antecedents(step0, step1), "(" + a + " ↔ " + b + ")");
  }

  /**
   * Applies contraposition; from {@code (A → B)} derives {@code (~B → ~A)}.
   *
   * @throws RuleException if the step's formula is not an implication
   */
  public Step contraposition(Step step) {
    final String f = step.uniqueFormula();
    final Formula parsed;
    try {
      parsed = Parsers.parse(f);
    } catch (FormulaParseException e) {
      throw new RuleException("Cannot parse formula '" + f + "'", e);
    }
    if (!Formulas.isImplication(parsed)) {
      throw new RuleException(
          "Formula is not an implication - contraposition requires an "
              + "implication: "
              + f);
    }
    final Formula.Binary implication = (Formula.Binary) parsed;
    final Formula contrapositive =
        formula.implies(
            formula.not(implication.right), formula.not(implication.left));
    return append(
        Rule.CONTRAPOSITION, antecedents(step), contrapositive.toString());
  }

  /** Applies double-negation introduction; derives {@code ~~A}. */
  public Step doubleNegationIntroduction(Step step) {
    return doubleNegation(step, Rule.DOUBLE_NEGATION_INTRODUCTION);
  }

  /** Applies double-negation elimination; from {@code ~~A} derives A. */
  public Step doubleNegationElimination(Step step) {
    return doubleNegation(step, Rule.DOUBLE_NEGATION_ELIMINATION);
  }

  /**
   * Applies a variant of the double negation rule.
   *
   * <p>Introduction is idempotent: a formula that already starts with
   * {@code ~~} is unchanged. Elimination strips exactly one leading
   * {@code ~~}, if present.
   */
  public Step doubleNegation(Step step, Rule rule) {
    final String f = step.uniqueFormula();
    final String result;
    switch (rule) {
      case DOUBLE_NEGATION_INTRODUCTION:
        result = f.startsWith("~~") ? f : "~~" + f;
        break;
      case DOUBLE_NEGATION_ELIMINATION:
        result = f.startsWith("~~") ? f.substring(2) : f;
        break;
      default:
        throw new RuleException(
            "Unknown subtype for doubleNegation rule: " + rule);
    }
    return append(rule, antecedents(step), result);
  }

  private ImmutableList<Integer> antecedents(Step... steps) {
    final ImmutableList.Builder<Integer> ordinals = ImmutableList.builder();
    for (Step step : steps) {
      checkArgument(
          !step.isLogged()
              || step.ordinal < this.steps.size()
                  && this.steps.get(step.ordinal) == step,
          "step %s does not belong to this derivation",
          step);
      ordinals.add(step.ordinal);
    }
    return ordinals.build();
  }

  private Step append(
      Rule rule, ImmutableList<Integer> antecedents, String formula) {
    final Step step = new Step(rule, antecedents, formula, steps.size());
    steps.add(step);
    return step;
  }

  /**
   * Returns the lineage of a step: the step itself and, transitively, every
   * logged step it was derived from, in log order.
   */
  public ImmutableList<Step> lineage(Step step) {
    final Set<Integer> ordinals = new TreeSet<>();
    collectLineage(step, ordinals);
    final ImmutableList.Builder<Step> list = ImmutableList.builder();
    for (int ordinal : ordinals) {
      list.add(steps.get(ordinal));
    }
    return list.build();
  }

  private void collectLineage(Step step, Set<Integer> ordinals) {
    if (step.isLogged() && ordinals.add(step.ordinal)) {
      for (int antecedent : step.antecedents) {
        if (antecedent != Step.NO_ORDINAL) {
          collectLineage(steps.get(antecedent), ordinals);
        }
      }
    }
  }

  /**
   * Searches for a proof of a target formula, using default bounds.
   *
   * @see ProofSearch
   */
  public SearchResult searchForProof(String target, int maxDepth) {
    return new ProofSearch(SearchBounds.DEFAULT, Tracers.empty())
        .search(this, target, maxDepth);
  }

  @Override
  public String toString() {
    return "DerivationState{facts=" + facts + ", steps=" + steps + "}";
  }
}

// End DerivationState.java
