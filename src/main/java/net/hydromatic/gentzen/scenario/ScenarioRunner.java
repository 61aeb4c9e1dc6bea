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
package net.hydromatic.gentzen.scenario;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import net.hydromatic.gentzen.config.Prop;
import net.hydromatic.gentzen.parse.FormulaParseException;
import net.hydromatic.gentzen.proof.DerivationState;
import net.hydromatic.gentzen.proof.ProofSearch;
import net.hydromatic.gentzen.proof.Resolution;
import net.hydromatic.gentzen.proof.Rule;
import net.hydromatic.gentzen.proof.RuleException;
import net.hydromatic.gentzen.proof.SearchBounds;
import net.hydromatic.gentzen.proof.SearchResult;
import net.hydromatic.gentzen.proof.SkippedStep;
import net.hydromatic.gentzen.proof.Step;
import net.hydromatic.gentzen.proof.Tracer;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a {@link Scenario}: resolves facts, builds a {@link DerivationState},
 * applies the scenario's steps, and searches for a proof of each target.
 *
 * <p>A step that cannot be applied, because a formula it needs is missing
 * or because its rule fails, is recorded as a {@link SkippedStep} and the
 * run continues.
 */
public class ScenarioRunner {
  private static final Logger LOG =
      LoggerFactory.getLogger(ScenarioRunner.class);

  private final Map<Prop, Object> properties;
  private final Tracer tracer;

  public ScenarioRunner(Map<Prop, Object> properties, Tracer tracer) {
    this.properties = ImmutableMap.copyOf(properties);
    this.tracer = requireNonNull(tracer, "tracer");
  }

  /**
   * Reads, optionally validates, and runs a scenario file.
   *
   * @throws ScenarioException if the file cannot be read, or if validation
   *   is enabled and the scenario is invalid
   */
  public ReasoningResult run(Path path, Map<String, FactResolver> resolvers) {
    if (Prop.VALIDATE.booleanValue(properties)) {
      final ScenarioValidator.Validation validation =
          ScenarioValidator.validate(path);
      validation.warnings.forEach(w -> LOG.warn("{}: {}", path, w));
      if (!validation.isValid()) {
        throw new ScenarioException(
            "Invalid scenario " + path + ": "
                + String.join("; ", validation.errors));
      }
    }
    return run(Scenarios.load(path), resolvers);
  }

  /** Resolves facts and runs a scenario. */
  public ReasoningResult run(
      Scenario scenario, Map<String, FactResolver> resolvers) {
    final Map<String, FactResolver> effectiveResolvers =
        Prop.SELECTIVE_RESOLUTION.booleanValue(properties)
            ? FactResolvers.retain(
                resolvers, Scenarios.referencedAtoms(scenario))
            : resolvers;
    final ImmutableMap<String, Boolean> factMap =
        FactResolvers.resolve(effectiveResolvers);
    LOG.debug("Scenario {}: resolved facts {}", scenario.name, factMap);

    final DerivationState state =
        load(scenario, FactResolvers.withNegations(factMap));
    final ProofSearch search =
        new ProofSearch(SearchBounds.of(properties), tracer);
    final int maxDepth = Prop.MAX_PROOF_DEPTH.intValue(properties);
    final List<ReasoningResult.TargetResult> targetResults = new ArrayList<>();
    for (String target : scenario.targets) {
      targetResults.add(searchTarget(search, state, target, maxDepth));
    }
    return new ReasoningResult(
        scenario.name,
        scenario.propositions,
        targetResults,
        state.facts(),
        state.missingFacts(),
        state.skippedSteps(),
        factMap,
        state);
  }

  private static ReasoningResult.TargetResult searchTarget(
      ProofSearch search, DerivationState state, String target, int maxDepth) {
    try {
      final SearchResult result = search.search(state, target, maxDepth);
      return ReasoningResult.TargetResult.of(target, result);
    } catch (FormulaParseException e) {
      LOG.warn("Target \"{}\" is malformed: {}", target, e.getMessage());
      return ReasoningResult.TargetResult.error(target, e.getMessage());
    }
  }

  /**
   * Builds a derivation state from a scenario and a map of resolved facts.
   *
   * <p>Each name that maps to true becomes a fact; names that map to false
   * are not available. Negated names, such as "~Y" for a fact "Y" that
   * resolved false, must already be in the map; see
   * {@link FactResolvers#withNegations(Map)}. Then the scenario's
   * propositions are added, and its steps applied in order.
   */
  public DerivationState load(Scenario scenario, Map<String, Boolean> factMap) {
    final DerivationState state = new DerivationState();
    factMap.forEach(
        (name, holds) -> {
          if (holds) {
            state.addFact(name);
          }
        });
    for (String proposition : scenario.propositions) {
      state.addProposition(proposition);
    }
    int index = 0;
    for (Scenario.Step step : scenario.steps) {
      applyStep(state, ++index, step);
    }
    return state;
  }

  private static void applyStep(
      DerivationState state, int index, Scenario.Step step) {
    final List<String> from = step.from;
    if (from == null) {
      state.recordSkippedStep(
          SkippedStep.failed(index, step.rule, step.subtype, ImmutableList.of(),
              "Step has no 'from' list"));
      return;
    }

    final List<Step> antecedents = new ArrayList<>();
    final List<String> missing = new ArrayList<>();
    @Nullable String unresolved = null;
    for (String formula : from) {
      try {
        final @Nullable Step antecedent = find(state, formula);
        if (antecedent != null) {
          antecedents.add(antecedent);
          continue;
        }
        final Resolution resolution = state.canResolveFormula(formula);
        if (resolution.resolved) {
          // Every atom is known, but the formula itself was never derived.
          if (unresolved == null) {
            unresolved = formula;
          }
        } else {
          missing.addAll(resolution.missing);
        }
      } catch (FormulaParseException e) {
        state.recordSkippedStep(
            SkippedStep.failed(index, step.rule, step.subtype, from,
                "Malformed formula \"" + formula + "\": " + e.getMessage()));
        return;
      }
    }

    // Missing facts are tracked whatever the rule, even an unknown one
    if (!missing.isEmpty()) {
      final ImmutableList<String> missingFacts =
          ImmutableList.copyOf(new LinkedHashSet<>(missing));
      LOG.debug("Step #{}: missing facts {}", index, missingFacts);
      missingFacts.forEach(state::trackMissingFact);
      state.recordSkippedStep(
          SkippedStep.missing(index, step.rule, step.subtype, from,
              missingFacts));
      return;
    }
    if (unresolved != null) {
      LOG.debug("Step #{}: cannot resolve formula \"{}\"", index, unresolved);
      state.recordSkippedStep(
          SkippedStep.failed(index, step.rule, step.subtype, from,
              "Cannot resolve formula \"" + unresolved + "\""));
      return;
    }

    if (step.rule == null) {
      LOG.warn("Step #{} has no rule. Skipping.", index);
      state.recordSkippedStep(
          SkippedStep.failed(index, null, step.subtype, from,
              "Step has no 'rule'"));
      return;
    }
    final Rule rule;
    try {
      rule = Rule.lookup(step.rule, step.subtype);
    } catch (RuleException e) {
      LOG.warn("Step #{}: {}. Skipping.", index, e.getMessage());
      state.recordSkippedStep(
          SkippedStep.failed(index, step.rule, step.subtype, from,
              e.getMessage()));
      return;
    }

    try {
      final Step derived = state.apply(rule, antecedents);
      LOG.debug("Step #{}: {}", index, derived);
    } catch (RuleException e) {
      LOG.warn("Step #{} failed to apply rule \"{}\": {}", index, rule,
          e.getMessage());
      state.recordSkippedStep(
          SkippedStep.failed(index, step.rule, step.subtype, from,
              e.getMessage()));
    }
  }

  /**
   * Returns a step for a formula: a fact reference if the formula is a fact,
   * otherwise the first step that contains it, otherwise null.
   */
  private static @Nullable Step find(DerivationState state, String formula) {
    if (state.facts().contains(formula)) {
      return state.factReference(formula);
    }
    final ImmutableList<Step> steps = state.findStepsContaining(formula);
    return steps.isEmpty() ? null : steps.get(0);
  }
}

// End ScenarioRunner.java
