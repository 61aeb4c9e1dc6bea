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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.gentzen.config.Prop;
import net.hydromatic.gentzen.proof.DerivationState;
import net.hydromatic.gentzen.proof.Rule;
import net.hydromatic.gentzen.proof.SearchResult;
import net.hydromatic.gentzen.proof.SkippedStep;
import net.hydromatic.gentzen.proof.Step;
import net.hydromatic.gentzen.proof.Tracers;
import org.junit.jupiter.api.Test;

/** Tests {@link ScenarioRunner}. */
public class ScenarioRunnerTest {
  private static ScenarioRunner runner() {
    return new ScenarioRunner(ImmutableMap.of(), Tracers.empty());
  }

  private static ReasoningResult run(String file, Map<String, Boolean> facts) {
    return runner()
        .run(Fixtures.scenario(file), FactResolvers.fromMap(facts));
  }

  /** Only facts that hold are added; a fact that resolved false is
   * unavailable, and so its negation is resolvable by the closed-world
   * assumption. */
  @Test void testLoadFacts() {
    final Map<String, Boolean> facts = new LinkedHashMap<>();
    facts.put("X", true);
    facts.put("Y", false);
    final DerivationState state =
        runner().load(Scenarios.parse("targets: [X]", "t"), facts);
    assertThat(state.facts(), is(ImmutableSet.of("X")));
    assertThat(state.steps().isEmpty(), is(true));
    assertThat(state.isAtomResolvable("X"), is(true));
    assertThat(state.isAtomResolvable("~X"), is(false));
    assertThat(state.isAtomResolvable("Y"), is(false));
    assertThat(state.isAtomResolvable("~Y"), is(true));
  }

  /** When facts come from resolvers, a fact that resolved false is added in
   * negated form. */
  @Test void testLoadResolvedFacts() {
    final Map<String, Boolean> facts = new LinkedHashMap<>();
    facts.put("X", true);
    facts.put("Y", false);
    facts.put("~Z", false);
    final DerivationState state =
        runner().load(Scenarios.parse("targets: [X]", "t"),
            FactResolvers.withNegations(facts));
    assertThat(state.facts(), is(ImmutableSet.of("X", "~Y")));
    assertThat(state.isAtomResolvable("Y"), is(true));
    assertThat(state.isAtomResolvable("~Y"), is(true));

    final ReasoningResult result =
        runner().run(Scenarios.parse("targets: [\"~Y\"]", "t"),
            FactResolvers.fromMap(facts));
    assertThat(result.availableFacts, is(ImmutableSet.of("X", "~Y")));
    assertThat(result.factResolutions, is(ImmutableMap.copyOf(facts)));
    assertThat(result.allProven(), is(true));
  }

  @Test void testLoadSteps() {
    final Map<String, Boolean> facts =
        ImmutableMap.of("CustomerIsVIP", true, "PaymentProcessed", true,
            "ProcessOrder", true);
    final DerivationState state =
        runner().load(Scenarios.load(Fixtures.scenario("order.yaml")), facts);
    final List<Step> steps = state.steps();
    assertThat(steps.size(), is(2));

    // Facts are referenced without being added to the step log
    assertThat(steps.get(0).rule, is(Rule.ALPHA_AND));
    assertThat(steps.get(0).formula,
        is("(CustomerIsVIP ∧ PaymentProcessed)"));
    assertThat(steps.get(0).antecedents,
        is(ImmutableList.of(Step.NO_ORDINAL, Step.NO_ORDINAL)));

    // A formula derived by an earlier step is found by that step
    assertThat(steps.get(1).rule, is(Rule.ALPHA_IMPLIES));
    assertThat(steps.get(1).formula,
        is("((CustomerIsVIP ∧ PaymentProcessed) → ProcessOrder)"));
    assertThat(steps.get(1).antecedents,
        is(ImmutableList.of(0, Step.NO_ORDINAL)));
    assertThat(state.skippedSteps().isEmpty(), is(true));
  }

  /** Runs the order scenario with facts for the customer and the payment.
   * The conjunction is derived by a step, so is proven at depth 0; nothing
   * establishes "ProcessOrder", so the second step is skipped and the
   * target is reported missing. */
  @Test void testOrder() {
    final ReasoningResult result =
        run("order.yaml",
            ImmutableMap.of("CustomerIsVIP", true, "PaymentProcessed", true));
    assertThat(result.scenarioName, is("order.yaml"));
    assertThat(result.targets.size(), is(2));

    final ReasoningResult.TargetResult conjunction = result.targets.get(0);
    assertThat(conjunction.proven(), is(true));
    assertThat(conjunction.result.depth, is(0));

    final ReasoningResult.TargetResult processOrder = result.targets.get(1);
    assertThat(processOrder.proven(), is(false));
    assertThat(processOrder.result.missingFacts,
        is(ImmutableList.of("ProcessOrder")));

    assertThat(result.availableFacts,
        is(ImmutableSet.of("CustomerIsVIP", "PaymentProcessed")));
    assertThat(result.missingFacts, is(ImmutableSet.of("ProcessOrder")));
    assertThat(result.skippedSteps.size(), is(1));
    final SkippedStep skipped = result.skippedSteps.get(0);
    assertThat(skipped.stepIndex, is(2));
    assertThat(skipped.rule, is("alpha"));
    assertThat(skipped.subtype, is("implies"));
    assertThat(skipped.missingFacts, is(ImmutableList.of("ProcessOrder")));
    assertThat(result.allProven(), is(false));
    assertThat(result.provenCount(), is(1));
    assertThat(result, hasToString("order.yaml: 1/2 targets proven"));
  }

  /** As {@link #testOrder()}, but "ProcessOrder" resolves false. The target
   * is resolvable, so the search runs; the rules never derive a bare atom
   * from a conjunction, so it is not proven. */
  @Test void testOrderNotReachable() {
    final ReasoningResult result =
        run("order.yaml",
            ImmutableMap.of("CustomerIsVIP", true, "PaymentProcessed", true,
                "ProcessOrder", false));
    assertThat(result.availableFacts,
        is(ImmutableSet.of("CustomerIsVIP", "PaymentProcessed",
            "~ProcessOrder")));

    final ReasoningResult.TargetResult processOrder = result.targets.get(1);
    assertThat(processOrder.error, nullValue());
    assertThat(processOrder.proven(), is(false));
    assertThat(processOrder.result.missingFacts.isEmpty(), is(true));
    assertThat(result.missingFacts.isEmpty(), is(true));
    assertThat(result.targets.get(0).proven(), is(true));

    // Step 2 needs "ProcessOrder" itself, which is never derived
    assertThat(result.skippedSteps.get(0).reason,
        is("Cannot resolve formula \"ProcessOrder\""));
  }

  /** With "ProcessOrder" declared as a proposition, the implication is
   * derived and every target is proven without search. */
  @Test void testOrderWithProposition() {
    final ReasoningResult result =
        run("order-propositions.yaml",
            ImmutableMap.of("CustomerIsVIP", true, "PaymentProcessed", true));
    assertThat(result.propositions, is(ImmutableList.of("ProcessOrder")));
    assertThat(result.allProven(), is(true));
    for (ReasoningResult.TargetResult target : result.targets) {
      assertThat(target.result.depth, is(0));
    }
    assertThat(result.skippedSteps.isEmpty(), is(true));
    assertThat(result.state.steps().size(), is(3));
  }

  @Test void testRain() {
    final ReasoningResult result =
        run("rain.yaml", ImmutableMap.of("WetGrass", true, "Sprinkler", false));
    assertThat(result.availableFacts,
        is(ImmutableSet.of("WetGrass", "~Sprinkler")));
    assertThat(result.factResolutions,
        is(ImmutableMap.of("WetGrass", true, "Sprinkler", false)));

    final List<String> formulas = new ArrayList<>();
    for (Step step : result.state.steps()) {
      formulas.add(step.formula);
    }
    assertThat(formulas,
        is(
            ImmutableList.of("Rain", "(Rain → WetGrass)",
                "(~WetGrass → ~Rain)", "~~Rain")));

    final List<ReasoningResult.TargetResult> targets = result.targets;
    assertThat(targets.get(0).proven(), is(true));
    assertThat(targets.get(1).proven(), is(true));
    assertThat(targets.get(1).result.depth, is(0));

    final SearchResult disjunction = targets.get(2).result;
    assertThat(disjunction.proven, is(true));
    assertThat(disjunction.depth, is(1));
    assertThat(disjunction.path,
        is(ImmutableList.of("(Rain ∨ (Rain → WetGrass))")));

    assertThat(targets.get(3).proven(), is(false));
    assertThat(targets.get(3).result.missingFacts.isEmpty(), is(true));

    // A malformed target is reported, and does not stop the run
    assertThat(targets.get(4).result, nullValue());
    assertThat(targets.get(4).error, notNullValue());
    assertThat(targets.get(4).error, startsWith("Parse error at position"));

    assertThat(result.provenCount(), is(3));
    assertThat(result.skippedSteps.size(), is(2));
    assertThat(result.skippedSteps.get(0),
        hasToString("Step 4 (beta): Cannot resolve formula \"Sprinkler\""));
    assertThat(result.skippedSteps.get(1),
        hasToString("Step 5 (gamma): Unknown rule 'gamma'"));
  }

  @Test void testRuleFailure() {
    final String yaml = "propositions: [A]\n"
        + "steps:\n"
        + "  - rule: contraposition\n"
        + "    from: [A]\n"
        + "  - rule: alpha\n"
        + "    from: [A]\n"
        + "  - rule: beta\n"
        + "  - rule: beta\n"
        + "    from: [\"(A ∧\", A]\n"
        + "targets: [A]\n";
    final ReasoningResult result =
        runner().run(Scenarios.parse(yaml, "fail"), ImmutableMap.of());
    assertThat(result.allProven(), is(true));
    final List<SkippedStep> skipped = result.skippedSteps;
    assertThat(skipped.size(), is(4));
    assertThat(skipped.get(0).reason,
        is("Formula is not an implication - contraposition requires an "
            + "implication: A"));
    assertThat(skipped.get(1).reason,
        is("Rule 'alpha/and' expects 2 antecedent step(s) but got 1"));
    assertThat(skipped.get(2).reason, is("Step has no 'from' list"));
    assertThat(skipped.get(3).reason,
        startsWith("Malformed formula \"(A ∧\": "));
    assertThat(result.state.steps().size(), is(1));
  }

  /** A step that names no rule is skipped; later steps still apply. */
  @Test void testStepWithoutRule() {
    final String yaml = "propositions: [A, B]\n"
        + "steps:\n"
        + "  - from: [A]\n"
        + "  - rule: alpha\n"
        + "    from: [A, B]\n"
        + "targets: ['(A ∧ B)']\n";
    final ReasoningResult result =
        runner().run(Scenarios.parse(yaml, "norule"), ImmutableMap.of());
    assertThat(result.skippedSteps.size(), is(1));
    final SkippedStep skipped = result.skippedSteps.get(0);
    assertThat(skipped.stepIndex, is(1));
    assertThat(skipped.rule, nullValue());
    assertThat(skipped, hasToString("Step 1: Step has no 'rule'"));
    assertThat(result.state.steps().size(), is(3));
    assertThat(result.allProven(), is(true));
    assertThat(result.targets.get(0).result.depth, is(0));
  }

  /** Missing facts are tracked before the rule is looked up, so a step
   * with an unknown rule still reports them. */
  @Test void testMissingFactsBeforeRule() {
    final String yaml = "propositions: [A]\n"
        + "steps:\n"
        + "  - rule: gamma\n"
        + "    from: [A, Z]\n"
        + "targets: [A]\n";
    final ReasoningResult result =
        runner().run(Scenarios.parse(yaml, "unknown"), ImmutableMap.of());
    assertThat(result.missingFacts, is(ImmutableSet.of("Z")));
    final SkippedStep skipped = result.skippedSteps.get(0);
    assertThat(skipped.missingFacts, is(ImmutableList.of("Z")));
    assertThat(skipped, hasToString("Step 1 (gamma): Missing Z"));
  }

  /** With selective resolution, only resolvers for atoms the scenario
   * references are run. */
  @Test void testSelectiveResolution() {
    final AtomicInteger calls = new AtomicInteger();
    final Map<String, FactResolver> resolvers = new LinkedHashMap<>();
    resolvers.put("CustomerIsVIP", FactResolvers.constant(true));
    resolvers.put("PaymentProcessed", FactResolvers.constant(true));
    resolvers.put("WeatherIsFine", () -> calls.incrementAndGet() > 0);

    final Map<Prop, Object> map = new LinkedHashMap<>();
    Prop.SELECTIVE_RESOLUTION.set(map, true);
    final ReasoningResult result =
        new ScenarioRunner(map, Tracers.empty())
            .run(Fixtures.scenario("order.yaml"), resolvers);
    assertThat(calls.get(), is(0));
    assertThat(result.factResolutions.keySet(),
        is(ImmutableSet.of("CustomerIsVIP", "PaymentProcessed")));

    final ReasoningResult result2 =
        runner().run(Fixtures.scenario("order.yaml"), resolvers);
    assertThat(calls.get(), is(1));
    assertThat(result2.availableFacts.contains("WeatherIsFine"), is(true));
  }

  @Test void testValidate() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    Prop.VALIDATE.set(map, true);
    final ScenarioRunner runner = new ScenarioRunner(map, Tracers.empty());
    final ScenarioException e =
        assertThrows(ScenarioException.class,
            () -> runner.run(Fixtures.scenario("invalid.yaml"),
                ImmutableMap.of()));
    assertThat(e.getMessage(), startsWith("Invalid scenario "));

    // A valid scenario runs as usual
    assertThat(
        runner.run(Fixtures.scenario("proven.yaml"), ImmutableMap.of())
            .allProven(),
        is(true));
  }

  /** The proof depth limit comes from the configuration. */
  @Test void testMaxProofDepth() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    Prop.MAX_PROOF_DEPTH.set(map, 1);
    final Scenario scenario =
        Scenarios.parse("propositions: [A, B]\n"
            + "targets: [\"((A ∧ B) ∨ A)\", \"(A ∧ B)\"]\n", "depth");
    final ReasoningResult result =
        new ScenarioRunner(map, Tracers.empty())
            .run(scenario, ImmutableMap.of());
    assertThat(result.targets.get(0).proven(), is(false));
    assertThat(result.targets.get(1).proven(), is(true));

    final ReasoningResult result2 = runner().run(scenario, ImmutableMap.of());
    assertThat(result2.allProven(), is(true));
  }
}

// End ScenarioRunnerTest.java
