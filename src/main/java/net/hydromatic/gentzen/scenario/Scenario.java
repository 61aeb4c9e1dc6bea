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
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Declarative reasoning scenario: propositions to declare, rule applications
 * to perform, and target formulas to prove.
 *
 * <p>In YAML:
 *
 * <pre>{@code
 * propositions:
 *   - ProcessOrder
 * steps:
 *   - rule: alpha
 *     subtype: and
 *     from: [CustomerIsVIP, PaymentProcessed]
 * targets:
 *   - (CustomerIsVIP ∧ PaymentProcessed)
 * }</pre>
 *
 * @see Scenarios
 */
public class Scenario {
  public final String name;
  public final ImmutableList<String> propositions;
  public final ImmutableList<Step> steps;
  public final ImmutableList<String> targets;

  public Scenario(
      String name,
      List<String> propositions,
      List<Step> steps,
      List<String> targets) {
    this.name = requireNonNull(name, "name");
    this.propositions = ImmutableList.copyOf(propositions);
    this.steps = ImmutableList.copyOf(steps);
    this.targets = ImmutableList.copyOf(targets);
  }

  @Override
  public String toString() {
    return "Scenario{name="
        + name
        + ", propositions="
        + propositions
        + ", steps="
        + steps
        + ", targets="
        + targets
        + "}";
  }

  /** Rule application in a scenario. */
  public static class Step {
    /** Name of the rule; null if the step does not name one. */
    public final @Nullable String rule;
    public final @Nullable String subtype;
    /** Formulas the rule is applied to; null if the step has no list. */
    public final @Nullable ImmutableList<String> from;

    public Step(
        @Nullable String rule,
        @Nullable String subtype,
        @Nullable List<String> from) {
      this.rule = rule;
      this.subtype = subtype;
      this.from = from == null ? null : ImmutableList.copyOf(from);
    }

    @Override
    public String toString() {
      return rule + (subtype == null ? "" : "/" + subtype) + " from " + from;
    }
  }
}

// End Scenario.java
