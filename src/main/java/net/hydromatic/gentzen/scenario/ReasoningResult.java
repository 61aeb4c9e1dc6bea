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
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.gentzen.proof.DerivationState;
import net.hydromatic.gentzen.proof.SearchResult;
import net.hydromatic.gentzen.proof.SkippedStep;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Outcome of running a {@link Scenario}. */
public class ReasoningResult {
  public final String scenarioName;
  public final ImmutableList<String> propositions;
  public final ImmutableList<TargetResult> targets;
  /** Facts that were available to the derivation. */
  public final ImmutableSet<String> availableFacts;
  /** Atoms that steps or targets needed but no resolver established. */
  public final ImmutableSet<String> missingFacts;
  public final ImmutableList<SkippedStep> skippedSteps;
  /** Value of each fact resolver that was run. */
  public final ImmutableMap<String, Boolean> factResolutions;
  /** Derivation state after steps were applied and targets searched. */
  public final DerivationState state;

  public ReasoningResult(
      String scenarioName,
      List<String> propositions,
      List<TargetResult> targets,
      Set<String> availableFacts,
      Set<String> missingFacts,
      List<SkippedStep> skippedSteps,
      Map<String, Boolean> factResolutions,
      DerivationState state) {
    this.scenarioName = requireNonNull(scenarioName, "scenarioName");
    this.propositions = ImmutableList.copyOf(propositions);
    this.targets = ImmutableList.copyOf(targets);
    this.availableFacts = ImmutableSet.copyOf(availableFacts);
    this.missingFacts = ImmutableSet.copyOf(missingFacts);
    this.skippedSteps = ImmutableList.copyOf(skippedSteps);
    this.factResolutions = ImmutableMap.copyOf(factResolutions);
    this.state = requireNonNull(state, "state");
  }

  /** Returns whether every target was proven. */
  public boolean allProven() {
    return targets.stream().allMatch(TargetResult::proven);
  }

  /** Returns the number of targets that were proven. */
  public int provenCount() {
    return (int) targets.stream().filter(TargetResult::proven).count();
  }

  @Override
  public String toString() {
    return scenarioName + ": " + provenCount() + "/" + targets.size()
        + " targets proven";
  }

  /** Outcome of searching for a proof of one target. */
  public static class TargetResult {
    public final String target;
    /** Search result; null if the target could not be searched. */
    public final @Nullable SearchResult result;
    /** Why the target could not be searched; null if it was. */
    public final @Nullable String error;

    private TargetResult(
        String target, @Nullable SearchResult result, @Nullable String error) {
      this.target = requireNonNull(target, "target");
      this.result = result;
      this.error = error;
    }

    /** Creates a result for a target that was searched. */
    public static TargetResult of(String target, SearchResult result) {
      return new TargetResult(target, requireNonNull(result, "result"), null);
    }

    /** Creates a result for a target that could not be searched. */
    public static TargetResult error(String target, String error) {
      return new TargetResult(target, null, requireNonNull(error, "error"));
    }

    public boolean proven() {
      return result != null && result.proven;
    }

    @Override
    public String toString() {
      return target + ": " + (result != null ? result : "error: " + error);
    }
  }
}

// End ReasoningResult.java
