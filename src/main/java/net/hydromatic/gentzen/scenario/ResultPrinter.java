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
import java.io.PrintWriter;
import java.util.Map;
import net.hydromatic.gentzen.proof.DerivationState;
import net.hydromatic.gentzen.proof.SearchResult;
import net.hydromatic.gentzen.proof.SkippedStep;
import net.hydromatic.gentzen.proof.Step;

/** Writes a {@link ReasoningResult} as plain text. */
public class ResultPrinter {
  private final PrintWriter out;
  private final boolean verbose;

  public ResultPrinter(PrintWriter out, boolean verbose) {
    this.out = requireNonNull(out, "out");
    this.verbose = verbose;
  }

  /** Prints a result, and flushes the writer. */
  public void print(ReasoningResult result) {
    out.println("Scenario: " + result.scenarioName);
    if (!result.propositions.isEmpty()) {
      out.println("Propositions: " + String.join(", ", result.propositions));
    }
    out.println("Available facts: " + list(result.availableFacts));
    if (!result.missingFacts.isEmpty()) {
      out.println("Missing facts: " + String.join(", ", result.missingFacts));
    }

    out.println("Targets:");
    for (ReasoningResult.TargetResult target : result.targets) {
      printTarget(target);
    }

    if (!result.skippedSteps.isEmpty()) {
      out.println("Skipped steps:");
      for (SkippedStep skippedStep : result.skippedSteps) {
        out.println("  " + skippedStep);
      }
    }

    if (verbose) {
      out.println("Fact resolutions:");
      for (Map.Entry<String, Boolean> e : result.factResolutions.entrySet()) {
        out.println("  " + e.getKey() + " = " + e.getValue());
      }
      out.println("Steps:");
      for (Step step : result.state.steps()) {
        out.println("  " + step);
      }
    }

    out.println(
        "Proven " + result.provenCount() + " of " + result.targets.size()
            + " targets");
    out.flush();
  }

  private void printTarget(ReasoningResult.TargetResult target) {
    if (target.result == null) {
      out.println("  ✗ " + target.target + ": error: " + target.error);
      return;
    }
    final SearchResult result = target.result;
    if (result.proven) {
      out.println(
          "  ✓ " + target.target + ": proven at depth " + result.depth);
      if (!result.path.isEmpty()) {
        out.println("      path: " + String.join(" ⇒ ", result.path));
      }
      if (verbose && result.proof != null) {
        printLineage(result.proof, target.target);
      }
    } else if (!result.missingFacts.isEmpty()) {
      out.println(
          "  ✗ " + target.target + ": missing facts "
              + String.join(", ", result.missingFacts));
    } else if (result.boundExceeded) {
      out.println(
          "  ✗ " + target.target + ": not proven (search bounds exceeded)");
    } else {
      out.println("  ✗ " + target.target + ": not proven");
    }
  }

  private void printLineage(DerivationState proof, String target) {
    final ImmutableList<Step> steps = proof.findStepsContaining(target);
    if (steps.isEmpty()) {
      // Target is a fact.
      return;
    }
    out.println("      proof:");
    for (Step step : proof.lineage(steps.get(0))) {
      out.println("        " + step);
    }
  }

  private static String list(Iterable<String> strings) {
    final String s = String.join(", ", strings);
    return s.isEmpty() ? "(none)" : s;
  }
}

// End ResultPrinter.java
