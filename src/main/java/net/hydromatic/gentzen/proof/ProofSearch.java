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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import net.hydromatic.gentzen.formula.Formulas;

/**
 * Bounded breadth-first search for a derivation of a target formula.
 *
 * <p>Each round expands a state by applying every binary rule to every
 * ordered pair of its steps, and every unary rule to every step, each on its
 * own copy of the state. A candidate survives only if it adds a formula that
 * its parent did not know. States whose {@link DerivationState#signature()
 * signature} has been seen before are not queued again.
 *
 * <p>The search stops as soon as a candidate contains the target, or when it
 * exceeds one of its {@link SearchBounds}.
 */
public class ProofSearch {
  private final SearchBounds bounds;
  private final Tracer tracer;

  public ProofSearch(SearchBounds bounds, Tracer tracer) {
    this.bounds = requireNonNull(bounds, "bounds");
    this.tracer = requireNonNull(tracer, "tracer");
  }

  /**
   * Searches for a derivation of {@code target} from {@code state}.
   *
   * <p>If some atoms of the target are unresolvable, records them as missing
   * in {@code state} and returns without searching. Otherwise, does not
   * modify {@code state}.
   *
   * @param state Initial state
   * @param target Target formula
   * @param maxDepth Maximum number of rounds of rule application
   */
  public SearchResult search(DerivationState state, String target,
      int maxDepth) {
    final SearchResult result = search_(state, target, maxDepth);
    tracer.onResult(target, result);
    return result;
  }

  private SearchResult search_(DerivationState state, String target,
      int maxDepth) {
    if (state.isProved(target)) {
      return SearchResult.proven(0, ImmutableList.of(), state);
    }

    final Resolution resolution = state.canResolveFormula(target);
    if (!resolution.resolved) {
      resolution.missing.forEach(state::trackMissingFact);
      tracer.onMissingFacts(target, resolution.missing);
      return SearchResult.missing(resolution.missing);
    }

    final Queue<Node> queue = new ArrayDeque<>();
    queue.add(new Node(state, 0, ImmutableList.of()));
    final Set<String> visited = new HashSet<>();
    visited.add(state.signature());
    int iterations = 0;

    while (!queue.isEmpty()) {
      ++iterations;
      if (iterations > bounds.maxIterations
          || queue.size() > bounds.maxQueueSize) {
        tracer.onBoundExceeded(target, iterations, queue.size());
        return SearchResult.notFound(true);
      }
      final Node node = queue.remove();
      if (node.state.isProved(target)) {
        return SearchResult.proven(node.depth, node.path, node.state);
      }
      if (node.depth >= maxDepth) {
        continue;
      }
      final List<Candidate> candidates = successors(node.state);
      tracer.onExpand(node.depth, node.state, candidates.size());
      for (Candidate candidate : candidates) {
        final ImmutableList<String> path =
            ImmutableList.<String>builder()
                .addAll(node.path)
                .add(candidate.formula)
                .build();
        if (candidate.state.isProved(target)) {
          return SearchResult.proven(node.depth + 1, path, candidate.state);
        }
        if (visited.add(candidate.state.signature())) {
          queue.add(new Node(candidate.state, node.depth + 1, path));
        }
      }
    }
    return SearchResult.notFound(false);
  }

  /**
   * Returns the states reachable from a state by one rule application that
   * each add a new formula.
   */
  public List<DerivationState> expand(DerivationState state) {
    final List<DerivationState> states = new ArrayList<>();
    for (Candidate candidate : successors(state)) {
      states.add(candidate.state);
    }
    return states;
  }

  /**
   * Generates the candidates of one round, in a deterministic order: binary
   * rules over ordered pairs of steps, then unary rules over single steps.
   */
  List<Candidate> successors(DerivationState state) {
    final List<Step> steps = state.steps();
    final int stepCount = steps.size();
    if (stepCount >= bounds.maxSteps) {
      return ImmutableList.of();
    }
    final Set<String> known = state.knownFormulas();
    final List<Candidate> candidates = new ArrayList<>();
    for (int i = 0; i < stepCount; i++) {
      for (int j = 0; j < stepCount; j++) {
        for (Rule rule : Rule.BINARY_RULES) {
          tryApply(state, known, rule, ImmutableList.of(i, j), candidates);
        }
      }
    }
    for (int i = 0; i < stepCount; i++) {
      for (Rule rule : Rule.UNARY_RULES) {
        tryApply(state, known, rule, ImmutableList.of(i), candidates);
      }
    }
    return candidates;
  }

  private static void tryApply(
      DerivationState state,
      Set<String> known,
      Rule rule,
      List<Integer> ordinals,
      List<Candidate> candidates) {
    final DerivationState copy = state.copy();
    final List<Step> antecedents = new ArrayList<>();
    for (int ordinal : ordinals) {
      antecedents.add(copy.steps().get(ordinal));
    }
    final Step step;
    try {
      step = copy.apply(rule, antecedents);
    } catch (RuleException e) {
      return; // not applicable; discard
    }
    for (String formula : step.formulas()) {
      if (!known.contains(Formulas.stripDoubleNegation(formula))) {
        candidates.add(new Candidate(copy, formula));
        return;
      }
    }
  }

  /** State in the search queue. */
  private static class Node {
    final DerivationState state;
    final int depth;
    final ImmutableList<String> path;

    Node(DerivationState state, int depth, ImmutableList<String> path) {
      this.state = state;
      this.depth = depth;
      this.path = path;
    }
  }

  /** Successor state, and the new formula it derived. */
  static class Candidate {
    final DerivationState state;
    final String formula;

    Candidate(DerivationState state, String formula) {
      this.state = state;
      this.formula = formula;
    }
  }
}

// End ProofSearch.java
