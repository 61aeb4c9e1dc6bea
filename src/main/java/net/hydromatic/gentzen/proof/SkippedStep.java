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
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Record of a scenario step that could not be applied, either because some
 * of the facts it needs are missing or because its rule failed.
 */
public class SkippedStep {
  /** One-based position of the step in its scenario. */
  public final int stepIndex;

  /** Rule name as written in the scenario; null if the step has none. */
  public final @Nullable String rule;
  public final @Nullable String subtype;
  public final ImmutableList<String> from;
  public final ImmutableList<String> missingFacts;
  /** Why the step was skipped. */
  public final String reason;

  public SkippedStep(
      int stepIndex,
      @Nullable String rule,
      @Nullable String subtype,
      List<String> from,
      List<String> missingFacts,
      String reason) {
    this.stepIndex = stepIndex;
    this.rule = rule;
    this.subtype = subtype;
    this.from = ImmutableList.copyOf(from);
    this.missingFacts = ImmutableList.copyOf(missingFacts);
    this.reason = requireNonNull(reason, "reason");
  }

  /** Creates a record of a step skipped because facts are missing. */
  public static SkippedStep missing(
      int stepIndex,
      @Nullable String rule,
      @Nullable String subtype,
      List<String> from,
      List<String> missingFacts) {
    return new SkippedStep(
        stepIndex,
        rule,
        subtype,
        from,
        missingFacts,
        "Missing " + String.join(", ", missingFacts));
  }

  /** Creates a record of a step skipped because its rule failed. */
  public static SkippedStep failed(
      int stepIndex,
      @Nullable String rule,
      @Nullable String subtype,
      List<String> from,
      String reason) {
    return new SkippedStep(
        stepIndex, rule, subtype, from, ImmutableList.of(), reason);
  }

  @Override
  public String toString() {
    return "Step " + stepIndex + (rule == null ? "" : " (" + rule + ")")
        + ": " + reason;
  }
}

// End SkippedStep.java
