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

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks a scenario file for structural problems before it is run.
 *
 * <p>Errors are problems that will make steps or targets fail; warnings are
 * matters of style.
 */
public abstract class ScenarioValidator {
  private static final Pattern PASCAL_CASE =
      Pattern.compile("[A-Z][a-zA-Z0-9]*");

  /** Binary operator, in any of its spellings. Alphabetic spellings are
   * whole words, so "ORDER" is not an operator. */
  private static final Pattern BINARY_OPERATOR =
      Pattern.compile("[∧∨→↔&|]|->|=>|\\b(?:AND|OR|IMPLIES|IFF)\\b");

  private ScenarioValidator() {}

  /** Validates a scenario file. Never throws. */
  public static Validation validate(Path path) {
    final JsonNode node;
    try {
      node = Scenarios.readTree(path);
    } catch (ScenarioException e) {
      return new Validation(
          ImmutableList.of(
              "Failed to parse scenario file: " + e.getMessage()),
          ImmutableList.of());
    }
    return validate(node);
  }

  /** Validates the YAML tree of a scenario. */
  public static Validation validate(JsonNode scenario) {
    final List<String> errors = new ArrayList<>();
    final List<String> warnings = new ArrayList<>();
    final List<String> formulas = new ArrayList<>();

    final JsonNode targets = scenario.path("targets");
    if (!targets.isArray() || targets.isEmpty()) {
      errors.add(
          "Missing required \"targets\" field or targets array is empty");
    } else {
      int i = 0;
      for (JsonNode target : targets) {
        if (!target.isTextual() || target.asText().isEmpty()) {
          errors.add("Target " + i + " is not a valid string");
        } else {
          formulas.add(target.asText());
        }
        ++i;
      }
    }

    final JsonNode steps = scenario.path("steps");
    if (!steps.isMissingNode() && !steps.isNull()) {
      if (!steps.isArray()) {
        errors.add("Steps must be an array");
      } else {
        int i = 0;
        for (JsonNode step : steps) {
          if (!step.path("rule").isTextual()) {
            errors.add("Step " + i + " missing \"rule\" field");
          }
          final JsonNode from = step.path("from");
          if (!from.isArray()) {
            errors.add("Step " + i + " missing \"from\" array");
          } else {
            for (JsonNode formula : from) {
              if (formula.isTextual()) {
                formulas.add(formula.asText());
              }
            }
          }
          ++i;
        }
      }
    }

    final JsonNode propositions = scenario.path("propositions");
    if (!propositions.isMissingNode() && !propositions.isNull()) {
      if (!propositions.isArray()) {
        errors.add("Propositions must be an array");
      } else {
        final Set<String> names = new HashSet<>();
        int i = 0;
        for (JsonNode proposition : propositions) {
          if (!proposition.isTextual()) {
            errors.add("Proposition " + i + " must be a string");
          } else {
            final String name = proposition.asText();
            if (!names.add(name)) {
              errors.add("Duplicate proposition name: " + name);
            }
            if (!PASCAL_CASE.matcher(name).matches()) {
              warnings.add(
                  "Proposition \"" + name + "\" should use PascalCase naming");
            }
          }
          ++i;
        }
      }
    }

    for (String formula : formulas) {
      if (!balanced(formula)) {
        errors.add("Formula \"" + formula + "\" has unbalanced parentheses");
      }
      if (BINARY_OPERATOR.matcher(formula).find() && !formula.contains("(")) {
        warnings.add(
            "Formula \""
                + formula
                + "\" may need parentheses around compound expressions");
      }
    }
    return new Validation(errors, warnings);
  }

  private static boolean balanced(String formula) {
    int depth = 0;
    for (int i = 0; i < formula.length(); i++) {
      switch (formula.charAt(i)) {
        case '(':
          ++depth;
          break;
        case ')':
          if (--depth < 0) {
            return false;
          }
          break;
        default:
          break;
      }
    }
    return depth == 0;
  }

  /** Result of validating a scenario. */
  public static class Validation {
    public final ImmutableList<String> errors;
    public final ImmutableList<String> warnings;

    Validation(List<String> errors, List<String> warnings) {
      this.errors = ImmutableList.copyOf(errors);
      this.warnings = ImmutableList.copyOf(warnings);
    }

    public boolean isValid() {
      return errors.isEmpty();
    }

    /** Returns a summary such as "2 errors, 1 warnings". */
    public String summary() {
      return errors.size() + " errors, " + warnings.size() + " warnings";
    }

    @Override
    public String toString() {
      return summary();
    }
  }
}

// End ScenarioValidator.java
