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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;
import net.hydromatic.gentzen.parse.Parsers;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Reads {@link Scenario} objects from YAML. */
public abstract class Scenarios {
  private static final YAMLMapper MAPPER = new YAMLMapper();

  private Scenarios() {}

  /** Reads a scenario from a YAML file. */
  public static Scenario load(Path path) {
    return fromTree(readTree(path), fileName(path));
  }

  /** Reads a scenario from a YAML string. */
  public static Scenario parse(String yaml, String name) {
    return fromTree(readTree(yaml), name);
  }

  /** Reads the YAML tree of a scenario file, without interpreting it. */
  public static JsonNode readTree(Path path) {
    final String yaml;
    try {
      yaml = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ScenarioException("Cannot read scenario " + path, e);
    }
    return readTree(yaml);
  }

  /** Reads the YAML tree of a scenario, without interpreting it. */
  public static JsonNode readTree(String yaml) {
    try {
      final @Nullable JsonNode node = MAPPER.readTree(yaml);
      return node == null ? MissingNode.getInstance() : node;
    } catch (JsonProcessingException e) {
      throw new ScenarioException(
          "Failed to parse scenario: " + e.getOriginalMessage(), e);
    }
  }

  /** Converts a YAML tree into a scenario. */
  public static Scenario fromTree(JsonNode node, String name) {
    if (!node.isObject()) {
      throw new ScenarioException("Scenario must be a mapping");
    }
    final ImmutableList.Builder<Scenario.Step> steps = ImmutableList.builder();
    final JsonNode stepsNode = node.path("steps");
    if (!stepsNode.isMissingNode() && !stepsNode.isNull()) {
      if (!stepsNode.isArray()) {
        throw new ScenarioException("Steps must be an array");
      }
      for (JsonNode stepNode : stepsNode) {
        final JsonNode rule = stepNode.path("rule");
        final JsonNode subtype = stepNode.path("subtype");
        final JsonNode from = stepNode.path("from");
        steps.add(
            new Scenario.Step(
                rule.isTextual() ? rule.asText() : null,
                subtype.isTextual() ? subtype.asText() : null,
                from.isArray() ? strings(from, "from") : null));
      }
    }
    return new Scenario(
        name,
        stringList(node, "propositions"),
        steps.build(),
        stringList(node, "targets"));
  }

  private static ImmutableList<String> stringList(JsonNode node, String field) {
    final JsonNode list = node.path(field);
    if (list.isMissingNode() || list.isNull()) {
      return ImmutableList.of();
    }
    if (!list.isArray()) {
      throw new ScenarioException(
          "Field \"" + field + "\" must be an array");
    }
    return strings(list, field);
  }

  private static ImmutableList<String> strings(JsonNode list, String field) {
    final ImmutableList.Builder<String> strings = ImmutableList.builder();
    for (JsonNode element : list) {
      if (!element.isTextual()) {
        throw new ScenarioException(
            "Field \"" + field + "\" must contain only strings");
      }
      strings.add(element.asText());
    }
    return strings.build();
  }

  /**
   * Returns the atoms a scenario refers to: its propositions, and the atoms
   * of its step formulas and targets. Formulas that cannot be parsed
   * contribute no atoms.
   */
  public static ImmutableSet<String> referencedAtoms(Scenario scenario) {
    final Set<String> atoms = new LinkedHashSet<>(scenario.propositions);
    for (Scenario.Step step : scenario.steps) {
      if (step.from != null) {
        for (String formula : step.from) {
          addAtoms(formula, atoms);
        }
      }
    }
    for (String target : scenario.targets) {
      addAtoms(target, atoms);
    }
    return ImmutableSet.copyOf(atoms);
  }

  private static void addAtoms(String formula, Set<String> atoms) {
    // Malformed formulas are reported when the scenario runs.
    if (Parsers.validate(formula).isValid()) {
      atoms.addAll(Parsers.atoms(formula));
    }
  }

  private static String fileName(Path path) {
    final @Nullable Path fileName = path.getFileName();
    return fileName == null ? path.toString() : fileName.toString();
  }
}

// End Scenarios.java
