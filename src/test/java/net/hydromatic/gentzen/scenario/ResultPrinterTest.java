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
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;

import com.google.common.collect.ImmutableMap;
import java.io.PrintWriter;
import java.io.StringWriter;
import net.hydromatic.gentzen.proof.Tracers;
import org.junit.jupiter.api.Test;

/** Tests {@link ResultPrinter}. */
public class ResultPrinterTest {
  private static String print(ReasoningResult result, boolean verbose) {
    final StringWriter sw = new StringWriter();
    new ResultPrinter(new PrintWriter(sw), verbose).print(result);
    return sw.toString().replace(System.lineSeparator(), "\n");
  }

  private static ReasoningResult run(String file,
      ImmutableMap<String, Boolean> facts) {
    return new ScenarioRunner(ImmutableMap.of(), Tracers.empty())
        .run(Fixtures.scenario(file), FactResolvers.fromMap(facts));
  }

  @Test void testPrint() {
    final ReasoningResult result =
        run("order.yaml",
            ImmutableMap.of("CustomerIsVIP", true, "PaymentProcessed", true));
    final String expected = "Scenario: order.yaml\n"
        + "Available facts: CustomerIsVIP, PaymentProcessed\n"
        + "Missing facts: ProcessOrder\n"
        + "Targets:\n"
        + "  ✓ (CustomerIsVIP ∧ PaymentProcessed): proven at depth 0\n"
        + "  ✗ ProcessOrder: missing facts ProcessOrder\n"
        + "Skipped steps:\n"
        + "  Step 2 (alpha): Missing ProcessOrder\n"
        + "Proven 1 of 2 targets\n";
    assertThat(print(result, false), is(expected));
  }

  @Test void testPrintVerbose() {
    final ReasoningResult result = run("proven.yaml", ImmutableMap.of());
    final String expected = "Scenario: proven.yaml\n"
        + "Propositions: A, B\n"
        + "Available facts: (none)\n"
        + "Targets:\n"
        + "  ✓ A AND B: proven at depth 0\n"
        + "      proof:\n"
        + "        #1 Proposition A\n"
        + "        #2 Proposition B\n"
        + "        #3 alpha/and (A ∧ B)\n"
        + "  ✓ (B ∨ A): proven at depth 1\n"
        + "      path: (B ∨ A)\n"
        + "      proof:\n"
        + "        #1 Proposition A\n"
        + "        #2 Proposition B\n"
        + "        #4 beta (B ∨ A)\n"
        + "Fact resolutions:\n"
        + "Steps:\n"
        + "  #1 Proposition A\n"
        + "  #2 Proposition B\n"
        + "  #3 alpha/and (A ∧ B)\n"
        + "Proven 2 of 2 targets\n";
    assertThat(print(result, true), is(expected));
  }

  @Test void testPrintErrorsAndBounds() {
    final ReasoningResult result =
        run("rain.yaml", ImmutableMap.of("WetGrass", true, "Sprinkler", false));
    final String s = print(result, true);
    assertThat(s, containsString("  ✗ (Rain ∧: error: Parse error at "));
    assertThat(s,
        containsString("      path: (Rain ∨ (Rain → WetGrass))\n"));
    assertThat(s, containsString("  Sprinkler = false\n"));
    assertThat(s, containsString("  Step 5 (gamma): Unknown rule 'gamma'\n"));
    assertThat(s, containsString("Proven 3 of 5 targets\n"));
  }
}

// End ResultPrinterTest.java
