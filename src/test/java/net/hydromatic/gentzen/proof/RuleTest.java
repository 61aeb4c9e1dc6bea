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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests {@link Rule}. */
public class RuleTest {
  @Test void testLookup() {
    assertThat(Rule.lookup("alpha", "and"), is(Rule.ALPHA_AND));
    assertThat(Rule.lookup("alpha", "implies"), is(Rule.ALPHA_IMPLIES));
    assertThat(Rule.lookup("alpha", "IMPLIES"), is(Rule.ALPHA_IMPLIES));
    assertThat(Rule.lookup("beta", null), is(Rule.BETA));
    assertThat(Rule.lookup("contraposition", null), is(Rule.CONTRAPOSITION));
    assertThat(Rule.lookup("doubleNegation", "elimination"),
        is(Rule.DOUBLE_NEGATION_ELIMINATION));
    assertThat(Rule.lookup("equivalence", null), is(Rule.EQUIVALENCE));
  }

  @Test void testLookupDefaultSubtype() {
    assertThat(Rule.lookup("alpha", null), is(Rule.ALPHA_AND));
    assertThat(Rule.lookup("doubleNegation", null),
        is(Rule.DOUBLE_NEGATION_INTRODUCTION));
  }

  @Test void testLookupUnknown() {
    final RuleException e =
        assertThrows(RuleException.class, () -> Rule.lookup("gamma", null));
    assertThat(e.getMessage(), is("Unknown rule 'gamma'"));

    final RuleException e2 =
        assertThrows(RuleException.class, () -> Rule.lookup("alpha", "or"));
    assertThat(e2.getMessage(), is("Unknown subtype 'or' for alpha rule"));

    final RuleException e3 =
        assertThrows(RuleException.class,
            () -> Rule.lookup("doubleNegation", "triple"));
    assertThat(e3.getMessage(),
        is("Unknown subtype 'triple' for doubleNegation rule"));
  }

  @Test void testArity() {
    for (Rule rule : Rule.BINARY_RULES) {
      assertThat(rule.arity, is(2));
    }
    for (Rule rule : Rule.UNARY_RULES) {
      assertThat(rule.arity, is(1));
    }
    assertThat(Rule.PROPOSITION.isInference(), is(false));
    assertThat(Rule.FACT_REFERENCE.isInference(), is(false));
    assertThat(Rule.BETA.isInference(), is(true));
  }

  @Test void testToString() {
    assertThat(Rule.ALPHA_IMPLIES, hasToString("alpha/implies"));
    assertThat(Rule.DOUBLE_NEGATION_ELIMINATION,
        hasToString("doubleNegation/elimination"));
    assertThat(Rule.BETA, hasToString("beta"));
    assertThat(Rule.PROPOSITION, hasToString("Proposition"));
  }
}

// End RuleTest.java
