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
package net.hydromatic.gentzen.formula;

/** Builds formula nodes. */
public enum FormulaBuilder {
  /**
   * The singleton instance of the formula builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  formula;

  /** Creates an atomic proposition. */
  public Formula.Atom atom(String name) {
    return new Formula.Atom(name);
  }

  /** Creates a negation. */
  public Formula.Not not(Formula operand) {
    return new Formula.Not(operand);
  }

  /** Creates a negation; synonym for {@link #not}. */
  public Formula.Not negate(Formula operand) {
    return not(operand);
  }

  /** Creates a conjunction, "{@code left ∧ right}". */
  public Formula.Binary and(Formula left, Formula right) {
    return new Formula.Binary(Op.AND, left, right);
  }

  /** Creates a disjunction, "{@code left ∨ right}". */
  public Formula.Binary or(Formula left, Formula right) {
    return new Formula.Binary(Op.OR, left, right);
  }

  /** Creates an implication, "{@code left → right}". */
  public Formula.Binary implies(Formula left, Formula right) {
    return new Formula.Binary(Op.IMPLIES, left, right);
  }

  /** Creates an equivalence, "{@code left ↔ right}". */
  public Formula.Binary iff(Formula left, Formula right) {
    return new Formula.Binary(Op.IFF, left, right);
  }

  /** Creates a binary node with a given operator. */
  public Formula.Binary binary(Op op, Formula left, Formula right) {
    return new Formula.Binary(op, left, right);
  }
}

// End FormulaBuilder.java
