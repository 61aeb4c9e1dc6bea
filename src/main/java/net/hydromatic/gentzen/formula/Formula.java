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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Propositional formula.
 *
 * <p>A formula is an immutable tree of {@link Atom}, {@link Not} and {@link
 * Binary} nodes. Its {@link #toString()} is the canonical rendering: binary
 * nodes are always parenthesized, for example {@code ((A ∧ B) → ~C)}. Two
 * formulas are the same if and only if their canonical strings are equal.
 *
 * @see FormulaBuilder
 */
public abstract class Formula {
  /** Pattern that an atom's name must match. */
  public static final Pattern NAME_PATTERN =
      Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

  public final Op op;

  Formula(Op op) {
    this.op = requireNonNull(op, "op");
  }

  @Override
  public final String toString() {
    return unparse(new StringBuilder()).toString();
  }

  /** Appends the canonical rendering of this formula to a buffer. */
  public abstract StringBuilder unparse(StringBuilder buf);

  /** Atomic proposition. */
  public static final class Atom extends Formula {
    public final String name;

    Atom(String name) {
      super(Op.ATOM);
      this.name = requireNonNull(name, "name");
      checkArgument(
          NAME_PATTERN.matcher(name).matches(), "invalid atom name '%s'", name);
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      return buf.append(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Atom && name.equals(((Atom) o).name);
    }
  }

  /** Negation. */
  public static final class Not extends Formula {
    public final Formula operand;

    Not(Formula operand) {
      super(Op.NOT);
      this.operand = requireNonNull(operand, "operand");
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      return operand.unparse(buf.append(op.symbol));
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, operand);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Not && operand.equals(((Not) o).operand);
    }
  }

  /** Conjunction, disjunction, implication or equivalence. */
  public static final class Binary extends Formula {
    public final Formula left;
    public final Formula right;

    Binary(Op op, Formula left, Formula right) {
      super(op);
      checkArgument(op.isBinary(), "not a binary operator: %s", op);
      this.left = requireNonNull(left, "left");
      this.right = requireNonNull(right, "right");
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      buf.append('(');
      left.unparse(buf).append(' ').append(op.symbol).append(' ');
      return right.unparse(buf).append(')');
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, left, right);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Binary
              && op == ((Binary) o).op
              && left.equals(((Binary) o).left)
              && right.equals(((Binary) o).right);
    }
  }
}

// End Formula.java
