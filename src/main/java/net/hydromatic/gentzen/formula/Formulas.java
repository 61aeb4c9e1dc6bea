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

import static net.hydromatic.gentzen.formula.FormulaBuilder.formula;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashSet;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Formula}. */
public abstract class Formulas {
  private Formulas() {}

  /**
   * Collapses every double negation, {@code ~~x}, into {@code x}.
   *
   * <p>This is the only simplification ever applied to a formula. It is
   * applied once, after parsing.
   */
  public static Formula normalize(Formula f) {
    switch (f.op) {
      case ATOM:
        return f;
      case NOT:
        final Formula operand = ((Formula.Not) f).operand;
        if (operand.op == Op.NOT) {
          return normalize(((Formula.Not) operand).operand);
        }
        final Formula operand2 = normalize(operand);
        return operand2 == operand ? f : formula.not(operand2);
      default:
        final Formula.Binary binary = (Formula.Binary) f;
        final Formula left = normalize(binary.left);
        final Formula right = normalize(binary.right);
        return left == binary.left && right == binary.right
            ? f
            : formula.binary(f.op, left, right);
    }
  }

  /**
   * Returns the names of the atoms in a formula, in order of first
   * occurrence, without duplicates.
   *
   * <p>Negation does not change an atom's identity: the atoms of {@code (A ∧
   * ~B)} are {@code [A, B]}.
   */
  public static ImmutableList<String> atoms(Formula f) {
    final Set<String> names = new LinkedHashSet<>();
    collectAtoms(f, names);
    return ImmutableList.copyOf(names);
  }

  private static void collectAtoms(Formula f, Set<String> names) {
    switch (f.op) {
      case ATOM:
        names.add(((Formula.Atom) f).name);
        break;
      case NOT:
        collectAtoms(((Formula.Not) f).operand, names);
        break;
      default:
        collectAtoms(((Formula.Binary) f).left, names);
        collectAtoms(((Formula.Binary) f).right, names);
    }
  }

  /** Returns whether two formulas have the same structure. */
  public static boolean equal(@Nullable Formula f0, @Nullable Formula f1) {
    if (f0 == f1) {
      return true;
    }
    if (f0 == null || f1 == null || f0.op != f1.op) {
      return false;
    }
    switch (f0.op) {
      case ATOM:
        return ((Formula.Atom) f0).name.equals(((Formula.Atom) f1).name);
      case NOT:
        return equal(((Formula.Not) f0).operand, ((Formula.Not) f1).operand);
      default:
        return equal(((Formula.Binary) f0).left, ((Formula.Binary) f1).left)
            && equal(((Formula.Binary) f0).right, ((Formula.Binary) f1).right);
    }
  }

  /** Returns the maximum nesting level of a formula; an atom has depth 1. */
  public static int depth(Formula f) {
    switch (f.op) {
      case ATOM:
        return 1;
      case NOT:
        return 1 + depth(((Formula.Not) f).operand);
      default:
        return 1
            + Math.max(
                depth(((Formula.Binary) f).left),
                depth(((Formula.Binary) f).right));
    }
  }

  /** Returns the number of nodes in a formula. */
  public static int nodeCount(Formula f) {
    switch (f.op) {
      case ATOM:
        return 1;
      case NOT:
        return 1 + nodeCount(((Formula.Not) f).operand);
      default:
        return 1
            + nodeCount(((Formula.Binary) f).left)
            + nodeCount(((Formula.Binary) f).right);
    }
  }

  /**
   * Checks that a formula is well-formed, and returns a list of errors. The
   * list is empty if the formula is valid.
   *
   * <p>Each error names the path to the offending node, for example "Null
   * node at root.left.operand".
   */
  public static ImmutableList<String> validate(@Nullable Formula f) {
    final ImmutableList.Builder<String> errors = ImmutableList.builder();
    validate(f, "root", errors);
    return errors.build();
  }

  private static void validate(
      @Nullable Formula f, String path, ImmutableList.Builder<String> errors) {
    if (f == null) {
      errors.add("Null node at " + path);
      return;
    }
    if (f instanceof Formula.Atom) {
      final String name = ((Formula.Atom) f).name;
      if (!Formula.NAME_PATTERN.matcher(name).matches()) {
        errors.add("Invalid atom name '" + name + "' at " + path);
      }
    } else if (f instanceof Formula.Not) {
      validate(((Formula.Not) f).operand, path + ".operand", errors);
    } else if (f instanceof Formula.Binary) {
      if (!f.op.isBinary()) {
        errors.add("Invalid binary operator '" + f.op.tag + "' at " + path);
      }
      validate(((Formula.Binary) f).left, path + ".left", errors);
      validate(((Formula.Binary) f).right, path + ".right", errors);
    } else {
      errors.add("Invalid node type '" + f.op + "' at " + path);
    }
  }

  /** Returns whether a formula is an implication, {@code A → B}. */
  public static boolean isImplication(Formula f) {
    return f.op == Op.IMPLIES;
  }

  /**
   * Strips every leading pair of negations from a formula string.
   *
   * <p>For example, {@code "~~~~A"} becomes {@code "A"} and {@code "~~~A"}
   * becomes {@code "~A"}. Works on the text, without parsing, so it only
   * looks at the front of the string; {@code "(~~A ∧ B)"} is unchanged.
   */
  public static String stripDoubleNegation(String s) {
    int i = 0;
    while (s.startsWith("~~", i)) {
      i += 2;
    }
    return s.substring(i);
  }
}

// End Formulas.java
