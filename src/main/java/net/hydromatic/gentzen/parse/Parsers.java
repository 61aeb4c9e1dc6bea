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
package net.hydromatic.gentzen.parse;

import static java.util.Objects.requireNonNull;

import com.google.common.base.Throwables;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.UncheckedExecutionException;
import net.hydromatic.gentzen.formula.Formula;
import net.hydromatic.gentzen.formula.Formulas;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for parsing formulas. */
public final class Parsers {
  private Parsers() {}

  /** Canonical strings of recently seen formula strings. */
  private static final LoadingCache<String, String> CANONICAL_CACHE =
      CacheBuilder.newBuilder()
          .maximumSize(10_000)
          .build(CacheLoader.from(s -> parse(s).toString()));

  /**
   * Parses a string into a normalized formula.
   *
   * @throws FormulaParseException if the string is not a valid formula
   */
  public static Formula parse(String s) {
    return Formulas.normalize(parseRaw(s));
  }

  /** Parses a string into a formula, without collapsing double negations. */
  public static Formula parseRaw(String s) {
    return FormulaParser.parse(s);
  }

  /** Splits a string into tokens. */
  public static ImmutableList<Token> tokenize(String s) {
    return FormulaLexer.tokenize(s);
  }

  /**
   * Returns the canonical string of a formula string; for example, {@code
   * canonical("A AND B -> ~~C")} returns {@code "((A ∧ B) → C)"}.
   *
   * @throws FormulaParseException if the string is not a valid formula
   */
  public static String canonical(String s) {
    try {
      return CANONICAL_CACHE.getUnchecked(s);
    } catch (UncheckedExecutionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw e;
    }
  }

  /**
   * Returns the canonical string of a formula string, or null if it is not
   * a valid formula.
   */
  public static @Nullable String tryCanonical(String s) {
    try {
      return canonical(s);
    } catch (FormulaParseException e) {
      return null;
    }
  }

  /** Returns the names of the atoms referenced by a formula string. */
  public static ImmutableList<String> atoms(String s) {
    return Formulas.atoms(parse(s));
  }

  /** Checks the syntax of a formula string. Never throws. */
  public static SyntaxCheck validate(String s) {
    try {
      parseRaw(s);
      return new SyntaxCheck(ImmutableList.of(), null);
    } catch (FormulaParseException e) {
      return new SyntaxCheck(ImmutableList.of(e.getMessage()), e.pos());
    }
  }

  /** Result of {@link #validate(String)}. */
  public static class SyntaxCheck {
    public final ImmutableList<String> errors;
    /** Position of the first error, or null if valid. */
    public final @Nullable Pos pos;

    SyntaxCheck(ImmutableList<String> errors, @Nullable Pos pos) {
      this.errors = requireNonNull(errors);
      this.pos = pos;
    }

    public boolean isValid() {
      return errors.isEmpty();
    }

    @Override
    public String toString() {
      return isValid() ? "valid" : errors.get(0);
    }
  }
}

// End Parsers.java
