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

import static net.hydromatic.gentzen.formula.FormulaBuilder.formula;

import java.util.List;
import net.hydromatic.gentzen.formula.Formula;
import net.hydromatic.gentzen.formula.Op;

/**
 * Recursive-descent parser for propositional formulas.
 *
 * <p>Grammar, from lowest to highest precedence:
 *
 * <pre>
 * formula     := iff
 * iff         := implication ( IFF implication )*          (left-assoc)
 * implication := disjunction ( IMPLIES implication )?      (right-assoc)
 * disjunction := conjunction ( OR conjunction )*           (left-assoc)
 * conjunction := negation ( AND negation )*                (left-assoc)
 * negation    := NOT* primary
 * primary     := IDENTIFIER | '(' formula ')'
 * </pre>
 *
 * <p>The parser does not normalize; see {@link Parsers#parse(String)}.
 */
public class FormulaParser {
  private final List<Token> tokens;
  private int i;

  /** Creates a parser over a list of tokens that ends with EOF. */
  public FormulaParser(List<Token> tokens) {
    this.tokens = tokens;
  }

  /** Parses a string, without normalizing. */
  public static Formula parse(String s) {
    return new FormulaParser(FormulaLexer.tokenize(s)).parse();
  }

  /**
   * Parses a complete formula. Throws if there are tokens left over.
   *
   * @throws FormulaParseException if the tokens do not form a formula
   */
  public Formula parse() {
    final Formula f = parseIff();
    final Token token = current();
    if (token.kind != Token.Kind.EOF) {
      throw new FormulaParseException(
          "Unexpected token " + token.describe() + " after complete formula",
          token.pos);
    }
    return f;
  }

  private Token current() {
    return tokens.get(Math.min(i, tokens.size() - 1));
  }

  private boolean match(Op op) {
    if (current().isOp(op)) {
      ++i;
      return true;
    }
    return false;
  }

  private Formula parseIff() {
    Formula left = parseImplication();
    while (match(Op.IFF)) {
      left = formula.iff(left, parseImplication());
    }
    return left;
  }

  private Formula parseImplication() {
    final Formula left = parseDisjunction();
    if (match(Op.IMPLIES)) {
      // Right-associative: "A → B → C" is "A → (B → C)"
      return formula.implies(left, parseImplication());
    }
    return left;
  }

  private Formula parseDisjunction() {
    Formula left = parseConjunction();
    while (match(Op.OR)) {
      left = formula.or(left, parseConjunction());
    }
    return left;
  }

  private Formula parseConjunction() {
    Formula left = parseNegation();
    while (match(Op.AND)) {
      left = formula.and(left, parseNegation());
    }
    return left;
  }

  private Formula parseNegation() {
    if (match(Op.NOT)) {
      return formula.not(parseNegation());
    }
    return parsePrimary();
  }

  private Formula parsePrimary() {
    final Token token = current();
    switch (token.kind) {
      case LPAREN:
        ++i;
        final Formula f = parseIff();
        final Token close = current();
        if (close.kind != Token.Kind.RPAREN) {
          throw new FormulaParseException(
              "Expected ')' after expression but found " + close.describe(),
              close.pos);
        }
        ++i;
        return f;
      case IDENTIFIER:
        ++i;
        return formula.atom(token.text);
      default:
        throw new FormulaParseException(
            "Expected identifier or '(' but found " + token.describe(),
            token.pos);
    }
  }
}

// End FormulaParser.java
