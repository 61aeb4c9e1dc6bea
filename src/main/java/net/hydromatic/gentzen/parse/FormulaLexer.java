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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import net.hydromatic.gentzen.formula.Op;

/**
 * Splits a formula string into tokens.
 *
 * <p>Operator aliases are normalized to their canonical {@link Op} as they are
 * read. Symbolic aliases are matched longest first, so that {@code <->} is
 * one token rather than {@code <}, {@code -}, {@code >}. Alphabetic aliases
 * ({@code AND}, {@code OR}, {@code IMPLIES}, {@code IFF}, {@code NOT}) are
 * recognized only as whole words; {@code ORDER} is an identifier.
 */
public class FormulaLexer {
  /** Symbolic aliases, longest first. */
  private static final ImmutableList<Map.Entry<String, Op>> SYMBOLS;

  /** Alphabetic aliases. */
  private static final ImmutableMap<String, Op> WORDS;

  static {
    final List<Map.Entry<String, Op>> symbols = new ArrayList<>();
    final ImmutableMap.Builder<String, Op> words = ImmutableMap.builder();
    for (Op op : Op.values()) {
      for (String alias : op.aliases) {
        if (Character.isLetter(alias.charAt(0))) {
          words.put(alias, op);
        } else {
          symbols.add(Map.entry(alias, op));
        }
      }
    }
    symbols.sort(
        Comparator.comparingInt(
                (Map.Entry<String, Op> e) -> e.getKey().length())
            .reversed());
    SYMBOLS = ImmutableList.copyOf(symbols);
    WORDS = words.build();
  }

  private final String input;
  private int offset;

  /** Creates a lexer. */
  public FormulaLexer(String input) {
    this.input = input;
  }

  /** Converts a string into a list of tokens, the last of which is EOF. */
  public static ImmutableList<Token> tokenize(String input) {
    final FormulaLexer lexer = new FormulaLexer(input);
    final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    for (; ; ) {
      final Token token = lexer.next();
      tokens.add(token);
      if (token.kind == Token.Kind.EOF) {
        return tokens.build();
      }
    }
  }

  /** Returns the next token. */
  public Token next() {
    while (offset < input.length()
        && Character.isWhitespace(input.charAt(offset))) {
      ++offset;
    }
    if (offset >= input.length()) {
      return new Token(Token.Kind.EOF, "", null, new Pos(offset, offset));
    }
    final int start = offset;
    final char c = input.charAt(offset);
    if (c == '(') {
      ++offset;
      return new Token(Token.Kind.LPAREN, "(", null, Pos.at(start));
    }
    if (c == ')') {
      ++offset;
      return new Token(Token.Kind.RPAREN, ")", null, Pos.at(start));
    }
    for (Map.Entry<String, Op> symbol : SYMBOLS) {
      if (input.startsWith(symbol.getKey(), offset)) {
        offset += symbol.getKey().length();
        return new Token(
            Token.Kind.OPERATOR,
            symbol.getKey(),
            symbol.getValue(),
            new Pos(start, offset));
      }
    }
    if (isLetter(c)) {
      return identifierOrWord(start);
    }
    if (isDigit(c) || c == '_') {
      throw new FormulaParseException(
          "Invalid identifier start character '" + c + "'", Pos.at(start));
    }
    throw new FormulaParseException(
        "Unexpected character '" + c + "'", Pos.at(start));
  }

  private Token identifierOrWord(int start) {
    while (offset < input.length() && isIdentifierPart(input.charAt(offset))) {
      ++offset;
    }
    final String text = input.substring(start, offset);
    final Pos pos = new Pos(start, offset);
    final Op op = WORDS.get(text);
    if (op != null) {
      return new Token(Token.Kind.OPERATOR, text, op, pos);
    }
    return new Token(Token.Kind.IDENTIFIER, text, null, pos);
  }

  private static boolean isLetter(char c) {
    return c >= 'A' && c <= 'Z' || c >= 'a' && c <= 'z';
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isIdentifierPart(char c) {
    return isLetter(c) || isDigit(c) || c == '_';
  }
}

// End FormulaLexer.java
