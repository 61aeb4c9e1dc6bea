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

import net.hydromatic.gentzen.formula.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Token produced by {@link FormulaLexer}. */
public class Token {
  public final Kind kind;
  /** Text of the token, as it appeared in the input; empty for EOF. */
  public final String text;
  /** Canonical operator, if this is an operator token; otherwise null. */
  public final @Nullable Op op;

  public final Pos pos;

  Token(Kind kind, String text, @Nullable Op op, Pos pos) {
    this.kind = requireNonNull(kind, "kind");
    this.text = requireNonNull(text, "text");
    this.op = op;
    this.pos = requireNonNull(pos, "pos");
  }

  /** Whether this is an operator token for a given operator. */
  public boolean isOp(Op op) {
    return kind == Kind.OPERATOR && this.op == op;
  }

  /** Describes this token for use in an error message. */
  String describe() {
    return kind == Kind.EOF ? "end of input" : "'" + text + "'";
  }

  @Override
  public String toString() {
    return "Token("
        + kind
        + ", '"
        + (op != null ? op.tag : text)
        + "', "
        + pos.start
        + ")";
  }

  /** Kind of token. */
  public enum Kind {
    IDENTIFIER,
    LPAREN,
    RPAREN,
    OPERATOR,
    EOF
  }
}

// End Token.java
