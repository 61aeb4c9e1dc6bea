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

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Kind of {@link Formula} node, and the operator it represents. */
public enum Op {
  ATOM("", "", 6, ImmutableList.of()),
  NOT("not", "~", 5, ImmutableList.of("~", "NOT", "!")),
  AND("and", "∧", 4, ImmutableList.of("∧", "AND", "&")),
  OR("or", "∨", 3, ImmutableList.of("∨", "OR", "|")),
  IMPLIES("implies", "→", 2, ImmutableList.of("→", "IMPLIES", "->", "=>")),
  IFF("iff", "↔", 1, ImmutableList.of("↔", "IFF", "<->", "<=>"));

  /** Lower-case tag, e.g. "implies". */
  public final String tag;

  /** Symbol used in the canonical rendering, e.g. "→". */
  public final String symbol;

  /** Binding strength; higher binds tighter. */
  public final int precedence;

  /** Spellings accepted by the lexer. */
  public final ImmutableList<String> aliases;

  Op(String tag, String symbol, int precedence, ImmutableList<String> aliases) {
    this.tag = tag;
    this.symbol = symbol;
    this.precedence = precedence;
    this.aliases = aliases;
  }

  /** Whether this operator combines two operands. */
  public boolean isBinary() {
    return this == AND || this == OR || this == IMPLIES || this == IFF;
  }

  /** Looks up an operator by its tag; returns null if there is none. */
  public static @Nullable Op ofTag(String tag) {
    for (Op op : values()) {
      if (op != ATOM && op.tag.equals(tag)) {
        return op;
      }
    }
    return null;
  }
}

// End Op.java
