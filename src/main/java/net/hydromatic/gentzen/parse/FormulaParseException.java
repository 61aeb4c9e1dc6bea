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

import net.hydromatic.gentzen.util.GentzenException;

/**
 * Exception caused by a malformed formula: an unexpected character,
 * unbalanced parentheses, a missing operand, or tokens after a complete
 * formula.
 */
public class FormulaParseException extends RuntimeException
    implements GentzenException {
  private final Pos pos;

  FormulaParseException(String message, Pos pos) {
    super("Parse error at " + pos + ": " + message);
    this.pos = pos;
  }

  /** Returns the position of the error. */
  public Pos pos() {
    return pos;
  }

  /** Returns the zero-based character offset of the error. */
  public int position() {
    return pos.start;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append(getMessage());
  }
}

// End FormulaParseException.java
