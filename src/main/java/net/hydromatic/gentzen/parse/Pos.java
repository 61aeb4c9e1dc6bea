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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Position of a token within a formula string.
 *
 * <p>Offsets are zero-based character indexes; {@code end} is exclusive.
 */
public class Pos {
  public static final Pos ZERO = new Pos(0, 0);

  public final int start;
  public final int end;

  /** Creates a Pos. */
  public Pos(int start, int end) {
    checkArgument(start >= 0 && end >= start, "invalid range [%s, %s)", start,
        end);
    this.start = start;
    this.end = end;
  }

  /** Creates a Pos that covers a single character. */
  public static Pos at(int offset) {
    return new Pos(offset, offset + 1);
  }

  /** Returns a position spanning from the start of this to the end of
   * another. */
  public Pos plus(Pos pos) {
    return new Pos(Math.min(start, pos.start), Math.max(end, pos.end));
  }

  @Override
  public int hashCode() {
    return start * 31 + end;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
            && this.start == ((Pos) o).start
            && this.end == ((Pos) o).end;
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("position ").append(start);
  }
}

// End Pos.java
