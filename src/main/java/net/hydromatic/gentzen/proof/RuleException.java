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
package net.hydromatic.gentzen.proof;

import net.hydromatic.gentzen.util.GentzenException;

/**
 * Error applying an inference rule: a step that does not hold exactly one
 * formula, an unknown rule or subtype, contraposition of a formula that is
 * not an implication, or the wrong number of antecedent steps.
 *
 * <p>These errors are recoverable. The proof search discards the candidate
 * that raised it; the scenario runner skips the step.
 */
public class RuleException extends RuntimeException
    implements GentzenException {
  public RuleException(String message) {
    super(message);
  }

  public RuleException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Rule error: ").append(getMessage());
  }
}

// End RuleException.java
