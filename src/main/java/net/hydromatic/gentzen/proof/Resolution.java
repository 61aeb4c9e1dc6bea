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

import com.google.common.collect.ImmutableList;

/**
 * Result of {@link DerivationState#canResolveFormula(String)}: whether every
 * atom of a formula is resolvable, and the base names of those that are
 * not.
 */
public class Resolution {
  public final boolean resolved;
  public final ImmutableList<String> missing;

  Resolution(ImmutableList<String> missing) {
    this.resolved = missing.isEmpty();
    this.missing = missing;
  }

  @Override
  public String toString() {
    return resolved ? "resolved" : "missing " + missing;
  }
}

// End Resolution.java
