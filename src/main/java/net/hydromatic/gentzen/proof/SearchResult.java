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
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Outcome of a proof search.
 *
 * <p>"Not proven" is a valid result, not an error. If atoms of the target
 * were unresolvable, {@link #missingFacts} lists them and no search took
 * place. If the search ran out of its bounds, {@link #boundExceeded} is
 * true; that is "not found within bounds", never a disproof.
 */
public class SearchResult {
  public final boolean proven;
  /** Number of rounds of rule application needed; 0 if already known. */
  public final int depth;
  /** Formula added by each round, ending with the round that proved the
   * target. */
  public final ImmutableList<String> path;

  public final ImmutableList<String> missingFacts;
  public final boolean boundExceeded;
  /** State that contains the target, if proven. */
  public final @Nullable DerivationState proof;

  private SearchResult(
      boolean proven,
      int depth,
      List<String> path,
      List<String> missingFacts,
      boolean boundExceeded,
      @Nullable DerivationState proof) {
    this.proven = proven;
    this.depth = depth;
    this.path = ImmutableList.copyOf(path);
    this.missingFacts = ImmutableList.copyOf(missingFacts);
    this.boundExceeded = boundExceeded;
    this.proof = proof;
  }

  static SearchResult proven(
      int depth, List<String> path, DerivationState proof) {
    return new SearchResult(
        true, depth, path, ImmutableList.of(), false, proof);
  }

  static SearchResult missing(List<String> missingFacts) {
    return new SearchResult(
        false, 0, ImmutableList.of(), missingFacts, false, null);
  }

  static SearchResult notFound(boolean boundExceeded) {
    return new SearchResult(
        false, 0, ImmutableList.of(), ImmutableList.of(), boundExceeded, null);
  }

  @Override
  public String toString() {
    if (proven) {
      return "proven at depth " + depth + (path.isEmpty() ? "" : " " + path);
    }
    if (!missingFacts.isEmpty()) {
      return "not proven; missing " + missingFacts;
    }
    return boundExceeded ? "not proven within bounds" : "not proven";
  }
}

// End SearchResult.java
