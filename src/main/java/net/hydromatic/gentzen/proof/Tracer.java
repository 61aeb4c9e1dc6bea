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

import java.util.List;

/** Called on various events during a proof search. */
public interface Tracer {
  /**
   * Called when a state has been expanded by one round of rule application.
   *
   * @param depth Depth of the expanded state
   * @param state Expanded state
   * @param successorCount Number of candidates that added a new formula
   */
  void onExpand(int depth, DerivationState state, int successorCount);

  /** Called when some atoms of the target cannot be resolved. */
  void onMissingFacts(String target, List<String> missingFacts);

  /** Called when the search stops because it exceeded a bound. */
  void onBoundExceeded(String target, int iterations, int queueSize);

  /** Called with the result of every search. */
  void onResult(String target, SearchResult result);
}

// End Tracer.java
