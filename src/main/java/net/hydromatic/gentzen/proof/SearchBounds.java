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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Map;
import net.hydromatic.gentzen.config.Prop;

/**
 * Hard limits that guarantee a {@link ProofSearch} terminates.
 *
 * <p>Exceeding a bound ends the search without a proof; it is never a
 * disproof.
 */
public class SearchBounds {
  /** Default bounds: 1,000 iterations, 1,000 queued states, 100 steps. */
  public static final SearchBounds DEFAULT = new SearchBounds(1000, 1000, 100);

  /** Maximum number of states taken from the queue. */
  public final int maxIterations;

  /** Maximum number of states waiting in the queue. */
  public final int maxQueueSize;

  /** A state with this many steps has no successors. */
  public final int maxSteps;

  public SearchBounds(int maxIterations, int maxQueueSize, int maxSteps) {
    checkArgument(maxIterations > 0, "maxIterations must be positive");
    checkArgument(maxQueueSize > 0, "maxQueueSize must be positive");
    checkArgument(maxSteps > 0, "maxSteps must be positive");
    this.maxIterations = maxIterations;
    this.maxQueueSize = maxQueueSize;
    this.maxSteps = maxSteps;
  }

  /** Creates bounds from configuration properties. */
  public static SearchBounds of(Map<Prop, Object> map) {
    return new SearchBounds(
        Prop.MAX_ITERATIONS.intValue(map),
        Prop.MAX_QUEUE_SIZE.intValue(map),
        Prop.MAX_STEPS.intValue(map));
  }

  @Override
  public String toString() {
    return "SearchBounds{maxIterations="
        + maxIterations
        + ", maxQueueSize="
        + maxQueueSize
        + ", maxSteps="
        + maxSteps
        + "}";
  }
}

// End SearchBounds.java
