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
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import org.slf4j.Logger;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that writes events to a logger. */
  public static Tracer logging(Logger logger) {
    return new LoggingTracer(logger);
  }

  /**
   * Returns a tracer that performs the given action on the result of a
   * search, then calls the underlying tracer.
   */
  public static Tracer withOnResult(
      Tracer tracer, BiConsumer<String, SearchResult> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onResult(String target, SearchResult result) {
        consumer.accept(target, result);
        super.onResult(target, result);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each expanded state,
   * then calls the underlying tracer.
   */
  public static Tracer withOnExpand(
      Tracer tracer, Consumer<DerivationState> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onExpand(
          int depth, DerivationState state, int successorCount) {
        consumer.accept(state);
        super.onExpand(depth, state, successorCount);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action when a bound is
   * exceeded, then calls the underlying tracer.
   */
  public static Tracer withOnBoundExceeded(
      Tracer tracer, Consumer<String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onBoundExceeded(String target, int iterations,
          int queueSize) {
        consumer.accept(target);
        super.onBoundExceeded(target, iterations, queueSize);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onExpand(int depth, DerivationState state,
        int successorCount) {}

    @Override
    public void onMissingFacts(String target, List<String> missingFacts) {}

    @Override
    public void onBoundExceeded(String target, int iterations, int queueSize) {}

    @Override
    public void onResult(String target, SearchResult result) {}
  }

  /** Tracer that writes to an SLF4J logger. */
  private static class LoggingTracer implements Tracer {
    private final Logger logger;

    LoggingTracer(Logger logger) {
      this.logger = logger;
    }

    @Override
    public void onExpand(int depth, DerivationState state, int successorCount) {
      logger.trace(
          "Expanded state with {} steps at depth {}: {} successors",
          state.steps().size(),
          depth,
          successorCount);
    }

    @Override
    public void onMissingFacts(String target, List<String> missingFacts) {
      logger.debug(
          "Cannot search for {}: missing facts {}", target, missingFacts);
    }

    @Override
    public void onBoundExceeded(String target, int iterations, int queueSize) {
      logger.warn(
          "Search for {} stopped after {} iterations with {} queued states",
          target,
          iterations,
          queueSize);
    }

    @Override
    public void onResult(String target, SearchResult result) {
      logger.debug("Target {}: {}", target, result);
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onExpand(int depth, DerivationState state, int successorCount) {
      tracer.onExpand(depth, state, successorCount);
    }

    @Override
    public void onMissingFacts(String target, List<String> missingFacts) {
      tracer.onMissingFacts(target, missingFacts);
    }

    @Override
    public void onBoundExceeded(String target, int iterations, int queueSize) {
      tracer.onBoundExceeded(target, iterations, queueSize);
    }

    @Override
    public void onResult(String target, SearchResult result) {
      tracer.onResult(target, result);
    }
  }
}

// End Tracers.java
