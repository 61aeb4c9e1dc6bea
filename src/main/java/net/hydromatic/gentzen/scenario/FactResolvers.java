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
package net.hydromatic.gentzen.scenario;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Utilities for {@link FactResolver}. */
public abstract class FactResolvers {
  private static final Logger LOG =
      LoggerFactory.getLogger(FactResolvers.class);

  private FactResolvers() {}

  /** Returns a resolver that always returns the given value. */
  public static FactResolver constant(boolean value) {
    return () -> value;
  }

  /**
   * Returns a resolver that waits for an asynchronous computation.
   *
   * <p>The supplier is called each time the resolver runs. If the
   * computation fails or does not complete within the timeout, the resolver
   * throws, and so the fact resolves to false; a computation that has not
   * completed is cancelled.
   */
  public static FactResolver fromFuture(
      Supplier<? extends Future<Boolean>> supplier, Duration timeout) {
    requireNonNull(supplier, "supplier");
    requireNonNull(timeout, "timeout");
    return () -> {
      final Future<Boolean> future = supplier.get();
      try {
        return Boolean.TRUE.equals(
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
      } finally {
        if (!future.isDone()) {
          future.cancel(true);
        }
      }
    };
  }

  /** Returns a resolver for each entry of a map of fixed values. */
  public static Map<String, FactResolver> fromMap(Map<String, Boolean> map) {
    final Map<String, FactResolver> resolvers = new LinkedHashMap<>();
    map.forEach((name, value) -> resolvers.put(name, constant(value)));
    return resolvers;
  }

  /**
   * Returns a resolver for each entry of a set of properties, such as
   * "CustomerIsVIP=true". Values other than "true" (ignoring case) are
   * false.
   */
  public static Map<String, FactResolver> fromProperties(
      Properties properties) {
    final Map<String, FactResolver> resolvers = new LinkedHashMap<>();
    for (String name : properties.stringPropertyNames()) {
      resolvers.put(
          name, constant(Boolean.parseBoolean(properties.getProperty(name))));
    }
    return resolvers;
  }

  /** Returns the resolvers whose names are in a given set. */
  public static Map<String, FactResolver> retain(
      Map<String, FactResolver> resolvers, Set<String> names) {
    final Map<String, FactResolver> retained = new LinkedHashMap<>();
    resolvers.forEach(
        (name, resolver) -> {
          if (names.contains(name)) {
            retained.put(name, resolver);
          }
        });
    return retained;
  }

  /**
   * Runs every resolver, and returns a map from fact name to whether it
   * holds.
   *
   * <p>A resolver that throws is logged and its fact is false.
   */
  public static ImmutableMap<String, Boolean> resolve(
      Map<String, FactResolver> resolvers) {
    final ImmutableMap.Builder<String, Boolean> facts = ImmutableMap.builder();
    resolvers.forEach((name, resolver) -> facts.put(name, run(name, resolver)));
    return facts.build();
  }

  /**
   * Adds negated names to a map of resolved facts.
   *
   * <p>For each name that resolved false, and is not itself negated, the
   * result also maps the negated name to true; so {@code {X: true,
   * Y: false}} becomes {@code {X: true, Y: false, ~Y: true}}. An entry
   * already in the map takes precedence over a synthesized one.
   */
  public static ImmutableMap<String, Boolean> withNegations(
      Map<String, Boolean> facts) {
    final Map<String, Boolean> map = new LinkedHashMap<>(facts);
    facts.forEach(
        (name, holds) -> {
          if (!holds && !name.startsWith("~")) {
            map.putIfAbsent("~" + name, true);
          }
        });
    return ImmutableMap.copyOf(map);
  }

  private static boolean run(String name, FactResolver resolver) {
    try {
      return resolver.resolve();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.warn("Fact resolver for \"{}\" was interrupted", name);
      return false;
    } catch (Exception e) {
      LOG.warn("Fact resolver for \"{}\" failed: {}", name, e.toString());
      return false;
    }
  }
}

// End FactResolvers.java
