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
package net.hydromatic.gentzen;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import net.hydromatic.gentzen.config.Configs;
import net.hydromatic.gentzen.config.Prop;
import net.hydromatic.gentzen.proof.ProofSearch;
import net.hydromatic.gentzen.proof.Tracers;
import net.hydromatic.gentzen.scenario.FactResolver;
import net.hydromatic.gentzen.scenario.FactResolvers;
import net.hydromatic.gentzen.scenario.ReasoningResult;
import net.hydromatic.gentzen.scenario.ResultPrinter;
import net.hydromatic.gentzen.scenario.ScenarioException;
import net.hydromatic.gentzen.scenario.ScenarioRunner;
import net.hydromatic.gentzen.util.GentzenException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;

/** Command-line entry point; runs a scenario file and prints the result. */
public class Main {
  /** Exit status if every target was proven. */
  public static final int EXIT_PROVEN = 0;
  /** Exit status if some target was not proven. */
  public static final int EXIT_NOT_PROVEN = 1;
  /** Exit status if the arguments or the input were invalid. */
  public static final int EXIT_ERROR = 2;

  static final String USAGE =
      "Usage: gentzen [--verbose] [--validate] [--selective]"
          + " [--facts file.properties] [--config file.properties]"
          + " [--fact Name=true|false]... scenario.yaml";

  private final List<String> args;
  private final PrintWriter out;
  private final PrintWriter err;
  private final Map<Prop, Object> propMap;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final PrintWriter out =
        new PrintWriter(
            new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
    final PrintWriter err =
        new PrintWriter(
            new OutputStreamWriter(System.err, StandardCharsets.UTF_8));
    final int status;
    try {
      status = new Main(ImmutableList.copyOf(args), out, err, Configs.load())
          .run();
    } catch (IllegalArgumentException e) {
      // Invalid setting in gentzen.properties or a system property
      err.println("gentzen: " + e.getMessage());
      err.flush();
      System.exit(EXIT_ERROR);
      return;
    }
    System.exit(status);
  }

  /** Creates a Main. */
  public Main(
      List<String> args,
      PrintWriter out,
      PrintWriter err,
      Map<Prop, Object> propMap) {
    this.args = ImmutableList.copyOf(args);
    this.out = requireNonNull(out, "out");
    this.err = requireNonNull(err, "err");
    this.propMap = new LinkedHashMap<>(propMap);
  }

  /** Runs the command, and returns its exit status. */
  public int run() {
    try {
      return run2();
    } catch (UsageException e) {
      err.println("gentzen: " + e.getMessage());
      err.println(USAGE);
      return EXIT_ERROR;
    } catch (ScenarioException | UncheckedIOException
        | IllegalArgumentException e) {
      err.println("gentzen: " + message(e));
      return EXIT_ERROR;
    } finally {
      out.flush();
      err.flush();
    }
  }

  private int run2() {
    final Map<String, FactResolver> resolvers = new LinkedHashMap<>();
    @Nullable Path scenarioPath = null;
    for (Iterator<String> iterator = args.iterator(); iterator.hasNext();) {
      final String arg = iterator.next();
      switch (arg) {
        case "--verbose":
          Prop.VERBOSE.set(propMap, true);
          break;
        case "--validate":
          Prop.VALIDATE.set(propMap, true);
          break;
        case "--selective":
          Prop.SELECTIVE_RESOLUTION.set(propMap, true);
          break;
        case "--config":
          Configs.load(path(value(arg, iterator)), propMap);
          break;
        case "--facts":
          resolvers.putAll(
              FactResolvers.fromProperties(
                  loadProperties(path(value(arg, iterator)))));
          break;
        case "--fact":
          addFact(resolvers, value(arg, iterator));
          break;
        case "--help":
          out.println(USAGE);
          return EXIT_PROVEN;
        default:
          if (arg.startsWith("--")) {
            throw new UsageException("unknown option " + arg);
          }
          if (scenarioPath != null) {
            throw new UsageException("more than one scenario file");
          }
          scenarioPath = path(arg);
      }
    }
    if (scenarioPath == null) {
      throw new UsageException("no scenario file");
    }

    final ScenarioRunner runner =
        new ScenarioRunner(propMap,
            Tracers.logging(LoggerFactory.getLogger(ProofSearch.class)));
    final ReasoningResult result = runner.run(scenarioPath, resolvers);
    new ResultPrinter(out, Prop.VERBOSE.booleanValue(propMap)).print(result);
    return result.allProven() ? EXIT_PROVEN : EXIT_NOT_PROVEN;
  }

  private static String value(String option, Iterator<String> iterator) {
    if (!iterator.hasNext()) {
      throw new UsageException("option " + option + " requires a value");
    }
    return iterator.next();
  }

  private static Path path(String s) {
    final Path path = Paths.get(s);
    if (!Files.isRegularFile(path)) {
      throw new UsageException("file not found: " + s);
    }
    return path;
  }

  /** Parses "Name=true" or "Name=false" and adds a constant resolver. */
  private static void addFact(Map<String, FactResolver> resolvers, String s) {
    final int i = s.indexOf('=');
    if (i <= 0) {
      throw new UsageException("expected Name=true|false, got " + s);
    }
    final String name = s.substring(0, i).trim();
    final String value = s.substring(i + 1).trim();
    switch (value) {
      case "true":
        resolvers.put(name, FactResolvers.constant(true));
        break;
      case "false":
        resolvers.put(name, FactResolvers.constant(false));
        break;
      default:
        throw new UsageException("expected Name=true|false, got " + s);
    }
  }

  private static Properties loadProperties(Path path) {
    final Properties properties = new Properties();
    try (Reader reader =
             Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      properties.load(reader);
    } catch (IOException e) {
      throw new UncheckedIOException("error reading " + path, e);
    }
    return properties;
  }

  private static String message(RuntimeException e) {
    if (e instanceof GentzenException) {
      return ((GentzenException) e).describeTo(new StringBuilder()).toString();
    }
    return e.getMessage();
  }

  /** Thrown when the command-line arguments are invalid. */
  private static class UsageException extends RuntimeException {
    UsageException(String message) {
      super(message);
    }
  }
}

// End Main.java
