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
package net.hydromatic.gentzen.config;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import net.hydromatic.gentzen.proof.SearchBounds;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests {@link Prop} and {@link Configs}. */
public class PropTest {
  @Test void testDefaults() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    assertThat(Prop.MAX_PROOF_DEPTH.intValue(map), is(5));
    assertThat(Prop.MAX_ITERATIONS.intValue(map), is(1000));
    assertThat(Prop.MAX_QUEUE_SIZE.intValue(map), is(1000));
    assertThat(Prop.MAX_STEPS.intValue(map), is(100));
    assertThat(Prop.VERBOSE.booleanValue(map), is(false));
    assertThat(Prop.VALIDATE.booleanValue(map), is(false));
    assertThat(Prop.SELECTIVE_RESOLUTION.booleanValue(map), is(false));
  }

  @Test void testLookup() {
    assertThat(Prop.lookup("maxSteps"), is(Prop.MAX_STEPS));
    assertThat(Prop.lookup("MAX_STEPS"), is(Prop.MAX_STEPS));
    assertThrows(IllegalArgumentException.class, () -> Prop.lookup("foo"));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.MAX_ITERATIONS));
  }

  @Test void testSet() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    Prop.MAX_PROOF_DEPTH.set(map, 7);
    assertThat(Prop.MAX_PROOF_DEPTH.intValue(map), is(7));
    Prop.MAX_PROOF_DEPTH.set(map, null);
    assertThat(Prop.MAX_PROOF_DEPTH.intValue(map), is(5));

    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.MAX_PROOF_DEPTH.set(map, 21));
    assertThat(e.getMessage(),
        is("value 21 for property maxProofDepth is out of range [1..20]"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.MAX_ITERATIONS.set(map, 9));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.VERBOSE.set(map, 1));

    // Reading a property as the wrong type fails
    assertThrows(IllegalArgumentException.class,
        () -> Prop.VERBOSE.intValue(map));
  }

  @Test void testSetLenient() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    Prop.VERBOSE.setLenient(map, " TRUE ");
    assertThat(Prop.VERBOSE.booleanValue(map), is(true));
    Prop.VERBOSE.setLenient(map, "0");
    assertThat(Prop.VERBOSE.booleanValue(map), is(false));
    Prop.MAX_STEPS.setLenient(map, "50");
    assertThat(Prop.MAX_STEPS.intValue(map), is(50));

    assertThrows(IllegalArgumentException.class,
        () -> Prop.VERBOSE.setLenient(map, "yes"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.MAX_STEPS.setLenient(map, "many"));
  }

  @Test void testLoadProperties() {
    final Properties properties = new Properties();
    properties.setProperty("gentzen.maxProofDepth", "3");
    properties.setProperty("gentzen.selectiveResolution", "true");
    properties.setProperty("other.key", "ignored");
    final Map<Prop, Object> map = new LinkedHashMap<>();
    Prop.load(properties, map);
    assertThat(map.size(), is(2));
    assertThat(Prop.MAX_PROOF_DEPTH.intValue(map), is(3));
    assertThat(Prop.SELECTIVE_RESOLUTION.booleanValue(map), is(true));

    final SearchBounds bounds = SearchBounds.of(map);
    assertThat(bounds.maxIterations, is(1000));
    assertThat(bounds.maxSteps, is(100));
  }

  @Test void testConfigsLoad() {
    // The resource holds the defaults
    final Map<Prop, Object> map = Configs.load();
    assertThat(Prop.MAX_PROOF_DEPTH.intValue(map), is(5));
    assertThat(Prop.MAX_QUEUE_SIZE.intValue(map), is(1000));
  }

  @Test void testConfigsLoadFile(@TempDir Path dir) throws IOException {
    final Path file = dir.resolve("gentzen.properties");
    Files.write(file,
        ("gentzen.maxIterations = 50\n"
            + "gentzen.verbose = true\n").getBytes(StandardCharsets.UTF_8));
    final Map<Prop, Object> map = new LinkedHashMap<>();
    Prop.MAX_STEPS.set(map, 10);
    Configs.load(file, map);
    assertThat(Prop.MAX_ITERATIONS.intValue(map), is(50));
    assertThat(Prop.VERBOSE.booleanValue(map), is(true));
    assertThat(Prop.MAX_STEPS.intValue(map), is(10));
  }
}

// End PropTest.java
