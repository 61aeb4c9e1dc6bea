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

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/** Utilities for building a map of {@link Prop} values. */
public abstract class Configs {
  /** Name of the classpath resource that holds default settings. */
  public static final String RESOURCE = "/gentzen.properties";

  private Configs() {}

  /**
   * Creates a configuration from the "gentzen.properties" resource, if
   * present, overridden by system properties such as
   * "-Dgentzen.maxSteps=50".
   */
  public static Map<Prop, Object> load() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    try (InputStream in = Configs.class.getResourceAsStream(RESOURCE)) {
      if (in != null) {
        final Properties properties = new Properties();
        properties.load(in);
        Prop.load(properties, map);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("error reading " + RESOURCE, e);
    }
    Prop.load(System.getProperties(), map);
    return map;
  }

  /** Overrides a configuration with the settings in a properties file. */
  public static Map<Prop, Object> load(Path path, Map<Prop, Object> map) {
    final Properties properties = new Properties();
    try (Reader reader =
             Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      properties.load(reader);
    } catch (IOException e) {
      throw new UncheckedIOException("error reading " + path, e);
    }
    Prop.load(properties, map);
    return map;
  }
}

// End Configs.java
