/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.cairn.config;

import com.google.common.base.MoreObjects;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.function.Function;
import java.util.function.IntPredicate;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * A Cairn specific system property that is used to configure various aspects
 * of the planner.
 *
 * <p>Cairn system properties must always be in the "cairn" root namespace.
 * Values come from the JVM system properties, merged over the contents of an
 * optional {@code cairn.properties} file on the class path.</p>
 *
 * @param <T> the type of the property value
 */
public final class CairnSystemProperty<T> {
  /**
   * Holds all system properties related with Cairn.
   */
  private static final Properties PROPERTIES = loadProperties();

  /**
   * Whether to run Cairn in debug mode.
   *
   * <p>When debug mode is activated, exceptions are logged at ERROR level as
   * they are created, and the planner verifies the table mask invariant after
   * every registration.</p>
   */
  public static final CairnSystemProperty<Boolean> DEBUG =
      booleanProperty("cairn.debug", false);

  /**
   * Maximum number of tables in a join. A table mask is a 64-bit word, so the
   * value must lie between 1 and 64.
   */
  public static final CairnSystemProperty<Integer> MAX_TABLES =
      intProperty("cairn.planner.maxTables", 64, v -> v >= 1 && v <= 64);

  /**
   * Maximum number of conjuncts, including conjuncts derived during
   * analysis, that one WHERE clause may hold.
   */
  public static final CairnSystemProperty<Integer> MAX_CONJUNCTS =
      intProperty("cairn.planner.maxConjuncts", 10_000, v -> v >= 1);

  /** Row count assumed for a table whose size the storage layer does not
   * know. */
  public static final CairnSystemProperty<Integer> DEFAULT_ROW_ESTIMATE =
      intProperty("cairn.planner.defaultRowEstimate", 1_000_000, v -> v >= 1);

  /** Cost assumed for {@code rowid IN (SELECT ...)}, whose cardinality is
   * unknown. */
  public static final CairnSystemProperty<Integer> IN_SUB_QUERY_ROWID_COST =
      intProperty("cairn.planner.inSubQueryRowidCost", 200, v -> v >= 1);

  /** Multiplier applied to an index probe for each
   * {@code column IN (SELECT ...)} key column. */
  public static final CairnSystemProperty<Integer> IN_SUB_QUERY_MULTIPLIER =
      intProperty("cairn.planner.inSubQueryMultiplier", 25, v -> v >= 1);

  /**
   * Whether LIKE compares case-sensitively. If false (the default), LIKE
   * prefix ranges can only be used on columns with NOCASE collation.
   */
  public static final CairnSystemProperty<Boolean> CASE_SENSITIVE_LIKE =
      booleanProperty("cairn.planner.caseSensitiveLike", false);

  /** Whether to rewrite {@code a = x OR a = y} into {@code a IN (x, y)}. */
  public static final CairnSystemProperty<Boolean> OR_REWRITE =
      booleanProperty("cairn.planner.or.rewrite", true);

  /** Whether to derive a pair of range conjuncts from BETWEEN. */
  public static final CairnSystemProperty<Boolean> BETWEEN_REWRITE =
      booleanProperty("cairn.planner.between.rewrite", true);

  /** Whether to derive a pair of range conjuncts from LIKE and GLOB
   * patterns with a constant prefix. */
  public static final CairnSystemProperty<Boolean> LIKE_REWRITE =
      booleanProperty("cairn.planner.like.rewrite", true);

  private static CairnSystemProperty<Boolean> booleanProperty(String key,
      boolean defaultValue) {
    // Note that "" -> true (convenient for command-lines flags like '-Dflag')
    return new CairnSystemProperty<>(key,
        v -> v == null ? defaultValue
            : "".equals(v) || Boolean.parseBoolean(v));
  }

  /**
   * Returns the value of the system property with the specified name as {@code
   * int}. If any of the conditions below hold, returns the
   * <code>defaultValue</code>:
   *
   * <ol>
   * <li>the property is not defined;
   * <li>the property value cannot be transformed to an int;
   * <li>the property value does not satisfy the checker.
   * </ol>
   */
  private static CairnSystemProperty<Integer> intProperty(String key,
      int defaultValue, IntPredicate valueChecker) {
    return new CairnSystemProperty<>(key, v -> {
      if (v == null) {
        return defaultValue;
      }
      try {
        int intVal = Integer.parseInt(v.trim());
        return valueChecker.test(intVal) ? intVal : defaultValue;
      } catch (NumberFormatException nfe) {
        return defaultValue;
      }
    });
  }

  private static Properties loadProperties() {
    Properties fileProperties = new Properties();
    ClassLoader classLoader = MoreObjects.firstNonNull(
        Thread.currentThread().getContextClassLoader(),
        CairnSystemProperty.class.getClassLoader());
    // Read properties from the file "cairn.properties", if it exists in classpath
    try (InputStream stream = requireNonNull(classLoader, "classLoader")
        .getResourceAsStream("cairn.properties")) {
      if (stream != null) {
        fileProperties.load(stream);
      }
    } catch (IOException e) {
      throw new RuntimeException("while reading from cairn.properties file", e);
    }

    // System properties override the file
    final Properties allProperties = new Properties();
    Stream.concat(
        fileProperties.entrySet().stream(),
        System.getProperties().entrySet().stream())
        .forEach(prop -> {
          String key = (String) prop.getKey();
          if (key.startsWith("cairn.")) {
            allProperties.setProperty(key, (String) prop.getValue());
          }
        });
    return allProperties;
  }

  private final String key;
  private final T value;

  private CairnSystemProperty(String key,
      Function<? super @Nullable String, ? extends T> valueParser) {
    this.key = key;
    this.value = valueParser.apply(PROPERTIES.getProperty(key));
  }

  /** Returns the name of this property, for example "cairn.debug". */
  public String key() {
    return key;
  }

  /**
   * Returns the value of this property.
   *
   * @return the value of this property, or its default value if it has not
   * been set
   */
  public T value() {
    return value;
  }
}
