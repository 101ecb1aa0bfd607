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
package org.apache.cairn.sql;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * A collating sequence: the rule by which two strings are compared.
 *
 * <p>Collations are identified by name; names compare case-insensitively, so
 * {@code SqlCollation.of("nocase")} equals {@link #NOCASE}.
 */
public final class SqlCollation {
  /** Compares strings byte by byte. The default collation. */
  public static final SqlCollation BINARY = new SqlCollation("BINARY", false);

  /** Compares strings ignoring the case of ASCII letters. */
  public static final SqlCollation NOCASE = new SqlCollation("NOCASE", true);

  /** Compares strings ignoring trailing spaces. */
  public static final SqlCollation RTRIM = new SqlCollation("RTRIM", false);

  private final String name;
  private final boolean caseInsensitive;

  private SqlCollation(String name, boolean caseInsensitive) {
    this.name = requireNonNull(name, "name");
    this.caseInsensitive = caseInsensitive;
  }

  /** Returns the collation with a given name; one of the built-in
   * collations if the name matches one, otherwise a user-defined collation
   * that is assumed to be case-sensitive. */
  public static SqlCollation of(String name) {
    switch (name.toUpperCase(Locale.ROOT)) {
    case "BINARY":
      return BINARY;
    case "NOCASE":
      return NOCASE;
    case "RTRIM":
      return RTRIM;
    default:
      return new SqlCollation(name, false);
    }
  }

  public String getName() {
    return name;
  }

  /** Returns whether this collation treats upper- and lower-case ASCII
   * letters as equal. */
  public boolean isCaseInsensitive() {
    return caseInsensitive;
  }

  @Override public boolean equals(@Nullable Object obj) {
    return this == obj
        || obj instanceof SqlCollation
        && name.equalsIgnoreCase(((SqlCollation) obj).name);
  }

  @Override public int hashCode() {
    return name.toUpperCase(Locale.ROOT).hashCode();
  }

  @Override public String toString() {
    return name;
  }
}
