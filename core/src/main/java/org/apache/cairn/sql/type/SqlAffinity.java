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
package org.apache.cairn.sql.type;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Type affinity: the preferred storage class of a column, which decides what
 * conversions are applied to a value before it is compared with the column.
 *
 * <p>An expression that is not a column (a literal, for instance) usually
 * has no affinity; methods that compute affinities return {@code null} in
 * that case.
 */
public enum SqlAffinity {
  TEXT,
  NONE,
  NUMERIC,
  INTEGER,
  REAL;

  /** Returns whether this affinity is one of the numeric affinities,
   * {@link #NUMERIC}, {@link #INTEGER} or {@link #REAL}. */
  public boolean isNumeric() {
    return this == NUMERIC || this == INTEGER || this == REAL;
  }

  /**
   * Returns the affinity to use when comparing a value of affinity
   * {@code a1} with a value of affinity {@code a2}.
   *
   * <p>If both have an affinity and either is numeric, the comparison is
   * numeric; if both have an affinity and neither is numeric, no conversion
   * happens ({@link #NONE}); if just one has an affinity, it wins; if neither
   * has one, {@link #NONE}.
   */
  public static SqlAffinity compare(@Nullable SqlAffinity a1,
      @Nullable SqlAffinity a2) {
    if (a1 != null && a2 != null) {
      if (a1.isNumeric() || a2.isNumeric()) {
        return NUMERIC;
      }
      return NONE;
    } else if (a1 == null && a2 == null) {
      return NONE;
    } else {
      return a1 != null ? a1 : a2;
    }
  }

  /**
   * Returns whether an index on a column with affinity {@code indexAffinity}
   * can be used to evaluate a comparison performed with affinity
   * {@code comparisonAffinity}.
   */
  public static boolean indexCompatible(SqlAffinity comparisonAffinity,
      SqlAffinity indexAffinity) {
    switch (comparisonAffinity) {
    case NONE:
      return true;
    case TEXT:
      return indexAffinity == TEXT;
    default:
      return indexAffinity.isNumeric();
    }
  }
}
