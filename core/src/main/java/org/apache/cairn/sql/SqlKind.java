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

import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Enumerates the possible types of {@link org.apache.cairn.rex.RexNode}.
 *
 * <p>Only those kinds that the WHERE planner distinguishes are listed; every
 * other operator is an {@link #OTHER_FUNCTION} call identified by name.
 */
public enum SqlKind {
  //~ Static fields/initializers ---------------------------------------------

  // the basics

  /** Column reference. */
  COLUMN_REF,

  /** Literal. */
  LITERAL,

  /** Scalar sub-query, "(SELECT ...)". */
  SCALAR_QUERY,

  /** EXISTS operator. */
  EXISTS,

  /** Function call that is not one of the operators below, for example
   * {@code UPPER(x)} or {@code MATCH(q, x)}. */
  OTHER_FUNCTION,

  // binary operators

  /** Logical AND operator. */
  AND,

  /** Logical OR operator. */
  OR,

  /** Equals operator, "=". */
  EQUALS("="),

  /** Less-than operator, "&lt;". */
  LESS_THAN("<"),

  /** Less-than-or-equal operator, "&lt;=". */
  LESS_THAN_OR_EQUAL("<="),

  /** Greater-than operator, "&gt;". */
  GREATER_THAN(">"),

  /** Greater-than-or-equal operator, "&gt;=". */
  GREATER_THAN_OR_EQUAL(">="),

  /** IN operator, either over a list of expressions or over a sub-query. */
  IN,

  /** BETWEEN operator. */
  BETWEEN,

  /** LIKE operator. */
  LIKE,

  /** GLOB operator: like LIKE but case-sensitive, with Unix wildcards. */
  GLOB,

  /** Full-text match of a column against a query. Only created by the
   * planner, from a call to the reserved function {@code MATCH}; the native
   * cost model ignores it and hands it to virtual-table advisors. */
  MATCH,

  // postfix operators

  /** IS NULL operator. */
  IS_NULL("IS NULL");

  //~ Static fields ----------------------------------------------------------

  /**
   * Category of comparison operators.
   *
   * <p>Consists of:
   * {@link #EQUALS},
   * {@link #LESS_THAN},
   * {@link #LESS_THAN_OR_EQUAL},
   * {@link #GREATER_THAN},
   * {@link #GREATER_THAN_OR_EQUAL}.
   */
  public static final Set<SqlKind> COMPARISON =
      EnumSet.of(EQUALS, LESS_THAN, LESS_THAN_OR_EQUAL, GREATER_THAN,
          GREATER_THAN_OR_EQUAL);

  /**
   * Category of operators that an index can exploit when they appear in the
   * form "column OP expression".
   *
   * <p>Consists of {@link #COMPARISON}, {@link #IN} and {@link #IS_NULL}.
   */
  public static final Set<SqlKind> INDEXABLE;

  static {
    final EnumSet<SqlKind> indexable = EnumSet.copyOf(COMPARISON);
    indexable.add(IN);
    indexable.add(IS_NULL);
    INDEXABLE = indexable;
  }

  /** Lower-case name. */
  public final String lowerName = name().toLowerCase(Locale.ROOT);
  public final String sql;

  SqlKind() {
    sql = name();
  }

  SqlKind(String sql) {
    this.sql = sql;
  }

  /** Returns the kind that corresponds to this operator but in the opposite
   * direction. Or returns this, if this kind is not reversible.
   *
   * <p>For example, {@code GREATER_THAN.reverse()} returns {@link #LESS_THAN}.
   */
  public SqlKind reverse() {
    switch (this) {
    case GREATER_THAN:
      return LESS_THAN;
    case GREATER_THAN_OR_EQUAL:
      return LESS_THAN_OR_EQUAL;
    case LESS_THAN:
      return GREATER_THAN;
    case LESS_THAN_OR_EQUAL:
      return GREATER_THAN_OR_EQUAL;
    default:
      return this;
    }
  }

  /**
   * Returns whether this {@code SqlKind} belongs to a given category.
   *
   * <p>A category is a collection of kinds, not necessarily disjoint. For
   * example, QUERY is { SELECT, UNION, INTERSECT, EXCEPT, VALUES, ORDER_BY,
   * EXPLICIT_TABLE }.
   *
   * @param category Category
   * @return Whether this kind belongs to the given category
   */
  public final boolean belongsTo(Collection<SqlKind> category) {
    return category.contains(this);
  }
}
