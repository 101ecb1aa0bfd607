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
package org.apache.cairn.plan.where;

import org.apache.cairn.rex.RexCall;
import org.apache.cairn.rex.RexNode;
import org.apache.cairn.rex.RexUtil;
import org.apache.cairn.sql.SqlCollation;
import org.apache.cairn.sql.SqlKind;
import org.apache.cairn.util.Util;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.EnumSet;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * One AND-connected fragment of a WHERE clause, with the results of its
 * analysis.
 *
 * <p>If analysis finds that the conjunct has the form
 * {@code column OP expression} with OP one of {@link SqlKind#INDEXABLE}, then
 * {@link #getLeftTable()}, {@link #getLeftColumn()} and {@link #getKind()}
 * describe the column and operator, and {@link #getRhsTables()} the tables
 * that must be placed before the conjunct can drive an index on the column.
 *
 * <p>A conjunct that was derived from another (its parent) points to it
 * through {@link #getParent()}. When every child of a parent has been
 * enforced by an access path, the parent is enforced too.
 */
public class Conjunct {
  /** Flags of a conjunct. */
  public enum Flag {
    /** The expression was created by the planner, not by the caller. */
    DYNAMIC,
    /** The conjunct was derived by the planner and is only a hint for
     * choosing access paths; it must not be evaluated. */
    VIRTUAL,
    /** The chosen access path guarantees the conjunct; the executor need not
     * evaluate it. */
    ENFORCED,
    /** A commuted duplicate of the conjunct has been added. */
    COPIED,
    /** The conjunct is a disjunct that qualifies for the OR to IN
     * rewrite. */
    OR_OK
  }

  private RexNode expr;
  private final EnumSet<Flag> flags;
  private final int rightJoinTable;
  private SqlCollation collation;
  int leftTable = -1;
  int leftColumn;
  @Nullable SqlKind kind;
  long rhsTables;
  long allTables;
  int parent = -1;
  int liveChildren;

  Conjunct(RexNode expr, Set<Flag> flags, int rightJoinTable) {
    this.expr = requireNonNull(expr, "expr");
    this.flags = flags.isEmpty() ? EnumSet.noneOf(Flag.class)
        : EnumSet.copyOf(flags);
    this.rightJoinTable = rightJoinTable;
    this.collation = expr instanceof RexCall
        ? RexUtil.comparisonCollation((RexCall) expr)
        : SqlCollation.BINARY;
  }

  /** Returns the expression, in {@code column OP expression} form if
   * analysis was able to put it in that form. */
  public RexNode getExpr() {
    return expr;
  }

  void setExpr(RexNode expr) {
    this.expr = requireNonNull(expr, "expr");
  }

  public boolean hasFlag(Flag flag) {
    return flags.contains(flag);
  }

  void addFlag(Flag flag) {
    flags.add(flag);
  }

  void removeFlag(Flag flag) {
    flags.remove(flag);
  }

  public Set<Flag> getFlags() {
    return EnumSet.copyOf(flags);
  }

  public boolean isVirtual() {
    return flags.contains(Flag.VIRTUAL);
  }

  public boolean isEnforced() {
    return flags.contains(Flag.ENFORCED);
  }

  /** Returns the handle of the right-hand table of the LEFT JOIN in whose ON
   * clause the conjunct was written, or -1 if it comes from the WHERE
   * clause. */
  public int getRightJoinTable() {
    return rightJoinTable;
  }

  public boolean isFromJoin() {
    return rightJoinTable >= 0;
  }

  /** Returns the collation with which the comparison is evaluated. A
   * commuted conjunct keeps the collation of its original orientation. */
  public SqlCollation getCollation() {
    return collation;
  }

  void setCollation(SqlCollation collation) {
    this.collation = requireNonNull(collation, "collation");
  }

  /** Returns the handle of the table whose column is the left operand, or
   * -1 if the conjunct cannot be used by an index. */
  public int getLeftTable() {
    return leftTable;
  }

  /** Returns the column that is the left operand; only valid if
   * {@link #getLeftTable()} is not -1. */
  public int getLeftColumn() {
    return leftColumn;
  }

  /** Returns the operator class, or null if the conjunct cannot be used by
   * an index. */
  public @Nullable SqlKind getKind() {
    return kind;
  }

  /** Returns the tables referenced by the right-hand operand. */
  public long getRhsTables() {
    return rhsTables;
  }

  /** Returns the tables referenced anywhere in the conjunct. */
  public long getAllTables() {
    return allTables;
  }

  /** Returns the index of the conjunct this one was derived from, or -1. */
  public int getParent() {
    return parent;
  }

  /** Returns the number of derived conjuncts that have not yet been
   * enforced. */
  public int getLiveChildren() {
    return liveChildren;
  }

  @Override public String toString() {
    final StringBuilder sb = new StringBuilder(expr.toString());
    if (kind != null) {
      sb.append(" [").append(leftTable).append('.').append(leftColumn)
          .append(' ').append(kind).append(" rhs=")
          .append(Util.maskToString(rhsTables)).append(']');
    }
    if (!flags.isEmpty()) {
      sb.append(' ').append(flags);
    }
    return sb.toString();
  }
}
