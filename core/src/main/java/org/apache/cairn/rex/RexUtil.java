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
package org.apache.cairn.rex;

import org.apache.cairn.sql.SqlCollation;
import org.apache.cairn.sql.SqlKind;
import org.apache.cairn.sql.type.SqlAffinity;
import org.apache.cairn.util.Util;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Utility methods concerning row-expressions.
 */
public class RexUtil {
  private RexUtil() {}

  /**
   * Returns whether an expression is constant: it references no column, and
   * contains no sub-query and no function call.
   *
   * <p>Such an expression has the same value for every row, so a WHERE
   * clause that is constant can be evaluated once, before any table is read.
   */
  public static boolean isConstant(RexNode e) {
    try {
      RexVisitor<Void> visitor =
          new RexVisitorImpl<Void>(true) {
            @Override public Void visitColumnRef(RexColumnRef columnRef) {
              throw Util.FoundOne.NULL;
            }

            @Override public Void visitSubQuery(RexSubQuery subQuery) {
              throw Util.FoundOne.NULL;
            }

            @Override public Void visitCall(RexCall call) {
              if (call.getKind() == SqlKind.OTHER_FUNCTION) {
                throw Util.FoundOne.NULL;
              }
              return super.visitCall(call);
            }
          };
      e.accept(visitor);
      return true;
    } catch (Util.FoundOne ex) {
      Util.swallow(ex, null);
      return false;
    }
  }

  /**
   * Returns the expression with its operands swapped and its operator
   * reversed; for example {@code a < b} becomes {@code b > a}.
   *
   * <p>Applying the method twice yields an expression equal to the original.
   */
  public static RexCall commute(RexCall call) {
    if (!call.isA(SqlKind.COMPARISON)) {
      throw new IllegalArgumentException("cannot commute " + call);
    }
    return new RexCall(call.getKind().reverse(),
        ImmutableList.of(call.operand(1), call.operand(0)), null);
  }

  /**
   * Returns the affinity of an expression, or null if it has none.
   *
   * <p>A column has its declared affinity; a scalar sub-query has the
   * affinity of its only select item; any other expression has none.
   */
  public static @Nullable SqlAffinity affinity(RexNode e) {
    switch (e.getKind()) {
    case COLUMN_REF:
      return ((RexColumnRef) e).getAffinity();
    case SCALAR_QUERY:
      return affinity(((RexSubQuery) e).select.selectList.get(0));
    default:
      return null;
    }
  }

  /**
   * Returns the affinity with which a comparison is evaluated.
   *
   * <p>Combines the affinity of the left operand with that of the right
   * operand, or, for {@code x IN (SELECT ...)}, with that of the first select
   * item. If neither side has an affinity, returns {@link SqlAffinity#NONE}.
   */
  public static SqlAffinity comparisonAffinity(RexCall call) {
    final SqlAffinity left = affinity(call.operand(0));
    if (call instanceof RexSubQuery) {
      final RexSubQuery subQuery = (RexSubQuery) call;
      return SqlAffinity.compare(
          affinity(subQuery.select.selectList.get(0)), left);
    }
    if (call.isA(SqlKind.COMPARISON)) {
      return SqlAffinity.compare(affinity(call.operand(1)), left);
    }
    return left == null ? SqlAffinity.NONE : left;
  }

  /**
   * Returns the collating sequence with which a binary comparison is
   * evaluated: that of the left operand if it is a column, otherwise that of
   * the right operand if it is a column, otherwise
   * {@link SqlCollation#BINARY}.
   */
  public static SqlCollation comparisonCollation(RexCall call) {
    if (call.operands.isEmpty()) {
      return SqlCollation.BINARY;
    }
    final RexNode left = call.operand(0);
    if (left instanceof RexColumnRef) {
      return ((RexColumnRef) left).getCollation();
    }
    if (call.isA(SqlKind.COMPARISON)
        && call.operand(1) instanceof RexColumnRef) {
      return ((RexColumnRef) call.operand(1)).getCollation();
    }
    return SqlCollation.BINARY;
  }
}
