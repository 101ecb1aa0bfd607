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

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Factory for row expressions.
 *
 * <p>Some common expressions have a convenience method, such as
 * {@link #makeIn}; the rest are created with {@link #makeCall}.
 */
public class RexBuilder {
  //~ Methods ----------------------------------------------------------------

  /**
   * Creates a reference to a column of a FROM-list table.
   *
   * @param tableHandle Cursor number of the table
   * @param column      0-based column number, or {@link RexColumnRef#ROWID}
   * @param affinity    Declared affinity of the column
   * @param collation   Declared collating sequence of the column
   * @param name        Name, used in digests and plan descriptions
   */
  public RexColumnRef makeColumnRef(int tableHandle, int column,
      SqlAffinity affinity, SqlCollation collation, String name) {
    checkArgument(column >= RexColumnRef.ROWID, "invalid column %s", column);
    return new RexColumnRef(tableHandle, column, affinity, collation, name);
  }

  /** Creates a reference to the row identity of a table. */
  public RexColumnRef makeRowidRef(int tableHandle, String name) {
    return new RexColumnRef(tableHandle, RexColumnRef.ROWID,
        SqlAffinity.INTEGER, SqlCollation.BINARY, name);
  }

  /** Creates a character string literal. */
  public RexLiteral makeLiteral(String s) {
    return new RexLiteral(s);
  }

  /** Creates an integer literal. */
  public RexLiteral makeExactLiteral(long n) {
    return new RexLiteral(n);
  }

  /** Creates a floating-point literal. */
  public RexLiteral makeApproxLiteral(double d) {
    return new RexLiteral(d);
  }

  /** Creates the NULL literal. */
  public RexLiteral makeNullLiteral() {
    return new RexLiteral(null);
  }

  /**
   * Creates a call to an operator.
   *
   * <p>For {@link SqlKind#OTHER_FUNCTION} use {@link #makeFunction}.
   */
  public RexCall makeCall(SqlKind kind, RexNode... operands) {
    return makeCall(kind, ImmutableList.copyOf(operands));
  }

  /**
   * Creates a call to an operator with a list of operands.
   */
  public RexCall makeCall(SqlKind kind, List<? extends RexNode> operands) {
    switch (kind) {
    case AND:
    case OR:
      checkArgument(operands.size() >= 2, "%s requires at least 2 operands",
          kind);
      break;
    case EQUALS:
    case LESS_THAN:
    case LESS_THAN_OR_EQUAL:
    case GREATER_THAN:
    case GREATER_THAN_OR_EQUAL:
      checkArgument(operands.size() == 2, "%s requires 2 operands", kind);
      break;
    case IS_NULL:
      checkArgument(operands.size() == 1, "%s requires 1 operand", kind);
      break;
    case BETWEEN:
      checkArgument(operands.size() == 3, "%s requires 3 operands", kind);
      break;
    case LIKE:
    case GLOB:
      checkArgument(operands.size() == 2 || operands.size() == 3,
          "%s requires 2 or 3 operands", kind);
      break;
    case IN:
      checkArgument(operands.size() >= 2, "%s requires a value list", kind);
      break;
    case OTHER_FUNCTION:
      throw new IllegalArgumentException("use makeFunction");
    case SCALAR_QUERY:
    case EXISTS:
    case COLUMN_REF:
    case LITERAL:
      throw new IllegalArgumentException("not an operator: " + kind);
    default:
      break;
    }
    return new RexCall(kind, operands, null);
  }

  /** Creates a call to a named function, such as {@code MATCH(q, c)}. */
  public RexCall makeFunction(String name, RexNode... operands) {
    return new RexCall(SqlKind.OTHER_FUNCTION, ImmutableList.copyOf(operands),
        name);
  }

  /** Creates {@code node IN (values...)}. */
  public RexCall makeIn(RexNode node, List<? extends RexNode> values) {
    return makeCall(SqlKind.IN,
        ImmutableList.<RexNode>builder().add(node).addAll(values).build());
  }

  /** Creates {@code node IN (values...)}. */
  public RexCall makeIn(RexNode node, RexNode... values) {
    return makeIn(node, ImmutableList.copyOf(values));
  }

  /** Creates {@code node IN (SELECT ...)}. */
  public RexSubQuery makeInSubQuery(RexNode node, RexSubQuery.Select select) {
    return RexSubQuery.in(node, select);
  }

  /** Creates a scalar sub-query {@code (SELECT ...)}. */
  public RexSubQuery makeScalarQuery(RexSubQuery.Select select) {
    return RexSubQuery.scalar(select);
  }

  /** Creates {@code EXISTS (SELECT ...)}. */
  public RexSubQuery makeExists(RexSubQuery.Select select) {
    return RexSubQuery.exists(select);
  }

  /** Creates {@code node BETWEEN lower AND upper}. */
  public RexCall makeBetween(RexNode node, RexNode lower, RexNode upper) {
    return makeCall(SqlKind.BETWEEN, node, lower, upper);
  }

  /** Creates {@code node IS NULL}. */
  public RexCall makeIsNull(RexNode node) {
    return makeCall(SqlKind.IS_NULL, node);
  }

  /** Creates {@code left = right}. */
  public RexCall equals(RexNode left, RexNode right) {
    return makeCall(SqlKind.EQUALS, left, right);
  }

  /** Creates the conjunction of two or more expressions. */
  public RexCall and(RexNode... operands) {
    return makeCall(SqlKind.AND, operands);
  }

  /** Creates the disjunction of two or more expressions. */
  public RexCall or(RexNode... operands) {
    return makeCall(SqlKind.OR, operands);
  }
}
