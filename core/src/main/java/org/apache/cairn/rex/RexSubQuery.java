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

import org.apache.cairn.sql.SqlKind;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Scalar expression that represents an IN, EXISTS or scalar sub-query.
 *
 * <p>For {@code x IN (SELECT ...)} the single operand is {@code x}; EXISTS
 * and scalar sub-queries have no operands.
 */
public class RexSubQuery extends RexCall {
  public final Select select;

  private RexSubQuery(SqlKind kind, ImmutableList<RexNode> operands,
      Select select) {
    super(kind, operands, null,
        kind.sql + "(" + (operands.isEmpty() ? "" : operands.get(0) + ", ")
            + "{" + select + "})");
    this.select = requireNonNull(select, "select");
  }

  /** Creates an IN sub-query. */
  static RexSubQuery in(RexNode node, Select select) {
    return new RexSubQuery(SqlKind.IN, ImmutableList.of(node), select);
  }

  /** Creates an EXISTS sub-query. */
  static RexSubQuery exists(Select select) {
    return new RexSubQuery(SqlKind.EXISTS, ImmutableList.of(), select);
  }

  /** Creates a scalar sub-query. */
  static RexSubQuery scalar(Select select) {
    if (select.selectList.size() != 1) {
      throw new IllegalArgumentException(
          "scalar sub-query must return one column: " + select);
    }
    return new RexSubQuery(SqlKind.SCALAR_QUERY, ImmutableList.of(), select);
  }

  @Override public <R> R accept(RexVisitor<R> visitor) {
    return visitor.visitSubQuery(this);
  }

  @Override public boolean equals(@Nullable Object obj) {
    return super.equals(obj)
        && select.equals(((RexSubQuery) obj).select);
  }

  @Override public int hashCode() {
    return Objects.hash(super.hashCode(), select);
  }

  /**
   * The parts of a SELECT statement that the planner inspects to find out
   * which outer tables a sub-query refers to.
   *
   * <p>A compound query ({@code UNION} and friends) is a chain of selects
   * linked through {@link #prior}.
   */
  public static class Select {
    public final ImmutableList<RexNode> selectList;
    public final @Nullable RexNode where;
    public final ImmutableList<RexNode> groupBy;
    public final @Nullable RexNode having;
    public final ImmutableList<RexNode> orderBy;
    public final @Nullable Select prior;

    public Select(List<? extends RexNode> selectList, @Nullable RexNode where,
        List<? extends RexNode> groupBy, @Nullable RexNode having,
        List<? extends RexNode> orderBy, @Nullable Select prior) {
      this.selectList = ImmutableList.copyOf(selectList);
      this.where = where;
      this.groupBy = ImmutableList.copyOf(groupBy);
      this.having = having;
      this.orderBy = ImmutableList.copyOf(orderBy);
      this.prior = prior;
    }

    /** Creates a select with the given select list and no other clauses. */
    public static Select of(RexNode... selectList) {
      return new Select(ImmutableList.copyOf(selectList), null,
          ImmutableList.of(), null, ImmutableList.of(), null);
    }

    public Select withWhere(@Nullable RexNode where) {
      return new Select(selectList, where, groupBy, having, orderBy, prior);
    }

    public Select withGroupBy(List<? extends RexNode> groupBy) {
      return new Select(selectList, where, groupBy, having, orderBy, prior);
    }

    public Select withHaving(@Nullable RexNode having) {
      return new Select(selectList, where, groupBy, having, orderBy, prior);
    }

    public Select withOrderBy(List<? extends RexNode> orderBy) {
      return new Select(selectList, where, groupBy, having, orderBy, prior);
    }

    public Select withPrior(@Nullable Select prior) {
      return new Select(selectList, where, groupBy, having, orderBy, prior);
    }

    @Override public boolean equals(@Nullable Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Select)) {
        return false;
      }
      final Select that = (Select) obj;
      return selectList.equals(that.selectList)
          && Objects.equals(where, that.where)
          && groupBy.equals(that.groupBy)
          && Objects.equals(having, that.having)
          && orderBy.equals(that.orderBy)
          && Objects.equals(prior, that.prior);
    }

    @Override public int hashCode() {
      return Objects.hash(selectList, where, groupBy, having, orderBy, prior);
    }

    @Override public String toString() {
      final StringBuilder sb = new StringBuilder();
      if (prior != null) {
        sb.append(prior).append(" UNION ");
      }
      sb.append("SELECT ");
      for (int i = 0; i < selectList.size(); i++) {
        if (i > 0) {
          sb.append(", ");
        }
        sb.append(selectList.get(i));
      }
      if (where != null) {
        sb.append(" WHERE ").append(where);
      }
      if (!groupBy.isEmpty()) {
        sb.append(" GROUP BY ").append(groupBy);
      }
      if (having != null) {
        sb.append(" HAVING ").append(having);
      }
      if (!orderBy.isEmpty()) {
        sb.append(" ORDER BY ").append(orderBy);
      }
      return sb.toString();
    }
  }
}
