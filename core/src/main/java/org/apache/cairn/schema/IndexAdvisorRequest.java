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
package org.apache.cairn.schema;

import org.apache.cairn.rel.RelFieldCollation;
import org.apache.cairn.sql.SqlKind;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Request passed to an {@link IndexAdvisor}: the constraints of the WHERE
 * clause that apply to the table, and the required ordering.
 */
public class IndexAdvisorRequest {
  private final ImmutableList<Constraint> constraints;
  private final ImmutableList<RelFieldCollation> orderBy;

  public IndexAdvisorRequest(List<Constraint> constraints,
      List<RelFieldCollation> orderBy) {
    this.constraints = ImmutableList.copyOf(constraints);
    this.orderBy = ImmutableList.copyOf(orderBy);
  }

  public List<Constraint> getConstraints() {
    return constraints;
  }

  /** Returns the required ordering, as columns of the table; empty if the
   * query does not need the rows in any particular order, or if the planner
   * cannot exploit ordering at this position. */
  public List<RelFieldCollation> getOrderBy() {
    return orderBy;
  }

  @Override public String toString() {
    return "constraints=" + constraints + ", orderBy=" + orderBy;
  }

  /** Constraint of the form {@code column OP expression}. */
  public static class Constraint {
    /** Column number, or -1 for the row identity. */
    public final int column;
    /** Operator; one of {@link SqlKind#COMPARISON}, or
     * {@link SqlKind#MATCH}. */
    public final SqlKind op;
    /** Whether the expression can be evaluated before the table is read. */
    public final boolean usable;
    /** Position of the conjunct in the WHERE clause's conjunct list. */
    public final int termOffset;

    public Constraint(int column, SqlKind op, boolean usable, int termOffset) {
      this.column = column;
      this.op = requireNonNull(op, "op");
      this.usable = usable;
      this.termOffset = termOffset;
    }

    @Override public String toString() {
      return column + " " + op.sql + (usable ? "" : " (unusable)");
    }
  }
}
