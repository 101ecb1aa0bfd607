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

import org.apache.cairn.rel.RelFieldCollation;
import org.apache.cairn.rex.RexColumnRef;
import org.apache.cairn.rex.RexNode;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/** A term of an ORDER BY clause. */
public class OrderByTerm {
  public final RexNode expr;
  public final RelFieldCollation.Direction direction;

  public OrderByTerm(RexNode expr, RelFieldCollation.Direction direction) {
    this.expr = requireNonNull(expr, "expr");
    this.direction = requireNonNull(direction, "direction");
  }

  public static OrderByTerm asc(RexNode expr) {
    return new OrderByTerm(expr, RelFieldCollation.Direction.ASCENDING);
  }

  public static OrderByTerm desc(RexNode expr) {
    return new OrderByTerm(expr, RelFieldCollation.Direction.DESCENDING);
  }

  /** Returns the expression as a column of the given table, or null if it is
   * something else. */
  @Nullable RexColumnRef columnOf(int tableHandle) {
    if (expr instanceof RexColumnRef
        && ((RexColumnRef) expr).getTableHandle() == tableHandle) {
      return (RexColumnRef) expr;
    }
    return null;
  }

  @Override public boolean equals(@Nullable Object o) {
    return this == o
        || o instanceof OrderByTerm
        && expr.equals(((OrderByTerm) o).expr)
        && direction == ((OrderByTerm) o).direction;
  }

  @Override public int hashCode() {
    return Objects.hash(expr, direction);
  }

  @Override public String toString() {
    return expr + " " + direction.shortString;
  }
}
