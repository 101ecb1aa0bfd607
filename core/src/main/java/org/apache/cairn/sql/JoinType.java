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

import java.util.Locale;

/**
 * Enumerates the ways a FROM-list item is joined to the items on its left.
 */
public enum JoinType {
  /**
   * Inner join.
   */
  INNER,

  /**
   * Cross join (also known as Cartesian product). The planner never moves a
   * CROSS JOIN operand ahead of the items to its left, so users can fix the
   * join order by writing CROSS JOIN.
   */
  CROSS,

  /**
   * Left outer join.
   */
  LEFT,

  /**
   * Comma join: the good old-fashioned SQL <code>FROM</code> clause,
   * where table expressions are specified with commas between them, and
   * join conditions are specified in the <code>WHERE</code> clause.
   */
  COMMA;

  /** Lower-case name. */
  public final String lowerName = name().toLowerCase(Locale.ROOT);

  /**
   * Returns whether a join of this type may generate NULL values on the
   * right-hand side.
   */
  public boolean generatesNullsOnRight() {
    return this == LEFT;
  }

  /**
   * Returns whether the right-hand item of a join of this type must stay
   * after every item to its left in the join order.
   */
  public boolean isReorderBarrier() {
    return this == LEFT || this == CROSS;
  }
}
