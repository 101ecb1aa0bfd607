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

import org.apache.cairn.schema.IndexAdvice;
import org.apache.cairn.schema.IndexAdvisorRequest;
import org.apache.cairn.schema.IndexDescriptor;
import org.apache.cairn.sql.SqlKind;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.EnumSet;
import java.util.Set;

/**
 * Access method for one FROM item, as priced by {@link CostModel}.
 */
public class AccessPath {
  /** Cost of a path that is not possible. */
  public static final double BIG_COST = 1e99;

  private final double cost;
  private final @Nullable IndexDescriptor index;
  private final int nEq;
  private final ImmutableSet<AccessShape> shapes;
  private final ImmutableSet<SqlKind> eqOps;
  private final @Nullable IndexAdvisorRequest request;
  private final @Nullable IndexAdvice advice;

  AccessPath(double cost, @Nullable IndexDescriptor index, int nEq,
      Set<AccessShape> shapes, Set<SqlKind> eqOps) {
    this(cost, index, nEq, shapes, eqOps, null, null);
  }

  AccessPath(double cost, @Nullable IndexDescriptor index, int nEq,
      Set<AccessShape> shapes, Set<SqlKind> eqOps,
      @Nullable IndexAdvisorRequest request, @Nullable IndexAdvice advice) {
    this.cost = cost;
    this.index = index;
    this.nEq = nEq;
    this.shapes = Sets.immutableEnumSet(shapes);
    this.eqOps = Sets.immutableEnumSet(eqOps);
    this.request = request;
    this.advice = advice;
  }

  /** Returns a copy of this path with different shapes. */
  AccessPath withShapes(Set<AccessShape> shapes) {
    return new AccessPath(cost, index, nEq, shapes, eqOps, request, advice);
  }

  public double getCost() {
    return cost;
  }

  /** Returns the index to use, or null for rowid access, a full scan or a
   * virtual table. */
  public @Nullable IndexDescriptor getIndex() {
    return index;
  }

  /** Returns the number of leading index columns fixed by equality (or IN)
   * constraints; 1 for rowid equality. */
  public int getEqColumnCount() {
    return nEq;
  }

  public ImmutableSet<AccessShape> getShapes() {
    return shapes;
  }

  public boolean has(AccessShape shape) {
    return shapes.contains(shape);
  }

  /** Returns the operators that were accepted as equality constraints when
   * the path was priced. */
  public ImmutableSet<SqlKind> getEqOps() {
    return eqOps;
  }

  /** Returns the request that was put to the virtual table's advisor, or
   * null. */
  public @Nullable IndexAdvisorRequest getAdvisorRequest() {
    return request;
  }

  /** Returns the virtual table's advice, or null. */
  public @Nullable IndexAdvice getAdvice() {
    return advice;
  }

  /** Returns whether the path scans the whole table without any
   * constraint. */
  public boolean isFullScan() {
    return shapes.isEmpty();
  }

  static Set<AccessShape> noShapes() {
    return EnumSet.noneOf(AccessShape.class);
  }

  @Override public String toString() {
    return "cost=" + cost
        + (index == null ? "" : " index=" + index.getName())
        + " nEq=" + nEq + " " + shapes;
  }
}
