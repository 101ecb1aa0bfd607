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

import org.apache.cairn.rex.RexColumnRef;
import org.apache.cairn.rex.RexNode;
import org.apache.cairn.rex.RexSubQuery;
import org.apache.cairn.rex.RexVisitorImpl;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Computes which tables of the FROM list an expression refers to.
 *
 * <p>The result is a mask, as defined by a {@link TableMaskSet}. A column
 * reference contributes the mask of its table; a call the union of its
 * operands; a sub-query the union of its operands and of every clause of its
 * SELECT (and of the SELECTs it is compounded with). References to tables
 * that are not in the mask set, such as the tables of a sub-query's own FROM
 * list, contribute nothing.
 */
public class TableUsage extends RexVisitorImpl<Void> {
  private final TableMaskSet maskSet;
  private long mask;

  private TableUsage(TableMaskSet maskSet) {
    super(true);
    this.maskSet = maskSet;
  }

  /** Returns the tables used by an expression; 0 if it is null. */
  public static long of(TableMaskSet maskSet, @Nullable RexNode node) {
    final TableUsage usage = new TableUsage(maskSet);
    usage.add(node);
    return usage.mask;
  }

  /** Returns the tables used by a list of expressions. */
  public static long of(TableMaskSet maskSet, List<? extends RexNode> nodes) {
    final TableUsage usage = new TableUsage(maskSet);
    usage.addAll(nodes);
    return usage.mask;
  }

  /** Returns the tables used by a SELECT, including its priors. */
  public static long of(TableMaskSet maskSet, RexSubQuery.Select select) {
    final TableUsage usage = new TableUsage(maskSet);
    usage.add(select);
    return usage.mask;
  }

  private void add(@Nullable RexNode node) {
    if (node != null) {
      node.accept(this);
    }
  }

  private void addAll(List<? extends RexNode> nodes) {
    for (RexNode node : nodes) {
      node.accept(this);
    }
  }

  private void add(RexSubQuery.Select select) {
    for (RexSubQuery.Select s = select; s != null; s = s.prior) {
      addAll(s.selectList);
      addAll(s.groupBy);
      addAll(s.orderBy);
      add(s.where);
      add(s.having);
    }
  }

  @Override public Void visitColumnRef(RexColumnRef columnRef) {
    mask |= maskSet.maskOf(columnRef.getTableHandle());
    return null;
  }

  @Override public Void visitSubQuery(RexSubQuery subQuery) {
    super.visitSubQuery(subQuery);
    add(subQuery.select);
    return null;
  }
}
