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

import org.apache.cairn.plan.PlannerListener;
import org.apache.cairn.rex.RexColumnRef;
import org.apache.cairn.schema.IndexAdvice;
import org.apache.cairn.schema.IndexAdvisorRequest;
import org.apache.cairn.schema.IndexDescriptor;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.apache.cairn.plan.where.AccessPath.BIG_COST;

import static java.util.Objects.requireNonNull;

/**
 * Chooses a join order, and an access path for each table in it.
 *
 * <p>The algorithm is greedy: for each position of the join order in turn,
 * it places the table that is cheapest to read given the tables already
 * placed. It never reconsiders a choice.
 *
 * <p>The right-hand side of a LEFT JOIN or CROSS JOIN is never moved ahead
 * of an item to its left; a CROSS JOIN is how a user forces a join order.
 */
public class JoinPlanner {
  private final CostModel costModel;
  private final ConjunctList conjuncts;
  private final PlannerListener listener;

  public JoinPlanner(CostModel costModel, ConjunctList conjuncts,
      PlannerListener listener) {
    this.costModel = requireNonNull(costModel, "costModel");
    this.conjuncts = requireNonNull(conjuncts, "conjuncts");
    this.listener = requireNonNull(listener, "listener");
  }

  /**
   * Orders the items of a FROM list.
   *
   * @param from    FROM list, each item registered in the mask set of the
   *                conjunct list
   * @param orderBy ORDER BY clause, or null
   */
  public JoinOrder order(List<FromItem> from,
      @Nullable List<OrderByTerm> orderBy) {
    final TableMaskSet maskSet = conjuncts.getMaskSet();
    final boolean orderByRequested = orderBy != null && !orderBy.isEmpty();
    @Nullable List<OrderByTerm> pendingOrderBy =
        orderByRequested ? orderBy : null;
    final ImmutableList.Builder<AccessStep> steps = ImmutableList.builder();
    final Set<AccessShape> andShapes = EnumSet.allOf(AccessShape.class);
    long notReady = maskSet.allMask();
    int iFrom = 0;
    for (int i = 0; i < from.size(); i++) {
      double lowestCost = BIG_COST;
      @Nullable AccessPath best = null;
      int bestJ = -1;
      boolean once = false;
      for (int j = iFrom; j < from.size(); j++) {
        final FromItem item = from.get(j);
        final boolean doNotReorder = item.getJoinType().isReorderBarrier();
        if (once && doNotReorder) {
          break;
        }
        final long m = maskSet.maskOf(item.getHandle());
        if ((m & notReady) == 0) {
          if (j == iFrom) {
            iFrom++;
          }
          continue;
        }
        final AccessPath path = item.getTable().isVirtual()
            ? costModel.bestAdvisedIndex(item, notReady, pendingOrderBy,
                i == 0)
            : costModel.bestIndex(item, notReady,
                i == 0 ? pendingOrderBy : null);
        listener.accessPathCosted(
            new PlannerListener.AccessPathCostedEvent(this, item, i, path));
        if (best == null || path.getCost() < lowestCost) {
          once = true;
          lowestCost = path.getCost();
          best = path;
          bestJ = j;
        }
        if (doNotReorder) {
          break;
        }
      }
      final AccessPath chosen =
          requireNonNull(best, "no access path for join position");
      final FromItem item = from.get(bestJ);
      if (chosen.has(AccessShape.ORDER_BY)) {
        pendingOrderBy = null;
      }
      andShapes.retainAll(chosen.getShapes());
      notReady &= ~maskSet.maskOf(item.getHandle());
      final AccessStep step = new AccessStep(i, bestJ, item, chosen);
      steps.add(step);
      listener.accessStepChosen(
          new PlannerListener.AccessStepChosenEvent(this, step));
    }
    final boolean unique = andShapes.contains(AccessShape.UNIQUE);
    if (unique) {
      // At most one row, which is trivially in order.
      pendingOrderBy = null;
    }
    return new JoinOrder(steps.build(), unique,
        orderByRequested && pendingOrderBy == null);
  }

  /**
   * Marks the conjuncts that the access paths of a join order guarantee, so
   * that the executor does not evaluate them.
   */
  public void enforce(List<AccessStep> steps) {
    long notReady = conjuncts.getMaskSet().allMask();
    for (AccessStep step : steps) {
      final FromItem item = step.getItem();
      final int handle = item.getHandle();
      final boolean leftJoinRight = item.isLeftJoinRight();
      final AccessPath path = step.getPath();
      final @Nullable IndexDescriptor index = path.getIndex();
      if (path.has(AccessShape.VIRTUAL_TABLE)) {
        final IndexAdvisorRequest request =
            requireNonNull(path.getAdvisorRequest(), "request");
        final IndexAdvice advice = requireNonNull(path.getAdvice(), "advice");
        for (int i = 0; i < advice.getUsages().size(); i++) {
          final IndexAdvice.ConstraintUsage usage = advice.getUsages().get(i);
          if (usage.argvIndex > 0 && usage.omit) {
            conjuncts.disable(request.getConstraints().get(i).termOffset,
                leftJoinRight);
          }
        }
      } else if (path.has(AccessShape.ROWID_EQ)) {
        disable(TermIndex.find(conjuncts, handle, RexColumnRef.ROWID,
            notReady, CostModel.EQ_OR_IN), leftJoinRight);
      } else if (path.has(AccessShape.ROWID_RANGE)) {
        if (path.has(AccessShape.TOP_LIMIT)) {
          disable(TermIndex.find(conjuncts, handle, RexColumnRef.ROWID,
              notReady, CostModel.UPPER_BOUND), leftJoinRight);
        }
        if (path.has(AccessShape.BTM_LIMIT)) {
          disable(TermIndex.find(conjuncts, handle, RexColumnRef.ROWID,
              notReady, CostModel.LOWER_BOUND), leftJoinRight);
        }
      } else if (index != null) {
        final int nEq = path.getEqColumnCount();
        for (int i = 0; i < nEq; i++) {
          disable(TermIndex.find(conjuncts, item, index.getColumn(i).column,
              notReady, path.getEqOps(), index), leftJoinRight);
        }
        if (nEq < index.getColumnCount()) {
          final int column = index.getColumn(nEq).column;
          if (path.has(AccessShape.TOP_LIMIT)) {
            disable(TermIndex.find(conjuncts, item, column, notReady,
                CostModel.UPPER_BOUND, index), leftJoinRight);
          }
          if (path.has(AccessShape.BTM_LIMIT)) {
            disable(TermIndex.find(conjuncts, item, column, notReady,
                CostModel.LOWER_BOUND, index), leftJoinRight);
          }
        }
      }
      notReady &= ~conjuncts.getMaskSet().maskOf(handle);
    }
  }

  private void disable(int term, boolean leftJoinRight) {
    if (term >= 0) {
      conjuncts.disable(term, leftJoinRight);
    }
  }

  /** A join order: the steps, and what they guarantee about the result. */
  public static class JoinOrder {
    public final ImmutableList<AccessStep> steps;
    /** Whether every step reads at most one row. */
    public final boolean unique;
    /** Whether an ORDER BY was requested and the order satisfies it. */
    public final boolean orderBySatisfied;

    JoinOrder(ImmutableList<AccessStep> steps, boolean unique,
        boolean orderBySatisfied) {
      this.steps = steps;
      this.unique = unique;
      this.orderBySatisfied = orderBySatisfied;
    }
  }
}
