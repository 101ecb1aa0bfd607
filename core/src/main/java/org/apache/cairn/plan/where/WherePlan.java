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

import org.apache.cairn.rex.RexNode;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The result of planning a WHERE clause: the order in which to read the
 * tables of the FROM list, how to read each one, and which conjuncts remain
 * to be evaluated.
 *
 * <p>The executor evaluates {@link #getConstantCondition()} once, before the
 * loops; then, in the loop of each step, the conjuncts of
 * {@link #getConjuncts()} that are neither virtual nor enforced.
 */
public class WherePlan {
  private final ImmutableList<AccessStep> steps;
  private final ConjunctList conjuncts;
  private final @Nullable RexNode constantCondition;
  private final boolean unique;
  private final boolean orderBySatisfied;
  private final boolean onePass;

  WherePlan(List<AccessStep> steps, ConjunctList conjuncts,
      @Nullable RexNode constantCondition, boolean unique,
      boolean orderBySatisfied, boolean onePass) {
    this.steps = ImmutableList.copyOf(steps);
    this.conjuncts = requireNonNull(conjuncts, "conjuncts");
    this.constantCondition = constantCondition;
    this.unique = unique;
    this.orderBySatisfied = orderBySatisfied;
    this.onePass = onePass;
  }

  /** Returns the steps, in join order; one per FROM item. */
  public ImmutableList<AccessStep> getSteps() {
    return steps;
  }

  public AccessStep getStep(int position) {
    return steps.get(position);
  }

  /** Returns the analyzed conjuncts, with accurate
   * {@link Conjunct.Flag#ENFORCED} flags. */
  public ConjunctList getConjuncts() {
    return conjuncts;
  }

  /** Returns the conjuncts the executor must evaluate. */
  public ImmutableList<RexNode> getResidual() {
    return conjuncts.residual();
  }

  /** Returns the WHERE clause if it does not depend on any row, else
   * null. */
  public @Nullable RexNode getConstantCondition() {
    return constantCondition;
  }

  /** Returns whether the query produces at most one row. */
  public boolean isUnique() {
    return unique;
  }

  /** Returns whether an ORDER BY was requested and rows come out in that
   * order, so no sort is needed. */
  public boolean isOrderBySatisfied() {
    return orderBySatisfied;
  }

  /** Returns whether rows can be modified while the only table is scanned;
   * see {@link WhereOption#ONE_PASS_DESIRED}. */
  public boolean isOnePass() {
    return onePass;
  }

  /** Returns a description of the plan, one line per step. */
  public String explain() {
    final StringBuilder sb = new StringBuilder();
    for (AccessStep step : steps) {
      sb.append(step.explain()).append('\n');
    }
    return sb.toString();
  }

  @Override public String toString() {
    return explain();
  }
}
