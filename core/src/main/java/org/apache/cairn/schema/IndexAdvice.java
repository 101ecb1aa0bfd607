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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Response of an {@link IndexAdvisor}.
 *
 * <p>The usage list is parallel to the request's constraints. A constraint
 * with a positive {@code argvIndex} is passed to the table, as argument
 * number {@code argvIndex}, when the scan starts; if it is also marked
 * {@code omit}, the executor does not re-check it.
 */
public class IndexAdvice {
  private final double estimatedCost;
  private final int idxNum;
  private final @Nullable String idxStr;
  private final ImmutableList<ConstraintUsage> usages;
  private final boolean orderByConsumed;

  public IndexAdvice(double estimatedCost, int idxNum, @Nullable String idxStr,
      List<ConstraintUsage> usages, boolean orderByConsumed) {
    this.estimatedCost = estimatedCost;
    this.idxNum = idxNum;
    this.idxStr = idxStr;
    this.usages = ImmutableList.copyOf(usages);
    this.orderByConsumed = orderByConsumed;
  }

  /** Creates an advice that uses no constraint and does not sort: a full
   * scan of the table. */
  public static IndexAdvice fullScan(IndexAdvisorRequest request,
      double estimatedCost) {
    final ImmutableList.Builder<ConstraintUsage> usages =
        ImmutableList.builder();
    for (int i = 0; i < request.getConstraints().size(); i++) {
      usages.add(ConstraintUsage.UNUSED);
    }
    return new IndexAdvice(estimatedCost, 0, null, usages.build(), false);
  }

  public double getEstimatedCost() {
    return estimatedCost;
  }

  public int getIdxNum() {
    return idxNum;
  }

  public @Nullable String getIdxStr() {
    return idxStr;
  }

  public List<ConstraintUsage> getUsages() {
    return usages;
  }

  public boolean isOrderByConsumed() {
    return orderByConsumed;
  }

  @Override public String toString() {
    return "idxNum=" + idxNum + ", idxStr=" + idxStr + ", cost="
        + estimatedCost + ", usages=" + usages
        + (orderByConsumed ? ", orderByConsumed" : "");
  }

  /** How the table uses one constraint. */
  public static class ConstraintUsage {
    public static final ConstraintUsage UNUSED = new ConstraintUsage(0, false);

    /** 1-based argument position, or 0 if the constraint is not used. */
    public final int argvIndex;
    /** Whether the table guarantees the constraint. */
    public final boolean omit;

    public ConstraintUsage(int argvIndex, boolean omit) {
      this.argvIndex = argvIndex;
      this.omit = omit;
    }

    @Override public String toString() {
      return argvIndex + (omit ? " omit" : "");
    }
  }
}
