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
import org.apache.cairn.runtime.PlannerOutOfMemoryException;
import org.apache.cairn.sql.SqlKind;

import com.google.common.collect.ImmutableList;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/**
 * Append-only list of the {@link Conjunct}s of a WHERE clause.
 *
 * <p>A conjunct is addressed by its position in the list, which never
 * changes; derived conjuncts refer to their parent by position. Conjuncts
 * are never removed, only flagged {@link Conjunct.Flag#ENFORCED}.
 *
 * <p>The list also carries the {@link TableMaskSet} of the query, which its
 * sub-lists (the disjuncts of an OR) share.
 */
public class ConjunctList extends AbstractList<Conjunct> {
  private final TableMaskSet maskSet;
  private final int capacity;
  private final SqlKind connective;
  private final List<Conjunct> conjuncts = new ArrayList<>();

  /** Creates an empty list of AND-connected conjuncts. */
  public ConjunctList(TableMaskSet maskSet, int capacity) {
    this(maskSet, capacity, SqlKind.AND);
  }

  private ConjunctList(TableMaskSet maskSet, int capacity,
      SqlKind connective) {
    checkArgument(capacity > 0, "capacity must be positive: %s", capacity);
    this.maskSet = requireNonNull(maskSet, "maskSet");
    this.capacity = capacity;
    this.connective = connective;
  }

  /** Creates an empty list that shares this list's mask set, for the
   * disjuncts of an OR. */
  public ConjunctList newSubList() {
    return new ConjunctList(maskSet, capacity, SqlKind.OR);
  }

  /** Returns the operator that connects the elements of this list, AND or
   * OR. */
  public SqlKind getConnective() {
    return connective;
  }

  public TableMaskSet getMaskSet() {
    return maskSet;
  }

  public int getCapacity() {
    return capacity;
  }

  @Override public Conjunct get(int index) {
    return conjuncts.get(index);
  }

  @Override public int size() {
    return conjuncts.size();
  }

  /**
   * Appends a conjunct and returns its position.
   *
   * @param expr           Expression
   * @param flags          Initial flags
   * @param rightJoinTable Handle of the right-hand table of the LEFT JOIN
   *                       whose ON clause contains the expression, or -1
   *
   * @throws PlannerOutOfMemoryException if the list is full
   */
  public int add(RexNode expr, Set<Conjunct.Flag> flags, int rightJoinTable) {
    if (conjuncts.size() >= capacity) {
      throw new PlannerOutOfMemoryException(capacity);
    }
    conjuncts.add(new Conjunct(expr, flags, rightJoinTable));
    return conjuncts.size() - 1;
  }

  /**
   * Marks a conjunct as enforced by the access path. If every child of its
   * parent is now enforced, marks the parent too, and so on up the chain.
   *
   * <p>If the access path reads the right-hand side of a LEFT JOIN, only
   * conjuncts from an ON clause may be marked; a WHERE conjunct must still
   * be evaluated against the NULL row the join generates.
   *
   * @param index          Position of the conjunct
   * @param leftJoinRight  Whether the access path reads the right-hand side
   *                       of a LEFT JOIN
   */
  void disable(int index, boolean leftJoinRight) {
    for (int i = index; i >= 0;) {
      final Conjunct conjunct = conjuncts.get(i);
      if (conjunct.isEnforced()
          || leftJoinRight && !conjunct.isFromJoin()) {
        return;
      }
      conjunct.addFlag(Conjunct.Flag.ENFORCED);
      final int parent = conjunct.parent;
      if (parent < 0) {
        return;
      }
      final Conjunct p = conjuncts.get(parent);
      if (--p.liveChildren != 0) {
        return;
      }
      i = parent;
    }
  }

  /** Returns the expressions the executor must still evaluate: every
   * conjunct that is neither virtual nor enforced, in list order. */
  public ImmutableList<RexNode> residual() {
    final ImmutableList.Builder<RexNode> b = ImmutableList.builder();
    for (Conjunct conjunct : conjuncts) {
      if (!conjunct.isVirtual() && !conjunct.isEnforced()) {
        b.add(conjunct.getExpr());
      }
    }
    return b.build();
  }
}
