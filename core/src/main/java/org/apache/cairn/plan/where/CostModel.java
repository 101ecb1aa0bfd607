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
import org.apache.cairn.rex.RexCall;
import org.apache.cairn.rex.RexColumnRef;
import org.apache.cairn.rex.RexSubQuery;
import org.apache.cairn.runtime.InvalidExternalPlanException;
import org.apache.cairn.schema.IndexAdvice;
import org.apache.cairn.schema.IndexAdvisor;
import org.apache.cairn.schema.IndexAdvisorRequest;
import org.apache.cairn.schema.IndexDescriptor;
import org.apache.cairn.schema.TableDescriptor;
import org.apache.cairn.sql.SqlKind;
import org.apache.cairn.util.trace.CairnTrace;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.apache.cairn.plan.where.AccessPath.BIG_COST;

import static java.util.Objects.requireNonNull;

/**
 * Prices the ways of reading one FROM item, given the tables already placed
 * before it in the join order, and returns the cheapest.
 *
 * <p>Costs are rough estimates of the number of rows visited. An access path
 * for a table is chosen from a rowid lookup, a rowid range scan, a lookup or
 * range scan on one of its indexes, and a full scan; a virtual table
 * delegates the choice to its {@link IndexAdvisor}.
 *
 * <p>A CostModel belongs to one planning session: it caches the request
 * template for each virtual table.
 */
public class CostModel {
  private static final Logger LOGGER = CairnTrace.getPlannerTracer();

  static final Set<SqlKind> EQ_OR_IN =
      Sets.immutableEnumSet(SqlKind.EQUALS, SqlKind.IN);
  static final Set<SqlKind> RANGE =
      Sets.immutableEnumSet(SqlKind.LESS_THAN, SqlKind.LESS_THAN_OR_EQUAL,
          SqlKind.GREATER_THAN, SqlKind.GREATER_THAN_OR_EQUAL);
  static final Set<SqlKind> UPPER_BOUND =
      Sets.immutableEnumSet(SqlKind.LESS_THAN, SqlKind.LESS_THAN_OR_EQUAL);
  static final Set<SqlKind> LOWER_BOUND =
      Sets.immutableEnumSet(SqlKind.GREATER_THAN,
          SqlKind.GREATER_THAN_OR_EQUAL);
  private static final Set<SqlKind> ROWID_USABLE =
      Sets.immutableEnumSet(Sets.union(EQ_OR_IN, RANGE));

  private final WherePlanner.Config config;
  private final ConjunctList conjuncts;
  private final Map<Integer, AdvisorTemplate> templates = new HashMap<>();

  public CostModel(WherePlanner.Config config, ConjunctList conjuncts) {
    this.config = requireNonNull(config, "config");
    this.conjuncts = requireNonNull(conjuncts, "conjuncts");
  }

  /**
   * Returns an estimate of the base-10 logarithm of {@code n}: 1 plus the
   * number of powers of ten, starting at 10, that are less than it.
   */
  public static double estLog(double n) {
    double logN = 1;
    double x = 10;
    while (n > x) {
      logN += 1;
      x *= 10;
    }
    return logN;
  }

  /** Returns the operators that may fix an index column of {@code item} to
   * a single value. IS NULL is excluded for the right-hand side of a LEFT
   * JOIN, where the join generates NULLs the index does not hold. */
  static Set<SqlKind> eqOps(FromItem item) {
    return item.isLeftJoinRight()
        ? EnumSet.of(SqlKind.EQUALS, SqlKind.IN)
        : EnumSet.of(SqlKind.EQUALS, SqlKind.IN, SqlKind.IS_NULL);
  }

  /**
   * Returns the cheapest native access path for a table.
   *
   * @param item     Table
   * @param notReady Tables not yet placed in the join order; includes
   *                 {@code item}
   * @param orderBy  ORDER BY clause the path should try to satisfy, or null
   */
  public AccessPath bestIndex(FromItem item, long notReady,
      @Nullable List<OrderByTerm> orderBy) {
    final TableDescriptor table = item.getTable();
    final int handle = item.getHandle();
    final TableMaskSet maskSet = conjuncts.getMaskSet();
    if (orderBy != null && orderBy.isEmpty()) {
      orderBy = null;
    }
    final Set<SqlKind> eqOps = eqOps(item);
    LOGGER.trace("bestIndex: table={} notReady={}", table.getName(),
        Long.toHexString(notReady));

    // With no index and no constraint on the rowid, the only way to read the
    // table is a full scan. Cost 0 puts it first in the join order, where it
    // may make constraints on other tables usable.
    if (table.getIndexes().isEmpty()
        && TermIndex.find(conjuncts, handle, RexColumnRef.ROWID, 0,
            ROWID_USABLE) < 0
        && (orderBy == null
            || !SortCompatibility.rowidOrderMatches(maskSet, item, orderBy)
                .matches())) {
      return new AccessPath(0, null, 0, AccessPath.noShapes(), eqOps);
    }

    double lowestCost = BIG_COST;
    @Nullable IndexDescriptor bestIndex = null;
    int bestNEq = 0;
    Set<AccessShape> bestShapes = AccessPath.noShapes();

    final int rowidTerm =
        TermIndex.find(conjuncts, handle, RexColumnRef.ROWID, notReady,
            EQ_OR_IN);
    if (rowidTerm >= 0) {
      final Conjunct term = conjuncts.get(rowidTerm);
      bestShapes = EnumSet.of(AccessShape.ROWID_EQ);
      if (term.getKind() == SqlKind.EQUALS) {
        // A single row, so output is trivially sorted. Look no further.
        LOGGER.trace("... best is rowid");
        return new AccessPath(0, null, 1,
            EnumSet.of(AccessShape.ROWID_EQ, AccessShape.UNIQUE), eqOps);
      } else if (term.getExpr() instanceof RexSubQuery) {
        lowestCost = config.inSubQueryRowidCost();
      } else {
        final double n = ((RexCall) term.getExpr()).operands.size() - 1;
        lowestCost = n * estLog(n);
      }
      LOGGER.trace("... rowid IN cost: {}", lowestCost);
    }

    double cost = scanCost(table);
    LOGGER.trace("... table scan base cost: {}", cost);
    Set<AccessShape> shapes = EnumSet.of(AccessShape.ROWID_RANGE);
    if (TermIndex.find(conjuncts, handle, RexColumnRef.ROWID, notReady,
        RANGE) >= 0) {
      if (TermIndex.find(conjuncts, handle, RexColumnRef.ROWID, notReady,
          UPPER_BOUND) >= 0) {
        shapes.add(AccessShape.TOP_LIMIT);
        cost /= 3;
      }
      if (TermIndex.find(conjuncts, handle, RexColumnRef.ROWID, notReady,
          LOWER_BOUND) >= 0) {
        shapes.add(AccessShape.BTM_LIMIT);
        cost /= 3;
      }
      LOGGER.trace("... rowid range reduces cost to {}", cost);
    } else {
      shapes = AccessPath.noShapes();
    }
    if (orderBy != null) {
      final OrderMatch match =
          SortCompatibility.rowidOrderMatches(maskSet, item, orderBy);
      if (match.matches()) {
        shapes.add(AccessShape.ORDER_BY);
        shapes.add(AccessShape.ROWID_RANGE);
        if (match == OrderMatch.REVERSE) {
          shapes.add(AccessShape.REVERSE);
        }
      } else {
        cost += cost * estLog(cost);
        LOGGER.trace("... sorting increases cost to {}", cost);
      }
    }
    if (!(cost <= BIG_COST / 2)) {
      cost = BIG_COST / 2;
    }
    if (cost < lowestCost) {
      lowestCost = cost;
      bestShapes = shapes;
    }

    for (IndexDescriptor index : table.getIndexes()) {
      LOGGER.trace("... index {}:", index.getName());
      shapes = AccessPath.noShapes();
      double inMultiplier = 1;
      int nEq;
      for (nEq = 0; nEq < index.getColumnCount(); nEq++) {
        final int column = index.getColumn(nEq).column;
        final int t =
            TermIndex.find(conjuncts, item, column, notReady, eqOps, index);
        if (t < 0) {
          break;
        }
        shapes.add(AccessShape.COLUMN_EQ);
        final Conjunct term = conjuncts.get(t);
        if (term.getKind() == SqlKind.IN) {
          shapes.add(AccessShape.COLUMN_IN);
          if (term.getExpr() instanceof RexSubQuery) {
            inMultiplier *= config.inSubQueryMultiplier();
          } else {
            inMultiplier *= ((RexCall) term.getExpr()).operands.size();
          }
        }
      }
      cost = index.rowEstimate(nEq) * inMultiplier * estLog(inMultiplier);
      if (index.isUnique()
          && !shapes.contains(AccessShape.COLUMN_IN)
          && nEq == index.getColumnCount()) {
        shapes.add(AccessShape.UNIQUE);
      }
      LOGGER.trace("...... nEq={} inMult={} cost={}", nEq, inMultiplier,
          cost);

      if (nEq < index.getColumnCount()) {
        final int column = index.getColumn(nEq).column;
        if (TermIndex.find(conjuncts, item, column, notReady, RANGE,
            index) >= 0) {
          shapes.add(AccessShape.COLUMN_RANGE);
          if (TermIndex.find(conjuncts, item, column, notReady, UPPER_BOUND,
              index) >= 0) {
            shapes.add(AccessShape.TOP_LIMIT);
            cost /= 3;
          }
          if (TermIndex.find(conjuncts, item, column, notReady, LOWER_BOUND,
              index) >= 0) {
            shapes.add(AccessShape.BTM_LIMIT);
            cost /= 3;
          }
          LOGGER.trace("...... range reduces cost to {}", cost);
        }
      }

      if (orderBy != null) {
        final OrderMatch match = shapes.contains(AccessShape.COLUMN_IN)
            ? OrderMatch.NO_MATCH
            : SortCompatibility.indexOrderMatches(maskSet, index, item,
                orderBy, nEq);
        if (match.matches()) {
          if (shapes.isEmpty()) {
            shapes.add(AccessShape.COLUMN_RANGE);
          }
          shapes.add(AccessShape.ORDER_BY);
          if (match == OrderMatch.REVERSE) {
            shapes.add(AccessShape.REVERSE);
          }
        } else {
          cost += cost * estLog(cost);
          LOGGER.trace("...... orderby increases cost to {}", cost);
        }
      }

      if (!shapes.isEmpty() && index.covers(item.getColumnsUsed())) {
        shapes.add(AccessShape.INDEX_ONLY);
        cost /= 2;
        LOGGER.trace("...... idx-only reduces cost to {}", cost);
      }

      if (!shapes.isEmpty() && cost < lowestCost) {
        bestIndex = index;
        lowestCost = cost;
        bestShapes = shapes;
        bestNEq = nEq;
      }
    }

    final AccessPath path =
        new AccessPath(lowestCost, bestIndex, bestNEq, bestShapes, eqOps);
    LOGGER.trace("best index is {}", path);
    return path;
  }

  /** Returns the estimated number of rows in a table. */
  private double scanCost(TableDescriptor table) {
    final Double rowCount = table.getRowCount();
    if (rowCount != null) {
      return rowCount;
    }
    if (!table.getIndexes().isEmpty()) {
      return table.getIndexes().get(0).rowEstimate(0);
    }
    return config.defaultRowEstimate();
  }

  /**
   * Asks the advisor of a virtual table for the best way to read it.
   *
   * <p>The advisor sees every constraint on the table except IN and IS NULL,
   * each marked usable if its expression can be evaluated given the tables
   * already placed. It may only ask for the values of usable constraints.
   *
   * @param item          Virtual table
   * @param notReady      Tables not yet placed in the join order
   * @param orderBy       ORDER BY clause, or null
   * @param orderByUsable Whether the advisor may satisfy the ORDER BY at this
   *                      position
   *
   * @throws InvalidExternalPlanException if the advisor returns no advice,
   *   or uses a constraint that is not usable
   */
  public AccessPath bestAdvisedIndex(FromItem item, long notReady,
      @Nullable List<OrderByTerm> orderBy, boolean orderByUsable) {
    final TableDescriptor table = item.getTable();
    final IndexAdvisor advisor =
        requireNonNull(table.getAdvisor(), () -> table.getName() + " advisor");
    final AdvisorTemplate template =
        templates.computeIfAbsent(item.getHandle(),
            handle -> AdvisorTemplate.create(conjuncts, item, orderBy));

    final ImmutableList.Builder<IndexAdvisorRequest.Constraint> constraints =
        ImmutableList.builder();
    for (int i = 0; i < template.termOffsets.size(); i++) {
      final int offset = template.termOffsets.get(i);
      final Conjunct term = conjuncts.get(offset);
      constraints.add(
          new IndexAdvisorRequest.Constraint(term.getLeftColumn(),
              requireNonNull(term.getKind(), "kind"),
              (term.getRhsTables() & notReady) == 0, offset));
    }
    final IndexAdvisorRequest request =
        new IndexAdvisorRequest(constraints.build(),
            orderByUsable ? template.orderBy : ImmutableList.of());
    LOGGER.trace("bestAdvisedIndex: table={} request={}", table.getName(),
        request);

    final IndexAdvice advice = advisor.advise(request);
    if (advice == null
        || advice.getUsages().size() != request.getConstraints().size()) {
      throw new InvalidExternalPlanException(table.getName());
    }
    for (int i = 0; i < advice.getUsages().size(); i++) {
      final IndexAdvice.ConstraintUsage usage = advice.getUsages().get(i);
      if (!request.getConstraints().get(i).usable
          && (usage.argvIndex > 0 || usage.omit)) {
        throw new InvalidExternalPlanException(table.getName());
      }
    }

    double cost = advice.getEstimatedCost();
    if (!(cost <= BIG_COST / 2)) {
      cost = BIG_COST / 2;
    }
    final Set<AccessShape> shapes = EnumSet.of(AccessShape.VIRTUAL_TABLE);
    if (advice.isOrderByConsumed() && !request.getOrderBy().isEmpty()) {
      shapes.add(AccessShape.ORDER_BY);
    }
    final AccessPath path =
        new AccessPath(cost, null, 0, shapes, EnumSet.noneOf(SqlKind.class),
            request, advice);
    LOGGER.trace("advised {}", path);
    return path;
  }

  /** The parts of an advisor request that do not depend on the join
   * position. */
  private static class AdvisorTemplate {
    final ImmutableList<Integer> termOffsets;
    final ImmutableList<RelFieldCollation> orderBy;

    private AdvisorTemplate(ImmutableList<Integer> termOffsets,
        ImmutableList<RelFieldCollation> orderBy) {
      this.termOffsets = termOffsets;
      this.orderBy = orderBy;
    }

    static AdvisorTemplate create(ConjunctList conjuncts, FromItem item,
        @Nullable List<OrderByTerm> orderBy) {
      final ImmutableList.Builder<Integer> offsets = ImmutableList.builder();
      for (int i = 0; i < conjuncts.size(); i++) {
        final Conjunct term = conjuncts.get(i);
        if (term.getLeftTable() != item.getHandle()
            || term.getKind() == null
            || term.getKind() == SqlKind.IN
            || term.getKind() == SqlKind.IS_NULL) {
          continue;
        }
        offsets.add(i);
      }
      // The advisor can only sort on columns of its own table.
      final ImmutableList.Builder<RelFieldCollation> collations =
          ImmutableList.builder();
      if (orderBy != null) {
        for (OrderByTerm term : orderBy) {
          final RexColumnRef column = term.columnOf(item.getHandle());
          if (column == null) {
            return new AdvisorTemplate(offsets.build(), ImmutableList.of());
          }
          collations.add(
              new RelFieldCollation(column.getColumn(), term.direction));
        }
      }
      return new AdvisorTemplate(offsets.build(), collations.build());
    }
  }
}
