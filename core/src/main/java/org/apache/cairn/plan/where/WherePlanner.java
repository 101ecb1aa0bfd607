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

import org.apache.cairn.config.CairnSystemProperty;
import org.apache.cairn.plan.LoggingPlannerListener;
import org.apache.cairn.plan.MulticastPlannerListener;
import org.apache.cairn.plan.PlannerListener;
import org.apache.cairn.rex.RexBuilder;
import org.apache.cairn.rex.RexNode;
import org.apache.cairn.rex.RexUtil;
import org.apache.cairn.runtime.TableLimitExceededException;
import org.apache.cairn.sql.SqlKind;
import org.apache.cairn.util.trace.CairnTrace;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.immutables.value.Value;
import org.slf4j.Logger;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/**
 * Plans the evaluation of a WHERE clause over the tables of a FROM list.
 *
 * <p>Planning proceeds in four phases:
 *
 * <ol>
 *   <li>The WHERE clause, followed by the ON clause of each FROM item, is
 *   split into conjuncts ({@link ConjunctSplitter}).
 *   <li>Each conjunct is analyzed, and further conjuncts derived from it
 *   ({@link ConjunctAnalyzer}).
 *   <li>A join order and an access path for each table are chosen
 *   ({@link JoinPlanner}, {@link CostModel}).
 *   <li>Conjuncts guaranteed by the access paths are marked enforced.
 * </ol>
 *
 * <p>A WherePlanner is immutable and can be shared between threads; the
 * state of a planning session lives only for the duration of a call to
 * {@link #plan}.
 *
 * <p>For example,
 *
 * <blockquote><pre>
 * WherePlanner planner = new WherePlanner(WherePlanner.Config.DEFAULT);
 * WherePlan plan = planner.plan(from, where, orderBy, EnumSet.noneOf(WhereOption.class));
 * System.out.println(plan.explain());</pre></blockquote>
 */
@Value.Enclosing
public class WherePlanner {
  private static final Logger LOGGER = CairnTrace.getPlannerTracer();

  private final Config config;
  private final RexBuilder rexBuilder;
  private final MulticastPlannerListener listener;

  /** Creates a WherePlanner that reports events to the planner tracer. */
  public WherePlanner(Config config) {
    this(config, ImmutableList.of(new LoggingPlannerListener()));
  }

  /** Creates a WherePlanner that reports events to the given listeners. */
  public WherePlanner(Config config, List<PlannerListener> listeners) {
    this.config = requireNonNull(config, "config");
    this.rexBuilder = new RexBuilder();
    this.listener = new MulticastPlannerListener();
    for (PlannerListener l : listeners) {
      this.listener.addListener(l);
    }
  }

  public Config getConfig() {
    return config;
  }

  /**
   * Plans a WHERE clause.
   *
   * @param from    FROM list, in the order written; each item has a distinct
   *                handle
   * @param where   WHERE clause, or null
   * @param orderBy ORDER BY clause, or null
   * @param options Options
   * @return Plan
   *
   * @throws TableLimitExceededException if there are more FROM items than
   *   {@link Config#maxTables()}
   * @throws org.apache.cairn.runtime.PlannerOutOfMemoryException if analysis
   *   creates more than {@link Config#maxConjuncts()} conjuncts
   * @throws org.apache.cairn.runtime.InvalidExternalPlanException if a
   *   virtual table's advisor returns an invalid plan
   */
  public WherePlan plan(List<FromItem> from, @Nullable RexNode where,
      @Nullable List<OrderByTerm> orderBy, Set<WhereOption> options) {
    final boolean onePassDesired =
        options.contains(WhereOption.ONE_PASS_DESIRED);
    checkArgument(!onePassDesired || from.size() == 1,
        "one-pass requires exactly one table: %s", from);
    if (from.size() > config.maxTables()) {
      throw new TableLimitExceededException(from.size(), config.maxTables());
    }

    final TableMaskSet maskSet = new TableMaskSet(config.maxTables());
    for (FromItem item : from) {
      maskSet.register(item.getHandle());
    }

    // A WHERE clause that does not depend on any row is evaluated once,
    // before the loops, and not split.
    final ConjunctList conjuncts =
        new ConjunctList(maskSet, config.maxConjuncts());
    @Nullable RexNode constantCondition = null;
    if (where != null && (from.isEmpty() || RexUtil.isConstant(where))) {
      constantCondition = where;
    } else {
      ConjunctSplitter.split(where, SqlKind.AND, conjuncts);
    }
    for (FromItem item : from) {
      ConjunctSplitter.split(item.getOn(), SqlKind.AND, conjuncts,
          item.isLeftJoinRight() ? item.getHandle() : -1);
    }

    new ConjunctAnalyzer(config, rexBuilder, listener).analyzeAll(conjuncts);
    if (LOGGER.isTraceEnabled()) {
      LOGGER.trace("Conjuncts:\n{}", ConjunctAnalyzer.describe(conjuncts));
    }

    final JoinPlanner joinPlanner =
        new JoinPlanner(new CostModel(config, conjuncts), conjuncts, listener);
    final JoinPlanner.JoinOrder order = joinPlanner.order(from, orderBy);
    List<AccessStep> steps = order.steps;
    boolean onePass = false;
    if (onePassDesired && order.unique) {
      // Rows are modified in place, so the table must be read.
      onePass = true;
      final AccessStep step = steps.get(0);
      final Set<AccessShape> shapes = EnumSet.copyOf(step.getShapes());
      shapes.remove(AccessShape.INDEX_ONLY);
      steps = ImmutableList.of(step.withShapes(shapes));
    }
    joinPlanner.enforce(steps);

    final WherePlan plan =
        new WherePlan(steps, conjuncts, constantCondition, order.unique,
            order.orderBySatisfied, onePass);
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Plan:\n{}", plan.explain());
    }
    return plan;
  }

  /** Configuration for {@link WherePlanner}.
   *
   * <p>The default value of each property comes from the corresponding
   * {@link CairnSystemProperty}. */
  @Value.Immutable
  public interface Config {
    /** Default configuration. */
    Config DEFAULT = ImmutableWherePlanner.Config.builder().build();

    /** Maximum number of tables in a FROM list, at most 64. */
    @Value.Default default int maxTables() {
      return CairnSystemProperty.MAX_TABLES.value();
    }

    /** Sets {@link #maxTables}. */
    Config withMaxTables(int maxTables);

    /** Maximum number of conjuncts, including derived ones. */
    @Value.Default default int maxConjuncts() {
      return CairnSystemProperty.MAX_CONJUNCTS.value();
    }

    /** Sets {@link #maxConjuncts}. */
    Config withMaxConjuncts(int maxConjuncts);

    /** Number of rows assumed for a table that has no row estimate and no
     * index. */
    @Value.Default default double defaultRowEstimate() {
      return CairnSystemProperty.DEFAULT_ROW_ESTIMATE.value();
    }

    /** Sets {@link #defaultRowEstimate}. */
    Config withDefaultRowEstimate(double defaultRowEstimate);

    /** Cost of a {@code rowid IN (SELECT ...)} lookup, whose number of rows
     * is unknown. */
    @Value.Default default double inSubQueryRowidCost() {
      return CairnSystemProperty.IN_SUB_QUERY_ROWID_COST.value();
    }

    /** Sets {@link #inSubQueryRowidCost}. */
    Config withInSubQueryRowidCost(double inSubQueryRowidCost);

    /** Number of values assumed for an {@code x IN (SELECT ...)} constraint
     * on an index column. */
    @Value.Default default double inSubQueryMultiplier() {
      return CairnSystemProperty.IN_SUB_QUERY_MULTIPLIER.value();
    }

    /** Sets {@link #inSubQueryMultiplier}. */
    Config withInSubQueryMultiplier(double inSubQueryMultiplier);

    /** Whether LIKE is case-sensitive; if false, only a NOCASE column can
     * use a LIKE prefix range. */
    @Value.Default default boolean caseSensitiveLike() {
      return CairnSystemProperty.CASE_SENSITIVE_LIKE.value();
    }

    /** Sets {@link #caseSensitiveLike}. */
    Config withCaseSensitiveLike(boolean caseSensitiveLike);

    /** Whether to derive an IN list from an OR of equalities. */
    @Value.Default default boolean orRewrite() {
      return CairnSystemProperty.OR_REWRITE.value();
    }

    /** Sets {@link #orRewrite}. */
    Config withOrRewrite(boolean orRewrite);

    /** Whether to derive a pair of ranges from a BETWEEN. */
    @Value.Default default boolean betweenRewrite() {
      return CairnSystemProperty.BETWEEN_REWRITE.value();
    }

    /** Sets {@link #betweenRewrite}. */
    Config withBetweenRewrite(boolean betweenRewrite);

    /** Whether to derive a range from the prefix of a LIKE or GLOB
     * pattern. */
    @Value.Default default boolean likeRewrite() {
      return CairnSystemProperty.LIKE_REWRITE.value();
    }

    /** Sets {@link #likeRewrite}. */
    Config withLikeRewrite(boolean likeRewrite);
  }
}
