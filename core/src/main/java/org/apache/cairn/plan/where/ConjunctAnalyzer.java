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
import org.apache.cairn.plan.PlannerListener.Derivation;
import org.apache.cairn.rex.RexBuilder;
import org.apache.cairn.rex.RexCall;
import org.apache.cairn.rex.RexColumnRef;
import org.apache.cairn.rex.RexLiteral;
import org.apache.cairn.rex.RexNode;
import org.apache.cairn.rex.RexSubQuery;
import org.apache.cairn.rex.RexUtil;
import org.apache.cairn.sql.SqlCollation;
import org.apache.cairn.sql.SqlKind;
import org.apache.cairn.sql.type.SqlAffinity;
import org.apache.cairn.util.trace.CairnTrace;

import com.google.common.base.Ascii;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Analyzes the conjuncts of a WHERE clause to find those an index can use,
 * and derives additional conjuncts that make more access paths possible.
 *
 * <p>Analysis puts a conjunct of the form {@code column OP expression} (OP
 * one of {@link SqlKind#INDEXABLE}) into a form the cost model can look up;
 * a comparison between two columns is made available for either column by
 * adding a commuted copy. Derived conjuncts are flagged
 * {@link Conjunct.Flag#VIRTUAL}: they guide the choice of access path but the
 * executor never evaluates them. They are:
 *
 * <ul>
 *   <li>{@code x >= a} and {@code x <= b} for {@code x BETWEEN a AND b};
 *   <li>{@code x IN (a, b, c)} for {@code x = a OR x = b OR c = x};
 *   <li>{@code x >= 'ab'} and {@code x < 'ac'} for {@code x LIKE 'ab%'};
 *   <li>a {@link SqlKind#MATCH} constraint for {@code MATCH(q, x)}, which
 *   only a virtual table can use.
 * </ul>
 *
 * <p>A derived conjunct points to the conjunct it was derived from. If every
 * derived conjunct of a parent is enforced by the access path, so is the
 * parent.
 */
public class ConjunctAnalyzer {
  private static final Logger LOGGER = CairnTrace.getAnalyzerTracer();

  private static final Set<Conjunct.Flag> DERIVED =
      EnumSet.of(Conjunct.Flag.VIRTUAL, Conjunct.Flag.DYNAMIC);

  private final WherePlanner.Config config;
  private final RexBuilder rexBuilder;
  private final PlannerListener listener;

  public ConjunctAnalyzer(WherePlanner.Config config, RexBuilder rexBuilder,
      PlannerListener listener) {
    this.config = requireNonNull(config, "config");
    this.rexBuilder = requireNonNull(rexBuilder, "rexBuilder");
    this.listener = requireNonNull(listener, "listener");
  }

  /**
   * Analyzes every conjunct in a list.
   *
   * <p>Works from last to first; conjuncts appended during the pass are
   * analyzed by the call that appends them, if at all.
   */
  public void analyzeAll(ConjunctList list) {
    for (int i = list.size() - 1; i >= 0; i--) {
      analyze(list, i);
    }
  }

  /** Analyzes the conjunct at the given position of a list. */
  public void analyze(ConjunctList list, int index) {
    final TableMaskSet maskSet = list.getMaskSet();
    final Conjunct term = list.get(index);
    final RexNode expr = term.getExpr();
    final SqlKind kind = expr.getKind();
    final @Nullable RexCall call =
        expr instanceof RexCall ? (RexCall) expr : null;
    final long prereqLeft = call == null || call.operands.isEmpty()
        ? 0
        : TableUsage.of(maskSet, call.operand(0));
    term.rhsTables = call == null ? 0 : rightUsage(maskSet, call);
    long prereqAll = TableUsage.of(maskSet, expr);
    long extraRight = 0;
    if (term.isFromJoin()) {
      // The conjunct may not drive an index on any table left of the join.
      final long x = maskSet.maskOf(term.getRightJoinTable());
      prereqAll |= x;
      extraRight = x - 1;
    }
    term.allTables = prereqAll;
    term.leftTable = -1;
    term.parent = -1;
    term.kind = null;

    if (call != null
        && kind.belongsTo(SqlKind.INDEXABLE)
        && (term.rhsTables & prereqLeft) == 0) {
      final RexNode left = call.operand(0);
      if (left instanceof RexColumnRef) {
        setLeft(term, (RexColumnRef) left, kind);
      }
      if (kind.belongsTo(SqlKind.COMPARISON)
          && call.operand(1) instanceof RexColumnRef) {
        final RexCall commuted = RexUtil.commute(call);
        final Conjunct target;
        int copy = -1;
        if (term.leftTable >= 0) {
          copy = list.add(commuted, DERIVED, term.getRightJoinTable());
          target = list.get(copy);
          target.setCollation(term.getCollation());
          target.parent = index;
          term.liveChildren = 1;
          term.addFlag(Conjunct.Flag.COPIED);
        } else {
          term.setExpr(commuted);
          target = term;
        }
        setLeft(target, (RexColumnRef) commuted.operand(0),
            commuted.getKind());
        target.rhsTables = prereqLeft;
        target.allTables = prereqAll;
        if (copy >= 0) {
          derived(list, copy, Derivation.COMMUTE);
        }
      }
    } else if (call != null
        && kind == SqlKind.BETWEEN
        && list.getConnective() == SqlKind.AND
        && config.betweenRewrite()) {
      analyzeBetween(list, index, call);
    } else if (call != null
        && kind == SqlKind.OR
        && config.orRewrite()) {
      analyzeOr(list, index, call);
    }

    if (call != null
        && (kind == SqlKind.LIKE || kind == SqlKind.GLOB)
        && list.getConnective() == SqlKind.AND
        && config.likeRewrite()) {
      analyzeLike(list, index, call);
    }

    if (call != null && isMatchOfColumn(call)) {
      analyzeMatch(list, index, call);
    }

    term.rhsTables |= extraRight;
  }

  /** Returns the tables used by the operand(s) an index lookup would have to
   * evaluate. */
  private static long rightUsage(TableMaskSet maskSet, RexCall call) {
    switch (call.getKind()) {
    case IN:
      if (call instanceof RexSubQuery) {
        return TableUsage.of(maskSet, ((RexSubQuery) call).select);
      }
      return TableUsage.of(maskSet,
          call.operands.subList(1, call.operands.size()));
    case IS_NULL:
      return 0;
    default:
      if (call.isA(SqlKind.COMPARISON)) {
        return TableUsage.of(maskSet, call.operand(1));
      }
      return 0;
    }
  }

  private static void setLeft(Conjunct term, RexColumnRef column,
      SqlKind kind) {
    term.leftTable = column.getTableHandle();
    term.leftColumn = column.getColumn();
    term.kind = kind;
  }

  /** Adds {@code x >= a} and {@code x <= b} for {@code x BETWEEN a AND b}. */
  private void analyzeBetween(ConjunctList list, int index, RexCall between) {
    final Conjunct term = list.get(index);
    final SqlKind[] ops = {
        SqlKind.GREATER_THAN_OR_EQUAL, SqlKind.LESS_THAN_OR_EQUAL
    };
    for (int i = 0; i < ops.length; i++) {
      final RexNode bound =
          rexBuilder.makeCall(ops[i], between.operand(0),
              between.operand(i + 1));
      final int k = list.add(bound, DERIVED, term.getRightJoinTable());
      analyze(list, k);
      list.get(k).parent = index;
      derived(list, k, Derivation.BETWEEN);
    }
    term.liveChildren = 2;
  }

  /**
   * Attempts to convert an OR of equalities on the same column into an IN.
   *
   * <p>The disjuncts are split into a private list and analyzed there, so
   * that a disjunct {@code a = b} between two columns also offers its
   * commuted form. The rewrite is attempted for the column of the first
   * disjunct and, if that disjunct was commuted, for the column of the
   * second disjunct (which is then its commuted copy or the next original).
   * A disjunct qualifies if it is an equality on the column and the other
   * operand has no affinity or the column's affinity. A disjunct that does
   * not qualify is tolerated only if its copy qualifies, or it is a copy
   * whose original qualifies.
   */
  private void analyzeOr(ConjunctList list, int index, RexCall or) {
    final Conjunct term = list.get(index);
    final ConjunctList disjuncts = list.newSubList();
    ConjunctSplitter.split(or, SqlKind.OR, disjuncts,
        term.getRightJoinTable());
    analyzeAll(disjuncts);
    assert disjuncts.size() >= 2;

    boolean ok;
    int j = 0;
    do {
      final int table = disjuncts.get(j).leftTable;
      final int column = disjuncts.get(j).leftColumn;
      ok = table >= 0;
      for (int i = 0; i < disjuncts.size() && ok; i++) {
        final Conjunct disjunct = disjuncts.get(i);
        if (disjunct.kind != SqlKind.EQUALS) {
          return;
        }
        if (isOrCandidate(disjunct, table, column)) {
          disjunct.addFlag(Conjunct.Flag.OR_OK);
        } else if (hasOkDuplicate(disjuncts, disjunct)) {
          disjunct.removeFlag(Conjunct.Flag.OR_OK);
        } else {
          ok = false;
        }
      }
    } while (!ok
        && disjuncts.get(j++).hasFlag(Conjunct.Flag.COPIED)
        && j < 2);
    if (!ok) {
      return;
    }

    final List<RexNode> values = new ArrayList<>();
    @Nullable RexNode left = null;
    for (Conjunct disjunct : disjuncts) {
      if (!disjunct.hasFlag(Conjunct.Flag.OR_OK)) {
        continue;
      }
      final RexCall equals = (RexCall) disjunct.getExpr();
      values.add(equals.operand(1));
      left = equals.operand(0);
    }
    if (left == null) {
      return;
    }
    final int k =
        list.add(rexBuilder.makeIn(left, values), DERIVED,
            term.getRightJoinTable());
    analyze(list, k);
    list.get(k).parent = index;
    term.liveChildren = 1;
    derived(list, k, Derivation.OR_TO_IN);
  }

  private static boolean isOrCandidate(Conjunct disjunct, int table,
      int column) {
    if (disjunct.leftTable != table || disjunct.leftColumn != column) {
      return false;
    }
    final RexCall equals = (RexCall) disjunct.getExpr();
    final SqlAffinity rightAffinity = RexUtil.affinity(equals.operand(1));
    return rightAffinity == null
        || rightAffinity == RexUtil.affinity(equals.operand(0));
  }

  private static boolean hasOkDuplicate(ConjunctList disjuncts,
      Conjunct disjunct) {
    if (disjunct.hasFlag(Conjunct.Flag.COPIED)) {
      // The original of a pair; its copy comes later and has not been
      // examined yet.
      return true;
    }
    return disjunct.isVirtual()
        && disjunct.parent >= 0
        && disjuncts.get(disjunct.parent).hasFlag(Conjunct.Flag.OR_OK);
  }

  /**
   * Adds a range on the literal prefix of a LIKE or GLOB pattern: for
   * {@code x LIKE 'abc%'}, {@code x >= 'abc'} and {@code x < 'abd'}.
   *
   * <p>If the prefix is followed only by a single match-all wildcard the range
   * is equivalent to the pattern, and the pattern is enforced when the range
   * is.
   */
  private void analyzeLike(ConjunctList list, int index, RexCall like) {
    if (like.operands.size() != 2
        || !(like.operand(0) instanceof RexColumnRef)
        || !(like.operand(1) instanceof RexLiteral)
        || !((RexLiteral) like.operand(1)).isString()) {
      return;
    }
    final RexColumnRef column = (RexColumnRef) like.operand(0);
    final boolean noCase =
        like.getKind() == SqlKind.LIKE && !config.caseSensitiveLike();
    final SqlCollation collation = column.getCollation();
    if ((!collation.equals(SqlCollation.BINARY) || noCase)
        && (!collation.equals(SqlCollation.NOCASE) || !noCase)) {
      return;
    }
    final String wildcards = like.getKind() == SqlKind.LIKE ? "%_" : "*?[";
    final String pattern = ((RexLiteral) like.operand(1)).getStringValue();
    int cnt = 0;
    while (cnt < pattern.length()
        && wildcards.indexOf(pattern.charAt(cnt)) < 0) {
      cnt++;
    }
    if (cnt == 0 || pattern.charAt(cnt - 1) == Character.MAX_VALUE) {
      return;
    }
    boolean complete = cnt == pattern.length() - 1
        && pattern.charAt(cnt) == wildcards.charAt(0);
    final String prefix = pattern.substring(0, cnt);
    char c = prefix.charAt(cnt - 1);
    if (noCase) {
      if (c == '@') {
        complete = false;
      }
      c = Ascii.toLowerCase(c);
    }
    final String upper = prefix.substring(0, cnt - 1) + (char) (c + 1);

    final Conjunct term = list.get(index);
    final int k1 =
        list.add(
            rexBuilder.makeCall(SqlKind.GREATER_THAN_OR_EQUAL, column,
                rexBuilder.makeLiteral(prefix)),
            DERIVED, term.getRightJoinTable());
    analyze(list, k1);
    final int k2 =
        list.add(
            rexBuilder.makeCall(SqlKind.LESS_THAN, column,
                rexBuilder.makeLiteral(upper)),
            DERIVED, term.getRightJoinTable());
    analyze(list, k2);
    if (complete) {
      list.get(k1).parent = index;
      list.get(k2).parent = index;
      term.liveChildren = 2;
    }
    derived(list, k1, Derivation.LIKE_PREFIX);
    derived(list, k2, Derivation.LIKE_PREFIX);
  }

  private static boolean isMatchOfColumn(RexCall call) {
    return call.isFunction("match")
        && call.operands.size() == 2
        && call.operand(1) instanceof RexColumnRef;
  }

  /** Adds a {@link SqlKind#MATCH} constraint for {@code MATCH(q, x)}, which
   * an index advisor can use to drive a full-text lookup on {@code x}. */
  private void analyzeMatch(ConjunctList list, int index, RexCall match) {
    final TableMaskSet maskSet = list.getMaskSet();
    final RexNode query = match.operand(0);
    final RexColumnRef column = (RexColumnRef) match.operand(1);
    final long prereqQuery = TableUsage.of(maskSet, query);
    final long prereqColumn = TableUsage.of(maskSet, column);
    if ((prereqQuery & prereqColumn) != 0) {
      return;
    }
    final Conjunct term = list.get(index);
    final int k =
        list.add(rexBuilder.makeCall(SqlKind.MATCH, column, query), DERIVED,
            term.getRightJoinTable());
    final Conjunct constraint = list.get(k);
    constraint.rhsTables = prereqQuery;
    setLeft(constraint, column, SqlKind.MATCH);
    constraint.parent = index;
    constraint.allTables = term.allTables;
    term.liveChildren = 1;
    term.addFlag(Conjunct.Flag.COPIED);
    derived(list, k, Derivation.MATCH);
  }

  private void derived(ConjunctList list, int index, Derivation derivation) {
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("{} conjunct #{}: {}", derivation, index, list.get(index));
    }
    listener.conjunctDerived(
        new PlannerListener.ConjunctDerivedEvent(this, list, index,
            derivation));
  }

  /** Returns a description of the conjuncts of a list, one per line. */
  static String describe(ConjunctList list) {
    final StringBuilder sb = new StringBuilder();
    for (int i = 0; i < list.size(); i++) {
      sb.append('#').append(i).append(' ')
          .append(list.get(i)).append('\n');
    }
    return sb.toString();
  }
}
