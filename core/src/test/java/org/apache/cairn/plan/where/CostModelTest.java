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

import org.apache.cairn.rex.RexBuilder;
import org.apache.cairn.rex.RexColumnRef;
import org.apache.cairn.rex.RexNode;
import org.apache.cairn.runtime.InvalidExternalPlanException;
import org.apache.cairn.schema.IndexAdvice;
import org.apache.cairn.schema.IndexAdvisor;
import org.apache.cairn.schema.IndexAdvisorRequest;
import org.apache.cairn.schema.IndexDescriptor;
import org.apache.cairn.schema.TableDescriptor;
import org.apache.cairn.sql.JoinType;
import org.apache.cairn.sql.SqlKind;
import org.apache.cairn.sql.type.SqlAffinity;
import org.apache.cairn.test.MockCatalog;
import org.apache.cairn.test.RecordingPlannerListener;
import org.apache.cairn.util.ImmutableBitSet;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;

import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit test for {@link CostModel}.
 */
class CostModelTest {
  private final MockCatalog catalog = new MockCatalog();
  private final RexBuilder rexBuilder = catalog.rexBuilder;

  /** Analyzes a WHERE clause over some tables and returns a cost model. */
  private static CostModel costModel(MockCatalog catalog,
      List<FromItem> from, @Nullable RexNode where) {
    final TableMaskSet maskSet = new TableMaskSet(8);
    for (FromItem item : from) {
      maskSet.register(item.getHandle());
    }
    final ConjunctList list = new ConjunctList(maskSet, 100);
    ConjunctSplitter.split(where, SqlKind.AND, list);
    new ConjunctAnalyzer(WherePlanner.Config.DEFAULT, catalog.rexBuilder,
        new RecordingPlannerListener()).analyzeAll(list);
    return new CostModel(WherePlanner.Config.DEFAULT, list);
  }

  private AccessPath bestIndex(FromItem item, @Nullable RexNode where) {
    return bestIndex(item, where, null);
  }

  private AccessPath bestIndex(FromItem item, @Nullable RexNode where,
      @Nullable List<OrderByTerm> orderBy) {
    return costModel(catalog, ImmutableList.of(item), where)
        .bestIndex(item, -1L, orderBy);
  }

  @Test void testEstLog() {
    assertThat(CostModel.estLog(0), is(1d));
    assertThat(CostModel.estLog(10), is(1d));
    assertThat(CostModel.estLog(11), is(2d));
    assertThat(CostModel.estLog(100), is(2d));
    assertThat(CostModel.estLog(1_000_000), is(6d));
    assertThat(CostModel.estLog(1_000_001), is(7d));
  }

  /** A table with no index and no usable constraint goes first. */
  @Test void testNoIndexNoConstraint() {
    final FromItem dept = catalog.item(catalog.dept);
    final AccessPath path =
        bestIndex(dept,
            catalog.eq(catalog.ref(dept, "DNAME"), catalog.literal("x")));
    assertThat(path.getCost(), is(0d));
    assertThat(path.getIndex(), nullValue());
    assertThat(path.getShapes().isEmpty(), is(true));
    assertThat(path.isFullScan(), is(true));
  }

  @Test void testRowidEquals() {
    final FromItem t = catalog.item(catalog.t);
    final AccessPath path =
        bestIndex(t, catalog.eq(catalog.ref(t, "ID"), catalog.literal(5)));
    assertThat(path.getCost(), is(0d));
    assertThat(path.getEqColumnCount(), is(1));
    assertThat(path.getShapes(),
        is(EnumSet.of(AccessShape.ROWID_EQ, AccessShape.UNIQUE)));
  }

  @Test void testRowidIn() {
    final FromItem t = catalog.item(catalog.t);
    final AccessPath path =
        bestIndex(t,
            rexBuilder.makeIn(catalog.ref(t, "ID"), catalog.literal(1),
                catalog.literal(2), catalog.literal(3)));
    assertThat(path.getCost(), is(3d));
    assertThat(path.getShapes(), is(EnumSet.of(AccessShape.ROWID_EQ)));
  }

  @Test void testRowidRange() {
    final FromItem t = catalog.item(catalog.t);
    final RexColumnRef id = catalog.ref(t, "ID");
    final AccessPath path =
        bestIndex(t,
            catalog.and(catalog.gt(id, catalog.literal(5)),
                catalog.lt(id, catalog.literal(10))));
    assertThat(path.getCost(), closeTo(1_000_000d / 9, 1e-6));
    assertThat(path.getShapes(),
        is(
            EnumSet.of(AccessShape.ROWID_RANGE, AccessShape.TOP_LIMIT,
                AccessShape.BTM_LIMIT)));

    final AccessPath path2 =
        bestIndex(t, catalog.lt(id, catalog.literal(10)));
    assertThat(path2.getCost(), closeTo(1_000_000d / 3, 1e-6));
    assertThat(path2.has(AccessShape.BTM_LIMIT), is(false));
  }

  @Test void testRowCount() {
    final TableDescriptor table =
        TableDescriptor.builder("SMALL")
            .column("ID", SqlAffinity.INTEGER).rowidAlias()
            .rowCount(300d)
            .build();
    final FromItem item = catalog.item(table);
    final AccessPath path =
        bestIndex(item, catalog.gt(catalog.ref(item, "ID"), catalog.literal(0)));
    assertThat(path.getCost(), is(100d));
  }

  @Test void testIndexEquals() {
    final FromItem emp = catalog.item(catalog.emp);
    final AccessPath path =
        bestIndex(emp,
            catalog.eq(catalog.ref(emp, "DEPTNO"), catalog.literal(10)));
    assertThat(path.getIndex().getName(), is("EMP_DEPTNO"));
    assertThat(path.getEqColumnCount(), is(1));
    assertThat(path.getCost(), is(10d));
    assertThat(path.getShapes(), is(EnumSet.of(AccessShape.COLUMN_EQ)));
  }

  /** An index that holds every column the query needs halves the cost. */
  @Test void testCoveringIndex() {
    final FromItem emp =
        catalog.item(catalog.emp).withColumnsUsed(ImmutableBitSet.of(2));
    final AccessPath path =
        bestIndex(emp,
            catalog.eq(catalog.ref(emp, "DEPTNO"), catalog.literal(10)));
    assertThat(path.getCost(), is(5d));
    assertThat(path.has(AccessShape.INDEX_ONLY), is(true));
  }

  @Test void testUniqueIndex() {
    final FromItem emp = catalog.item(catalog.emp);
    final AccessPath path =
        bestIndex(emp,
            catalog.eq(catalog.ref(emp, "ENAME"), catalog.literal("Bob")));
    assertThat(path.getIndex().getName(), is("EMP_ENAME"));
    assertThat(path.getCost(), is(1d));
    assertThat(path.getShapes(),
        is(EnumSet.of(AccessShape.COLUMN_EQ, AccessShape.UNIQUE)));
  }

  /** An IN list multiplies the cost by the number of operands, and a
   * unique index probed by IN may return several rows. */
  @Test void testIndexIn() {
    final FromItem emp = catalog.item(catalog.emp);
    final AccessPath path =
        bestIndex(emp,
            rexBuilder.makeIn(catalog.ref(emp, "DEPTNO"), catalog.literal(1),
                catalog.literal(2)));
    assertThat(path.getCost(), is(30d));
    assertThat(path.getShapes(),
        is(EnumSet.of(AccessShape.COLUMN_EQ, AccessShape.COLUMN_IN)));

    final AccessPath path2 =
        bestIndex(emp,
            rexBuilder.makeIn(catalog.ref(emp, "ENAME"), catalog.literal("a"),
                catalog.literal("b")));
    assertThat(path2.has(AccessShape.UNIQUE), is(false));
  }

  /** Of two equally good indexes, the first is chosen. */
  @Test void testTieKeepsFirst() {
    final TableDescriptor table =
        TableDescriptor.builder("TWIN")
            .column("A", SqlAffinity.INTEGER)
            .column("B", SqlAffinity.INTEGER)
            .index(IndexDescriptor.of("TWIN_A1", false, 0))
            .index(IndexDescriptor.of("TWIN_A2", false, 0))
            .build();
    final FromItem item = catalog.item(table);
    final AccessPath path =
        bestIndex(item, catalog.eq(catalog.ref(item, "A"), catalog.literal(1)));
    assertThat(path.getIndex().getName(), is("TWIN_A1"));
  }

  /** On the right-hand side of a LEFT JOIN, IS NULL cannot use an index:
   * the join generates NULLs that the index does not contain. */
  @Test void testIsNullLeftJoin() {
    final FromItem emp = catalog.item(catalog.emp);
    final RexNode isNull = rexBuilder.makeIsNull(catalog.ref(emp, "DEPTNO"));
    final AccessPath inner = bestIndex(emp, isNull);
    assertThat(inner.getIndex().getName(), is("EMP_DEPTNO"));
    assertThat(inner.getEqOps().contains(SqlKind.IS_NULL), is(true));

    final AccessPath left =
        bestIndex(emp.withJoinType(JoinType.LEFT), isNull);
    assertThat(left.getIndex(), nullValue());
    assertThat(left.getCost(), is(1_000_000d));
    assertThat(left.getEqOps().contains(SqlKind.IS_NULL), is(false));
  }

  @Test void testOrderByIndex() {
    final FromItem emp = catalog.item(catalog.emp);
    final RexColumnRef ename = catalog.ref(emp, "ENAME");
    final AccessPath path =
        bestIndex(emp, null, ImmutableList.of(MockCatalog.asc(ename)));
    assertThat(path.getIndex().getName(), is("EMP_ENAME"));
    assertThat(path.getCost(), is(1_000_000d));
    assertThat(path.getShapes(),
        is(EnumSet.of(AccessShape.COLUMN_RANGE, AccessShape.ORDER_BY)));

    final AccessPath reverse =
        bestIndex(emp, null, ImmutableList.of(MockCatalog.desc(ename)));
    assertThat(reverse.has(AccessShape.REVERSE), is(true));
  }

  /** If nothing provides the order, every path pays for a sort. */
  @Test void testOrderBySort() {
    final FromItem emp = catalog.item(catalog.emp);
    final AccessPath path =
        bestIndex(emp, null,
            ImmutableList.of(MockCatalog.asc(catalog.ref(emp, "MGR"))));
    assertThat(path.getIndex(), nullValue());
    assertThat(path.getCost(), is(7_000_000d));
    assertThat(path.has(AccessShape.ORDER_BY), is(false));
  }

  @Test void testOrderByRowid() {
    final FromItem t = catalog.item(catalog.t);
    final AccessPath path =
        bestIndex(t, null,
            ImmutableList.of(MockCatalog.desc(catalog.ref(t, "ID"))));
    assertThat(path.getShapes(),
        is(
            EnumSet.of(AccessShape.ROWID_RANGE, AccessShape.ORDER_BY,
                AccessShape.REVERSE)));
  }

  @Test void testAdvisorRequest() {
    final List<IndexAdvisorRequest> requests = new ArrayList<>();
    final IndexAdvisor advisor = request -> {
      requests.add(request);
      return new IndexAdvice(10, 1, "fts",
          ImmutableList.of(IndexAdvice.ConstraintUsage.UNUSED,
              new IndexAdvice.ConstraintUsage(1, true)),
          true);
    };
    final FromItem docs =
        catalog.item(MockCatalog.virtualTable("DOCS", advisor));
    final FromItem emp = catalog.item(catalog.emp);
    final RexNode where =
        catalog.and(
            rexBuilder.makeFunction("match", catalog.literal("q"),
                catalog.ref(docs, "BODY")),
            catalog.eq(catalog.ref(docs, "TITLE"), catalog.ref(emp, "ENAME")));
    final CostModel costModel =
        costModel(catalog, ImmutableList.of(docs, emp), where);
    final List<OrderByTerm> orderBy =
        ImmutableList.of(MockCatalog.asc(catalog.ref(docs, "TITLE")));
    final AccessPath path =
        costModel.bestAdvisedIndex(docs, -1L, orderBy, true);

    assertThat(requests.size(), is(1));
    final IndexAdvisorRequest request = requests.get(0);
    assertThat(request.getConstraints().size(), is(2));
    // TITLE = EMP.ENAME; EMP is not ready.
    assertThat(request.getConstraints().get(0).column, is(1));
    assertThat(request.getConstraints().get(0).op, is(SqlKind.EQUALS));
    assertThat(request.getConstraints().get(0).usable, is(false));
    // MATCH on BODY
    assertThat(request.getConstraints().get(1).column, is(0));
    assertThat(request.getConstraints().get(1).op, is(SqlKind.MATCH));
    assertThat(request.getConstraints().get(1).usable, is(true));
    assertThat(request.getOrderBy().size(), is(1));
    assertThat(request.getOrderBy().get(0).getFieldIndex(), is(1));

    assertThat(path.getCost(), is(10d));
    assertThat(path.getShapes(),
        is(EnumSet.of(AccessShape.VIRTUAL_TABLE, AccessShape.ORDER_BY)));
    assertThat(path.getAdvice().getIdxStr(), is("fts"));

    // Once EMP is placed, the join constraint is usable; away from the first
    // position, the ORDER BY is not offered.
    final AccessPath path2 =
        costModel.bestAdvisedIndex(docs, 1L, orderBy, false);
    assertThat(requests.get(1).getConstraints().get(0).usable, is(true));
    assertThat(requests.get(1).getOrderBy().isEmpty(), is(true));
    assertThat(path2.has(AccessShape.ORDER_BY), is(false));
  }

  @Test void testAdvisorCostClamped() {
    final FromItem docs =
        catalog.item(
            MockCatalog.virtualTable("DOCS",
                request -> IndexAdvice.fullScan(request, Double.NaN)));
    final AccessPath path =
        costModel(catalog, ImmutableList.of(docs), null)
            .bestAdvisedIndex(docs, -1L, null, true);
    assertThat(path.getCost(), is(AccessPath.BIG_COST / 2));

    final FromItem docs2 =
        catalog.item(
            MockCatalog.virtualTable("DOCS2",
                request -> IndexAdvice.fullScan(request,
                    Double.POSITIVE_INFINITY)));
    assertThat(
        costModel(catalog, ImmutableList.of(docs2), null)
            .bestAdvisedIndex(docs2, -1L, null, true).getCost(),
        is(AccessPath.BIG_COST / 2));
  }

  /** The advisor may not ask for the value of a constraint that is not
   * usable. */
  @Test void testAdvisorUsesUnusableConstraint() {
    final FromItem docs =
        catalog.item(
            MockCatalog.virtualTable("DOCS",
                request -> new IndexAdvice(1, 0, null,
                    ImmutableList.of(new IndexAdvice.ConstraintUsage(1, false)),
                    false)));
    final FromItem emp = catalog.item(catalog.emp);
    final RexNode where =
        catalog.eq(catalog.ref(docs, "TITLE"), catalog.ref(emp, "ENAME"));
    final CostModel costModel =
        costModel(catalog, ImmutableList.of(docs, emp), where);
    final InvalidExternalPlanException e =
        assertThrows(InvalidExternalPlanException.class,
            () -> costModel.bestAdvisedIndex(docs, -1L, null, true));
    assertThat(e.getTableName(), is("DOCS"));
    assertThat(e.getMessage(),
        is("table DOCS: index advisor returned an invalid plan"));
  }

  /** Nor may it take over the evaluation of a constraint that is not
   * usable, even one it does not ask the value of. */
  @Test void testAdvisorOmitsUnusableConstraint() {
    final FromItem docs =
        catalog.item(
            MockCatalog.virtualTable("DOCS",
                request -> new IndexAdvice(1, 0, null,
                    ImmutableList.of(new IndexAdvice.ConstraintUsage(0, true)),
                    false)));
    final FromItem emp = catalog.item(catalog.emp);
    final RexNode where =
        catalog.eq(catalog.ref(docs, "TITLE"), catalog.ref(emp, "MGR"));
    final CostModel costModel =
        costModel(catalog, ImmutableList.of(docs, emp), where);
    assertThrows(InvalidExternalPlanException.class,
        () -> costModel.bestAdvisedIndex(docs, -1L, null, true));

    // Once EMP is placed the constraint is usable, and the usage is valid.
    final AccessPath path = costModel.bestAdvisedIndex(docs, 1L, null, true);
    assertThat(path.has(AccessShape.VIRTUAL_TABLE), is(true));
  }

  @Test void testAdvisorReturnsWrongUsages() {
    final FromItem docs =
        catalog.item(
            MockCatalog.virtualTable("DOCS",
                request -> new IndexAdvice(1, 0, null, ImmutableList.of(),
                    false)));
    final RexNode where =
        catalog.eq(catalog.ref(docs, "TITLE"), catalog.literal("x"));
    final CostModel costModel =
        costModel(catalog, ImmutableList.of(docs), where);
    assertThrows(InvalidExternalPlanException.class,
        () -> costModel.bestAdvisedIndex(docs, -1L, null, true));
  }

  @Test void testAdvisorReturnsNull() {
    final FromItem docs =
        catalog.item(MockCatalog.virtualTable("DOCS", request -> null));
    final CostModel costModel =
        costModel(catalog, ImmutableList.of(docs), null);
    assertThrows(InvalidExternalPlanException.class,
        () -> costModel.bestAdvisedIndex(docs, -1L, null, true));
  }
}
