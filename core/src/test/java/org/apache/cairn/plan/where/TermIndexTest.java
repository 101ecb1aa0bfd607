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
import org.apache.cairn.schema.IndexDescriptor;
import org.apache.cairn.sql.SqlKind;
import org.apache.cairn.test.MockCatalog;
import org.apache.cairn.test.RecordingPlannerListener;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

/**
 * Unit test for {@link TermIndex}.
 */
class TermIndexTest {
  private static final Set<SqlKind> EQ = EnumSet.of(SqlKind.EQUALS);

  private final MockCatalog catalog = new MockCatalog();
  private final FromItem emp = catalog.item(catalog.emp);
  private final FromItem dept = catalog.item(catalog.dept);
  private final IndexDescriptor empEname = catalog.emp.getIndexes().get(1);
  private final IndexDescriptor empJobSal = catalog.emp.getIndexes().get(2);

  private ConjunctList analyze(RexNode where) {
    final TableMaskSet maskSet = new TableMaskSet(4);
    maskSet.register(emp.getHandle());
    maskSet.register(dept.getHandle());
    final ConjunctList list = new ConjunctList(maskSet, 100);
    ConjunctSplitter.split(where, SqlKind.AND, list);
    new ConjunctAnalyzer(WherePlanner.Config.DEFAULT, catalog.rexBuilder,
        new RecordingPlannerListener()).analyzeAll(list);
    return list;
  }

  @Test void testFindByOperator() {
    final ConjunctList list =
        analyze(
            catalog.and(
                catalog.gt(catalog.ref(emp, "SAL"), catalog.literal(1)),
                catalog.eq(catalog.ref(emp, "DEPTNO"), catalog.literal(10))));
    final int handle = emp.getHandle();
    assertThat(TermIndex.find(list, handle, 2, -1L, EQ), is(1));
    assertThat(TermIndex.find(list, handle, 2, -1L, CostModel.RANGE), is(-1));
    assertThat(TermIndex.find(list, handle, 4, -1L, CostModel.RANGE), is(0));
    assertThat(TermIndex.find(list, handle, 4, -1L, CostModel.UPPER_BOUND),
        is(-1));
    assertThat(TermIndex.find(list, dept.getHandle(), 2, -1L, EQ), is(-1));
  }

  /** A conjunct can only be used once the tables its right-hand side
   * refers to have been placed. */
  @Test void testNotReady() {
    final ConjunctList list =
        analyze(catalog.eq(catalog.ref(emp, "MGR"), catalog.ref(dept, "DEPTNO")));
    final long deptMask = list.getMaskSet().maskOf(dept.getHandle());
    final long empMask = list.getMaskSet().maskOf(emp.getHandle());
    assertThat(TermIndex.find(list, emp.getHandle(), 5, deptMask, EQ), is(-1));
    assertThat(TermIndex.find(list, emp.getHandle(), 5, empMask, EQ), is(0));
    assertThat(
        TermIndex.find(list, dept.getHandle(), RexColumnRef.ROWID, empMask,
            EQ),
        is(-1));
    assertThat(
        TermIndex.find(list, dept.getHandle(), RexColumnRef.ROWID, deptMask,
            EQ),
        is(1));
  }

  /** A comparison performed with numeric affinity cannot use an index on a
   * text column. */
  @Test void testAffinity() {
    final ConjunctList list =
        analyze(
            catalog.eq(catalog.ref(emp, "ENAME"), catalog.ref(dept, "DEPTNO")));
    assertThat(TermIndex.find(list, emp.getHandle(), 1, 0L, EQ), is(0));
    assertThat(TermIndex.find(list, emp, 1, 0L, EQ, empEname), is(-1));

    final ConjunctList list2 =
        analyze(catalog.eq(catalog.ref(emp, "ENAME"), catalog.literal(7)));
    assertThat(TermIndex.find(list2, emp, 1, 0L, EQ, empEname), is(0));
  }

  /** A conjunct must compare with the collation of the index column. */
  @Test void testCollation() {
    final ConjunctList list =
        analyze(
            catalog.and(
                catalog.eq(catalog.ref(dept, "DNAME"), catalog.ref(emp, "JOB")),
                catalog.eq(catalog.ref(emp, "JOB"), catalog.literal("x"))));
    // #2 is "EMP.JOB = DEPT.DNAME", which compares with DNAME's collation,
    // BINARY; the index on JOB is NOCASE.
    assertThat(list.get(2).getLeftColumn(), is(3));
    assertThat(TermIndex.find(list, emp.getHandle(), 3, 0L, EQ), is(1));
    assertThat(TermIndex.find(list, emp, 3, 0L, EQ, empJobSal), is(1));

    final ConjunctList list2 =
        analyze(
            catalog.eq(catalog.ref(dept, "DNAME"), catalog.ref(emp, "JOB")));
    assertThat(TermIndex.find(list2, emp.getHandle(), 3, 0L, EQ), is(1));
    assertThat(TermIndex.find(list2, emp, 3, 0L, EQ, empJobSal), is(-1));
  }

  /** IS NULL is not subject to affinity and collation checks. */
  @Test void testIsNull() {
    final ConjunctList list =
        analyze(catalog.rexBuilder.makeIsNull(catalog.ref(emp, "JOB")));
    assertThat(
        TermIndex.find(list, emp, 3, -1L, EnumSet.of(SqlKind.IS_NULL),
            empJobSal),
        is(0));
  }
}
