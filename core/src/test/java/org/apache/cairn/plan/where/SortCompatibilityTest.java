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

import org.apache.cairn.schema.IndexDescriptor;
import org.apache.cairn.schema.TableDescriptor;
import org.apache.cairn.sql.SqlCollation;
import org.apache.cairn.sql.type.SqlAffinity;
import org.apache.cairn.test.MockCatalog;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.apache.cairn.test.MockCatalog.asc;
import static org.apache.cairn.test.MockCatalog.desc;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

/**
 * Unit test for {@link SortCompatibility}.
 */
class SortCompatibilityTest {
  private final MockCatalog catalog = new MockCatalog();
  private final FromItem emp = catalog.item(catalog.emp);
  private final FromItem dept = catalog.item(catalog.dept);
  private final FromItem t = catalog.item(catalog.t);
  private final TableMaskSet maskSet = new TableMaskSet(8);
  private final IndexDescriptor empDeptno = catalog.emp.getIndexes().get(0);
  private final IndexDescriptor empEname = catalog.emp.getIndexes().get(1);
  private final IndexDescriptor empJobSal = catalog.emp.getIndexes().get(2);

  SortCompatibilityTest() {
    maskSet.register(emp.getHandle());
    maskSet.register(dept.getHandle());
    maskSet.register(t.getHandle());
  }

  private OrderMatch check(IndexDescriptor index, FromItem item,
      List<OrderByTerm> orderBy, int nEq) {
    return SortCompatibility.indexOrderMatches(maskSet, index, item, orderBy,
        nEq);
  }

  @Test void testIndexColumns() {
    final List<OrderByTerm> orderBy =
        ImmutableList.of(asc(catalog.ref(emp, "JOB")),
            asc(catalog.ref(emp, "SAL")));
    assertThat(check(empJobSal, emp, orderBy, 0), is(OrderMatch.FORWARD));
    assertThat(check(empDeptno, emp, orderBy, 0), is(OrderMatch.NO_MATCH));
  }

  @Test void testDirections() {
    assertThat(
        check(empJobSal, emp,
            ImmutableList.of(desc(catalog.ref(emp, "JOB")),
                desc(catalog.ref(emp, "SAL"))), 0),
        is(OrderMatch.REVERSE));
    assertThat(
        check(empJobSal, emp,
            ImmutableList.of(asc(catalog.ref(emp, "JOB")),
                desc(catalog.ref(emp, "SAL"))), 0),
        is(OrderMatch.NO_MATCH));
  }

  /** A column fixed by an equality constraint may be skipped. */
  @Test void testSkipEqualityColumn() {
    final List<OrderByTerm> orderBy =
        ImmutableList.of(desc(catalog.ref(emp, "SAL")));
    assertThat(check(empJobSal, emp, orderBy, 1), is(OrderMatch.REVERSE));
    assertThat(check(empJobSal, emp, orderBy, 0), is(OrderMatch.NO_MATCH));
  }

  /** Every index ends with the rowid. */
  @Test void testTrailingRowid() {
    final List<OrderByTerm> orderBy =
        ImmutableList.of(asc(catalog.ref(emp, "DEPTNO")),
            asc(catalog.ref(emp, "EMPNO")),
            asc(catalog.ref(emp, "SAL")));
    assertThat(check(empDeptno, emp, orderBy, 0), is(OrderMatch.FORWARD));
  }

  /** Once all columns of a unique index have matched, later terms on the
   * same table do not matter, but terms on other tables do. */
  @Test void testUniqueIndex() {
    assertThat(
        check(empEname, emp,
            ImmutableList.of(asc(catalog.ref(emp, "ENAME")),
                asc(catalog.ref(emp, "SAL"))), 0),
        is(OrderMatch.FORWARD));
    assertThat(
        check(empDeptno, emp,
            ImmutableList.of(asc(catalog.ref(emp, "DEPTNO")),
                asc(catalog.ref(emp, "SAL"))), 0),
        is(OrderMatch.NO_MATCH));
    assertThat(
        check(empEname, emp,
            ImmutableList.of(asc(catalog.ref(emp, "ENAME")),
                asc(catalog.ref(dept, "DNAME"))), 0),
        is(OrderMatch.NO_MATCH));
  }

  /** An index column that aliases the rowid matches a rowid term, and
   * nothing after it matters. */
  @Test void testRowidAliasColumn() {
    final TableDescriptor table =
        TableDescriptor.builder("R")
            .column("ID", SqlAffinity.INTEGER).rowidAlias()
            .column("V", SqlAffinity.INTEGER)
            .index(IndexDescriptor.of("R_ID", false, 0))
            .build();
    final FromItem r = catalog.item(table);
    maskSet.register(r.getHandle());
    final IndexDescriptor index = table.getIndexes().get(0);
    assertThat(
        check(index, r,
            ImmutableList.of(asc(catalog.ref(r, "ID")),
                desc(catalog.ref(r, "V"))), 0),
        is(OrderMatch.FORWARD));
  }

  @Test void testCollationMismatch() {
    final TableDescriptor table =
        TableDescriptor.builder("P")
            .column("NAME", SqlAffinity.TEXT, SqlCollation.NOCASE)
            .index(IndexDescriptor.of("P_NAME", false, 0))
            .build();
    final FromItem p = catalog.item(table);
    assertThat(
        check(table.getIndexes().get(0), p,
            ImmutableList.of(asc(catalog.ref(p, "NAME"))), 0),
        is(OrderMatch.NO_MATCH));
  }

  @Test void testExpression() {
    assertThat(
        check(empEname, emp, ImmutableList.of(asc(catalog.literal(1))), 0),
        is(OrderMatch.NO_MATCH));
  }

  @Test void testRowidOrder() {
    assertThat(
        SortCompatibility.rowidOrderMatches(maskSet, t,
            ImmutableList.of(desc(catalog.ref(t, "ID")))),
        is(OrderMatch.REVERSE));
    assertThat(
        SortCompatibility.rowidOrderMatches(maskSet, t,
            ImmutableList.of(asc(catalog.ref(t, "ID")),
                desc(catalog.ref(t, "V")))),
        is(OrderMatch.FORWARD));
    assertThat(
        SortCompatibility.rowidOrderMatches(maskSet, t,
            ImmutableList.of(asc(catalog.ref(t, "ID")),
                asc(catalog.ref(dept, "DNAME")))),
        is(OrderMatch.NO_MATCH));
    assertThat(
        SortCompatibility.rowidOrderMatches(maskSet, t,
            ImmutableList.of(asc(catalog.ref(t, "V")))),
        is(OrderMatch.NO_MATCH));
    assertThat(
        SortCompatibility.rowidOrderMatches(maskSet, t, ImmutableList.of()),
        is(OrderMatch.NO_MATCH));
  }
}
