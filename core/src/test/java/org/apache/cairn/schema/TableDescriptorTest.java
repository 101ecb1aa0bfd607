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

import org.apache.cairn.rex.RexColumnRef;
import org.apache.cairn.sql.SqlCollation;
import org.apache.cairn.sql.type.SqlAffinity;
import org.apache.cairn.test.MockCatalog;
import org.apache.cairn.util.ImmutableBitSet;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit test for {@link TableDescriptor} and {@link IndexDescriptor}.
 */
class TableDescriptorTest {
  @Test void testDefaultRowEstimates() {
    assertThat(IndexDescriptor.defaultRowEstimates(1, false),
        is(ImmutableList.of(1_000_000L, 10L)));
    assertThat(IndexDescriptor.defaultRowEstimates(6, false),
        is(ImmutableList.of(1_000_000L, 10L, 9L, 8L, 7L, 5L, 5L)));
    assertThat(IndexDescriptor.defaultRowEstimates(2, true),
        is(ImmutableList.of(1_000_000L, 10L, 1L)));
  }

  @Test void testRowEstimatesMustMatchColumns() {
    assertThrows(IllegalArgumentException.class,
        () -> new IndexDescriptor("I",
            ImmutableList.of(IndexDescriptor.Column.of(0)), false,
            ImmutableList.of(100L)));
    final IndexDescriptor index =
        new IndexDescriptor("I", ImmutableList.of(IndexDescriptor.Column.of(0)),
            false, ImmutableList.of(100L, 3L));
    assertThat(index.rowEstimate(1), is(3L));
  }

  @Test void testCovers() {
    final IndexDescriptor index = IndexDescriptor.of("I", false, 1, 3);
    assertThat(index.covers(ImmutableBitSet.of(3)), is(true));
    assertThat(index.covers(ImmutableBitSet.of(1, 3)), is(true));
    assertThat(index.covers(ImmutableBitSet.of(1, 2)), is(false));
    assertThat(index.covers(ImmutableBitSet.of()), is(true));
  }

  @Test void testRowid() {
    final TableDescriptor emp = new MockCatalog().emp;
    assertThat(emp.getRowidAlias(), is(0));
    assertThat(emp.affinity(RexColumnRef.ROWID), is(SqlAffinity.INTEGER));
    assertThat(emp.collation(RexColumnRef.ROWID), is(SqlCollation.BINARY));
    assertThat(emp.collation(3), is(SqlCollation.NOCASE));
    assertThat(emp.isVirtual(), is(false));
  }

  @Test void testInvalidRowCount() {
    final TableDescriptor.Builder builder =
        TableDescriptor.builder("X").column("A", SqlAffinity.INTEGER);
    assertThrows(IllegalArgumentException.class,
        () -> builder.rowCount(Double.POSITIVE_INFINITY));
    assertThrows(IllegalArgumentException.class,
        () -> builder.rowCount(Double.NaN));
    assertThrows(IllegalArgumentException.class,
        () -> builder.rowCount(-1d));
    assertThat(builder.rowCount(null).build().getRowCount() == null, is(true));
  }

  @Test void testIndexOnMissingColumn() {
    assertThrows(IllegalArgumentException.class,
        () -> TableDescriptor.builder("X")
            .column("A", SqlAffinity.INTEGER)
            .index(IndexDescriptor.of("X_B", false, 1))
            .build());
  }

  @Test void testCollationNames() {
    assertThat(SqlCollation.of("nocase"), is(SqlCollation.NOCASE));
    assertThat(SqlCollation.NOCASE.isCaseInsensitive(), is(true));
    assertThat(SqlCollation.of("RTRIM").isCaseInsensitive(), is(false));
  }
}
