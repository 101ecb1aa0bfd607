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
package org.apache.cairn.test;

import org.apache.cairn.plan.where.FromItem;
import org.apache.cairn.plan.where.OrderByTerm;
import org.apache.cairn.rel.RelFieldCollation;
import org.apache.cairn.rex.RexBuilder;
import org.apache.cairn.rex.RexColumnRef;
import org.apache.cairn.rex.RexLiteral;
import org.apache.cairn.rex.RexNode;
import org.apache.cairn.schema.IndexAdvisor;
import org.apache.cairn.schema.IndexDescriptor;
import org.apache.cairn.schema.TableDescriptor;
import org.apache.cairn.sql.SqlCollation;
import org.apache.cairn.sql.SqlKind;
import org.apache.cairn.sql.type.SqlAffinity;

import com.google.common.collect.ImmutableList;

/**
 * Mock catalog for tests of the WHERE planner.
 *
 * <p>Defines the following tables:
 *
 * <ul>
 *   <li>{@code EMP(EMPNO INTEGER PRIMARY KEY, ENAME TEXT, DEPTNO INTEGER,
 *   JOB TEXT COLLATE NOCASE, SAL REAL, MGR INTEGER)}, with indexes
 *   {@code EMP_DEPTNO(DEPTNO)}, unique {@code EMP_ENAME(ENAME)} and
 *   {@code EMP_JOB_SAL(JOB COLLATE NOCASE, SAL)};
 *   <li>{@code DEPT(DEPTNO INTEGER PRIMARY KEY, DNAME TEXT)}, no index;
 *   <li>{@code T(ID INTEGER PRIMARY KEY, V INTEGER)}, no index;
 *   <li>{@code U(ID INTEGER PRIMARY KEY, T_ID INTEGER)}, with unique
 *   index {@code U_T_ID(T_ID)}.
 * </ul>
 *
 * <p>Each call to {@link #item} creates a FROM item with a new handle.
 */
public class MockCatalog {
  public final RexBuilder rexBuilder = new RexBuilder();

  public final TableDescriptor emp =
      TableDescriptor.builder("EMP")
          .column("EMPNO", SqlAffinity.INTEGER).rowidAlias()
          .column("ENAME", SqlAffinity.TEXT)
          .column("DEPTNO", SqlAffinity.INTEGER)
          .column("JOB", SqlAffinity.TEXT, SqlCollation.NOCASE)
          .column("SAL", SqlAffinity.REAL)
          .column("MGR", SqlAffinity.INTEGER)
          .index(IndexDescriptor.of("EMP_DEPTNO", false, 2))
          .index(IndexDescriptor.of("EMP_ENAME", true, 1))
          .index(
              new IndexDescriptor("EMP_JOB_SAL",
                  ImmutableList.of(
                      new IndexDescriptor.Column(3, SqlCollation.NOCASE,
                          RelFieldCollation.Direction.ASCENDING),
                      IndexDescriptor.Column.of(4)),
                  false, null))
          .build();

  public final TableDescriptor dept =
      TableDescriptor.builder("DEPT")
          .column("DEPTNO", SqlAffinity.INTEGER).rowidAlias()
          .column("DNAME", SqlAffinity.TEXT)
          .build();

  public final TableDescriptor t =
      TableDescriptor.builder("T")
          .column("ID", SqlAffinity.INTEGER).rowidAlias()
          .column("V", SqlAffinity.INTEGER)
          .build();

  public final TableDescriptor u =
      TableDescriptor.builder("U")
          .column("ID", SqlAffinity.INTEGER).rowidAlias()
          .column("T_ID", SqlAffinity.INTEGER)
          .index(IndexDescriptor.of("U_T_ID", true, 1))
          .build();

  private int nextHandle;

  /** Creates a FROM item for a table, with a new handle. */
  public FromItem item(TableDescriptor table) {
    return FromItem.of(nextHandle++, table);
  }

  /** Creates a FROM item for a table, with an alias and a new handle. */
  public FromItem item(TableDescriptor table, String alias) {
    return item(table).withAlias(alias);
  }

  /** Creates a table that has no index and delegates to an advisor. */
  public static TableDescriptor virtualTable(String name,
      IndexAdvisor advisor) {
    return TableDescriptor.builder(name)
        .column("BODY", SqlAffinity.TEXT)
        .column("TITLE", SqlAffinity.TEXT)
        .advisor(advisor)
        .build();
  }

  /** Creates a reference to a column of a FROM item, as the binder would:
   * a reference to the rowid alias column becomes a rowid reference. */
  public RexColumnRef ref(FromItem item, String columnName) {
    final TableDescriptor table = item.getTable();
    final String prefix =
        (item.getAlias() != null ? item.getAlias() : table.getName()) + ".";
    for (int i = 0; i < table.getColumns().size(); i++) {
      final TableDescriptor.Column column = table.getColumn(i);
      if (column.name.equals(columnName)) {
        if (i == table.getRowidAlias()) {
          return rexBuilder.makeRowidRef(item.getHandle(),
              prefix + columnName);
        }
        return rexBuilder.makeColumnRef(item.getHandle(), i, column.affinity,
            column.collation, prefix + columnName);
      }
    }
    throw new IllegalArgumentException("column not found: " + columnName);
  }

  public RexColumnRef rowid(FromItem item) {
    return rexBuilder.makeRowidRef(item.getHandle(),
        item.getTable().getName() + ".ROWID");
  }

  public RexLiteral literal(long n) {
    return rexBuilder.makeExactLiteral(n);
  }

  public RexLiteral literal(String s) {
    return rexBuilder.makeLiteral(s);
  }

  public RexNode eq(RexNode left, RexNode right) {
    return rexBuilder.equals(left, right);
  }

  public RexNode lt(RexNode left, RexNode right) {
    return rexBuilder.makeCall(SqlKind.LESS_THAN, left, right);
  }

  public RexNode gt(RexNode left, RexNode right) {
    return rexBuilder.makeCall(SqlKind.GREATER_THAN, left, right);
  }

  public RexNode ge(RexNode left, RexNode right) {
    return rexBuilder.makeCall(SqlKind.GREATER_THAN_OR_EQUAL, left, right);
  }

  public RexNode and(RexNode... operands) {
    return rexBuilder.and(operands);
  }

  public RexNode or(RexNode... operands) {
    return rexBuilder.or(operands);
  }

  public RexNode like(RexNode column, String pattern) {
    return rexBuilder.makeCall(SqlKind.LIKE, column, literal(pattern));
  }

  public RexNode glob(RexNode column, String pattern) {
    return rexBuilder.makeCall(SqlKind.GLOB, column, literal(pattern));
  }

  public static OrderByTerm asc(RexNode e) {
    return OrderByTerm.asc(e);
  }

  public static OrderByTerm desc(RexNode e) {
    return OrderByTerm.desc(e);
  }
}
