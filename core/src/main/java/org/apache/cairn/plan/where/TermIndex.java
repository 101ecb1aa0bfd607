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

import org.apache.cairn.rex.RexCall;
import org.apache.cairn.rex.RexUtil;
import org.apache.cairn.schema.IndexDescriptor;
import org.apache.cairn.sql.SqlKind;
import org.apache.cairn.sql.type.SqlAffinity;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Set;

/**
 * Looks up the analyzed conjunct that constrains a given column.
 */
public abstract class TermIndex {
  private TermIndex() {
  }

  /**
   * Returns the position of the first conjunct of the form
   * {@code column OP expression}, where OP is one of {@code ops} and
   * {@code expression} refers to no table in {@code notReady}; or -1.
   *
   * @param list     Analyzed conjuncts
   * @param table    Handle of the table
   * @param column   Column, or {@link org.apache.cairn.rex.RexColumnRef#ROWID}
   * @param notReady Tables that have not been placed in the join order yet
   * @param ops      Acceptable operators
   */
  public static int find(ConjunctList list, int table, int column,
      long notReady, Set<SqlKind> ops) {
    return find(list, table, column, notReady, ops, null, null);
  }

  /**
   * Returns the position of the first conjunct that can drive a lookup on
   * {@code index}: as {@link #find(ConjunctList, int, int, long, Set)}, but
   * unless the operator is IS NULL, the comparison must be evaluated with an
   * affinity compatible with the column's and with the index column's
   * collation. Returns -1 if there is no such conjunct.
   */
  public static int find(ConjunctList list, FromItem item, int column,
      long notReady, Set<SqlKind> ops, @Nullable IndexDescriptor index) {
    return find(list, item.getHandle(), column, notReady, ops, item, index);
  }

  private static int find(ConjunctList list, int table, int column,
      long notReady, Set<SqlKind> ops, @Nullable FromItem item,
      @Nullable IndexDescriptor index) {
    for (int i = 0; i < list.size(); i++) {
      final Conjunct term = list.get(i);
      if (term.leftTable != table
          || (term.rhsTables & notReady) != 0
          || term.leftColumn != column
          || term.kind == null
          || !ops.contains(term.kind)) {
        continue;
      }
      if (index != null && item != null && term.kind != SqlKind.IS_NULL) {
        final SqlAffinity columnAffinity =
            item.getTable().affinity(column);
        final SqlAffinity comparisonAffinity =
            RexUtil.comparisonAffinity((RexCall) term.getExpr());
        if (!SqlAffinity.indexCompatible(comparisonAffinity,
            columnAffinity)) {
          continue;
        }
        final IndexDescriptor.Column indexColumn = indexColumn(index, column);
        if (indexColumn == null
            || !term.getCollation().equals(indexColumn.collation)) {
          continue;
        }
      }
      return i;
    }
    return -1;
  }

  private static IndexDescriptor.@Nullable Column indexColumn(
      IndexDescriptor index, int column) {
    for (IndexDescriptor.Column c : index.getColumns()) {
      if (c.column == column) {
        return c;
      }
    }
    return null;
  }
}
