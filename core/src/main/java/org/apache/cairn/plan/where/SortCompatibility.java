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
import org.apache.cairn.rex.RexColumnRef;
import org.apache.cairn.schema.IndexDescriptor;
import org.apache.cairn.schema.TableDescriptor;
import org.apache.cairn.sql.SqlCollation;

import java.util.List;

/**
 * Decides whether reading a table in rowid order, or in the order of one of
 * its indexes, produces rows in the order an ORDER BY clause asks for.
 *
 * <p>Only the first table of the join order can satisfy an ORDER BY in this
 * way.
 */
public abstract class SortCompatibility {
  private SortCompatibility() {
  }

  /**
   * Returns whether a scan of the table in rowid order satisfies the ORDER
   * BY: its first term must be the rowid of the table, and no later term may
   * refer to another table. (Later terms on the same table are irrelevant,
   * since the rowid is unique.)
   */
  public static OrderMatch rowidOrderMatches(TableMaskSet maskSet,
      FromItem item, List<OrderByTerm> orderBy) {
    if (orderBy.isEmpty()) {
      return OrderMatch.NO_MATCH;
    }
    final OrderByTerm first = orderBy.get(0);
    final RexColumnRef column = first.columnOf(item.getHandle());
    if (column != null
        && column.isRowid()
        && !referencesOtherTables(maskSet, orderBy, 1, item.getHandle())) {
      return OrderMatch.of(first.direction.isDescending());
    }
    return OrderMatch.NO_MATCH;
  }

  /**
   * Returns whether a scan of {@code index} satisfies the ORDER BY.
   *
   * <p>Terms of the ORDER BY are matched against the index columns and then
   * against the rowid, which every index entry ends with. A term must match
   * the column and collation of its index column. An index column fixed by
   * an equality constraint (one of the first {@code nEq}) may be skipped.
   * Past the equality columns, every term must run in the same direction
   * relative to its index column, so that the scan can go forward or in
   * reverse.
   *
   * <p>Once the rowid (or the column that aliases it) has matched, the
   * remaining terms are irrelevant unless they refer to another table. The
   * same holds once every column of a unique index has matched.
   *
   * @param maskSet Table masks
   * @param index   Index
   * @param item    Table that is scanned, first in the join order
   * @param orderBy ORDER BY clause, not empty
   * @param nEq     Number of leading index columns fixed by equality
   */
  public static OrderMatch indexOrderMatches(TableMaskSet maskSet,
      IndexDescriptor index, FromItem item, List<OrderByTerm> orderBy,
      int nEq) {
    assert !orderBy.isEmpty();
    final TableDescriptor table = item.getTable();
    final int base = item.getHandle();
    final int nTerm = orderBy.size();
    final int nColumn = index.getColumnCount();
    boolean reverse = false;
    int i;
    int j = 0;
    for (i = 0; j < nTerm && i <= nColumn; i++) {
      final OrderByTerm term = orderBy.get(j);
      final RexColumnRef column = term.columnOf(base);
      if (column == null) {
        // Only columns of the scanned table can be sorted by an index.
        break;
      }
      final SqlCollation termCollation = column.getCollation();
      final int indexColumn;
      final RelFieldCollation.Direction indexDirection;
      final SqlCollation indexCollation;
      if (i < nColumn) {
        final IndexDescriptor.Column c = index.getColumn(i);
        indexColumn = c.column == table.getRowidAlias()
            ? RexColumnRef.ROWID
            : c.column;
        indexDirection = c.direction;
        indexCollation = c.collation;
      } else {
        indexColumn = RexColumnRef.ROWID;
        indexDirection = RelFieldCollation.Direction.ASCENDING;
        indexCollation = termCollation;
      }
      if (column.getColumn() != indexColumn
          || !termCollation.equals(indexCollation)) {
        if (i < nEq) {
          continue;
        } else if (i == nColumn) {
          break;
        } else {
          return OrderMatch.NO_MATCH;
        }
      }
      final boolean termReverse =
          indexDirection.isDescending() ^ term.direction.isDescending();
      if (i > nEq) {
        if (termReverse != reverse) {
          return OrderMatch.NO_MATCH;
        }
      } else {
        reverse = termReverse;
      }
      j++;
      if (indexColumn == RexColumnRef.ROWID
          && !referencesOtherTables(maskSet, orderBy, j, base)) {
        j = nTerm;
      }
    }
    if (j >= nTerm) {
      return OrderMatch.of(reverse);
    }
    if (index.isUnique()
        && i == nColumn
        && !referencesOtherTables(maskSet, orderBy, j, base)) {
      return OrderMatch.of(reverse);
    }
    return OrderMatch.NO_MATCH;
  }

  /** Returns whether any ORDER BY term from {@code first} onwards refers to
   * a table other than {@code base}. */
  static boolean referencesOtherTables(TableMaskSet maskSet,
      List<OrderByTerm> orderBy, int first, int base) {
    final long others = ~maskSet.maskOf(base);
    for (int i = first; i < orderBy.size(); i++) {
      if ((TableUsage.of(maskSet, orderBy.get(i).expr) & others) != 0) {
        return true;
      }
    }
    return false;
  }
}
