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

import org.apache.cairn.config.CairnSystemProperty;
import org.apache.cairn.rel.RelFieldCollation;
import org.apache.cairn.sql.SqlCollation;
import org.apache.cairn.util.ImmutableBitSet;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.primitives.Longs;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/**
 * Description of an index, as supplied by the storage layer.
 *
 * <p>The row estimates describe the selectivity of the index:
 * {@code rowEstimate(0)} is the number of rows in the table, and
 * {@code rowEstimate(i)} is the expected number of rows that have a given
 * value in each of the first {@code i} key columns.
 */
public class IndexDescriptor {
  private final String name;
  private final ImmutableList<Column> columns;
  private final boolean unique;
  private final ImmutableList<Long> rowEstimates;
  private final ImmutableBitSet keyColumns;

  /**
   * Creates an IndexDescriptor.
   *
   * @param name         Index name
   * @param columns      Key columns, most significant first
   * @param unique       Whether no two rows have the same key
   * @param rowEstimates Row estimates, one more than there are columns; or
   *                     null to use {@link #defaultRowEstimates}
   */
  public IndexDescriptor(String name, List<Column> columns, boolean unique,
      @Nullable List<Long> rowEstimates) {
    this.name = requireNonNull(name, "name");
    this.columns = ImmutableList.copyOf(columns);
    this.unique = unique;
    this.keyColumns =
        ImmutableBitSet.of(Lists.transform(this.columns, c -> c.column));
    checkArgument(!this.columns.isEmpty(), "index %s has no columns", name);
    this.rowEstimates = rowEstimates == null
        ? defaultRowEstimates(this.columns.size(), unique)
        : ImmutableList.copyOf(rowEstimates);
    checkArgument(this.rowEstimates.size() == this.columns.size() + 1,
        "index %s: expected %s row estimates, got %s", name,
        this.columns.size() + 1, this.rowEstimates.size());
  }

  /** Creates an index with default row estimates whose key columns are
   * ascending and use the BINARY collation. */
  public static IndexDescriptor of(String name, boolean unique,
      int... columns) {
    final ImmutableList.Builder<Column> list = ImmutableList.builder();
    for (int column : columns) {
      list.add(Column.of(column));
    }
    return new IndexDescriptor(name, list.build(), unique, null);
  }

  /**
   * Returns the row estimates to use for an index that has not been
   * analyzed.
   *
   * <p>The table is assumed to hold a million rows (see
   * {@link CairnSystemProperty#DEFAULT_ROW_ESTIMATE}); the first key column
   * selects 10 rows, each further column one fewer, down to 5. If the index is
   * unique, the full key selects 1 row.
   */
  public static ImmutableList<Long> defaultRowEstimates(int columnCount,
      boolean unique) {
    final long[] a = new long[columnCount + 1];
    a[0] = CairnSystemProperty.DEFAULT_ROW_ESTIMATE.value();
    for (int i = 1; i <= columnCount; i++) {
      a[i] = i >= 5 ? 5 : 11 - i;
    }
    if (unique) {
      a[columnCount] = 1;
    }
    return ImmutableList.copyOf(Longs.asList(a));
  }

  public String getName() {
    return name;
  }

  public List<Column> getColumns() {
    return columns;
  }

  public int getColumnCount() {
    return columns.size();
  }

  public Column getColumn(int i) {
    return columns.get(i);
  }

  public boolean isUnique() {
    return unique;
  }

  /** Returns the expected number of rows with a given value in each of the
   * first {@code depth} key columns. */
  public long rowEstimate(int depth) {
    return rowEstimates.get(depth);
  }

  public List<Long> getRowEstimates() {
    return rowEstimates;
  }

  /** Returns whether every column in {@code columnsUsed} is a key column of
   * this index, so that a query can read the index and not the table. */
  public boolean covers(ImmutableBitSet columnsUsed) {
    return keyColumns.contains(columnsUsed);
  }

  @Override public String toString() {
    return name;
  }

  /** Key column of an index. */
  public static class Column {
    /** Column number in the table. */
    public final int column;
    public final SqlCollation collation;
    public final RelFieldCollation.Direction direction;

    public Column(int column, SqlCollation collation,
        RelFieldCollation.Direction direction) {
      checkArgument(column >= 0, "invalid column %s", column);
      this.column = column;
      this.collation = requireNonNull(collation, "collation");
      this.direction = requireNonNull(direction, "direction");
    }

    /** Creates an ascending key column with BINARY collation. */
    public static Column of(int column) {
      return new Column(column, SqlCollation.BINARY,
          RelFieldCollation.Direction.ASCENDING);
    }

    @Override public String toString() {
      return column + " " + collation + " " + direction.shortString;
    }
  }
}
