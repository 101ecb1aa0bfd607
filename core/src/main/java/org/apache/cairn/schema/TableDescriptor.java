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

import org.apache.cairn.sql.SqlCollation;
import org.apache.cairn.sql.type.SqlAffinity;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/**
 * Description of a table, as supplied by the schema and the storage layer.
 *
 * <p>A table that has an {@link IndexAdvisor} is a virtual table; the planner
 * asks the advisor how to access it, and ignores its indexes.
 */
public class TableDescriptor {
  private final String name;
  private final ImmutableList<Column> columns;
  private final int rowidAlias;
  private final @Nullable Double rowCount;
  private final ImmutableList<IndexDescriptor> indexes;
  private final @Nullable IndexAdvisor advisor;

  private TableDescriptor(String name, List<Column> columns, int rowidAlias,
      @Nullable Double rowCount, List<IndexDescriptor> indexes,
      @Nullable IndexAdvisor advisor) {
    this.name = requireNonNull(name, "name");
    this.columns = ImmutableList.copyOf(columns);
    this.rowidAlias = rowidAlias;
    this.rowCount = rowCount;
    this.indexes = ImmutableList.copyOf(indexes);
    this.advisor = advisor;
    checkArgument(rowidAlias >= -1 && rowidAlias < this.columns.size(),
        "invalid rowid alias %s", rowidAlias);
    for (IndexDescriptor index : this.indexes) {
      for (IndexDescriptor.Column c : index.getColumns()) {
        checkArgument(c.column < this.columns.size(),
            "index %s references column %s of table %s, which has %s columns",
            index.getName(), c.column, name, this.columns.size());
      }
    }
  }

  /** Creates a builder for a table of the given name. */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String getName() {
    return name;
  }

  public List<Column> getColumns() {
    return columns;
  }

  public Column getColumn(int i) {
    return columns.get(i);
  }

  /** Returns the declared affinity of a column; the row identity has
   * {@link SqlAffinity#INTEGER} affinity. */
  public SqlAffinity affinity(int column) {
    return column < 0 ? SqlAffinity.INTEGER : columns.get(column).affinity;
  }

  /** Returns the declared collation of a column; the row identity uses
   * {@link SqlCollation#BINARY}. */
  public SqlCollation collation(int column) {
    return column < 0 ? SqlCollation.BINARY : columns.get(column).collation;
  }

  /** Returns the column that is an alias for the row identity (an INTEGER
   * PRIMARY KEY column), or -1. */
  public int getRowidAlias() {
    return rowidAlias;
  }

  /** Returns the number of rows in the table, or null if not known. */
  public @Nullable Double getRowCount() {
    return rowCount;
  }

  public List<IndexDescriptor> getIndexes() {
    return indexes;
  }

  public @Nullable IndexAdvisor getAdvisor() {
    return advisor;
  }

  public boolean isVirtual() {
    return advisor != null;
  }

  @Override public String toString() {
    return name;
  }

  /** Column of a table. */
  public static class Column {
    public final String name;
    public final SqlAffinity affinity;
    public final SqlCollation collation;

    public Column(String name, SqlAffinity affinity, SqlCollation collation) {
      this.name = requireNonNull(name, "name");
      this.affinity = requireNonNull(affinity, "affinity");
      this.collation = requireNonNull(collation, "collation");
    }

    @Override public String toString() {
      return name;
    }
  }

  /** Builder for {@link TableDescriptor}. */
  public static class Builder {
    private final String name;
    private final List<Column> columns = new ArrayList<>();
    private final List<IndexDescriptor> indexes = new ArrayList<>();
    private int rowidAlias = -1;
    private @Nullable Double rowCount;
    private @Nullable IndexAdvisor advisor;

    private Builder(String name) {
      this.name = name;
    }

    /** Adds a column with BINARY collation. */
    public Builder column(String name, SqlAffinity affinity) {
      return column(name, affinity, SqlCollation.BINARY);
    }

    /** Adds a column. */
    public Builder column(String name, SqlAffinity affinity,
        SqlCollation collation) {
      columns.add(new Column(name, affinity, collation));
      return this;
    }

    /** Declares the most recently added column an alias of the row
     * identity. */
    public Builder rowidAlias() {
      checkArgument(!columns.isEmpty(), "no column");
      rowidAlias = columns.size() - 1;
      return this;
    }

    public Builder rowCount(@Nullable Double rowCount) {
      checkArgument(rowCount == null
              || Double.isFinite(rowCount) && rowCount >= 0,
          "invalid row count %s for table %s", rowCount, name);
      this.rowCount = rowCount;
      return this;
    }

    public Builder index(IndexDescriptor index) {
      indexes.add(index);
      return this;
    }

    public Builder advisor(@Nullable IndexAdvisor advisor) {
      this.advisor = advisor;
      return this;
    }

    public TableDescriptor build() {
      return new TableDescriptor(name, columns, rowidAlias, rowCount, indexes,
          advisor);
    }
  }
}
