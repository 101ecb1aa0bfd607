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
package org.apache.cairn.rex;

import org.apache.cairn.sql.SqlCollation;
import org.apache.cairn.sql.SqlKind;
import org.apache.cairn.sql.type.SqlAffinity;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Reference to a column of a table in the FROM list.
 *
 * <p>A table is identified by its handle, the integer cursor number that the
 * binder assigned to the FROM-list item. Column {@link #ROWID} denotes the
 * row identity of the table; the binder resolves references to a column
 * declared as an alias of the row identity to it.
 */
public class RexColumnRef extends RexNode {
  /** Column number of the row identity. */
  public static final int ROWID = -1;

  private final int tableHandle;
  private final int column;
  private final SqlAffinity affinity;
  private final SqlCollation collation;
  private final String name;

  RexColumnRef(int tableHandle, int column, SqlAffinity affinity,
      SqlCollation collation, String name) {
    super(name);
    this.tableHandle = tableHandle;
    this.column = column;
    this.affinity = requireNonNull(affinity, "affinity");
    this.collation = requireNonNull(collation, "collation");
    this.name = requireNonNull(name, "name");
  }

  public int getTableHandle() {
    return tableHandle;
  }

  /** Returns the 0-based column number, or {@link #ROWID}. */
  public int getColumn() {
    return column;
  }

  public boolean isRowid() {
    return column == ROWID;
  }

  public SqlAffinity getAffinity() {
    return affinity;
  }

  /** Returns the declared collating sequence of the column. */
  public SqlCollation getCollation() {
    return collation;
  }

  public String getName() {
    return name;
  }

  @Override public SqlKind getKind() {
    return SqlKind.COLUMN_REF;
  }

  @Override public <R> R accept(RexVisitor<R> visitor) {
    return visitor.visitColumnRef(this);
  }

  @Override public boolean equals(@Nullable Object obj) {
    return this == obj
        || obj instanceof RexColumnRef
        && tableHandle == ((RexColumnRef) obj).tableHandle
        && column == ((RexColumnRef) obj).column;
  }

  @Override public int hashCode() {
    return Objects.hash(tableHandle, column);
  }
}
