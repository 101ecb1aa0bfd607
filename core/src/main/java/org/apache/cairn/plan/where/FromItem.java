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

import org.apache.cairn.rex.RexNode;
import org.apache.cairn.schema.TableDescriptor;
import org.apache.cairn.sql.JoinType;
import org.apache.cairn.util.ImmutableBitSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/**
 * An item of the FROM list: a table, with the handle the binder gave it and
 * the way it joins the items to its left.
 *
 * <p>Instances are immutable; use the {@code withXxx} methods to derive a
 * modified copy.
 */
public class FromItem {
  private final int handle;
  private final TableDescriptor table;
  private final @Nullable String alias;
  private final JoinType joinType;
  private final ImmutableBitSet columnsUsed;
  private final @Nullable RexNode on;

  private FromItem(int handle, TableDescriptor table, @Nullable String alias,
      JoinType joinType, ImmutableBitSet columnsUsed, @Nullable RexNode on) {
    checkArgument(handle >= 0, "handle must be non-negative: %s", handle);
    this.handle = handle;
    this.table = requireNonNull(table, "table");
    this.alias = alias;
    this.joinType = requireNonNull(joinType, "joinType");
    this.columnsUsed = requireNonNull(columnsUsed, "columnsUsed");
    this.on = on;
  }

  /** Creates an inner-joined FromItem that reads every column of its
   * table. A reference to the rowid alias column is a reference to the
   * rowid, which every index holds, so that column is not counted. */
  public static FromItem of(int handle, TableDescriptor table) {
    final List<Integer> columns = new ArrayList<>();
    for (int i = 0; i < table.getColumns().size(); i++) {
      if (i != table.getRowidAlias()) {
        columns.add(i);
      }
    }
    return new FromItem(handle, table, null, JoinType.INNER,
        ImmutableBitSet.of(columns), null);
  }

  public FromItem withAlias(@Nullable String alias) {
    return new FromItem(handle, table, alias, joinType, columnsUsed, on);
  }

  public FromItem withJoinType(JoinType joinType) {
    return new FromItem(handle, table, alias, joinType, columnsUsed, on);
  }

  public FromItem withColumnsUsed(ImmutableBitSet columnsUsed) {
    return new FromItem(handle, table, alias, joinType, columnsUsed, on);
  }

  /** Returns a copy with the given ON condition. For a LEFT JOIN, conjuncts
   * of the condition may only be enforced when this item is accessed. */
  public FromItem withOn(@Nullable RexNode on) {
    return new FromItem(handle, table, alias, joinType, columnsUsed, on);
  }

  public int getHandle() {
    return handle;
  }

  public TableDescriptor getTable() {
    return table;
  }

  public @Nullable String getAlias() {
    return alias;
  }

  /** Returns how this item joins the items to its left. */
  public JoinType getJoinType() {
    return joinType;
  }

  /** Returns the columns of the table that the query reads, not counting
   * the rowid. */
  public ImmutableBitSet getColumnsUsed() {
    return columnsUsed;
  }

  public @Nullable RexNode getOn() {
    return on;
  }

  /** Returns whether this item is the right-hand side of a LEFT JOIN. */
  public boolean isLeftJoinRight() {
    return joinType.generatesNullsOnRight();
  }

  @Override public String toString() {
    return table.getName() + (alias == null ? "" : " AS " + alias)
        + "#" + handle;
  }
}
