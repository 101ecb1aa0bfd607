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

import org.apache.cairn.schema.IndexAdvice;
import org.apache.cairn.schema.IndexDescriptor;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * One position of a join order: which FROM item to read there, and how.
 */
public class AccessStep {
  private final int position;
  private final int fromIndex;
  private final FromItem item;
  private final AccessPath path;

  AccessStep(int position, int fromIndex, FromItem item, AccessPath path) {
    this.position = position;
    this.fromIndex = fromIndex;
    this.item = requireNonNull(item, "item");
    this.path = requireNonNull(path, "path");
  }

  AccessStep withShapes(Set<AccessShape> shapes) {
    return new AccessStep(position, fromIndex, item, path.withShapes(shapes));
  }

  /** Returns the position of this step in the join order. */
  public int getPosition() {
    return position;
  }

  /** Returns the position of the item in the FROM list. */
  public int getFromIndex() {
    return fromIndex;
  }

  public FromItem getItem() {
    return item;
  }

  public AccessPath getPath() {
    return path;
  }

  public @Nullable IndexDescriptor getIndex() {
    return path.getIndex();
  }

  public Set<AccessShape> getShapes() {
    return path.getShapes();
  }

  public boolean has(AccessShape shape) {
    return path.has(shape);
  }

  public @Nullable IndexAdvice getAdvice() {
    return path.getAdvice();
  }

  /** Renders this step as a line of EXPLAIN output, for example
   * "TABLE emp AS e WITH INDEX emp_deptno ORDER BY". */
  public String explain() {
    final StringBuilder sb = new StringBuilder("TABLE ")
        .append(item.getTable().getName());
    if (item.getAlias() != null) {
      sb.append(" AS ").append(item.getAlias());
    }
    final IndexDescriptor index = path.getIndex();
    final IndexAdvice advice = path.getAdvice();
    if (index != null) {
      sb.append(" WITH INDEX ").append(index.getName());
    } else if (has(AccessShape.ROWID_EQ) || has(AccessShape.ROWID_RANGE)) {
      sb.append(" USING PRIMARY KEY");
    } else if (advice != null) {
      final String idxStr = advice.getIdxStr();
      sb.append(" VIRTUAL TABLE INDEX ").append(advice.getIdxNum());
      if (idxStr != null) {
        sb.append(':').append(idxStr);
      }
    }
    if (has(AccessShape.ORDER_BY)) {
      sb.append(" ORDER BY");
    }
    return sb.toString();
  }

  @Override public String toString() {
    return "#" + position + ": " + item + " " + path;
  }
}
