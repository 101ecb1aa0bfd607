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

import org.apache.cairn.runtime.TableLimitExceededException;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Assigns a bit of a 64-bit mask to each table of a FROM list.
 *
 * <p>Tables are registered in FROM-list order, and the k-th table registered
 * gets bit k. Hence if {@code m} is the mask of a table, {@code m - 1} is the
 * mask of all tables to its left; the planner relies on this to find the
 * tables to the left of a LEFT JOIN.
 *
 * <p>A table is identified by its handle, the cursor number that the binder
 * assigned to it. A handle that has not been registered, for instance that of
 * a table in the FROM list of a sub-query, has mask 0.
 */
public class TableMaskSet {
  private final int[] handles;
  private int size;

  /** Creates a TableMaskSet that holds at most {@code maxTables} tables. */
  public TableMaskSet(int maxTables) {
    checkArgument(maxTables >= 1 && maxTables <= Long.SIZE,
        "maxTables must be between 1 and %s: %s", Long.SIZE, maxTables);
    this.handles = new int[maxTables];
  }

  /**
   * Registers a table, and returns its mask.
   *
   * @throws TableLimitExceededException if the set is full
   */
  public long register(int handle) {
    assert maskOf(handle) == 0 : "table " + handle + " already registered";
    if (size == handles.length) {
      throw new TableLimitExceededException(size + 1, handles.length);
    }
    handles[size] = handle;
    return 1L << size++;
  }

  /** Returns the mask of a table, or 0 if it is not registered. */
  public long maskOf(int handle) {
    for (int i = 0; i < size; i++) {
      if (handles[i] == handle) {
        return 1L << i;
      }
    }
    return 0;
  }

  /** Returns the handle of the table that has the given bit. */
  public int handleAt(int bitIndex) {
    if (bitIndex < 0 || bitIndex >= size) {
      throw new IndexOutOfBoundsException("bitIndex: " + bitIndex);
    }
    return handles[bitIndex];
  }

  /** Returns the number of registered tables. */
  public int size() {
    return size;
  }

  /** Returns the mask of all registered tables. */
  public long allMask() {
    return size == Long.SIZE ? -1L : (1L << size) - 1;
  }
}
