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

/**
 * Describes one aspect of how an {@link AccessStep} reads its table.
 *
 * <p>A step has a set of shapes; for example a lookup on a unique index
 * whose key columns hold every column the query reads has
 * {COLUMN_EQ, UNIQUE, INDEX_ONLY}.
 */
public enum AccessShape {
  /** rowid = X or rowid IN (...). */
  ROWID_EQ,
  /** rowid &lt; X and/or rowid &gt; Y, or a scan in rowid order. */
  ROWID_RANGE,
  /** x = X or x IN (...) on a leading index column. */
  COLUMN_EQ,
  /** x &lt; X and/or x &gt; Y on the first index column not fixed by
   * equality. */
  COLUMN_RANGE,
  /** x IN (...) on an index column. */
  COLUMN_IN,
  /** The range has an upper bound. */
  TOP_LIMIT,
  /** The range has a lower bound. */
  BTM_LIMIT,
  /** The index holds every column the query reads; the table is not
   * visited. */
  INDEX_ONLY,
  /** Rows come out in ORDER BY order. */
  ORDER_BY,
  /** The scan runs in reverse. */
  REVERSE,
  /** At most one row is selected. */
  UNIQUE,
  /** Access is delegated to a virtual table's index advisor. */
  VIRTUAL_TABLE
}
