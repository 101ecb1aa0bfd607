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
package org.apache.cairn.runtime;

import java.util.Locale;

/**
 * Thrown when a FROM list has more tables than fit in a table mask.
 */
public class TableLimitExceededException extends CairnException {
  private static final long serialVersionUID = -2841739468150238841L;

  private final int tableCount;
  private final int limit;

  public TableLimitExceededException(int tableCount, int limit) {
    super(String.format(Locale.ROOT, "at most %d tables in a join", limit));
    this.tableCount = tableCount;
    this.limit = limit;
  }

  /** Returns the number of tables in the offending FROM list. */
  public int getTableCount() {
    return tableCount;
  }

  /** Returns the maximum number of tables in a join. */
  public int getLimit() {
    return limit;
  }
}
