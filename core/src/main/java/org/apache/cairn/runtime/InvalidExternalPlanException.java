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
 * Thrown when an {@link org.apache.cairn.schema.IndexAdvisor} asks to use a
 * constraint whose right-hand side cannot be computed at the table's position
 * in the join order.
 */
public class InvalidExternalPlanException extends CairnException {
  private static final long serialVersionUID = -7390420733815032671L;

  private final String tableName;

  public InvalidExternalPlanException(String tableName) {
    super(
        String.format(Locale.ROOT,
            "table %s: index advisor returned an invalid plan", tableName));
    this.tableName = tableName;
  }

  /** Returns the name of the table whose advisor misbehaved. */
  public String getTableName() {
    return tableName;
  }
}
