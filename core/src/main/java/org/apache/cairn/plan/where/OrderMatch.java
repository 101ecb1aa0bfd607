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

/** Result of checking whether an access order satisfies an ORDER BY. */
public enum OrderMatch {
  /** The order does not satisfy the ORDER BY; rows must be sorted. */
  NO_MATCH,
  /** A forward scan produces rows in ORDER BY order. */
  FORWARD,
  /** A reverse scan produces rows in ORDER BY order. */
  REVERSE;

  /** Returns whether rows need no sort. */
  public boolean matches() {
    return this != NO_MATCH;
  }

  static OrderMatch of(boolean reverse) {
    return reverse ? REVERSE : FORWARD;
  }
}
