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

/** Options the caller may pass to {@link WherePlanner#plan}. */
public enum WhereOption {
  /**
   * The caller (for example an UPDATE or DELETE of a single table) would
   * like to modify rows while it visits them. If the plan selects at most
   * one row, {@link WherePlan#isOnePass()} is true. Only valid with one FROM
   * item.
   */
  ONE_PASS_DESIRED
}
