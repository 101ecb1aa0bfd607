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

/**
 * Cost-based planning of the WHERE clause of a query.
 *
 * <p>{@link org.apache.cairn.plan.where.WherePlanner} is the entry point.
 * Given the FROM list, the WHERE clause and the ORDER BY clause, it decides
 * the order in which the tables are read (the outermost loop first), how
 * each is read, and which conjuncts of the WHERE clause the chosen access
 * paths make redundant.
 *
 * <p>Planning proceeds in phases:
 *
 * <ol>
 *   <li>The WHERE clause, and the ON clause of each join, is split into
 *   conjuncts ({@link org.apache.cairn.plan.where.ConjunctSplitter}).
 *   <li>Each conjunct is analyzed, and additional conjuncts derived
 *   ({@link org.apache.cairn.plan.where.ConjunctAnalyzer}).
 *   <li>Tables are placed one at a time, choosing for each position the
 *   table that is cheapest to read given the tables already placed
 *   ({@link org.apache.cairn.plan.where.JoinPlanner},
 *   {@link org.apache.cairn.plan.where.CostModel}).
 *   <li>Conjuncts that the access paths guarantee are marked enforced.
 * </ol>
 */
package org.apache.cairn.plan.where;
