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
package org.apache.cairn.schema;

import org.apiguardian.api.API;

/**
 * Plugin through which a virtual table chooses how it is accessed.
 *
 * <p>The planner calls {@link #advise} once for each position in the join
 * order at which the table is a candidate, each time with different
 * constraints marked usable. The advisor may be called several times for
 * the same query, and must not retain the request.
 */
@API(since = "1.0", status = API.Status.EXPERIMENTAL)
public interface IndexAdvisor {
  /**
   * Chooses an access strategy for the table.
   *
   * <p>An advice must not ask for the value of a constraint that the request
   * marks unusable; the planner rejects such an advice with
   * {@link org.apache.cairn.runtime.InvalidExternalPlanException}.
   *
   * @param request Constraints and ordering the query could exploit
   * @return Chosen strategy and its estimated cost
   */
  IndexAdvice advise(IndexAdvisorRequest request);
}
