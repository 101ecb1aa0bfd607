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
 * Thrown when the planner cannot allocate more space for conjuncts.
 *
 * <p>Conjunct storage is bounded by
 * {@link org.apache.cairn.config.CairnSystemProperty#MAX_CONJUNCTS}; analysis
 * of a pathological predicate (for instance a huge chain of BETWEEN and LIKE
 * terms, each of which derives more conjuncts) hits that bound rather than
 * exhausting the heap. The planner never retries.
 */
public class PlannerOutOfMemoryException extends CairnException {
  private static final long serialVersionUID = 6005393219784312487L;

  public PlannerOutOfMemoryException(int capacity) {
    super(
        String.format(Locale.ROOT,
            "out of memory: WHERE clause needs more than %d conjuncts",
            capacity));
  }
}
