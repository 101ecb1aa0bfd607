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
package org.apache.cairn.plan;

import org.apache.cairn.util.trace.CairnTrace;

import org.slf4j.Logger;

/**
 * Listener that writes planner events to the planner tracer.
 */
public class LoggingPlannerListener implements PlannerListener {
  private static final Logger LOG = CairnTrace.getPlannerTracer();

  @Override public void conjunctDerived(ConjunctDerivedEvent event) {
    if (LOG.isDebugEnabled()) {
      LOG.debug("Derived conjunct #{} ({}): {}", event.getIndex(),
          event.getDerivation(), event.getConjunct());
    }
  }

  @Override public void accessPathCosted(AccessPathCostedEvent event) {
    if (LOG.isTraceEnabled()) {
      LOG.trace("Position {}: {} costs {}", event.getPosition(),
          event.getItem(), event.getPath());
    }
  }

  @Override public void accessStepChosen(AccessStepChosenEvent event) {
    if (LOG.isDebugEnabled()) {
      LOG.debug("Chose {}", event.getStep());
    }
  }
}
