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

import java.util.ArrayList;
import java.util.List;

/**
 * MulticastPlannerListener implements the {@link PlannerListener} interface
 * by forwarding events on to a collection of other listeners.
 */
public class MulticastPlannerListener implements PlannerListener {
  //~ Instance fields --------------------------------------------------------

  private final List<PlannerListener> listeners;

  //~ Constructors -----------------------------------------------------------

  /**
   * Creates a new empty multicast listener.
   */
  public MulticastPlannerListener() {
    listeners = new ArrayList<>();
  }

  //~ Methods ----------------------------------------------------------------

  /**
   * Adds a listener which will receive multicast events.
   *
   * @param listener listener to add
   */
  public void addListener(PlannerListener listener) {
    listeners.add(listener);
  }

  @Override public void conjunctDerived(ConjunctDerivedEvent event) {
    for (PlannerListener listener : listeners) {
      listener.conjunctDerived(event);
    }
  }

  @Override public void accessPathCosted(AccessPathCostedEvent event) {
    for (PlannerListener listener : listeners) {
      listener.accessPathCosted(event);
    }
  }

  @Override public void accessStepChosen(AccessStepChosenEvent event) {
    for (PlannerListener listener : listeners) {
      listener.accessStepChosen(event);
    }
  }
}
