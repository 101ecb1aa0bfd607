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

import org.apache.cairn.plan.where.AccessPath;
import org.apache.cairn.plan.where.AccessStep;
import org.apache.cairn.plan.where.Conjunct;
import org.apache.cairn.plan.where.ConjunctList;
import org.apache.cairn.plan.where.FromItem;

import org.apiguardian.api.API;

import java.util.EventListener;
import java.util.EventObject;

/**
 * PlannerListener defines an interface for listening to events which occur
 * while the WHERE planner analyzes a predicate and orders a join.
 */
@API(since = "1.0", status = API.Status.EXPERIMENTAL)
public interface PlannerListener extends EventListener {
  //~ Methods ----------------------------------------------------------------

  /**
   * Notifies this listener that conjunct analysis has appended a derived
   * conjunct to a list.
   *
   * @param event details about the event
   */
  void conjunctDerived(ConjunctDerivedEvent event);

  /**
   * Notifies this listener that the cost model has priced an access path for
   * a FROM item at a particular join position. Called for every candidate,
   * chosen or not.
   *
   * @param event details about the event
   */
  void accessPathCosted(AccessPathCostedEvent event);

  /**
   * Notifies this listener that a FROM item and its access path have been
   * committed to a join position.
   *
   * @param event details about the event
   */
  void accessStepChosen(AccessStepChosenEvent event);

  //~ Inner Classes ----------------------------------------------------------

  /** Reason a conjunct was derived. */
  enum Derivation {
    /** Commuted copy of a comparison between two columns. */
    COMMUTE,
    /** One bound of a BETWEEN. */
    BETWEEN,
    /** IN list that replaces an OR of equalities. */
    OR_TO_IN,
    /** Range derived from the literal prefix of a LIKE or GLOB pattern. */
    LIKE_PREFIX,
    /** Full-text constraint derived from a MATCH function call. */
    MATCH
  }

  /** Event indicating that a conjunct has been derived. */
  class ConjunctDerivedEvent extends EventObject {
    private final ConjunctList conjuncts;
    private final int index;
    private final Derivation derivation;

    public ConjunctDerivedEvent(Object eventSource, ConjunctList conjuncts,
        int index, Derivation derivation) {
      super(eventSource);
      this.conjuncts = conjuncts;
      this.index = index;
      this.derivation = derivation;
    }

    public ConjunctList getConjuncts() {
      return conjuncts;
    }

    /** Returns the position of the derived conjunct in its list. */
    public int getIndex() {
      return index;
    }

    public Conjunct getConjunct() {
      return conjuncts.get(index);
    }

    public Derivation getDerivation() {
      return derivation;
    }
  }

  /** Event indicating that an access path has been priced. */
  class AccessPathCostedEvent extends EventObject {
    private final FromItem item;
    private final int position;
    private final AccessPath path;

    public AccessPathCostedEvent(Object eventSource, FromItem item,
        int position, AccessPath path) {
      super(eventSource);
      this.item = item;
      this.position = position;
      this.path = path;
    }

    public FromItem getItem() {
      return item;
    }

    /** Returns the join position being filled. */
    public int getPosition() {
      return position;
    }

    public AccessPath getPath() {
      return path;
    }
  }

  /** Event indicating that an access step has been chosen. */
  class AccessStepChosenEvent extends EventObject {
    private final AccessStep step;

    public AccessStepChosenEvent(Object eventSource, AccessStep step) {
      super(eventSource);
      this.step = step;
    }

    public AccessStep getStep() {
      return step;
    }
  }
}
