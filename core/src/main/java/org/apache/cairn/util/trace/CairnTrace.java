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
package org.apache.cairn.util.trace;

import org.apache.cairn.plan.where.ConjunctAnalyzer;
import org.apache.cairn.plan.where.WherePlanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Contains all of the {@link org.slf4j.Logger tracers} used within
 * org.apache.cairn class libraries.
 *
 * <h2>Note to developers</h2>
 *
 * <p>Please ensure that every tracer used in org.apache.cairn is added to
 * this class as a <em>public static</em> method called <code>
 * get<i>Component</i>Tracer</code>. The javadoc in this file is the primary
 * source of information on what tracers are available, so the javadoc against
 * each tracer must be an up-to-date description of what that tracer does.
 *
 * <p>In the class where the tracer is used, create a <em>private</em> (or
 * perhaps <em>protected</em>) <em>static final</em> member called
 * <code>LOGGER</code>.
 */
public abstract class CairnTrace {
  private CairnTrace() {
  }

  /**
   * The "org.apache.cairn.plan.where.WherePlanner" tracer prints the join
   * ordering and index selection process.
   *
   * <p>Levels:
   *
   * <ul>
   * <li>DEBUG prints the access step chosen for each join position, and
   * listener events;
   * <li>TRACE prints the cost of every candidate table and index.
   * </ul>
   */
  public static Logger getPlannerTracer() {
    return LoggerFactory.getLogger(WherePlanner.class.getName());
  }

  /**
   * The "org.apache.cairn.plan.where.ConjunctAnalyzer" tracer prints the
   * conjuncts derived while analyzing a WHERE clause, at level DEBUG.
   */
  public static Logger getAnalyzerTracer() {
    return LoggerFactory.getLogger(ConjunctAnalyzer.class.getName());
  }
}
