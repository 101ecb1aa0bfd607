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

import org.apache.cairn.rex.RexCall;
import org.apache.cairn.rex.RexNode;
import org.apache.cairn.sql.SqlKind;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;

/**
 * Splits a predicate into the operands of its top-level AND (or OR) tree.
 *
 * <p>For example, splitting {@code a = 1 AND (b = 2 AND c > d)} on AND adds
 * three conjuncts: {@code a = 1}, {@code b = 2}, {@code c > d}.
 */
public abstract class ConjunctSplitter {
  private ConjunctSplitter() {
  }

  /**
   * Appends to {@code list} every maximal subtree of {@code predicate} that
   * is not a call of {@code kind}, in left-to-right order. Does nothing if
   * the predicate is null.
   */
  public static void split(@Nullable RexNode predicate, SqlKind kind,
      ConjunctList list) {
    split(predicate, kind, list, -1);
  }

  /**
   * Splits a predicate, recording the LEFT JOIN whose ON clause it came
   * from.
   *
   * @param rightJoinTable Handle of the right-hand table of the LEFT JOIN,
   *                       or -1 if the predicate is a WHERE clause
   */
  public static void split(@Nullable RexNode predicate, SqlKind kind,
      ConjunctList list, int rightJoinTable) {
    if (predicate == null) {
      return;
    }
    if (predicate.getKind() == kind && predicate instanceof RexCall) {
      for (RexNode operand : ((RexCall) predicate).operands) {
        split(operand, kind, list, rightJoinTable);
      }
    } else {
      list.add(predicate, Collections.emptySet(), rightJoinTable);
    }
  }
}
