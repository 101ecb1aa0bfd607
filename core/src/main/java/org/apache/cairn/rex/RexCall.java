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
package org.apache.cairn.rex;

import org.apache.cairn.sql.SqlKind;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * An expression formed by a call to an operator with zero or more expressions
 * as operands.
 *
 * <p>Operators are identified by {@link SqlKind}; a call of kind
 * {@link SqlKind#OTHER_FUNCTION} also carries the name of the function.
 *
 * <p>Operand conventions: AND and OR are n-ary; {@code x IN (a, b)} has
 * operands {@code [x, a, b]}; {@code x BETWEEN lo AND hi} has operands
 * {@code [x, lo, hi]}; {@code x LIKE p ESCAPE e} has operands
 * {@code [x, p, e]}.
 */
public class RexCall extends RexNode {
  //~ Instance fields --------------------------------------------------------

  private final SqlKind kind;
  public final ImmutableList<RexNode> operands;
  private final @Nullable String functionName;

  //~ Constructors -----------------------------------------------------------

  protected RexCall(SqlKind kind, List<? extends RexNode> operands,
      @Nullable String functionName) {
    this(kind, ImmutableList.copyOf(operands), functionName,
        computeDigest(kind, functionName, operands));
  }

  protected RexCall(SqlKind kind, ImmutableList<RexNode> operands,
      @Nullable String functionName, String digest) {
    super(digest);
    this.kind = requireNonNull(kind, "kind");
    this.operands = operands;
    this.functionName = functionName;
    assert kind != SqlKind.OTHER_FUNCTION || functionName != null
        : "function call requires a name";
  }

  //~ Methods ----------------------------------------------------------------

  private static String computeDigest(SqlKind kind,
      @Nullable String functionName, List<? extends RexNode> operands) {
    final StringBuilder sb = new StringBuilder();
    sb.append(functionName != null ? functionName : kind.sql).append('(');
    for (int i = 0; i < operands.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(operands.get(i));
    }
    return sb.append(')').toString();
  }

  @Override public SqlKind getKind() {
    return kind;
  }

  public List<RexNode> getOperands() {
    return operands;
  }

  public RexNode operand(int i) {
    return operands.get(i);
  }

  /** Returns the name of the function, if this is a call to a named
   * function, otherwise null. */
  public @Nullable String getFunctionName() {
    return functionName;
  }

  /** Returns whether this is a call to the function of the given name,
   * ignoring case. */
  public boolean isFunction(String name) {
    return kind == SqlKind.OTHER_FUNCTION
        && name.equalsIgnoreCase(functionName);
  }

  @Override public <R> R accept(RexVisitor<R> visitor) {
    return visitor.visitCall(this);
  }

  @Override public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    final RexCall that = (RexCall) obj;
    return kind == that.kind
        && operands.equals(that.operands)
        && Objects.equals(functionName, that.functionName);
  }

  @Override public int hashCode() {
    return Objects.hash(kind, operands, functionName);
  }
}
