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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * Constant value in a row-expression.
 *
 * <p>The value is a {@link String}, a {@link Long}, a {@link Double}, or
 * null for the SQL NULL literal.
 */
public class RexLiteral extends RexNode {
  private final @Nullable Comparable value;

  RexLiteral(@Nullable Comparable value) {
    super(digest(value));
    assert value == null
        || value instanceof String
        || value instanceof Long
        || value instanceof Double
        : "invalid literal value: " + value;
    this.value = value;
  }

  private static String digest(@Nullable Comparable value) {
    if (value == null) {
      return "NULL";
    }
    if (value instanceof String) {
      return "'" + ((String) value).replace("'", "''") + "'";
    }
    return value.toString();
  }

  public @Nullable Comparable getValue() {
    return value;
  }

  public boolean isNull() {
    return value == null;
  }

  /** Returns whether this literal is a character string. */
  public boolean isString() {
    return value instanceof String;
  }

  /** Returns the value of a character string literal.
   *
   * @throws IllegalStateException if this is not a character string */
  public String getStringValue() {
    if (!(value instanceof String)) {
      throw new IllegalStateException("not a string literal: " + digest);
    }
    return (String) value;
  }

  @Override public SqlKind getKind() {
    return SqlKind.LITERAL;
  }

  @Override public <R> R accept(RexVisitor<R> visitor) {
    return visitor.visitLiteral(this);
  }

  @Override public boolean equals(@Nullable Object obj) {
    return this == obj
        || obj instanceof RexLiteral
        && Objects.equals(value, ((RexLiteral) obj).value);
  }

  @Override public int hashCode() {
    return Objects.hashCode(value);
  }
}
