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
package org.apache.cairn.rel;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * Definition of the ordering of one column of a table or index.
 *
 * <p>Used for the key columns of an index, and to describe the ORDER BY
 * clause to an {@link org.apache.cairn.schema.IndexAdvisor}.
 */
public class RelFieldCollation {
  //~ Enums ------------------------------------------------------------------

  /**
   * Direction that a field is ordered in.
   */
  public enum Direction {
    /**
     * Ascending direction: A value is always followed by a greater or equal
     * value.
     */
    ASCENDING("ASC"),

    /**
     * Descending direction: A value is always followed by a lesser or equal
     * value.
     */
    DESCENDING("DESC");

    public final String shortString;

    Direction(String shortString) {
      this.shortString = shortString;
    }

    /** Returns whether this is {@link #DESCENDING}. */
    public boolean isDescending() {
      return this == DESCENDING;
    }

    /**
     * Returns the reverse of this direction.
     *
     * @return reverse of the input direction
     */
    public Direction reverse() {
      return this == ASCENDING ? DESCENDING : ASCENDING;
    }
  }

  //~ Instance fields --------------------------------------------------------

  /**
   * 0-based index of the column being sorted.
   */
  private final int fieldIndex;

  /**
   * Direction of sorting.
   */
  public final Direction direction;

  //~ Constructors -----------------------------------------------------------

  /**
   * Creates an ascending field collation.
   */
  public RelFieldCollation(int fieldIndex) {
    this(fieldIndex, Direction.ASCENDING);
  }

  /**
   * Creates a field collation.
   */
  public RelFieldCollation(int fieldIndex, Direction direction) {
    this.fieldIndex = fieldIndex;
    this.direction = Objects.requireNonNull(direction, "direction");
  }

  //~ Methods ----------------------------------------------------------------

  /** Creates a copy of this RelFieldCollation with a different direction. */
  public RelFieldCollation withDirection(Direction direction) {
    return this.direction == direction ? this
        : new RelFieldCollation(fieldIndex, direction);
  }

  @Override public boolean equals(@Nullable Object o) {
    return this == o
        || o instanceof RelFieldCollation
        && fieldIndex == ((RelFieldCollation) o).fieldIndex
        && direction == ((RelFieldCollation) o).direction;
  }

  @Override public int hashCode() {
    return Objects.hash(fieldIndex, direction);
  }

  public int getFieldIndex() {
    return fieldIndex;
  }

  public RelFieldCollation.Direction getDirection() {
    return direction;
  }

  @Override public String toString() {
    if (direction == Direction.ASCENDING) {
      return String.valueOf(fieldIndex);
    }
    return fieldIndex + " " + direction.shortString;
  }
}
