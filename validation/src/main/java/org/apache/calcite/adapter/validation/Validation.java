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
package org.apache.calcite.adapter.validation;

import org.apache.calcite.adapter.validation.table.RowTable;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Entry point for validating tables.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * RowTable table = Tables.of(
 *     Arrays.asList("foo", "bar"),
 *     Arrays.asList(1, "a"),
 *     Arrays.asList(-1, "b"),
 *     Arrays.asList(2, "c", "extra"));
 * List<Constraint> constraints = Collections.singletonList(
 *     Constraint.builder("foo_pos")
 *         .field("foo")
 *         .assertion(v -> ((Integer) v) > 0)
 *         .build());
 *
 * for (Problem problem : Validation.validate(table, constraints).problems()) {
 *   // foo_pos at row 2 (AssertionFailure), __len__ at row 3 (RowLengthMismatch)
 * }
 * }</pre>
 *
 * <p>Validation never stops at a failing row or constraint; every failure is
 * reported as a {@link Problem}. The only error raised to the caller is a
 * {@link org.apache.calcite.adapter.validation.table.FieldSelectionException}
 * for a non-optional constraint whose field is not in the header, and it is
 * raised when the view is first read, not here.
 */
public final class Validation {

  private Validation() {
  }

  /**
   * Validates only the structure of a table: every data row must have as
   * many values as the header has fields.
   */
  public static ProblemsView validate(RowTable table) {
    return validate(table, null, null);
  }

  /**
   * Validates a table against constraints, using its own header.
   */
  public static ProblemsView validate(RowTable table,
      @Nullable List<Constraint> constraints) {
    return validate(table, constraints, null);
  }

  /**
   * Validates a table against constraints and an expected header.
   *
   * @param table Table to validate; must support repeated iteration
   * @param constraints Constraints applied to every data row, or null
   * @param header Expected header, or null to accept the table's own. When
   *     given, it is the header fields are resolved against, whether or not
   *     the table's header matches it
   * @return A lazy, re-iterable view of the problems
   */
  public static ProblemsView validate(RowTable table,
      @Nullable List<Constraint> constraints, @Nullable List<?> header) {
    return new ProblemsView(table, constraints, header);
  }
}
