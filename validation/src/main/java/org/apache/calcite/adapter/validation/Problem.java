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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One validation failure found in a table.
 *
 * <p>A problem reports the constraint that failed (or one of the reserved
 * names {@link #HEADER} and {@link #LENGTH} for structural checks), the
 * 1-based data row it was found in (0 for the header), the field and value
 * involved when there are any, and the {@link ErrorKind}.
 */
public final class Problem {

  /** Name of the problem raised when the header does not match. */
  public static final String HEADER = "__header__";

  /** Name of the problem raised when a row has the wrong number of values. */
  public static final String LENGTH = "__len__";

  /** Column names of a problems report. */
  public static final List<String> REPORT_HEADER =
      ImmutableList.of("name", "row", "field", "value", "error");

  private final @Nullable String name;
  private final long row;
  private final @Nullable String field;
  private final @Nullable Object value;
  private final ErrorKind error;
  private final @Nullable String cause;

  public Problem(@Nullable String name, long row, @Nullable String field,
      @Nullable Object value, ErrorKind error, @Nullable String cause) {
    this.name = name;
    this.row = row;
    this.field = field;
    this.value = value;
    this.error = Objects.requireNonNull(error, "error");
    this.cause = cause;
  }

  /** Creates the problem reported when the expected header does not match. */
  public static Problem headerMismatch() {
    return new Problem(HEADER, 0, null, null, ErrorKind.HEADER_MISMATCH, null);
  }

  /** Creates the problem reported when a row has {@code length} values. */
  public static Problem rowLengthMismatch(long row, int length) {
    return new Problem(LENGTH, row, null, length, ErrorKind.ROW_LENGTH_MISMATCH, null);
  }

  public @Nullable String getName() {
    return name;
  }

  /** Returns the 1-based data row number, or 0 for a header problem. */
  public long getRow() {
    return row;
  }

  public @Nullable String getField() {
    return field;
  }

  public @Nullable Object getValue() {
    return value;
  }

  public ErrorKind getError() {
    return error;
  }

  /**
   * Returns the simple class name of the exception behind this problem, such
   * as {@code "NumberFormatException"}, or null if the failure was not an
   * exception (an assertion that returned false, a structural mismatch).
   */
  public @Nullable String getCause() {
    return cause;
  }

  /** Returns whether this problem comes from a header or row-length check. */
  public boolean isStructural() {
    return error == ErrorKind.HEADER_MISMATCH || error == ErrorKind.ROW_LENGTH_MISMATCH;
  }

  /**
   * Returns this problem as a report row shaped like {@link #REPORT_HEADER},
   * with the error as its symbol.
   */
  public List<@Nullable Object> toList() {
    return Arrays.asList(toArray());
  }

  /** Returns this problem as an array shaped like {@link #REPORT_HEADER}. */
  public @Nullable Object[] toArray() {
    return new Object[] {name, row, field, value, error.getSymbol()};
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Problem)) {
      return false;
    }
    Problem that = (Problem) o;
    return row == that.row
        && Objects.equals(name, that.name)
        && Objects.equals(field, that.field)
        && Objects.equals(value, that.value)
        && error == that.error
        && Objects.equals(cause, that.cause);
  }

  @Override public int hashCode() {
    return Objects.hash(name, row, field, value, error, cause);
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("Problem{name='").append(name).append("', row=").append(row);
    if (field != null) {
      sb.append(", field='").append(field).append("'");
    }
    if (value != null) {
      sb.append(", value=").append(value);
    }
    sb.append(", error=").append(error.getSymbol());
    if (cause != null) {
      sb.append(", cause=").append(cause);
    }
    sb.append("}");
    return sb.toString();
  }
}
