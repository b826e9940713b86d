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

import java.util.Locale;

/**
 * Category of a validation failure, surfaced as the {@code error} column of a
 * problems report.
 *
 * <p>Symbols are stable and safe to persist or group by; they never carry
 * free-text messages. The exception class behind a failure, when there was
 * one, is kept separately as {@link Problem#getCause()}.
 */
public enum ErrorKind {
  /** Expected header differs from the actual header in names, order or count. */
  HEADER_MISMATCH("HeaderMismatch"),
  /** A data row has a different number of values than the effective header. */
  ROW_LENGTH_MISMATCH("RowLengthMismatch"),
  /** A constraint's getter could not produce a value from the row. */
  EXTRACTION_FAILURE("ExtractionFailure"),
  /** A constraint's test threw. */
  TEST_FAILURE("TestFailure"),
  /** A constraint's assertion returned false or threw. */
  ASSERTION_FAILURE("AssertionFailure");

  private final String symbol;

  ErrorKind(String symbol) {
    this.symbol = symbol;
  }

  /** Returns the symbolic name, e.g. {@code "HeaderMismatch"}. */
  public String getSymbol() {
    return symbol;
  }

  /**
   * Parses a symbol or enum constant name, case-insensitively.
   *
   * @param value Symbol such as {@code "TestFailure"} or {@code "TEST_FAILURE"}
   * @return The matching kind
   * @throws IllegalArgumentException if nothing matches
   */
  public static ErrorKind fromString(String value) {
    for (ErrorKind kind : values()) {
      if (kind.symbol.equalsIgnoreCase(value)
          || kind.name().equals(value.toUpperCase(Locale.ROOT))) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown error kind: " + value);
  }

  @Override public String toString() {
    return symbol;
  }
}
