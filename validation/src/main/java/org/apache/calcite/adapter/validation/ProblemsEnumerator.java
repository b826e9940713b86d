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

import org.apache.calcite.adapter.validation.table.FieldIndex;
import org.apache.calcite.adapter.validation.table.Record;
import org.apache.calcite.adapter.validation.table.RowTable;
import org.apache.calcite.linq4j.Enumerator;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Runs one validation pass over a table, producing problems on demand.
 *
 * <p>Nothing is read until the first call to {@link #moveNext()}. That call
 * pulls the table's header, compares it with the expected header and compiles
 * the constraints. Data rows are then read one at a time, and within a row the
 * constraints are applied one at a time, only as far as needed to find the
 * next problem.
 *
 * <p>For each data row the length check comes first, then each constraint in
 * declaration order: extract the target, run the test, run the assertion. A
 * failed extraction skips the test and assertion for that constraint; any
 * other failure is reported and evaluation carries on.
 *
 * <p>{@link #reset()} discards the pass and starts a new one.
 */
class ProblemsEnumerator implements Enumerator<Problem> {
  private static final Logger LOGGER = LoggerFactory.getLogger(ProblemsEnumerator.class);

  private final RowTable table;
  private final @Nullable List<Constraint> constraints;
  private final @Nullable List<?> expectedHeader;

  private final Deque<Problem> pending = new ArrayDeque<Problem>(2);
  private @Nullable Iterator<List<?>> rows;
  private List<CompiledConstraint> compiled = ImmutableList.of();
  private @Nullable FieldIndex index;
  private @Nullable Record record;
  private int cursor;
  private long rowNumber;
  private long problemCount;
  private boolean started;
  private boolean done;
  private @Nullable Problem current;

  ProblemsEnumerator(RowTable table, @Nullable List<Constraint> constraints,
      @Nullable List<?> expectedHeader) {
    this.table = table;
    this.constraints = constraints;
    this.expectedHeader = expectedHeader;
  }

  @Override public Problem current() {
    if (current == null) {
      throw new NoSuchElementException();
    }
    return current;
  }

  @Override public boolean moveNext() {
    while (true) {
      if (!pending.isEmpty()) {
        current = pending.poll();
        problemCount++;
        LOGGER.trace("{}", current);
        return true;
      }
      if (done) {
        current = null;
        return false;
      }
      if (!started) {
        start();
      } else if (record != null && cursor < compiled.size()) {
        evaluate(compiled.get(cursor++), record);
      } else if (rows != null && rows.hasNext()) {
        nextRow(rows.next());
      } else {
        finish();
      }
    }
  }

  private void start() {
    started = true;
    Iterator<List<?>> iterator = table.iterator();
    rows = iterator;
    final List<String> actual = iterator.hasNext()
        ? normalize(iterator.next())
        : ImmutableList.<String>of();
    final List<String> fields;
    if (expectedHeader == null) {
      fields = actual;
    } else {
      fields = normalize(expectedHeader);
      if (!fields.equals(actual)) {
        LOGGER.debug("Header mismatch: expected {} but was {}", fields, actual);
        pending.add(Problem.headerMismatch());
      }
    }
    index = FieldIndex.of(fields);
    try {
      compiled = ConstraintCompiler.compile(constraints, index);
    } catch (RuntimeException e) {
      // the pass cannot continue; release the table before propagating
      pending.clear();
      done = true;
      close();
      throw e;
    }
    LOGGER.debug("Validating {} against {} fields with {} constraints",
        table, fields.size(), compiled.size());
  }

  private void nextRow(List<?> row) {
    rowNumber++;
    final FieldIndex fieldIndex = index;
    if (fieldIndex == null) {
      throw new IllegalStateException("Row read before header");
    }
    if (row.size() != fieldIndex.size()) {
      pending.add(Problem.rowLengthMismatch(rowNumber, row.size()));
    }
    record = new Record(row, fieldIndex);
    cursor = 0;
  }

  private void evaluate(CompiledConstraint compiledConstraint, Record row) {
    if (compiledConstraint.isSkipped()) {
      return;
    }
    final Constraint constraint = compiledConstraint.constraint();
    final String name = constraint.getName();
    final String field = constraint.getFieldLabel();
    final Object target;
    try {
      target = compiledConstraint.extract(row);
    } catch (Exception | AssertionError e) {
      pending.add(
          new Problem(name, rowNumber, field, null, ErrorKind.EXTRACTION_FAILURE, causeOf(e)));
      return;
    }
    final Object value = constraint.hasFields() ? target : null;

    final Constraint.ValueTest test = constraint.getTest();
    if (test != null) {
      try {
        test.test(target);
      } catch (Exception | AssertionError e) {
        pending.add(
            new Problem(name, rowNumber, field, value, ErrorKind.TEST_FAILURE, causeOf(e)));
      }
    }

    final Constraint.ValueAssertion assertion = constraint.getAssertion();
    if (assertion != null) {
      try {
        if (!assertion.check(target)) {
          pending.add(
              new Problem(name, rowNumber, field, value, ErrorKind.ASSERTION_FAILURE, null));
        }
      } catch (Exception | AssertionError e) {
        pending.add(
            new Problem(name, rowNumber, field, value, ErrorKind.ASSERTION_FAILURE, causeOf(e)));
      }
    }
  }

  private void finish() {
    done = true;
    record = null;
    LOGGER.debug("Validated {} rows of {}: {} problems", rowNumber, table, problemCount);
    close();
  }

  private static String causeOf(Throwable e) {
    return e.getClass().getSimpleName();
  }

  private static List<String> normalize(List<?> header) {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (Object field : header) {
      builder.add(String.valueOf(field));
    }
    return builder.build();
  }

  @Override public void reset() {
    close();
    pending.clear();
    rows = null;
    compiled = ImmutableList.of();
    index = null;
    record = null;
    cursor = 0;
    rowNumber = 0;
    problemCount = 0;
    started = false;
    done = false;
    current = null;
  }

  /** Closes the current row iterator, at most once per pass. */
  @Override public void close() {
    final Iterator<List<?>> iterator = rows;
    rows = null;
    if (iterator instanceof AutoCloseable) {
      try {
        ((AutoCloseable) iterator).close();
      } catch (RuntimeException e) {
        throw e;
      } catch (Exception e) {
        throw new RuntimeException(e);
      }
    }
  }
}
