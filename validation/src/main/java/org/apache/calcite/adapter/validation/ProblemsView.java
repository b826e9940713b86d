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
import org.apache.calcite.linq4j.AbstractEnumerable;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Enumerator;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy report of the problems found in a table.
 *
 * <p>A view holds no results. Each iteration runs a new validation pass over
 * the table: the header is pulled again, constraints are compiled again and
 * rows are scanned only as far as the consumer reads.
 *
 * <p>Iterated as a {@link RowTable}, the view yields
 * {@link Problem#REPORT_HEADER} followed by one row per problem, so a report
 * can itself be handed to anything that consumes tables. {@link #problems()}
 * yields the same problems as typed {@link Problem} objects.
 *
 * @see Validation#validate(RowTable, List, List)
 */
public class ProblemsView implements RowTable {
  private final RowTable table;
  private final @Nullable List<Constraint> constraints;
  private final @Nullable List<?> header;

  ProblemsView(RowTable table, @Nullable List<Constraint> constraints,
      @Nullable List<?> header) {
    this.table = table;
    this.constraints = constraints == null ? null : ImmutableList.copyOf(constraints);
    this.header = header == null
        ? null
        : Collections.unmodifiableList(new ArrayList<Object>(header));
  }

  /** Returns the table being validated. */
  public RowTable getTable() {
    return table;
  }

  /** Returns the constraints, or null if only structure is validated. */
  public @Nullable List<Constraint> getConstraints() {
    return constraints;
  }

  /** Returns the expected header, or null if the table's own header is used. */
  public @Nullable List<?> getHeader() {
    return header;
  }

  /**
   * Returns the problems as an enumerable. Each enumerator runs its own pass.
   */
  public Enumerable<Problem> problems() {
    return new AbstractEnumerable<Problem>() {
      @Override public Enumerator<Problem> enumerator() {
        return new ProblemsEnumerator(table, constraints, header);
      }
    };
  }

  @Override public Iterator<List<?>> iterator() {
    return new ReportIterator(new ProblemsEnumerator(table, constraints, header));
  }

  @Override public String toString() {
    return "ProblemsView{table=" + table
        + ", constraints=" + (constraints == null ? 0 : constraints.size())
        + (header == null ? "" : ", header=" + header) + "}";
  }

  /**
   * Yields the report header and then one row per problem.
   */
  private static class ReportIterator implements Iterator<List<?>>, AutoCloseable {
    private final Enumerator<Problem> enumerator;
    private boolean headerReturned;
    private @Nullable Boolean ahead;

    ReportIterator(Enumerator<Problem> enumerator) {
      this.enumerator = enumerator;
    }

    @Override public boolean hasNext() {
      if (!headerReturned) {
        return true;
      }
      if (ahead == null) {
        ahead = enumerator.moveNext();
      }
      return ahead;
    }

    @Override public List<?> next() {
      if (!headerReturned) {
        headerReturned = true;
        return Problem.REPORT_HEADER;
      }
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      ahead = null;
      return enumerator.current().toList();
    }

    @Override public void close() {
      enumerator.close();
    }
  }
}
