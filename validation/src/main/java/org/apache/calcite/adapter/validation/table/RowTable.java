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
package org.apache.calcite.adapter.validation.table;

import org.apache.calcite.adapter.validation.Constraint;
import org.apache.calcite.adapter.validation.ProblemsView;
import org.apache.calcite.adapter.validation.Validation;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Tabular data that can be iterated any number of times.
 *
 * <p>Every call to {@link #iterator()} starts again from the beginning. The
 * first row is the header (field names); the remaining rows are data rows.
 * Rows must not be null.
 *
 * <p>An iterator that holds a resource (an open file, say) should implement
 * {@link AutoCloseable}; consumers that stop early close it.
 *
 * @see Tables
 * @see CsvRowTable
 */
public interface RowTable extends Iterable<List<?>> {

  /**
   * Validates this table.
   *
   * @param constraints Constraints to apply to every data row, or null
   * @param header Expected header, or null to accept the table's own header
   * @return A lazy view of the problems found
   * @see Validation#validate(RowTable, List, List)
   */
  default ProblemsView validate(@Nullable List<Constraint> constraints,
      @Nullable List<?> header) {
    return Validation.validate(this, constraints, header);
  }
}
