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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Factory methods for {@link RowTable} instances.
 */
public final class Tables {

  private Tables() {
    // Utility class
  }

  /**
   * Creates an in-memory table.
   *
   * @param header Field names
   * @param rows Data rows
   * @return A table whose first row is {@code header}
   */
  public static RowTable of(List<?> header, List<?>... rows) {
    ImmutableList.Builder<List<?>> builder = ImmutableList.builder();
    builder.add(header);
    builder.addAll(Arrays.asList(rows));
    return fromIterable(builder.build());
  }

  /**
   * Wraps an iterable of rows. The iterable must support repeated iteration;
   * its first element is the header.
   *
   * @param rows Header followed by data rows
   * @return A table backed by {@code rows}
   */
  public static RowTable fromIterable(Iterable<? extends List<?>> rows) {
    return () -> Iterators.unmodifiableIterator(rows.iterator());
  }

  /**
   * Wraps rows that can only be read once, such as a network stream.
   *
   * <p>The returned table can be iterated a single time; any further attempt
   * fails with {@link IllegalStateException}. Re-iterating a problems view over
   * such a table therefore fails too.
   *
   * @param rows Header followed by data rows
   * @return A single-pass table
   */
  public static RowTable singlePass(Iterator<? extends List<?>> rows) {
    final AtomicBoolean consumed = new AtomicBoolean();
    return () -> {
      if (consumed.getAndSet(true)) {
        throw new IllegalStateException("Single-pass table has already been consumed");
      }
      return Iterators.unmodifiableIterator(rows);
    };
  }
}
