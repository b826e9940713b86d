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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link Tables}.
 */
@Tag("unit")
public class TablesTest {

  @Test void testOf() {
    RowTable table = Tables.of(Arrays.asList("a", "b"),
        Arrays.asList(1, 2),
        Arrays.asList(3, 4));

    assertEquals(3, ImmutableList.copyOf(table).size());
    // each iteration starts from the header
    assertEquals(Arrays.asList("a", "b"), table.iterator().next());
    assertEquals(Arrays.asList("a", "b"), table.iterator().next());
  }

  @Test void testHeaderOnly() {
    RowTable table = Tables.of(Arrays.asList("a"));

    Iterator<List<?>> iterator = table.iterator();
    assertEquals(Arrays.asList("a"), iterator.next());
    assertFalse(iterator.hasNext());
  }

  @Test void testFromIterableIsReadOnly() {
    List<List<?>> rows = new java.util.ArrayList<List<?>>();
    rows.add(Arrays.asList("a"));
    RowTable table = Tables.fromIterable(rows);

    Iterator<List<?>> iterator = table.iterator();
    iterator.next();
    assertThrows(UnsupportedOperationException.class, iterator::remove);
    assertEquals(1, rows.size());
  }

  @Test void testSinglePass() {
    RowTable table = Tables.singlePass(
        Arrays.<List<?>>asList(Arrays.asList("a"), Arrays.asList(1)).iterator());

    assertEquals(2, ImmutableList.copyOf(table).size());
    IllegalStateException e =
        assertThrows(IllegalStateException.class, table::iterator);
    assertEquals("Single-pass table has already been consumed", e.getMessage());
  }
}
