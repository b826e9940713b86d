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
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves field names to positions within a header.
 *
 * <p>An index is built once per validation pass and shared, read-only, by
 * every {@link Record} of that pass. When a header repeats a name, the first
 * occurrence wins.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * FieldIndex index = FieldIndex.of(Arrays.asList("foo", "bar", "baz"));
 * int[] positions = index.select(Arrays.asList("baz", "foo")); // {2, 0}
 * }</pre>
 */
public final class FieldIndex {

  private final ImmutableList<String> fields;
  private final ImmutableMap<String, Integer> positions;

  private FieldIndex(ImmutableList<String> fields) {
    this.fields = fields;
    Map<String, Integer> map = new HashMap<String, Integer>();
    for (int i = 0; i < fields.size(); i++) {
      map.putIfAbsent(fields.get(i), i);
    }
    this.positions = ImmutableMap.copyOf(map);
  }

  /**
   * Creates an index over a header.
   *
   * @param fields Field names, in header order
   * @return A new FieldIndex
   */
  public static FieldIndex of(List<String> fields) {
    return new FieldIndex(ImmutableList.copyOf(fields));
  }

  /** Returns the header this index was built from. */
  public ImmutableList<String> fields() {
    return fields;
  }

  /** Returns the number of fields in the header. */
  public int size() {
    return fields.size();
  }

  /** Returns whether the header contains a field. */
  public boolean contains(@Nullable String name) {
    return name != null && positions.containsKey(name);
  }

  /**
   * Returns the position of a field.
   *
   * @param name Field name
   * @return Zero-based position
   * @throws FieldSelectionException if the header has no such field
   */
  public int indexOf(String name) {
    Integer position = positions.get(name);
    if (position == null) {
      throw new FieldSelectionException(name, fields);
    }
    return position;
  }

  /**
   * Returns the positions of several fields, in the order the names are given.
   *
   * @param names Field names
   * @return Zero-based positions
   * @throws FieldSelectionException if any name is absent
   */
  public int[] select(List<String> names) {
    int[] result = new int[names.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = indexOf(names.get(i));
    }
    return result;
  }

  @Override public String toString() {
    return "FieldIndex" + fields;
  }
}
