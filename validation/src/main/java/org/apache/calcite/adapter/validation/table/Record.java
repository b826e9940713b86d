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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.AbstractList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * View of a positional row that can also be addressed by field name.
 *
 * <p>A record does not copy the row. Positions beyond the end of a short row
 * raise {@link IndexOutOfBoundsException}; names missing from the header raise
 * {@link FieldSelectionException}.
 */
public class Record extends AbstractList<@Nullable Object> {
  private final List<?> values;
  private final FieldIndex index;

  public Record(List<?> values, FieldIndex index) {
    this.values = values;
    this.index = index;
  }

  @Override public @Nullable Object get(int position) {
    return values.get(position);
  }

  /**
   * Returns the value of a named field.
   *
   * @param field Field name
   * @return The value, which may be null
   */
  public @Nullable Object get(String field) {
    return values.get(index.indexOf(field));
  }

  @Override public int size() {
    return values.size();
  }

  /** Returns the header this record resolves names against. */
  public List<String> fields() {
    return index.fields();
  }

  /**
   * Returns the record as a map of field name to value.
   *
   * <p>Fields the row is too short to hold are omitted; values beyond the
   * header are not included.
   */
  public Map<String, @Nullable Object> asMap() {
    Map<String, @Nullable Object> map = new LinkedHashMap<String, @Nullable Object>();
    List<String> fields = index.fields();
    int n = Math.min(fields.size(), values.size());
    for (int i = 0; i < n; i++) {
      map.putIfAbsent(fields.get(i), values.get(i));
    }
    return map;
  }
}
