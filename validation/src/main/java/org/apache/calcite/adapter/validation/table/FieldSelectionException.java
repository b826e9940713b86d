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

import java.util.List;

/**
 * Indicates that one or more field names could not be resolved against a header.
 *
 * <p>Raised while constraints are compiled. It is a configuration error,
 * never a row-level problem, so it propagates to the caller of the pass.
 */
public class FieldSelectionException extends RuntimeException {
  private final String field;
  private final List<String> available;

  public FieldSelectionException(String field, List<String> available) {
    super("Field '" + field + "' not found in header " + available);
    this.field = field;
    this.available = available;
  }

  /** Returns the name that could not be resolved. */
  public String getField() {
    return field;
  }

  /** Returns the header the name was resolved against. */
  public List<String> getAvailable() {
    return available;
  }
}
