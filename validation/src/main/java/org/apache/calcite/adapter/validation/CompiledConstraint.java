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

import org.apache.calcite.adapter.validation.table.Record;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@link Constraint} resolved against one header, ready to apply to rows.
 *
 * <p>Produced by {@link ConstraintCompiler} once per validation pass; the
 * getter is reused unchanged for every row of that pass.
 */
final class CompiledConstraint {
  private final Constraint constraint;
  private final Constraint.@Nullable Getter getter;
  private final boolean skipped;

  CompiledConstraint(Constraint constraint, Constraint.@Nullable Getter getter,
      boolean skipped) {
    this.constraint = constraint;
    this.getter = getter;
    this.skipped = skipped;
  }

  Constraint constraint() {
    return constraint;
  }

  Constraint.@Nullable Getter getter() {
    return getter;
  }

  /** Whether the constraint is optional and names a field the header lacks. */
  boolean isSkipped() {
    return skipped;
  }

  /** Returns the value to judge; the record itself when there is no getter. */
  @Nullable Object extract(Record row) throws Exception {
    return getter == null ? row : getter.get(row);
  }

  @Override public String toString() {
    return "CompiledConstraint{" + constraint + (skipped ? ", skipped" : "") + "}";
  }
}
