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
import org.apache.calcite.adapter.validation.table.FieldSelectionException;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Resolves the fields named by constraints to positions in a header.
 *
 * <p>For every constraint that has no getter of its own:
 * <ul>
 *   <li>no fields: left without a getter, so it receives the whole row;</li>
 *   <li>optional, with a field the header lacks: marked skipped;</li>
 *   <li>otherwise: given a getter that reads the field's position, or a list
 *       of positions when several fields are named.</li>
 * </ul>
 *
 * <p>A field that is missing and not optional is a configuration error and
 * fails with {@link FieldSelectionException}.
 */
public final class ConstraintCompiler {
  private static final Logger LOGGER = LoggerFactory.getLogger(ConstraintCompiler.class);

  private ConstraintCompiler() {
  }

  /**
   * Compiles constraints against a header.
   *
   * @param constraints Constraints in declaration order, or null
   * @param index Effective header
   * @return Compiled constraints in the same order
   * @throws FieldSelectionException if a non-optional field is missing
   */
  static List<CompiledConstraint> compile(@Nullable List<Constraint> constraints,
      FieldIndex index) {
    if (constraints == null || constraints.isEmpty()) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<CompiledConstraint> compiled = ImmutableList.builder();
    for (Constraint constraint : constraints) {
      compiled.add(compile(constraint, index));
    }
    return compiled.build();
  }

  /**
   * Compiles a single constraint.
   *
   * @param constraint Constraint to compile
   * @param index Effective header
   * @return The compiled constraint
   */
  static CompiledConstraint compile(Constraint constraint, FieldIndex index) {
    if (constraint.getGetter() != null) {
      return new CompiledConstraint(constraint, constraint.getGetter(), false);
    }
    if (!constraint.hasFields()) {
      return new CompiledConstraint(constraint, null, false);
    }
    if (constraint.isOptional()) {
      for (String field : constraint.getFields()) {
        if (!index.contains(field)) {
          LOGGER.debug("Skipping optional constraint '{}': field '{}' not in header {}",
              constraint.getName(), field, index.fields());
          return new CompiledConstraint(constraint, null, true);
        }
      }
    }
    final int[] positions = index.select(constraint.getFields());
    return new CompiledConstraint(constraint, getter(positions), false);
  }

  private static Constraint.Getter getter(final int[] positions) {
    if (positions.length == 1) {
      final int position = positions[0];
      return row -> row.get(position);
    }
    return row -> {
      List<@Nullable Object> values = new ArrayList<@Nullable Object>(positions.length);
      for (int position : positions) {
        values.add(row.get(position));
      }
      return Collections.unmodifiableList(values);
    };
  }
}
