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
import org.apache.calcite.adapter.validation.table.Record;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ConstraintCompiler}.
 */
@Tag("unit")
public class ConstraintCompilerTest {

  private static final FieldIndex INDEX = FieldIndex.of(Arrays.asList("a", "b", "c"));
  private static final Record ROW = new Record(Arrays.asList(1, "two", 3.0), INDEX);

  @Test void testWholeRowConstraintHasNoGetter() throws Exception {
    CompiledConstraint compiled =
        ConstraintCompiler.compile(Constraint.builder("row").build(), INDEX);

    assertNull(compiled.getter());
    assertFalse(compiled.isSkipped());
    assertSame(ROW, compiled.extract(ROW));
  }

  @Test void testSingleFieldGetter() throws Exception {
    CompiledConstraint compiled =
        ConstraintCompiler.compile(Constraint.builder("b").field("b").build(), INDEX);

    assertNotNull(compiled.getter());
    assertEquals("two", compiled.extract(ROW));
  }

  @Test void testMultiFieldGetterKeepsNameOrder() throws Exception {
    CompiledConstraint compiled =
        ConstraintCompiler.compile(Constraint.builder("ca").fields("c", "a").build(), INDEX);

    assertEquals(Arrays.asList(3.0, 1), compiled.extract(ROW));
  }

  @Test void testOptionalMissingFieldIsSkipped() {
    CompiledConstraint compiled = ConstraintCompiler.compile(
        Constraint.builder("x").fields("a", "x").optional(true).build(), INDEX);

    assertTrue(compiled.isSkipped());
  }

  @Test void testOptionalPresentFieldIsCompiled() throws Exception {
    CompiledConstraint compiled = ConstraintCompiler.compile(
        Constraint.builder("a").field("a").optional(true).build(), INDEX);

    assertFalse(compiled.isSkipped());
    assertEquals(1, compiled.extract(ROW));
  }

  @Test void testRequiredMissingFieldFails() {
    FieldSelectionException e = assertThrows(FieldSelectionException.class,
        () -> ConstraintCompiler.compile(Constraint.builder("x").field("x").build(), INDEX));

    assertEquals("x", e.getField());
    assertTrue(e.getMessage().contains("[a, b, c]"));
  }

  @Test void testExplicitGetterIsKeptUnresolved() throws Exception {
    Constraint.Getter getter = row -> row.get(0);
    Constraint constraint = Constraint.builder("custom")
        .field("not_in_header")
        .getter(getter)
        .build();

    CompiledConstraint compiled = ConstraintCompiler.compile(constraint, INDEX);

    assertSame(getter, compiled.getter());
    assertEquals(1, compiled.extract(ROW));
  }

  @Test void testCompileListKeepsOrderAndInputs() {
    List<Constraint> constraints = Arrays.asList(
        Constraint.builder("first").field("c").build(),
        Constraint.builder("second").build(),
        Constraint.builder("third").field("z").optional(true).build());

    List<CompiledConstraint> compiled = ConstraintCompiler.compile(constraints, INDEX);

    assertEquals(3, compiled.size());
    assertSame(constraints.get(0), compiled.get(0).constraint());
    assertSame(constraints.get(1), compiled.get(1).constraint());
    assertTrue(compiled.get(2).isSkipped());
    assertNull(constraints.get(0).getGetter());
    assertEquals(Arrays.asList("c"), constraints.get(0).getFields());
  }

  @Test void testNoConstraints() {
    assertTrue(ConstraintCompiler.compile((List<Constraint>) null, INDEX).isEmpty());
    assertTrue(ConstraintCompiler.compile(Arrays.<Constraint>asList(), INDEX).isEmpty());
  }

  @Test void testShortRowFailsOnExtraction() throws Exception {
    CompiledConstraint compiled =
        ConstraintCompiler.compile(Constraint.builder("c").field("c").build(), INDEX);
    Record shortRow = new Record(Arrays.asList(1), INDEX);

    assertThrows(IndexOutOfBoundsException.class, () -> compiled.extract(shortRow));
  }
}
