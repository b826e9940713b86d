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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link Problem} and {@link ErrorKind}.
 */
@Tag("unit")
public class ProblemTest {

  @Test void testErrorKindSymbols() {
    assertEquals("HeaderMismatch", ErrorKind.HEADER_MISMATCH.getSymbol());
    assertEquals("RowLengthMismatch", ErrorKind.ROW_LENGTH_MISMATCH.getSymbol());
    assertEquals("ExtractionFailure", ErrorKind.EXTRACTION_FAILURE.getSymbol());
    assertEquals("TestFailure", ErrorKind.TEST_FAILURE.getSymbol());
    assertEquals("AssertionFailure", ErrorKind.ASSERTION_FAILURE.toString());
  }

  @Test void testErrorKindFromString() {
    assertEquals(ErrorKind.TEST_FAILURE, ErrorKind.fromString("TestFailure"));
    assertEquals(ErrorKind.TEST_FAILURE, ErrorKind.fromString("testfailure"));
    assertEquals(ErrorKind.TEST_FAILURE, ErrorKind.fromString("test_failure"));
    assertThrows(IllegalArgumentException.class, () -> ErrorKind.fromString("Oops"));
  }

  @Test void testStructuralProblems() {
    Problem header = Problem.headerMismatch();
    assertEquals(Problem.HEADER, header.getName());
    assertEquals(0, header.getRow());
    assertEquals(ErrorKind.HEADER_MISMATCH, header.getError());
    assertTrue(header.isStructural());

    Problem length = Problem.rowLengthMismatch(4, 7);
    assertEquals(Problem.LENGTH, length.getName());
    assertEquals(4, length.getRow());
    assertEquals(7, length.getValue());
    assertTrue(length.isStructural());
  }

  @Test void testReportRow() {
    Problem problem =
        new Problem("foo_int", 2, "foo", "x", ErrorKind.TEST_FAILURE, "NumberFormatException");

    assertEquals(Arrays.asList("foo_int", 2L, "foo", "x", "TestFailure"), problem.toList());
    assertArrayEquals(new Object[] {"foo_int", 2L, "foo", "x", "TestFailure"},
        problem.toArray());
    assertEquals(Problem.REPORT_HEADER.size(), problem.toList().size());
    assertFalse(problem.isStructural());
  }

  @Test void testRowNumberBeyondIntRange() {
    long row = Integer.MAX_VALUE + 5L;
    Problem problem = Problem.rowLengthMismatch(row, 3);

    assertEquals(row, problem.getRow());
    assertEquals(row, problem.toArray()[1]);
  }

  @Test void testEquality() {
    Problem a = new Problem("n", 1, "n", 5, ErrorKind.ASSERTION_FAILURE, null);
    Problem b = new Problem("n", 1, "n", 5, ErrorKind.ASSERTION_FAILURE, null);
    Problem c = new Problem("n", 1, "n", 5, ErrorKind.ASSERTION_FAILURE, "ClassCastException");

    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, c);
  }

  @Test void testToString() {
    String s = new Problem("n", 3, "n", 5, ErrorKind.TEST_FAILURE, "NumberFormatException")
        .toString();
    assertTrue(s.contains("row=3"));
    assertTrue(s.contains("TestFailure"));
    assertTrue(s.contains("NumberFormatException"));
  }
}
