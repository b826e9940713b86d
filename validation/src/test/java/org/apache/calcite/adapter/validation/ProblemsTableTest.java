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

import org.apache.calcite.adapter.validation.table.RowTable;
import org.apache.calcite.adapter.validation.table.Tables;
import org.apache.calcite.jdbc.CalciteConnection;
import org.apache.calcite.jdbc.JavaTypeFactoryImpl;
import org.apache.calcite.rel.type.RelDataType;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ProblemsTable}.
 */
@Tag("unit")
public class ProblemsTableTest {

  private static ProblemsView view() {
    RowTable table = Tables.of(Arrays.asList("foo", "bar"),
        Arrays.asList(1, "a"),
        Arrays.asList(-1, "b"),
        Arrays.asList(-2, "c", "extra"));
    List<Constraint> constraints = Collections.singletonList(
        Constraint.builder("foo_pos")
            .field("foo")
            .assertion(v -> ((Integer) v) > 0)
            .build());
    return Validation.validate(table, constraints);
  }

  @Test void testRowType() {
    RelDataType rowType = new ProblemsTable(view()).getRowType(new JavaTypeFactoryImpl());

    assertEquals(Problem.REPORT_HEADER, rowType.getFieldNames());
    assertFalse(rowType.getFieldList().get(1).getType().isNullable());
    assertTrue(rowType.getFieldList().get(3).getType().isNullable());
  }

  @Test void testScan() {
    List<Object[]> rows = new ProblemsTable(view()).scan(null).toList();

    assertEquals(3, rows.size());
    assertArrayEquals(new Object[] {"foo_pos", 2L, "foo", -1, "AssertionFailure"}, rows.get(0));
    assertArrayEquals(new Object[] {"__len__", 3L, null, 3, "RowLengthMismatch"}, rows.get(1));
  }

  @Test void testQueryWithSql() throws Exception {
    try (Connection connection = DriverManager.getConnection("jdbc:calcite:")) {
      CalciteConnection calciteConnection = connection.unwrap(CalciteConnection.class);
      calciteConnection.getRootSchema().add("problems", new ProblemsTable(view()));

      List<String> found = new ArrayList<String>();
      try (Statement statement = connection.createStatement();
           ResultSet resultSet = statement.executeQuery(
               "select \"name\", \"row\" from \"problems\"\n"
                   + "where \"error\" = 'AssertionFailure'\n"
                   + "order by \"row\"")) {
        while (resultSet.next()) {
          found.add(resultSet.getString(1) + ":" + resultSet.getLong(2));
        }
      }

      assertEquals(Arrays.asList("foo_pos:2", "foo_pos:3"), found);
    }
  }
}
