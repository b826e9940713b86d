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

import org.apache.calcite.DataContext;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.schema.ScannableTable;
import org.apache.calcite.schema.impl.AbstractTable;
import org.apache.calcite.sql.type.SqlTypeName;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Exposes a {@link ProblemsView} as a Calcite table, so that a validation
 * report can be filtered, grouped and joined with SQL.
 *
 * <p>Columns follow {@link Problem#REPORT_HEADER}: {@code name VARCHAR},
 * {@code row BIGINT}, {@code field VARCHAR}, {@code value ANY} and
 * {@code error VARCHAR}. Every scan runs a new validation pass.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * rootSchema.add("problems", new ProblemsTable(table.validate(constraints, null)));
 * // select "name", count(*) from "problems" group by "name"
 * }</pre>
 */
public class ProblemsTable extends AbstractTable implements ScannableTable {
  private final ProblemsView view;

  public ProblemsTable(ProblemsView view) {
    this.view = view;
  }

  public ProblemsView getView() {
    return view;
  }

  @Override public RelDataType getRowType(RelDataTypeFactory typeFactory) {
    return typeFactory.builder()
        .add("name", SqlTypeName.VARCHAR).nullable(true)
        .add("row", SqlTypeName.BIGINT)
        .add("field", SqlTypeName.VARCHAR).nullable(true)
        .add("value", SqlTypeName.ANY).nullable(true)
        .add("error", SqlTypeName.VARCHAR)
        .build();
  }

  @Override public Enumerable<@Nullable Object[]> scan(DataContext root) {
    return view.problems().select(Problem::toArray);
  }

  @Override public String toString() {
    return "ProblemsTable";
  }
}
