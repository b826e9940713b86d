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

/**
 * Streaming validation of tabular data.
 *
 * <p>This package checks the rows of a table against an expected header and a
 * list of constraints, and reports every failure without stopping:
 *
 * <h2>Core Components</h2>
 * <ul>
 *   <li>{@link org.apache.calcite.adapter.validation.Validation} - Entry point
 *       returning a lazy report</li>
 *   <li>{@link org.apache.calcite.adapter.validation.Constraint} - Named rule:
 *       fields or getter, test and assertion</li>
 *   <li>{@link org.apache.calcite.adapter.validation.ConstraintCompiler} - Resolves
 *       constraint fields to row positions once per pass</li>
 *   <li>{@link org.apache.calcite.adapter.validation.ProblemsView} - Re-iterable
 *       report; every iteration is a new pass over the table</li>
 *   <li>{@link org.apache.calcite.adapter.validation.Problem} and
 *       {@link org.apache.calcite.adapter.validation.ErrorKind} - What failed,
 *       where, and how</li>
 *   <li>{@link org.apache.calcite.adapter.validation.ProblemsTable} - Report as a
 *       Calcite table for SQL queries</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ValidationConfig config = ValidationConfig.fromResource("/orders-validation.yaml");
 * RowTable table = new CsvRowTable(Sources.of(new File("orders.csv")));
 * for (Problem problem : config.validate(table).problems()) {
 *   LOGGER.warn("{}", problem);
 * }
 * }</pre>
 */
package org.apache.calcite.adapter.validation;
