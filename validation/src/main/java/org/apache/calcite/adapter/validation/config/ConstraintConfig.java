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
package org.apache.calcite.adapter.validation.config;

import org.apache.calcite.adapter.validation.Constraint;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Declarative description of a {@link Constraint}, as read from YAML or JSON.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * - name: foo_int
 *   field: foo
 *   test: integer
 * - name: bar_date
 *   field: bar
 *   test: date
 *   format: "yyyy-MM-dd"
 * - name: baz_enum
 *   field: baz
 *   assertion: in
 *   values: [Y, N]
 * - name: qty_range
 *   field: qty
 *   optional: true
 *   assertion: range
 *   min: 0
 *   max: 1000
 * - name: not_none
 *   assertion: notNull
 * }</pre>
 *
 * <p>Tests: {@code integer}, {@code decimal}, {@code date}. Assertions:
 * {@code notNull}, {@code notBlank}, {@code in}, {@code matches},
 * {@code range}. See {@link Checks}.
 */
public class ConstraintConfig {

  /** Date pattern used by the {@code date} test when no format is given. */
  public static final String DEFAULT_DATE_FORMAT = "yyyy-MM-dd";

  private final @Nullable String name;
  private final List<String> fields;
  private final boolean optional;
  private final @Nullable String test;
  private final @Nullable String assertion;
  private final @Nullable String format;
  private final List<Object> values;
  private final @Nullable String pattern;
  private final @Nullable BigDecimal min;
  private final @Nullable BigDecimal max;

  private ConstraintConfig(@Nullable String name, List<String> fields, boolean optional,
      @Nullable String test, @Nullable String assertion, @Nullable String format,
      List<Object> values, @Nullable String pattern, @Nullable BigDecimal min,
      @Nullable BigDecimal max) {
    this.name = name;
    this.fields = fields;
    this.optional = optional;
    this.test = test;
    this.assertion = assertion;
    this.format = format;
    this.values = values;
    this.pattern = pattern;
    this.min = min;
    this.max = max;
  }

  /**
   * Creates a ConstraintConfig from a YAML/JSON map.
   *
   * @param map Configuration map
   * @return ConstraintConfig instance
   * @throws IllegalArgumentException if a check is unknown or lacks a required option
   */
  public static ConstraintConfig fromMap(Map<String, Object> map) {
    Object nameObj = map.get("name");
    String name = nameObj == null ? null : String.valueOf(nameObj);

    List<String> fields = new ArrayList<String>();
    Object fieldObj = map.get("field");
    if (fieldObj == null) {
      fieldObj = map.get("fields");
    }
    if (fieldObj instanceof List) {
      for (Object item : (List<?>) fieldObj) {
        fields.add(String.valueOf(item));
      }
    } else if (fieldObj != null) {
      fields.add(String.valueOf(fieldObj));
    }

    boolean optional = false;
    Object optionalObj = map.get("optional");
    if (optionalObj instanceof Boolean) {
      optional = (Boolean) optionalObj;
    } else if (optionalObj instanceof String) {
      optional = Boolean.parseBoolean((String) optionalObj);
    }

    List<Object> values = new ArrayList<Object>();
    Object valuesObj = map.get("values");
    if (valuesObj instanceof List) {
      values.addAll((List<?>) valuesObj);
    }

    ConstraintConfig config =
        new ConstraintConfig(name, ImmutableList.copyOf(fields), optional,
            stringOrNull(map.get("test")), stringOrNull(map.get("assertion")),
            stringOrNull(map.get("format")), values, stringOrNull(map.get("pattern")),
            decimalOrNull(map.get("min")), decimalOrNull(map.get("max")));
    config.check();
    return config;
  }

  private void check() {
    if (test != null) {
      switch (test.toLowerCase(Locale.ROOT)) {
        case "integer":
        case "decimal":
        case "date":
          break;
        default:
          throw new IllegalArgumentException("Unknown test '" + test + "' in constraint '"
              + name + "'");
      }
    }
    if (assertion != null) {
      switch (assertion.toLowerCase(Locale.ROOT)) {
        case "notnull":
        case "notblank":
          break;
        case "in":
          if (values.isEmpty()) {
            throw new IllegalArgumentException("Assertion 'in' requires 'values' in constraint '"
                + name + "'");
          }
          break;
        case "matches":
          if (pattern == null) {
            throw new IllegalArgumentException(
                "Assertion 'matches' requires 'pattern' in constraint '" + name + "'");
          }
          break;
        case "range":
          if (min == null && max == null) {
            throw new IllegalArgumentException(
                "Assertion 'range' requires 'min' or 'max' in constraint '" + name + "'");
          }
          break;
        default:
          throw new IllegalArgumentException("Unknown assertion '" + assertion
              + "' in constraint '" + name + "'");
      }
    }
  }

  /**
   * Builds the constraint this configuration describes.
   *
   * @return A new Constraint
   */
  public Constraint toConstraint() {
    Constraint.Builder builder = Constraint.builder(name)
        .fields(fields)
        .optional(optional);
    if (test != null) {
      builder.test(createTest(test));
    }
    if (assertion != null) {
      builder.assertion(createAssertion(assertion));
    }
    return builder.build();
  }

  private Constraint.ValueTest createTest(String type) {
    switch (type.toLowerCase(Locale.ROOT)) {
      case "integer":
        return Checks.integer();
      case "decimal":
        return Checks.decimal();
      default:
        return Checks.date(format != null ? format : DEFAULT_DATE_FORMAT);
    }
  }

  private Constraint.ValueAssertion createAssertion(String type) {
    switch (type.toLowerCase(Locale.ROOT)) {
      case "notnull":
        return Checks.notNull();
      case "notblank":
        return Checks.notBlank();
      case "in":
        return Checks.in(values);
      case "matches":
        return Checks.matches(String.valueOf(pattern));
      default:
        return Checks.range(min, max);
    }
  }

  private static @Nullable String stringOrNull(@Nullable Object value) {
    return value == null ? null : String.valueOf(value);
  }

  private static @Nullable BigDecimal decimalOrNull(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    try {
      return new BigDecimal(String.valueOf(value).trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Not a number: " + value, e);
    }
  }

  public @Nullable String getName() {
    return name;
  }

  public List<String> getFields() {
    return fields;
  }

  public boolean isOptional() {
    return optional;
  }

  public @Nullable String getTest() {
    return test;
  }

  public @Nullable String getAssertion() {
    return assertion;
  }

  public @Nullable String getFormat() {
    return format;
  }

  public List<Object> getValues() {
    return values;
  }

  public @Nullable String getPattern() {
    return pattern;
  }

  public @Nullable BigDecimal getMin() {
    return min;
  }

  public @Nullable BigDecimal getMax() {
    return max;
  }

  @Override public String toString() {
    return "ConstraintConfig{name='" + name + "', fields=" + fields
        + (test == null ? "" : ", test=" + test)
        + (assertion == null ? "" : ", assertion=" + assertion) + "}";
  }
}
