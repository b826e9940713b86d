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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.List;

/**
 * A named rule that extracts a value from each row and judges it.
 *
 * <p>A constraint names zero or more fields. With no fields it inspects the
 * whole row, as a {@link Record}. With one field the target is that field's
 * value; with several it is an unmodifiable list of their values, in the order
 * the names were given. A {@link Getter} may be supplied instead, in which
 * case it is used as is.
 *
 * <p>The target is then passed to the {@link ValueTest}, which signals an
 * invalid value by throwing, and to the {@link ValueAssertion}, which signals
 * one by returning false or throwing. Both run even when the test fails.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * List<Constraint> constraints = Arrays.asList(
 *     Constraint.builder("foo_int")
 *         .field("foo")
 *         .test(v -> Integer.parseInt(String.valueOf(v)))
 *         .build(),
 *     Constraint.builder("baz_enum")
 *         .field("baz")
 *         .assertion(v -> "Y".equals(v) || "N".equals(v))
 *         .build(),
 *     Constraint.builder("not_none")
 *         .assertion(row -> !((List<?>) row).contains(null))
 *         .build());
 * }</pre>
 *
 * <p>Constraints are immutable and may be shared between validations.
 */
public final class Constraint {

  /** Extracts the value a constraint inspects from a row. */
  @FunctionalInterface
  public interface Getter {
    @Nullable Object get(Record row) throws Exception;
  }

  /** Checks a value; returns normally if it is valid and throws otherwise. */
  @FunctionalInterface
  public interface ValueTest {
    void test(@Nullable Object value) throws Exception;
  }

  /** Checks a value; returns true if it is valid. */
  @FunctionalInterface
  public interface ValueAssertion {
    boolean check(@Nullable Object value) throws Exception;
  }

  private final @Nullable String name;
  private final ImmutableList<String> fields;
  private final boolean optional;
  private final @Nullable Getter getter;
  private final @Nullable ValueTest test;
  private final @Nullable ValueAssertion assertion;

  private Constraint(Builder builder) {
    this.name = builder.name;
    this.fields = builder.fields;
    this.optional = builder.optional;
    this.getter = builder.getter;
    this.test = builder.test;
    this.assertion = builder.assertion;
  }

  /**
   * Creates a builder.
   *
   * @param name Name used to tag problems this constraint raises
   * @return A new Builder
   */
  public static Builder builder(@Nullable String name) {
    return new Builder(name);
  }

  public @Nullable String getName() {
    return name;
  }

  /** Returns the inspected fields; empty if the constraint inspects whole rows. */
  public ImmutableList<String> getFields() {
    return fields;
  }

  public boolean hasFields() {
    return !fields.isEmpty();
  }

  /**
   * Returns the field as it appears in a problem: the single field name,
   * the names joined with commas, or null for a whole-row constraint.
   */
  public @Nullable String getFieldLabel() {
    if (fields.isEmpty()) {
      return null;
    }
    return fields.size() == 1 ? fields.get(0) : String.join(",", fields);
  }

  public boolean isOptional() {
    return optional;
  }

  public @Nullable Getter getGetter() {
    return getter;
  }

  public @Nullable ValueTest getTest() {
    return test;
  }

  public @Nullable ValueAssertion getAssertion() {
    return assertion;
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder("Constraint{name='").append(name).append("'");
    if (!fields.isEmpty()) {
      sb.append(", fields=").append(fields);
    }
    if (optional) {
      sb.append(", optional");
    }
    if (getter != null) {
      sb.append(", getter");
    }
    if (test != null) {
      sb.append(", test");
    }
    if (assertion != null) {
      sb.append(", assertion");
    }
    return sb.append("}").toString();
  }

  /**
   * Builder for Constraint.
   */
  public static class Builder {
    private final @Nullable String name;
    private ImmutableList<String> fields = ImmutableList.of();
    private boolean optional;
    private @Nullable Getter getter;
    private @Nullable ValueTest test;
    private @Nullable ValueAssertion assertion;

    private Builder(@Nullable String name) {
      this.name = name;
    }

    /** Sets a single field to inspect. */
    public Builder field(String field) {
      this.fields = ImmutableList.of(field);
      return this;
    }

    /** Sets several fields to inspect; the target becomes a list of their values. */
    public Builder fields(String... fields) {
      return fields(Arrays.asList(fields));
    }

    public Builder fields(List<String> fields) {
      this.fields = ImmutableList.copyOf(fields);
      return this;
    }

    /** Skips this constraint when one of its fields is missing from the header. */
    public Builder optional(boolean optional) {
      this.optional = optional;
      return this;
    }

    public Builder getter(@Nullable Getter getter) {
      this.getter = getter;
      return this;
    }

    public Builder test(@Nullable ValueTest test) {
      this.test = test;
      return this;
    }

    public Builder assertion(@Nullable ValueAssertion assertion) {
      this.assertion = assertion;
      return this;
    }

    public Constraint build() {
      return new Constraint(this);
    }
  }
}
