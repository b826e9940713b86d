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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Ready-made tests and assertions for common value checks.
 *
 * <p>Tests throw when a value cannot be read as the expected type, so the
 * problem's cause names the parse failure ({@code NumberFormatException},
 * {@code DateTimeParseException}, or {@code NullPointerException} for a
 * missing value). Assertions return false for values outside the allowed set.
 *
 * <p>String-typed input, as read from CSV, is accepted everywhere: values are
 * compared and parsed through {@link String#valueOf(Object)}.
 */
public final class Checks {

  private Checks() {
    // Utility class
  }

  /** Test that passes integral numbers and strings that parse as integers. */
  public static Constraint.ValueTest integer() {
    return value -> {
      if (value instanceof Integer || value instanceof Long
          || value instanceof Short || value instanceof Byte
          || value instanceof BigInteger) {
        return;
      }
      new BigInteger(text(value));
    };
  }

  /** Test that passes numbers and strings that parse as decimals. */
  public static Constraint.ValueTest decimal() {
    return value -> {
      if (value instanceof Number) {
        return;
      }
      new BigDecimal(text(value));
    };
  }

  /**
   * Test that passes dates and strings that parse with a pattern.
   *
   * <p>Parsing is strict: a day that does not exist in its month, such as
   * {@code 2001-02-31}, fails rather than being adjusted.
   *
   * @param pattern {@link DateTimeFormatter} pattern, e.g. {@code yyyy-MM-dd}
   */
  public static Constraint.ValueTest date(String pattern) {
    // year-of-era patterns (yyyy) need an era to resolve strictly
    final DateTimeFormatter formatter = new DateTimeFormatterBuilder()
        .appendPattern(pattern)
        .parseDefaulting(ChronoField.ERA, 1)
        .toFormatter(Locale.ROOT)
        .withResolverStyle(ResolverStyle.STRICT);
    return value -> {
      if (value instanceof TemporalAccessor) {
        return;
      }
      LocalDate.parse(text(value), formatter);
    };
  }

  /**
   * Assertion that a value is not null. Applied to a whole row (or to
   * several fields at once), it requires every value to be non-null.
   */
  public static Constraint.ValueAssertion notNull() {
    return value -> {
      if (value instanceof Collection) {
        return !((Collection<?>) value).contains(null);
      }
      return value != null;
    };
  }

  /** Assertion that a value is not null and not empty or whitespace. */
  public static Constraint.ValueAssertion notBlank() {
    return value -> value != null && !String.valueOf(value).trim().isEmpty();
  }

  /**
   * Assertion that a value is one of a set, compared by string form.
   *
   * @param allowed Allowed values
   */
  public static Constraint.ValueAssertion in(Collection<?> allowed) {
    final Set<String> set = new HashSet<String>();
    for (Object value : allowed) {
      set.add(String.valueOf(value));
    }
    return value -> value != null && set.contains(String.valueOf(value));
  }

  /**
   * Assertion that a value's string form matches a regular expression in full.
   *
   * @param regex Regular expression
   */
  public static Constraint.ValueAssertion matches(String regex) {
    final Pattern pattern = Pattern.compile(regex);
    return value -> value != null && pattern.matcher(String.valueOf(value)).matches();
  }

  /**
   * Assertion that a numeric value lies within inclusive bounds. A value that
   * is not numeric makes the assertion throw.
   *
   * @param min Lower bound, or null for none
   * @param max Upper bound, or null for none
   */
  public static Constraint.ValueAssertion range(@Nullable BigDecimal min,
      @Nullable BigDecimal max) {
    return value -> {
      BigDecimal decimal = value instanceof BigDecimal
          ? (BigDecimal) value
          : new BigDecimal(text(value));
      return (min == null || decimal.compareTo(min) >= 0)
          && (max == null || decimal.compareTo(max) <= 0);
    };
  }

  private static String text(@Nullable Object value) {
    return Objects.requireNonNull(value, "value").toString().trim();
  }
}
