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
import org.apache.calcite.adapter.validation.ProblemsView;
import org.apache.calcite.adapter.validation.Validation;
import org.apache.calcite.adapter.validation.table.RowTable;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Expected header and constraints for validating a table, loadable from
 * YAML or JSON.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * header: [foo, bar, baz]
 * constraints:
 *   - name: foo_int
 *     field: foo
 *     test: integer
 *   - name: baz_enum
 *     field: baz
 *     assertion: in
 *     values: [Y, N]
 * }</pre>
 *
 * <p>Without a {@code header} entry the table's own header is used.
 *
 * @see ConstraintConfig
 */
public class ValidationConfig {
  private static final Logger LOGGER = LoggerFactory.getLogger(ValidationConfig.class);

  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

  private final @Nullable List<String> header;
  private final List<ConstraintConfig> constraints;

  private ValidationConfig(Builder builder) {
    this.header = builder.header != null
        ? Collections.unmodifiableList(new ArrayList<String>(builder.header))
        : null;
    this.constraints = builder.constraints != null
        ? Collections.unmodifiableList(new ArrayList<ConstraintConfig>(builder.constraints))
        : Collections.<ConstraintConfig>emptyList();
  }

  /** Returns the expected header, or null to accept the table's own. */
  public @Nullable List<String> getHeader() {
    return header;
  }

  /** Returns the constraint configurations in declaration order. */
  public List<ConstraintConfig> getConstraints() {
    return constraints;
  }

  /**
   * Builds the constraints this configuration describes.
   *
   * @return New constraints, in declaration order
   */
  public List<Constraint> toConstraints() {
    List<Constraint> list = new ArrayList<Constraint>(constraints.size());
    for (ConstraintConfig config : constraints) {
      list.add(config.toConstraint());
    }
    return list;
  }

  /**
   * Validates a table with this configuration.
   *
   * @param table Table to validate
   * @return A lazy view of the problems
   */
  public ProblemsView validate(RowTable table) {
    return Validation.validate(table, toConstraints(), header);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a ValidationConfig from a YAML/JSON map.
   *
   * @param map Configuration map
   * @return ValidationConfig instance, or an empty config if map is null
   */
  @SuppressWarnings("unchecked")
  public static ValidationConfig fromMap(@Nullable Map<String, Object> map) {
    Builder builder = builder();
    if (map == null) {
      return builder.build();
    }

    Object headerObj = map.get("header");
    if (headerObj instanceof List) {
      List<String> header = new ArrayList<String>();
      for (Object item : (List<?>) headerObj) {
        header.add(String.valueOf(item));
      }
      builder.header(header);
    } else if (headerObj != null) {
      throw new IllegalArgumentException("'header' must be a list, got: " + headerObj);
    }

    Object constraintsObj = map.get("constraints");
    if (constraintsObj instanceof List) {
      List<ConstraintConfig> configs = new ArrayList<ConstraintConfig>();
      for (Object item : (List<?>) constraintsObj) {
        if (item instanceof Map) {
          configs.add(ConstraintConfig.fromMap((Map<String, Object>) item));
        } else {
          throw new IllegalArgumentException("Constraint entry must be a map, got: " + item);
        }
      }
      builder.constraints(configs);
    }
    return builder.build();
  }

  /**
   * Reads a configuration from a YAML stream.
   *
   * @param in YAML input
   * @return ValidationConfig instance
   * @throws IOException if the stream cannot be read or parsed
   */
  public static ValidationConfig fromYaml(InputStream in) throws IOException {
    return read(YAML_MAPPER, in);
  }

  /**
   * Reads a configuration from a JSON stream.
   *
   * @param in JSON input
   * @return ValidationConfig instance
   * @throws IOException if the stream cannot be read or parsed
   */
  public static ValidationConfig fromJson(InputStream in) throws IOException {
    return read(JSON_MAPPER, in);
  }

  /**
   * Loads a configuration from a classpath resource. Resources ending in
   * {@code .yaml} or {@code .yml} are read as YAML, others as JSON.
   *
   * @param resourcePath Absolute classpath resource path
   * @return ValidationConfig instance
   * @throws IOException if the resource is missing or cannot be parsed
   */
  public static ValidationConfig fromResource(String resourcePath) throws IOException {
    LOGGER.info("Loading validation config from resource: {}", resourcePath);
    try (InputStream in = ValidationConfig.class.getResourceAsStream(resourcePath)) {
      if (in == null) {
        throw new IOException("Resource not found: " + resourcePath);
      }
      boolean yaml = resourcePath.endsWith(".yaml") || resourcePath.endsWith(".yml");
      ValidationConfig config = yaml ? fromYaml(in) : fromJson(in);
      LOGGER.info("Loaded {} constraints from {}", config.constraints.size(), resourcePath);
      return config;
    }
  }

  @SuppressWarnings("unchecked")
  private static ValidationConfig read(ObjectMapper mapper, InputStream in)
      throws IOException {
    Map<String, Object> map = mapper.readValue(in, Map.class);
    return fromMap(map);
  }

  @Override public String toString() {
    return "ValidationConfig{header=" + header + ", constraints=" + constraints.size() + "}";
  }

  /**
   * Builder for ValidationConfig.
   */
  public static class Builder {
    private @Nullable List<String> header;
    private @Nullable List<ConstraintConfig> constraints;

    public Builder header(@Nullable List<String> header) {
      this.header = header;
      return this;
    }

    public Builder constraints(@Nullable List<ConstraintConfig> constraints) {
      this.constraints = constraints;
      return this;
    }

    public ValidationConfig build() {
      return new ValidationConfig(this);
    }
  }
}
