package org.elasticube.cube.metadata;
/*
 *
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 *
*/

import java.util.Date;

/**
 * Logical column types. Each type has one Java value class; {@code date} and
 * {@code timestamp} both carry {@link Date} values.
 */
public enum ColumnType {
  STRING(String.class),
  INT(Integer.class),
  BIGINT(Long.class),
  FLOAT(Float.class),
  DOUBLE(Double.class),
  BOOLEAN(Boolean.class),
  DATE(Date.class),
  TIMESTAMP(Date.class);

  private final Class<?> valueClass;

  private ColumnType(Class<?> valueClass) {
    this.valueClass = valueClass;
  }

  public Class<?> getValueClass() {
    return valueClass;
  }

  public String getTypeName() {
    return name().toLowerCase();
  }

  /**
   * Null is a valid value of every type.
   */
  public boolean accepts(Object value) {
    return value == null || valueClass.isInstance(value);
  }

  public boolean isNumeric() {
    return this == INT || this == BIGINT || this == FLOAT || this == DOUBLE;
  }

  public boolean isIntegral() {
    return this == INT || this == BIGINT;
  }

  public static ColumnType fromString(String typeName) {
    String type = typeName.trim().toLowerCase();
    if (type.equals("integer")) {
      return INT;
    } else if (type.equals("long")) {
      return BIGINT;
    } else if (type.equals("utf8") || type.equals("varchar")) {
      return STRING;
    }
    for (ColumnType columnType : values()) {
      if (columnType.getTypeName().equals(type)) {
        return columnType;
      }
    }
    throw new IllegalArgumentException("Unknown column type " + typeName);
  }

  /**
   * Type of a runtime value, null when the value is null or of no known type.
   */
  public static ColumnType ofValue(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof java.sql.Timestamp) {
      return TIMESTAMP;
    }
    for (ColumnType columnType : values()) {
      if (columnType.valueClass.isInstance(value)) {
        return columnType;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return getTypeName();
  }
}
