package org.elasticube.cube.parse;
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

import org.elasticube.cube.metadata.CubeException;

public final class Literal extends Expression {
  public static final Literal NULL = new Literal(null);
  public static final Literal TRUE = new Literal(Boolean.TRUE);
  public static final Literal FALSE = new Literal(Boolean.FALSE);

  private final Object value;

  private Literal(Object value) {
    this.value = value;
  }

  /**
   * Literal for a caller supplied value. Integral numbers are widened to
   * long and floating point numbers to double.
   */
  public static Literal of(Object value) {
    if (value == null) {
      return NULL;
    }
    if (value instanceof Boolean) {
      return ((Boolean) value) ? TRUE : FALSE;
    }
    if (value instanceof Integer || value instanceof Short
        || value instanceof Byte) {
      return new Literal(Long.valueOf(((Number) value).longValue()));
    }
    if (value instanceof Float) {
      return new Literal(Double.valueOf(((Number) value).doubleValue()));
    }
    if (value instanceof Long || value instanceof Double
        || value instanceof String || value instanceof Date) {
      return new Literal(value);
    }
    throw new IllegalArgumentException("Unsupported literal value " + value
        + " of " + value.getClass());
  }

  public Object getValue() {
    return value;
  }

  public boolean isNull() {
    return value == null;
  }

  public boolean isNumeric() {
    return value instanceof Number;
  }

  @Override
  public Expression transform(ExprTransformer transformer) throws CubeException {
    return this;
  }

  @Override
  public String toString() {
    if (value == null) {
      return "NULL";
    }
    if (value instanceof String) {
      return "'" + ((String) value).replace("'", "''") + "'";
    }
    if (value instanceof Boolean) {
      return ((Boolean) value) ? "TRUE" : "FALSE";
    }
    if (value instanceof Date) {
      return "TIMESTAMP '" + ((Date) value).getTime() + "'";
    }
    return value.toString();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Literal)) {
      return false;
    }
    Literal other = (Literal) obj;
    if (value == null) {
      return other.value == null;
    }
    return value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return value == null ? 0 : value.hashCode();
  }
}
