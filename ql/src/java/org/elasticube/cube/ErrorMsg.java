package org.elasticube.cube;
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

import java.text.MessageFormat;

/**
 * List of all error messages raised by the cube.
 * The error codes are stable so that callers can branch on them.
 */
public enum ErrorMsg {
  GENERIC_ERROR(10000, "Exception while processing cube request"),

  // schema declaration
  DUPLICATE_NAME(10001, "Field {0} is already declared in cube {1}"),
  UNKNOWN_DEPENDENCY(10002, "Expression of {0} references undeclared field {1}"),
  CYCLIC_DEPENDENCY(10003, "Declaring {0} creates a dependency cycle: {1}"),
  INVALID_DEPENDENCY(10004, "Field {0} cannot reference {1}: {2}"),
  INVALID_HIERARCHY_LEVEL(10005, "{0} is not a valid level of hierarchy {1}"),
  NO_DATA_SOURCE(10006, "No data source or base fields specified for cube {0}"),

  // query construction
  UNKNOWN_FIELD(10101, "Unknown field {0} in {1}"),
  EMPTY_SELECT(10102, "Select list is empty"),
  INVALID_EXPRESSION(10103, "Invalid expression {0}: {1}"),

  // mutations
  SCHEMA_MISMATCH(10201, "Batch does not match the layout of cube {0}: {1}"),

  // execution
  EXECUTION_FAILED(10301, "Query execution failed: {0}"),
  TYPE_MISMATCH(10302, "Type mismatch in {0}: {1}"),
  AGGREGATION_ERROR(10303, "Aggregation {0} failed: {1}"),
  CACHE_COMPUTE_FAILED(10304, "Computing result for cache key {0} failed");

  private final int errorCode;
  private final String mesg;

  private ErrorMsg(int errorCode, String mesg) {
    this.errorCode = errorCode;
    this.mesg = mesg;
  }

  public int getErrorCode() {
    return errorCode;
  }

  public String getMsg() {
    return mesg;
  }

  public String format(String... reasons) {
    if (reasons == null || reasons.length == 0) {
      return mesg;
    }
    return MessageFormat.format(mesg, (Object[]) reasons);
  }

  /**
   * Whether this error is raised by the execution engine rather than by
   * schema declaration, query construction or mutation validation.
   */
  public boolean isExecutionError() {
    return errorCode >= 10301 && errorCode < 10400;
  }
}
