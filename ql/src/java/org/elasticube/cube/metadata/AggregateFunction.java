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

import java.util.Collections;

import org.elasticube.cube.parse.Expression;
import org.elasticube.cube.parse.FunctionCall;

/**
 * Default aggregates of measures.
 */
public enum AggregateFunction {
  SUM("sum", false),
  AVG("avg", false),
  MIN("min", false),
  MAX("max", false),
  COUNT("count", false),
  COUNT_DISTINCT("count", true);

  private final String functionName;
  private final boolean distinct;

  private AggregateFunction(String functionName, boolean distinct) {
    this.functionName = functionName;
    this.distinct = distinct;
  }

  public String getFunctionName() {
    return functionName;
  }

  public boolean isDistinct() {
    return distinct;
  }

  /**
   * Call of this aggregate over the given expression.
   */
  public FunctionCall wrap(Expression expr) {
    return new FunctionCall(functionName, Collections.singletonList(expr),
        distinct);
  }

  public static boolean isAggregateFunction(String name) {
    String fname = name.toLowerCase();
    for (AggregateFunction function : values()) {
      if (function.functionName.equals(fname)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Aggregate computed by the call, null if the call is not an aggregate.
   */
  public static AggregateFunction fromCall(FunctionCall call) {
    if (call.getName().equals("count")) {
      return call.isDistinct() ? COUNT_DISTINCT : COUNT;
    }
    for (AggregateFunction function : values()) {
      if (function.functionName.equals(call.getName())) {
        return function;
      }
    }
    return null;
  }

  public static AggregateFunction fromString(String aggregate) {
    String agg = aggregate.trim().toLowerCase().replace(' ', '_');
    if (agg.equals("mean")) {
      return AVG;
    }
    if (agg.equals("countdistinct")) {
      return COUNT_DISTINCT;
    }
    return valueOf(agg.toUpperCase());
  }

  @Override
  public String toString() {
    return name().toLowerCase();
  }
}
