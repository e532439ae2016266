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

import org.elasticube.cube.parse.ExprParser;
import org.elasticube.cube.parse.Expression;
import org.elasticube.cube.parse.ParseException;

/**
 * Measure defined by an expression. When its expansion holds aggregate
 * calls it is evaluated after grouping, otherwise it is a row level value
 * that gets aggregated with its declared aggregate.
 */
public final class CalculatedMeasure extends CubeMeasure implements
    DerivedColumn {
  private final String expr;
  private volatile Expression expression;

  public CalculatedMeasure(String name, String expr, ColumnType type,
      AggregateFunction aggregate) {
    super(name, type, aggregate);
    assert (expr != null);
    this.expr = expr;
  }

  public String getExpr() {
    return expr;
  }

  public Expression getExpression() throws ParseException {
    if (expression == null) {
      expression = ExprParser.parseExpression(expr);
    }
    return expression;
  }

  @Override
  public String toString() {
    return super.toString() + ",expr:" + expr;
  }

  @Override
  public boolean equals(Object obj) {
    return super.equals(obj) && expr.equals(((CalculatedMeasure) obj).expr);
  }

  @Override
  public int hashCode() {
    return 31 * super.hashCode() + expr.hashCode();
  }
}
