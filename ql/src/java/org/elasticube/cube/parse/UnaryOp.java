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

import java.util.Collections;
import java.util.List;

import org.elasticube.cube.metadata.CubeException;

public final class UnaryOp extends Expression {

  public static enum Operator {
    NOT,
    NEGATE,
    IS_NULL,
    IS_NOT_NULL
  }

  private final Operator operator;
  private final Expression operand;

  public UnaryOp(Operator operator, Expression operand) {
    assert (operator != null && operand != null);
    this.operator = operator;
    this.operand = operand;
  }

  public Operator getOperator() {
    return operator;
  }

  public Expression getOperand() {
    return operand;
  }

  @Override
  public List<Expression> getChildren() {
    return Collections.singletonList(operand);
  }

  @Override
  public Expression transform(ExprTransformer transformer) throws CubeException {
    return new UnaryOp(operator, operand.transform(transformer));
  }

  @Override
  public String toString() {
    switch (operator) {
    case NOT:
      return "(NOT " + operand + ")";
    case NEGATE:
      return "(- " + operand + ")";
    case IS_NULL:
      return "(" + operand + " IS NULL)";
    default:
      return "(" + operand + " IS NOT NULL)";
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof UnaryOp)) {
      return false;
    }
    UnaryOp other = (UnaryOp) obj;
    return operator == other.operator && operand.equals(other.operand);
  }

  @Override
  public int hashCode() {
    return 31 * operator.hashCode() + operand.hashCode();
  }
}
