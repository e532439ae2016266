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

import java.util.Arrays;
import java.util.List;

import org.elasticube.cube.metadata.CubeException;

public final class BinaryOp extends Expression {

  public static enum Operator {
    OR("OR"),
    AND("AND"),
    EQ("="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    LIKE("LIKE"),
    PLUS("+"),
    MINUS("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    MOD("%");

    private final String symbol;

    private Operator(String symbol) {
      this.symbol = symbol;
    }

    public String getSymbol() {
      return symbol;
    }

    public boolean isArithmetic() {
      return this == PLUS || this == MINUS || this == MULTIPLY
          || this == DIVIDE || this == MOD;
    }

    public boolean isComparison() {
      return this == EQ || this == NE || this == LT || this == LE
          || this == GT || this == GE;
    }

    public boolean isLogical() {
      return this == AND || this == OR;
    }
  }

  private final Operator operator;
  private final Expression left;
  private final Expression right;

  public BinaryOp(Operator operator, Expression left, Expression right) {
    assert (operator != null && left != null && right != null);
    this.operator = operator;
    this.left = left;
    this.right = right;
  }

  public Operator getOperator() {
    return operator;
  }

  public Expression getLeft() {
    return left;
  }

  public Expression getRight() {
    return right;
  }

  @Override
  public List<Expression> getChildren() {
    return Arrays.asList(left, right);
  }

  @Override
  public Expression transform(ExprTransformer transformer) throws CubeException {
    return new BinaryOp(operator, left.transform(transformer),
        right.transform(transformer));
  }

  @Override
  public String toString() {
    return "(" + left + " " + operator.getSymbol() + " " + right + ")";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof BinaryOp)) {
      return false;
    }
    BinaryOp other = (BinaryOp) obj;
    return operator == other.operator && left.equals(other.left)
        && right.equals(other.right);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = operator.hashCode();
    result = prime * result + left.hashCode();
    result = prime * result + right.hashCode();
    return result;
  }
}
