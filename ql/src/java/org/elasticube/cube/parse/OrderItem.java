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

public final class OrderItem {
  private final Expression expression;
  private final boolean ascending;

  public OrderItem(Expression expression, boolean ascending) {
    assert (expression != null);
    this.expression = expression;
    this.ascending = ascending;
  }

  public Expression getExpression() {
    return expression;
  }

  public boolean isAscending() {
    return ascending;
  }

  public OrderItem withExpression(Expression expr) {
    return new OrderItem(expr, ascending);
  }

  @Override
  public String toString() {
    return expression + (ascending ? " ASC" : " DESC");
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof OrderItem)) {
      return false;
    }
    OrderItem other = (OrderItem) obj;
    return ascending == other.ascending && expression.equals(other.expression);
  }

  @Override
  public int hashCode() {
    return 31 * expression.hashCode() + (ascending ? 1 : 0);
  }
}
