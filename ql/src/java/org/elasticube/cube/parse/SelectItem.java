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

/**
 * One projected expression with its optional output alias.
 */
public final class SelectItem {
  private final Expression expression;
  private final String alias;

  public SelectItem(Expression expression, String alias) {
    assert (expression != null);
    this.expression = expression;
    this.alias = alias == null ? null : alias.toLowerCase();
  }

  public Expression getExpression() {
    return expression;
  }

  public String getAlias() {
    return alias;
  }

  public SelectItem withExpression(Expression expr) {
    return new SelectItem(expr, alias);
  }

  /**
   * Name of the result column: the alias if there is one, the canonical
   * expression text otherwise.
   */
  public String getOutputName() {
    return alias != null ? alias : expression.toString();
  }

  @Override
  public String toString() {
    return alias == null ? expression.toString()
        : expression + " AS " + alias;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof SelectItem)) {
      return false;
    }
    SelectItem other = (SelectItem) obj;
    if (alias == null ? other.alias != null : !alias.equals(other.alias)) {
      return false;
    }
    return expression.equals(other.expression);
  }

  @Override
  public int hashCode() {
    return 31 * expression.hashCode() + (alias == null ? 0 : alias.hashCode());
  }
}
