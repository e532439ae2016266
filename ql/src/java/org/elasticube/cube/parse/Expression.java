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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.elasticube.cube.metadata.CubeException;

/**
 * Node of an immutable expression tree. Field names are always kept in lower
 * case. {@link #toString()} gives the canonical, fully parenthesized text of
 * the tree, two structurally equal trees always print the same.
 */
public abstract class Expression {

  public List<Expression> getChildren() {
    return Collections.emptyList();
  }

  /**
   * Copy of this tree with every column reference replaced by what the
   * transformer returns for it.
   */
  public abstract Expression transform(ExprTransformer transformer)
      throws CubeException;

  public void collectColumns(Set<String> columns) {
    for (Expression child : getChildren()) {
      child.collectColumns(columns);
    }
  }

  public Set<String> getColumns() {
    Set<String> columns = new LinkedHashSet<String>();
    collectColumns(columns);
    return columns;
  }

  public boolean containsAggregate() {
    for (Expression child : getChildren()) {
      if (child.containsAggregate()) {
        return true;
      }
    }
    return false;
  }

  /**
   * All aggregate calls in this tree, outermost first, without duplicates.
   */
  public void collectAggregates(Set<FunctionCall> aggregates) {
    for (Expression child : getChildren()) {
      child.collectAggregates(aggregates);
    }
  }

  /**
   * True if every column this tree reads is either inside an aggregate call or
   * inside a subtree equal to one of the group by expressions.
   */
  public boolean isGroupedBy(List<Expression> groupBy) {
    if (groupBy.contains(this) || this instanceof Literal) {
      return true;
    }
    if (this instanceof FunctionCall && ((FunctionCall) this).isAggregate()) {
      return true;
    }
    if (this instanceof ColumnRef) {
      return false;
    }
    for (Expression child : getChildren()) {
      if (!child.isGroupedBy(groupBy)) {
        return false;
      }
    }
    return true;
  }

  protected static List<Expression> transformAll(List<Expression> exprs,
      ExprTransformer transformer) throws CubeException {
    List<Expression> result = new ArrayList<Expression>(exprs.size());
    for (Expression expr : exprs) {
      result.add(expr.transform(transformer));
    }
    return result;
  }

  /**
   * Conjunction of the given predicates, in order. Null if the list is empty.
   */
  public static Expression and(List<Expression> predicates) {
    Expression result = null;
    for (Expression predicate : predicates) {
      if (result == null) {
        result = predicate;
      } else {
        result = new BinaryOp(BinaryOp.Operator.AND, result, predicate);
      }
    }
    return result;
  }

  @Override
  public abstract String toString();

  @Override
  public abstract boolean equals(Object obj);

  @Override
  public abstract int hashCode();
}
