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
import java.util.List;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.conf.Configuration;
import org.elasticube.cube.CubeConfUtil;
import org.elasticube.cube.metadata.CubeException;
import org.elasticube.cube.metadata.CubeMeasure;
import org.elasticube.cube.metadata.CubeSchema;
import org.elasticube.cube.metadata.DerivedColumn;

/**
 * In an aggregating query, wraps measures used outside of any aggregate call
 * in their default aggregate, so {@code select region, sales group by region}
 * reads {@code select region, sum(sales) as sales group by region}. Measures
 * whose expansion already aggregates are left alone.
 */
public class AggregateResolver implements ContextRewriter {
  public static final Log LOG = LogFactory.getLog(
      AggregateResolver.class.getName());

  private final boolean disabled;

  public AggregateResolver(Configuration conf) {
    disabled = conf.getBoolean(CubeConfUtil.DISABLE_AGGREGATE_RESOLVER,
        CubeConfUtil.DEFAULT_DISABLE_AGGREGATE_RESOLVER);
  }

  @Override
  public void rewriteContext(CubeQueryContext cubeql) throws SemanticException {
    if (disabled || !cubeql.hasAggregates()) {
      return;
    }
    CubeSchema schema = cubeql.getSchema();
    try {
      List<SelectItem> selects = new ArrayList<SelectItem>();
      for (SelectItem item : cubeql.getSelects()) {
        Expression expr = item.getExpression();
        Expression wrapped = wrapMeasures(schema, expr);
        if (wrapped != expr) {
          String alias = item.getAlias();
          if (alias == null && expr instanceof ColumnRef) {
            alias = ((ColumnRef) expr).getName();
          }
          LOG.debug("Resolved aggregate " + item + " to " + wrapped);
          item = new SelectItem(wrapped, alias);
        }
        selects.add(item);
      }
      cubeql.setSelects(selects);

      List<OrderItem> orderBy = new ArrayList<OrderItem>();
      for (OrderItem item : cubeql.getOrderBy()) {
        orderBy.add(item.withExpression(wrapMeasures(schema,
            item.getExpression())));
      }
      cubeql.setOrderBy(orderBy);
    } catch (CubeException e) {
      throw new SemanticException(e);
    }
  }

  // Returns the same instance when nothing was wrapped. Aggregate calls are
  // not descended into.
  private Expression wrapMeasures(CubeSchema schema, Expression expr)
      throws CubeException {
    if (expr instanceof ColumnRef) {
      String name = ((ColumnRef) expr).getName();
      CubeMeasure measure = schema.getMeasureByName(name);
      if (measure == null) {
        return expr;
      }
      if (measure instanceof DerivedColumn && schema.isAggregating(name)) {
        return expr;
      }
      return measure.getAggregate().wrap(expr);
    }
    if (expr instanceof FunctionCall) {
      FunctionCall call = (FunctionCall) expr;
      if (call.isAggregate() || call.isStar()) {
        return expr;
      }
      List<Expression> args = new ArrayList<Expression>();
      boolean changed = false;
      for (Expression arg : call.getArgs()) {
        Expression wrapped = wrapMeasures(schema, arg);
        changed |= wrapped != arg;
        args.add(wrapped);
      }
      return changed ? new FunctionCall(call.getName(), args,
          call.isDistinct()) : expr;
    }
    if (expr instanceof BinaryOp) {
      BinaryOp op = (BinaryOp) expr;
      Expression left = wrapMeasures(schema, op.getLeft());
      Expression right = wrapMeasures(schema, op.getRight());
      if (left == op.getLeft() && right == op.getRight()) {
        return expr;
      }
      return new BinaryOp(op.getOperator(), left, right);
    }
    if (expr instanceof UnaryOp) {
      UnaryOp op = (UnaryOp) expr;
      Expression operand = wrapMeasures(schema, op.getOperand());
      return operand == op.getOperand() ? expr
          : new UnaryOp(op.getOperator(), operand);
    }
    return expr;
  }
}
