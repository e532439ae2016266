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

import org.apache.hadoop.conf.Configuration;
import org.elasticube.cube.ErrorMsg;

/**
 * Rejects queries that cannot be evaluated once derived fields are inlined:
 * aggregates in the filter or the group by, and non aggregated select or
 * order items that the group by does not cover.
 */
public class AggregationValidator implements ContextRewriter {

  public AggregationValidator(Configuration conf) {
  }

  @Override
  public void rewriteContext(CubeQueryContext cubeql) throws SemanticException {
    for (Expression filter : cubeql.getFilters()) {
      checkNoAggregate(filter, "filter");
    }
    for (Expression expr : cubeql.getGroupBy()) {
      checkNoAggregate(expr, "group by");
    }
    if (!cubeql.hasAggregates()) {
      return;
    }
    for (SelectItem item : cubeql.getSelects()) {
      checkGrouped(item.getExpression(), cubeql);
    }
    for (OrderItem item : cubeql.getOrderBy()) {
      checkGrouped(item.getExpression(), cubeql);
    }
  }

  private static void checkNoAggregate(Expression expr, String clause)
      throws SemanticException {
    if (expr.containsAggregate()) {
      throw new SemanticException(ErrorMsg.INVALID_EXPRESSION, expr.toString(),
          "aggregates are not allowed in " + clause);
    }
  }

  private static void checkGrouped(Expression expr, CubeQueryContext cubeql)
      throws SemanticException {
    if (!expr.isGroupedBy(cubeql.getGroupBy())) {
      throw new SemanticException(ErrorMsg.INVALID_EXPRESSION, expr.toString(),
          "must be aggregated or appear in group by");
    }
  }
}
