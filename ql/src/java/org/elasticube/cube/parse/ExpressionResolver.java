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

import org.apache.hadoop.conf.Configuration;
import org.elasticube.cube.metadata.CubeException;
import org.elasticube.cube.metadata.CubeSchema;

/**
 * Replaces every calculated measure and virtual dimension in the query with
 * its expansion over base fields. A derived field selected on its own keeps
 * its name as the output column name.
 */
public class ExpressionResolver implements ContextRewriter {

  public ExpressionResolver(Configuration conf) {
  }

  @Override
  public void rewriteContext(CubeQueryContext cubeql) throws SemanticException {
    CubeSchema schema = cubeql.getSchema();
    try {
      List<SelectItem> selects = new ArrayList<SelectItem>();
      for (SelectItem item : cubeql.getSelects()) {
        Expression expr = item.getExpression();
        String alias = item.getAlias();
        if (alias == null && expr instanceof ColumnRef
            && schema.isDerived(((ColumnRef) expr).getName())) {
          alias = ((ColumnRef) expr).getName();
        }
        selects.add(new SelectItem(schema.expand(expr, "select"), alias));
      }
      cubeql.setSelects(selects);

      List<Expression> filters = new ArrayList<Expression>();
      for (Expression filter : cubeql.getFilters()) {
        filters.add(schema.expand(filter, "filter"));
      }
      cubeql.getFilters().clear();
      cubeql.getFilters().addAll(filters);

      List<Expression> groupBy = new ArrayList<Expression>();
      for (Expression expr : cubeql.getGroupBy()) {
        groupBy.add(schema.expand(expr, "group by"));
      }
      cubeql.setGroupBy(groupBy);

      List<OrderItem> orderBy = new ArrayList<OrderItem>();
      for (OrderItem item : cubeql.getOrderBy()) {
        orderBy.add(item.withExpression(schema.expand(item.getExpression(),
            "order by")));
      }
      cubeql.setOrderBy(orderBy);
    } catch (CubeException e) {
      throw new SemanticException(e);
    }
  }
}
