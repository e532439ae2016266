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
import java.util.Map;

import org.apache.hadoop.conf.Configuration;

/**
 * Replaces order by items naming a select alias with the aliased expression.
 */
public class AliasReplacer implements ContextRewriter {

  public AliasReplacer(Configuration conf) {
  }

  @Override
  public void rewriteContext(CubeQueryContext cubeql) throws SemanticException {
    Map<String, Expression> aliases = cubeql.getSelectAliases();
    if (aliases.isEmpty()) {
      return;
    }
    List<OrderItem> orderBy = new ArrayList<OrderItem>();
    for (OrderItem item : cubeql.getOrderBy()) {
      Expression expr = item.getExpression();
      if (expr instanceof ColumnRef) {
        Expression aliased = aliases.get(((ColumnRef) expr).getName());
        if (aliased != null) {
          item = item.withExpression(aliased);
        }
      }
      orderBy.add(item);
    }
    cubeql.setOrderBy(orderBy);
  }
}
