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

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.conf.Configuration;
import org.elasticube.cube.CubeConfUtil;

/**
 * When enabled, promotes the non aggregated select expressions of an
 * aggregating query without group by into its group by.
 */
public class GroupbyResolver implements ContextRewriter {
  private static Log LOG = LogFactory.getLog(
      GroupbyResolver.class.getName());

  private final boolean selectPromotionEnabled;

  public GroupbyResolver(Configuration conf) {
    selectPromotionEnabled = conf.getBoolean(
        CubeConfUtil.ENABLE_SELECT_TO_GROUPBY,
        CubeConfUtil.DEFAULT_ENABLE_SELECT_TO_GROUPBY);
  }

  @Override
  public void rewriteContext(CubeQueryContext cubeql) throws SemanticException {
    if (!selectPromotionEnabled) {
      return;
    }
    if (!cubeql.getGroupBy().isEmpty()) {
      LOG.info("Not promoting select expression to groupby,"
          + " since there are already group by expressions");
      return;
    }
    if (!cubeql.hasAggregates()) {
      return;
    }
    for (SelectItem item : cubeql.getSelects()) {
      Expression expr = item.getExpression();
      if (expr instanceof Literal || cubeql.isAggregateExpr(expr)) {
        continue;
      }
      if (!cubeql.getGroupBy().contains(expr)) {
        cubeql.getGroupBy().add(expr);
      }
    }
  }
}
