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
import org.elasticube.cube.metadata.Hierarchy;

/**
 * Applies roll up and drill down to the group by, in call order. Slice and
 * dice were already turned into filters by the builder.
 *
 * A roll up replaces the group by unless the query has an explicit group by,
 * which always wins. A drill down extends the group by with the hierarchy
 * levels down to the requested one that are not grouped on yet.
 */
public class OlapOperationResolver implements ContextRewriter {
  private static final Log LOG = LogFactory.getLog(OlapOperationResolver.class);

  public OlapOperationResolver(Configuration conf) {
  }

  @Override
  public void rewriteContext(CubeQueryContext cubeql) throws SemanticException {
    for (OlapOperation op : cubeql.getOlapOps()) {
      if (op.getType() == OlapOperation.Type.ROLL_UP) {
        if (cubeql.isExplicitGroupBy()) {
          LOG.info("Ignoring " + op + " since the query groups explicitly by "
              + cubeql.getGroupBy());
          continue;
        }
        List<Expression> groupBy = new ArrayList<Expression>();
        for (String dim : op.getArgs()) {
          groupBy.add(new ColumnRef(dim));
        }
        cubeql.setGroupBy(groupBy);
      } else if (op.getType() == OlapOperation.Type.DRILL_DOWN) {
        Hierarchy hierarchy = cubeql.getSchema().getHierarchyByName(
            op.getArgs().get(0));
        for (String level : hierarchy.levelsUpTo(op.getArgs().get(1))) {
          ColumnRef ref = new ColumnRef(level);
          if (!cubeql.getGroupBy().contains(ref)) {
            cubeql.getGroupBy().add(ref);
          }
        }
      }
    }
  }
}
