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
import java.util.Set;

import org.apache.hadoop.conf.Configuration;
import org.elasticube.cube.ErrorMsg;
import org.elasticube.cube.metadata.CubeSchema;
import org.elasticube.cube.metadata.Hierarchy;

/**
 * Checks that every name used by the query is a queryable field of the cube
 * and that the OLAP verbs target dimensions and hierarchy levels.
 */
public class ColumnResolver implements ContextRewriter {

  public ColumnResolver(Configuration conf) {
  }

  @Override
  public void rewriteContext(CubeQueryContext cubeql) throws SemanticException {
    if (cubeql.getSelects().isEmpty()) {
      throw new SemanticException(ErrorMsg.EMPTY_SELECT);
    }
    CubeSchema schema = cubeql.getSchema();
    for (SelectItem item : cubeql.getSelects()) {
      checkColumns(schema, item.getExpression(), "select");
    }
    for (Expression filter : cubeql.getFilters()) {
      checkColumns(schema, filter, "filter");
    }
    for (Expression expr : cubeql.getGroupBy()) {
      checkColumns(schema, expr, "group by");
    }
    Map<String, Expression> aliases = cubeql.getSelectAliases();
    for (OrderItem item : cubeql.getOrderBy()) {
      Expression expr = item.getExpression();
      if (expr instanceof ColumnRef
          && aliases.containsKey(((ColumnRef) expr).getName())) {
        continue;
      }
      checkColumns(schema, expr, "order by");
    }
    List<OlapOperation> olapOps = new ArrayList<OlapOperation>();
    for (OlapOperation op : cubeql.getOlapOps()) {
      olapOps.add(checkOlapOperation(schema, op));
    }
    cubeql.getOlapOps().clear();
    cubeql.getOlapOps().addAll(olapOps);
  }

  private static void checkColumns(CubeSchema schema, Expression expr,
      String clause) throws SemanticException {
    Set<String> columns = expr.getColumns();
    for (String column : columns) {
      if (schema.getColumnByName(column) == null) {
        // hierarchy names are not columns either
        throw new SemanticException(ErrorMsg.UNKNOWN_FIELD, column, clause);
      }
    }
  }

  /**
   * Checks the targets of an OLAP verb as the caller spelled them and returns
   * the verb with its field names in lower case.
   */
  private static OlapOperation checkOlapOperation(CubeSchema schema,
      OlapOperation op) throws SemanticException {
    List<String> args = new ArrayList<String>();
    switch (op.getType()) {
    case SLICE:
      args.add(checkDimension(schema, op.getArgs().get(0), "slice"));
      args.add(op.getArgs().get(1));
      break;
    case DICE:
      for (String arg : op.getArgs()) {
        int split = arg.indexOf('=');
        args.add(checkDimension(schema, arg.substring(0, split), "dice")
            + arg.substring(split));
      }
      break;
    case ROLL_UP:
      for (String arg : op.getArgs()) {
        args.add(checkDimension(schema, arg, "roll up"));
      }
      break;
    case DRILL_DOWN:
      String hierName = op.getArgs().get(0);
      Hierarchy hierarchy = hierName == null ? null
          : schema.getHierarchyByName(hierName.toLowerCase());
      if (hierarchy == null) {
        throw new SemanticException(ErrorMsg.UNKNOWN_FIELD,
            String.valueOf(hierName), "drill down");
      }
      String level = op.getArgs().get(1);
      if (level == null || hierarchy.indexOf(level.toLowerCase()) < 0) {
        throw new SemanticException(ErrorMsg.INVALID_HIERARCHY_LEVEL,
            String.valueOf(level), hierarchy.getName());
      }
      args.add(hierarchy.getName());
      args.add(level.toLowerCase());
      break;
    default:
      args.addAll(op.getArgs());
      break;
    }
    return new OlapOperation(op.getType(), args);
  }

  private static String checkDimension(CubeSchema schema, String name,
      String verb) throws SemanticException {
    if (name == null || !schema.isDimension(name.toLowerCase())) {
      throw new SemanticException(ErrorMsg.UNKNOWN_FIELD,
          String.valueOf(name), verb);
    }
    return name.toLowerCase();
  }
}
