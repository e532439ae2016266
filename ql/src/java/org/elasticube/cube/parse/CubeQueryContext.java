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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.conf.Configuration;
import org.elasticube.cube.metadata.CubeException;
import org.elasticube.cube.metadata.CubeSchema;

/**
 * Working state of a query while the rewriters resolve it. Every clause is
 * freely mutable here; {@link #toDescriptor()} freezes the final state.
 */
public class CubeQueryContext {
  public static final Log LOG = LogFactory.getLog(CubeQueryContext.class.getName());

  private final CubeSchema schema;
  private final Configuration conf;
  private final long schemaVersion;

  private List<SelectItem> selects = new ArrayList<SelectItem>();
  private final List<Expression> filters = new ArrayList<Expression>();
  private List<Expression> groupBy = new ArrayList<Expression>();
  private boolean explicitGroupBy;
  private List<OrderItem> orderBy = new ArrayList<OrderItem>();
  private Integer limit;
  private final List<OlapOperation> olapOps = new ArrayList<OlapOperation>();

  public CubeQueryContext(CubeSchema schema, Configuration conf) {
    this.schema = schema;
    this.conf = conf;
    this.schemaVersion = schema.getVersion();
  }

  public CubeSchema getSchema() {
    return schema;
  }

  public Configuration getConf() {
    return conf;
  }

  /**
   * Schema version when resolution started.
   */
  public long getSchemaVersion() {
    return schemaVersion;
  }

  public List<SelectItem> getSelects() {
    return selects;
  }

  public void setSelects(List<SelectItem> selects) {
    this.selects = selects;
  }

  /**
   * Filters in the order they were added. They are AND-ed together.
   */
  public List<Expression> getFilters() {
    return filters;
  }

  public List<Expression> getGroupBy() {
    return groupBy;
  }

  public void setGroupBy(List<Expression> groupBy) {
    this.groupBy = groupBy;
  }

  public boolean isExplicitGroupBy() {
    return explicitGroupBy;
  }

  public void setExplicitGroupBy(boolean explicitGroupBy) {
    this.explicitGroupBy = explicitGroupBy;
  }

  public List<OrderItem> getOrderBy() {
    return orderBy;
  }

  public void setOrderBy(List<OrderItem> orderBy) {
    this.orderBy = orderBy;
  }

  public Integer getLimit() {
    return limit;
  }

  public void setLimit(Integer limit) {
    this.limit = limit;
  }

  public List<OlapOperation> getOlapOps() {
    return olapOps;
  }

  /**
   * Select expressions by alias, for items that have one.
   */
  public Map<String, Expression> getSelectAliases() {
    Map<String, Expression> aliases = new LinkedHashMap<String, Expression>();
    for (SelectItem item : selects) {
      if (item.getAlias() != null && !aliases.containsKey(item.getAlias())) {
        aliases.put(item.getAlias(), item.getExpression());
      }
    }
    return aliases;
  }

  /**
   * Whether the expression is evaluated per group: it calls an aggregate or
   * references a calculated measure whose expansion does.
   */
  public boolean isAggregateExpr(Expression expr) throws SemanticException {
    if (expr.containsAggregate()) {
      return true;
    }
    try {
      for (String column : expr.getColumns()) {
        if (schema.isMeasure(column) && schema.isDerived(column)
            && schema.isAggregating(column)) {
          return true;
        }
      }
    } catch (CubeException e) {
      throw new SemanticException(e);
    }
    return false;
  }

  /**
   * Whether the query aggregates at all: it has a group by or aggregates in
   * its select or order by.
   */
  public boolean hasAggregates() throws SemanticException {
    if (!groupBy.isEmpty()) {
      return true;
    }
    for (SelectItem item : selects) {
      if (isAggregateExpr(item.getExpression())) {
        return true;
      }
    }
    for (OrderItem item : orderBy) {
      if (isAggregateExpr(item.getExpression())) {
        return true;
      }
    }
    return false;
  }

  public QueryDescriptor toDescriptor() {
    QueryDescriptor descriptor = new QueryDescriptor(selects,
        Expression.and(filters), groupBy, orderBy, limit, olapOps,
        schemaVersion);
    LOG.info("Resolved query on cube " + schema.getName() + ": " + descriptor);
    return descriptor;
  }
}
