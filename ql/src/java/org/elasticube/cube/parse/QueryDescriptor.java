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
import java.util.List;

import org.apache.commons.lang.StringUtils;

/**
 * Immutable, fully resolved form of a query. Every expression in it
 * references base fields only, order by items never name aliases and the
 * OLAP verbs have already been applied to the filter and group by.
 */
public final class QueryDescriptor {
  private final List<SelectItem> select;
  private final Expression filter;
  private final List<Expression> groupBy;
  private final List<OrderItem> orderBy;
  private final Integer limit;
  private final List<OlapOperation> olapOps;
  private final long schemaVersion;

  public QueryDescriptor(List<SelectItem> select, Expression filter,
      List<Expression> groupBy, List<OrderItem> orderBy, Integer limit,
      List<OlapOperation> olapOps, long schemaVersion) {
    this.select = Collections.unmodifiableList(new ArrayList<SelectItem>(select));
    this.filter = filter;
    this.groupBy = Collections.unmodifiableList(
        new ArrayList<Expression>(groupBy));
    this.orderBy = Collections.unmodifiableList(
        new ArrayList<OrderItem>(orderBy));
    this.limit = limit;
    this.olapOps = Collections.unmodifiableList(
        new ArrayList<OlapOperation>(olapOps));
    this.schemaVersion = schemaVersion;
  }

  public List<SelectItem> getSelect() {
    return select;
  }

  /**
   * Conjunction of all filters, null when the query has none.
   */
  public Expression getFilter() {
    return filter;
  }

  public List<Expression> getGroupBy() {
    return groupBy;
  }

  public List<OrderItem> getOrderBy() {
    return orderBy;
  }

  public Integer getLimit() {
    return limit;
  }

  public List<OlapOperation> getOlapOps() {
    return olapOps;
  }

  /**
   * Version of the schema the descriptor was resolved against.
   */
  public long getSchemaVersion() {
    return schemaVersion;
  }

  public List<String> getColumnNames() {
    List<String> names = new ArrayList<String>(select.size());
    for (SelectItem item : select) {
      names.add(item.getOutputName());
    }
    return names;
  }

  public boolean isAggregating() {
    if (!groupBy.isEmpty()) {
      return true;
    }
    for (SelectItem item : select) {
      if (item.getExpression().containsAggregate()) {
        return true;
      }
    }
    for (OrderItem item : orderBy) {
      if (item.getExpression().containsAggregate()) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder();
    builder.append("SELECT ").append(StringUtils.join(select, ", "));
    if (filter != null) {
      builder.append(" WHERE ").append(filter);
    }
    if (!groupBy.isEmpty()) {
      builder.append(" GROUP BY ").append(StringUtils.join(groupBy, ", "));
    }
    if (!orderBy.isEmpty()) {
      builder.append(" ORDER BY ").append(StringUtils.join(orderBy, ", "));
    }
    if (limit != null) {
      builder.append(" LIMIT ").append(limit);
    }
    return builder.toString();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof QueryDescriptor)) {
      return false;
    }
    QueryDescriptor other = (QueryDescriptor) obj;
    if (filter == null ? other.filter != null : !filter.equals(other.filter)) {
      return false;
    }
    if (limit == null ? other.limit != null : !limit.equals(other.limit)) {
      return false;
    }
    return schemaVersion == other.schemaVersion && select.equals(other.select)
        && groupBy.equals(other.groupBy) && orderBy.equals(other.orderBy)
        && olapOps.equals(other.olapOps);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = select.hashCode();
    result = prime * result + (filter == null ? 0 : filter.hashCode());
    result = prime * result + groupBy.hashCode();
    result = prime * result + orderBy.hashCode();
    result = prime * result + (limit == null ? 0 : limit.hashCode());
    result = prime * result + olapOps.hashCode();
    result = prime * result + (int) (schemaVersion ^ (schemaVersion >>> 32));
    return result;
  }
}
