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

/**
 * Clauses of a textual query, as written. Nothing is resolved against a
 * schema yet.
 */
public class ParsedQuery {
  private final List<SelectItem> selects = new ArrayList<SelectItem>();
  private final List<Expression> groupBy = new ArrayList<Expression>();
  private final List<OrderItem> orderBy = new ArrayList<OrderItem>();
  private String from;
  private Expression where;
  private Integer limit;

  public List<SelectItem> getSelects() {
    return selects;
  }

  public List<Expression> getGroupBy() {
    return groupBy;
  }

  public List<OrderItem> getOrderBy() {
    return orderBy;
  }

  public String getFrom() {
    return from;
  }

  void setFrom(String from) {
    this.from = from;
  }

  public Expression getWhere() {
    return where;
  }

  void setWhere(Expression where) {
    this.where = where;
  }

  public Integer getLimit() {
    return limit;
  }

  void setLimit(Integer limit) {
    this.limit = limit;
  }
}
