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
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.hadoop.conf.Configuration;
import org.elasticube.cube.ElastiCube;
import org.elasticube.cube.ErrorMsg;
import org.elasticube.cube.exec.QueryResult;
import org.elasticube.cube.metadata.CubeException;
import org.elasticube.cube.metadata.CubeSchema;

/**
 * Fluent construction of a cube query. Calls only record what was asked;
 * parsing and validation happen in {@link #materialize()}, so every
 * construction error surfaces there.
 *
 * <pre>
 * cube.query()
 *     .select("region", "SUM(sales) AS total")
 *     .slice("year", 2024)
 *     .groupBy("region")
 *     .orderBy("total DESC")
 *     .limit(10)
 *     .execute();
 * </pre>
 */
public class CubeQueryBuilder {
  private final CubeSchema schema;
  private final Configuration conf;
  private final ElastiCube cube;
  private final String text;

  private final List<String> selects = new ArrayList<String>();
  private final List<PendingFilter> filters = new ArrayList<PendingFilter>();
  private final List<String> groupBy = new ArrayList<String>();
  private final List<String> orderBy = new ArrayList<String>();
  private final List<OlapOperation> olapOps = new ArrayList<OlapOperation>();
  private boolean explicitGroupBy;
  private Integer limit;
  private SemanticException deferred;

  /**
   * Builder bound to a cube, able to execute.
   */
  public CubeQueryBuilder(ElastiCube cube, String text) {
    this(cube.getSchema(), cube.getConf(), cube, text);
  }

  /**
   * Builder over a bare schema. It can materialize but not execute.
   */
  public CubeQueryBuilder(CubeSchema schema, Configuration conf) {
    this(schema, conf, null, null);
  }

  private CubeQueryBuilder(CubeSchema schema, Configuration conf,
      ElastiCube cube, String text) {
    this.schema = schema;
    this.conf = conf;
    this.cube = cube;
    this.text = text;
  }

  /**
   * Adds projected items, each {@code expr [AS alias]}.
   */
  public CubeQueryBuilder select(String... items) {
    selects.addAll(Arrays.asList(items));
    return this;
  }

  /**
   * Adds a predicate. Predicates from repeated calls, slices and dices are
   * AND-ed in call order.
   */
  public CubeQueryBuilder filter(String predicate) {
    filters.add(new PendingFilter(predicate));
    return this;
  }

  public CubeQueryBuilder groupBy(String... items) {
    groupBy.addAll(Arrays.asList(items));
    explicitGroupBy = true;
    return this;
  }

  /**
   * Adds ordering items, each {@code expr [ASC|DESC]}. An item may name a
   * select alias.
   */
  public CubeQueryBuilder orderBy(String... items) {
    orderBy.addAll(Arrays.asList(items));
    return this;
  }

  public CubeQueryBuilder limit(int rows) {
    if (rows < 0) {
      deferred = new SemanticException(ErrorMsg.INVALID_EXPRESSION,
          "LIMIT " + rows, "limit cannot be negative");
    }
    limit = Integer.valueOf(rows);
    return this;
  }

  /**
   * Keeps only the rows where the dimension equals the value.
   */
  public CubeQueryBuilder slice(String dimension, Object value) {
    Map<String, Object> equality = new LinkedHashMap<String, Object>();
    equality.put(dimension, value);
    Literal literal = toLiteral(dimension, value);
    if (literal != null) {
      filters.add(new PendingFilter("slice", equality));
      olapOps.add(new OlapOperation(OlapOperation.Type.SLICE,
          Arrays.asList(dimension, literal.toString())));
    }
    return this;
  }

  /**
   * Keeps only the rows matching every dimension value pair, in the
   * iteration order of the map.
   */
  public CubeQueryBuilder dice(Map<String, ?> values) {
    Map<String, Object> equalities = new LinkedHashMap<String, Object>();
    List<String> args = new ArrayList<String>();
    for (Map.Entry<String, ?> entry : values.entrySet()) {
      Literal literal = toLiteral(entry.getKey(), entry.getValue());
      if (literal == null) {
        return this;
      }
      equalities.put(entry.getKey(), entry.getValue());
      args.add(entry.getKey() + "=" + literal);
    }
    filters.add(new PendingFilter("dice", equalities));
    olapOps.add(new OlapOperation(OlapOperation.Type.DICE, args));
    return this;
  }

  /**
   * Groups by exactly the given dimensions, unless {@link #groupBy} was
   * called.
   */
  public CubeQueryBuilder rollUp(String... dimensions) {
    List<String> args = new ArrayList<String>();
    if (dimensions != null) {
      args.addAll(Arrays.asList(dimensions));
    }
    olapOps.add(new OlapOperation(OlapOperation.Type.ROLL_UP, args));
    return this;
  }

  /**
   * Adds the levels of the hierarchy down to the given one to the group by.
   */
  public CubeQueryBuilder drillDown(String hierarchy, String level) {
    olapOps.add(new OlapOperation(OlapOperation.Type.DRILL_DOWN,
        Arrays.asList(hierarchy, level)));
    return this;
  }

  private Literal toLiteral(String dimension, Object value) {
    try {
      return Literal.of(value);
    } catch (IllegalArgumentException e) {
      deferred = new SemanticException(ErrorMsg.INVALID_EXPRESSION, e,
          dimension + " = " + value, e.getMessage());
      return null;
    }
  }

  /**
   * Parses and resolves the query into its immutable descriptor.
   */
  public QueryDescriptor materialize() throws SemanticException {
    if (deferred != null) {
      throw deferred;
    }
    CubeQueryContext ctx = new CubeQueryContext(schema, conf);
    try {
      if (text != null) {
        addParsedQuery(ctx, ExprParser.parseQuery(text));
      }
      for (String item : selects) {
        ctx.getSelects().add(ExprParser.parseSelectItem(item));
      }
      for (PendingFilter filter : filters) {
        if (filter.equalities == null) {
          ctx.getFilters().add(ExprParser.parseExpression(filter.predicate));
        } else {
          for (Map.Entry<String, Object> entry : filter.equalities.entrySet()) {
            if (entry.getKey() == null) {
              throw new SemanticException(ErrorMsg.UNKNOWN_FIELD, "null",
                  filter.verb);
            }
            ctx.getFilters().add(new BinaryOp(BinaryOp.Operator.EQ,
                new ColumnRef(entry.getKey()), Literal.of(entry.getValue())));
          }
        }
      }
      for (String item : groupBy) {
        ctx.getGroupBy().add(ExprParser.parseExpression(item));
      }
      for (String item : orderBy) {
        ctx.getOrderBy().add(ExprParser.parseOrderItem(item));
      }
    } catch (ParseException e) {
      throw new SemanticException(ErrorMsg.INVALID_EXPRESSION, e, e.getText(),
          e.getMessage());
    }
    if (explicitGroupBy) {
      ctx.setExplicitGroupBy(true);
    }
    if (limit != null) {
      ctx.setLimit(limit);
    }
    ctx.getOlapOps().addAll(olapOps);
    return new CubeQueryRewriter(conf).rewrite(ctx);
  }

  private void addParsedQuery(CubeQueryContext ctx, ParsedQuery query)
      throws SemanticException {
    if (query.getFrom() != null && !query.getFrom().equals(schema.getName())) {
      throw new SemanticException(ErrorMsg.UNKNOWN_FIELD, query.getFrom(),
          "from");
    }
    ctx.getSelects().addAll(query.getSelects());
    if (query.getWhere() != null) {
      ctx.getFilters().add(query.getWhere());
    }
    if (!query.getGroupBy().isEmpty()) {
      ctx.getGroupBy().addAll(query.getGroupBy());
      ctx.setExplicitGroupBy(true);
    }
    ctx.getOrderBy().addAll(query.getOrderBy());
    if (query.getLimit() != null) {
      ctx.setLimit(query.getLimit());
    }
  }

  /**
   * Materializes the query and runs it through the cube's cache and engine.
   */
  public QueryResult execute() throws CubeException {
    if (cube == null) {
      throw new IllegalStateException("Query is not bound to a cube");
    }
    return cube.execute(materialize());
  }

  /**
   * A textual predicate, or the equalities of a slice or dice.
   */
  private static class PendingFilter {
    final String predicate;
    final String verb;
    final Map<String, Object> equalities;

    PendingFilter(String predicate) {
      this.predicate = predicate;
      this.verb = null;
      this.equalities = null;
    }

    PendingFilter(String verb, Map<String, Object> equalities) {
      this.predicate = null;
      this.verb = verb;
      this.equalities = equalities;
    }
  }
}
