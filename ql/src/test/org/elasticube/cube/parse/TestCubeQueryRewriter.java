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

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.hadoop.conf.Configuration;
import org.elasticube.cube.CubeConfUtil;
import org.elasticube.cube.CubeTestSetup;
import org.elasticube.cube.ErrorMsg;
import org.elasticube.cube.metadata.AggregateFunction;
import org.elasticube.cube.metadata.ColumnType;
import org.elasticube.cube.metadata.CubeSchema;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class TestCubeQueryRewriter {

  private Configuration conf;
  private CubeSchema schema;

  @Before
  public void setupSchema() throws Exception {
    conf = CubeTestSetup.getConf();
    schema = CubeTestSetup.createSchema();
    schema.addCalculatedMeasure("profit", "sum(revenue) - sum(cost)",
        ColumnType.DOUBLE, AggregateFunction.SUM);
    schema.addCalculatedMeasure("net", "revenue - cost", ColumnType.DOUBLE,
        AggregateFunction.SUM);
    schema.addVirtualDimension("region_upper", "upper(region)",
        ColumnType.STRING);
  }

  private CubeQueryBuilder query() {
    return new CubeQueryBuilder(schema, conf);
  }

  private static List<Expression> refs(String... names) {
    Expression[] exprs = new Expression[names.length];
    for (int i = 0; i < names.length; i++) {
      exprs[i] = new ColumnRef(names[i]);
    }
    return Arrays.asList(exprs);
  }

  private static Set<String> allColumns(QueryDescriptor desc) {
    Set<String> columns = new HashSet<String>();
    for (SelectItem item : desc.getSelect()) {
      item.getExpression().collectColumns(columns);
    }
    if (desc.getFilter() != null) {
      desc.getFilter().collectColumns(columns);
    }
    for (Expression expr : desc.getGroupBy()) {
      expr.collectColumns(columns);
    }
    for (OrderItem item : desc.getOrderBy()) {
      item.getExpression().collectColumns(columns);
    }
    return columns;
  }

  private static void assertFails(ErrorMsg expected, CubeQueryBuilder builder) {
    try {
      builder.materialize();
      Assert.fail("Expected " + expected);
    } catch (SemanticException e) {
      Assert.assertEquals(expected.getErrorCode(),
          e.getCanonicalErrorMsg().getErrorCode());
    }
  }

  @Test
  public void testCalculatedMeasureIsInlined() throws Exception {
    QueryDescriptor desc = query().select("region", "profit")
        .groupBy("region").materialize();
    SelectItem profit = desc.getSelect().get(1);
    Assert.assertEquals("(sum(revenue) - sum(cost))",
        profit.getExpression().toString());
    Assert.assertEquals("profit", profit.getOutputName());
    Assert.assertEquals(new HashSet<String>(Arrays.asList("region", "revenue",
        "cost")), allColumns(desc));
    Assert.assertFalse(allColumns(desc).contains("profit"));
  }

  @Test
  public void testRollUpWithoutExplicitGroupBy() throws Exception {
    QueryDescriptor desc = query().select("region", "revenue")
        .rollUp("region").materialize();
    Assert.assertEquals(refs("region"), desc.getGroupBy());
    Assert.assertEquals(OlapOperation.Type.ROLL_UP,
        desc.getOlapOps().get(0).getType());
  }

  @Test
  public void testExplicitGroupByWinsOverRollUp() throws Exception {
    QueryDescriptor desc = query().select("region", "product", "revenue")
        .groupBy("region", "product").rollUp("region").materialize();
    Assert.assertEquals(refs("region", "product"), desc.getGroupBy());

    desc = query().select("region", "product", "revenue")
        .rollUp("region").groupBy("region", "product").materialize();
    Assert.assertEquals(refs("region", "product"), desc.getGroupBy());
  }

  @Test
  public void testRollUpTargetsMustBeDimensions() throws Exception {
    assertFails(ErrorMsg.UNKNOWN_FIELD, query().select("revenue")
        .rollUp("revenue"));
    assertFails(ErrorMsg.UNKNOWN_FIELD, query().select("revenue")
        .rollUp("nowhere"));
  }

  @Test
  public void testDrillDownExtendsGroupBy() throws Exception {
    QueryDescriptor desc = query().select("revenue").groupBy("region")
        .drillDown("time", "quarter").materialize();
    Assert.assertEquals(refs("region", "year", "quarter"), desc.getGroupBy());

    desc = query().select("revenue").groupBy("year")
        .drillDown("TIME", "month").materialize();
    Assert.assertEquals(refs("year", "quarter", "month"), desc.getGroupBy());

    assertFails(ErrorMsg.INVALID_HIERARCHY_LEVEL, query().select("revenue")
        .drillDown("time", "region"));
    assertFails(ErrorMsg.UNKNOWN_FIELD, query().select("revenue")
        .drillDown("geo", "region"));
  }

  @Test
  public void testSliceAndDiceAreAndedInCallOrder() throws Exception {
    Map<String, Object> dice = new LinkedHashMap<String, Object>();
    dice.put("product", "Widget");
    dice.put("quarter", "Q2");
    QueryDescriptor desc = query().select("revenue").slice("region", "North")
        .filter("year > 2023").dice(dice).materialize();
    Assert.assertEquals("((((region = 'North') AND (year > 2023)) AND "
        + "(product = 'Widget')) AND (quarter = 'Q2'))",
        desc.getFilter().toString());
    Assert.assertEquals(2, desc.getOlapOps().size());
    Assert.assertEquals("slice(region, 'North')",
        desc.getOlapOps().get(0).toString());
    Assert.assertEquals("dice(product='Widget', quarter='Q2')",
        desc.getOlapOps().get(1).toString());

    assertFails(ErrorMsg.UNKNOWN_FIELD, query().select("revenue")
        .slice("revenue", 10.0));
    assertFails(ErrorMsg.INVALID_EXPRESSION, query().select("revenue")
        .slice("region", new Object()));
  }

  @Test
  public void testNoFilterGivesNullPredicate() throws Exception {
    QueryDescriptor desc = query().select("region").materialize();
    Assert.assertNull(desc.getFilter());
    Assert.assertTrue(desc.getOlapOps().isEmpty());
    Assert.assertFalse(desc.isAggregating());
  }

  @Test
  public void testDefaultAggregates() throws Exception {
    QueryDescriptor desc = query().select("region", "revenue", "units * 2")
        .groupBy("region").materialize();
    Assert.assertEquals("sum(revenue)",
        desc.getSelect().get(1).getExpression().toString());
    Assert.assertEquals("revenue", desc.getSelect().get(1).getAlias());
    Assert.assertEquals("(sum(units) * 2)",
        desc.getSelect().get(2).getExpression().toString());

    // row level calculated measures are aggregated after expansion
    desc = query().select("region", "net").groupBy("region").materialize();
    Assert.assertEquals("sum((revenue - cost))",
        desc.getSelect().get(1).getExpression().toString());
    Assert.assertEquals("net", desc.getSelect().get(1).getOutputName());

    // a query without grouping is left alone
    desc = query().select("region", "revenue").materialize();
    Assert.assertEquals("revenue",
        desc.getSelect().get(1).getExpression().toString());
  }

  @Test
  public void testDisabledAggregateResolver() throws Exception {
    conf.setBoolean(CubeConfUtil.DISABLE_AGGREGATE_RESOLVER, true);
    QueryDescriptor desc = query().select("region", "revenue")
        .groupBy("region", "revenue").materialize();
    Assert.assertEquals(new ColumnRef("revenue"),
        desc.getSelect().get(1).getExpression());
    // nothing wraps the bare measure, so it is left ungrouped
    assertFails(ErrorMsg.INVALID_EXPRESSION, query().select("region",
        "revenue").groupBy("region"));
  }

  @Test
  public void testSelectPromotion() throws Exception {
    assertFails(ErrorMsg.INVALID_EXPRESSION, query().select("region",
        "SUM(revenue)"));

    conf.setBoolean(CubeConfUtil.ENABLE_SELECT_TO_GROUPBY, true);
    QueryDescriptor desc = query().select("region", "region_upper", "profit").materialize();
    Assert.assertEquals(Arrays.asList(new ColumnRef("region"),
        ExprParser.parseExpression("upper(region)")), desc.getGroupBy());
  }

  @Test
  public void testOrderByAlias() throws Exception {
    QueryDescriptor desc = query().select("region", "SUM(revenue) AS total")
        .groupBy("region").orderBy("total DESC", "region").materialize();
    OrderItem first = desc.getOrderBy().get(0);
    Assert.assertEquals("sum(revenue)", first.getExpression().toString());
    Assert.assertFalse(first.isAscending());
    Assert.assertEquals(new ColumnRef("region"),
        desc.getOrderBy().get(1).getExpression());
    Assert.assertEquals(Arrays.asList("region", "total"),
        desc.getColumnNames());
  }

  @Test
  public void testVirtualDimensionIsInlined() throws Exception {
    QueryDescriptor desc = query().select("region_upper", "revenue")
        .filter("region_upper != 'EAST'").groupBy("region_upper")
        .orderBy("region_upper").materialize();
    Assert.assertEquals("upper(region)", desc.getGroupBy().get(0).toString());
    Assert.assertEquals("region_upper", desc.getSelect().get(0).getAlias());
    Assert.assertEquals("(upper(region) != 'EAST')",
        desc.getFilter().toString());
    Assert.assertEquals("upper(region)",
        desc.getOrderBy().get(0).getExpression().toString());
    Assert.assertFalse(allColumns(desc).contains("region_upper"));
  }

  @Test
  public void testConstructionErrors() throws Exception {
    assertFails(ErrorMsg.EMPTY_SELECT, query());
    assertFails(ErrorMsg.UNKNOWN_FIELD, query().select("discount"));
    assertFails(ErrorMsg.UNKNOWN_FIELD, query().select("revenue")
        .filter("channel = 'web'"));
    assertFails(ErrorMsg.UNKNOWN_FIELD, query().select("revenue")
        .groupBy("nowhere"));
    assertFails(ErrorMsg.UNKNOWN_FIELD, query().select("revenue")
        .orderBy("nowhere"));
    // hierarchies are not columns
    assertFails(ErrorMsg.UNKNOWN_FIELD, query().select("time"));
    assertFails(ErrorMsg.INVALID_EXPRESSION, query().select("revenue +"));
    assertFails(ErrorMsg.INVALID_EXPRESSION, query().select("revenue")
        .limit(-1));
  }

  @Test
  public void testAggregatesRejectedAfterExpansion() throws Exception {
    // profit only aggregates once it is inlined
    assertFails(ErrorMsg.INVALID_EXPRESSION, query().select("region")
        .filter("profit > 10"));
    assertFails(ErrorMsg.INVALID_EXPRESSION, query().select("region")
        .filter("sum(revenue) > 5"));
    assertFails(ErrorMsg.INVALID_EXPRESSION, query().select("revenue")
        .groupBy("profit"));
    assertFails(ErrorMsg.INVALID_EXPRESSION, query().select("revenue")
        .groupBy("count(*)"));
    // row level calculated measures stay usable in filters
    QueryDescriptor desc = query().select("region").filter("net > 10")
        .materialize();
    Assert.assertEquals("((revenue - cost) > 10)", desc.getFilter().toString());
  }

  @Test
  public void testUngroupedItemsRejected() throws Exception {
    assertFails(ErrorMsg.INVALID_EXPRESSION, query().select("product",
        "sum(revenue)").groupBy("region"));
    assertFails(ErrorMsg.INVALID_EXPRESSION, query().select("region",
        "profit"));
    assertFails(ErrorMsg.INVALID_EXPRESSION, query().select("sum(revenue)")
        .groupBy("region").orderBy("product"));
    assertFails(ErrorMsg.INVALID_EXPRESSION, query().select("region_upper",
        "revenue").groupBy("product"));

    // grouped on the expanded form, or on a subtree of it
    QueryDescriptor desc = query().select("upper(region) AS r", "profit")
        .groupBy("region_upper").materialize();
    Assert.assertEquals("upper(region)", desc.getGroupBy().get(0).toString());
    desc = query().select("region", "lower(region) AS l", "count(*) AS n")
        .groupBy("region").materialize();
    Assert.assertEquals(3, desc.getSelect().size());
  }

  @Test
  public void testOlapArgumentsResolvedAtMaterialize() throws Exception {
    QueryDescriptor desc = query().select("revenue").slice("REGION", "North")
        .rollUp("Region").drillDown("Time", "Quarter").materialize();
    Assert.assertEquals("slice(region, 'North')",
        desc.getOlapOps().get(0).toString());
    Assert.assertEquals("roll_up(region)",
        desc.getOlapOps().get(1).toString());
    Assert.assertEquals("drill_down(time, quarter)",
        desc.getOlapOps().get(2).toString());
    Assert.assertEquals(refs("region", "year", "quarter"), desc.getGroupBy());
    Assert.assertEquals(desc, query().select("revenue")
        .slice("region", "North").rollUp("region").drillDown("time", "quarter")
        .materialize());

    Map<String, Object> dice = new LinkedHashMap<String, Object>();
    dice.put(null, "Widget");
    // null names are only reported when the query is materialized
    CubeQueryBuilder nullDice = query().select("revenue").dice(dice);
    assertFails(ErrorMsg.UNKNOWN_FIELD, nullDice);
    assertFails(ErrorMsg.UNKNOWN_FIELD, query().select("revenue")
        .slice(null, "North"));
    assertFails(ErrorMsg.UNKNOWN_FIELD, query().select("revenue")
        .rollUp("region", null));
    assertFails(ErrorMsg.UNKNOWN_FIELD, query().select("revenue")
        .drillDown(null, "month"));
    assertFails(ErrorMsg.INVALID_HIERARCHY_LEVEL, query().select("revenue")
        .drillDown("time", null));
  }

  @Test
  public void testDescriptorCarriesSchemaVersion() throws Exception {
    QueryDescriptor desc = query().select("region").limit(3).materialize();
    Assert.assertEquals(schema.getVersion(), desc.getSchemaVersion());
    Assert.assertEquals(Integer.valueOf(3), desc.getLimit());
    Assert.assertEquals("SELECT region LIMIT 3", desc.toString());
    Assert.assertEquals(desc, query().select("REGION").limit(3).materialize());
  }
}
