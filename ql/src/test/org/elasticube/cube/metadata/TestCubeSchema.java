package org.elasticube.cube.metadata;
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
import java.util.List;

import org.elasticube.cube.CubeTestSetup;
import org.elasticube.cube.ErrorMsg;
import org.elasticube.cube.parse.ColumnRef;
import org.elasticube.cube.parse.Expression;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class TestCubeSchema {

  private CubeSchema schema;

  @Before
  public void setup() throws Exception {
    schema = CubeTestSetup.createSchema();
  }

  private static void assertError(ErrorMsg expected, CubeException e) {
    Assert.assertEquals(expected.getErrorCode(),
        e.getCanonicalErrorMsg().getErrorCode());
  }

  @Test
  public void testBatchLayout() throws Exception {
    Assert.assertEquals(Arrays.asList("region", "product", "year", "quarter",
        "month", "revenue", "cost", "units"),
        schema.getBatchSchema().getFieldNames());
    schema.addVirtualDimension("region_upper", "upper(region)",
        ColumnType.STRING);
    schema.addCalculatedMeasure("profit", "sum(revenue) - sum(cost)",
        ColumnType.DOUBLE, AggregateFunction.SUM);
    // derived fields are not physical
    Assert.assertEquals(8, schema.getBatchSchema().size());
    Assert.assertTrue(schema.hasBaseFields());
  }

  @Test
  public void testVersionAdvancesOnEveryDeclaration() throws Exception {
    // 8 base fields and one hierarchy
    Assert.assertEquals(9, schema.getVersion());
    schema.addCalculatedMeasure("profit", "sum(revenue) - sum(cost)",
        ColumnType.DOUBLE, AggregateFunction.SUM);
    Assert.assertEquals(10, schema.getVersion());
  }

  @Test
  public void testCaseInsensitiveNames() throws Exception {
    Assert.assertNotNull(schema.getColumnByName("REGION"));
    Assert.assertTrue(schema.isDimension("Region"));
    Assert.assertTrue(schema.isMeasure("Revenue"));
    Assert.assertTrue(schema.isHierarchy("TIME"));
    Assert.assertFalse(schema.isDimension("revenue"));
  }

  @Test
  public void testDuplicateName() throws Exception {
    long version = schema.getVersion();
    try {
      schema.addMeasure("REGION", ColumnType.DOUBLE, AggregateFunction.SUM);
      Assert.fail("Duplicate name accepted");
    } catch (CubeException e) {
      assertError(ErrorMsg.DUPLICATE_NAME, e);
    }
    try {
      schema.addVirtualDimension("time", "year * 100", ColumnType.INT);
      Assert.fail("Name of a hierarchy accepted");
    } catch (CubeException e) {
      assertError(ErrorMsg.DUPLICATE_NAME, e);
    }
    Assert.assertEquals(version, schema.getVersion());
  }

  @Test
  public void testUnknownDependency() throws Exception {
    try {
      schema.addCalculatedMeasure("margin", "revenue - discount",
          ColumnType.DOUBLE, AggregateFunction.SUM);
      Assert.fail("Undeclared reference accepted");
    } catch (CubeException e) {
      assertError(ErrorMsg.UNKNOWN_DEPENDENCY, e);
    }
    Assert.assertNull(schema.getColumnByName("margin"));
  }

  @Test
  public void testSelfReferenceLeavesSchemaUnchanged() throws Exception {
    long version = schema.getVersion();
    List<String> names = schema.getAllFieldNames();
    try {
      schema.addCalculatedMeasure("loop", "loop + revenue", ColumnType.DOUBLE,
          AggregateFunction.SUM);
      Assert.fail("Cycle accepted");
    } catch (CubeException e) {
      assertError(ErrorMsg.CYCLIC_DEPENDENCY, e);
    }
    try {
      schema.addVirtualDimension("vloop", "upper(vloop)", ColumnType.STRING);
      Assert.fail("Cycle accepted");
    } catch (CubeException e) {
      assertError(ErrorMsg.CYCLIC_DEPENDENCY, e);
    }
    Assert.assertEquals(version, schema.getVersion());
    Assert.assertEquals(names, schema.getAllFieldNames());
    Assert.assertNull(schema.getColumnByName("loop"));
  }

  @Test
  public void testTransitiveCycleDetection() {
    FieldGraph graph = new FieldGraph();
    graph.addField("a", new HashSet<String>(Arrays.asList("b")));
    graph.addField("b", new HashSet<String>(Arrays.asList("c", "revenue")));
    Assert.assertEquals(Arrays.asList("c", "a", "b", "c"),
        graph.findCycle("c", new HashSet<String>(Arrays.asList("a"))));
    Assert.assertNull(graph.findCycle("d",
        new HashSet<String>(Arrays.asList("a"))));
  }

  @Test
  public void testInvalidExpression() throws Exception {
    try {
      schema.addCalculatedMeasure("broken", "revenue +", ColumnType.DOUBLE,
          AggregateFunction.SUM);
      Assert.fail("Unparseable expression accepted");
    } catch (CubeException e) {
      assertError(ErrorMsg.INVALID_EXPRESSION, e);
    }
    try {
      schema.addVirtualDimension("total", "sum(month)", ColumnType.BIGINT);
      Assert.fail("Aggregating virtual dimension accepted");
    } catch (CubeException e) {
      assertError(ErrorMsg.INVALID_EXPRESSION, e);
    }
  }

  @Test
  public void testCrossCategoryReferences() throws Exception {
    try {
      schema.addVirtualDimension("revenue_band", "revenue / 100",
          ColumnType.DOUBLE);
      Assert.fail("Virtual dimension over a measure accepted");
    } catch (CubeException e) {
      assertError(ErrorMsg.INVALID_DEPENDENCY, e);
    }
    schema.addVirtualDimension("region_upper", "upper(region)",
        ColumnType.STRING);
    try {
      schema.addVirtualDimension("region_code", "substr(region_upper, 1, 1)",
          ColumnType.STRING);
      Assert.fail("Virtual dimension over a virtual dimension accepted");
    } catch (CubeException e) {
      assertError(ErrorMsg.INVALID_DEPENDENCY, e);
    }
    try {
      schema.addCalculatedMeasure("per_time", "sum(revenue) / time",
          ColumnType.DOUBLE, AggregateFunction.SUM);
      Assert.fail("Reference to a hierarchy accepted");
    } catch (CubeException e) {
      assertError(ErrorMsg.INVALID_DEPENDENCY, e);
    }
    // calculated measures may use dimensions, virtual or not
    schema.addCalculatedMeasure("regions", "count(DISTINCT region_upper)",
        ColumnType.BIGINT, AggregateFunction.COUNT);
  }

  @Test
  public void testHierarchyValidation() throws Exception {
    long version = schema.getVersion();
    try {
      schema.addHierarchy("bad", "year", "revenue");
      Assert.fail("Measure accepted as hierarchy level");
    } catch (CubeException e) {
      assertError(ErrorMsg.INVALID_HIERARCHY_LEVEL, e);
    }
    try {
      schema.addHierarchy("bad", "year", "quarter", "year");
      Assert.fail("Repeated level accepted");
    } catch (CubeException e) {
      assertError(ErrorMsg.INVALID_HIERARCHY_LEVEL, e);
    }
    try {
      schema.addHierarchy("bad");
      Assert.fail("Empty hierarchy accepted");
    } catch (CubeException e) {
      assertError(ErrorMsg.INVALID_HIERARCHY_LEVEL, e);
    }
    Assert.assertEquals(version, schema.getVersion());

    schema.addVirtualDimension("region_upper", "upper(region)",
        ColumnType.STRING);
    schema.addHierarchy("geo", "region_upper", "product");
    Hierarchy geo = schema.getHierarchyByName("geo");
    Assert.assertEquals(Arrays.asList("region_upper", "product"),
        geo.getLevels());
    Assert.assertEquals(Arrays.asList("year", "quarter"),
        schema.getHierarchyByName("time").levelsUpTo("quarter"));
  }

  @Test
  public void testNestedExpansion() throws Exception {
    schema.addCalculatedMeasure("profit", "sum(revenue) - sum(cost)",
        ColumnType.DOUBLE, AggregateFunction.SUM);
    schema.addCalculatedMeasure("margin", "profit / sum(revenue)",
        ColumnType.DOUBLE, AggregateFunction.AVG);
    Expression margin = schema.resolve("margin");
    Assert.assertEquals("((sum(revenue) - sum(cost)) / sum(revenue))",
        margin.toString());
    Assert.assertEquals(new HashSet<String>(Arrays.asList("revenue", "cost")),
        margin.getColumns());
    Assert.assertTrue(schema.isAggregating("margin"));
    Assert.assertFalse(schema.isAggregating("revenue"));
  }

  @Test
  public void testExpansionIsMemoizedPerVersion() throws Exception {
    schema.addCalculatedMeasure("net", "revenue - cost", ColumnType.DOUBLE,
        AggregateFunction.SUM);
    Expression first = schema.resolve("net");
    Assert.assertSame(first, schema.resolve("NET"));
    schema.addDimension("channel", ColumnType.STRING);
    Expression afterChange = schema.resolve("net");
    Assert.assertEquals(first, afterChange);
    Assert.assertNotSame(first, afterChange);
  }

  @Test
  public void testResolveBaseAndUnknown() throws Exception {
    Assert.assertEquals(new ColumnRef("region"), schema.resolve("Region"));
    try {
      schema.resolve("time");
      Assert.fail("Hierarchy resolved as a column");
    } catch (CubeException e) {
      assertError(ErrorMsg.UNKNOWN_FIELD, e);
    }
  }
}
