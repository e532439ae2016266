package org.elasticube.cube;
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
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.apache.hadoop.conf.Configuration;
import org.elasticube.cube.cache.CacheStats;
import org.elasticube.cube.data.BatchField;
import org.elasticube.cube.data.BatchSchema;
import org.elasticube.cube.data.ColumnStatistics;
import org.elasticube.cube.data.CubeStatistics;
import org.elasticube.cube.data.RecordBatch;
import org.elasticube.cube.exec.QueryResult;
import org.elasticube.cube.metadata.AggregateFunction;
import org.elasticube.cube.metadata.ColumnType;
import org.elasticube.cube.metadata.CubeException;
import org.elasticube.cube.parse.QueryDescriptor;
import org.elasticube.cube.source.RecordBatchSource;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class TestElastiCube {

  private ElastiCube cube;

  @Before
  public void setup() throws Exception {
    cube = CubeTestSetup.createCube();
  }

  private static List<Object> column(QueryResult result, String name) {
    List<Object> values = new ArrayList<Object>();
    for (int i = 0; i < result.getRowCount(); i++) {
      values.add(result.getValue(i, name));
    }
    return values;
  }

  private QueryResult revenueByRegion() throws CubeException {
    return cube.query().select("region", "revenue").groupBy("region")
        .orderBy("revenue DESC").execute();
  }

  @Test
  public void testStatistics() throws Exception {
    CubeStatistics stats = cube.statistics();
    Assert.assertEquals(8L, stats.getRowCount());
    Assert.assertEquals(2, stats.getBatchCount());
    Assert.assertEquals(cube.getEpoch(), stats.getEpoch());
    Assert.assertEquals(cube.getSchema().getVersion(),
        stats.getSchemaVersion());
    Assert.assertEquals(8, stats.getColumns().size());

    ColumnStatistics region = stats.getColumn("REGION");
    Assert.assertEquals(ColumnType.STRING, region.getType());
    Assert.assertEquals(0L, region.getNullCount());
    Assert.assertEquals("East", region.getMin());
    Assert.assertEquals("South", region.getMax());
    ColumnStatistics year = stats.getColumn("year");
    Assert.assertEquals(2023, year.getMin());
    Assert.assertEquals(2024, year.getMax());
    // two array headers, eight slots and eight boxed ints
    Assert.assertEquals(2 * 16 + 8 * (8 + 16), year.getApproximateBytes());
    ColumnStatistics cost = stats.getColumn("cost");
    Assert.assertEquals(8L, cost.getRowCount());
    Assert.assertEquals(1L, cost.getNullCount());
    Assert.assertEquals(30.0, cost.getMin());
    Assert.assertEquals(200.0, cost.getMax());
    Assert.assertEquals(2 * 16 + 8 * 8 + 7 * 24, cost.getApproximateBytes());
    Assert.assertEquals(2L, stats.getColumn("units").getMin());
    Assert.assertNull(stats.getColumn("profit"));

    long bytes = 0;
    for (ColumnStatistics column : stats.getColumns()) {
      bytes += column.getApproximateBytes();
    }
    Assert.assertEquals(bytes, stats.getMemoryBytes());
    String summary = stats.summary();
    Assert.assertTrue(summary, summary.startsWith(
        "Cube sales: 8 rows in 2 batches"));
    Assert.assertTrue(summary, summary.contains("\n  cost double: 1 nulls, "
        + "range [30.0, 200.0]"));

    cube.delete("year > 0");
    CubeStatistics empty = cube.statistics();
    Assert.assertEquals(0L, empty.getRowCount());
    Assert.assertEquals(0, empty.getBatchCount());
    Assert.assertEquals(8, empty.getColumns().size());
    Assert.assertNull(empty.getColumn("region").getMin());
    Assert.assertEquals(0L, empty.getMemoryBytes());
    Assert.assertFalse(empty.summary().contains("range"));
    // the earlier statistics are unaffected
    Assert.assertEquals(8L, stats.getRowCount());
  }

  @Test
  public void testBaseFieldsCannotBeAddedUnderData() throws Exception {
    long version = cube.getSchema().getVersion();
    try {
      cube.getSchema().addDimension("channel", ColumnType.STRING);
      Assert.fail("Added a dimension to a loaded cube");
    } catch (CubeException e) {
      Assert.assertEquals(ErrorMsg.SCHEMA_MISMATCH, e.getCanonicalErrorMsg());
    }
    Assert.assertEquals(version, cube.getSchema().getVersion());
    Assert.assertEquals(1090.0, cube.query().select("SUM(revenue) AS total")
        .execute().getValue(0, "total"));
    cube.consolidate();
    Assert.assertEquals(1090.0, cube.query().select("SUM(revenue) AS total")
        .execute().getValue(0, "total"));
  }

  @Test
  public void testBuild() throws Exception {
    Assert.assertEquals(CubeTestSetup.TEST_CUBE_NAME, cube.getName());
    Assert.assertEquals(8L, cube.getRowCount());
    Assert.assertEquals(2, cube.getBatchCount());
    Assert.assertEquals(1, cube.getEpoch());
    Assert.assertNotNull(cube.getSchema().getHierarchyByName("time"));
  }

  @Test
  public void testRevenueByRegionIsCached() throws Exception {
    QueryResult first = revenueByRegion();
    Assert.assertEquals(Arrays.<Object>asList("North", "East", "South"),
        column(first, "region"));
    Assert.assertEquals(Arrays.<Object>asList(420.0, 380.0, 290.0),
        column(first, "revenue"));

    QueryResult second = revenueByRegion();
    Assert.assertSame(first, second);
    CacheStats stats = cube.stats();
    Assert.assertEquals(1, stats.getHits());
    Assert.assertEquals(1, stats.getMisses());
    Assert.assertEquals(1, stats.getCurrentSize());
  }

  @Test
  public void testAppendInvalidatesCachedResults() throws Exception {
    QueryResult before = revenueByRegion();
    long epoch = cube.getEpoch();
    RecordBatch batch = new RecordBatch.Builder(CubeTestSetup.getLayout())
        .addRow("West", "Widget", 2024, "Q4", 12, 500.0, 100.0, 50L)
        .addRow("South", "Gadget", 2024, "Q4", 10, 10.0, 5.0, 1L)
        .build();
    Assert.assertEquals(2L, cube.append(batch));
    Assert.assertEquals(epoch + 1, cube.getEpoch());

    QueryResult after = revenueByRegion();
    Assert.assertNotSame(before, after);
    Assert.assertEquals(Arrays.<Object>asList("West", "North", "East",
        "South"), column(after, "region"));
    Assert.assertEquals(Arrays.<Object>asList(500.0, 420.0, 380.0, 300.0),
        column(after, "revenue"));
    Assert.assertEquals(2, cube.stats().getMisses());
    Assert.assertEquals(0, cube.stats().getHits());
  }

  @Test
  public void testDeleteAndUpdate() throws Exception {
    Assert.assertEquals(2L, cube.delete("region = 'East'"));
    QueryResult result = revenueByRegion();
    Assert.assertEquals(Arrays.<Object>asList("North", "South"),
        column(result, "region"));

    RecordBatch replacement = new RecordBatch.Builder(
        CubeTestSetup.getLayout())
        .addRow("South", "Widget", 2024, "Q2", 6, 400.0, 50.0, 9L).build();
    long[] counts = cube.update("region = 'South' AND month = 6",
        replacement);
    Assert.assertEquals(1L, counts[0]);
    Assert.assertEquals(1L, counts[1]);
    result = revenueByRegion();
    Assert.assertEquals(Arrays.<Object>asList("South", "North"),
        column(result, "region"));
    Assert.assertEquals(Arrays.<Object>asList(600.0, 420.0),
        column(result, "revenue"));
  }

  @Test
  public void testConsolidateKeepsResults() throws Exception {
    for (int i = 0; i < CubeTestSetup.ROWS.length; i++) {
      cube.append(CubeTestSetup.getBatch(i, i + 1));
    }
    Assert.assertEquals(10, cube.getBatchCount());
    QueryResult before = revenueByRegion();
    Assert.assertEquals(10, cube.consolidate());
    Assert.assertEquals(1, cube.getBatchCount());
    Assert.assertEquals(16L, cube.getRowCount());
    QueryResult after = revenueByRegion();
    Assert.assertEquals(before.getColumnNames(), after.getColumnNames());
    Assert.assertEquals(column(before, "revenue"), column(after, "revenue"));
    Assert.assertEquals(Arrays.<Object>asList(840.0, 760.0, 580.0),
        column(after, "revenue"));

    Assert.assertEquals(1, cube.consolidate());
    Assert.assertEquals(1, cube.getBatchCount());
    Assert.assertEquals(column(after, "revenue"),
        column(revenueByRegion(), "revenue"));
  }

  @Test
  public void testConsolidateBatchSize() throws Exception {
    Configuration conf = CubeTestSetup.getConf();
    conf.setInt(CubeConfUtil.CONSOLIDATE_MAX_BATCH_ROWS, 3);
    cube = CubeTestSetup.createBuilder().withConfiguration(conf)
        .withData(CubeTestSetup.getBatches()).build();
    Assert.assertEquals(2, cube.consolidate());
    Assert.assertEquals(3, cube.getBatchCount());
    Assert.assertEquals(8L, cube.getRowCount());
  }

  @Test
  public void testSchemaChangeMissesCache() throws Exception {
    revenueByRegion();
    long version = cube.getSchema().getVersion();
    cube.addCalculatedMeasure("profit", "sum(revenue) - sum(cost)",
        ColumnType.DOUBLE, AggregateFunction.SUM);
    Assert.assertEquals(version + 1, cube.getSchema().getVersion());
    revenueByRegion();
    Assert.assertEquals(0, cube.stats().getHits());
    Assert.assertEquals(2, cube.stats().getMisses());

    QueryResult result = cube.query().select("region", "profit")
        .groupBy("region").orderBy("profit DESC").execute();
    Assert.assertEquals(Arrays.asList("region", "profit"),
        result.getColumnNames());
    Assert.assertEquals(Arrays.<Object>asList("East", "North", "South"),
        column(result, "region"));
    // East has a null cost, its profit only counts the known costs
    Assert.assertEquals(Arrays.<Object>asList(180.0, 170.0, 120.0),
        column(result, "profit"));
  }

  @Test
  public void testStaleDescriptorDoesNotHitNewVersion() throws Exception {
    QueryDescriptor desc = cube.query().select("region").materialize();
    cube.execute(desc);
    cube.addVirtualDimension("region_code", "substr(upper(region), 1, 2)",
        ColumnType.STRING);
    QueryDescriptor fresh = cube.query().select("region").materialize();
    Assert.assertFalse(desc.equals(fresh));
    cube.execute(fresh);
    Assert.assertEquals(0, cube.stats().getHits());

    QueryResult codes = cube.query().select("region_code", "COUNT(*) AS n")
        .groupBy("region_code").orderBy("region_code").execute();
    Assert.assertEquals(Arrays.<Object>asList("EA", "NO", "SO"),
        column(codes, "region_code"));
    Assert.assertEquals(Arrays.<Object>asList(2L, 3L, 3L),
        column(codes, "n"));
  }

  @Test
  public void testOlapOperations() throws Exception {
    QueryResult result = cube.query().select("revenue").slice("year", 2024)
        .rollUp("region").orderBy("region").execute();
    Assert.assertEquals(Arrays.<Object>asList(380.0, 120.0, 140.0),
        column(result, "revenue"));

    result = cube.query().select("units").slice("region", "North")
        .groupBy("region").drillDown("time", "year").orderBy("year")
        .execute();
    Assert.assertEquals(Arrays.<Object>asList(15L, 12L),
        column(result, "units"));

    Map<String, Object> dice = new LinkedHashMap<String, Object>();
    dice.put("product", "Widget");
    dice.put("quarter", "Q1");
    result = cube.query().select("COUNT(*) AS n").dice(dice).execute();
    Assert.assertEquals(2L, result.getValue(0, "n"));
  }

  @Test
  public void testDisabledCache() throws Exception {
    Configuration conf = CubeTestSetup.getConf();
    conf.setBoolean(CubeConfUtil.QUERY_CACHE_ENABLED, false);
    cube = CubeTestSetup.createBuilder().withConfiguration(conf)
        .withData(CubeTestSetup.getBatches()).build();
    QueryResult first = revenueByRegion();
    QueryResult second = revenueByRegion();
    Assert.assertNotSame(first, second);
    Assert.assertEquals(column(first, "revenue"), column(second, "revenue"));
    Assert.assertEquals(0, cube.stats().getHits());
    Assert.assertEquals(2, cube.stats().getMisses());
  }

  @Test
  public void testInferredLayout() throws Exception {
    BatchSchema layout = new BatchSchema(Arrays.asList(
        new BatchField("city", ColumnType.STRING),
        new BatchField("visits", ColumnType.BIGINT)));
    RecordBatch batch = new RecordBatch.Builder(layout)
        .addRow("Oslo", 3L).addRow("Bergen", 5L).addRow("Oslo", 4L).build();
    ElastiCube visits = new ElastiCubeBuilder("visits")
        .withConfiguration(CubeTestSetup.getConf())
        .load(new RecordBatchSource("visits", batch)).build();
    Assert.assertTrue(visits.getSchema().isDimension("city"));
    Assert.assertTrue(visits.getSchema().isDimension("visits"));
    Assert.assertTrue(visits.getSchema().getMeasures().isEmpty());
    QueryResult result = visits.query().select("city", "SUM(visits) AS total")
        .groupBy("city").orderBy("city").execute();
    Assert.assertEquals(Arrays.<Object>asList("Bergen", "Oslo"),
        column(result, "city"));
    Assert.assertEquals(Arrays.<Object>asList(5L, 7L),
        column(result, "total"));
  }

  @Test
  public void testSourceColumnsAreProjected() throws Exception {
    BatchSchema layout = new BatchSchema(Arrays.asList(
        new BatchField("visits", ColumnType.BIGINT),
        new BatchField("extra", ColumnType.STRING),
        new BatchField("city", ColumnType.STRING)));
    RecordBatch batch = new RecordBatch.Builder(layout)
        .addRow(3L, "x", "Oslo").build();
    ElastiCube visits = new ElastiCubeBuilder("visits")
        .withConfiguration(CubeTestSetup.getConf())
        .addDimension("city", ColumnType.STRING)
        .addMeasure("visits", ColumnType.BIGINT, AggregateFunction.SUM)
        .load(new RecordBatchSource("visits", batch)).build();
    Assert.assertEquals(Arrays.asList("city", "visits"),
        visits.snapshot().getBatchSet().getBatches().get(0).getSchema()
            .getFieldNames());

    try {
      new ElastiCubeBuilder("visits")
          .addDimension("city", ColumnType.STRING)
          .addDimension("country", ColumnType.STRING)
          .load(new RecordBatchSource("visits", batch)).build();
      Assert.fail("Expected schema mismatch");
    } catch (CubeException e) {
      Assert.assertEquals(ErrorMsg.SCHEMA_MISMATCH, e.getCanonicalErrorMsg());
    }
  }

  @Test
  public void testNoDataSource() throws Exception {
    try {
      new ElastiCubeBuilder("empty").addHierarchy("h", "a").build();
      Assert.fail("Expected failure");
    } catch (CubeException e) {
      Assert.assertEquals(ErrorMsg.NO_DATA_SOURCE, e.getCanonicalErrorMsg());
    }
    ElastiCube empty = new ElastiCubeBuilder("empty")
        .withConfiguration(CubeTestSetup.getConf())
        .addDimension("a", ColumnType.STRING).build();
    Assert.assertEquals(0L, empty.getRowCount());
    Assert.assertEquals(0, empty.getEpoch());
  }

  @Test
  public void testConcurrentReadersSeeWholeAppends() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Future<Void>> readers = new ArrayList<Future<Void>>();
      for (int t = 0; t < 3; t++) {
        readers.add(pool.submit(new Callable<Void>() {
          public Void call() throws Exception {
            for (int i = 0; i < 50; i++) {
              long n = (Long) cube.query().select("COUNT(*) AS n").execute()
                  .getValue(0, "n");
              Assert.assertEquals("partial append observed: " + n, 0, n % 8);
            }
            return null;
          }
        }));
      }
      Future<Void> writer = pool.submit(new Callable<Void>() {
        public Void call() throws Exception {
          for (int i = 0; i < 20; i++) {
            cube.append(CubeTestSetup.getBatches());
          }
          return null;
        }
      });
      writer.get(30, TimeUnit.SECONDS);
      for (Future<Void> reader : readers) {
        reader.get(30, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }
    Assert.assertEquals(21 * 8L, cube.getRowCount());
    Assert.assertEquals(21, cube.getEpoch());
  }
}
