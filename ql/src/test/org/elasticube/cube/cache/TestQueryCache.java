package org.elasticube.cube.cache;
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
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.hadoop.conf.Configuration;
import org.elasticube.cube.CubeConfUtil;
import org.elasticube.cube.CubeTestSetup;
import org.elasticube.cube.ErrorMsg;
import org.elasticube.cube.data.RecordBatch;
import org.elasticube.cube.exec.QueryExecutionException;
import org.elasticube.cube.exec.QueryResult;
import org.elasticube.cube.metadata.CubeException;
import org.elasticube.cube.metadata.CubeSchema;
import org.elasticube.cube.parse.CubeQueryBuilder;
import org.elasticube.cube.parse.QueryDescriptor;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class TestQueryCache {

  private CubeSchema schema;

  private static class CountingComputer implements ResultComputer {
    final AtomicInteger calls = new AtomicInteger();

    @Override
    public QueryResult compute() throws CubeException {
      calls.incrementAndGet();
      return new QueryResult(Arrays.asList("n"),
          new ArrayList<RecordBatch>());
    }
  }

  @Before
  public void setup() throws Exception {
    schema = CubeTestSetup.createSchema();
  }

  private QueryCacheKey key(String select, long epoch) throws Exception {
    QueryDescriptor desc = new CubeQueryBuilder(schema,
        CubeTestSetup.getConf()).select(select).materialize();
    return QueryCacheKey.forQuery(desc, desc.getSchemaVersion(), epoch);
  }

  @Test
  public void testKeys() throws Exception {
    QueryCacheKey key = key("region", 1);
    Assert.assertEquals(key, key("REGION", 1));
    Assert.assertEquals(key.hashCode(), key("REGION", 1).hashCode());
    Assert.assertEquals(key.getDigest(), key("region", 1).getDigest());
    Assert.assertEquals(32, key.getDigest().length());
    Assert.assertFalse(key.equals(key("region", 2)));
    Assert.assertFalse(key.equals(key("product", 1)));
    Assert.assertTrue(key.getCanonicalForm().contains("\"epoch\":1"));

    QueryDescriptor desc = new CubeQueryBuilder(schema,
        CubeTestSetup.getConf()).select("region").materialize();
    Assert.assertFalse(QueryCacheKey.forQuery(desc, 1, 1).equals(
        QueryCacheKey.forQuery(desc, 2, 1)));
  }

  @Test
  public void testHitAndMiss() throws Exception {
    QueryCache cache = new QueryCache(10, true);
    CountingComputer computer = new CountingComputer();
    QueryResult first = cache.getOrInsert(key("region", 1), computer);
    QueryResult second = cache.getOrInsert(key("region", 1), computer);
    Assert.assertSame(first, second);
    Assert.assertEquals(1, computer.calls.get());
    cache.getOrInsert(key("region", 2), computer);
    Assert.assertEquals(2, computer.calls.get());

    CacheStats stats = cache.stats();
    Assert.assertEquals(1, stats.getHits());
    Assert.assertEquals(2, stats.getMisses());
    Assert.assertEquals(2, stats.getCurrentSize());
    Assert.assertEquals(1.0 / 3, stats.getHitRate(), 1e-9);
  }

  @Test
  public void testLruEviction() throws Exception {
    QueryCache cache = new QueryCache(2, true);
    CountingComputer computer = new CountingComputer();
    QueryCacheKey a = key("region", 1);
    QueryCacheKey b = key("product", 1);
    QueryCacheKey c = key("year", 1);
    cache.getOrInsert(a, computer);
    cache.getOrInsert(b, computer);
    // touch a so that b is the least recently used
    cache.getOrInsert(a, computer);
    cache.getOrInsert(c, computer);
    Assert.assertTrue(cache.contains(a));
    Assert.assertFalse(cache.contains(b));
    Assert.assertTrue(cache.contains(c));
    Assert.assertEquals(1, cache.stats().getEvictions());

    cache.setMaxEntries(1);
    Assert.assertEquals(1, cache.stats().getCurrentSize());
    Assert.assertTrue(cache.contains(c));
    Assert.assertEquals(2, cache.stats().getEvictions());
  }

  @Test
  public void testZeroCapacityStoresNothing() throws Exception {
    QueryCache cache = new QueryCache(0, true);
    CountingComputer computer = new CountingComputer();
    cache.getOrInsert(key("region", 1), computer);
    cache.getOrInsert(key("region", 1), computer);
    Assert.assertEquals(2, computer.calls.get());
    Assert.assertEquals(0, cache.stats().getCurrentSize());
  }

  @Test
  public void testDisabled() throws Exception {
    Configuration conf = CubeTestSetup.getConf();
    conf.setBoolean(CubeConfUtil.QUERY_CACHE_ENABLED, false);
    QueryCache cache = new QueryCache(conf);
    Assert.assertFalse(cache.isEnabled());
    CountingComputer computer = new CountingComputer();
    cache.getOrInsert(key("region", 1), computer);
    cache.getOrInsert(key("region", 1), computer);
    Assert.assertEquals(2, computer.calls.get());
    Assert.assertEquals(2, cache.stats().getMisses());
    Assert.assertEquals(0, cache.stats().getHits());

    cache.setEnabled(true);
    cache.getOrInsert(key("region", 1), computer);
    Assert.assertTrue(cache.contains(key("region", 1)));
    cache.setEnabled(false);
    Assert.assertFalse(cache.contains(key("region", 1)));
  }

  @Test
  public void testConfiguredCapacity() {
    Configuration conf = CubeTestSetup.getConf();
    Assert.assertEquals(CubeConfUtil.DEFAULT_QUERY_CACHE_MAX_ENTRIES,
        new QueryCache(conf).getMaxEntries());
    conf.setInt(CubeConfUtil.QUERY_CACHE_MAX_ENTRIES, 5);
    Assert.assertEquals(5, new QueryCache(conf).getMaxEntries());
  }

  @Test
  public void testFailuresAreNotStored() throws Exception {
    QueryCache cache = new QueryCache(10, true);
    QueryCacheKey key = key("region", 1);
    try {
      cache.getOrInsert(key, new ResultComputer() {
        @Override
        public QueryResult compute() throws CubeException {
          throw new QueryExecutionException(ErrorMsg.TYPE_MISMATCH, "a", "b");
        }
      });
      Assert.fail("Expected failure");
    } catch (QueryExecutionException e) {
      Assert.assertEquals(ErrorMsg.TYPE_MISMATCH, e.getCanonicalErrorMsg());
    }
    try {
      cache.getOrInsert(key, new ResultComputer() {
        @Override
        public QueryResult compute() {
          throw new IllegalStateException("boom");
        }
      });
      Assert.fail("Expected failure");
    } catch (CubeException e) {
      Assert.assertEquals(ErrorMsg.CACHE_COMPUTE_FAILED,
          e.getCanonicalErrorMsg());
      Assert.assertTrue(e.getCause() instanceof IllegalStateException);
    }
    Assert.assertFalse(cache.contains(key));
    Assert.assertEquals(2, cache.stats().getComputeFailures());

    CountingComputer computer = new CountingComputer();
    cache.getOrInsert(key, computer);
    Assert.assertEquals(1, computer.calls.get());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeCapacity() {
    new QueryCache(10, true).setMaxEntries(-1);
  }
}
