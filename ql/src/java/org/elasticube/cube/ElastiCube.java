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

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.conf.Configuration;
import org.elasticube.cube.cache.CacheStats;
import org.elasticube.cube.cache.QueryCache;
import org.elasticube.cube.cache.QueryCacheKey;
import org.elasticube.cube.cache.ResultComputer;
import org.elasticube.cube.data.CubeStatistics;
import org.elasticube.cube.data.DataSnapshot;
import org.elasticube.cube.data.MutationManager;
import org.elasticube.cube.data.RecordBatch;
import org.elasticube.cube.exec.ExecutionEngine;
import org.elasticube.cube.exec.QueryResult;
import org.elasticube.cube.metadata.AggregateFunction;
import org.elasticube.cube.metadata.ColumnType;
import org.elasticube.cube.metadata.CubeException;
import org.elasticube.cube.metadata.CubeSchema;
import org.elasticube.cube.metadata.Named;
import org.elasticube.cube.parse.CubeQueryBuilder;
import org.elasticube.cube.parse.QueryDescriptor;

/**
 * Handle on a cube: its schema, data, query cache and execution engine. A
 * single instance is meant to be shared by all threads using the cube.
 * Queries run against a snapshot of the data taken when they start, so they
 * never see a half applied mutation.
 *
 * Instances are created with {@link ElastiCubeBuilder}.
 */
public class ElastiCube implements Named {
  private static final Log LOG = LogFactory.getLog(ElastiCube.class);

  private final String name;
  private final String description;
  private final Configuration conf;
  private final CubeSchema schema;
  private final MutationManager mutations;
  private final QueryCache cache;
  private final ExecutionEngine engine;

  ElastiCube(String name, String description, Configuration conf,
      CubeSchema schema, ExecutionEngine engine) {
    this.name = name;
    this.description = description;
    this.conf = conf;
    this.schema = schema;
    this.engine = engine;
    this.mutations = new MutationManager(schema,
        CubeConfUtil.getConsolidateMaxBatchRows(conf));
    this.cache = new QueryCache(conf);
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public Configuration getConf() {
    return conf;
  }

  public CubeSchema getSchema() {
    return schema;
  }

  public QueryCache getCache() {
    return cache;
  }

  public CubeQueryBuilder query() {
    return new CubeQueryBuilder(this, null);
  }

  /**
   * Query from text: {@code SELECT items [FROM cube] [WHERE predicate]
   * [GROUP BY items] [ORDER BY items] [LIMIT n]}.
   */
  public CubeQueryBuilder query(String text) {
    return new CubeQueryBuilder(this, text);
  }

  /**
   * Runs a resolved query against the current data, going through the query
   * cache.
   */
  public QueryResult execute(final QueryDescriptor query) throws CubeException {
    final DataSnapshot snapshot = mutations.snapshot();
    ResultComputer computer = new ResultComputer() {
      public QueryResult compute() throws CubeException {
        return engine.execute(query, snapshot.getBatchSet());
      }
    };
    QueryCacheKey key;
    try {
      key = QueryCacheKey.forQuery(query, query.getSchemaVersion(),
          snapshot.getEpoch());
    } catch (IOException e) {
      LOG.warn("Could not derive cache key for " + query
          + ", running uncached", e);
      return computer.compute();
    }
    return cache.getOrInsert(key, computer);
  }

  public long append(List<RecordBatch> batches) throws CubeException {
    return mutations.append(batches);
  }

  public long append(RecordBatch... batches) throws CubeException {
    return mutations.append(Arrays.asList(batches));
  }

  /**
   * @return rows deleted and rows added
   */
  public long[] update(String predicate, RecordBatch replacement)
      throws CubeException {
    return mutations.update(predicate, replacement);
  }

  public long delete(String predicate) throws CubeException {
    return mutations.delete(predicate);
  }

  /**
   * @return number of batches before consolidation
   */
  public int consolidate() throws CubeException {
    return mutations.consolidate();
  }

  public void addCalculatedMeasure(String measureName, String expr,
      ColumnType type, AggregateFunction aggregate) throws CubeException {
    schema.addCalculatedMeasure(measureName, expr, type, aggregate);
  }

  public void addVirtualDimension(String dimName, String expr,
      ColumnType type) throws CubeException {
    schema.addVirtualDimension(dimName, expr, type);
  }

  public void addHierarchy(String hierName, String... levels)
      throws CubeException {
    schema.addHierarchy(hierName, levels);
  }

  public CacheStats stats() {
    return cache.stats();
  }

  /**
   * Row, batch and per column statistics of the current data, taken from a
   * single snapshot.
   */
  public CubeStatistics statistics() {
    DataSnapshot snapshot = mutations.snapshot();
    return CubeStatistics.compute(name, schema.getVersion(),
        schema.getBatchSchema(), snapshot);
  }

  public long getRowCount() {
    return mutations.snapshot().getBatchSet().getRowCount();
  }

  public int getBatchCount() {
    return mutations.snapshot().getBatchSet().getBatchCount();
  }

  public long getEpoch() {
    return mutations.getEpoch();
  }

  public DataSnapshot snapshot() {
    return mutations.snapshot();
  }

  @Override
  public String toString() {
    return name + " " + schema + " " + mutations.snapshot();
  }
}
