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

import org.apache.hadoop.conf.Configuration;

/**
 * Configuration keys understood by the cube, with their defaults.
 */
public class CubeConfUtil {
  public static final String QUERY_CACHE_ENABLED = "cube.query.cache.enabled";
  public static final String QUERY_CACHE_MAX_ENTRIES =
      "cube.query.cache.max.entries";
  public static final String DISABLE_AGGREGATE_RESOLVER =
      "cube.query.disable.aggregate.resolver";
  public static final String ENABLE_SELECT_TO_GROUPBY =
      "cube.query.enable.select.to.groupby";
  public static final String CONSOLIDATE_MAX_BATCH_ROWS =
      "cube.data.consolidate.max.batch.rows";

  public static final boolean DEFAULT_QUERY_CACHE_ENABLED = true;
  public static final int DEFAULT_QUERY_CACHE_MAX_ENTRIES = 1000;
  public static final boolean DEFAULT_DISABLE_AGGREGATE_RESOLVER = false;
  public static final boolean DEFAULT_ENABLE_SELECT_TO_GROUPBY = false;
  public static final int DEFAULT_CONSOLIDATE_MAX_BATCH_ROWS = 65536;

  public static boolean isCacheEnabled(Configuration conf) {
    return conf.getBoolean(QUERY_CACHE_ENABLED, DEFAULT_QUERY_CACHE_ENABLED);
  }

  public static int getCacheMaxEntries(Configuration conf) {
    return conf.getInt(QUERY_CACHE_MAX_ENTRIES,
        DEFAULT_QUERY_CACHE_MAX_ENTRIES);
  }

  public static int getConsolidateMaxBatchRows(Configuration conf) {
    int rows = conf.getInt(CONSOLIDATE_MAX_BATCH_ROWS,
        DEFAULT_CONSOLIDATE_MAX_BATCH_ROWS);
    if (rows <= 0) {
      throw new IllegalArgumentException(CONSOLIDATE_MAX_BATCH_ROWS
          + " must be positive, got " + rows);
    }
    return rows;
  }
}
