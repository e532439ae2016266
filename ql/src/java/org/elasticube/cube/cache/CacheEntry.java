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

import org.elasticube.cube.exec.QueryResult;

public class CacheEntry {
  private final QueryCacheKey key;
  private final QueryResult result;
  private volatile long lastAccess;

  CacheEntry(QueryCacheKey key, QueryResult result, long tick) {
    this.key = key;
    this.result = result;
    this.lastAccess = tick;
  }

  public QueryCacheKey getKey() {
    return key;
  }

  public QueryResult getResult() {
    return result;
  }

  /**
   * Size estimate in rows.
   */
  public long getApproximateSize() {
    return result.getRowCount();
  }

  public long getLastAccess() {
    return lastAccess;
  }

  void touch(long tick) {
    lastAccess = tick;
  }
}
