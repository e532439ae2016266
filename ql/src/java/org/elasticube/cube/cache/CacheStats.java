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

/**
 * Point in time view of the cache counters. Counters run since the cache
 * was created and are not reset by {@link QueryCache#clear()}.
 */
public final class CacheStats {
  private final long hits;
  private final long misses;
  private final long evictions;
  private final long computeFailures;
  private final int currentSize;
  private final int maxEntries;

  public CacheStats(long hits, long misses, long evictions,
      long computeFailures, int currentSize, int maxEntries) {
    this.hits = hits;
    this.misses = misses;
    this.evictions = evictions;
    this.computeFailures = computeFailures;
    this.currentSize = currentSize;
    this.maxEntries = maxEntries;
  }

  public long getHits() {
    return hits;
  }

  public long getMisses() {
    return misses;
  }

  public long getEvictions() {
    return evictions;
  }

  public long getComputeFailures() {
    return computeFailures;
  }

  public int getCurrentSize() {
    return currentSize;
  }

  public int getMaxEntries() {
    return maxEntries;
  }

  public double getHitRate() {
    long total = hits + misses;
    return total == 0 ? 0.0 : (double) hits / total;
  }

  @Override
  public String toString() {
    return "hits:" + hits + ",misses:" + misses + ",evictions:" + evictions
        + ",computeFailures:" + computeFailures + ",size:" + currentSize + "/"
        + maxEntries;
  }
}
