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

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.conf.Configuration;
import org.elasticube.cube.CubeConfUtil;
import org.elasticube.cube.ErrorMsg;
import org.elasticube.cube.exec.QueryResult;
import org.elasticube.cube.metadata.CubeException;

/**
 * Bounded LRU store of query results. Keys carry the schema version and data
 * epoch, so results of older versions are never hit again and simply age
 * out.
 *
 * Results are computed outside the store lock; two threads missing on the
 * same key may both compute it.
 */
public class QueryCache {
  private static final Log LOG = LogFactory.getLog(QueryCache.class);

  private final LinkedHashMap<QueryCacheKey, CacheEntry> entries =
      new LinkedHashMap<QueryCacheKey, CacheEntry>(16, 0.75f, true);
  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();
  private final AtomicLong evictions = new AtomicLong();
  private final AtomicLong computeFailures = new AtomicLong();
  private final AtomicLong tick = new AtomicLong();
  private volatile int maxEntries;
  private volatile boolean enabled;

  public QueryCache(Configuration conf) {
    this(CubeConfUtil.getCacheMaxEntries(conf),
        CubeConfUtil.isCacheEnabled(conf));
  }

  public QueryCache(int maxEntries, boolean enabled) {
    if (maxEntries < 0) {
      throw new IllegalArgumentException("maxEntries cannot be negative: "
          + maxEntries);
    }
    this.maxEntries = maxEntries;
    this.enabled = enabled;
  }

  /**
   * Returns the stored result for the key, or computes, stores and returns
   * it. A failing computation stores nothing; engine failures are rethrown
   * as they are, anything else is wrapped in a cache compute failure.
   */
  public QueryResult getOrInsert(QueryCacheKey key, ResultComputer computer)
      throws CubeException {
    if (!enabled) {
      misses.incrementAndGet();
      return compute(key, computer);
    }
    synchronized (entries) {
      CacheEntry entry = entries.get(key);
      if (entry != null) {
        hits.incrementAndGet();
        entry.touch(tick.incrementAndGet());
        if (LOG.isDebugEnabled()) {
          LOG.debug("Cache hit for " + key);
        }
        return entry.getResult();
      }
    }
    misses.incrementAndGet();
    QueryResult result = compute(key, computer);
    synchronized (entries) {
      if (enabled && maxEntries > 0) {
        entries.put(key, new CacheEntry(key, result, tick.incrementAndGet()));
        evictOverflow();
      }
    }
    return result;
  }

  private QueryResult compute(QueryCacheKey key, ResultComputer computer)
      throws CubeException {
    try {
      return computer.compute();
    } catch (CubeException e) {
      computeFailures.incrementAndGet();
      throw e;
    } catch (RuntimeException e) {
      computeFailures.incrementAndGet();
      throw new CubeException(ErrorMsg.CACHE_COMPUTE_FAILED, e,
          key.getDigest());
    }
  }

  private void evictOverflow() {
    Iterator<Map.Entry<QueryCacheKey, CacheEntry>> it =
        entries.entrySet().iterator();
    while (entries.size() > maxEntries && it.hasNext()) {
      Map.Entry<QueryCacheKey, CacheEntry> eldest = it.next();
      it.remove();
      evictions.incrementAndGet();
      if (LOG.isDebugEnabled()) {
        LOG.debug("Evicted " + eldest.getKey());
      }
    }
  }

  public boolean contains(QueryCacheKey key) {
    synchronized (entries) {
      return entries.containsKey(key);
    }
  }

  public int getMaxEntries() {
    return maxEntries;
  }

  /**
   * Changes the capacity, evicting least recently used entries right away
   * when shrinking.
   */
  public void setMaxEntries(int maxEntries) {
    if (maxEntries < 0) {
      throw new IllegalArgumentException("maxEntries cannot be negative: "
          + maxEntries);
    }
    synchronized (entries) {
      this.maxEntries = maxEntries;
      evictOverflow();
    }
    LOG.info("Query cache capacity set to " + maxEntries);
  }

  public boolean isEnabled() {
    return enabled;
  }

  /**
   * Disabling the cache also drops everything stored in it.
   */
  public void setEnabled(boolean enabled) {
    synchronized (entries) {
      this.enabled = enabled;
      if (!enabled) {
        entries.clear();
      }
    }
    LOG.info("Query cache " + (enabled ? "enabled" : "disabled"));
  }

  public void clear() {
    synchronized (entries) {
      entries.clear();
    }
  }

  public CacheStats stats() {
    int size;
    synchronized (entries) {
      size = entries.size();
    }
    return new CacheStats(hits.get(), misses.get(), evictions.get(),
        computeFailures.get(), size, maxEntries);
  }
}
