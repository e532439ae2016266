package org.elasticube.cube.data;
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
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.elasticube.cube.ErrorMsg;
import org.elasticube.cube.exec.ExpressionEvaluator;
import org.elasticube.cube.exec.RowAccessor;
import org.elasticube.cube.metadata.CubeException;
import org.elasticube.cube.metadata.CubeSchema;
import org.elasticube.cube.parse.ExprParser;
import org.elasticube.cube.parse.Expression;
import org.elasticube.cube.parse.ParseException;

/**
 * Owns the batch set of a cube and its data epoch.
 *
 * Writers serialize on one lock, build a complete new batch set and publish
 * it together with the next epoch in a single reference swap. Readers never
 * lock: {@link #snapshot()} returns whatever was last published, and that
 * snapshot stays valid for as long as the reader holds it. A failed mutation
 * publishes nothing.
 */
public class MutationManager {
  private static final Log LOG = LogFactory.getLog(MutationManager.class);

  private final CubeSchema schema;
  private final int maxBatchRows;
  private final ReentrantLock writeLock = new ReentrantLock();
  private final AtomicReference<DataSnapshot> current =
      new AtomicReference<DataSnapshot>(new DataSnapshot(BatchSet.EMPTY, 0));

  public MutationManager(CubeSchema schema, int maxBatchRows) {
    if (maxBatchRows <= 0) {
      throw new IllegalArgumentException("maxBatchRows must be positive");
    }
    this.schema = schema;
    this.maxBatchRows = maxBatchRows;
  }

  public DataSnapshot snapshot() {
    return current.get();
  }

  public long getEpoch() {
    return current.get().getEpoch();
  }

  /**
   * Appends batches that match the physical layout of the cube.
   *
   * @return number of rows added
   */
  public long append(List<RecordBatch> batches) throws CubeException {
    BatchSchema layout = schema.getBatchSchema();
    for (RecordBatch batch : batches) {
      validate(batch, layout);
    }
    writeLock.lock();
    try {
      DataSnapshot snapshot = current.get();
      List<RecordBatch> merged = new ArrayList<RecordBatch>(
          snapshot.getBatchSet().getBatches());
      long added = 0;
      for (RecordBatch batch : batches) {
        if (batch.getRowCount() > 0) {
          merged.add(batch);
          added += batch.getRowCount();
        }
      }
      publish(snapshot, new BatchSet(merged), layout);
      LOG.info("Appended " + added + " rows in " + batches.size()
          + " batches to cube " + schema.getName() + ", epoch now "
          + getEpoch());
      return added;
    } finally {
      writeLock.unlock();
    }
  }

  public long append(RecordBatch... batches) throws CubeException {
    return append(Arrays.asList(batches));
  }

  /**
   * Removes the rows for which the predicate is true. Rows where it is false
   * or null are kept. The epoch advances even when nothing matched.
   *
   * @return number of rows deleted
   */
  public long delete(String predicate) throws CubeException {
    Expression filter = resolvePredicate(predicate);
    writeLock.lock();
    try {
      DataSnapshot snapshot = current.get();
      List<RecordBatch> kept = new ArrayList<RecordBatch>();
      long deleted = removeMatching(snapshot.getBatchSet(), filter, kept);
      publish(snapshot, new BatchSet(kept), schema.getBatchSchema());
      LOG.info("Deleted " + deleted + " rows matching " + filter
          + " from cube " + schema.getName() + ", epoch now " + getEpoch());
      return deleted;
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Removes the rows matching the predicate and appends the replacement,
   * publishing both changes as one epoch.
   *
   * @return rows deleted and rows added, in that order
   */
  public long[] update(String predicate, RecordBatch replacement)
      throws CubeException {
    Expression filter = resolvePredicate(predicate);
    BatchSchema layout = schema.getBatchSchema();
    validate(replacement, layout);
    writeLock.lock();
    try {
      DataSnapshot snapshot = current.get();
      List<RecordBatch> kept = new ArrayList<RecordBatch>();
      long deleted = removeMatching(snapshot.getBatchSet(), filter, kept);
      if (replacement.getRowCount() > 0) {
        kept.add(replacement);
      }
      publish(snapshot, new BatchSet(kept), layout);
      LOG.info("Updated cube " + schema.getName() + ": deleted " + deleted
          + " rows matching " + filter + ", added "
          + replacement.getRowCount() + ", epoch now " + getEpoch());
      return new long[] {deleted, replacement.getRowCount()};
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Merges the batches into as few batches of at most the configured size as
   * possible, keeping rows in order.
   *
   * @return number of batches before consolidation
   */
  public int consolidate() throws CubeException {
    writeLock.lock();
    try {
      DataSnapshot snapshot = current.get();
      BatchSet batchSet = snapshot.getBatchSet();
      int before = batchSet.getBatchCount();
      List<RecordBatch> consolidated = new ArrayList<RecordBatch>();
      BatchSchema layout = schema.getBatchSchema();
      if (batchSet.getRowCount() > 0) {
        RecordBatch all = RecordBatch.concat(layout, batchSet.getBatches());
        for (int from = 0; from < all.getRowCount(); from += maxBatchRows) {
          int to = Math.min(all.getRowCount(), from + maxBatchRows);
          consolidated.add(all.slice(from, to));
        }
      }
      publish(snapshot, new BatchSet(consolidated), layout);
      LOG.info("Consolidated cube " + schema.getName() + " from " + before
          + " to " + consolidated.size() + " batches, epoch now " + getEpoch());
      return before;
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Swaps in the new batch set. The schema layout stays locked for as long as
   * the published set holds rows, so base fields cannot be declared under
   * existing data.
   */
  private void publish(DataSnapshot previous, BatchSet batchSet,
      BatchSchema layout) throws CubeException {
    // only ever called under the write lock
    if (batchSet.getRowCount() > 0) {
      schema.lockLayout(layout);
    } else {
      schema.unlockLayout();
    }
    current.set(new DataSnapshot(batchSet, previous.getEpoch() + 1));
  }

  private long removeMatching(BatchSet batchSet, Expression filter,
      List<RecordBatch> kept) throws CubeException {
    long deleted = 0;
    for (RecordBatch batch : batchSet.getBatches()) {
      boolean[] keep = new boolean[batch.getRowCount()];
      int removed = 0;
      RowAccessor row = new RowAccessor(batch);
      for (int i = 0; i < keep.length; i++) {
        row.setRow(i);
        keep[i] = !ExpressionEvaluator.test(filter, row);
        if (!keep[i]) {
          removed++;
        }
      }
      deleted += removed;
      if (removed == 0) {
        kept.add(batch);
      } else if (removed < keep.length) {
        kept.add(batch.filter(keep));
      }
    }
    return deleted;
  }

  /**
   * Parses a mutation predicate and expands any derived field it uses.
   */
  private Expression resolvePredicate(String predicate) throws CubeException {
    Expression expr;
    try {
      expr = ExprParser.parseExpression(predicate);
    } catch (ParseException e) {
      throw new CubeException(ErrorMsg.INVALID_EXPRESSION, e, predicate,
          e.getMessage());
    }
    if (expr.containsAggregate()) {
      throw new CubeException(ErrorMsg.INVALID_EXPRESSION, predicate,
          "aggregates are not allowed in mutation predicates");
    }
    Expression expanded = schema.expand(expr, "predicate");
    if (expanded.containsAggregate()) {
      throw new CubeException(ErrorMsg.INVALID_EXPRESSION, predicate,
          "predicate references an aggregating measure");
    }
    return expanded;
  }

  private void validate(RecordBatch batch, BatchSchema layout)
      throws CubeException {
    BatchSchema batchSchema = batch.getSchema();
    if (!batchSchema.equals(layout)) {
      throw new CubeException(ErrorMsg.SCHEMA_MISMATCH, schema.getName(),
          "expected " + layout + ", got " + batchSchema);
    }
    for (int c = 0; c < batchSchema.size(); c++) {
      BatchField field = batchSchema.getField(c);
      for (int r = 0; r < batch.getRowCount(); r++) {
        Object value = batch.getValue(r, c);
        if (!field.getType().accepts(value)) {
          throw new CubeException(ErrorMsg.SCHEMA_MISMATCH, schema.getName(),
              "value " + value + " of column " + field.getName()
                  + " is not of type " + field.getType());
        }
      }
    }
  }
}
