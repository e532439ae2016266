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
import java.util.Collections;
import java.util.List;

/**
 * Immutable ordered list of record batches. Mutations build a new set.
 */
public final class BatchSet {
  public static final BatchSet EMPTY =
      new BatchSet(Collections.<RecordBatch>emptyList());

  private final List<RecordBatch> batches;
  private final long rowCount;

  public BatchSet(List<RecordBatch> batches) {
    this.batches = Collections.unmodifiableList(
        new ArrayList<RecordBatch>(batches));
    long rows = 0;
    for (RecordBatch batch : batches) {
      rows += batch.getRowCount();
    }
    this.rowCount = rows;
  }

  public List<RecordBatch> getBatches() {
    return batches;
  }

  public int getBatchCount() {
    return batches.size();
  }

  public long getRowCount() {
    return rowCount;
  }

  @Override
  public String toString() {
    return "BatchSet batches:" + batches.size() + " rows:" + rowCount;
  }
}
