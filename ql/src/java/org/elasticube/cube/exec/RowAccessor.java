package org.elasticube.cube.exec;
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

import java.util.HashMap;
import java.util.Map;

import org.elasticube.cube.ErrorMsg;
import org.elasticube.cube.data.BatchSchema;
import org.elasticube.cube.data.RecordBatch;

/**
 * Positioned view of one row of a record batch, read by column name.
 */
public class RowAccessor {
  private final RecordBatch batch;
  private final Map<String, Integer> positions;
  private int row;

  public RowAccessor(RecordBatch batch) {
    this.batch = batch;
    BatchSchema schema = batch.getSchema();
    positions = new HashMap<String, Integer>();
    for (int i = 0; i < schema.size(); i++) {
      positions.put(schema.getField(i).getName(), i);
    }
  }

  private RowAccessor(RecordBatch batch, Map<String, Integer> positions,
      int row) {
    this.batch = batch;
    this.positions = positions;
    this.row = row;
  }

  public void setRow(int row) {
    this.row = row;
  }

  public int getRow() {
    return row;
  }

  /**
   * Accessor fixed on the current row, sharing the column positions.
   */
  public RowAccessor pin() {
    return new RowAccessor(batch, positions, row);
  }

  public Object getValue(String column) throws QueryExecutionException {
    Integer position = positions.get(column);
    if (position == null) {
      throw new QueryExecutionException(ErrorMsg.INVALID_EXPRESSION, column,
          "no such column in " + batch.getSchema());
    }
    return batch.getValue(row, position.intValue());
  }
}
