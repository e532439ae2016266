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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.elasticube.cube.data.RecordBatch;

/**
 * Output of a query: column names and ordered result batches.
 */
public final class QueryResult {
  private final List<String> columnNames;
  private final List<RecordBatch> batches;
  private final long rowCount;

  public QueryResult(List<String> columnNames, List<RecordBatch> batches) {
    this.columnNames = Collections.unmodifiableList(
        new ArrayList<String>(columnNames));
    this.batches = Collections.unmodifiableList(
        new ArrayList<RecordBatch>(batches));
    long rows = 0;
    for (RecordBatch batch : batches) {
      rows += batch.getRowCount();
    }
    this.rowCount = rows;
  }

  public List<String> getColumnNames() {
    return columnNames;
  }

  public List<RecordBatch> getBatches() {
    return batches;
  }

  public long getRowCount() {
    return rowCount;
  }

  /**
   * All rows of all batches, in order.
   */
  public List<Object[]> getRows() {
    List<Object[]> rows = new ArrayList<Object[]>();
    for (RecordBatch batch : batches) {
      for (int i = 0; i < batch.getRowCount(); i++) {
        rows.add(batch.getRow(i));
      }
    }
    return rows;
  }

  public Object getValue(int row, String column) {
    int index = columnNames.indexOf(column.toLowerCase());
    if (index < 0) {
      throw new IllegalArgumentException("No column " + column + " in "
          + columnNames);
    }
    return getRows().get(row)[index];
  }

  @Override
  public String toString() {
    return "QueryResult" + columnNames + " rows:" + rowCount;
  }
}
