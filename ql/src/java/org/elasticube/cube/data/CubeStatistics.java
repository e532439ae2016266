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

import org.apache.hadoop.util.StringUtils;

/**
 * Point in time view of the data held by a cube: row and batch counts,
 * approximate memory use and per column statistics, all taken from one
 * snapshot.
 */
public final class CubeStatistics {
  private final String cubeName;
  private final long epoch;
  private final long schemaVersion;
  private final long rowCount;
  private final int batchCount;
  private final List<ColumnStatistics> columns;

  public CubeStatistics(String cubeName, long epoch, long schemaVersion,
      long rowCount, int batchCount, List<ColumnStatistics> columns) {
    this.cubeName = cubeName;
    this.epoch = epoch;
    this.schemaVersion = schemaVersion;
    this.rowCount = rowCount;
    this.batchCount = batchCount;
    this.columns = Collections.unmodifiableList(
        new ArrayList<ColumnStatistics>(columns));
  }

  /**
   * Scans every batch of the snapshot once per column of the layout.
   */
  public static CubeStatistics compute(String cubeName, long schemaVersion,
      BatchSchema layout, DataSnapshot snapshot) {
    BatchSet batchSet = snapshot.getBatchSet();
    List<ColumnStatistics> columns = new ArrayList<ColumnStatistics>();
    for (int c = 0; c < layout.size(); c++) {
      columns.add(ColumnStatistics.compute(layout.getField(c), c,
          batchSet.getBatches()));
    }
    return new CubeStatistics(cubeName, snapshot.getEpoch(), schemaVersion,
        batchSet.getRowCount(), batchSet.getBatchCount(), columns);
  }

  public String getCubeName() {
    return cubeName;
  }

  public long getEpoch() {
    return epoch;
  }

  public long getSchemaVersion() {
    return schemaVersion;
  }

  public long getRowCount() {
    return rowCount;
  }

  /**
   * Number of record batches, the unit of storage and of consolidation.
   */
  public int getBatchCount() {
    return batchCount;
  }

  public List<ColumnStatistics> getColumns() {
    return columns;
  }

  /**
   * @return statistics of the named column, or null if the layout has no
   *         such column
   */
  public ColumnStatistics getColumn(String name) {
    for (ColumnStatistics column : columns) {
      if (column.getName().equalsIgnoreCase(name)) {
        return column;
      }
    }
    return null;
  }

  public long getMemoryBytes() {
    long bytes = 0;
    for (ColumnStatistics column : columns) {
      bytes += column.getApproximateBytes();
    }
    return bytes;
  }

  /**
   * Human readable report, one line for the cube followed by one line per
   * column.
   */
  public String summary() {
    StringBuilder sb = new StringBuilder();
    sb.append("Cube ").append(cubeName).append(": ").append(rowCount)
        .append(" rows in ").append(batchCount).append(" batches, ~")
        .append(StringUtils.byteDesc(getMemoryBytes())).append(", epoch ")
        .append(epoch).append(", schema version ").append(schemaVersion);
    for (ColumnStatistics column : columns) {
      sb.append("\n  ").append(column.getName()).append(' ')
          .append(column.getType().getTypeName()).append(": ")
          .append(column.getNullCount()).append(" nulls");
      if (column.getMin() != null) {
        sb.append(", range [").append(column.getMin()).append(", ")
            .append(column.getMax()).append(']');
      }
      sb.append(", ~").append(StringUtils.byteDesc(
          column.getApproximateBytes()));
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return "rows:" + rowCount + ",batches:" + batchCount + ",bytes:"
        + getMemoryBytes() + ",epoch:" + epoch;
  }
}
