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

import java.util.List;

import org.elasticube.cube.metadata.ColumnType;

/**
 * Null count, value range and approximate in-memory size of one column of
 * the physical layout. Min and max ignore nulls and are null when the column
 * holds no values.
 */
public final class ColumnStatistics {
  // object header plus payload of a boxed value, and one array slot per row
  private static final int BOXED_BYTES = 24;
  private static final int SMALL_BOXED_BYTES = 16;
  private static final int STRING_BYTES = 40;
  private static final int SLOT_BYTES = 8;
  private static final int ARRAY_BYTES = 16;

  private final String name;
  private final ColumnType type;
  private final long rowCount;
  private final long nullCount;
  private final Object min;
  private final Object max;
  private final long approximateBytes;

  public ColumnStatistics(String name, ColumnType type, long rowCount,
      long nullCount, Object min, Object max, long approximateBytes) {
    this.name = name;
    this.type = type;
    this.rowCount = rowCount;
    this.nullCount = nullCount;
    this.min = min;
    this.max = max;
    this.approximateBytes = approximateBytes;
  }

  /**
   * Scans column {@code index} of every batch.
   */
  @SuppressWarnings("unchecked")
  static ColumnStatistics compute(BatchField field, int index,
      List<RecordBatch> batches) {
    long rows = 0;
    long nulls = 0;
    long bytes = 0;
    Comparable<Object> min = null;
    Comparable<Object> max = null;
    for (RecordBatch batch : batches) {
      bytes += ARRAY_BYTES;
      for (int r = 0; r < batch.getRowCount(); r++) {
        Object value = batch.getValue(r, index);
        rows++;
        bytes += SLOT_BYTES + sizeOf(value);
        if (value == null) {
          nulls++;
          continue;
        }
        Comparable<Object> comparable = (Comparable<Object>) value;
        if (min == null || comparable.compareTo(min) < 0) {
          min = comparable;
        }
        if (max == null || comparable.compareTo(max) > 0) {
          max = comparable;
        }
      }
    }
    return new ColumnStatistics(field.getName(), field.getType(), rows, nulls,
        min, max, bytes);
  }

  static long sizeOf(Object value) {
    if (value == null) {
      return 0;
    } else if (value instanceof String) {
      return STRING_BYTES + 2L * ((String) value).length();
    } else if (value instanceof Integer || value instanceof Boolean) {
      return SMALL_BOXED_BYTES;
    }
    return BOXED_BYTES;
  }

  public String getName() {
    return name;
  }

  public ColumnType getType() {
    return type;
  }

  public long getRowCount() {
    return rowCount;
  }

  public long getNullCount() {
    return nullCount;
  }

  public Object getMin() {
    return min;
  }

  public Object getMax() {
    return max;
  }

  public long getApproximateBytes() {
    return approximateBytes;
  }

  @Override
  public String toString() {
    return name + ":" + type + " nulls:" + nullCount + "/" + rowCount
        + ",min:" + min + ",max:" + max + ",bytes:" + approximateBytes;
  }
}
