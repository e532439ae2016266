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
 * Immutable columnar chunk of rows. Columns are copied on the way in and on
 * the way out, so a batch never changes once built.
 */
public final class RecordBatch {
  private final BatchSchema schema;
  private final List<Object[]> columns;
  private final int rowCount;

  public RecordBatch(BatchSchema schema, List<Object[]> columns) {
    if (columns.size() != schema.size()) {
      throw new IllegalArgumentException("Expected " + schema.size()
          + " columns for " + schema + ", got " + columns.size());
    }
    int rows = -1;
    List<Object[]> copy = new ArrayList<Object[]>(columns.size());
    for (int i = 0; i < columns.size(); i++) {
      Object[] column = columns.get(i);
      if (rows < 0) {
        rows = column.length;
      } else if (column.length != rows) {
        throw new IllegalArgumentException("Column "
            + schema.getField(i).getName() + " has " + column.length
            + " values, expected " + rows);
      }
      copy.add(column.clone());
    }
    this.schema = schema;
    this.columns = Collections.unmodifiableList(copy);
    this.rowCount = rows < 0 ? 0 : rows;
  }

  public BatchSchema getSchema() {
    return schema;
  }

  public int getRowCount() {
    return rowCount;
  }

  public int getColumnCount() {
    return columns.size();
  }

  public Object getValue(int row, int column) {
    return columns.get(column)[row];
  }

  public Object getValue(int row, String column) {
    int index = schema.indexOf(column);
    if (index < 0) {
      throw new IllegalArgumentException("No column " + column + " in "
          + schema);
    }
    return columns.get(index)[row];
  }

  public Object[] getColumn(int column) {
    return columns.get(column).clone();
  }

  public Object[] getRow(int row) {
    Object[] values = new Object[columns.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = columns.get(i)[row];
    }
    return values;
  }

  /**
   * Batch holding the rows whose flag is set, in their original order.
   */
  public RecordBatch filter(boolean[] keep) {
    int kept = 0;
    for (int i = 0; i < rowCount; i++) {
      if (keep[i]) {
        kept++;
      }
    }
    List<Object[]> filtered = new ArrayList<Object[]>(columns.size());
    for (Object[] column : columns) {
      Object[] values = new Object[kept];
      int pos = 0;
      for (int i = 0; i < rowCount; i++) {
        if (keep[i]) {
          values[pos++] = column[i];
        }
      }
      filtered.add(values);
    }
    return new RecordBatch(schema, filtered);
  }

  /**
   * Rows {@code from} (inclusive) to {@code to} (exclusive).
   */
  public RecordBatch slice(int from, int to) {
    List<Object[]> sliced = new ArrayList<Object[]>(columns.size());
    for (Object[] column : columns) {
      Object[] values = new Object[to - from];
      System.arraycopy(column, from, values, 0, to - from);
      sliced.add(values);
    }
    return new RecordBatch(schema, sliced);
  }

  /**
   * Concatenates batches of one layout, preserving row order.
   *
   * @throws IllegalArgumentException if a batch has another layout
   */
  public static RecordBatch concat(BatchSchema schema, List<RecordBatch> batches) {
    int total = 0;
    for (RecordBatch batch : batches) {
      if (!batch.getSchema().equals(schema)) {
        throw new IllegalArgumentException("Cannot concatenate " + batch
            + " into layout " + schema);
      }
      total += batch.getRowCount();
    }
    List<Object[]> merged = new ArrayList<Object[]>(schema.size());
    for (int c = 0; c < schema.size(); c++) {
      Object[] values = new Object[total];
      int pos = 0;
      for (RecordBatch batch : batches) {
        Object[] column = batch.columns.get(c);
        System.arraycopy(column, 0, values, pos, column.length);
        pos += column.length;
      }
      merged.add(values);
    }
    return new RecordBatch(schema, merged);
  }

  @Override
  public String toString() {
    return "RecordBatch" + schema + " rows:" + rowCount;
  }

  /**
   * Row-wise builder of a record batch.
   */
  public static class Builder {
    private final BatchSchema schema;
    private final List<Object[]> rows = new ArrayList<Object[]>();

    public Builder(BatchSchema schema) {
      this.schema = schema;
    }

    public Builder addRow(Object... values) {
      if (values.length != schema.size()) {
        throw new IllegalArgumentException("Expected " + schema.size()
            + " values, got " + values.length);
      }
      rows.add(values.clone());
      return this;
    }

    public RecordBatch build() {
      List<Object[]> columns = new ArrayList<Object[]>(schema.size());
      for (int c = 0; c < schema.size(); c++) {
        Object[] column = new Object[rows.size()];
        for (int r = 0; r < rows.size(); r++) {
          column[r] = rows.get(r)[c];
        }
        columns.add(column);
      }
      return new RecordBatch(schema, columns);
    }
  }
}
