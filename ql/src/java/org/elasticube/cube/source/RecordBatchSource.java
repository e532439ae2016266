package org.elasticube.cube.source;
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

import org.elasticube.cube.ErrorMsg;
import org.elasticube.cube.data.BatchField;
import org.elasticube.cube.data.BatchSchema;
import org.elasticube.cube.data.RecordBatch;
import org.elasticube.cube.metadata.CubeException;

/**
 * Source over record batches already in memory. Columns are matched to the
 * target layout by name, so the source may hold them in any order and may
 * hold extra columns.
 */
public class RecordBatchSource implements DataSource {
  private final String name;
  private final List<RecordBatch> batches;

  public RecordBatchSource(String name, List<RecordBatch> batches) {
    if (batches.isEmpty()) {
      throw new IllegalArgumentException("Source " + name + " has no batches");
    }
    this.name = name;
    this.batches = new ArrayList<RecordBatch>(batches);
  }

  public RecordBatchSource(String name, RecordBatch... batches) {
    this(name, Arrays.asList(batches));
  }

  public BatchSchema getSchema() {
    return batches.get(0).getSchema();
  }

  public List<RecordBatch> load(BatchSchema target) throws CubeException {
    List<RecordBatch> projected = new ArrayList<RecordBatch>(batches.size());
    for (RecordBatch batch : batches) {
      projected.add(project(batch, target));
    }
    return projected;
  }

  private RecordBatch project(RecordBatch batch, BatchSchema target)
      throws CubeException {
    BatchSchema source = batch.getSchema();
    if (source.equals(target)) {
      return batch;
    }
    List<Object[]> columns = new ArrayList<Object[]>(target.size());
    for (BatchField field : target.getFields()) {
      int index = source.indexOf(field.getName());
      if (index < 0) {
        throw new CubeException(ErrorMsg.SCHEMA_MISMATCH, name,
            "source has no column " + field.getName());
      }
      if (source.getField(index).getType() != field.getType()) {
        throw new CubeException(ErrorMsg.SCHEMA_MISMATCH, name, "column "
            + field.getName() + " is " + source.getField(index).getType()
            + ", expected " + field.getType());
      }
      columns.add(batch.getColumn(index));
    }
    return new RecordBatch(target, columns);
  }
}
