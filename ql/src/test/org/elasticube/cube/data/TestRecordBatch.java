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

import java.util.Arrays;

import org.elasticube.cube.CubeTestSetup;
import org.elasticube.cube.metadata.ColumnType;
import org.junit.Assert;
import org.junit.Test;

public class TestRecordBatch {

  @Test
  public void testConcatKeepsRowOrder() throws Exception {
    RecordBatch all = RecordBatch.concat(CubeTestSetup.getLayout(),
        CubeTestSetup.getBatches());
    Assert.assertEquals(CubeTestSetup.ROWS.length, all.getRowCount());
    for (int r = 0; r < all.getRowCount(); r++) {
      Assert.assertEquals(CubeTestSetup.ROWS[r][5], all.getValue(r, "revenue"));
    }
  }

  @Test
  public void testConcatRejectsOtherLayouts() throws Exception {
    BatchSchema wider = new BatchSchema(Arrays.asList(
        new BatchField("region", ColumnType.STRING),
        new BatchField("channel", ColumnType.STRING),
        new BatchField("revenue", ColumnType.DOUBLE)));
    BatchSchema narrow = new BatchSchema(Arrays.asList(
        new BatchField("region", ColumnType.STRING),
        new BatchField("revenue", ColumnType.DOUBLE)));
    RecordBatch old = new RecordBatch.Builder(narrow)
        .addRow("North", 10.0).build();
    RecordBatch current = new RecordBatch.Builder(wider)
        .addRow("South", "web", 20.0).build();
    try {
      RecordBatch.concat(wider, Arrays.asList(old, current));
      Assert.fail("Concatenated batches of different layouts");
    } catch (IllegalArgumentException e) {
      Assert.assertTrue(e.getMessage().contains("channel"));
    }
  }

  @Test
  public void testFilterAndSlice() throws Exception {
    RecordBatch all = CubeTestSetup.getAllRows();
    boolean[] keep = new boolean[all.getRowCount()];
    keep[1] = true;
    keep[6] = true;
    RecordBatch filtered = all.filter(keep);
    Assert.assertEquals(2, filtered.getRowCount());
    Assert.assertEquals(200.0, filtered.getValue(0, "revenue"));
    Assert.assertEquals(120.0, filtered.getValue(1, "revenue"));

    RecordBatch slice = all.slice(4, 6);
    Assert.assertEquals(2, slice.getRowCount());
    Assert.assertEquals("East", slice.getValue(0, "region"));
    Assert.assertNull(slice.getValue(1, "cost"));
  }
}
