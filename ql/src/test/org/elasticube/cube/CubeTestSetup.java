package org.elasticube.cube;
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
import java.util.List;

import org.apache.hadoop.conf.Configuration;
import org.elasticube.cube.data.BatchSchema;
import org.elasticube.cube.data.RecordBatch;
import org.elasticube.cube.metadata.AggregateFunction;
import org.elasticube.cube.metadata.ColumnType;
import org.elasticube.cube.metadata.CubeException;
import org.elasticube.cube.metadata.CubeSchema;

/**
 * Sales cube shared by the tests.
 *
 * <pre>
 * region product year quarter month revenue cost  units
 * North  Widget  2023 Q1      1     100.0   60.0  10
 * North  Gadget  2023 Q2      4     200.0   120.0 5
 * South  Widget  2023 Q1      2     150.0   90.0  15
 * South  Gadget  2024 Q1      1     50.0    30.0  2
 * East   Widget  2024 Q3      7     300.0   200.0 20
 * East   Gadget  2024 Q4      11    80.0    null  4
 * North  Widget  2024 Q2      5     120.0   70.0  12
 * South  Widget  2024 Q2      6     90.0    50.0  9
 * </pre>
 */
public class CubeTestSetup {
  public static final String TEST_CUBE_NAME = "sales";

  public static final Object[][] ROWS = {
    {"North", "Widget", 2023, "Q1", 1, 100.0, 60.0, 10L},
    {"North", "Gadget", 2023, "Q2", 4, 200.0, 120.0, 5L},
    {"South", "Widget", 2023, "Q1", 2, 150.0, 90.0, 15L},
    {"South", "Gadget", 2024, "Q1", 1, 50.0, 30.0, 2L},
    {"East", "Widget", 2024, "Q3", 7, 300.0, 200.0, 20L},
    {"East", "Gadget", 2024, "Q4", 11, 80.0, null, 4L},
    {"North", "Widget", 2024, "Q2", 5, 120.0, 70.0, 12L},
    {"South", "Widget", 2024, "Q2", 6, 90.0, 50.0, 9L},
  };

  public static Configuration getConf() {
    return new Configuration(false);
  }

  /**
   * Base fields and the time hierarchy, no derived fields.
   */
  public static CubeSchema createSchema() throws CubeException {
    CubeSchema schema = new CubeSchema(TEST_CUBE_NAME);
    schema.addDimension("region", ColumnType.STRING, 3L);
    schema.addDimension("product", ColumnType.STRING);
    schema.addDimension("year", ColumnType.INT);
    schema.addDimension("quarter", ColumnType.STRING);
    schema.addDimension("month", ColumnType.INT);
    schema.addMeasure("revenue", ColumnType.DOUBLE, AggregateFunction.SUM);
    schema.addMeasure("cost", ColumnType.DOUBLE, AggregateFunction.SUM);
    schema.addMeasure("units", ColumnType.BIGINT, AggregateFunction.SUM);
    schema.addHierarchy("time", "year", "quarter", "month");
    return schema;
  }

  public static ElastiCubeBuilder createBuilder() {
    return new ElastiCubeBuilder(TEST_CUBE_NAME)
        .withConfiguration(getConf())
        .addDimension("region", ColumnType.STRING, 3L)
        .addDimension("product", ColumnType.STRING)
        .addDimension("year", ColumnType.INT)
        .addDimension("quarter", ColumnType.STRING)
        .addDimension("month", ColumnType.INT)
        .addMeasure("revenue", ColumnType.DOUBLE, AggregateFunction.SUM)
        .addMeasure("cost", ColumnType.DOUBLE, AggregateFunction.SUM)
        .addMeasure("units", ColumnType.BIGINT, AggregateFunction.SUM)
        .addHierarchy("time", "year", "quarter", "month");
  }

  /**
   * The sales cube loaded with all rows, split over two batches.
   */
  public static ElastiCube createCube() throws CubeException {
    return createBuilder().withData(getBatches()).build();
  }

  public static BatchSchema getLayout() throws CubeException {
    return createSchema().getBatchSchema();
  }

  public static RecordBatch getBatch(int from, int to) throws CubeException {
    RecordBatch.Builder builder = new RecordBatch.Builder(getLayout());
    for (int i = from; i < to; i++) {
      builder.addRow(ROWS[i]);
    }
    return builder.build();
  }

  public static List<RecordBatch> getBatches() throws CubeException {
    List<RecordBatch> batches = new ArrayList<RecordBatch>();
    batches.add(getBatch(0, 4));
    batches.add(getBatch(4, ROWS.length));
    return batches;
  }

  public static RecordBatch getAllRows() throws CubeException {
    return getBatch(0, ROWS.length);
  }
}
