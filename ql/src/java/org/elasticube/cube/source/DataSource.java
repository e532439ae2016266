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

import java.util.List;

import org.elasticube.cube.data.BatchSchema;
import org.elasticube.cube.data.RecordBatch;
import org.elasticube.cube.metadata.CubeException;

/**
 * Supplier of the initial data of a cube.
 */
public interface DataSource {

  /**
   * Layout of the data as the source holds it. Used to infer the cube layout
   * when no base fields were declared.
   */
  BatchSchema getSchema() throws CubeException;

  /**
   * Loads all data in the given layout.
   */
  List<RecordBatch> load(BatchSchema target) throws CubeException;
}
