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

import org.elasticube.cube.data.BatchSet;
import org.elasticube.cube.parse.QueryDescriptor;

/**
 * Runs resolved queries over a snapshot of the cube data. Implementations
 * must be safe to call from several threads at once.
 */
public interface ExecutionEngine {
  QueryResult execute(QueryDescriptor query, BatchSet data)
      throws QueryExecutionException;
}
