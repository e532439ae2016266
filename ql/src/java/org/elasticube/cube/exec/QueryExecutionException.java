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

import org.elasticube.cube.ErrorMsg;
import org.elasticube.cube.metadata.CubeException;

/**
 * Failure raised by an execution engine while running a query.
 */
public class QueryExecutionException extends CubeException {
  private static final long serialVersionUID = 1L;

  public QueryExecutionException(ErrorMsg msg, String... msgArgs) {
    super(msg, msgArgs);
  }

  public QueryExecutionException(ErrorMsg msg, Throwable cause,
      String... msgArgs) {
    super(msg, cause, msgArgs);
  }
}
