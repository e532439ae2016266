package org.elasticube.cube.metadata;
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

/**
 * Generic exception class for cube errors. Every instance carries the
 * {@link ErrorMsg} it was raised for.
 */
public class CubeException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ErrorMsg canonicalErrorMsg;

  public CubeException(String message) {
    super(message);
    canonicalErrorMsg = ErrorMsg.GENERIC_ERROR;
  }

  public CubeException(Throwable cause) {
    super(cause);
    canonicalErrorMsg = ErrorMsg.GENERIC_ERROR;
  }

  public CubeException(String message, Throwable cause) {
    super(message, cause);
    canonicalErrorMsg = ErrorMsg.GENERIC_ERROR;
  }

  public CubeException(ErrorMsg message, String... msgArgs) {
    super(message.format(msgArgs));
    canonicalErrorMsg = message;
  }

  public CubeException(ErrorMsg message, Throwable cause, String... msgArgs) {
    super(message.format(msgArgs), cause);
    canonicalErrorMsg = message;
  }

  /**
   * Wraps another cube failure keeping its message and error kind.
   */
  protected CubeException(CubeException cause) {
    super(cause.getMessage(), cause);
    canonicalErrorMsg = cause.getCanonicalErrorMsg();
  }

  public ErrorMsg getCanonicalErrorMsg() {
    return canonicalErrorMsg;
  }
}
