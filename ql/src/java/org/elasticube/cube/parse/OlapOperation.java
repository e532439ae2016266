package org.elasticube.cube.parse;
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

import org.apache.commons.lang.StringUtils;

/**
 * An OLAP verb applied while building a query, kept with its parameters in
 * the order the verbs were called.
 */
public final class OlapOperation {

  public static enum Type {
    SLICE,
    DICE,
    ROLL_UP,
    DRILL_DOWN
  }

  private final Type type;
  private final List<String> args;

  public OlapOperation(Type type, List<String> args) {
    this.type = type;
    this.args = Collections.unmodifiableList(new ArrayList<String>(args));
  }

  public Type getType() {
    return type;
  }

  public List<String> getArgs() {
    return args;
  }

  @Override
  public String toString() {
    return type.name().toLowerCase() + "(" + StringUtils.join(args, ", ") + ")";
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof OlapOperation)) {
      return false;
    }
    OlapOperation other = (OlapOperation) obj;
    return type == other.type && args.equals(other.args);
  }

  @Override
  public int hashCode() {
    return 31 * type.hashCode() + args.hashCode();
  }
}
