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

import org.elasticube.cube.metadata.ColumnType;

public final class BatchField {
  private final String name;
  private final ColumnType type;

  public BatchField(String name, ColumnType type) {
    assert (name != null && type != null);
    this.name = name.toLowerCase();
    this.type = type;
  }

  public String getName() {
    return name;
  }

  public ColumnType getType() {
    return type;
  }

  @Override
  public String toString() {
    return name + ":" + type;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof BatchField)) {
      return false;
    }
    BatchField other = (BatchField) obj;
    return name.equals(other.name) && type == other.type;
  }

  @Override
  public int hashCode() {
    return 31 * name.hashCode() + type.hashCode();
  }
}
