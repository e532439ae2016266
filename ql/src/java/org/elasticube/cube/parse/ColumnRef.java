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

import java.util.Set;

import org.elasticube.cube.metadata.CubeException;

public final class ColumnRef extends Expression {
  private final String name;

  public ColumnRef(String name) {
    assert (name != null);
    this.name = name.toLowerCase();
  }

  public String getName() {
    return name;
  }

  @Override
  public Expression transform(ExprTransformer transformer) throws CubeException {
    Expression replaced = transformer.transformColumn(this);
    return replaced == null ? this : replaced;
  }

  @Override
  public void collectColumns(Set<String> columns) {
    columns.add(name);
  }

  @Override
  public String toString() {
    return name;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ColumnRef)) {
      return false;
    }
    return name.equals(((ColumnRef) obj).name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }
}
