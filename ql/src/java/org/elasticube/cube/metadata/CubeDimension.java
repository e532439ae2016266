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

public abstract class CubeDimension extends CubeColumn {
  private final Long cardinality;

  protected CubeDimension(String name, ColumnType type, Long cardinality) {
    super(name, type);
    this.cardinality = cardinality;
  }

  /**
   * Estimated number of distinct values, null when unknown.
   */
  public Long getCardinality() {
    return cardinality;
  }

  @Override
  public String toString() {
    String str = super.toString();
    if (cardinality != null) {
      str += ",cardinality:" + cardinality;
    }
    return str;
  }

  @Override
  public boolean equals(Object obj) {
    if (!super.equals(obj)) {
      return false;
    }
    CubeDimension other = (CubeDimension) obj;
    if (cardinality == null) {
      return other.cardinality == null;
    }
    return cardinality.equals(other.cardinality);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = super.hashCode();
    result = prime * result + ((cardinality == null) ? 0 :
        cardinality.hashCode());
    return result;
  }
}
