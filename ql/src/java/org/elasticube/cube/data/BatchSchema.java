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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang.StringUtils;

/**
 * Ordered, named and typed columns of a record batch.
 */
public final class BatchSchema {
  private final List<BatchField> fields;

  public BatchSchema(List<BatchField> fields) {
    this.fields = Collections.unmodifiableList(new ArrayList<BatchField>(fields));
  }

  public List<BatchField> getFields() {
    return fields;
  }

  public int size() {
    return fields.size();
  }

  public BatchField getField(int index) {
    return fields.get(index);
  }

  public int indexOf(String name) {
    String lower = name.toLowerCase();
    for (int i = 0; i < fields.size(); i++) {
      if (fields.get(i).getName().equals(lower)) {
        return i;
      }
    }
    return -1;
  }

  public List<String> getFieldNames() {
    List<String> names = new ArrayList<String>(fields.size());
    for (BatchField field : fields) {
      names.add(field.getName());
    }
    return names;
  }

  @Override
  public String toString() {
    return "[" + StringUtils.join(fields, ", ") + "]";
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof BatchSchema)) {
      return false;
    }
    return fields.equals(((BatchSchema) obj).fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }
}
