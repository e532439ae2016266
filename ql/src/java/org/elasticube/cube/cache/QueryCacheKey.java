package org.elasticube.cube.cache;
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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.hadoop.io.MD5Hash;
import org.codehaus.jackson.map.ObjectMapper;
import org.elasticube.cube.parse.Expression;
import org.elasticube.cube.parse.OlapOperation;
import org.elasticube.cube.parse.OrderItem;
import org.elasticube.cube.parse.QueryDescriptor;
import org.elasticube.cube.parse.SelectItem;

/**
 * Cache key of a query result: the canonical JSON form of the resolved query
 * together with the schema version and data epoch it ran against. Equal
 * queries over the same schema and data give equal keys. Keys compare on
 * the full canonical form, the MD5 digest is only a compact identifier.
 */
public final class QueryCacheKey {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final String canonical;
  private final String digest;

  private QueryCacheKey(String canonical) {
    this.canonical = canonical;
    this.digest = MD5Hash.digest(canonical).toString();
  }

  public static QueryCacheKey forQuery(QueryDescriptor query,
      long schemaVersion, long epoch) throws IOException {
    Map<String, Object> form = new LinkedHashMap<String, Object>();
    List<String> select = new ArrayList<String>();
    for (SelectItem item : query.getSelect()) {
      select.add(item.toString());
    }
    form.put("select", select);
    form.put("filter", query.getFilter() == null ? null
        : query.getFilter().toString());
    List<String> groupBy = new ArrayList<String>();
    for (Expression expr : query.getGroupBy()) {
      groupBy.add(expr.toString());
    }
    form.put("groupBy", groupBy);
    List<String> orderBy = new ArrayList<String>();
    for (OrderItem item : query.getOrderBy()) {
      orderBy.add(item.toString());
    }
    form.put("orderBy", orderBy);
    form.put("limit", query.getLimit());
    List<String> olap = new ArrayList<String>();
    for (OlapOperation op : query.getOlapOps()) {
      olap.add(op.toString());
    }
    form.put("olap", olap);
    form.put("schemaVersion", Long.valueOf(schemaVersion));
    form.put("epoch", Long.valueOf(epoch));

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try {
      MAPPER.writeValue(out, form);
      return new QueryCacheKey(out.toString("UTF-8"));
    } finally {
      out.close();
    }
  }

  public String getCanonicalForm() {
    return canonical;
  }

  public String getDigest() {
    return digest;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof QueryCacheKey)) {
      return false;
    }
    return canonical.equals(((QueryCacheKey) obj).canonical);
  }

  @Override
  public int hashCode() {
    return canonical.hashCode();
  }

  @Override
  public String toString() {
    return digest;
  }
}
