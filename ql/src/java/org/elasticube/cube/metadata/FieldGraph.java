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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.elasticube.cube.parse.Expression;

/**
 * Dependency graph of derived fields. An edge goes from a derived field to
 * every field its expression references. The graph also keeps the memoized
 * base field expansion of each derived field; the memo is dropped whenever
 * a field is added.
 */
public class FieldGraph {
  private final Map<String, Set<String>> edges =
      new HashMap<String, Set<String>>();
  private final Map<String, Expression> expansions =
      new ConcurrentHashMap<String, Expression>();

  public Set<String> getReferences(String name) {
    Set<String> refs = edges.get(name);
    if (refs == null) {
      return Collections.emptySet();
    }
    return refs;
  }

  public void addField(String name, Set<String> refs) {
    edges.put(name, new LinkedHashSet<String>(refs));
    expansions.clear();
  }

  /**
   * Looks for a path from the references of a field being declared back to
   * the field itself.
   *
   * @return the cycle, starting and ending at {@code name}, or null
   */
  public List<String> findCycle(String name, Set<String> refs) {
    Set<String> done = new HashSet<String>();
    List<String> path = new ArrayList<String>();
    path.add(name);
    for (String ref : refs) {
      if (visit(ref, name, path, done)) {
        return path;
      }
    }
    return null;
  }

  private boolean visit(String node, String target, List<String> path,
      Set<String> done) {
    path.add(node);
    if (node.equals(target)) {
      return true;
    }
    if (!done.contains(node)) {
      done.add(node);
      for (String ref : getReferences(node)) {
        if (visit(ref, target, path, done)) {
          return true;
        }
      }
    }
    path.remove(path.size() - 1);
    return false;
  }

  public Expression getExpansion(String name) {
    return expansions.get(name);
  }

  public void putExpansion(String name, Expression expansion) {
    expansions.put(name, expansion);
  }

  public void clearExpansions() {
    expansions.clear();
  }
}
