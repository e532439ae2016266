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
import java.util.List;

import org.apache.commons.lang.StringUtils;

/**
 * Ordered list of dimensions, coarsest level first.
 */
public final class Hierarchy implements Named {
  private final String name;
  private final List<String> levels;

  public Hierarchy(String name, List<String> levels) {
    assert (name != null);
    this.name = name.toLowerCase();
    List<String> lowered = new ArrayList<String>(levels.size());
    for (String level : levels) {
      lowered.add(level.toLowerCase());
    }
    this.levels = Collections.unmodifiableList(lowered);
  }

  public String getName() {
    return name;
  }

  public List<String> getLevels() {
    return levels;
  }

  public int indexOf(String level) {
    return levels.indexOf(level.toLowerCase());
  }

  /**
   * Levels from the coarsest up to and including the given one.
   */
  public List<String> levelsUpTo(String level) {
    int index = indexOf(level);
    if (index < 0) {
      throw new IllegalArgumentException(level + " is not a level of " + name);
    }
    return levels.subList(0, index + 1);
  }

  @Override
  public String toString() {
    return name + ":[" + StringUtils.join(levels, ",") + "]";
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Hierarchy)) {
      return false;
    }
    Hierarchy other = (Hierarchy) obj;
    return name.equals(other.name) && levels.equals(other.levels);
  }

  @Override
  public int hashCode() {
    return 31 * name.hashCode() + levels.hashCode();
  }
}
