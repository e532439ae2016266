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
import java.util.Set;

import org.apache.commons.lang.StringUtils;
import org.elasticube.cube.metadata.AggregateFunction;
import org.elasticube.cube.metadata.CubeException;

/**
 * Call of an aggregate or scalar function. {@code count(*)} is a star call
 * without arguments, {@code count(DISTINCT x)} is a distinct call.
 */
public final class FunctionCall extends Expression {
  private final String name;
  private final List<Expression> args;
  private final boolean distinct;
  private final boolean star;

  public FunctionCall(String name, List<Expression> args) {
    this(name, args, false, false);
  }

  public FunctionCall(String name, List<Expression> args, boolean distinct) {
    this(name, args, distinct, false);
  }

  private FunctionCall(String name, List<Expression> args, boolean distinct,
      boolean star) {
    this.name = name.toLowerCase();
    this.args = Collections.unmodifiableList(new ArrayList<Expression>(args));
    this.distinct = distinct;
    this.star = star;
  }

  public static FunctionCall star(String name) {
    return new FunctionCall(name, Collections.<Expression>emptyList(), false,
        true);
  }

  public String getName() {
    return name;
  }

  public List<Expression> getArgs() {
    return args;
  }

  public boolean isDistinct() {
    return distinct;
  }

  public boolean isStar() {
    return star;
  }

  public boolean isAggregate() {
    return AggregateFunction.isAggregateFunction(name);
  }

  @Override
  public List<Expression> getChildren() {
    return args;
  }

  @Override
  public Expression transform(ExprTransformer transformer) throws CubeException {
    if (star) {
      return this;
    }
    return new FunctionCall(name, transformAll(args, transformer), distinct,
        false);
  }

  @Override
  public boolean containsAggregate() {
    return isAggregate() || super.containsAggregate();
  }

  @Override
  public void collectAggregates(Set<FunctionCall> aggregates) {
    if (isAggregate()) {
      aggregates.add(this);
    } else {
      super.collectAggregates(aggregates);
    }
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder();
    builder.append(name).append('(');
    if (star) {
      builder.append('*');
    } else {
      if (distinct) {
        builder.append("DISTINCT ");
      }
      builder.append(StringUtils.join(args, ", "));
    }
    builder.append(')');
    return builder.toString();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof FunctionCall)) {
      return false;
    }
    FunctionCall other = (FunctionCall) obj;
    return name.equals(other.name) && distinct == other.distinct
        && star == other.star && args.equals(other.args);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = name.hashCode();
    result = prime * result + args.hashCode();
    result = prime * result + (distinct ? 1 : 0);
    result = prime * result + (star ? 1 : 0);
    return result;
  }
}
