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
import java.util.List;

import org.apache.hadoop.conf.Configuration;

/**
 * Runs the resolution steps of a query in order.
 */
public class CubeQueryRewriter {
  private final Configuration conf;
  private final List<ContextRewriter> rewriters = new ArrayList<ContextRewriter>();

  public CubeQueryRewriter(Configuration conf) {
    this.conf = conf;
    setupRewriters();
  }

  private void setupRewriters() {
    // Validate names before anything is rewritten
    rewriters.add(new ColumnResolver(conf));
    // Apply roll up and drill down to the group by
    rewriters.add(new OlapOperationResolver(conf));
    // Rewrite order by items using select aliases
    rewriters.add(new AliasReplacer(conf));
    // Wrap bare measures in their default aggregate
    rewriters.add(new AggregateResolver(conf));
    rewriters.add(new GroupbyResolver(conf));
    // Inline derived fields
    rewriters.add(new ExpressionResolver(conf));
    // Check the expanded query, must run last
    rewriters.add(new AggregationValidator(conf));
  }

  public QueryDescriptor rewrite(CubeQueryContext ctx) throws SemanticException {
    for (ContextRewriter rewriter : rewriters) {
      rewriter.rewriteContext(ctx);
    }
    return ctx.toDescriptor();
  }
}
