package org.elasticube.cube;
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

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.conf.Configuration;
import org.elasticube.cube.data.BatchField;
import org.elasticube.cube.data.BatchSchema;
import org.elasticube.cube.data.RecordBatch;
import org.elasticube.cube.exec.ExecutionEngine;
import org.elasticube.cube.exec.InMemoryExecutionEngine;
import org.elasticube.cube.metadata.AggregateFunction;
import org.elasticube.cube.metadata.ColumnType;
import org.elasticube.cube.metadata.CubeException;
import org.elasticube.cube.metadata.CubeSchema;
import org.elasticube.cube.source.DataSource;
import org.elasticube.cube.source.RecordBatchSource;

/**
 * Declares a cube and its initial data.
 *
 * <pre>
 * ElastiCube cube = new ElastiCubeBuilder("sales")
 *     .addDimension("region", ColumnType.STRING)
 *     .addMeasure("revenue", ColumnType.DOUBLE, AggregateFunction.SUM)
 *     .load(source)
 *     .build();
 * </pre>
 *
 * When no base field is declared the layout is taken from the source, every
 * source column becoming a dimension. Declarations are recorded in call
 * order and checked in {@link #build()}.
 */
public class ElastiCubeBuilder {
  private static final Log LOG = LogFactory.getLog(ElastiCubeBuilder.class);

  private final String name;
  private final List<Declaration> declarations = new ArrayList<Declaration>();
  private String description;
  private Configuration conf;
  private ExecutionEngine engine;
  private DataSource source;

  public ElastiCubeBuilder(String name) {
    this.name = name;
  }

  public ElastiCubeBuilder withDescription(String description) {
    this.description = description;
    return this;
  }

  public ElastiCubeBuilder withConfiguration(Configuration conf) {
    this.conf = conf;
    return this;
  }

  public ElastiCubeBuilder withExecutionEngine(ExecutionEngine engine) {
    this.engine = engine;
    return this;
  }

  public ElastiCubeBuilder addDimension(String dimName, ColumnType type) {
    return addDimension(dimName, type, null);
  }

  public ElastiCubeBuilder addDimension(final String dimName,
      final ColumnType type, final Long cardinality) {
    declarations.add(new Declaration(true) {
      void apply(CubeSchema schema) throws CubeException {
        schema.addDimension(dimName, type, cardinality);
      }
    });
    return this;
  }

  public ElastiCubeBuilder addMeasure(final String measureName,
      final ColumnType type, final AggregateFunction aggregate) {
    declarations.add(new Declaration(true) {
      void apply(CubeSchema schema) throws CubeException {
        schema.addMeasure(measureName, type, aggregate);
      }
    });
    return this;
  }

  public ElastiCubeBuilder addHierarchy(final String hierName,
      final String... levels) {
    declarations.add(new Declaration(false) {
      void apply(CubeSchema schema) throws CubeException {
        schema.addHierarchy(hierName, levels);
      }
    });
    return this;
  }

  public ElastiCubeBuilder addCalculatedMeasure(final String measureName,
      final String expr, final ColumnType type,
      final AggregateFunction aggregate) {
    declarations.add(new Declaration(false) {
      void apply(CubeSchema schema) throws CubeException {
        schema.addCalculatedMeasure(measureName, expr, type, aggregate);
      }
    });
    return this;
  }

  public ElastiCubeBuilder addVirtualDimension(String dimName, String expr,
      ColumnType type) {
    return addVirtualDimension(dimName, expr, type, null);
  }

  public ElastiCubeBuilder addVirtualDimension(final String dimName,
      final String expr, final ColumnType type, final Long cardinality) {
    declarations.add(new Declaration(false) {
      void apply(CubeSchema schema) throws CubeException {
        schema.addVirtualDimension(dimName, expr, type, cardinality);
      }
    });
    return this;
  }

  public ElastiCubeBuilder load(DataSource source) {
    this.source = source;
    return this;
  }

  /**
   * Shortcut for loading batches already in memory.
   */
  public ElastiCubeBuilder withData(List<RecordBatch> batches) {
    return load(new RecordBatchSource(name, batches));
  }

  public ElastiCube build() throws CubeException {
    boolean hasBaseFields = false;
    for (Declaration declaration : declarations) {
      hasBaseFields |= declaration.baseField;
    }
    if (!hasBaseFields && source == null) {
      throw new CubeException(ErrorMsg.NO_DATA_SOURCE, name);
    }
    CubeSchema schema = new CubeSchema(name);
    if (!hasBaseFields) {
      for (BatchField field : source.getSchema().getFields()) {
        schema.addDimension(field.getName(), field.getType());
      }
      LOG.info("Inferred layout of cube " + name + " from its source: "
          + schema.getBatchSchema());
    }
    for (Declaration declaration : declarations) {
      declaration.apply(schema);
    }
    ElastiCube cube = new ElastiCube(name, description,
        conf == null ? new Configuration() : conf, schema,
        engine == null ? new InMemoryExecutionEngine() : engine);
    if (source != null) {
      BatchSchema layout = schema.getBatchSchema();
      cube.append(source.load(layout));
    }
    LOG.info("Built cube " + name + " with " + cube.getRowCount() + " rows");
    return cube;
  }

  private abstract static class Declaration {
    final boolean baseField;

    Declaration(boolean baseField) {
      this.baseField = baseField;
    }

    abstract void apply(CubeSchema schema) throws CubeException;
  }
}
