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
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.elasticube.cube.ErrorMsg;
import org.elasticube.cube.data.BatchField;
import org.elasticube.cube.data.BatchSchema;
import org.elasticube.cube.parse.ColumnRef;
import org.elasticube.cube.parse.ExprTransformer;
import org.elasticube.cube.parse.Expression;
import org.elasticube.cube.parse.ParseException;

/**
 * Schema of a cube: dimensions, measures, hierarchies and the derived fields
 * over them, sharing a single case-insensitive namespace.
 *
 * Every successful declaration bumps the schema version. A declaration that
 * fails leaves both the fields and the version untouched.
 */
public class CubeSchema implements Named {
  public static final Log LOG = LogFactory.getLog(CubeSchema.class.getName());

  private final String name;
  private final Map<String, CubeDimension> dimensions =
      new LinkedHashMap<String, CubeDimension>();
  private final Map<String, CubeMeasure> measures =
      new LinkedHashMap<String, CubeMeasure>();
  private final Map<String, Hierarchy> hierarchies =
      new LinkedHashMap<String, Hierarchy>();
  private final FieldGraph graph = new FieldGraph();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private boolean layoutLocked;
  private volatile long version = 0;

  public CubeSchema(String name) {
    this.name = name.toLowerCase();
  }

  public String getName() {
    return name;
  }

  public long getVersion() {
    return version;
  }

  public void addDimension(String dimName, ColumnType type)
      throws CubeException {
    addDimension(dimName, type, null);
  }

  public void addDimension(String dimName, ColumnType type, Long cardinality)
      throws CubeException {
    declare(new BaseDimension(dimName, type, cardinality));
  }

  public void addMeasure(String measureName, ColumnType type,
      AggregateFunction aggregate) throws CubeException {
    declare(new ColumnMeasure(measureName, type, aggregate));
  }

  public void addCalculatedMeasure(String measureName, String expr,
      ColumnType type, AggregateFunction aggregate) throws CubeException {
    declare(new CalculatedMeasure(measureName, expr, type, aggregate));
  }

  public void addVirtualDimension(String dimName, String expr,
      ColumnType type) throws CubeException {
    addVirtualDimension(dimName, expr, type, null);
  }

  public void addVirtualDimension(String dimName, String expr,
      ColumnType type, Long cardinality) throws CubeException {
    declare(new VirtualDimension(dimName, expr, type, cardinality));
  }

  public void addHierarchy(String hierName, String... levels)
      throws CubeException {
    addHierarchy(hierName, Arrays.asList(levels));
  }

  public void addHierarchy(String hierName, List<String> levels)
      throws CubeException {
    Hierarchy hierarchy = new Hierarchy(hierName, levels);
    lock.writeLock().lock();
    try {
      checkDuplicate(hierarchy.getName());
      if (hierarchy.getLevels().isEmpty()) {
        throw new CubeException(ErrorMsg.INVALID_HIERARCHY_LEVEL, "<none>",
            hierarchy.getName());
      }
      Set<String> seen = new HashSet<String>();
      for (String level : hierarchy.getLevels()) {
        if (!dimensions.containsKey(level) || !seen.add(level)) {
          throw new CubeException(ErrorMsg.INVALID_HIERARCHY_LEVEL, level,
              hierarchy.getName());
        }
      }
      hierarchies.put(hierarchy.getName(), hierarchy);
      advanceVersion();
      LOG.info("Added hierarchy " + hierarchy + " to cube " + name);
    } finally {
      lock.writeLock().unlock();
    }
  }

  private void declare(CubeColumn column) throws CubeException {
    lock.writeLock().lock();
    try {
      String fieldName = column.getName();
      checkDuplicate(fieldName);
      if (layoutLocked && !(column instanceof DerivedColumn)) {
        throw new CubeException(ErrorMsg.SCHEMA_MISMATCH, name,
            "cannot add base field " + fieldName + " while the cube holds data");
      }
      Set<String> refs = null;
      if (column instanceof DerivedColumn) {
        refs = checkDerived((DerivedColumn) column);
      }
      if (column instanceof CubeDimension) {
        dimensions.put(fieldName, (CubeDimension) column);
      } else {
        measures.put(fieldName, (CubeMeasure) column);
      }
      if (refs != null) {
        graph.addField(fieldName, refs);
      }
      advanceVersion();
      LOG.info("Added " + column + " to cube " + name);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Pins the physical layout while the cube holds rows.
   *
   * @throws CubeException if the layout is no longer the expected one
   */
  public void lockLayout(BatchSchema expected) throws CubeException {
    lock.writeLock().lock();
    try {
      BatchSchema layout = getBatchSchema();
      if (!layout.equals(expected)) {
        throw new CubeException(ErrorMsg.SCHEMA_MISMATCH, name, "expected "
            + expected + ", layout is now " + layout);
      }
      layoutLocked = true;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public void unlockLayout() {
    lock.writeLock().lock();
    try {
      layoutLocked = false;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public boolean isLayoutLocked() {
    lock.readLock().lock();
    try {
      return layoutLocked;
    } finally {
      lock.readLock().unlock();
    }
  }

  private void advanceVersion() {
    graph.clearExpansions();
    version++;
  }

  private void checkDuplicate(String fieldName) throws CubeException {
    if (dimensions.containsKey(fieldName) || measures.containsKey(fieldName)
        || hierarchies.containsKey(fieldName)) {
      throw new CubeException(ErrorMsg.DUPLICATE_NAME, fieldName, name);
    }
  }

  private Set<String> checkDerived(DerivedColumn column) throws CubeException {
    String fieldName = column.getName();
    Expression expr;
    try {
      expr = column.getExpression();
    } catch (ParseException e) {
      throw new CubeException(ErrorMsg.INVALID_EXPRESSION, e,
          column.getExpr(), e.getMessage());
    }
    Set<String> refs = expr.getColumns();
    List<String> cycle = graph.findCycle(fieldName, refs);
    if (cycle != null) {
      throw new CubeException(ErrorMsg.CYCLIC_DEPENDENCY, fieldName,
          StringUtils.join(cycle, " -> "));
    }
    for (String ref : refs) {
      if (hierarchies.containsKey(ref)) {
        throw new CubeException(ErrorMsg.INVALID_DEPENDENCY, fieldName, ref,
            "hierarchies cannot be used in expressions");
      }
      CubeColumn target = getColumnByName(ref);
      if (target == null) {
        throw new CubeException(ErrorMsg.UNKNOWN_DEPENDENCY, fieldName, ref);
      }
      if (column instanceof VirtualDimension
          && !(target instanceof BaseDimension)) {
        throw new CubeException(ErrorMsg.INVALID_DEPENDENCY, fieldName, ref,
            "virtual dimensions may only reference base dimensions");
      }
    }
    if (column instanceof VirtualDimension && expr.containsAggregate()) {
      throw new CubeException(ErrorMsg.INVALID_EXPRESSION, column.getExpr(),
          "virtual dimensions cannot aggregate");
    }
    return refs;
  }

  /**
   * Expression of a field with all derived references inlined, so that it
   * only references base dimensions and base measures.
   */
  public Expression resolve(String fieldName) throws CubeException {
    lock.readLock().lock();
    try {
      return resolveField(fieldName.toLowerCase(), "expression");
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Replaces every field reference in the expression by its resolved form.
   *
   * @param clause where the expression is used, for error messages
   */
  public Expression expand(Expression expr, final String clause)
      throws CubeException {
    lock.readLock().lock();
    try {
      return expr.transform(new ExprTransformer() {
        public Expression transformColumn(ColumnRef column)
            throws CubeException {
          return resolveField(column.getName(), clause);
        }
      });
    } finally {
      lock.readLock().unlock();
    }
  }

  private Expression resolveField(String fieldName, final String clause)
      throws CubeException {
    CubeColumn column = getColumnByName(fieldName);
    if (column == null) {
      throw new CubeException(ErrorMsg.UNKNOWN_FIELD, fieldName, clause);
    }
    if (!(column instanceof DerivedColumn)) {
      return new ColumnRef(fieldName);
    }
    Expression expansion = graph.getExpansion(fieldName);
    if (expansion != null) {
      return expansion;
    }
    Expression expr;
    try {
      expr = ((DerivedColumn) column).getExpression();
    } catch (ParseException e) {
      throw new CubeException(ErrorMsg.INVALID_EXPRESSION, e,
          ((DerivedColumn) column).getExpr(), e.getMessage());
    }
    expansion = expr.transform(new ExprTransformer() {
      public Expression transformColumn(ColumnRef ref) throws CubeException {
        return resolveField(ref.getName(), clause);
      }
    });
    graph.putExpansion(fieldName, expansion);
    return expansion;
  }

  /**
   * Whether the expansion of the field aggregates, that is whether it can
   * only be evaluated per group.
   */
  public boolean isAggregating(String fieldName) throws CubeException {
    return resolve(fieldName).containsAggregate();
  }

  public CubeColumn getColumnByName(String fieldName) {
    String key = fieldName.toLowerCase();
    lock.readLock().lock();
    try {
      CubeColumn column = dimensions.get(key);
      if (column == null) {
        column = measures.get(key);
      }
      return column;
    } finally {
      lock.readLock().unlock();
    }
  }

  public CubeDimension getDimensionByName(String dimName) {
    lock.readLock().lock();
    try {
      return dimensions.get(dimName.toLowerCase());
    } finally {
      lock.readLock().unlock();
    }
  }

  public CubeMeasure getMeasureByName(String measureName) {
    lock.readLock().lock();
    try {
      return measures.get(measureName.toLowerCase());
    } finally {
      lock.readLock().unlock();
    }
  }

  public Hierarchy getHierarchyByName(String hierName) {
    lock.readLock().lock();
    try {
      return hierarchies.get(hierName.toLowerCase());
    } finally {
      lock.readLock().unlock();
    }
  }

  public List<CubeDimension> getDimensions() {
    lock.readLock().lock();
    try {
      return new ArrayList<CubeDimension>(dimensions.values());
    } finally {
      lock.readLock().unlock();
    }
  }

  public List<CubeMeasure> getMeasures() {
    lock.readLock().lock();
    try {
      return new ArrayList<CubeMeasure>(measures.values());
    } finally {
      lock.readLock().unlock();
    }
  }

  public List<Hierarchy> getHierarchies() {
    lock.readLock().lock();
    try {
      return new ArrayList<Hierarchy>(hierarchies.values());
    } finally {
      lock.readLock().unlock();
    }
  }

  public List<String> getAllFieldNames() {
    lock.readLock().lock();
    try {
      List<String> names = new ArrayList<String>();
      names.addAll(dimensions.keySet());
      names.addAll(measures.keySet());
      names.addAll(hierarchies.keySet());
      return names;
    } finally {
      lock.readLock().unlock();
    }
  }

  public boolean isDimension(String fieldName) {
    return getDimensionByName(fieldName) != null;
  }

  public boolean isMeasure(String fieldName) {
    return getMeasureByName(fieldName) != null;
  }

  public boolean isHierarchy(String fieldName) {
    return getHierarchyByName(fieldName) != null;
  }

  public boolean isDerived(String fieldName) {
    return getColumnByName(fieldName) instanceof DerivedColumn;
  }

  public boolean hasBaseFields() {
    return !getBatchSchema().getFields().isEmpty();
  }

  /**
   * Physical layout of the record batches: base dimensions followed by base
   * measures, each in declaration order.
   */
  public BatchSchema getBatchSchema() {
    lock.readLock().lock();
    try {
      List<BatchField> fields = new ArrayList<BatchField>();
      addBaseFields(dimensions.values(), fields);
      addBaseFields(measures.values(), fields);
      return new BatchSchema(fields);
    } finally {
      lock.readLock().unlock();
    }
  }

  private static void addBaseFields(Collection<? extends CubeColumn> columns,
      List<BatchField> fields) {
    for (CubeColumn column : columns) {
      if (!(column instanceof DerivedColumn)) {
        fields.add(new BatchField(column.getName(), column.getType()));
      }
    }
  }

  @Override
  public String toString() {
    return name + " dimensions:" + getDimensions() + " measures:"
        + getMeasures() + " hierarchies:" + getHierarchies();
  }
}
