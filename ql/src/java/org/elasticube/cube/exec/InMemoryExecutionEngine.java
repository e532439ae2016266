package org.elasticube.cube.exec;
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
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.elasticube.cube.ErrorMsg;
import org.elasticube.cube.data.BatchField;
import org.elasticube.cube.data.BatchSchema;
import org.elasticube.cube.data.BatchSet;
import org.elasticube.cube.data.RecordBatch;
import org.elasticube.cube.metadata.AggregateFunction;
import org.elasticube.cube.metadata.ColumnType;
import org.elasticube.cube.parse.Expression;
import org.elasticube.cube.parse.FunctionCall;
import org.elasticube.cube.parse.OrderItem;
import org.elasticube.cube.parse.QueryDescriptor;
import org.elasticube.cube.parse.SelectItem;

/**
 * Reference engine evaluating queries row by row over the batches held in
 * memory. Rows are filtered first, then grouped on the group by expressions
 * (a query with aggregates and no group by forms a single group, even over
 * no rows), then projected, sorted with nulls last and limited.
 */
public class InMemoryExecutionEngine implements ExecutionEngine {
  private static final Log LOG = LogFactory.getLog(InMemoryExecutionEngine.class);

  public QueryResult execute(QueryDescriptor query, BatchSet data)
      throws QueryExecutionException {
    if (query.getFilter() != null) {
      checkNoAggregate(query.getFilter(), "filter");
    }
    for (Expression expr : query.getGroupBy()) {
      checkNoAggregate(expr, "group by");
    }
    List<RowAccessor> rows = filterRows(query.getFilter(), data);
    List<OutputRow> output;
    if (query.isAggregating()) {
      output = aggregate(query, rows);
    } else {
      output = project(query, rows);
    }
    sort(query.getOrderBy(), output);
    if (query.getLimit() != null && output.size() > query.getLimit()) {
      output = output.subList(0, query.getLimit());
    }
    QueryResult result = toResult(query.getColumnNames(), output);
    LOG.debug("Executed " + query + " over " + data + ", returned "
        + result.getRowCount() + " rows");
    return result;
  }

  private static void checkNoAggregate(Expression expr, String clause)
      throws QueryExecutionException {
    if (expr.containsAggregate()) {
      throw new QueryExecutionException(ErrorMsg.INVALID_EXPRESSION,
          expr.toString(), "aggregates are not allowed in " + clause);
    }
  }

  private static List<RowAccessor> filterRows(Expression filter, BatchSet data)
      throws QueryExecutionException {
    List<RowAccessor> rows = new ArrayList<RowAccessor>();
    for (RecordBatch batch : data.getBatches()) {
      RowAccessor accessor = new RowAccessor(batch);
      for (int i = 0; i < batch.getRowCount(); i++) {
        accessor.setRow(i);
        if (filter == null || ExpressionEvaluator.test(filter, accessor)) {
          rows.add(accessor.pin());
        }
      }
    }
    return rows;
  }

  private static List<OutputRow> project(QueryDescriptor query,
      List<RowAccessor> rows) throws QueryExecutionException {
    List<OutputRow> output = new ArrayList<OutputRow>(rows.size());
    for (RowAccessor row : rows) {
      output.add(evaluateRow(query, row, null));
    }
    return output;
  }

  private static OutputRow evaluateRow(QueryDescriptor query, RowAccessor row,
      Map<FunctionCall, Object> aggregates) throws QueryExecutionException {
    List<SelectItem> select = query.getSelect();
    Object[] values = new Object[select.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = ExpressionEvaluator.evaluate(select.get(i).getExpression(),
          row, aggregates);
    }
    List<OrderItem> orderBy = query.getOrderBy();
    Object[] sortKeys = new Object[orderBy.size()];
    for (int i = 0; i < sortKeys.length; i++) {
      sortKeys[i] = ExpressionEvaluator.evaluate(orderBy.get(i).getExpression(),
          row, aggregates);
    }
    return new OutputRow(values, sortKeys);
  }

  private static List<OutputRow> aggregate(QueryDescriptor query,
      List<RowAccessor> rows) throws QueryExecutionException {
    List<Expression> groupBy = query.getGroupBy();
    Set<FunctionCall> calls = new LinkedHashSet<FunctionCall>();
    for (SelectItem item : query.getSelect()) {
      item.getExpression().collectAggregates(calls);
      checkGrouped(item.getExpression(), groupBy);
    }
    for (OrderItem item : query.getOrderBy()) {
      item.getExpression().collectAggregates(calls);
      checkGrouped(item.getExpression(), groupBy);
    }
    List<FunctionCall> aggregateCalls = new ArrayList<FunctionCall>(calls);
    for (FunctionCall call : aggregateCalls) {
      validateAggregate(call);
    }

    Map<List<Object>, Group> groups = new LinkedHashMap<List<Object>, Group>();
    for (RowAccessor row : rows) {
      List<Object> key = new ArrayList<Object>(groupBy.size());
      for (Expression expr : groupBy) {
        key.add(ExpressionEvaluator.evaluate(expr, row));
      }
      Group group = groups.get(key);
      if (group == null) {
        group = new Group(row, aggregateCalls);
        groups.put(key, group);
      }
      group.accumulate(row);
    }
    if (groupBy.isEmpty() && groups.isEmpty()) {
      groups.put(Collections.<Object>emptyList(), new Group(null, aggregateCalls));
    }

    List<OutputRow> output = new ArrayList<OutputRow>(groups.size());
    for (Group group : groups.values()) {
      output.add(evaluateRow(query, group.first, group.results()));
    }
    return output;
  }

  private static void checkGrouped(Expression expr, List<Expression> groupBy)
      throws QueryExecutionException {
    if (!expr.isGroupedBy(groupBy)) {
      throw new QueryExecutionException(ErrorMsg.INVALID_EXPRESSION,
          expr.toString(), "must be aggregated or appear in group by");
    }
  }

  private static void validateAggregate(FunctionCall call)
      throws QueryExecutionException {
    if (call.isStar()) {
      if (!call.getName().equals("count")) {
        throw new QueryExecutionException(ErrorMsg.AGGREGATION_ERROR,
            call.toString(), "only count accepts *");
      }
      return;
    }
    if (call.getArgs().size() != 1) {
      throw new QueryExecutionException(ErrorMsg.AGGREGATION_ERROR,
          call.toString(), "expected exactly one argument");
    }
    if (call.getArgs().get(0).containsAggregate()) {
      throw new QueryExecutionException(ErrorMsg.AGGREGATION_ERROR,
          call.toString(), "aggregates cannot be nested");
    }
  }

  private static void sort(final List<OrderItem> orderBy, List<OutputRow> output)
      throws QueryExecutionException {
    if (orderBy.isEmpty()) {
      return;
    }
    try {
      Collections.sort(output, new Comparator<OutputRow>() {
        public int compare(OutputRow r1, OutputRow r2) {
          for (int i = 0; i < orderBy.size(); i++) {
            Object a = r1.sortKeys[i];
            Object b = r2.sortKeys[i];
            int cmp;
            if (a == null || b == null) {
              // nulls last in both directions
              cmp = a == null ? (b == null ? 0 : 1) : -1;
            } else {
              try {
                cmp = ExpressionEvaluator.compare(a, b,
                    orderBy.get(i).getExpression());
              } catch (QueryExecutionException e) {
                throw new SortFailure(e);
              }
              if (!orderBy.get(i).isAscending()) {
                cmp = -cmp;
              }
            }
            if (cmp != 0) {
              return cmp;
            }
          }
          return 0;
        }
      });
    } catch (SortFailure e) {
      throw e.failure;
    }
  }

  private static QueryResult toResult(List<String> columnNames,
      List<OutputRow> output) {
    List<BatchField> fields = new ArrayList<BatchField>(columnNames.size());
    List<Object[]> columns = new ArrayList<Object[]>(columnNames.size());
    for (int c = 0; c < columnNames.size(); c++) {
      Object[] column = new Object[output.size()];
      ColumnType type = null;
      for (int r = 0; r < column.length; r++) {
        column[r] = output.get(r).values[c];
        if (type == null) {
          type = ColumnType.ofValue(column[r]);
        }
      }
      fields.add(new BatchField(columnNames.get(c),
          type == null ? ColumnType.STRING : type));
      columns.add(column);
    }
    RecordBatch batch = new RecordBatch(new BatchSchema(fields), columns);
    return new QueryResult(columnNames, Collections.singletonList(batch));
  }

  private static class OutputRow {
    final Object[] values;
    final Object[] sortKeys;

    OutputRow(Object[] values, Object[] sortKeys) {
      this.values = values;
      this.sortKeys = sortKeys;
    }
  }

  private static class SortFailure extends RuntimeException {
    private static final long serialVersionUID = 1L;
    final QueryExecutionException failure;

    SortFailure(QueryExecutionException failure) {
      super(failure);
      this.failure = failure;
    }
  }

  private static class Group {
    final RowAccessor first;
    final List<FunctionCall> calls;
    final List<Aggregator> aggregators;

    Group(RowAccessor first, List<FunctionCall> calls)
        throws QueryExecutionException {
      this.first = first;
      this.calls = calls;
      this.aggregators = new ArrayList<Aggregator>(calls.size());
      for (FunctionCall call : calls) {
        aggregators.add(createAggregator(call));
      }
    }

    void accumulate(RowAccessor row) throws QueryExecutionException {
      for (int i = 0; i < calls.size(); i++) {
        FunctionCall call = calls.get(i);
        if (call.isStar()) {
          aggregators.get(i).add(Boolean.TRUE);
        } else {
          aggregators.get(i).add(ExpressionEvaluator.evaluate(
              call.getArgs().get(0), row));
        }
      }
    }

    Map<FunctionCall, Object> results() {
      Map<FunctionCall, Object> results = new HashMap<FunctionCall, Object>();
      for (int i = 0; i < calls.size(); i++) {
        results.put(calls.get(i), aggregators.get(i).result());
      }
      return results;
    }
  }

  private static Aggregator createAggregator(FunctionCall call)
      throws QueryExecutionException {
    AggregateFunction function = AggregateFunction.fromCall(call);
    if (function == null) {
      throw new QueryExecutionException(ErrorMsg.AGGREGATION_ERROR,
          call.toString(), "unknown aggregate");
    }
    switch (function) {
    case SUM:
      return new SumAggregator(call);
    case AVG:
      return new AvgAggregator(call);
    case MIN:
      return new ExtremeAggregator(call, false);
    case MAX:
      return new ExtremeAggregator(call, true);
    case COUNT:
      return new CountAggregator();
    default:
      return new CountDistinctAggregator();
    }
  }

  /**
   * Accumulates the values of one aggregate call for one group. Nulls are
   * skipped.
   */
  private static interface Aggregator {
    void add(Object value) throws QueryExecutionException;

    Object result();
  }

  private static Number checkNumber(FunctionCall call, Object value)
      throws QueryExecutionException {
    if (!(value instanceof Number)) {
      throw new QueryExecutionException(ErrorMsg.TYPE_MISMATCH,
          call.toString(), "cannot aggregate non numeric value " + value);
    }
    return (Number) value;
  }

  private static class SumAggregator implements Aggregator {
    private final FunctionCall call;
    private long longSum;
    private double doubleSum;
    private boolean seen;
    private boolean floating;

    SumAggregator(FunctionCall call) {
      this.call = call;
    }

    public void add(Object value) throws QueryExecutionException {
      if (value == null) {
        return;
      }
      Number number = checkNumber(call, value);
      seen = true;
      if (ExpressionEvaluator.isIntegral(number)) {
        longSum += number.longValue();
      } else {
        floating = true;
        doubleSum += number.doubleValue();
      }
    }

    public Object result() {
      if (!seen) {
        return null;
      }
      if (floating) {
        return Double.valueOf(longSum + doubleSum);
      }
      return Long.valueOf(longSum);
    }
  }

  private static class AvgAggregator implements Aggregator {
    private final FunctionCall call;
    private double sum;
    private long count;

    AvgAggregator(FunctionCall call) {
      this.call = call;
    }

    public void add(Object value) throws QueryExecutionException {
      if (value == null) {
        return;
      }
      sum += checkNumber(call, value).doubleValue();
      count++;
    }

    public Object result() {
      return count == 0 ? null : Double.valueOf(sum / count);
    }
  }

  private static class ExtremeAggregator implements Aggregator {
    private final FunctionCall call;
    private final boolean max;
    private Object current;

    ExtremeAggregator(FunctionCall call, boolean max) {
      this.call = call;
      this.max = max;
    }

    public void add(Object value) throws QueryExecutionException {
      if (value == null) {
        return;
      }
      if (current == null) {
        current = value;
        return;
      }
      int cmp = ExpressionEvaluator.compare(value, current, call);
      if (max ? cmp > 0 : cmp < 0) {
        current = value;
      }
    }

    public Object result() {
      return current;
    }
  }

  private static class CountAggregator implements Aggregator {
    private long count;

    public void add(Object value) {
      if (value != null) {
        count++;
      }
    }

    public Object result() {
      return Long.valueOf(count);
    }
  }

  private static class CountDistinctAggregator implements Aggregator {
    private final Set<Object> seen = new HashSet<Object>();

    public void add(Object value) {
      if (value != null) {
        seen.add(value);
      }
    }

    public Object result() {
      return Long.valueOf(seen.size());
    }
  }
}
