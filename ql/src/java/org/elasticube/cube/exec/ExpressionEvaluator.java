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

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Calendar;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.TimeZone;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

import org.elasticube.cube.ErrorMsg;
import org.elasticube.cube.parse.BinaryOp;
import org.elasticube.cube.parse.ColumnRef;
import org.elasticube.cube.parse.Expression;
import org.elasticube.cube.parse.FunctionCall;
import org.elasticube.cube.parse.Literal;
import org.elasticube.cube.parse.UnaryOp;

/**
 * Evaluates expressions against one row, with SQL null semantics: any null
 * operand of an arithmetic or comparison operator gives null, AND and OR are
 * three valued. Integral arithmetic stays integral except for division,
 * which always gives a double. Division or modulo by zero gives null.
 *
 * Date parts are computed in UTC.
 */
public final class ExpressionEvaluator {
  private static final Map<String, Pattern> LIKE_PATTERNS =
      new ConcurrentHashMap<String, Pattern>();
  private static final TimeZone UTC = TimeZone.getTimeZone("UTC");

  private ExpressionEvaluator() {
  }

  public static Object evaluate(Expression expr, RowAccessor row)
      throws QueryExecutionException {
    return evaluate(expr, row, null);
  }

  /**
   * @param aggregates values of the aggregate calls of the current group,
   * null when evaluating outside of any group
   */
  public static Object evaluate(Expression expr, RowAccessor row,
      Map<FunctionCall, Object> aggregates) throws QueryExecutionException {
    if (expr instanceof Literal) {
      return ((Literal) expr).getValue();
    } else if (expr instanceof ColumnRef) {
      if (row == null) {
        throw new QueryExecutionException(ErrorMsg.INVALID_EXPRESSION,
            expr.toString(), "column used outside of a row context");
      }
      return row.getValue(((ColumnRef) expr).getName());
    } else if (expr instanceof FunctionCall) {
      FunctionCall call = (FunctionCall) expr;
      if (call.isAggregate()) {
        if (aggregates == null || !aggregates.containsKey(call)) {
          throw new QueryExecutionException(ErrorMsg.INVALID_EXPRESSION,
              call.toString(), "aggregate not allowed here");
        }
        return aggregates.get(call);
      }
      return evaluateFunction(call, row, aggregates);
    } else if (expr instanceof BinaryOp) {
      return evaluateBinary((BinaryOp) expr, row, aggregates);
    } else if (expr instanceof UnaryOp) {
      return evaluateUnary((UnaryOp) expr, row, aggregates);
    }
    throw new QueryExecutionException(ErrorMsg.INVALID_EXPRESSION,
        expr.toString(), "unsupported expression");
  }

  /**
   * Whether the predicate holds for the row. Null and false both reject the
   * row.
   */
  public static boolean test(Expression predicate, RowAccessor row)
      throws QueryExecutionException {
    Object value = evaluate(predicate, row);
    if (value == null) {
      return false;
    }
    if (!(value instanceof Boolean)) {
      throw new QueryExecutionException(ErrorMsg.TYPE_MISMATCH,
          predicate.toString(), "predicate is not boolean");
    }
    return ((Boolean) value).booleanValue();
  }

  private static Object evaluateUnary(UnaryOp op, RowAccessor row,
      Map<FunctionCall, Object> aggregates) throws QueryExecutionException {
    Object value = evaluate(op.getOperand(), row, aggregates);
    switch (op.getOperator()) {
    case IS_NULL:
      return Boolean.valueOf(value == null);
    case IS_NOT_NULL:
      return Boolean.valueOf(value != null);
    case NOT:
      if (value == null) {
        return null;
      }
      return Boolean.valueOf(!asBoolean(value, op));
    default:
      if (value == null) {
        return null;
      }
      Number number = asNumber(value, op);
      if (isIntegral(number)) {
        return Long.valueOf(-number.longValue());
      }
      return Double.valueOf(-number.doubleValue());
    }
  }

  private static Object evaluateBinary(BinaryOp op, RowAccessor row,
      Map<FunctionCall, Object> aggregates) throws QueryExecutionException {
    BinaryOp.Operator operator = op.getOperator();
    Object left = evaluate(op.getLeft(), row, aggregates);
    if (operator == BinaryOp.Operator.AND) {
      if (left != null && !asBoolean(left, op)) {
        return Boolean.FALSE;
      }
      Object right = evaluate(op.getRight(), row, aggregates);
      if (right != null && !asBoolean(right, op)) {
        return Boolean.FALSE;
      }
      return (left == null || right == null) ? null : Boolean.TRUE;
    }
    if (operator == BinaryOp.Operator.OR) {
      if (left != null && asBoolean(left, op)) {
        return Boolean.TRUE;
      }
      Object right = evaluate(op.getRight(), row, aggregates);
      if (right != null && asBoolean(right, op)) {
        return Boolean.TRUE;
      }
      return (left == null || right == null) ? null : Boolean.FALSE;
    }
    Object right = evaluate(op.getRight(), row, aggregates);
    if (left == null || right == null) {
      return null;
    }
    if (operator.isComparison()) {
      int cmp = compare(left, right, op);
      switch (operator) {
      case EQ:
        return Boolean.valueOf(cmp == 0);
      case NE:
        return Boolean.valueOf(cmp != 0);
      case LT:
        return Boolean.valueOf(cmp < 0);
      case LE:
        return Boolean.valueOf(cmp <= 0);
      case GT:
        return Boolean.valueOf(cmp > 0);
      default:
        return Boolean.valueOf(cmp >= 0);
      }
    }
    if (operator == BinaryOp.Operator.LIKE) {
      if (!(left instanceof String) || !(right instanceof String)) {
        throw new QueryExecutionException(ErrorMsg.TYPE_MISMATCH,
            op.toString(), "LIKE needs string operands");
      }
      return Boolean.valueOf(likePattern((String) right)
          .matcher((String) left).matches());
    }
    return arithmetic(operator, asNumber(left, op), asNumber(right, op));
  }

  private static Object arithmetic(BinaryOp.Operator operator, Number left,
      Number right) {
    boolean integral = isIntegral(left) && isIntegral(right);
    switch (operator) {
    case PLUS:
      return integral ? (Object) Long.valueOf(left.longValue() + right.longValue())
          : (Object) Double.valueOf(left.doubleValue() + right.doubleValue());
    case MINUS:
      return integral ? (Object) Long.valueOf(left.longValue() - right.longValue())
          : (Object) Double.valueOf(left.doubleValue() - right.doubleValue());
    case MULTIPLY:
      return integral ? (Object) Long.valueOf(left.longValue() * right.longValue())
          : (Object) Double.valueOf(left.doubleValue() * right.doubleValue());
    case DIVIDE:
      if (right.doubleValue() == 0) {
        return null;
      }
      return Double.valueOf(left.doubleValue() / right.doubleValue());
    default:
      if (right.doubleValue() == 0) {
        return null;
      }
      return integral ? (Object) Long.valueOf(left.longValue() % right.longValue())
          : (Object) Double.valueOf(left.doubleValue() % right.doubleValue());
    }
  }

  private static Object evaluateFunction(FunctionCall call, RowAccessor row,
      Map<FunctionCall, Object> aggregates) throws QueryExecutionException {
    String name = call.getName();
    List<Expression> args = call.getArgs();
    if (name.equals("coalesce")) {
      for (Expression arg : args) {
        Object value = evaluate(arg, row, aggregates);
        if (value != null) {
          return value;
        }
      }
      return null;
    }
    Object[] values = new Object[args.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = evaluate(args.get(i), row, aggregates);
    }
    if (name.equals("in")) {
      checkArity(call, 2, Integer.MAX_VALUE);
      if (values[0] == null) {
        return null;
      }
      boolean sawNull = false;
      for (int i = 1; i < values.length; i++) {
        if (values[i] == null) {
          sawNull = true;
        } else if (compare(values[0], values[i], call) == 0) {
          return Boolean.TRUE;
        }
      }
      return sawNull ? null : Boolean.FALSE;
    }
    if (name.equals("concat")) {
      StringBuilder builder = new StringBuilder();
      for (Object value : values) {
        if (value == null) {
          return null;
        }
        builder.append(value);
      }
      return builder.toString();
    }
    if (name.equals("abs")) {
      checkArity(call, 1, 1);
      if (values[0] == null) {
        return null;
      }
      Number number = asNumber(values[0], call);
      return isIntegral(number) ? (Object) Long.valueOf(Math.abs(number.longValue()))
          : (Object) Double.valueOf(Math.abs(number.doubleValue()));
    }
    if (name.equals("round")) {
      checkArity(call, 1, 2);
      if (values[0] == null) {
        return null;
      }
      Number number = asNumber(values[0], call);
      int scale = 0;
      if (values.length == 2 && values[1] != null) {
        scale = asNumber(values[1], call).intValue();
      }
      if (isIntegral(number)) {
        return Long.valueOf(number.longValue());
      }
      return Double.valueOf(new BigDecimal(number.doubleValue()).setScale(
          scale, RoundingMode.HALF_UP).doubleValue());
    }
    if (name.equals("upper") || name.equals("lower")) {
      checkArity(call, 1, 1);
      if (values[0] == null) {
        return null;
      }
      String str = asString(values[0], call);
      return name.equals("upper") ? str.toUpperCase() : str.toLowerCase();
    }
    if (name.equals("substr") || name.equals("substring")) {
      checkArity(call, 2, 3);
      for (Object value : values) {
        if (value == null) {
          return null;
        }
      }
      String str = asString(values[0], call);
      int start = asNumber(values[1], call).intValue();
      // 1 based, negative counts from the end
      int begin = start > 0 ? start - 1 : (start < 0 ? str.length() + start : 0);
      begin = Math.max(0, Math.min(begin, str.length()));
      int end = str.length();
      if (values.length == 3) {
        int len = asNumber(values[2], call).intValue();
        end = Math.min(str.length(), begin + Math.max(0, len));
      }
      return str.substring(begin, end);
    }
    if (name.equals("year") || name.equals("month") || name.equals("day")) {
      checkArity(call, 1, 1);
      if (values[0] == null) {
        return null;
      }
      if (!(values[0] instanceof Date)) {
        throw new QueryExecutionException(ErrorMsg.TYPE_MISMATCH,
            call.toString(), "expected a date, got " + values[0]);
      }
      Calendar calendar = Calendar.getInstance(UTC);
      calendar.setTime((Date) values[0]);
      if (name.equals("year")) {
        return Integer.valueOf(calendar.get(Calendar.YEAR));
      } else if (name.equals("month")) {
        return Integer.valueOf(calendar.get(Calendar.MONTH) + 1);
      }
      return Integer.valueOf(calendar.get(Calendar.DAY_OF_MONTH));
    }
    throw new QueryExecutionException(ErrorMsg.INVALID_EXPRESSION,
        call.toString(), "unknown function " + name);
  }

  private static void checkArity(FunctionCall call, int min, int max)
      throws QueryExecutionException {
    int count = call.getArgs().size();
    if (count < min || count > max) {
      throw new QueryExecutionException(ErrorMsg.INVALID_EXPRESSION,
          call.toString(), "wrong number of arguments");
    }
  }

  /**
   * Orders two non null values of compatible types. Numbers of any width
   * compare with each other.
   */
  public static int compare(Object left, Object right, Expression context)
      throws QueryExecutionException {
    if (left instanceof Number && right instanceof Number) {
      Number l = (Number) left;
      Number r = (Number) right;
      if (isIntegral(l) && isIntegral(r)) {
        long a = l.longValue();
        long b = r.longValue();
        return a < b ? -1 : (a == b ? 0 : 1);
      }
      return Double.compare(l.doubleValue(), r.doubleValue());
    }
    if (left instanceof String && right instanceof String) {
      return ((String) left).compareTo((String) right);
    }
    if (left instanceof Boolean && right instanceof Boolean) {
      return ((Boolean) left).compareTo((Boolean) right);
    }
    if (left instanceof Date && right instanceof Date) {
      long a = ((Date) left).getTime();
      long b = ((Date) right).getTime();
      return a < b ? -1 : (a == b ? 0 : 1);
    }
    throw new QueryExecutionException(ErrorMsg.TYPE_MISMATCH,
        String.valueOf(context), "cannot compare " + describe(left) + " with "
            + describe(right));
  }

  public static boolean isIntegral(Number number) {
    return number instanceof Long || number instanceof Integer
        || number instanceof Short || number instanceof Byte;
  }

  private static Number asNumber(Object value, Expression context)
      throws QueryExecutionException {
    if (!(value instanceof Number)) {
      throw new QueryExecutionException(ErrorMsg.TYPE_MISMATCH,
          context.toString(), "expected a number, got " + describe(value));
    }
    return (Number) value;
  }

  private static boolean asBoolean(Object value, Expression context)
      throws QueryExecutionException {
    if (!(value instanceof Boolean)) {
      throw new QueryExecutionException(ErrorMsg.TYPE_MISMATCH,
          context.toString(), "expected a boolean, got " + describe(value));
    }
    return ((Boolean) value).booleanValue();
  }

  private static String asString(Object value, Expression context)
      throws QueryExecutionException {
    if (!(value instanceof String)) {
      throw new QueryExecutionException(ErrorMsg.TYPE_MISMATCH,
          context.toString(), "expected a string, got " + describe(value));
    }
    return (String) value;
  }

  private static String describe(Object value) {
    return value + " (" + value.getClass().getSimpleName() + ")";
  }

  private static Pattern likePattern(String like) {
    Pattern pattern = LIKE_PATTERNS.get(like);
    if (pattern == null) {
      StringBuilder regex = new StringBuilder();
      StringBuilder literal = new StringBuilder();
      for (char c : like.toCharArray()) {
        if (c == '%' || c == '_') {
          if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
          }
          regex.append(c == '%' ? ".*" : ".");
        } else {
          literal.append(c);
        }
      }
      if (literal.length() > 0) {
        regex.append(Pattern.quote(literal.toString()));
      }
      pattern = Pattern.compile(regex.toString(), Pattern.DOTALL);
      LIKE_PATTERNS.put(like, pattern);
    }
    return pattern;
  }
}
