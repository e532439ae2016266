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

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;

/**
 * Turns a {@link CubeQueryParser} parse tree into {@link Expression},
 * {@link SelectItem}, {@link OrderItem} and {@link ParsedQuery} objects.
 * Identifiers are folded to lower case. A minus sign directly in front of a
 * numeric literal is folded into the literal.
 */
class CubeQueryAstBuilder extends CubeQueryBaseVisitor<Object> {

  /**
   * Carries a {@link ParseException} out of the visitor methods, which cannot
   * declare checked exceptions.
   */
  static class ParseFailure extends RuntimeException {
    private static final long serialVersionUID = 1L;

    final ParseException failure;

    ParseFailure(ParseException failure) {
      super(failure.getMessage(), failure);
      this.failure = failure;
    }
  }

  private final String text;

  CubeQueryAstBuilder(String text) {
    this.text = text;
  }

  private Expression expr(ParserRuleContext ctx) {
    return (Expression) visit(ctx);
  }

  private List<Expression> exprs(List<? extends ParserRuleContext> contexts) {
    List<Expression> result = new ArrayList<Expression>(contexts.size());
    for (ParserRuleContext ctx : contexts) {
      result.add(expr(ctx));
    }
    return result;
  }

  private static Expression not(boolean negated, Expression expr) {
    return negated ? new UnaryOp(UnaryOp.Operator.NOT, expr) : expr;
  }

  @Override
  public Object visitSingleExpression(CubeQueryParser.SingleExpressionContext ctx) {
    return visit(ctx.expression());
  }

  @Override
  public Object visitSingleSelectItem(CubeQueryParser.SingleSelectItemContext ctx) {
    return visit(ctx.selectItem());
  }

  @Override
  public Object visitSingleOrderItem(CubeQueryParser.SingleOrderItemContext ctx) {
    return visit(ctx.orderItem());
  }

  @Override
  public Object visitSingleQuery(CubeQueryParser.SingleQueryContext ctx) {
    return visit(ctx.query());
  }

  @Override
  public Object visitQuery(CubeQueryParser.QueryContext ctx) {
    ParsedQuery query = new ParsedQuery();
    for (CubeQueryParser.SelectItemContext item : ctx.selectItem()) {
      query.getSelects().add((SelectItem) visit(item));
    }
    if (ctx.source != null) {
      query.setFrom((String) visit(ctx.source));
    }
    if (ctx.where != null) {
      query.setWhere(expr(ctx.where));
    }
    query.getGroupBy().addAll(exprs(ctx.groupBy));
    for (CubeQueryParser.OrderItemContext item : ctx.orderItem()) {
      query.getOrderBy().add((OrderItem) visit(item));
    }
    if (ctx.limit != null) {
      try {
        query.setLimit(Integer.valueOf(ctx.limit.getText()));
      } catch (NumberFormatException e) {
        throw new ParseFailure(new ParseException(text,
            ctx.limit.getStartIndex(), "Invalid limit " + ctx.limit.getText()));
      }
    }
    return query;
  }

  @Override
  public Object visitSelectItem(CubeQueryParser.SelectItemContext ctx) {
    String alias = null;
    if (ctx.identifier() != null) {
      alias = (String) visit(ctx.identifier());
    }
    return new SelectItem(expr(ctx.expression()), alias);
  }

  @Override
  public Object visitOrderItem(CubeQueryParser.OrderItemContext ctx) {
    boolean ascending = ctx.ordering == null
        || ctx.ordering.getType() == CubeQueryParser.ASC;
    return new OrderItem(expr(ctx.expression()), ascending);
  }

  @Override
  public Object visitExpression(CubeQueryParser.ExpressionContext ctx) {
    return visit(ctx.booleanExpression());
  }

  @Override
  public Object visitPredicated(CubeQueryParser.PredicatedContext ctx) {
    return visit(ctx.predicate());
  }

  @Override
  public Object visitLogicalNot(CubeQueryParser.LogicalNotContext ctx) {
    return new UnaryOp(UnaryOp.Operator.NOT, expr(ctx.booleanExpression()));
  }

  @Override
  public Object visitLogicalAnd(CubeQueryParser.LogicalAndContext ctx) {
    return new BinaryOp(BinaryOp.Operator.AND, expr(ctx.left), expr(ctx.right));
  }

  @Override
  public Object visitLogicalOr(CubeQueryParser.LogicalOrContext ctx) {
    return new BinaryOp(BinaryOp.Operator.OR, expr(ctx.left), expr(ctx.right));
  }

  @Override
  public Object visitComparison(CubeQueryParser.ComparisonContext ctx) {
    BinaryOp.Operator op;
    switch (ctx.comparisonOperator().getStart().getType()) {
    case CubeQueryParser.EQ:
      op = BinaryOp.Operator.EQ;
      break;
    case CubeQueryParser.NEQ:
      op = BinaryOp.Operator.NE;
      break;
    case CubeQueryParser.LT:
      op = BinaryOp.Operator.LT;
      break;
    case CubeQueryParser.LTE:
      op = BinaryOp.Operator.LE;
      break;
    case CubeQueryParser.GT:
      op = BinaryOp.Operator.GT;
      break;
    default:
      op = BinaryOp.Operator.GE;
      break;
    }
    return new BinaryOp(op, expr(ctx.left), expr(ctx.right));
  }

  @Override
  public Object visitNullPredicate(CubeQueryParser.NullPredicateContext ctx) {
    return new UnaryOp(ctx.NOT() != null ? UnaryOp.Operator.IS_NOT_NULL
        : UnaryOp.Operator.IS_NULL, expr(ctx.valueExpression()));
  }

  @Override
  public Object visitInList(CubeQueryParser.InListContext ctx) {
    List<Expression> args = new ArrayList<Expression>();
    args.add(expr(ctx.valueExpression()));
    args.addAll(exprs(ctx.expression()));
    return not(ctx.NOT() != null, new FunctionCall("in", args));
  }

  @Override
  public Object visitLike(CubeQueryParser.LikeContext ctx) {
    return not(ctx.NOT() != null, new BinaryOp(BinaryOp.Operator.LIKE,
        expr(ctx.value), expr(ctx.pattern)));
  }

  @Override
  public Object visitBetween(CubeQueryParser.BetweenContext ctx) {
    Expression value = expr(ctx.value);
    return not(ctx.NOT() != null, new BinaryOp(BinaryOp.Operator.AND,
        new BinaryOp(BinaryOp.Operator.GE, value, expr(ctx.lower)),
        new BinaryOp(BinaryOp.Operator.LE, value, expr(ctx.upper))));
  }

  @Override
  public Object visitPlainValue(CubeQueryParser.PlainValueContext ctx) {
    return visit(ctx.valueExpression());
  }

  @Override
  public Object visitValuePrimary(CubeQueryParser.ValuePrimaryContext ctx) {
    return visit(ctx.primaryExpression());
  }

  @Override
  public Object visitArithmeticUnary(CubeQueryParser.ArithmeticUnaryContext ctx) {
    if (ctx.operator.getType() == CubeQueryParser.PLUS) {
      return visit(ctx.valueExpression());
    }
    CubeQueryParser.PrimaryExpressionContext primary = null;
    if (ctx.valueExpression() instanceof CubeQueryParser.ValuePrimaryContext) {
      primary = ((CubeQueryParser.ValuePrimaryContext) ctx.valueExpression())
          .primaryExpression();
    }
    if (primary instanceof CubeQueryParser.IntegerLiteralContext) {
      return integer("-" + primary.getText(), primary.getStart());
    } else if (primary instanceof CubeQueryParser.DecimalLiteralContext) {
      return decimal("-" + primary.getText(), primary.getStart());
    }
    Expression operand = expr(ctx.valueExpression());
    if (operand instanceof Literal && ((Literal) operand).isNumeric()) {
      Object value = ((Literal) operand).getValue();
      if (value instanceof Long) {
        return Literal.of(Long.valueOf(-((Long) value).longValue()));
      }
      return Literal.of(Double.valueOf(-((Double) value).doubleValue()));
    }
    return new UnaryOp(UnaryOp.Operator.NEGATE, operand);
  }

  @Override
  public Object visitArithmeticMultiplicative(
      CubeQueryParser.ArithmeticMultiplicativeContext ctx) {
    BinaryOp.Operator op;
    switch (ctx.operator.getType()) {
    case CubeQueryParser.ASTERISK:
      op = BinaryOp.Operator.MULTIPLY;
      break;
    case CubeQueryParser.SLASH:
      op = BinaryOp.Operator.DIVIDE;
      break;
    default:
      op = BinaryOp.Operator.MOD;
      break;
    }
    return new BinaryOp(op, expr(ctx.left), expr(ctx.right));
  }

  @Override
  public Object visitArithmeticAdditive(
      CubeQueryParser.ArithmeticAdditiveContext ctx) {
    BinaryOp.Operator op = ctx.operator.getType() == CubeQueryParser.PLUS
        ? BinaryOp.Operator.PLUS : BinaryOp.Operator.MINUS;
    return new BinaryOp(op, expr(ctx.left), expr(ctx.right));
  }

  @Override
  public Object visitNullLiteral(CubeQueryParser.NullLiteralContext ctx) {
    return Literal.NULL;
  }

  @Override
  public Object visitBooleanLiteral(CubeQueryParser.BooleanLiteralContext ctx) {
    return ctx.TRUE() != null ? Literal.TRUE : Literal.FALSE;
  }

  @Override
  public Object visitIntegerLiteral(CubeQueryParser.IntegerLiteralContext ctx) {
    return integer(ctx.getText(), ctx.getStart());
  }

  @Override
  public Object visitDecimalLiteral(CubeQueryParser.DecimalLiteralContext ctx) {
    return decimal(ctx.getText(), ctx.getStart());
  }

  @Override
  public Object visitStringLiteral(CubeQueryParser.StringLiteralContext ctx) {
    String quoted = ctx.STRING().getText();
    return Literal.of(quoted.substring(1, quoted.length() - 1)
        .replace("''", "'"));
  }

  @Override
  public Object visitStarCall(CubeQueryParser.StarCallContext ctx) {
    return FunctionCall.star((String) visit(ctx.identifier()));
  }

  @Override
  public Object visitFunctionCall(CubeQueryParser.FunctionCallContext ctx) {
    return new FunctionCall((String) visit(ctx.identifier()),
        exprs(ctx.expression()), ctx.DISTINCT() != null);
  }

  @Override
  public Object visitColumnReference(
      CubeQueryParser.ColumnReferenceContext ctx) {
    return new ColumnRef((String) visit(ctx.identifier()));
  }

  @Override
  public Object visitParenthesized(CubeQueryParser.ParenthesizedContext ctx) {
    return visit(ctx.expression());
  }

  @Override
  public Object visitIdentifier(CubeQueryParser.IdentifierContext ctx) {
    String name = ctx.getText();
    if (ctx.QUOTED_IDENTIFIER() != null) {
      name = name.substring(1, name.length() - 1);
    }
    return name.toLowerCase();
  }

  private Literal integer(String number, Token token) {
    try {
      return Literal.of(Long.valueOf(number));
    } catch (NumberFormatException e) {
      // beyond the long range, fall back to double
      return decimal(number, token);
    }
  }

  private Literal decimal(String number, Token token) {
    try {
      return Literal.of(Double.valueOf(number));
    } catch (NumberFormatException e) {
      throw new ParseFailure(new ParseException(text, token.getStartIndex(),
          "Invalid number " + number));
    }
  }
}
