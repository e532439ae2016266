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

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

/**
 * Parses field expressions, select and order items and whole textual queries
 * with the generated {@link CubeQueryParser}. Identifiers are folded to lower
 * case, keywords are case-insensitive and reserved.
 *
 * Precedence, loosest first: OR, AND, NOT, comparison (including IS NULL, IN,
 * LIKE and BETWEEN), additive, multiplicative, unary minus.
 */
public final class ExprParser {

  private ExprParser() {
  }

  private abstract static class Entry {
    abstract ParserRuleContext enter(CubeQueryParser parser);
  }

  /**
   * Reports the first lexer or parser error as a {@link ParseException}.
   */
  private static class ErrorListener extends BaseErrorListener {
    private final String text;

    ErrorListener(String text) {
      this.text = text;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
        int line, int charPositionInLine, String msg, RecognitionException e) {
      int position;
      String message = msg;
      if (offendingSymbol instanceof Token) {
        Token token = (Token) offendingSymbol;
        if (token.getType() == Token.EOF) {
          position = text.length();
          message = "Unexpected end of input";
        } else {
          position = token.getStartIndex();
        }
      } else {
        position = offset(line, charPositionInLine);
      }
      throw new CubeQueryAstBuilder.ParseFailure(new ParseException(text,
          position, message));
    }

    private int offset(int line, int charPositionInLine) {
      int offset = 0;
      for (int i = 1; i < line; i++) {
        offset = text.indexOf('\n', offset) + 1;
      }
      return offset + charPositionInLine;
    }
  }

  public static Expression parseExpression(String text) throws ParseException {
    return (Expression) parse(text, new Entry() {
      @Override
      ParserRuleContext enter(CubeQueryParser parser) {
        return parser.singleExpression();
      }
    });
  }

  /**
   * Parses {@code expr [[AS] alias]}.
   */
  public static SelectItem parseSelectItem(String text) throws ParseException {
    return (SelectItem) parse(text, new Entry() {
      @Override
      ParserRuleContext enter(CubeQueryParser parser) {
        return parser.singleSelectItem();
      }
    });
  }

  /**
   * Parses {@code expr [ASC|DESC]}.
   */
  public static OrderItem parseOrderItem(String text) throws ParseException {
    return (OrderItem) parse(text, new Entry() {
      @Override
      ParserRuleContext enter(CubeQueryParser parser) {
        return parser.singleOrderItem();
      }
    });
  }

  public static ParsedQuery parseQuery(String text) throws ParseException {
    return (ParsedQuery) parse(text, new Entry() {
      @Override
      ParserRuleContext enter(CubeQueryParser parser) {
        return parser.singleQuery();
      }
    });
  }

  private static Object parse(String text, Entry entry) throws ParseException {
    if (text == null) {
      throw new ParseException("", 0, "Missing expression");
    }
    ErrorListener errors = new ErrorListener(text);
    CubeQueryLexer lexer = new CubeQueryLexer(CharStreams.fromString(text));
    lexer.removeErrorListeners();
    lexer.addErrorListener(errors);
    CubeQueryParser parser = new CubeQueryParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(errors);
    try {
      return new CubeQueryAstBuilder(text).visit(entry.enter(parser));
    } catch (CubeQueryAstBuilder.ParseFailure e) {
      throw e.failure;
    }
  }
}
