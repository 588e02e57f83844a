/*
 * Copyright © 2022,2023 James Crawford
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package io.vbaemu;

import java.util.Arrays;

/**
 * Operators of the expression grammar with their binding strength (lower
 * binds more weakly). The grammar uses the same symbol for several operators
 * ('-' for negation and subtraction, '(' for grouping and for call/index)
 * so the Parser picks the operator from the symbol and whether an operand
 * precedes it. A '.' or '!' with no operand before it is a With-block member
 * and is handled by the Parser directly.
 */
public enum OperatorType {
  //= Virtual operators used while parsing
  CLOSE_PAREN(-2, false),
  INDEX_CLOSE(-1, false),

  //= Argument lists
  COMMA(0, false, ","),
  NAMED_ARGUMENT(0, true, ":="),

  //= Logical
  IMP(1, false, "imp"),
  EQV(2, false, "eqv"),
  XOR(3, false, "xor"),
  OR(4, false, "or"),
  AND(5, false, "and"),
  NOT(6, true, "not"),

  //= Comparison
  IS(7, false, "is"),
  LIKE(7, false, "like"),
  GREATER_EQUAL(7, false, ">=", "=>"),
  GREATER(7, false, ">"),
  LESS(7, false, "<"),
  LESS_EQUAL(7, false, "<=", "=<"),
  EQUAL(7, false, "="),
  NOT_EQUAL(7, false, "<>", "><"),

  //= Arithmetic
  CONCAT(8, false, "&"),
  ADD(9, false, "+"),
  SUBTRACT(9, false, "-"),
  MOD(10, false, "mod"),
  INT_DIVIDE(11, false, "\\"),
  MULTIPLY(12, false, "*"),
  DIVIDE(12, false, "/"),
  NEGATE(13, true, "-"),
  POWER(14, false, "^"),

  //= Access and grouping
  MEMBER(15, false, "."),
  DICT(15, false, "!"),
  GROUP(15, true, "("),
  INDEX(15, false, "(");

  public final int      precedence;
  public final boolean  isUnary;
  private final String[] symbols;

  OperatorType(int precedence, boolean isUnary, String... symbols) {
    this.precedence = precedence;
    this.isUnary    = isUnary;
    this.symbols    = symbols;
  }

  public boolean is(OperatorType... types) {
    for (OperatorType type: types) {
      if (this == type) {
        return true;
      }
    }
    return false;
  }

  /**
   * Markers left on the operator stack by '(' until the matching ')'
   */
  public boolean isParen() {
    return this == GROUP || this == INDEX;
  }

  public boolean isAccess() {
    return this == MEMBER || this == DICT;
  }

  /**
   * Canonical text of the operator
   */
  public String symbol() {
    return symbols.length == 0 ? ")" : symbols[0];
  }

  /**
   * Find operator for given token
   * @param token    the token
   * @param unary    true if no operand precedes the token
   * @return the operator or null if token is not an operator in that position
   */
  public static OperatorType of(Token token, boolean unary) {
    if (token.isNot(TokenType.OPERATOR, TokenType.KEYWORD, TokenType.SYMBOL)) {
      return null;
    }
    return Arrays.stream(values())
                 .filter(type -> type.isUnary == unary)
                 .filter(type -> token.textIs(type.symbols))
                 .findFirst()
                 .orElse(null);
  }

  @Override
  public String toString() {
    return symbol();
  }
}
