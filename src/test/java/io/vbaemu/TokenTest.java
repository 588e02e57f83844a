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

import io.vbaemu.runtime.Position;
import org.junit.jupiter.api.Test;

import static io.vbaemu.TokenType.*;
import static org.junit.jupiter.api.Assertions.*;

class TokenTest {

  private static Token token(String text, TokenType type, int start) {
    String content = "0123456789" + text;
    return new Token(text, type, Position.fromIndices("t", content, start, start + text.length(), 1, start + 1));
  }

  @Test public void equalityIgnoresCaseAndPosition() {
    Token a = token("Dim", KEYWORD, 0);
    Token b = token("DIM", KEYWORD, 5);
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, token("Dim", IDENTIFIER, 0));
    assertNotEquals(a, token("Din", KEYWORD, 0));
    assertNotEquals(a, "Dim");
  }

  @Test public void matching() {
    Token token = token("Then", KEYWORD, 0);
    assertTrue(token.is(KEYWORD));
    assertTrue(token.is(IDENTIFIER, KEYWORD));
    assertFalse(token.is(IDENTIFIER));
    assertTrue(token.isNot(IDENTIFIER, OPERATOR));
    assertTrue(token.textIs("if", "then"));
    assertFalse(token.textIs("else"));
    assertTrue(token.is(KEYWORD, "then"));
    assertTrue(token.is(KEYWORD, "else", "THEN"));
    assertFalse(token.is(IDENTIFIER, "then"));
    assertEquals("then", token.lowerCase());
    assertFalse(token.isEmpty());
  }

  @Test public void withType() {
    Token token = token("and", IDENTIFIER, 0);
    assertSame(token, token.withType(IDENTIFIER));
    Token operator = token.withType(OPERATOR);
    assertEquals(OPERATOR, operator.getType());
    assertEquals("and", operator.getText());
    assertSame(token.getPosition(), operator.getPosition());
  }

  @Test public void concatAdjacent() {
    String   content = "Mid$ x";
    Token    mid     = new Token("Mid", IDENTIFIER, Position.fromIndices("t", content, 0, 3, 1, 1));
    Token    dollar  = new Token("$", SYMBOL, Position.fromIndices("t", content, 3, 4, 1, 4));
    Token    x       = new Token("x", IDENTIFIER, Position.fromIndices("t", content, 5, 6, 1, 6));
    Token    joined  = mid.concat(dollar);
    assertEquals("Mid$", joined.getText());
    assertEquals(IDENTIFIER, joined.getType());
    assertEquals(0, joined.getPosition().getStartIndex());
    assertEquals(4, joined.getPosition().getEndIndex());
    assertEquals(5, joined.getPosition().getEndColumn());
    assertThrows(IllegalArgumentException.class, () -> mid.concat(x));

    Token elsewhere = new Token("$", SYMBOL, Position.fromIndices("u", content, 3, 4, 1, 4));
    assertThrows(IllegalArgumentException.class, () -> mid.concat(elsewhere));
  }

  @Test public void tokenTypes() {
    assertTrue(IDENTIFIER.isFirstPass());
    assertTrue(SYMBOL.isFirstPass());
    assertFalse(KEYWORD.isFirstPass());
    assertFalse(OPERATOR.isFirstPass());
    assertTrue(END_OF_STATEMENT.isTerminator());
    assertTrue(END_OF_FILE.isTerminator());
    assertFalse(COMMENT.isTerminator());
    assertTrue(STRING.isLiteral());
    assertTrue(BOOLEAN.isLiteral());
    assertTrue(OBJECT.isLiteral());
    assertFalse(IDENTIFIER.isLiteral());
  }
}
