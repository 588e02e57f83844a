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

package io.vbaemu.runtime;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PositionTest {

  @Test public void singleLine() {
    Position position = Position.fromIndices("f", "abc def", 4, 7, 1, 5);
    assertEquals(1, position.getStartLine());
    assertEquals(1, position.getEndLine());
    assertEquals(5, position.getStartColumn());
    assertEquals(8, position.getEndColumn());
    assertEquals("def", position.body());
    assertEquals("f:1:5:", position.header());
  }

  @Test public void spanningLines() {
    String content = "ab\r\ncd\ne";
    Position position = Position.fromIndices("f", content, 0, 8, 1, 1);
    assertEquals(3, position.getEndLine());
    assertEquals(2, position.getEndColumn());

    Position crlf = Position.fromIndices("f", content, 2, 4, 1, 3);
    assertEquals(2, crlf.getEndLine());
    assertEquals(1, crlf.getEndColumn());

    Position separator = Position.fromIndices("f", "a\u2028b", 0, 3, 1, 1);
    assertEquals(2, separator.getEndLine());
    assertEquals(2, separator.getEndColumn());
  }

  @Test public void lineTerminators() {
    assertTrue(Position.isLineTerminator('\r'));
    assertTrue(Position.isLineTerminator('\n'));
    assertTrue(Position.isLineTerminator('\u2028'));
    assertTrue(Position.isLineTerminator('\u2029'));
    assertFalse(Position.isLineTerminator(' '));
    assertFalse(Position.isLineTerminator(':'));
  }

  @Test public void merge() {
    String   content = "x = a + b\ny";
    Position a       = Position.fromIndices("f", content, 4, 5, 1, 5);
    Position b       = Position.fromIndices("f", content, 8, 9, 1, 9);
    Position y       = Position.fromIndices("f", content, 10, 11, 2, 1);
    Position merged  = a.merge(b);
    assertEquals(merged, b.merge(a));
    assertEquals(4, merged.getStartIndex());
    assertEquals(9, merged.getEndIndex());
    assertEquals(5, merged.getStartColumn());
    assertEquals(10, merged.getEndColumn());
    assertEquals("a + b", merged.body());

    Position all = Position.merge(null, y, a, null);
    assertEquals(1, all.getStartLine());
    assertEquals(2, all.getEndLine());
    assertEquals(2, all.getEndColumn());
    assertNull(Position.merge(null, null));
    assertNull(Position.merge());

    Position other = Position.fromIndices("g", content, 0, 1, 1, 1);
    assertThrows(IllegalArgumentException.class, () -> a.merge(other));
  }

  @Test public void invalidIndices() {
    assertThrows(IllegalArgumentException.class, () -> new Position("f", "abc", 2, 1, 1, 1, 3, 2));
  }

  @Test public void markedSourceLine() {
    String content = "first\nx = foo(1)\nlast";
    Position position = Position.fromIndices("f", content, 10, 13, 2, 5);
    assertEquals("x = foo(1)", position.getLines());
    assertEquals("x = foo(1)\n    ^~~", position.getMarkedSourceLine());

    Position empty = Position.fromIndices("f", content, 16, 16, 2, 11);
    assertEquals("x = foo(1)\n          ^", empty.getMarkedSourceLine());

    Position spanning = Position.fromIndices("f", content, 3, 8, 1, 4);
    assertEquals("first\nx = foo(1)", spanning.getLines());
    assertEquals("first\nx = foo(1)\n   ^~", spanning.getMarkedSourceLine());
  }

  @Test public void equality() {
    Position p1 = Position.fromIndices("f", "abc", 0, 2, 1, 1);
    Position p2 = new Position("f", "other content", 0, 2, 1, 1, 1, 3);
    assertEquals(p1, p2);
    assertEquals(p1.hashCode(), p2.hashCode());
    assertNotEquals(p1, Position.fromIndices("f", "abc", 0, 3, 1, 1));
    assertNotEquals(p1, Position.fromIndices("g", "abc", 0, 2, 1, 1));
  }
}
