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

import org.junit.jupiter.api.Test;

import java.util.List;

import static io.vbaemu.TokenType.*;
import static org.junit.jupiter.api.Assertions.*;

class EmuTest {

  @Test public void tokenise() {
    List<Token> tokens = Emu.tokenise("a = 1", "m");
    assertEquals(6, tokens.size());
    assertEquals(IDENTIFIER, tokens.get(0).getType());
    assertEquals(END_OF_FILE, tokens.get(5).getType());
    assertEquals("m", tokens.get(0).getPosition().getFileName());
  }

  @Test public void streamNames() {
    assertEquals("900150983cd24fb0d6963f7d28e17f72", Emu.tokenise("abc", null).get(0).getPosition().getFileName());
    EmuContext context = EmuContext.create().defaultStreamName("default").build();
    assertEquals("default", Emu.tokenise("abc", null, context).get(0).getPosition().getFileName());
    assertEquals("default", Emu.tokenise("abc", "", context).get(0).getPosition().getFileName());
    assertEquals("given", Emu.tokenise("abc", "given", context).get(0).getPosition().getFileName());
  }

  @Test public void parseModule() {
    Stmt.Block block = Emu.parse("Sub Main()\n  x = 1\nEnd Sub\n", "Module1");
    assertEquals("(block (sub Main (params) (block (let x 1))))", AstDumper.dump(block));
    assertEquals("Module1", block.getPosition().getFileName());
    assertEquals(1, block.stmts.size());
  }

  @Test public void parseExpression() {
    assertEquals("(+ a (* b 2))", AstDumper.dump(Emu.parseExpression("a + b * 2")));
    assertEquals("(+ a b)", Emu.parseExpression("a + b").toString());
    assertNull(Emu.parseExpression(""));
  }

  @Test public void parseByRule() {
    EmuContext   context = EmuContext.create().build();
    Expr.Literal literal = (Expr.Literal)Emu.parse("integer", "&hFF&", "n", context);
    assertEquals(VbaType.LONG, literal.type);
    assertEquals(255, literal.value);
    assertEquals("(let x 1)", AstDumper.dump((Stmt)Emu.parse("statement", "x = 1", "n", context)));
    assertThrows(ParserError.class, () -> Emu.parse("unknown", "x", "n", context));
  }

  @Test public void debugContext() {
    EmuContext context = EmuContext.create().debug(2).build();
    assertTrue(context.isDebug());
    assertEquals("(block (call foo 1))", AstDumper.dump(Emu.parse("foo 1", "dbg", context)));
    assertEquals(3, Emu.tokenise("a b", "dbg", context).size() - 1);
    assertFalse(EmuContext.create().build().isDebug());
  }

  @Test public void typeSuffixSetting() {
    EmuContext context = EmuContext.create().typeSuffixes(false).build();
    ParserError error = assertThrows(ParserError.class, () -> Emu.parse("x$ = 1", "m", context));
    assertEquals("m:1:2: Expected argument but got '$'", error.getSingleLineMessage());
    assertEquals("(block (let x$ 1))", AstDumper.dump(Emu.parse("x$ = 1", "m")));
  }

  @Test public void invalidContext() {
    assertThrows(IllegalArgumentException.class, () -> EmuContext.create().debug(-1).build());
  }

  @Test public void errors() {
    ParserError parserError = assertThrows(ParserError.class, () -> Emu.parse("x = ", "m"));
    assertEquals("m:1:5: Expected expression but got ''", parserError.getSingleLineMessage());
    LexerError lexerError = assertThrows(LexerError.class, () -> Emu.parse("x = {", "m"));
    assertEquals("m:1:5: Can't scan this line", lexerError.getSingleLineMessage());
    assertTrue(lexerError instanceof EmuError);
  }
}
