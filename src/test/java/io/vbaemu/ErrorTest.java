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
import java.util.function.BiConsumer;

import static org.junit.jupiter.api.Assertions.*;

class ErrorTest {

  private static void parse(String rule, String source) {
    new Parser(new Tokeniser(source, "test")).parse(rule);
  }

  /**
   * Check that parsing fails with the given single line message ("test:line:column: error")
   */
  private static void error(String rule, String source, String expected) {
    ParserError error = assertThrows(ParserError.class, () -> parse(rule, source), source);
    assertEquals(expected, error.getSingleLineMessage(), source);
  }

  @Test public void expressionErrors() {
    BiConsumer<String,String> doTest = (source,expected) -> error("expression", source, expected);
    doTest.accept("(a", "test:1:1: Unbalanced parenthesis");
    doTest.accept("f(a, (b)", "test:1:2: Unbalanced parenthesis");
    doTest.accept("(a + (b)", "test:1:1: Unbalanced parenthesis");
    doTest.accept("a +", "test:1:1: Expected expression but got ''");
    doTest.accept("a + b *", "test:1:5: Expected expression but got ''");
    doTest.accept("()", "test:1:2: Expected expression but got ')'");
    doTest.accept("-", "test:1:2: Expected expression but got ''");
    doTest.accept("a + ,", "test:1:1: Expected expression but got ','");
    doTest.accept("(a, b)", "test:1:2: Unexpected argument list");
    doTest.accept("(x:=1)", "test:1:3: Unexpected ':='");
    doTest.accept("f(1 := 2)", "test:1:5: Unexpected ':='");
    doTest.accept("f(a b)", "test:1:5: Expected operator or ')' but got 'b'");
    doTest.accept("f(a, x:=1 + y:=2)", "test:1:14: Unexpected ':='");
    doTest.accept("a.1", "test:1:3: Expected member name but got '1'");
    doTest.accept("a. ", "test:1:4: Expected member name but got ''");
    doTest.accept("f(a, b) + (c, d)", "test:1:12: Unexpected argument list");
  }

  @Test public void lExpressionErrors() {
    error("l_expression", "1 + 2", "test:1:1: Expected name, member access or index expression");
    error("l_expression", "(a)", "test:1:1: Expected name, member access or index expression");
    error("l_expression", "", "test:1:1: Expected expression");
    error("statement", "(a) = 1", "test:1:1: Expected name, member access or index expression");
    error("statement", "1.5 = 2", "test:1:1: Expected name, member access or index expression");
    error("statement", "Set 1 = a", "test:1:5: Expected name, member access or index expression");
  }

  @Test public void statementErrors() {
    BiConsumer<String,String> doTest = (source,expected) -> error("module", source, expected);
    doTest.accept("x = 1 2", "test:1:7: Expected end of statement but got '2'");
    doTest.accept("x = ", "test:1:5: Expected expression but got ''");
    doTest.accept("Next", "test:1:1: Expected statement but got 'Next'");
    doTest.accept("a + b", "test:1:1: Expected procedure call or assignment");
    doTest.accept("Call 1", "test:1:6: Expected procedure name");
    doTest.accept("foo a b", "test:1:7: Expected end of statement but got 'b'");
    doTest.accept("Mid(s) = t", "test:1:5: Expected 2 or 3 arguments for Mid assignment");
    doTest.accept("Mid$(s, 1, 2, 3) = t", "test:1:6: Expected 2 or 3 arguments for Mid$ assignment");
    doTest.accept("Private Dim x", "test:1:9: Unexpected 'Dim'");
    doTest.accept("Public Static x", "test:1:8: Unexpected 'Static'");
    doTest.accept("Friend x", "test:1:8: Expected declaration");
    doTest.accept("Dim 1", "test:1:5: Expected variable name but got '1'");
    doTest.accept("Dim s As String * ", "test:1:19: Expected string length");
    doTest.accept("Dim x As", "test:1:9: Expected type name");
    doTest.accept("Const a", "test:1:8: Expected '=' but got ''");
    doTest.accept("ReDim a", "test:1:7: Expected array bounds");
    doTest.accept("On Error Resume", "test:1:16: Expected 'next' but got ''");
    doTest.accept("On Error Foo", "test:1:10: Expected 'goto' but got 'Foo'");
    doTest.accept("GoTo", "test:1:5: Expected label");
    doTest.accept("Exit Foo", "test:1:6: Expected 'sub' or 'function' or 'property' or 'for' or 'do' but got 'Foo'");
    doTest.accept("End If", "test:1:5: Expected end of statement but got 'If'");
    doTest.accept("Option Explicit\nEnd Sub", "test:2:5: Expected end of statement but got 'Sub'");
  }

  @Test public void blockErrors() {
    BiConsumer<String,String> doTest = (source,expected) -> error("module", source, expected);
    doTest.accept("If a Then\n  b = 1\n", "test:1:1: Expected 'elseif' or 'else' or 'end if' or 'endif' before end of file");
    doTest.accept("If a Then\nElse\n", "test:1:1: Expected 'end if' or 'endif' before end of file");
    doTest.accept("If a\n", "test:1:5: Expected 'then' but got '\n'");
    doTest.accept("For i = 1 To 3\n", "test:1:1: Expected 'next' before end of file");
    doTest.accept("For i = 1\nNext", "test:1:10: Expected 'to' but got '\n'");
    doTest.accept("For Each x c\nNext", "test:1:12: Expected 'in' but got 'c'");
    doTest.accept("While x\n", "test:1:1: Expected 'wend' before end of file");
    doTest.accept("Do\n  x\n", "test:1:1: Expected 'loop' before end of file");
    doTest.accept("With o\n", "test:1:1: Expected 'end with' before end of file");
    doTest.accept("Sub Foo()\n  x = 1\n", "test:1:1: Expected 'end sub' before end of file");
    doTest.accept("Function F()\nEnd Sub", "test:2:5: Expected end of statement but got 'Sub'");
    doTest.accept("Sub Foo() x", "test:1:11: Expected end of line but got 'x'");
    doTest.accept("Sub 1()\nEnd Sub", "test:1:5: Expected procedure name");
    doTest.accept("Property Foo()\nEnd Property", "test:1:10: Expected 'get' or 'let' or 'set' but got 'Foo'");
    doTest.accept("If a Then b 1 2", "test:1:15: Expected end of statement but got '2'");
  }

  @Test public void errorMessageShowsSource() {
    ParserError error = assertThrows(ParserError.class, () -> parse("module", "x = 1\ny = (2 + 3\nz = 4"));
    assertEquals("test:2:5: Unbalanced parenthesis\ny = (2 + 3\n    ^\n", error.getMessage());
    assertEquals(2, error.getPosition().getStartLine());
    assertEquals("Unbalanced parenthesis", error.getErrorMessage());
  }

  @Test public void unknownRule() {
    ParserError error = assertThrows(ParserError.class, () -> parse("no_such_rule", "x"));
    assertEquals("Unknown grammar rule 'no_such_rule' @ unknown location", error.getMessage());
    assertNull(error.getPosition());
  }

  @Test public void ruleNames() {
    Parser parser = new Parser(new Tokeniser("", "test"));
    assertTrue(parser.ruleNames().containsAll(List.of("expression", "l_expression", "primary", "literal", "integer",
                                                      "float", "string", "statement", "statement_block", "module")));
    assertThrows(UnsupportedOperationException.class, () -> parser.ruleNames().add("x"));
  }

  @Test public void lexerErrorsPassThrough() {
    LexerError error = assertThrows(LexerError.class, () -> parse("module", "x = 1\ny = {"));
    assertEquals("test:2:5: Can't scan this line", error.getSingleLineMessage());
  }

  @Test public void otherErrorsAreWrapped() {
    Tokeniser failing = new Tokeniser("x + y", "test") {
      int pops = 0;
      @Override public Token pop() {
        if (++pops == 2) {
          throw new IllegalStateException("boom");
        }
        return super.pop();
      }
    };
    ParserError error = assertThrows(ParserError.class, () -> new Parser(failing).parse("expression"));
    assertEquals("test:1:1: Error parsing expression: boom (IllegalStateException)", error.getSingleLineMessage());
    assertTrue(error.getCause() instanceof IllegalStateException);
  }
}
