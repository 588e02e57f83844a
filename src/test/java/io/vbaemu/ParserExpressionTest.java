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

import static io.vbaemu.TokenType.*;
import static org.junit.jupiter.api.Assertions.*;

class ParserExpressionTest {

  private static Expr expression(String source) {
    return new Parser(new Tokeniser(source, "test")).parseExpression();
  }

  private static String dump(String source) {
    return AstDumper.dump(expression(source));
  }

  @Test public void arithmetic() {
    BiConsumer<String,String> doTest = (source,expected) -> assertEquals(expected, dump(source), source);
    doTest.accept("a", "a");
    doTest.accept("a + b", "(+ a b)");
    doTest.accept("a + b + c", "(+ a b c)");
    doTest.accept("a + b - c", "(- (+ a b) c)");
    doTest.accept("a - b + c", "(+ (- a b) c)");
    doTest.accept("a * b + c", "(+ (* a b) c)");
    doTest.accept("a + b * c", "(+ a (* b c))");
    doTest.accept("a * b * (c + ab) + -c", "(+ (* a b (paren (+ c ab))) (neg c))");
    doTest.accept("a / b * c", "(* (/ a b) c)");
    doTest.accept("a \\ b Mod c", "(mod (\\ a b) c)");
    doTest.accept("a Mod b * c", "(mod a (* b c))");
    doTest.accept("2 ^ 3 ^ 4", "(^ 2 3 4)");
    doTest.accept("a & b + c", "(& a (+ b c))");
    doTest.accept("a & b & c", "(& a b c)");
  }

  @Test public void unaryOperators() {
    BiConsumer<String,String> doTest = (source,expected) -> assertEquals(expected, dump(source), source);
    doTest.accept("-a", "(neg a)");
    doTest.accept("--c", "(neg neg c)");
    doTest.accept("- - c", "(neg neg c)");
    doTest.accept("- a ^ b", "(neg (^ a b))");
    doTest.accept("- a * b", "(* (neg a) b)");
    doTest.accept("a * -b", "(* a (neg b))");
    doTest.accept("a ^ -b", "(^ a (neg b))");
    doTest.accept("-(a)", "(neg (paren a))");
    doTest.accept("Not a", "(not a)");
    doTest.accept("Not Not a", "(not not a)");
    doTest.accept("Not a And b", "(and (not a) b)");
    doTest.accept("Not a = b", "(not (= a b))");
    doTest.accept("-a = b", "(= (neg a) b)");
  }

  @Test public void comparisonAndLogical() {
    BiConsumer<String,String> doTest = (source,expected) -> assertEquals(expected, dump(source), source);
    doTest.accept("a = b", "(= a b)");
    doTest.accept("a <> b", "(<> a b)");
    doTest.accept("a >< b", "(<> a b)");
    doTest.accept("a => b", "(>= a b)");
    doTest.accept("a =< b", "(<= a b)");
    doTest.accept("a < b = c", "(= (< a b) c)");
    doTest.accept("a = b = c", "(= a b c)");
    doTest.accept("a + 1 > b * 2", "(> (+ a 1) (* b 2))");
    doTest.accept("a Or b And c", "(or a (and b c))");
    doTest.accept("a And b Or c", "(or (and a b) c)");
    doTest.accept("a Xor b Or c", "(xor a (or b c))");
    doTest.accept("a Imp b Eqv c", "(imp a (eqv b c))");
    doTest.accept("x Is Nothing", "(is x Nothing)");
    doTest.accept("s Like \"a*\"", "(like s \"a*\")");
    doTest.accept("a = 1 And b <> \"x\"", "(and (= a 1) (<> b \"x\"))");
  }

  @Test public void memberAccess() {
    BiConsumer<String,String> doTest = (source,expected) -> assertEquals(expected, dump(source), source);
    doTest.accept("a.b", "(. a b)");
    doTest.accept("a.b.c", "(. (. a b) c)");
    doTest.accept("a!d!b!eb", "(! (! (! a d) b) eb)");
    doTest.accept("a.b!c", "(! (. a b) c)");
    doTest.accept("a!b.c", "(. (! a b) c)");
    doTest.accept("Me.Caption", "(. Me Caption)");
    doTest.accept("a.Dim", "(. a Dim)");
    doTest.accept("a.b + c.d", "(+ (. a b) (. c d))");
    doTest.accept("-a.b", "(neg (. a b))");
    doTest.accept(".Name", "(with. Name)");
    doTest.accept("!key", "(with! key)");
    doTest.accept(".a.b", "(. (with. a) b)");
    doTest.accept(".Items(1).Value", "(. (index (with. Items) (args 1)) Value)");
    doTest.accept("x + .y", "(+ x (with. y))");
  }

  @Test public void callsAndIndexes() {
    BiConsumer<String,String> doTest = (source,expected) -> assertEquals(expected, dump(source), source);
    doTest.accept("f()", "(index f (args))");
    doTest.accept("f(1)", "(index f (args 1))");
    doTest.accept("f(a, b)", "(index f (args a b))");
    doTest.accept("f(a + 1, b * 2)", "(index f (args (+ a 1) (* b 2)))");
    doTest.accept("a(arg1, arg2).b", "(. (index a (args arg1 arg2)) b)");
    doTest.accept("a().b().c", "(. (index (. (index a (args)) b) (args)) c)");
    doTest.accept("a.b(1)", "(index (. a b) (args 1))");
    doTest.accept("a(1)(2)", "(index (index a (args 1)) (args 2))");
    doTest.accept("(a + b)(b)", "(index (paren (+ a b)) (args b))");
    doTest.accept("a(b(1), c)", "(index a (args (index b (args 1)) c))");
    doTest.accept("f((a))", "(index f (args (paren a)))");
    doTest.accept("f(a)!b", "(! (index f (args a)) b)");
    doTest.accept("Len(s) + 1", "(+ (index Len (args s)) 1)");
    doTest.accept("Mid$(s, 2)", "(index Mid$ (args s 2))");
    doTest.accept("-f(x) ^ 2", "(neg (^ (index f (args x)) 2))");
  }

  @Test public void missingAndNamedArguments() {
    BiConsumer<String,String> doTest = (source,expected) -> assertEquals(expected, dump(source), source);
    doTest.accept("f(, b)", "(index f (args _ b))");
    doTest.accept("f(a, )", "(index f (args a _))");
    doTest.accept("f(a,,b)", "(index f (args a _ b))");
    doTest.accept("f(,)", "(index f (args _ _))");
    doTest.accept("f(x:=1)", "(index f (args (:= x 1)))");
    doTest.accept("f(a, x:=1 + 2)", "(index f (args a (:= x (+ 1 2))))");
    doTest.accept("f(x:=1, y:=g(2))", "(index f (args (:= x 1) (:= y (index g (args 2)))))");
    doTest.accept("x.y(1, , z:=2)", "(index (. x y) (args 1 _ (:= z 2)))");
  }

  @Test public void literalsInExpressions() {
    BiConsumer<String,String> doTest = (source,expected) -> assertEquals(expected, dump(source), source);
    doTest.accept("1 + 2.5", "(+ 1 2.5)");
    doTest.accept("&hFF And x", "(and &hFF x)");
    doTest.accept("\"a\" & \"b\"", "(& \"a\" \"b\")");
    doTest.accept("x = True", "(= x True)");
    doTest.accept("IsNull(Null)", "(index IsNull (args Null))");
    doTest.accept("v = Empty", "(= v Empty)");
  }

  @Test public void typeSuffixes() {
    assertEquals("(& a$ b%)", dump("a$ & b%"));
    assertEquals("(+ x# y@)", dump("x# + y@"));
    Expr.Name name = (Expr.Name)expression("total%");
    assertEquals("total%", name.getName());
    assertEquals(6, name.getPosition().getEndIndex());

    Tokeniser tokeniser = new Tokeniser("a$", "test");
    Parser    parser    = new Parser(tokeniser, EmuContext.create().typeSuffixes(false).build());
    assertEquals("a", AstDumper.dump(parser.parseExpression()));
    assertEquals("$", tokeniser.peek().getText());
  }

  @Test public void expressionEnds() {
    Tokeniser tokeniser = new Tokeniser("a + b c", "test");
    assertEquals("(+ a b)", AstDumper.dump(new Parser(tokeniser).parseExpression()));
    assertEquals("c", tokeniser.peek().getText());

    tokeniser = new Tokeniser("f(1), 2", "test");
    assertEquals("(index f (args 1))", AstDumper.dump(new Parser(tokeniser).parseExpression()));
    assertEquals(",", tokeniser.peek().getText());

    tokeniser = new Tokeniser("a Then b", "test");
    assertEquals("a", AstDumper.dump(new Parser(tokeniser).parseExpression()));
    assertEquals(KEYWORD, tokeniser.peek().getType());

    tokeniser = new Tokeniser("x := 1", "test");
    assertEquals("x", AstDumper.dump(new Parser(tokeniser).parseExpression()));

    tokeniser = new Tokeniser("a) + 1", "test");
    assertEquals("a", AstDumper.dump(new Parser(tokeniser).parseExpression()));
    assertEquals(")", tokeniser.peek().getText());

    tokeniser = new Tokeniser("a + 1 ' comment", "test");
    assertEquals("(+ a 1)", AstDumper.dump(new Parser(tokeniser).parseExpression()));
    assertEquals(COMMENT, tokeniser.peek().getType());

    assertEquals("(+ a b)", dump("a + _\n   b"));
  }

  @Test public void noExpression() {
    assertNull(expression(""));
    assertNull(expression(")"));
    assertNull(expression(", a"));
    assertNull(expression("Then"));
    assertNull(expression("\n a"));
  }

  @Test public void lExpressions() {
    Parser parser = new Parser(new Tokeniser("a.b(1) = 2", "test"));
    Expr   target = (Expr)parser.parse("l_expression");
    assertEquals("(index (. a b) (args 1))", AstDumper.dump(target));
    assertTrue(target.isLExpression());
    assertTrue(expression(".a").isLExpression());
    assertTrue(expression("!a").isLExpression());
    assertFalse(expression("(a)").isLExpression());
    assertFalse(expression("a + b").isLExpression());
    assertFalse(expression("1").isLExpression());
  }

  @Test public void positions() {
    Expr expr = expression("a + bc * 2");
    assertEquals(0, expr.getPosition().getStartIndex());
    assertEquals(10, expr.getPosition().getEndIndex());
    Expr.Operation add = (Expr.Operation)expr;
    assertEquals(OperatorType.ADD, add.getType());
    assertEquals(4, add.operands.get(1).getPosition().getStartIndex());

    Expr call = expression("  f(x, y)  ");
    assertEquals(2, call.getPosition().getStartIndex());
    assertEquals(9, call.getPosition().getEndIndex());

    Expr paren = expression("(a)");
    assertEquals(0, paren.getPosition().getStartIndex());
    assertEquals(3, paren.getPosition().getEndIndex());

    Expr.Operation twice = (Expr.Operation)expression("- -a");
    assertEquals(2, twice.operator.tokens.size());
    assertEquals(0, twice.getPosition().getStartIndex());
    assertEquals(4, twice.getPosition().getEndIndex());
  }

  @Test public void argumentStructure() {
    Expr.IndexExpr call = (Expr.IndexExpr)expression("f(1, , n:=2)");
    assertEquals(3, call.args.args.size());
    assertFalse(call.args.args.get(0).isMissing());
    assertTrue(call.args.args.get(1).isMissing());
    assertEquals("n", call.args.args.get(2).name.getName());
    assertEquals("2", AstDumper.dump(call.args.args.get(2).value));
    assertTrue(((Expr.IndexExpr)expression("f()")).args.isEmpty());
  }

  @Test public void operationArity() {
    Token         plus = new Tokeniser("+", "test").pop();
    Expr          a    = expression("a");
    Expr.Operator add  = new Expr.Operator(OperatorType.ADD, List.of(plus));
    assertThrows(IllegalArgumentException.class, () -> new Expr.Operation(add, List.of(a)));
    Expr.Operator neg  = new Expr.Operator(OperatorType.NEGATE, List.of(plus));
    assertThrows(IllegalArgumentException.class, () -> new Expr.Operation(neg, List.of(a, a)));
  }
}
