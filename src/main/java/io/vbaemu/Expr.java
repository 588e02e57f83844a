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

import java.util.List;
import java.util.Objects;

/**
 * Expr classes for our AST.
 *
 * Nodes are immutable and own their children. The position of every node
 * encloses the positions of all its children. Operation nodes are what the
 * operator precedence parser builds; member/dictionary access, argument
 * lists, index expressions and parenthesised expressions are normalised
 * into their own node types as soon as they are reduced, so an Operation
 * left in a finished tree is always a logical, comparison or arithmetic
 * operation.
 */
public abstract class Expr {

  protected final Position position;

  protected Expr(Position position) {
    this.position = Objects.requireNonNull(position, "position");
  }

  public Position getPosition() {
    return position;
  }

  public abstract <T> T accept(Visitor<T> visitor);

  /**
   * Whether expression can be the target of an assignment
   */
  public boolean isLExpression() {
    return this instanceof Name || this instanceof MemberAccess || this instanceof DictAccess ||
           this instanceof WithMemberAccess || this instanceof WithDictAccess || this instanceof IndexExpr;
  }

  @Override
  public String toString() {
    return accept(new AstDumper());
  }

  private static Position span(Position first, List<? extends Expr> exprs) {
    Position result = first;
    for (Expr expr: exprs) {
      result = Position.merge(result, expr.position);
    }
    return result;
  }

  ////////////////////////////////////

  /**
   * Expression enclosed in parentheses where the parentheses only group
   */
  public static class ParenExpr extends Expr {
    public final Expr expr;

    public ParenExpr(Expr expr, Token leftParen, Token rightParen) {
      super(Position.merge(leftParen.getPosition(), expr.position, rightParen.getPosition()));
      this.expr = expr;
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitParenExpr(this); }
  }

  public static class Literal extends Expr {
    public final Token   token;
    public final VbaType type;
    public final Object  value;

    public Literal(Token token, VbaType type, Object value) {
      super(token.getPosition());
      this.token = token;
      this.type  = Objects.requireNonNull(type);
      this.value = value;
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitLiteral(this); }
  }

  public static class Name extends Expr {
    public final Token name;

    public Name(Token name) {
      super(name.getPosition());
      this.name = name;
    }

    public String getName() {
      return name.getText();
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitName(this); }
  }

  /**
   * parent.member
   */
  public static class MemberAccess extends Expr {
    public final Expr parent;
    public final Name member;

    public MemberAccess(Expr parent, Name member) {
      super(Position.merge(parent.position, member.position));
      this.parent = parent;
      this.member = member;
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitMemberAccess(this); }
  }

  /**
   * parent!member
   */
  public static class DictAccess extends Expr {
    public final Expr parent;
    public final Name member;

    public DictAccess(Expr parent, Name member) {
      super(Position.merge(parent.position, member.position));
      this.parent = parent;
      this.member = member;
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitDictAccess(this); }
  }

  /**
   * .member inside a With block
   */
  public static class WithMemberAccess extends Expr {
    public final Token operator;
    public final Name  member;

    public WithMemberAccess(Token operator, Name member) {
      super(Position.merge(operator.getPosition(), member.position));
      this.operator = operator;
      this.member   = member;
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitWithMemberAccess(this); }
  }

  /**
   * !member inside a With block
   */
  public static class WithDictAccess extends Expr {
    public final Token operator;
    public final Name  member;

    public WithDictAccess(Token operator, Name member) {
      super(Position.merge(operator.getPosition(), member.position));
      this.operator = operator;
      this.member   = member;
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitWithDictAccess(this); }
  }

  /**
   * Call or array index: expr(args). The grammar does not distinguish the two.
   */
  public static class IndexExpr extends Expr {
    public final Expr    expr;
    public final ArgList args;

    public IndexExpr(Expr expr, ArgList args, Token rightParen) {
      super(Position.merge(expr.position, args.position, rightParen.getPosition()));
      this.expr = expr;
      this.args = args;
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitIndexExpr(this); }
  }

  public static class ArgList extends Expr {
    public final List<Arg> args;

    /**
     * @param args      the arguments
     * @param location  position used when there are no arguments
     */
    public ArgList(List<Arg> args, Position location) {
      super(span(location, args));
      this.args = List.copyOf(args);
    }

    public ArgList(List<Arg> args) {
      this(args, args.isEmpty() ? null : args.get(0).position);
    }

    public boolean isEmpty() {
      return args.isEmpty();
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitArgList(this); }
  }

  /**
   * Argument in an argument list: optionally named (name:=value) and possibly
   * missing (f(a,,b)) in which case value is null.
   */
  public static class Arg extends Expr {
    public final Name name;
    public final Expr value;

    public Arg(Name name, Expr value, Position location) {
      super(Position.merge(location, name == null ? null : name.position, value == null ? null : value.position));
      this.name  = name;
      this.value = value;
    }

    public Arg(Expr value) {
      this(null, value, null);
    }

    public boolean isMissing() {
      return value == null;
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitArg(this); }
  }

  /**
   * Operator of an Operation together with the operator tokens it was built
   * from (one per application).
   */
  public static class Operator extends Expr {
    public final OperatorType type;
    public final List<Token>  tokens;

    public Operator(OperatorType type, List<Token> tokens) {
      super(Position.merge(tokens.stream().map(Token::getPosition).toArray(Position[]::new)));
      this.type   = type;
      this.tokens = List.copyOf(tokens);
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitOperator(this); }
  }

  /**
   * Operation applied to operands. Binary operators are n-ary: a chain of the
   * same operator is one node whose value is the left fold of its operands
   * (a - b - c is ((a - b) - c)). A unary operator has a single operand and is
   * applied once per operator token (- - a).
   */
  public static class Operation extends Expr {
    public final Operator   operator;
    public final List<Expr> operands;

    public Operation(Operator operator, List<Expr> operands) {
      super(span(operator.position, operands));
      if (operator.type.isUnary ? operands.size() != 1 : operands.size() < 2) {
        throw new IllegalArgumentException("Internal error: " + operands.size() + " operands for operator " + operator.type);
      }
      this.operator = operator;
      this.operands = List.copyOf(operands);
    }

    public OperatorType getType() {
      return operator.type;
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitOperation(this); }
  }

  ////////////////////////////////////

  public interface Visitor<T> {
    T visitParenExpr(ParenExpr expr);
    T visitLiteral(Literal expr);
    T visitName(Name expr);
    T visitMemberAccess(MemberAccess expr);
    T visitDictAccess(DictAccess expr);
    T visitWithMemberAccess(WithMemberAccess expr);
    T visitWithDictAccess(WithDictAccess expr);
    T visitIndexExpr(IndexExpr expr);
    T visitArgList(ArgList expr);
    T visitArg(Arg expr);
    T visitOperator(Operator expr);
    T visitOperation(Operation expr);
  }
}
