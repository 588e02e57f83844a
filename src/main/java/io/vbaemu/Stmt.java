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
 * Stmt classes for our AST.
 *
 * Statements are built by the recursive descent part of the Parser out of
 * the expression nodes in {@link Expr}. As with expressions the position of
 * a statement spans from its first to its last token.
 */
public abstract class Stmt {

  protected final Position position;

  protected Stmt(Position position) {
    this.position = Objects.requireNonNull(position, "position");
  }

  public Position getPosition() {
    return position;
  }

  public abstract <T> T accept(Visitor<T> visitor);

  @Override
  public String toString() {
    return accept(new AstDumper());
  }

  private static <E> List<E> copy(List<E> list) {
    return list == null ? null : List.copyOf(list);
  }

  //= Helper types

  /**
   * Array dimension: lower To upper (lower is null when not given)
   */
  public static class Bound {
    public final Expr lower;
    public final Expr upper;

    public Bound(Expr lower, Expr upper) {
      this.lower = lower;
      this.upper = Objects.requireNonNull(upper);
    }
  }

  /**
   * Variable declared by Dim/Static/Public/Private/Global/Const/ReDim.
   * bounds is null for a scalar and empty for a dynamic array ("a()").
   */
  public static class Variable {
    public final Expr.Name   name;
    public final List<Bound> bounds;
    public final Expr        type;         // Name, or MemberAccess for qualified class names
    public final boolean     isNew;
    public final Expr        fixedLength;  // String * n
    public final Expr        value;        // Const value

    public Variable(Expr.Name name, List<Bound> bounds, Expr type, boolean isNew, Expr fixedLength, Expr value) {
      this.name        = name;
      this.bounds      = copy(bounds);
      this.type        = type;
      this.isNew       = isNew;
      this.fixedLength = fixedLength;
      this.value       = value;
    }

    public boolean isArray() {
      return bounds != null;
    }
  }

  public static class Parameter {
    public final boolean   optional;
    public final Token     passing;      // ByVal/ByRef or null
    public final boolean   paramArray;
    public final Expr.Name name;
    public final boolean   isArray;
    public final Expr      type;
    public final Expr      defaultValue;

    public Parameter(boolean optional, Token passing, boolean paramArray, Expr.Name name, boolean isArray, Expr type, Expr defaultValue) {
      this.optional     = optional;
      this.passing      = passing;
      this.paramArray   = paramArray;
      this.name         = name;
      this.isArray      = isArray;
      this.type         = type;
      this.defaultValue = defaultValue;
    }

    public boolean isByVal() {
      return passing != null && passing.textIs("byval");
    }
  }

  /**
   * Condition and body of If/ElseIf
   */
  public static class Branch {
    public final Expr  condition;
    public final Block body;

    public Branch(Expr condition, Block body) {
      this.condition = condition;
      this.body      = body;
    }
  }

  public enum AssignType { LET, SET, LSET, RSET }

  public enum ProcedureType {
    SUB("Sub"), FUNCTION("Function"), PROPERTY_GET("Property Get"), PROPERTY_LET("Property Let"), PROPERTY_SET("Property Set");

    private final String keyword;
    ProcedureType(String keyword) { this.keyword = keyword; }

    public String getKeyword() { return keyword; }
  }

  ////////////////////////////////////

  /**
   * Sequence of statements
   */
  public static class Block extends Stmt {
    public final List<Stmt> stmts;

    public Block(List<Stmt> stmts, Position position) {
      super(position);
      this.stmts = List.copyOf(stmts);
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitBlock(this); }
  }

  public static class Comment extends Stmt {
    public final Token comment;

    public Comment(Token comment) {
      super(comment.getPosition());
      this.comment = comment;
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitComment(this); }
  }

  /**
   * Module level directives: Option Explicit, Option Base 1, Attribute VB_Name = "x".
   * The words following the keyword are kept as they are.
   */
  public static class Directive extends Stmt {
    public final Token       keyword;
    public final List<Token> words;

    public Directive(Token keyword, List<Token> words, Position position) {
      super(position);
      this.keyword = keyword;
      this.words   = List.copyOf(words);
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitDirective(this); }
  }

  /**
   * Line label ("name:") or line number
   */
  public static class Label extends Stmt {
    public final Token label;

    public Label(Token label, Position position) {
      super(position);
      this.label = label;
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitLabel(this); }
  }

  /**
   * Procedure call: "Call f(a, b)", "f a, b", "obj.method a"
   */
  public static class CallStmt extends Stmt {
    public final Expr         target;
    public final Expr.ArgList args;       // null when there is no argument list
    public final boolean      explicit;

    public CallStmt(Expr target, Expr.ArgList args, boolean explicit, Position position) {
      super(position);
      this.target   = target;
      this.args     = args;
      this.explicit = explicit;
    }

    public List<Expr.Arg> getArgs() {
      return args == null ? List.of() : args.args;
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitCallStmt(this); }
  }

  /**
   * Assignment. For "Set x = New Foo" the value is the class name and isNew is set.
   */
  public static class Assign extends Stmt {
    public final AssignType type;
    public final Expr       target;
    public final Expr       value;
    public final boolean    isNew;

    public Assign(AssignType type, Expr target, Expr value, boolean isNew, Position position) {
      super(position);
      this.type   = type;
      this.target = target;
      this.value  = value;
      this.isNew  = isNew;
    }

    public Assign(AssignType type, Expr target, Expr value, Position position) {
      this(type, target, value, false, position);
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitAssign(this); }
  }

  /**
   * Mid(target, start[, length]) = value
   */
  public static class MidAssign extends Stmt {
    public final Token function;
    public final Expr  target;
    public final Expr  start;
    public final Expr  length;
    public final Expr  value;

    public MidAssign(Token function, Expr target, Expr start, Expr length, Expr value, Position position) {
      super(position);
      this.function = function;
      this.target   = target;
      this.start    = start;
      this.length   = length;
      this.value    = value;
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitMidAssign(this); }
  }

  /**
   * Dim, Static, Public, Private, Global and Const declarations
   */
  public static class Declaration extends Stmt {
    public final Token          scope;        // Dim/Static/Public/Private/Global or null for plain Const
    public final boolean        isConst;
    public final boolean        shared;
    public final List<Variable> variables;

    public Declaration(Token scope, boolean isConst, boolean shared, List<Variable> variables, Position position) {
      super(position);
      this.scope     = scope;
      this.isConst   = isConst;
      this.shared    = shared;
      this.variables = List.copyOf(variables);
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitDeclaration(this); }
  }

  public static class ReDim extends Stmt {
    public final boolean        preserve;
    public final List<Variable> variables;

    public ReDim(boolean preserve, List<Variable> variables, Position position) {
      super(position);
      this.preserve  = preserve;
      this.variables = List.copyOf(variables);
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitReDim(this); }
  }

  public static class Erase extends Stmt {
    public final List<Expr> arrays;

    public Erase(List<Expr> arrays, Position position) {
      super(position);
      this.arrays = List.copyOf(arrays);
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitErase(this); }
  }

  /**
   * On Error GoTo label, On Error GoTo 0, On Error Resume Next
   */
  public static class OnError extends Stmt {
    public final Token   label;         // null for Resume Next
    public final boolean resumeNext;

    public OnError(Token label, boolean resumeNext, Position position) {
      super(position);
      this.label      = label;
      this.resumeNext = resumeNext;
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitOnError(this); }
  }

  /**
   * Resume, Resume Next, Resume label
   */
  public static class Resume extends Stmt {
    public final Token   label;
    public final boolean next;

    public Resume(Token label, boolean next, Position position) {
      super(position);
      this.label = label;
      this.next  = next;
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitResume(this); }
  }

  /**
   * Error errNumber
   */
  public static class ErrorStmt extends Stmt {
    public final Expr number;

    public ErrorStmt(Expr number, Position position) {
      super(position);
      this.number = number;
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitErrorStmt(this); }
  }

  /**
   * GoTo and GoSub
   */
  public static class Jump extends Stmt {
    public final Token   keyword;
    public final Token   label;

    public Jump(Token keyword, Token label, Position position) {
      super(position);
      this.keyword = keyword;
      this.label   = label;
    }

    public boolean isGoSub() {
      return keyword.textIs("gosub");
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitJump(this); }
  }

  /**
   * Single keyword statements: Return, End, Stop, and Exit Sub/Function/Property/For/Do
   */
  public static class Simple extends Stmt {
    public final Token keyword;
    public final Token qualifier;   // what Exit leaves

    public Simple(Token keyword, Token qualifier, Position position) {
      super(position);
      this.keyword   = keyword;
      this.qualifier = qualifier;
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitSimple(this); }
  }

  public static class If extends Stmt {
    public final List<Branch> branches;
    public final Block        elseBlock;
    public final boolean      singleLine;

    public If(List<Branch> branches, Block elseBlock, boolean singleLine, Position position) {
      super(position);
      this.branches   = List.copyOf(branches);
      this.elseBlock  = elseBlock;
      this.singleLine = singleLine;
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitIf(this); }
  }

  public static class For extends Stmt {
    public final Expr  counter;
    public final Expr  start;
    public final Expr  end;
    public final Expr  step;
    public final Block body;

    public For(Expr counter, Expr start, Expr end, Expr step, Block body, Position position) {
      super(position);
      this.counter = counter;
      this.start   = start;
      this.end     = end;
      this.step    = step;
      this.body    = body;
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitFor(this); }
  }

  public static class ForEach extends Stmt {
    public final Expr  element;
    public final Expr  collection;
    public final Block body;

    public ForEach(Expr element, Expr collection, Block body, Position position) {
      super(position);
      this.element    = element;
      this.collection = collection;
      this.body       = body;
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitForEach(this); }
  }

  public static class While extends Stmt {
    public final Expr  condition;
    public final Block body;

    public While(Expr condition, Block body, Position position) {
      super(position);
      this.condition = condition;
      this.body      = body;
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitWhile(this); }
  }

  /**
   * Do [While|Until cond] ... Loop [While|Until cond]
   */
  public static class DoLoop extends Stmt {
    public final Expr    condition;         // null for an endless loop
    public final boolean until;
    public final boolean conditionFirst;
    public final Block   body;

    public DoLoop(Expr condition, boolean until, boolean conditionFirst, Block body, Position position) {
      super(position);
      this.condition      = condition;
      this.until          = until;
      this.conditionFirst = conditionFirst;
      this.body           = body;
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitDoLoop(this); }
  }

  public static class With extends Stmt {
    public final Expr  object;
    public final Block body;

    public With(Expr object, Block body, Position position) {
      super(position);
      this.object = object;
      this.body   = body;
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitWith(this); }
  }

  /**
   * Sub, Function and Property Get/Let/Set declarations
   */
  public static class Procedure extends Stmt {
    public final ProcedureType   type;
    public final Token           scope;       // Public/Private/Friend/Global or null
    public final boolean         isStatic;
    public final Expr.Name       name;
    public final List<Parameter> parameters;
    public final Expr            returnType;
    public final Block           body;

    public Procedure(ProcedureType type, Token scope, boolean isStatic, Expr.Name name, List<Parameter> parameters,
                     Expr returnType, Block body, Position position) {
      super(position);
      this.type       = type;
      this.scope      = scope;
      this.isStatic   = isStatic;
      this.name       = name;
      this.parameters = List.copyOf(parameters);
      this.returnType = returnType;
      this.body       = body;
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitProcedure(this); }
  }

  ////////////////////////////////////

  public interface Visitor<T> {
    T visitBlock(Block stmt);
    T visitComment(Comment stmt);
    T visitDirective(Directive stmt);
    T visitLabel(Label stmt);
    T visitCallStmt(CallStmt stmt);
    T visitAssign(Assign stmt);
    T visitMidAssign(MidAssign stmt);
    T visitDeclaration(Declaration stmt);
    T visitReDim(ReDim stmt);
    T visitErase(Erase stmt);
    T visitOnError(OnError stmt);
    T visitResume(Resume stmt);
    T visitErrorStmt(ErrorStmt stmt);
    T visitJump(Jump stmt);
    T visitSimple(Simple stmt);
    T visitIf(If stmt);
    T visitFor(For stmt);
    T visitForEach(ForEach stmt);
    T visitWhile(While stmt);
    T visitDoLoop(DoLoop stmt);
    T visitWith(With stmt);
    T visitProcedure(Procedure stmt);
  }
}
