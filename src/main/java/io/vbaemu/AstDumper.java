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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders an AST as an s-expression. Used when logging parsed trees and for
 * checking the shape of trees in tests.
 * <pre>
 *   a * b + -c         ==&gt;  (+ (* a b) (neg c))
 *   x.y(1, , z:=2)     ==&gt;  (index (. x y) (args 1 _ (:= z 2)))
 *   If a Then b = 1    ==&gt;  (if a (block (let b 1)))
 * </pre>
 * Literals are rendered as they appear in the source.
 */
public class AstDumper implements Expr.Visitor<String>, Stmt.Visitor<String> {

  public static String dump(Expr expr) {
    return expr == null ? "null" : expr.accept(new AstDumper());
  }

  public static String dump(Stmt stmt) {
    return stmt == null ? "null" : stmt.accept(new AstDumper());
  }

  private String list(Object... parts) {
    List<String> strings = new ArrayList<>();
    for (Object part: parts) {
      if (part instanceof Expr) {
        strings.add(((Expr)part).accept(this));
      }
      else if (part instanceof Stmt) {
        strings.add(((Stmt)part).accept(this));
      }
      else if (part instanceof List) {
        for (Object elem: (List<?>)part) {
          strings.add(elem instanceof Expr ? ((Expr)elem).accept(this) : elem instanceof Stmt ? ((Stmt)elem).accept(this) : String.valueOf(elem));
        }
      }
      else if (part != null) {
        strings.add(part.toString());
      }
    }
    return strings.stream().collect(Collectors.joining(" ", "(", ")"));
  }

  private static String lower(Token token) {
    return token.getText().toLowerCase(Locale.ROOT);
  }

  //= Expr

  @Override public String visitParenExpr(Expr.ParenExpr expr)               { return list("paren", expr.expr); }
  @Override public String visitLiteral(Expr.Literal expr)                   { return expr.token.getText(); }
  @Override public String visitName(Expr.Name expr)                         { return expr.getName(); }
  @Override public String visitMemberAccess(Expr.MemberAccess expr)         { return list(".", expr.parent, expr.member); }
  @Override public String visitDictAccess(Expr.DictAccess expr)             { return list("!", expr.parent, expr.member); }
  @Override public String visitWithMemberAccess(Expr.WithMemberAccess expr) { return list("with.", expr.member); }
  @Override public String visitWithDictAccess(Expr.WithDictAccess expr)     { return list("with!", expr.member); }
  @Override public String visitIndexExpr(Expr.IndexExpr expr)               { return list("index", expr.expr, expr.args); }
  @Override public String visitArgList(Expr.ArgList expr)                   { return list("args", expr.args); }

  @Override
  public String visitArg(Expr.Arg expr) {
    if (expr.name != null) {
      return list(":=", expr.name, expr.value);
    }
    return expr.isMissing() ? "_" : expr.value.accept(this);
  }

  @Override
  public String visitOperator(Expr.Operator expr) {
    switch (expr.type) {
      case NEGATE: return "neg";
      case NOT:    return "not";
      default:     return expr.type.symbol();
    }
  }

  @Override
  public String visitOperation(Expr.Operation expr) {
    List<String> ops = new ArrayList<>();
    int count = expr.operator.type.isUnary ? expr.operator.tokens.size() : 1;
    for (int i = 0; i < count; i++) {
      ops.add(expr.operator.accept(this));
    }
    return list(ops, expr.operands);
  }

  //= Stmt

  @Override public String visitBlock(Stmt.Block stmt)         { return list("block", stmt.stmts); }
  @Override public String visitComment(Stmt.Comment stmt)     { return "(comment)"; }
  @Override public String visitLabel(Stmt.Label stmt)         { return list("label", stmt.label.getText()); }
  @Override public String visitErase(Stmt.Erase stmt)         { return list("erase", stmt.arrays); }
  @Override public String visitErrorStmt(Stmt.ErrorStmt stmt) { return list("error", stmt.number); }
  @Override public String visitJump(Stmt.Jump stmt)           { return list(lower(stmt.keyword), stmt.label.getText()); }
  @Override public String visitWhile(Stmt.While stmt)         { return list("while", stmt.condition, stmt.body); }
  @Override public String visitWith(Stmt.With stmt)           { return list("with", stmt.object, stmt.body); }

  @Override
  public String visitDirective(Stmt.Directive stmt) {
    return list(lower(stmt.keyword), stmt.words.stream().map(Token::getText).collect(Collectors.toList()));
  }

  @Override
  public String visitCallStmt(Stmt.CallStmt stmt) {
    return list("call", stmt.target, stmt.getArgs());
  }

  @Override
  public String visitAssign(Stmt.Assign stmt) {
    String keyword = stmt.type.name().toLowerCase(Locale.ROOT);
    return stmt.isNew ? list(keyword, stmt.target, list("new", stmt.value)) : list(keyword, stmt.target, stmt.value);
  }

  @Override
  public String visitMidAssign(Stmt.MidAssign stmt) {
    return list(stmt.function.getText() + "=", stmt.target, stmt.start, stmt.length, stmt.value);
  }

  @Override
  public String visitDeclaration(Stmt.Declaration stmt) {
    List<String> keywords = new ArrayList<>();
    if (stmt.scope != null) {
      keywords.add(lower(stmt.scope));
    }
    if (stmt.shared) {
      keywords.add("shared");
    }
    if (stmt.isConst) {
      keywords.add("const");
    }
    return list(keywords, variables(stmt.variables));
  }

  @Override
  public String visitReDim(Stmt.ReDim stmt) {
    return list("redim", stmt.preserve ? "preserve" : null, variables(stmt.variables));
  }

  private List<String> variables(List<Stmt.Variable> variables) {
    return variables.stream().map(this::variable).collect(Collectors.toList());
  }

  private String variable(Stmt.Variable variable) {
    if (!variable.isArray() && variable.type == null && variable.value == null) {
      return variable.name.accept(this);
    }
    List<String> bounds = null;
    if (variable.isArray()) {
      bounds = variable.bounds.stream()
                              .map(b -> b.lower == null ? b.upper.accept(this) : list("to", b.lower, b.upper))
                              .collect(Collectors.toList());
    }
    return list(variable.name,
                bounds == null ? null : list("bounds", bounds),
                variable.type == null ? null : list(variable.isNew ? "as-new" : "as", variable.type, variable.fixedLength),
                variable.value == null ? null : list("=", variable.value));
  }

  @Override
  public String visitOnError(Stmt.OnError stmt) {
    return stmt.resumeNext ? "(on-error resume-next)" : list("on-error", "goto", stmt.label.getText());
  }

  @Override
  public String visitResume(Stmt.Resume stmt) {
    return list("resume", stmt.next ? "next" : null, stmt.label == null ? null : stmt.label.getText());
  }

  @Override
  public String visitSimple(Stmt.Simple stmt) {
    return list(lower(stmt.keyword), stmt.qualifier == null ? null : lower(stmt.qualifier));
  }

  @Override
  public String visitIf(Stmt.If stmt) {
    List<Object> parts = new ArrayList<>();
    parts.add("if");
    for (int i = 0; i < stmt.branches.size(); i++) {
      if (i > 0) {
        parts.add("elseif");
      }
      parts.add(stmt.branches.get(i).condition);
      parts.add(stmt.branches.get(i).body);
    }
    if (stmt.elseBlock != null) {
      parts.add("else");
      parts.add(stmt.elseBlock);
    }
    return list(parts.toArray());
  }

  @Override
  public String visitFor(Stmt.For stmt) {
    return list("for", stmt.counter, stmt.start, stmt.end, stmt.step == null ? null : list("step", stmt.step), stmt.body);
  }

  @Override
  public String visitForEach(Stmt.ForEach stmt) {
    return list("for-each", stmt.element, stmt.collection, stmt.body);
  }

  @Override
  public String visitDoLoop(Stmt.DoLoop stmt) {
    String condition = stmt.condition == null ? null : list(stmt.until ? "until" : "while", stmt.condition);
    return stmt.conditionFirst ? list("do", condition, stmt.body) : list("do", stmt.body, condition);
  }

  @Override
  public String visitProcedure(Stmt.Procedure stmt) {
    List<String> parameters = stmt.parameters.stream().map(this::parameter).collect(Collectors.toList());
    return list(stmt.type.getKeyword().toLowerCase(Locale.ROOT).replace(' ', '-'),
                stmt.scope == null ? null : lower(stmt.scope),
                stmt.isStatic ? "static" : null,
                stmt.name,
                list("params", parameters),
                stmt.returnType == null ? null : list("as", stmt.returnType),
                stmt.body);
  }

  private String parameter(Stmt.Parameter parameter) {
    if (!parameter.optional && parameter.passing == null && !parameter.paramArray && !parameter.isArray &&
        parameter.type == null && parameter.defaultValue == null) {
      return parameter.name.accept(this);
    }
    return list(parameter.name,
                parameter.optional ? "optional" : null,
                parameter.passing == null ? null : lower(parameter.passing),
                parameter.paramArray ? "paramarray" : null,
                parameter.isArray ? "()" : null,
                parameter.type == null ? null : list("as", parameter.type),
                parameter.defaultValue == null ? null : list("=", parameter.defaultValue));
  }
}
