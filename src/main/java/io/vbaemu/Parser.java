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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.*;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static io.vbaemu.OperatorType.*;
import static io.vbaemu.TokenType.*;

/**
 * Parser for VBA source code.
 * <p>
 * Statements are parsed by recursive descent. Expressions are parsed with an
 * operator precedence (shunting-yard) algorithm since the grammar uses the same
 * symbol for different operators and arity has to be decided from what
 * precedes the symbol: '-' is negation or subtraction, '(' is grouping or a
 * call/index, '.' and '!' are member/dictionary access or the With-block forms.
 * </p><p>
 * Grammar rules can be invoked by name through {@link #parse(String)}, which
 * is how the tests drive the parser.
 * </p>
 * To extract the EBNF grammar from the comments grep out lines starting with '  *#'
 */
public class Parser {
  private static final Logger logger = LoggerFactory.getLogger(Parser.class);

  private final Tokeniser                     tokeniser;
  private final EmuContext                    context;
  private final Map<String, Supplier<Object>> rules = new LinkedHashMap<>();
  private       Token                         previous;     // Last token consumed (never a blank)

  // Reserved words that are also the names of built-in functions
  private static final Set<String> NAME_KEYWORDS = Set.of("me", "len", "date", "string", "input", "error", "tab", "spc", "seek");

  // Type declaration characters that can end a name
  private static final Set<String> TYPE_SUFFIXES = Set.of("$", "%", "#", "@");

  // Type declaration characters that are also operators (concatenation and
  // dictionary access) so are only absorbed by names being declared or assigned
  private static final Set<String> OPERATOR_SUFFIXES = Set.of("&", "!");

  // Words that end a statement block (used by the statement_block rule)
  private static final String[] BLOCK_ENDS = { "end if", "endif", "end sub", "end function", "end property", "end with",
                                               "next", "loop", "wend", "else", "elseif" };

  public Parser(Tokeniser tokeniser) {
    this(tokeniser, EmuContext.create().build());
  }

  public Parser(Tokeniser tokeniser, EmuContext context) {
    this.tokeniser = tokeniser;
    this.context   = context;
    rules.put("expression",      this::expression);
    rules.put("l_expression",    this::lExpression);
    rules.put("primary",         this::primary);
    rules.put("literal",         this::literal);
    rules.put("integer",         this::integer);
    rules.put("float",           this::floatLiteral);
    rules.put("string",          this::string);
    rules.put("statement",       this::statement);
    rules.put("statement_block", this::statementBlock);
    rules.put("module",          this::module);
  }

  /**
   * Parse source using given grammar rule.
   * Errors other than lexer and parser errors raised while parsing are
   * reported as a ParserError with the underlying exception as its cause.
   * @param rule  the rule name (e.g. "expression", "module")
   * @return the AST node or null if rule is optional and nothing matched
   * @throws ParserError if the source does not match the rule or the rule does not exist
   * @throws LexerError  if the source cannot be tokenised
   */
  public Object parse(String rule) {
    Supplier<Object> method = rules.get(rule);
    if (method == null) {
      throw new ParserError("Unknown grammar rule '" + rule + "'", (Position)null);
    }
    logger.debug("{}: parsing '{}'", tokeniser.getStreamName(), rule);
    try {
      return method.get();
    }
    catch (EmuError e) {
      throw e;
    }
    catch (RuntimeException e) {
      logger.warn("{}: error parsing '{}'", tokeniser.getStreamName(), rule, e);
      throw new ParserError("Error parsing " + rule, previous == null ? null : previous.getPosition(), e);
    }
  }

  public Set<String> ruleNames() {
    return Collections.unmodifiableSet(rules.keySet());
  }

  /**
   * Parse the whole source as a module
   * @return the block of top level statements
   */
  public Stmt.Block parseModule() {
    return (Stmt.Block)parse("module");
  }

  /**
   * Parse an expression
   * @return the expression or null if no expression starts at the current token
   */
  public Expr parseExpression() {
    return (Expr)parse("expression");
  }

  ////////////////////////////////////////////

  // = Stmt

  /**
   *# module ::= statementBlock END_OF_FILE
   */
  Stmt.Block module() {
    Stmt.Block block = block(null, true);
    Token      token = peek();
    if (token.isNot(END_OF_FILE)) {
      throw new ParserError("Unexpected '" + token.getText() + "'", token);
    }
    return block;
  }

  /**
   * Statements up to the end of the source or up to a keyword that ends a block
   * (which is not consumed).
   *<pre>
   *# statementBlock ::= ( statement? ( COMMENT )? END_OF_STATEMENT )*
   *</pre>
   */
  Stmt.Block statementBlock() {
    return block(null, true, BLOCK_ENDS);
  }

  /**
   * Parse statements until one of the given block ends is reached.
   * @param start      the token starting the enclosing statement (for errors)
   * @param eofAllowed whether the block can be ended by the end of the source
   * @param ends       the words that end the block ("end if", "next", ...)
   */
  private Stmt.Block block(Token start, boolean eofAllowed, String... ends) {
    List<Stmt> stmts         = new ArrayList<>();
    Position   startPosition = peek().getPosition();
    while (true) {
      Token token = peek();
      if (token.is(END_OF_STATEMENT)) {
        advance();
        continue;
      }
      if (token.is(END_OF_FILE)) {
        if (!eofAllowed) {
          throw new ParserError("Expected '" + String.join("' or '", ends) + "' before end of file", start);
        }
        break;
      }
      if (lookingAtAny(ends)) {
        break;
      }
      Stmt stmt = statement();
      stmts.add(stmt);
      if (!(stmt instanceof Stmt.Label)) {
        endOfStatement(stmts);
      }
    }
    Position position = stmts.isEmpty() ? startPosition
                                        : Position.merge(stmts.get(0).getPosition(), stmts.get(stmts.size() - 1).getPosition());
    return new Stmt.Block(stmts, position);
  }

  private Stmt.Block block(Token start, String... ends) {
    return block(start, false, ends);
  }

  /**
   * After a statement we expect an optional comment and then a new line or ':'
   */
  private void endOfStatement(List<Stmt> stmts) {
    Token token = peek();
    if (token.is(COMMENT)) {
      stmts.add(new Stmt.Comment(advance()));
      token = peek();
    }
    if (token.isNot(END_OF_STATEMENT, END_OF_FILE)) {
      throw new ParserError("Expected end of statement but got '" + token.getText() + "'", token);
    }
  }

  /**
   *<pre>
   *# statement ::= COMMENT | label | callStmt | assignment | declaration | procedure
   *#             | redimStmt | eraseStmt | onErrorStmt | resumeStmt | errorStmt
   *#             | jumpStmt | exitStmt | RETURN | STOP | END
   *#             | ifStmt | forStmt | whileStmt | doStmt | withStmt | directive
   *#             | lExpression "=" expression | lExpression callArguments?
   *</pre>
   */
  Stmt statement() {
    Token token = peek();
    if (token.is(COMMENT)) {
      return new Stmt.Comment(advance());
    }
    if (token.is(INTEGER)) {
      advance();
      return new Stmt.Label(token, token.getPosition());   // Line number
    }
    if (isLabel(token)) {
      advance();
      return new Stmt.Label(token, token.getPosition());
    }
    if (token.is(KEYWORD)) {
      switch (token.lowerCase()) {
        case "call":        return callStmt();
        case "let":
        case "set":
        case "lset":
        case "rset":        return assignment();
        case "dim":
        case "static":
        case "public":
        case "private":
        case "global":
        case "friend":
        case "const":       return declarationOrProcedure();
        case "sub":
        case "function":
        case "property":    return procedure(token, null, false);
        case "redim":       return redimStmt();
        case "erase":       return eraseStmt();
        case "on":          return onErrorStmt();
        case "resume":      return resumeStmt();
        case "error":       return errorStmt();
        case "goto":
        case "gosub":       return jumpStmt();
        case "exit":        return exitStmt();
        case "return":
        case "stop":
        case "end":         return new Stmt.Simple(advance(), null, token.getPosition());
        case "if":          return ifStmt();
        case "for":         return forStmt();
        case "while":       return whileStmt();
        case "do":          return doStmt();
        case "with":        return withStmt();
        case "option":
        case "attribute":   return directive();
        default:            break;
      }
    }
    return assignmentOrCall();
  }

  /**
   *# label ::= IDENTIFIER ":"
   */
  private boolean isLabel(Token token) {
    if (token.isNot(IDENTIFIER)) {
      return false;
    }
    Token next = tokeniser.peek(1);
    return next.is(END_OF_STATEMENT, ":") && next.getPosition().getStartIndex() == token.getPosition().getEndIndex();
  }

  /**
   *# assignmentOrCall ::= lExpression "=" expression | lExpression callArguments?
   */
  private Stmt assignmentOrCall() {
    Token start = peek();
    if (lookahead(this::isCallWithSpacedArgument)) {
      return callStatement(start, new ExpressionParser(false, true).parse(), false);
    }
    Expr target = isSuffixedTarget() ? name(advance(), true) : expression(true);
    if (target == null) {
      throw new ParserError("Expected statement but got '" + start.getText() + "'", start);
    }
    if (matchOperator("=")) {
      Expr value = requiredExpression();
      if (isMid(target)) {
        return midAssign(start, (Expr.IndexExpr)target, value);
      }
      checkLExpression(target);
      return new Stmt.Assign(Stmt.AssignType.LET, target, value, from(start));
    }
    return callStatement(start, target, false);
  }

  /**
   * Check for a call whose first argument starts with '(' or '-' after a blank:
   * "Foo (a), b" and "Debug.Print -1" are calls, not an index followed by more
   * arguments or a subtraction.
   */
  private boolean isCallWithSpacedArgument() {
    Expr target = expression(true);
    if (target == null || peek().is(OPERATOR, "=")) {
      return false;
    }
    return target instanceof Expr.IndexExpr ? peek().is(OPERATOR, ",") : !target.isLExpression();
  }

  /**
   * Check for a name with '&' or '!' type character followed by '=' ("x& = 1")
   */
  private boolean isSuffixedTarget() {
    Token token = peek();
    if (!context.typeSuffixes || token.isNot(IDENTIFIER)) {
      return false;
    }
    Token suffix = tokeniser.peek(1);
    if (!suffix.is(OPERATOR) || !OPERATOR_SUFFIXES.contains(suffix.getText()) ||
        suffix.getPosition().getStartIndex() != token.getPosition().getEndIndex()) {
      return false;
    }
    int distance = 2;
    while (tokeniser.peek(distance).is(BLANK)) {
      distance++;
    }
    return tokeniser.peek(distance).is(OPERATOR, "=");
  }

  /**
   *# callStmt ::= CALL lExpression
   */
  private Stmt callStmt() {
    Token start  = advance();
    Expr  target = requiredExpression();
    if (!target.isLExpression()) {
      throw new ParserError("Expected procedure name", target.getPosition());
    }
    if (target instanceof Expr.IndexExpr) {
      Expr.IndexExpr call = (Expr.IndexExpr)target;
      return new Stmt.CallStmt(call.expr, call.args, true, from(start));
    }
    return new Stmt.CallStmt(target, null, true, from(start));
  }

  private Stmt callStatement(Token start, Expr target, boolean explicit) {
    if (!target.isLExpression()) {
      throw new ParserError("Expected procedure call or assignment", target.getPosition());
    }
    Expr.ArgList args = null;
    if (!isEndOfStatement(peek())) {
      args = callArguments();
    }
    else if (target instanceof Expr.IndexExpr) {
      // f(a, b) as a statement: arguments belong to the call
      Expr.IndexExpr call = (Expr.IndexExpr)target;
      return new Stmt.CallStmt(call.expr, call.args, explicit, from(start));
    }
    return new Stmt.CallStmt(target, args, explicit, from(start));
  }

  /**
   * Arguments of a call statement (no parentheses)
   *<pre>
   *# callArguments ::= argument? ( "," argument? )*
   *# argument      ::= ( IDENTIFIER ":=" )? expression
   *</pre>
   */
  private Expr.ArgList callArguments() {
    List<Expr.Arg> args     = new ArrayList<>();
    Position       location = peek().getPosition();
    while (true) {
      Token token = peek();
      args.add(token.is(OPERATOR, ",") ? new Expr.Arg(null, null, token.getPosition()) : argument());
      if (!peek().is(OPERATOR, ",")) {
        break;
      }
      Token comma = advance();
      if (isEndOfStatement(peek())) {
        args.add(new Expr.Arg(null, null, comma.getPosition()));
        break;
      }
    }
    return new Expr.ArgList(args, location);
  }

  private Expr.Arg argument() {
    Token token = peek();
    if (token.is(IDENTIFIER) && lookahead(() -> advance() != null && peek().is(SYMBOL, ":="))) {
      Expr.Name name = name(advance());
      Token     op   = advance();
      return new Expr.Arg(name, requiredExpression(), op.getPosition());
    }
    Expr value = expression();
    if (value == null) {
      throw new ParserError("Expected argument but got '" + token.getText() + "'", token);
    }
    return new Expr.Arg(value);
  }

  /**
   *# assignment ::= ( LET | SET | LSET | RSET ) lExpression "=" ( NEW typeName | expression )
   */
  private Stmt assignment() {
    Token               keyword = advance();
    Stmt.AssignType     type    = Stmt.AssignType.valueOf(keyword.getText().toUpperCase(Locale.ROOT));
    Expr                target  = lExpression();
    expectOperator("=");
    if (type == Stmt.AssignType.SET && matchKeyword("new")) {
      return new Stmt.Assign(type, target, typeName(), true, from(keyword));
    }
    Expr value = requiredExpression();
    if (type == Stmt.AssignType.LET && isMid(target)) {
      return midAssign(keyword, (Expr.IndexExpr)target, value);
    }
    return new Stmt.Assign(type, target, value, from(keyword));
  }

  private static boolean isMid(Expr target) {
    return target instanceof Expr.IndexExpr &&
           ((Expr.IndexExpr)target).expr instanceof Expr.Name &&
           ((Expr.Name)((Expr.IndexExpr)target).expr).name.textIs("mid", "midb", "mid$", "midb$");
  }

  /**
   *# midAssign ::= ( MID | MIDB | MID$ | MIDB$ ) "(" lExpression "," expression ( "," expression )? ")" "=" expression
   */
  private Stmt midAssign(Token start, Expr.IndexExpr call, Expr value) {
    List<Expr.Arg> args = call.args.args;
    if (args.size() < 2 || args.size() > 3 || args.stream().anyMatch(arg -> arg.isMissing() || arg.name != null)) {
      throw new ParserError("Expected 2 or 3 arguments for " + ((Expr.Name)call.expr).getName() + " assignment", call.args.getPosition());
    }
    Expr target = args.get(0).value;
    checkLExpression(target);
    return new Stmt.MidAssign(((Expr.Name)call.expr).name, target, args.get(1).value,
                              args.size() == 3 ? args.get(2).value : null, value, from(start));
  }

  /**
   *<pre>
   *# declaration ::= ( DIM | STATIC | PUBLIC | PRIVATE | GLOBAL ) SHARED? variable ( "," variable )*
   *#               | ( PUBLIC | PRIVATE | GLOBAL )? CONST constant ( "," constant )*
   *# procedure   ::= ( PUBLIC | PRIVATE | GLOBAL | FRIEND )? STATIC? procedureDecl
   *</pre>
   */
  private Stmt declarationOrProcedure() {
    Token start = peek();
    Token scope = null;
    if (peek().is(KEYWORD, "public", "private", "global", "friend")) {
      scope = advance();
    }
    if (peek().is(KEYWORD, "static")) {
      Token staticToken = advance();
      if (isProcedureStart(peek())) {
        return procedure(start, scope, true);
      }
      if (scope != null) {
        throw new ParserError("Unexpected 'Static'", staticToken);
      }
      return variableDeclaration(start, staticToken);
    }
    if (isProcedureStart(peek())) {
      return procedure(start, scope, false);
    }
    if (matchKeyword("const")) {
      return constDeclaration(start, scope);
    }
    if (peek().is(KEYWORD, "dim")) {
      if (scope != null) {
        throw new ParserError("Unexpected 'Dim'", peek());
      }
      return variableDeclaration(start, advance());
    }
    if (scope == null || scope.textIs("friend")) {
      throw new ParserError("Expected declaration", peek());
    }
    return variableDeclaration(start, scope);
  }

  private static boolean isProcedureStart(Token token) {
    return token.is(KEYWORD, "sub", "function", "property");
  }

  private Stmt variableDeclaration(Token start, Token scope) {
    boolean             shared    = matchKeyword("shared");
    List<Stmt.Variable> variables = new ArrayList<>();
    do {
      matchKeyword("withevents");
      variables.add(variable());
    } while (matchOperator(","));
    return new Stmt.Declaration(scope, false, shared, variables, from(start));
  }

  /**
   *<pre>
   *# variable ::= IDENTIFIER ( "(" bounds? ")" )? ( AS NEW? typeName ( "*" primary )? )?
   *# bounds   ::= bound ( "," bound )*
   *# bound    ::= expression ( TO expression )?
   *</pre>
   */
  private Stmt.Variable variable() {
    Expr.Name        name   = identifier("variable name");
    List<Stmt.Bound> bounds = null;
    if (matchOperator("(")) {
      bounds = bounds();
      expectOperator(")");
    }
    Expr    type        = null;
    boolean isNew       = false;
    Expr    fixedLength = null;
    if (matchKeyword("as")) {
      isNew = matchKeyword("new");
      type  = typeName();
      if (matchOperator("*")) {
        fixedLength = primary();
        if (fixedLength == null) {
          throw new ParserError("Expected string length", peek());
        }
      }
    }
    return new Stmt.Variable(name, bounds, type, isNew, fixedLength, null);
  }

  private List<Stmt.Bound> bounds() {
    List<Stmt.Bound> bounds = new ArrayList<>();
    if (peek().is(OPERATOR, ")")) {
      return bounds;
    }
    do {
      Expr first = requiredExpression();
      bounds.add(matchKeyword("to") ? new Stmt.Bound(first, requiredExpression()) : new Stmt.Bound(null, first));
    } while (matchOperator(","));
    return bounds;
  }

  /**
   *# constant ::= IDENTIFIER ( AS typeName )? "=" expression
   */
  private Stmt constDeclaration(Token start, Token scope) {
    List<Stmt.Variable> constants = new ArrayList<>();
    do {
      Expr.Name name = identifier("constant name");
      Expr      type = matchKeyword("as") ? typeName() : null;
      expectOperator("=");
      constants.add(new Stmt.Variable(name, null, type, false, null, requiredExpression()));
    } while (matchOperator(","));
    return new Stmt.Declaration(scope, true, false, constants, from(start));
  }

  /**
   *# typeName ::= word ( "." word )*
   */
  private Expr typeName() {
    Token token = peek();
    if (!isWord(token)) {
      throw new ParserError("Expected type name", token);
    }
    Expr type = new Expr.Name(advance());
    while (matchOperator(".")) {
      Token member = peek();
      if (!isWord(member)) {
        throw new ParserError("Expected type name", member);
      }
      type = new Expr.MemberAccess(type, new Expr.Name(advance()));
    }
    return type;
  }

  /**
   *<pre>
   *# procedureDecl ::= ( SUB | FUNCTION | PROPERTY ( GET | LET | SET ) ) word ( "(" parameters? ")" )? ( AS typeName )?
   *#                   END_OF_STATEMENT statementBlock END ( SUB | FUNCTION | PROPERTY )
   *</pre>
   */
  private Stmt procedure(Token start, Token scope, boolean isStatic) {
    Token              keyword = advance();
    Stmt.ProcedureType type;
    String             endWord;
    if (keyword.textIs("sub")) {
      type    = Stmt.ProcedureType.SUB;
      endWord = "sub";
    }
    else if (keyword.textIs("function")) {
      type    = Stmt.ProcedureType.FUNCTION;
      endWord = "function";
    }
    else {
      Token kind = expectKeyword("get", "let", "set");
      type    = Stmt.ProcedureType.valueOf("PROPERTY_" + kind.getText().toUpperCase(Locale.ROOT));
      endWord = "property";
    }

    Token nameToken = peek();
    if (!isWord(nameToken)) {
      throw new ParserError("Expected procedure name", nameToken);
    }
    Expr.Name name = name(advance(), true);

    List<Stmt.Parameter> parameters = new ArrayList<>();
    if (matchOperator("(")) {
      if (!peek().is(OPERATOR, ")")) {
        do {
          parameters.add(parameter());
        } while (matchOperator(","));
      }
      expectOperator(")");
    }
    Expr returnType = null;
    if (matchKeyword("as")) {
      returnType = typeName();
      if (matchOperator("(")) {
        expectOperator(")");
      }
    }
    checkEndOfLine(peek());

    Stmt.Block body = block(keyword, "end " + endWord);
    expectKeyword("end");
    expectKeyword(endWord);
    return new Stmt.Procedure(type, scope, isStatic, name, parameters, returnType, body, from(start));
  }

  /**
   *# parameter ::= OPTIONAL? ( BYVAL | BYREF )? PARAMARRAY? IDENTIFIER ( "(" ")" )? ( AS typeName )? ( "=" expression )?
   */
  private Stmt.Parameter parameter() {
    boolean   optional   = matchKeyword("optional");
    Token     passing    = peek().is(KEYWORD, "byval", "byref") ? advance() : null;
    boolean   paramArray = matchKeyword("paramarray");
    Expr.Name name       = identifier("parameter name");
    boolean   isArray    = false;
    if (matchOperator("(")) {
      expectOperator(")");
      isArray = true;
    }
    Expr type         = matchKeyword("as") ? typeName() : null;
    Expr defaultValue = matchOperator("=") ? requiredExpression() : null;
    return new Stmt.Parameter(optional, passing, paramArray, name, isArray, type, defaultValue);
  }

  /**
   *# redimStmt ::= REDIM PRESERVE? variable ( "," variable )*
   */
  private Stmt redimStmt() {
    Token               start     = advance();
    boolean             preserve  = matchKeyword("preserve");
    List<Stmt.Variable> variables = new ArrayList<>();
    do {
      Stmt.Variable variable = variable();
      if (variable.bounds == null) {
        throw new ParserError("Expected array bounds", variable.name.getPosition());
      }
      variables.add(variable);
    } while (matchOperator(","));
    return new Stmt.ReDim(preserve, variables, from(start));
  }

  /**
   *# eraseStmt ::= ERASE lExpression ( "," lExpression )*
   */
  private Stmt eraseStmt() {
    Token      start  = advance();
    List<Expr> arrays = new ArrayList<>();
    do {
      arrays.add(lExpression());
    } while (matchOperator(","));
    return new Stmt.Erase(arrays, from(start));
  }

  /**
   *# onErrorStmt ::= ON ERROR ( GOTO label | RESUME NEXT )
   */
  private Stmt onErrorStmt() {
    Token start = advance();
    expectKeyword("error");
    if (matchKeyword("resume")) {
      expectKeyword("next");
      return new Stmt.OnError(null, true, from(start));
    }
    expectKeyword("goto");
    return new Stmt.OnError(label(), false, from(start));
  }

  /**
   *# resumeStmt ::= RESUME ( NEXT | label )?
   */
  private Stmt resumeStmt() {
    Token start = advance();
    if (matchKeyword("next")) {
      return new Stmt.Resume(null, true, from(start));
    }
    Token label = peek().is(IDENTIFIER, INTEGER) ? label() : null;
    return new Stmt.Resume(label, false, from(start));
  }

  /**
   *# errorStmt ::= ERROR expression
   */
  private Stmt errorStmt() {
    Token start = advance();
    return new Stmt.ErrorStmt(requiredExpression(), from(start));
  }

  /**
   *# jumpStmt ::= ( GOTO | GOSUB ) label
   */
  private Stmt jumpStmt() {
    Token keyword = advance();
    return new Stmt.Jump(keyword, label(), from(keyword));
  }

  private Token label() {
    Token token = peek();
    if (token.isNot(IDENTIFIER, INTEGER)) {
      throw new ParserError("Expected label", token);
    }
    return advance();
  }

  /**
   *# exitStmt ::= EXIT ( SUB | FUNCTION | PROPERTY | FOR | DO )
   */
  private Stmt exitStmt() {
    Token keyword = advance();
    Token what    = expectKeyword("sub", "function", "property", "for", "do");
    return new Stmt.Simple(keyword, what, from(keyword));
  }

  /**
   *<pre>
   *# ifStmt ::= IF expression THEN END_OF_STATEMENT statementBlock
   *#              ( ELSEIF expression THEN statementBlock )*
   *#              ( ELSE statementBlock )?
   *#            ( END IF | ENDIF )
   *#          | IF expression THEN singleLineStatements ( ELSE singleLineStatements )?
   *</pre>
   */
  private Stmt ifStmt() {
    Token start     = advance();
    Expr  condition = requiredExpression();
    expectKeyword("then");

    Token next = peek();
    if (next.is(END_OF_FILE, COMMENT) || next.is(END_OF_STATEMENT) && !next.textIs(":")) {
      String[]          ends      = { "elseif", "else", "end if", "endif" };
      List<Stmt.Branch> branches  = new ArrayList<>();
      Stmt.Block        elseBlock = null;
      branches.add(new Stmt.Branch(condition, block(start, ends)));
      while (true) {
        if (matchKeyword("elseif")) {
          Expr elseIfCondition = requiredExpression();
          expectKeyword("then");
          branches.add(new Stmt.Branch(elseIfCondition, block(start, ends)));
          continue;
        }
        if (matchKeyword("else")) {
          elseBlock = block(start, "end if", "endif");
        }
        break;
      }
      if (!matchKeyword("endif")) {
        expectKeyword("end");
        expectKeyword("if");
      }
      return new Stmt.If(branches, elseBlock, false, from(start));
    }

    Stmt.Block thenBlock = singleLineStatements();
    Stmt.Block elseBlock = matchKeyword("else") ? singleLineStatements() : null;
    return new Stmt.If(List.of(new Stmt.Branch(condition, thenBlock)), elseBlock, true, from(start));
  }

  /**
   * Statements separated by ':' up to the end of the line or an Else
   */
  private Stmt.Block singleLineStatements() {
    List<Stmt> stmts         = new ArrayList<>();
    Position   startPosition = peek().getPosition();
    while (true) {
      Token token = peek();
      if (token.is(END_OF_STATEMENT, ":")) {
        advance();
        continue;
      }
      if (isEndOfStatement(token)) {
        break;
      }
      stmts.add(statement());
      Token next = peek();
      if (!isEndOfStatement(next) && !next.is(END_OF_STATEMENT, ":")) {
        throw new ParserError("Expected end of statement but got '" + next.getText() + "'", next);
      }
    }
    Position position = stmts.isEmpty() ? startPosition
                                        : Position.merge(stmts.get(0).getPosition(), stmts.get(stmts.size() - 1).getPosition());
    return new Stmt.Block(stmts, position);
  }

  /**
   *<pre>
   *# forStmt ::= FOR lExpression "=" expression TO expression ( STEP expression )? statementBlock NEXT lExpression?
   *#           | FOR EACH lExpression IN expression statementBlock NEXT lExpression?
   *</pre>
   */
  private Stmt forStmt() {
    Token start = advance();
    if (matchKeyword("each")) {
      Expr element = lExpression();
      expectKeyword("in");
      Expr       collection = requiredExpression();
      Stmt.Block body       = block(start, "next");
      next();
      return new Stmt.ForEach(element, collection, body, from(start));
    }
    Expr counter = lExpression();
    expectOperator("=");
    Expr initial = requiredExpression();
    expectKeyword("to");
    Expr       limit = requiredExpression();
    Expr       step  = matchKeyword("step") ? requiredExpression() : null;
    Stmt.Block body  = block(start, "next");
    next();
    return new Stmt.For(counter, initial, limit, step, body, from(start));
  }

  private void next() {
    expectKeyword("next");
    if (peek().is(IDENTIFIER)) {
      lExpression();
    }
  }

  /**
   *# whileStmt ::= WHILE expression statementBlock WEND
   */
  private Stmt whileStmt() {
    Token      start     = advance();
    Expr       condition = requiredExpression();
    Stmt.Block body      = block(start, "wend");
    expectKeyword("wend");
    return new Stmt.While(condition, body, from(start));
  }

  /**
   *<pre>
   *# doStmt ::= DO ( ( WHILE | UNTIL ) expression )? statementBlock LOOP
   *#          | DO statementBlock LOOP ( ( WHILE | UNTIL ) expression )?
   *</pre>
   */
  private Stmt doStmt() {
    Token   start          = advance();
    Expr    condition      = null;
    boolean until          = false;
    boolean conditionFirst = false;
    if (peek().is(KEYWORD, "while", "until")) {
      until          = advance().textIs("until");
      condition      = requiredExpression();
      conditionFirst = true;
    }
    Stmt.Block body = block(start, "loop");
    expectKeyword("loop");
    if (condition == null && peek().is(KEYWORD, "while", "until")) {
      until     = advance().textIs("until");
      condition = requiredExpression();
    }
    return new Stmt.DoLoop(condition, until, conditionFirst, body, from(start));
  }

  /**
   *# withStmt ::= WITH expression statementBlock END WITH
   */
  private Stmt withStmt() {
    Token      start  = advance();
    Expr       object = requiredExpression();
    Stmt.Block body   = block(start, "end with");
    expectKeyword("end");
    expectKeyword("with");
    return new Stmt.With(object, body, from(start));
  }

  /**
   *# directive ::= ( OPTION | ATTRIBUTE ) ( any token but END_OF_STATEMENT )*
   */
  private Stmt directive() {
    Token       keyword = advance();
    List<Token> words   = new ArrayList<>();
    while (!isEndOfStatement(peek())) {
      words.add(advance());
    }
    return new Stmt.Directive(keyword, words, from(keyword));
  }

  ////////////////////////////////////////////

  // = Expr

  /**
   *# lExpression ::= expression     (where expression is a name, member access, or index expression)
   */
  Expr lExpression() {
    if (isSuffixedTarget()) {
      return name(advance(), true);
    }
    Token token = peek();
    Expr  expr  = expression(true);
    if (expr == null) {
      throw new ParserError("Expected expression", token);
    }
    checkLExpression(expr);
    return expr;
  }

  private static void checkLExpression(Expr expr) {
    if (!expr.isLExpression()) {
      throw new ParserError("Expected name, member access or index expression", expr.getPosition());
    }
  }

  private Expr requiredExpression() {
    Token token = peek();
    Expr  expr  = expression();
    if (expr == null) {
      throw new ParserError("Expected expression but got '" + token.getText() + "'", token);
    }
    return expr;
  }

  /**
   *<pre>
   *# expression ::= operand ( binaryOp operand )*
   *# operand    ::= ( "-" | NOT )* ( primary | "(" expression ")" | ( "." | "!" ) word ) postfix*
   *# postfix    ::= ( "." | "!" ) word | "(" arguments? ")"
   *# arguments  ::= argument? ( "," argument? )*
   *# argument   ::= ( IDENTIFIER ":=" )? expression
   *</pre>
   * @return the expression or null if no expression starts at the current token
   */
  Expr expression() {
    return expression(false);
  }

  /**
   * @param stopAtEquals  whether '=' ends the expression (assignment targets)
   */
  private Expr expression(boolean stopAtEquals) {
    return new ExpressionParser(stopAtEquals, false).parse();
  }

  private enum Element { NONE, OPERAND, OPERATOR }

  /**
   * Entry on the operator stack. For '(' markers, base is the size of the
   * operand stack at the time the marker was pushed.
   */
  private static class StackEntry {
    final OperatorType type;
    final Token        token;
    final int          base;

    StackEntry(OperatorType type, Token token, int base) {
      this.type  = type;
      this.token = token;
      this.base  = base;
    }
  }

  /**
   * Operator precedence parsing of a single expression.
   * <p>
   * The operator stack is seeded with a sentinel that stands for a virtual
   * open parenthesis enclosing the whole expression. A binary operator first
   * reduces any operators on the stack that bind at least as tightly, stopping
   * at a '(' marker and at an operator of the same type so that chains like
   * a + b + c fold into a single n-ary Operation. Unary prefix operators are
   * pushed without reducing anything.
   * </p><p>
   * At the top level (no unclosed parentheses) the expression ends, without
   * consuming it, at anything that cannot continue it: ',' and ')', keywords
   * that are not operators, an operand following an operand (arguments of a
   * call statement) and, for assignment targets, '='.
   * </p>
   */
  private class ExpressionParser {
    private final boolean           stopAtEquals;
    private final boolean           callTarget;     // Stop at '(' or '-' after a blank (start of call arguments)
    private final Deque<StackEntry> operators = new ArrayDeque<>();
    private final List<Expr>        operands  = new ArrayList<>();
    private final StackEntry        sentinel  = new StackEntry(CLOSE_PAREN, null, 0);
    private       Element           last      = Element.NONE;
    private       int               depth     = 0;
    private       boolean           namedArgumentAllowed = false;   // Last operand is a name starting an argument

    ExpressionParser(boolean stopAtEquals, boolean callTarget) {
      this.stopAtEquals = stopAtEquals;
      this.callTarget   = callTarget;
      operators.push(sentinel);
    }

    Expr parse() {
      while (true) {
        Token token = peek();
        if (token.is(END_OF_FILE, END_OF_STATEMENT, COMMENT)) {
          break;
        }
        boolean canBeNamed = namedArgumentAllowed;
        namedArgumentAllowed = false;
        boolean consumed = last == Element.OPERAND ? afterOperand(token, canBeNamed) : beforeOperand(token);
        if (!consumed) {
          break;
        }
      }
      return finish();
    }

    /**
     * Binary operators, postfix access and call, closing parenthesis
     * @return false if token ends the expression
     */
    private boolean afterOperand(Token token, boolean canBeNamed) {
      if (callTarget && depth == 0 && token.is(OPERATOR, "(", "-") &&
          token.getPosition().getStartIndex() > previous.getPosition().getEndIndex()) {
        return false;
      }
      if (token.is(SYMBOL, ":=")) {
        if (depth == 0) {
          return false;
        }
        if (!canBeNamed) {
          throw new ParserError("Unexpected ':='", token);
        }
        operators.push(new StackEntry(NAMED_ARGUMENT, advance(), operands.size()));
        last = Element.OPERATOR;
        return true;
      }
      if (token.is(OPERATOR, ")")) {
        if (depth == 0) {
          return false;
        }
        closeParen(advance());
        return true;
      }
      if (depth == 0 && (token.is(OPERATOR, ",") || stopAtEquals && token.is(OPERATOR, "="))) {
        return false;
      }
      OperatorType type = OperatorType.of(token, false);
      if (type == null) {
        if (depth == 0) {
          return false;
        }
        throw new ParserError("Expected operator or ')' but got '" + token.getText() + "'", token);
      }
      advance();
      reduce(type.precedence, type);
      operators.push(new StackEntry(type, token, operands.size()));
      if (type == INDEX) {
        depth++;
        last = Element.OPERATOR;
      }
      else if (type.isAccess()) {
        operands.add(memberName());
        last = Element.OPERAND;
      }
      else {
        last = Element.OPERATOR;
      }
      return true;
    }

    /**
     * Operands, prefix operators, grouping, missing arguments
     * @return false if token ends the expression
     */
    private boolean beforeOperand(Token token) {
      boolean argumentStart = last == Element.OPERATOR && operators.peek().type.is(INDEX, COMMA);
      if (token.is(OPERATOR, ",") || token.is(OPERATOR, ")")) {
        if (depth == 0) {
          if (last == Element.NONE) {
            return false;
          }
          throw expected(token);
        }
        if (token.textIs(",") ? argumentStart : last == Element.OPERATOR && operators.peek().type == COMMA) {
          operands.add(new Expr.Arg(null, null, token.getPosition()));    // Missing argument
          last = Element.OPERAND;
          return true;
        }
        if (token.textIs(")") && argumentStart) {
          closeParen(advance());      // Empty argument list
          return true;
        }
        throw expected(token);
      }
      if (token.is(OPERATOR, "(")) {
        operators.push(new StackEntry(GROUP, advance(), operands.size()));
        depth++;
        last = Element.OPERATOR;
        return true;
      }
      if (token.is(OPERATOR, ".", "!")) {
        advance();
        Expr.Name member = memberName();
        operands.add(token.textIs(".") ? new Expr.WithMemberAccess(token, member) : new Expr.WithDictAccess(token, member));
        last = Element.OPERAND;
        return true;
      }
      OperatorType unary = OperatorType.of(token, true);
      if (unary != null && unary.is(NEGATE, NOT)) {
        operators.push(new StackEntry(unary, advance(), operands.size()));
        last = Element.OPERATOR;
        return true;
      }
      Expr operand = primary();
      if (operand == null) {
        if (last == Element.NONE) {
          return false;
        }
        throw expected(token);
      }
      operands.add(operand);
      namedArgumentAllowed = argumentStart && operand instanceof Expr.Name;
      last = Element.OPERAND;
      return true;
    }

    /**
     * Reduce down to the innermost '(' and replace it by a parenthesised
     * expression or an index expression.
     */
    private void closeParen(Token close) {
      reduce(INDEX_CLOSE.precedence, INDEX_CLOSE);
      StackEntry marker = operators.pop();
      if (!marker.type.isParen()) {
        throw new IllegalStateException("Internal error: expected '(' on operator stack but got " + marker.type.name());
      }
      depth--;
      int count = operands.size() - marker.base;
      if (marker.type == GROUP) {
        if (count != 1) {
          throw expected(close);
        }
        Expr inner = pop();
        if (inner instanceof Expr.Arg || inner instanceof Expr.ArgList) {
          throw new ParserError("Unexpected argument list", inner.getPosition());
        }
        operands.add(new Expr.ParenExpr(inner, marker.token, close));
      }
      else {
        Expr.ArgList args;
        if (count == 0) {
          args = new Expr.ArgList(List.of(), Position.merge(marker.token.getPosition(), close.getPosition()));
        }
        else {
          Expr inner = pop();
          args = inner instanceof Expr.ArgList ? (Expr.ArgList)inner : new Expr.ArgList(List.of(asArg(inner)));
        }
        Expr base = pop();
        operands.add(new Expr.IndexExpr(base, args, close));
      }
      last = Element.OPERAND;
    }

    /**
     * Reduce operators that bind at least as tightly as the given precedence.
     * Stops at a '(' marker, at the sentinel and at an operator of the given type.
     */
    private void reduce(int precedence, OperatorType type) {
      while (true) {
        StackEntry top = operators.peek();
        if (top == sentinel || top.type.isParen() || top.type.precedence < precedence || top.type == type) {
          return;
        }
        reduceTop();
      }
    }

    /**
     * Pop the run of identical operators from the top of the stack and replace
     * their operands by the resulting node.
     */
    private void reduceTop() {
      StackEntry  top    = operators.pop();
      List<Token> tokens = new ArrayList<>();
      tokens.add(top.token);
      while (top.type != NAMED_ARGUMENT && operators.peek().type == top.type) {
        tokens.add(operators.pop().token);
      }
      Collections.reverse(tokens);
      int count = top.type == NAMED_ARGUMENT ? 2 : top.type.isUnary ? 1 : tokens.size() + 1;
      if (operands.size() < count) {
        throw new IllegalStateException("Internal error: " + operands.size() + " operands for " + count + " x " + top.type.name());
      }
      List<Expr> args = new ArrayList<>(operands.subList(operands.size() - count, operands.size()));
      operands.subList(operands.size() - count, operands.size()).clear();
      operands.add(reduced(top.type, tokens, args));
    }

    private Expr reduced(OperatorType type, List<Token> tokens, List<Expr> args) {
      switch (type) {
        case MEMBER:
        case DICT: {
          Expr result = args.get(0);
          for (Expr member: args.subList(1, args.size())) {
            if (!(member instanceof Expr.Name)) {
              throw new ParserError("Expected member name", member.getPosition());
            }
            result = type == MEMBER ? new Expr.MemberAccess(result, (Expr.Name)member)
                                    : new Expr.DictAccess(result, (Expr.Name)member);
          }
          return result;
        }
        case COMMA:
          return new Expr.ArgList(args.stream().map(Parser::asArg).collect(Collectors.toList()));
        case NAMED_ARGUMENT:
          return new Expr.Arg((Expr.Name)args.get(0), args.get(1), tokens.get(0).getPosition());
        default:
          for (Expr arg: args) {
            if (arg instanceof Expr.Arg || arg instanceof Expr.ArgList) {
              throw new ParserError("Unexpected argument", arg.getPosition());
            }
          }
          return new Expr.Operation(new Expr.Operator(type, tokens), args);
      }
    }

    private Expr finish() {
      if (last == Element.NONE) {
        return null;
      }
      if (depth > 0) {
        StackEntry open = operators.stream().filter(entry -> entry.type.isParen()).findFirst().orElseThrow();
        throw new ParserError("Unbalanced parenthesis", open.token);
      }
      if (last == Element.OPERATOR) {
        throw expected(peek());
      }
      reduce(CLOSE_PAREN.precedence, CLOSE_PAREN);
      if (operands.size() != 1) {
        throw new ParserError("Expected single expression", operands.get(operands.size() - 1).getPosition());
      }
      return operands.get(0);
    }

    private Expr pop() {
      return operands.remove(operands.size() - 1);
    }

    /**
     * Error for a missing operand: positioned at last operand if there is one
     */
    private ParserError expected(Token token) {
      Position position = operands.isEmpty() ? token.getPosition() : operands.get(operands.size() - 1).getPosition();
      return new ParserError("Expected expression but got '" + token.getText() + "'", position);
    }
  }

  private static Expr.Arg asArg(Expr expr) {
    return expr instanceof Expr.Arg ? (Expr.Arg)expr : new Expr.Arg(expr);
  }

  /**
   * Name after '.' or '!': any word, including reserved words
   */
  private Expr.Name memberName() {
    Token token = peek();
    if (!isWord(token)) {
      throw new ParserError("Expected member name but got '" + token.getText() + "'", token);
    }
    return name(advance());
  }

  /**
   *# primary ::= literal | IDENTIFIER | ME
   */
  Expr primary() {
    Expr.Literal literal = literal();
    if (literal != null) {
      return literal;
    }
    Token token = peek();
    if (token.is(IDENTIFIER) || token.is(KEYWORD) && NAME_KEYWORDS.contains(token.lowerCase())) {
      return name(advance());
    }
    return null;
  }

  private Expr.Name identifier(String what) {
    Token token = peek();
    if (token.isNot(IDENTIFIER)) {
      throw new ParserError("Expected " + what + " but got '" + token.getText() + "'", token);
    }
    return name(advance(), true);
  }

  private Expr.Name name(Token token) {
    return name(token, false);
  }

  /**
   * Create Name from token, absorbing an immediately following type declaration
   * character if enabled.
   * @param token     the name
   * @param declared  true if the name is being declared or assigned, where '&amp;' and '!' are also type characters
   */
  private Expr.Name name(Token token, boolean declared) {
    if (context.typeSuffixes && token.is(IDENTIFIER)) {
      Token   next     = tokeniser.peek();
      boolean isSuffix = next.is(SYMBOL) && TYPE_SUFFIXES.contains(next.getText()) ||
                         declared && next.is(OPERATOR) && OPERATOR_SUFFIXES.contains(next.getText());
      if (isSuffix && next.getPosition().getStartIndex() == token.getPosition().getEndIndex()) {
        tokeniser.pop();
        token    = token.concat(next);
        previous = token;
      }
    }
    return new Expr.Name(token);
  }

  /**
   *# literal ::= INTEGER | FLOAT | STRING | BOOLEAN | VARIANT | OBJECT
   */
  Expr.Literal literal() {
    Token token = peek();
    switch (token.getType()) {
      case INTEGER: return integer();
      case FLOAT:   return floatLiteral();
      case STRING:  return string();
      case BOOLEAN:
        advance();
        return new Expr.Literal(token, VbaType.BOOLEAN, token.textIs("true"));
      case VARIANT:
        advance();
        return new Expr.Literal(token, token.textIs("empty") ? VbaType.EMPTY : VbaType.NULL, null);
      case OBJECT:
        advance();
        return new Expr.Literal(token, VbaType.NOTHING, null);
      default:
        return null;
    }
  }

  /**
   * Integer literal: decimal, octal (&amp;o or &amp;) or hex (&amp;h) with optional
   * type suffix (% Integer, &amp; Long, ^ LongLong). Without a suffix the value
   * is an Integer if it fits in 16 bits and a Long if it fits in 32 bits. A
   * decimal value too large for a Long is a Double.
   */
  Expr.Literal integer() {
    Token token = peek();
    if (token.isNot(INTEGER)) {
      return null;
    }
    advance();

    String  text     = token.getText();
    VbaType declared = null;
    switch (text.charAt(text.length() - 1)) {
      case '%': declared = VbaType.INTEGER;   break;
      case '&': declared = VbaType.LONG;      break;
      case '^': declared = VbaType.LONG_LONG; break;
      default:  break;
    }
    String digits = declared == null ? text : text.substring(0, text.length() - 1);
    int    radix  = 10;
    if (digits.startsWith("&")) {
      char base = Character.toLowerCase(digits.charAt(1));
      radix  = base == 'h' ? 16 : 8;
      digits = digits.substring(base == 'h' || base == 'o' ? 2 : 1);
    }
    BigInteger value   = new BigInteger(digits, radix);
    boolean    decimal = radix == 10;

    if (declared != null) {
      Long result = fitInteger(value, declared.bits(), decimal);
      if (result == null) {
        throw new ParserError(declared.getTypeName() + " literal out of range", token);
      }
      return new Expr.Literal(token, declared, boxInteger(declared, result));
    }
    for (int bits: new int[]{ 16, 32 }) {
      Long result = fitInteger(value, bits, decimal);
      if (result != null) {
        VbaType type = VbaType.integerOfBits(bits);
        return new Expr.Literal(token, type, boxInteger(type, result));
      }
    }
    if (decimal) {
      return new Expr.Literal(token, VbaType.DOUBLE, value.doubleValue());
    }
    throw new ParserError("Long literal out of range", token);
  }

  /**
   * Decimal values must fit in the positive half of the range. Other bases can
   * use the full width with the top bit giving a negative value.
   * @return the value or null if it does not fit
   */
  private static Long fitInteger(BigInteger value, int bits, boolean decimal) {
    BigInteger max = BigInteger.ONE.shiftLeft(decimal ? bits - 1 : bits).subtract(BigInteger.ONE);
    if (value.compareTo(max) > 0) {
      return null;
    }
    if (value.testBit(bits - 1)) {
      value = value.subtract(BigInteger.ONE.shiftLeft(bits));
    }
    return value.longValue();
  }

  private static Object boxInteger(VbaType type, long value) {
    switch (type) {
      case INTEGER: return (short)value;
      case LONG:    return (int)value;
      default:      return value;
    }
  }

  /**
   * Floating point literal with optional suffix (! Single, # Double, @ Currency).
   * The exponent marker can be 'e' or 'd'.
   */
  Expr.Literal floatLiteral() {
    Token token = peek();
    if (token.isNot(FLOAT)) {
      return null;
    }
    advance();

    String  text = token.getText();
    VbaType type = VbaType.DOUBLE;
    switch (text.charAt(text.length() - 1)) {
      case '!': type = VbaType.SINGLE;   break;
      case '#': type = VbaType.DOUBLE;   break;
      case '@': type = VbaType.CURRENCY; break;
      default:  break;
    }
    if ("!#@".indexOf(text.charAt(text.length() - 1)) >= 0) {
      text = text.substring(0, text.length() - 1);
    }

    BigDecimal value;
    try {
      int exponentIndex = indexOfExponent(text);
      if (exponentIndex < 0) {
        value = new BigDecimal(text);
      }
      else {
        int exponent = Integer.parseInt(text.substring(exponentIndex + 1));
        value = new BigDecimal(text.substring(0, exponentIndex)).scaleByPowerOfTen(exponent);
      }
    }
    catch (NumberFormatException | ArithmeticException e) {
      throw new ParserError(type.getTypeName() + " literal out of range", token);
    }

    switch (type) {
      case SINGLE: {
        float result = value.floatValue();
        if (Float.isInfinite(result)) {
          throw new ParserError("Single literal out of range", token);
        }
        return new Expr.Literal(token, type, result);
      }
      case CURRENCY: {
        try {
          long scaled = value.multiply(BigDecimal.valueOf(VbaType.CURRENCY_SCALE)).setScale(0, RoundingMode.HALF_EVEN).longValueExact();
          return new Expr.Literal(token, type, scaled);
        }
        catch (ArithmeticException e) {
          throw new ParserError("Currency literal out of range", token);
        }
      }
      default: {
        double result = value.doubleValue();
        if (Double.isInfinite(result)) {
          throw new ParserError("Double literal out of range", token);
        }
        return new Expr.Literal(token, type, result);
      }
    }
  }

  private static int indexOfExponent(String text) {
    for (int i = 0; i < text.length(); i++) {
      if ("eEdD".indexOf(text.charAt(i)) >= 0) {
        return i;
      }
    }
    return -1;
  }

  /**
   * String literal: quotes removed and "" replaced by "
   */
  Expr.Literal string() {
    Token token = peek();
    if (token.isNot(STRING)) {
      return null;
    }
    advance();
    String text = token.getText();
    return new Expr.Literal(token, VbaType.STRING, text.substring(1, text.length() - 1).replace("\"\"", "\""));
  }

  ////////////////////////////////////////////

  // = Token helpers

  private void skipBlanks() {
    while (tokeniser.peek().is(BLANK)) {
      tokeniser.pop();
    }
  }

  private Token peek() {
    skipBlanks();
    return tokeniser.peek();
  }

  private Token advance() {
    skipBlanks();
    previous = tokeniser.pop();
    return previous;
  }

  private static boolean isWord(Token token) {
    return token.is(IDENTIFIER, KEYWORD, OPERATOR, BOOLEAN, VARIANT, OBJECT) &&
           !token.isEmpty() && Character.isLetter(token.getText().charAt(0));
  }

  /**
   * End of statement: new line, ':', comment, end of file, or Else of a single line If
   */
  private static boolean isEndOfStatement(Token token) {
    return token.is(END_OF_STATEMENT, END_OF_FILE, COMMENT) || token.is(KEYWORD, "else");
  }

  private void checkEndOfLine(Token token) {
    if (token.isNot(END_OF_STATEMENT, END_OF_FILE, COMMENT)) {
      throw new ParserError("Expected end of line but got '" + token.getText() + "'", token);
    }
  }

  private boolean matchOperator(String symbol) {
    if (peek().is(OPERATOR, symbol)) {
      advance();
      return true;
    }
    return false;
  }

  private boolean matchKeyword(String keyword) {
    if (peek().is(KEYWORD, keyword)) {
      advance();
      return true;
    }
    return false;
  }

  private Token expectOperator(String symbol) {
    Token token = peek();
    if (!token.is(OPERATOR, symbol)) {
      throw new ParserError("Expected '" + symbol + "' but got '" + token.getText() + "'", token);
    }
    return advance();
  }

  private Token expectKeyword(String keyword, String... others) {
    Token token = peek();
    if (!token.is(KEYWORD, keyword, others)) {
      List<String> expected = new ArrayList<>(List.of(keyword));
      expected.addAll(List.of(others));
      throw new ParserError("Expected '" + String.join("' or '", expected) + "' but got '" + token.getText() + "'", token);
    }
    return advance();
  }

  /**
   * Check whether the next tokens are the keywords of one of the given phrases
   * ("end if"). Nothing is consumed.
   */
  private boolean lookingAtAny(String... phrases) {
    for (String phrase: phrases) {
      String[] words = phrase.split(" ");
      if (lookahead(() -> Arrays.stream(words).allMatch(this::matchKeyword))) {
        return true;
      }
    }
    return false;
  }

  /**
   * Run lambda and then rewind to where we were
   * @param lambda  lambda returning true if lookahead succeeds
   * @return result of lambda or false if it threw a ParserError
   */
  private boolean lookahead(Supplier<Boolean> lambda) {
    Token savedPrevious = previous;
    tokeniser.saveCheckpoint();
    try {
      return lambda.get();
    }
    catch (ParserError e) {
      return false;
    }
    finally {
      tokeniser.backtrack();
      previous = savedPrevious;
    }
  }

  /**
   * Position from start token to last token consumed
   */
  private Position from(Token start) {
    return Position.merge(start.getPosition(), previous.getPosition());
  }
}
