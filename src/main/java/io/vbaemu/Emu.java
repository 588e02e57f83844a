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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * <p>The Emu class is the main entry point for reading VBA source. It turns
 * source text into tokens or into an AST.</p>
 * <p>Every call works on its own Tokeniser/Parser pair so different sources
 * can be parsed concurrently.</p>
 * <p>The stream name is only used in diagnostics. If no name is given the name
 * configured in the {@link EmuContext} is used and, failing that, the MD5 sum
 * of the source.</p>
 */
public class Emu {
  private static final Logger logger = LoggerFactory.getLogger(Emu.class);

  /**
   * Tokenise source
   * @param source  the source code
   * @param name    the stream name (may be null)
   * @return the tokens including the final END_OF_FILE token
   * @throws LexerError if the source cannot be tokenised
   */
  public static List<Token> tokenise(String source, String name) {
    return tokenise(source, name, EmuContext.create().build());
  }

  public static List<Token> tokenise(String source, String name, EmuContext context) {
    Tokeniser   tokeniser = new Tokeniser(source, context.streamName(name));
    List<Token> tokens    = tokeniser.tokens();
    if (context.isDebug()) {
      logger.debug("{}: {} tokens", tokeniser.getStreamName(), tokens.size());
      tokens.forEach(token -> logger.debug("  {}", token));
    }
    return tokens;
  }

  /**
   * Parse a whole module
   * @param source  the source code
   * @param name    the stream name (may be null)
   * @return the block of top level statements
   * @throws LexerError  if the source cannot be tokenised
   * @throws ParserError if the source is not valid
   */
  public static Stmt.Block parse(String source, String name) {
    return parse(source, name, EmuContext.create().build());
  }

  public static Stmt.Block parse(String source, String name, EmuContext context) {
    return (Stmt.Block)parse("module", source, name, context);
  }

  /**
   * Parse an expression. Nothing after the expression is checked.
   * @param source  the source code
   * @return the expression or null if source does not start with an expression
   */
  public static Expr parseExpression(String source) {
    return (Expr)parse("expression", source, null, EmuContext.create().build());
  }

  /**
   * Parse source using the named grammar rule
   * @param rule     the rule ("module", "statement", "expression", "integer", ...)
   * @param source   the source code
   * @param name     the stream name (may be null)
   * @param context  the context
   * @return the AST node or null
   * @throws LexerError  if the source cannot be tokenised
   * @throws ParserError if the source does not match or the rule is unknown
   */
  public static Object parse(String rule, String source, String name, EmuContext context) {
    Tokeniser tokeniser = new Tokeniser(source, context.streamName(name));
    logger.info("Parsing {} ({} characters) as {}", tokeniser.getStreamName(), source.length(), rule);
    try {
      Object result = new Parser(tokeniser, context).parse(rule);
      if (context.isDebug()) {
        logger.debug("{}: {}", tokeniser.getStreamName(), dump(result));
      }
      return result;
    }
    catch (EmuError e) {
      logger.debug("Parsing {} failed: {}", tokeniser.getStreamName(), e.getSingleLineMessage());
      throw e;
    }
  }

  private static String dump(Object node) {
    if (node instanceof Expr) {
      return AstDumper.dump((Expr)node);
    }
    return node instanceof Stmt ? AstDumper.dump((Stmt)node) : String.valueOf(node);
  }
}
