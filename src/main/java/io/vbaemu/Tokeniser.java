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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.vbaemu.TokenType.*;

/**
 * Two-pass tokeniser for VBA source code.
 *
 * The first pass tries an ordered list of scanners at the current offset and
 * the first one that matches wins (order encodes priority: blanks and line
 * continuations before symbols, numeric literals with suffixes before plain
 * integers, etc). The second pass reclassifies identifiers that are reserved
 * words and symbols that are operators.
 *
 * Tokens are produced on demand and kept in a buffer so that the Parser can
 * look ahead an arbitrary distance and can speculatively parse an alternative
 * after saving a checkpoint. Checkpoints are just indexes into the buffer so
 * backtracking never rescans any characters. Checkpoints nest: an inner
 * checkpoint can be discarded (committed) and an outer backtrack will still
 * restore the stream to where the outer checkpoint was taken.
 *
 * Scanning stops at the first malformed character sequence with a LexerError.
 */
public class Tokeniser {
  private static final Logger logger = LoggerFactory.getLogger(Tokeniser.class);

  private static final int COMPACT_THRESHOLD = 1024;

  private final String source;            // The source code being tokenised
  private final String streamName;        // Name used in positions/diagnostics
  private final int    length;
  private       int    offset = 0;        // Current offset of the first pass
  private       int    line   = 1;
  private       int    column = 1;

  private       Token  rawLookahead;      // First pass token read ahead by the Mid$ rule

  private final List<Token>    buffer      = new ArrayList<>();   // Tokens produced by the second pass
  private       int            current     = 0;                   // Index of next token to pop
  private final Deque<Integer> checkpoints = new ArrayDeque<>();
  private       Token          previousToken;

  /**
   * Constructor
   * @param source  the source code to tokenise
   */
  public Tokeniser(String source) {
    this(source, null);
  }

  /**
   * Constructor
   * @param source      the source code to tokenise
   * @param streamName  the name of the source, replaced by the MD5 sum of the source if null or empty
   */
  public Tokeniser(String source, String streamName) {
    this.source     = source;
    this.length     = source.length();
    this.streamName = streamName == null || streamName.isEmpty() ? md5(source) : streamName;
  }

  public String getStreamName() {
    return streamName;
  }

  /**
   * Return the next token and advance. Once the end of the source has been
   * reached every call returns an empty END_OF_FILE token.
   * @return the next token
   * @throws LexerError if the source is malformed
   */
  public Token pop() {
    fill(current);
    Token token = buffer.get(current);
    if (token.isNot(END_OF_FILE)) {
      current++;
    }
    previousToken = token;
    compact();
    return token;
  }

  /**
   * Peek at a token without consuming anything
   * @param distance  how far ahead (0 is the next token)
   * @return the token
   * @throws LexerError if one of the tokens up to distance is malformed
   */
  public Token peek(int distance) {
    if (distance < 0) {
      throw new IllegalArgumentException("Internal error: cannot peek at negative distance " + distance);
    }
    fill(current + distance);
    return buffer.get(current + distance);
  }

  public Token peek() {
    return peek(0);
  }

  /**
   * @return the last token returned by pop() (null at start of stream)
   */
  public Token previous() {
    return previousToken;
  }

  /**
   * Remember the current position so that the stream can be rewound to it.
   * Checkpoints nest.
   */
  public void saveCheckpoint() {
    checkpoints.push(current);
  }

  /**
   * Rewind to the innermost checkpoint and forget it
   */
  public void backtrack() {
    if (checkpoints.isEmpty()) {
      throw new IllegalStateException("Internal error: backtrack with no active checkpoint");
    }
    current       = checkpoints.pop();
    previousToken = current > 0 ? buffer.get(current - 1) : null;
  }

  /**
   * Commit the innermost checkpoint. Tokens popped since remain replayable
   * by any outer checkpoint.
   */
  public void discardCheckpoint() {
    if (checkpoints.isEmpty()) {
      throw new IllegalStateException("Internal error: discard with no active checkpoint");
    }
    checkpoints.pop();
  }

  public int checkpointDepth() {
    return checkpoints.size();
  }

  /**
   * @return all remaining tokens including the final END_OF_FILE token
   */
  public List<Token> tokens() {
    List<Token> tokens = new ArrayList<>();
    Token token;
    do {
      token = pop();
      tokens.add(token);
    } while (token.isNot(END_OF_FILE));
    return tokens;
  }

  //////////////////////////////////////////////////////////////////

  private void fill(int index) {
    while (buffer.size() <= index) {
      secondPass();
    }
  }

  /**
   * Drop tokens that can no longer be replayed
   */
  private void compact() {
    if (checkpoints.isEmpty() && current > COMPACT_THRESHOLD) {
      buffer.subList(0, current).clear();
      current = 0;
    }
  }

  /**
   * Reclassify the next first pass token and add it (or the composite Mid$/MidB$
   * token) to the buffer.
   */
  private void secondPass() {
    Token token = nextRawToken();

    if (token.is(IDENTIFIER) && KEYWORDS.contains(token.lowerCase())) {
      TokenType specialised = SPECIALISED_KEYWORDS.get(token.lowerCase());
      if (specialised != null) {
        token = token.withType(specialised);
      }
      else if (token.textIs("mid", "midb")) {
        // Mid$ and MidB$ are distinct names but '$' is otherwise a symbol on its own
        Token next = nextRawToken();
        if (next.is(SYMBOL) && next.textIs("$")) {
          token = token.concat(next);
        }
        else {
          rawLookahead = next;
        }
      }
      else {
        token = token.withType(KEYWORD);
      }
    }
    else if (token.is(SYMBOL) && OPERATOR_SYMBOLS.contains(token.getText())) {
      token = token.withType(OPERATOR);
    }

    logger.trace("{}: {}", streamName, token);
    buffer.add(token);
  }

  private Token nextRawToken() {
    if (rawLookahead != null) {
      Token token = rawLookahead;
      rawLookahead = null;
      return token;
    }
    return firstPass();
  }

  /**
   * Try each scanner in turn at the current offset and return the token for the
   * first one that matches.
   */
  private Token firstPass() {
    for (Scanner scanner: SCANNERS) {
      int end = scanner.scan(source, offset, length);
      if (end < 0) {
        continue;
      }
      Position position = Position.fromIndices(streamName, source, offset, end, line, column);
      Token    token    = new Token(source.substring(offset, end), scanner.type, position);
      offset = end;
      line   = position.getEndLine();
      column = position.getEndColumn();
      return token;
    }

    Position position = Position.fromIndices(streamName, source, offset, offset + 1, line, column);
    LexerError error = new LexerError("Can't scan this line", position);
    logger.debug("Scanning failed: {}", error.getSingleLineMessage());
    throw error;
  }

  private static String md5(String source) {
    try {
      byte[]        digest = MessageDigest.getInstance("MD5").digest(source.getBytes(StandardCharsets.UTF_8));
      StringBuilder sb     = new StringBuilder();
      for (byte b: digest) {
        sb.append(String.format("%02x", b));
      }
      return sb.toString();
    }
    catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("Internal error: MD5 not available", e);
    }
  }

  //////////////////////////////////////////////////////////////////////

  // = INIT

  private static class Scanner {
    final Pattern   pattern;
    final TokenType type;

    Scanner(String regex, TokenType type) {
      this.pattern = regex == null ? null : Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
      this.type    = type;
    }

    /**
     * @return end offset of the token starting at offset or -1 if no match
     */
    int scan(String source, int offset, int length) {
      if (pattern == null) {
        return offset == length ? offset : -1;   // End of file
      }
      if (offset >= length) {
        return -1;
      }
      Matcher matcher = pattern.matcher(source).region(offset, length).useTransparentBounds(true);
      return matcher.lookingAt() ? matcher.end() : -1;
    }
  }

  private static final String BLANK_CHARS = "[\\t \\u0019\\u3000]";
  private static final String NOT_EOL     = "[^\\r\\n\\u2028\\u2029]";
  private static final String AT_EOL      = "(?=[\\r\\n\\u2028\\u2029]|\\z)";

  // Order matters: first scanner that matches wins
  private static final List<Scanner> SCANNERS = List.of(
    new Scanner(null, END_OF_FILE),
    new Scanner(BLANK_CHARS + "+(_" + BLANK_CHARS + "*(\\r\\n|\\r|\\n|\\u2028|\\u2029)" + BLANK_CHARS + "*)?", BLANK),
    new Scanner("[0-9]+[!#@]", FLOAT),
    new Scanner("[0-9]+(\\.[0-9]*)?[de][+-]?[0-9]+[!#@]?", FLOAT),
    new Scanner("[0-9]+\\.[0-9]+[!#@]?", FLOAT),
    new Scanner("\\.[0-9]+([de][+-]?[0-9]+)?[!#@]?", FLOAT),
    new Scanner("([0-9]+|&o?[0-7]+|&h[0-9a-f]+)[%&^]?", INTEGER),
    new Scanner("\"[^\"]*+(\"\"[^\"]*+)*+\"", STRING),
    new Scanner(":=|<=|=<|>=|=>|<>|><|[,.!?#()\\[\\];%&^@$+\\-*/\\\\<>=]", SYMBOL),
    new Scanner("\\r\\n|\\r|\\n|\\u2028|\\u2029|:", END_OF_STATEMENT),
    new Scanner("Rem(" + BLANK_CHARS + NOT_EOL + "*)?" + AT_EOL, COMMENT),
    new Scanner("[a-z][a-z0-9_]*", IDENTIFIER),
    new Scanner("'" + NOT_EOL + "*" + AT_EOL, COMMENT)
  );

  // Reserved words (lower case)
  static final Set<String> KEYWORDS = Set.of(
    "access", "addressof", "alias", "and", "any", "append", "as", "attribute", "base", "binary", "boolean",
    "byref", "byte", "byval", "call", "case", "class_initialize", "class_terminate", "close", "compare",
    "const", "currency", "date", "declare", "defbool", "defbyte", "defcur", "defdate", "defdbl", "defint",
    "deflng", "deflnglng", "deflngptr", "defobj", "defsng", "defstr", "defvar", "dim", "do", "double",
    "each", "else", "elseif", "empty", "end", "endif", "enum", "eqv", "erase", "error", "event", "exit",
    "explicit", "false", "for", "friend", "function", "get", "global", "go", "gosub", "goto", "if", "imp",
    "implements", "in", "input", "integer", "is", "len", "let", "lib", "like", "line", "lineinput", "lock",
    "long", "longlong", "longptr", "loop", "lset", "me", "mid", "midb", "mod", "module", "new", "next",
    "not", "nothing", "null", "object", "on", "open", "option", "optional", "or", "output", "paramarray",
    "preserve", "print", "private", "property", "ptrsafe", "public", "put", "raiseevent", "random", "read",
    "redim", "rem", "reset", "resume", "return", "rset", "seek", "select", "set", "shared", "single", "spc",
    "static", "step", "stop", "string", "sub", "tab", "text", "then", "to", "true", "type", "typeof",
    "unlock", "until", "variant", "vb_base", "vb_control", "vb_creatable", "vb_customizable",
    "vb_description", "vb_exposed", "vb_ext_key", "vb_globalnamespace", "vb_helpid", "vb_invoke_func",
    "vb_invoke_property", "vb_invoke_propertyput", "vb_invoke_propertyputref", "vb_memberflags", "vb_name",
    "vb_predeclaredid", "vb_procdata", "vb_templatederived", "vb_usermemid", "vb_vardescription",
    "vb_varhelpid", "vb_varmemberflags", "vb_varprocdata", "vb_varusermemid", "wend", "while", "width",
    "with", "withevents", "write", "xor"
  );

  // Reserved words that get their own category
  static final Map<String,TokenType> SPECIALISED_KEYWORDS = Map.ofEntries(
    Map.entry("like",    OPERATOR),
    Map.entry("is",      OPERATOR),
    Map.entry("not",     OPERATOR),
    Map.entry("and",     OPERATOR),
    Map.entry("or",      OPERATOR),
    Map.entry("xor",     OPERATOR),
    Map.entry("eqv",     OPERATOR),
    Map.entry("imp",     OPERATOR),
    Map.entry("false",   BOOLEAN),
    Map.entry("true",    BOOLEAN),
    Map.entry("empty",   VARIANT),
    Map.entry("null",    VARIANT),
    Map.entry("nothing", OBJECT)
  );

  // Symbols that are operators
  static final Set<String> OPERATOR_SYMBOLS = Set.of(
    "+", "-", "*", "/", "\\", "^", "&", "=", "<>", "><", "<", ">", "<=", "=<", ">=", "=>", "(", ")", ".", "!", ","
  );
}
