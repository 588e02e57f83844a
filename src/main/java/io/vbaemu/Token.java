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

import java.util.Locale;
import java.util.Objects;

/**
 * A single token read from VBA source code: its exact text, its category
 * and its position in the source.
 *
 * Comparisons between tokens are case-insensitive on the text (VBA is not
 * case sensitive) but also take the category into account so that the
 * identifier "Hey" is not equal to a keyword "Hey". Tokens are immutable:
 * reclassification during the second pass creates a new token.
 */
public final class Token {
  private final String    text;
  private final TokenType type;
  private final Position  position;

  public Token(String text, TokenType type, Position position) {
    this.text     = Objects.requireNonNull(text);
    this.type     = Objects.requireNonNull(type);
    this.position = position;
  }

  /**
   * Construct a token of a different type from an existing token
   * @param type   the new token type
   * @return the new token
   */
  public Token withType(TokenType type) {
    return type == this.type ? this : new Token(text, type, position);
  }

  public String    getText()     { return text; }
  public TokenType getType()     { return type; }
  public Position  getPosition() { return position; }

  /**
   * Check if type of token matches any of types passed in
   * @param types  the types to check
   * @return true if type matches one of the supplied types
   */
  public boolean is(TokenType... types) {
    return type.is(types);
  }

  public boolean isNot(TokenType... types) {
    return !type.is(types);
  }

  /**
   * Case-insensitive check of the token text against the given values
   * @param values  the values to compare against
   * @return true if the text matches one of the values
   */
  public boolean textIs(String... values) {
    for (String value: values) {
      if (text.equalsIgnoreCase(value)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Check both type and (case-insensitive) text
   */
  public boolean is(TokenType type, String value, String... values) {
    return this.type == type && (textIs(value) || textIs(values));
  }

  public String lowerCase() {
    return text.toLowerCase(Locale.ROOT);
  }

  public boolean isEmpty() {
    return text.isEmpty();
  }

  /**
   * Concatenate this token with the token that immediately follows it in the
   * same source. The result keeps the category of this token.
   * @param next  the adjacent token
   * @return the combined token
   * @throws IllegalArgumentException if the tokens are not adjacent in the same file
   */
  public Token concat(Token next) {
    if (!Objects.equals(position.getFileName(), next.position.getFileName())) {
      throw new IllegalArgumentException("Internal error: cannot concatenate tokens from different files");
    }
    if (position.getEndIndex() != next.position.getStartIndex()) {
      throw new IllegalArgumentException("Internal error: cannot concatenate non-adjacent tokens '" + text + "' and '" + next.text + "'");
    }
    return new Token(text + next.text, type, position.merge(next.position));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) { return true; }
    if (!(o instanceof Token)) { return false; }
    Token other = (Token) o;
    return type == other.type && text.equalsIgnoreCase(other.text);
  }

  @Override
  public int hashCode() {
    return lowerCase().hashCode();
  }

  @Override
  public String toString() {
    return "Token{" +
           "type='" + type +
           "', value='" + text + '\'' +
           '}';
  }
}
