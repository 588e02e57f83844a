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

/**
 * Categories of tokens. The first group is produced by the first (scanning)
 * pass of the Tokeniser, the second group by the reclassification pass.
 */
public enum TokenType {
  //= First pass
  START_OF_FILE,
  END_OF_FILE,
  END_OF_STATEMENT,   // Line terminator or ':'
  BLANK,              // Spaces/tabs, including line continuations
  SYMBOL,             // One or two char punctuation
  COMMENT,            // Rem or ' comment
  INTEGER,
  FLOAT,
  STRING,             // Including enclosing quotes
  IDENTIFIER,

  //= Second pass
  KEYWORD,
  OPERATOR,
  BOOLEAN,            // True, False
  VARIANT,            // Empty, Null
  OBJECT;             // Nothing

  public boolean is(TokenType... types) {
    for (TokenType type: types) {
      if (this == type) {
        return true;
      }
    }
    return false;
  }

  public boolean isFirstPass() {
    return ordinal() <= IDENTIFIER.ordinal();
  }

  /**
   * True for tokens that can never be part of an expression and so end any
   * expression being parsed
   */
  public boolean isTerminator() {
    return this.is(END_OF_FILE, END_OF_STATEMENT, SYMBOL, COMMENT);
  }

  public boolean isLiteral() {
    return this.is(INTEGER, FLOAT, STRING, BOOLEAN, VARIANT, OBJECT);
  }
}
