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

/**
 * Syntax error: the token stream does not match the grammar at the current
 * position, a literal is out of range, or an internal failure occurred while
 * running a grammar rule (in which case the underlying exception is the cause).
 */
public class ParserError extends EmuError {

  public ParserError(String error, Position position) {
    super(error, position);
  }

  public ParserError(String error, Token token) {
    super(error, token == null ? null : token.getPosition());
  }

  public ParserError(String error, Position position, Throwable cause) {
    super(error, position, cause);
  }
}
