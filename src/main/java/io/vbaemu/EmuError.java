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
 * Base class of the errors reported while reading VBA source. The message
 * renders as a diagnostic of the form:
 * <pre>
 *   file:line:column: message
 *   source line
 *      ^~~~
 * </pre>
 */
public class EmuError extends RuntimeException {

  private final String   errorMessage;
  private final Position position;

  /**
   * Constructor
   * @param error     the error message
   * @param position  the position where error occurred (may be null)
   */
  public EmuError(String error, Position position) {
    this(error, position, null);
  }

  public EmuError(String error, Position position, Throwable cause) {
    super(null, cause);
    if (cause != null) {
      String causeMsg = cause.getMessage();
      if (causeMsg == null) {
        causeMsg = cause.getClass().getSimpleName();
      }
      else {
        causeMsg += " (" + cause.getClass().getSimpleName() + ")";
      }
      error += ": " + causeMsg;
    }
    this.errorMessage = error;
    this.position     = position;
  }

  public Position getPosition() {
    return position;
  }

  @Override
  public String getMessage() {
    if (position == null || position.getFileContent() == null) {
      return getSingleLineMessage();
    }
    return getSingleLineMessage() + "\n" + position.getMarkedSourceLine() + "\n";
  }

  public String getSingleLineMessage() {
    if (position == null) {
      return String.format("%s @ unknown location", errorMessage);
    }
    return position.header() + " " + errorMessage;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  @Override
  public String toString() {
    return getMessage();
  }
}
