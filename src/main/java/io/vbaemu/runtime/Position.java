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

package io.vbaemu.runtime;

import java.util.Objects;

/**
 * Immutable span of a named source buffer. Indices are 0-based and half-open,
 * lines and columns are 1-based (end column is exclusive).
 *
 * Positions are attached to every token and every AST node so that errors
 * raised anywhere in the tool chain can show the exact source they refer to.
 */
public final class Position {

  /** Individual characters that terminate a line */
  public static final String   LINE_TERMINATOR_CHARS = "\r\n\u2028\u2029";

  /** Line terminator sequences, longest first */
  public static final String[] LINE_TERMINATORS      = { "\r\n", "\r", "\n", "\u2028", "\u2029" };

  private final String fileName;
  private final String fileContent;
  private final int    startIndex;
  private final int    endIndex;
  private final int    startLine;
  private final int    endLine;
  private final int    startColumn;
  private final int    endColumn;

  public Position(String fileName, String fileContent, int startIndex, int endIndex,
                  int startLine, int endLine, int startColumn, int endColumn) {
    if (startIndex > endIndex) {
      throw new IllegalArgumentException("Internal error: position end index " + endIndex + " is before start index " + startIndex);
    }
    this.fileName    = fileName;
    this.fileContent = fileContent;
    this.startIndex  = startIndex;
    this.endIndex    = endIndex;
    this.startLine   = startLine;
    this.endLine     = endLine;
    this.startColumn = startColumn;
    this.endColumn   = endColumn;
  }

  /**
   * Build a position from its indices, computing the end line and column by
   * counting the line terminators in the covered text (a single token such
   * as a line continuation can span several lines).
   * @param fileName     name of the source
   * @param fileContent  whole content of the source
   * @param startIndex   start offset (inclusive)
   * @param endIndex     end offset (exclusive)
   * @param startLine    line at startIndex
   * @param startColumn  column at startIndex
   * @return the position
   */
  public static Position fromIndices(String fileName, String fileContent, int startIndex, int endIndex,
                                     int startLine, int startColumn) {
    int index         = startIndex;
    int endLine       = startLine;
    int lastLineIndex = 0;
    while (index < endIndex) {
      int eolLength = terminatorLength(fileContent, index);
      if (eolLength > 0) {
        index += eolLength;
        endLine++;
        lastLineIndex = index;
      }
      else {
        index++;
      }
    }
    int endColumn = endLine == startLine ? startColumn + endIndex - startIndex
                                         : endIndex - lastLineIndex + 1;
    return new Position(fileName, fileContent, startIndex, endIndex, startLine, endLine, startColumn, endColumn);
  }

  /**
   * Length of the line terminator starting at given offset or 0 if there is none
   */
  private static int terminatorLength(String content, int index) {
    for (String eol: LINE_TERMINATORS) {
      if (content.startsWith(eol, index)) {
        return eol.length();
      }
    }
    return 0;
  }

  public static boolean isLineTerminator(int c) {
    return LINE_TERMINATOR_CHARS.indexOf(c) != -1;
  }

  /**
   * Return the smallest position enclosing both this position and the other one
   * @param other  the other position (must be in the same file)
   * @return the merged position
   */
  public Position merge(Position other) {
    if (!Objects.equals(fileName, other.fileName)) {
      throw new IllegalArgumentException("Internal error: cannot merge positions from '" + fileName + "' and '" + other.fileName + "'");
    }
    Position first = startIndex <= other.startIndex ? this : other;
    Position last  = endIndex >= other.endIndex ? this : other;
    return new Position(fileName, fileContent,
                        first.startIndex, last.endIndex,
                        first.startLine, last.endLine,
                        first.startColumn, last.endColumn);
  }

  /**
   * Merge an arbitrary number of positions, ignoring nulls
   * @param positions  the positions
   * @return the enclosing position or null if all positions were null
   */
  public static Position merge(Position... positions) {
    Position result = null;
    for (Position position: positions) {
      if (position != null) {
        result = result == null ? position : result.merge(position);
      }
    }
    return result;
  }

  public String getFileName()    { return fileName; }
  public String getFileContent() { return fileContent; }
  public int    getStartIndex()  { return startIndex; }
  public int    getEndIndex()    { return endIndex; }
  public int    getStartLine()   { return startLine; }
  public int    getEndLine()     { return endLine; }
  public int    getStartColumn() { return startColumn; }
  public int    getEndColumn()   { return endColumn; }

  /**
   * @return the diagnostic prefix "{file}:{line}:{column}:"
   */
  public String header() {
    return String.format("%s:%d:%d:", fileName, startLine, startColumn);
  }

  /**
   * @return the source text covered by the position
   */
  public String body() {
    return fileContent.substring(startIndex, endIndex);
  }

  /**
   * @return the whole source line(s) that contain the position, without their terminator
   */
  public String getLines() {
    return fileContent.substring(startOfLineIndex(), endOfLineIndex(Math.max(endIndex - 1, startIndex)));
  }

  private int startOfLineIndex() {
    int index = startIndex;
    while (index > 0 && !isLineTerminator(fileContent.charAt(index - 1))) {
      index--;
    }
    return index;
  }

  private int endOfLineIndex(int from) {
    int index = from;
    while (index < fileContent.length() && !isLineTerminator(fileContent.charAt(index))) {
      index++;
    }
    return index;
  }

  /**
   * Get the source line(s) with an additional line underlining the start of the
   * position with '^' followed by '~' for the rest of the span on that line
   * @return the marked source
   */
  public String getMarkedSourceLine() {
    int lastMarked = Math.min(endIndex, endOfLineIndex(startIndex));
    int tildes     = Math.max(0, lastMarked - startIndex - 1);
    return String.format("%s\n%s^%s", getLines(), " ".repeat(Math.max(0, startColumn - 1)), "~".repeat(tildes));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) { return true; }
    if (!(o instanceof Position)) { return false; }
    Position other = (Position) o;
    return startIndex == other.startIndex && endIndex == other.endIndex &&
           startLine == other.startLine && endLine == other.endLine &&
           startColumn == other.startColumn && endColumn == other.endColumn &&
           Objects.equals(fileName, other.fileName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(fileName, startIndex, endIndex, startLine, endLine, startColumn, endColumn);
  }

  @Override
  public String toString() {
    return "Position{" + fileName + ":" + startLine + ":" + startColumn + "-" + endLine + ":" + endColumn +
           " [" + startIndex + "," + endIndex + ")}";
  }
}
