/*
 * Copyright 2026 The Closure Compiler Authors.
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
 */
package com.google.braces;

import static java.util.Objects.requireNonNull;

import java.io.Serializable;

/**
 * Pattern syntax error description.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param sourceName Name of the source, used when printing the error.
 * @param source The complete text that failed to parse.
 * @param offset Zero-indexed character offset of the error location in {@code source}.
 * @param lineno One-indexed line number of the error location.
 * @param charno Zero-indexed character number of the error location within its line.
 */
public record ParseError(
    DiagnosticType type,
    String description,
    String sourceName,
    String source,
    int offset,
    int lineno,
    int charno)
    implements Serializable {
  public ParseError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(sourceName, "sourceName");
    requireNonNull(source, "source");
  }

  /**
   * Creates a ParseError at {@code offset}, deriving the line and column from the source text.
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static ParseError make(
      DiagnosticType type, String sourceName, String source, int offset, String... arguments) {
    int lineStart = source.lastIndexOf('\n', offset - 1) + 1;
    int lineno = 1;
    for (int i = 0; i < lineStart; i++) {
      if (source.charAt(i) == '\n') {
        lineno++;
      }
    }
    return new ParseError(
        type, type.format(arguments), sourceName, source, offset, lineno, offset - lineStart);
  }

  /** Returns the line of {@code source} holding the error, without its line terminator. */
  public String getSourceLine() {
    int start = offset - charno;
    int end = source.indexOf('\n', start);
    return source.substring(start, end < 0 ? source.length() : end);
  }

  @Override
  public String toString() {
    return type.key + ". " + description + " at " + sourceName + " line " + lineno + " : " + charno;
  }
}
