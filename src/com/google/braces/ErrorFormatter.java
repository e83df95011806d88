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

import com.google.common.base.CharMatcher;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * Formats parse errors compactly: the position and description on one line, followed by the
 * offending source line and a caret under the error column.
 *
 * <pre>
 * &lt;input&gt;:1:3: ERROR - [BRACE_UNEXPECTED_CHARACTER] Unexpected "}"; write "\}" for a literal
 * {a}}b
 *    ^
 * </pre>
 */
public final class ErrorFormatter {
  private boolean includeLocation = true;
  private boolean includeExcerpt = true;

  @CanIgnoreReturnValue
  public ErrorFormatter setIncludeLocation(boolean includeLocation) {
    this.includeLocation = includeLocation;
    return this;
  }

  @CanIgnoreReturnValue
  public ErrorFormatter setIncludeExcerpt(boolean includeExcerpt) {
    this.includeExcerpt = includeExcerpt;
    return this;
  }

  public String formatError(ParseError error) {
    StringBuilder b = new StringBuilder();
    if (includeLocation) {
      appendPosition(b, error.sourceName(), error.lineno(), error.charno());
    }
    b.append("ERROR - [");
    b.append(error.type().key);
    b.append("] ");
    b.append(error.description());
    b.append('\n');

    if (includeExcerpt) {
      String sourceExcerpt = error.getSourceLine();
      b.append(sourceExcerpt);
      b.append('\n');
      // charno == sourceExcerpt.length() means something is missing
      // at the end of the line
      if (error.charno() <= sourceExcerpt.length()) {
        padLine(error.charno(), sourceExcerpt, b);
      }
    }
    return b.toString();
  }

  private static void appendPosition(StringBuilder b, String sourceName, int lineNumber, int charno) {
    b.append(sourceName);
    b.append(':').append(lineNumber);
    b.append(':').append(charno);
    b.append(": ");
  }

  private static void padLine(int charno, String sourceExcerpt, StringBuilder b) {
    // Append leading whitespace
    for (int i = 0; i < charno; i++) {
      char c = sourceExcerpt.charAt(i);
      if (CharMatcher.whitespace().matches(c)) {
        b.append(c);
      } else {
        b.append(' ');
      }
    }
    b.append("^\n");
  }
}
