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

import com.google.braces.tree.Pattern;
import com.google.braces.tree.RangeDescriptor;
import com.google.braces.tree.Segment;
import com.google.common.base.CharMatcher;

/**
 * Prints a {@link Pattern} back to canonical source text.
 *
 * <p>Literal text is escaped for the position it is printed at: outside of lists a backslash
 * precedes {@code \ { }}, inside list members it also precedes {@code ,}. Range endpoints are
 * printed in plain decimal, or as the single character they stand for, and the step only when it
 * is not one. Parsing the printed text of a parsed pattern yields an equal pattern again, but not
 * always the original text: endpoint tokens are normalized, so {@code {=01..10}} prints as
 * {@code {=1..10}}. A hand-built list whose only member reads like a range, such as {@code 1..2},
 * has no text form and prints as the range.
 */
public final class PatternPrinter {

  private static final CharMatcher TOP_LEVEL_SPECIAL = CharMatcher.anyOf("\\{}");
  private static final CharMatcher MEMBER_SPECIAL = CharMatcher.anyOf("\\{},");
  private static final CharMatcher RANGE_SPECIAL = CharMatcher.anyOf("\\{},.");
  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

  private final StringBuilder out = new StringBuilder();

  private PatternPrinter() {}

  public static String print(Pattern pattern) {
    PatternPrinter printer = new PatternPrinter();
    printer.add(pattern, TOP_LEVEL_SPECIAL);
    return printer.out.toString();
  }

  private void add(Pattern pattern, CharMatcher special) {
    for (Segment segment : pattern.getSegments()) {
      add(segment, special);
    }
  }

  private void add(Segment segment, CharMatcher special) {
    switch (segment.getKind()) {
      case LITERAL -> addEscaped(segment.asLiteral().getText(), special);
      case ALTERNATIVES -> {
        out.append('{');
        boolean first = true;
        for (Segment member : segment.asAlternatives().getMembers()) {
          if (!first) {
            out.append(',');
          }
          add(member, MEMBER_SPECIAL);
          first = false;
        }
        out.append('}');
      }
      case RANGE -> addRange(segment.asRange().getDescriptor());
      case COMPOUND -> add(segment.asCompound().getPattern(), special);
    }
  }

  private void addRange(RangeDescriptor range) {
    out.append('{');
    if (range.isNumeric()) {
      if (range.isFixedWidth()) {
        out.append('=');
      }
      String start = Long.toString(range.getStart());
      String end = Long.toString(range.getEnd());
      if (Math.max(start.length(), end.length()) < range.getWidth()) {
        // The width is taken from the longest endpoint token, so pad one of them to keep it.
        end = range.render(range.getEnd());
      }
      out.append(start).append("..").append(end);
    } else {
      int start = (int) range.getStart();
      int end = (int) range.getEnd();
      // Two bare digits would read back as a numeric range.
      boolean digits = isDigit(start) && isDigit(end);
      addRangeCharacter(start, digits);
      out.append("..");
      addRangeCharacter(end, digits);
    }
    if (range.getStep() != 1) {
      // A step of 2^63 is stored as Long.MIN_VALUE, which prints as a negative step of the same
      // magnitude.
      out.append("..").append(Long.toString(range.getStep()));
    }
    out.append('}');
  }

  private void addRangeCharacter(int codePoint, boolean escape) {
    if (escape
        || (codePoint < Character.MIN_SUPPLEMENTARY_CODE_POINT
            && RANGE_SPECIAL.matches((char) codePoint))) {
      out.append('\\');
    }
    out.appendCodePoint(codePoint);
  }

  private static boolean isDigit(int codePoint) {
    return codePoint < Character.MIN_SUPPLEMENTARY_CODE_POINT && DIGITS.matches((char) codePoint);
  }

  private void addEscaped(String text, CharMatcher special) {
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (special.matches(c)) {
        out.append('\\');
      }
      out.append(c);
    }
  }
}
