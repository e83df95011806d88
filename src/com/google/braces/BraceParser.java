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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.braces.tree.Pattern;
import com.google.braces.tree.RangeDescriptor;
import com.google.braces.tree.Segment;
import com.google.common.base.CharMatcher;
import com.google.common.primitives.Longs;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Recursive descent parser for brace patterns.
 *
 * <pre>
 * Pattern    := (NumRange | CharRange | List | TopLiteral)*
 * List       := '{' (Member | '') (',' (Member | ''))* '}'
 * Member     := (NumRange | CharRange | List | ListLiteral)+
 * NumRange   := '{' ['='] Int '..' Int ('..' Int)? '}'
 * CharRange  := '{' Char '..' Char ('..' Int)? '}'
 * TopLiteral := text with '\', '{' and '}' escaped
 * ListLiteral:= text with '\', '{', '}' and ',' escaped
 * Char       := one code point other than '.', '{', '}', ',' ; or '\' and any code point
 * </pre>
 *
 * <p>At every '{' the three braced rules are tried in order: numeric range, character range, list.
 * The first one that matches wins, and a rule that fails consumes nothing. At the top level a '{'
 * that no rule matches is literal text; inside a list member it ends the member, which makes the
 * enclosing list fail in turn. A '{' without a matching '}' further on is taken as unmatched
 * without trying any rule.
 *
 * <p>The whole input must be consumed. Parsing either returns a complete {@link Pattern} or throws
 * a {@link BraceSyntaxException}.
 */
public final class BraceParser {

  static final DiagnosticType INVALID_ESCAPE =
      DiagnosticType.error(
          "BRACE_INVALID_ESCAPE",
          "Invalid escape sequence \"\\{0}\"; only a backslash, a brace, or a comma inside a"
              + " list may be escaped");

  static final DiagnosticType DANGLING_ESCAPE =
      DiagnosticType.error("BRACE_DANGLING_ESCAPE", "Backslash at end of input escapes nothing");

  static final DiagnosticType UNEXPECTED_CHARACTER =
      DiagnosticType.error(
          "BRACE_UNEXPECTED_CHARACTER", "Unexpected \"{0}\"; write \"\\{0}\" for a literal");

  static final DiagnosticType NESTING_TOO_DEEP =
      DiagnosticType.error("BRACE_NESTING_TOO_DEEP", "Braces nested more than {0} levels deep");

  /** Deepest nesting of braced rules a parse may enter. */
  static final int MAX_NESTING_DEPTH = 500;

  private static final Logger logger = Logger.getLogger(BraceParser.class.getName());

  /** Characters a backslash may escape outside of lists. */
  private static final CharMatcher TOP_LEVEL_ESCAPABLE = CharMatcher.anyOf("\\{}");

  /** Characters a backslash may escape inside list members. */
  private static final CharMatcher MEMBER_ESCAPABLE = CharMatcher.anyOf("\\{},");

  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

  /** Characters that cannot stand unescaped as a range endpoint. */
  private static final CharMatcher RANGE_RESERVED = CharMatcher.anyOf(".{},");

  private final boolean strictEscapes;
  private final String sourceName;

  public BraceParser() {
    this(new ExpansionOptions());
  }

  public BraceParser(ExpansionOptions options) {
    this.strictEscapes = options.isStrictEscapes();
    this.sourceName = options.getSourceName();
  }

  /**
   * Parses {@code text} into a pattern tree.
   *
   * @throws BraceSyntaxException if the text does not conform to the grammar
   */
  public Pattern parse(String text) {
    return new Run(checkNotNull(text)).parseTopLevel();
  }

  /**
   * Marks every '{' that has a matching '}' later in {@code text}, pairing braces like brackets.
   * A backslash hides the character after it. Every braced rule ends on the '}' this pairs with
   * its '{', so a '{' left unmarked can only be literal text.
   */
  private static boolean[] findClosableBraces(String text) {
    boolean[] closable = new boolean[text.length()];
    Deque<Integer> open = new ArrayDeque<>();
    for (int i = 0; i < text.length(); i++) {
      switch (text.charAt(i)) {
        case '\\' -> i++;
        case '{' -> open.push(i);
        case '}' -> {
          if (!open.isEmpty()) {
            closable[open.pop()] = true;
          }
        }
        default -> {}
      }
    }
    return closable;
  }

  /** The state of a single parse. Braced rules restore {@code pos} when they fail. */
  private final class Run {
    private final String text;
    private final boolean[] closable;
    private int pos = 0;
    private int depth = 0;

    Run(String text) {
      this.text = text;
      this.closable = findClosableBraces(text);
    }

    Pattern parseTopLevel() {
      List<Segment> segments = new ArrayList<>();
      StringBuilder literal = new StringBuilder();
      while (pos < text.length()) {
        char c = text.charAt(pos);
        switch (c) {
          case '{' -> {
            Segment braced = parseBraced();
            if (braced != null) {
              flushLiteral(literal, segments);
              segments.add(braced);
            } else {
              logger.log(Level.FINE, "Unmatched '{' at offset {0} kept as literal text", pos);
              literal.append(c);
              pos++;
            }
          }
          case '}' -> throw error(UNEXPECTED_CHARACTER, pos, "}");
          case '\\' -> {
            if (!appendEscape(literal, TOP_LEVEL_ESCAPABLE)) {
              throw escapeError();
            }
          }
          default -> {
            literal.append(c);
            pos++;
          }
        }
      }
      flushLiteral(literal, segments);
      return Pattern.of(segments);
    }

    /** Tries each braced rule at the current '{'. Returns null, consuming nothing, if none fit. */
    private @Nullable Segment parseBraced() {
      int start = pos;
      if (!closable[start]) {
        return null;
      }
      if (depth == MAX_NESTING_DEPTH) {
        throw error(NESTING_TOO_DEEP, start, String.valueOf(MAX_NESTING_DEPTH));
      }
      depth++;
      try {
        Segment segment = parseNumericRange();
        if (segment != null) {
          return segment;
        }
        pos = start;
        segment = parseCharacterRange();
        if (segment != null) {
          return segment;
        }
        pos = start;
        segment = parseList();
        if (segment != null) {
          return segment;
        }
        pos = start;
        return null;
      } finally {
        depth--;
      }
    }

    private @Nullable Segment parseNumericRange() {
      if (!consume('{')) {
        return null;
      }
      boolean fixedWidth = consume('=');

      int tokenStart = pos;
      Long start = parseInteger();
      if (start == null) {
        return null;
      }
      int width = pos - tokenStart;
      if (!consume("..")) {
        return null;
      }

      tokenStart = pos;
      Long end = parseInteger();
      if (end == null) {
        return null;
      }
      width = Math.max(width, pos - tokenStart);

      Long step = parseOptionalStep();
      if (step == null || !consume('}')) {
        return null;
      }
      return Segment.range(RangeDescriptor.numeric(start, end, step, fixedWidth ? width : 0));
    }

    private @Nullable Segment parseCharacterRange() {
      if (!consume('{')) {
        return null;
      }
      int start = parseRangeCharacter();
      if (start < 0 || !consume("..")) {
        return null;
      }
      int end = parseRangeCharacter();
      if (end < 0) {
        return null;
      }
      Long step = parseOptionalStep();
      if (step == null || !consume('}')) {
        return null;
      }
      return Segment.range(RangeDescriptor.character(start, end, step));
    }

    private @Nullable Segment parseList() {
      if (!consume('{')) {
        return null;
      }
      List<Segment> members = new ArrayList<>();
      while (true) {
        Segment member = parseMember();
        members.add(member != null ? member : Segment.literal(""));
        if (consume(',')) {
          continue;
        }
        if (consume('}')) {
          return Segment.alternatives(members);
        }
        return null;
      }
    }

    /** Parses one non-empty list member. Returns null if the member is empty. */
    private @Nullable Segment parseMember() {
      List<Segment> segments = new ArrayList<>();
      StringBuilder literal = new StringBuilder();
      scan:
      while (pos < text.length()) {
        char c = text.charAt(pos);
        switch (c) {
          case '{' -> {
            Segment braced = parseBraced();
            if (braced == null) {
              break scan;
            }
            flushLiteral(literal, segments);
            segments.add(braced);
          }
          case '}', ',' -> {
            break scan;
          }
          case '\\' -> {
            // Whatever the top level may escape, a member may escape too.
            if (!appendEscape(literal, MEMBER_ESCAPABLE)) {
              throw escapeError();
            }
          }
          default -> {
            literal.append(c);
            pos++;
          }
        }
      }
      flushLiteral(literal, segments);
      return segments.isEmpty() ? null : Segment.compound(Pattern.of(segments));
    }

    /**
     * Parses an optionally signed decimal integer that fits in a long. Returns null, having
     * consumed an unspecified amount of input, if there is none.
     */
    private @Nullable Long parseInteger() {
      int start = pos;
      if (pos < text.length() && (text.charAt(pos) == '-' || text.charAt(pos) == '+')) {
        pos++;
      }
      int digitsStart = pos;
      while (pos < text.length() && DIGITS.matches(text.charAt(pos))) {
        pos++;
      }
      if (pos == digitsStart) {
        return null;
      }
      // Longs.tryParse does not accept a leading '+'.
      int signLength = text.charAt(start) == '+' ? 1 : 0;
      return Longs.tryParse(text.substring(start + signLength, pos));
    }

    /** Parses "..step" if present. Returns 1 if absent, null if malformed. */
    private @Nullable Long parseOptionalStep() {
      if (!consume("..")) {
        return 1L;
      }
      return parseInteger();
    }

    /** Parses a range endpoint. Returns its code point, or -1 if there is none. */
    private int parseRangeCharacter() {
      if (pos >= text.length()) {
        return -1;
      }
      int codePoint = text.codePointAt(pos);
      if (codePoint < Character.MIN_SUPPLEMENTARY_CODE_POINT
          && RANGE_RESERVED.matches((char) codePoint)) {
        return -1;
      }
      if (codePoint == '\\') {
        pos++;
        if (pos >= text.length()) {
          return -1;
        }
        codePoint = text.codePointAt(pos);
      }
      if (Character.getType(codePoint) == Character.SURROGATE) {
        // An unpaired surrogate is not a character.
        return -1;
      }
      pos += Character.charCount(codePoint);
      return codePoint;
    }

    /**
     * Appends the character escaped by the backslash at {@code pos}. In lenient mode, a backslash
     * that escapes nothing is appended as is.
     *
     * @return false if the escape is not allowed here, in which case nothing is consumed
     */
    private boolean appendEscape(StringBuilder literal, CharMatcher escapable) {
      if (pos + 1 < text.length() && escapable.matches(text.charAt(pos + 1))) {
        literal.append(text.charAt(pos + 1));
        pos += 2;
        return true;
      }
      if (!strictEscapes) {
        literal.append('\\');
        pos++;
        return true;
      }
      return false;
    }

    private boolean consume(char expected) {
      if (pos < text.length() && text.charAt(pos) == expected) {
        pos++;
        return true;
      }
      return false;
    }

    private boolean consume(String expected) {
      if (text.startsWith(expected, pos)) {
        pos += expected.length();
        return true;
      }
      return false;
    }

    private void flushLiteral(StringBuilder literal, List<Segment> segments) {
      if (literal.length() > 0) {
        segments.add(Segment.literal(literal.toString()));
        literal.setLength(0);
      }
    }

    private BraceSyntaxException escapeError() {
      if (pos + 1 >= text.length()) {
        return error(DANGLING_ESCAPE, pos);
      }
      int escaped = text.codePointAt(pos + 1);
      return error(INVALID_ESCAPE, pos, new String(Character.toChars(escaped)));
    }

    private BraceSyntaxException error(DiagnosticType type, int offset, String... arguments) {
      return new BraceSyntaxException(ParseError.make(type, sourceName, text, offset, arguments));
    }
  }
}
