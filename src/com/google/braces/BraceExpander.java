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

import com.google.braces.ExpansionOptions.ConversionErrorMode;
import com.google.braces.sequence.Attempt;
import com.google.braces.tree.Pattern;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for brace expansion: parses patterns, expands them, and prints them back.
 *
 * <pre>{@code
 * BraceExpander expander = BraceExpander.create();
 * expander.expandToList("a{b,c}d{1..2}");  // [abd1, abd2, acd1, acd2]
 * }</pre>
 *
 * <p>Instances are immutable and may be shared.
 */
public final class BraceExpander {
  private static final Logger logger = Logger.getLogger(BraceExpander.class.getName());

  private final BraceParser parser;
  private final ConversionErrorMode conversionErrorMode;

  private BraceExpander(ExpansionOptions options) {
    this.parser = new BraceParser(options);
    this.conversionErrorMode = options.getConversionErrorMode();
  }

  public static BraceExpander create() {
    return create(new ExpansionOptions());
  }

  public static BraceExpander create(ExpansionOptions options) {
    return new BraceExpander(checkNotNull(options));
  }

  /**
   * Parses {@code text} into a pattern tree.
   *
   * @throws BraceSyntaxException if the text is not a valid pattern
   */
  public Pattern parse(String text) {
    Pattern pattern = parser.parse(text);
    if (logger.isLoggable(Level.FINE)) {
      logger.log(
          Level.FINE,
          "Parsed {0} segment(s) from a pattern of {1} character(s)",
          new Object[] {pattern.getSegments().size(), text.length()});
    }
    return pattern;
  }

  /** Lazily expands {@code pattern}. Each {@code iterator()} call restarts the enumeration. */
  public Iterable<Attempt<String>> expand(Pattern pattern) {
    return PatternExpander.expand(checkNotNull(pattern));
  }

  /**
   * Parses and lazily expands {@code text}.
   *
   * @throws BraceSyntaxException if the text is not a valid pattern
   */
  public Iterable<Attempt<String>> expand(String text) {
    return expand(parse(text));
  }

  /**
   * Parses and expands {@code text} into a list. Items that failed to convert are handled as the
   * options' {@link ConversionErrorMode} says.
   *
   * @throws BraceSyntaxException if the text is not a valid pattern
   * @throws com.google.braces.sequence.CharacterConversionException for the first failed item, in
   *     {@link ConversionErrorMode#FAIL} mode
   */
  public ImmutableList<String> expandToList(String text) {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (Attempt<String> item : expand(text)) {
      if (item.isSuccess() || conversionErrorMode == ConversionErrorMode.FAIL) {
        result.add(item.get());
      } else {
        logger.log(
            Level.WARNING,
            "Skipping expansion of {0}: {1}",
            new Object[] {text, item.getError().getMessage()});
      }
    }
    return result.build();
  }

  /** Prints {@code pattern} as canonical pattern text. */
  public String format(Pattern pattern) {
    return PatternPrinter.print(checkNotNull(pattern));
  }

  /** Returns the number of items {@link #expand(Pattern)} yields, without enumerating them. */
  public BigInteger count(Pattern pattern) {
    return PatternExpander.count(checkNotNull(pattern));
  }
}
