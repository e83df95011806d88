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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.braces.tree.Pattern;
import com.google.braces.tree.RangeDescriptor;
import com.google.braces.tree.Segment;
import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class PatternPrinterTest {

  @Test
  public void testCanonicalPatternsPrintUnchanged() {
    assertPrintSame("");
    assertPrintSame("abc");
    assertPrintSame("a{b,c,}d{1..2}e");
    assertPrintSame("{=-1..1000..300}");
    assertPrintSame("a{b,c{d,e}f}g");
    assertPrintSame("{a..e..2}");
    assertPrintSame("{}");
    assertPrintSame("{,}");
    assertPrintSame("{1..10..-9223372036854775808}");
  }

  @Test
  public void testNormalizesRanges() {
    assertPrint("{1..5..1}", "{1..5}");
    assertPrint("{1..5..-2}", "{1..5..2}");
    assertPrint("{1..5..0}", "{1..5}");
    assertPrint("{+3..5}", "{3..5}");
    assertPrint("{a..c..-1}", "{a..c}");
  }

  @Test
  public void testKeepsFixedWidth() {
    assertPrint("{=01..10}", "{=1..10}");
    assertPrint("{=-01..5}", "{=-1..005}");
    assertPrint("{=007..9}", "{=7..009}");
  }

  @Test
  public void testEscapesTopLevelLiterals() {
    assertPrintSame("\\{a\\}\\\\");
    assertPrint("{a,b", "\\{a,b");
    assertThat(PatternPrinter.print(Pattern.of(Segment.literal("x,{y}"))))
        .isEqualTo("x,\\{y\\}");
  }

  @Test
  public void testEscapesListMembers() {
    assertPrintSame("{a\\,b,c}");
    Pattern pattern =
        Pattern.of(
            Segment.alternatives(
                Segment.compound(Segment.literal("a,b")),
                Segment.literal(""),
                Segment.compound(Segment.literal("{c}"))));
    assertThat(PatternPrinter.print(pattern)).isEqualTo("{a\\,b,,\\{c\\}}");
  }

  @Test
  public void testEscapesRangeEndpoints() {
    assertPrintSame("{\\...\\}}");
    Pattern pattern = Pattern.of(Segment.range(RangeDescriptor.character(',', '\\', 1)));
    assertThat(PatternPrinter.print(pattern)).isEqualTo("{\\,..\\\\}");
  }

  @Test
  public void testEscapesDigitCharacterRanges() {
    assertPrintSame("{\\1..\\5}");
    assertPrint("{\\1..5..2}", "{\\1..\\5..2}");
    assertPrintSame("{0..a}");
    assertThat(new BraceParser().parse("{\\1..\\5}"))
        .isEqualTo(Pattern.of(Segment.range(RangeDescriptor.character('1', '5', 1))));
  }

  @Test
  public void testPrintedPatternsParseBack() {
    ImmutableList<String> inputs =
        ImmutableList.of(
            "a{b,c,}d{1..2}e",
            "{=-005..3}",
            "{{a,b}",
            "{1..2..}",
            "{ab..c}",
            "{\\0..\\9..3}",
            "x{y{1..3..2},{a..c},}z",
            "{\uD83D\uDE00..\uD83D\uDE02..7}",
            "{-9223372036854775808..9223372036854775807}",
            "\\\\{a\\,b}");
    BraceParser parser = new BraceParser();
    for (String input : inputs) {
      Pattern pattern = parser.parse(input);
      String printed = PatternPrinter.print(pattern);
      assertWithMessage("reparse of %s printed as %s", input, printed)
          .that(parser.parse(printed))
          .isEqualTo(pattern);
    }
  }

  @Test
  public void testLenientlyParsedBackslashesAreEscaped() {
    ExpansionOptions options = new ExpansionOptions();
    options.setStrictEscapes(false);
    Pattern pattern = new BraceParser(options).parse("a\\qb");
    String printed = PatternPrinter.print(pattern);
    assertThat(printed).isEqualTo("a\\\\qb");
    assertThat(new BraceParser().parse(printed)).isEqualTo(pattern);
  }

  private static void assertPrintSame(String text) {
    assertPrint(text, text);
  }

  private static void assertPrint(String text, String expected) {
    assertThat(PatternPrinter.print(new BraceParser().parse(text))).isEqualTo(expected);
  }
}
