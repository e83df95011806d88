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
package com.google.braces.tree;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.braces.sequence.Attempt;
import com.google.braces.sequence.RangeSequence;
import com.google.common.base.Strings;
import com.google.common.collect.Iterables;
import com.google.errorprone.annotations.Immutable;
import java.math.BigInteger;

/**
 * The start, end and step of a {@code {a..b..n}} range, over integers or characters.
 *
 * <p>Character endpoints are stored as code points. The step is an unsigned magnitude of at least
 * one, whatever sign it was written with. A numeric range may also carry a fixed width, in which
 * case every rendered value is zero-padded to that many characters.
 */
@AutoValue
@Immutable
public abstract class RangeDescriptor {

  /** The domain a range walks over. */
  public enum Type {
    NUMERIC,
    CHARACTER
  }

  RangeDescriptor() {}

  public abstract Type getType();

  /** The first value: an integer, or a code point for character ranges. */
  public abstract long getStart();

  /** The bound the walk stops at: an integer, or a code point for character ranges. */
  public abstract long getEnd();

  /** The step magnitude, an unsigned value of at least one. */
  public abstract long getStep();

  /** Zero-padded width of every rendered value, or 0 if the width is free. */
  public abstract int getWidth();

  public boolean isFixedWidth() {
    return getWidth() > 0;
  }

  public boolean isNumeric() {
    return getType() == Type.NUMERIC;
  }

  public static RangeDescriptor numeric(long start, long end, long step) {
    return numeric(start, end, step, 0);
  }

  /**
   * @param step the step as written; its magnitude is used, and zero means one
   * @param width the fixed width, or 0 for none
   */
  public static RangeDescriptor numeric(long start, long end, long step, int width) {
    checkArgument(width >= 0, "negative width: %s", width);
    return new AutoValue_RangeDescriptor(Type.NUMERIC, start, end, magnitude(step), width);
  }

  /**
   * @param step the step as written; its magnitude is used, and zero means one
   */
  public static RangeDescriptor character(int start, int end, long step) {
    checkArgument(Character.isValidCodePoint(start), "invalid start code point: %s", start);
    checkArgument(Character.isValidCodePoint(end), "invalid end code point: %s", end);
    return new AutoValue_RangeDescriptor(Type.CHARACTER, start, end, magnitude(step), 0);
  }

  /**
   * Returns the rendered values of this range, in walk order. A character that is not a Unicode
   * scalar value yields a failed item without ending the sequence.
   */
  public Iterable<Attempt<String>> values() {
    if (isNumeric()) {
      return Iterables.transform(
          RangeSequence.ofIntegers(getStart(), getEnd(), getStep()),
          item -> item.map(this::render));
    }
    return Iterables.transform(
        RangeSequence.ofCodePoints((int) getStart(), (int) getEnd(), getStep()),
        item -> item.map(RangeDescriptor::renderCharacter));
  }

  /** Number of values this range yields. */
  public BigInteger size() {
    if (isNumeric()) {
      return RangeSequence.ofIntegers(getStart(), getEnd(), getStep()).size();
    }
    return RangeSequence.ofCodePoints((int) getStart(), (int) getEnd(), getStep()).size();
  }

  /**
   * Renders an integer in decimal, zero-padded to the fixed width if there is one. A minus sign
   * stays the leading character and counts towards the width.
   */
  public String render(long value) {
    String digits = Long.toString(value);
    if (!isFixedWidth()) {
      return digits;
    }
    if (value < 0) {
      return "-" + Strings.padStart(digits.substring(1), getWidth() - 1, '0');
    }
    return Strings.padStart(digits, getWidth(), '0');
  }

  static String renderCharacter(int codePoint) {
    return new String(Character.toChars(codePoint));
  }

  private static long magnitude(long step) {
    if (step == 0) {
      return 1;
    }
    // Negating Long.MIN_VALUE leaves the bits of 2^63, which is the right unsigned magnitude.
    return step < 0 ? -step : step;
  }
}
