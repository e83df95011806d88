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
package com.google.braces.sequence;

import java.util.Locale;

/**
 * Thrown when a character range steps onto a position that is not a Unicode scalar value, such as
 * a code point in the UTF-16 surrogate block.
 */
public final class CharacterConversionException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final long position;

  public CharacterConversionException(long position) {
    super("Invalid character in range: " + describe(position) + " is not a Unicode scalar value");
    this.position = position;
  }

  /** Returns the rejected code point. */
  public long getPosition() {
    return position;
  }

  private static String describe(long position) {
    if (position < 0 || position > 0xFFFFFFFFL) {
      return Long.toUnsignedString(position);
    }
    return String.format(Locale.ROOT, "U+%04X", position);
  }
}
