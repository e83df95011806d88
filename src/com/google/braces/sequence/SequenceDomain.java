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

/**
 * Maps the items of a range onto unsigned 64-bit positions, so that one stepping algorithm serves
 * every item type.
 *
 * <p>The mapping must be order preserving when positions are compared as unsigned values, and
 * consecutive items must map to consecutive positions.
 */
public interface SequenceDomain<T> {

  /** Signed 64-bit integers. Flipping the sign bit keeps the order under unsigned comparison. */
  SequenceDomain<Long> INTEGERS =
      new SequenceDomain<Long>() {
        @Override
        public long toPosition(Long value) {
          return value ^ Long.MIN_VALUE;
        }

        @Override
        public Long fromPosition(long position) {
          return position ^ Long.MIN_VALUE;
        }

        @Override
        public String toString() {
          return "INTEGERS";
        }
      };

  /** Unicode code points. The position is the code point itself. */
  SequenceDomain<Integer> CODE_POINTS =
      new SequenceDomain<Integer>() {
        @Override
        public long toPosition(Integer codePoint) {
          return codePoint;
        }

        @Override
        public Integer fromPosition(long position) {
          if (position < Character.MIN_CODE_POINT
              || position > Character.MAX_CODE_POINT
              || (position >= Character.MIN_SURROGATE && position <= Character.MAX_SURROGATE)) {
            throw new CharacterConversionException(position);
          }
          return (int) position;
        }

        @Override
        public String toString() {
          return "CODE_POINTS";
        }
      };

  long toPosition(T value);

  /**
   * Converts a position back into an item.
   *
   * @throws CharacterConversionException if no item exists at that position
   */
  T fromPosition(long position);
}
