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

import com.google.braces.sequence.Attempt;
import com.google.braces.sequence.CartesianProduct;
import com.google.braces.tree.Pattern;
import com.google.braces.tree.Segment;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.math.BigInteger;
import java.util.List;

/**
 * Expands a {@link Pattern} into the strings it stands for.
 *
 * <p>Each segment of a pattern is one dimension of a cartesian product, enumerated with the first
 * segment varying slowest. A list contributes the choices of its first member, then those of its
 * second member, and so on. Nothing is computed before it is pulled from the returned iterable,
 * and every call to {@code iterator()} starts the enumeration over.
 *
 * <p>An item built from a character that failed to convert is a failed {@link Attempt}; the items
 * around it are unaffected.
 */
public final class PatternExpander {

  private PatternExpander() {} /* all static */

  public static Iterable<Attempt<String>> expand(Pattern pattern) {
    ImmutableList<Segment> segments = pattern.getSegments();
    if (segments.size() == 1) {
      return expandSegment(segments.get(0));
    }
    List<Iterable<Attempt<String>>> dimensions =
        ImmutableList.copyOf(Iterables.transform(segments, PatternExpander::expandSegment));
    return Iterables.transform(CartesianProduct.of(dimensions), PatternExpander::concatenate);
  }

  /**
   * Returns the number of items {@link #expand} yields for {@code pattern}, failed ones included,
   * without enumerating them.
   */
  public static BigInteger count(Pattern pattern) {
    BigInteger product = BigInteger.ONE;
    for (Segment segment : pattern.getSegments()) {
      product = product.multiply(countSegment(segment));
      if (product.signum() == 0) {
        break;
      }
    }
    return product;
  }

  static Iterable<Attempt<String>> expandSegment(Segment segment) {
    return switch (segment.getKind()) {
      case LITERAL -> ImmutableList.of(Attempt.success(segment.asLiteral().getText()));
      case ALTERNATIVES ->
          Iterables.concat(
              Iterables.transform(
                  segment.asAlternatives().getMembers(), PatternExpander::expandSegment));
      case RANGE -> segment.asRange().getDescriptor().values();
      case COMPOUND -> expand(segment.asCompound().getPattern());
    };
  }

  private static BigInteger countSegment(Segment segment) {
    return switch (segment.getKind()) {
      case LITERAL -> BigInteger.ONE;
      case ALTERNATIVES -> {
        BigInteger sum = BigInteger.ZERO;
        for (Segment member : segment.asAlternatives().getMembers()) {
          sum = sum.add(countSegment(member));
        }
        yield sum;
      }
      case RANGE -> segment.asRange().getDescriptor().size();
      case COMPOUND -> count(segment.asCompound().getPattern());
    };
  }

  /** Joins one tuple of the product. The first failed element fails the whole item. */
  private static Attempt<String> concatenate(List<Attempt<String>> tuple) {
    StringBuilder sb = new StringBuilder();
    for (Attempt<String> element : tuple) {
      if (!element.isSuccess()) {
        return Attempt.failure(element.getError());
      }
      sb.append(element.get());
    }
    return Attempt.success(sb.toString());
  }
}
