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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import java.util.List;

/**
 * A parsed brace pattern: the concatenation of its segments, in order.
 *
 * <p>The empty pattern stands for the empty string. Patterns are immutable and own all of their
 * text, so a tree stays valid independently of the input it was parsed from.
 */
@AutoValue
@Immutable
public abstract class Pattern {
  private static final Pattern EMPTY = new AutoValue_Pattern(ImmutableList.of());

  Pattern() {}

  public abstract ImmutableList<Segment> getSegments();

  public static Pattern of(List<Segment> segments) {
    return segments.isEmpty() ? EMPTY : new AutoValue_Pattern(ImmutableList.copyOf(segments));
  }

  public static Pattern of(Segment... segments) {
    return of(ImmutableList.copyOf(segments));
  }

  public static Pattern empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return getSegments().isEmpty();
  }
}
