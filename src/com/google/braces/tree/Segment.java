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
import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import java.util.List;

/**
 * One position of a {@link Pattern}.
 *
 * <ul>
 *   <li>{@link Literal}: fixed, already unescaped text.
 *   <li>{@link Alternatives}: a {@code {a,b,c}} list. Its choices are the choices of its members,
 *       one member after the other.
 *   <li>{@link Range}: a {@code {a..b..n}} range.
 *   <li>{@link Compound}: a nested pattern, used as a member of a list.
 * </ul>
 */
@Immutable
public abstract class Segment {

  /** The variant of a segment. */
  public enum Kind {
    LITERAL,
    ALTERNATIVES,
    RANGE,
    COMPOUND
  }

  Segment() {}

  public abstract Kind getKind();

  public static Literal literal(String text) {
    return new AutoValue_Segment_Literal(text);
  }

  /**
   * @param members the list members, each either an empty {@link Literal} or a {@link Compound}
   */
  public static Alternatives alternatives(List<Segment> members) {
    for (Segment member : members) {
      checkArgument(
          member.getKind() == Kind.COMPOUND
              || (member.getKind() == Kind.LITERAL && member.asLiteral().getText().isEmpty()),
          "list member must be an empty literal or a compound: %s",
          member);
    }
    return new AutoValue_Segment_Alternatives(ImmutableList.copyOf(members));
  }

  public static Alternatives alternatives(Segment... members) {
    return alternatives(ImmutableList.copyOf(members));
  }

  public static Range range(RangeDescriptor descriptor) {
    return new AutoValue_Segment_Range(descriptor);
  }

  public static Compound compound(Pattern pattern) {
    return new AutoValue_Segment_Compound(pattern);
  }

  /** Shorthand for a list member holding {@code segments}. */
  public static Compound compound(Segment... segments) {
    return compound(Pattern.of(segments));
  }

  public Literal asLiteral() {
    checkState(this instanceof Literal, "not a literal: %s", this);
    return (Literal) this;
  }

  public Alternatives asAlternatives() {
    checkState(this instanceof Alternatives, "not a list: %s", this);
    return (Alternatives) this;
  }

  public Range asRange() {
    checkState(this instanceof Range, "not a range: %s", this);
    return (Range) this;
  }

  public Compound asCompound() {
    checkState(this instanceof Compound, "not a compound: %s", this);
    return (Compound) this;
  }

  /** Fixed text. Only an empty list member may be empty. */
  @AutoValue
  @Immutable
  public abstract static class Literal extends Segment {
    public abstract String getText();

    @Override
    public Kind getKind() {
      return Kind.LITERAL;
    }
  }

  /** A comma-separated list. */
  @AutoValue
  @Immutable
  public abstract static class Alternatives extends Segment {
    public abstract ImmutableList<Segment> getMembers();

    @Override
    public Kind getKind() {
      return Kind.ALTERNATIVES;
    }
  }

  /** A numeric or character range. */
  @AutoValue
  @Immutable
  public abstract static class Range extends Segment {
    public abstract RangeDescriptor getDescriptor();

    @Override
    public Kind getKind() {
      return Kind.RANGE;
    }
  }

  /** A nested pattern standing as one list member. */
  @AutoValue
  @Immutable
  public abstract static class Compound extends Segment {
    public abstract Pattern getPattern();

    @Override
    public Kind getKind() {
      return Kind.COMPOUND;
    }
  }
}
