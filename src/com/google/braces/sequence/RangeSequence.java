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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.primitives.UnsignedLong;
import com.google.common.primitives.UnsignedLongs;
import java.math.BigInteger;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * An inclusive walk from {@code start} towards {@code end}, moving {@code step} positions at a
 * time.
 *
 * <p>The walk ascends when start is below end, descends when it is above, and yields the single
 * item start when both are equal. It never lands on {@code end} artificially: the last item is the
 * last position reachable without crossing {@code end}. Since every position it moves to lies
 * between the two endpoints, stepping can never overflow the position space.
 *
 * <p>Items are converted from positions lazily, when they are returned. A position that does not
 * convert yields a failed {@link Attempt} and the walk carries on past it.
 *
 * <p>Each call to {@link #iterator()} starts a new walk.
 */
public final class RangeSequence<T> implements Iterable<Attempt<T>> {
  private final SequenceDomain<T> domain;
  private final long start;
  private final long end;
  private final long step;

  private RangeSequence(SequenceDomain<T> domain, long start, long end, long step) {
    this.domain = domain;
    this.start = start;
    this.end = end;
    this.step = step;
  }

  /**
   * @param step the distance between two items, read as an unsigned value; must not be zero
   */
  public static <T> RangeSequence<T> of(SequenceDomain<T> domain, T start, T end, long step) {
    checkNotNull(domain);
    checkArgument(step != 0, "step must be positive");
    return new RangeSequence<>(domain, domain.toPosition(start), domain.toPosition(end), step);
  }

  public static RangeSequence<Long> ofIntegers(long start, long end, long step) {
    return of(SequenceDomain.INTEGERS, start, end, step);
  }

  public static RangeSequence<Integer> ofCodePoints(int start, int end, long step) {
    return of(SequenceDomain.CODE_POINTS, start, end, step);
  }

  /** Number of items a walk yields, failed ones included: |end - start| / step + 1. */
  public BigInteger size() {
    long distance = UnsignedLongs.compare(start, end) <= 0 ? end - start : start - end;
    return UnsignedLong.fromLongBits(distance)
        .bigIntegerValue()
        .divide(UnsignedLong.fromLongBits(step).bigIntegerValue())
        .add(BigInteger.ONE);
  }

  @Override
  public Iterator<Attempt<T>> iterator() {
    return new Walk();
  }

  @Override
  public String toString() {
    return "RangeSequence{"
        + domain
        + ", "
        + UnsignedLongs.toString(start)
        + ".."
        + UnsignedLongs.toString(end)
        + ".."
        + UnsignedLongs.toString(step)
        + "}";
  }

  private final class Walk implements Iterator<Attempt<T>> {
    private long next = start;
    private boolean exhausted = false;

    @Override
    public boolean hasNext() {
      return !exhausted;
    }

    @Override
    public Attempt<T> next() {
      if (exhausted) {
        throw new NoSuchElementException();
      }
      long current = next;
      advance(current);
      try {
        return Attempt.success(domain.fromPosition(current));
      } catch (CharacterConversionException e) {
        return Attempt.failure(e);
      }
    }

    /** Moves to the position after {@code current}, or marks the walk exhausted. */
    private void advance(long current) {
      int direction = UnsignedLongs.compare(current, end);
      if (direction < 0 && UnsignedLongs.compare(end - current, step) >= 0) {
        next = current + step;
      } else if (direction > 0 && UnsignedLongs.compare(current - end, step) >= 0) {
        next = current - step;
      } else {
        exhausted = true;
      }
    }
  }
}
