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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * The lazy n-ary cartesian product of a list of iterables, in odometer order: the first dimension
 * varies slowest and the last one fastest.
 *
 * <p>Unlike {@link com.google.common.collect.Lists#cartesianProduct}, dimensions are never
 * materialized. When a digit rolls over, its dimension is replayed by asking the iterable for a
 * fresh iterator, so every dimension must yield the same items each time it is iterated.
 *
 * <p>With no dimensions the product holds exactly one tuple, the empty one. With any empty
 * dimension it holds none.
 */
public final class CartesianProduct<T> implements Iterable<ImmutableList<T>> {
  private final ImmutableList<Iterable<? extends T>> dimensions;

  private CartesianProduct(ImmutableList<Iterable<? extends T>> dimensions) {
    this.dimensions = dimensions;
  }

  public static <T> CartesianProduct<T> of(List<? extends Iterable<? extends T>> dimensions) {
    return new CartesianProduct<>(ImmutableList.copyOf(dimensions));
  }

  @Override
  public Iterator<ImmutableList<T>> iterator() {
    return new Odometer();
  }

  private final class Odometer implements Iterator<ImmutableList<T>> {
    private final List<Iterator<? extends T>> digits;
    private final Object[] current;
    private boolean started = false;
    private boolean empty = false;

    Odometer() {
      this.digits = new ArrayList<>(dimensions.size());
      for (Iterable<? extends T> dimension : dimensions) {
        Iterator<? extends T> digit = dimension.iterator();
        empty |= !digit.hasNext();
        digits.add(digit);
      }
      this.current = new Object[dimensions.size()];
    }

    @Override
    public boolean hasNext() {
      if (!started) {
        return !empty;
      }
      for (Iterator<? extends T> digit : digits) {
        if (digit.hasNext()) {
          return true;
        }
      }
      return false;
    }

    @Override
    public ImmutableList<T> next() {
      if (!started) {
        if (empty) {
          throw new NoSuchElementException();
        }
        started = true;
        for (int i = 0; i < digits.size(); i++) {
          current[i] = digits.get(i).next();
        }
        return snapshot();
      }

      int carry = digits.size() - 1;
      while (carry >= 0 && !digits.get(carry).hasNext()) {
        carry--;
      }
      if (carry < 0) {
        throw new NoSuchElementException();
      }
      current[carry] = digits.get(carry).next();
      for (int i = carry + 1; i < digits.size(); i++) {
        Iterator<? extends T> replay = dimensions.get(i).iterator();
        checkState(replay.hasNext(), "dimension %s yielded no items on replay", i);
        digits.set(i, replay);
        current[i] = replay.next();
      }
      return snapshot();
    }

    @SuppressWarnings("unchecked")
    private ImmutableList<T> snapshot() {
      ImmutableList.Builder<T> tuple = ImmutableList.builderWithExpectedSize(current.length);
      for (Object element : current) {
        tuple.add((T) element);
      }
      return tuple.build();
    }
  }
}
