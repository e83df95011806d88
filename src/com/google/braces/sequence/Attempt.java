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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * One item of a lazily produced sequence: either a value, or the {@link
 * CharacterConversionException} raised while producing it.
 *
 * <p>A failed item does not end the sequence it came from. Consumers decide per item whether to
 * rethrow ({@link #get()}), skip, or report the failure.
 */
public final class Attempt<T> {
  private final @Nullable T value;
  private final @Nullable CharacterConversionException error;

  private Attempt(@Nullable T value, @Nullable CharacterConversionException error) {
    this.value = value;
    this.error = error;
  }

  public static <T> Attempt<T> success(T value) {
    return new Attempt<>(checkNotNull(value), null);
  }

  public static <T> Attempt<T> failure(CharacterConversionException error) {
    return new Attempt<>(null, checkNotNull(error));
  }

  public boolean isSuccess() {
    return error == null;
  }

  /**
   * @return the produced value
   * @throws CharacterConversionException if this item failed
   */
  public T get() {
    if (error != null) {
      throw error;
    }
    return value;
  }

  /** @return the failure, or null for a successful item */
  public @Nullable CharacterConversionException getError() {
    return error;
  }

  /** Applies {@code function} to a successful value; a failure is passed through unchanged. */
  @SuppressWarnings("unchecked")
  public <R> Attempt<R> map(Function<? super T, ? extends R> function) {
    if (error != null) {
      return (Attempt<R>) this;
    }
    return success(function.apply(value));
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Attempt)) {
      return false;
    }
    Attempt<?> that = (Attempt<?>) o;
    if (error != null || that.error != null) {
      return error != null
          && that.error != null
          && error.getPosition() == that.error.getPosition();
    }
    return value.equals(that.value);
  }

  @Override
  public int hashCode() {
    return error != null ? Long.hashCode(error.getPosition()) : Objects.hashCode(value);
  }

  @Override
  public String toString() {
    return error != null ? "Failure(" + error.getMessage() + ")" : "Success(" + value + ")";
  }
}
