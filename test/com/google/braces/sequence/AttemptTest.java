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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class AttemptTest {

  @Test
  public void testSuccess() {
    Attempt<String> attempt = Attempt.success("a");
    assertThat(attempt.isSuccess()).isTrue();
    assertThat(attempt.get()).isEqualTo("a");
    assertThat(attempt.getError()).isNull();
    assertThat(attempt.map(s -> s + "b")).isEqualTo(Attempt.success("ab"));
  }

  @Test
  public void testFailure() {
    CharacterConversionException error = new CharacterConversionException(0xD800);
    Attempt<String> attempt = Attempt.failure(error);
    assertThat(attempt.isSuccess()).isFalse();
    assertThat(attempt.getError()).isSameInstanceAs(error);
    assertThat(assertThrows(CharacterConversionException.class, attempt::get))
        .isSameInstanceAs(error);
  }

  @Test
  public void testMapPassesFailureThrough() {
    Attempt<Integer> attempt = Attempt.failure(new CharacterConversionException(0xDC00));
    Attempt<String> mapped = attempt.map(String::valueOf);
    assertThat(mapped.isSuccess()).isFalse();
    assertThat(mapped.getError().getPosition()).isEqualTo(0xDC00L);
  }

  @Test
  public void testEquality() {
    assertThat(Attempt.success("a")).isEqualTo(Attempt.success("a"));
    assertThat(Attempt.success("a")).isNotEqualTo(Attempt.success("b"));
    assertThat(Attempt.failure(new CharacterConversionException(0xD800)))
        .isEqualTo(Attempt.failure(new CharacterConversionException(0xD800)));
    assertThat(Attempt.success("a"))
        .isNotEqualTo(Attempt.failure(new CharacterConversionException(0xD800)));
  }

  @Test
  public void testMessage() {
    assertThat(new CharacterConversionException(0xD800))
        .hasMessageThat()
        .isEqualTo("Invalid character in range: U+D800 is not a Unicode scalar value");
  }
}
