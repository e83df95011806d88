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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.braces.sequence.Attempt;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.math.BigInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RangeDescriptorTest {

  @Test
  public void testNumericValues() {
    assertThat(rendered(RangeDescriptor.numeric(-10, 10, 3)))
        .containsExactly("-10", "-7", "-4", "-1", "2", "5", "8")
        .inOrder();
  }

  @Test
  public void testFixedWidthValues() {
    assertThat(rendered(RangeDescriptor.numeric(-1, 1000, 300, 4)))
        .containsExactly("-001", "0299", "0599", "0899")
        .inOrder();
  }

  @Test
  public void testFixedWidthKeepsLongerValues() {
    RangeDescriptor range = RangeDescriptor.numeric(98, 100, 1, 2);
    assertThat(rendered(range)).containsExactly("98", "99", "100").inOrder();
  }

  @Test
  public void testFixedWidthRendering() {
    RangeDescriptor range = RangeDescriptor.numeric(0, 0, 1, 5);
    assertThat(range.render(7)).isEqualTo("00007");
    assertThat(range.render(-7)).isEqualTo("-0007");
    assertThat(range.render(12345)).isEqualTo("12345");
    assertThat(range.render(Long.MIN_VALUE)).isEqualTo("-9223372036854775808");
    assertThat(RangeDescriptor.numeric(0, 0, 1).render(-7)).isEqualTo("-7");
  }

  @Test
  public void testCharacterValues() {
    assertThat(rendered(RangeDescriptor.character('a', 'e', 2)))
        .containsExactly("a", "c", "e")
        .inOrder();
    assertThat(rendered(RangeDescriptor.character(0x1F600, 0x1F602, 1)))
        .containsExactly("\uD83D\uDE00", "\uD83D\uDE01", "\uD83D\uDE02")
        .inOrder();
  }

  @Test
  public void testSurrogateValuesFail() {
    ImmutableList<Attempt<String>> values =
        ImmutableList.copyOf(RangeDescriptor.character(0xD7FF, 0xE000, 0x400).values());
    assertThat(values).hasSize(3);
    assertThat(values.get(0).get()).isEqualTo("\uD7FF");
    assertThat(values.get(1).isSuccess()).isFalse();
    assertThat(values.get(2).isSuccess()).isFalse();
  }

  @Test
  public void testStepMagnitude() {
    assertThat(RangeDescriptor.numeric(1, 5, -2).getStep()).isEqualTo(2);
    assertThat(RangeDescriptor.numeric(1, 5, 0).getStep()).isEqualTo(1);
    assertThat(RangeDescriptor.character('a', 'c', -1).getStep()).isEqualTo(1);
    assertThat(RangeDescriptor.numeric(1, 5, Long.MIN_VALUE).getStep()).isEqualTo(Long.MIN_VALUE);
  }

  @Test
  public void testSize() {
    assertThat(RangeDescriptor.numeric(1, 10, 3).size()).isEqualTo(BigInteger.valueOf(4));
    assertThat(RangeDescriptor.character('z', 'a', 5).size()).isEqualTo(BigInteger.valueOf(6));
  }

  @Test
  public void testValueSemantics() {
    assertThat(RangeDescriptor.numeric(1, 5, -2)).isEqualTo(RangeDescriptor.numeric(1, 5, 2));
    assertThat(RangeDescriptor.numeric(1, 5, 1, 2)).isNotEqualTo(RangeDescriptor.numeric(1, 5, 1));
    assertThat(RangeDescriptor.character('1', '5', 1))
        .isNotEqualTo(RangeDescriptor.numeric('1', '5', 1));
  }

  @Test
  public void testInvalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> RangeDescriptor.numeric(1, 2, 1, -1));
    assertThrows(IllegalArgumentException.class, () -> RangeDescriptor.character(-1, 'a', 1));
  }

  private static ImmutableList<String> rendered(RangeDescriptor range) {
    return ImmutableList.copyOf(Iterables.transform(range.values(), Attempt::get));
  }
}
