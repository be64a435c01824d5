/*
 * Copyright 2026 The Modlint Authors.
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

package com.modlint.syntax;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link SourceRange} and {@link SourcePosition}. */
@RunWith(JUnit4.class)
public final class SourceRangeTest {

  @Test
  public void testOrderingIsStartRowThenStartColumnThenEnd() {
    SourceRange a = SourceRange.of(1, 0, 1, 3);
    SourceRange b = SourceRange.of(1, 0, 2, 0);
    SourceRange c = SourceRange.of(1, 4, 1, 5);
    SourceRange d = SourceRange.of(2, 5, 2, 9);

    assertThat(Ordering.from(SourceRange.POSITION_ORDER).sortedCopy(ImmutableList.of(d, c, b, a)))
        .containsExactly(a, b, c, d)
        .inOrder();
    assertThat(a).isLessThan(d);
  }

  @Test
  public void testEndBeforeStartIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> SourceRange.of(2, 0, 1, 5));
    assertThrows(IllegalArgumentException.class, () -> SourceRange.of(1, 5, 1, 4));
  }

  @Test
  public void testNegativePositionIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> SourcePosition.of(-1, 0));
  }

  @Test
  public void testUnionAndContains() {
    SourceRange first = SourceRange.of(1, 4, 2, 0);
    SourceRange second = SourceRange.of(3, 0, 3, 8);

    SourceRange union = first.union(second);

    assertThat(union).isEqualTo(SourceRange.of(1, 4, 3, 8));
    assertThat(union.contains(first)).isTrue();
    assertThat(union.contains(second)).isTrue();
    assertThat(first.contains(union)).isFalse();
  }

  @Test
  public void testToString() {
    assertThat(SourceRange.of(1, 2, 3, 4).toString()).isEqualTo("1:2-3:4");
  }
}
