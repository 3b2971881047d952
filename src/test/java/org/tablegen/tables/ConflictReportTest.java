/*
 * Copyright 2025 The Tablegen Authors
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

package org.tablegen.tables;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ConflictReportTest {

  private static final Conflict SHIFT_REDUCE =
      new Conflict("plus", "shift (precedence 0) / reduce sum (precedence 0)");
  private static final Conflict REDUCE_REDUCE =
      new Conflict("times", "reduce sum (precedence 1) / reduce product (precedence 1)");

  @Test
  public void conflictText() {
    assertThat(SHIFT_REDUCE.text())
        .isEqualTo("plus: shift (precedence 0) / reduce sum (precedence 0)");
    assertThat(SHIFT_REDUCE.lookahead).isEqualTo("plus");
    assertThat(SHIFT_REDUCE.description)
        .isEqualTo("shift (precedence 0) / reduce sum (precedence 0)");
    assertThat(SHIFT_REDUCE)
        .isEqualTo(new Conflict("plus", "shift (precedence 0) / reduce sum (precedence 0)"));
    assertThat(SHIFT_REDUCE).isNotEqualTo(REDUCE_REDUCE);
  }

  @Test
  public void render() {
    assertThat(ConflictReport.of(ImmutableList.of()).render()).isEmpty();
    assertThat(ConflictReport.of(ImmutableList.of(SHIFT_REDUCE, REDUCE_REDUCE)).render())
        .isEqualTo(
            "2 unresolved conflicts:\n"
                + "  plus: shift (precedence 0) / reduce sum (precedence 0)\n"
                + "  times: reduce sum (precedence 1) / reduce product (precedence 1)\n");
  }

  @Test
  public void mergeOrdersByKey() {
    ConflictReport report =
        ConflictReport.merge(
            ImmutableMap.of(
                12, ImmutableList.of(REDUCE_REDUCE),
                3, ImmutableList.of(SHIFT_REDUCE),
                7, ImmutableList.<Conflict>of()));
    assertThat(report.size()).isEqualTo(2);
    assertThat(report.conflicts()).containsExactly(SHIFT_REDUCE, REDUCE_REDUCE).inOrder();
    assertThat(report.isEmpty()).isFalse();
  }
}
