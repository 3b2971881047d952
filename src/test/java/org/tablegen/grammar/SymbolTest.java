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

package org.tablegen.grammar;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SymbolTest {

  @Test
  public void equality() {
    assertThat(Symbol.rule("expr")).isEqualTo(Symbol.rule("expr"));
    assertThat(Symbol.rule("expr").hashCode()).isEqualTo(Symbol.rule("expr").hashCode());
    assertThat(Symbol.rule("expr")).isNotEqualTo(Symbol.rule("term"));
    // Same name, different kind
    assertThat(Symbol.rule("expr")).isNotEqualTo(Symbol.token("expr"));
  }

  @Test
  public void kinds() {
    assertThat(Symbol.token("number").isToken()).isTrue();
    assertThat(Symbol.token("number").isRule()).isFalse();
    assertThat(Symbol.rule("expr").kind).isEqualTo(Symbol.Kind.RULE);
    assertThat(Symbol.rule("expr").toString()).isEqualTo("expr");
  }

  @Test
  public void emptyName() {
    assertThrows(IllegalArgumentException.class, () -> Symbol.token(""));
  }
}
