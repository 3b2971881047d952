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

import com.google.common.base.Preconditions;
import org.tablegen.grammar.Symbol;

/**
 * A LexAction is what the lexer does in one cell of the lex table: report an error, keep consuming
 * input in another lex state, or accept the input consumed so far as a token.
 *
 * <p>The set of variants is closed; code that needs to distinguish them should switch on {@link
 * #kind}, so that adding a variant fails to compile until every such switch handles it.
 *
 * <p>LexActions are immutable and compared structurally.
 */
public abstract class LexAction {

  /** We define three subclasses (Error, Advance, Accept), and that's it. */
  private LexAction() {}

  public enum Kind {
    ERROR,
    ADVANCE,
    ACCEPT
  }

  public abstract Kind kind();

  private static final Error ERROR = new Error();

  /** Returns the action for a lex state in which no token can be recognized. */
  public static LexAction error() {
    return ERROR;
  }

  /** Returns an action that consumes the next character and moves to {@code state}. */
  public static LexAction advance(int state) {
    Preconditions.checkArgument(state >= 0, "Negative lex state %s", state);
    return new Advance(state);
  }

  /** Returns an action that recognizes the input consumed so far as {@code symbol}. */
  public static LexAction accept(Symbol symbol) {
    Preconditions.checkArgument(
        symbol.isToken(), "Only tokens can be accepted (got rule %s)", symbol);
    return new Accept(symbol);
  }

  public static final class Error extends LexAction {
    private Error() {}

    @Override
    public Kind kind() {
      return Kind.ERROR;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Error;
    }

    @Override
    public int hashCode() {
      return 0;
    }

    @Override
    public String toString() {
      return "error";
    }
  }

  public static final class Advance extends LexAction {
    public final int state;

    private Advance(int state) {
      this.state = state;
    }

    @Override
    public Kind kind() {
      return Kind.ADVANCE;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Advance other && state == other.state;
    }

    @Override
    public int hashCode() {
      return 1 + state * 31;
    }

    @Override
    public String toString() {
      return "advance " + state;
    }
  }

  public static final class Accept extends LexAction {
    public final Symbol symbol;

    private Accept(Symbol symbol) {
      this.symbol = symbol;
    }

    @Override
    public Kind kind() {
      return Kind.ACCEPT;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Accept other && symbol.equals(other.symbol);
    }

    @Override
    public int hashCode() {
      return 2 + symbol.hashCode() * 31;
    }

    @Override
    public String toString() {
      return "accept " + symbol;
    }
  }
}
