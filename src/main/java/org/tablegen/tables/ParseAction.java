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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Arrays;
import java.util.Collection;
import org.tablegen.grammar.Symbol;

/**
 * A ParseAction is what the parser does in one cell of the parse table, given the current state
 * and a lookahead symbol: report an error, shift to another state, or reduce some number of stack
 * entries to a rule.
 *
 * <p>As with {@link LexAction}, the variants are closed and consumers should switch on {@link
 * #kind}.
 *
 * <p>A Shift carries the precedences of every item that justifies it (several overlapping items
 * with different declared precedences can demand the same shift); a Reduce carries the single
 * precedence declared on its production.
 */
public abstract class ParseAction {

  /** We define three subclasses (Error, Shift, Reduce), and that's it. */
  private ParseAction() {}

  public enum Kind {
    ERROR,
    SHIFT,
    REDUCE
  }

  public abstract Kind kind();

  private static final Error ERROR = new Error();

  /** Returns the action for a lookahead with no valid continuation. */
  public static ParseAction error() {
    return ERROR;
  }

  /**
   * Returns an action that shifts to {@code state}. {@code precedences} must be non-empty; it
   * contains one entry per distinct precedence among the items demanding the shift.
   */
  public static ParseAction shift(int state, Collection<Integer> precedences) {
    Preconditions.checkArgument(state >= 0, "Negative parse state %s", state);
    Preconditions.checkArgument(
        !precedences.isEmpty(), "Shift to state %s has no precedence", state);
    return new Shift(state, ImmutableSortedSet.copyOf(precedences));
  }

  /** Varargs version of {@link #shift(int, Collection)}. */
  public static ParseAction shift(int state, Integer... precedences) {
    return shift(state, Arrays.asList(precedences));
  }

  /**
   * Returns an action that pops {@code count} entries from the parse stack and replaces them with
   * {@code symbol}, which must be a rule.
   */
  public static ParseAction reduce(Symbol symbol, int count, int precedence) {
    Preconditions.checkArgument(
        symbol.isRule(), "Only rules can be reduced to (got token %s)", symbol);
    Preconditions.checkArgument(
        count >= 0, "Negative symbol count %s reducing to %s", count, symbol);
    return new Reduce(symbol, count, precedence);
  }

  public static final class Error extends ParseAction {
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

  public static final class Shift extends ParseAction {
    public final int state;

    /** Never empty; iterates in ascending order. */
    public final ImmutableSortedSet<Integer> precedences;

    private Shift(int state, ImmutableSortedSet<Integer> precedences) {
      this.state = state;
      this.precedences = precedences;
    }

    @Override
    public Kind kind() {
      return Kind.SHIFT;
    }

    /** Returns the precedences as a comma-separated list, in ascending order. */
    String precedenceList() {
      return Joiner.on(", ").join(precedences);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Shift other
          && state == other.state
          && precedences.equals(other.precedences);
    }

    @Override
    public int hashCode() {
      return 1 + (state * 31 + precedences.hashCode()) * 31;
    }

    @Override
    public String toString() {
      return String.format("shift %s (precedence %s)", state, precedenceList());
    }
  }

  public static final class Reduce extends ParseAction {
    public final Symbol symbol;
    public final int count;
    public final int precedence;

    private Reduce(Symbol symbol, int count, int precedence) {
      this.symbol = symbol;
      this.count = count;
      this.precedence = precedence;
    }

    @Override
    public Kind kind() {
      return Kind.REDUCE;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Reduce other
          && count == other.count
          && precedence == other.precedence
          && symbol.equals(other.symbol);
    }

    @Override
    public int hashCode() {
      return 2 + ((symbol.hashCode() * 31 + count) * 31 + precedence) * 31;
    }

    @Override
    public String toString() {
      return String.format("reduce %s/%s (precedence %s)", symbol, count, precedence);
    }
  }
}
