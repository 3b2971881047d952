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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A Grammar is an ordered catalogue of syntax rule definitions and (separately) lexical token
 * definitions, exactly as they were declared. Definitions are never reordered, deduplicated or
 * sorted.
 *
 * <p>Each distinct symbol is assigned a declaration-order index when the Grammar is constructed:
 * the position of its first definition among the definitions of the same kind. Rules and tokens
 * are numbered independently, so the first rule and the first token both have index 0.
 *
 * <p>Grammars are immutable.
 */
public final class Grammar {

  /**
   * The index returned by {@link #orderOf} for a symbol this Grammar does not declare. It sorts
   * after every declared symbol, and all undeclared symbols share it.
   */
  public static final int UNDECLARED = Integer.MAX_VALUE;

  /** A Grammar with no rules and no tokens. */
  public static final Grammar EMPTY = new Grammar(ImmutableList.of(), ImmutableList.of());

  /**
   * One declaration: the defined symbol and the text of its definition. The body is opaque here;
   * it is whatever the grammar source said (a rule expression or a token pattern).
   */
  public record Definition(Symbol symbol, String body) {
    public Definition {
      Preconditions.checkNotNull(symbol);
      Preconditions.checkNotNull(body);
    }
  }

  private final ImmutableList<Definition> rules;
  private final ImmutableList<Definition> tokens;

  /** Declaration-order index of each distinct rule and token, computed once. */
  private final ImmutableMap<Symbol, Integer> order;

  /**
   * Creates a Grammar from ordered rule definitions and ordered token definitions. Every rule
   * definition must define a {@link Symbol.Kind#RULE} symbol, and every token definition a {@link
   * Symbol.Kind#TOKEN} symbol.
   */
  public Grammar(List<Definition> rules, List<Definition> tokens) {
    this.rules = ImmutableList.copyOf(rules);
    this.tokens = ImmutableList.copyOf(tokens);
    Map<Symbol, Integer> order = new HashMap<>();
    addFirstOccurrences(this.rules, Symbol.Kind.RULE, order);
    addFirstOccurrences(this.tokens, Symbol.Kind.TOKEN, order);
    this.order = ImmutableMap.copyOf(order);
  }

  private static void addFirstOccurrences(
      ImmutableList<Definition> definitions, Symbol.Kind kind, Map<Symbol, Integer> order) {
    for (int i = 0; i < definitions.size(); i++) {
      Symbol symbol = definitions.get(i).symbol();
      Preconditions.checkArgument(
          symbol.kind == kind, "%s definition of %s at position %s", kind, symbol, i);
      order.putIfAbsent(symbol, i);
    }
  }

  /** Returns a Builder for a new Grammar. */
  public static Builder builder() {
    return new Builder();
  }

  /** The rule definitions, in declaration order. */
  public ImmutableList<Definition> rules() {
    return rules;
  }

  /** The token definitions, in declaration order. */
  public ImmutableList<Definition> tokens() {
    return tokens;
  }

  public boolean isEmpty() {
    return rules.isEmpty() && tokens.isEmpty();
  }

  /** True if {@code symbol} has at least one definition in this Grammar. */
  public boolean declares(Symbol symbol) {
    return order.containsKey(symbol);
  }

  /**
   * Returns the declaration-order index of {@code symbol} among symbols of its kind, or {@link
   * #UNDECLARED} if this Grammar has no definition for it.
   */
  public int orderOf(Symbol symbol) {
    return order.getOrDefault(symbol, UNDECLARED);
  }

  @Override
  public String toString() {
    return String.format("Grammar(%s rules, %s tokens)", rules.size(), tokens.size());
  }

  /** Accumulates definitions in declaration order. */
  public static class Builder {
    private final ImmutableList.Builder<Definition> rules = ImmutableList.builder();
    private final ImmutableList.Builder<Definition> tokens = ImmutableList.builder();

    private Builder() {}

    /** Appends a definition for the rule with the given name. */
    @CanIgnoreReturnValue
    public Builder rule(String name, String body) {
      rules.add(new Definition(Symbol.rule(name), body));
      return this;
    }

    /** Appends a definition for the token with the given name. */
    @CanIgnoreReturnValue
    public Builder token(String name, String pattern) {
      tokens.add(new Definition(Symbol.token(name), pattern));
      return this;
    }

    public Grammar build() {
      return new Grammar(rules.build(), tokens.build());
    }
  }
}
