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
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.tablegen.grammar.Symbol;

/**
 * A ParseTable maps (state, lookahead) cells to ParseActions. States are numbered from 0 in the
 * order they are added.
 *
 * <p>The table makes no decisions itself: when an action is added to an occupied cell, the {@link
 * ConflictManager} it was created with decides whether the new action replaces the old one.
 */
public class ParseTable {
  private final ConflictManager manager;

  /** Indexed by state; each map is linked to preserve the order in which lookaheads were added. */
  private final List<Map<Symbol, ParseAction>> states = new ArrayList<>();

  public ParseTable(ConflictManager manager) {
    this.manager = Preconditions.checkNotNull(manager);
  }

  /** Adds a new state with no actions and returns its index. */
  public int addState() {
    states.add(new LinkedHashMap<>());
    return states.size() - 1;
  }

  public int stateCount() {
    return states.size();
  }

  /**
   * Offers {@code action} for the cell ({@code state}, {@code lookahead}). If the cell is empty the
   * action is stored; otherwise it replaces the current action only if the ConflictManager says
   * so. Returns true if the cell holds {@code action} afterwards.
   */
  @CanIgnoreReturnValue
  public boolean addAction(int state, Symbol lookahead, ParseAction action) {
    Map<Symbol, ParseAction> actions = state(state);
    ParseAction existing = actions.get(lookahead);
    if (existing == null || manager.resolveParseAction(lookahead, existing, action)) {
      actions.put(lookahead, action);
      return true;
    }
    return existing.equals(action);
  }

  /** Returns the action for the given cell, or {@link ParseAction#error} if it is empty. */
  public ParseAction actionAt(int state, Symbol lookahead) {
    return state(state).getOrDefault(lookahead, ParseAction.error());
  }

  /** Returns the non-empty cells of {@code state}, in the order their lookaheads were added. */
  public ImmutableMap<Symbol, ParseAction> actions(int state) {
    return ImmutableMap.copyOf(state(state));
  }

  private Map<Symbol, ParseAction> state(int state) {
    Preconditions.checkElementIndex(state, states.size(), "parse state");
    return states.get(state);
  }
}
