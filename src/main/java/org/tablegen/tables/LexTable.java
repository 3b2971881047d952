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
import com.google.common.collect.ImmutableSortedMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

/**
 * A LexTable maps (state, character) cells to LexActions. Each state also has a default action,
 * used for characters that have no cell of their own; it starts out as {@link LexAction#error}.
 *
 * <p>Like {@link ParseTable}, collisions are settled by the table's {@link ConflictManager}.
 */
public class LexTable {
  private final ConflictManager manager;
  private final List<LexState> states = new ArrayList<>();

  private static class LexState {
    /** Keyed by code point. */
    final TreeMap<Integer, LexAction> actions = new TreeMap<>();

    LexAction defaultAction = LexAction.error();
  }

  public LexTable(ConflictManager manager) {
    this.manager = Preconditions.checkNotNull(manager);
  }

  /** Adds a new state with no actions and returns its index. */
  public int addState() {
    states.add(new LexState());
    return states.size() - 1;
  }

  public int stateCount() {
    return states.size();
  }

  /**
   * Offers {@code action} for the cell ({@code state}, {@code codePoint}). Returns true if the cell
   * holds {@code action} afterwards.
   */
  @CanIgnoreReturnValue
  public boolean addAction(int state, int codePoint, LexAction action) {
    Preconditions.checkArgument(
        Character.isValidCodePoint(codePoint), "Invalid code point %s", codePoint);
    LexState lexState = state(state);
    LexAction existing = lexState.actions.get(codePoint);
    if (existing == null || manager.resolveLexAction(existing, action)) {
      lexState.actions.put(codePoint, action);
      return true;
    }
    return existing.equals(action);
  }

  /**
   * Offers {@code action} as the default action of {@code state}. Returns true if it is the default
   * action afterwards.
   */
  @CanIgnoreReturnValue
  public boolean addDefaultAction(int state, LexAction action) {
    LexState lexState = state(state);
    if (manager.resolveLexAction(lexState.defaultAction, action)) {
      lexState.defaultAction = action;
      return true;
    }
    return lexState.defaultAction.equals(action);
  }

  /**
   * Returns the action taken in {@code state} on {@code codePoint}: the cell's action if it has
   * one, otherwise the state's default action.
   */
  public LexAction actionAt(int state, int codePoint) {
    LexState lexState = state(state);
    LexAction action = lexState.actions.get(codePoint);
    return (action != null) ? action : lexState.defaultAction;
  }

  public LexAction defaultAction(int state) {
    return state(state).defaultAction;
  }

  /** Returns the non-default cells of {@code state}, keyed by code point. */
  public ImmutableSortedMap<Integer, LexAction> actions(int state) {
    return ImmutableSortedMap.copyOf(state(state).actions);
  }

  private LexState state(int state) {
    Preconditions.checkElementIndex(state, states.size(), "lex state");
    return states.get(state);
  }
}
