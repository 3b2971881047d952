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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.tablegen.grammar.Grammar;
import org.tablegen.grammar.Symbol;
import org.tablegen.tables.LexAction.Accept;
import org.tablegen.tables.ParseAction.Reduce;
import org.tablegen.tables.ParseAction.Shift;

/**
 * A ConflictManager decides which of two candidate actions for the same table cell survives, and
 * keeps a log of the decisions that precedence alone did not determine.
 *
 * <p>The table builder calls {@link #resolveLexAction} or {@link #resolveParseAction} once for each
 * new candidate that collides with the action already in a cell, and overwrites the cell if the
 * result is true. The ConflictManager holds no table state; apart from the accumulated {@link
 * #conflicts}, each decision depends only on its arguments.
 *
 * <p>The resolution rules are:
 *
 * <ul>
 *   <li>Identical actions never replace each other.
 *   <li>Any action beats an error.
 *   <li>Lexically, advancing beats accepting (longest match), and between two accepted tokens the
 *       one declared first wins. No lexical decision is recorded as a conflict.
 *   <li>Between a shift and a reduce, the side whose precedences are all strictly higher wins.
 *       Otherwise the shift wins and the decision is recorded, once per distinct text.
 *   <li>Between two reduces, the higher precedence wins. On a tie the rule declared first wins and
 *       the decision is always recorded.
 * </ul>
 *
 * <p>A ConflictManager is meant to be used for a single table-generation run by a single thread;
 * it is not synchronized. Builders that work in parallel should use one instance per worker and
 * combine the results with {@link ConflictReport#merge}.
 */
public class ConflictManager {

  private static final Logger LOGGER = Logger.getLogger(ConflictManager.class.getName());

  private final Grammar grammar;
  private final ImmutableMap<Symbol, String> displayNames;

  /** Every conflict recorded so far, in the order they were found. */
  private final List<Conflict> conflicts = new ArrayList<>();

  /** The shift/reduce conflicts in {@link #conflicts}, used to suppress repeats. */
  private final Set<Conflict> shiftReduceConflicts = new HashSet<>();

  /**
   * Creates a ConflictManager for {@code grammar}. {@code displayNames} gives the name to use for a
   * symbol in conflict descriptions; symbols without an entry use their declared name.
   */
  public ConflictManager(Grammar grammar, Map<Symbol, String> displayNames) {
    this.grammar = Preconditions.checkNotNull(grammar);
    this.displayNames = ImmutableMap.copyOf(displayNames);
  }

  /** Creates a ConflictManager that names every symbol by its declared name. */
  public ConflictManager(Grammar grammar) {
    this(grammar, ImmutableMap.of());
  }

  public Grammar grammar() {
    return grammar;
  }

  /** Returns the conflicts recorded so far, in the order they were recorded. */
  public ImmutableList<Conflict> conflicts() {
    return ImmutableList.copyOf(conflicts);
  }

  /**
   * Returns the name used for {@code symbol} in conflict descriptions. Throws an
   * IllegalArgumentException if the symbol has neither a display name nor a definition in the
   * grammar, unless the grammar is empty; with an empty grammar every symbol without a display
   * name uses its declared name.
   */
  public String displayName(Symbol symbol) {
    String name = displayNames.get(symbol);
    if (name != null) {
      return name;
    }
    Preconditions.checkArgument(
        grammar.isEmpty() || grammar.declares(symbol), "Unknown symbol %s", symbol);
    return symbol.name;
  }

  /** Returns true if {@code candidate} should replace {@code existing} in a lex table cell. */
  public boolean resolveLexAction(LexAction existing, LexAction candidate) {
    if (existing.equals(candidate)) {
      return false;
    }
    return switch (existing.kind()) {
      case ERROR -> true;
      case ADVANCE ->
          switch (candidate.kind()) {
            case ERROR, ACCEPT -> false;
            case ADVANCE -> {
              LOGGER.log(
                  Level.WARNING,
                  "Lexer advances to two states on the same input ({0}, {1}); keeping {0}",
                  new Object[] {existing, candidate});
              yield false;
            }
          };
      case ACCEPT ->
          switch (candidate.kind()) {
            case ERROR -> false;
            case ADVANCE -> true;
            case ACCEPT -> tokenOrder(candidate) < tokenOrder(existing);
          };
    };
  }

  private int tokenOrder(LexAction accept) {
    return grammar.orderOf(((Accept) accept).symbol);
  }

  /**
   * Returns true if {@code candidate} should replace {@code existing} in the parse table cell for
   * {@code lookahead}. May record a conflict.
   */
  public boolean resolveParseAction(Symbol lookahead, ParseAction existing, ParseAction candidate) {
    if (existing.equals(candidate)) {
      return false;
    }
    return switch (existing.kind()) {
      case ERROR -> true;
      case SHIFT ->
          switch (candidate.kind()) {
            case ERROR -> false;
            case SHIFT -> {
              LOGGER.log(
                  Level.WARNING,
                  "Parser shifts {0} to two states ({1}, {2}); keeping {1}",
                  new Object[] {lookahead, existing, candidate});
              yield false;
            }
            case REDUCE -> !shiftBeatsReduce(lookahead, (Shift) existing, (Reduce) candidate);
          };
      case REDUCE ->
          switch (candidate.kind()) {
            case ERROR -> false;
            case SHIFT -> shiftBeatsReduce(lookahead, (Shift) candidate, (Reduce) existing);
            case REDUCE -> resolveReduceReduce(lookahead, (Reduce) existing, (Reduce) candidate);
          };
    };
  }

  /**
   * Returns true if {@code shift} should be preferred over {@code reduce}. If all of the shift's
   * precedences are below the reduce's precedence the reduce wins; if they are all above, the shift
   * wins. Otherwise the shift wins and a conflict is recorded (unless the same conflict was
   * recorded previously).
   */
  private boolean shiftBeatsReduce(Symbol lookahead, Shift shift, Reduce reduce) {
    int precedence = reduce.precedence;
    if (shift.precedences.first() > precedence) {
      return true;
    } else if (shift.precedences.last() < precedence) {
      return false;
    }
    Conflict conflict =
        new Conflict(
            displayName(lookahead),
            String.format(
                "shift (precedence %s) / reduce %s (precedence %s)",
                shift.precedenceList(), displayName(reduce.symbol), precedence));
    if (shiftReduceConflicts.add(conflict)) {
      conflicts.add(conflict);
    }
    return true;
  }

  /**
   * Returns true if {@code candidate} should replace {@code existing}. The higher precedence wins;
   * if the precedences are equal the rule declared first wins and a conflict is recorded.
   */
  private boolean resolveReduceReduce(Symbol lookahead, Reduce existing, Reduce candidate) {
    if (existing.precedence != candidate.precedence) {
      return candidate.precedence > existing.precedence;
    }
    // Recorded on every call, never deduplicated; the candidate is named first.
    conflicts.add(
        new Conflict(
            displayName(lookahead),
            String.format(
                "reduce %s (precedence %s) / reduce %s (precedence %s)",
                displayName(candidate.symbol),
                candidate.precedence,
                displayName(existing.symbol),
                existing.precedence)));
    return grammar.orderOf(candidate.symbol) < grammar.orderOf(existing.symbol);
  }
}
