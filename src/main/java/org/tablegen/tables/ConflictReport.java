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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.List;
import java.util.Map;

/**
 * A ConflictReport is the list of conflicts found while building a set of tables, in a form that
 * can be shown to the grammar author. Conflicts are warnings: the tables are usable whatever the
 * report contains.
 */
public final class ConflictReport {
  private final ImmutableList<Conflict> conflicts;

  private ConflictReport(ImmutableList<Conflict> conflicts) {
    this.conflicts = conflicts;
  }

  /** Returns a report of the given conflicts, in the given order. */
  public static ConflictReport of(List<Conflict> conflicts) {
    return new ConflictReport(ImmutableList.copyOf(conflicts));
  }

  /** Returns a report of the conflicts recorded by {@code manager} so far. */
  public static ConflictReport of(ConflictManager manager) {
    return new ConflictReport(manager.conflicts());
  }

  /**
   * Combines the conflicts found by separate ConflictManagers (e.g. one per worker thread). The
   * lists are concatenated in ascending order of their keys, such as the index of the first state
   * each worker built, so the result does not depend on which worker finished first.
   */
  public static ConflictReport merge(Map<Integer, ? extends List<Conflict>> conflictsByKey) {
    ImmutableList.Builder<Conflict> builder = ImmutableList.builder();
    ImmutableSortedMap.copyOf(conflictsByKey).values().forEach(builder::addAll);
    return new ConflictReport(builder.build());
  }

  public ImmutableList<Conflict> conflicts() {
    return conflicts;
  }

  public boolean isEmpty() {
    return conflicts.isEmpty();
  }

  public int size() {
    return conflicts.size();
  }

  /**
   * Returns the report as text: a summary line followed by one indented line per conflict, each
   * line terminated by a newline. Returns the empty string if there are no conflicts.
   */
  public String render() {
    if (conflicts.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder();
    sb.append(conflicts.size())
        .append(conflicts.size() == 1 ? " unresolved conflict:\n" : " unresolved conflicts:\n");
    for (Conflict conflict : conflicts) {
      sb.append("  ").append(conflict.text()).append('\n');
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return render();
  }
}
