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

/**
 * A Conflict describes one ambiguous decision made while resolving competing parse actions: the
 * lookahead symbol (by display name) and the two actions with their precedences.
 *
 * <p>Conflicts are immutable. Two Conflicts are equal if their rendered text is equal.
 */
public final class Conflict {

  /** The display name of the lookahead symbol for the table cell. */
  public final String lookahead;

  /** The competing actions, e.g. "{@code shift (precedence 0) / reduce expr (precedence 0)}". */
  public final String description;

  private final String text;

  public Conflict(String lookahead, String description) {
    Preconditions.checkNotNull(lookahead);
    Preconditions.checkNotNull(description);
    this.lookahead = lookahead;
    this.description = description;
    this.text = lookahead + ": " + description;
  }

  /** Returns the text shown to the grammar author, e.g. "{@code expr: shift (...) / ...}". */
  public String text() {
    return text;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Conflict other && text.equals(other.text);
  }

  @Override
  public int hashCode() {
    return text.hashCode();
  }

  @Override
  public String toString() {
    return text;
  }
}
