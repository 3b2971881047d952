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

/**
 * A Symbol names either a syntax rule or a lexical token. Two Symbols are equal if they have the
 * same kind and the same name; a rule and a token may share a name without being confused.
 *
 * <p>Symbols carry no position information. The declaration order used for tie-breaks is assigned
 * by the {@link Grammar} that declares them (see {@link Grammar#orderOf}).
 */
public final class Symbol {

  /** The two kinds of Symbol, and that's it. */
  public enum Kind {
    RULE,
    TOKEN
  }

  public final Kind kind;
  public final String name;

  private Symbol(Kind kind, String name) {
    Preconditions.checkArgument(!name.isEmpty(), "Symbol names must be non-empty");
    this.kind = kind;
    this.name = name;
  }

  /** Returns the Symbol for the syntax rule with the given name. */
  public static Symbol rule(String name) {
    return new Symbol(Kind.RULE, name);
  }

  /** Returns the Symbol for the lexical token with the given name. */
  public static Symbol token(String name) {
    return new Symbol(Kind.TOKEN, name);
  }

  public boolean isToken() {
    return kind == Kind.TOKEN;
  }

  public boolean isRule() {
    return kind == Kind.RULE;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Symbol other && kind == other.kind && name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return kind.hashCode() * 31 + name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
