/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.arbor.type;

import org.checkerframework.checker.nullness.qual.Nullable;

/** Kind of node that a node variable may bind to. */
public enum NodeKind {
  TERMINAL("T"),
  NONTERMINAL("NT"),
  /** Not known yet; may be refined to {@link #TERMINAL} or
   * {@link #NONTERMINAL}. */
  UNKNOWN(null);

  /** Token used for a feature record of this kind, e.g. "T" in "[T]";
   * null for {@link #UNKNOWN}. */
  public final @Nullable String symbol;

  NodeKind(@Nullable String symbol) {
    this.symbol = symbol;
  }

  /** Returns the opposite kind. {@link #UNKNOWN} has no opposite. */
  public NodeKind flip() {
    switch (this) {
    case TERMINAL:
      return NONTERMINAL;
    case NONTERMINAL:
      return TERMINAL;
    default:
      throw new IllegalArgumentException("cannot flip " + this);
    }
  }

  /** Looks up a kind by its feature record symbol, or returns null. */
  public static @Nullable NodeKind ofSymbol(String symbol) {
    for (NodeKind kind : values()) {
      if (symbol.equals(kind.symbol)) {
        return kind;
      }
    }
    return null;
  }
}

// End NodeKind.java
