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
package net.hydromatic.arbor.eval;

import com.google.common.collect.ImmutableMap;

import java.util.Comparator;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/** Result of a query: a tree, and the node bound to each Single variable.
 *
 * <p>Bindings are in the order that variables occur in the query.
 * Anonymous variables have generated names such as "$0". */
public class Match {
  /** Orders matches by tree id. */
  public static final Comparator<Match> BY_TREE =
      Comparator.comparingInt(m -> m.treeId);

  public final int treeId;
  public final ImmutableMap<String, Integer> bindings;

  public Match(int treeId, Map<String, Integer> bindings) {
    this.treeId = treeId;
    this.bindings = ImmutableMap.copyOf(bindings);
  }

  /** Returns the node bound to a variable. */
  public int get(String name) {
    return requireNonNull(bindings.get(name), name);
  }

  @Override public String toString() {
    return treeId + ":" + bindings;
  }

  @Override public int hashCode() {
    return treeId * 31 + bindings.hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Match
        && treeId == ((Match) o).treeId
        && bindings.equals(((Match) o).bindings);
  }
}

// End Match.java
