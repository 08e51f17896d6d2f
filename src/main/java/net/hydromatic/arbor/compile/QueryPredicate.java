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
package net.hydromatic.arbor.compile;

import net.hydromatic.arbor.store.NodeFilter;

import static java.util.Objects.requireNonNull;

/** Predicate on a node variable.
 *
 * <p>A node predicate becomes a {@link NodeFilter} in the store lookup of
 * its variable. A set predicate is evaluated on the candidates of a Set
 * variable in a tree, after they have been retrieved. */
public abstract class QueryPredicate {
  public final String name;

  private QueryPredicate(String name) {
    this.name = requireNonNull(name);
  }

  /** Creates a node predicate. */
  public static QueryPredicate node(String name, NodeFilter filter) {
    return new NodePredicate(name, filter);
  }

  /** Creates a set predicate that requires a given number of candidates:
   * none, or at least one. */
  public static QueryPredicate setSize(String name, boolean nonEmpty) {
    return new SetSizePredicate(name, nonEmpty);
  }

  /** Returns whether this predicate filters individual nodes. */
  public abstract boolean isNodePredicate();

  /** Returns the store filter of a node predicate. */
  public abstract NodeFilter filter();

  /** Evaluates a set predicate on the number of candidates in a tree. */
  public abstract boolean test(int candidateCount);

  /** Predicate that filters individual nodes. */
  private static class NodePredicate extends QueryPredicate {
    private final NodeFilter filter;

    NodePredicate(String name, NodeFilter filter) {
      super(name);
      this.filter = requireNonNull(filter);
    }

    @Override public boolean isNodePredicate() {
      return true;
    }

    @Override public NodeFilter filter() {
      return filter;
    }

    @Override public boolean test(int candidateCount) {
      throw new UnsupportedOperationException();
    }

    @Override public String toString() {
      return name + ":" + filter;
    }

    @Override public int hashCode() {
      return filter.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof NodePredicate
          && filter.equals(((NodePredicate) o).filter);
    }
  }

  /** Predicate on the number of candidates of a Set variable. */
  private static class SetSizePredicate extends QueryPredicate {
    private final boolean nonEmpty;

    SetSizePredicate(String name, boolean nonEmpty) {
      super(name);
      this.nonEmpty = nonEmpty;
    }

    @Override public boolean isNodePredicate() {
      return false;
    }

    @Override public NodeFilter filter() {
      throw new UnsupportedOperationException();
    }

    @Override public boolean test(int candidateCount) {
      return (candidateCount > 0) == nonEmpty;
    }

    @Override public String toString() {
      return name;
    }

    @Override public int hashCode() {
      return Boolean.hashCode(nonEmpty);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof SetSizePredicate
          && nonEmpty == ((SetSizePredicate) o).nonEmpty;
    }
  }
}

// End QueryPredicate.java
