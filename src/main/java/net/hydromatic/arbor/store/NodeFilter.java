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
package net.hydromatic.arbor.store;

import net.hydromatic.arbor.type.NodeKind;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/** Condition on a single node that the store applies while searching.
 *
 * <p>Filters come from node-level predicates such as {@code root(#x)}, from
 * the kind of a variable, and from relations that push conditions down to
 * their operands. */
public class NodeFilter {
  public final Kind kind;
  /** Lower bound, or label id; unused by some kinds. */
  public final int min;
  /** Upper bound; unused by some kinds. */
  public final int max;

  private NodeFilter(Kind kind, int min, int max) {
    this.kind = requireNonNull(kind);
    this.min = min;
    this.max = max;
  }

  /** Filter that accepts nodes of a given kind. */
  public static NodeFilter of(NodeKind nodeKind) {
    switch (nodeKind) {
    case TERMINAL:
      return new NodeFilter(Kind.TERMINAL, 0, 0);
    case NONTERMINAL:
      return new NodeFilter(Kind.NONTERMINAL, 0, 0);
    default:
      throw new IllegalArgumentException("no filter for " + nodeKind);
    }
  }

  public static NodeFilter root() {
    return new NodeFilter(Kind.ROOT, 0, 0);
  }

  public static NodeFilter continuous() {
    return new NodeFilter(Kind.CONTINUOUS, 0, 0);
  }

  public static NodeFilter discontinuous() {
    return new NodeFilter(Kind.DISCONTINUOUS, 0, 0);
  }

  /** Filter on the number of children of a nonterminal. */
  public static NodeFilter arity(int min, int max) {
    checkArgument(0 <= min && min <= max, "invalid range");
    return new NodeFilter(Kind.ARITY, min, max);
  }

  /** Filter on the number of terminals dominated by a nonterminal. */
  public static NodeFilter tokenArity(int min, int max) {
    checkArgument(0 <= min && min <= max, "invalid range");
    return new NodeFilter(Kind.TOKEN_ARITY, min, max);
  }

  public static NodeFilter edgeLabel(int labelId) {
    return new NodeFilter(Kind.EDGE_LABEL, labelId, labelId);
  }

  public static NodeFilter nonterminalChildren() {
    return new NodeFilter(Kind.NONTERMINAL_CHILDREN, 0, 0);
  }

  public static NodeFilter secondaryEdgeOrigin() {
    return new NodeFilter(Kind.SECONDARY_EDGE_ORIGIN, 0, 0);
  }

  public static NodeFilter secondaryEdgeTarget() {
    return new NodeFilter(Kind.SECONDARY_EDGE_TARGET, 0, 0);
  }

  /** Evaluates this filter against a node. */
  public boolean test(NodeRecord node) {
    switch (kind) {
    case TERMINAL:
      return node.isTerminal();
    case NONTERMINAL:
      return !node.isTerminal();
    case ROOT:
      return node.depth() == 0;
    case CONTINUOUS:
      return node.continuity == NodeRecord.CONTINUOUS;
    case DISCONTINUOUS:
      return node.continuity == NodeRecord.DISCONTINUOUS;
    case ARITY:
      return !node.isTerminal()
          && min <= node.arity && node.arity <= max;
    case TOKEN_ARITY:
      return !node.isTerminal()
          && min <= node.tokenArity && node.tokenArity <= max;
    case EDGE_LABEL:
      return node.edgeLabel == min;
    case NONTERMINAL_CHILDREN:
      return (node.childrenKind & NodeRecord.NONTERMINAL_CHILDREN) != 0;
    case SECONDARY_EDGE_ORIGIN:
      return node.secondaryEdgeOrigin;
    case SECONDARY_EDGE_TARGET:
      return node.secondaryEdgeTarget;
    default:
      throw new AssertionError(kind);
    }
  }

  @Override public String toString() {
    switch (kind) {
    case ARITY:
    case TOKEN_ARITY:
      return kind + "[" + min + ", " + max + "]";
    case EDGE_LABEL:
      return kind + "[" + min + "]";
    default:
      return kind.toString();
    }
  }

  @Override public int hashCode() {
    return Objects.hash(kind, min, max);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof NodeFilter
        && kind == ((NodeFilter) o).kind
        && min == ((NodeFilter) o).min
        && max == ((NodeFilter) o).max;
  }

  /** Kind of filter. */
  public enum Kind {
    TERMINAL,
    NONTERMINAL,
    ROOT,
    CONTINUOUS,
    DISCONTINUOUS,
    ARITY,
    TOKEN_ARITY,
    EDGE_LABEL,
    NONTERMINAL_CHILDREN,
    SECONDARY_EDGE_ORIGIN,
    SECONDARY_EDGE_TARGET
  }
}

// End NodeFilter.java
