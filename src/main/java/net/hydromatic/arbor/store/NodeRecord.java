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

import com.google.common.primitives.ImmutableIntArray;

import static java.util.Objects.requireNonNull;

/** Record describing one node of a treebank.
 *
 * <p>Node ids are unique within a treebank; nodes of a tree have contiguous
 * ids, and trees are numbered in the same order as their nodes. */
public class NodeRecord {
  /** Value of {@link #continuity} for a terminal. */
  public static final int TERMINAL = 0;
  /** Value of {@link #continuity} for a nonterminal whose terminals form a
   * contiguous span. */
  public static final int CONTINUOUS = 1;
  /** Value of {@link #continuity} for a nonterminal whose terminals have
   * gaps. */
  public static final int DISCONTINUOUS = 2;

  /** Bit of {@link #childrenKind} set if a node has a terminal child. */
  public static final int TERMINAL_CHILDREN = 1;
  /** Bit of {@link #childrenKind} set if a node has a nonterminal child. */
  public static final int NONTERMINAL_CHILDREN = 2;

  /** Label id meaning "no label". */
  public static final int NO_LABEL = -1;

  public final int id;
  public final int treeId;
  /** Id of the label of the edge from the parent, or {@link #NO_LABEL}. */
  public final int edgeLabel;
  public final int continuity;
  /** Id of the leftmost terminal; a terminal is its own corner. */
  public final int leftCorner;
  /** Id of the rightmost terminal; a terminal is its own corner. */
  public final int rightCorner;
  /** Position of a terminal in its sentence, starting at 0; -1 for a
   * nonterminal. */
  public final int tokenOrder;
  /** Gorn address: child indexes on the path from the root. The root has
   * an empty address. */
  public final ImmutableIntArray gorn;
  public final int arity;
  public final int tokenArity;
  public final int childrenKind;
  public final boolean secondaryEdgeOrigin;
  public final boolean secondaryEdgeTarget;

  public NodeRecord(int id, int treeId, int edgeLabel, int continuity,
      int leftCorner, int rightCorner, int tokenOrder, ImmutableIntArray gorn,
      int arity, int tokenArity, int childrenKind,
      boolean secondaryEdgeOrigin, boolean secondaryEdgeTarget) {
    this.id = id;
    this.treeId = treeId;
    this.edgeLabel = edgeLabel;
    this.continuity = continuity;
    this.leftCorner = leftCorner;
    this.rightCorner = rightCorner;
    this.tokenOrder = tokenOrder;
    this.gorn = requireNonNull(gorn);
    this.arity = arity;
    this.tokenArity = tokenArity;
    this.childrenKind = childrenKind;
    this.secondaryEdgeOrigin = secondaryEdgeOrigin;
    this.secondaryEdgeTarget = secondaryEdgeTarget;
  }

  public boolean isTerminal() {
    return continuity == TERMINAL;
  }

  /** Returns the length of the Gorn address; 0 for the root. */
  public int depth() {
    return gorn.length();
  }

  /** Returns whether this node's Gorn address is a prefix of (or equal to)
   * another node's. */
  public boolean isPrefixOf(NodeRecord other) {
    final int n = gorn.length();
    if (other.gorn.length() < n) {
      return false;
    }
    for (int i = 0; i < n; i++) {
      if (gorn.get(i) != other.gorn.get(i)) {
        return false;
      }
    }
    return true;
  }

  /** Returns whether this node and another node have the same parent.
   * A node is its own sibling, and so is a root. */
  public boolean isSiblingOf(NodeRecord other) {
    final int n = gorn.length();
    if (other.gorn.length() != n) {
      return false;
    }
    for (int i = 0; i < n - 1; i++) {
      if (gorn.get(i) != other.gorn.get(i)) {
        return false;
      }
    }
    return true;
  }

  @Override public String toString() {
    return "NodeRecord{id=" + id
        + ", tree=" + treeId
        + ", gorn=" + gorn
        + ", continuity=" + continuity
        + ", order=" + tokenOrder
        + "}";
  }
}

// End NodeRecord.java
