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

import net.hydromatic.arbor.compile.Constraint;
import net.hydromatic.arbor.store.NodeRecord;
import net.hydromatic.arbor.store.TreebankIndex;

import java.util.HashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/** State of the evaluation of a query over one connection to the store.
 *
 * <p>Owns the connection, and closes it on {@link #close()}. Holds a cache
 * of node records that is cleared when evaluation moves to the next tree,
 * and the counters that become {@link Stats}.
 *
 * <p>Not thread-safe; a parallel evaluation has one context per worker. */
public class QueryContext implements Constraint.Context, AutoCloseable {
  final TreebankIndex index;
  private final Map<Integer, NodeRecord> nodes = new HashMap<>();
  private int treeId = -1;
  private long checkedTrees;
  private long constraintChecks;
  private long nodeCacheHits;
  private long nodeCacheMisses;

  public QueryContext(TreebankIndex index) {
    this.index = requireNonNull(index);
  }

  /** Starts checking the candidates of a tree. */
  void startTree(int treeId) {
    if (treeId != this.treeId) {
      nodes.clear();
      this.treeId = treeId;
    }
    ++checkedTrees;
  }

  /** Records that a constraint has been tested. */
  void countCheck() {
    ++constraintChecks;
  }

  @Override public NodeRecord node(int id) {
    final NodeRecord node = nodes.get(id);
    if (node != null) {
      ++nodeCacheHits;
      return node;
    }
    ++nodeCacheMisses;
    final NodeRecord node2 = index.node(id);
    nodes.put(id, node2);
    return node2;
  }

  @Override public boolean hasSecondaryEdge(int originId, int targetId,
      int labelId) {
    return index.hasSecondaryEdge(originId, targetId, labelId);
  }

  /** Returns a snapshot of the counters. */
  public Stats stats() {
    return new Stats(checkedTrees, constraintChecks, nodeCacheHits,
        nodeCacheMisses);
  }

  @Override public void close() {
    nodes.clear();
    index.close();
  }
}

// End QueryContext.java
