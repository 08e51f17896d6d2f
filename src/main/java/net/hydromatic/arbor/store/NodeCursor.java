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

/** Cursor over (node id, tree id) pairs, ordered by tree id.
 *
 * <p>Initially positioned before the first row; call {@link #next()} to
 * move to the first row. */
public interface NodeCursor extends AutoCloseable {
  /** Moves to the next row; returns false if there are no more rows. */
  boolean next();

  /** Returns the node id of the current row. */
  int nodeId();

  /** Returns the tree id of the current row. */
  int treeId();

  /** Releases resources. Does not throw. */
  @Override void close();

  /** Creates a cursor over rows held in two parallel arrays. */
  static NodeCursor of(int[] nodeIds, int[] treeIds) {
    return new ArrayNodeCursor(nodeIds, treeIds);
  }

  /** Cursor over arrays. */
  class ArrayNodeCursor implements NodeCursor {
    private final int[] nodeIds;
    private final int[] treeIds;
    private int i = -1;

    ArrayNodeCursor(int[] nodeIds, int[] treeIds) {
      if (nodeIds.length != treeIds.length) {
        throw new IllegalArgumentException("arrays differ in length");
      }
      this.nodeIds = nodeIds;
      this.treeIds = treeIds;
    }

    @Override public boolean next() {
      return ++i < nodeIds.length;
    }

    @Override public int nodeId() {
      return nodeIds[i];
    }

    @Override public int treeId() {
      return treeIds[i];
    }

    @Override public void close() {
      i = nodeIds.length;
    }
  }
}

// End NodeCursor.java
