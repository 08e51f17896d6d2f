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

import java.util.List;
import java.util.OptionalInt;
import java.util.function.Predicate;

/** Read-only connection to an indexed treebank.
 *
 * <p>A connection is used by one thread at a time. Value tables that a
 * connection creates are visible only to that connection, and are dropped
 * when it is closed. */
public interface TreebankIndex extends AutoCloseable {
  /** Returns the names that the treebank defines. */
  CorpusSchema schema();

  /** Returns the number of trees; tree ids range from 0 to this value. */
  int treeCount();

  /** Returns the id of a value of a feature, or empty if no node has that
   * value. */
  OptionalInt valueId(String feature, String value);

  /** Creates a table of the ids of the values of {@code feature} that
   * satisfy {@code predicate}. */
  ValueTable createValueTable(String feature, Predicate<String> predicate);

  /** Drops a table created by {@link #createValueTable}. */
  void dropValueTable(ValueTable table);

  /** Returns the nodes, in trees within {@code range}, that satisfy at
   * least one of the lookups, ordered by tree id and then node id. */
  NodeCursor search(List<Lookup> lookups, TreeRange range);

  /** Returns the record of a node. */
  NodeRecord node(int id);

  /** Returns whether there is a secondary edge from one node to another;
   * if {@code labelId} is not {@link NodeRecord#NO_LABEL}, the edge must
   * have that label. */
  boolean hasSecondaryEdge(int originId, int targetId, int labelId);

  /** Drops remaining value tables and releases resources. */
  @Override void close();
}

// End TreebankIndex.java
