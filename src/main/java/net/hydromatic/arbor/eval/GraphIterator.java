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

import net.hydromatic.arbor.compile.CompiledQuery;
import net.hydromatic.arbor.compile.NodeQuery;
import net.hydromatic.arbor.compile.NodeVariable;
import net.hydromatic.arbor.compile.QueryPredicate;
import net.hydromatic.arbor.compile.Tracer;
import net.hydromatic.arbor.store.Lookup;
import net.hydromatic.arbor.store.NodeCursor;
import net.hydromatic.arbor.store.TreeRange;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/** Iterates over the trees that have candidates for every Single variable
 * of a query, and for each such tree returns the candidates of every
 * variable.
 *
 * <p>Each Single variable has a cursor, ordered by tree id; the iterator
 * advances the cursors that are behind until all are on the same tree.
 * Cursors of Set variables do not decide which trees are returned; a tree
 * may have no candidates for a Set variable. If every variable is a Set
 * variable, a padding cursor returns each tree once.
 *
 * <p>Variables of the same container kind with equal node queries share a
 * cursor, if {@link Prop#SHARE_CURSORS} is set. */
class GraphIterator extends AbstractIterator<GraphIterator.Candidates>
    implements AutoCloseable {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(GraphIterator.class);

  /** Cursors that decide which trees are returned. */
  private final List<Source> drivers = new ArrayList<>();
  /** Cursors of Set variables. */
  private final List<Source> sets = new ArrayList<>();
  private final Map<NodeVariable, List<QueryPredicate>> setPredicates =
      new LinkedHashMap<>();
  private final List<NodeVariable> variables;

  /** Creates a GraphIterator.
   *
   * @throws EmptyResultException if a Single variable can match no node */
  GraphIterator(CompiledQuery query, NodeSearcher searcher, TreeRange range,
      boolean shareCursors, Tracer tracer) {
    this.variables = query.variables;
    final Map<List<Object>, Source> sharedSources = new LinkedHashMap<>();
    try {
      for (NodeVariable variable : query.variables) {
        final NodeQuery nodeQuery =
            requireNonNull(query.nodeQueries.get(variable));
        final List<Object> key =
            ImmutableList.of(variable.container, nodeQuery);
        final Source shared = shareCursors ? sharedSources.get(key) : null;
        if (shared != null) {
          LOGGER.debug("Variable {} shares cursor with {}", variable,
              shared.variables.get(0));
          shared.variables.add(variable);
        } else {
          final List<Lookup> lookups = searcher.lookups(variable, nodeQuery);
          tracer.onLookups(variable, lookups);
          final Source source =
              new Source(searcher.search(lookups, range), variable);
          sharedSources.put(key, source);
          (variable.isSet() ? sets : drivers).add(source);
        }
        for (QueryPredicate predicate : query.predicates(variable)) {
          if (!predicate.isNodePredicate()) {
            setPredicates.computeIfAbsent(variable, v -> new ArrayList<>())
                .add(predicate);
          }
        }
      }
      if (drivers.isEmpty()) {
        drivers.add(new Source(searcher.padding(range), null));
      }
    } catch (RuntimeException e) {
      close();
      throw e;
    }
    drivers.forEach(Source::next);
    sets.forEach(Source::next);
  }

  @Override protected Candidates computeNext() {
    for (;;) {
      // Align the drivers on the greatest current tree.
      int treeId = -1;
      for (Source driver : drivers) {
        if (!driver.valid) {
          return endOfData();
        }
        treeId = Math.max(treeId, driver.cursor.treeId());
      }
      boolean aligned = true;
      for (Source driver : drivers) {
        driver.advanceTo(treeId);
        if (!driver.valid) {
          return endOfData();
        }
        if (driver.cursor.treeId() != treeId) {
          aligned = false;
        }
      }
      if (!aligned) {
        continue;
      }

      final Map<NodeVariable, ImmutableList<Integer>> map =
          new LinkedHashMap<>();
      for (Source driver : drivers) {
        driver.collect(treeId, map);
      }
      for (Source set : sets) {
        set.advanceTo(treeId);
        set.collect(treeId, map);
      }
      if (!checkSetPredicates(map)) {
        continue;
      }
      final ImmutableMap.Builder<NodeVariable, ImmutableList<Integer>> b =
          ImmutableMap.builder();
      for (NodeVariable variable : variables) {
        b.put(variable, requireNonNull(map.get(variable)));
      }
      return new Candidates(treeId, b.build());
    }
  }

  private boolean checkSetPredicates(
      Map<NodeVariable, ImmutableList<Integer>> map) {
    for (Map.Entry<NodeVariable, List<QueryPredicate>> entry
        : setPredicates.entrySet()) {
      final int size = requireNonNull(map.get(entry.getKey())).size();
      for (QueryPredicate predicate : entry.getValue()) {
        if (!predicate.test(size)) {
          return false;
        }
      }
    }
    return true;
  }

  @Override public void close() {
    drivers.forEach(source -> source.cursor.close());
    sets.forEach(source -> source.cursor.close());
  }

  /** Candidates of each variable in a tree. */
  static class Candidates {
    final int treeId;
    final ImmutableMap<NodeVariable, ImmutableList<Integer>> nodes;

    Candidates(int treeId,
        ImmutableMap<NodeVariable, ImmutableList<Integer>> nodes) {
      this.treeId = treeId;
      this.nodes = nodes;
    }

    ImmutableList<Integer> get(NodeVariable variable) {
      return requireNonNull(nodes.get(variable));
    }

    @Override public String toString() {
      return treeId + ":" + nodes;
    }
  }

  /** Cursor, and the variables that read from it. */
  private static class Source {
    final NodeCursor cursor;
    final List<NodeVariable> variables = new ArrayList<>();
    /** Whether the cursor is on a row. */
    boolean valid;

    Source(NodeCursor cursor, @Nullable NodeVariable variable) {
      this.cursor = cursor;
      if (variable != null) {
        variables.add(variable);
      }
    }

    void next() {
      valid = cursor.next();
    }

    /** Moves to the first row whose tree is not less than a given tree. */
    void advanceTo(int treeId) {
      while (valid && cursor.treeId() < treeId) {
        next();
      }
    }

    /** Reads the rows of a tree, and assigns them to each variable. */
    void collect(int treeId,
        Map<NodeVariable, ImmutableList<Integer>> map) {
      final ImmutableList.Builder<Integer> nodeIds = ImmutableList.builder();
      while (valid && cursor.treeId() == treeId) {
        nodeIds.add(cursor.nodeId());
        next();
      }
      final ImmutableList<Integer> list = nodeIds.build();
      for (NodeVariable variable : variables) {
        map.put(variable, list);
      }
    }
  }
}

// End GraphIterator.java
