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

import net.hydromatic.arbor.compile.NodeQuery;
import net.hydromatic.arbor.compile.NodeVariable;
import net.hydromatic.arbor.store.FeatureMatch;
import net.hydromatic.arbor.store.Lookup;
import net.hydromatic.arbor.store.NodeCursor;
import net.hydromatic.arbor.store.NodeFilter;
import net.hydromatic.arbor.store.TreeRange;
import net.hydromatic.arbor.store.TreebankIndex;
import net.hydromatic.arbor.store.ValueTable;

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/** Converts the node query of each variable into lookups against the store,
 * and runs them.
 *
 * <p>Caches the ids of feature values, and the value tables that hold the
 * values matched by each regular expression. Value tables are dropped when
 * the searcher is closed. */
class NodeSearcher implements AutoCloseable {
  private final TreebankIndex index;
  private final Map<List<String>, OptionalInt> valueIds = new HashMap<>();
  private final Map<List<Object>, ValueTable> valueTables = new HashMap<>();

  NodeSearcher(TreebankIndex index) {
    this.index = requireNonNull(index);
  }

  /** Returns the lookups, one per disjunct, that find the candidates of a
   * variable.
   *
   * <p>A disjunct that requires a value that does not occur in the corpus
   * has no lookup. If no disjunct remains, a Set variable has no
   * candidates, and a Single variable means that the query has no results.
   *
   * @throws EmptyResultException if a Single variable can match no node */
  List<Lookup> lookups(NodeVariable variable, NodeQuery query) {
    final List<Lookup> lookups = new ArrayList<>();
    for (NodeQuery.Disjunct disjunct : query.disjuncts) {
      final Lookup lookup = lookup(disjunct, query.filters);
      if (lookup != null && !lookups.contains(lookup)) {
        lookups.add(lookup);
      }
    }
    if (lookups.isEmpty() && !variable.isSet()) {
      throw new EmptyResultException("no node can match " + variable);
    }
    return lookups;
  }

  private @Nullable Lookup lookup(NodeQuery.Disjunct disjunct,
      List<NodeFilter> filters) {
    final List<FeatureMatch> features = new ArrayList<>();
    for (NodeQuery.FeatureTest test : disjunct.tests) {
      final FeatureMatch match;
      if (test.regex) {
        final ValueTable table = valueTable(test);
        if (table.size == 0) {
          return null;
        }
        match = FeatureMatch.in(test.feature, table.name);
      } else {
        final OptionalInt valueId = valueId(test.feature, test.value);
        if (valueId.isPresent()) {
          match = test.match
              ? FeatureMatch.equal(test.feature, valueId.getAsInt())
              : FeatureMatch.notEqual(test.feature, valueId.getAsInt());
        } else if (test.match) {
          return null;
        } else {
          // Every value differs from a value that does not occur.
          match = FeatureMatch.exists(test.feature);
        }
      }
      if (!features.contains(match)) {
        features.add(match);
      }
    }
    final ImmutableList.Builder<NodeFilter> filterList =
        ImmutableList.builder();
    if (disjunct.kind != null) {
      filterList.add(NodeFilter.of(disjunct.kind));
    }
    filterList.addAll(filters);
    return new Lookup(features, filterList.build());
  }

  private OptionalInt valueId(String feature, String value) {
    return valueIds.computeIfAbsent(ImmutableList.of(feature, value),
        k -> index.valueId(feature, value));
  }

  /** Returns the table of values of a feature that a regular expression
   * matches (or, for "!=", does not match), creating it the first time. */
  private ValueTable valueTable(NodeQuery.FeatureTest test) {
    final List<Object> key =
        ImmutableList.of(test.feature, test.match, test.value);
    final ValueTable table = valueTables.get(key);
    if (table != null) {
      return table;
    }
    final Pattern pattern = Pattern.compile(test.value);
    final boolean match = test.match;
    final ValueTable newTable =
        index.createValueTable(test.feature,
            value -> pattern.matcher(value).matches() == match);
    valueTables.put(key, newTable);
    return newTable;
  }

  /** Runs lookups over a range of trees. */
  NodeCursor search(List<Lookup> lookups, TreeRange range) {
    if (lookups.isEmpty()) {
      return NodeCursor.of(new int[0], new int[0]);
    }
    return index.search(lookups, range);
  }

  /** Returns a cursor with one row for each tree in a range: its root. */
  NodeCursor padding(TreeRange range) {
    return index.search(
        ImmutableList.of(
            new Lookup(ImmutableList.of(), ImmutableList.of(NodeFilter.root()))),
        range);
  }

  @Override public void close() {
    for (ValueTable table : valueTables.values()) {
      index.dropValueTable(table);
    }
    valueTables.clear();
  }
}

// End NodeSearcher.java
