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

import net.hydromatic.arbor.compile.NodeVariable;
import net.hydromatic.arbor.compile.Tracer;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import com.google.common.collect.Lists;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Result set of a query that has no constraints.
 *
 * <p>Every combination of the candidates of the Single variables in a tree
 * is a match; combinations are generated as they are read. */
class LazyResultSet extends TreeResultSet {
  private final ImmutableList<NodeVariable> singles;

  LazyResultSet(List<NodeVariable> variables, GraphIterator graphs,
      NodeSearcher searcher, QueryContext context, Tracer tracer) {
    super(graphs, searcher, context, tracer);
    final ImmutableList.Builder<NodeVariable> b = ImmutableList.builder();
    for (NodeVariable variable : variables) {
      if (!variable.isSet()) {
        b.add(variable);
      }
    }
    this.singles = b.build();
  }

  @Override Iterator<Match> matches(GraphIterator.Candidates candidates) {
    context.startTree(candidates.treeId);
    final List<List<Integer>> lists = new ArrayList<>();
    for (NodeVariable variable : singles) {
      lists.add(candidates.get(variable));
    }
    return Iterators.transform(Lists.cartesianProduct(lists).iterator(),
        combination -> {
          final Map<String, Integer> bindings = new LinkedHashMap<>();
          for (int i = 0; i < singles.size(); i++) {
            bindings.put(singles.get(i).name, combination.get(i));
          }
          return new Match(candidates.treeId, bindings);
        });
  }
}

// End LazyResultSet.java
