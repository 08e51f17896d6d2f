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

import net.hydromatic.arbor.compile.Tracer;

import com.google.common.collect.AbstractIterator;

import java.util.Collections;
import java.util.Iterator;

import static java.util.Objects.requireNonNull;

/** Result set that reads the candidates of each tree from a
 * {@link GraphIterator} and converts them into matches.
 *
 * <p>Closing the result set closes the graph iterator, drops value tables,
 * and closes the connection. */
abstract class TreeResultSet extends AbstractIterator<Match>
    implements ResultSet {
  private final GraphIterator graphs;
  private final NodeSearcher searcher;
  final QueryContext context;
  private final Tracer tracer;
  private Iterator<Match> matches = Collections.emptyIterator();
  private boolean closed;

  TreeResultSet(GraphIterator graphs, NodeSearcher searcher,
      QueryContext context, Tracer tracer) {
    this.graphs = requireNonNull(graphs);
    this.searcher = requireNonNull(searcher);
    this.context = requireNonNull(context);
    this.tracer = requireNonNull(tracer);
  }

  /** Returns the matches of a tree. */
  abstract Iterator<Match> matches(GraphIterator.Candidates candidates);

  @Override protected Match computeNext() {
    while (!matches.hasNext()) {
      if (closed || !graphs.hasNext()) {
        return endOfData();
      }
      matches = matches(graphs.next());
    }
    return matches.next();
  }

  @Override public Stats stats() {
    return context.stats();
  }

  @Override public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      graphs.close();
      searcher.close();
    } finally {
      context.close();
    }
    tracer.onStats(stats());
  }
}

// End TreeResultSet.java
