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
import net.hydromatic.arbor.compile.Tracer;
import net.hydromatic.arbor.store.TreeRange;
import net.hydromatic.arbor.store.TreebankIndex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.NoSuchElementException;

/** Evaluates a compiled query over a range of trees, using one connection
 * to the store. */
public abstract class Evaluator {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(Evaluator.class);

  private Evaluator() {
  }

  /** Opens a result set.
   *
   * <p>The result set takes ownership of the connection, and closes it when
   * it is closed. If a value that the query requires does not occur in the
   * corpus, returns an empty result set. */
  public static ResultSet open(CompiledQuery query, TreebankIndex index,
      TreeRange range, Map<Prop, Object> map, Tracer tracer) {
    final QueryContext context = new QueryContext(index);
    final NodeSearcher searcher = new NodeSearcher(index);
    try {
      final GraphIterator graphs =
          new GraphIterator(query, searcher, range,
              Prop.SHARE_CURSORS.booleanValue(map), tracer);
      switch (query.strategy) {
      case CARTESIAN:
        return new LazyResultSet(query.variables, graphs, searcher, context,
            tracer);
      case CONSTRAINT_CHECK:
        final ConstraintChecker checker =
            new ConstraintChecker(query, context,
                Prop.JOIN_ORDER_SAMPLE_SIZE.intValue(map));
        return new CheckedResultSet(checker, graphs, searcher, context,
            tracer);
      default:
        throw new AssertionError(query.strategy);
      }
    } catch (EmptyResultException e) {
      LOGGER.debug("Query has no results: {}", e.getMessage());
      close(searcher, context);
      final EmptyResultSet resultSet = new EmptyResultSet(context.stats());
      tracer.onStats(resultSet.stats());
      return resultSet;
    } catch (RuntimeException | Error e) {
      close(searcher, context);
      throw e;
    }
  }

  private static void close(NodeSearcher searcher, QueryContext context) {
    try {
      searcher.close();
    } finally {
      context.close();
    }
  }

  /** Result set with no matches. */
  private static class EmptyResultSet implements ResultSet {
    private final Stats stats;

    EmptyResultSet(Stats stats) {
      this.stats = stats;
    }

    @Override public boolean hasNext() {
      return false;
    }

    @Override public Match next() {
      throw new NoSuchElementException();
    }

    @Override public Stats stats() {
      return stats;
    }

    @Override public void close() {
    }
  }
}

// End Evaluator.java
