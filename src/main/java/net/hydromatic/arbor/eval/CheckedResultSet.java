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

import java.util.Iterator;

import static java.util.Objects.requireNonNull;

/** Result set of a query whose variables are connected by constraints. */
class CheckedResultSet extends TreeResultSet {
  private final ConstraintChecker checker;

  CheckedResultSet(ConstraintChecker checker, GraphIterator graphs,
      NodeSearcher searcher, QueryContext context, Tracer tracer) {
    super(graphs, searcher, context, tracer);
    this.checker = requireNonNull(checker);
  }

  @Override Iterator<Match> matches(GraphIterator.Candidates candidates) {
    return checker.check(candidates).iterator();
  }
}

// End CheckedResultSet.java
