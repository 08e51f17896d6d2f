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
package net.hydromatic.arbor.compile;

import net.hydromatic.arbor.ast.Ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/** Query that has been compiled against a corpus schema.
 *
 * <p>It is immutable, and may be evaluated any number of times, by any
 * number of threads. */
public class CompiledQuery {
  /** Normalized query. */
  public final Ast.Query query;
  /** Node variables, named and anonymous, in order of first occurrence. */
  public final ImmutableList<NodeVariable> variables;
  /** Normalized node description of each variable. */
  public final ImmutableMap<NodeVariable, Ast.NodeDescription> nodeDefs;
  /** Predicates of each variable, including filters pushed down from
   * constraints. */
  public final ImmutableMap<NodeVariable, ImmutableList<QueryPredicate>>
      predicates;
  public final ImmutableList<QueryConstraint> constraints;
  /** Store query of each variable. */
  public final ImmutableMap<NodeVariable, NodeQuery> nodeQueries;
  public final Strategy strategy;

  CompiledQuery(Ast.Query query, List<NodeVariable> variables,
      ImmutableMap<NodeVariable, Ast.NodeDescription> nodeDefs,
      ImmutableMap<NodeVariable, ImmutableList<QueryPredicate>> predicates,
      List<QueryConstraint> constraints,
      ImmutableMap<NodeVariable, NodeQuery> nodeQueries, Strategy strategy) {
    this.query = requireNonNull(query);
    this.variables = ImmutableList.copyOf(variables);
    this.nodeDefs = requireNonNull(nodeDefs);
    this.predicates = requireNonNull(predicates);
    this.constraints = ImmutableList.copyOf(constraints);
    this.nodeQueries = requireNonNull(nodeQueries);
    this.strategy = requireNonNull(strategy);
    checkArgument(nodeQueries.keySet().equals(nodeDefs.keySet()));
  }

  /** Returns the variable with a given name. */
  public NodeVariable variable(String name) {
    for (NodeVariable variable : variables) {
      if (variable.name.equals(name)) {
        return variable;
      }
    }
    throw new IllegalArgumentException("unknown variable " + name);
  }

  /** Returns the predicates of a variable. */
  public List<QueryPredicate> predicates(NodeVariable variable) {
    final ImmutableList<QueryPredicate> list = predicates.get(variable);
    return list == null ? ImmutableList.of() : list;
  }

  @Override public String toString() {
    final StringBuilder b = new StringBuilder();
    for (NodeVariable variable : variables) {
      b.append(variable).append(':').append(variable.kind())
          .append(' ').append(nodeDefs.get(variable));
      final List<QueryPredicate> predicates = predicates(variable);
      if (!predicates.isEmpty()) {
        b.append(' ').append(predicates);
      }
      b.append('\n');
    }
    constraints.forEach(c -> b.append(c).append('\n'));
    return b.append(strategy).toString();
  }

  /** How results are computed from the candidates of each tree. */
  public enum Strategy {
    /** No constraints; every combination of candidates is a result. */
    CARTESIAN,
    /** Candidates are checked against constraints. */
    CONSTRAINT_CHECK
  }
}

// End CompiledQuery.java
