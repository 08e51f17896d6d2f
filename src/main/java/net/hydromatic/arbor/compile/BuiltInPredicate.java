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
import net.hydromatic.arbor.ast.Op;
import net.hydromatic.arbor.store.NodeFilter;
import net.hydromatic.arbor.type.ContainerKind;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/** Predicates that a query may call.
 *
 * <p>The first argument of every predicate is a node variable; the other
 * arguments are integers. */
public enum BuiltInPredicate {
  /** {@code root(#x)}: the node is the root of its tree. */
  ROOT("root", 0, 0, ContainerKind.values()) {
    @Override QueryPredicate create(List<Integer> args) {
      return QueryPredicate.node(name, NodeFilter.root());
    }
  },

  /** {@code continuous(#x)}: the node's terminals are contiguous. */
  CONTINUOUS("continuous", 0, 0, ContainerKind.values()) {
    @Override QueryPredicate create(List<Integer> args) {
      return QueryPredicate.node(name, NodeFilter.continuous());
    }
  },

  /** {@code discontinuous(#x)}: the node's terminals have gaps. */
  DISCONTINUOUS("discontinuous", 0, 0, ContainerKind.values()) {
    @Override QueryPredicate create(List<Integer> args) {
      return QueryPredicate.node(name, NodeFilter.discontinuous());
    }
  },

  /** {@code arity(#x, n)} or {@code arity(#x, n, m)}: the node has between
   * n and m children. */
  ARITY("arity", 1, 2, ContainerKind.values()) {
    @Override QueryPredicate create(List<Integer> args) {
      return QueryPredicate.node(name,
          NodeFilter.arity(args.get(0), args.get(args.size() - 1)));
    }
  },

  /** {@code tokenarity(#x, n)} or {@code tokenarity(#x, n, m)}: the node
   * dominates between n and m terminals. */
  TOKEN_ARITY("tokenarity", 1, 2, ContainerKind.values()) {
    @Override QueryPredicate create(List<Integer> args) {
      return QueryPredicate.node(name,
          NodeFilter.tokenArity(args.get(0), args.get(args.size() - 1)));
    }
  },

  /** {@code empty(%x)}: the Set variable has no candidates. */
  EMPTY("empty", 0, 0, ContainerKind.SET) {
    @Override QueryPredicate create(List<Integer> args) {
      return QueryPredicate.setSize(name, false);
    }
  },

  /** {@code nonempty(%x)}: the Set variable has at least one candidate. */
  NON_EMPTY("nonempty", 0, 0, ContainerKind.SET) {
    @Override QueryPredicate create(List<Integer> args) {
      return QueryPredicate.setSize(name, true);
    }
  };

  private static final ImmutableMap<String, BuiltInPredicate> BY_NAME;

  static {
    final ImmutableMap.Builder<String, BuiltInPredicate> b =
        ImmutableMap.builder();
    for (BuiltInPredicate p : values()) {
      b.put(p.name, p);
    }
    BY_NAME = b.build();
  }

  /** Name, as used in queries. */
  public final String name;
  /** Minimum number of integer arguments. */
  final int minIntArgs;
  /** Maximum number of integer arguments. */
  final int maxIntArgs;
  /** Containers that the variable argument may have. */
  final ImmutableSet<ContainerKind> containers;

  BuiltInPredicate(String name, int minIntArgs, int maxIntArgs,
      ContainerKind... containers) {
    this.name = name;
    this.minIntArgs = minIntArgs;
    this.maxIntArgs = maxIntArgs;
    this.containers = ImmutableSet.copyOf(containers);
  }

  /** Looks up a predicate by name; returns null if not found. */
  public static @Nullable BuiltInPredicate lookup(String name) {
    return BY_NAME.get(name);
  }

  /** Creates the predicate from its integer arguments, which have already
   * been checked against the signature. */
  abstract QueryPredicate create(List<Integer> args);

  /** Checks a call to this predicate against its signature, and returns the
   * variable it applies to.
   *
   * @throws PredicateSignatureException if the call has the wrong number or
   * type of arguments, or a variable of an unsupported container */
  Ast.VariableReference checkCall(Ast.Predicate call) {
    final List<Ast.Exp> args = call.args;
    if (args.size() < minIntArgs + 1) {
      throw new PredicateSignatureException(
          "missing arguments for '" + name + "'", call.pos);
    }
    if (args.size() > maxIntArgs + 1) {
      throw new PredicateSignatureException(
          "too many arguments for '" + name + "'", call.pos);
    }
    if (args.get(0).op != Op.VARIABLE_REFERENCE) {
      throw new PredicateSignatureException(
          "argument 1 of '" + name + "' must be a node variable",
          args.get(0).pos);
    }
    for (int i = 1; i < args.size(); i++) {
      if (args.get(i).op != Op.INT_LITERAL) {
        throw new PredicateSignatureException(
            "argument " + (i + 1) + " of '" + name + "' must be an integer",
            args.get(i).pos);
      }
    }
    final Ast.VariableReference variable =
        (Ast.VariableReference) args.get(0);
    if (!containers.contains(variable.container)) {
      throw new PredicateSignatureException(
          "predicate '" + name + "' is not valid for variable " + variable,
          call.pos);
    }
    if (args.size() == 3
        && ((Ast.IntLiteral) args.get(1)).value
            > ((Ast.IntLiteral) args.get(2)).value) {
      throw new CompileException("invalid range in '" + name + "'",
          call.pos);
    }
    return variable;
  }
}

// End BuiltInPredicate.java
