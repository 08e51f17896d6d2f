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

import net.hydromatic.arbor.store.NodeFilter;
import net.hydromatic.arbor.store.NodeRecord;
import net.hydromatic.arbor.type.NodeKind;

import com.google.common.collect.ImmutableList;
import org.apache.calcite.util.Pair;

import java.util.List;

import static java.util.Objects.requireNonNull;

/** Relation that must hold between the nodes bound to two variables.
 *
 * <p>Each sub-class chooses its {@link Check} when it is constructed, based
 * on its modifiers and on the kinds of its operands, so that evaluating a
 * constraint never branches on the modifiers. */
public abstract class Constraint {
  /** Operator as written in the query, for example "&gt;*". */
  public final String operator;
  public final boolean negated;
  private final Check check;

  protected Constraint(String operator, boolean negated, Check check) {
    this.operator = requireNonNull(operator);
    this.negated = negated;
    this.check = requireNonNull(check);
  }

  /** Returns whether the constraint holds between two nodes. */
  public final boolean test(NodeRecord left, NodeRecord right,
      Context context) {
    return check.test(left, right, context);
  }

  /** Returns the kinds that the left and right operands must have. */
  public Pair<NodeKind, NodeKind> nodeKinds() {
    return Pair.of(NodeKind.UNKNOWN, NodeKind.UNKNOWN);
  }

  /** Returns filters that any node bound to the left and right operands
   * must satisfy, given the variables' kinds. These are pushed into the
   * store lookups of the variables. */
  public Pair<List<NodeFilter>, List<NodeFilter>> filters(
      NodeVariable left, NodeVariable right) {
    return Pair.of(ImmutableList.of(), ImmutableList.of());
  }

  /** Returns the directions in which a node matches at most one node on
   * the other side. */
  public Direction singleMatchDirection() {
    return Direction.NONE;
  }

  @Override public String toString() {
    return getClass().getSimpleName() + "(" + operator + ")";
  }

  /** Evaluates a constraint on two nodes. */
  @FunctionalInterface
  public interface Check {
    boolean test(NodeRecord left, NodeRecord right, Context context);
  }

  /** Access to nodes and secondary edges while checking constraints. */
  public interface Context {
    /** Returns the record of a node. */
    NodeRecord node(int id);

    /** Returns whether there is a secondary edge between two nodes; see
     * {@link net.hydromatic.arbor.store.TreebankIndex#hasSecondaryEdge}. */
    boolean hasSecondaryEdge(int originId, int targetId, int labelId);
  }

  /** Directions in which a constraint matches at most one node.
   *
   * <p>For example, a node has at most one parent, so if immediate
   * dominance holds for a right node and some left node, it holds for no
   * other left node; its direction is {@link #RIGHT_TO_LEFT}. */
  public enum Direction {
    NONE,
    LEFT_TO_RIGHT,
    RIGHT_TO_LEFT,
    BOTH;

    /** Whether a left node matches at most one right node. */
    public boolean leftToRight() {
      return this == LEFT_TO_RIGHT || this == BOTH;
    }

    /** Whether a right node matches at most one left node. */
    public boolean rightToLeft() {
      return this == RIGHT_TO_LEFT || this == BOTH;
    }
  }
}

// End Constraint.java
