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
import net.hydromatic.arbor.store.CorpusSchema;
import net.hydromatic.arbor.store.NodeFilter;
import net.hydromatic.arbor.store.NodeRecord;
import net.hydromatic.arbor.type.NodeKind;

import com.google.common.collect.ImmutableList;
import org.apache.calcite.util.Pair;

import java.util.List;

/** Constraints for each relation operator. */
public abstract class Constraints {
  private Constraints() {}

  /** Creates the constraint for a relation, given the current kinds of its
   * operands.
   *
   * @throws UndefinedNameException if the relation's label is not
   * defined */
  public static Constraint create(Ast.Relation relation, NodeKind leftKind,
      NodeKind rightKind, CorpusSchema schema) {
    switch (relation.op) {
    case DOMINANCE:
      final Ast.Dominance dominance = (Ast.Dominance) relation;
      return new DominanceConstraint(dominance,
          dominance.label == null
              ? NodeRecord.NO_LABEL
              : labelId(schema.edgeLabelId(dominance.label),
                  UndefinedNameException.Kind.EDGE_LABEL, dominance));
    case PRECEDENCE:
      return new PrecedenceConstraint((Ast.Precedence) relation,
          leftKind == NodeKind.TERMINAL && rightKind == NodeKind.TERMINAL);
    case CORNER:
      return new CornerConstraint((Ast.Corner) relation);
    case SEC_EDGE:
      final Ast.SecEdge secEdge = (Ast.SecEdge) relation;
      return new SecEdgeConstraint(secEdge,
          secEdge.label == null
              ? NodeRecord.NO_LABEL
              : labelId(schema.secondaryEdgeLabelId(secEdge.label),
                  UndefinedNameException.Kind.SECONDARY_EDGE_LABEL, secEdge));
    case SIBLING:
      return new SiblingConstraint((Ast.Sibling) relation);
    default:
      throw new AssertionError(relation.op);
    }
  }

  private static int labelId(int id, UndefinedNameException.Kind kind,
      Ast.Relation relation) {
    if (id == NodeRecord.NO_LABEL) {
      final String label = relation instanceof Ast.Dominance
          ? ((Ast.Dominance) relation).label
          : ((Ast.SecEdge) relation).label;
      throw new UndefinedNameException(kind, String.valueOf(label),
          relation.pos);
    }
    return id;
  }

  /** Order of the first terminal of a node. */
  static int order(NodeRecord node, Constraint.Context context) {
    return node.isTerminal()
        ? node.tokenOrder
        : context.node(node.leftCorner).tokenOrder;
  }

  /** Dominance, {@code L > R}: R's Gorn address extends L's by a number
   * of steps within the range; if labeled, R's edge has the label. */
  static class DominanceConstraint extends Constraint {
    private final int labelId;
    private final Direction direction;

    DominanceConstraint(Ast.Dominance dominance, int labelId) {
      super(dominance.operator(), dominance.negated,
          check(dominance.range, labelId, dominance.negated));
      this.labelId = labelId;
      this.direction = dominance.range.isImmediate() && !dominance.negated
          ? Direction.RIGHT_TO_LEFT
          : Direction.NONE;
    }

    private static Check check(Ast.Range range, int labelId,
        boolean negated) {
      if (range.isImmediate()) {
        if (labelId == NodeRecord.NO_LABEL) {
          return negated
              ? (l, r, c) -> !(r.depth() == l.depth() + 1 && l.isPrefixOf(r))
              : (l, r, c) -> r.depth() == l.depth() + 1 && l.isPrefixOf(r);
        }
        return negated
            ? (l, r, c) -> !(r.depth() == l.depth() + 1 && l.isPrefixOf(r)
                && r.edgeLabel == labelId)
            : (l, r, c) -> r.depth() == l.depth() + 1 && l.isPrefixOf(r)
                && r.edgeLabel == labelId;
      }
      if (range.isUnbounded() && range.min == 1) {
        return negated
            ? (l, r, c) -> !(r.depth() > l.depth() && l.isPrefixOf(r))
            : (l, r, c) -> r.depth() > l.depth() && l.isPrefixOf(r);
      }
      final int min = range.min;
      final int max = range.max;
      return negated
          ? (l, r, c) -> !(min <= r.depth() - l.depth()
              && r.depth() - l.depth() <= max
              && l.isPrefixOf(r))
          : (l, r, c) -> min <= r.depth() - l.depth()
              && r.depth() - l.depth() <= max
              && l.isPrefixOf(r);
    }

    @Override public Pair<NodeKind, NodeKind> nodeKinds() {
      return Pair.of(NodeKind.NONTERMINAL, NodeKind.UNKNOWN);
    }

    @Override public Pair<List<NodeFilter>, List<NodeFilter>> filters(
        NodeVariable left, NodeVariable right) {
      if (negated) {
        return super.filters(left, right);
      }
      return Pair.of(
          right.kind() == NodeKind.NONTERMINAL
              ? ImmutableList.of(NodeFilter.nonterminalChildren())
              : ImmutableList.of(),
          labelId == NodeRecord.NO_LABEL
              ? ImmutableList.of()
              : ImmutableList.of(NodeFilter.edgeLabel(labelId)));
    }

    @Override public Direction singleMatchDirection() {
      return direction;
    }
  }

  /** Precedence, {@code L . R}: the first terminal of R follows the first
   * terminal of L by a distance within the range. */
  static class PrecedenceConstraint extends Constraint {
    private final Direction direction;

    PrecedenceConstraint(Ast.Precedence precedence, boolean terminals) {
      super(precedence.operator(), precedence.negated,
          check(precedence.range, terminals, precedence.negated));
      this.direction =
          precedence.range.isImmediate() && terminals && !precedence.negated
              ? Direction.BOTH
              : Direction.NONE;
    }

    private static Check check(Ast.Range range, boolean terminals,
        boolean negated) {
      if (range.isImmediate()) {
        if (terminals) {
          return negated
              ? (l, r, c) -> r.tokenOrder - l.tokenOrder != 1
              : (l, r, c) -> r.tokenOrder - l.tokenOrder == 1;
        }
        return negated
            ? (l, r, c) -> order(r, c) - order(l, c) != 1
            : (l, r, c) -> order(r, c) - order(l, c) == 1;
      }
      if (range.isUnbounded() && range.min == 1) {
        return negated
            ? (l, r, c) -> order(l, c) >= order(r, c)
            : (l, r, c) -> order(l, c) < order(r, c);
      }
      final int min = range.min;
      final int max = range.max;
      return negated
          ? (l, r, c) -> !range.contains(order(r, c) - order(l, c))
          : (l, r, c) -> {
            final int distance = order(r, c) - order(l, c);
            return min <= distance && distance <= max;
          };
    }

    @Override public Direction singleMatchDirection() {
      return direction;
    }
  }

  /** Corner, {@code L >@l R}: R is the leftmost (or rightmost) terminal
   * that L dominates, or L itself if L is a terminal. */
  static class CornerConstraint extends Constraint {
    CornerConstraint(Ast.Corner corner) {
      super(corner.operator(), corner.negated,
          check(corner.side, corner.negated));
    }

    private static Check check(Ast.Side side, boolean negated) {
      // A terminal is its own corner.
      switch (side) {
      case LEFT:
        return negated
            ? (l, r, c) -> l.leftCorner != r.id
            : (l, r, c) -> l.leftCorner == r.id;
      default:
        return negated
            ? (l, r, c) -> l.rightCorner != r.id
            : (l, r, c) -> l.rightCorner == r.id;
      }
    }

    @Override public Pair<NodeKind, NodeKind> nodeKinds() {
      return Pair.of(NodeKind.UNKNOWN, NodeKind.TERMINAL);
    }
  }

  /** Secondary edge, {@code L >~ R}: there is a secondary edge from L to R,
   * with the given label if there is one. */
  static class SecEdgeConstraint extends Constraint {
    SecEdgeConstraint(Ast.SecEdge secEdge, int labelId) {
      super(secEdge.operator(), secEdge.negated,
          secEdge.negated
              ? (l, r, c) -> !c.hasSecondaryEdge(l.id, r.id, labelId)
              : (l, r, c) -> c.hasSecondaryEdge(l.id, r.id, labelId));
    }

    @Override public Pair<List<NodeFilter>, List<NodeFilter>> filters(
        NodeVariable left, NodeVariable right) {
      if (negated) {
        return super.filters(left, right);
      }
      return Pair.of(ImmutableList.of(NodeFilter.secondaryEdgeOrigin()),
          ImmutableList.of(NodeFilter.secondaryEdgeTarget()));
    }
  }

  /** Sibling, {@code L $ R}: L and R have the same parent, and may be the
   * same node; if ordered, L's first terminal precedes R's. */
  static class SiblingConstraint extends Constraint {
    SiblingConstraint(Ast.Sibling sibling) {
      super(sibling.operator(), sibling.negated,
          sibling.ordered
              ? (l, r, c) -> l.isSiblingOf(r) && order(l, c) < order(r, c)
              : sibling.negated
                  ? (l, r, c) -> !l.isSiblingOf(r)
                  : (l, r, c) -> l.isSiblingOf(r));
    }
  }
}

// End Constraints.java
