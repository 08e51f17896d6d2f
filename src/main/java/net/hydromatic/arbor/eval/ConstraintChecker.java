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
import net.hydromatic.arbor.compile.Constraint;
import net.hydromatic.arbor.compile.NodeVariable;
import net.hydromatic.arbor.compile.QueryConstraint;
import net.hydromatic.arbor.store.NodeRecord;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/** Finds the matches in a tree by checking constraints between the
 * candidates of variables.
 *
 * <p>Pairs of variables are checked in order, and each check removes the
 * candidates that satisfy no constraint. Variables with fewer candidates
 * come first, so that the cheap checks prune the expensive ones. Until
 * {@code sampleSize} trees have been checked the order is that of the
 * query; then the order is computed from the number of candidates seen, and
 * does not change again.
 *
 * <p>A constraint whose operand is a Set variable must hold for every node
 * in the set; a set with no candidates satisfies it. */
class ConstraintChecker {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(ConstraintChecker.class);

  private final CompiledQuery query;
  private final QueryContext context;
  private final int sampleSize;
  /** Single variables, in query order. */
  private final ImmutableList<NodeVariable> singles;
  private final ImmutableList<NodeVariable> sets;
  private final Map<NodeVariable, Long> candidateCounts = new HashMap<>();
  private int sampledTrees;
  private ImmutableList<PairCheck> plan;

  ConstraintChecker(CompiledQuery query, QueryContext context,
      int sampleSize) {
    this.query = requireNonNull(query);
    this.context = requireNonNull(context);
    this.sampleSize = sampleSize;
    final ImmutableList.Builder<NodeVariable> singles =
        ImmutableList.builder();
    final ImmutableList.Builder<NodeVariable> sets = ImmutableList.builder();
    for (NodeVariable variable : query.variables) {
      (variable.isSet() ? sets : singles).add(variable);
      candidateCounts.put(variable, 0L);
    }
    this.singles = singles.build();
    this.sets = sets.build();
    this.plan = plan(ImmutableList.<NodeVariable>builder()
        .addAll(this.singles).addAll(this.sets).build());
  }

  /** Creates a check for each pair of variables, in a given order, that has
   * constraints. */
  private ImmutableList<PairCheck> plan(List<NodeVariable> order) {
    final ImmutableList.Builder<PairCheck> b = ImmutableList.builder();
    for (int i = 0; i < order.size(); i++) {
      for (int j = i + 1; j < order.size(); j++) {
        final NodeVariable upper = order.get(i);
        final NodeVariable lower = order.get(j);
        final List<Constraint> constraints = new ArrayList<>();
        final List<Boolean> exchanged = new ArrayList<>();
        for (QueryConstraint c : query.constraints) {
          if (c.left.equals(upper) && c.right.equals(lower)) {
            constraints.add(c.constraint);
            exchanged.add(false);
          } else if (c.left.equals(lower) && c.right.equals(upper)) {
            constraints.add(c.constraint);
            exchanged.add(true);
          }
        }
        if (!constraints.isEmpty()) {
          b.add(new PairCheck(upper, lower, constraints, exchanged));
        }
      }
    }
    return b.build();
  }

  /** Returns the matches in a tree. */
  List<Match> check(GraphIterator.Candidates candidates) {
    context.startTree(candidates.treeId);
    sample(candidates);

    final Map<NodeVariable, List<Integer>> nodes =
        new HashMap<>(candidates.nodes);
    final List<Set<Long>> pairs = new ArrayList<>();
    for (PairCheck check : plan) {
      final Set<Long> ok = prefilter(check, nodes);
      if (ok == null) {
        return ImmutableList.of();
      }
      pairs.add(ok);
    }
    return extract(candidates.treeId, nodes, pairs);
  }

  private void sample(GraphIterator.Candidates candidates) {
    if (sampledTrees >= sampleSize) {
      return;
    }
    candidates.nodes.forEach((variable, list) ->
        candidateCounts.merge(variable, (long) list.size(), Long::sum));
    if (++sampledTrees == sampleSize) {
      final List<NodeVariable> order = new ArrayList<>(singles);
      order.sort(Comparator.comparingLong(v -> candidateCounts.get(v)));
      order.addAll(sets);
      plan = plan(order);
      LOGGER.debug("Join order after {} trees: {} (candidates {})",
          sampledTrees, order, candidateCounts);
    }
  }

  /** Checks a pair of variables on every combination of their candidates,
   * and removes candidates that satisfy no combination. Returns the
   * satisfying pairs, or null if a variable has no candidates left. */
  private @Nullable Set<Long> prefilter(PairCheck check,
      Map<NodeVariable, List<Integer>> nodes) {
    final List<Integer> uppers = requireNonNull(nodes.get(check.upper));
    final List<Integer> lowers = requireNonNull(nodes.get(check.lower));
    final Set<Long> ok = new HashSet<>();
    if (check.lower.isSet()) {
      final List<Integer> survivors = new ArrayList<>();
      for (int upper : uppers) {
        if (checkAll(check, upper, lowers)) {
          survivors.add(upper);
        }
      }
      if (check.upper.isSet()) {
        return survivors.size() == uppers.size() ? ok : null;
      }
      if (survivors.isEmpty()) {
        return null;
      }
      nodes.put(check.upper, survivors);
      return ok;
    }

    final Set<Integer> upperSurvivors = new HashSet<>();
    final Set<Integer> lowerSurvivors = new HashSet<>();
    for (int upper : uppers) {
      for (int lower : lowers) {
        if (check.test(upper, lower, context)) {
          ok.add(key(upper, lower));
          upperSurvivors.add(upper);
          lowerSurvivors.add(lower);
          if (check.failAfterSuccess) {
            break;
          }
        }
      }
    }
    if (upperSurvivors.isEmpty()) {
      return null;
    }
    nodes.put(check.upper, retain(uppers, upperSurvivors));
    nodes.put(check.lower, retain(lowers, lowerSurvivors));
    return ok;
  }

  private boolean checkAll(PairCheck check, int upper, List<Integer> lowers) {
    for (int lower : lowers) {
      if (!check.test(upper, lower, context)) {
        return false;
      }
    }
    return true;
  }

  private static List<Integer> retain(List<Integer> list, Set<Integer> set) {
    final List<Integer> list2 = new ArrayList<>();
    for (Integer i : list) {
      if (set.contains(i)) {
        list2.add(i);
      }
    }
    return list2;
  }

  private static long key(int upper, int lower) {
    return ((long) upper << 32) | (lower & 0xFFFFFFFFL);
  }

  /** Returns the combinations of candidates of Single variables that satisfy
   * every pair check between Single variables. */
  private List<Match> extract(int treeId,
      Map<NodeVariable, List<Integer>> nodes, List<Set<Long>> pairs) {
    final List<List<Integer>> lists = new ArrayList<>();
    for (NodeVariable variable : singles) {
      lists.add(requireNonNull(nodes.get(variable)));
    }
    final List<Match> matches = new ArrayList<>();
    for (List<Integer> combination : Lists.cartesianProduct(lists)) {
      if (satisfies(combination, pairs)) {
        final Map<String, Integer> bindings = new LinkedHashMap<>();
        for (int i = 0; i < singles.size(); i++) {
          bindings.put(singles.get(i).name, combination.get(i));
        }
        matches.add(new Match(treeId, bindings));
      }
    }
    return matches;
  }

  private boolean satisfies(List<Integer> combination,
      List<Set<Long>> pairs) {
    for (int k = 0; k < plan.size(); k++) {
      final PairCheck check = plan.get(k);
      if (check.lower.isSet()) {
        continue;
      }
      final int upper = combination.get(singles.indexOf(check.upper));
      final int lower = combination.get(singles.indexOf(check.lower));
      if (!pairs.get(k).contains(key(upper, lower))) {
        return false;
      }
    }
    return true;
  }

  /** Constraints between two variables, oriented so that the variable that
   * is earlier in the join order is on the left. */
  private static class PairCheck {
    final NodeVariable upper;
    final NodeVariable lower;
    final ImmutableList<Constraint> constraints;
    /** Whether each constraint has {@link #lower} as its left operand. */
    final ImmutableList<Boolean> exchanged;
    /** Whether a node of {@link #upper} can match at most one node of
     * {@link #lower}, so that the search can stop after the first. */
    final boolean failAfterSuccess;

    PairCheck(NodeVariable upper, NodeVariable lower,
        List<Constraint> constraints, List<Boolean> exchanged) {
      this.upper = upper;
      this.lower = lower;
      this.constraints = ImmutableList.copyOf(constraints);
      this.exchanged = ImmutableList.copyOf(exchanged);
      if (constraints.size() == 1) {
        final Constraint.Direction direction =
            constraints.get(0).singleMatchDirection();
        this.failAfterSuccess = exchanged.get(0)
            ? direction.rightToLeft()
            : direction.leftToRight();
      } else {
        this.failAfterSuccess = false;
      }
    }

    boolean test(int upperId, int lowerId, QueryContext context) {
      final NodeRecord upperNode = context.node(upperId);
      final NodeRecord lowerNode = context.node(lowerId);
      for (int i = 0; i < constraints.size(); i++) {
        context.countCheck();
        final boolean b = exchanged.get(i)
            ? constraints.get(i).test(lowerNode, upperNode, context)
            : constraints.get(i).test(upperNode, lowerNode, context);
        if (!b) {
          return false;
        }
      }
      return true;
    }

    @Override public String toString() {
      return upper + "/" + lower + ":" + constraints;
    }
  }
}

// End ConstraintChecker.java
