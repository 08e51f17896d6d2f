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

import net.hydromatic.arbor.TreebankFixtures;
import net.hydromatic.arbor.compile.CompiledQuery;
import net.hydromatic.arbor.compile.Tracers;
import net.hydromatic.arbor.compile.UndefinedNameException;
import net.hydromatic.arbor.store.Lookup;
import net.hydromatic.arbor.store.Treebank;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static net.hydromatic.arbor.Aq.aq;
import static net.hydromatic.arbor.Matchers.isMatches;
import static net.hydromatic.arbor.Matchers.throwsA;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

/** Tests the evaluation of queries.
 *
 * <p>Unless stated otherwise, queries run over
 * {@link TreebankFixtures#DOG}, whose node ids are S=0, NP=1, DT=2, NN=3,
 * VP=4, VBD=5. */
public class EvaluatorTest {
  private static final String SENTENCE_IT =
      "(S (NP (NN it)) (VP (VBZ works)))";

  @Test void testDominance() {
    aq("#a:[cat=\"S\"] > #b:[cat=\"NP\"]")
        .assertMatches(isMatches("0:{a=0, b=1}"));
    aq("#a:[cat=\"NP\"] > #b:[cat=\"S\"]")
        .assertMatches(isMatches());
  }

  @Test void testSibling() {
    aq("#a:[cat=\"NP\"] $ #b:[cat=\"VP\"]")
        .assertMatches(isMatches("0:{a=1, b=4}"));
    aq("#a:[cat=\"VP\"] $.* #b:[cat=\"NP\"]")
        .assertMatches(isMatches());
  }

  /** Tests that a node is its own sibling, so two variables may bind the
   * same node. */
  @Test void testSiblingSameNode() {
    aq("#a:[T] $ #b:[T]")
        .withTrees("(NP (DT a))")
        .assertMatches(isMatches("0:{a=1, b=1}"));
    aq("#a:[T] !$ #b:[T]")
        .withTrees("(NP (DT a))")
        .assertMatches(isMatches());
    aq("#a:[T] $.* #b:[T]")
        .withTrees("(NP (DT a))")
        .assertMatches(isMatches());
  }

  /** Tests that an undefined name fails before any tree is read. */
  @Test void testUndefinedFeature() {
    final List<Stats> statsList = new ArrayList<>();
    aq("#a:[lemma=\"dog\"] > #b")
        .withTracer(Tracers.withOnStats(Tracers.empty(), statsList::add))
        .assertEvaluateThrows(
            throwsA(UndefinedNameException.class,
                is("feature 'lemma' is not defined")));
    assertThat(statsList.isEmpty(), is(true));
  }

  @Test void testSingleVariable() {
    aq("[cat=\"NP\"]").assertMatches(isMatches("0:{$0=1}"));
    aq("[T]").assertMatches(isMatches("0:{$0=2}", "0:{$0=3}", "0:{$0=5}"));
    aq("#x:[cat=\"NP\" | pos=\"VBD\"]")
        .assertMatches(isMatches("0:{x=1}", "0:{x=5}"));
    aq("[!(cat=\"NP\")]")
        .assertMatches(
            isMatches("0:{$0=0}", "0:{$0=2}", "0:{$0=3}", "0:{$0=4}",
                "0:{$0=5}"));
  }

  /** Tests that a query without constraints returns every combination of
   * candidates. */
  @Test void testCartesian() {
    aq("#a:[cat=\"NP\" | cat=\"VP\"] & #b:[pos=\"DT\" | pos=\"VBD\"]")
        .assertMatches(
            isMatches("0:{a=1, b=2}", "0:{a=1, b=5}", "0:{a=4, b=2}",
                "0:{a=4, b=5}"));
  }

  @Test void testDominanceRange() {
    aq("#a:[cat=\"A\"] >2,3 #b")
        .withTrees("(A (B (C (X x))))")
        .assertMatches(isMatches("0:{a=0, b=2}", "0:{a=0, b=3}"));
    aq("#a:[cat=\"A\"] >* #b:[T]")
        .withTrees("(A (B (C (X x))))")
        .assertMatches(isMatches("0:{a=0, b=3}"));
    aq("#a:[cat=\"A\"] !>2 #b:[NT]")
        .withTrees("(A (B (C (X x))))")
        .assertMatches(isMatches("0:{a=0, b=0}", "0:{a=0, b=1}"));

    // Node ids: A=0, B=1, C=2; C is two edges below A.
    aq("#a:[cat=\"A\"] >* #c:[pos=\"C\"]")
        .withTrees("(A (B (C c)))")
        .assertMatches(isMatches("0:{a=0, c=2}"));
    aq("#a:[cat=\"A\"] >1,1 #c:[pos=\"C\"]")
        .withTrees("(A (B (C c)))")
        .assertMatches(isMatches());
    aq("#a:[cat=\"A\"] >1,2 #c:[pos=\"C\"]")
        .withTrees("(A (B (C c)))")
        .assertMatches(isMatches("0:{a=0, c=2}"));
  }

  @Test void testLabeledDominance() {
    aq("#s >SB #x").assertMatches(isMatches("0:{s=0, x=1}"));
    aq("#s >HD #x").assertMatches(isMatches("0:{s=0, x=4}"));
  }

  @Test void testPrecedence() {
    aq("[pos=\"DT\"] . [pos=\"NN\"]")
        .assertMatches(isMatches("0:{$0=2, $1=3}"));
    aq("#a:[T] . #b:[T]")
        .assertMatches(isMatches("0:{a=2, b=3}", "0:{a=3, b=5}"));
    aq("#a:[word=\"the\"] !. #b:[T]")
        .assertMatches(isMatches("0:{a=2, b=2}", "0:{a=2, b=5}"));
    aq("#np:[cat=\"NP\"] .* #v:[T]")
        .assertMatches(isMatches("0:{np=1, v=3}", "0:{np=1, v=5}"));
  }

  @Test void testCorner() {
    aq("#np:[cat=\"NP\"] >@l #w").assertMatches(isMatches("0:{np=1, w=2}"));
    aq("#np:[cat=\"NP\"] >@r #w").assertMatches(isMatches("0:{np=1, w=3}"));
    aq("#s:[cat=\"S\"] >@r #w:[word=\"barked\"]")
        .assertMatches(isMatches("0:{s=0, w=5}"));
  }

  @Test void testSecondaryEdge() {
    final Treebank.Builder builder = TreebankFixtures.builder();
    final Treebank.TreeBuilder t = builder.tree();
    final int a = t.terminal(ImmutableMap.of("word", "a"));
    final int b = t.terminal(ImmutableMap.of("word", "b"));
    t.nonterminal(ImmutableMap.of("cat", "X"), ImmutableList.of(a, b));
    t.secondaryEdge(a, b, "REF");
    final Treebank treebank = t.end().build();

    // Node ids: X=0, a=1, b=2.
    aq("#a >~REF #b").withTreebank(treebank)
        .assertMatches(isMatches("0:{a=1, b=2}"));
    aq("[word=\"a\"] >~ #b").withTreebank(treebank)
        .assertMatches(isMatches("0:{$0=1, b=2}"));
    aq("[word=\"b\"] >~ #b").withTreebank(treebank)
        .assertMatches(isMatches());
  }

  @Test void testPredicates() {
    aq("#x:[NT] & arity(#x, 1)").assertMatches(isMatches("0:{x=4}"));
    aq("#x:[NT] & tokenarity(#x, 2, 3)")
        .assertMatches(isMatches("0:{x=0}", "0:{x=1}"));
    aq("#x & root(#x)").assertMatches(isMatches("0:{x=0}"));
    aq("#x:[NT] & continuous(#x)")
        .assertMatches(isMatches("0:{x=0}", "0:{x=1}", "0:{x=4}"));
    aq("#x:[NT] & discontinuous(#x)").assertMatches(isMatches());
    aq("root(#x) & #x > #y:[cat=\"NP\"]")
        .assertMatches(isMatches("0:{x=0, y=1}"));
  }

  @Test void testRegex() {
    aq("[word=/d.*/]").assertMatches(isMatches("0:{$0=3}"));
    aq("[word!=/d.*/]").assertMatches(isMatches("0:{$0=2}", "0:{$0=5}"));
    // The expression must match the whole value.
    aq("[word=/o/]").assertMatches(isMatches());
    aq("[word=/.*o.*/]").assertMatches(isMatches("0:{$0=3}"));
  }

  /** Tests that a value that does not occur in the corpus matches no node,
   * and that every node's value differs from it. */
  @Test void testMissingValue() {
    aq("[cat=\"PP\"]").assertMatches(isMatches());
    aq("#a:[cat=\"PP\"] > #b").assertMatches(isMatches());
    aq("[cat!=\"PP\"]")
        .assertMatches(isMatches("0:{$0=0}", "0:{$0=1}", "0:{$0=4}"));
    aq("[cat=\"PP\" | cat=\"NP\"]").assertMatches(isMatches("0:{$0=1}"));
  }

  /** Tests that a constraint on a Set variable holds for every node of the
   * set, and that Set variables are not bound in matches. */
  @Test void testSets() {
    aq("#vp:[cat=\"VP\"] > %w:[pos=\"VBD\"]")
        .assertMatches(isMatches("0:{vp=4}"));
    aq("#np:[cat=\"NP\"] > %w:[T]").assertMatches(isMatches());
    aq("#x:[NT] >* %w:[T]").assertMatches(isMatches("0:{x=0}"));

    // A set with no candidates satisfies every constraint.
    aq("#np:[cat=\"NP\"] > %w:[pos=\"JJ\"]")
        .assertMatches(isMatches("0:{np=1}"));
    aq("#np:[cat=\"NP\"] > %w:[pos=\"JJ\"] & empty(%w)")
        .assertMatches(isMatches("0:{np=1}"));
    aq("#np:[cat=\"NP\"] > %w:[pos=\"JJ\"] & nonempty(%w)")
        .assertMatches(isMatches());
  }

  @Test void testOnlySets() {
    aq("%w:[T] & nonempty(%w)").assertMatches(isMatches("0:{}"));
    aq("%w:[pos=\"JJ\"] & nonempty(%w)").assertMatches(isMatches());
    aq("%w:[pos=\"JJ\"] & empty(%w)")
        .withTrees(TreebankFixtures.DOG, SENTENCE_IT)
        .assertMatches(isMatches("0:{}", "1:{}"));
  }

  @Test void testSeveralTrees() {
    aq("#a:[cat=\"S\"] > #b:[cat=\"NP\"]")
        .withTrees(TreebankFixtures.DOG, "(NP (DT a))", SENTENCE_IT)
        .assertMatches(isMatches("0:{a=0, b=1}", "2:{a=8, b=9}"));
    aq("[pos=\"NN\"]")
        .withTrees(TreebankFixtures.DOG, "(NP (DT a))", SENTENCE_IT)
        .assertMatches(isMatches("0:{$0=3}", "2:{$0=10}"));
  }

  /** Tests that a tree with several roots has a virtual root that
   * dominates them. */
  @Test void testForest() {
    aq("#r > #np:[cat=\"NP\"]")
        .withTrees("(NP (DT a)) (VP (VB go))")
        .assertMatches(isMatches("0:{r=0, np=1}"));
    aq("#np:[cat=\"NP\"] $ #vp:[cat=\"VP\"]")
        .withTrees("(NP (DT a)) (VP (VB go))")
        .assertMatches(isMatches("0:{np=1, vp=3}"));
  }

  /** Tests that the join order does not change the results. */
  @Test void testJoinOrder() {
    final String[] trees = {TreebankFixtures.DOG, "(NP (DT a))", SENTENCE_IT};
    final String query = "#s:[cat=\"S\"] >* #t:[T] & #t . #u:[T]";
    final String[] expected = {
        "0:{s=0, t=2, u=3}", "0:{s=0, t=3, u=5}", "2:{s=8, t=10, u=12}"};
    aq(query).withTrees(trees)
        .assertMatches(isMatches(expected));
    aq(query).withTrees(trees).withProp(Prop.JOIN_ORDER_SAMPLE_SIZE, 1)
        .assertMatches(isMatches(expected));
    aq(query).withTrees(trees).withProp(Prop.JOIN_ORDER_SAMPLE_SIZE, 0)
        .assertMatches(isMatches(expected));
  }

  @Test void testShareCursors() {
    final String query = "#a:[T] . #b:[T]";
    final List<String> lookups = new ArrayList<>();
    aq(query)
        .withTracer(
            Tracers.withOnLookups(Tracers.empty(),
                (variable, list) -> lookups.add(variable.name)))
        .assertMatches(isMatches("0:{a=2, b=3}", "0:{a=3, b=5}"));
    assertThat(lookups, is(ImmutableList.of("a")));

    lookups.clear();
    aq(query)
        .withProp(Prop.SHARE_CURSORS, false)
        .withTracer(
            Tracers.withOnLookups(Tracers.empty(),
                (variable, list) -> lookups.add(variable.name)))
        .assertMatches(isMatches("0:{a=2, b=3}", "0:{a=3, b=5}"));
    assertThat(lookups, is(ImmutableList.of("a", "b")));
  }

  @Test void testStats() {
    final List<Stats> statsList = new ArrayList<>();
    aq("#a:[cat=\"S\"] > #b:[cat=\"NP\"]")
        .withTracer(Tracers.withOnStats(Tracers.empty(), statsList::add))
        .assertMatches(isMatches("0:{a=0, b=1}"));
    assertThat(statsList.size(), is(1));
    final Stats stats = statsList.get(0);
    assertThat(stats.checkedTrees, is(1L));
    assertThat(stats.constraintChecks, is(1L));
    assertThat(stats.nodeCacheMisses, is(2L));
  }

  @Test void testLookupsTracer() {
    final List<List<Lookup>> lookups = new ArrayList<>();
    aq("[cat=\"NP\" | cat=\"PP\" | cat=\"VP\"]")
        .withTracer(
            Tracers.withOnLookups(Tracers.empty(),
                (variable, list) -> lookups.add(list)))
        .assertMatches(isMatches("0:{$0=1}", "0:{$0=4}"));
    // "PP" does not occur, so its disjunct has no lookup.
    assertThat(lookups.size(), is(1));
    assertThat(lookups.get(0).size(), is(2));
  }

  /** Tests a result set used directly: reading it, its statistics, and
   * closing it twice. */
  @Test void testResultSet() {
    final Treebank treebank =
        TreebankFixtures.treebank(TreebankFixtures.DOG, SENTENCE_IT);
    final Session session = new Session(ImmutableMap.of(), treebank);
    final CompiledQuery query = session.compile("#n:[cat=\"NP\"] > #w:[T]");
    final List<Integer> words = new ArrayList<>();
    final ResultSet resultSet = session.evaluate(query);
    try {
      while (resultSet.hasNext()) {
        final Match match = resultSet.next();
        words.add(match.get("w"));
      }
      assertThat(resultSet.stats().checkedTrees, is(2L));
    } finally {
      resultSet.close();
    }
    resultSet.close();
    assertThat(words, is(ImmutableList.of(2, 3, 8)));

    // A compiled query can be evaluated again.
    try (ResultSet resultSet2 = session.evaluate(query)) {
      assertThat(resultSet2.hasNext(), is(true));
      assertThat(resultSet2.next().toString(), is("0:{n=1, w=2}"));
    }
  }
}

// End EvaluatorTest.java
