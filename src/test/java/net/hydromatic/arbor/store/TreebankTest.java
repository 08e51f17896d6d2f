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
package net.hydromatic.arbor.store;

import net.hydromatic.arbor.TreebankFixtures;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.ImmutableIntArray;
import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static net.hydromatic.arbor.Matchers.throwsA;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

/** Tests {@link Treebank} and the node records that it computes. */
public class TreebankTest {
  private static final Treebank DOG =
      TreebankFixtures.treebank(TreebankFixtures.DOG);

  @Test void testIds() {
    assertThat(DOG.treeCount(), is(1));
    assertThat(DOG.nodeCount(), is(6));
    assertThat(DOG.nodeIds(0), is(ImmutableList.of(0, 1, 2, 3, 4, 5)));
    assertThat(DOG.value(0, "cat"), is("S"));
    assertThat(DOG.value(1, "cat"), is("NP"));
    assertThat(DOG.value(2, "word"), is("the"));
    assertThat(DOG.value(4, "cat"), is("VP"));
    assertThat(DOG.value(5, "pos"), is("VBD"));
    assertThat(DOG.value(0, "word"), nullValue());
  }

  @Test void testGorn() {
    assertThat(DOG.node(0).gorn, is(ImmutableIntArray.of()));
    assertThat(DOG.node(3).gorn, is(ImmutableIntArray.of(0, 1)));
    assertThat(DOG.node(5).gorn, is(ImmutableIntArray.of(1, 0)));
    assertThat(DOG.node(5).depth(), is(2));
    assertThat(DOG.node(1).isPrefixOf(DOG.node(3)), is(true));
    assertThat(DOG.node(1).isPrefixOf(DOG.node(1)), is(true));
    assertThat(DOG.node(1).isPrefixOf(DOG.node(5)), is(false));
    assertThat(DOG.node(2).isSiblingOf(DOG.node(3)), is(true));
    assertThat(DOG.node(2).isSiblingOf(DOG.node(2)), is(true));
    assertThat(DOG.node(0).isSiblingOf(DOG.node(0)), is(true));
    assertThat(DOG.node(0).isSiblingOf(DOG.node(1)), is(false));
  }

  @Test void testTerminals() {
    assertThat(DOG.node(2).isTerminal(), is(true));
    assertThat(DOG.node(2).tokenOrder, is(0));
    assertThat(DOG.node(3).tokenOrder, is(1));
    assertThat(DOG.node(5).tokenOrder, is(2));
    assertThat(DOG.node(1).tokenOrder, is(-1));
    assertThat(DOG.node(1).isTerminal(), is(false));
  }

  @Test void testCornersAndArity() {
    final NodeRecord np = DOG.node(1);
    assertThat(np.leftCorner, is(2));
    assertThat(np.rightCorner, is(3));
    assertThat(DOG.node(0).leftCorner, is(2));
    assertThat(DOG.node(0).rightCorner, is(5));
    assertThat(DOG.node(3).leftCorner, is(3));
    assertThat(DOG.node(0).arity, is(2));
    assertThat(DOG.node(0).tokenArity, is(3));
    assertThat(DOG.node(4).arity, is(1));
    assertThat(DOG.node(0).childrenKind,
        is(NodeRecord.NONTERMINAL_CHILDREN));
    assertThat(np.childrenKind, is(NodeRecord.TERMINAL_CHILDREN));
    assertThat(np.continuity, is(NodeRecord.CONTINUOUS));
  }

  @Test void testLabels() {
    final CorpusSchema schema = DOG.schema();
    assertThat(schema.edgeLabels, is(ImmutableList.of("SB", "HD")));
    assertThat(DOG.node(1).edgeLabel, is(schema.edgeLabelId("SB")));
    assertThat(DOG.node(4).edgeLabel, is(schema.edgeLabelId("HD")));
    assertThat(DOG.node(0).edgeLabel, is(NodeRecord.NO_LABEL));
    assertThat(schema.edgeLabelId("OA"), is(NodeRecord.NO_LABEL));
  }

  @Test void testValueIds() {
    // Values are numbered in the order they are first seen.
    assertThat(DOG.values("cat"), is(ImmutableList.of("S", "NP", "VP")));
    assertThat(DOG.valueId("cat", "NP"), is(OptionalInt.of(1)));
    assertThat(DOG.valueId("cat", "PP"), is(OptionalInt.empty()));
    assertThat(DOG.valueId("lemma", "dog"), is(OptionalInt.empty()));
    assertThat(DOG.valueIds(3), is(ImmutableMap.of("pos", 1, "word", 1)));
  }

  @Test void testSeveralTrees() {
    final Treebank treebank =
        TreebankFixtures.treebank(TreebankFixtures.DOG, "(NP (DT a))");
    assertThat(treebank.treeCount(), is(2));
    assertThat(treebank.nodeIds(1), is(ImmutableList.of(6, 7)));
    assertThat(treebank.node(6).treeId, is(1));
    assertThat(treebank.node(6).depth(), is(0));
    assertThat(treebank.node(7).tokenOrder, is(0));
    assertThat(treebank.node(7).leftCorner, is(7));
  }

  /** Tests that a tree with several roots gets a virtual root. */
  @Test void testForest() {
    final Treebank treebank =
        TreebankFixtures.treebank("(NP (DT a)) (VP (VB go))");
    assertThat(treebank.treeCount(), is(1));
    assertThat(treebank.nodeCount(), is(5));
    final NodeRecord root = treebank.node(0);
    assertThat(root.depth(), is(0));
    assertThat(root.arity, is(2));
    assertThat(root.tokenArity, is(2));
    assertThat(treebank.value(0, "cat"), nullValue());
    assertThat(treebank.value(1, "cat"), is("NP"));
    assertThat(treebank.value(3, "cat"), is("VP"));
    assertThat(treebank.node(3).gorn, is(ImmutableIntArray.of(1)));
  }

  @Test void testDiscontinuous() {
    final Treebank.Builder builder = TreebankFixtures.builder();
    final Treebank.TreeBuilder t = builder.tree();
    final int a = t.terminal(ImmutableMap.of("word", "a"));
    final int b = t.terminal(ImmutableMap.of("word", "b"));
    final int c = t.terminal(ImmutableMap.of("word", "c"));
    final int x = t.nonterminal(ImmutableMap.of("cat", "X"),
        ImmutableList.of(a, c));
    t.nonterminal(ImmutableMap.of("cat", "Y"), ImmutableList.of(x, b));
    final Treebank treebank = t.end().build();

    // Preorder: Y=0, X=1, a=2, c=3, b=4.
    assertThat(treebank.value(1, "cat"), is("X"));
    assertThat(treebank.node(0).continuity, is(NodeRecord.CONTINUOUS));
    assertThat(treebank.node(1).continuity, is(NodeRecord.DISCONTINUOUS));
    assertThat(treebank.node(1).leftCorner, is(2));
    assertThat(treebank.node(1).rightCorner, is(3));
    assertThat(treebank.node(4).tokenOrder, is(1));
    assertThat(treebank.node(1).tokenArity, is(2));
  }

  @Test void testSecondaryEdges() {
    final Treebank.Builder builder = TreebankFixtures.builder();
    final Treebank.TreeBuilder t = builder.tree();
    final int a = t.terminal(ImmutableMap.of("word", "a"));
    final int b = t.terminal(ImmutableMap.of("word", "b"));
    t.nonterminal(ImmutableMap.of("cat", "X"), ImmutableList.of(a, b));
    t.secondaryEdge(a, b, "REF");
    final Treebank treebank = t.end().build();

    // Preorder: X=0, a=1, b=2.
    final int ref = treebank.schema().secondaryEdgeLabelId("REF");
    assertThat(ref, is(0));
    assertThat(treebank.hasSecondaryEdge(1, 2, NodeRecord.NO_LABEL),
        is(true));
    assertThat(treebank.hasSecondaryEdge(1, 2, ref), is(true));
    assertThat(treebank.hasSecondaryEdge(2, 1, NodeRecord.NO_LABEL),
        is(false));
    assertThat(treebank.node(1).secondaryEdgeOrigin, is(true));
    assertThat(treebank.node(2).secondaryEdgeTarget, is(true));
    assertThat(treebank.node(2).secondaryEdgeOrigin, is(false));
  }

  @Test void testUndeclaredFeature() {
    final Treebank.TreeBuilder t = TreebankFixtures.builder().tree();
    t.terminal(ImmutableMap.of("lemma", "go"));
    try {
      t.end();
      fail("expected error");
    } catch (IllegalArgumentException e) {
      assertThat(e, throwsA("undeclared feature lemma"));
    }
  }

  @Test void testTreeRange() {
    assertThat(TreeRange.partition(10, 0, 3), is(TreeRange.of(0, 3)));
    assertThat(TreeRange.partition(10, 1, 3), is(TreeRange.of(3, 6)));
    assertThat(TreeRange.partition(10, 2, 3).lower, is(6));
    assertThat(TreeRange.partition(10, 2, 3).isUnboundedAbove(), is(true));
    assertThat(TreeRange.partition(10, 0, 1), is(TreeRange.ALL));
    assertThat(TreeRange.of(3, 6).contains(5), is(true));
    assertThat(TreeRange.of(3, 6).contains(6), is(false));
    assertThat(TreeRange.of(3, 6).toString(), is("[3, 6)"));
  }
}

// End TreebankTest.java
