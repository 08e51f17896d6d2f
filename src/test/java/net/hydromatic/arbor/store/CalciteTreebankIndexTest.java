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
import net.hydromatic.arbor.type.NodeKind;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

/** Tests {@link CalciteTreebankIndex}.
 *
 * <p>In {@link TreebankFixtures#DOG}, node ids are S=0, NP=1, DT=2, NN=3,
 * VP=4, VBD=5. */
public class CalciteTreebankIndexTest {
  private static final Treebank DOG =
      TreebankFixtures.treebank(TreebankFixtures.DOG);

  /** Returns the rows of a cursor as strings "node/tree". */
  private static List<String> rows(NodeCursor cursor) {
    final List<String> list = new ArrayList<>();
    try (NodeCursor c = cursor) {
      while (c.next()) {
        list.add(c.nodeId() + "/" + c.treeId());
      }
    }
    return list;
  }

  private static List<String> search(Treebank treebank, TreeRange range,
      Lookup... lookups) {
    try (TreebankIndex index = treebank.connect()) {
      return rows(index.search(ImmutableList.copyOf(lookups), range));
    }
  }

  private static Lookup features(FeatureMatch... matches) {
    return new Lookup(ImmutableList.copyOf(matches), ImmutableList.of());
  }

  private static Lookup filters(NodeFilter... filters) {
    return new Lookup(ImmutableList.of(), ImmutableList.copyOf(filters));
  }

  private static int valueId(String feature, String value) {
    return DOG.valueId(feature, value).getAsInt();
  }

  @Test void testEqual() {
    assertThat(
        search(DOG, TreeRange.ALL,
            features(FeatureMatch.equal("cat", valueId("cat", "NP")))),
        is(ImmutableList.of("1/0")));
    assertThat(
        search(DOG, TreeRange.ALL,
            features(FeatureMatch.notEqual("cat", valueId("cat", "S")))),
        is(ImmutableList.of("1/0", "4/0")));
    assertThat(
        search(DOG, TreeRange.ALL, features(FeatureMatch.exists("word"))),
        is(ImmutableList.of("2/0", "3/0", "5/0")));
  }

  @Test void testConjunctionOfFeatures() {
    assertThat(
        search(DOG, TreeRange.ALL,
            features(FeatureMatch.equal("pos", valueId("pos", "NN")),
                FeatureMatch.equal("word", valueId("word", "dog")))),
        is(ImmutableList.of("3/0")));
    assertThat(
        search(DOG, TreeRange.ALL,
            features(FeatureMatch.equal("pos", valueId("pos", "NN")),
                FeatureMatch.equal("word", valueId("word", "the")))),
        is(ImmutableList.of()));
  }

  @Test void testUnion() {
    assertThat(
        search(DOG, TreeRange.ALL,
            features(FeatureMatch.equal("pos", valueId("pos", "NN"))),
            features(FeatureMatch.equal("cat", valueId("cat", "S")))),
        is(ImmutableList.of("0/0", "3/0")));
  }

  @Test void testFilters() {
    assertThat(search(DOG, TreeRange.ALL, filters(NodeFilter.root())),
        is(ImmutableList.of("0/0")));
    assertThat(
        search(DOG, TreeRange.ALL, filters(NodeFilter.of(NodeKind.TERMINAL))),
        is(ImmutableList.of("2/0", "3/0", "5/0")));
    assertThat(search(DOG, TreeRange.ALL, filters(NodeFilter.arity(2, 2))),
        is(ImmutableList.of("0/0", "1/0")));
    assertThat(
        search(DOG, TreeRange.ALL, filters(NodeFilter.tokenArity(1, 2))),
        is(ImmutableList.of("1/0", "4/0")));
    assertThat(
        search(DOG, TreeRange.ALL,
            filters(NodeFilter.edgeLabel(DOG.schema().edgeLabelId("HD")))),
        is(ImmutableList.of("4/0")));
    assertThat(
        search(DOG, TreeRange.ALL, filters(NodeFilter.nonterminalChildren())),
        is(ImmutableList.of("0/0")));
    assertThat(
        search(DOG, TreeRange.ALL,
            new Lookup(ImmutableList.of(FeatureMatch.exists("cat")),
                ImmutableList.of(NodeFilter.continuous()))),
        is(ImmutableList.of("0/0", "1/0", "4/0")));
  }

  @Test void testValueTable() {
    try (TreebankIndex index = DOG.connect()) {
      final ValueTable table =
          index.createValueTable("word", s -> s.startsWith("b")
              || s.startsWith("d"));
      assertThat(table.size, is(2));
      assertThat(table.feature, is("word"));
      final Lookup lookup = features(FeatureMatch.in("word", table.name));
      assertThat(rows(index.search(ImmutableList.of(lookup), TreeRange.ALL)),
          is(ImmutableList.of("3/0", "5/0")));
      index.dropValueTable(table);
    }
  }

  @Test void testTreeRange() {
    final Treebank treebank =
        TreebankFixtures.treebank(TreebankFixtures.DOG, "(NP (DT a))",
            "(NP (NN cat))");
    final Lookup np = features(
        FeatureMatch.equal("cat", treebank.valueId("cat", "NP").getAsInt()));
    assertThat(search(treebank, TreeRange.ALL, np),
        is(ImmutableList.of("1/0", "6/1", "8/2")));
    assertThat(search(treebank, TreeRange.of(1, 2), np),
        is(ImmutableList.of("6/1")));
    assertThat(search(treebank, TreeRange.of(1, Integer.MAX_VALUE), np),
        is(ImmutableList.of("6/1", "8/2")));
    assertThat(search(treebank, TreeRange.of(0, 1), np),
        is(ImmutableList.of("1/0")));
  }

  @Test void testNode() {
    try (TreebankIndex index = DOG.connect()) {
      assertThat(index.treeCount(), is(1));
      assertThat(index.node(3).tokenOrder, is(1));
      assertThat(index.valueId("word", "dog"), is(DOG.valueId("word", "dog")));
      assertThat(index.schema().featureKind("pos"), is(NodeKind.TERMINAL));
    }
  }
}

// End CalciteTreebankIndexTest.java
