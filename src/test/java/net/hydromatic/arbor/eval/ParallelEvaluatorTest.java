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
import net.hydromatic.arbor.compile.Tracers;
import net.hydromatic.arbor.store.CorpusSchema;
import net.hydromatic.arbor.store.IndexProvider;
import net.hydromatic.arbor.store.Treebank;
import net.hydromatic.arbor.store.TreebankIndex;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static net.hydromatic.arbor.Matchers.throwsA;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

/** Tests evaluation with several workers. */
public class ParallelEvaluatorTest {
  private static final String QUERY = "#a:[cat=\"S\"] >* #b:[T]";

  /** Treebank of 20 trees, of which 14 contain a sentence. */
  private static final Treebank TREEBANK = createTreebank();

  private static Treebank createTreebank() {
    final String[] shapes = {
        TreebankFixtures.DOG,
        "(S (NP (PRP it)) (VP (VBZ works) (ADVP (RB well))))",
        "(NP (DT a) (NN cat))"
    };
    final List<String> trees = new ArrayList<>();
    for (int i = 0; i < 20; i++) {
      trees.add(shapes[i % shapes.length]);
    }
    return TreebankFixtures.treebank(trees.toArray(new String[0]));
  }

  private static List<Match> evaluate(Map<Prop, Object> map) {
    return new Session(map, TREEBANK).evaluateToList(QUERY);
  }

  @Test void testSameMatchesAsSequential() {
    final List<Match> sequential = evaluate(ImmutableMap.of());
    assertThat(sequential.size(), is(7 * 3 + 7 * 3));

    final List<Match> parallel =
        evaluate(ImmutableMap.of(Prop.PARALLELISM, 4));
    assertThat(HashMultiset.create(parallel),
        is(HashMultiset.create(sequential)));
  }

  @Test void testSortResults() {
    final List<Match> sequential = evaluate(ImmutableMap.of());
    assertThat(
        evaluate(
            ImmutableMap.of(Prop.PARALLELISM, 3, Prop.SORT_RESULTS, true)),
        is(sequential));
    // More workers than trees; some workers have no trees.
    assertThat(
        evaluate(
            ImmutableMap.of(Prop.PARALLELISM, 32, Prop.SORT_RESULTS, true)),
        is(sequential));
  }

  /** Tests that a small queue makes workers wait for the consumer, but does
   * not lose matches. */
  @Test void testSmallQueue() {
    final List<Match> sequential = evaluate(ImmutableMap.of());
    final List<Match> parallel =
        evaluate(
            ImmutableMap.of(Prop.PARALLELISM, 2, Prop.SORT_RESULTS, true,
                Prop.RESULT_QUEUE_CAPACITY, 1));
    assertThat(parallel, is(sequential));
  }

  /** Tests that the statistics of the workers are added up. */
  @Test void testStats() {
    final List<Stats> statsList = new ArrayList<>();
    final Session session =
        new Session(ImmutableMap.of(Prop.PARALLELISM, 4), TREEBANK,
            Tracers.withOnStats(Tracers.empty(), statsList::add));
    session.evaluateToList(QUERY);
    assertThat(statsList.size(), is(1));
    assertThat(statsList.get(0).checkedTrees, is(14L));
  }

  @Test void testWorkerFailure() {
    final FailingProvider provider = new FailingProvider(TREEBANK);
    final Session session =
        new Session(ImmutableMap.of(Prop.PARALLELISM, 2), provider);
    try {
      session.evaluateToList(QUERY);
      fail("expected error");
    } catch (EvaluationException e) {
      assertThat(e.getMessage(), containsString("failed: "));
      assertThat(e, throwsA("connection refused"));
    }
  }

  /** Tests that closing a result set before reading every match stops the
   * workers. */
  @Test void testCloseEarly() {
    final Session session =
        new Session(
            ImmutableMap.of(Prop.PARALLELISM, 4,
                Prop.RESULT_QUEUE_CAPACITY, 1),
            TREEBANK);
    final List<Match> matches = new ArrayList<>();
    try (ResultSet resultSet = session.evaluate(QUERY)) {
      matches.add(resultSet.next());
    }
    assertThat(matches.size(), is(1));
    assertThat(matches.get(0).bindings.keySet(),
        is(ImmutableSet.of("a", "b")));
  }

  /** Tests that reading every match releases the workers' threads, even
   * before the result set is closed. */
  @Test void testReadToEnd() {
    final Session session =
        new Session(ImmutableMap.of(Prop.PARALLELISM, 4), TREEBANK);
    try (ResultSet resultSet = session.evaluate(QUERY)) {
      final ParallelResultSet parallel = (ParallelResultSet) resultSet;
      int count = 0;
      while (parallel.hasNext()) {
        parallel.next();
        ++count;
      }
      assertThat(count, is(7 * 3 + 7 * 3));
      assertThat(parallel.isShutdown(), is(true));
    }
  }

  /** Provider whose connections fail, except the first, which is used to
   * count the trees. */
  private static class FailingProvider implements IndexProvider {
    private final Treebank treebank;
    private final AtomicInteger connectCount = new AtomicInteger();

    FailingProvider(Treebank treebank) {
      this.treebank = treebank;
    }

    @Override public CorpusSchema schema() {
      return treebank.schema();
    }

    @Override public TreebankIndex connect() {
      if (connectCount.getAndIncrement() > 0) {
        throw new IllegalStateException("connection refused");
      }
      return treebank.connect();
    }
  }
}

// End ParallelEvaluatorTest.java
