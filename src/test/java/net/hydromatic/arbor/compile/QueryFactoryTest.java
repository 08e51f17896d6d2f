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
import net.hydromatic.arbor.type.ContainerKind;
import net.hydromatic.arbor.type.NodeKind;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static net.hydromatic.arbor.Aq.aq;
import static net.hydromatic.arbor.Aq.aqE;
import static net.hydromatic.arbor.Matchers.throwsA;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

/** Tests {@link QueryFactory}, which turns a normalized query into a
 * {@link CompiledQuery}. */
public class QueryFactoryTest {
  private static NodeQuery.FeatureTest eq(String feature, String value) {
    return new NodeQuery.FeatureTest(feature, true, value, false);
  }

  @Test void testDominance() {
    aq("#a:[cat=\"S\"] > #b:[cat=\"NP\"]")
        .assertCompile(q -> {
          assertThat(q.variables.size(), is(2));
          final NodeVariable a = q.variable("a");
          final NodeVariable b = q.variable("b");
          assertThat(a.kind(), is(NodeKind.NONTERMINAL));
          assertThat(b.kind(), is(NodeKind.NONTERMINAL));
          assertThat(a.isAnonymous(), is(false));
          assertThat(q.strategy, is(CompiledQuery.Strategy.CONSTRAINT_CHECK));
          assertThat(q.constraints.size(), is(1));
          assertThat(q.constraints.get(0).left, is(a));
          assertThat(q.constraints.get(0).constraint.operator, is(">"));

          // The parent of a nonterminal has a nonterminal child.
          assertThat(q.nodeQueries.get(a).filters,
              is(ImmutableList.of(NodeFilter.nonterminalChildren())));
          assertThat(q.nodeQueries.get(b).filters, is(ImmutableList.of()));
          assertThat(q.nodeQueries.get(b).disjuncts,
              is(
                  ImmutableList.of(
                      new NodeQuery.Disjunct(
                          ImmutableList.of(eq("cat", "NP")), null))));
        });
  }

  @Test void testAnonymousVariables() {
    aq("[cat=\"NP\"] . [pos=\"VBD\"]")
        .assertCompile(q -> {
          final List<String> names = new ArrayList<>();
          q.variables.forEach(v -> names.add(v.toString()));
          assertThat(names, is(ImmutableList.of("#$0", "#$1")));
          assertThat(q.variable("$0").isAnonymous(), is(true));
          assertThat(q.variable("$0").kind(), is(NodeKind.NONTERMINAL));
          assertThat(q.variable("$1").kind(), is(NodeKind.TERMINAL));
        });
  }

  @Test void testFeatureRecord() {
    aq("#a:[T]")
        .assertCompile(q -> {
          final NodeVariable a = q.variable("a");
          assertThat(a.kind(), is(NodeKind.TERMINAL));
          assertThat(q.strategy, is(CompiledQuery.Strategy.CARTESIAN));
          assertThat(q.nodeQueries.get(a).disjuncts,
              is(
                  ImmutableList.of(
                      new NodeQuery.Disjunct(ImmutableList.of(),
                          NodeKind.TERMINAL))));
        });
    aq("[]")
        .assertCompile(q -> {
          final NodeVariable v = q.variables.get(0);
          assertThat(v.kind(), is(NodeKind.UNKNOWN));
          assertThat(v.container, is(ContainerKind.SINGLE));
          assertThat(q.nodeQueries.get(v).disjuncts,
              is(
                  ImmutableList.of(
                      new NodeQuery.Disjunct(ImmutableList.of(), null))));
        });
  }

  /** Tests that a variable's kind comes from the relations it is in, and
   * that a disjunct of the other kind is removed. */
  @Test void testKindFromRelation() {
    aq("#x:[T | cat=\"NP\"] > #y")
        .assertCompile(q -> {
          final NodeVariable x = q.variable("x");
          final NodeVariable y = q.variable("y");
          assertThat(x.kind(), is(NodeKind.NONTERMINAL));
          assertThat(y.kind(), is(NodeKind.UNKNOWN));
          assertThat(q.nodeQueries.get(x).disjuncts,
              is(
                  ImmutableList.of(
                      new NodeQuery.Disjunct(
                          ImmutableList.of(eq("cat", "NP")), null))));
        });
    aq("#x >@l #y")
        .assertCompile(q -> {
          final NodeVariable y = q.variable("y");
          assertThat(y.kind(), is(NodeKind.TERMINAL));
          assertThat(q.nodeQueries.get(y).disjuncts,
              is(
                  ImmutableList.of(
                      new NodeQuery.Disjunct(ImmutableList.of(),
                          NodeKind.TERMINAL))));
        });
  }

  @Test void testMergeDefinitions() {
    aq("#x:[cat=\"NP\"] & #x > #y & #x:[NT]")
        .assertCompile(q -> {
          assertThat(q.variables.size(), is(2));
          assertThat(q.nodeDefs.get(q.variable("x")).toString(),
              is("[cat=\"NP\" & NT]"));
        });
  }

  @Test void testPredicates() {
    aq("#x:[cat=\"NP\"] & arity(#x, 2) & arity(#x, 2, 2) & root(#x)")
        .assertCompile(q -> {
          final NodeVariable x = q.variable("x");
          assertThat(q.predicates(x).size(), is(2));
          assertThat(q.nodeQueries.get(x).filters,
              is(ImmutableList.of(NodeFilter.arity(2, 2), NodeFilter.root())));
        });
    aq("%x:[pos=\"JJ\"] & empty(%x)")
        .assertCompile(q -> {
          final NodeVariable x = q.variable("x");
          assertThat(x.isSet(), is(true));
          assertThat(q.predicates(x).size(), is(1));
          assertThat(q.predicates(x).get(0).isNodePredicate(), is(false));
          assertThat(q.nodeQueries.get(x).filters, is(ImmutableList.of()));
        });
  }

  /** Tests that filters implied by a constraint are not pushed onto a Set
   * variable. */
  @Test void testNoPushDownToSet() {
    aq("#a:[cat=\"S\"] > %b:[cat=\"NP\"]")
        .assertCompile(q -> {
          assertThat(q.nodeQueries.get(q.variable("a")).filters,
              is(ImmutableList.of(NodeFilter.nonterminalChildren())));
          assertThat(q.nodeQueries.get(q.variable("b")).filters,
              is(ImmutableList.of()));
        });
    aq("#a >SB %b")
        .assertCompile(q ->
            assertThat(q.nodeQueries.get(q.variable("b")).filters,
                is(ImmutableList.of())));
    aq("#a >SB #b")
        .assertCompile(q ->
            assertThat(q.nodeQueries.get(q.variable("b")).filters,
                is(ImmutableList.of(NodeFilter.edgeLabel(0)))));
  }

  @Test void testDisconnectedSingletons() {
    aq("#a > #b & [pos=\"DT\"]")
        .assertCompile(q ->
            assertThat(q.strategy,
                is(CompiledQuery.Strategy.CONSTRAINT_CHECK)));
    aq("[pos=\"DT\"] & [cat=\"NP\"]")
        .assertCompile(q ->
            assertThat(q.strategy, is(CompiledQuery.Strategy.CARTESIAN)));
  }

  @Test void testTracer() {
    final List<String> events = new ArrayList<>();
    aq("#a:[!T] > #b")
        .withTracer(
            Tracers.withOnParse(
                Tracers.withOnNormalize(
                    Tracers.withOnCompile(Tracers.empty(),
                        q -> events.add("compile " + q.variables.size())),
                    q -> events.add("normalize " + q)),
                q -> events.add("parse " + q)))
        .compile();
    assertThat(events,
        is(
            ImmutableList.of("parse #a:[!T] > #b",
                "normalize #a:[NT] > #b",
                "compile 2")));
  }

  @Test void testUndefinedNames() {
    aqE("[$lemma=\"go\"$]")
        .assertCompileThrows(
            throwsA(UndefinedNameException.class,
                is("feature 'lemma' is not defined")));
    aqE("$foo(#a)$")
        .assertCompileThrows(
            throwsA(UndefinedNameException.class,
                is("predicate 'foo' is not defined")));
    aqE("$#a >XY #b$")
        .assertCompileThrows(
            throwsA(UndefinedNameException.class,
                is("edge label 'XY' is not defined")));
    aqE("$#a >~XY #b$")
        .assertCompileThrows(
            throwsA(UndefinedNameException.class,
                is("secondary edge label 'XY' is not defined")));
  }

  @Test void testTypeConflict() {
    aqE("#a:[cat=\"S\"] > #b & $%b$ > #c")
        .assertCompileThrows(
            throwsA(TypeConflictException.class,
                is("variable 'b' is used as both #b and %b")));
    aqE("$[cat=\"NP\" & pos=\"DT\"]$")
        .assertCompileThrows(
            throwsA(TypeConflictException.class,
                is("node description of #$0 requires a node to be both "
                    + "terminal and nonterminal")));
    aqE("$#a:[pos=\"DT\"]$ > #b")
        .assertCompileThrows(
            throwsA(TypeConflictException.class,
                is("variable #a cannot be both terminal and nonterminal")));
  }

  @Test void testConflictingValues() {
    aqE("[cat=\"NP\" & $cat=\"VP\"$]")
        .assertCompileThrows(
            throwsA(ConflictException.class,
                is("feature 'cat' has two conflicting constraints")));
    // Equal values do not conflict.
    aq("[cat=\"NP\" & cat=\"NP\"]")
        .assertCompile(q ->
            assertThat(q.nodeQueries.get(q.variables.get(0)).disjuncts
                .get(0).tests.size(), is(1)));
  }

  @Test void testInvalidRegex() {
    aqE("[word=$/a(/$]")
        .assertCompileThrows(
            throwsA(CompileException.class,
                containsString("invalid regular expression /a(/: ")));
  }

  @Test void testPredicateSignature() {
    aqE("$arity(#a)$")
        .assertCompileThrows(
            throwsA(PredicateSignatureException.class,
                is("missing arguments for 'arity'")));
    aqE("$root(#a, 1)$")
        .assertCompileThrows(
            throwsA(PredicateSignatureException.class,
                is("too many arguments for 'root'")));
    aqE("arity($2$, 1)")
        .assertCompileThrows(
            throwsA(PredicateSignatureException.class,
                is("argument 1 of 'arity' must be a node variable")));
    aqE("arity(#a, $#b$)")
        .assertCompileThrows(
            throwsA(PredicateSignatureException.class,
                is("argument 2 of 'arity' must be an integer")));
    aqE("$empty(#a)$")
        .assertCompileThrows(
            throwsA(PredicateSignatureException.class,
                is("predicate 'empty' is not valid for variable #a")));
    aqE("$arity(#a, 3, 2)$")
        .assertCompileThrows(
            throwsA(CompileException.class,
                is("invalid range in 'arity'")));
  }

  @Test void testSelfRelation() {
    aqE("$#a > #a$")
        .assertCompileThrows(
            throwsA(CompileException.class,
                is("variable #a cannot be related to itself")));
  }

  @Test void testUnsupportedShape() {
    aqE("$#a > #b & #c > #d$")
        .assertCompileThrows(
            throwsA(UnsupportedQueryShapeException.class,
                is("query has 2 groups of variables that are not related "
                    + "to each other")));
  }
}

// End QueryFactoryTest.java
