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
import net.hydromatic.arbor.type.NodeKind;

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/** What to search for to find the candidates of a node variable: a union
 * of disjuncts, each a conjunction of feature tests, and filters that apply
 * to every disjunct.
 *
 * <p>Two variables with equal node queries have the same candidates, so
 * they may share a cursor. */
public class NodeQuery {
  public final ImmutableList<Disjunct> disjuncts;
  public final ImmutableList<NodeFilter> filters;

  NodeQuery(List<Disjunct> disjuncts, List<NodeFilter> filters) {
    this.disjuncts = ImmutableList.copyOf(disjuncts);
    this.filters = ImmutableList.copyOf(filters);
  }

  @Override public String toString() {
    return "NodeQuery{disjuncts=" + disjuncts + ", filters=" + filters + "}";
  }

  @Override public int hashCode() {
    return Objects.hash(disjuncts, filters);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof NodeQuery
        && disjuncts.equals(((NodeQuery) o).disjuncts)
        && filters.equals(((NodeQuery) o).filters);
  }

  /** Conjunction of feature tests, and optionally a node kind from a
   * feature record such as "T". */
  public static class Disjunct {
    public final ImmutableList<FeatureTest> tests;
    public final @Nullable NodeKind kind;

    Disjunct(List<FeatureTest> tests, @Nullable NodeKind kind) {
      this.tests = ImmutableList.copyOf(tests);
      this.kind = kind;
    }

    @Override public String toString() {
      return (kind == null ? "" : kind + " ") + tests;
    }

    @Override public int hashCode() {
      return Objects.hash(tests, kind);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Disjunct
          && tests.equals(((Disjunct) o).tests)
          && kind == ((Disjunct) o).kind;
    }
  }

  /** Test on the value of a feature: equal or not equal to a string, or
   * matching or not matching a regular expression.
   *
   * <p>Every test requires that the node has the feature. */
  public static class FeatureTest {
    public final String feature;
    /** Whether the value must match; false for "!=". */
    public final boolean match;
    /** String literal, or regular expression. */
    public final String value;
    public final boolean regex;

    FeatureTest(String feature, boolean match, String value, boolean regex) {
      this.feature = requireNonNull(feature);
      this.match = match;
      this.value = requireNonNull(value);
      this.regex = regex;
    }

    @Override public String toString() {
      return feature + (match ? "=" : "!=")
          + (regex ? "/" + value + "/" : "\"" + value + "\"");
    }

    @Override public int hashCode() {
      return Objects.hash(feature, match, value, regex);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof FeatureTest
          && feature.equals(((FeatureTest) o).feature)
          && match == ((FeatureTest) o).match
          && value.equals(((FeatureTest) o).value)
          && regex == ((FeatureTest) o).regex;
    }
  }
}

// End NodeQuery.java
