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

/** Counters of an evaluation.
 *
 * <p>Immutable; a parallel evaluation adds the statistics of its workers
 * using {@link #plus(Stats)}. */
public class Stats {
  public static final Stats ZERO = new Stats(0, 0, 0, 0);

  /** Number of trees whose candidates were checked against the
   * constraints. */
  public final long checkedTrees;
  /** Number of times a constraint was tested on a pair of nodes. */
  public final long constraintChecks;
  public final long nodeCacheHits;
  public final long nodeCacheMisses;

  public Stats(long checkedTrees, long constraintChecks, long nodeCacheHits,
      long nodeCacheMisses) {
    this.checkedTrees = checkedTrees;
    this.constraintChecks = constraintChecks;
    this.nodeCacheHits = nodeCacheHits;
    this.nodeCacheMisses = nodeCacheMisses;
  }

  /** Returns the sum of this and another set of statistics. */
  public Stats plus(Stats stats) {
    return new Stats(checkedTrees + stats.checkedTrees,
        constraintChecks + stats.constraintChecks,
        nodeCacheHits + stats.nodeCacheHits,
        nodeCacheMisses + stats.nodeCacheMisses);
  }

  @Override public String toString() {
    return "Stats{checkedTrees=" + checkedTrees
        + ", constraintChecks=" + constraintChecks
        + ", nodeCacheHits=" + nodeCacheHits
        + ", nodeCacheMisses=" + nodeCacheMisses + "}";
  }

  @Override public int hashCode() {
    return Long.hashCode(checkedTrees) * 31
        + Long.hashCode(constraintChecks) * 17
        + Long.hashCode(nodeCacheHits) * 7
        + Long.hashCode(nodeCacheMisses);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Stats
        && checkedTrees == ((Stats) o).checkedTrees
        && constraintChecks == ((Stats) o).constraintChecks
        && nodeCacheHits == ((Stats) o).nodeCacheHits
        && nodeCacheMisses == ((Stats) o).nodeCacheMisses;
  }
}

// End Stats.java
