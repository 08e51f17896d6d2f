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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/** Condition on the value of one feature of a node, in a form that the
 * store can evaluate directly: against a value id, or against the value ids
 * in a value table.
 *
 * <p>Every kind of match requires that the node has the feature. */
public class FeatureMatch {
  public final String feature;
  public final Kind kind;
  /** Value id, for {@link Kind#EQUAL} and {@link Kind#NOT_EQUAL}. */
  public final int valueId;
  /** Name of the value table, for {@link Kind#IN}. */
  public final @Nullable String table;

  private FeatureMatch(String feature, Kind kind, int valueId,
      @Nullable String table) {
    this.feature = requireNonNull(feature);
    this.kind = requireNonNull(kind);
    this.valueId = valueId;
    this.table = table;
  }

  /** Node has a given value for the feature. */
  public static FeatureMatch equal(String feature, int valueId) {
    return new FeatureMatch(feature, Kind.EQUAL, valueId, null);
  }

  /** Node has a value for the feature, other than a given value. */
  public static FeatureMatch notEqual(String feature, int valueId) {
    return new FeatureMatch(feature, Kind.NOT_EQUAL, valueId, null);
  }

  /** Node's value for the feature is in a value table. */
  public static FeatureMatch in(String feature, String table) {
    return new FeatureMatch(feature, Kind.IN, -1, requireNonNull(table));
  }

  /** Node has any value for the feature. */
  public static FeatureMatch exists(String feature) {
    return new FeatureMatch(feature, Kind.EXISTS, -1, null);
  }

  @Override public String toString() {
    switch (kind) {
    case EQUAL:
      return feature + " = #" + valueId;
    case NOT_EQUAL:
      return feature + " <> #" + valueId;
    case IN:
      return feature + " in " + table;
    default:
      return feature + " exists";
    }
  }

  @Override public int hashCode() {
    return Objects.hash(feature, kind, valueId, table);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof FeatureMatch
        && feature.equals(((FeatureMatch) o).feature)
        && kind == ((FeatureMatch) o).kind
        && valueId == ((FeatureMatch) o).valueId
        && Objects.equals(table, ((FeatureMatch) o).table);
  }

  /** Kind of feature match. */
  public enum Kind {
    EQUAL,
    NOT_EQUAL,
    IN,
    EXISTS
  }
}

// End FeatureMatch.java
