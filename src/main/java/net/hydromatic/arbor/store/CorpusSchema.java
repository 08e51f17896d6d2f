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

import net.hydromatic.arbor.type.NodeKind;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/** Names that a treebank defines: features (each belonging to terminals or
 * to nonterminals), edge labels and secondary edge labels.
 *
 * <p>Queries are compiled against a schema, so that a compiled query never
 * refers to an unknown name. Label ids are positions in the label lists. */
public class CorpusSchema {
  public final ImmutableMap<String, NodeKind> features;
  public final ImmutableList<String> edgeLabels;
  public final ImmutableList<String> secondaryEdgeLabels;
  private final ImmutableMap<String, Integer> edgeLabelIds;
  private final ImmutableMap<String, Integer> secondaryEdgeLabelIds;

  public CorpusSchema(Map<String, NodeKind> features,
      List<String> edgeLabels, List<String> secondaryEdgeLabels) {
    this.features = ImmutableMap.copyOf(features);
    this.edgeLabels = ImmutableList.copyOf(edgeLabels);
    this.secondaryEdgeLabels = ImmutableList.copyOf(secondaryEdgeLabels);
    this.features.values().forEach(kind ->
        checkArgument(kind != NodeKind.UNKNOWN,
            "feature must belong to terminals or nonterminals"));
    this.edgeLabelIds = index(this.edgeLabels);
    this.secondaryEdgeLabelIds = index(this.secondaryEdgeLabels);
  }

  private static ImmutableMap<String, Integer> index(List<String> labels) {
    final ImmutableMap.Builder<String, Integer> b = ImmutableMap.builder();
    for (int i = 0; i < labels.size(); i++) {
      b.put(labels.get(i), i);
    }
    return b.build();
  }

  /** Returns the kind of node that has a feature, or null if the feature is
   * not defined. */
  public @Nullable NodeKind featureKind(String feature) {
    return features.get(feature);
  }

  /** Returns the id of an edge label, or {@link NodeRecord#NO_LABEL}. */
  public int edgeLabelId(String label) {
    return edgeLabelIds.getOrDefault(label, NodeRecord.NO_LABEL);
  }

  public String edgeLabel(int id) {
    return edgeLabels.get(id);
  }

  /** Returns the id of a secondary edge label, or
   * {@link NodeRecord#NO_LABEL}. */
  public int secondaryEdgeLabelId(String label) {
    return secondaryEdgeLabelIds.getOrDefault(label, NodeRecord.NO_LABEL);
  }

  public String secondaryEdgeLabel(int id) {
    return secondaryEdgeLabels.get(id);
  }

  @Override public String toString() {
    return "CorpusSchema{features=" + features
        + ", edgeLabels=" + edgeLabels
        + ", secondaryEdgeLabels=" + secondaryEdgeLabels + "}";
  }
}

// End CorpusSchema.java
