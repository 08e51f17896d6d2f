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
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.primitives.ImmutableIntArray;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import static java.util.Objects.requireNonNull;

/** Treebank held in memory.
 *
 * <p>Trees are added through a {@link Builder}, which computes each node's
 * record: Gorn address, corners, continuity and arity. A tree with more than
 * one root gets a virtual root, a nonterminal with no features whose
 * children are the roots.
 *
 * <p>Feature values are stored as ids into a dictionary per feature, in the
 * order that they are first seen. */
public class Treebank implements IndexProvider {
  private final CorpusSchema schema;
  private final ImmutableList<NodeRecord> nodes;
  /** Id of the first node of each tree, plus the node count. */
  private final ImmutableIntArray treeStarts;
  private final ImmutableMap<String, ImmutableList<String>> values;
  private final ImmutableMap<String, ImmutableMap<String, Integer>> valueIds;
  /** For each node, the value id of each feature it has. */
  private final ImmutableList<ImmutableMap<String, Integer>> nodeValues;
  /** Secondary edge labels, keyed by {@link #edgeKey(int, int)}. */
  private final ImmutableSetMultimap<Long, Integer> secondaryEdges;

  private Treebank(CorpusSchema schema, ImmutableList<NodeRecord> nodes,
      ImmutableIntArray treeStarts,
      ImmutableMap<String, ImmutableList<String>> values,
      ImmutableList<ImmutableMap<String, Integer>> nodeValues,
      ImmutableSetMultimap<Long, Integer> secondaryEdges) {
    this.schema = schema;
    this.nodes = nodes;
    this.treeStarts = treeStarts;
    this.values = values;
    this.nodeValues = nodeValues;
    this.secondaryEdges = secondaryEdges;
    final ImmutableMap.Builder<String, ImmutableMap<String, Integer>> b =
        ImmutableMap.builder();
    values.forEach((feature, list) -> {
      final ImmutableMap.Builder<String, Integer> b2 = ImmutableMap.builder();
      for (int i = 0; i < list.size(); i++) {
        b2.put(list.get(i), i);
      }
      b.put(feature, b2.build());
    });
    this.valueIds = b.build();
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  private static long edgeKey(int originId, int targetId) {
    return ((long) originId << 32) | targetId;
  }

  @Override public CorpusSchema schema() {
    return schema;
  }

  @Override public TreebankIndex connect() {
    return new CalciteTreebankIndex(this);
  }

  public int treeCount() {
    return treeStarts.length() - 1;
  }

  public int nodeCount() {
    return nodes.size();
  }

  public NodeRecord node(int id) {
    return nodes.get(id);
  }

  /** Returns all node records, ordered by id. */
  public List<NodeRecord> nodes() {
    return nodes;
  }

  /** Returns the ids of the nodes of a tree. */
  public List<Integer> nodeIds(int treeId) {
    final List<Integer> list = new ArrayList<>();
    for (int i = treeStarts.get(treeId); i < treeStarts.get(treeId + 1); i++) {
      list.add(i);
    }
    return list;
  }

  /** Returns the value of a feature of a node, or null. */
  public @Nullable String value(int nodeId, String feature) {
    final Integer valueId = nodeValues.get(nodeId).get(feature);
    return valueId == null
        ? null
        : requireNonNull(values.get(feature)).get(valueId);
  }

  /** Returns the feature values of a node as value ids. */
  public Map<String, Integer> valueIds(int nodeId) {
    return nodeValues.get(nodeId);
  }

  /** Returns the dictionary of a feature: its distinct values, indexed by
   * value id. */
  public List<String> values(String feature) {
    final ImmutableList<String> list = values.get(feature);
    checkArgument(list != null, "unknown feature %s", feature);
    return list;
  }

  public OptionalInt valueId(String feature, String value) {
    final ImmutableMap<String, Integer> map = valueIds.get(feature);
    if (map == null) {
      return OptionalInt.empty();
    }
    final Integer id = map.get(value);
    return id == null ? OptionalInt.empty() : OptionalInt.of(id);
  }

  public boolean hasSecondaryEdge(int originId, int targetId, int labelId) {
    final long key = edgeKey(originId, targetId);
    return labelId == NodeRecord.NO_LABEL
        ? secondaryEdges.containsKey(key)
        : secondaryEdges.containsEntry(key, labelId);
  }

  /** Builds a {@link Treebank}. */
  public static class Builder {
    private final Map<String, NodeKind> features = new LinkedHashMap<>();
    private final List<String> edgeLabels = new ArrayList<>();
    private final List<String> secondaryEdgeLabels = new ArrayList<>();
    private final Map<String, List<String>> values = new LinkedHashMap<>();
    private final Map<String, Map<String, Integer>> valueIds =
        new LinkedHashMap<>();
    private final List<NodeRecord> nodes = new ArrayList<>();
    private final List<ImmutableMap<String, Integer>> nodeValues =
        new ArrayList<>();
    private final List<Integer> treeStarts = new ArrayList<>();
    private final ImmutableSetMultimap.Builder<Long, Integer> secondaryEdges =
        ImmutableSetMultimap.builder();

    private Builder() {
      treeStarts.add(0);
    }

    /** Declares a feature of terminals or nonterminals. */
    public Builder feature(String name, NodeKind kind) {
      checkArgument(kind != NodeKind.UNKNOWN,
          "feature must belong to terminals or nonterminals");
      final NodeKind previous = features.put(name, kind);
      checkArgument(previous == null || previous == kind,
          "feature %s declared with two kinds", name);
      values.computeIfAbsent(name, f -> new ArrayList<>());
      valueIds.computeIfAbsent(name, f -> new LinkedHashMap<>());
      return this;
    }

    /** Declares an edge label; labels used in trees are declared
     * automatically. */
    public Builder edgeLabel(String label) {
      labelId(edgeLabels, label);
      return this;
    }

    /** Declares a secondary edge label; labels used in trees are declared
     * automatically. */
    public Builder secondaryEdgeLabel(String label) {
      labelId(secondaryEdgeLabels, label);
      return this;
    }

    private static int labelId(List<String> labels, String label) {
      int i = labels.indexOf(label);
      if (i < 0) {
        i = labels.size();
        labels.add(label);
      }
      return i;
    }

    /** Starts a tree. Call {@link TreeBuilder#end()} to add it. */
    public TreeBuilder tree() {
      return new TreeBuilder(this);
    }

    public Treebank build() {
      final ImmutableMap.Builder<String, ImmutableList<String>> b =
          ImmutableMap.builder();
      values.forEach((feature, list) ->
          b.put(feature, ImmutableList.copyOf(list)));
      return new Treebank(
          new CorpusSchema(features, edgeLabels, secondaryEdgeLabels),
          ImmutableList.copyOf(nodes),
          ImmutableIntArray.copyOf(treeStarts),
          b.build(),
          ImmutableList.copyOf(nodeValues),
          secondaryEdges.build());
    }

    private int valueId(String feature, String value, NodeKind kind) {
      final NodeKind declared = features.get(feature);
      checkArgument(declared != null, "undeclared feature %s", feature);
      checkArgument(declared == kind,
          "feature %s does not belong to %s", feature, kind);
      final Map<String, Integer> ids = requireNonNull(valueIds.get(feature));
      final Integer id = ids.get(value);
      if (id != null) {
        return id;
      }
      final List<String> list = requireNonNull(values.get(feature));
      ids.put(value, list.size());
      list.add(value);
      return list.size() - 1;
    }

    /** Computes records for the nodes of a finished tree. */
    private void add(TreeBuilder t) {
      checkArgument(!t.nodes.isEmpty(), "empty tree");
      final List<PendingNode> roots = new ArrayList<>();
      for (PendingNode node : t.nodes) {
        if (node.parent == null) {
          roots.add(node);
        }
      }
      // A terminal's span is its own order; compute nonterminal spans
      // bottom-up before sorting roots by their left corner.
      roots.forEach(Builder::computeSpan);
      final PendingNode root;
      if (roots.size() == 1) {
        root = roots.get(0);
      } else {
        roots.sort(Comparator.comparingInt(n -> n.minOrder));
        root = new PendingNode(NodeKind.NONTERMINAL, ImmutableMap.of(), -1);
        root.children.addAll(roots);
        roots.forEach(r -> r.parent = root);
        computeSpan(root);
      }

      final int treeId = treeStarts.size() - 1;
      final int firstId = nodes.size();
      final List<PendingNode> preorder = new ArrayList<>();
      assignIds(root, ImmutableIntArray.of(), firstId, preorder);

      // Terminal id by token order, for corners.
      final int[] terminalIds = new int[t.terminalCount];
      for (PendingNode node : preorder) {
        if (node.kind == NodeKind.TERMINAL) {
          terminalIds[node.order] = node.id;
        }
      }
      for (PendingNode node : preorder) {
        final ImmutableMap.Builder<String, Integer> b = ImmutableMap.builder();
        node.features.forEach((feature, value) ->
            b.put(feature, valueId(feature, value, node.kind)));
        nodeValues.add(b.build());
        final int edgeLabel = node.label == null
            ? NodeRecord.NO_LABEL
            : labelId(edgeLabels, node.label);
        int childrenKind = 0;
        for (PendingNode child : node.children) {
          childrenKind |= child.kind == NodeKind.TERMINAL
              ? NodeRecord.TERMINAL_CHILDREN
              : NodeRecord.NONTERMINAL_CHILDREN;
        }
        final boolean terminal = node.kind == NodeKind.TERMINAL;
        final int continuity = terminal
            ? NodeRecord.TERMINAL
            : node.maxOrder - node.minOrder + 1 == node.tokenArity
                ? NodeRecord.CONTINUOUS
                : NodeRecord.DISCONTINUOUS;
        nodes.add(
            new NodeRecord(node.id, treeId, edgeLabel, continuity,
                terminal ? node.id : terminalIds[node.minOrder],
                terminal ? node.id : terminalIds[node.maxOrder],
                terminal ? node.order : -1,
                node.gorn, node.children.size(),
                terminal ? 1 : node.tokenArity, childrenKind,
                node.secondaryEdgeOrigin, node.secondaryEdgeTarget));
      }
      for (PendingEdge edge : t.secondaryEdges) {
        secondaryEdges.put(edgeKey(edge.origin.id, edge.target.id),
            labelId(secondaryEdgeLabels, edge.label));
      }
      treeStarts.add(nodes.size());
    }

    private static void computeSpan(PendingNode node) {
      if (node.kind == NodeKind.TERMINAL) {
        node.minOrder = node.maxOrder = node.order;
        node.tokenArity = 1;
        return;
      }
      checkArgument(!node.children.isEmpty(), "nonterminal has no children");
      node.minOrder = Integer.MAX_VALUE;
      node.maxOrder = Integer.MIN_VALUE;
      node.tokenArity = 0;
      for (PendingNode child : node.children) {
        computeSpan(child);
        node.minOrder = Math.min(node.minOrder, child.minOrder);
        node.maxOrder = Math.max(node.maxOrder, child.maxOrder);
        node.tokenArity += child.tokenArity;
      }
    }

    private static int assignIds(PendingNode node, ImmutableIntArray gorn,
        int id, List<PendingNode> preorder) {
      node.id = id++;
      node.gorn = gorn;
      preorder.add(node);
      for (int i = 0; i < node.children.size(); i++) {
        final ImmutableIntArray childGorn =
            ImmutableIntArray.builder(gorn.length() + 1)
                .addAll(gorn).add(i).build();
        id = assignIds(node.children.get(i), childGorn, id, preorder);
      }
      return id;
    }
  }

  /** Builds one tree of a {@link Treebank}.
   *
   * <p>Nodes are identified by handles that are local to the tree.
   * Terminals are numbered in the order they are created. */
  public static class TreeBuilder {
    private final Builder parent;
    private final List<PendingNode> nodes = new ArrayList<>();
    private final List<PendingEdge> secondaryEdges = new ArrayList<>();
    private int terminalCount = 0;
    private boolean ended = false;

    private TreeBuilder(Builder parent) {
      this.parent = parent;
    }

    /** Adds a terminal; returns its handle. */
    public int terminal(Map<String, String> features) {
      checkState(!ended, "tree has ended");
      nodes.add(
          new PendingNode(NodeKind.TERMINAL, ImmutableMap.copyOf(features),
              terminalCount++));
      return nodes.size() - 1;
    }

    /** Adds a nonterminal whose children have already been added; returns
     * its handle. */
    public int nonterminal(Map<String, String> features, List<Integer> children) {
      checkState(!ended, "tree has ended");
      checkArgument(!children.isEmpty(), "nonterminal has no children");
      final PendingNode node =
          new PendingNode(NodeKind.NONTERMINAL, ImmutableMap.copyOf(features),
              -1);
      for (int child : children) {
        final PendingNode childNode = nodes.get(child);
        checkArgument(childNode.parent == null,
            "node %s already has a parent", child);
        childNode.parent = node;
        node.children.add(childNode);
      }
      nodes.add(node);
      return nodes.size() - 1;
    }

    /** Sets the label of the edge from a node's parent. */
    public TreeBuilder label(int node, String label) {
      nodes.get(node).label = requireNonNull(label);
      return this;
    }

    /** Adds a labeled secondary edge. */
    public TreeBuilder secondaryEdge(int origin, int target, String label) {
      final PendingNode originNode = nodes.get(origin);
      final PendingNode targetNode = nodes.get(target);
      originNode.secondaryEdgeOrigin = true;
      targetNode.secondaryEdgeTarget = true;
      secondaryEdges.add(
          new PendingEdge(originNode, targetNode, requireNonNull(label)));
      return this;
    }

    /** Finishes this tree and adds it to the treebank. */
    public Builder end() {
      checkState(!ended, "tree has ended");
      ended = true;
      parent.add(this);
      return parent;
    }
  }

  /** Node of a tree under construction. */
  private static class PendingNode {
    final NodeKind kind;
    final ImmutableMap<String, String> features;
    /** Token order; -1 for a nonterminal. */
    final int order;
    final List<PendingNode> children = new ArrayList<>();
    @Nullable PendingNode parent;
    @Nullable String label;
    boolean secondaryEdgeOrigin;
    boolean secondaryEdgeTarget;
    int minOrder;
    int maxOrder;
    int tokenArity;
    int id;
    ImmutableIntArray gorn = ImmutableIntArray.of();

    PendingNode(NodeKind kind, ImmutableMap<String, String> features,
        int order) {
      this.kind = kind;
      this.features = features;
      this.order = order;
    }
  }

  /** Secondary edge of a tree under construction. */
  private static class PendingEdge {
    final PendingNode origin;
    final PendingNode target;
    final String label;

    PendingEdge(PendingNode origin, PendingNode target, String label) {
      this.origin = origin;
      this.target = target;
      this.label = label;
    }
  }
}

// End Treebank.java
