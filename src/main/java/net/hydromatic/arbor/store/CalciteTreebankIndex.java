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

import com.google.common.collect.ImmutableList;
import org.apache.calcite.DataContext;
import org.apache.calcite.adapter.java.JavaTypeFactory;
import org.apache.calcite.interpreter.Interpreter;
import org.apache.calcite.jdbc.CalciteSchema;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Enumerator;
import org.apache.calcite.linq4j.Linq4j;
import org.apache.calcite.linq4j.QueryProvider;
import org.apache.calcite.plan.RelOptUtil;
import org.apache.calcite.rel.RelNode;
import org.apache.calcite.rel.core.JoinRelType;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.rex.RexNode;
import org.apache.calcite.schema.ScannableTable;
import org.apache.calcite.schema.SchemaPlus;
import org.apache.calcite.schema.impl.AbstractTable;
import org.apache.calcite.sql.type.SqlTypeName;
import org.apache.calcite.tools.Frameworks;
import org.apache.calcite.tools.RelBuilder;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.function.Predicate;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/** Connection to a {@link Treebank} that evaluates searches as relational
 * expressions using Apache Calcite.
 *
 * <p>The connection registers a table {@code node_data} with one row per
 * node, and a table {@code feature_<name>} with a (node id, value id) row
 * for each node that has feature {@code <name>}, in a schema of its own.
 * Each lookup of a search becomes a chain of joins from {@code node_data}
 * to the feature tables; lookups are combined by a union, and the result
 * is sorted by tree id. */
public class CalciteTreebankIndex implements TreebankIndex {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(CalciteTreebankIndex.class);

  /** Columns of {@code node_data}. */
  private static final List<String> NODE_COLUMNS =
      ImmutableList.of("id", "tree_id", "edge_label", "depth", "continuity",
          "arity", "token_arity", "nt_children", "secedge_out", "secedge_in");

  private final Treebank treebank;
  private final CalciteSchema schema;
  private final RelBuilder relBuilder;
  private final DataContext dataContext;
  private final Map<String, ValueTable> valueTables = new LinkedHashMap<>();
  private int nextTable = 0;
  private boolean closed = false;

  CalciteTreebankIndex(Treebank treebank) {
    this.treebank = treebank;
    // Not cached, so that value tables are seen as soon as they are added.
    this.schema = CalciteSchema.createRootSchema(false, false);
    final SchemaPlus rootSchema = schema.plus();
    rootSchema.add("node_data", nodeTable(treebank));
    treebank.schema().features.keySet().forEach(feature ->
        rootSchema.add(featureTable(feature), featureTable(treebank, feature)));
    this.relBuilder =
        RelBuilder.create(
            Frameworks.newConfigBuilder()
                .defaultSchema(rootSchema)
                .build())
            .transform(c -> c.withSimplify(false));
    this.dataContext =
        new EmptyDataContext((JavaTypeFactory) relBuilder.getTypeFactory(),
            rootSchema);
  }

  private static String featureTable(String feature) {
    return "feature_" + feature;
  }

  private static int flag(boolean b) {
    return b ? 1 : 0;
  }

  private static Table nodeTable(Treebank treebank) {
    final List<Object[]> rows = new ArrayList<>();
    for (NodeRecord node : treebank.nodes()) {
      rows.add(
          new Object[] {node.id, node.treeId, node.edgeLabel, node.depth(),
              node.continuity, node.arity, node.tokenArity,
              flag((node.childrenKind & NodeRecord.NONTERMINAL_CHILDREN) != 0),
              flag(node.secondaryEdgeOrigin), flag(node.secondaryEdgeTarget)});
    }
    return new Table(NODE_COLUMNS, rows);
  }

  private static Table featureTable(Treebank treebank, String feature) {
    final List<Object[]> rows = new ArrayList<>();
    for (int id = 0; id < treebank.nodeCount(); id++) {
      final Integer valueId = treebank.valueIds(id).get(feature);
      if (valueId != null) {
        rows.add(new Object[] {id, valueId});
      }
    }
    return new Table(ImmutableList.of("node_id", "value_id"), rows);
  }

  @Override public CorpusSchema schema() {
    return treebank.schema();
  }

  @Override public int treeCount() {
    return treebank.treeCount();
  }

  @Override public OptionalInt valueId(String feature, String value) {
    return treebank.valueId(feature, value);
  }

  @Override public ValueTable createValueTable(String feature,
      Predicate<String> predicate) {
    checkState(!closed, "closed");
    final List<String> values = treebank.values(feature);
    final List<Object[]> rows = new ArrayList<>();
    for (int i = 0; i < values.size(); i++) {
      if (predicate.test(values.get(i))) {
        rows.add(new Object[] {i});
      }
    }
    final String name = "value_table_" + nextTable++;
    schema.add(name, new Table(ImmutableList.of("id"), rows));
    final ValueTable table = new ValueTable(name, feature, rows.size());
    valueTables.put(name, table);
    LOGGER.debug("Created value table {}", table);
    return table;
  }

  @Override public void dropValueTable(ValueTable table) {
    checkArgument(valueTables.remove(table.name) != null,
        "unknown value table %s", table.name);
    schema.removeTable(table.name);
    LOGGER.debug("Dropped value table {}", table);
  }

  @Override public NodeCursor search(List<Lookup> lookups, TreeRange range) {
    checkState(!closed, "closed");
    checkArgument(!lookups.isEmpty(), "no lookups");
    final RelNode rel = plan(lookups, range);
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Search plan:\n{}", RelOptUtil.toString(rel));
    }
    final List<Integer> nodeIds = new ArrayList<>();
    final List<Integer> treeIds = new ArrayList<>();
    final Interpreter interpreter = new Interpreter(dataContext, rel);
    try (Enumerator<Object[]> enumerator = interpreter.enumerator()) {
      while (enumerator.moveNext()) {
        final Object[] row = enumerator.current();
        nodeIds.add(((Number) row[0]).intValue());
        treeIds.add(((Number) row[1]).intValue());
      }
    } finally {
      interpreter.close();
    }
    return NodeCursor.of(nodeIds.stream().mapToInt(i -> i).toArray(),
        treeIds.stream().mapToInt(i -> i).toArray());
  }

  /** Converts a search into a relational expression. */
  RelNode plan(List<Lookup> lookups, TreeRange range) {
    final RelBuilder b = relBuilder.transform(c -> c);
    for (Lookup lookup : lookups) {
      b.scan("node_data");
      final List<RexNode> conditions = new ArrayList<>();
      if (range.lower > 0) {
        conditions.add(
            b.greaterThanOrEqual(b.field("tree_id"), b.literal(range.lower)));
      }
      if (!range.isUnboundedAbove()) {
        conditions.add(
            b.lessThan(b.field("tree_id"), b.literal(range.upper)));
      }
      for (NodeFilter filter : lookup.filters) {
        conditions.add(condition(b, filter));
      }
      if (!conditions.isEmpty()) {
        b.filter(conditions);
      }
      b.project(b.field("id"), b.field("tree_id"));
      for (FeatureMatch match : lookup.features) {
        featureScan(b, match);
        b.join(JoinRelType.INNER,
            b.equals(b.field(2, 0, 0), b.field(2, 1, 0)));
        b.project(b.field(0), b.field(1));
      }
    }
    if (lookups.size() > 1) {
      b.union(false, lookups.size());
    }
    return b.sort(b.field(1), b.field(0))
        .build();
  }

  /** Pushes a relation with one column, the ids of the nodes that satisfy
   * a feature match. */
  private static void featureScan(RelBuilder b, FeatureMatch match) {
    b.scan(featureTable(match.feature));
    switch (match.kind) {
    case EQUAL:
      b.filter(b.equals(b.field("value_id"), b.literal(match.valueId)));
      break;
    case NOT_EQUAL:
      b.filter(b.notEquals(b.field("value_id"), b.literal(match.valueId)));
      break;
    case IN:
      b.scan(requireTable(match));
      b.join(JoinRelType.INNER,
          b.equals(b.field(2, 0, "value_id"), b.field(2, 1, "id")));
      break;
    case EXISTS:
      break;
    default:
      throw new AssertionError(match.kind);
    }
    b.project(b.field(0));
  }

  private static String requireTable(FeatureMatch match) {
    final String table = match.table;
    if (table == null) {
      throw new IllegalArgumentException("no table in " + match);
    }
    return table;
  }

  private static RexNode condition(RelBuilder b, NodeFilter filter) {
    switch (filter.kind) {
    case TERMINAL:
      return b.equals(b.field("continuity"), b.literal(NodeRecord.TERMINAL));
    case NONTERMINAL:
      return b.notEquals(b.field("continuity"),
          b.literal(NodeRecord.TERMINAL));
    case ROOT:
      return b.equals(b.field("depth"), b.literal(0));
    case CONTINUOUS:
      return b.equals(b.field("continuity"),
          b.literal(NodeRecord.CONTINUOUS));
    case DISCONTINUOUS:
      return b.equals(b.field("continuity"),
          b.literal(NodeRecord.DISCONTINUOUS));
    case ARITY:
      return between(b, "arity", filter);
    case TOKEN_ARITY:
      return between(b, "token_arity", filter);
    case EDGE_LABEL:
      return b.equals(b.field("edge_label"), b.literal(filter.min));
    case NONTERMINAL_CHILDREN:
      return b.equals(b.field("nt_children"), b.literal(1));
    case SECONDARY_EDGE_ORIGIN:
      return b.equals(b.field("secedge_out"), b.literal(1));
    case SECONDARY_EDGE_TARGET:
      return b.equals(b.field("secedge_in"), b.literal(1));
    default:
      throw new AssertionError(filter.kind);
    }
  }

  /** Range filters on arity apply only to nonterminals. */
  private static RexNode between(RelBuilder b, String column,
      NodeFilter filter) {
    return b.and(
        b.notEquals(b.field("continuity"), b.literal(NodeRecord.TERMINAL)),
        b.greaterThanOrEqual(b.field(column), b.literal(filter.min)),
        b.lessThanOrEqual(b.field(column), b.literal(filter.max)));
  }

  @Override public NodeRecord node(int id) {
    return treebank.node(id);
  }

  @Override public boolean hasSecondaryEdge(int originId, int targetId,
      int labelId) {
    return treebank.hasSecondaryEdge(originId, targetId, labelId);
  }

  @Override public void close() {
    if (closed) {
      return;
    }
    for (ValueTable table : ImmutableList.copyOf(valueTables.values())) {
      dropValueTable(table);
    }
    closed = true;
  }

  /** Table of integer columns whose rows are held in a list. */
  private static class Table extends AbstractTable implements ScannableTable {
    private final List<String> columns;
    private final List<Object[]> rows;

    Table(List<String> columns, List<Object[]> rows) {
      this.columns = ImmutableList.copyOf(columns);
      this.rows = rows;
    }

    @Override public RelDataType getRowType(RelDataTypeFactory typeFactory) {
      final RelDataTypeFactory.Builder b = typeFactory.builder();
      columns.forEach(column -> b.add(column, SqlTypeName.INTEGER));
      return b.build();
    }

    @Override public Enumerable<@Nullable Object[]> scan(DataContext root) {
      return Linq4j.asEnumerable(rows);
    }
  }

  /** Data context for the interpreter; it has no variables. */
  private static class EmptyDataContext implements DataContext {
    private final JavaTypeFactory typeFactory;
    private final SchemaPlus rootSchema;

    EmptyDataContext(JavaTypeFactory typeFactory, SchemaPlus rootSchema) {
      this.typeFactory = typeFactory;
      this.rootSchema = rootSchema;
    }

    @Override public SchemaPlus getRootSchema() {
      return rootSchema;
    }

    @Override public JavaTypeFactory getTypeFactory() {
      return typeFactory;
    }

    @Override public QueryProvider getQueryProvider() {
      throw new UnsupportedOperationException();
    }

    @Override public @Nullable Object get(String name) {
      return null;
    }
  }
}

// End CalciteTreebankIndex.java
