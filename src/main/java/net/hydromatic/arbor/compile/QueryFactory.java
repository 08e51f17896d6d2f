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

import net.hydromatic.arbor.ast.Ast;
import net.hydromatic.arbor.ast.Pos;
import net.hydromatic.arbor.store.CorpusSchema;
import net.hydromatic.arbor.store.NodeFilter;
import net.hydromatic.arbor.type.ContainerKind;
import net.hydromatic.arbor.type.NodeKind;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.apache.calcite.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static net.hydromatic.arbor.ast.AstBuilder.ast;

import static java.util.Objects.requireNonNull;

/** Converts a normalized query into a {@link CompiledQuery}.
 *
 * <p>Each node description that is not bound to a variable gets a variable
 * with a generated name. Definitions of the same variable are merged by
 * conjunction. Predicates are attached to their variable, and each relation
 * becomes a {@link Constraint}. Node kinds are inferred from features, from
 * feature records and from the relations that a variable takes part in.
 *
 * <p>A factory is used for one query. */
public class QueryFactory {
  private final CorpusSchema schema;
  private final Normalizer normalizer;
  private final NameGenerator nameGenerator = new NameGenerator();

  private final Map<String, NodeVariable> variables = new LinkedHashMap<>();
  private final Map<NodeVariable, Ast.NodeDescription> descriptions =
      new HashMap<>();
  private final Map<NodeVariable, List<QueryPredicate>> predicates =
      new HashMap<>();
  private final Map<NodeVariable, List<DisjunctBuilder>> disjuncts =
      new HashMap<>();
  private final List<Ast.Predicate> calls = new ArrayList<>();
  private final List<Ast.Relation> relations = new ArrayList<>();

  private QueryFactory(CorpusSchema schema) {
    this.schema = requireNonNull(schema);
    this.normalizer = new Normalizer(schema);
  }

  /** Compiles a normalized query. */
  public static CompiledQuery create(Ast.Query query, CorpusSchema schema) {
    return new QueryFactory(schema).compile(query);
  }

  private CompiledQuery compile(Ast.Query query) {
    for (Ast.Exp term : query.terms()) {
      addTerm(term);
    }

    // Node descriptions; may refine kinds.
    final ImmutableMap.Builder<NodeVariable, Ast.NodeDescription> nodeDefs =
        ImmutableMap.builder();
    for (NodeVariable variable : variables.values()) {
      final Ast.NodeDescription description =
          normalizer.normalizeDescription(
              requireNonNull(descriptions.get(variable)));
      nodeDefs.put(variable, description);
      disjuncts.put(variable, analyze(variable, description));
      predicates.put(variable, new ArrayList<>());
    }

    // Predicates.
    for (Ast.Predicate call : calls) {
      addPredicate(call);
    }

    // Constraints; refine kinds, then push filters down.
    final List<QueryConstraint> constraints = new ArrayList<>();
    for (Ast.Relation relation : relations) {
      constraints.add(createConstraint(relation));
    }
    for (QueryConstraint c : constraints) {
      final Pair<List<NodeFilter>, List<NodeFilter>> filters =
          c.constraint.filters(c.left, c.right);
      pushDown(c.left, c.constraint, filters.left);
      pushDown(c.right, c.constraint, filters.right);
    }

    final ImmutableMap.Builder<NodeVariable, ImmutableList<QueryPredicate>>
        predicateMap = ImmutableMap.builder();
    final ImmutableMap.Builder<NodeVariable, NodeQuery> nodeQueries =
        ImmutableMap.builder();
    for (NodeVariable variable : variables.values()) {
      final List<QueryPredicate> list = predicates(variable);
      predicateMap.put(variable, ImmutableList.copyOf(list));
      final List<NodeFilter> filters = new ArrayList<>();
      for (QueryPredicate predicate : list) {
        if (predicate.isNodePredicate()) {
          filters.add(predicate.filter());
        }
      }
      nodeQueries.put(variable, nodeQuery(variable, filters));
    }

    return new CompiledQuery(query,
        ImmutableList.copyOf(variables.values()), nodeDefs.build(),
        predicateMap.build(), constraints, nodeQueries.build(),
        strategy(query.pos, constraints));
  }

  private List<QueryPredicate> predicates(NodeVariable variable) {
    return requireNonNull(predicates.get(variable));
  }

  // Terms

  private void addTerm(Ast.Exp term) {
    switch (term.op) {
    case PREDICATE:
      final Ast.Predicate predicate = (Ast.Predicate) term;
      final List<Ast.Exp> args = new ArrayList<>();
      for (Ast.Exp arg : predicate.args) {
        args.add(arg.op.isNodeOperand() ? define(arg) : arg);
      }
      calls.add(predicate.copy(args));
      break;

    case DOMINANCE:
    case PRECEDENCE:
    case CORNER:
    case SEC_EDGE:
    case SIBLING:
      final Ast.Relation relation = (Ast.Relation) term;
      relations.add(relation.copy(define(relation.left),
          define(relation.right)));
      break;

    default:
      define(term);
    }
  }

  /** Registers the variable of a node operand, and returns a reference to
   * it. A node description gets an anonymous variable. */
  private Ast.VariableReference define(Ast.Exp operand) {
    switch (operand.op) {
    case NODE_DESCRIPTION:
      final NodeVariable anonymous =
          variable(nameGenerator.get(), ContainerKind.SINGLE, operand.pos);
      descriptions.put(anonymous, (Ast.NodeDescription) operand);
      return ast.variableReference(operand.pos, anonymous.name,
          anonymous.container);

    case VARIABLE_DEFINITION:
      final Ast.VariableDefinition definition =
          (Ast.VariableDefinition) operand;
      final NodeVariable variable =
          variable(definition.name, definition.container, definition.pos);
      descriptions.put(variable,
          merge(requireNonNull(descriptions.get(variable)),
              definition.description));
      return ast.variableReference(definition.pos, definition.name,
          definition.container);

    case VARIABLE_REFERENCE:
      final Ast.VariableReference reference = (Ast.VariableReference) operand;
      variable(reference.name, reference.container, reference.pos);
      return reference;

    default:
      throw new AssertionError("not a node operand: " + operand);
    }
  }

  /** Returns the variable with a given name, creating it with an empty
   * description if it does not exist. */
  private NodeVariable variable(String name, ContainerKind container,
      Pos pos) {
    final NodeVariable variable = variables.get(name);
    if (variable == null) {
      final NodeVariable newVariable = new NodeVariable(name, container);
      variables.put(name, newVariable);
      descriptions.put(newVariable, ast.nodeDescription(pos, ast.nop(pos)));
      return newVariable;
    }
    if (variable.container != container) {
      throw new TypeConflictException("variable '" + name
          + "' is used as both " + ContainerKind.SINGLE.prefix + name
          + " and " + ContainerKind.SET.prefix + name, pos);
    }
    return variable;
  }

  /** Merges two descriptions of the same variable by conjunction. */
  private static Ast.NodeDescription merge(Ast.NodeDescription d0,
      Ast.NodeDescription d1) {
    if (d0.exp instanceof Ast.Nop) {
      return d1;
    }
    if (d1.exp instanceof Ast.Nop) {
      return d0;
    }
    return ast.nodeDescription(d0.pos.plus(d1.pos),
        ast.conjunction(d0.pos.plus(d1.pos), ImmutableList.of(d0.exp, d1.exp)));
  }

  // Node descriptions

  /** Converts a normalized description into disjuncts, and refines the
   * kind of its variable.
   *
   * <p>A disjunct that requires both a terminal and a nonterminal can never
   * match, and is dropped; if every disjunct is dropped, the variable has a
   * type conflict. */
  private List<DisjunctBuilder> analyze(NodeVariable variable,
      Ast.NodeDescription description) {
    final List<Ast.Exp> terms = description.exp instanceof Ast.Disjunction
        ? ((Ast.Disjunction) description.exp).args
        : ImmutableList.of(description.exp);
    final List<DisjunctBuilder> list = new ArrayList<>();
    NodeKind kind = null;
    boolean anyKind = false;
    int conflicts = 0;
    for (Ast.Exp term : terms) {
      final DisjunctBuilder b = new DisjunctBuilder();
      final List<Ast.Exp> atoms = term instanceof Ast.Conjunction
          ? ((Ast.Conjunction) term).args
          : ImmutableList.of(term);
      for (Ast.Exp atom : atoms) {
        b.add(atom);
      }
      if (b.contradictory) {
        ++conflicts;
        continue;
      }
      if (b.empty) {
        continue;
      }
      list.add(b);
      // The variable's kind is known if every disjunct implies the same
      // kind.
      if (b.kind == null) {
        anyKind = true;
      } else if (kind == null) {
        kind = b.kind;
      } else if (kind != b.kind) {
        anyKind = true;
      }
    }
    if (list.isEmpty() && conflicts > 0) {
      throw new TypeConflictException("node description of " + variable
          + " requires a node to be both terminal and nonterminal",
          description.pos);
    }
    if (kind != null && !anyKind) {
      variable.refine(kind, description.pos);
    }
    return list;
  }

  /** Builds one disjunct of a node query. */
  private class DisjunctBuilder {
    final List<NodeQuery.FeatureTest> tests = new ArrayList<>();
    final Map<String, String> equalities = new HashMap<>();
    @Nullable NodeKind kind;
    boolean contradictory;
    boolean empty;

    void add(Ast.Exp atom) {
      switch (atom.op) {
      case FEATURE_RECORD:
        final NodeKind k = ((Ast.FeatureRecord) atom).kind;
        refine(k);
        break;

      case FEATURE_CONSTRAINT:
        final Ast.FeatureConstraint constraint = (Ast.FeatureConstraint) atom;
        final NodeKind featureKind = schema.featureKind(constraint.feature);
        if (featureKind == null) {
          throw new UndefinedNameException(
              UndefinedNameException.Kind.FEATURE, constraint.feature,
              constraint.pos);
        }
        refine(featureKind);
        final List<Ast.Exp> values =
            constraint.value instanceof Ast.Conjunction
                ? ((Ast.Conjunction) constraint.value).args
                : ImmutableList.of(constraint.value);
        for (Ast.Exp value : values) {
          addTest(constraint, value);
        }
        break;

      case NOP:
        break;

      case NEGATION:
        // "!()" matches no node
        if (((Ast.Negation) atom).arg instanceof Ast.Nop) {
          empty = true;
          break;
        }
        throw new AssertionError("not normalized: " + atom);

      default:
        throw new AssertionError("not normalized: " + atom);
      }
    }

    private void refine(NodeKind k) {
      if (kind != null && kind != k) {
        contradictory = true;
      }
      kind = k;
    }

    private void addTest(Ast.FeatureConstraint constraint, Ast.Exp value) {
      boolean match = true;
      if (value instanceof Ast.Negation) {
        match = false;
        value = ((Ast.Negation) value).arg;
      }
      final NodeQuery.FeatureTest test;
      switch (value.op) {
      case STRING_LITERAL:
        final String s = ((Ast.StringLiteral) value).value;
        if (match) {
          final String previous = equalities.put(constraint.feature, s);
          if (previous != null && !previous.equals(s)) {
            throw new ConflictException("feature '" + constraint.feature
                + "' has two conflicting constraints", constraint.pos);
          }
        }
        test = new NodeQuery.FeatureTest(constraint.feature, match, s, false);
        break;

      case REGEX_LITERAL:
        final String regex = ((Ast.RegexLiteral) value).regex;
        try {
          Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
          throw new CompileException("invalid regular expression /" + regex
              + "/: " + e.getDescription(), value.pos);
        }
        test = new NodeQuery.FeatureTest(constraint.feature, match, regex,
            true);
        break;

      default:
        throw new AssertionError("not normalized: " + constraint);
      }
      if (!tests.contains(test)) {
        tests.add(test);
      }
    }

    /** Creates a disjunct for a variable of a given kind. A kind filter is
     * needed only if no feature test implies the kind. */
    NodeQuery.Disjunct build(NodeKind variableKind) {
      if (!tests.isEmpty()) {
        return new NodeQuery.Disjunct(tests, null);
      }
      return new NodeQuery.Disjunct(tests,
          kind != null ? kind
              : variableKind != NodeKind.UNKNOWN ? variableKind
              : null);
    }
  }

  /** Creates the node query of a variable, after its kind is final.
   * Disjuncts of the other kind cannot match, and are removed. */
  private NodeQuery nodeQuery(NodeVariable variable,
      List<NodeFilter> filters) {
    final List<NodeQuery.Disjunct> list = new ArrayList<>();
    for (DisjunctBuilder b : requireNonNull(disjuncts.get(variable))) {
      if (b.kind == null
          || variable.kind() == NodeKind.UNKNOWN
          || b.kind == variable.kind()) {
        list.add(b.build(variable.kind()));
      }
    }
    return new NodeQuery(list, filters);
  }

  // Predicates

  private void addPredicate(Ast.Predicate call) {
    final BuiltInPredicate builtIn = BuiltInPredicate.lookup(call.name);
    if (builtIn == null) {
      throw new UndefinedNameException(UndefinedNameException.Kind.PREDICATE,
          call.name, call.pos);
    }
    final Ast.VariableReference reference = builtIn.checkCall(call);
    final List<Integer> intArgs = new ArrayList<>();
    for (Ast.Exp arg : call.args.subList(1, call.args.size())) {
      intArgs.add(((Ast.IntLiteral) arg).value);
    }
    final NodeVariable variable =
        requireNonNull(variables.get(reference.name));
    final QueryPredicate predicate = builtIn.create(intArgs);
    if (!predicates(variable).contains(predicate)) {
      predicates(variable).add(predicate);
    }
  }

  // Constraints

  private QueryConstraint createConstraint(Ast.Relation relation) {
    final NodeVariable left = variableOf(relation.left);
    final NodeVariable right = variableOf(relation.right);
    if (left.equals(right)) {
      throw new CompileException("variable " + left
          + " cannot be related to itself", relation.pos);
    }
    final Constraint constraint =
        Constraints.create(relation, left.kind(), right.kind(), schema);
    final Pair<NodeKind, NodeKind> kinds = constraint.nodeKinds();
    left.refine(kinds.left, relation.left.pos);
    right.refine(kinds.right, relation.right.pos);
    return new QueryConstraint(left, right, constraint);
  }

  private NodeVariable variableOf(Ast.Exp operand) {
    return requireNonNull(
        variables.get(((Ast.VariableReference) operand).name));
  }

  /** Adds filters from a constraint to a variable. Filters are not pushed
   * onto Set variables, whose candidates must include every node that
   * matches their description. */
  private void pushDown(NodeVariable variable, Constraint constraint,
      List<NodeFilter> filters) {
    if (variable.isSet()) {
      return;
    }
    final List<QueryPredicate> list = predicates(variable);
    for (NodeFilter filter : filters) {
      final QueryPredicate predicate =
          QueryPredicate.node(constraint.operator, filter);
      if (!list.contains(predicate)) {
        list.add(predicate);
      }
    }
  }

  /** Chooses how to evaluate the query, from the connected components of
   * the graph whose vertices are variables and whose edges are
   * constraints. At most one component may have more than one variable. */
  private CompiledQuery.Strategy strategy(Pos pos,
      List<QueryConstraint> constraints) {
    if (constraints.isEmpty()) {
      return CompiledQuery.Strategy.CARTESIAN;
    }
    final Map<NodeVariable, NodeVariable> parents = new HashMap<>();
    for (QueryConstraint c : constraints) {
      parents.put(root(parents, c.left), root(parents, c.right));
    }
    final Map<NodeVariable, Integer> sizes = new HashMap<>();
    for (NodeVariable variable : variables.values()) {
      sizes.merge(root(parents, variable), 1, Integer::sum);
    }
    final long connected =
        sizes.values().stream().filter(size -> size > 1).count();
    if (connected > 1) {
      throw new UnsupportedQueryShapeException("query has " + connected
          + " groups of variables that are not related to each other", pos);
    }
    return CompiledQuery.Strategy.CONSTRAINT_CHECK;
  }

  private static NodeVariable root(Map<NodeVariable, NodeVariable> parents,
      NodeVariable variable) {
    NodeVariable v = variable;
    for (;;) {
      final NodeVariable parent = parents.get(v);
      if (parent == null || parent.equals(v)) {
        return v;
      }
      v = parent;
    }
  }
}

// End QueryFactory.java
