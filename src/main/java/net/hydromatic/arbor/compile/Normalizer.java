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
import net.hydromatic.arbor.ast.AstNode;
import net.hydromatic.arbor.ast.Shuttle;
import net.hydromatic.arbor.store.CorpusSchema;
import net.hydromatic.arbor.type.NodeKind;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.util.ArrayList;
import java.util.List;

import static net.hydromatic.arbor.ast.AstBuilder.ast;

import static java.util.Objects.requireNonNull;

/** Converts queries and node descriptions to a normal form.
 *
 * <p>Normalization has two steps. The first pushes negations down to the
 * leaves, using De Morgan's laws, eliminating double negations, and
 * rewriting a negated feature constraint as
 * <code>!(f=v) &rarr; [T'] | f!=v</code>, where {@code T'} is the kind of
 * node that does not have feature {@code f}. The second step converts to
 * disjunctive normal form, and splits each feature constraint whose value is
 * a disjunction into a disjunction of feature constraints.
 *
 * <p>Normalizing a normalized expression returns an equal expression. */
public class Normalizer {
  private final CorpusSchema schema;
  private final NegationPusher negationPusher = new NegationPusher();
  private final ValueSplitter valueSplitter = new ValueSplitter();
  private final DescriptionNormalizer descriptionNormalizer =
      new DescriptionNormalizer();

  public Normalizer(CorpusSchema schema) {
    this.schema = requireNonNull(schema);
  }

  /** Normalizes a query: flattens its top-level conjunction and normalizes
   * each node description in it. */
  public Ast.Query normalizeQuery(Ast.Query query) {
    final Ast.Query query2 = query.accept(descriptionNormalizer);
    return query2.copy(toDnf(query2.exp));
  }

  /** Normalizes a node description. */
  public Ast.NodeDescription normalizeDescription(
      Ast.NodeDescription description) {
    return description.copy(normalize(description.exp));
  }

  /** Normalizes the boolean expression inside a node description. */
  public Ast.Exp normalize(Ast.Exp exp) {
    return toDnf(exp.accept(negationPusher).accept(valueSplitter));
  }

  /** Converts an expression whose negations have been pushed to the leaves
   * into disjunctive normal form. Feature constraints are atoms.
   *
   * <p>Distribution preserves order:
   * <code>(A | B) &amp; C &rarr; (A &amp; C) | (B &amp; C)</code>. */
  static Ast.Exp toDnf(Ast.Exp exp) {
    switch (exp.op) {
    case DISJUNCTION:
      final List<Ast.Exp> disjuncts = new ArrayList<>();
      for (Ast.Exp arg : ((Ast.Disjunction) exp).args) {
        addDisjuncts(disjuncts, toDnf(arg));
      }
      return ((Ast.Disjunction) exp).copy(disjuncts);

    case CONJUNCTION:
      final List<List<Ast.Exp>> choices = new ArrayList<>();
      boolean distribute = false;
      for (Ast.Exp arg : ((Ast.Conjunction) exp).args) {
        final Ast.Exp arg2 = toDnf(arg);
        if (arg2 instanceof Ast.Disjunction) {
          choices.add(((Ast.Disjunction) arg2).args);
          distribute = true;
        } else {
          choices.add(ImmutableList.of(arg2));
        }
      }
      if (!distribute) {
        return ((Ast.Conjunction) exp)
            .copy(flattenConjunction(Lists.transform(choices, l -> l.get(0))));
      }
      final List<Ast.Exp> terms = new ArrayList<>();
      for (List<Ast.Exp> combination : Lists.cartesianProduct(choices)) {
        terms.add(ast.and(exp.pos, flattenConjunction(combination)));
      }
      return ast.disjunction(exp.pos, terms);

    default:
      return exp;
    }
  }

  private static void addDisjuncts(List<Ast.Exp> list, Ast.Exp exp) {
    if (exp instanceof Ast.Disjunction) {
      list.addAll(((Ast.Disjunction) exp).args);
    } else {
      list.add(exp);
    }
  }

  private static List<Ast.Exp> flattenConjunction(List<Ast.Exp> args) {
    final List<Ast.Exp> list = new ArrayList<>();
    for (Ast.Exp arg : args) {
      if (arg instanceof Ast.Conjunction) {
        list.addAll(((Ast.Conjunction) arg).args);
      } else {
        list.add(arg);
      }
    }
    return list;
  }

  /** Pushes negations down to atoms. */
  private class NegationPusher extends Shuttle {
    @Override public Ast.Exp visit(Ast.Negation negation) {
      final Ast.Exp negated = negate(negation);
      return negated instanceof Ast.Negation
          ? negated
          : negated.accept(this);
    }

    /** Returns the negation of the argument of a negation, one level
     * deep; or the negation itself if it cannot be pushed down. */
    private Ast.Exp negate(Ast.Negation negation) {
      final Ast.Exp arg = negation.arg;
      switch (arg.op) {
      case NEGATION:
        return ((Ast.Negation) arg).arg;

      case CONJUNCTION:
        return ast.disjunction(negation.pos,
            negateAll(negation, ((Ast.Conjunction) arg).args));

      case DISJUNCTION:
        return ast.conjunction(negation.pos,
            negateAll(negation, ((Ast.Disjunction) arg).args));

      case FEATURE_RECORD:
        return ast.featureRecord(negation.pos,
            ((Ast.FeatureRecord) arg).kind.flip());

      case FEATURE_CONSTRAINT:
        // A node that lacks a feature satisfies the negation, so
        // "!(f=v)" is "nodes of the other kind, or f!=v".
        final Ast.FeatureConstraint constraint = (Ast.FeatureConstraint) arg;
        final NodeKind kind = schema.featureKind(constraint.feature);
        if (kind == null) {
          throw new UndefinedNameException(
              UndefinedNameException.Kind.FEATURE, constraint.feature,
              constraint.pos);
        }
        return ast.disjunction(negation.pos,
            ImmutableList.of(ast.featureRecord(negation.pos, kind.flip()),
                ast.featureConstraint(constraint.pos, constraint.feature,
                    ast.negation(constraint.value.pos, constraint.value))));

      default:
        // Literal or empty description; cannot be pushed further.
        return negation;
      }
    }

    private List<Ast.Exp> negateAll(AstNode negation, List<Ast.Exp> args) {
      final List<Ast.Exp> list = new ArrayList<>();
      for (Ast.Exp arg : args) {
        list.add(ast.negation(negation.pos, arg));
      }
      return list;
    }
  }

  /** Converts each feature constraint's value to disjunctive normal form,
   * and splits a constraint whose value is a disjunction,
   * <code>f=(a | b) &rarr; f=a | f=b</code>. */
  private static class ValueSplitter extends Shuttle {
    @Override public Ast.Exp visit(Ast.FeatureConstraint constraint) {
      final Ast.Exp value = toDnf(constraint.value);
      if (value instanceof Ast.Disjunction) {
        final List<Ast.Exp> list = new ArrayList<>();
        for (Ast.Exp arg : ((Ast.Disjunction) value).args) {
          list.add(ast.featureConstraint(constraint.pos, constraint.feature,
              arg));
        }
        return ast.disjunction(constraint.pos, list);
      }
      return constraint.copy(value);
    }
  }

  /** Normalizes every node description in a query. */
  private class DescriptionNormalizer extends Shuttle {
    @Override public Ast.NodeDescription visit(
        Ast.NodeDescription description) {
      return normalizeDescription(description);
    }
  }
}

// End Normalizer.java
