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
package net.hydromatic.arbor.ast;

import java.util.ArrayList;
import java.util.List;

/** Visits and transforms syntax trees.
 *
 * <p>Each {@code visit} method returns the replacement for the node it was
 * given; the default implementations rebuild a node only if one of its
 * children was replaced. A sub-class stops descending into a sub-tree by
 * returning the node without visiting its children. */
public class Shuttle {
  protected <E extends AstNode> List<E> visitList(List<E> nodes) {
    final List<E> list = new ArrayList<>();
    for (E node : nodes) {
      //noinspection unchecked
      list.add((E) node.accept(this));
    }
    return list;
  }

  public Ast.Query visit(Ast.Query query) {
    return query.copy(query.exp.accept(this));
  }

  // literals

  public Ast.Exp visit(Ast.StringLiteral literal) {
    return literal; // leaf
  }

  public Ast.Exp visit(Ast.RegexLiteral literal) {
    return literal; // leaf
  }

  public Ast.Exp visit(Ast.IntLiteral literal) {
    return literal; // leaf
  }

  // boolean connectives

  public Ast.Exp visit(Ast.Conjunction conjunction) {
    return conjunction.copy(visitList(conjunction.args));
  }

  public Ast.Exp visit(Ast.Disjunction disjunction) {
    return disjunction.copy(visitList(disjunction.args));
  }

  public Ast.Exp visit(Ast.Negation negation) {
    return negation.copy(negation.arg.accept(this));
  }

  // node descriptions

  public Ast.Exp visit(Ast.FeatureConstraint constraint) {
    return constraint.copy(constraint.value.accept(this));
  }

  public Ast.Exp visit(Ast.FeatureRecord record) {
    return record; // leaf
  }

  public Ast.Exp visit(Ast.Nop nop) {
    return nop; // leaf
  }

  public Ast.NodeDescription visit(Ast.NodeDescription description) {
    return description.copy(description.exp.accept(this));
  }

  // node operands

  public Ast.Exp visit(Ast.VariableDefinition definition) {
    return definition.copy(definition.description.accept(this));
  }

  public Ast.Exp visit(Ast.VariableReference reference) {
    return reference; // leaf
  }

  // terms

  public Ast.Exp visit(Ast.Predicate predicate) {
    return predicate.copy(visitList(predicate.args));
  }

  protected Ast.Exp visitRelation(Ast.Relation relation) {
    return relation.copy(relation.left.accept(this),
        relation.right.accept(this));
  }

  public Ast.Exp visit(Ast.Dominance dominance) {
    return visitRelation(dominance);
  }

  public Ast.Exp visit(Ast.Precedence precedence) {
    return visitRelation(precedence);
  }

  public Ast.Exp visit(Ast.Corner corner) {
    return visitRelation(corner);
  }

  public Ast.Exp visit(Ast.SecEdge secEdge) {
    return visitRelation(secEdge);
  }

  public Ast.Exp visit(Ast.Sibling sibling) {
    return visitRelation(sibling);
  }
}

// End Shuttle.java
