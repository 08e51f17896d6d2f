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

/** Visits syntax trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  public void visit(Ast.Query query) {
    query.exp.accept(this);
  }

  // literals

  public void visit(Ast.StringLiteral literal) {}

  public void visit(Ast.RegexLiteral literal) {}

  public void visit(Ast.IntLiteral literal) {}

  // boolean connectives

  public void visit(Ast.Conjunction conjunction) {
    conjunction.args.forEach(this::accept);
  }

  public void visit(Ast.Disjunction disjunction) {
    disjunction.args.forEach(this::accept);
  }

  public void visit(Ast.Negation negation) {
    negation.arg.accept(this);
  }

  // node descriptions

  public void visit(Ast.FeatureConstraint constraint) {
    constraint.value.accept(this);
  }

  public void visit(Ast.FeatureRecord record) {}

  public void visit(Ast.Nop nop) {}

  public void visit(Ast.NodeDescription description) {
    description.exp.accept(this);
  }

  // node operands

  public void visit(Ast.VariableDefinition definition) {
    definition.description.accept(this);
  }

  public void visit(Ast.VariableReference reference) {}

  // terms

  public void visit(Ast.Predicate predicate) {
    predicate.args.forEach(this::accept);
  }

  protected void visitRelation(Ast.Relation relation) {
    relation.left.accept(this);
    relation.right.accept(this);
  }

  public void visit(Ast.Dominance dominance) {
    visitRelation(dominance);
  }

  public void visit(Ast.Precedence precedence) {
    visitRelation(precedence);
  }

  public void visit(Ast.Corner corner) {
    visitRelation(corner);
  }

  public void visit(Ast.SecEdge secEdge) {
    visitRelation(secEdge);
  }

  public void visit(Ast.Sibling sibling) {
    visitRelation(sibling);
  }
}

// End Visitor.java
