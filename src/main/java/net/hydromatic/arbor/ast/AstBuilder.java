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

import net.hydromatic.arbor.type.ContainerKind;
import net.hydromatic.arbor.type.NodeKind;

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /** The singleton instance of the AST builder. The short name is
   * convenient for use via 'import static', but checkstyle does not
   * approve. */
  // CHECKSTYLE: IGNORE 1
  ast;

  public Ast.Query query(Pos pos, Ast.Exp exp) {
    return new Ast.Query(pos, exp);
  }

  public Ast.StringLiteral stringLiteral(Pos pos, String value) {
    return new Ast.StringLiteral(pos, value);
  }

  public Ast.RegexLiteral regexLiteral(Pos pos, String regex) {
    return new Ast.RegexLiteral(pos, regex);
  }

  public Ast.IntLiteral intLiteral(Pos pos, int value) {
    return new Ast.IntLiteral(pos, value);
  }

  /** Creates a conjunction of two or more expressions. */
  public Ast.Conjunction conjunction(Pos pos, List<? extends Ast.Exp> args) {
    return new Ast.Conjunction(pos, ImmutableList.copyOf(args));
  }

  /** Creates a disjunction of two or more expressions. */
  public Ast.Disjunction disjunction(Pos pos, List<? extends Ast.Exp> args) {
    return new Ast.Disjunction(pos, ImmutableList.copyOf(args));
  }

  /** Creates a conjunction, or returns the sole argument if there is only
   * one. */
  public Ast.Exp and(Pos pos, List<? extends Ast.Exp> args) {
    return args.size() == 1 ? args.get(0) : conjunction(pos, args);
  }

  /** Creates a disjunction, or returns the sole argument if there is only
   * one. */
  public Ast.Exp or(Pos pos, List<? extends Ast.Exp> args) {
    return args.size() == 1 ? args.get(0) : disjunction(pos, args);
  }

  public Ast.Negation negation(Pos pos, Ast.Exp arg) {
    return new Ast.Negation(pos, arg);
  }

  public Ast.FeatureConstraint featureConstraint(Pos pos, String feature,
      Ast.Exp value) {
    return new Ast.FeatureConstraint(pos, feature, value);
  }

  public Ast.FeatureRecord featureRecord(Pos pos, NodeKind kind) {
    return new Ast.FeatureRecord(pos, kind);
  }

  public Ast.Nop nop(Pos pos) {
    return new Ast.Nop(pos);
  }

  public Ast.NodeDescription nodeDescription(Pos pos, Ast.Exp exp) {
    return new Ast.NodeDescription(pos, exp);
  }

  public Ast.VariableDefinition variableDefinition(Pos pos, String name,
      ContainerKind container, Ast.NodeDescription description) {
    return new Ast.VariableDefinition(pos, name, container, description);
  }

  public Ast.VariableReference variableReference(Pos pos, String name,
      ContainerKind container) {
    return new Ast.VariableReference(pos, name, container);
  }

  public Ast.Predicate predicate(Pos pos, String name,
      List<? extends Ast.Exp> args) {
    return new Ast.Predicate(pos, name, ImmutableList.copyOf(args));
  }

  public Ast.Dominance dominance(Pos pos, Ast.Exp left, Ast.Exp right,
      boolean negated, Ast.Range range, @Nullable String label) {
    return new Ast.Dominance(pos, left, right, negated, range, label);
  }

  public Ast.Precedence precedence(Pos pos, Ast.Exp left, Ast.Exp right,
      boolean negated, Ast.Range range) {
    return new Ast.Precedence(pos, left, right, negated, range);
  }

  public Ast.Corner corner(Pos pos, Ast.Exp left, Ast.Exp right,
      boolean negated, Ast.Side side) {
    return new Ast.Corner(pos, left, right, negated, side);
  }

  public Ast.SecEdge secEdge(Pos pos, Ast.Exp left, Ast.Exp right,
      boolean negated, @Nullable String label) {
    return new Ast.SecEdge(pos, left, right, negated, label);
  }

  public Ast.Sibling sibling(Pos pos, Ast.Exp left, Ast.Exp right,
      boolean negated, boolean ordered) {
    return new Ast.Sibling(pos, left, right, negated, ordered);
  }
}

// End AstBuilder.java
