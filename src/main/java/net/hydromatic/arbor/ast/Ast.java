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
import java.util.Objects;

import static net.hydromatic.arbor.ast.AstBuilder.ast;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Base class of all nodes that can occur in a query: terms, boolean
   * connectives, feature expressions and values. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }

    @Override public abstract Exp accept(Shuttle shuttle);
  }

  /** Parse tree node of a query; the root of every parsed AST. */
  public static class Query extends AstNode {
    public final Exp exp;

    Query(Pos pos, Exp exp) {
      super(pos, Op.QUERY);
      this.exp = requireNonNull(exp);
    }

    /** Returns the top-level terms of this query. */
    public List<Exp> terms() {
      return exp instanceof Conjunction
          ? ((Conjunction) exp).args
          : ImmutableList.of(exp);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return exp.unparse(w, left, right);
    }

    @Override public Query accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Query copy(Exp exp) {
      return this.exp.equals(exp) ? this : ast.query(pos, exp);
    }

    @Override public int hashCode() {
      return exp.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Query
          && exp.equals(((Query) o).exp);
    }
  }

  /** String literal, such as {@code "NP"}. */
  public static class StringLiteral extends Exp {
    public final String value;

    StringLiteral(Pos pos, String value) {
      super(pos, Op.STRING_LITERAL);
      this.value = requireNonNull(value);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.quoted(value);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public int hashCode() {
      return value.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof StringLiteral
          && value.equals(((StringLiteral) o).value);
    }
  }

  /** Regular expression literal, such as {@code /N.* /}. The expression
   * must match the whole feature value. */
  public static class RegexLiteral extends Exp {
    public final String regex;

    RegexLiteral(Pos pos, String regex) {
      super(pos, Op.REGEX_LITERAL);
      this.regex = requireNonNull(regex);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.regex(regex);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public int hashCode() {
      return regex.hashCode() + 1;
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof RegexLiteral
          && regex.equals(((RegexLiteral) o).regex);
    }
  }

  /** Integer literal; occurs only as a predicate argument. */
  public static class IntLiteral extends Exp {
    public final int value;

    IntLiteral(Pos pos, int value) {
      super(pos, Op.INT_LITERAL);
      this.value = value;
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(Integer.toString(value));
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public int hashCode() {
      return value;
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof IntLiteral
          && value == ((IntLiteral) o).value;
    }
  }

  /** Boolean connective with two or more arguments. */
  public abstract static class Connective extends Exp {
    public final ImmutableList<Exp> args;

    Connective(Pos pos, Op op, ImmutableList<Exp> args) {
      super(pos, op);
      this.args = requireNonNull(args);
      checkArgument(args.size() >= 2, "connective needs two arguments");
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, args, op, right);
    }

    /** Creates a connective of the same kind with different arguments. */
    public abstract Exp copy(List<Exp> args);

    @Override public int hashCode() {
      return Objects.hash(op, args);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Connective
          && op == ((Connective) o).op
          && args.equals(((Connective) o).args);
    }
  }

  /** Conjunction, "a &amp; b". */
  public static class Conjunction extends Connective {
    Conjunction(Pos pos, ImmutableList<Exp> args) {
      super(pos, Op.CONJUNCTION, args);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp copy(List<Exp> args) {
      return this.args.equals(args) ? this : ast.conjunction(pos, args);
    }
  }

  /** Disjunction, "a | b". */
  public static class Disjunction extends Connective {
    Disjunction(Pos pos, ImmutableList<Exp> args) {
      super(pos, Op.DISJUNCTION, args);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp copy(List<Exp> args) {
      return this.args.equals(args) ? this : ast.disjunction(pos, args);
    }
  }

  /** Negation, "!a". */
  public static class Negation extends Exp {
    public final Exp arg;

    Negation(Pos pos, Exp arg) {
      super(pos, Op.NEGATION);
      this.arg = requireNonNull(arg);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, arg, right);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Negation copy(Exp arg) {
      return this.arg.equals(arg) ? this : ast.negation(pos, arg);
    }

    @Override public int hashCode() {
      return ~arg.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Negation
          && arg.equals(((Negation) o).arg);
    }
  }

  /** Constraint on the value of a feature, such as {@code cat="NP"} or
   * {@code pos!=/V.* /}. The value is a boolean expression of string and
   * regex literals; "!=" is represented as a negated value. */
  public static class FeatureConstraint extends Exp {
    public final String feature;
    public final Exp value;

    FeatureConstraint(Pos pos, String feature, Exp value) {
      super(pos, Op.FEATURE_CONSTRAINT);
      this.feature = requireNonNull(feature);
      this.value = requireNonNull(value);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append(feature);
      if (value instanceof Negation) {
        return w.append("!=").append(((Negation) value).arg, 98, 0);
      }
      return w.append("=").append(value, 98, 0);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public FeatureConstraint copy(Exp value) {
      return this.value.equals(value)
          ? this
          : ast.featureConstraint(pos, feature, value);
    }

    @Override public int hashCode() {
      return Objects.hash(feature, value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof FeatureConstraint
          && feature.equals(((FeatureConstraint) o).feature)
          && value.equals(((FeatureConstraint) o).value);
    }
  }

  /** Feature record "T" (any terminal) or "NT" (any nonterminal). */
  public static class FeatureRecord extends Exp {
    public final NodeKind kind;

    FeatureRecord(Pos pos, NodeKind kind) {
      super(pos, Op.FEATURE_RECORD);
      this.kind = requireNonNull(kind);
      checkArgument(kind != NodeKind.UNKNOWN);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(requireNonNull(kind.symbol));
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public int hashCode() {
      return kind.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof FeatureRecord
          && kind == ((FeatureRecord) o).kind;
    }
  }

  /** Empty feature expression, as in "[]"; matches every node. */
  public static class Nop extends Exp {
    Nop(Pos pos) {
      super(pos, Op.NOP);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w;
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public int hashCode() {
      return Op.NOP.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o instanceof Nop;
    }
  }

  /** Node description, such as {@code [cat="NP" & !(case="nom")]}. */
  public static class NodeDescription extends Exp {
    public final Exp exp;

    NodeDescription(Pos pos, Exp exp) {
      super(pos, Op.NODE_DESCRIPTION);
      this.exp = requireNonNull(exp);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("[").append(exp, 0, 0).append("]");
    }

    @Override public NodeDescription accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public NodeDescription copy(Exp exp) {
      return this.exp.equals(exp) ? this : ast.nodeDescription(pos, exp);
    }

    @Override public int hashCode() {
      return exp.hashCode() * 31 + 7;
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof NodeDescription
          && exp.equals(((NodeDescription) o).exp);
    }
  }

  /** Definition of a variable, such as {@code #np:[cat="NP"]}. */
  public static class VariableDefinition extends Exp {
    public final String name;
    public final ContainerKind container;
    public final NodeDescription description;

    VariableDefinition(Pos pos, String name, ContainerKind container,
        NodeDescription description) {
      super(pos, Op.VARIABLE_DEFINITION);
      this.name = requireNonNull(name);
      this.container = requireNonNull(container);
      this.description = requireNonNull(description);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(String.valueOf(container.prefix)).append(name)
          .append(":").append(description, 0, 0);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public VariableDefinition copy(NodeDescription description) {
      return this.description.equals(description)
          ? this
          : ast.variableDefinition(pos, name, container, description);
    }

    @Override public int hashCode() {
      return Objects.hash(name, container, description);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof VariableDefinition
          && name.equals(((VariableDefinition) o).name)
          && container == ((VariableDefinition) o).container
          && description.equals(((VariableDefinition) o).description);
    }
  }

  /** Reference to a variable, such as {@code #np} or {@code %words}. */
  public static class VariableReference extends Exp {
    public final String name;
    public final ContainerKind container;

    VariableReference(Pos pos, String name, ContainerKind container) {
      super(pos, Op.VARIABLE_REFERENCE);
      this.name = requireNonNull(name);
      this.container = requireNonNull(container);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(String.valueOf(container.prefix)).append(name);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public int hashCode() {
      return Objects.hash(name, container);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof VariableReference
          && name.equals(((VariableReference) o).name)
          && container == ((VariableReference) o).container;
    }
  }

  /** Call to a predicate, such as {@code arity(#np, 2, 3)}. */
  public static class Predicate extends Exp {
    public final String name;
    public final ImmutableList<Exp> args;

    Predicate(Pos pos, String name, ImmutableList<Exp> args) {
      super(pos, Op.PREDICATE);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append(name).append("(");
      for (int i = 0; i < args.size(); i++) {
        if (i > 0) {
          w.append(", ");
        }
        w.append(args.get(i), 0, 0);
      }
      return w.append(")");
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Predicate copy(List<Exp> args) {
      return this.args.equals(args) ? this : ast.predicate(pos, name, args);
    }

    @Override public int hashCode() {
      return Objects.hash(name, args);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Predicate
          && name.equals(((Predicate) o).name)
          && args.equals(((Predicate) o).args);
    }
  }

  /** Distance range of a dominance or precedence operator. */
  public static class Range {
    /** Range of an operator with no distance modifier, e.g. "&gt;". */
    public static final Range IMMEDIATE = new Range(1, 1);
    /** Range of an operator with the "*" modifier, e.g. "&gt;*". */
    public static final Range UNBOUNDED = new Range(1, Integer.MAX_VALUE);

    public final int min;
    public final int max;

    private Range(int min, int max) {
      this.min = min;
      this.max = max;
    }

    /** Creates a range; the caller is responsible for validating it. */
    public static Range of(int min, int max) {
      if (min == 1 && max == 1) {
        return IMMEDIATE;
      }
      if (min == 1 && max == Integer.MAX_VALUE) {
        return UNBOUNDED;
      }
      return new Range(min, max);
    }

    public boolean isImmediate() {
      return min == 1 && max == 1;
    }

    public boolean isUnbounded() {
      return max == Integer.MAX_VALUE;
    }

    /** Returns whether a distance is within this range. */
    public boolean contains(int distance) {
      return min <= distance && distance <= max;
    }

    /** Returns the modifier that follows an operator, for example "" for
     * {@link #IMMEDIATE}, "*" for {@link #UNBOUNDED}, "2" or "2,4". */
    public String modifier() {
      if (isImmediate()) {
        return "";
      } else if (min == 1 && isUnbounded()) {
        return "*";
      } else if (min == max) {
        return Integer.toString(min);
      } else {
        return min + "," + max;
      }
    }

    @Override public String toString() {
      return "[" + min + ", " + (isUnbounded() ? "inf" : max) + "]";
    }

    @Override public int hashCode() {
      return min * 31 + max;
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Range
          && min == ((Range) o).min
          && max == ((Range) o).max;
    }
  }

  /** Side of a corner operator. */
  public enum Side {
    LEFT("l"),
    RIGHT("r");

    public final String symbol;

    Side(String symbol) {
      this.symbol = symbol;
    }
  }

  /** Binary relation between two node operands. */
  public abstract static class Relation extends Exp {
    public final Exp left;
    public final Exp right;
    public final boolean negated;

    Relation(Pos pos, Op op, Exp left, Exp right, boolean negated) {
      super(pos, op);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
      this.negated = negated;
      checkArgument(op.isRelation());
    }

    /** Returns the operator as written, for example "!&gt;*" or "$.*". */
    public abstract String operator();

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(this.left, 0, 0)
          .append(" ").append(operator()).append(" ")
          .append(this.right, 0, 0);
    }

    /** Creates a relation of the same kind and modifiers with different
     * operands. */
    public abstract Relation copy(Exp left, Exp right);

    String negation() {
      return negated ? "!" : "";
    }

    @Override public int hashCode() {
      return Objects.hash(op, left, right, negated, operator());
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Relation
          && op == ((Relation) o).op
          && negated == ((Relation) o).negated
          && left.equals(((Relation) o).left)
          && right.equals(((Relation) o).right)
          && sameModifiers((Relation) o);
    }

    abstract boolean sameModifiers(Relation o);
  }

  /** Dominance, such as {@code #a > #b}, {@code #a >* #b},
   * {@code #a >2,3 #b} or {@code #a >HD #b}. */
  public static class Dominance extends Relation {
    public final Range range;
    public final @Nullable String label;

    Dominance(Pos pos, Exp left, Exp right, boolean negated, Range range,
        @Nullable String label) {
      super(pos, Op.DOMINANCE, left, right, negated);
      this.range = requireNonNull(range);
      this.label = label;
      checkArgument(label == null || range.isImmediate(),
          "labeled dominance must be immediate");
    }

    @Override public String operator() {
      return negation() + ">" + (label != null ? label : range.modifier());
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Dominance copy(Exp left, Exp right) {
      return this.left.equals(left) && this.right.equals(right)
          ? this
          : ast.dominance(pos, left, right, negated, range, label);
    }

    @Override boolean sameModifiers(Relation o) {
      return range.equals(((Dominance) o).range)
          && Objects.equals(label, ((Dominance) o).label);
    }
  }

  /** Precedence, such as {@code #a . #b} or {@code #a .* #b}. */
  public static class Precedence extends Relation {
    public final Range range;

    Precedence(Pos pos, Exp left, Exp right, boolean negated, Range range) {
      super(pos, Op.PRECEDENCE, left, right, negated);
      this.range = requireNonNull(range);
    }

    @Override public String operator() {
      return negation() + "." + range.modifier();
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Precedence copy(Exp left, Exp right) {
      return this.left.equals(left) && this.right.equals(right)
          ? this
          : ast.precedence(pos, left, right, negated, range);
    }

    @Override boolean sameModifiers(Relation o) {
      return range.equals(((Precedence) o).range);
    }
  }

  /** Corner relation, such as {@code #np >@l #word}. */
  public static class Corner extends Relation {
    public final Side side;

    Corner(Pos pos, Exp left, Exp right, boolean negated, Side side) {
      super(pos, Op.CORNER, left, right, negated);
      this.side = requireNonNull(side);
    }

    @Override public String operator() {
      return negation() + ">@" + side.symbol;
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Corner copy(Exp left, Exp right) {
      return this.left.equals(left) && this.right.equals(right)
          ? this
          : ast.corner(pos, left, right, negated, side);
    }

    @Override boolean sameModifiers(Relation o) {
      return side == ((Corner) o).side;
    }
  }

  /** Secondary edge, such as {@code #a >~ #b} or {@code #a >~RE #b}. */
  public static class SecEdge extends Relation {
    public final @Nullable String label;

    SecEdge(Pos pos, Exp left, Exp right, boolean negated,
        @Nullable String label) {
      super(pos, Op.SEC_EDGE, left, right, negated);
      this.label = label;
    }

    @Override public String operator() {
      return negation() + ">~" + (label == null ? "" : label);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public SecEdge copy(Exp left, Exp right) {
      return this.left.equals(left) && this.right.equals(right)
          ? this
          : ast.secEdge(pos, left, right, negated, label);
    }

    @Override boolean sameModifiers(Relation o) {
      return Objects.equals(label, ((SecEdge) o).label);
    }
  }

  /** Sibling relation, such as {@code #a $ #b}, {@code #a $.* #b} (ordered)
   * or {@code #a !$ #b}. */
  public static class Sibling extends Relation {
    public final boolean ordered;

    Sibling(Pos pos, Exp left, Exp right, boolean negated, boolean ordered) {
      super(pos, Op.SIBLING, left, right, negated);
      this.ordered = ordered;
      checkArgument(!(negated && ordered),
          "ordered sibling operator cannot be negated");
    }

    @Override public String operator() {
      return negation() + "$" + (ordered ? ".*" : "");
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Sibling copy(Exp left, Exp right) {
      return this.left.equals(left) && this.right.equals(right)
          ? this
          : ast.sibling(pos, left, right, negated, ordered);
    }

    @Override boolean sameModifiers(Relation o) {
      return ordered == ((Sibling) o).ordered;
    }
  }
}

// End Ast.java
