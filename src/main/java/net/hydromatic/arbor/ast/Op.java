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

/** Sub-types of {@link AstNode}. */
public enum Op {
  // literals
  STRING_LITERAL(true),
  REGEX_LITERAL(true),
  INT_LITERAL(true),

  // boolean connectives
  DISJUNCTION(" | ", 1),
  CONJUNCTION(" & ", 2),
  NEGATION("!", 3),

  // node descriptions
  FEATURE_CONSTRAINT(true),
  FEATURE_RECORD(true),
  NOP(true),
  NODE_DESCRIPTION(true),

  // node operands
  VARIABLE_DEFINITION(true),
  VARIABLE_REFERENCE(true),

  // terms
  PREDICATE(true),
  DOMINANCE(true),
  PRECEDENCE(true),
  CORNER(true),
  SEC_EDGE(true),
  SIBLING(true),

  QUERY;

  /** Padded name, e.g. " &amp; ". */
  public final String padded;
  /** Left precedence. */
  public final int left;
  /** Right precedence. */
  public final int right;

  Op() {
    this("", 0, 0);
  }

  Op(boolean atom) {
    this("", 99, 99);
    assert atom;
  }

  Op(String padded, int precedence) {
    this(padded, precedence * 2, precedence * 2 + 1);
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns whether this is one of the five relation operators. */
  public boolean isRelation() {
    switch (this) {
    case DOMINANCE:
    case PRECEDENCE:
    case CORNER:
    case SEC_EDGE:
    case SIBLING:
      return true;
    default:
      return false;
    }
  }

  /** Returns whether a node of this kind can be an operand of a relation or
   * the first argument of a predicate. */
  public boolean isNodeOperand() {
    switch (this) {
    case NODE_DESCRIPTION:
    case VARIABLE_DEFINITION:
    case VARIABLE_REFERENCE:
      return true;
    default:
      return false;
    }
  }
}

// End Op.java
