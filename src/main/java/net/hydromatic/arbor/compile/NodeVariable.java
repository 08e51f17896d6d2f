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

import net.hydromatic.arbor.ast.Pos;
import net.hydromatic.arbor.type.ContainerKind;
import net.hydromatic.arbor.type.NodeKind;

import static java.util.Objects.requireNonNull;

/** Variable in a query that binds to nodes.
 *
 * <p>Identity is the name. The kind starts as {@link NodeKind#UNKNOWN} and
 * is refined as the query is compiled; once it is terminal or nonterminal
 * it cannot change to the other. */
public class NodeVariable {
  public final String name;
  public final ContainerKind container;
  private NodeKind kind = NodeKind.UNKNOWN;

  public NodeVariable(String name, ContainerKind container) {
    this.name = requireNonNull(name);
    this.container = requireNonNull(container);
  }

  public NodeKind kind() {
    return kind;
  }

  public boolean isSet() {
    return container == ContainerKind.SET;
  }

  /** Returns whether the name was generated for an anonymous node
   * description. */
  public boolean isAnonymous() {
    return NameGenerator.isGenerated(name);
  }

  /** Narrows the kind of this variable.
   *
   * <p>Refining to {@link NodeKind#UNKNOWN}, or to the current kind, has no
   * effect.
   *
   * @throws TypeConflictException if the variable already has the other
   * kind */
  public void refine(NodeKind kind, Pos pos) {
    if (kind == NodeKind.UNKNOWN || kind == this.kind) {
      return;
    }
    if (this.kind != NodeKind.UNKNOWN) {
      throw new TypeConflictException("variable " + this
          + " cannot be both " + describe(this.kind) + " and "
          + describe(kind), pos);
    }
    this.kind = kind;
  }

  private static String describe(NodeKind kind) {
    return kind == NodeKind.TERMINAL ? "terminal" : "nonterminal";
  }

  @Override public String toString() {
    return container.prefix + name;
  }

  @Override public int hashCode() {
    return name.hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof NodeVariable
        && name.equals(((NodeVariable) o).name);
  }
}

// End NodeVariable.java
