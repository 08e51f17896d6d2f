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

import static java.util.Objects.requireNonNull;

/** Constraint between two node variables of a query. */
public class QueryConstraint {
  public final NodeVariable left;
  public final NodeVariable right;
  public final Constraint constraint;

  QueryConstraint(NodeVariable left, NodeVariable right,
      Constraint constraint) {
    this.left = requireNonNull(left);
    this.right = requireNonNull(right);
    this.constraint = requireNonNull(constraint);
  }

  @Override public String toString() {
    return left + " " + constraint.operator + " " + right;
  }
}

// End QueryConstraint.java
