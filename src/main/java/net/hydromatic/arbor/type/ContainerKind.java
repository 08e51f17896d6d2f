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
package net.hydromatic.arbor.type;

/** Whether a variable binds to one node per match or to all matching nodes
 * of a tree. */
public enum ContainerKind {
  /** Variable such as {@code #x}; binds to exactly one node. */
  SINGLE('#'),
  /** Variable such as {@code %x}; binds to the set of all candidate nodes
   * in a tree. */
  SET('%');

  public final char prefix;

  ContainerKind(char prefix) {
    this.prefix = prefix;
  }

  /** Returns the container kind for a variable token such as "#x". */
  public static ContainerKind ofPrefix(char c) {
    for (ContainerKind kind : values()) {
      if (kind.prefix == c) {
        return kind;
      }
    }
    throw new IllegalArgumentException("not a variable prefix: " + c);
  }
}

// End ContainerKind.java
