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

import static java.util.Objects.requireNonNull;

/** A query refers to a name that the corpus or the predicate library does
 * not define. */
public class UndefinedNameException extends CompileException {
  public final Kind kind;
  public final String name;

  public UndefinedNameException(Kind kind, String name, Pos pos) {
    super(kind.description + " '" + name + "' is not defined", pos);
    this.kind = requireNonNull(kind);
    this.name = requireNonNull(name);
  }

  /** What sort of name was not found. */
  public enum Kind {
    FEATURE("feature"),
    PREDICATE("predicate"),
    EDGE_LABEL("edge label"),
    SECONDARY_EDGE_LABEL("secondary edge label");

    final String description;

    Kind(String description) {
      this.description = description;
    }
  }
}

// End UndefinedNameException.java
