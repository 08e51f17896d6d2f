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
package net.hydromatic.arbor.parse;

import net.hydromatic.arbor.ast.AstNode;
import net.hydromatic.arbor.ast.Pos;

import static java.util.Objects.requireNonNull;

/** Tracks the position of a grammar production while it is being parsed.
 *
 * <p>The grammar creates a span at the first token of a production, then
 * calls {@link #end} with the last token or child node to get the position
 * of the whole production. */
public final class Span {
  private Pos pos;

  private Span(Pos pos) {
    this.pos = requireNonNull(pos);
  }

  /** Creates a Span that starts at a given position. */
  public static Span of(Pos pos) {
    return new Span(pos);
  }

  /** Returns the position covered so far. */
  public Pos pos() {
    return pos;
  }

  /** Extends this span to the last token read by a parser, and returns the
   * position covered. */
  public Pos end(ArborParser parser) {
    pos = pos.plus(parser.pos());
    return pos;
  }

  /** Extends this span to the end of a node, and returns the position
   * covered. */
  public Pos end(AstNode node) {
    pos = pos.plus(node.pos);
    return pos;
  }
}

// End Span.java
