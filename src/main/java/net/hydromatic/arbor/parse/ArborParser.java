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

import net.hydromatic.arbor.ast.Ast;
import net.hydromatic.arbor.ast.Pos;

/** Parser for the tree query language. */
public interface ArborParser {
  /** Returns the position of the last token returned by the parser. */
  Pos pos();

  /** Parses a query followed by end-of-file. Throws
   * {@link ArborParseException} if the query is malformed. */
  Ast.Query queryEofSafe();
}

// End ArborParser.java
