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

import java.io.StringReader;

import static com.google.common.base.Preconditions.checkArgument;

/** Utilities for parsing. */
public final class Parsers {
  private Parsers() {}

  /** Parses a query.
   *
   * @param query Query text
   * @return Parse tree
   * @throws ArborParseException if the query is malformed */
  public static Ast.Query parse(String query) {
    final ArborParserImpl parser =
        new ArborParserImpl(new StringReader(query));
    parser.zero("");
    return parser.queryEofSafe();
  }

  /** Given quoted string {@code "abc"} or {@code 'abc'} returns {@code abc}.
   * A backslash escapes the following character; {@code \t}, {@code \n} and
   * {@code \r} denote tab, newline and carriage return. */
  public static String unquoteString(String s) {
    checkArgument(s.length() >= 2);
    final char quote = s.charAt(0);
    checkArgument(quote == '"' || quote == '\'');
    checkArgument(s.charAt(s.length() - 1) == quote);
    s = s.substring(1, s.length() - 1);
    if (!s.contains("\\")) {
      // There are no escaped characters. Take the quick route.
      return s;
    }
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '\\') {
        checkArgument(++i < s.length(), "no character after \\");
        c = s.charAt(i);
        switch (c) {
        case 't':
          c = '\t';
          break;
        case 'n':
          c = '\n';
          break;
        case 'r':
          c = '\r';
          break;
        default:
          break;
        }
      }
      b.append(c);
    }
    return b.toString();
  }

  /** Given regex literal {@code /a\/b/} returns {@code a/b}. Escapes other
   * than an escaped slash are left for the regular expression engine. */
  public static String unquoteRegex(String s) {
    checkArgument(s.length() >= 2);
    checkArgument(s.charAt(0) == '/');
    checkArgument(s.charAt(s.length() - 1) == '/');
    return s.substring(1, s.length() - 1).replace("\\/", "/");
  }

  /** Given a variable token such as {@code #np} returns {@code np}. */
  public static String variableName(String s) {
    checkArgument(s.length() >= 2);
    return s.substring(1);
  }

  /** Parses a distance or predicate argument. */
  static int parseInt(String s, Pos pos) {
    try {
      return Integer.parseInt(s);
    } catch (NumberFormatException e) {
      throw new ArborParseException(e, pos);
    }
  }
}

// End Parsers.java
