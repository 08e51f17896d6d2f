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

import java.util.List;

/** Context for writing an AST out as query text. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node to the output. */
  public AstWriter append(AstNode node, int left, int right) {
    return node.unparse(this, left, right);
  }

  /** Appends a call to an n-ary infix operator, such as "a &amp; b &amp; c",
   * adding parentheses if the context binds tighter than the operator. */
  public AstWriter infix(int left, List<? extends AstNode> args, Op op,
      int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, args, op, 0).append(")");
    }
    for (int i = 0; i < args.size(); i++) {
      if (i > 0) {
        append(op.padded);
      }
      args.get(i).unparse(this, i == 0 ? left : op.right,
          i == args.size() - 1 ? right : op.left);
    }
    return this;
  }

  /** Appends a call to a prefix operator, such as "!a". */
  public AstWriter prefix(int left, Op op, AstNode a, int right) {
    if (left > op.left || op.right < right) {
      return append("(").prefix(0, op, a, 0).append(")");
    }
    append(op.padded);
    a.unparse(this, op.left, right);
    return this;
  }

  /** Appends a string literal, quoted with double-quotes and escaped. */
  public AstWriter quoted(String s) {
    b.append('"');
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (c == '"' || c == '\\') {
        b.append('\\');
      }
      b.append(c);
    }
    b.append('"');
    return this;
  }

  /** Appends a regular expression between slashes. */
  public AstWriter regex(String regex) {
    b.append('/').append(regex.replace("/", "\\/")).append('/');
    return this;
  }

  @Override public String toString() {
    return b.toString();
  }
}

// End AstWriter.java
