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

import org.apache.calcite.util.Pair;
import org.checkerframework.checker.nullness.qual.NonNull;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/** Position of a parse-tree node in the query text.
 *
 * <p>Lines and columns are 1-based; {@link #endColumn} is one past the last
 * character. {@link #file} does not take part in equality. */
public class Pos {
  public final String file;
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;

  public Pos(String file, int startLine, int startColumn,
      int endLine, int endColumn) {
    this.file = file;
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  /** Removes the two occurrences of a delimiter from a query, and returns
   * the query and the position of the text between them.
   *
   * <p>For example, {@code split("[cat=$\"NP\"$]", '$', "")} returns
   * {@code [cat="NP"]} and position 1.6-1.10. */
  public static Pair<@NonNull String, @NonNull Pos> split(String s,
      char delimiter, String file) {
    final int start = s.indexOf(delimiter);
    final int end = s.indexOf(delimiter, start + 1);
    checkArgument(start >= 0 && end > start
            && s.indexOf(delimiter, end + 1) < 0,
        "expected exactly two occurrences of delimiter, '%s'", delimiter);
    final String query = s.substring(0, start)
        + s.substring(start + 1, end)
        + s.substring(end + 1);
    final int[] from = lineColumn(query, start);
    final int[] to = lineColumn(query, end - 1);
    return Pair.of(query, new Pos(file, from[0], from[1], to[0], to[1]));
  }

  /** Returns the line and column of an offset into a string. */
  private static int[] lineColumn(String s, int offset) {
    int line = 1;
    int lineStart = 0;
    for (int i = 0; i < offset; i++) {
      if (s.charAt(i) == '\n') {
        ++line;
        lineStart = i + 1;
      }
    }
    return new int[] {line, offset - lineStart + 1};
  }

  /** Returns the position that spans a non-empty list of nodes. */
  public static Pos sum(List<? extends AstNode> nodes) {
    checkArgument(!nodes.isEmpty(), "no nodes");
    Pos pos = nodes.get(0).pos;
    for (AstNode node : nodes.subList(1, nodes.size())) {
      pos = pos.plus(node.pos);
    }
    return pos;
  }

  /** Returns a position that spans this and another position. */
  public Pos plus(Pos pos) {
    final boolean thisStarts = startLine < pos.startLine
        || startLine == pos.startLine && startColumn <= pos.startColumn;
    final boolean thisEnds = endLine > pos.endLine
        || endLine == pos.endLine && endColumn >= pos.endColumn;
    final Pos first = thisStarts ? this : pos;
    final Pos last = thisEnds ? this : pos;
    return new Pos(file, first.startLine, first.startColumn, last.endLine,
        last.endColumn);
  }

  @Override public int hashCode() {
    return Objects.hash(startLine, startColumn, endLine, endColumn);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
        && startLine == ((Pos) o).startLine
        && startColumn == ((Pos) o).startColumn
        && endLine == ((Pos) o).endLine
        && endColumn == ((Pos) o).endColumn;
  }

  @Override public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  /** Writes this position as "line.column", or "line.column-line.column"
   * if it spans more than one character, prefixed by the file name if
   * there is one. */
  public StringBuilder describeTo(StringBuilder buf) {
    if (!file.isEmpty()) {
      buf.append(file).append(':');
    }
    buf.append(startLine).append('.').append(startColumn);
    if (endLine != startLine || endColumn != startColumn + 1) {
      buf.append('-').append(endLine).append('.').append(endColumn);
    }
    return buf;
  }
}

// End Pos.java
