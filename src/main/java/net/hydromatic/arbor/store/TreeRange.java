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
package net.hydromatic.arbor.store;

import static com.google.common.base.Preconditions.checkArgument;

/** Contiguous range of tree ids, from {@link #lower} inclusive to
 * {@link #upper} exclusive. */
public class TreeRange {
  /** Range that contains every tree. */
  public static final TreeRange ALL = new TreeRange(0, Integer.MAX_VALUE);

  public final int lower;
  public final int upper;

  private TreeRange(int lower, int upper) {
    checkArgument(0 <= lower && lower <= upper, "invalid range");
    this.lower = lower;
    this.upper = upper;
  }

  public static TreeRange of(int lower, int upper) {
    return lower == 0 && upper == Integer.MAX_VALUE
        ? ALL
        : new TreeRange(lower, upper);
  }

  /** Returns one of {@code parts} equal partitions of a corpus with
   * {@code treeCount} trees.
   *
   * <p>Each part has {@code treeCount / parts} trees; the first part starts
   * at 0, and the last part has no upper bound, so the parts cover every
   * tree even if the count is not divisible. */
  public static TreeRange partition(int treeCount, int part, int parts) {
    checkArgument(parts > 0 && 0 <= part && part < parts,
        "invalid partition %s of %s", part, parts);
    final int size = treeCount / parts;
    final int lower = part == 0 ? 0 : part * size;
    final int upper = part + 1 < parts ? (part + 1) * size : Integer.MAX_VALUE;
    return of(lower, upper);
  }

  public boolean contains(int treeId) {
    return lower <= treeId && treeId < upper;
  }

  public boolean isUnboundedAbove() {
    return upper == Integer.MAX_VALUE;
  }

  @Override public String toString() {
    return "[" + lower + ", "
        + (isUnboundedAbove() ? "inf" : Integer.toString(upper)) + ")";
  }

  @Override public int hashCode() {
    return lower * 31 + upper;
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof TreeRange
        && lower == ((TreeRange) o).lower
        && upper == ((TreeRange) o).upper;
  }
}

// End TreeRange.java
