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

import static java.util.Objects.requireNonNull;

/** Query-scoped table holding the ids of the values of a feature that
 * satisfy a condition, typically a regular expression. */
public class ValueTable {
  public final String name;
  public final String feature;
  /** Number of value ids in the table. */
  public final int size;

  public ValueTable(String name, String feature, int size) {
    this.name = requireNonNull(name);
    this.feature = requireNonNull(feature);
    this.size = size;
  }

  @Override public String toString() {
    return name + "(" + feature + ", " + size + ")";
  }
}

// End ValueTable.java
