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

/** Generates names for anonymous node variables.
 *
 * <p>Generated names start with "$", which cannot occur in a variable that
 * the user writes, so they never clash. */
public class NameGenerator {
  private int id = 0;

  /** Generates a name that is unique in this query. */
  public String get() {
    return "$" + id++;
  }

  /** Returns whether a name was generated rather than written by the
   * user. */
  public static boolean isGenerated(String name) {
    return name.startsWith("$");
  }
}

// End NameGenerator.java
