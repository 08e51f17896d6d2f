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
package net.hydromatic.arbor.eval;

import java.util.Iterator;

/** Iterator over the matches of a query.
 *
 * <p>A result set holds connections to the store, and perhaps worker
 * threads; the caller must close it, but may do so before reading every
 * match. */
public interface ResultSet extends Iterator<Match>, AutoCloseable {
  /** Returns the statistics gathered so far. */
  Stats stats();

  @Override void close();
}

// End ResultSet.java
