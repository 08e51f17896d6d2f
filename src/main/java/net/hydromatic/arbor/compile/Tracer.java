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

import net.hydromatic.arbor.ast.Ast;
import net.hydromatic.arbor.eval.Stats;
import net.hydromatic.arbor.store.Lookup;

import java.util.List;

/** Called on various events during compilation and evaluation. */
public interface Tracer {
  /** Called when a query has been parsed. */
  void onParse(Ast.Query query);

  /** Called when a query has been normalized. */
  void onNormalize(Ast.Query query);

  /** Called when a query has been compiled. */
  void onCompile(CompiledQuery query);

  /** Called with the store lookups that find the candidates of a
   * variable. */
  void onLookups(NodeVariable variable, List<Lookup> lookups);

  /** Called with the statistics of an evaluation, after its result set is
   * closed. */
  void onStats(Stats stats);
}

// End Tracer.java
