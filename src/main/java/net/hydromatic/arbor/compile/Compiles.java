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
import net.hydromatic.arbor.parse.Parsers;
import net.hydromatic.arbor.store.CorpusSchema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Helpers for {@link QueryFactory} and {@link Normalizer}. */
public abstract class Compiles {
  private static final Logger LOGGER = LoggerFactory.getLogger(Compiles.class);

  /** Parses, normalizes and compiles a query. */
  public static CompiledQuery compile(String queryText, CorpusSchema schema,
      Tracer tracer) {
    final Ast.Query query = Parsers.parse(queryText);
    tracer.onParse(query);
    return compile(query, schema, tracer);
  }

  /** Normalizes and compiles a parsed query. */
  public static CompiledQuery compile(Ast.Query query, CorpusSchema schema,
      Tracer tracer) {
    final Ast.Query normalized = new Normalizer(schema).normalizeQuery(query);
    tracer.onNormalize(normalized);
    LOGGER.debug("normalized query: {}", normalized);
    final CompiledQuery compiledQuery =
        QueryFactory.create(normalized, schema);
    tracer.onCompile(compiledQuery);
    LOGGER.debug("compiled query:\n{}", compiledQuery);
    return compiledQuery;
  }
}

// End Compiles.java
