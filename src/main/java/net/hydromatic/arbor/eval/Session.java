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

import net.hydromatic.arbor.compile.CompiledQuery;
import net.hydromatic.arbor.compile.Compiles;
import net.hydromatic.arbor.compile.Tracer;
import net.hydromatic.arbor.compile.Tracers;
import net.hydromatic.arbor.store.IndexProvider;
import net.hydromatic.arbor.store.TreeRange;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/** Session state: a treebank, properties and a tracer.
 *
 * <p>A compiled query may be evaluated many times. */
public class Session {
  private static final Logger LOGGER = LoggerFactory.getLogger(Session.class);

  /** Property values. */
  public final Map<Prop, Object> map;
  private final IndexProvider provider;
  private final Tracer tracer;

  /** Creates a Session.
   *
   * <p>The {@code map} parameter, that contains property values, is copied.
   *
   * @param map Map from property to value
   * @param provider Treebank to query
   * @param tracer Tracer
   */
  public Session(Map<Prop, Object> map, IndexProvider provider,
      Tracer tracer) {
    this.map = new HashMap<>(map);
    this.provider = requireNonNull(provider);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a Session with no tracer. */
  public Session(Map<Prop, Object> map, IndexProvider provider) {
    this(map, provider, Tracers.empty());
  }

  /** Parses and compiles a query against the treebank's schema. */
  public CompiledQuery compile(String query) {
    return Compiles.compile(query, provider.schema(), tracer);
  }

  /** Compiles and evaluates a query. The caller must close the result
   * set. */
  public ResultSet evaluate(String query) {
    return evaluate(compile(query));
  }

  /** Evaluates a compiled query. The caller must close the result set.
   *
   * <p>If {@link Prop#PARALLELISM} is greater than 1, the trees are
   * partitioned among that many workers. */
  public ResultSet evaluate(CompiledQuery query) {
    int parallelism = Prop.PARALLELISM.intValue(map);
    if (parallelism == 0) {
      parallelism = Runtime.getRuntime().availableProcessors();
    }
    LOGGER.debug("Evaluating with parallelism {}", parallelism);
    if (parallelism == 1) {
      return Evaluator.open(query, provider.connect(), TreeRange.ALL, map,
          tracer);
    }
    return new ParallelResultSet(query, provider, map, parallelism, tracer);
  }

  /** Compiles and evaluates a query, and returns all of its matches. */
  public List<Match> evaluateToList(String query) {
    try (ResultSet resultSet = evaluate(query)) {
      return ImmutableList.copyOf(resultSet);
    }
  }
}

// End Session.java
