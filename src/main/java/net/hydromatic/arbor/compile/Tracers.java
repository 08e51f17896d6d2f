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
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on a parsed query,
   * then calls the underlying tracer. */
  public static Tracer withOnParse(Tracer tracer,
      Consumer<Ast.Query> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onParse(Ast.Query query) {
        consumer.accept(query);
        super.onParse(query);
      }
    };
  }

  /** Returns a tracer that performs the given action on a normalized
   * query, then calls the underlying tracer. */
  public static Tracer withOnNormalize(Tracer tracer,
      Consumer<Ast.Query> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onNormalize(Ast.Query query) {
        consumer.accept(query);
        super.onNormalize(query);
      }
    };
  }

  /** Returns a tracer that performs the given action on a compiled query,
   * then calls the underlying tracer. */
  public static Tracer withOnCompile(Tracer tracer,
      Consumer<CompiledQuery> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onCompile(CompiledQuery query) {
        consumer.accept(query);
        super.onCompile(query);
      }
    };
  }

  public static Tracer withOnLookups(Tracer tracer,
      BiConsumer<NodeVariable, List<Lookup>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onLookups(NodeVariable variable,
          List<Lookup> lookups) {
        consumer.accept(variable, lookups);
        super.onLookups(variable, lookups);
      }
    };
  }

  public static Tracer withOnStats(Tracer tracer, Consumer<Stats> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onStats(Stats stats) {
        consumer.accept(stats);
        super.onStats(stats);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onParse(Ast.Query query) {
    }

    @Override public void onNormalize(Ast.Query query) {
    }

    @Override public void onCompile(CompiledQuery query) {
    }

    @Override public void onLookups(NodeVariable variable,
        List<Lookup> lookups) {
    }

    @Override public void onStats(Stats stats) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onParse(Ast.Query query) {
      tracer.onParse(query);
    }

    @Override public void onNormalize(Ast.Query query) {
      tracer.onNormalize(query);
    }

    @Override public void onCompile(CompiledQuery query) {
      tracer.onCompile(query);
    }

    @Override public void onLookups(NodeVariable variable,
        List<Lookup> lookups) {
      tracer.onLookups(variable, lookups);
    }

    @Override public void onStats(Stats stats) {
      tracer.onStats(stats);
    }
  }
}

// End Tracers.java
