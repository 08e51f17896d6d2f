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
import net.hydromatic.arbor.compile.Tracer;
import net.hydromatic.arbor.compile.Tracers;
import net.hydromatic.arbor.store.IndexProvider;
import net.hydromatic.arbor.store.TreeRange;
import net.hydromatic.arbor.store.TreebankIndex;

import com.google.common.collect.AbstractIterator;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/** Result set that evaluates a query in several workers, each over its own
 * range of trees and with its own connection to the store.
 *
 * <p>Workers send matches, and finally their statistics, to the consumer
 * over a bounded queue; they share no other state. Matches from one worker
 * arrive in tree order, but matches from different workers are interleaved,
 * unless {@link Prop#SORT_RESULTS} is set.
 *
 * <p>If a worker fails, the other workers are cancelled and the consumer
 * receives an {@link EvaluationException}. Closing the result set before
 * reading every match also cancels the workers. */
class ParallelResultSet extends AbstractIterator<Match> implements ResultSet {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(ParallelResultSet.class);

  private final CompiledQuery query;
  private final Tracer tracer;
  private final boolean sort;
  private final ExecutorService executor;
  private final BlockingQueue<Message> queue;
  private int runningWorkers;
  private Stats stats = Stats.ZERO;
  private @Nullable Iterator<Match> sorted;
  private boolean closed;

  ParallelResultSet(CompiledQuery query, IndexProvider provider,
      Map<Prop, Object> map, int parallelism, Tracer tracer) {
    this.query = requireNonNull(query);
    this.tracer = requireNonNull(tracer);
    this.sort = Prop.SORT_RESULTS.booleanValue(map);
    this.queue =
        new ArrayBlockingQueue<>(
            Math.max(Prop.RESULT_QUEUE_CAPACITY.intValue(map), 1));
    final int treeCount;
    try (TreebankIndex index = provider.connect()) {
      treeCount = index.treeCount();
    }
    this.executor =
        Executors.newFixedThreadPool(parallelism,
            new ThreadFactoryBuilder()
                .setNameFormat("arbor-worker-%d")
                .setDaemon(true)
                .build());
    for (int part = 0; part < parallelism; part++) {
      final TreeRange range = TreeRange.partition(treeCount, part, parallelism);
      final Worker worker = new Worker(part, range, provider, map);
      executor.execute(worker);
      ++runningWorkers;
    }
    LOGGER.debug("Started {} workers over {} trees", parallelism, treeCount);
  }

  @Override protected Match computeNext() {
    if (sort) {
      if (sorted == null) {
        final List<Match> list = new ArrayList<>();
        for (;;) {
          final Match match = take();
          if (match == null) {
            break;
          }
          list.add(match);
        }
        list.sort(Match.BY_TREE);
        sorted = list.iterator();
      }
      return sorted.hasNext() ? sorted.next() : endOfData();
    }
    final Match match = take();
    return match != null ? match : endOfData();
  }

  /** Returns the next match from any worker, or null when every worker has
   * finished. */
  private @Nullable Match take() {
    while (runningWorkers > 0 && !closed) {
      final Message message;
      try {
        message = queue.take();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        cancel();
        throw new EvaluationException("interrupted while waiting for workers",
            query.query.pos, e);
      }
      if (message.match != null) {
        return message.match;
      }
      if (message.failure != null) {
        LOGGER.warn("Worker {} failed; cancelling the other workers",
            message.worker, message.failure);
        cancel();
        throw new EvaluationException("worker " + message.worker
            + " failed: " + message.failure, query.query.pos,
            message.failure);
      }
      stats = stats.plus(requireNonNull(message.stats));
      --runningWorkers;
      LOGGER.debug("Worker {} finished; {} running", message.worker,
          runningWorkers);
    }
    if (!closed) {
      // Every worker has finished; release the pool's threads.
      executor.shutdown();
    }
    return null;
  }

  @Override public Stats stats() {
    return stats;
  }

  /** Returns whether the pool of workers has been shut down. */
  boolean isShutdown() {
    return executor.isShutdown();
  }

  private void cancel() {
    runningWorkers = 0;
    executor.shutdownNow();
  }

  @Override public void close() {
    if (closed) {
      return;
    }
    closed = true;
    cancel();
    try {
      if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
        LOGGER.warn("Workers did not terminate in time");
      }
    } catch (InterruptedException e) {
      LOGGER.warn("Interrupted while waiting for workers to terminate", e);
      Thread.currentThread().interrupt();
    }
    tracer.onStats(stats);
  }

  /** Message from a worker: a match, its final statistics, or a
   * failure. */
  private static class Message {
    final int worker;
    final @Nullable Match match;
    final @Nullable Stats stats;
    final @Nullable Throwable failure;

    private Message(int worker, @Nullable Match match, @Nullable Stats stats,
        @Nullable Throwable failure) {
      this.worker = worker;
      this.match = match;
      this.stats = stats;
      this.failure = failure;
    }
  }

  /** Evaluates the query over one range of trees. */
  private class Worker implements Runnable {
    private final int part;
    private final TreeRange range;
    private final IndexProvider provider;
    private final Map<Prop, Object> map;

    Worker(int part, TreeRange range, IndexProvider provider,
        Map<Prop, Object> map) {
      this.part = part;
      this.range = range;
      this.provider = provider;
      this.map = map;
    }

    @Override public void run() {
      LOGGER.debug("Worker {} evaluating trees {}", part, range);
      try {
        try (ResultSet resultSet =
                 Evaluator.open(query, provider.connect(), range, map,
                     Tracers.empty())) {
          while (resultSet.hasNext()) {
            queue.put(new Message(part, resultSet.next(), null, null));
          }
          queue.put(new Message(part, null, resultSet.stats(), null));
        }
      } catch (InterruptedException e) {
        LOGGER.debug("Worker {} cancelled", part);
        Thread.currentThread().interrupt();
      } catch (RuntimeException | Error e) {
        try {
          queue.put(new Message(part, null, null, e));
        } catch (InterruptedException e2) {
          LOGGER.warn("Worker {} failed, and was cancelled before it could"
              + " report the failure", part, e);
          Thread.currentThread().interrupt();
        }
      }
    }
  }
}

// End ParallelResultSet.java
