/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package trafficdb.query;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trafficdb.interfaces.LogEntry;
import trafficdb.interfaces.PartitionKey;
import trafficdb.interfaces.store.PartitionedStore;
import trafficdb.util.TrafficFutures;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static trafficdb.interfaces.store.EntryIterable.EntryIterator;

/**
 * Runs aggregation jobs against a {@link PartitionedStore}. Each partition a job needs is
 * folded into a {@link PartitionAggregate} by a task of its own on the scan executor; once
 * every fold has finished the partials are merged by {@link ResultMerger}.
 * <p>
 * Partitions that the job's filter rules out are not scanned. If any fold fails, the other
 * folds are cancelled and the failure is thrown as the store reported it. No partial result
 * is ever returned.
 */
public class AggregationExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(AggregationExecutor.class);

  private final PartitionedStore store;
  private final ListeningExecutorService scanExecutor;

  public AggregationExecutor(PartitionedStore store, ListeningExecutorService scanExecutor) {
    this.store = store;
    this.scanExecutor = scanExecutor;
  }

  /**
   * Aggregate over every partition in the store.
   */
  public AggregationResult execute(AggregationJob job) throws IOException {
    return execute(job, store.listPartitions());
  }

  /**
   * Aggregate over the given partitions, waiting as long as it takes.
   *
   * @throws trafficdb.interfaces.store.StoreUnavailableException if a partition could not be
   *                                                              scanned.
   */
  public AggregationResult execute(AggregationJob job, Collection<PartitionKey> partitions) throws IOException {
    checkNotNull(job);
    checkNotNull(partitions);

    final Stopwatch stopwatch = Stopwatch.createStarted();
    final List<ListenableFuture<PartitionAggregate>> folds = submitFolds(job, partitions);
    final ListenableFuture<List<PartitionAggregate>> allFolds = Futures.allAsList(folds);

    try {
      return finish(job, allFolds.get(), stopwatch);
    } catch (ExecutionException e) {
      cancelAll(folds);
      throw TrafficFutures.propagateCause(e);
    } catch (InterruptedException e) {
      cancelAll(folds);
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while waiting for aggregation " + job);
    }
  }

  /**
   * Aggregate over the given partitions, giving up after the timeout. On timeout every
   * unfinished fold is cancelled.
   *
   * @throws AggregationTimeoutException if the folds did not all finish in time.
   */
  public AggregationResult execute(AggregationJob job,
                                   Collection<PartitionKey> partitions,
                                   long timeout,
                                   TimeUnit unit) throws IOException, AggregationTimeoutException {
    checkNotNull(job);
    checkNotNull(partitions);
    checkNotNull(unit);
    checkArgument(timeout > 0, "Timeout must be positive");

    final Stopwatch stopwatch = Stopwatch.createStarted();
    final List<ListenableFuture<PartitionAggregate>> folds = submitFolds(job, partitions);
    final ListenableFuture<List<PartitionAggregate>> allFolds = Futures.allAsList(folds);

    try {
      return finish(job, allFolds.get(timeout, unit), stopwatch);
    } catch (TimeoutException e) {
      cancelAll(folds);
      LOG.warn("Aggregation {} timed out after {}", job, stopwatch);
      throw new AggregationTimeoutException(job, timeout, unit);
    } catch (ExecutionException e) {
      cancelAll(folds);
      throw TrafficFutures.propagateCause(e);
    } catch (InterruptedException e) {
      cancelAll(folds);
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while waiting for aggregation " + job);
    }
  }

  private List<ListenableFuture<PartitionAggregate>> submitFolds(AggregationJob job,
                                                                 Collection<PartitionKey> partitions) {
    final List<ListenableFuture<PartitionAggregate>> folds = new ArrayList<>();
    for (PartitionKey key : ImmutableSortedSet.copyOf(partitions)) {
      if (!job.getFilter().mayMatchPartition(key)) {
        LOG.debug("Skipping partition {}, which cannot match {}", key, job.getFilter());
        continue;
      }
      folds.add(scanExecutor.submit(() -> fold(job, key)));
    }
    return folds;
  }

  private PartitionAggregate fold(AggregationJob job, PartitionKey key) throws IOException {
    final PartitionAggregate aggregate = new PartitionAggregate(key, job);

    try (EntryIterator<LogEntry> entries = store.scan(key)) {
      while (entries.hasNext()) {
        if (Thread.currentThread().isInterrupted()) {
          throw new InterruptedIOException("Scan of partition " + key + " was cancelled");
        }
        aggregate.accumulate(entries.next());
      }
    }

    LOG.debug("Folded {}", aggregate);
    return aggregate;
  }

  private AggregationResult finish(AggregationJob job, List<PartitionAggregate> partials, Stopwatch stopwatch) {
    final AggregationResult result = ResultMerger.merge(job, partials, store.rejectedCount());
    final long wallTimeMillis = stopwatch.elapsed(TimeUnit.MILLISECONDS);

    LOG.info("Aggregation {} over {} partitions produced {} rows in {} ms",
        job, partials.size(), result.getRows().size(), wallTimeMillis);
    return result.withWallTime(wallTimeMillis);
  }

  private static void cancelAll(List<ListenableFuture<PartitionAggregate>> folds) {
    for (ListenableFuture<PartitionAggregate> fold : folds) {
      fold.cancel(true);
    }
  }
}
