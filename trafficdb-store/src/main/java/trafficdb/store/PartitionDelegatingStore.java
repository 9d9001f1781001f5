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

package trafficdb.store;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trafficdb.interfaces.LogEntry;
import trafficdb.interfaces.PartitionKey;
import trafficdb.interfaces.PartitionRef;
import trafficdb.interfaces.store.EntryCodec;
import trafficdb.interfaces.store.PartitionWriter;
import trafficdb.interfaces.store.PartitionedStore;
import trafficdb.interfaces.store.StoreUnavailableException;
import trafficdb.util.CheckedSupplier;
import trafficdb.util.KeySerializingExecutor;
import trafficdb.util.TrafficFutures;
import trafficdb.util.WrappingKeySerializingExecutor;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

import static com.google.common.base.Preconditions.checkArgument;
import static trafficdb.interfaces.store.EntryIterable.EntryIterator;
import static trafficdb.store.PartitionPersistenceService.BytePersistence;

/**
 * Partitioned store which delegates each partition's data to its own series of segments,
 * obtained from a {@link PartitionPersistenceService}.
 * <p>
 * Partitions are registered in a concurrent map the first time an entry is written to them;
 * registration is atomic per key, so concurrent first writers of a partition all share one
 * instance. All appends to a given partition run as tasks on a {@link KeySerializingExecutor},
 * keyed by partition, so each partition has a single writer at a time while different
 * partitions are written in parallel. Scans do not go through the executor; they read the
 * segments directly and may overlap with appends.
 */
public class PartitionDelegatingStore implements PartitionedStore, PartitionWriter, AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(PartitionDelegatingStore.class);

  private final PartitionPersistenceService<?> persistenceService;
  private final KeySerializingExecutor<PartitionKey> taskExecutor;
  private final EntryCodec<LogEntry> codec;
  private final StoreConfiguration configuration;
  private final Map<PartitionKey, PerPartition> partitionMap = new ConcurrentHashMap<>();
  private final AtomicLong rejectedCount = new AtomicLong();

  public PartitionDelegatingStore(PartitionPersistenceService<?> persistenceService,
                                  KeySerializingExecutor<PartitionKey> taskExecutor,
                                  EntryCodec<LogEntry> codec,
                                  StoreConfiguration configuration) {
    this.persistenceService = persistenceService;
    this.taskExecutor = taskExecutor;
    this.codec = codec;
    this.configuration = configuration;
  }

  /**
   * Open a store keeping its partitions in files under the given directory, picking up any
   * partitions already there.
   */
  public static PartitionDelegatingStore openInDirectory(Path basePath, StoreConfiguration configuration)
      throws IOException {
    final KeySerializingExecutor<PartitionKey> executor = new WrappingKeySerializingExecutor<>(
        Executors.newFixedThreadPool(configuration.getWriterThreads(),
            new ThreadFactoryBuilder().setNameFormat("partition-writer-%d").setDaemon(true).build()));

    final PartitionDelegatingStore store = new PartitionDelegatingStore(
        new SegmentFileService(basePath), executor, new LogEntryCodec(), configuration);
    store.recover();
    return store;
  }

  /**
   * Register every partition the persistence service has stored, along with its segments.
   * Entries written afterwards go to new segments; existing segments are only read.
   *
   * @throws StoreUnavailableException if the stored partitions cannot be listed or opened.
   */
  public void recover() throws IOException {
    final Set<PartitionKey> storedPartitions;
    try {
      storedPartitions = persistenceService.getStoredPartitions();
    } catch (IOException e) {
      throw new StoreUnavailableException("Unable to list stored partitions", e);
    }

    final List<ListenableFuture<Void>> loads = new ArrayList<>();
    for (PartitionKey key : storedPartitions) {
      final PerPartition partition = getOrCreatePartition(key);
      loads.add(taskExecutor.submit(key, () -> {
        partition.loadStoredSegments();
        return null;
      }));
    }

    for (ListenableFuture<Void> load : loads) {
      TrafficFutures.getPropagatingIOException(load);
    }
    LOG.info("Recovered {} stored partitions", storedPartitions.size());
  }

  @Override
  public PartitionRef write(LogEntry entry) throws IOException {
    return TrafficFutures.getPropagatingIOException(
        writeAll(entry.partitionKey(), ImmutableList.of(entry)));
  }

  @Override
  public ListenableFuture<PartitionRef> writeAll(PartitionKey key, List<LogEntry> passedInEntries) {
    final List<LogEntry> entries = validateAndMakeDefensiveCopy(key, passedInEntries);
    final PerPartition partition = getOrCreatePartition(key);

    return taskExecutor.submit(key, () -> partition.append(entries));
  }

  @Override
  public Set<PartitionKey> listPartitions() {
    return ImmutableSortedSet.copyOf(partitionMap.keySet());
  }

  @Override
  public EntryIterator<LogEntry> scan(PartitionKey key) {
    final PerPartition partition = partitionMap.get(key);
    if (partition == null) {
      return new PartitionEntryIterator<>(key, ImmutableList.of());
    }

    final ImmutableList.Builder<CheckedSupplier<EntryIterator<LogEntry>, IOException>> segmentIterators =
        ImmutableList.builder();
    for (EncodedSegment<LogEntry> segment : partition.segments) {
      segmentIterators.add(segment::iterator);
    }
    return new PartitionEntryIterator<>(key, segmentIterators.build());
  }

  @Override
  public void noteRejected(long count) {
    checkArgument(count >= 0, "count must not be negative");
    rejectedCount.addAndGet(count);
  }

  @Override
  public long rejectedCount() {
    return rejectedCount.get();
  }

  /**
   * Wait for pending appends to finish, then release every segment.
   */
  @Override
  public void close() throws IOException {
    try {
      taskExecutor.shutdownAndAwaitTermination(StoreConstants.STORE_CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while waiting for pending appends", e);
    } catch (TimeoutException e) {
      throw new IOException("Timed out waiting for pending appends", e);
    }

    IOException firstFailure = null;
    for (PerPartition partition : partitionMap.values()) {
      try {
        partition.close();
      } catch (IOException e) {
        LOG.error("Error closing partition {}", partition.key, e);
        if (firstFailure == null) {
          firstFailure = e;
        }
      }
    }
    if (firstFailure != null) {
      throw firstFailure;
    }
  }

  /**
   * The segments of one partition. The segment list may be read from any thread; every other
   * member may only be used from a task running on the partition's executor queue.
   */
  private class PerPartition {
    private final PartitionKey key;
    private final List<EncodedSegment<LogEntry>> segments = new CopyOnWriteArrayList<>();
    private EncodedSegment<LogEntry> currentSegment;
    private long nextSegmentId = StoreConstants.FIRST_SEGMENT_ID;

    public PerPartition(PartitionKey key) {
      this.key = key;
    }

    public void loadStoredSegments() throws StoreUnavailableException {
      try {
        final NavigableSet<Long> segmentIds = persistenceService.getSegmentIds(key);
        for (long segmentId : segmentIds) {
          final BytePersistence persistence = persistenceService.open(key, segmentId);
          final EncodedSegment<LogEntry> segment = new EncodedSegment<>(segmentId, persistence, codec);
          segment.seal();
          segments.add(segment);
        }
        if (!segmentIds.isEmpty()) {
          nextSegmentId = Math.max(nextSegmentId, segmentIds.last() + 1);
        }
      } catch (IOException e) {
        throw new StoreUnavailableException("Unable to open stored segments", key, e);
      }
    }

    /**
     * Append a batch. Every entry is encoded before any is appended, so an entry the codec
     * refuses fails the whole batch with nothing written.
     */
    public PartitionRef append(List<LogEntry> entries) throws StoreUnavailableException {
      final List<ByteBuffer[]> records = new ArrayList<>(entries.size());
      for (LogEntry entry : entries) {
        records.add(codec.encode(entry));
      }

      try {
        for (ByteBuffer[] record : records) {
          segmentForNextAppend().appendEncoded(record);
        }
        if (configuration.isSyncAfterBatch()) {
          currentSegment.sync();
        }
      } catch (IOException e) {
        throw new StoreUnavailableException("Unable to append to partition", key, e);
      }

      LOG.debug("Appended {} entries to partition {}", entries.size(), key);
      return new PartitionRef(key, currentSegment.getSegmentId());
    }

    public void close() throws IOException {
      for (EncodedSegment<LogEntry> segment : segments) {
        segment.close();
      }
    }

    @NotNull
    private EncodedSegment<LogEntry> segmentForNextAppend() throws IOException {
      if (currentSegment == null || isFull(currentSegment)) {
        roll();
      }
      return currentSegment;
    }

    private boolean isFull(EncodedSegment<LogEntry> segment) throws IOException {
      return segment.sizeInBytes() >= configuration.getSegmentMaxBytes()
          || segment.appendedRecords() >= configuration.getSegmentMaxRecords();
    }

    private void roll() throws IOException {
      if (currentSegment != null) {
        if (configuration.isSyncAfterBatch()) {
          currentSegment.sync();
        }
        currentSegment.seal();
        LOG.info("Rotated out segment {} of partition {} at {} records",
            currentSegment.getSegmentId(), key, currentSegment.appendedRecords());
      }

      final long segmentId = nextSegmentId;
      final EncodedSegment<LogEntry> newSegment =
          new EncodedSegment<>(segmentId, persistenceService.create(key, segmentId), codec);
      nextSegmentId++;
      segments.add(newSegment);
      currentSegment = newSegment;
    }
  }

  private PerPartition getOrCreatePartition(PartitionKey key) {
    return partitionMap.computeIfAbsent(key, k -> {
      LOG.info("Creating partition {}", k);
      return new PerPartition(k);
    });
  }

  private static List<LogEntry> validateAndMakeDefensiveCopy(PartitionKey key, List<LogEntry> entries) {
    if (entries.isEmpty()) {
      throw new IllegalArgumentException("Attempting to write an empty entry list");
    }

    for (LogEntry entry : entries) {
      if (!entry.partitionKey().equals(key)) {
        throw new IllegalArgumentException("Entry " + entry + " does not belong in partition " + key);
      }
    }

    return ImmutableList.copyOf(entries);
  }
}
