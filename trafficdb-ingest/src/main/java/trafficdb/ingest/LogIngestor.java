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

package trafficdb.ingest;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ListenableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trafficdb.interfaces.LogEntry;
import trafficdb.interfaces.PartitionKey;
import trafficdb.interfaces.PartitionRef;
import trafficdb.interfaces.store.PartitionWriter;
import trafficdb.interfaces.store.PartitionedStore;
import trafficdb.util.TrafficFutures;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Parses a stream of raw lines and writes the accepted entries to their partitions.
 * <p>
 * Entries are buffered per partition and written in batches, so that partitions are written
 * in parallel; at most a fixed number of batches may be in flight at once, which bounds the
 * memory an ingestion can take regardless of the size of the input. Within a partition,
 * entries are stored in input order.
 * <p>
 * A malformed line never stops an ingestion: it is counted, and the first few are kept for
 * inspection. A failure to write does stop it, and is thrown to the caller as it was reported
 * by the writer.
 */
public class LogIngestor {
  private static final Logger LOG = LoggerFactory.getLogger(LogIngestor.class);

  private final RecordParser parser;
  private final PartitionWriter writer;
  private final PartitionedStore store;
  private final int batchSize;
  private final int maxInFlightBatches;
  private final int maxRetainedFailures;

  public LogIngestor(RecordParser parser, PartitionWriter writer, PartitionedStore store,
                     int batchSize, int maxInFlightBatches, int maxRetainedFailures) {
    checkArgument(batchSize > 0, "batchSize must be positive");
    checkArgument(maxInFlightBatches > 0, "maxInFlightBatches must be positive");
    checkArgument(maxRetainedFailures >= 0, "maxRetainedFailures must not be negative");

    this.parser = parser;
    this.writer = writer;
    this.store = store;
    this.batchSize = batchSize;
    this.maxInFlightBatches = maxInFlightBatches;
    this.maxRetainedFailures = maxRetainedFailures;
  }

  public <S extends PartitionWriter & PartitionedStore> LogIngestor(RecordParser parser, S store) {
    this(parser, store, store,
        IngestConstants.DEFAULT_BATCH_SIZE,
        IngestConstants.DEFAULT_MAX_IN_FLIGHT_BATCHES,
        IngestConstants.DEFAULT_MAX_RETAINED_FAILURES);
  }

  /**
   * Ingest every line the iterator yields, returning once every accepted entry has been written.
   * The number of rejected lines is added to the store's tally, even if the ingestion fails.
   *
   * @throws trafficdb.interfaces.store.StoreUnavailableException if an entry could not be written.
   */
  public IngestReport ingest(Iterator<String> lines) throws IOException {
    final Stopwatch stopwatch = Stopwatch.createStarted();
    final IngestReport.Tally tally = new IngestReport.Tally(maxRetainedFailures);
    final Run run = new Run();

    try {
      while (lines.hasNext()) {
        final ParseResult result = parser.parse(lines.next());
        if (result.isAccepted()) {
          tally.accept();
          run.add(result.getEntry());
        } else {
          tally.reject(result.getFailure());
        }
      }
      run.flushAllAndWait();
    } finally {
      store.noteRejected(tally.rejected());
    }

    final IngestReport report = tally.toReport();
    LOG.info("Ingested {} lines in {}: {}", report.getAccepted() + report.getRejected(), stopwatch, report);
    return report;
  }

  /**
   * Buffers and in-flight batches of a single ingestion.
   */
  private class Run {
    private final Map<PartitionKey, List<LogEntry>> buffers = new TreeMap<>();
    private final Deque<ListenableFuture<PartitionRef>> inFlight = new ArrayDeque<>();

    void add(LogEntry entry) throws IOException {
      final PartitionKey key = entry.partitionKey();
      final List<LogEntry> buffer = buffers.computeIfAbsent(key, k -> new ArrayList<>(batchSize));
      buffer.add(entry);
      if (buffer.size() >= batchSize) {
        flush(key, buffer);
      }
    }

    void flushAllAndWait() throws IOException {
      for (Map.Entry<PartitionKey, List<LogEntry>> bufferEntry : buffers.entrySet()) {
        if (!bufferEntry.getValue().isEmpty()) {
          flush(bufferEntry.getKey(), bufferEntry.getValue());
        }
      }
      while (!inFlight.isEmpty()) {
        TrafficFutures.getPropagatingIOException(inFlight.removeFirst());
      }
    }

    private void flush(PartitionKey key, List<LogEntry> buffer) throws IOException {
      while (inFlight.size() >= maxInFlightBatches) {
        TrafficFutures.getPropagatingIOException(inFlight.removeFirst());
      }

      final List<LogEntry> batch = ImmutableList.copyOf(buffer);
      buffer.clear();
      LOG.debug("Writing batch of {} entries to partition {}", batch.size(), key);
      inFlight.addLast(writer.writeAll(key, batch));
    }
  }
}
