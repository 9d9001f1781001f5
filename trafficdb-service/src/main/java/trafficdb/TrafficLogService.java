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

package trafficdb;

import com.google.common.util.concurrent.AbstractService;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trafficdb.ingest.IngestReport;
import trafficdb.ingest.LogIngestor;
import trafficdb.ingest.RecordParser;
import trafficdb.interfaces.PartitionKey;
import trafficdb.query.AggregationExecutor;
import trafficdb.query.AggregationJob;
import trafficdb.query.AggregationResult;
import trafficdb.query.AggregationTimeoutException;
import trafficdb.query.sink.DelimitedFileResultSink;
import trafficdb.query.sink.ResultSink;
import trafficdb.store.PartitionDelegatingStore;
import trafficdb.store.StoreConstants;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkState;

/**
 * One run of ingestion and analytics over a data directory. Starting the service opens (or
 * recovers) the partitioned store and the scan workers; stopping it waits for them and closes
 * the store. The store is owned by this service and shared by its ingestor and executor.
 */
public class TrafficLogService extends AbstractService {
  private static final Logger LOG = LoggerFactory.getLogger(TrafficLogService.class);

  private final TrafficServiceConfiguration configuration;

  private PartitionDelegatingStore store;
  private ListeningExecutorService scanExecutor;
  private LogIngestor ingestor;
  private AggregationExecutor aggregationExecutor;
  private ResultSink resultSink;

  public TrafficLogService(TrafficServiceConfiguration configuration) {
    this.configuration = configuration;
  }

  @Override
  protected void doStart() {
    try {
      store = PartitionDelegatingStore.openInDirectory(
          configuration.getDataDirectory(), configuration.getStoreConfiguration());
      scanExecutor = MoreExecutors.listeningDecorator(Executors.newFixedThreadPool(
          configuration.getScanThreads(),
          new ThreadFactoryBuilder().setNameFormat("partition-scan-%d").setDaemon(true).build()));

      final RecordParser parser = new RecordParser(
          configuration.getInputDelimiter(),
          configuration.getTimestampWidth(),
          configuration.isStrictFieldCount());
      ingestor = new LogIngestor(parser, store, store,
          configuration.getBatchSize(),
          configuration.getMaxInFlightBatches(),
          configuration.getMaxRetainedFailures());
      aggregationExecutor = new AggregationExecutor(store, scanExecutor);
      resultSink = new DelimitedFileResultSink(configuration.getResultDelimiter());

      LOG.info("Started with {}", configuration);
      notifyStarted();
    } catch (IOException | RuntimeException e) {
      LOG.error("Unable to start in {}", configuration.getDataDirectory(), e);
      notifyFailed(e);
    }
  }

  @Override
  protected void doStop() {
    try {
      dispose();
      notifyStopped();
    } catch (IOException e) {
      LOG.error("Error while stopping", e);
      notifyFailed(e);
    }
  }

  /**
   * Parse and store every line, returning once every accepted entry has been written.
   */
  public IngestReport ingest(Iterator<String> lines) throws IOException {
    checkRunning();
    return ingestor.ingest(lines);
  }

  /**
   * Ingest a UTF-8 file of log lines, reading it one line at a time. Bytes that are not valid
   * UTF-8 are decoded as {@link trafficdb.ingest.IngestConstants#UNDECODABLE_CHARACTER}, so the
   * line holding them is rejected by the parser and the rest of the file is still ingested.
   */
  public IngestReport ingest(Path inputFile) throws IOException {
    checkRunning();
    LOG.info("Ingesting {}", inputFile);

    final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPLACE)
        .onUnmappableCharacter(CodingErrorAction.REPLACE);
    try (BufferedReader reader = new BufferedReader(
        new InputStreamReader(Files.newInputStream(inputFile), decoder))) {
      return ingestor.ingest(reader.lines().iterator());
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
  }

  public AggregationResult query(AggregationJob job) throws IOException {
    checkRunning();
    return aggregationExecutor.execute(job);
  }

  public AggregationResult query(AggregationJob job, long timeout, TimeUnit unit)
      throws IOException, AggregationTimeoutException {
    checkRunning();
    return aggregationExecutor.execute(job, store.listPartitions(), timeout, unit);
  }

  public void writeResult(AggregationResult result, String destination) throws IOException {
    checkRunning();
    resultSink.write(result, destination);
  }

  public Set<PartitionKey> listPartitions() {
    checkRunning();
    return store.listPartitions();
  }

  private void checkRunning() {
    checkState(isRunning(), "TrafficLogService is not running (state %s)", state());
  }

  private void dispose() throws IOException {
    if (scanExecutor != null) {
      scanExecutor.shutdown();
      try {
        if (!scanExecutor.awaitTermination(StoreConstants.STORE_CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
          LOG.warn("Partition scans still running after {} seconds; interrupting them",
              StoreConstants.STORE_CLOSE_TIMEOUT_SECONDS);
          scanExecutor.shutdownNow();
        }
      } catch (InterruptedException e) {
        scanExecutor.shutdownNow();
        Thread.currentThread().interrupt();
      }
      scanExecutor = null;
    }

    if (store != null) {
      store.close();
      store = null;
    }
  }
}
