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

import com.google.common.base.MoreObjects;
import trafficdb.ingest.IngestConstants;
import trafficdb.query.QueryConstants;
import trafficdb.store.StoreConfiguration;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Settings for one {@link TrafficLogService}. Anything not given keeps the default from the
 * constants class of the module it configures.
 */
public final class TrafficServiceConfiguration {
  public static final String DATA_DIRECTORY_KEY = "trafficdb.data.dir";
  public static final String SEGMENT_MAX_BYTES_KEY = "trafficdb.store.segment.max.bytes";
  public static final String SEGMENT_MAX_RECORDS_KEY = "trafficdb.store.segment.max.records";
  public static final String WRITER_THREADS_KEY = "trafficdb.store.writer.threads";
  public static final String SYNC_AFTER_BATCH_KEY = "trafficdb.store.sync.after.batch";
  public static final String INPUT_DELIMITER_KEY = "trafficdb.ingest.delimiter";
  public static final String TIMESTAMP_WIDTH_KEY = "trafficdb.ingest.timestamp.width";
  public static final String STRICT_FIELD_COUNT_KEY = "trafficdb.ingest.strict.field.count";
  public static final String BATCH_SIZE_KEY = "trafficdb.ingest.batch.size";
  public static final String MAX_IN_FLIGHT_BATCHES_KEY = "trafficdb.ingest.max.in.flight.batches";
  public static final String MAX_RETAINED_FAILURES_KEY = "trafficdb.ingest.max.retained.failures";
  public static final String SCAN_THREADS_KEY = "trafficdb.query.scan.threads";
  public static final String RESULT_DELIMITER_KEY = "trafficdb.result.delimiter";

  private final Path dataDirectory;
  private final StoreConfiguration storeConfiguration;
  private final String inputDelimiter;
  private final int timestampWidth;
  private final boolean strictFieldCount;
  private final int batchSize;
  private final int maxInFlightBatches;
  private final int maxRetainedFailures;
  private final int scanThreads;
  private final String resultDelimiter;

  private TrafficServiceConfiguration(Builder builder) {
    this.dataDirectory = builder.dataDirectory;
    this.storeConfiguration = builder.storeConfiguration;
    this.inputDelimiter = builder.inputDelimiter;
    this.timestampWidth = builder.timestampWidth;
    this.strictFieldCount = builder.strictFieldCount;
    this.batchSize = builder.batchSize;
    this.maxInFlightBatches = builder.maxInFlightBatches;
    this.maxRetainedFailures = builder.maxRetainedFailures;
    this.scanThreads = builder.scanThreads;
    this.resultDelimiter = builder.resultDelimiter;
  }

  public static Builder inDirectory(Path dataDirectory) {
    return new Builder(dataDirectory);
  }

  /**
   * Read the trafficdb.* keys from the properties. The data directory key is required.
   *
   * @throws IllegalArgumentException if a key is missing or has a value of the wrong form.
   */
  public static TrafficServiceConfiguration fromProperties(Properties properties) {
    final String dataDirectory = properties.getProperty(DATA_DIRECTORY_KEY);
    checkArgument(dataDirectory != null && !dataDirectory.isEmpty(), "%s must be set", DATA_DIRECTORY_KEY);

    StoreConfiguration storeConfiguration = StoreConfiguration.DEFAULT
        .withSegmentMaxBytes(longProperty(properties, SEGMENT_MAX_BYTES_KEY,
            StoreConfiguration.DEFAULT.getSegmentMaxBytes()))
        .withSegmentMaxRecords(longProperty(properties, SEGMENT_MAX_RECORDS_KEY,
            StoreConfiguration.DEFAULT.getSegmentMaxRecords()))
        .withWriterThreads(intProperty(properties, WRITER_THREADS_KEY,
            StoreConfiguration.DEFAULT.getWriterThreads()))
        .withSyncAfterBatch(Boolean.parseBoolean(properties.getProperty(SYNC_AFTER_BATCH_KEY,
            Boolean.toString(StoreConfiguration.DEFAULT.isSyncAfterBatch()))));

    return inDirectory(Paths.get(dataDirectory))
        .storeConfiguration(storeConfiguration)
        .inputDelimiter(properties.getProperty(INPUT_DELIMITER_KEY, IngestConstants.DEFAULT_DELIMITER))
        .timestampWidth(intProperty(properties, TIMESTAMP_WIDTH_KEY, IngestConstants.DEFAULT_TIMESTAMP_WIDTH))
        .strictFieldCount(Boolean.parseBoolean(properties.getProperty(STRICT_FIELD_COUNT_KEY, "false")))
        .batchSize(intProperty(properties, BATCH_SIZE_KEY, IngestConstants.DEFAULT_BATCH_SIZE))
        .maxInFlightBatches(intProperty(properties, MAX_IN_FLIGHT_BATCHES_KEY,
            IngestConstants.DEFAULT_MAX_IN_FLIGHT_BATCHES))
        .maxRetainedFailures(intProperty(properties, MAX_RETAINED_FAILURES_KEY,
            IngestConstants.DEFAULT_MAX_RETAINED_FAILURES))
        .scanThreads(intProperty(properties, SCAN_THREADS_KEY, QueryConstants.DEFAULT_SCAN_THREADS))
        .resultDelimiter(properties.getProperty(RESULT_DELIMITER_KEY, QueryConstants.DEFAULT_RESULT_DELIMITER))
        .build();
  }

  public Path getDataDirectory() {
    return dataDirectory;
  }

  public StoreConfiguration getStoreConfiguration() {
    return storeConfiguration;
  }

  public String getInputDelimiter() {
    return inputDelimiter;
  }

  /**
   * Width every input timestamp must have; 0 accepts any width.
   */
  public int getTimestampWidth() {
    return timestampWidth;
  }

  public boolean isStrictFieldCount() {
    return strictFieldCount;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public int getMaxInFlightBatches() {
    return maxInFlightBatches;
  }

  public int getMaxRetainedFailures() {
    return maxRetainedFailures;
  }

  public int getScanThreads() {
    return scanThreads;
  }

  public String getResultDelimiter() {
    return resultDelimiter;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("dataDirectory", dataDirectory)
        .add("storeConfiguration", storeConfiguration)
        .add("inputDelimiter", inputDelimiter)
        .add("timestampWidth", timestampWidth)
        .add("strictFieldCount", strictFieldCount)
        .add("batchSize", batchSize)
        .add("maxInFlightBatches", maxInFlightBatches)
        .add("maxRetainedFailures", maxRetainedFailures)
        .add("scanThreads", scanThreads)
        .add("resultDelimiter", resultDelimiter)
        .toString();
  }

  private static int intProperty(Properties properties, String key, int defaultValue) {
    final String value = properties.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(key + " must be an integer, not " + value, e);
    }
  }

  private static long longProperty(Properties properties, String key, long defaultValue) {
    final String value = properties.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(key + " must be an integer, not " + value, e);
    }
  }

  public static final class Builder {
    private final Path dataDirectory;
    private StoreConfiguration storeConfiguration = StoreConfiguration.DEFAULT;
    private String inputDelimiter = IngestConstants.DEFAULT_DELIMITER;
    private int timestampWidth = IngestConstants.DEFAULT_TIMESTAMP_WIDTH;
    private boolean strictFieldCount = false;
    private int batchSize = IngestConstants.DEFAULT_BATCH_SIZE;
    private int maxInFlightBatches = IngestConstants.DEFAULT_MAX_IN_FLIGHT_BATCHES;
    private int maxRetainedFailures = IngestConstants.DEFAULT_MAX_RETAINED_FAILURES;
    private int scanThreads = QueryConstants.DEFAULT_SCAN_THREADS;
    private String resultDelimiter = QueryConstants.DEFAULT_RESULT_DELIMITER;

    private Builder(Path dataDirectory) {
      this.dataDirectory = checkNotNull(dataDirectory, "dataDirectory");
    }

    public Builder storeConfiguration(StoreConfiguration storeConfiguration) {
      this.storeConfiguration = checkNotNull(storeConfiguration);
      return this;
    }

    public Builder inputDelimiter(String inputDelimiter) {
      this.inputDelimiter = inputDelimiter;
      return this;
    }

    public Builder timestampWidth(int timestampWidth) {
      this.timestampWidth = timestampWidth;
      return this;
    }

    public Builder strictFieldCount(boolean strictFieldCount) {
      this.strictFieldCount = strictFieldCount;
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder maxInFlightBatches(int maxInFlightBatches) {
      this.maxInFlightBatches = maxInFlightBatches;
      return this;
    }

    public Builder maxRetainedFailures(int maxRetainedFailures) {
      this.maxRetainedFailures = maxRetainedFailures;
      return this;
    }

    public Builder scanThreads(int scanThreads) {
      this.scanThreads = scanThreads;
      return this;
    }

    public Builder resultDelimiter(String resultDelimiter) {
      this.resultDelimiter = resultDelimiter;
      return this;
    }

    public TrafficServiceConfiguration build() {
      checkArgument(inputDelimiter != null && !inputDelimiter.isEmpty(), "input delimiter must not be empty");
      checkArgument(resultDelimiter != null && !resultDelimiter.isEmpty(), "result delimiter must not be empty");
      checkArgument(timestampWidth >= 0, "timestampWidth must not be negative");
      checkArgument(batchSize > 0, "batchSize must be positive");
      checkArgument(maxInFlightBatches > 0, "maxInFlightBatches must be positive");
      checkArgument(maxRetainedFailures >= 0, "maxRetainedFailures must not be negative");
      checkArgument(scanThreads > 0, "scanThreads must be positive");
      return new TrafficServiceConfiguration(this);
    }
  }
}
