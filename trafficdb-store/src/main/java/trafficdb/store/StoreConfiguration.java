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

import com.google.common.base.MoreObjects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Tunables of a {@link PartitionDelegatingStore}. Immutable; the with- methods return
 * modified copies.
 */
public final class StoreConfiguration {
  public static final StoreConfiguration DEFAULT = new StoreConfiguration(
      StoreConstants.DEFAULT_SEGMENT_MAX_BYTES,
      StoreConstants.DEFAULT_SEGMENT_MAX_RECORDS,
      StoreConstants.STORE_THREAD_POOL_SIZE,
      StoreConstants.STORE_USE_FILE_CHANNEL_FORCE);

  private final long segmentMaxBytes;
  private final long segmentMaxRecords;
  private final int writerThreads;
  private final boolean syncAfterBatch;

  private StoreConfiguration(long segmentMaxBytes, long segmentMaxRecords, int writerThreads,
                             boolean syncAfterBatch) {
    checkArgument(segmentMaxBytes > 0, "segmentMaxBytes must be positive");
    checkArgument(segmentMaxRecords > 0, "segmentMaxRecords must be positive");
    checkArgument(writerThreads > 0, "writerThreads must be positive");

    this.segmentMaxBytes = segmentMaxBytes;
    this.segmentMaxRecords = segmentMaxRecords;
    this.writerThreads = writerThreads;
    this.syncAfterBatch = syncAfterBatch;
  }

  /**
   * A segment is rotated out once its size in bytes reaches this value.
   */
  public long getSegmentMaxBytes() {
    return segmentMaxBytes;
  }

  /**
   * A segment is rotated out once it holds this many records.
   */
  public long getSegmentMaxRecords() {
    return segmentMaxRecords;
  }

  public int getWriterThreads() {
    return writerThreads;
  }

  /**
   * Whether to force each written batch to the storage medium before reporting it written.
   */
  public boolean isSyncAfterBatch() {
    return syncAfterBatch;
  }

  public StoreConfiguration withSegmentMaxBytes(long segmentMaxBytes) {
    return new StoreConfiguration(segmentMaxBytes, segmentMaxRecords, writerThreads, syncAfterBatch);
  }

  public StoreConfiguration withSegmentMaxRecords(long segmentMaxRecords) {
    return new StoreConfiguration(segmentMaxBytes, segmentMaxRecords, writerThreads, syncAfterBatch);
  }

  public StoreConfiguration withWriterThreads(int writerThreads) {
    return new StoreConfiguration(segmentMaxBytes, segmentMaxRecords, writerThreads, syncAfterBatch);
  }

  public StoreConfiguration withSyncAfterBatch(boolean syncAfterBatch) {
    return new StoreConfiguration(segmentMaxBytes, segmentMaxRecords, writerThreads, syncAfterBatch);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("segmentMaxBytes", segmentMaxBytes)
        .add("segmentMaxRecords", segmentMaxRecords)
        .add("writerThreads", writerThreads)
        .add("syncAfterBatch", syncAfterBatch)
        .toString();
  }
}
