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

package trafficdb.interfaces.store;

import com.google.common.util.concurrent.ListenableFuture;
import trafficdb.interfaces.LogEntry;
import trafficdb.interfaces.PartitionKey;
import trafficdb.interfaces.PartitionRef;

import java.io.IOException;
import java.util.List;

/**
 * Write side of the partitioned store. Routes each entry to the partition for its status code,
 * creating the partition on first use.
 */
public interface PartitionWriter {
  /**
   * Append one entry and wait until it has been written.
   *
   * @return The partition and segment the entry was appended to.
   * @throws StoreUnavailableException if the entry could not be written.
   */
  PartitionRef write(LogEntry entry) throws IOException;

  /**
   * Append a batch of entries, all of which must belong to the given partition, without
   * waiting. Batches submitted for the same partition are appended in submission order;
   * batches for different partitions may be appended concurrently.
   *
   * @return A future of the partition and segment the last entry of the batch was appended
   * to, which fails with {@link StoreUnavailableException} if the batch could not be written.
   * @throws IllegalArgumentException if the batch is empty or an entry belongs to a different partition.
   */
  ListenableFuture<PartitionRef> writeAll(PartitionKey key, List<LogEntry> entries);
}
