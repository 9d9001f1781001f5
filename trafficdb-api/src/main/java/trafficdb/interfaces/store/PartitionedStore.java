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

import trafficdb.interfaces.LogEntry;
import trafficdb.interfaces.PartitionKey;

import java.io.IOException;
import java.util.Set;

import static trafficdb.interfaces.store.EntryIterable.EntryIterator;

/**
 * Read side of the partitioned, append-only store of log entries. Each partition holds the
 * entries of one status code (or of the default partition) as an ordered series of segments.
 * <p>
 * The store instance also owns the run-wide tally of input records that were rejected before
 * reaching it, so that query results can report how much input never entered the aggregates.
 */
public interface PartitionedStore {
  /**
   * Return the key of every partition created up to this call, including partitions that were
   * already on disk when the store was opened.
   */
  Set<PartitionKey> listPartitions();

  /**
   * Begin a lazy scan of the partition's entries, in the order they were appended. Each call
   * returns a fresh sequence starting from the oldest entry. Every entry appended before the
   * call is visible to the scan; entries appended while it runs may or may not be. A key with
   * no partition yields an empty sequence.
   * <p>
   * The caller must close the returned iterator.
   *
   * @throws StoreUnavailableException if the underlying storage cannot be read.
   */
  EntryIterator<LogEntry> scan(PartitionKey key) throws IOException;

  /**
   * Add to the tally of input records rejected by parsing.
   */
  void noteRejected(long count);

  long rejectedCount();
}
