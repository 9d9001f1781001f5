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

import org.jetbrains.annotations.NotNull;
import trafficdb.interfaces.PartitionKey;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;
import java.util.NavigableSet;
import java.util.Set;

/**
 * Locates, creates, and opens the segments that make up each partition's stored data. Each
 * segment is identified within its partition by a positive id; higher ids hold later data.
 *
 * @param <P> Type of the persistence representing a single segment.
 */
public interface PartitionPersistenceService<P extends PartitionPersistenceService.BytePersistence> {
  /**
   * Return the keys of all partitions that have at least one stored segment.
   *
   * @throws IOException
   */
  Set<PartitionKey> getStoredPartitions() throws IOException;

  /**
   * Return the ids of the partition's segments, in ascending order. If the partition has no
   * segments, return an empty set.
   *
   * @throws IOException
   */
  NavigableSet<Long> getSegmentIds(PartitionKey key) throws IOException;

  /**
   * Create a new, empty segment with the given id, and return a persistence ready to be
   * appended to.
   *
   * @throws IOException if the segment already exists, or could not be created.
   */
  @NotNull
  P create(PartitionKey key, long segmentId) throws IOException;

  /**
   * Open an existing segment for reading only.
   *
   * @throws IOException if there is no such segment.
   */
  @NotNull
  P open(PartitionKey key, long segmentId) throws IOException;

  /**
   * The bytes of one segment. Appends go to the end; reads always start from the beginning.
   */
  interface BytePersistence extends AutoCloseable {
    boolean isEmpty() throws IOException;

    /**
     * Bytes appended so far, which is also the offset the next append will land at.
     */
    long size() throws IOException;

    /**
     * Append the remaining bytes of each buffer, in order.
     *
     * @throws IOException if this persistence was opened read-only or has been closed
     */
    void append(ByteBuffer[] buffers) throws IOException;

    /**
     * Open an independent channel over the bytes present now. The caller closes it. Readers may
     * still be opened after this persistence is closed.
     */
    ReadableByteChannel getReader() throws IOException;

    /**
     * Force appended bytes to the storage device.
     */
    void sync() throws IOException;

    @Override
    void close() throws IOException;
  }
}
