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

import trafficdb.interfaces.store.EntryCodec;
import trafficdb.interfaces.store.EntryIterable;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.List;

import static trafficdb.store.PartitionPersistenceService.BytePersistence;

/**
 * One segment of a partition: entries encoded with an {@link EntryCodec} and appended one
 * after another to a {@link BytePersistence}.
 * <p>
 * Appends must come from one thread at a time. Iteration may take place from any thread,
 * concurrently with appends, and also after the segment has been sealed.
 *
 * @param <E> Type of entry held in the segment
 */
public class EncodedSegment<E> implements EntryIterable<E>, AutoCloseable {
  private final long segmentId;
  private final BytePersistence persistence;
  private final EntryCodec<E> codec;
  private long appendedRecords;
  private volatile boolean sealed;

  public EncodedSegment(long segmentId, BytePersistence persistence, EntryCodec<E> codec) {
    this.segmentId = segmentId;
    this.persistence = persistence;
    this.codec = codec;
  }

  public long getSegmentId() {
    return segmentId;
  }

  public void append(E entry) throws IOException {
    appendEncoded(codec.encode(entry));
  }

  /**
   * Append one record already framed by this segment's codec.
   */
  public void appendEncoded(ByteBuffer[] record) throws IOException {
    persistence.append(record);
    appendedRecords++;
  }

  public void append(List<E> entries) throws IOException {
    for (E entry : entries) {
      append(entry);
    }
  }

  /**
   * Return the number of records appended through this instance; records already present
   * when the segment was opened are not counted.
   */
  public long appendedRecords() {
    return appendedRecords;
  }

  public long sizeInBytes() throws IOException {
    return persistence.size();
  }

  public boolean isSealed() {
    return sealed;
  }

  @Override
  public EntryIterator<E> iterator() throws IOException {
    return new EncodedEntryIterator<>(persistence.getReader(), codec);
  }

  public void sync() throws IOException {
    persistence.sync();
  }

  /**
   * Release the resources held for appending. The segment remains readable.
   */
  public void seal() throws IOException {
    sealed = true;
    persistence.close();
  }

  @Override
  public void close() throws IOException {
    seal();
  }
}
