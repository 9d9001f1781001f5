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
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps segments in memory, for tests that need many partitions quickly.
 */
class ArrayPersistenceService implements PartitionPersistenceService<ByteArrayPersistence> {
  private final Map<PartitionKey, NavigableMap<Long, ByteArrayPersistence>> partitionMap = new ConcurrentHashMap<>();
  private final AtomicInteger segmentsCreated = new AtomicInteger();

  @Override
  public Set<PartitionKey> getStoredPartitions() throws IOException {
    return new TreeSet<>(partitionMap.keySet());
  }

  @Override
  public NavigableSet<Long> getSegmentIds(PartitionKey key) throws IOException {
    return new TreeSet<>(segmentsOf(key).keySet());
  }

  @NotNull
  @Override
  public ByteArrayPersistence create(PartitionKey key, long segmentId) throws IOException {
    final ByteArrayPersistence persistence = new ByteArrayPersistence();
    if (segmentsOf(key).putIfAbsent(segmentId, persistence) != null) {
      throw new FileAlreadyExistsException(key + "/" + segmentId);
    }
    segmentsCreated.incrementAndGet();
    return persistence;
  }

  @NotNull
  @Override
  public ByteArrayPersistence open(PartitionKey key, long segmentId) throws IOException {
    final ByteArrayPersistence persistence = segmentsOf(key).get(segmentId);
    if (persistence == null) {
      throw new NoSuchFileException(key + "/" + segmentId);
    }
    return persistence;
  }

  public int segmentsCreated() {
    return segmentsCreated.get();
  }

  public ByteArrayPersistence segment(PartitionKey key, long segmentId) {
    return segmentsOf(key).get(segmentId);
  }

  private NavigableMap<Long, ByteArrayPersistence> segmentsOf(PartitionKey key) {
    return partitionMap.computeIfAbsent(key, k -> new ConcurrentSkipListMap<>());
  }
}
