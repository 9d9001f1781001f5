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
import trafficdb.interfaces.PartitionKey;
import trafficdb.interfaces.store.StoreUnavailableException;
import trafficdb.util.CheckedSupplier;

import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static trafficdb.interfaces.store.EntryIterable.EntryIterator;

/**
 * Iterates over a partition's segments one after another, oldest first, opening each segment
 * only once the previous one has been exhausted. Any IOException raised by the underlying
 * storage surfaces as a {@link StoreUnavailableException} naming the partition.
 */
class PartitionEntryIterator<E> implements EntryIterator<E> {
  private final PartitionKey key;
  private final Iterator<CheckedSupplier<EntryIterator<E>, IOException>> segmentIterators;
  private EntryIterator<E> current;

  PartitionEntryIterator(PartitionKey key, List<CheckedSupplier<EntryIterator<E>, IOException>> segmentIterators) {
    this.key = key;
    this.segmentIterators = ImmutableList.copyOf(segmentIterators).iterator();
  }

  @Override
  public boolean hasNext() throws IOException {
    try {
      while (current == null || !current.hasNext()) {
        if (current != null) {
          current.close();
          current = null;
        }
        if (!segmentIterators.hasNext()) {
          return false;
        }
        current = segmentIterators.next().get();
      }
      return true;
    } catch (StoreUnavailableException e) {
      throw e;
    } catch (IOException e) {
      throw new StoreUnavailableException("Unable to read partition", key, e);
    }
  }

  @Override
  public E next() throws IOException {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    try {
      return current.next();
    } catch (IOException e) {
      throw new StoreUnavailableException("Unable to read partition", key, e);
    }
  }

  @Override
  public void close() throws IOException {
    if (current != null) {
      current.close();
      current = null;
    }
  }
}
