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

import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.ReadableByteChannel;
import java.util.NoSuchElementException;

import static trafficdb.interfaces.store.EntryIterable.EntryIterator;

/**
 * Reads entries from the start of a persistence until its end. A record cut short by the end
 * of the data is taken to be the end of the data, so a record still being written is never
 * returned.
 */
class EncodedEntryIterator<E> implements EntryIterator<E> {
  private final EntryCodec<E> codec;
  private final InputStream inputStream;
  private E nextEntry;

  EncodedEntryIterator(ReadableByteChannel reader, EntryCodec<E> codec) throws IOException {
    this.codec = codec;
    this.inputStream = new BufferedInputStream(Channels.newInputStream(reader));

    try {
      this.nextEntry = fetchNext();
    } catch (IOException | RuntimeException e) {
      inputStream.close();
      throw e;
    }
  }

  @Override
  public void close() throws IOException {
    inputStream.close();
  }

  @Override
  public boolean hasNext() throws IOException {
    return (nextEntry != null);
  }

  @Override
  public E next() throws IOException {
    if (nextEntry == null) {
      throw new NoSuchElementException();
    }
    E thisEntry = nextEntry;
    nextEntry = fetchNext();
    return thisEntry;
  }

  private E fetchNext() throws IOException {
    try {
      return codec.decode(inputStream);
    } catch (EOFException e) {
      return null;
    }
  }
}
