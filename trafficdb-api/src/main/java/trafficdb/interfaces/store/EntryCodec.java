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

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;

/**
 * Encapsulates capability to serialize and deserialize stored entry objects.
 *
 * @param <E> Type of the entry to encode/serialize and decode/deserialize
 */
public interface EntryCodec<E> {
  /**
   * Serialize an entry, including prepending any length necessary to reconstruct
   * the entry, and including any necessary CRCs.
   *
   * @param entry An entry to be serialized.
   * @return An array of ByteBuffer containing the serialized data, each ready to be read.
   */
  ByteBuffer[] encode(E entry);

  /**
   * Deserialize an entry from an input stream, and check its CRC.
   *
   * @param inputStream An open input stream, positioned at the start of an entry.
   * @return The reconstructed entry.
   * @throws java.io.EOFException if the stream ends before a complete entry could be read; in
   *                              particular, if it ends partway through an entry.
   * @throws IOException          for any other problem reading the stream.
   */
  E decode(InputStream inputStream) throws IOException;
}
