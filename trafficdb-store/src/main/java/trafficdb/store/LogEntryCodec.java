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

import trafficdb.interfaces.LogEntry;
import trafficdb.interfaces.store.EntryCodec;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;

/**
 * Codec for log entries as stored in segments. Each entry is framed as described in
 * {@link EntryEncodingUtil}; an entry whose encoding exceeds
 * {@link StoreConstants#MAX_ENTRY_SIZE_BYTES} is refused by {@link #encode}.
 */
public class LogEntryCodec implements EntryCodec<LogEntry> {
  @Override
  public ByteBuffer[] encode(LogEntry entry) {
    return EntryEncodingUtil.encodeWithLengthAndCrc(StoredLogEntry.SCHEMA, StoredLogEntry.fromLogEntry(entry),
        StoreConstants.MAX_ENTRY_SIZE_BYTES);
  }

  @Override
  public LogEntry decode(InputStream inputStream) throws IOException {
    return EntryEncodingUtil.decodeAndCheckCrc(inputStream, StoredLogEntry.SCHEMA,
        StoreConstants.MAX_ENTRY_SIZE_BYTES).toLogEntry();
  }
}
