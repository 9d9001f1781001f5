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

import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;
import trafficdb.interfaces.LogEntry;

/**
 * Stored form of a {@link LogEntry}; the protostuff runtime schema is derived from these fields,
 * so their declaration order is part of the on-disk format.
 */
final class StoredLogEntry {
  static final Schema<StoredLogEntry> SCHEMA = RuntimeSchema.getSchema(StoredLogEntry.class);

  String clientAddress;
  String timestamp;
  String url;
  int statusCode;
  String userAgent;

  public StoredLogEntry() {
  }

  static StoredLogEntry fromLogEntry(LogEntry entry) {
    StoredLogEntry stored = new StoredLogEntry();
    stored.clientAddress = entry.getClientAddress();
    stored.timestamp = entry.getTimestamp();
    stored.url = entry.getUrl();
    stored.statusCode = entry.getStatusCode();
    stored.userAgent = entry.getUserAgent();
    return stored;
  }

  LogEntry toLogEntry() {
    return new LogEntry(
        nullToEmpty(clientAddress),
        nullToEmpty(timestamp),
        nullToEmpty(url),
        statusCode,
        nullToEmpty(userAgent));
  }

  // Absent string fields decode as null
  private static String nullToEmpty(String s) {
    return s == null ? "" : s;
  }
}
