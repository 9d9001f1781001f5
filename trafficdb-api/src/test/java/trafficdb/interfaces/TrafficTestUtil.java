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

package trafficdb.interfaces;

import com.google.common.base.Joiner;
import trafficdb.interfaces.store.PartitionedStore;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static trafficdb.interfaces.store.EntryIterable.EntryIterator;

/**
 * Builders for log entries and raw input lines used across tests.
 */
public class TrafficTestUtil {
  public static final String DEFAULT_TIMESTAMP = "2025-02-25 13:00:15";
  public static final String DEFAULT_USER_AGENT = "Firefox/98.0";

  private static final Joiner COMMA_JOINER = Joiner.on(',');

  public static LogEntry anEntry(String clientAddress, String timestamp, String url, int statusCode,
                                 String userAgent) {
    return new LogEntry(clientAddress, timestamp, url, statusCode, userAgent);
  }

  public static LogEntry anEntryWithStatus(int statusCode) {
    return anEntry("192.168.0.1", DEFAULT_TIMESTAMP, "/index", statusCode, DEFAULT_USER_AGENT);
  }

  public static LogEntry anEntryWithUrl(String url, int statusCode) {
    return anEntry("192.168.0.1", DEFAULT_TIMESTAMP, url, statusCode, DEFAULT_USER_AGENT);
  }

  public static LogEntry anEntryFrom(String clientAddress, int statusCode) {
    return anEntry(clientAddress, DEFAULT_TIMESTAMP, "/index", statusCode, DEFAULT_USER_AGENT);
  }

  public static LogEntry anEntryAt(String timestamp) {
    return anEntry("192.168.0.1", timestamp, "/index", 200, DEFAULT_USER_AGENT);
  }

  /**
   * Return a list of entries in the given partition, distinguishable from each other by url.
   */
  public static List<LogEntry> someEntries(int statusCode, int count) {
    List<LogEntry> entries = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      entries.add(anEntryWithUrl("/page/" + i, statusCode));
    }
    return entries;
  }

  public static String line(Object... fields) {
    return COMMA_JOINER.join(fields);
  }

  public static String lineFor(LogEntry entry) {
    return line(entry.getClientAddress(), entry.getTimestamp(), entry.getUrl(), entry.getStatusCode(),
        entry.getUserAgent());
  }

  /**
   * Scan the whole partition and return its entries in scan order.
   */
  public static List<LogEntry> scanAll(PartitionedStore store, PartitionKey key) throws IOException {
    final List<LogEntry> entries = new ArrayList<>();
    try (EntryIterator<LogEntry> iterator = store.scan(key)) {
      while (iterator.hasNext()) {
        entries.add(iterator.next());
      }
    }
    return entries;
  }
}
