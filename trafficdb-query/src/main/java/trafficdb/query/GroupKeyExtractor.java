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

package trafficdb.query;

import trafficdb.interfaces.LogEntry;

import java.util.Objects;
import java.util.function.Function;

/**
 * Derives the group key of an entry. The available extractors are a closed set, obtained from
 * the static factory methods or by name through {@link #named(String)}.
 */
public final class GroupKeyExtractor {
  private static final GroupKeyExtractor ALL =
      new GroupKeyExtractor("all", entry -> QueryConstants.ALL_GROUP_KEY);
  private static final GroupKeyExtractor CLIENT_ADDRESS =
      new GroupKeyExtractor("clientAddress", LogEntry::getClientAddress);
  private static final GroupKeyExtractor URL =
      new GroupKeyExtractor("url", LogEntry::getUrl);
  private static final GroupKeyExtractor STATUS_CODE =
      new GroupKeyExtractor("statusCode", entry -> Integer.toString(entry.getStatusCode()));
  private static final GroupKeyExtractor USER_AGENT =
      new GroupKeyExtractor("userAgent", LogEntry::getUserAgent);

  private final String name;
  private final Function<LogEntry, String> function;

  private GroupKeyExtractor(String name, Function<LogEntry, String> function) {
    this.name = name;
    this.function = function;
  }

  /**
   * Puts every entry in a single group.
   */
  public static GroupKeyExtractor all() {
    return ALL;
  }

  public static GroupKeyExtractor clientAddress() {
    return CLIENT_ADDRESS;
  }

  public static GroupKeyExtractor url() {
    return URL;
  }

  public static GroupKeyExtractor statusCode() {
    return STATUS_CODE;
  }

  public static GroupKeyExtractor userAgent() {
    return USER_AGENT;
  }

  /**
   * Groups by the first prefixLength characters of the timestamp; a timestamp shorter than
   * that is its own bucket.
   *
   * @throws InvalidJobSpecException if prefixLength is not positive.
   */
  public static GroupKeyExtractor timeBucket(int prefixLength) {
    if (prefixLength <= 0) {
      throw new InvalidJobSpecException("Time bucket prefix length must be positive, not " + prefixLength);
    }
    return new GroupKeyExtractor(QueryConstants.TIME_BUCKET_EXTRACTOR_PREFIX + prefixLength, entry -> {
      final String timestamp = entry.getTimestamp();
      return timestamp.length() <= prefixLength ? timestamp : timestamp.substring(0, prefixLength);
    });
  }

  /**
   * Look up an extractor by its name: one of "all", "clientAddress", "url", "statusCode",
   * "userAgent", or "timeBucket:" followed by a prefix length.
   *
   * @throws InvalidJobSpecException if there is no extractor with that name.
   */
  public static GroupKeyExtractor named(String name) {
    if (name == null) {
      throw new InvalidJobSpecException("Group key extractor name must not be null");
    }

    switch (name) {
      case "all":
        return all();
      case "clientAddress":
        return clientAddress();
      case "url":
        return url();
      case "statusCode":
        return statusCode();
      case "userAgent":
        return userAgent();
      default:
        if (name.startsWith(QueryConstants.TIME_BUCKET_EXTRACTOR_PREFIX)) {
          return timeBucket(parsePrefixLength(name));
        }
        throw new InvalidJobSpecException("Unknown group key extractor: " + name);
    }
  }

  public String extract(LogEntry entry) {
    return function.apply(entry);
  }

  public String name() {
    return name;
  }

  private static int parsePrefixLength(String name) {
    final String lengthPart = name.substring(QueryConstants.TIME_BUCKET_EXTRACTOR_PREFIX.length());
    try {
      return Integer.parseInt(lengthPart);
    } catch (NumberFormatException e) {
      throw new InvalidJobSpecException("Bad time bucket prefix length in " + name, e);
    }
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof GroupKeyExtractor && ((GroupKeyExtractor) o).name.equals(name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name);
  }

  @Override
  public String toString() {
    return name;
  }
}
