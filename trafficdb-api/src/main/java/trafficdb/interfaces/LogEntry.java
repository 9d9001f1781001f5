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

import com.google.common.base.MoreObjects;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One web-server access log record. Immutable.
 * <p>
 * The timestamp is kept exactly as it appeared in the input, so that timestamps of equal
 * width compare lexically in time order and time buckets can be taken as string prefixes.
 * The partition an entry belongs to depends only on its status code; see {@link #partitionKey()}.
 */
public final class LogEntry {
  private final String clientAddress;
  private final String timestamp;
  private final String url;
  private final int statusCode;
  private final String userAgent;

  public LogEntry(@NotNull String clientAddress,
                  @NotNull String timestamp,
                  @NotNull String url,
                  int statusCode,
                  @NotNull String userAgent) {
    this.clientAddress = checkNotNull(clientAddress, "clientAddress");
    this.timestamp = checkNotNull(timestamp, "timestamp");
    this.url = checkNotNull(url, "url");
    this.statusCode = statusCode;
    this.userAgent = checkNotNull(userAgent, "userAgent");
  }

  public String getClientAddress() {
    return clientAddress;
  }

  public String getTimestamp() {
    return timestamp;
  }

  public String getUrl() {
    return url;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public PartitionKey partitionKey() {
    return PartitionKey.forStatusCode(statusCode);
  }

  @Override
  public boolean equals(Object o) {
    if (o == null || (o.getClass() != this.getClass())) {
      return false;
    }
    LogEntry that = (LogEntry) o;
    return this.statusCode == that.statusCode
        && this.clientAddress.equals(that.clientAddress)
        && this.timestamp.equals(that.timestamp)
        && this.url.equals(that.url)
        && this.userAgent.equals(that.userAgent);
  }

  @Override
  public int hashCode() {
    return Objects.hash(clientAddress, timestamp, url, statusCode, userAgent);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("clientAddress", clientAddress)
        .add("timestamp", timestamp)
        .add("url", url)
        .add("statusCode", statusCode)
        .add("userAgent", userAgent)
        .toString();
  }
}
