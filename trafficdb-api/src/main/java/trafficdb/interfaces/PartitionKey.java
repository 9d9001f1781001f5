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

import org.jetbrains.annotations.NotNull;

/**
 * Identifies a partition: either an HTTP status code in the range 100 to 599 inclusive, or the
 * reserved default partition that receives every entry whose status lies outside that range.
 * <p>
 * A key's id is its decimal status code ("404"), or "__default__"; the id is what the store
 * uses to name the partition on disk. Keys order by status code, with the default key last.
 */
public final class PartitionKey implements Comparable<PartitionKey> {
  public static final int MIN_STATUS_CODE = 100;
  public static final int MAX_STATUS_CODE = 599;
  public static final String DEFAULT_ID = "__default__";

  public static final PartitionKey DEFAULT = new PartitionKey(-1);

  private static final PartitionKey[] STATUS_KEYS = new PartitionKey[MAX_STATUS_CODE - MIN_STATUS_CODE + 1];

  static {
    for (int status = MIN_STATUS_CODE; status <= MAX_STATUS_CODE; status++) {
      STATUS_KEYS[status - MIN_STATUS_CODE] = new PartitionKey(status);
    }
  }

  private final int statusCode;

  private PartitionKey(int statusCode) {
    this.statusCode = statusCode;
  }

  public static boolean isValidStatusCode(int statusCode) {
    return statusCode >= MIN_STATUS_CODE && statusCode <= MAX_STATUS_CODE;
  }

  /**
   * Return the key of the partition an entry with the given status code belongs in.
   */
  public static PartitionKey forStatusCode(int statusCode) {
    if (isValidStatusCode(statusCode)) {
      return STATUS_KEYS[statusCode - MIN_STATUS_CODE];
    }
    return DEFAULT;
  }

  /**
   * Inverse of {@link #id()}.
   *
   * @throws IllegalArgumentException if the id names no partition.
   */
  public static PartitionKey fromId(@NotNull String id) {
    if (DEFAULT_ID.equals(id)) {
      return DEFAULT;
    }

    final int statusCode;
    try {
      statusCode = Integer.parseInt(id);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Not a partition id: " + id, e);
    }

    if (!isValidStatusCode(statusCode) || !id.equals(Integer.toString(statusCode))) {
      throw new IllegalArgumentException("Not a partition id: " + id);
    }
    return forStatusCode(statusCode);
  }

  public boolean isDefault() {
    return this == DEFAULT;
  }

  /**
   * @throws IllegalStateException for the default partition, which has no single status code.
   */
  public int getStatusCode() {
    if (isDefault()) {
      throw new IllegalStateException("The default partition has no status code");
    }
    return statusCode;
  }

  public String id() {
    return isDefault() ? DEFAULT_ID : Integer.toString(statusCode);
  }

  @Override
  public int compareTo(@NotNull PartitionKey other) {
    if (this.isDefault() || other.isDefault()) {
      return Boolean.compare(this.isDefault(), other.isDefault());
    }
    return Integer.compare(this.statusCode, other.statusCode);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof PartitionKey && ((PartitionKey) o).statusCode == statusCode;
  }

  @Override
  public int hashCode() {
    return statusCode;
  }

  @Override
  public String toString() {
    return id();
  }
}
