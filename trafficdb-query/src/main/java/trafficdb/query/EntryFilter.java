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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import trafficdb.interfaces.LogEntry;
import trafficdb.interfaces.PartitionKey;

import java.util.List;
import java.util.function.Predicate;

/**
 * Selects the entries an aggregation counts. A filter on status codes also tells the executor
 * which partitions cannot hold a matching entry, so it can skip scanning them.
 * <p>
 * Filters are built from the static factory methods, which reject malformed arguments with
 * {@link InvalidJobSpecException}.
 */
public final class EntryFilter {
  private static final EntryFilter ALL = new EntryFilter("all", entry -> true, key -> true);

  private final String description;
  private final Predicate<LogEntry> predicate;
  private final Predicate<PartitionKey> partitionPredicate;

  private EntryFilter(String description,
                      Predicate<LogEntry> predicate,
                      Predicate<PartitionKey> partitionPredicate) {
    this.description = description;
    this.predicate = predicate;
    this.partitionPredicate = partitionPredicate;
  }

  public static EntryFilter all() {
    return ALL;
  }

  public static EntryFilter statusIn(int... statusCodes) {
    if (statusCodes == null || statusCodes.length == 0) {
      throw new InvalidJobSpecException("statusIn requires at least one status code");
    }
    final ImmutableSortedSet.Builder<Integer> builder = ImmutableSortedSet.naturalOrder();
    for (int code : statusCodes) {
      builder.add(code);
    }
    final ImmutableSortedSet<Integer> codes = builder.build();
    final boolean anyOutsideRange = codes.stream().anyMatch(code -> !PartitionKey.isValidStatusCode(code));

    return new EntryFilter("statusIn" + codes,
        entry -> codes.contains(entry.getStatusCode()),
        key -> key.isDefault() ? anyOutsideRange : codes.contains(key.getStatusCode()));
  }

  /**
   * Match status codes from low to high, both inclusive.
   */
  public static EntryFilter statusBetween(int low, int high) {
    if (low > high) {
      throw new InvalidJobSpecException("statusBetween bounds are reversed: " + low + " > " + high);
    }
    final boolean reachesOutsideRange =
        low < PartitionKey.MIN_STATUS_CODE || high > PartitionKey.MAX_STATUS_CODE;

    return new EntryFilter("statusBetween[" + low + ", " + high + "]",
        entry -> entry.getStatusCode() >= low && entry.getStatusCode() <= high,
        key -> key.isDefault()
            ? reachesOutsideRange
            : key.getStatusCode() >= low && key.getStatusCode() <= high);
  }

  public static EntryFilter urlPrefix(String prefix) {
    if (prefix == null) {
      throw new InvalidJobSpecException("urlPrefix requires a prefix");
    }
    return new EntryFilter("urlPrefix(" + prefix + ")",
        entry -> entry.getUrl().startsWith(prefix),
        key -> true);
  }

  public static EntryFilter clientAddress(String address) {
    if (address == null || address.isEmpty()) {
      throw new InvalidJobSpecException("clientAddress requires an address");
    }
    return new EntryFilter("clientAddress(" + address + ")",
        entry -> entry.getClientAddress().equals(address),
        key -> true);
  }

  /**
   * Match timestamps from inclusive to exclusive, comparing timestamps as strings. Either bound
   * may be null for an open range.
   */
  public static EntryFilter timestampBetween(String fromInclusive, String toExclusive) {
    if (fromInclusive != null && toExclusive != null && fromInclusive.compareTo(toExclusive) > 0) {
      throw new InvalidJobSpecException(
          "timestampBetween bounds are reversed: " + fromInclusive + " > " + toExclusive);
    }
    return new EntryFilter("timestampBetween[" + fromInclusive + ", " + toExclusive + ")",
        entry -> (fromInclusive == null || entry.getTimestamp().compareTo(fromInclusive) >= 0)
            && (toExclusive == null || entry.getTimestamp().compareTo(toExclusive) < 0),
        key -> true);
  }

  public static EntryFilter and(EntryFilter... filters) {
    if (filters == null || filters.length == 0) {
      throw new InvalidJobSpecException("and requires at least one filter");
    }
    for (EntryFilter filter : filters) {
      if (filter == null) {
        throw new InvalidJobSpecException("and was given a null filter");
      }
    }
    final List<EntryFilter> parts = ImmutableList.copyOf(filters);

    return new EntryFilter("and" + parts,
        entry -> parts.stream().allMatch(filter -> filter.matches(entry)),
        key -> parts.stream().allMatch(filter -> filter.mayMatchPartition(key)));
  }

  public boolean matches(LogEntry entry) {
    return predicate.test(entry);
  }

  /**
   * Return false only if no entry stored under this partition key could match.
   */
  public boolean mayMatchPartition(PartitionKey key) {
    return partitionPredicate.test(key);
  }

  @Override
  public String toString() {
    return description;
  }
}
