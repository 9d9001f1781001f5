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

import com.google.common.base.MoreObjects;
import trafficdb.interfaces.LogEntry;
import trafficdb.interfaces.PartitionKey;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The partial result of folding one partition's entries into the groups of a job. Counts are
 * exact, including for TOP_K jobs; selection happens only after all partials are merged.
 * Groups keep the order in which they were first seen within the partition.
 */
public final class PartitionAggregate {
  private final PartitionKey partitionKey;
  private final AggregationJob job;
  private final Map<String, Long> counts = new LinkedHashMap<>();
  private final Map<String, Set<String>> distinctValues = new LinkedHashMap<>();
  private long rowsScanned;
  private long rowsMatched;

  public PartitionAggregate(PartitionKey partitionKey, AggregationJob job) {
    this.partitionKey = partitionKey;
    this.job = job;
  }

  /**
   * Count one scanned entry, adding it to its group if it passes the job's filter.
   */
  public void accumulate(LogEntry entry) {
    rowsScanned++;
    if (!job.getFilter().matches(entry)) {
      return;
    }
    rowsMatched++;

    final String groupKey = job.getGroupBy().extract(entry);
    if (job.getKind() == AggregateKind.COUNT_DISTINCT) {
      //noinspection ConstantConditions
      final String value = job.getDistinctOf().extract(entry);
      distinctValues.computeIfAbsent(groupKey, k -> new HashSet<>()).add(value);
    } else {
      counts.merge(groupKey, 1L, Long::sum);
    }
  }

  public PartitionKey getPartitionKey() {
    return partitionKey;
  }

  public long getRowsScanned() {
    return rowsScanned;
  }

  public long getRowsMatched() {
    return rowsMatched;
  }

  /**
   * Entry counts per group, for COUNT and TOP_K jobs.
   */
  public Map<String, Long> getCounts() {
    return Collections.unmodifiableMap(counts);
  }

  /**
   * The values seen per group, for COUNT_DISTINCT jobs.
   */
  public Map<String, Set<String>> getDistinctValues() {
    return Collections.unmodifiableMap(distinctValues);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("partitionKey", partitionKey)
        .add("groups", counts.size() + distinctValues.size())
        .add("rowsScanned", rowsScanned)
        .add("rowsMatched", rowsMatched)
        .toString();
  }
}
