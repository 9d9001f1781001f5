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

import com.google.common.collect.Ordering;
import trafficdb.query.AggregationResult.ResultRow;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Combines per-partition aggregates into a job's result. The having threshold, ordering, top-k
 * selection and limit all act on the merged groups, never on a single partition's groups, so
 * the result does not depend on how entries were spread over partitions.
 */
public class ResultMerger {
  static final Comparator<ResultRow> BY_VALUE_DESCENDING =
      Comparator.comparingLong(ResultRow::getValue).reversed()
          .thenComparing(ResultRow::getGroupKey);

  static final Comparator<ResultRow> BY_KEY =
      Comparator.comparing(ResultRow::getGroupKey);

  private ResultMerger() {
  }

  /**
   * Merge partials, which must be given in the order their partitions were visited; groups
   * are first-seen in that order.
   *
   * @param rowsSkipped input records rejected before they reached the store.
   */
  public static AggregationResult merge(AggregationJob job, List<PartitionAggregate> partials, long rowsSkipped) {
    long rowsScanned = 0;
    long rowsMatched = 0;
    for (PartitionAggregate partial : partials) {
      rowsScanned += partial.getRowsScanned();
      rowsMatched += partial.getRowsMatched();
    }

    List<ResultRow> rows = mergedRows(job, partials);

    if (job.getHavingMoreThan() != null) {
      final long threshold = job.getHavingMoreThan();
      rows.removeIf(row -> row.getValue() <= threshold);
    }

    rows = ordered(job, rows);

    if (job.getLimit() != null && rows.size() > job.getLimit()) {
      rows = rows.subList(0, job.getLimit());
    }

    return new AggregationResult(rows, job.getOrderBy() != OrderBy.NONE,
        rowsScanned, rowsMatched, rowsSkipped, partials.size(), 0);
  }

  private static List<ResultRow> mergedRows(AggregationJob job, List<PartitionAggregate> partials) {
    final List<ResultRow> rows = new ArrayList<>();

    if (job.getKind() == AggregateKind.COUNT_DISTINCT) {
      final Map<String, Set<String>> merged = new LinkedHashMap<>();
      for (PartitionAggregate partial : partials) {
        partial.getDistinctValues().forEach((groupKey, values) ->
            merged.computeIfAbsent(groupKey, k -> new HashSet<>()).addAll(values));
      }
      merged.forEach((groupKey, values) -> rows.add(new ResultRow(groupKey, values.size())));
    } else {
      final Map<String, Long> merged = new LinkedHashMap<>();
      for (PartitionAggregate partial : partials) {
        partial.getCounts().forEach((groupKey, count) -> merged.merge(groupKey, count, Long::sum));
      }
      merged.forEach((groupKey, count) -> rows.add(new ResultRow(groupKey, count)));
    }

    return rows;
  }

  private static List<ResultRow> ordered(AggregationJob job, List<ResultRow> rows) {
    if (job.getKind() == AggregateKind.TOP_K) {
      return Ordering.from(BY_VALUE_DESCENDING).leastOf(rows, job.getTopK());
    }

    switch (job.getOrderBy()) {
      case COUNT_DESC:
        rows.sort(BY_VALUE_DESCENDING);
        break;
      case KEY_ASC:
        rows.sort(BY_KEY);
        break;
      case NONE:
      default:
        break;
    }
    return rows;
  }
}
