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
import com.google.common.collect.ImmutableList;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The rows an aggregation produced, in result order, along with how much work went into them.
 */
public final class AggregationResult {
  private final ImmutableList<ResultRow> rows;
  private final boolean ranked;
  private final long rowsScanned;
  private final long rowsMatched;
  private final long rowsSkipped;
  private final int partitionsScanned;
  private final long wallTimeMillis;

  public AggregationResult(List<ResultRow> rows,
                           boolean ranked,
                           long rowsScanned,
                           long rowsMatched,
                           long rowsSkipped,
                           int partitionsScanned,
                           long wallTimeMillis) {
    this.rows = ImmutableList.copyOf(rows);
    this.ranked = ranked;
    this.rowsScanned = rowsScanned;
    this.rowsMatched = rowsMatched;
    this.rowsSkipped = rowsSkipped;
    this.partitionsScanned = partitionsScanned;
    this.wallTimeMillis = wallTimeMillis;
  }

  public List<ResultRow> getRows() {
    return rows;
  }

  /**
   * True if the rows are ordered by value or key, false if they are in first-seen order.
   */
  public boolean isRanked() {
    return ranked;
  }

  public long getRowsScanned() {
    return rowsScanned;
  }

  public long getRowsMatched() {
    return rowsMatched;
  }

  /**
   * Input records rejected at ingestion, which no aggregate includes.
   */
  public long getRowsSkipped() {
    return rowsSkipped;
  }

  public int getPartitionsScanned() {
    return partitionsScanned;
  }

  public long getWallTimeMillis() {
    return wallTimeMillis;
  }

  /**
   * The rows as a map from group key to value, iterating in result order.
   */
  public Map<String, Long> asMap() {
    final Map<String, Long> map = new LinkedHashMap<>();
    for (ResultRow row : rows) {
      map.put(row.getGroupKey(), row.getValue());
    }
    return map;
  }

  AggregationResult withWallTime(long wallTimeMillis) {
    return new AggregationResult(rows, ranked, rowsScanned, rowsMatched, rowsSkipped,
        partitionsScanned, wallTimeMillis);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("rows", rows.size())
        .add("ranked", ranked)
        .add("rowsScanned", rowsScanned)
        .add("rowsMatched", rowsMatched)
        .add("rowsSkipped", rowsSkipped)
        .add("partitionsScanned", partitionsScanned)
        .add("wallTimeMillis", wallTimeMillis)
        .toString();
  }

  public static final class ResultRow {
    private final String groupKey;
    private final long value;

    public ResultRow(String groupKey, long value) {
      this.groupKey = groupKey;
      this.value = value;
    }

    public String getGroupKey() {
      return groupKey;
    }

    public long getValue() {
      return value;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      ResultRow resultRow = (ResultRow) o;
      return value == resultRow.value && groupKey.equals(resultRow.groupKey);
    }

    @Override
    public int hashCode() {
      return Objects.hash(groupKey, value);
    }

    @Override
    public String toString() {
      return groupKey + "=" + value;
    }
  }
}
